/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.coinduct.ast;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.coinduct.type.CapabilityRef;
import net.hydromatic.coinduct.type.Obligation;
import net.hydromatic.coinduct.type.TypeExpr;
import net.hydromatic.coinduct.type.Types;
import net.hydromatic.coinduct.util.Static;

/**
 * Declaration that a type implements a capability, subject to preconditions.
 *
 * <p>For example,
 *
 * <pre>{@code
 * impl<S, T: Default> TraitA<S> for RecA<T>
 * where
 *     RecB<T>: TraitB<S>,
 *     T: UpperHex + Display
 * }</pre>
 *
 * <p>has Self type {@code RecA<T>}, capability {@code TraitA<S>}, generic
 * parameters {@code S} and {@code T} (the latter bounded by {@code Default}),
 * and two predicates, the second of which is compound.
 *
 * <p>Declarations are immutable. They are compared by identity, not
 * structurally: two declarations with the same content are different
 * declarations.
 */
public class Declaration {
  public final TypeExpr selfType;
  public final CapabilityRef capability;
  public final ImmutableList<GenericParam> genericParams;
  public final ImmutableList<Predicate> predicates;

  /** Body of the declaration. Opaque; never inspected or altered. */
  public final String body;

  private Declaration(
      TypeExpr selfType,
      CapabilityRef capability,
      List<GenericParam> genericParams,
      List<Predicate> predicates,
      String body) {
    this.selfType = requireNonNull(selfType);
    this.capability = requireNonNull(capability);
    this.genericParams = ImmutableList.copyOf(genericParams);
    this.predicates = ImmutableList.copyOf(predicates);
    this.body = requireNonNull(body);
  }

  /** Creates a builder. */
  public static Builder builder(TypeExpr selfType, CapabilityRef capability) {
    return new Builder(selfType, capability);
  }

  /** Identity of this declaration for diagnostics, e.g. "Evaluate for Expr". */
  public String id() {
    return capability + " for " + selfType;
  }

  /** Returns the obligation that this declaration satisfies. */
  public Obligation rootObligation() {
    return Obligation.of(selfType, capability);
  }

  /** Returns the names of the generic parameters. */
  public ImmutableSet<String> genericParamNames() {
    final ImmutableSet.Builder<String> names = ImmutableSet.builder();
    genericParams.forEach(p -> names.add(p.name));
    return names.build();
  }

  /**
   * Returns the atomic preconditions of this declaration: the bounds of the
   * generic parameters followed by the bounds of the predicates, with
   * compound bounds split, in declaration order.
   */
  public ImmutableList<Obligation> obligations() {
    final ImmutableList.Builder<Obligation> b = ImmutableList.builder();
    for (GenericParam param : genericParams) {
      b.addAll(param.obligations());
    }
    for (Predicate predicate : predicates) {
      b.addAll(predicate.obligations());
    }
    return b.build();
  }

  /**
   * Returns a copy of this declaration with different generic parameters and
   * predicates. Self type, capability, parameter names and body are
   * unchanged.
   */
  public Declaration withPreconditions(
      List<GenericParam> genericParams, List<Predicate> predicates) {
    return new Declaration(
        selfType, capability, genericParams, predicates, body);
  }

  @Override
  public String toString() {
    return unparse(new StringBuilder()).toString();
  }

  /** Writes this declaration, in the style of an {@code impl} block. */
  public StringBuilder unparse(StringBuilder buf) {
    buf.append("impl");
    if (!genericParams.isEmpty()) {
      buf.append('<');
      for (int i = 0; i < genericParams.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        genericParams.get(i).unparse(buf);
      }
      buf.append('>');
    }
    buf.append(' ').append(capability).append(" for ").append(selfType);
    if (!predicates.isEmpty()) {
      buf.append(" where ");
      for (int i = 0; i < predicates.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        predicates.get(i).unparse(buf);
      }
    }
    if (!body.isEmpty()) {
      buf.append(' ').append(body);
    }
    return buf;
  }

  static void unparseBounds(StringBuilder buf, List<CapabilityRef> bounds) {
    for (int i = 0; i < bounds.size(); i++) {
      if (i > 0) {
        buf.append(" + ");
      }
      buf.append(bounds.get(i));
    }
  }

  /** Generic parameter, with bounds, e.g. {@code T: Display + Default}. */
  public static class GenericParam {
    public final String name;
    public final ImmutableList<CapabilityRef> bounds;

    GenericParam(String name, List<CapabilityRef> bounds) {
      this.name = requireNonNull(name);
      this.bounds = ImmutableList.copyOf(bounds);
    }

    /** Creates a generic parameter. */
    public static GenericParam of(String name, CapabilityRef... bounds) {
      return new GenericParam(name, ImmutableList.copyOf(bounds));
    }

    /** Creates a generic parameter with a list of bounds. */
    public static GenericParam of(String name, List<CapabilityRef> bounds) {
      return new GenericParam(name, bounds);
    }

    /** Returns the type that this parameter stands for. */
    public TypeExpr type() {
      return Types.path(name);
    }

    /** Returns one obligation per bound. */
    public ImmutableList<Obligation> obligations() {
      final TypeExpr type = type();
      return Static.transformEager(bounds, c -> Obligation.of(type, c));
    }

    /** Returns a copy of this parameter with different bounds. */
    public GenericParam withBounds(List<CapabilityRef> bounds) {
      return new GenericParam(name, bounds);
    }

    @Override
    public String toString() {
      return unparse(new StringBuilder()).toString();
    }

    StringBuilder unparse(StringBuilder buf) {
      buf.append(name);
      if (!bounds.isEmpty()) {
        buf.append(": ");
        unparseBounds(buf, bounds);
      }
      return buf;
    }
  }

  /**
   * Predicate in a where clause, e.g. {@code T: UpperHex + Display}.
   *
   * <p>A predicate with more than one bound is compound; each bound is a
   * separate obligation.
   */
  public static class Predicate {
    public final TypeExpr type;
    public final ImmutableList<CapabilityRef> bounds;

    Predicate(TypeExpr type, List<CapabilityRef> bounds) {
      this.type = requireNonNull(type);
      this.bounds = ImmutableList.copyOf(bounds);
    }

    /** Creates a predicate. */
    public static Predicate of(TypeExpr type, CapabilityRef... bounds) {
      return new Predicate(type, ImmutableList.copyOf(bounds));
    }

    /** Creates a predicate with a list of bounds. */
    public static Predicate of(TypeExpr type, List<CapabilityRef> bounds) {
      return new Predicate(type, bounds);
    }

    /** Creates a predicate with a single bound. */
    public static Predicate of(Obligation obligation) {
      return new Predicate(
          obligation.type, ImmutableList.of(obligation.capability));
    }

    /** Returns one obligation per bound. */
    public ImmutableList<Obligation> obligations() {
      return Static.transformEager(bounds, c -> Obligation.of(type, c));
    }

    /** Returns a copy of this predicate with different bounds. */
    public Predicate withBounds(List<CapabilityRef> bounds) {
      return new Predicate(type, bounds);
    }

    @Override
    public String toString() {
      return unparse(new StringBuilder()).toString();
    }

    StringBuilder unparse(StringBuilder buf) {
      buf.append(type).append(": ");
      unparseBounds(buf, bounds);
      return buf;
    }
  }

  /** Builder for {@link Declaration}. */
  public static class Builder {
    private final TypeExpr selfType;
    private final CapabilityRef capability;
    private final List<GenericParam> genericParams = new ArrayList<>();
    private final List<Predicate> predicates = new ArrayList<>();
    private String body = "";

    private Builder(TypeExpr selfType, CapabilityRef capability) {
      this.selfType = requireNonNull(selfType);
      this.capability = requireNonNull(capability);
    }

    /** Adds a generic parameter. */
    public Builder genericParam(String name, CapabilityRef... bounds) {
      genericParams.add(GenericParam.of(name, bounds));
      return this;
    }

    /** Adds a predicate to the where clause. */
    public Builder where(TypeExpr type, CapabilityRef... bounds) {
      predicates.add(Predicate.of(type, bounds));
      return this;
    }

    /** Adds a single-bound predicate to the where clause. */
    public Builder where(Obligation obligation) {
      predicates.add(Predicate.of(obligation));
      return this;
    }

    /** Sets the body. */
    public Builder body(String body) {
      this.body = requireNonNull(body);
      return this;
    }

    public Declaration build() {
      return new Declaration(
          selfType, capability, genericParams, predicates, body);
    }
  }
}

// End Declaration.java
