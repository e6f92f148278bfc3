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
package net.hydromatic.coinduct.compile;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.coinduct.ast.Declaration;
import net.hydromatic.coinduct.type.CapabilityRef;
import net.hydromatic.coinduct.type.Obligation;
import net.hydromatic.coinduct.type.PathType;
import net.hydromatic.coinduct.type.TypeExpr;
import net.hydromatic.coinduct.type.TypeShuttle;
import net.hydromatic.coinduct.type.TypeUnifier;
import net.hydromatic.coinduct.type.Types;
import net.hydromatic.coinduct.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rule that says how to satisfy an obligation.
 *
 * <p>A pattern applies to obligations on its capability whose type matches
 * its shape. For example, the pattern
 *
 * <pre>{@code
 * shape: Vec<$t>
 * capability: Evaluate
 * templates: [$t: Evaluate]
 * }</pre>
 *
 * <p>resolves {@code Vec<Term>: Evaluate} to {@code Term: Evaluate}.
 *
 * <p>Every variable in a template must also occur in the shape or in the
 * capability's arguments, so that instantiated templates contain no
 * variables.
 */
public class Pattern {
  public final TypeExpr shape;
  public final CapabilityRef capability;
  public final ImmutableList<Obligation> templates;

  Pattern(
      TypeExpr shape, CapabilityRef capability, List<Obligation> templates) {
    this.shape = requireNonNull(shape);
    this.capability = requireNonNull(capability);
    this.templates = ImmutableList.copyOf(templates);
    final Set<String> bound = new HashSet<>(shape.variables());
    capability.args.forEach(arg -> bound.addAll(arg.variables()));
    for (Obligation template : this.templates) {
      final Set<String> names = new LinkedHashSet<>(template.type.variables());
      template.capability.args.forEach(arg -> names.addAll(arg.variables()));
      names.removeAll(bound);
      checkArgument(
          names.isEmpty(),
          "template %s has variables %s that do not occur in %s: %s",
          template,
          names,
          shape,
          capability);
    }
  }

  /** Creates a pattern. */
  public static Pattern of(
      TypeExpr shape, CapabilityRef capability, Obligation... templates) {
    return new Pattern(shape, capability, ImmutableList.copyOf(templates));
  }

  /** Creates a pattern with a list of templates. */
  public static Pattern of(
      TypeExpr shape, CapabilityRef capability, List<Obligation> templates) {
    return new Pattern(shape, capability, templates);
  }

  /**
   * Creates a pattern from a declaration.
   *
   * <p>The shape is the declaration's Self type, and the templates are its
   * atomic preconditions. Each generic parameter of the declaration becomes
   * a variable; thus {@code impl<T: Default> Cap for Wrapper<T>} becomes a
   * pattern with shape {@code Wrapper<$T>} and template {@code $T:
   * Default}.
   */
  public static Pattern of(Declaration declaration) {
    final ImmutableSet<String> names = declaration.genericParamNames();
    if (names.isEmpty()) {
      return new Pattern(
          declaration.selfType,
          declaration.capability,
          declaration.obligations());
    }
    final ParamToVar shuttle = new ParamToVar(names);
    return new Pattern(
        declaration.selfType.accept(shuttle),
        shuttle.convertCapability(declaration.capability),
        Static.transformEager(
            declaration.obligations(), shuttle::convertObligation));
  }

  @Override
  public String toString() {
    return shape + ": " + capability + " => " + templates;
  }

  /**
   * Matches an obligation against this pattern. Returns the variable
   * bindings, or null if the obligation is on a different capability, or
   * its type does not match the shape, or its capability arguments do not
   * match.
   */
  public @Nullable Map<String, TypeExpr> match(Obligation target) {
    if (!capability.name.equals(target.capability.name)) {
      return null;
    }
    final Map<String, TypeExpr> bindings =
        TypeUnifier.match(shape, target.type);
    if (bindings == null) {
      return null;
    }
    return TypeUnifier.matchAll(
        capability.args, target.capability.args, bindings);
  }

  /** Returns the templates, with variables replaced by their bindings. */
  public ImmutableList<Obligation> instantiate(
      Map<String, ? extends TypeExpr> bindings) {
    return Static.transformEager(templates, t -> t.substitute(bindings));
  }

  /** Shuttle that converts generic parameters into variables. */
  private static class ParamToVar extends TypeShuttle {
    private final ImmutableSet<String> names;

    ParamToVar(ImmutableSet<String> names) {
      this.names = names;
    }

    @Override
    public TypeExpr visit(PathType pathType) {
      if (pathType.isBareName() && names.contains(pathType.name())) {
        return Types.var(pathType.name());
      }
      return super.visit(pathType);
    }

    CapabilityRef convertCapability(CapabilityRef capability) {
      final ImmutableList<TypeExpr> args =
          Static.transformEager(capability.args, t -> t.accept(this));
      if (Static.elementsIdentical(capability.args, args)) {
        return capability;
      }
      return Types.capability(capability.name, args);
    }

    Obligation convertObligation(Obligation obligation) {
      return Obligation.of(
          obligation.type.accept(this),
          convertCapability(obligation.capability));
    }
  }
}

// End Pattern.java
