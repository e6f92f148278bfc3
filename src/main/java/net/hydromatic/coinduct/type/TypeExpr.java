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
package net.hydromatic.coinduct.type;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Structural representation of a type.
 *
 * <p>A type expression is either a {@link PathType} (a possibly qualified
 * name with ordered generic arguments, such as {@code Vec<T>} or {@code
 * std::fmt::Display}), a {@link TupleType} such as {@code (A, B)}, or a
 * {@link TypeVar}, which stands for any type and may only occur inside a
 * pattern.
 *
 * <p>Two type expressions are equal if and only if their printed forms, as
 * returned by {@link #key()}, are equal.
 */
public interface TypeExpr {
  /**
   * Returns the printed form of this type, e.g. "{@code Vec<T>}", "{@code (A,
   * B)}", "{@code $t}". It is also the structural identity of the type.
   */
  String key();

  /** Returns the kind of this type. */
  Kind kind();

  /** Writes the printed form of this type to a string builder. */
  StringBuilder describe(StringBuilder buf);

  <R> R accept(TypeVisitor<R> typeVisitor);

  /**
   * Copies this type, applying a given transform to component types, and
   * returning the original type if the component types are unchanged.
   */
  TypeExpr copy(UnaryOperator<TypeExpr> transform);

  /** Returns the component types, in order; empty for a variable. */
  default ImmutableList<TypeExpr> args() {
    return ImmutableList.of();
  }

  /**
   * Returns a copy of this type in which each variable that has an entry in
   * {@code bindings} is replaced by the bound type.
   */
  default TypeExpr substitute(Map<String, ? extends TypeExpr> bindings) {
    if (bindings.isEmpty()) {
      return this;
    }
    return accept(
        new TypeShuttle() {
          @Override
          public TypeExpr visit(TypeVar typeVar) {
            final TypeExpr type = bindings.get(typeVar.name);
            return type != null ? type : typeVar;
          }
        });
  }

  /** Returns the names of the variables in this type, in order. */
  default ImmutableSet<String> variables() {
    final Set<String> names = new LinkedHashSet<>();
    accept(
        new TypeVisitor<Void>() {
          @Override
          public Void visit(TypeVar typeVar) {
            names.add(typeVar.name);
            return null;
          }
        });
    return ImmutableSet.copyOf(names);
  }

  /** Kind of type expression. */
  enum Kind {
    PATH,
    TUPLE,
    VAR
  }
}

// End TypeExpr.java
