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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Matches a pattern type against a target type.
 *
 * <p>Matching is one-way: only variables in the pattern are bound. A variable
 * that occurs more than once must be bound to the same type each time. A
 * variable in the target is treated as an opaque name, and matches only an
 * identical variable in the pattern position.
 *
 * <p>For example, matching the pattern {@code Pair<$a, $a>} against {@code
 * Pair<i32, i32>} yields {@code {a: i32}}; matching it against {@code
 * Pair<i32, u8>} fails.
 */
public class TypeUnifier {
  private final Map<String, TypeExpr> bindings;

  private TypeUnifier(Map<String, TypeExpr> bindings) {
    this.bindings = new LinkedHashMap<>(bindings);
  }

  /**
   * Matches a pattern against a target, returning the variable bindings, or
   * null if the pattern does not match.
   */
  public static @Nullable Map<String, TypeExpr> match(
      TypeExpr pattern, TypeExpr target) {
    final TypeUnifier unifier = new TypeUnifier(ImmutableMap.of());
    if (unifier.tryMatch(pattern, target)) {
      return ImmutableMap.copyOf(unifier.bindings);
    }
    return null;
  }

  /**
   * Matches a list of patterns against a list of targets of the same length,
   * starting from a set of existing bindings. Returns the combined bindings,
   * or null if the lists have different lengths or a pair does not match.
   */
  public static @Nullable Map<String, TypeExpr> matchAll(
      List<? extends TypeExpr> patterns,
      List<? extends TypeExpr> targets,
      Map<String, TypeExpr> bindings) {
    final TypeUnifier unifier = new TypeUnifier(bindings);
    if (unifier.tryMatchAll(patterns, targets)) {
      return ImmutableMap.copyOf(unifier.bindings);
    }
    return null;
  }

  private boolean tryMatchAll(
      List<? extends TypeExpr> patterns, List<? extends TypeExpr> targets) {
    if (patterns.size() != targets.size()) {
      return false;
    }
    for (int i = 0; i < patterns.size(); i++) {
      if (!tryMatch(patterns.get(i), targets.get(i))) {
        return false;
      }
    }
    return true;
  }

  boolean tryMatch(TypeExpr pattern, TypeExpr target) {
    final TypeVar var;
    final PathType path1;
    final PathType path2;
    final TupleType tuple1;
    final TupleType tuple2;

    switch (pattern.kind()) {
      case VAR:
        var = (TypeVar) pattern;
        final @Nullable TypeExpr bound = bindings.get(var.name);
        if (bound == null) {
          bindings.put(var.name, target);
          return true;
        }
        return bound.equals(target);

      case PATH:
        path1 = (PathType) pattern;
        switch (target.kind()) {
          case PATH:
            path2 = (PathType) target;
            return path1.segments.equals(path2.segments)
                && tryMatchAll(path1.args, path2.args);

          default:
            return false;
        }

      case TUPLE:
        tuple1 = (TupleType) pattern;
        switch (target.kind()) {
          case TUPLE:
            tuple2 = (TupleType) target;
            return tryMatchAll(tuple1.elements, tuple2.elements);

          default:
            return false;
        }

      default:
        throw new AssertionError("unknown kind " + pattern.kind());
    }
  }
}

// End TypeUnifier.java
