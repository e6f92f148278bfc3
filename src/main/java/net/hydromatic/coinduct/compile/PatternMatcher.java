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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.coinduct.ast.Declaration;
import net.hydromatic.coinduct.type.Obligation;
import net.hydromatic.coinduct.type.PathType;
import net.hydromatic.coinduct.type.TypeExpr;
import net.hydromatic.coinduct.util.CoinductionException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Resolves an obligation to the obligations that it depends on.
 *
 * <p>An obligation is resolved by the first registered pattern for its
 * capability that matches it, or by a declaration of the same capability
 * whose Self type matches its type. An obligation on a generic parameter of
 * the declaration that contains it is an assumption; it is satisfied by
 * whoever uses the declaration, and depends on nothing.
 */
public class PatternMatcher {
  private final PatternRegistry registry;
  private final ImmutableList<Declaration> declarations;
  private final ImmutableList<Pattern> declarationPatterns;
  private final Prop.AmbiguityPolicy ambiguityPolicy;

  public PatternMatcher(
      PatternRegistry registry,
      List<Declaration> declarations,
      Prop.AmbiguityPolicy ambiguityPolicy) {
    this.registry = requireNonNull(registry);
    this.declarations = ImmutableList.copyOf(declarations);
    this.declarationPatterns =
        ImmutableList.copyOf(
            this.declarations.stream().map(Pattern::of).iterator());
    this.ambiguityPolicy = requireNonNull(ambiguityPolicy);
  }

  /**
   * Resolves an obligation.
   *
   * @param target Obligation to resolve
   * @param owner Declaration in whose graph the obligation occurs
   * @throws CoinductionException if nothing resolves the obligation, or if
   *     it is resolved ambiguously
   */
  public Resolution resolve(Obligation target, Declaration owner) {
    final Resolution patternResolution = matchPattern(target);

    final List<Resolution> declarationResolutions = new ArrayList<>();
    for (int i = 0; i < declarations.size(); i++) {
      final Pattern pattern = declarationPatterns.get(i);
      final Map<String, TypeExpr> bindings = pattern.match(target);
      if (bindings != null) {
        declarationResolutions.add(
            new Resolution(
                Resolution.Kind.DIRECT_REFERENCE,
                declarations.get(i).id(),
                pattern.instantiate(bindings)));
      }
    }

    if (declarationResolutions.size() > 1) {
      throw CoinductionException.ambiguous(
          owner.id(), target.key(), sources(declarationResolutions));
    }
    if (patternResolution != null) {
      if (!declarationResolutions.isEmpty()
          && ambiguityPolicy == Prop.AmbiguityPolicy.REJECT) {
        throw CoinductionException.ambiguous(
            owner.id(),
            target.key(),
            sources(
                ImmutableList.of(
                    patternResolution, declarationResolutions.get(0))));
      }
      return patternResolution;
    }
    if (!declarationResolutions.isEmpty()) {
      return declarationResolutions.get(0);
    }
    if (isGenericParam(target.type, owner)) {
      return new Resolution(
          Resolution.Kind.ASSUMPTION, owner.id(), ImmutableList.of());
    }
    throw CoinductionException.unresolved(owner.id(), target.key());
  }

  /** Returns the resolution by the first pattern that matches, or null. */
  private @Nullable Resolution matchPattern(Obligation target) {
    for (Pattern pattern : registry.get(target.capability.name)) {
      final Map<String, TypeExpr> bindings = pattern.match(target);
      if (bindings != null) {
        return new Resolution(
            Resolution.Kind.PATTERN,
            pattern.toString(),
            pattern.instantiate(bindings));
      }
    }
    return null;
  }

  private static boolean isGenericParam(TypeExpr type, Declaration owner) {
    if (type.kind() != TypeExpr.Kind.PATH) {
      return false;
    }
    final PathType pathType = (PathType) type;
    return pathType.isBareName()
        && owner.genericParamNames().contains(pathType.name());
  }

  private static String sources(List<Resolution> resolutions) {
    final StringBuilder buf = new StringBuilder("[");
    for (Resolution resolution : resolutions) {
      if (buf.length() > 1) {
        buf.append(", ");
      }
      buf.append(resolution.source);
    }
    return buf.append(']').toString();
  }

  /** Result of resolving an obligation. */
  public static class Resolution {
    public final Kind kind;

    /** Description of the pattern or declaration that resolved it. */
    public final String source;

    /** Obligations that the resolved obligation depends on. */
    public final ImmutableList<Obligation> derived;

    Resolution(Kind kind, String source, List<Obligation> derived) {
      this.kind = requireNonNull(kind);
      this.source = requireNonNull(source);
      this.derived = ImmutableList.copyOf(derived);
    }

    @Override
    public String toString() {
      return kind + " " + source + " " + derived;
    }

    /** How an obligation was resolved. */
    public enum Kind {
      /** By a registered pattern. */
      PATTERN,
      /** By a declaration in the same invocation. */
      DIRECT_REFERENCE,
      /** By the caller of the declaration. */
      ASSUMPTION
    }
  }
}

// End PatternMatcher.java
