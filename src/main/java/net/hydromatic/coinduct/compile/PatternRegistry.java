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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import net.hydromatic.coinduct.ast.Declaration;

/**
 * Immutable collection of patterns, grouped by capability name.
 *
 * <p>Within a capability, patterns are kept in order of registration, which
 * is the order in which they are tried. A registry may be shared among
 * invocations.
 */
public class PatternRegistry {
  private static final PatternRegistry EMPTY =
      new PatternRegistry(ImmutableListMultimap.of());

  private final ImmutableListMultimap<String, Pattern> patterns;

  private PatternRegistry(ImmutableListMultimap<String, Pattern> patterns) {
    this.patterns = patterns;
  }

  /** Returns a registry that has no patterns. */
  public static PatternRegistry empty() {
    return EMPTY;
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns the patterns for a capability, in order of registration. */
  public ImmutableList<Pattern> get(String capabilityName) {
    return patterns.get(capabilityName);
  }

    /** Returns the number of patterns. */
  public int size() {
    return patterns.size();
  }

  @Override
  public String toString() {
    return patterns.toString();
  }

  /** Builder for {@link PatternRegistry}. */
  public static class Builder {
    private final ImmutableListMultimap.Builder<String, Pattern> b =
        ImmutableListMultimap.builder();

    private Builder() {}

    /** Adds a pattern. */
    public Builder add(Pattern pattern) {
      b.put(pattern.capability.name, pattern);
      return this;
    }

    /**
     * Adds a pattern derived from a declaration, so that a declaration of one
     * module can satisfy obligations that arise in another.
     *
     * @see Pattern#of(Declaration)
     */
    public Builder addDeclaration(Declaration declaration) {
      return add(Pattern.of(declaration));
    }

    public PatternRegistry build() {
      return new PatternRegistry(b.build());
    }
  }
}

// End PatternRegistry.java
