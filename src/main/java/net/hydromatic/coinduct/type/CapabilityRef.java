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

import static java.util.Objects.requireNonNull;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import net.hydromatic.coinduct.util.Static;

/**
 * Reference to a capability, with generic arguments.
 *
 * <p>For example, {@code Evaluate}, {@code TraitA<S>}, {@code
 * std::fmt::Display}. Capabilities are identified by {@link #name}; two
 * references are equal if their printed forms are equal.
 */
public final class CapabilityRef {
  private static final Splitter PATH_SPLITTER = Splitter.on("::");

  /** Name of the capability, possibly qualified, e.g. "super::TraitA". */
  public final String name;
  public final ImmutableList<TypeExpr> args;
  private final String key;

  CapabilityRef(String name, List<? extends TypeExpr> args) {
    this.name = requireNonNull(name);
    this.args = ImmutableList.copyOf(args);
    this.key =
        PathType.describe(
                new StringBuilder(),
                PathType.checkSegments(PATH_SPLITTER.splitToList(name)),
                this.args)
            .toString();
  }

  /** Returns the printed form, e.g. "{@code TraitA<S>}". */
  public String key() {
    return key;
  }

  @Override
  public String toString() {
    return key;
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj
        || obj instanceof CapabilityRef
            && key.equals(((CapabilityRef) obj).key);
  }

  /** Returns a copy of this reference with variables substituted. */
  public CapabilityRef substitute(Map<String, ? extends TypeExpr> bindings) {
    if (args.isEmpty() || bindings.isEmpty()) {
      return this;
    }
    final ImmutableList<TypeExpr> args2 =
        Static.transformEager(args, arg -> arg.substitute(bindings));
    if (Static.elementsIdentical(args, args2)) {
      return this;
    }
    return new CapabilityRef(name, args2);
  }
}

// End CapabilityRef.java
