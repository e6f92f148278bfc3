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

import java.util.Map;
import java.util.Set;

/**
 * Obligation that a type implements a capability, e.g. {@code Vec<Term>:
 * Evaluate}.
 *
 * <p>Obligations are values: two obligations are identical if and only if
 * their printed forms are identical.
 */
public final class Obligation {
  public final TypeExpr type;
  public final CapabilityRef capability;
  private final String key;

  Obligation(TypeExpr type, CapabilityRef capability) {
    this.type = requireNonNull(type);
    this.capability = requireNonNull(capability);
    this.key = type.key() + ": " + capability.key();
  }

  /** Creates an obligation. */
  public static Obligation of(TypeExpr type, CapabilityRef capability) {
    return new Obligation(type, capability);
  }

  /** Returns the printed form, e.g. "{@code T: TraitA<S>}". */
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
        || obj instanceof Obligation && key.equals(((Obligation) obj).key);
  }

  /** Returns whether this obligation's capability is in a set of names. */
  public boolean isTracked(Set<String> capabilityNames) {
    return capabilityNames.contains(capability.name);
  }

  /** Returns a copy of this obligation with variables substituted. */
  public Obligation substitute(Map<String, ? extends TypeExpr> bindings) {
    final TypeExpr type2 = type.substitute(bindings);
    final CapabilityRef capability2 = capability.substitute(bindings);
    if (type2 == type && capability2 == capability) {
      return this;
    }
    return new Obligation(type2, capability2);
  }
}

// End Obligation.java
