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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Factory methods for types, capability references and obligations. */
public class Types {
  private static final Splitter PATH_SPLITTER = Splitter.on("::");

  private Types() {}

  /**
   * Creates a path type. The name may be qualified; "{@code a::b::C}" becomes
   * a path of three segments.
   */
  public static PathType path(String name, TypeExpr... args) {
    return path(name, ImmutableList.copyOf(args));
  }

  /** Creates a path type with a list of arguments. */
  public static PathType path(String name, List<? extends TypeExpr> args) {
    return new PathType(PATH_SPLITTER.splitToList(name), args);
  }

  /** Creates a tuple type. */
  public static TupleType tuple(TypeExpr... elements) {
    return tuple(ImmutableList.copyOf(elements));
  }

  /** Creates a tuple type with a list of elements. */
  public static TupleType tuple(List<? extends TypeExpr> elements) {
    return new TupleType(elements);
  }

  /** Creates a pattern variable. */
  public static TypeVar var(String name) {
    return new TypeVar(name);
  }

  /** Creates a reference to a capability. */
  public static CapabilityRef capability(String name, TypeExpr... args) {
    return capability(name, ImmutableList.copyOf(args));
  }

  /** Creates a reference to a capability with a list of arguments. */
  public static CapabilityRef capability(
      String name, List<? extends TypeExpr> args) {
    return new CapabilityRef(name, args);
  }

  /** Creates an obligation. */
  public static Obligation obligation(TypeExpr type, CapabilityRef capability) {
    return Obligation.of(type, capability);
  }

  /** Creates an obligation on a capability without arguments. */
  public static Obligation obligation(TypeExpr type, String capabilityName) {
    return Obligation.of(type, capability(capabilityName));
  }
}

// End Types.java
