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

/**
 * Abstract implementation of {@link TypeExpr}.
 *
 * <p>Subclasses compute the printed form once, in their constructor, and this
 * class uses it for {@link #equals} and {@link #hashCode}.
 */
abstract class BaseType implements TypeExpr {
  private final Kind kind;
  private final String key;

  protected BaseType(Kind kind, String key) {
    this.kind = requireNonNull(kind);
    this.key = requireNonNull(key);
  }

  @Override
  public final String key() {
    return key;
  }

  @Override
  public final Kind kind() {
    return kind;
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
        || obj instanceof BaseType
            && kind == ((BaseType) obj).kind
            && key.equals(((BaseType) obj).key);
  }
}

// End BaseType.java
