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

/**
 * Visitor over {@link TypeExpr} objects.
 *
 * @param <R> return type from {@code visit} methods
 * @see TypeExpr#accept(TypeVisitor)
 */
public class TypeVisitor<R> {
  /** Visits a {@link TypeVar}. */
  public R visit(TypeVar typeVar) {
    return null;
  }

  /** Visits a {@link PathType}. */
  public R visit(PathType pathType) {
    R r = null;
    for (TypeExpr arg : pathType.args) {
      r = arg.accept(this);
    }
    return r;
  }

  /** Visits a {@link TupleType}. */
  public R visit(TupleType tupleType) {
    R r = null;
    for (TypeExpr element : tupleType.elements) {
      r = element.accept(this);
    }
    return r;
  }
}

// End TypeVisitor.java
