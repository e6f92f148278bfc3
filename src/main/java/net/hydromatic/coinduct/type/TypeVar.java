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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.function.UnaryOperator;

/**
 * Pattern variable (e.g. {@code $t}).
 *
 * <p>A variable matches any type. Variables occur in the shapes and templates
 * of patterns; the generic parameters of a declaration become variables when
 * the declaration is used as a pattern.
 */
public class TypeVar extends BaseType {
  public final String name;

  TypeVar(String name) {
    super(Kind.VAR, "$" + checkName(name));
    this.name = name;
  }

  private static String checkName(String name) {
    checkArgument(!name.isEmpty(), "variable must have a name");
    checkArgument(
        !name.startsWith("$"), "name must not start with '$': %s", name);
    return name;
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append('$').append(name);
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public TypeExpr copy(UnaryOperator<TypeExpr> transform) {
    return this;
  }
}

// End TypeVar.java
