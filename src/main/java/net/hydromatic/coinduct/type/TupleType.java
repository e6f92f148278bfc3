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
import java.util.List;
import java.util.function.UnaryOperator;
import net.hydromatic.coinduct.util.Static;

/** Tuple type, e.g. {@code (A, B)}, or the unit type {@code ()}. */
public class TupleType extends BaseType {
  public final ImmutableList<TypeExpr> elements;

  TupleType(List<? extends TypeExpr> elements) {
    super(Kind.TUPLE, describe(new StringBuilder(), elements).toString());
    this.elements = ImmutableList.copyOf(elements);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return describe(buf, elements);
  }

  @Override
  public ImmutableList<TypeExpr> args() {
    return elements;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public TupleType copy(UnaryOperator<TypeExpr> transform) {
    final ImmutableList<TypeExpr> elements2 =
        Static.transformEager(elements, transform::apply);
    if (Static.elementsIdentical(elements, elements2)) {
      return this;
    }
    return new TupleType(elements2);
  }

  static StringBuilder describe(
      StringBuilder buf, List<? extends TypeExpr> elements) {
    buf.append('(');
    for (int i = 0; i < elements.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      elements.get(i).describe(buf);
    }
    if (elements.size() == 1) {
      // "(A,)" is a tuple, "(A)" would be A in parentheses
      buf.append(',');
    }
    return buf.append(')');
  }
}

// End TupleType.java
