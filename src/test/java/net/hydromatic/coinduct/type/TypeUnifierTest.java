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

import static net.hydromatic.coinduct.type.Types.path;
import static net.hydromatic.coinduct.type.Types.tuple;
import static net.hydromatic.coinduct.type.Types.var;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNull.nullValue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

/** Tests for {@link TypeUnifier}. */
public class TypeUnifierTest {
  @Test
  void testMatchVariable() {
    assertThat(
        TypeUnifier.match(var("t"), path("Vec", path("Term"))),
        hasToString("{t=Vec<Term>}"));
    assertThat(
        TypeUnifier.match(path("Vec", var("t")), path("Vec", path("Term"))),
        hasToString("{t=Term}"));
    assertThat(
        TypeUnifier.match(
            tuple(var("t1"), var("t2")), tuple(path("Unit"), path("NodeB"))),
        hasToString("{t1=Unit, t2=NodeB}"));
  }

  @Test
  void testMatchGround() {
    assertThat(
        TypeUnifier.match(path("Expr"), path("Expr")), hasToString("{}"));
    assertThat(TypeUnifier.match(path("Expr"), path("Term")), nullValue());
    assertThat(
        TypeUnifier.match(path("a::Expr"), path("b::Expr")), nullValue());
  }

  /** A variable that occurs twice must match the same type twice. */
  @Test
  void testMatchRepeatedVariable() {
    final TypeExpr pattern = path("Pair", var("a"), var("a"));
    assertThat(
        TypeUnifier.match(pattern, path("Pair", path("i32"), path("i32"))),
        hasToString("{a=i32}"));
    assertThat(
        TypeUnifier.match(pattern, path("Pair", path("i32"), path("u8"))),
        nullValue());
  }

  @Test
  void testMatchShapeMismatch() {
    // different number of arguments
    assertThat(
        TypeUnifier.match(path("Vec", var("t")), path("Vec")), nullValue());
    assertThat(
        TypeUnifier.match(
            tuple(var("a"), var("b")), tuple(path("A"), path("B"), path("C"))),
        nullValue());
    // tuple versus path
    assertThat(
        TypeUnifier.match(tuple(var("a")), path("Vec", path("A"))),
        nullValue());
    assertThat(
        TypeUnifier.match(path("Vec", var("a")), tuple(path("A"))),
        nullValue());
  }

  @Test
  void testMatchAll() {
    assertThat(
        TypeUnifier.matchAll(
            ImmutableList.of(var("s")),
            ImmutableList.of(path("S")),
            ImmutableMap.of("t", path("T"))),
        hasToString("{t=T, s=S}"));
    // existing binding is respected
    assertThat(
        TypeUnifier.matchAll(
            ImmutableList.of(var("t")),
            ImmutableList.of(path("U")),
            ImmutableMap.of("t", path("T"))),
        nullValue());
    assertThat(
        TypeUnifier.matchAll(
            ImmutableList.of(var("t")),
            ImmutableList.of(),
            ImmutableMap.of()),
        nullValue());
    assertThat(
        TypeUnifier.matchAll(
            ImmutableList.of(), ImmutableList.of(), ImmutableMap.of())
            .isEmpty(),
        is(true));
  }
}

// End TypeUnifierTest.java
