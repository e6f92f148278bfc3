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

import static net.hydromatic.coinduct.type.Types.capability;
import static net.hydromatic.coinduct.type.Types.path;
import static net.hydromatic.coinduct.type.Types.tuple;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableSet;
import net.hydromatic.coinduct.Fixtures;
import net.hydromatic.coinduct.ast.Declaration;
import net.hydromatic.coinduct.graph.ConstraintGraph;
import net.hydromatic.coinduct.type.TypeExpr;
import net.hydromatic.coinduct.type.Types;
import net.hydromatic.coinduct.util.CoinductionException;
import org.junit.jupiter.api.Test;

/** Tests for {@link Extractor}. */
public class ExtractorTest {
  @Test
  void testExtract() {
    final WorkList workList = new WorkList();
    final Extractor extractor =
        new Extractor(ImmutableSet.of("Evaluate"), workList);
    final ConstraintGraph graph = extractor.extract(Fixtures.expr());
    assertThat(
        graph,
        hasToString(
            "{nodes: [0: Expr: Evaluate, 1: Term: Evaluate], "
                + "edges: [0 -> 1]}"));
    assertThat(workList, hasToString("[Term: Evaluate]"));
  }

  /**
   * Compound bounds are split, generic parameter bounds come first, and only
   * tracked obligations go onto the work list.
   */
  @Test
  void testExtractCompound() {
    final Declaration d =
        Declaration.builder(path("Foo", path("T")), capability("Cap"))
            .genericParam("T", capability("Display"), capability("Default"))
            .where(path("T"), capability("Cap"))
            .where(path("Bar"), capability("Cap"), capability("Other"))
            .where(path("T"), capability("Cap"))
            .build();
    final WorkList workList = new WorkList();
    final ConstraintGraph graph =
        new Extractor(ImmutableSet.of("Cap"), workList).extract(d);
    assertThat(
        graph.nodes(),
        hasToString(
            "[0: Foo<T>: Cap, 1: T: Display, 2: T: Default, 3: T: Cap, "
                + "4: Bar: Cap, 5: Bar: Other, 6: T: Cap]"));
    assertThat(
        graph.edges(),
        hasToString("[0 -> 1, 0 -> 2, 0 -> 3, 0 -> 4, 0 -> 5, 0 -> 6]"));
    // "T: Cap" occurs twice, but is only pending once
    assertThat(workList, hasToString("[Bar: Cap, T: Cap]"));
  }

  @Test
  void testExtractNothingTracked() {
    final WorkList workList = new WorkList();
    final ConstraintGraph graph =
        new Extractor(ImmutableSet.of(), workList).extract(Fixtures.recA());
    assertThat(graph.size(), is(4));
    assertThat(workList.isEmpty(), is(true));
  }

  @Test
  void testMalformedSelfType() {
    checkMalformed(path("a::Foo"), "a::Foo");
    checkMalformed(tuple(path("A"), path("B")), "(A, B)");
    checkMalformed(Types.var("t"), "$t");
  }

  private static void checkMalformed(TypeExpr selfType, String expected) {
    final Declaration d =
        Declaration.builder(selfType, capability("Cap"))
            .where(path("i32"), capability("Cap"))
            .build();
    final WorkList workList = new WorkList();
    final Extractor extractor =
        new Extractor(ImmutableSet.of("Cap"), workList);
    final CoinductionException e =
        assertThrows(CoinductionException.class, () -> extractor.extract(d));
    assertThat(e.kind(), is(CoinductionException.Kind.MALFORMED_SELF_TYPE));
    assertThat(
        e,
        hasToString(
            "Error: MALFORMED_SELF_TYPE in Cap for " + expected
                + ": Self type must be a name with optional generic "
                + "arguments, but was " + expected));
    assertThat(workList.isEmpty(), is(true));
  }
}

// End ExtractorTest.java
