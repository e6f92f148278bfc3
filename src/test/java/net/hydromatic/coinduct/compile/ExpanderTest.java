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
import static net.hydromatic.coinduct.type.Types.obligation;
import static net.hydromatic.coinduct.type.Types.path;
import static net.hydromatic.coinduct.type.Types.var;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.coinduct.Fixtures;
import net.hydromatic.coinduct.ast.Declaration;
import net.hydromatic.coinduct.graph.ConstraintGraph;
import net.hydromatic.coinduct.util.CoinductionException;
import org.junit.jupiter.api.Test;

/** Tests for {@link Expander}. */
public class ExpanderTest {
  /** Extracts graphs and expands them. */
  private static Map<Declaration, ConstraintGraph> expand(
      PatternRegistry registry,
      ImmutableSet<String> tracked,
      int maxIterations,
      Tracer tracer,
      Declaration... declarations) {
    final WorkList workList = new WorkList();
    final Extractor extractor = new Extractor(tracked, workList);
    final Map<Declaration, ConstraintGraph> graphs = new LinkedHashMap<>();
    for (Declaration declaration : declarations) {
      graphs.put(declaration, extractor.extract(declaration));
    }
    final PatternMatcher matcher =
        new PatternMatcher(
            registry,
            ImmutableList.copyOf(declarations),
            Prop.AmbiguityPolicy.REJECT);
    final Expander expander =
        new Expander(matcher, tracked, workList, maxIterations, tracer);
    expander.expand(graphs);
    assertThat(workList.isEmpty(), is(true));
    return graphs;
  }

  /** Expansion closes the cycle between two declarations. */
  @Test
  void testExpandCycle() {
    final Declaration expr = Fixtures.expr();
    final Declaration term = Fixtures.term();
    final List<String> resolved = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnResolve(
            Tracers.empty(), (o, r) -> resolved.add(o + " by " + r.source));
    final Map<Declaration, ConstraintGraph> graphs =
        expand(
            PatternRegistry.empty(),
            ImmutableSet.of("Evaluate"),
            0,
            tracer,
            expr,
            term);
    assertThat(
        graphs.get(expr),
        hasToString(
            "{nodes: [0: Expr: Evaluate, 1: Term: Evaluate], "
                + "edges: [0 -> 1, 1 -> 0]}"));
    assertThat(
        graphs.get(term),
        hasToString(
            "{nodes: [0: Term: Evaluate, 1: Expr: Evaluate], "
                + "edges: [0 -> 1, 1 -> 0]}"));
    // The last obligation added, "Expr: Evaluate", is expanded first, in
    // each graph that contains it
    assertThat(
        resolved,
        hasToString(
            "[Expr: Evaluate by Evaluate for Expr, "
                + "Expr: Evaluate by Evaluate for Expr, "
                + "Term: Evaluate by Evaluate for Term, "
                + "Term: Evaluate by Evaluate for Term]"));
  }

  /**
   * Dependencies that are already in a graph reuse the existing node;
   * untracked dependencies become nodes but are not expanded.
   */
  @Test
  void testExpandGeneric() {
    final Declaration recA = Fixtures.recA();
    final Declaration recB = Fixtures.recB();
    final Map<Declaration, ConstraintGraph> graphs =
        expand(
            PatternRegistry.empty(),
            ImmutableSet.of("TraitA", "TraitB"),
            0,
            Tracers.empty(),
            recA,
            recB);
    assertThat(
        graphs.get(recA).nodes(),
        hasToString(
            "[0: RecA<T>: TraitA<S>, 1: RecB<T>: TraitB<S>, "
                + "2: T: UpperHex, 3: T: Default, 4: T: Display]"));
    assertThat(
        graphs.get(recA).edges(),
        hasToString("[0 -> 1, 0 -> 2, 0 -> 3, 1 -> 0, 1 -> 4, 1 -> 3]"));
    assertThat(
        graphs.get(recB).nodes(),
        hasToString(
            "[0: RecB<T>: TraitB<S>, 1: RecA<T>: TraitA<S>, "
                + "2: T: Display, 3: T: Default, 4: T: UpperHex]"));
  }

  /** Expansion that never finishes is stopped by the iteration limit. */
  @Test
  void testIterationLimit() {
    final PatternRegistry registry =
        PatternRegistry.builder()
            .add(
                Pattern.of(
                    var("t"),
                    capability("Grow"),
                    obligation(path("Box", var("t")), "Grow")))
            .build();
    final Declaration seed =
        Declaration.builder(path("Seed"), capability("Start"))
            .where(path("Seed"), capability("Grow"))
            .build();
    final CoinductionException e =
        assertThrows(
            CoinductionException.class,
            () ->
                expand(
                    registry,
                    ImmutableSet.of("Grow"),
                    5,
                    Tracers.empty(),
                    seed));
    assertThat(
        e.kind(), is(CoinductionException.Kind.ITERATION_LIMIT_EXCEEDED));
    assertThat(e.obligation(), is("Box<Box<Box<Box<Box<Seed>>>>>: Grow"));
    assertThat(e.declaration(), is("Start for Seed"));
    assertThat(
        e,
        hasToString(
            "Error: ITERATION_LIMIT_EXCEEDED in Start for Seed: "
                + "Expansion did not finish within 5 iterations"));
  }

  /** A negative iteration limit is rejected, not treated as unlimited. */
  @Test
  void testNegativeIterationLimit() {
    final PatternMatcher matcher =
        new PatternMatcher(
            PatternRegistry.empty(),
            ImmutableList.of(),
            Prop.AmbiguityPolicy.REJECT);
    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                new Expander(
                    matcher,
                    ImmutableSet.of("Grow"),
                    new WorkList(),
                    -1,
                    Tracers.empty()));
    assertThat(e.getMessage(), is("maxIterations must not be negative: -1"));
  }
}

// End ExpanderTest.java
