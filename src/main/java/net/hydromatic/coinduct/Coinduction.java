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
package net.hydromatic.coinduct;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.coinduct.ast.Declaration;
import net.hydromatic.coinduct.compile.CycleBreaker;
import net.hydromatic.coinduct.compile.Expander;
import net.hydromatic.coinduct.compile.Extractor;
import net.hydromatic.coinduct.compile.PatternMatcher;
import net.hydromatic.coinduct.compile.PatternRegistry;
import net.hydromatic.coinduct.compile.Prop;
import net.hydromatic.coinduct.compile.Tracer;
import net.hydromatic.coinduct.compile.Tracers;
import net.hydromatic.coinduct.compile.WorkList;
import net.hydromatic.coinduct.graph.ConstraintGraph;
import net.hydromatic.coinduct.util.CoinductionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes cyclic preconditions from a set of declarations.
 *
 * <p>Usage:
 *
 * <pre>{@code
 * List<Declaration> rewritten =
 *     Coinduction.create(registry, ImmutableList.of("Evaluate"), propMap)
 *         .rewrite(declarations);
 * }</pre>
 *
 * <p>Each call to {@link #rewrite} builds a constraint graph for every
 * declaration, expands the graphs until no new obligations appear, and then
 * rewrites each declaration whose graph has a cycle. An instance holds no
 * state between calls.
 */
public class Coinduction {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(Coinduction.class);

  private final PatternRegistry registry;
  private final ImmutableList<String> tracked;
  private final ImmutableMap<Prop, Object> propMap;
  private final Tracer tracer;

  private Coinduction(
      PatternRegistry registry,
      List<String> tracked,
      Map<Prop, Object> propMap,
      Tracer tracer) {
    this.registry = requireNonNull(registry);
    this.tracked = ImmutableList.copyOf(tracked);
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = requireNonNull(tracer);
  }

  /**
   * Creates a Coinduction.
   *
   * @param registry Patterns
   * @param tracked Names of capabilities whose obligations are expanded and
   *     checked for cycles; if empty, see {@link Prop#AUTO_DETECT}
   * @param propMap Property values
   */
  public static Coinduction create(
      PatternRegistry registry,
      List<String> tracked,
      Map<Prop, Object> propMap) {
    return new Coinduction(registry, tracked, propMap, Tracers.empty());
  }

  /** Returns a copy of this Coinduction with a given tracer. */
  public Coinduction withTracer(Tracer tracer) {
    return new Coinduction(registry, tracked, propMap, tracer);
  }

  /**
   * Returns the names of the capabilities that will be tracked when
   * rewriting a given list of declarations.
   */
  public ImmutableSet<String> trackedCapabilities(
      List<Declaration> declarations) {
    if (!tracked.isEmpty()) {
      return ImmutableSet.copyOf(tracked);
    }
    if (!Prop.AUTO_DETECT.booleanValue(propMap)) {
      return ImmutableSet.of();
    }
    final ImmutableSet.Builder<String> names = ImmutableSet.builder();
    declarations.forEach(d -> names.add(d.capability.name));
    return names.build();
  }

  /**
   * Rewrites a list of declarations.
   *
   * <p>Returns a list of the same length and order. A declaration without
   * cycles is returned as is; others have their generic parameter bounds and
   * where clause changed, and nothing else.
   *
   * @throws CoinductionException on the first error; there is no partial
   *     result
   */
  public ImmutableList<Declaration> rewrite(List<Declaration> declarations) {
    try {
      return rewrite_(declarations);
    } catch (CoinductionException e) {
      tracer.onException(e);
      throw e;
    }
  }

  private ImmutableList<Declaration> rewrite_(List<Declaration> declarations) {
    final ImmutableSet<String> trackedNames =
        trackedCapabilities(declarations);
    LOGGER.debug(
        "Rewriting {} declarations, tracking {}",
        declarations.size(),
        trackedNames);

    final WorkList workList = new WorkList();
    final Extractor extractor = new Extractor(trackedNames, workList);
    final Map<Declaration, ConstraintGraph> graphs = new LinkedHashMap<>();
    for (Declaration declaration : declarations) {
      final ConstraintGraph previous =
          graphs.put(declaration, extractor.extract(declaration));
      checkArgument(
          previous == null,
          "declaration occurs more than once: %s",
          declaration);
    }

    final PatternMatcher matcher =
        new PatternMatcher(
            registry,
            declarations,
            Prop.AMBIGUITY_POLICY.enumValue(
                propMap, Prop.AmbiguityPolicy.class));
    final Expander expander =
        new Expander(
            matcher,
            trackedNames,
            workList,
            Prop.MAX_ITERATIONS.intValue(propMap),
            tracer);
    final int iterations = expander.expand(graphs);
    LOGGER.debug("Expansion finished after {} iterations", iterations);

    final ImmutableList.Builder<Declaration> b = ImmutableList.builder();
    graphs.forEach(
        (declaration, graph) -> {
          tracer.onGraph(declaration, graph);
          final Declaration rewritten =
              CycleBreaker.rewrite(declaration, graph);
          tracer.onRewrite(declaration, rewritten);
          b.add(rewritten);
        });
    return b.build();
  }
}

// End Coinduction.java
