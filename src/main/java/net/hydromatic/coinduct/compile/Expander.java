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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import net.hydromatic.coinduct.ast.Declaration;
import net.hydromatic.coinduct.graph.ConstraintGraph;
import net.hydromatic.coinduct.type.Obligation;
import net.hydromatic.coinduct.util.CoinductionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands constraint graphs until no new obligations appear.
 *
 * <p>Each obligation removed from the work list is resolved in every graph
 * that contains it, and the obligations it depends on are added to that
 * graph. A dependency that is already a node of the graph reuses that node,
 * which is how cycles close. A tracked dependency that becomes a new node is
 * added to the work list.
 */
public class Expander {
  private static final Logger LOGGER = LoggerFactory.getLogger(Expander.class);

  private final PatternMatcher matcher;
  private final ImmutableSet<String> tracked;
  private final WorkList workList;
  private final int maxIterations;
  private final Tracer tracer;

  /**
   * Creates an Expander.
   *
   * @param matcher Resolves obligations
   * @param tracked Names of tracked capabilities
   * @param workList Pending obligations
   * @param maxIterations Maximum number of obligations to remove from the
   *     work list, or 0 for no limit; must not be negative
   * @param tracer Receives resolutions
   */
  public Expander(
      PatternMatcher matcher,
      Set<String> tracked,
      WorkList workList,
      int maxIterations,
      Tracer tracer) {
    this.matcher = requireNonNull(matcher);
    this.tracked = ImmutableSet.copyOf(tracked);
    this.workList = requireNonNull(workList);
    checkArgument(
        maxIterations >= 0,
        "maxIterations must not be negative: %s",
        maxIterations);
    this.maxIterations = maxIterations;
    this.tracer = requireNonNull(tracer);
  }

  /**
   * Expands graphs until the work list is empty.
   *
   * @param graphs Graph of each declaration, in declaration order
   * @return Number of obligations removed from the work list
   * @throws CoinductionException if an obligation cannot be resolved, or if
   *     the iteration limit is exceeded
   */
  public int expand(Map<Declaration, ConstraintGraph> graphs) {
    int iterations = 0;
    while (!workList.isEmpty()) {
      final Obligation target = requireNonNull(workList.poll());
      if (maxIterations > 0 && iterations >= maxIterations) {
        throw CoinductionException.iterationLimit(
            maxIterations, owner(graphs, target), target.key());
      }
      ++iterations;
      LOGGER.debug(
          "Expanding {} (iteration {}, {} pending)",
          target,
          iterations,
          workList.size());
      for (Map.Entry<Declaration, ConstraintGraph> entry : graphs.entrySet()) {
        expandIn(entry.getKey(), entry.getValue(), target);
      }
    }
    return iterations;
  }

  /**
   * Returns the identity of the first declaration whose graph contains an
   * obligation.
   */
  private static String owner(
      Map<Declaration, ConstraintGraph> graphs, Obligation obligation) {
    for (Map.Entry<Declaration, ConstraintGraph> entry : graphs.entrySet()) {
      if (entry.getValue().findNode(obligation).isPresent()) {
        return entry.getKey().id();
      }
    }
    throw new AssertionError("obligation in no graph: " + obligation);
  }

  private void expandIn(
      Declaration declaration, ConstraintGraph graph, Obligation target) {
    final OptionalInt found = graph.findNode(target);
    if (!found.isPresent()) {
      return;
    }
    final PatternMatcher.Resolution resolution =
        matcher.resolve(target, declaration);
    LOGGER.trace(
        "In {}, resolved {} by {}", declaration.id(), target, resolution);
    tracer.onResolve(declaration, target, resolution);

    final int from = found.getAsInt();
    for (Obligation derived : resolution.derived) {
      final OptionalInt existing = graph.findNode(derived);
      final int to;
      if (existing.isPresent()) {
        to = existing.getAsInt();
      } else {
        to = graph.insertNode(derived);
        if (derived.isTracked(tracked)) {
          workList.add(derived);
        }
      }
      if (!graph.hasEdge(from, to)) {
        graph.insertEdge(from, to);
      }
    }
  }
}

// End Expander.java
