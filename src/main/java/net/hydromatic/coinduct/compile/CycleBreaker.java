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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;
import net.hydromatic.coinduct.ast.Declaration;
import net.hydromatic.coinduct.graph.ConstraintGraph;
import net.hydromatic.coinduct.type.CapabilityRef;
import net.hydromatic.coinduct.type.Obligation;
import net.hydromatic.coinduct.util.Static;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes cyclic preconditions from declarations.
 *
 * <p>A precondition that is on a cycle is satisfied coinductively, by the
 * declarations that form the cycle, and is removed. Obligations that are
 * not on a cycle but are reachable from one (leaves) are still needed, and
 * are added to the where clause.
 */
public class CycleBreaker {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(CycleBreaker.class);

  private CycleBreaker() {}

  /** Classifies the nodes of a graph. */
  public static Analysis analyze(ConstraintGraph graph) {
    final TreeSet<Integer> cyclic = new TreeSet<>();
    for (ImmutableSet<Integer> scc : graph.computeSccs()) {
      if (scc.size() > 1) {
        cyclic.addAll(scc);
      } else {
        final int id = scc.iterator().next();
        if (graph.hasSelfEdge(id)) {
          cyclic.add(id);
        }
      }
    }
    final TreeSet<Integer> leaves = new TreeSet<>();
    for (int id : cyclic) {
      leaves.addAll(graph.reachableFrom(id));
    }
    leaves.removeAll(cyclic);
    // A duplicate of a cyclic obligation is not a leaf
    leaves.removeIf(id -> cyclic.contains(firstNode(graph, id)));
    return new Analysis(
        ImmutableSet.copyOf(cyclic), ImmutableSet.copyOf(leaves));
  }

  /** Returns the id of the first node with the same obligation as a node. */
  private static int firstNode(ConstraintGraph graph, int id) {
    return graph.findNode(graph.node(id).obligation).orElse(id);
  }

  /**
   * Rewrites a declaration given its fully expanded graph. Returns the
   * declaration itself if its graph has no cycles.
   */
  public static Declaration rewrite(
      Declaration declaration, ConstraintGraph graph) {
    final Analysis analysis = analyze(graph);
    if (analysis.cyclic.isEmpty()) {
      return declaration;
    }

    final Set<Obligation> remaining = new LinkedHashSet<>();
    final List<Declaration.GenericParam> genericParams = new ArrayList<>();
    for (Declaration.GenericParam param : declaration.genericParams) {
      final ImmutableList<CapabilityRef> bounds =
          Static.filterEager(
              param.bounds,
              c -> !analysis.isCyclic(graph, Obligation.of(param.type(), c)));
      bounds.forEach(c -> remaining.add(Obligation.of(param.type(), c)));
      genericParams.add(param.withBounds(bounds));
    }

    final List<Declaration.Predicate> predicates = new ArrayList<>();
    for (Declaration.Predicate predicate : declaration.predicates) {
      final ImmutableList<CapabilityRef> bounds =
          Static.filterEager(
              predicate.bounds,
              c -> !analysis.isCyclic(graph, Obligation.of(predicate.type, c)));
      if (!bounds.isEmpty()) {
        bounds.forEach(c -> remaining.add(Obligation.of(predicate.type, c)));
        predicates.add(predicate.withBounds(bounds));
      }
    }

    for (int id : analysis.leaves) {
      final Obligation leaf = graph.node(id).obligation;
      if (remaining.add(leaf)) {
        predicates.add(Declaration.Predicate.of(leaf));
      }
    }

    final Declaration rewritten =
        declaration.withPreconditions(genericParams, predicates);
    LOGGER.debug("Rewrote {} as {}", declaration, rewritten);
    return rewritten;
  }

  /** Classification of the nodes of a graph. */
  public static class Analysis {
    /** Nodes that are on a cycle, in ascending order. */
    public final ImmutableSet<Integer> cyclic;

    /**
     * Nodes that are not on a cycle but can be reached from one, in ascending
     * order. A node whose obligation equals that of a cyclic node is not a
     * leaf.
     */
    public final ImmutableSet<Integer> leaves;

    Analysis(ImmutableSet<Integer> cyclic, ImmutableSet<Integer> leaves) {
      this.cyclic = cyclic;
      this.leaves = leaves;
    }

    /**
     * Returns whether the first node for an obligation is cyclic. An
     * obligation that has no node is not cyclic.
     */
    boolean isCyclic(ConstraintGraph graph, Obligation obligation) {
      final OptionalInt id = graph.findNode(obligation);
      return id.isPresent() && cyclic.contains(id.getAsInt());
    }

    @Override
    public String toString() {
      return "{cyclic: " + cyclic + ", leaves: " + leaves + "}";
    }
  }
}

// End CycleBreaker.java
