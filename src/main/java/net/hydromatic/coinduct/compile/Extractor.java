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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import net.hydromatic.coinduct.ast.Declaration;
import net.hydromatic.coinduct.graph.ConstraintGraph;
import net.hydromatic.coinduct.type.Obligation;
import net.hydromatic.coinduct.type.PathType;
import net.hydromatic.coinduct.type.TypeExpr;
import net.hydromatic.coinduct.util.CoinductionException;

/**
 * Builds the initial constraint graph of a declaration.
 *
 * <p>The graph has the declaration's own obligation as its root, and an edge
 * from the root to a node for each atomic precondition. Preconditions whose
 * capability is tracked are added to the work list.
 */
public class Extractor {
  private final ImmutableSet<String> tracked;
  private final WorkList workList;

  public Extractor(Set<String> tracked, WorkList workList) {
    this.tracked = ImmutableSet.copyOf(tracked);
    this.workList = requireNonNull(workList);
  }

  /**
   * Creates the graph of a declaration.
   *
   * @throws CoinductionException if the Self type is not a simple name with
   *     optional generic arguments
   */
  public ConstraintGraph extract(Declaration declaration) {
    checkSelfType(declaration);
    final ConstraintGraph graph =
        new ConstraintGraph(declaration.rootObligation());
    final int root = graph.root().id;
    for (Obligation obligation : declaration.obligations()) {
      final int id = graph.insertNode(obligation);
      graph.insertEdge(root, id);
      if (obligation.isTracked(tracked)) {
        workList.add(obligation);
      }
    }
    return graph;
  }

  private static void checkSelfType(Declaration declaration) {
    final TypeExpr selfType = declaration.selfType;
    if (selfType.kind() != TypeExpr.Kind.PATH
        || ((PathType) selfType).isQualified()) {
      throw CoinductionException.malformedSelfType(
          declaration.id(), selfType.key());
    }
  }
}

// End Extractor.java
