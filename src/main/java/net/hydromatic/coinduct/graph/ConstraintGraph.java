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
package net.hydromatic.coinduct.graph;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;
import java.util.OptionalInt;
import java.util.TreeSet;
import net.hydromatic.coinduct.type.Obligation;
import net.hydromatic.coinduct.util.CoinductionException;

/**
 * Directed graph of obligations for one declaration.
 *
 * <p>Node 0 is the root, the obligation that the declaration itself
 * satisfies. An edge from node {@code a} to node {@code b} means that the
 * implementation that justifies {@code a} assumes {@code b}.
 *
 * <p>The graph only grows. Nodes are numbered densely, in order of insertion,
 * and are never removed or renumbered. Neither nodes nor edges are
 * deduplicated; callers use {@link #findNode} and {@link #hasEdge} when they
 * want to reuse an existing one.
 */
public class ConstraintGraph {
  private final List<Node> nodes = new ArrayList<>();
  private final List<Edge> edges = new ArrayList<>();

  /** Successors of each node, in order of edge insertion. */
  private final List<List<Integer>> successors = new ArrayList<>();

  /** Creates a graph whose root is a given obligation. */
  public ConstraintGraph(Obligation root) {
    insertNode(root);
  }

  /** Returns the root node. */
  public Node root() {
    return nodes.get(0);
  }

  /** Returns the number of nodes. */
  public int size() {
    return nodes.size();
  }

  /** Returns the nodes, in order of id. */
  public ImmutableList<Node> nodes() {
    return ImmutableList.copyOf(nodes);
  }

  /** Returns the edges, in order of insertion. */
  public ImmutableList<Edge> edges() {
    return ImmutableList.copyOf(edges);
  }

  /** Returns the node with a given id. */
  public Node node(int id) {
    checkId(id);
    return nodes.get(id);
  }

  /** Appends a node and returns its id. */
  public int insertNode(Obligation obligation) {
    final int id = nodes.size();
    nodes.add(new Node(id, obligation));
    successors.add(new ArrayList<>());
    return id;
  }

  /**
   * Appends an edge.
   *
   * @throws CoinductionException if either id does not refer to a node
   */
  public void insertEdge(int from, int to) {
    checkId(from);
    checkId(to);
    edges.add(new Edge(from, to));
    successors.get(from).add(to);
  }

  private void checkId(int id) {
    if (id < 0 || id >= nodes.size()) {
      throw CoinductionException.graphLookupFailure(id, nodes.size());
    }
  }

  /** Returns the id of the first node whose obligation equals the target. */
  public OptionalInt findNode(Obligation target) {
    for (Node node : nodes) {
      if (node.obligation.equals(target)) {
        return OptionalInt.of(node.id);
      }
    }
    return OptionalInt.empty();
  }

  /** Returns the successors of a node, in order of edge insertion. */
  public ImmutableList<Integer> successors(int id) {
    checkId(id);
    return ImmutableList.copyOf(successors.get(id));
  }

  /** Returns whether there is an edge from one node to another. */
  public boolean hasEdge(int from, int to) {
    checkId(from);
    return successors.get(from).contains(to);
  }

  /** Returns whether a node has an edge to itself. */
  public boolean hasSelfEdge(int id) {
    return hasEdge(id, id);
  }

  /**
   * Returns the ids of the nodes reachable from a node by following one or
   * more edges, in ascending order.
   *
   * <p>The node itself is included only if it is on a cycle.
   */
  public ImmutableSet<Integer> reachableFrom(int id) {
    checkId(id);
    final BitSet visited = new BitSet(nodes.size());
    final Deque<Integer> stack = new ArrayDeque<>(successors.get(id));
    while (!stack.isEmpty()) {
      final int n = stack.pop();
      if (!visited.get(n)) {
        visited.set(n);
        stack.addAll(successors.get(n));
      }
    }
    final ImmutableSet.Builder<Integer> b = ImmutableSet.builder();
    for (int n = visited.nextSetBit(0); n >= 0; n = visited.nextSetBit(n + 1)) {
      b.add(n);
    }
    return b.build();
  }

  /**
   * Computes the strongly-connected components of this graph, using
   * Tarjan's algorithm.
   *
   * <p>Start nodes are visited in order of id, and the successors of each
   * node in order of edge insertion, so the result is deterministic. Each
   * component is emitted when its root is finished, so a component precedes
   * any component that can reach it. Within a component, ids are ascending.
   */
  public ImmutableList<ImmutableSet<Integer>> computeSccs() {
    return new Tarjan().run();
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder("{nodes: [");
    for (Node node : nodes) {
      if (node.id > 0) {
        buf.append(", ");
      }
      buf.append(node);
    }
    buf.append("], edges: [");
    for (int i = 0; i < edges.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      buf.append(edges.get(i));
    }
    return buf.append("]}").toString();
  }

  /** Node in a constraint graph. */
  public static class Node {
    public final int id;
    public final Obligation obligation;

    Node(int id, Obligation obligation) {
      this.id = id;
      this.obligation = requireNonNull(obligation);
    }

    @Override
    public String toString() {
      return id + ": " + obligation;
    }
  }

  /** Edge in a constraint graph. */
  public static class Edge {
    public final int from;
    public final int to;

    Edge(int from, int to) {
      this.from = from;
      this.to = to;
    }

    @Override
    public int hashCode() {
      return from * 31 + to;
    }

    @Override
    public boolean equals(Object obj) {
      return this == obj
          || obj instanceof Edge
              && from == ((Edge) obj).from
              && to == ((Edge) obj).to;
    }

    @Override
    public String toString() {
      return from + " -> " + to;
    }
  }

  /**
   * State of one run of Tarjan's algorithm.
   *
   * <p>The depth-first search uses an explicit call stack, so that long
   * chains of obligations do not overflow the Java stack.
   */
  private class Tarjan {
    final int[] index = new int[nodes.size()];
    final int[] lowLink = new int[nodes.size()];
    final BitSet onStack = new BitSet(nodes.size());
    final Deque<Integer> stack = new ArrayDeque<>();
    final ImmutableList.Builder<ImmutableSet<Integer>> sccs =
        ImmutableList.builder();
    int nextIndex = 0;

    ImmutableList<ImmutableSet<Integer>> run() {
      Arrays.fill(index, -1);
      for (int n = 0; n < nodes.size(); n++) {
        if (index[n] < 0) {
          visit(n);
        }
      }
      return sccs.build();
    }

    private void visit(int start) {
      // Each frame is {node, position of next successor to explore}
      final Deque<int[]> callStack = new ArrayDeque<>();
      enter(start);
      callStack.push(new int[] {start, 0});
      while (!callStack.isEmpty()) {
        final int[] frame = callStack.peek();
        final int v = frame[0];
        final List<Integer> succ = successors.get(v);
        if (frame[1] < succ.size()) {
          final int w = succ.get(frame[1]++);
          if (index[w] < 0) {
            enter(w);
            callStack.push(new int[] {w, 0});
          } else if (onStack.get(w)) {
            lowLink[v] = Math.min(lowLink[v], index[w]);
          }
          continue;
        }
        callStack.pop();
        if (!callStack.isEmpty()) {
          final int parent = callStack.peek()[0];
          lowLink[parent] = Math.min(lowLink[parent], lowLink[v]);
        }
        if (lowLink[v] == index[v]) {
          final TreeSet<Integer> scc = new TreeSet<>();
          int w;
          do {
            w = stack.pop();
            onStack.clear(w);
            scc.add(w);
          } while (w != v);
          sccs.add(ImmutableSet.copyOf(scc));
        }
      }
    }

    private void enter(int v) {
      index[v] = nextIndex;
      lowLink[v] = nextIndex;
      ++nextIndex;
      stack.push(v);
      onStack.set(v);
    }
  }
}

// End ConstraintGraph.java
