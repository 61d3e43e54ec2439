// Copyright 2014 The Bazel Authors. All rights reserved.
// Copyright 2021 Jonathan Bluett-Duncan. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package io.github.jbduncan.layered.graph;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterators;
import com.google.common.collect.Sets;
import com.google.common.graph.AbstractGraph;
import com.google.common.graph.ElementOrder;
import com.google.common.graph.EndpointPair;
import com.google.common.graph.Graphs;
import com.google.common.graph.MutableGraph;
import java.util.AbstractSet;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code Digraph} a generic directed graph or "digraph", suitable for modeling asymmetric binary
 * relations.
 *
 * <p>An instance <code>G = &lt;V,E&gt;</code> consists of a set of nodes or vertices <code>V</code>
 * , and a set of directed edges <code>E</code>, which is a subset of <code>V &times; V</code>. Self
 * edges are not permitted and multiple edges between the same pair of nodes are not represented.
 *
 * <p>Nodes may be labeled with values of any type (type parameter T). All nodes within a graph have
 * distinct labels. The null pointer is not a valid label.
 *
 * <p>Some invariants:
 *
 * <ul>
 *   <li>Each graph instances "owns" the nodes is creates. The behaviour of operations on nodes a
 *       graph does not own is undefined.
 *   <li>{@code Digraph} assumes immutability of node labels, much like {@link java.util.HashMap}
 *       assumes it for keys.
 *   <li>Mutating the underlying graph invalidates any sets and iterators backed by it.
 *   <li>Nodes, successors and predecessors are iterated in insertion order, so every traversal of a
 *       graph built by the same sequence of operations visits nodes in the same order.
 *   <li>Instances are not thread safe.
 * </ul>
 */
public final class Digraph<T> extends AbstractGraph<T> implements MutableGraph<T> {

  /** Maps labels to nodes, which are in strict 1:1 correspondence. */
  private final Map<T, Node<T>> nodes = new LinkedHashMap<>();

  /** Construct an empty Digraph. */
  public Digraph() {}

  @Override
  public boolean putEdge(T nodeU, T nodeV) {
    return addEdge(checkNotNull(nodeU, "nodeU"), checkNotNull(nodeV, "nodeV"));
  }

  @Override
  public boolean putEdge(EndpointPair<T> endpoints) {
    checkNotNull(endpoints, "endpoints");
    return putEdge(endpoints.source(), endpoints.target());
  }

  /**
   * Adds a directed edge between the nodes labelled 'from' and 'to', creating them if necessary.
   *
   * @return true iff the edge was not already present.
   * @throws IllegalArgumentException if 'from' and 'to' are equal.
   */
  private boolean addEdge(T from, T to) {
    checkArgument(!from.equals(to), "Self-edges are not permitted: %s", from);
    Node<T> fromNode = createNode(from);
    Node<T> toNode = createNode(to);
    return fromNode.addEdge(toNode);
  }

  @Override
  public boolean removeEdge(T nodeU, T nodeV) {
    Node<T> nodeUMaybe = getNodeMaybe(checkNotNull(nodeU, "nodeU"));
    Node<T> nodeVMaybe = getNodeMaybe(checkNotNull(nodeV, "nodeV"));
    return nodeUMaybe != null && nodeVMaybe != null && nodeUMaybe.removeEdge(nodeVMaybe);
  }

  @Override
  public boolean removeEdge(EndpointPair<T> endpoints) {
    return removeEdge(endpoints.source(), endpoints.target());
  }

  /**
   * Replaces the edge 'from' -&gt; 'to' with the edge 'to' -&gt; 'from'.
   *
   * @return true iff the reversed edge was not already present, i.e. false if the two nodes were
   *     connected in both directions and have now merged into a single edge.
   * @throws IllegalArgumentException if there is no edge from 'from' to 'to'.
   */
  public boolean reverseEdge(T from, T to) {
    checkArgument(removeEdge(from, to), "No such edge: %s -> %s", from, to);
    return putEdge(to, from);
  }

  @Override
  public String toString() {
    return "Digraph[" + nodes().size() + " nodes]";
  }

  /** Returns an immutable view of the nodes of this graph, in insertion order. */
  @Override
  public Set<T> nodes() {
    return Collections.unmodifiableSet(nodes.keySet());
  }

  /**
   * @return the set of root nodes: those with no predecessors, in insertion order.
   *     <p>NOTE: in a cyclic graph, there may be nodes that are not reachable from any "root".
   */
  public ImmutableSet<T> roots() {
    ImmutableSet.Builder<T> roots = ImmutableSet.builder();
    for (Node<T> node : nodes.values()) {
      if (node.numPredecessors() == 0) {
        roots.add(node.getLabel());
      }
    }
    return roots.build();
  }

  /**
   * Finds and returns the node with the specified label. If there is no such node, an exception is
   * thrown. The null pointer is not a valid label.
   *
   * @return the node whose label is "label".
   * @throws IllegalArgumentException if no node was found with the specified label.
   */
  private Node<T> getNode(T label) {
    Node<T> node = nodes.get(checkNotNull(label));
    checkArgument(node != null, "No such node label: %s", label);
    return node;
  }

  /**
   * Find the node with the specified label. Returns null if it doesn't exist. The null pointer is
   * not a valid label.
   *
   * @return the node whose label is "label", or null if it was not found.
   */
  private Node<T> getNodeMaybe(T label) {
    return nodes.get(checkNotNull(label));
  }

  @Override
  public boolean addNode(T node) {
    checkNotNull(node, "node");
    boolean modified = !nodes.containsKey(node);
    createNode(node);
    return modified;
  }

  /**
   * Find or create a node with the specified label. This is the <i>only</i> factory of Nodes. The
   * null pointer is not a valid label.
   */
  private Node<T> createNode(T label) {
    return nodes.computeIfAbsent(label, Node::new);
  }

  @Override
  public boolean removeNode(T node) {
    Node<T> nodeMaybe = getNodeMaybe(checkNotNull(node, "node"));
    if (nodeMaybe == null) {
      return false;
    }
    nodeMaybe.removeAllPredecessors();
    nodeMaybe.removeAllSuccessors();
    nodes.remove(node);
    return true;
  }

  @Override
  public Set<T> adjacentNodes(T node) {
    return Sets.union(predecessors(node), successors(node));
  }

  @Override
  public Set<T> predecessors(T node) {
    checkNotNull(node, "node");
    checkArgument(nodes.containsKey(node), "'node' must be a node of the graph");

    return new AbstractSet<T>() {
      @Override
      public Iterator<T> iterator() {
        return Iterators.transform(getNode(node).getPredecessors().iterator(), Node::getLabel);
      }

      @Override
      public int size() {
        return getNode(node).numPredecessors();
      }
    };
  }

  @Override
  public Set<T> successors(T node) {
    checkNotNull(node, "node");
    checkArgument(nodes.containsKey(node), "'node' must be a node of the graph");

    return new AbstractSet<>() {
      @Override
      public Iterator<T> iterator() {
        return Iterators.transform(getNode(node).getSuccessors().iterator(), Node::getLabel);
      }

      @Override
      public int size() {
        return getNode(node).numSuccessors();
      }
    };
  }

  @Override
  public boolean isDirected() {
    return true;
  }

  @Override
  public boolean allowsSelfLoops() {
    return false;
  }

  @Override
  public ElementOrder<T> nodeOrder() {
    return ElementOrder.insertion();
  }

  // *** Graph Algorithms ***

  // These only manipulate the graph through methods defined above.

  /** Returns true iff the graph is cyclic. Time: O(n). */
  public boolean isCyclic() {
    return Graphs.hasCycle(this);
  }

  /**
   * Returns the edges that close a cycle when the graph is searched depth-first from every node in
   * insertion order: each is an edge to a node on the active search path. Reversing all of them
   * makes the graph acyclic.
   */
  public ImmutableList<EndpointPair<T>> getBackEdges() {
    ImmutableList.Builder<EndpointPair<T>> backEdges = ImmutableList.builder();
    visitDepthFirst(
        new AbstractGraphVisitor<T>() {
          @Override
          public void visitBackEdge(T lhs, T rhs) {
            backEdges.add(EndpointPair.ordered(lhs, rhs));
          }
        },
        nodes());
    return backEdges.build();
  }

  /**
   * Returns the nodes of an acyclic graph in topological order [a.k.a "reverse post-order" of
   * depth-first search.]
   *
   * <p>A topological order is one such that, if (u, v) is a path in acyclic graph G, then u is
   * before v in the topological order. In other words "tails before heads" or "roots before
   * leaves".
   *
   * @return The nodes of the graph, in a topological order
   */
  public List<T> getTopologicalOrder() {
    CollectingVisitor<T> collectingVisitor = new CollectingVisitor<>();
    visitDepthFirst(collectingVisitor, nodes());
    List<T> order = collectingVisitor.getVisitedNodes();
    Collections.reverse(order);
    return Collections.unmodifiableList(order);
  }

  // *** Traversals ***

  /**
   * A postorder visitation over all the nodes reachable from {@code startNodes} in depth-first
   * order.
   *
   * @param startNodes the set of nodes from which to begin the visitation.
   */
  private void visitDepthFirst(GraphVisitor<T> visitor, Iterable<T> startNodes) {
    DFS<T> visitation = new DFS<>(this);
    for (T node : startNodes) {
      visitation.visit(node, visitor);
    }
  }
}
