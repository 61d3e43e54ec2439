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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A node in a {@link Digraph}: a label plus its successor and predecessor adjacency sets.
 *
 * <p>Both adjacency sets iterate in the order in which edges were added, which is what makes
 * traversals of a {@link Digraph} deterministic.
 */
final class Node<T> {

  private final T label;

  private final Set<Node<T>> successors = new LinkedHashSet<>();

  private final Set<Node<T>> predecessors = new LinkedHashSet<>();

  Node(T label) {
    this.label = checkNotNull(label, "label");
  }

  T getLabel() {
    return label;
  }

  /** Returns an unmodifiable view of the successors of this node. */
  Collection<Node<T>> getSuccessors() {
    return Collections.unmodifiableSet(successors);
  }

  /** Returns an unmodifiable view of the predecessors of this node. */
  Collection<Node<T>> getPredecessors() {
    return Collections.unmodifiableSet(predecessors);
  }

  int numSuccessors() {
    return successors.size();
  }

  int numPredecessors() {
    return predecessors.size();
  }

  /**
   * Adds an edge from this node to {@code to}, updating both adjacency sets.
   *
   * @return true iff the edge was not already present.
   */
  boolean addEdge(Node<T> to) {
    boolean added = successors.add(to);
    if (added) {
      to.predecessors.add(this);
    }
    return added;
  }

  /**
   * Removes the edge from this node to {@code to}, if present.
   *
   * @return true iff the edge was present.
   */
  boolean removeEdge(Node<T> to) {
    boolean removed = successors.remove(to);
    if (removed) {
      to.predecessors.remove(this);
    }
    return removed;
  }

  /** Removes all edges leading into this node and returns the former predecessors. */
  Collection<Node<T>> removeAllPredecessors() {
    ImmutableList<Node<T>> former = ImmutableList.copyOf(predecessors);
    for (Node<T> predecessor : former) {
      predecessor.removeEdge(this);
    }
    return former;
  }

  /** Removes all edges leading out of this node and returns the former successors. */
  Collection<Node<T>> removeAllSuccessors() {
    ImmutableList<Node<T>> former = ImmutableList.copyOf(successors);
    for (Node<T> successor : former) {
      removeEdge(successor);
    }
    return former;
  }

  @Override
  public String toString() {
    return "node:" + label;
  }
}
