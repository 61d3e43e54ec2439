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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

/**
 * The DFS class encapsulates a depth-first search visitation, which reports each node to {@link
 * GraphVisitor#visitNode} once all its successors have been visited (postorder), and remembers
 * which nodes have been seen already.
 *
 * <p>The search is iterative: the active path is kept on an explicit stack of frames, each holding
 * a node and an iterator over a snapshot of its successors. Graphs of any depth can therefore be
 * visited without exhausting the thread's call stack.
 *
 * <p>Every edge followed from a node on the active path to another node on the active path is
 * reported to {@link GraphVisitor#visitBackEdge}. Because successors are snapshotted when a node is
 * entered, a visitor may reverse such an edge in the enclosing Digraph while the traversal is in
 * progress; any other modification of the Digraph during a traversal is unsupported.
 */
final class DFS<T> {

  private final Digraph<T> digraph;

  private final Set<T> marked = new HashSet<>();

  /** Nodes on the active path, i.e. entered but not yet finished. */
  private final Set<T> onPath = new HashSet<>();

  /** Constructs a DFS instance for searching over the enclosing Digraph instance. */
  DFS(Digraph<T> digraph) {
    this.digraph = digraph;
  }

  void visit(T root, GraphVisitor<T> visitor) {
    if (!enter(root)) {
      return;
    }
    Deque<Frame<T>> stack = new ArrayDeque<>();
    stack.push(new Frame<>(root, successors(root)));

    while (!stack.isEmpty()) {
      Frame<T> frame = stack.peek();
      if (frame.successors.hasNext()) {
        T v = frame.successors.next();
        if (onPath.contains(v)) {
          visitor.visitBackEdge(frame.node, v);
        } else if (enter(v)) {
          stack.push(new Frame<>(v, successors(v)));
        }
      } else {
        stack.pop();
        onPath.remove(frame.node);
        visitor.visitNode(frame.node);
      }
    }
  }

  /** Marks {@code node}, returning false if it had been visited already. */
  private boolean enter(T node) {
    if (!marked.add(node)) {
      return false;
    }
    onPath.add(node);
    return true;
  }

  private Iterator<T> successors(T node) {
    return ImmutableList.copyOf(digraph.successors(node)).iterator();
  }

  private static final class Frame<T> {
    final T node;
    final Iterator<T> successors;

    Frame(T node, Iterator<T> successors) {
      this.node = node;
      this.successors = successors;
    }
  }
}
