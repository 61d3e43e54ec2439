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

/**
 * A graph visitor interface. Nodes are reported to {@link #visitNode} in depth-first postorder;
 * edges that close a cycle are reported to {@link #visitBackEdge} as they are found.
 */
interface GraphVisitor<T> {

  /** Called once all successors of {@code node} have been visited. */
  void visitNode(T node);

  /**
   * Called when a depth-first visitation follows an edge from {@code lhs} to {@code rhs} while
   * {@code rhs} is still on the active path, i.e. the edge closes a cycle.
   */
  void visitBackEdge(T lhs, T rhs);
}
