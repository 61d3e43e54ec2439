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

package io.github.jbduncan.layered;

import com.google.common.graph.EndpointPair;

/**
 * Makes the working graph acyclic by reversing the edges that a depth-first search finds closing a
 * cycle.
 */
final class CycleBreaker {

  private CycleBreaker() {}

  /**
   * Reverses every back edge in the working graph and in the edge records it stands for.
   *
   * @return the number of edge records reversed.
   */
  static int breakCycles(LayoutContext context) {
    int reversed = 0;
    for (EndpointPair<String> backEdge : context.graph.getBackEdges()) {
      context.graph.reverseEdge(backEdge.source(), backEdge.target());
      // Parallel edges share one adjacency entry, so all of them turn around together.
      for (LayoutEdge edge : context.edges.values()) {
        if (edge.source.equals(backEdge.source()) && edge.target.equals(backEdge.target())) {
          edge.reverse();
          reversed++;
        }
      }
    }
    return reversed;
  }
}
