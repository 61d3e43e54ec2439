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

import com.google.common.base.MoreObjects;

/** Summary figures of a computed layout. */
public final class LayoutStats {

  private static final LayoutStats EMPTY = new LayoutStats(0, 0, 0, 0);

  private final int crossings;
  private final int dummyNodes;
  private final int reversedEdges;
  private final double totalEdgeLength;

  LayoutStats(int crossings, int dummyNodes, int reversedEdges, double totalEdgeLength) {
    this.crossings = crossings;
    this.dummyNodes = dummyNodes;
    this.reversedEdges = reversedEdges;
    this.totalEdgeLength = totalEdgeLength;
  }

  static LayoutStats empty() {
    return EMPTY;
  }

  /** Returns the number of pairs of edges that cross between adjacent levels. */
  public int crossings() {
    return crossings;
  }

  /** Returns the number of routing nodes inserted for edges spanning several levels. */
  public int dummyNodes() {
    return dummyNodes;
  }

  /** Returns the number of edges reversed to make the graph acyclic. */
  public int reversedEdges() {
    return reversedEdges;
  }

  /** Returns the summed length of all edge polylines. */
  public double totalEdgeLength() {
    return totalEdgeLength;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("crossings", crossings)
        .add("dummyNodes", dummyNodes)
        .add("reversedEdges", reversedEdges)
        .add("totalEdgeLength", totalEdgeLength)
        .toString();
  }
}
