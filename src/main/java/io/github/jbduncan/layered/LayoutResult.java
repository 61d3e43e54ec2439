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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/** The output of a layout. */
public final class LayoutResult {

  private static final LayoutResult EMPTY =
      new LayoutResult(ImmutableMap.of(), ImmutableList.of(), Bounds.empty(), LayoutStats.empty());

  private final ImmutableMap<String, Point> positions;
  private final ImmutableList<RoutedEdge> edges;
  private final Bounds bounds;
  private final LayoutStats stats;

  LayoutResult(
      ImmutableMap<String, Point> positions,
      ImmutableList<RoutedEdge> edges,
      Bounds bounds,
      LayoutStats stats) {
    this.positions = positions;
    this.edges = edges;
    this.bounds = bounds;
    this.stats = stats;
  }

  static LayoutResult empty() {
    return EMPTY;
  }

  /** Returns the position of every input node, keyed by node id, in input order. */
  public ImmutableMap<String, Point> positions() {
    return positions;
  }

  /** Returns every input edge that connects two distinct known nodes, with its route. */
  public ImmutableList<RoutedEdge> edges() {
    return edges;
  }

  /** Returns the bounds of all node positions, including those of routing nodes. */
  public Bounds bounds() {
    return bounds;
  }

  public LayoutStats stats() {
    return stats;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("nodes", positions.size())
        .add("edges", edges.size())
        .add("bounds", bounds)
        .add("stats", stats)
        .toString();
  }
}
