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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/** Publishes the outcome of a layout computation. */
final class ResultBuilder {

  private ResultBuilder() {}

  /**
   * Returns the positions of the real nodes, the routed edges, the bounds of all nodes including
   * dummies, and the statistics of the layout.
   */
  static LayoutResult buildResult(
      LayoutContext context, int reversedEdges, int dummyNodes, int crossings) {
    ImmutableMap.Builder<String, Point> positions = ImmutableMap.builder();
    double minX = Double.POSITIVE_INFINITY;
    double minY = Double.POSITIVE_INFINITY;
    double maxX = Double.NEGATIVE_INFINITY;
    double maxY = Double.NEGATIVE_INFINITY;

    for (LayoutNode node : context.nodes.values()) {
      if (!node.dummy) {
        positions.put(node.id, node.position());
      }
      minX = Math.min(minX, node.x);
      minY = Math.min(minY, node.y);
      maxX = Math.max(maxX, node.x);
      maxY = Math.max(maxY, node.y);
    }

    ImmutableList.Builder<RoutedEdge> edges = ImmutableList.builder();
    double totalEdgeLength = 0;
    for (LayoutEdge layoutEdge : context.edges.values()) {
      RoutedEdge edge = layoutEdge.toRoutedEdge();
      edges.add(edge);
      totalEdgeLength += edge.length();
    }

    return new LayoutResult(
        positions.buildOrThrow(),
        edges.build(),
        Bounds.of(minX, minY, maxX, maxY),
        new LayoutStats(crossings, dummyNodes, reversedEdges, totalEdgeLength));
  }
}
