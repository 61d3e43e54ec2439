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

import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reorders the nodes within each level to reduce the number of crossing edges, using the layer
 * sweep heuristic: each level in turn is sorted by the barycenter or median of its neighbors'
 * positions in the level swept from.
 *
 * <p>Crossings are counted by comparing every pair of edges between two adjacent levels, which is
 * quadratic in the number of such edges and does not scale to very dense levels.
 */
final class CrossingMinimizer {

  private CrossingMinimizer() {}

  /**
   * Sweeps up to {@link LayoutOptions#crossingIterations()} times, alternating downward and upward,
   * and leaves the levels in the best order seen.
   *
   * @return the number of crossings of the final order.
   */
  static int minimizeCrossings(LayoutContext context) {
    CrossingMinimization heuristic = context.options.crossingMinimization();
    int bestCrossings = countCrossings(context);
    if (heuristic == CrossingMinimization.NONE) {
      return bestCrossings;
    }

    Map<String, Integer> bestOrder = captureOrder(context);
    int iterations = context.options.crossingIterations();
    for (int i = 0; i < iterations && bestCrossings > 0; i++) {
      if (i % 2 == 0) {
        sweepDownward(context, heuristic);
      } else {
        sweepUpward(context, heuristic);
      }

      int crossings = countCrossings(context);
      if (crossings < bestCrossings) {
        bestCrossings = crossings;
        bestOrder = captureOrder(context);
      }
    }

    restoreOrder(context, bestOrder);
    return bestCrossings;
  }

  /** Returns the number of crossings between all pairs of adjacent levels. */
  @VisibleForTesting
  static int countCrossings(LayoutContext context) {
    int crossings = 0;
    Level upper = null;
    for (Level lower : context.levels.values()) {
      if (upper != null) {
        crossings += countCrossings(context, upper, lower);
      }
      upper = lower;
    }
    return crossings;
  }

  private static int countCrossings(LayoutContext context, Level upper, Level lower) {
    List<int[]> edges = new ArrayList<>();
    for (LayoutNode node : upper.nodes) {
      for (String childId : context.layeredGraph.successors(node.id)) {
        LayoutNode child = context.node(childId);
        if (child.level == lower.rank) {
          edges.add(new int[] {node.order, child.order});
        }
      }
    }

    int crossings = 0;
    for (int i = 0; i < edges.size(); i++) {
      int[] e = edges.get(i);
      for (int j = i + 1; j < edges.size(); j++) {
        int[] f = edges.get(j);
        if ((e[0] < f[0] && e[1] > f[1]) || (e[0] > f[0] && e[1] < f[1])) {
          crossings++;
        }
      }
    }
    return crossings;
  }

  private static void sweepDownward(LayoutContext context, CrossingMinimization heuristic) {
    Level previous = null;
    for (Level level : context.levelsTopDown()) {
      if (previous != null) {
        orderLevel(context, level, previous, /* useParents= */ true, heuristic);
      }
      previous = level;
    }
  }

  private static void sweepUpward(LayoutContext context, CrossingMinimization heuristic) {
    Level previous = null;
    for (Level level : context.levelsBottomUp()) {
      if (previous != null) {
        orderLevel(context, level, previous, /* useParents= */ false, heuristic);
      }
      previous = level;
    }
  }

  /**
   * Sorts {@code level} by the position its neighbors in {@code reference} suggest for each node.
   * Nodes without such neighbors keep their current order as their position. The sort is stable.
   */
  private static void orderLevel(
      LayoutContext context,
      Level level,
      Level reference,
      boolean useParents,
      CrossingMinimization heuristic) {
    Map<LayoutNode, Double> positions = new HashMap<>();
    for (LayoutNode node : level.nodes) {
      Set<String> neighbors =
          useParents
              ? context.layeredGraph.predecessors(node.id)
              : context.layeredGraph.successors(node.id);
      double[] neighborOrders =
          neighbors.stream()
              .map(context::node)
              .filter(neighbor -> neighbor.level == reference.rank)
              .mapToDouble(neighbor -> neighbor.order)
              .toArray();
      positions.put(node, position(node, neighborOrders, heuristic));
    }

    level.nodes.sort(Comparator.comparingDouble(positions::get));
    level.renumber();
  }

  @VisibleForTesting
  static double position(LayoutNode node, double[] neighborOrders, CrossingMinimization heuristic) {
    if (neighborOrders.length == 0) {
      return node.order;
    }
    if (heuristic == CrossingMinimization.MEDIAN) {
      double[] sorted = neighborOrders.clone();
      Arrays.sort(sorted);
      int mid = sorted.length / 2;
      return sorted.length % 2 == 0 ? (sorted[mid - 1] + sorted[mid]) / 2 : sorted[mid];
    }
    return Arrays.stream(neighborOrders).sum() / neighborOrders.length;
  }

  private static Map<String, Integer> captureOrder(LayoutContext context) {
    Map<String, Integer> order = new HashMap<>();
    for (LayoutNode node : context.nodes.values()) {
      order.put(node.id, node.order);
    }
    return order;
  }

  private static void restoreOrder(LayoutContext context, Map<String, Integer> order) {
    for (LayoutNode node : context.nodes.values()) {
      node.order = order.get(node.id);
    }
    for (Level level : context.levels.values()) {
      level.sortByOrder();
    }
  }
}
