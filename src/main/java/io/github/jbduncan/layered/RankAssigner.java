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
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import io.github.jbduncan.layered.graph.Digraph;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns every node of an acyclic working graph to a level, then groups the nodes into levels.
 *
 * <p>Whatever the algorithm, every edge of the working graph ends up pointing from a lower rank to
 * a strictly higher one.
 */
final class RankAssigner {

  private RankAssigner() {}

  static void assignRanks(LayoutContext context) {
    switch (context.options.rankingAlgorithm()) {
      case TIGHT_TREE:
      case NETWORK_SIMPLEX:
        // There is no network simplex implementation; tight-tree approximates it.
        assignRanksLongestPath(context);
        tightenRanks(context);
        break;
      case LONGEST_PATH:
        assignRanksLongestPath(context);
        break;
    }
    context.buildLevels();
  }

  /**
   * Returns the nodes ranked first: the configured root nodes that exist, or else all nodes without
   * parents, or else the node with the most children.
   */
  @VisibleForTesting
  static ImmutableList<String> findRoots(LayoutContext context) {
    ImmutableList<String> explicitRoots =
        context.options.rootNodes().stream()
            .filter(context.nodes::containsKey)
            .distinct()
            .collect(ImmutableList.toImmutableList());
    if (!explicitRoots.isEmpty()) {
      return explicitRoots;
    }

    ImmutableList<String> roots = context.graph.roots().asList();
    if (!roots.isEmpty() || context.graph.nodes().isEmpty()) {
      return roots;
    }

    String best = null;
    int maxOutDegree = -1;
    for (String node : context.graph.nodes()) {
      int outDegree = context.graph.outDegree(node);
      if (outDegree > maxOutDegree) {
        maxOutDegree = outDegree;
        best = node;
      }
    }
    return ImmutableList.of(best);
  }

  /**
   * Ranks each node one below its deepest parent by a breadth-first sweep from the roots. Nodes the
   * sweep does not reach start at rank 0 and are then pushed below their parents.
   */
  @VisibleForTesting
  static void assignRanksLongestPath(LayoutContext context) {
    Digraph<String> graph = context.graph;
    Map<String, Integer> ranks = new HashMap<>();
    Deque<String> queue = new ArrayDeque<>();
    Deque<Integer> queuedRanks = new ArrayDeque<>();

    for (String root : findRoots(context)) {
      ranks.put(root, 0);
      queue.add(root);
      queuedRanks.add(0);
    }

    while (!queue.isEmpty()) {
      String nodeId = queue.remove();
      int rank = queuedRanks.remove();
      if (rank < ranks.get(nodeId)) {
        continue; // superseded by a later entry with a higher rank
      }
      for (String child : graph.successors(nodeId)) {
        Integer current = ranks.get(child);
        if (current == null || rank + 1 > current) {
          ranks.put(child, rank + 1);
          queue.add(child);
          queuedRanks.add(rank + 1);
        }
      }
    }

    for (LayoutNode node : context.nodes.values()) {
      node.level = ranks.getOrDefault(node.id, 0);
    }

    // Only does anything when explicit roots leave some nodes unreached.
    for (String nodeId : graph.getTopologicalOrder()) {
      LayoutNode node = context.node(nodeId);
      for (String parent : graph.predecessors(nodeId)) {
        node.level = Math.max(node.level, context.node(parent).level + 1);
      }
    }
  }

  /**
   * Repeatedly moves nodes to the median rank suggested by their neighbors, as long as every parent
   * stays above and every child below. Stops after a pass that moves nothing, or after the
   * configured number of passes.
   */
  @VisibleForTesting
  static void tightenRanks(LayoutContext context) {
    int maxIterations = context.options.tightTreeIterations();
    boolean improved = true;
    for (int iteration = 0; improved && iteration < maxIterations; iteration++) {
      improved = false;
      for (LayoutNode node : context.nodes.values()) {
        int idealRank = idealRank(context, node);
        if (idealRank != node.level && canMoveToRank(context, node, idealRank)) {
          node.level = idealRank;
          improved = true;
        }
      }
    }
  }

  /**
   * Returns the upper median of the ranks a node's neighbors suggest for it: one below each parent
   * and one above each child.
   */
  private static int idealRank(LayoutContext context, LayoutNode node) {
    List<Integer> suggested = new ArrayList<>();
    for (String parent : context.graph.predecessors(node.id)) {
      suggested.add(context.node(parent).level + 1);
    }
    for (String child : context.graph.successors(node.id)) {
      suggested.add(context.node(child).level - 1);
    }
    if (suggested.isEmpty()) {
      return node.level;
    }
    int[] sorted = Ints.toArray(suggested);
    Arrays.sort(sorted);
    return sorted[sorted.length / 2];
  }

  private static boolean canMoveToRank(LayoutContext context, LayoutNode node, int rank) {
    for (String parent : context.graph.predecessors(node.id)) {
      if (context.node(parent).level >= rank) {
        return false;
      }
    }
    for (String child : context.graph.successors(node.id)) {
      if (context.node(child).level <= rank) {
        return false;
      }
    }
    return true;
  }
}
