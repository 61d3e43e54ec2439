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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import io.github.jbduncan.layered.graph.Digraph;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * All the state of one layout computation. A context is created by {@link GraphIngestor} at the
 * start of every layout and handed from phase to phase; nothing in it outlives the call.
 */
final class LayoutContext {

  final LayoutOptions options;

  /** Real and dummy nodes, in input order followed by insertion order of dummies. */
  final Map<String, LayoutNode> nodes = new LinkedHashMap<>();

  /** Surviving input edges, in input order. */
  final Map<String, LayoutEdge> edges = new LinkedHashMap<>();

  /** Adjacency between real nodes. Acyclic once cycles have been broken. */
  final Digraph<String> graph = new Digraph<>();

  /**
   * Adjacency between real and dummy nodes in which every edge joins adjacent levels. Built when
   * dummy nodes are inserted.
   */
  final Digraph<String> layeredGraph = new Digraph<>();

  /** Levels keyed by rank. */
  final NavigableMap<Integer, Level> levels = new TreeMap<>();

  LayoutContext(LayoutOptions options) {
    this.options = options;
  }

  LayoutNode node(String id) {
    LayoutNode node = nodes.get(id);
    checkArgument(node != null, "No such node: %s", id);
    return node;
  }

  Level level(int rank) {
    return levels.computeIfAbsent(rank, Level::new);
  }

  /** Returns the levels in increasing rank order. */
  ImmutableList<Level> levelsTopDown() {
    return ImmutableList.copyOf(levels.values());
  }

  /** Returns the levels in decreasing rank order. */
  ImmutableList<Level> levelsBottomUp() {
    return ImmutableList.copyOf(levels.descendingMap().values());
  }

  /** Regroups all nodes into levels by their current rank, in node insertion order. */
  void buildLevels() {
    levels.clear();
    for (LayoutNode node : nodes.values()) {
      level(node.level).append(node);
    }
  }
}
