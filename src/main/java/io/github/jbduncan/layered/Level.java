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

import java.util.ArrayList;
import java.util.List;

/**
 * The nodes sharing one rank, kept in their current order, and the coordinate of the level along
 * the primary axis.
 */
final class Level {

  final int rank;
  final List<LayoutNode> nodes = new ArrayList<>();
  double coordinate;

  Level(int rank) {
    this.rank = rank;
  }

  /** Appends {@code node}, placing it last in the order of this level. */
  void append(LayoutNode node) {
    node.order = nodes.size();
    nodes.add(node);
  }

  /** Sorts {@link #nodes} by their current order values. */
  void sortByOrder() {
    nodes.sort((a, b) -> Integer.compare(a.order, b.order));
  }

  /** Sets each node's order to its index in {@link #nodes}. */
  void renumber() {
    for (int i = 0; i < nodes.size(); i++) {
      nodes.get(i).order = i;
    }
  }

  int size() {
    return nodes.size();
  }

  @Override
  public String toString() {
    return "level " + rank + nodes;
  }
}
