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

import static com.google.common.base.Preconditions.checkState;

/**
 * Splits every edge spanning more than one level into a chain of dummy nodes, one per intermediate
 * level, and builds the layered graph in which every edge joins adjacent levels.
 */
final class DummyNodeInserter {

  private DummyNodeInserter() {}

  /** Returns the number of dummy nodes inserted. */
  static int insertDummyNodes(LayoutContext context) {
    for (String nodeId : context.nodes.keySet()) {
      context.layeredGraph.addNode(nodeId);
    }

    int dummyCount = 0;
    for (LayoutEdge edge : context.edges.values()) {
      LayoutNode source = context.node(edge.source);
      LayoutNode target = context.node(edge.target);
      int span = target.level - source.level;
      checkState(span > 0, "Edge %s does not point to a lower level", edge);

      String previous = source.id;
      for (int i = 1; i < span; i++) {
        LayoutNode dummy = LayoutNode.dummy(dummyId(context, edge, i), edge.id(), source.level + i);
        context.nodes.put(dummy.id, dummy);
        context.level(dummy.level).append(dummy);
        context.layeredGraph.putEdge(previous, dummy.id);
        edge.dummyNodes.add(dummy.id);
        previous = dummy.id;
        dummyCount++;
      }
      context.layeredGraph.putEdge(previous, target.id);
    }
    return dummyCount;
  }

  private static String dummyId(LayoutContext context, LayoutEdge edge, int index) {
    String id = "dummy_" + edge.id() + "_" + index;
    while (context.nodes.containsKey(id)) {
      id += "'";
    }
    return id;
  }
}
