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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a fresh {@link LayoutContext} from the input graph.
 *
 * <p>Edges whose endpoints are unknown, or that start and end at the same node, are dropped. So is
 * any node or edge whose id was already taken by an earlier one.
 */
final class GraphIngestor {

  private static final Logger logger = LoggerFactory.getLogger(GraphIngestor.class);

  private GraphIngestor() {}

  static LayoutContext ingest(GraphData data, LayoutOptions options) {
    LayoutContext context = new LayoutContext(options);

    for (GraphNode node : data.nodes()) {
      if (context.nodes.putIfAbsent(node.id(), LayoutNode.real(node.id())) != null) {
        logger.debug("Ignoring duplicate node id {}", node.id());
        continue;
      }
      context.graph.addNode(node.id());
    }

    for (GraphEdge edge : data.edges()) {
      String sourceId = edge.source().nodeId();
      String targetId = edge.target().nodeId();

      if (!context.nodes.containsKey(sourceId) || !context.nodes.containsKey(targetId)) {
        logger.debug("Dropping edge {}: unknown endpoint", edge.id());
        continue;
      }
      if (sourceId.equals(targetId)) {
        logger.debug("Dropping self-loop {}", edge.id());
        continue;
      }
      if (context.edges.containsKey(edge.id())) {
        logger.debug("Dropping edge {}: duplicate id", edge.id());
        continue;
      }

      context.edges.put(edge.id(), new LayoutEdge(edge, sourceId, targetId));
      context.graph.putEdge(sourceId, targetId);
    }
    return context;
  }
}
