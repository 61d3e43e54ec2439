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

import static com.google.common.base.Preconditions.checkNotNull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A layered ("Sugiyama-style") layout of directed graphs.
 *
 * <p>A layout runs these phases over a fresh {@link LayoutContext}:
 *
 * <ol>
 *   <li>ingestion, which drops self-loops and edges with unknown endpoints;
 *   <li>cycle breaking, by reversing the back edges of a depth-first search;
 *   <li>rank assignment;
 *   <li>dummy node insertion, so that every edge joins adjacent levels;
 *   <li>crossing minimization;
 *   <li>coordinate assignment;
 *   <li>edge routing through the dummy nodes.
 * </ol>
 *
 * <p>The layout accepts any graph: cyclic, disconnected, or with dangling edges. It is
 * deterministic, and since no state is kept between calls an instance may be shared between
 * threads.
 *
 * <pre>{@code
 * HierarchicalLayout layout =
 *     new HierarchicalLayout(LayoutOptions.builder().direction(LayoutDirection.LR).build());
 * LayoutResult result = layout.layout(graph);
 * Point a = result.positions().get("a");
 * }</pre>
 */
public final class HierarchicalLayout {

  private static final Logger logger = LoggerFactory.getLogger(HierarchicalLayout.class);

  private final LayoutOptions options;

  /** Creates a layout with the {@linkplain LayoutOptions#defaults() default options}. */
  public HierarchicalLayout() {
    this(LayoutOptions.defaults());
  }

  public HierarchicalLayout(LayoutOptions options) {
    this.options = checkNotNull(options, "options");
  }

  /** Creates a layout with the options of {@code preset}. */
  public static HierarchicalLayout withPreset(LayoutPreset preset) {
    return new HierarchicalLayout(checkNotNull(preset, "preset").options());
  }

  public LayoutOptions options() {
    return options;
  }

  /** Returns a layout like this one but with the given options. */
  public HierarchicalLayout withOptions(LayoutOptions options) {
    return new HierarchicalLayout(options);
  }

  /** Computes the layout of {@code graph}. */
  public LayoutResult layout(GraphData graph) {
    checkNotNull(graph, "graph");
    if (graph.nodes().isEmpty()) {
      return LayoutResult.empty();
    }

    LayoutContext context = GraphIngestor.ingest(graph, options);
    int reversedEdges = CycleBreaker.breakCycles(context);
    RankAssigner.assignRanks(context);
    int dummyNodes = DummyNodeInserter.insertDummyNodes(context);
    int crossings = CrossingMinimizer.minimizeCrossings(context);
    CoordinateAssigner.assignCoordinates(context);
    EdgeRouter.routeEdges(context);
    LayoutResult result = ResultBuilder.buildResult(context, reversedEdges, dummyNodes, crossings);

    logger.debug(
        "Laid out {} nodes and {} edges in {} levels: {} reversed, {} dummy nodes, {} crossings",
        result.positions().size(),
        result.edges().size(),
        context.levels.size(),
        reversedEdges,
        dummyNodes,
        crossings);
    return result;
  }
}
