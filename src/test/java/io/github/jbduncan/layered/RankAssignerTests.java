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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.graph.EndpointPair;
import org.junit.jupiter.api.Test;

/** Test for {@link RankAssigner}. */
class RankAssignerTests {

  private static LayoutContext rank(GraphData graph, LayoutOptions options) {
    LayoutContext context = GraphIngestor.ingest(graph, options);
    CycleBreaker.breakCycles(context);
    RankAssigner.assignRanks(context);
    return context;
  }

  private static int level(LayoutContext context, String id) {
    return context.node(id).level;
  }

  private static void assertEdgesPointDownward(LayoutContext context) {
    for (EndpointPair<String> edge : context.graph.edges()) {
      assertThat(level(context, edge.source())).isLessThan(level(context, edge.target()));
    }
  }

  @Test
  void testLongestPath() {
    GraphData graph =
        GraphData.builder()
            .addNodes("a", "b", "c", "d")
            .addEdge("a", "b")
            .addEdge("b", "c")
            .addEdge("a", "c")
            .build();

    LayoutContext context = rank(graph, LayoutOptions.defaults());

    assertThat(level(context, "a")).isEqualTo(0);
    assertThat(level(context, "b")).isEqualTo(1);
    assertThat(level(context, "c")).isEqualTo(2);
    assertThat(level(context, "d")).isEqualTo(0);
    assertThat(context.levels.keySet()).containsExactly(0, 1, 2).inOrder();
    assertThat(context.levels.get(0).nodes).hasSize(2);
    assertThat(context.levels.get(0).nodes.get(1).order).isEqualTo(1);
  }

  @Test
  void testExplicitRootsKeepEdgesPointingDownward() {
    GraphData graph =
        GraphData.builder().addNodes("a", "b", "c").addEdge("a", "b").addEdge("b", "c").build();
    LayoutOptions options = LayoutOptions.builder().rootNodes("b").build();

    LayoutContext context = rank(graph, options);

    assertThat(RankAssigner.findRoots(context)).containsExactly("b");
    assertThat(level(context, "a")).isEqualTo(0);
    assertThat(level(context, "b")).isEqualTo(1);
    assertThat(level(context, "c")).isEqualTo(2);
    assertEdgesPointDownward(context);
  }

  @Test
  void testUnknownRootsAreIgnored() {
    GraphData graph = GraphData.builder().addNodes("a", "b").addEdge("a", "b").build();
    LayoutOptions options = LayoutOptions.builder().rootNodes("missing").build();

    LayoutContext context = GraphIngestor.ingest(graph, options);

    assertThat(RankAssigner.findRoots(context)).containsExactly("a");
  }

  @Test
  void testNodeWithMostChildrenIsRootWhenEveryNodeHasParents() {
    GraphData graph =
        GraphData.builder()
            .addNodes("a", "b", "c")
            .addEdge("a", "b")
            .addEdge("b", "a")
            .addEdge("b", "c")
            .addEdge("c", "a")
            .build();

    LayoutContext context = GraphIngestor.ingest(graph, LayoutOptions.defaults());

    assertThat(RankAssigner.findRoots(context)).containsExactly("b");
  }

  @Test
  void testTightTreePullsNodesTowardsTheirChildren() {
    GraphData graph =
        GraphData.builder()
            .addNodes("a", "b", "c", "d", "e")
            .addEdge("a", "b")
            .addEdge("b", "c")
            .addEdge("c", "d")
            .addEdge("e", "d")
            .build();

    for (RankingAlgorithm algorithm :
        new RankingAlgorithm[] {RankingAlgorithm.TIGHT_TREE, RankingAlgorithm.NETWORK_SIMPLEX}) {
      LayoutContext context =
          rank(graph, LayoutOptions.builder().rankingAlgorithm(algorithm).build());

      assertThat(level(context, "e")).isEqualTo(2);
      assertThat(level(context, "d")).isEqualTo(3);
      assertEdgesPointDownward(context);
    }

    LayoutContext longestPath = rank(graph, LayoutOptions.defaults());
    assertThat(level(longestPath, "e")).isEqualTo(0);
  }

  @Test
  void testTightTreeIterationsCapTheMoves() {
    GraphData graph =
        GraphData.builder()
            .addNodes("a", "b", "c", "e")
            .addEdge("a", "b")
            .addEdge("b", "c")
            .addEdge("e", "c")
            .build();
    LayoutOptions options =
        LayoutOptions.builder()
            .rankingAlgorithm(RankingAlgorithm.TIGHT_TREE)
            .tightTreeIterations(0)
            .build();

    LayoutContext context = rank(graph, options);

    assertThat(level(context, "e")).isEqualTo(0);
  }

  @Test
  void testCyclicGraphIsRankedAfterCyclesAreBroken() {
    GraphData graph =
        GraphData.builder()
            .addNodes("a", "b", "c", "d")
            .addEdge("a", "b")
            .addEdge("b", "c")
            .addEdge("c", "a")
            .addEdge("c", "d")
            .addEdge("d", "b")
            .build();

    for (RankingAlgorithm algorithm : RankingAlgorithm.values()) {
      LayoutContext context =
          rank(graph, LayoutOptions.builder().rankingAlgorithm(algorithm).build());

      for (LayoutNode node : context.nodes.values()) {
        assertThat(node.level).isAtLeast(0);
      }
      assertEdgesPointDownward(context);
    }
  }
}
