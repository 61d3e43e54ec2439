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
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Test for {@link HierarchicalLayout}. */
class HierarchicalLayoutTests {

  private static final double MARGIN = 50;

  private static GraphData tree() {
    //     a
    //   /   \
    //  b     c
    // / \     \
    // d e     f
    return GraphData.builder()
        .addNodes("a", "b", "c", "d", "e", "f")
        .addEdge("a", "b")
        .addEdge("a", "c")
        .addEdge("b", "d")
        .addEdge("b", "e")
        .addEdge("c", "f")
        .build();
  }

  private static GraphData diamond() {
    return GraphData.builder()
        .addNodes("a", "b", "c", "d")
        .addEdge("a", "b")
        .addEdge("a", "c")
        .addEdge("b", "d")
        .addEdge("c", "d")
        .build();
  }

  private static GraphData triangle() {
    return GraphData.builder()
        .addNodes("a", "b", "c")
        .addEdge("a", "b")
        .addEdge("b", "c")
        .addEdge("c", "a")
        .build();
  }

  private static RoutedEdge edge(LayoutResult result, String id) {
    return result.edges().stream()
        .filter(edge -> edge.id().equals(id))
        .findFirst()
        .orElseThrow(() -> new AssertionError("No edge " + id));
  }

  @Test
  void testEveryNodeGetsAFinitePosition() {
    GraphData graph =
        GraphData.builder()
            .addNodes("a", "b", "c", "d", "e", "f", "g")
            .addEdge("a", "b")
            .addEdge("b", "c")
            .addEdge("c", "a")
            .addEdge("a", "d")
            .addEdge("d", "e")
            .addEdge("a", "e")
            .addEdge("f", "e")
            .build();

    LayoutResult result = new HierarchicalLayout().layout(graph);

    assertThat(result.positions().keySet())
        .containsExactly("a", "b", "c", "d", "e", "f", "g")
        .inOrder();
    for (Point point : result.positions().values()) {
      assertThat(Double.isFinite(point.x())).isTrue();
      assertThat(Double.isFinite(point.y())).isTrue();
    }
  }

  @Test
  void testTreeIsLaidOutLevelByLevelWithoutCrossings() {
    LayoutResult result = new HierarchicalLayout().layout(tree());
    Map<String, Point> positions = result.positions();

    assertThat(result.stats().reversedEdges()).isEqualTo(0);
    assertThat(result.stats().crossings()).isEqualTo(0);
    assertThat(result.stats().dummyNodes()).isEqualTo(0);
    for (RoutedEdge edge : result.edges()) {
      assertThat(edge.reversed()).isFalse();
      double gap = positions.get(edge.target()).y() - positions.get(edge.source()).y();
      assertThat(gap).isEqualTo(100.0);
    }
  }

  @Test
  void testDiamond() {
    LayoutResult result = new HierarchicalLayout().layout(diamond());
    Map<String, Point> positions = result.positions();

    assertThat(positions.get("a").y()).isEqualTo(MARGIN);
    assertThat(positions.get("b").y()).isEqualTo(MARGIN + 100);
    assertThat(positions.get("c").y()).isEqualTo(MARGIN + 100);
    assertThat(positions.get("d").y()).isEqualTo(MARGIN + 200);
    assertThat(positions.get("b").x()).isNotEqualTo(positions.get("c").x());
    assertThat(result.stats().crossings()).isEqualTo(0);
  }

  @Test
  void testCycleIsBrokenByReversingAnEdge() {
    LayoutResult result = new HierarchicalLayout().layout(triangle());

    assertThat(result.stats().reversedEdges()).isAtLeast(1);
    RoutedEdge closing = edge(result, "c->a");
    assertThat(closing.reversed()).isTrue();
    assertThat(closing.source()).isEqualTo("a");
    assertThat(closing.target()).isEqualTo("c");

    Map<String, Point> positions = result.positions();
    for (RoutedEdge edge : result.edges()) {
      assertThat(positions.get(edge.source()).y()).isLessThan(positions.get(edge.target()).y());
    }
  }

  @Test
  void testLayoutIsDeterministic() {
    LayoutOptions options =
        LayoutOptions.builder().crossingMinimization(CrossingMinimization.NONE).build();

    LayoutResult first = new HierarchicalLayout(options).layout(triangle());
    LayoutResult second = new HierarchicalLayout(options).layout(triangle());

    assertThat(second.positions()).isEqualTo(first.positions());
    assertThat(second.bounds()).isEqualTo(first.bounds());

    HierarchicalLayout layout = new HierarchicalLayout();
    assertThat(layout.layout(tree()).positions()).isEqualTo(layout.layout(tree()).positions());
  }

  @Test
  void testSimpleCoordinatesSeparateLevelsExactly() {
    LayoutOptions options =
        LayoutOptions.builder()
            .coordinateAssignment(CoordinateAssignment.SIMPLE)
            .levelSeparation(70)
            .nodeSeparation(30)
            .build();

    Map<String, Point> positions = new HierarchicalLayout(options).layout(tree()).positions();

    assertThat(positions.get("b").y() - positions.get("a").y()).isEqualTo(70.0);
    assertThat(positions.get("d").y() - positions.get("b").y()).isEqualTo(70.0);
    assertThat(positions.get("c").x() - positions.get("b").x()).isEqualTo(30.0);
  }

  @Test
  void testDrawingStartsAtTheMargin() {
    for (LayoutDirection direction : LayoutDirection.values()) {
      LayoutOptions options = LayoutOptions.builder().direction(direction).margin(20).build();

      LayoutResult result = new HierarchicalLayout(options).layout(triangle());

      assertThat(result.bounds().minX()).isEqualTo(20.0);
      assertThat(result.bounds().minY()).isEqualTo(20.0);
      for (Point point : result.positions().values()) {
        assertThat(point.x()).isAtLeast(20.0);
        assertThat(point.y()).isAtLeast(20.0);
      }
    }
  }

  @Test
  void testGridAlignment() {
    LayoutOptions options =
        LayoutOptions.builder()
            .alignToGrid(true)
            .gridSize(10)
            .margin(25)
            .nodeSeparation(33)
            .build();

    LayoutResult result = new HierarchicalLayout(options).layout(tree());

    for (Point point : result.positions().values()) {
      assertThat(point.x() / 10).isEqualTo(Math.rint(point.x() / 10));
      assertThat(point.y() / 10).isEqualTo(Math.rint(point.y() / 10));
      assertThat(point.x()).isAtLeast(25.0);
      assertThat(point.y()).isAtLeast(25.0);
    }
  }

  @Test
  void testEmptyGraph() {
    LayoutResult result = new HierarchicalLayout().layout(GraphData.empty());

    assertThat(result.positions()).isEmpty();
    assertThat(result.edges()).isEmpty();
    assertThat(result.bounds()).isEqualTo(Bounds.empty());
    assertThat(result.bounds().width()).isEqualTo(0.0);
    assertThat(result.stats().crossings()).isEqualTo(0);
    assertThat(result.stats().dummyNodes()).isEqualTo(0);
    assertThat(result.stats().reversedEdges()).isEqualTo(0);
    assertThat(result.stats().totalEdgeLength()).isEqualTo(0.0);
  }

  @Test
  void testSingleNode() {
    LayoutResult result =
        new HierarchicalLayout().layout(GraphData.builder().addNodes("a").build());

    assertThat(result.positions()).containsExactly("a", Point.of(MARGIN, MARGIN));
    assertThat(result.bounds()).isEqualTo(Bounds.of(MARGIN, MARGIN, MARGIN, MARGIN));
  }

  @Test
  void testDanglingEdgesAndSelfLoopsAreDropped() {
    GraphData graph =
        GraphData.builder()
            .addNodes("a", "b")
            .addEdge("a", "b")
            .addEdge("a", "missing")
            .addEdge("missing", "b")
            .addEdge("b", "b")
            .build();

    LayoutResult result = new HierarchicalLayout().layout(graph);

    assertThat(result.positions().keySet()).containsExactly("a", "b").inOrder();
    assertThat(result.edges()).hasSize(1);
    assertThat(result.edges().get(0).id()).isEqualTo("a->b");
  }

  @Test
  void testLongEdgesAreRoutedThroughDummyNodes() {
    GraphData graph =
        GraphData.builder()
            .addNodes("a", "b", "c", "d")
            .addEdge("a", "b")
            .addEdge("b", "c")
            .addEdge("c", "d")
            .addEdge("a", "d")
            .build();

    LayoutResult result = new HierarchicalLayout().layout(graph);
    RoutedEdge longEdge = edge(result, "a->d");

    assertThat(result.stats().dummyNodes()).isEqualTo(2);
    assertThat(longEdge.dummyNodes()).containsExactly("dummy_a->d_1", "dummy_a->d_2").inOrder();
    assertThat(longEdge.controlPoints()).hasSize(4);
    assertThat(longEdge.controlPoints().get(0)).isEqualTo(result.positions().get("a"));
    assertThat(longEdge.controlPoints().get(3)).isEqualTo(result.positions().get("d"));
    assertThat(result.positions()).doesNotContainKey("dummy_a->d_1");

    double totalLength = 0;
    for (RoutedEdge edge : result.edges()) {
      assertThat(edge.controlPoints().get(0)).isEqualTo(result.positions().get(edge.source()));
      totalLength += edge.length();
    }
    assertThat(result.stats().totalEdgeLength()).isEqualTo(totalLength);
  }

  @Test
  void testBoundsIncludeDummyNodes() {
    // The dummy of a->c sits right of b, beyond every real node.
    GraphData graph =
        GraphData.builder()
            .addNodes("a", "b", "c")
            .addEdge("a", "b")
            .addEdge("b", "c")
            .addEdge("a", "c")
            .build();
    LayoutOptions options =
        LayoutOptions.builder().coordinateAssignment(CoordinateAssignment.SIMPLE).build();

    LayoutResult result = new HierarchicalLayout(options).layout(graph);
    Point dummy = edge(result, "a->c").controlPoints().get(1);
    Bounds bounds = result.bounds();

    assertThat(dummy).isEqualTo(Point.of(MARGIN + 50, MARGIN + 100));
    for (Point point : result.positions().values()) {
      assertThat(point.x()).isLessThan(dummy.x());
    }
    assertThat(bounds.maxX()).isEqualTo(dummy.x());
    assertThat(bounds.minX()).isEqualTo(result.positions().get("b").x());
    assertThat(bounds.width()).isEqualTo(bounds.maxX() - bounds.minX());
    assertThat(bounds.width()).isEqualTo(50.0);
    assertThat(bounds.height()).isEqualTo(200.0);
  }

  @Test
  void testDirections() {
    GraphData graph = GraphData.builder().addNodes("a", "b").addEdge("a", "b").build();

    Map<String, Point> lr = layout(graph, LayoutDirection.LR);
    assertThat(lr.get("b").x() - lr.get("a").x()).isEqualTo(100.0);
    assertThat(lr.get("b").y()).isEqualTo(lr.get("a").y());

    Map<String, Point> rl = layout(graph, LayoutDirection.RL);
    assertThat(rl.get("a").x() - rl.get("b").x()).isEqualTo(100.0);

    Map<String, Point> tb = layout(graph, LayoutDirection.TB);
    assertThat(tb.get("b").y() - tb.get("a").y()).isEqualTo(100.0);
    assertThat(tb.get("b").x()).isEqualTo(tb.get("a").x());

    Map<String, Point> bt = layout(graph, LayoutDirection.BT);
    assertThat(bt.get("a").y() - bt.get("b").y()).isEqualTo(100.0);
  }

  private static Map<String, Point> layout(GraphData graph, LayoutDirection direction) {
    LayoutOptions options = LayoutOptions.builder().direction(direction).build();
    return new HierarchicalLayout(options).layout(graph).positions();
  }

  @Test
  void testEndpointsMayReferToNodes() {
    GraphNode a = GraphNode.of("a", ImmutableMap.of("label", "Start"));
    GraphNode b = GraphNode.of("b");
    GraphData graph =
        GraphData.builder()
            .addNode(a)
            .addNode(b)
            .addEdge(
                GraphEdge.of(
                    "e1",
                    EdgeEndpoint.of(a),
                    EdgeEndpoint.of("b"),
                    ImmutableMap.of("color", "red")))
            .addEdge(GraphEdge.of("e2", b, a))
            .build();

    LayoutResult result = new HierarchicalLayout().layout(graph);

    assertThat(edge(result, "e1").attributes()).containsExactly("color", "red");
    assertThat(edge(result, "e1").source()).isEqualTo("a");
    assertThat(edge(result, "e2").reversed()).isTrue();
    assertThat(result.stats().reversedEdges()).isEqualTo(1);
  }

  @Test
  void testDuplicateNodeIdsAreLaidOutOnce() {
    GraphData graph =
        GraphData.builder()
            .addNodes("a", "b", "a")
            .addEdge("a", "b")
            .addEdge(GraphEdge.of("a->b", "b", "a"))
            .build();

    LayoutResult result = new HierarchicalLayout().layout(graph);

    assertThat(result.positions().keySet()).containsExactly("a", "b").inOrder();
    assertThat(result.edges()).hasSize(1);
    assertThat(result.stats().reversedEdges()).isEqualTo(0);
  }

  @Test
  void testDisconnectedComponentsDoNotOverlap() {
    GraphData graph =
        GraphData.builder()
            .addNodes("a", "b", "c", "d", "e")
            .addEdge("a", "b")
            .addEdge("c", "d")
            .build();

    Map<String, Point> positions = new HierarchicalLayout().layout(graph).positions();

    assertThat(positions.values()).containsNoDuplicates();
    assertThat(positions.get("a").y()).isEqualTo(positions.get("c").y());
    assertThat(positions.get("e").y()).isEqualTo(positions.get("a").y());
  }

  @Test
  void testAllAlgorithmsProduceValidLayouts() {
    for (RankingAlgorithm ranking : RankingAlgorithm.values()) {
      for (CrossingMinimization crossing : CrossingMinimization.values()) {
        for (CoordinateAssignment coordinates : CoordinateAssignment.values()) {
          LayoutOptions options =
              LayoutOptions.builder()
                  .rankingAlgorithm(ranking)
                  .crossingMinimization(crossing)
                  .coordinateAssignment(coordinates)
                  .build();

          LayoutResult result = new HierarchicalLayout(options).layout(triangle());

          assertThat(result.positions()).hasSize(3);
          assertThat(result.bounds().minX()).isEqualTo(MARGIN);
          assertThat(result.bounds().minY()).isEqualTo(MARGIN);
        }
      }
    }
  }

  @Test
  void testLongChainDoesNotOverflowTheStack() {
    GraphData.Builder builder = GraphData.builder().addNodes("n0");
    int length = 5_000;
    for (int i = 1; i < length; i++) {
      builder.addNodes("n" + i).addEdge("n" + (i - 1), "n" + i);
    }
    builder.addEdge("n" + (length - 1), "n0");

    LayoutResult result = new HierarchicalLayout().layout(builder.build());

    assertThat(result.positions()).hasSize(length);
    assertThat(result.stats().reversedEdges()).isEqualTo(1);
    assertThat(result.positions().get("n" + (length - 1)).y())
        .isEqualTo(MARGIN + (length - 1) * 100.0);
  }

  @Test
  void testPresetsAndOptions() {
    HierarchicalLayout wide = HierarchicalLayout.withPreset(LayoutPreset.WIDE);
    assertThat(wide.options().direction()).isEqualTo(LayoutDirection.LR);

    LayoutOptions options = wide.options().toBuilder().margin(0).build();
    HierarchicalLayout changed = wide.withOptions(options);
    assertThat(changed.options()).isSameInstanceAs(options);
    assertThat(wide.options().margin()).isEqualTo(50.0);
  }

  @Test
  void testNullGraphIsRejected() {
    assertThrows(NullPointerException.class, () -> new HierarchicalLayout().layout(null));
  }
}
