// Copyright 2014 The Bazel Authors. All rights reserved.
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

package io.github.jbduncan.layered.graph;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.graph.EndpointPair;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Test for {@link Digraph}. */
class DigraphTests {

  private Digraph<String> digraph;

  @BeforeEach
  void setup() {
    digraph = new Digraph<>();
    //    f
    // / | | \
    // c g e d
    //      / \
    //      a  b
    digraph.putEdge("f", "c");
    digraph.putEdge("f", "g");
    digraph.putEdge("d", "a");
    digraph.putEdge("d", "b");
    digraph.putEdge("f", "e");
    digraph.putEdge("f", "d");
  }

  @Test
  void testTopologicalOrdering() {
    assertValidTopologicalOrdering(digraph);
  }

  @Test
  void testTopologicalOrderingIsRepeatable() {
    assertThat(digraph.getTopologicalOrder()).isEqualTo(digraph.getTopologicalOrder());
  }

  @Test
  void testNodesAreInInsertionOrder() {
    assertThat(digraph.nodes()).containsExactly("f", "c", "g", "d", "a", "b", "e").inOrder();
    assertThat(digraph.successors("f")).containsExactly("c", "g", "e", "d").inOrder();
  }

  @Test
  void testRoots() {
    assertThat(digraph.roots()).containsExactly("f");
    digraph.addNode("h");
    assertThat(digraph.roots()).containsExactly("f", "h").inOrder();
  }

  @Test
  void testAcyclicGraphHasNoBackEdges() {
    assertThat(digraph.isCyclic()).isFalse();
    assertThat(digraph.getBackEdges()).isEmpty();
  }

  @Test
  void testBackEdgesCloseCycles() {
    digraph.putEdge("a", "f");

    assertThat(digraph.isCyclic()).isTrue();
    assertThat(digraph.getBackEdges()).containsExactly(EndpointPair.ordered("a", "f"));
  }

  @Test
  void testReversingBackEdgesMakesGraphAcyclic() {
    Digraph<String> cycles = new Digraph<>();
    cycles.putEdge("a", "b");
    cycles.putEdge("b", "c");
    cycles.putEdge("c", "a");
    cycles.putEdge("c", "d");
    cycles.putEdge("d", "b");

    for (EndpointPair<String> backEdge : cycles.getBackEdges()) {
      cycles.reverseEdge(backEdge.source(), backEdge.target());
    }

    assertThat(cycles.isCyclic()).isFalse();
    assertValidTopologicalOrdering(cycles);
  }

  @Test
  void testReverseEdge() {
    assertThat(digraph.reverseEdge("d", "a")).isTrue();

    assertThat(digraph.hasEdgeConnecting("a", "d")).isTrue();
    assertThat(digraph.hasEdgeConnecting("d", "a")).isFalse();
    assertThat(digraph.roots()).containsExactly("f", "a").inOrder();
  }

  @Test
  void testReverseMissingEdgeFails() {
    assertThrows(IllegalArgumentException.class, () -> digraph.reverseEdge("a", "d"));
  }

  @Test
  void testSelfEdgesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> digraph.putEdge("a", "a"));
  }

  @Test
  void testRemoveNodeRemovesItsEdges() {
    assertThat(digraph.removeNode("d")).isTrue();

    assertThat(digraph.nodes()).doesNotContain("d");
    assertThat(digraph.successors("f")).containsExactly("c", "g", "e").inOrder();
    assertThat(digraph.predecessors("a")).isEmpty();
    assertThat(digraph.removeNode("d")).isFalse();
  }

  @Test
  void testDeepGraphsDoNotOverflowTheStack() {
    Digraph<Integer> chain = new Digraph<>();
    int length = 100_000;
    for (int i = 1; i < length; i++) {
      chain.putEdge(i - 1, i);
    }
    chain.putEdge(length - 1, 0);

    assertThat(chain.getBackEdges()).containsExactly(EndpointPair.ordered(length - 1, 0));
    chain.reverseEdge(length - 1, 0);
    List<Integer> order = chain.getTopologicalOrder();
    assertThat(order.get(0)).isEqualTo(0);
    assertThat(order.get(length - 1)).isEqualTo(length - 1);
  }

  static <T> void assertValidTopologicalOrdering(Digraph<T> digraph) {
    List<T> topologicalOrdering = digraph.getTopologicalOrder();

    assertThat(topologicalOrdering).containsExactlyElementsIn(digraph.nodes());
    for (EndpointPair<T> edge : digraph.edges()) {
      assertThat(edge.isOrdered()).isTrue();
      assertThat(topologicalOrdering).containsAtLeast(edge.source(), edge.target()).inOrder();
    }
  }
}
