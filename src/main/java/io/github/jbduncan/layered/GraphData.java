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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/** The input of a layout: the nodes and edges of a directed graph, in a meaningful order. */
public final class GraphData {

  private static final GraphData EMPTY = new GraphData(ImmutableList.of(), ImmutableList.of());

  private final ImmutableList<GraphNode> nodes;
  private final ImmutableList<GraphEdge> edges;

  private GraphData(ImmutableList<GraphNode> nodes, ImmutableList<GraphEdge> edges) {
    this.nodes = nodes;
    this.edges = edges;
  }

  public static GraphData empty() {
    return EMPTY;
  }

  public static GraphData of(Iterable<GraphNode> nodes, Iterable<GraphEdge> edges) {
    return new GraphData(ImmutableList.copyOf(nodes), ImmutableList.copyOf(edges));
  }

  public static Builder builder() {
    return new Builder();
  }

  public ImmutableList<GraphNode> nodes() {
    return nodes;
  }

  public ImmutableList<GraphEdge> edges() {
    return edges;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("nodes", nodes.size())
        .add("edges", edges.size())
        .toString();
  }

  /** Builder for {@link GraphData}. Nodes and edges keep the order in which they were added. */
  public static final class Builder {
    private final ImmutableList.Builder<GraphNode> nodes = ImmutableList.builder();
    private final ImmutableList.Builder<GraphEdge> edges = ImmutableList.builder();

    private Builder() {}

    public Builder addNode(GraphNode node) {
      nodes.add(checkNotNull(node, "node"));
      return this;
    }

    public Builder addNodes(String... ids) {
      for (String id : ids) {
        addNode(GraphNode.of(id));
      }
      return this;
    }

    public Builder addEdge(GraphEdge edge) {
      edges.add(checkNotNull(edge, "edge"));
      return this;
    }

    /** Adds an edge whose identifier is derived from its endpoints, e.g. {@code "a->b"}. */
    public Builder addEdge(String source, String target) {
      return addEdge(GraphEdge.of(source + "->" + target, source, target));
    }

    public GraphData build() {
      return new GraphData(nodes.build(), edges.build());
    }
  }
}
