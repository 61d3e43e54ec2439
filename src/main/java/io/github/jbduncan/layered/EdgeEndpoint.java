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

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * One end of a {@link GraphEdge}: either the bare identifier of a node or a reference to the
 * {@link GraphNode} itself. Either way the layout only ever looks at {@link #nodeId()}.
 */
public final class EdgeEndpoint {

  private final String nodeId;
  @Nullable private final GraphNode node;

  private EdgeEndpoint(String nodeId, @Nullable GraphNode node) {
    this.nodeId = nodeId;
    this.node = node;
  }

  /** Returns an endpoint referring to a node by its identifier. */
  public static EdgeEndpoint of(String nodeId) {
    return new EdgeEndpoint(checkNotNull(nodeId, "nodeId"), null);
  }

  /** Returns an endpoint referring to a resolved node. */
  public static EdgeEndpoint of(GraphNode node) {
    checkNotNull(node, "node");
    return new EdgeEndpoint(node.id(), node);
  }

  public String nodeId() {
    return nodeId;
  }

  /** Returns the node this endpoint was created from, if it was created from a node. */
  public Optional<GraphNode> node() {
    return Optional.ofNullable(node);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return obj instanceof EdgeEndpoint && nodeId.equals(((EdgeEndpoint) obj).nodeId);
  }

  @Override
  public int hashCode() {
    return nodeId.hashCode();
  }

  @Override
  public String toString() {
    return nodeId;
  }
}
