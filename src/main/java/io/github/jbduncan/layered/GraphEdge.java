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
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A directed edge of the graph to be laid out.
 *
 * <p>Edges are not validated on construction: an edge may name endpoints that are not part of its
 * {@link GraphData}, or start and end at the same node. The layout silently drops such edges.
 */
public final class GraphEdge {

  private final String id;
  private final EdgeEndpoint source;
  private final EdgeEndpoint target;
  private final ImmutableMap<String, Object> attributes;

  private GraphEdge(
      String id,
      EdgeEndpoint source,
      EdgeEndpoint target,
      ImmutableMap<String, Object> attributes) {
    this.id = id;
    this.source = source;
    this.target = target;
    this.attributes = attributes;
  }

  public static GraphEdge of(String id, String source, String target) {
    return of(id, EdgeEndpoint.of(source), EdgeEndpoint.of(target), ImmutableMap.of());
  }

  public static GraphEdge of(String id, GraphNode source, GraphNode target) {
    return of(id, EdgeEndpoint.of(source), EdgeEndpoint.of(target), ImmutableMap.of());
  }

  public static GraphEdge of(
      String id, EdgeEndpoint source, EdgeEndpoint target, Map<String, ?> attributes) {
    return new GraphEdge(
        checkNotNull(id, "id"),
        checkNotNull(source, "source"),
        checkNotNull(target, "target"),
        ImmutableMap.copyOf(attributes));
  }

  public String id() {
    return id;
  }

  public EdgeEndpoint source() {
    return source;
  }

  public EdgeEndpoint target() {
    return target;
  }

  public ImmutableMap<String, Object> attributes() {
    return attributes;
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof GraphEdge)) {
      return false;
    }
    GraphEdge that = (GraphEdge) obj;
    return id.equals(that.id)
        && source.equals(that.source)
        && target.equals(that.target)
        && attributes.equals(that.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, source, target, attributes);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("source", source)
        .add("target", target)
        .toString();
  }
}
