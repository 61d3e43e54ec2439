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
 * A node of the graph to be laid out. Besides its identifier a node may carry arbitrary display
 * attributes, which the layout ignores and hands back untouched.
 */
public final class GraphNode {

  private final String id;
  private final ImmutableMap<String, Object> attributes;

  private GraphNode(String id, ImmutableMap<String, Object> attributes) {
    this.id = id;
    this.attributes = attributes;
  }

  public static GraphNode of(String id) {
    return of(id, ImmutableMap.of());
  }

  public static GraphNode of(String id, Map<String, ?> attributes) {
    return new GraphNode(checkNotNull(id, "id"), ImmutableMap.copyOf(attributes));
  }

  public String id() {
    return id;
  }

  public ImmutableMap<String, Object> attributes() {
    return attributes;
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof GraphNode)) {
      return false;
    }
    GraphNode that = (GraphNode) obj;
    return id.equals(that.id) && attributes.equals(that.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, attributes);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("attributes", attributes)
        .omitNullValues()
        .toString();
  }
}
