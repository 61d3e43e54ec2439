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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * An edge of a computed layout together with its route.
 *
 * <p>If the edge had to be reversed to break a cycle, {@link #source()} and {@link #target()} are
 * swapped relative to the input edge and {@link #reversed()} is true; the control points then run
 * from the input target to the input source.
 */
public final class RoutedEdge {

  private final String id;
  private final String source;
  private final String target;
  private final boolean reversed;
  private final ImmutableList<String> dummyNodes;
  private final ImmutableList<Point> controlPoints;
  private final ImmutableMap<String, Object> attributes;

  RoutedEdge(
      String id,
      String source,
      String target,
      boolean reversed,
      ImmutableList<String> dummyNodes,
      ImmutableList<Point> controlPoints,
      ImmutableMap<String, Object> attributes) {
    this.id = id;
    this.source = source;
    this.target = target;
    this.reversed = reversed;
    this.dummyNodes = dummyNodes;
    this.controlPoints = controlPoints;
    this.attributes = attributes;
  }

  public String id() {
    return id;
  }

  public String source() {
    return source;
  }

  public String target() {
    return target;
  }

  public boolean reversed() {
    return reversed;
  }

  /** Returns the identifiers of the routing nodes of this edge, from source to target. */
  public ImmutableList<String> dummyNodes() {
    return dummyNodes;
  }

  /** Returns the polyline of this edge: source, every routing node, then target. */
  public ImmutableList<Point> controlPoints() {
    return controlPoints;
  }

  /** Returns the display attributes of the input edge. */
  public ImmutableMap<String, Object> attributes() {
    return attributes;
  }

  /** Returns the summed length of the segments of {@link #controlPoints()}. */
  public double length() {
    double length = 0;
    for (int i = 1; i < controlPoints.size(); i++) {
      length += controlPoints.get(i - 1).distanceTo(controlPoints.get(i));
    }
    return length;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("source", source)
        .add("target", target)
        .add("reversed", reversed)
        .add("controlPoints", controlPoints)
        .toString();
  }
}
