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

import javax.annotation.Nullable;

/** The mutable working state of one node, real or dummy, during a single layout. */
final class LayoutNode {

  static final int UNASSIGNED = -1;

  final String id;
  final boolean dummy;

  /** The edge a dummy node routes; null for real nodes. */
  @Nullable final String originalEdgeId;

  int level = UNASSIGNED;
  int order = UNASSIGNED;
  double x;
  double y;

  private LayoutNode(String id, boolean dummy, @Nullable String originalEdgeId) {
    this.id = id;
    this.dummy = dummy;
    this.originalEdgeId = originalEdgeId;
  }

  static LayoutNode real(String id) {
    return new LayoutNode(id, false, null);
  }

  static LayoutNode dummy(String id, String originalEdgeId, int level) {
    LayoutNode node = new LayoutNode(id, true, originalEdgeId);
    node.level = level;
    return node;
  }

  /** Returns the coordinate along the axis on which the nodes of a level are spread. */
  double crossCoordinate(LayoutDirection direction) {
    return direction.isHorizontal() ? y : x;
  }

  void setCrossCoordinate(LayoutDirection direction, double value) {
    if (direction.isHorizontal()) {
      y = value;
    } else {
      x = value;
    }
  }

  Point position() {
    return Point.of(x, y);
  }

  @Override
  public String toString() {
    return (dummy ? "dummy:" : "node:") + id + "@" + level + "/" + order;
  }
}
