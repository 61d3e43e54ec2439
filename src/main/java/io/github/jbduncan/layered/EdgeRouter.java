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

import com.google.common.collect.ImmutableList;

/** Routes every edge as a polyline from its source through its dummy nodes to its target. */
final class EdgeRouter {

  private EdgeRouter() {}

  static void routeEdges(LayoutContext context) {
    for (LayoutEdge edge : context.edges.values()) {
      ImmutableList.Builder<Point> controlPoints =
          ImmutableList.builderWithExpectedSize(edge.dummyNodes.size() + 2);
      controlPoints.add(context.node(edge.source).position());
      for (String dummy : edge.dummyNodes) {
        controlPoints.add(context.node(dummy).position());
      }
      controlPoints.add(context.node(edge.target).position());
      edge.controlPoints = controlPoints.build();
    }
  }
}
