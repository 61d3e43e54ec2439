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

import com.google.common.annotations.VisibleForTesting;
import java.util.Comparator;
import java.util.Set;

/**
 * Turns levels and orders into coordinates.
 *
 * <p>The primary axis is the one along which levels are stacked (y for {@link LayoutDirection#TB}
 * and {@link LayoutDirection#BT}, x otherwise); the cross axis is the other one. Once the selected
 * algorithm has run, the drawing is moved so that its minimum coordinates equal the margin, and
 * optionally snapped to the grid.
 */
final class CoordinateAssigner {

  private CoordinateAssigner() {}

  static void assignCoordinates(LayoutContext context) {
    switch (context.options.coordinateAssignment()) {
      case BRANDES_KOPF:
      case TIGHT:
        assignAligned(context);
        break;
      case SIMPLE:
        assignSimple(context);
        break;
    }

    applyMargin(context);
    if (context.options.alignToGrid()) {
      alignToGrid(context);
    }
  }

  /**
   * Spaces levels evenly along the primary axis, first level first unless the direction is
   * reversed, and centers the nodes of every level on the cross axis.
   */
  @VisibleForTesting
  static void assignSimple(LayoutContext context) {
    LayoutOptions options = context.options;
    LayoutDirection direction = options.direction();

    double levelCoordinate = 0;
    for (Level level :
        direction.isReversed() ? context.levelsBottomUp() : context.levelsTopDown()) {
      level.coordinate = levelCoordinate;
      levelCoordinate += options.levelSeparation();
    }

    for (Level level : context.levels.values()) {
      double crossCoordinate = -(level.size() - 1) * options.nodeSeparation() / 2;
      for (LayoutNode node : level.nodes) {
        if (direction.isHorizontal()) {
          node.x = level.coordinate;
        } else {
          node.y = level.coordinate;
        }
        node.setCrossCoordinate(direction, crossCoordinate);
        crossCoordinate += options.nodeSeparation();
      }
    }
  }

  /**
   * Starts from {@link #assignSimple} and repeatedly pulls every node towards the mean cross
   * coordinate of its parents, then of its children, without letting it come closer than half the
   * node separation to its neighbor in the level.
   */
  private static void assignAligned(LayoutContext context) {
    assignSimple(context);

    for (int i = 0; i < context.options.alignmentIterations(); i++) {
      alignToNeighbors(context, /* alignToParents= */ true);
      alignToNeighbors(context, /* alignToParents= */ false);
    }

    if (context.options.compact()) {
      compact(context);
    }
  }

  private static void alignToNeighbors(LayoutContext context, boolean alignToParents) {
    LayoutDirection direction = context.options.direction();
    for (Level level : alignToParents ? context.levelsTopDown() : context.levelsBottomUp()) {
      for (LayoutNode node : level.nodes) {
        Set<String> neighbors =
            alignToParents
                ? context.layeredGraph.predecessors(node.id)
                : context.layeredGraph.successors(node.id);
        if (neighbors.isEmpty()) {
          continue;
        }

        double idealPosition = 0;
        for (String neighbor : neighbors) {
          idealPosition += context.node(neighbor).crossCoordinate(direction);
        }
        idealPosition /= neighbors.size();

        double delta = idealPosition - node.crossCoordinate(direction);
        if (canShift(context, level, node, delta)) {
          node.setCrossCoordinate(direction, idealPosition);
        }
      }
    }
  }

  @VisibleForTesting
  static boolean canShift(LayoutContext context, Level level, LayoutNode node, double delta) {
    if (Math.abs(delta) < 1) {
      return false;
    }

    LayoutDirection direction = context.options.direction();
    double minSeparation = context.options.nodeSeparation() / 2;
    double newPosition = node.crossCoordinate(direction) + delta;
    int index = node.order;

    if (delta < 0 && index > 0) {
      double previous = level.nodes.get(index - 1).crossCoordinate(direction);
      if (newPosition - previous < minSeparation) {
        return false;
      }
    }
    if (delta > 0 && index < level.size() - 1) {
      double next = level.nodes.get(index + 1).crossCoordinate(direction);
      if (next - newPosition < minSeparation) {
        return false;
      }
    }
    return true;
  }

  /**
   * Closes gaps wider than twice the node separation within every level, working from the low end
   * of the cross axis, then centers the drawing on the cross axis.
   */
  @VisibleForTesting
  static void compact(LayoutContext context) {
    LayoutDirection direction = context.options.direction();
    double separation = context.options.nodeSeparation();

    for (Level level : context.levels.values()) {
      level.nodes.sort(Comparator.comparingDouble(node -> node.crossCoordinate(direction)));
      level.renumber();

      for (int i = 1; i < level.size(); i++) {
        double previous = level.nodes.get(i - 1).crossCoordinate(direction);
        LayoutNode node = level.nodes.get(i);
        double idealPosition = previous + separation;
        if (node.crossCoordinate(direction) > idealPosition + separation) {
          node.setCrossCoordinate(direction, idealPosition);
        }
      }
    }

    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (LayoutNode node : context.nodes.values()) {
      min = Math.min(min, node.crossCoordinate(direction));
      max = Math.max(max, node.crossCoordinate(direction));
    }
    double center = (min + max) / 2;
    for (LayoutNode node : context.nodes.values()) {
      node.setCrossCoordinate(direction, node.crossCoordinate(direction) - center);
    }
  }

  /** Moves all nodes so that the smallest x and the smallest y equal the margin. */
  private static void applyMargin(LayoutContext context) {
    double minX = Double.POSITIVE_INFINITY;
    double minY = Double.POSITIVE_INFINITY;
    for (LayoutNode node : context.nodes.values()) {
      minX = Math.min(minX, node.x);
      minY = Math.min(minY, node.y);
    }

    double margin = context.options.margin();
    for (LayoutNode node : context.nodes.values()) {
      node.x = node.x == minX ? margin : node.x + (margin - minX);
      node.y = node.y == minY ? margin : node.y + (margin - minY);
    }
  }

  /**
   * Rounds every coordinate to the nearest multiple of the grid size. If rounding took the drawing
   * into the margin, it is moved back out by whole grid cells.
   */
  private static void alignToGrid(LayoutContext context) {
    double grid = context.options.gridSize();
    double minX = Double.POSITIVE_INFINITY;
    double minY = Double.POSITIVE_INFINITY;
    for (LayoutNode node : context.nodes.values()) {
      node.x = Math.round(node.x / grid) * grid;
      node.y = Math.round(node.y / grid) * grid;
      minX = Math.min(minX, node.x);
      minY = Math.min(minY, node.y);
    }

    double margin = context.options.margin();
    double shiftX = minX < margin ? Math.ceil((margin - minX) / grid) * grid : 0;
    double shiftY = minY < margin ? Math.ceil((margin - minY) / grid) * grid : 0;
    if (shiftX != 0 || shiftY != 0) {
      for (LayoutNode node : context.nodes.values()) {
        node.x += shiftX;
        node.y += shiftY;
      }
    }
  }
}
