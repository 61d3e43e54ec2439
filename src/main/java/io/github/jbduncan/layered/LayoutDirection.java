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

/**
 * The direction in which levels are stacked. The first letter names the side of the drawing that
 * holds the first level: top, bottom, left or right.
 */
public enum LayoutDirection {
  /** Top to bottom. */
  TB(false, false),
  /** Bottom to top. */
  BT(false, true),
  /** Left to right. */
  LR(true, false),
  /** Right to left. */
  RL(true, true);

  private final boolean horizontal;
  private final boolean reversed;

  LayoutDirection(boolean horizontal, boolean reversed) {
    this.horizontal = horizontal;
    this.reversed = reversed;
  }

  /**
   * Returns true if levels are laid out along the x axis, in which case the position of a node
   * within its level is its y coordinate.
   */
  public boolean isHorizontal() {
    return horizontal;
  }

  /** Returns true if the first level is placed at the far end of the primary axis. */
  public boolean isReversed() {
    return reversed;
  }

  /** Returns the identifier of this direction, e.g. {@code "TB"}. */
  public String id() {
    return name();
  }

  /**
   * Returns the direction identified by {@code id}, ignoring case.
   *
   * @throws IllegalArgumentException if no direction has that identifier.
   */
  public static LayoutDirection forId(String id) {
    checkNotNull(id, "id");
    for (LayoutDirection direction : values()) {
      if (direction.name().equalsIgnoreCase(id)) {
        return direction;
      }
    }
    throw new IllegalArgumentException("Unknown layout direction: " + id);
  }
}
