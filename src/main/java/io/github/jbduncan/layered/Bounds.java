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
import javax.annotation.Nullable;

/** The axis-aligned bounding box of the coordinates of a layout. */
public final class Bounds {

  private static final Bounds EMPTY = new Bounds(0, 0, 0, 0);

  private final double minX;
  private final double minY;
  private final double maxX;
  private final double maxY;

  private Bounds(double minX, double minY, double maxX, double maxY) {
    this.minX = minX;
    this.minY = minY;
    this.maxX = maxX;
    this.maxY = maxY;
  }

  /** Returns bounds whose every field is zero. */
  public static Bounds empty() {
    return EMPTY;
  }

  public static Bounds of(double minX, double minY, double maxX, double maxY) {
    return new Bounds(minX, minY, maxX, maxY);
  }

  public double minX() {
    return minX;
  }

  public double minY() {
    return minY;
  }

  public double maxX() {
    return maxX;
  }

  public double maxY() {
    return maxY;
  }

  public double width() {
    return maxX - minX;
  }

  public double height() {
    return maxY - minY;
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Bounds)) {
      return false;
    }
    Bounds that = (Bounds) obj;
    return Double.compare(minX, that.minX) == 0
        && Double.compare(minY, that.minY) == 0
        && Double.compare(maxX, that.maxX) == 0
        && Double.compare(maxY, that.maxY) == 0;
  }

  @Override
  public int hashCode() {
    int result = Double.hashCode(minX);
    result = 31 * result + Double.hashCode(minY);
    result = 31 * result + Double.hashCode(maxX);
    result = 31 * result + Double.hashCode(maxY);
    return result;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("minX", minX)
        .add("minY", minY)
        .add("maxX", maxX)
        .add("maxY", maxY)
        .toString();
  }
}
