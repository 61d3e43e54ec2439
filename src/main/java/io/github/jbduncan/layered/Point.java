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

/** An immutable point in the plane of the drawing. */
public final class Point {

  private final double x;
  private final double y;

  private Point(double x, double y) {
    this.x = x;
    this.y = y;
  }

  public static Point of(double x, double y) {
    return new Point(x, y);
  }

  public double x() {
    return x;
  }

  public double y() {
    return y;
  }

  /** Returns the Euclidean distance between this point and {@code other}. */
  public double distanceTo(Point other) {
    return Math.hypot(other.x - x, other.y - y);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Point)) {
      return false;
    }
    Point that = (Point) obj;
    return Double.compare(x, that.x) == 0 && Double.compare(y, that.y) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * Double.hashCode(x) + Double.hashCode(y);
  }

  @Override
  public String toString() {
    return "(" + x + ", " + y + ")";
  }
}
