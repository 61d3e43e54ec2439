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

/** Heuristics for ordering the nodes of each level to reduce edge crossings. */
public enum CrossingMinimization {
  /** Orders nodes by the mean order of their neighbors in the reference level. */
  BARYCENTER("barycenter"),
  /** Orders nodes by the median order of their neighbors in the reference level. */
  MEDIAN("median"),
  /** Keeps the initial order. */
  NONE("none");

  private final String id;

  CrossingMinimization(String id) {
    this.id = id;
  }

  /** Returns the external identifier, e.g. {@code "barycenter"}. */
  public String id() {
    return id;
  }

  /**
   * Returns the constant whose identifier is {@code id}.
   *
   * @throws IllegalArgumentException if no constant has that identifier.
   */
  public static CrossingMinimization forId(String id) {
    checkNotNull(id, "id");
    for (CrossingMinimization value : values()) {
      if (value.id.equals(id)) {
        return value;
      }
    }
    throw new IllegalArgumentException("Unknown crossing minimization: " + id);
  }

  @Override
  public String toString() {
    return id;
  }
}
