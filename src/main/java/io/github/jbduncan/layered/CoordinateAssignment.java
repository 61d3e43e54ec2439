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

/** Strategies for turning levels and orders into coordinates. */
public enum CoordinateAssignment {
  /** Evenly spaced levels, with the nodes of each level centered on the cross axis. */
  SIMPLE("simple"),
  /**
   * {@link #SIMPLE} followed by iterative alignment of nodes with their neighbors and optional
   * compaction.
   */
  BRANDES_KOPF("brandes-kopf"),
  /** Currently computed exactly like {@link #BRANDES_KOPF}. */
  TIGHT("tight");

  private final String id;

  CoordinateAssignment(String id) {
    this.id = id;
  }

  /** Returns the external identifier, e.g. {@code "simple"}. */
  public String id() {
    return id;
  }

  /**
   * Returns the constant whose identifier is {@code id}.
   *
   * @throws IllegalArgumentException if no constant has that identifier.
   */
  public static CoordinateAssignment forId(String id) {
    checkNotNull(id, "id");
    for (CoordinateAssignment value : values()) {
      if (value.id.equals(id)) {
        return value;
      }
    }
    throw new IllegalArgumentException("Unknown coordinate assignment: " + id);
  }

  @Override
  public String toString() {
    return id;
  }
}
