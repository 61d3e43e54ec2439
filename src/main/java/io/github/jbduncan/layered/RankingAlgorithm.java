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

/** Strategies for assigning nodes to levels. */
public enum RankingAlgorithm {
  /** Places every node one level below its deepest parent. */
  LONGEST_PATH("longest-path"),
  /**
   * Longest-path followed by iterative rank tightening towards the median of a node's
   * neighbors.
   */
  TIGHT_TREE("tight-tree"),
  /**
   * Currently computed exactly like {@link #TIGHT_TREE}; this is an approximation, not a true
   * network simplex optimum.
   */
  NETWORK_SIMPLEX("network-simplex");

  private final String id;

  RankingAlgorithm(String id) {
    this.id = id;
  }

  /** Returns the external identifier, e.g. {@code "longest-path"}. */
  public String id() {
    return id;
  }

  /**
   * Returns the constant whose identifier is {@code id}.
   *
   * @throws IllegalArgumentException if no constant has that identifier.
   */
  public static RankingAlgorithm forId(String id) {
    checkNotNull(id, "id");
    for (RankingAlgorithm value : values()) {
      if (value.id.equals(id)) {
        return value;
      }
    }
    throw new IllegalArgumentException("Unknown ranking algorithm: " + id);
  }

  @Override
  public String toString() {
    return id;
  }
}
