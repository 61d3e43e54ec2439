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

import com.google.common.base.Ascii;

/** Named starting points for {@link LayoutOptions}, each overriding some of the defaults. */
public enum LayoutPreset {
  /** The defaults, with the usual level and node spacing. */
  DEFAULT {
    @Override
    public LayoutOptions.Builder toBuilder() {
      return LayoutOptions.builder()
          .direction(LayoutDirection.TB)
          .levelSeparation(100)
          .nodeSeparation(50)
          .subtreeSeparation(80)
          .rankingAlgorithm(RankingAlgorithm.LONGEST_PATH)
          .crossingMinimization(CrossingMinimization.BARYCENTER)
          .crossingIterations(24);
    }
  },
  /** Tighter spacing for trees, where parent-child relations dominate. */
  TREE {
    @Override
    public LayoutOptions.Builder toBuilder() {
      return LayoutOptions.builder()
          .direction(LayoutDirection.TB)
          .levelSeparation(80)
          .nodeSeparation(40)
          .subtreeSeparation(60)
          .rankingAlgorithm(RankingAlgorithm.LONGEST_PATH)
          .crossingMinimization(CrossingMinimization.BARYCENTER)
          .crossingIterations(12)
          .compact(true);
    }
  },
  /** Wider spacing and more sweeps for dense dependency graphs. */
  DAG {
    @Override
    public LayoutOptions.Builder toBuilder() {
      return LayoutOptions.builder()
          .direction(LayoutDirection.TB)
          .levelSeparation(120)
          .nodeSeparation(60)
          .subtreeSeparation(100)
          .rankingAlgorithm(RankingAlgorithm.NETWORK_SIMPLEX)
          .crossingMinimization(CrossingMinimization.MEDIAN)
          .crossingIterations(48)
          .compact(false);
    }
  },
  /** Minimal spacing. */
  COMPACT {
    @Override
    public LayoutOptions.Builder toBuilder() {
      return LayoutOptions.builder()
          .direction(LayoutDirection.TB)
          .levelSeparation(60)
          .nodeSeparation(30)
          .subtreeSeparation(40)
          .rankingAlgorithm(RankingAlgorithm.TIGHT_TREE)
          .crossingMinimization(CrossingMinimization.BARYCENTER)
          .crossingIterations(36)
          .compact(true);
    }
  },
  /** Left to right, with generous spacing. */
  WIDE {
    @Override
    public LayoutOptions.Builder toBuilder() {
      return LayoutOptions.builder()
          .direction(LayoutDirection.LR)
          .levelSeparation(150)
          .nodeSeparation(80)
          .subtreeSeparation(120)
          .rankingAlgorithm(RankingAlgorithm.LONGEST_PATH)
          .crossingMinimization(CrossingMinimization.BARYCENTER)
          .crossingIterations(24)
          .compact(false);
    }
  };

  /** Returns a builder holding the options of this preset, ready for further overrides. */
  public abstract LayoutOptions.Builder toBuilder();

  public LayoutOptions options() {
    return toBuilder().build();
  }

  /** Returns the identifier of this preset, e.g. {@code "dag"}. */
  public String id() {
    return Ascii.toLowerCase(name());
  }

  /**
   * Returns the preset identified by {@code id}, ignoring case.
   *
   * @throws IllegalArgumentException if no preset has that identifier.
   */
  public static LayoutPreset forId(String id) {
    checkNotNull(id, "id");
    for (LayoutPreset preset : values()) {
      if (preset.name().equalsIgnoreCase(id)) {
        return preset;
      }
    }
    throw new IllegalArgumentException("Unknown layout preset: " + id);
  }
}
