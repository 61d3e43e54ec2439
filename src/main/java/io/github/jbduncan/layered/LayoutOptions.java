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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * Configuration of a {@link HierarchicalLayout}. Instances are immutable; use {@link #builder()}
 * or {@link #toBuilder()} to create modified copies.
 *
 * <p>All distances are in the units of the drawing, typically pixels.
 */
public final class LayoutOptions {

  private static final LayoutOptions DEFAULTS = new Builder().build();

  private final LayoutDirection direction;
  private final double levelSeparation;
  private final double nodeSeparation;
  private final double subtreeSeparation;
  private final ImmutableList<String> rootNodes;
  private final RankingAlgorithm rankingAlgorithm;
  private final CrossingMinimization crossingMinimization;
  private final CoordinateAssignment coordinateAssignment;
  private final int crossingIterations;
  private final int tightTreeIterations;
  private final int alignmentIterations;
  private final boolean alignToGrid;
  private final double gridSize;
  private final boolean compact;
  private final double margin;

  private LayoutOptions(Builder builder) {
    this.direction = builder.direction;
    this.levelSeparation = builder.levelSeparation;
    this.nodeSeparation = builder.nodeSeparation;
    this.subtreeSeparation = builder.subtreeSeparation;
    this.rootNodes = builder.rootNodes;
    this.rankingAlgorithm = builder.rankingAlgorithm;
    this.crossingMinimization = builder.crossingMinimization;
    this.coordinateAssignment = builder.coordinateAssignment;
    this.crossingIterations = builder.crossingIterations;
    this.tightTreeIterations = builder.tightTreeIterations;
    this.alignmentIterations = builder.alignmentIterations;
    this.alignToGrid = builder.alignToGrid;
    this.gridSize = builder.gridSize;
    this.compact = builder.compact;
    this.margin = builder.margin;
  }

  /** Returns the default options. */
  public static LayoutOptions defaults() {
    return DEFAULTS;
  }

  /** Returns a builder initialized with the default options. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns a builder initialized with these options. */
  public Builder toBuilder() {
    return new Builder(this);
  }

  /** Direction in which levels are stacked. Default {@link LayoutDirection#TB}. */
  public LayoutDirection direction() {
    return direction;
  }

  /** Distance between adjacent levels along the primary axis. Default 100. */
  public double levelSeparation() {
    return levelSeparation;
  }

  /** Distance between neighboring nodes of a level along the cross axis. Default 50. */
  public double nodeSeparation() {
    return nodeSeparation;
  }

  /**
   * Distance between subtrees. Default 80.
   *
   * <p>Accepted for compatibility with existing configurations; no coordinate assignment
   * currently uses it.
   */
  public double subtreeSeparation() {
    return subtreeSeparation;
  }

  /** Nodes to rank first. If empty, or if none of them exists, roots are detected. */
  public ImmutableList<String> rootNodes() {
    return rootNodes;
  }

  public RankingAlgorithm rankingAlgorithm() {
    return rankingAlgorithm;
  }

  public CrossingMinimization crossingMinimization() {
    return crossingMinimization;
  }

  public CoordinateAssignment coordinateAssignment() {
    return coordinateAssignment;
  }

  /** Maximum number of crossing minimization sweeps. Default 24. */
  public int crossingIterations() {
    return crossingIterations;
  }

  /** Maximum number of rank tightening passes of {@link RankingAlgorithm#TIGHT_TREE}. */
  public int tightTreeIterations() {
    return tightTreeIterations;
  }

  /** Number of alignment rounds of {@link CoordinateAssignment#BRANDES_KOPF}. */
  public int alignmentIterations() {
    return alignmentIterations;
  }

  /** Whether coordinates are snapped to multiples of {@link #gridSize()}. Default false. */
  public boolean alignToGrid() {
    return alignToGrid;
  }

  /** Default 10. */
  public double gridSize() {
    return gridSize;
  }

  /** Whether {@link CoordinateAssignment#BRANDES_KOPF} compacts levels. Default true. */
  public boolean compact() {
    return compact;
  }

  /** Distance between the top-left corner of the drawing and the nearest node. Default 50. */
  public double margin() {
    return margin;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("direction", direction)
        .add("levelSeparation", levelSeparation)
        .add("nodeSeparation", nodeSeparation)
        .add("subtreeSeparation", subtreeSeparation)
        .add("rootNodes", rootNodes)
        .add("rankingAlgorithm", rankingAlgorithm)
        .add("crossingMinimization", crossingMinimization)
        .add("coordinateAssignment", coordinateAssignment)
        .add("crossingIterations", crossingIterations)
        .add("tightTreeIterations", tightTreeIterations)
        .add("alignmentIterations", alignmentIterations)
        .add("alignToGrid", alignToGrid)
        .add("gridSize", gridSize)
        .add("compact", compact)
        .add("margin", margin)
        .toString();
  }

  /** Builder for {@link LayoutOptions}. Values are validated by {@link #build()}. */
  public static final class Builder {
    private LayoutDirection direction = LayoutDirection.TB;
    private double levelSeparation = 100;
    private double nodeSeparation = 50;
    private double subtreeSeparation = 80;
    private ImmutableList<String> rootNodes = ImmutableList.of();
    private RankingAlgorithm rankingAlgorithm = RankingAlgorithm.LONGEST_PATH;
    private CrossingMinimization crossingMinimization = CrossingMinimization.BARYCENTER;
    private CoordinateAssignment coordinateAssignment = CoordinateAssignment.BRANDES_KOPF;
    private int crossingIterations = 24;
    private int tightTreeIterations = 100;
    private int alignmentIterations = 8;
    private boolean alignToGrid = false;
    private double gridSize = 10;
    private boolean compact = true;
    private double margin = 50;

    private Builder() {}

    private Builder(LayoutOptions options) {
      this.direction = options.direction;
      this.levelSeparation = options.levelSeparation;
      this.nodeSeparation = options.nodeSeparation;
      this.subtreeSeparation = options.subtreeSeparation;
      this.rootNodes = options.rootNodes;
      this.rankingAlgorithm = options.rankingAlgorithm;
      this.crossingMinimization = options.crossingMinimization;
      this.coordinateAssignment = options.coordinateAssignment;
      this.crossingIterations = options.crossingIterations;
      this.tightTreeIterations = options.tightTreeIterations;
      this.alignmentIterations = options.alignmentIterations;
      this.alignToGrid = options.alignToGrid;
      this.gridSize = options.gridSize;
      this.compact = options.compact;
      this.margin = options.margin;
    }

    public Builder direction(LayoutDirection direction) {
      this.direction = checkNotNull(direction, "direction");
      return this;
    }

    public Builder levelSeparation(double levelSeparation) {
      this.levelSeparation = levelSeparation;
      return this;
    }

    public Builder nodeSeparation(double nodeSeparation) {
      this.nodeSeparation = nodeSeparation;
      return this;
    }

    public Builder subtreeSeparation(double subtreeSeparation) {
      this.subtreeSeparation = subtreeSeparation;
      return this;
    }

    public Builder rootNodes(Iterable<String> rootNodes) {
      this.rootNodes = ImmutableList.copyOf(rootNodes);
      return this;
    }

    public Builder rootNodes(String... rootNodes) {
      this.rootNodes = ImmutableList.copyOf(rootNodes);
      return this;
    }

    public Builder rankingAlgorithm(RankingAlgorithm rankingAlgorithm) {
      this.rankingAlgorithm = checkNotNull(rankingAlgorithm, "rankingAlgorithm");
      return this;
    }

    public Builder crossingMinimization(CrossingMinimization crossingMinimization) {
      this.crossingMinimization = checkNotNull(crossingMinimization, "crossingMinimization");
      return this;
    }

    public Builder coordinateAssignment(CoordinateAssignment coordinateAssignment) {
      this.coordinateAssignment = checkNotNull(coordinateAssignment, "coordinateAssignment");
      return this;
    }

    public Builder crossingIterations(int crossingIterations) {
      this.crossingIterations = crossingIterations;
      return this;
    }

    public Builder tightTreeIterations(int tightTreeIterations) {
      this.tightTreeIterations = tightTreeIterations;
      return this;
    }

    public Builder alignmentIterations(int alignmentIterations) {
      this.alignmentIterations = alignmentIterations;
      return this;
    }

    public Builder alignToGrid(boolean alignToGrid) {
      this.alignToGrid = alignToGrid;
      return this;
    }

    public Builder gridSize(double gridSize) {
      this.gridSize = gridSize;
      return this;
    }

    public Builder compact(boolean compact) {
      this.compact = compact;
      return this;
    }

    public Builder margin(double margin) {
      this.margin = margin;
      return this;
    }

    /**
     * Returns the configured options.
     *
     * @throws IllegalArgumentException if a distance is negative or not finite, the grid size is
     *     not positive, or an iteration count is negative.
     */
    public LayoutOptions build() {
      checkDistance("levelSeparation", levelSeparation);
      checkDistance("nodeSeparation", nodeSeparation);
      checkDistance("subtreeSeparation", subtreeSeparation);
      checkDistance("margin", margin);
      checkArgument(
          Double.isFinite(gridSize) && gridSize > 0, "gridSize must be positive: %s", gridSize);
      checkArgument(
          crossingIterations >= 0,
          "crossingIterations must not be negative: %s",
          crossingIterations);
      checkArgument(
          tightTreeIterations >= 0,
          "tightTreeIterations must not be negative: %s",
          tightTreeIterations);
      checkArgument(
          alignmentIterations >= 0,
          "alignmentIterations must not be negative: %s",
          alignmentIterations);
      return new LayoutOptions(this);
    }

    private static void checkDistance(String name, double value) {
      checkArgument(
          Double.isFinite(value) && value >= 0,
          "%s must be a non-negative number: %s",
          name,
          value);
    }
  }
}
