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
import java.util.ArrayList;
import java.util.List;

/** The mutable working state of one surviving input edge during a single layout. */
final class LayoutEdge {

  final GraphEdge input;

  String source;
  String target;
  boolean reversed;

  /** Dummy node ids from {@link #source} to {@link #target}. */
  final List<String> dummyNodes = new ArrayList<>();

  ImmutableList<Point> controlPoints = ImmutableList.of();

  LayoutEdge(GraphEdge input, String source, String target) {
    this.input = input;
    this.source = source;
    this.target = target;
  }

  String id() {
    return input.id();
  }

  void reverse() {
    String formerSource = source;
    source = target;
    target = formerSource;
    reversed = true;
  }

  RoutedEdge toRoutedEdge() {
    return new RoutedEdge(
        id(),
        source,
        target,
        reversed,
        ImmutableList.copyOf(dummyNodes),
        controlPoints,
        input.attributes());
  }

  @Override
  public String toString() {
    return id() + "[" + source + " -> " + target + (reversed ? ", reversed]" : "]");
  }
}
