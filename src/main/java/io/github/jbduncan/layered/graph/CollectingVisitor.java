// Copyright 2014 The Bazel Authors. All rights reserved.
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

package io.github.jbduncan.layered.graph;

import java.util.ArrayList;
import java.util.List;

/** A graph visitor that collects the visited nodes in the order in which they were visited. */
final class CollectingVisitor<T> extends AbstractGraphVisitor<T> {

  private final List<T> order = new ArrayList<>();

  @Override
  public void visitNode(T node) {
    order.add(node);
  }

  /** Returns a reference to (not a copy of) the list of visited nodes. */
  List<T> getVisitedNodes() {
    return order;
  }
}
