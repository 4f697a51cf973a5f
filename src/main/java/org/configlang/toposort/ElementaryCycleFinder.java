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

package org.configlang.toposort;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates the elementary cycles of one strongly connected component with Johnson's algorithm
 * ("Finding all the elementary circuits of a directed graph", SIAM J. Comput. 4(1), 1975).
 *
 * <p>The members of the component are taken in turn as the origin of a depth-first search. Every
 * cycle found from an origin passes through it, and an origin is never entered again once its
 * search is over, so every cycle is reported exactly once, starting at the first of its members in
 * component order.
 *
 * <p>A node is blocked while it is on the search path and for as long as no path from it back to
 * the origin is known. A blocked node records in its {@code blockedBy} list the nodes whose
 * blocking depends on it, so that they can be unblocked in turn when it is.
 *
 * <p>Edges leaving the component are ignored: no cycle can leave a strongly connected component.
 */
final class ElementaryCycleFinder<T> {

  private final StronglyConnectedComponent<T> component;

  private final List<Node<T>> path = new ArrayList<>();

  private final ImmutableList.Builder<Cycle<T>> cycles = ImmutableList.builder();

  ElementaryCycleFinder(StronglyConnectedComponent<T> component) {
    this.component = component;
  }

  ImmutableList<Cycle<T>> find() {
    List<Node<T>> members = component.members();
    for (Node<T> node : members) {
      node.exhausted = false;
      reset(node);
    }
    for (Node<T> origin : members) {
      circuit(origin, origin);
      origin.exhausted = true;
      for (Node<T> node : members) {
        if (!node.exhausted) {
          reset(node);
        }
      }
    }
    return cycles.build();
  }

  /** Returns true iff at least one cycle through {@code node} and {@code origin} was found. */
  private boolean circuit(Node<T> node, Node<T> origin) {
    boolean found = false;
    path.add(node);
    node.blocked = true;
    for (Node<T> next : node.getSuccessors()) {
      if (!isCandidate(next)) {
        continue;
      }
      if (next == origin) {
        cycles.add(new Cycle<>(path));
        found = true;
      } else if (!next.blocked && circuit(next, origin)) {
        found = true;
      }
    }
    if (found) {
      unblock(node);
    } else {
      for (Node<T> next : node.getSuccessors()) {
        if (isCandidate(next) && !next.blockedBy.contains(node)) {
          next.blockedBy.add(node);
        }
      }
    }
    path.remove(path.size() - 1);
    return found;
  }

  private void unblock(Node<T> node) {
    node.blocked = false;
    List<Node<T>> dependents = new ArrayList<>(node.blockedBy);
    node.blockedBy.clear();
    for (Node<T> dependent : dependents) {
      if (dependent.blocked) {
        unblock(dependent);
      }
    }
  }

  private boolean isCandidate(Node<T> node) {
    return node.getComponent() == component && !node.exhausted;
  }

  private static <T> void reset(Node<T> node) {
    node.blocked = false;
    node.blockedBy.clear();
  }
}
