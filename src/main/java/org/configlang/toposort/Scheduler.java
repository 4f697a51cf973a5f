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

import static com.google.common.base.Verify.verifyNotNull;

import com.google.common.collect.Comparators;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns every node of a graph its final position.
 *
 * <p>Components are visited in a topological order of the condensation graph, the component with
 * the smallest member keys first whenever there is a choice. Within a component, nodes are placed
 * in topological order, again smallest key first. When every unplaced node of a component waits on
 * another unplaced node, the configured {@link CycleResolution} decides how to continue.
 */
final class Scheduler<T> {

  private static final Logger logger = LoggerFactory.getLogger(Scheduler.class);

  private final ImmutableList<StronglyConnectedComponent<T>> components;

  private final SortOptions options;

  private final Function<StronglyConnectedComponent<T>, ImmutableList<Cycle<T>>> cycleSource;

  private final Comparator<Node<T>> nodeOrder = Comparator.comparing(Node::getKey);

  private final Comparator<Iterable<Node<T>>> sequenceOrder =
      Comparators.lexicographical(nodeOrder);

  private final Comparator<StronglyConnectedComponent<T>> componentOrder =
      (a, b) -> sequenceOrder.compare(a.members(), b.members());

  private final List<Node<T>> sorted = new ArrayList<>();

  Scheduler(ImmutableList<StronglyConnectedComponent<T>> components, SortOptions options) {
    this(components, options, StronglyConnectedComponent::elementaryCycles);
  }

  /** As above, but a stuck component's cycles come from {@code cycleSource}. */
  Scheduler(
      ImmutableList<StronglyConnectedComponent<T>> components,
      SortOptions options,
      Function<StronglyConnectedComponent<T>, ImmutableList<Cycle<T>>> cycleSource) {
    this.components = components;
    this.options = options;
    this.cycleSource = cycleSource;
  }

  ImmutableList<T> sort() {
    PriorityQueue<StronglyConnectedComponent<T>> ready =
        new PriorityQueue<>(Math.max(1, components.size()), componentOrder);
    for (StronglyConnectedComponent<T> component : components) {
      component.visited = false;
      component.sortMembers(nodeOrder);
    }
    for (StronglyConnectedComponent<T> component : components) {
      if (component.getPredecessors().isEmpty()) {
        ready.add(component);
      }
    }

    int visitedCount = 0;
    while (visitedCount != components.size()) {
      StronglyConnectedComponent<T> current = ready.remove();
      if (current.visited) {
        continue;
      }
      current.visited = true;
      visitedCount++;
      logger.debug("Scheduling {}", current);
      schedule(current);

      nextComponent:
      for (StronglyConnectedComponent<T> next : current.getSuccessors()) {
        for (StronglyConnectedComponent<T> required : next.getPredecessors()) {
          if (!required.visited) {
            continue nextComponent;
          }
        }
        ready.add(next);
      }
    }

    ImmutableList.Builder<T> result = ImmutableList.builderWithExpectedSize(sorted.size());
    for (Node<T> node : sorted) {
      result.add(node.getLabel());
    }
    return result.build();
  }

  private void schedule(StronglyConnectedComponent<T> component) {
    PriorityQueue<Node<T>> ready = new PriorityQueue<>(component.size(), nodeOrder);
    for (Node<T> node : component.members()) {
      node.setPosition(Node.IN_CURRENT_COMPONENT);
    }
    for (Node<T> node : component.members()) {
      if (isEnabled(node)) {
        ready.add(node);
      }
    }

    CycleChooser<T> chooser = null;
    int requiredSize = sorted.size() + component.size();
    while (sorted.size() != requiredSize) {
      if (!ready.isEmpty()) {
        place(ready.remove(), ready);
        continue;
      }
      logger.debug("Stuck after {} in {}", sorted.size(), component);
      if (!searchesCycles(component)) {
        for (Node<T> node : component.members()) {
          place(node, ready);
        }
        continue;
      }
      if (chooser == null) {
        ImmutableList<Cycle<T>> cycles = cycleSource.apply(component);
        logger.debug("{} has {} elementary cycles", component, cycles.size());
        chooser = new CycleChooser<>(cycles, nodeOrder);
      }
      Cycle<T> cycle =
          verifyNotNull(
              chooser.choose(), "No cycle found in %s, yet none of its nodes is ready", component);
      for (Node<T> node : cycle.members()) {
        place(node, ready);
      }
    }
  }

  private boolean searchesCycles(StronglyConnectedComponent<T> component) {
    if (options.cycleResolution() != CycleResolution.ELEMENTARY_CYCLES) {
      return false;
    }
    if (component.size() > options.maxCycleSearchSize()) {
      logger.warn(
          "Component of {} fields exceeds the cycle search limit of {}; ordering it by key",
          component.size(),
          options.maxCycleSearchSize());
      return false;
    }
    return true;
  }

  /**
   * Gives {@code node} the next position, unless it already has one, and makes ready each node of
   * the current component that was waiting only on it.
   */
  private void place(Node<T> node, PriorityQueue<Node<T>> ready) {
    if (node.isSorted()) {
      return;
    }
    node.setPosition(sorted.size());
    sorted.add(node);
    for (Node<T> next : node.getSuccessors()) {
      if (next.getPosition() == Node.IN_CURRENT_COMPONENT && isEnabled(next)) {
        ready.add(next);
      }
    }
  }

  /** Returns true iff every predecessor of {@code node} has been placed. */
  private static <T> boolean isEnabled(Node<T> node) {
    for (Node<T> required : node.getPredecessors()) {
      if (!required.isSorted()) {
        return false;
      }
    }
    return true;
  }
}
