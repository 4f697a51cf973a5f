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
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * A maximal set of fields of a {@link FieldGraph} that are all reachable from each other, together
 * with its edges in the condensation graph (the graph in which every component is collapsed to a
 * single node). Components are compared by identity.
 */
public final class StronglyConnectedComponent<T> {

  private final List<Node<T>> members = new ArrayList<>();

  private final Set<StronglyConnectedComponent<T>> successors = new LinkedHashSet<>();

  private final Set<StronglyConnectedComponent<T>> predecessors = new LinkedHashSet<>();

  @Nullable private ImmutableList<Cycle<T>> cycles;

  // Scheduler state.
  boolean visited;

  StronglyConnectedComponent() {}

  void addMember(Node<T> node) {
    node.setComponent(this);
    members.add(node);
  }

  void addSuccessor(StronglyConnectedComponent<T> next) {
    if (successors.add(next)) {
      next.predecessors.add(this);
    }
  }

  List<Node<T>> members() {
    return Collections.unmodifiableList(members);
  }

  /**
   * Reorders the members. Cycles found so far are discarded, since the order of the members
   * determines where each cycle starts.
   */
  void sortMembers(Comparator<? super Node<T>> order) {
    members.sort(order);
    cycles = null;
  }

  Set<StronglyConnectedComponent<T>> getSuccessors() {
    return Collections.unmodifiableSet(successors);
  }

  Set<StronglyConnectedComponent<T>> getPredecessors() {
    return Collections.unmodifiableSet(predecessors);
  }

  /** Returns the labels of the fields in this component. */
  public ImmutableList<T> nodes() {
    ImmutableList.Builder<T> labels = ImmutableList.builderWithExpectedSize(members.size());
    for (Node<T> node : members) {
      labels.add(node.getLabel());
    }
    return labels.build();
  }

  public int size() {
    return members.size();
  }

  /** Returns the components with an edge from this one, excluding this one. */
  public ImmutableList<StronglyConnectedComponent<T>> outgoing() {
    return ImmutableList.copyOf(successors);
  }

  /** Returns the components with an edge into this one, excluding this one. */
  public ImmutableList<StronglyConnectedComponent<T>> incoming() {
    return ImmutableList.copyOf(predecessors);
  }

  /**
   * Returns every elementary cycle (a cycle through no node more than once) inside this component.
   * Each cycle is reported once, at a rotation that callers should not depend on. A component of
   * a single node has a cycle only if that node has an edge to itself.
   *
   * <p>The number of cycles can grow factorially with the size of the component. The result is
   * computed on first use and cached.
   */
  public ImmutableList<Cycle<T>> elementaryCycles() {
    if (cycles == null) {
      cycles = new ElementaryCycleFinder<>(this).find();
    }
    return cycles;
  }

  @Override
  public String toString() {
    return "StronglyConnectedComponent" + nodes();
  }
}
