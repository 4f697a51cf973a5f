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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * An elementary cycle of a {@link FieldGraph}: a sequence of distinct nodes, each with an edge to
 * the next, the last with an edge back to the first.
 */
public final class Cycle<T> {

  private final List<Node<T>> members;

  Cycle(List<Node<T>> members) {
    checkArgument(!members.isEmpty(), "a cycle has at least one node");
    this.members = new ArrayList<>(members);
  }

  List<Node<T>> members() {
    return Collections.unmodifiableList(members);
  }

  boolean contains(Node<T> node) {
    return members.contains(node);
  }

  /** Rotates this cycle in place so that it starts at {@code start}, which must be a member. */
  void rotateToStartAt(Node<T> start) {
    int index = members.indexOf(start);
    checkArgument(index >= 0, "%s is not part of %s", start, this);
    Collections.rotate(members, -index);
  }

  /** Returns the labels of this cycle in order. */
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

  /**
   * Returns the labels of this cycle rotated to start at its smallest label under {@code order}.
   * Two cycles are the same cycle iff their canonical forms are equal.
   */
  public ImmutableList<T> canonical(Comparator<? super T> order) {
    checkNotNull(order, "order");
    List<T> labels = new ArrayList<>(nodes());
    T smallest = Collections.min(labels, order);
    Collections.rotate(labels, -labels.indexOf(smallest));
    return ImmutableList.copyOf(labels);
  }

  @Override
  public String toString() {
    return "Cycle" + nodes();
  }
}
