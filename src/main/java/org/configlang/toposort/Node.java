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

import com.google.common.base.MoreObjects;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A node of a {@link FieldGraph}, labelled with one field. Adjacency lists keep insertion order and
 * never contain duplicates; the owning {@link GraphBuilder} filters repeated edges.
 *
 * <p>Apart from the adjacency built up before the graph is frozen, the only state that changes is
 * the scratch state of the algorithms run over the graph, and the position assigned (once) by the
 * scheduler.
 */
final class Node<T> {

  /** Position of a node not yet scheduled. */
  static final int UNSORTED = -1;

  /** Position of a node in the component currently being scheduled, but not yet placed. */
  static final int IN_CURRENT_COMPONENT = -2;

  private final T label;

  private final List<Node<T>> successors = new ArrayList<>();

  private final List<Node<T>> predecessors = new ArrayList<>();

  private int position = UNSORTED;

  // Set by the scheduler before any comparison takes place.
  @Nullable private FieldKey key;

  // Set during strong component computation.
  @Nullable private StronglyConnectedComponent<T> component;

  // Elementary cycle search state.
  boolean blocked;
  boolean exhausted;
  final List<Node<T>> blockedBy = new ArrayList<>();

  Node(T label) {
    this.label = label;
  }

  T getLabel() {
    return label;
  }

  List<Node<T>> getSuccessors() {
    return Collections.unmodifiableList(successors);
  }

  List<Node<T>> getPredecessors() {
    return Collections.unmodifiableList(predecessors);
  }

  /** Links this node to {@code to}. Callers must not add the same edge twice. */
  void addEdge(Node<T> to) {
    successors.add(to);
    to.predecessors.add(this);
  }

  int getPosition() {
    return position;
  }

  void setPosition(int position) {
    this.position = position;
  }

  boolean isSorted() {
    return position >= 0;
  }

  FieldKey getKey() {
    return key;
  }

  void setKey(FieldKey key) {
    this.key = key;
  }

  @Nullable
  StronglyConnectedComponent<T> getComponent() {
    return component;
  }

  void setComponent(StronglyConnectedComponent<T> component) {
    this.component = component;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper("Node")
        .add("label", label)
        .add("position", position)
        .toString();
  }
}
