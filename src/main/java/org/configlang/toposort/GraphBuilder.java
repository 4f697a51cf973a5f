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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.graph.EndpointPair;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Collects the fields of one record and the precedence edges between them, then freezes them into
 * a {@link FieldGraph}.
 *
 * <p>An edge {@code (from, to)} means "emit {@code from} no later than {@code to}, when feasible".
 * Edges are idempotent: adding the same ordered pair twice has no further effect. Self-edges are
 * permitted. No other validation is done.
 *
 * <p>A builder is single-use: once {@link #build()} has been called it rejects further changes.
 */
public final class GraphBuilder<T> {

  private final boolean allowEdges;

  /** Maps labels to nodes, which are in strict 1:1 correspondence. */
  private final Map<T, Node<T>> nodes = new LinkedHashMap<>();

  private final Set<EndpointPair<T>> edges = new HashSet<>();

  private boolean built;

  private GraphBuilder(boolean allowEdges) {
    this.allowEdges = allowEdges;
  }

  /** Returns a builder that records edges. */
  public static <T> GraphBuilder<T> create() {
    return new GraphBuilder<>(true);
  }

  /**
   * Returns a builder that ignores edges. Nodes are still created for both endpoints of every
   * {@link #addEdge} call, so the fields all appear in the result, but since the graph has no
   * edges they are sorted purely by key.
   */
  public static <T> GraphBuilder<T> withoutEdges() {
    return new GraphBuilder<>(false);
  }

  /**
   * Ensures a node labelled {@code label} exists. This is needed for fields which are not
   * connected to any other field.
   *
   * @return true iff the node was not already present.
   */
  public boolean ensureNode(T label) {
    checkNotNull(label, "label");
    boolean modified = !nodes.containsKey(label);
    createNode(label);
    return modified;
  }

  /**
   * Adds a directed edge between the nodes labelled {@code from} and {@code to}, creating them if
   * necessary.
   *
   * @return true iff the edge was not already present (always false for a builder created by
   *     {@link #withoutEdges()}).
   */
  public boolean addEdge(T from, T to) {
    checkNotNull(from, "from");
    checkNotNull(to, "to");
    Node<T> fromNode = createNode(from);
    Node<T> toNode = createNode(to);
    if (!allowEdges || !edges.add(EndpointPair.ordered(from, to))) {
      return false;
    }
    fromNode.addEdge(toNode);
    return true;
  }

  /**
   * Equivalent to {@code addChain(null, chain)}.
   *
   * @return the last label of the chain, or null if it is empty.
   */
  @Nullable
  public T addChain(Iterable<? extends T> chain) {
    return addChain(null, chain);
  }

  /**
   * Adds a run of consecutively declared fields: every label gets a node, and each label gets an
   * edge to the one that follows it. If {@code predecessor} is non-null the chain is linked after
   * it, which is how declaration order carries over from one unified operand to the next.
   *
   * @return the last label of the chain, or {@code predecessor} if the chain is empty.
   */
  @Nullable
  public T addChain(@Nullable T predecessor, Iterable<? extends T> chain) {
    checkNotNull(chain, "chain");
    T previous = predecessor;
    if (previous != null) {
      ensureNode(previous);
    }
    for (T current : chain) {
      if (previous == null) {
        ensureNode(current);
      } else {
        addEdge(previous, current);
      }
      previous = current;
    }
    return previous;
  }

  /** Freezes the nodes and edges added so far into a graph. */
  public FieldGraph<T> build() {
    checkState(!built, "build() has already been called");
    built = true;
    return new FieldGraph<>(nodes);
  }

  /**
   * Find or create a node with the specified label. This is the <i>only</i> factory of Nodes. The
   * null pointer is not a valid label.
   */
  private Node<T> createNode(T label) {
    checkState(!built, "graph has already been built");
    return nodes.computeIfAbsent(label, Node::new);
  }

  @Override
  public String toString() {
    return "GraphBuilder[" + nodes.size() + " nodes, " + edges.size() + " edges]";
  }
}
