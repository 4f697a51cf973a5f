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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.graph.AbstractGraph;
import com.google.common.graph.ElementOrder;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code FieldGraph} is the frozen precedence graph of the fields of one record, as produced by a
 * {@link GraphBuilder}. An edge {@code (u, v)} asks for field {@code u} to be emitted no later than
 * field {@code v}.
 *
 * <p>The graph is read-only and is exposed as a Guava {@link com.google.common.graph.Graph}, so the
 * utilities in {@link com.google.common.graph.Graphs} apply to it. It permits self-edges but does
 * not represent multiple edges between the same pair of nodes. Nodes are reported in the order in
 * which they were first added to the builder.
 *
 * <p>Some invariants:
 *
 * <ul>
 *   <li>A graph is single-use: {@link #sort} records positions on the graph's nodes, so it may be
 *       called at most once. Build a fresh graph for every record to be ordered.
 *   <li>{@code FieldGraph} assumes immutability of node labels, much like {@link HashMap} assumes
 *       it for keys.
 *   <li>Instances are not thread-safe. Independent graphs share no state and may be used on
 *       different threads.
 * </ul>
 */
public final class FieldGraph<T> extends AbstractGraph<T> {

  private static final Logger logger = LoggerFactory.getLogger(FieldGraph.class);

  /** Maps labels to nodes, which are in strict 1:1 correspondence. */
  private final ImmutableMap<T, Node<T>> nodes;

  @Nullable private ImmutableList<StronglyConnectedComponent<T>> components;

  private boolean sorted;

  FieldGraph(Map<T, Node<T>> nodes) {
    this.nodes = ImmutableMap.copyOf(nodes);
  }

  @Override
  public Set<T> nodes() {
    return nodes.keySet();
  }

  @Override
  public Set<T> adjacentNodes(T node) {
    return Sets.union(predecessors(node), successors(node));
  }

  @Override
  public Set<T> predecessors(T node) {
    return labels(getNode(node).getPredecessors());
  }

  @Override
  public Set<T> successors(T node) {
    return labels(getNode(node).getSuccessors());
  }

  @Override
  public boolean isDirected() {
    return true;
  }

  @Override
  public boolean allowsSelfLoops() {
    return true;
  }

  @Override
  public ElementOrder<T> nodeOrder() {
    return ElementOrder.insertion();
  }

  @Override
  public String toString() {
    return "FieldGraph[" + nodes.size() + " nodes]";
  }

  /**
   * Finds and returns the node with the specified label.
   *
   * @throws IllegalArgumentException if no node was found with the specified label.
   */
  private Node<T> getNode(T label) {
    Node<T> node = nodes.get(checkNotNull(label, "node"));
    checkArgument(node != null, "No such node label: %s", label);
    return node;
  }

  private static <T> ImmutableSet<T> labels(List<Node<T>> nodes) {
    ImmutableSet.Builder<T> labels = ImmutableSet.builderWithExpectedSize(nodes.size());
    for (Node<T> node : nodes) {
      labels.add(node.getLabel());
    }
    return labels.build();
  }

  // *** Graph Algorithms ***

  /**
   * Returns a partition of the nodes of this graph into strongly-connected components, in a
   * topological order of the condensation graph: if any edge leads from a node of component X to a
   * node of component Y (X != Y) then X precedes Y in the returned list.
   *
   * <p>The result is computed once and cached.
   */
  public ImmutableList<StronglyConnectedComponent<T>> stronglyConnectedComponents() {
    if (components == null) {
      List<StronglyConnectedComponent<T>> postorder = new ArrayList<>();
      SccVisitor visitor = new SccVisitor();
      for (Node<T> node : nodes.values()) {
        visitor.visit(postorder::add, node);
      }
      // The visitor emits each component after every component reachable from it.
      Collections.reverse(postorder);
      linkComponents();
      components = ImmutableList.copyOf(postorder);
      logger.debug("{} has {} strongly connected components", this, components.size());
    }
    return components;
  }

  /** Records the edges of the condensation graph on the components. */
  private void linkComponents() {
    for (Node<T> from : nodes.values()) {
      for (Node<T> to : from.getSuccessors()) {
        if (from.getComponent() != to.getComponent()) {
          from.getComponent().addSuccessor(to.getComponent());
        }
      }
    }
  }

  /**
   * Returns every field of this graph exactly once, in an order that respects the edges wherever
   * the graph allows it, using {@link SortOptions#defaults() the default options}.
   *
   * @param nameOf maps each label to the key used to break ties; it never affects which orders are
   *     considered valid.
   * @throws IllegalStateException if this graph has already been sorted.
   */
  public ImmutableList<T> sort(Function<? super T, FieldKey> nameOf) {
    return sort(nameOf, SortOptions.defaults());
  }

  /**
   * Returns every field of this graph exactly once. If the graph is acyclic the result is a
   * topological order; whenever several fields could come next, the one with the smallest key is
   * chosen. How cycles are broken is governed by {@link SortOptions#cycleResolution()}.
   *
   * @throws IllegalStateException if this graph has already been sorted.
   */
  public ImmutableList<T> sort(Function<? super T, FieldKey> nameOf, SortOptions options) {
    checkNotNull(nameOf, "nameOf");
    checkNotNull(options, "options");
    checkState(!sorted, "%s has already been sorted; build a new graph", this);
    sorted = true;
    for (Node<T> node : nodes.values()) {
      node.setKey(checkNotNull(nameOf.apply(node.getLabel()), "no key for %s", node.getLabel()));
    }
    return new Scheduler<>(stronglyConnectedComponents(), options).sort();
  }

  @FunctionalInterface
  private interface ComponentReceiver<T> {
    void accept(StronglyConnectedComponent<T> component);
  }

  /**
   * Find strongly connected components using path-based strong component algorithm. This has the
   * advantage of returning the components in postorder.
   *
   * <p>We visit nodes depth-first, keeping track of the order that we visit them in (preorder). Our
   * goal is to find the smallest node (in this preorder of visitation) reachable from a given node.
   * We keep track of the smallest node pointed to so far at the top of a stack. If we ever find an
   * already-visited node, then if it is not already part of a component, we pop nodes from that
   * stack until we reach this already-visited node's number or an even smaller one.
   *
   * <p>Once the depth-first visitation of a node is complete, if this node's number is at the top
   * of the stack, then it is the "first" element visited in its strongly connected component. Hence
   * we pop all elements that were pushed onto the visitation stack and put them in a strongly
   * connected component with this one, then hand the component to a {@link ComponentReceiver}.
   */
  private class SccVisitor {

    // The order each node was visited in.
    private final Map<Node<T>, Integer> preorder = new HashMap<>();

    // Stack of all nodes visited whose SCC has not yet been determined. When an SCC is found,
    // that SCC is an initial segment of this stack, and is popped off.
    private final List<Node<T>> stack = new ArrayList<>();

    // Stack of visited indices for the first-visited nodes in each of their known-so-far
    // strongly connected components. See the class comment.
    private final List<Integer> preorderStack = new ArrayList<>();

    private int counter = 0;

    private void visit(ComponentReceiver<T> receiver, Node<T> root) {
      if (preorder.containsKey(root)) {
        // A previous top-level visit already reached this node.
        return;
      }
      // Explicit frames keep the Java stack flat however long the paths get.
      Deque<Frame<T>> frames = new ArrayDeque<>();
      frames.push(enter(root));
      while (!frames.isEmpty()) {
        Frame<T> frame = frames.peek();
        if (frame.successors.hasNext()) {
          Node<T> succ = frame.successors.next();
          Integer succPreorder = preorder.get(succ);
          if (succPreorder == null) {
            frames.push(enter(succ));
          } else if (succ.getComponent() == null) {
            // succ is visited but unassigned, so it is in the same SCC as frame.node.
            while (preorderStack.get(preorderStack.size() - 1) > succPreorder) {
              preorderStack.remove(preorderStack.size() - 1);
            }
          }
          continue;
        }
        frames.pop();
        if (frame.preorderLength == preorderStack.size()) {
          // No earlier-visited node of this node's component was found below it, so it is the
          // first-visited element of its component.
          preorderStack.remove(preorderStack.size() - 1);
          StronglyConnectedComponent<T> scc = new StronglyConnectedComponent<>();
          Node<T> compNode;
          do {
            compNode = stack.remove(stack.size() - 1);
            scc.addMember(compNode);
          } while (compNode != frame.node);
          receiver.accept(scc);
        }
      }
    }

    private Frame<T> enter(Node<T> node) {
      preorder.put(node, counter);
      stack.add(node);
      preorderStack.add(counter++);
      return new Frame<>(node, preorderStack.size());
    }
  }

  /** A node whose successors are still being visited. */
  private static final class Frame<T> {
    final Node<T> node;
    final Iterator<Node<T>> successors;
    final int preorderLength;

    Frame(Node<T> node, int preorderLength) {
      this.node = node;
      this.successors = node.getSuccessors().iterator();
      this.preorderLength = preorderLength;
    }
  }
}
