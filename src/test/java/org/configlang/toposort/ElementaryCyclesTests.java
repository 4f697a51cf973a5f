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

import static com.google.common.truth.Truth.assertThat;
import static java.util.Comparator.naturalOrder;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Test for {@link StronglyConnectedComponent#elementaryCycles()}. */
class ElementaryCyclesTests {

  @Test
  void testTwoCycle() {
    Chains.forEachPermutation(
        Chains.of("ab", "ba"),
        (permutation, graph) ->
            assertThat(canonicalCycles(graph)).containsExactly(ImmutableList.of("a", "b")));
  }

  @Test
  void testThreeCycle() {
    Chains.forEachPermutation(
        Chains.of("ab", "bc", "ca"),
        (permutation, graph) ->
            assertThat(canonicalCycles(graph)).containsExactly(ImmutableList.of("a", "b", "c")));
  }

  @Test
  void testSingleNodeWithoutSelfLoopHasNoCycle() {
    FieldGraph<String> graph = Chains.build(Chains.of("a"));
    assertThat(canonicalCycles(graph)).isEmpty();
  }

  @Test
  void testSelfLoop() {
    GraphBuilder<String> builder = GraphBuilder.create();
    builder.addEdge("a", "a");
    FieldGraph<String> graph = builder.build();
    assertThat(canonicalCycles(graph)).containsExactly(ImmutableList.of("a"));
  }

  @Test
  void testCyclesSharingANode() {
    Chains.forEachPermutation(
        Chains.of("ab", "ba", "bc", "cb"),
        (permutation, graph) ->
            assertThat(canonicalCycles(graph))
                .containsExactly(ImmutableList.of("a", "b"), ImmutableList.of("b", "c")));
  }

  @Test
  void testNestedCycles() {
    FieldGraph<String> graph = Chains.build(Chains.of("gbc", "ecbd", "dfae", "ahf"));
    assertThat(graph.stronglyConnectedComponents()).hasSize(2);
    assertThat(canonicalCycles(graph))
        .containsExactly(
            ImmutableList.of("a", "e", "c", "b", "d", "f"),
            ImmutableList.of("a", "h", "f"),
            ImmutableList.of("b", "c"));
  }

  @Test
  void testCompleteDigraphOnFourNodes() {
    GraphBuilder<String> builder = GraphBuilder.create();
    List<String> names = ImmutableList.of("a", "b", "c", "d");
    for (String from : names) {
      for (String to : names) {
        if (!from.equals(to)) {
          builder.addEdge(from, to);
        }
      }
    }
    FieldGraph<String> graph = builder.build();
    StronglyConnectedComponent<String> component =
        Iterables.getOnlyElement(graph.stronglyConnectedComponents());

    ImmutableList<Cycle<String>> cycles = component.elementaryCycles();
    assertThat(cycles).hasSize(20);
    assertThat(canonicalCycles(graph)).hasSize(20);

    int[] bySize = new int[5];
    for (Cycle<String> cycle : cycles) {
      assertThat(cycle.nodes()).containsNoDuplicates();
      bySize[cycle.size()]++;
    }
    assertThat(bySize).asList().containsExactly(0, 0, 6, 8, 6).inOrder();
    assertThat(component.elementaryCycles()).isSameInstanceAs(cycles);
  }

  @Test
  void testEveryCycleFollowsEdges() {
    FieldGraph<String> graph = Chains.build(Chains.of("abcd", "dbe", "eca", "ce"));
    for (StronglyConnectedComponent<String> component : graph.stronglyConnectedComponents()) {
      for (Cycle<String> cycle : component.elementaryCycles()) {
        List<String> nodes = cycle.nodes();
        for (int i = 0; i < nodes.size(); i++) {
          String next = nodes.get((i + 1) % nodes.size());
          assertThat(graph.successors(nodes.get(i))).contains(next);
        }
      }
    }
  }

  @Test
  void testCanonicalRotation() {
    FieldGraph<String> graph = Chains.build(Chains.of("cab", "bc"));
    Cycle<String> cycle =
        Iterables.getOnlyElement(
            Iterables.getOnlyElement(graph.stronglyConnectedComponents()).elementaryCycles());
    assertThat(cycle.canonical(naturalOrder())).containsExactly("a", "b", "c").inOrder();
  }

  /** Returns the cycles of every component, each rotated to start at its smallest name. */
  private static ImmutableSet<List<String>> canonicalCycles(FieldGraph<String> graph) {
    ImmutableSet.Builder<List<String>> cycles = ImmutableSet.builder();
    for (StronglyConnectedComponent<String> component : graph.stronglyConnectedComponents()) {
      for (Cycle<String> cycle : component.elementaryCycles()) {
        cycles.add(cycle.canonical(naturalOrder()));
      }
    }
    return cycles.build();
  }
}
