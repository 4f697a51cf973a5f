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
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.graph.EndpointPair;
import java.util.Comparator;
import org.junit.jupiter.api.Test;

/** Test for {@link GraphBuilder} and {@link SortOptions}. */
class GraphBuilderTests {

  @Test
  void testEdgesAreIdempotent() {
    GraphBuilder<String> builder = GraphBuilder.create();
    assertThat(builder.addEdge("a", "b")).isTrue();
    assertThat(builder.addEdge("a", "b")).isFalse();
    assertThat(builder.addEdge("b", "a")).isTrue();
    FieldGraph<String> graph = builder.build();
    assertThat(graph.successors("a")).containsExactly("b");
    assertThat(graph.edges())
        .containsExactly(EndpointPair.ordered("a", "b"), EndpointPair.ordered("b", "a"));
  }

  @Test
  void testSelfLoopIsLegal() {
    GraphBuilder<String> builder = GraphBuilder.create();
    assertThat(builder.addEdge("a", "a")).isTrue();
    FieldGraph<String> graph = builder.build();
    assertThat(graph.successors("a")).containsExactly("a");
    assertThat(graph.sort(FieldKey::ofLabel)).containsExactly("a");
  }

  @Test
  void testEnsureNode() {
    GraphBuilder<String> builder = GraphBuilder.create();
    assertThat(builder.ensureNode("a")).isTrue();
    assertThat(builder.ensureNode("a")).isFalse();
    builder.addEdge("b", "c");
    assertThat(builder.ensureNode("c")).isFalse();
    assertThat(builder.build().nodes()).containsExactly("a", "b", "c").inOrder();
  }

  @Test
  void testAddChain() {
    GraphBuilder<String> builder = GraphBuilder.create();
    assertThat(builder.addChain(ImmutableList.of("a", "b", "c"))).isEqualTo("c");
    assertThat(builder.addChain("c", ImmutableList.of())).isEqualTo("c");
    assertThat(builder.addChain(ImmutableList.of())).isNull();
    assertThat(builder.addChain("c", ImmutableList.of("d"))).isEqualTo("d");
    FieldGraph<String> graph = builder.build();
    assertThat(graph.edges())
        .containsExactly(
            EndpointPair.ordered("a", "b"),
            EndpointPair.ordered("b", "c"),
            EndpointPair.ordered("c", "d"));
  }

  @Test
  void testBuilderIsSingleUse() {
    GraphBuilder<String> builder = GraphBuilder.create();
    builder.ensureNode("a");
    builder.build();
    assertThrows(IllegalStateException.class, () -> builder.ensureNode("b"));
    assertThrows(IllegalStateException.class, () -> builder.addEdge("a", "b"));
    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  void testNullLabelsAreRejected() {
    GraphBuilder<String> builder = GraphBuilder.create();
    assertThrows(NullPointerException.class, () -> builder.ensureNode(null));
    assertThrows(NullPointerException.class, () -> builder.addEdge("a", null));
  }

  @Test
  void testEmptyGraphSortsToEmptyList() {
    FieldGraph<String> graph = GraphBuilder.<String>create().build();
    assertThat(graph.stronglyConnectedComponents()).isEmpty();
    assertThat(graph.sort(FieldKey::ofLabel)).isEmpty();
  }

  @Test
  void testSortOptions() {
    SortOptions defaults = SortOptions.defaults();
    assertThat(defaults.cycleResolution()).isEqualTo(CycleResolution.ATOMIC_COMPONENT);
    assertThat(defaults.maxCycleSearchSize()).isEqualTo(SortOptions.DEFAULT_MAX_CYCLE_SEARCH_SIZE);
    assertThat(defaults.toBuilder().build()).isEqualTo(defaults);
    assertThrows(
        IllegalArgumentException.class, () -> SortOptions.builder().setMaxCycleSearchSize(0));
  }

  @Test
  void testChooserWithoutCyclesReturnsNull() {
    Comparator<Node<String>> byKey = Comparator.comparing(Node::getKey);
    CycleChooser<String> chooser = new CycleChooser<>(ImmutableList.of(), byKey);
    assertThat(chooser.choose()).isNull();
  }
}
