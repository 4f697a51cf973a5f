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

import com.google.common.collect.Collections2;
import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * Builds graphs from precedence chains, the way a record's declarations are fed to a {@link
 * GraphBuilder}: each chain is a run of consecutively declared fields.
 */
final class Chains {

  private Chains() {}

  static List<List<String>> of(String... chains) {
    ImmutableList.Builder<List<String>> result = ImmutableList.builder();
    for (String chain : chains) {
      result.add(ImmutableList.copyOf(chain.split("")));
    }
    return result.build();
  }

  static FieldGraph<String> build(List<List<String>> chains) {
    GraphBuilder<String> builder = GraphBuilder.create();
    for (List<String> chain : chains) {
      builder.addChain(chain);
    }
    return builder.build();
  }

  /** Calls {@code test} with a fresh graph for every order in which the chains can be inserted. */
  static void forEachPermutation(
      List<List<String>> chains, BiConsumer<List<List<String>>, FieldGraph<String>> test) {
    Collection<List<List<String>>> permutations = Collections2.permutations(chains);
    for (List<List<String>> permutation : permutations) {
      test.accept(permutation, build(permutation));
    }
  }
}
