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

/** How {@link FieldGraph#sort} proceeds when every remaining field of a component is on a cycle. */
public enum CycleResolution {

  /**
   * Emits all remaining fields of the stuck component together, in key order. Cheap, and the
   * default: real cyclic components are almost always small.
   */
  ATOMIC_COMPONENT,

  /**
   * Enumerates the elementary cycles of the stuck component and enters the cycle that breaks the
   * fewest edges, at the node that became reachable earliest. This keeps as much of the partial
   * order inside the component as possible, at a cost that can grow factorially with the size of
   * the component; see {@link SortOptions#maxCycleSearchSize()}.
   */
  ELEMENTARY_CYCLES
}
