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

import com.google.common.collect.Comparators;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the cycle through which the scheduler enters a component it is stuck in, and the node at
 * which it enters it. Each cycle is handed out at most once.
 *
 * <p>Candidates are ranked by, in order:
 *
 * <ol>
 *   <li>the number of edges that entering the cycle would break: edges into its unscheduled
 *       members from unscheduled nodes outside the cycle;
 *   <li>how early the cycle became reachable: the smallest position of a scheduled predecessor of
 *       one of its unscheduled members, that member being the entry node;
 *   <li>the key of the entry node, which defaults to the smallest member when nothing scheduled
 *       points into the cycle;
 *   <li>the keys of the cycle's members, in order.
 * </ol>
 */
final class CycleChooser<T> {

  private static final Logger logger = LoggerFactory.getLogger(CycleChooser.class);

  private final List<Cycle<T>> unused;

  private final Comparator<Node<T>> nodeOrder;

  private final Comparator<Iterable<Node<T>>> sequenceOrder;

  CycleChooser(List<Cycle<T>> cycles, Comparator<Node<T>> nodeOrder) {
    this.unused = new ArrayList<>(cycles);
    this.nodeOrder = nodeOrder;
    this.sequenceOrder = Comparators.lexicographical(nodeOrder);
  }

  /**
   * Removes the best remaining cycle from the pool and returns it, rotated to start at its entry
   * node; returns null if every cycle has been used.
   */
  @Nullable
  Cycle<T> choose() {
    Candidate<T> best = null;
    for (Cycle<T> cycle : unused) {
      Candidate<T> candidate = evaluate(cycle);
      logger.debug(
          "{}: {} broken edges, enabled since {}, entry {}",
          cycle,
          candidate.brokenEdges,
          candidate.enabledSince,
          candidate.entry.getLabel());
      if (best == null || isBetter(candidate, best)) {
        best = candidate;
      }
    }
    if (best == null) {
      return null;
    }
    unused.remove(best.cycle);
    // The component's cycles are shared with callers of elementaryCycles(); rotate a copy.
    Cycle<T> chosen = new Cycle<>(best.cycle.members());
    chosen.rotateToStartAt(best.entry);
    logger.debug("Chose {}, entering at {}", chosen, best.entry.getLabel());
    return chosen;
  }

  private Candidate<T> evaluate(Cycle<T> cycle) {
    int brokenEdges = 0;
    int enabledSince = Integer.MAX_VALUE;
    Node<T> entry = null;
    for (Node<T> member : cycle.members()) {
      if (member.isSorted()) {
        continue;
      }
      for (Node<T> required : member.getPredecessors()) {
        if (!required.isSorted()) {
          if (!cycle.contains(required)) {
            brokenEdges++;
          }
        } else if (required.getPosition() < enabledSince) {
          enabledSince = required.getPosition();
          entry = member;
        }
      }
    }
    if (entry == null) {
      entry = Collections.min(cycle.members(), nodeOrder);
    }
    return new Candidate<>(cycle, entry, enabledSince, brokenEdges);
  }

  private boolean isBetter(Candidate<T> candidate, Candidate<T> best) {
    if (candidate.brokenEdges != best.brokenEdges) {
      return candidate.brokenEdges < best.brokenEdges;
    }
    if (candidate.enabledSince != best.enabledSince) {
      return candidate.enabledSince < best.enabledSince;
    }
    int entryComparison = nodeOrder.compare(candidate.entry, best.entry);
    if (entryComparison != 0) {
      return entryComparison < 0;
    }
    return sequenceOrder.compare(candidate.cycle.members(), best.cycle.members()) < 0;
  }

  private static final class Candidate<T> {
    final Cycle<T> cycle;
    final Node<T> entry;
    final int enabledSince;
    final int brokenEdges;

    Candidate(Cycle<T> cycle, Node<T> entry, int enabledSince, int brokenEdges) {
      this.cycle = cycle;
      this.entry = entry;
      this.enabledSince = enabledSince;
      this.brokenEdges = brokenEdges;
    }
  }
}
