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

import com.google.common.base.MoreObjects;
import java.util.Objects;

/** Immutable settings for {@link FieldGraph#sort(java.util.function.Function, SortOptions)}. */
public final class SortOptions {

  /** The largest component searched for elementary cycles unless configured otherwise. */
  public static final int DEFAULT_MAX_CYCLE_SEARCH_SIZE = 12;

  private static final SortOptions DEFAULTS = builder().build();

  private final CycleResolution cycleResolution;
  private final int maxCycleSearchSize;

  private SortOptions(Builder builder) {
    this.cycleResolution = builder.cycleResolution;
    this.maxCycleSearchSize = builder.maxCycleSearchSize;
  }

  /** Returns options using {@link CycleResolution#ATOMIC_COMPONENT}. */
  public static SortOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  public CycleResolution cycleResolution() {
    return cycleResolution;
  }

  /**
   * Returns the size above which a stuck component is resolved atomically even under {@link
   * CycleResolution#ELEMENTARY_CYCLES}.
   */
  public int maxCycleSearchSize() {
    return maxCycleSearchSize;
  }

  public Builder toBuilder() {
    return new Builder()
        .setCycleResolution(cycleResolution)
        .setMaxCycleSearchSize(maxCycleSearchSize);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof SortOptions)) {
      return false;
    }
    SortOptions that = (SortOptions) obj;
    return cycleResolution == that.cycleResolution && maxCycleSearchSize == that.maxCycleSearchSize;
  }

  @Override
  public int hashCode() {
    return Objects.hash(cycleResolution, maxCycleSearchSize);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("cycleResolution", cycleResolution)
        .add("maxCycleSearchSize", maxCycleSearchSize)
        .toString();
  }

  /** Builder for {@link SortOptions}. */
  public static final class Builder {
    private CycleResolution cycleResolution = CycleResolution.ATOMIC_COMPONENT;
    private int maxCycleSearchSize = DEFAULT_MAX_CYCLE_SEARCH_SIZE;

    private Builder() {}

    public Builder setCycleResolution(CycleResolution cycleResolution) {
      this.cycleResolution = checkNotNull(cycleResolution, "cycleResolution");
      return this;
    }

    public Builder setMaxCycleSearchSize(int maxCycleSearchSize) {
      checkArgument(
          maxCycleSearchSize >= 1, "maxCycleSearchSize must be positive: %s", maxCycleSearchSize);
      this.maxCycleSearchSize = maxCycleSearchSize;
      return this;
    }

    public SortOptions build() {
      return new SortOptions(this);
    }
  }
}
