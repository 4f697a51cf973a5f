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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.primitives.UnsignedBytes;
import java.util.Arrays;
import java.util.Comparator;
import javax.annotation.Nullable;

/**
 * The comparison key of a field label, used only to break ties deterministically.
 *
 * <p>Keys are totally ordered: index keys sort before text keys; index keys compare by numeric
 * value; text keys compare by their raw (unescaped) UTF-8 bytes, treated as unsigned.
 */
public final class FieldKey implements Comparable<FieldKey> {

  private static final Comparator<byte[]> RAW_ORDER = UnsignedBytes.lexicographicalComparator();

  private final long index;

  // Null for index keys.
  @Nullable private final byte[] raw;

  private FieldKey(long index, @Nullable byte[] raw) {
    this.index = index;
    this.raw = raw;
  }

  /** Returns the key of a positional (list) index. */
  public static FieldKey ofIndex(long index) {
    checkArgument(index >= 0, "index must be non-negative: %s", index);
    return new FieldKey(index, null);
  }

  /** Returns the key of a text label, compared by its raw unescaped content. */
  public static FieldKey ofLabel(String rawLabel) {
    checkNotNull(rawLabel, "rawLabel");
    return new FieldKey(-1, rawLabel.getBytes(UTF_8));
  }

  public boolean isIndex() {
    return raw == null;
  }

  @Override
  public int compareTo(FieldKey that) {
    if (this.isIndex() && that.isIndex()) {
      return Long.compare(this.index, that.index);
    }
    if (this.isIndex()) {
      return -1;
    }
    if (that.isIndex()) {
      return 1;
    }
    return RAW_ORDER.compare(this.raw, that.raw);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof FieldKey)) {
      return false;
    }
    FieldKey that = (FieldKey) obj;
    return index == that.index && Arrays.equals(raw, that.raw);
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(index) + Arrays.hashCode(raw);
  }

  @Override
  public String toString() {
    return isIndex() ? Long.toString(index) : new String(raw, UTF_8);
  }
}
