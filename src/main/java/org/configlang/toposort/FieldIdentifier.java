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

import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;
import java.util.Objects;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Names one field of a record: either a non-negative list index or a text label.
 *
 * <p>Equality is exact. Identifiers carry no order of their own; the order used for tie-breaking
 * is that of their {@link #key() keys}, so {@code FieldIdentifier::key} is the usual {@code nameOf}
 * function passed to {@link FieldGraph#sort}.
 */
public final class FieldIdentifier {

  private static final Pattern IDENTIFIER = Pattern.compile("[#_$]*[A-Za-z_$][A-Za-z0-9_$]*");

  private static final Escaper QUOTE_ESCAPER =
      Escapers.builder()
          .addEscape('"', "\\\"")
          .addEscape('\\', "\\\\")
          .addEscape('\n', "\\n")
          .addEscape('\t', "\\t")
          .build();

  private final long index;
  @Nullable private final String label;

  private FieldIdentifier(long index, @Nullable String label) {
    this.index = index;
    this.label = label;
  }

  public static FieldIdentifier index(long index) {
    checkArgument(index >= 0, "index must be non-negative: %s", index);
    return new FieldIdentifier(index, null);
  }

  public static FieldIdentifier label(String label) {
    checkNotNull(label, "label");
    checkArgument(!label.isEmpty(), "label must not be empty");
    return new FieldIdentifier(-1, label);
  }

  public boolean isIndex() {
    return label == null;
  }

  /** Returns the raw, unquoted label, or the decimal index. */
  public String rawString() {
    return isIndex() ? Long.toString(index) : label;
  }

  public FieldKey key() {
    return isIndex() ? FieldKey.ofIndex(index) : FieldKey.ofLabel(label);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof FieldIdentifier)) {
      return false;
    }
    FieldIdentifier that = (FieldIdentifier) obj;
    return index == that.index && Objects.equals(label, that.label);
  }

  @Override
  public int hashCode() {
    return Objects.hash(index, label);
  }

  /**
   * Returns the selector form of this identifier: {@code 3}, {@code name}, or {@code "runs-on"}
   * for labels that are not valid identifiers. Useful for debugging, not for comparisons.
   */
  @Override
  public String toString() {
    if (isIndex()) {
      return Long.toString(index);
    }
    if (IDENTIFIER.matcher(label).matches()) {
      return label;
    }
    return '"' + QUOTE_ESCAPER.escape(label) + '"';
  }
}
