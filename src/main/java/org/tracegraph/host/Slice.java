/*
 * Copyright 2025 The Retrospect Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tracegraph.host;

import static org.tracegraph.UnsupportedTraceException.unsupported;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * A constant {@code [start:stop:step]} slice. Any of the three bounds may be omitted (null), with
 * the host's meaning.
 */
public record Slice(@Nullable Integer start, @Nullable Integer stop, @Nullable Integer step) {

  /** Equivalent to {@code [start:stop]}. */
  public static Slice of(@Nullable Integer start, @Nullable Integer stop) {
    return new Slice(start, stop, null);
  }

  /**
   * Returns the indices this slice selects from a sequence of the given length, in the order they
   * are selected.
   */
  public ImmutableList<Integer> indices(int length) {
    int step = (this.step == null) ? 1 : this.step;
    if (step == 0) {
      throw unsupported("slice step cannot be zero");
    }
    int lower = (step < 0) ? -1 : 0;
    int upper = (step < 0) ? length - 1 : length;
    int first = (start == null) ? (step < 0 ? upper : lower) : clamp(start, length, lower, upper);
    int end = (stop == null) ? (step < 0 ? lower : upper) : clamp(stop, length, lower, upper);
    // Computed in long so that a large step can't overflow past the end.
    long count;
    if (step > 0) {
      count = (first < end) ? ((long) end - first - 1) / step + 1 : 0;
    } else {
      count = (first > end) ? ((long) first - end - 1) / -(long) step + 1 : 0;
    }
    ImmutableList.Builder<Integer> result = ImmutableList.builderWithExpectedSize((int) count);
    for (long i = 0; i < count; i++) {
      result.add((int) (first + i * step));
    }
    return result.build();
  }

  private static int clamp(int bound, int length, int lower, int upper) {
    if (bound < 0) {
      bound += length;
      return Math.max(bound, lower);
    }
    return Math.min(bound, upper);
  }

  @Override
  public String toString() {
    return String.format(
        "slice(%s, %s, %s)",
        start == null ? "None" : start,
        stop == null ? "None" : stop,
        step == null ? "None" : step);
  }
}
