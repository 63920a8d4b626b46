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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;

/**
 * A tensor-like datum held by a composite object, either as a parameter or as a buffer. The tracer
 * only needs its identity and shape; DataSlots are compared by identity, so the same DataSlot
 * reachable by two paths is recognized as a single datum.
 */
public final class DataSlot {
  private final String label;
  private final ImmutableList<Integer> shape;

  public DataSlot(String label, Integer... shape) {
    this.label = checkNotNull(label);
    this.shape = ImmutableList.copyOf(shape);
  }

  public String label() {
    return label;
  }

  public ImmutableList<Integer> shape() {
    return shape;
  }

  @Override
  public String toString() {
    return label + shape;
  }
}
