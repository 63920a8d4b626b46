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

package org.tracegraph.impl;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.MapMaker;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.concurrent.ConcurrentMap;

/**
 * Records which composite objects must not be identity-specialized. Once an object has been
 * tagged, every later reference to it (in this trace after a restart, or in any other trace) is
 * built as an {@link UnspecializedCompositeHandle}.
 *
 * <p>Objects are keyed by identity and held weakly, so tagging an object does not keep it alive.
 * Tags persist until {@link #clear} is called; nothing in the tracer calls it.
 */
public final class GenerationTracker {

  private static final GenerationTracker GLOBAL = new GenerationTracker();

  // MapMaker's weak keys are compared by identity.
  private final ConcurrentMap<Object, Boolean> tagged = new MapMaker().weakKeys().makeMap();

  /** The tracker shared by all traces in this process. */
  public static GenerationTracker global() {
    return GLOBAL;
  }

  /** Creates a tracker independent of {@link #global}; intended for tests. */
  public GenerationTracker() {}

  /** Tags {@code obj}; returns false if it was already tagged. */
  @CanIgnoreReturnValue
  public boolean tag(Object obj) {
    return tagged.put(checkNotNull(obj), Boolean.TRUE) == null;
  }

  public boolean isTagged(Object obj) {
    return tagged.containsKey(obj);
  }

  /** The number of live tagged objects. */
  public int size() {
    return tagged.size();
  }

  /** Forgets all tags. */
  public void clear() {
    tagged.clear();
  }
}
