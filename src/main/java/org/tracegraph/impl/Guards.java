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

import com.google.common.collect.ImmutableSet;
import java.util.Map;
import org.tracegraph.TraceConfig;
import org.tracegraph.source.Guard;

/** A static utility class for combining the guard sets carried by traced values. */
public class Guards {

  private Guards() {}

  /**
   * Returns the union of the guards carried by {@code self}, each of {@code args}, and each value
   * of {@code kwargs}.
   */
  public static ImmutableSet<Guard> propagate(
      TracedValue self,
      Iterable<? extends TracedValue> args,
      Map<String, ? extends TracedValue> kwargs) {
    ImmutableSet.Builder<Guard> result = ImmutableSet.builder();
    result.addAll(self.guards());
    for (TracedValue v : args) {
      result.addAll(v.guards());
    }
    for (TracedValue v : kwargs.values()) {
      result.addAll(v.guards());
    }
    return result.build();
  }

  /** Returns {@code guards} with {@code guard} added. */
  public static ImmutableSet<Guard> with(ImmutableSet<Guard> guards, Guard guard) {
    if (guards.contains(guard)) {
      return guards;
    }
    return ImmutableSet.<Guard>builder().addAll(guards).add(guard).build();
  }

  /** Returns the guards that will be checked at call time under {@code config}. */
  public static ImmutableSet<Guard> installable(ImmutableSet<Guard> guards, TraceConfig config) {
    return guards.stream()
        .filter(g -> g.isInstalled(config))
        .collect(ImmutableSet.toImmutableSet());
  }
}
