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

package org.tracegraph;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Options that control tracing. TraceConfigs are immutable; use the {@code with} methods to derive
 * a modified copy of {@link #DEFAULT}.
 */
public final class TraceConfig {

  public static final TraceConfig DEFAULT = new TraceConfig(false, 8);

  private final boolean guardCompositeObjects;
  private final int maxRestarts;

  private TraceConfig(boolean guardCompositeObjects, int maxRestarts) {
    checkArgument(maxRestarts >= 0);
    this.guardCompositeObjects = guardCompositeObjects;
    this.maxRestarts = maxRestarts;
  }

  /**
   * If false (the default), guards on identity-tracked composites are not checked at call time;
   * the composites are assumed not to change between calls. Guards on other values (including
   * composites that have been unspecialized) are always checked.
   */
  public boolean guardCompositeObjects() {
    return guardCompositeObjects;
  }

  /** The number of times a single compilation may be restarted before it is abandoned. */
  public int maxRestarts() {
    return maxRestarts;
  }

  public TraceConfig withGuardCompositeObjects(boolean guardCompositeObjects) {
    return new TraceConfig(guardCompositeObjects, maxRestarts);
  }

  public TraceConfig withMaxRestarts(int maxRestarts) {
    return new TraceConfig(guardCompositeObjects, maxRestarts);
  }

  @Override
  public String toString() {
    return String.format(
        "TraceConfig(guardCompositeObjects=%s, maxRestarts=%s)",
        guardCompositeObjects,
        maxRestarts);
  }
}
