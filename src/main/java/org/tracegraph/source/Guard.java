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

package org.tracegraph.source;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import org.tracegraph.TraceConfig;

/**
 * A predicate over the value a {@link Source} reaches, checked before a cached compiled artifact is
 * reused. Guards are immutable and compare structurally, so adding the same Guard to a set twice
 * has no effect.
 */
public record Guard(Source source, GuardKind kind) {

  public Guard {
    checkNotNull(source);
    checkNotNull(kind);
  }

  /** For a {@link GuardKind#HASATTR} guard, the name of the attribute whose presence is checked. */
  public String attributeName() {
    Source s = source;
    if (s instanceof Source.Composite c) {
      s = c.base();
    } else if (s instanceof Source.NotComposite n) {
      s = n.base();
    }
    checkState(
        kind == GuardKind.HASATTR && s instanceof Source.Attr, "Not a HASATTR guard: %s", this);
    return ((Source.Attr) s).member();
  }

  /**
   * True if this guard should be checked at call time. Guards on identity-tracked composites are
   * only checked if {@link TraceConfig#guardCompositeObjects} is set.
   */
  public boolean isInstalled(TraceConfig config) {
    return config.guardCompositeObjects() || !source.isTrackedComposite();
  }

  @Override
  public String toString() {
    return kind + "(" + source.name() + ")";
  }
}
