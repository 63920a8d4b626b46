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

/**
 * Where the root of a {@link Source} lives, and whether the value it reaches is a composite object
 * under identity tracking.
 */
public enum GuardSource {
  LOCAL,
  GLOBAL,
  LOCAL_COMPOSITE,
  GLOBAL_COMPOSITE;

  /** True if values reached from this source are composites under identity tracking. */
  public boolean isComposite() {
    return this == LOCAL_COMPOSITE || this == GLOBAL_COMPOSITE;
  }

  public boolean isLocal() {
    return this == LOCAL || this == LOCAL_COMPOSITE;
  }

  /** Returns the identity-tracked variant of this GuardSource. */
  public GuardSource asComposite() {
    return isLocal() ? LOCAL_COMPOSITE : GLOBAL_COMPOSITE;
  }

  /** Returns the variant of this GuardSource that is not identity-tracked. */
  public GuardSource asPlain() {
    return isLocal() ? LOCAL : GLOBAL;
  }
}
