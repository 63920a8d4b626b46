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

/**
 * The container shape of a composite class, determined once from its nearest built-in container
 * ancestor.
 */
public enum ContainerKind {
  /** An ordered container whose default call runs each child in turn. */
  SEQUENTIAL,
  /** An ordered container addressed by integer index (composite lists and parameter lists). */
  INDEXED,
  /** A container addressed by string key (composite dicts and parameter dicts). */
  KEYED,
  /** Not a built-in container. */
  GENERIC;

  /** True for the three ordered container kinds that can be expanded into a sequence. */
  public boolean isSequence() {
    return this == SEQUENTIAL || this == INDEXED;
  }
}
