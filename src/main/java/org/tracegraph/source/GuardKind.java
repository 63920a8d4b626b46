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

/** The predicate a {@link Guard} asserts about the value its source reaches. */
public enum GuardKind {
  /** The value is the same object (by identity) as when the artifact was compiled. */
  ID_MATCH,
  /** The value's class is the same class (by identity) as when the artifact was compiled. */
  TYPE_MATCH,
  /**
   * Whether the attribute exists has not changed. The guarded source is always an {@link
   * Source.Attr}, whose member is the attribute name.
   */
  HASATTR,
  /** The value is a composite whose set of parameter names has not changed. */
  PARAM_NAMES
}
