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
import org.tracegraph.source.Guard;
import org.tracegraph.source.Source;

/**
 * A table of the composites and data slots referenced by the graph being built, owned by the
 * output graph. The registry is the only owner of a composite's identity within a trace: handles
 * hold only a key into it, and fetch the live object through {@link #getSubmodule} whenever they
 * need it.
 *
 * <p>Entries are created on first reference and discarded along with the trace.
 */
public interface SubmoduleRegistry {

  /** Returns the live object registered under {@code key}. */
  Object getSubmodule(String key);

  /**
   * Returns a TracedValue for {@code value}, a child of the object registered under {@code
   * ownerKey}, registering it under a key derived from {@code ownerKey} and {@code childKey} if it
   * has not already been registered.
   */
  TracedValue addSubmodule(
      Object value, String ownerKey, Object childKey, Source source, ImmutableSet<Guard> guards);

  /**
   * Returns a TracedValue for {@code value}, reached from the traced program's state by {@code
   * source}, registering it under a key derived from {@code name}. A composite registered this way
   * is guarded by identity.
   */
  TracedValue registerAttribute(
      Object value, String name, Source source, ImmutableSet<Guard> guards);
}
