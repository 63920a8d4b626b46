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

import com.google.common.collect.ImmutableSet;
import org.jspecify.annotations.Nullable;
import org.tracegraph.source.Guard;
import org.tracegraph.source.Source;

/** A base class for TracedValues, holding their guards and source. */
abstract class BaseValue implements TracedValue {
  private final ImmutableSet<Guard> guards;
  private final @Nullable Source source;

  BaseValue(ImmutableSet<Guard> guards, @Nullable Source source) {
    this.guards = checkNotNull(guards);
    this.source = source;
  }

  @Override
  public ImmutableSet<Guard> guards() {
    return guards;
  }

  @Override
  public @Nullable Source source() {
    return source;
  }
}
