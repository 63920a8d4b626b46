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
import org.jspecify.annotations.Nullable;
import org.tracegraph.source.Guard;

/** A value known at trace time: a boolean, number, string, {@link org.tracegraph.host.Slice}... */
public final class ConstantValue extends BaseValue {
  private final @Nullable Object value;

  public ConstantValue(@Nullable Object value, ImmutableSet<Guard> guards) {
    super(guards, null);
    this.value = value;
  }

  /** Returns a ConstantValue that depends on no guards. */
  public static ConstantValue of(@Nullable Object value) {
    return new ConstantValue(value, ImmutableSet.of());
  }

  @Override
  public boolean isConstant() {
    return true;
  }

  @Override
  public @Nullable Object asConstant() {
    return value;
  }

  @Override
  public String typeName() {
    return (value == null) ? "None" : value.getClass().getSimpleName();
  }

  @Override
  public String toString() {
    return "Constant(" + value + ")";
  }
}
