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

import static org.tracegraph.UnsupportedTraceException.unsupported;

import com.google.common.collect.ImmutableSet;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.tracegraph.source.Guard;
import org.tracegraph.source.Source;

/**
 * A TracedValue is the tracer's symbolic stand-in for a value of the traced program. Every
 * TracedValue carries the set of guards that must hold for it to be valid, and most carry a {@link
 * Source} describing how it was reached from the traced function's inputs.
 *
 * <p>The general value model belongs to the symbolic execution engine; the implementations in this
 * package are the ones the composite-object layer needs to produce.
 */
public interface TracedValue {

  /** The guards this value depends on. */
  ImmutableSet<Guard> guards();

  /** How this value was reached from the traced function's inputs, or null if unknown. */
  @Nullable Source source();

  /** A short description of this value's host type, for diagnostics. */
  String typeName();

  /** True if this value is known at trace time. */
  default boolean isConstant() {
    return false;
  }

  /** Returns the trace-time value; only valid if {@link #isConstant} is true. */
  default @Nullable Object asConstant() {
    throw unsupported("%s is not a constant", typeName());
  }

  /** True if each of {@code args} and each value of {@code kwargs} is a constant. */
  static boolean allConstant(
      Iterable<? extends TracedValue> args, Map<String, ? extends TracedValue> kwargs) {
    for (TracedValue v : args) {
      if (!v.isConstant()) {
        return false;
      }
    }
    return kwargs.values().stream().allMatch(TracedValue::isConstant);
  }
}
