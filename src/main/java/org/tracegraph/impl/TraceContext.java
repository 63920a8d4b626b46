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
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.tracegraph.TraceConfig;
import org.tracegraph.host.HostClass;
import org.tracegraph.source.Guard;
import org.tracegraph.source.Source;

/**
 * The symbolic execution engine, as seen by the composite-object layer. One TraceContext exists
 * for each attempt at tracing a function; if the attempt is restarted everything reachable from its
 * TraceContext (including its {@link #registry}) is discarded.
 */
public interface TraceContext extends GraphEmitter {

  /** The registry of composites and data slots referenced by the graph being built. */
  SubmoduleRegistry registry();

  /** The options for the current compilation. */
  TraceConfig config();

  /** The process-wide record of composites that must not be identity-specialized. */
  GenerationTracker generations();

  /** Traces a call to {@code fn} by inlining it, and returns the traced result. */
  TracedValue inlineCall(TracedValue fn, List<TracedValue> args, Map<String, TracedValue> kwargs);

  /**
   * Traces a call to {@code fn} as though the traced program had made it, pushing the result on
   * the engine's value stack (see {@link #popLastResult}).
   */
  void callFunction(TracedValue fn, List<TracedValue> args, Map<String, TracedValue> kwargs);

  /** Pops the result pushed by the most recent {@link #callFunction}. */
  TracedValue popLastResult();

  /**
   * Builds the appropriate TracedValue for a value read from the traced program's state, reached
   * by {@code source}.
   */
  TracedValue wrap(@Nullable Object value, Source source, ImmutableSet<Guard> guards);

  /** Traces a method call on {@code receiver} using the engine's generic object model. */
  TracedValue genericCallMethod(
      TracedValue receiver, String name, List<TracedValue> args, Map<String, TracedValue> kwargs);

  /** Expands {@code value} into its elements using the engine's generic object model. */
  List<TracedValue> genericUnpack(TracedValue value);

  /**
   * True if calls to instances of {@code cls} should be recorded as single graph nodes rather than
   * traced through.
   */
  boolean isPrimitiveTraceable(HostClass cls);

  /** True if functions defined in {@code sourceFile} are trusted to be inlined. */
  boolean isInlineAllowed(String sourceFile);
}
