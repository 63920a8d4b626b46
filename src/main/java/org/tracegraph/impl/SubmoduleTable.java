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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static org.tracegraph.UnsupportedTraceException.unsupported;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.tracegraph.host.CompositeObject;
import org.tracegraph.host.DataSlot;
import org.tracegraph.source.Guard;
import org.tracegraph.source.GuardKind;
import org.tracegraph.source.Source;

/**
 * An in-memory {@link SubmoduleRegistry} for a single trace.
 *
 * <p>Keys are built by joining the names they are derived from with {@code "_"} and replacing
 * every character other than an ASCII letter or digit with {@code "_"}; if that key is already in
 * use by a different object a numeric suffix is added. Registering an object that is already in the
 * table returns a handle with its existing key.
 *
 * <p>Composites that have been tagged in the {@link GenerationTracker} are never entered in the
 * table; they are returned as {@link UnspecializedCompositeHandle}s.
 */
public final class SubmoduleTable implements SubmoduleRegistry {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final CharMatcher LETTERS =
      CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z'));

  private static final CharMatcher KEY_CHARS = LETTERS.or(CharMatcher.inRange('0', '9'));

  private final GenerationTracker generations;
  private final GraphEmitter graph;

  private final Map<String, Object> entries = new LinkedHashMap<>();
  private final Map<Object, String> keys = new IdentityHashMap<>();

  public SubmoduleTable(GenerationTracker generations, GraphEmitter graph) {
    this.generations = checkNotNull(generations);
    this.graph = checkNotNull(graph);
  }

  @Override
  public Object getSubmodule(String key) {
    Object result = entries.get(key);
    checkArgument(result != null, "No submodule registered as %s", key);
    return result;
  }

  /** The registered keys and objects, in registration order. */
  public ImmutableMap<String, Object> entries() {
    return ImmutableMap.copyOf(entries);
  }

  @Override
  public TracedValue addSubmodule(
      Object value, String ownerKey, Object childKey, Source source, ImmutableSet<Guard> guards) {
    return register(value, ownerKey + "_" + childKey, source, guards);
  }

  @Override
  public TracedValue registerAttribute(
      Object value, String name, Source source, ImmutableSet<Guard> guards) {
    if (value instanceof CompositeObject obj && !generations.isTagged(obj)) {
      guards = Guards.with(guards, source.asComposite().createGuard(GuardKind.ID_MATCH));
    }
    return register(value, name, source, guards);
  }

  private TracedValue register(
      Object value, String name, Source source, ImmutableSet<Guard> guards) {
    if (value instanceof CompositeObject obj) {
      if (generations.isTagged(obj)) {
        return UnspecializedCompositeHandle.create(obj, source, guards);
      }
      return new CompositeHandle(obj.type(), keyFor(obj, name), source.asComposite(), guards);
    } else if (value instanceof DataSlot slot) {
      NodeRef node =
          graph.emitGraphNode(
              NodeKind.GET_ATTR, keyFor(slot, name), ImmutableList.of(), ImmutableMap.of());
      return new TensorValue(node, guards, source);
    }
    throw unsupported(
        "cannot register %s as a submodule (%s)",
        (value == null) ? "None" : value.getClass().getSimpleName(),
        source.name());
  }

  /** Returns the key {@code value} is registered under, registering it if necessary. */
  private String keyFor(Object value, String name) {
    String existing = keys.get(value);
    if (existing != null) {
      return existing;
    }
    String base = KEY_CHARS.negate().replaceFrom(name, '_');
    if (base.isEmpty() || !LETTERS.matches(base.charAt(0))) {
      base = "sub" + base;
    }
    String key = base;
    for (int i = 0; entries.containsKey(key); i++) {
      key = base + "_" + i;
    }
    entries.put(key, value);
    keys.put(value, key);
    logger.atFine().log("Registered %s as %s", value, key);
    return key;
  }
}
