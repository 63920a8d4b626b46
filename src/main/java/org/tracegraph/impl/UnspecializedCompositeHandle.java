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
import static org.tracegraph.UnsupportedTraceException.unsupported;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.tracegraph.host.BuiltinClasses;
import org.tracegraph.host.CompositeObject;
import org.tracegraph.host.DataSlot;
import org.tracegraph.host.HostClass;
import org.tracegraph.host.HostFunction;
import org.tracegraph.source.Guard;
import org.tracegraph.source.GuardKind;
import org.tracegraph.source.Source;

/**
 * A TracedValue for a composite object that is treated like any other user object: its parameters
 * and buffers become inputs of the graph rather than constants baked into it, so one compiled
 * artifact serves every instance of the class.
 *
 * <p>The source of an UnspecializedCompositeHandle is never identity-tracked, so the guards built
 * against it are always installed and check the object's class rather than its identity.
 */
public final class UnspecializedCompositeHandle extends BaseValue {
  private final CompositeObject value;

  public UnspecializedCompositeHandle(
      CompositeObject value, @Nullable Source source, ImmutableSet<Guard> guards) {
    super(guards, untracked(source));
    this.value = checkNotNull(value);
  }

  private static @Nullable Source untracked(@Nullable Source source) {
    return (source != null && source.isTrackedComposite()) ? source.asNotComposite() : source;
  }

  /**
   * Returns a handle for {@code value} that is guarded on the class of the object {@code source}
   * reaches.
   */
  public static UnspecializedCompositeHandle create(
      CompositeObject value, Source source, ImmutableSet<Guard> guards) {
    Source widened = checkNotNull(untracked(source));
    Guard typeMatch = widened.createGuard(GuardKind.TYPE_MATCH);
    return new UnspecializedCompositeHandle(value, widened, Guards.with(guards, typeMatch));
  }

  /** The underlying object. */
  public CompositeObject value() {
    return value;
  }

  /** The class of the underlying object. */
  public HostClass valueType() {
    return value.type();
  }

  @Override
  public String typeName() {
    return value.type().name();
  }

  /** Returns the elements of the underlying object, if it can be iterated. */
  public List<TracedValue> expandIfIterable(TraceContext ctx) {
    if (valueType().lookupFunction("__iter__") == null) {
      throw unsupported("'%s' object is not iterable", valueType());
    } else if (!BuiltinClasses.hasDefaultIteration(valueType())) {
      return ctx.genericUnpack(this);
    }
    Source source = source();
    if (source == null) {
      throw unsupported("cannot unpack %s with no source", valueType());
    }
    ImmutableList<Object> elements = value.elements();
    ImmutableList.Builder<TracedValue> result = ImmutableList.builder();
    for (int i = 0; i < elements.size(); i++) {
      result.add(ctx.wrap(elements.get(i), source.item(i), guards()));
    }
    return result.build();
  }

  /**
   * Traces a call to the underlying object by tracing its {@code forward} method, or its {@code
   * __call__} method if it is lazily initialized.
   */
  public TracedValue invoke(
      TraceContext ctx, List<TracedValue> args, Map<String, TracedValue> kwargs) {
    HostClass cls = valueType();
    HostFunction fn = cls.lookupFunction(cls.isLazy() ? "__call__" : "forward");
    if (fn == null) {
      throw unsupported("'%s' object is not callable", cls);
    }
    FunctionValue function = new FunctionValue(fn, Guards.propagate(this, args, kwargs), null);
    return ctx.inlineCall(function, CompositeHandle.withReceiver(this, args), kwargs);
  }

  /** Traces a call to the method {@code name} of the underlying object. */
  public TracedValue invokeMethod(
      TraceContext ctx, String name, List<TracedValue> args, Map<String, TracedValue> kwargs) {
    if (!value.slots().containsKey(name)) {
      HostFunction method = valueType().lookupFunction(name);
      if (method != null && method == BuiltinClasses.COMPOSITE.lookupFunction("parameters")) {
        return parameters(ctx, args, kwargs);
      } else if (BuiltinClasses.isBaseBehavior(method)) {
        throw unsupported("composite base behavior not supported: %s", name);
      }
    }
    return ctx.genericCallMethod(this, name, args, kwargs);
  }

  private TracedValue parameters(
      TraceContext ctx, List<TracedValue> args, Map<String, TracedValue> kwargs) {
    if (!args.isEmpty() || !kwargs.isEmpty()) {
      throw unsupported("parameters() of %s must be called with no arguments", valueType());
    }
    Source source = source();
    if (source == null) {
      throw unsupported("cannot enumerate parameters of %s with no source", valueType());
    }
    Guard paramNames = source.createGuard(GuardKind.PARAM_NAMES);
    ImmutableSet<Guard> guards = Guards.with(Guards.propagate(this, args, kwargs), paramNames);
    List<TracedValue> items = new ArrayList<>();
    for (Map.Entry<String, DataSlot> param : value.namedParameters("", true, true)) {
      items.add(ctx.wrap(param.getValue(), source.attribute(param.getKey()), guards));
    }
    return new ListIteratorValue(items, guards);
  }

  @Override
  public String toString() {
    return "Unspecialized(" + value + ")";
  }
}
