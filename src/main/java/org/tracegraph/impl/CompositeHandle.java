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
import static com.google.common.flogger.LazyArgs.lazy;
import static org.tracegraph.UnsupportedTraceException.unsupported;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.tracegraph.RestartAnalysis;
import org.tracegraph.host.BuiltinClasses;
import org.tracegraph.host.ClassMember;
import org.tracegraph.host.CompositeObject;
import org.tracegraph.host.HostClass;
import org.tracegraph.host.HostFunction;
import org.tracegraph.host.Signature;
import org.tracegraph.host.Slice;
import org.tracegraph.source.Guard;
import org.tracegraph.source.GuardKind;
import org.tracegraph.source.Source;
import org.tracegraph.util.StringUtil;

/**
 * A TracedValue for a composite object that is baked into the graph by identity, so that the
 * compiled artifact is specific to this instance.
 *
 * <p>A CompositeHandle does not hold the object itself, only the key it was registered under; every
 * operation fetches the live object from {@link TraceContext#registry}. A CompositeHandle always
 * has a source.
 *
 * <p>If tracing discovers that the object cannot be specialized, {@link #forceUnspecialize} tags it
 * and abandons the trace; on the next attempt the registry returns an {@link
 * UnspecializedCompositeHandle} for it instead.
 */
public final class CompositeHandle extends BaseValue {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

  /** Changes when a lazily-initialized composite is first called. */
  private HostClass type;

  private final String key;

  public CompositeHandle(HostClass type, String key, Source source, ImmutableSet<Guard> guards) {
    super(guards, checkNotNull(source));
    this.type = checkNotNull(type);
    this.key = checkNotNull(key);
  }

  /** The class of the underlying object. */
  public HostClass typeOf() {
    return type;
  }

  /** The key the underlying object is registered under. */
  public String key() {
    return key;
  }

  @Override
  public Source source() {
    return checkNotNull(super.source());
  }

  @Override
  public String typeName() {
    return type.name();
  }

  private CompositeObject live(TraceContext ctx) {
    return (CompositeObject) ctx.registry().getSubmodule(key);
  }

  private TracedValue addChild(
      TraceContext ctx, Object child, Object childKey, Source source, ImmutableSet<Guard> guards) {
    return ctx.registry().addSubmodule(child, key, childKey, source.asComposite(), guards);
  }

  /** Returns a handle for each element of an ordered container. */
  public ImmutableList<TracedValue> expandToSequence(TraceContext ctx) {
    CompositeObject obj = live(ctx);
    if (!obj.type().containerKind().isSequence()) {
      throw unsupported("cannot unpack %s", obj.type());
    }
    ImmutableList<Object> elements = obj.elements();
    ImmutableList.Builder<TracedValue> result = ImmutableList.builder();
    for (int i = 0; i < elements.size(); i++) {
      result.add(addChild(ctx, elements.get(i), i, source().item(i), guards()));
    }
    return result.build();
  }

  /** Returns a constant with the result of {@code hasattr(obj, name)}, guarded on that result. */
  public TracedValue hasAttribute(TraceContext ctx, String name) {
    boolean result = live(ctx).hasAttribute(name);
    Guard guard = source().attribute(name).asComposite().createGuard(GuardKind.HASATTR);
    return new ConstantValue(result, Guards.with(guards(), guard));
  }

  /** Returns the object's {@code training} flag, or false if it has none. No guard is added. */
  public boolean isInTrainingMode(TraceContext ctx) {
    return live(ctx).isTraining();
  }

  /**
   * Marks the underlying object as one that must not be specialized, and abandons the current
   * trace. Never returns normally.
   */
  public void forceUnspecialize(TraceContext ctx) {
    CompositeObject obj = live(ctx);
    ctx.generations().tag(obj);
    logger.atInfo().log("Unspecializing %s (%s); restarting", obj, source().name());
    throw new RestartAnalysis("unspecialize " + source().name());
  }

  /** Returns the value of {@code obj.name}, following the host's attribute lookup order. */
  public TracedValue resolveAttribute(TraceContext ctx, String name) {
    CompositeObject obj = live(ctx);
    Source attrSource = source().attribute(name);
    @Nullable Object member = null;
    boolean objectMember = true;
    if (obj.slots().containsKey(name)) {
      member = obj.slots().get(name);
    } else if (obj.children().containsKey(name) && !obj.type().attributeNames().contains(name)) {
      member = obj.children().get(name);
    } else if (obj.parameters().containsKey(name)) {
      member = obj.parameters().get(name);
    } else if (obj.buffers().containsKey(name)) {
      member = obj.buffers().get(name);
    } else {
      objectMember = false;
    }
    if (objectMember) {
      return ctx.wrap(member, attrSource.asComposite(), guards());
    } else if (name.equals("__class__")) {
      return new ClassValue(obj.type(), guards(), attrSource);
    }
    ClassMember classMember = obj.type().lookup(name);
    if (classMember == null) {
      throw unsupported("'%s' object has no attribute '%s'", obj.type(), name);
    }
    if (classMember instanceof ClassMember.Property p) {
      FunctionValue getter = new FunctionValue(p.getter(), guards(), null);
      return ctx.inlineCall(getter, ImmutableList.of(this), ImmutableMap.of());
    } else if (classMember instanceof ClassMember.ClassMethod m) {
      ClassValue receiver = new ClassValue(obj.type(), guards(), null);
      return new BoundMethodValue(m.fn(), receiver, guards(), attrSource);
    } else if (classMember instanceof ClassMember.StaticMethod m) {
      return new FunctionValue(m.fn(), guards(), attrSource);
    } else if (classMember instanceof ClassMember.InstanceMethod m) {
      return new BoundMethodValue(m.fn(), this, guards(), attrSource);
    }
    throw unsupported("class property %s %s", obj.type(), classMember.kindName());
  }

  /** Traces a call to the underlying object. */
  public TracedValue invoke(
      TraceContext ctx, List<TracedValue> args, Map<String, TracedValue> kwargs) {
    ImmutableSet<Guard> guards = Guards.propagate(this, args, kwargs);
    CompositeObject obj = live(ctx);
    HostClass cls = obj.type();
    if (BuiltinClasses.hasDefaultSequentialCall(cls) && args.size() == 1 && kwargs.isEmpty()) {
      // Trace each child's call in turn rather than the container's own loop.
      ImmutableList<Object> elements = obj.elements();
      logger.atFine().log(
          "Unrolling %s into %s calls", lazy(() -> source().name()), elements.size());
      TracedValue arg = args.get(0);
      for (int i = 0; i < elements.size(); i++) {
        TracedValue child = addChild(ctx, elements.get(i), i, source().item(i), guards);
        ctx.callFunction(child, ImmutableList.of(arg), ImmutableMap.of());
        arg = ctx.popLastResult();
      }
      return arg;
    } else if (ctx.isPrimitiveTraceable(cls)) {
      if (cls.isLazy()) {
        type = cls.classToBecome();
        logger.atFine().log("%s will become %s when called", source().name(), type);
      }
      NodeRef node = ctx.emitGraphNode(NodeKind.CALL_MODULE, key, args, kwargs);
      return new TensorValue(node, guards, null);
    }
    // Only lazily-initialized composites are traced through __call__ (to run their hooks).
    HostFunction fn = cls.lookupFunction(cls.isLazy() ? "__call__" : "forward");
    if (fn == null) {
      throw unsupported("'%s' object is not callable", cls);
    }
    return ctx.inlineCall(new FunctionValue(fn, guards, null), withReceiver(this, args), kwargs);
  }

  /** Traces a call to the method {@code name} of the underlying object. */
  public TracedValue invokeMethod(
      TraceContext ctx, String name, List<TracedValue> args, Map<String, TracedValue> kwargs) {
    ImmutableSet<Guard> guards = Guards.propagate(this, args, kwargs);
    CompositeObject obj = live(ctx);
    if (name.equals("forward")) {
      return invoke(ctx, args, kwargs);
    } else if (name.equals("_check_input_dim")) {
      HostFunction check = obj.type().lookupFunction(name);
      if (check != null && ctx.isInlineAllowed(check.sourceFile())) {
        return new ConstantValue(true, guards);
      }
    }
    if (!TracedValue.allConstant(args, kwargs)) {
      throw unsupported(
          "unsupported operation on non-constant arguments to composite method %s", name);
    }
    switch (name) {
      case "children" -> {
        checkNoArguments(name, args, kwargs);
        return wrapValues(ctx, obj.namedChildren(), false, guards);
      }
      case "named_parameters" -> {
        Map<String, @Nullable Object> bound = bind(BuiltinClasses.NAMED_PARAMETERS, args, kwargs);
        return namedEmbed(
            ctx,
            obj.namedParameters(
                stringArg(bound, "prefix"),
                Boolean.TRUE.equals(bound.get("recurse")),
                Boolean.TRUE.equals(bound.get("remove_duplicate"))),
            guards);
      }
      case "named_modules" -> {
        Map<String, @Nullable Object> bound = bind(BuiltinClasses.NAMED_MODULES, args, kwargs);
        Object memo = bound.get("memo");
        if (memo != null && !(memo instanceof Collection<?>)) {
          throw unsupported("named_modules() memo must be a set, not %s", memo);
        }
        return namedEmbed(
            ctx,
            obj.namedModules(
                (Collection<?>) memo,
                stringArg(bound, "prefix"),
                Boolean.TRUE.equals(bound.get("remove_duplicate"))),
            guards);
      }
      case "parameters" -> {
        Map<String, @Nullable Object> bound = bind(BuiltinClasses.PARAMETERS, args, kwargs);
        return wrapValues(
            ctx,
            obj.namedParameters("", Boolean.TRUE.equals(bound.get("recurse")), true),
            false,
            guards);
      }
      case "values" -> {
        checkNoArguments(name, args, kwargs);
        return wrapValues(ctx, obj.items().entrySet(), true, guards);
      }
      case "items" -> {
        checkNoArguments(name, args, kwargs);
        return namedEmbed(ctx, obj.items().entrySet(), guards);
      }
      case "__len__" -> {
        checkNoArguments(name, args, kwargs);
        return new ConstantValue(obj.size(), guards);
      }
      case "__contains__" -> {
        if (BuiltinClasses.isDictLike(obj.type()) && !args.isEmpty()) {
          Object k = args.get(0).asConstant();
          return new ConstantValue(obj.children().containsKey(k), guards);
        }
      }
      case "__getitem__" -> {
        return getItem(ctx, obj, onlyArgument(name, args, kwargs), guards);
      }
      case "_get_abs_string_index" -> {
        Object index = onlyArgument(name, args, kwargs);
        if (obj.type() != BuiltinClasses.COMPOSITE_LIST) {
          throw unsupported("%s has no _get_abs_string_index", obj.type());
        }
        if (!(index instanceof Integer i)) {
          throw unsupported("index must be an integer, not %s", StringUtil.safeToString(index));
        }
        return new ConstantValue(obj.absoluteIndex(i), guards);
      }
      default -> {}
    }
    return ctx.genericCallMethod(this, name, args, kwargs);
  }

  private TracedValue getItem(
      TraceContext ctx, CompositeObject obj, @Nullable Object index, ImmutableSet<Guard> guards) {
    if (!BuiltinClasses.hasTrueGetItem(obj.type())) {
      throw unsupported("cannot trace __getitem__ of %s", obj.type());
    } else if (index instanceof Slice slice) {
      ImmutableList<Integer> keys = slice.indices(obj.size());
      ImmutableList<Object> selected = obj.getSlice(slice);
      List<TracedValue> result = new ArrayList<>(keys.size());
      for (int i = 0; i < keys.size(); i++) {
        int k = keys.get(i);
        result.add(addChild(ctx, selected.get(i), k, source().item(k), guards));
      }
      return new TupleValue(result, guards);
    } else if (index == null) {
      throw unsupported("%s indices must not be None", obj.type());
    }
    return addChild(ctx, obj.getItem(index), index, source().item(index), guards);
  }

  /**
   * Registers each (name, value) pair as a child of this composite, with a source that is an
   * attribute (or, if {@code byItem} is true, an item) of this one.
   */
  private ListIteratorValue wrapValues(
      TraceContext ctx,
      Collection<? extends Map.Entry<String, ?>> items,
      boolean byItem,
      ImmutableSet<Guard> guards) {
    List<TracedValue> result = new ArrayList<>(items.size());
    for (Map.Entry<String, ?> item : items) {
      // layer.0.foo => layer[0].foo
      String name = StringUtil.subscriptNumericSegments(item.getKey());
      Source src = byItem ? source().item(item.getKey()) : pathSource(item.getKey());
      result.add(addChild(ctx, item.getValue(), name, src, guards));
    }
    return new ListIteratorValue(result, guards);
  }

  /**
   * Returns a Source for the descendant at a dotted path, built from the same steps as the
   * equivalent chain of attribute and index accesses: numeric segments are items, the rest are
   * attributes, and each intermediate object is a tracked composite.
   */
  private Source pathSource(String path) {
    Source result = source();
    for (String segment : Splitter.on('.').split(path)) {
      Integer index = DIGITS.matchesAllOf(segment) ? Ints.tryParse(segment) : null;
      result = result.asComposite();
      result = (index != null) ? result.item(index) : result.attribute(segment);
    }
    return result;
  }

  /** Returns a (name, value) tuple for each pair, with the value registered as a child. */
  private ListIteratorValue namedEmbed(
      TraceContext ctx,
      Collection<? extends Map.Entry<String, ?>> items,
      ImmutableSet<Guard> guards) {
    List<TracedValue> result = new ArrayList<>(items.size());
    for (Map.Entry<String, ?> item : items) {
      String name = item.getKey();
      TracedValue value = addChild(ctx, item.getValue(), name, source().item(name), guards);
      result.add(new TupleValue(ImmutableList.of(new ConstantValue(name, guards), value), guards));
    }
    return new ListIteratorValue(result, guards);
  }

  private static Map<String, @Nullable Object> bind(
      Signature signature, List<TracedValue> args, Map<String, TracedValue> kwargs) {
    List<@Nullable Object> constArgs = new ArrayList<>(args.size());
    for (TracedValue arg : args) {
      constArgs.add(arg.asConstant());
    }
    Map<String, @Nullable Object> constKwargs = new LinkedHashMap<>();
    kwargs.forEach((k, v) -> constKwargs.put(k, v.asConstant()));
    return signature.bind(constArgs, constKwargs);
  }

  private static String stringArg(Map<String, @Nullable Object> bound, String name) {
    if (bound.get(name) instanceof String s) {
      return s;
    }
    throw unsupported("%s must be a string, not %s", name, bound.get(name));
  }

  private static void checkNoArguments(
      String name, List<TracedValue> args, Map<String, TracedValue> kwargs) {
    if (!args.isEmpty() || !kwargs.isEmpty()) {
      throw unsupported("%s() takes no arguments", name);
    }
  }

  private static @Nullable Object onlyArgument(
      String name, List<TracedValue> args, Map<String, TracedValue> kwargs) {
    if (args.size() != 1 || !kwargs.isEmpty()) {
      throw unsupported("%s() takes exactly one argument (%s given)", name, args.size());
    }
    return args.get(0).asConstant();
  }

  static ImmutableList<TracedValue> withReceiver(TracedValue receiver, List<TracedValue> args) {
    return ImmutableList.<TracedValue>builder().add(receiver).addAll(args).build();
  }

  @Override
  public String toString() {
    return "Composite(" + type.name() + ", " + key + ")";
  }
}
