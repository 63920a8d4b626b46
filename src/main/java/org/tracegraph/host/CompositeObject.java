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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static org.tracegraph.UnsupportedTraceException.unsupported;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A live composite object: an instance of some subclass of {@link BuiltinClasses#COMPOSITE}.
 *
 * <p>A CompositeObject has four instance-level tables, all ordered by insertion:
 *
 * <ul>
 *   <li>data slots (the instance dictionary, including the {@code training} flag);
 *   <li>child composites;
 *   <li>named parameters; and
 *   <li>named buffers.
 * </ul>
 *
 * <p>CompositeObjects are compared by identity. The enumeration methods ({@link #namedChildren},
 * {@link #namedModules}, {@link #namedParameters}) follow the host library's de-duplication rules,
 * so an object reachable by two paths is only reported once.
 */
public final class CompositeObject {
  private HostClass type;
  private final Map<String, @Nullable Object> slots = new LinkedHashMap<>();
  private final Map<String, CompositeObject> children = new LinkedHashMap<>();
  private final Map<String, DataSlot> parameters = new LinkedHashMap<>();
  private final Map<String, DataSlot> buffers = new LinkedHashMap<>();

  public CompositeObject(HostClass type) {
    checkArgument(type.isSubclassOf(BuiltinClasses.COMPOSITE), "%s is not a composite class", type);
    this.type = type;
    slots.put("training", true);
  }

  /** Returns a new container of the given class holding {@code children} under "0", "1", .... */
  public static CompositeObject sequenceOf(HostClass type, CompositeObject... children) {
    CompositeObject result = new CompositeObject(type);
    for (CompositeObject child : children) {
      result.addChild(String.valueOf(result.children.size()), child);
    }
    return result;
  }

  /** Returns a new parameter list holding {@code params} under "0", "1", .... */
  public static CompositeObject parameterListOf(DataSlot... params) {
    CompositeObject result = new CompositeObject(BuiltinClasses.PARAMETER_LIST);
    for (DataSlot param : params) {
      result.addParameter(String.valueOf(result.parameters.size()), param);
    }
    return result;
  }

  /** The object's current class; a lazily-initialized object changes class when initialized. */
  public HostClass type() {
    return type;
  }

  /** Switches a lazily-initialized object to its post-initialization class. */
  public void initialize() {
    type = type.classToBecome();
  }

  @CanIgnoreReturnValue
  public CompositeObject setSlot(String name, @Nullable Object value) {
    slots.put(checkNotNull(name), value);
    return this;
  }

  public void removeSlot(String name) {
    slots.remove(name);
  }

  @CanIgnoreReturnValue
  public CompositeObject addChild(String name, CompositeObject child) {
    children.put(checkNotNull(name), checkNotNull(child));
    return this;
  }

  @CanIgnoreReturnValue
  public CompositeObject addParameter(String name, DataSlot param) {
    parameters.put(checkNotNull(name), checkNotNull(param));
    return this;
  }

  @CanIgnoreReturnValue
  public CompositeObject addBuffer(String name, DataSlot buffer) {
    buffers.put(checkNotNull(name), checkNotNull(buffer));
    return this;
  }

  /** The instance dictionary. */
  public Map<String, @Nullable Object> slots() {
    return Collections.unmodifiableMap(slots);
  }

  /** The child-composite table. */
  public Map<String, CompositeObject> children() {
    return Collections.unmodifiableMap(children);
  }

  /** The named-parameter table. */
  public Map<String, DataSlot> parameters() {
    return Collections.unmodifiableMap(parameters);
  }

  /** The named-buffer table. */
  public Map<String, DataSlot> buffers() {
    return Collections.unmodifiableMap(buffers);
  }

  /** Returns the {@code training} data slot, or false if there is none. */
  public boolean isTraining() {
    return slots.get("training") instanceof Boolean b && b;
  }

  /**
   * True if an attribute lookup for {@code name} would succeed: it is in one of the instance tables
   * or declared somewhere in the class hierarchy.
   */
  public boolean hasAttribute(String name) {
    return slots.containsKey(name)
        || children.containsKey(name)
        || parameters.containsKey(name)
        || buffers.containsKey(name)
        || type.attributeNames().contains(name)
        || name.equals("__class__")
        || name.equals("__dict__");
  }

  /** The direct children, each reported once. */
  public ImmutableList<Map.Entry<String, CompositeObject>> namedChildren() {
    Set<CompositeObject> memo = Sets.newIdentityHashSet();
    ImmutableList.Builder<Map.Entry<String, CompositeObject>> result = ImmutableList.builder();
    children.forEach(
        (name, child) -> {
          if (memo.add(child)) {
            result.add(Maps.immutableEntry(name, child));
          }
        });
    return result.build();
  }

  /**
   * This object and all of its descendants with their dotted paths, depth first. Objects in {@code
   * memo} are skipped; if {@code removeDuplicate} is true, each object is reported only once.
   */
  public ImmutableList<Map.Entry<String, CompositeObject>> namedModules(
      @Nullable Collection<?> memo, String prefix, boolean removeDuplicate) {
    Set<Object> seen = Sets.newIdentityHashSet();
    if (memo != null) {
      seen.addAll(memo);
    }
    ImmutableList.Builder<Map.Entry<String, CompositeObject>> result = ImmutableList.builder();
    addNamedModules(seen, prefix, removeDuplicate, result);
    return result.build();
  }

  private void addNamedModules(
      Set<Object> seen,
      String prefix,
      boolean removeDuplicate,
      ImmutableList.Builder<Map.Entry<String, CompositeObject>> result) {
    if (seen.contains(this)) {
      return;
    }
    if (removeDuplicate) {
      seen.add(this);
    }
    result.add(Maps.immutableEntry(prefix, this));
    children.forEach(
        (name, child) -> child.addNamedModules(seen, join(prefix, name), removeDuplicate, result));
  }

  /**
   * The parameters of this object (and, if {@code recurse} is true, of its descendants) with their
   * dotted paths. If {@code removeDuplicate} is true, each object and each DataSlot is reported
   * only once.
   */
  public ImmutableList<Map.Entry<String, DataSlot>> namedParameters(
      String prefix, boolean recurse, boolean removeDuplicate) {
    ImmutableList<Map.Entry<String, CompositeObject>> modules =
        recurse
            ? namedModules(null, prefix, removeDuplicate)
            : ImmutableList.of(Maps.immutableEntry(prefix, this));
    Set<DataSlot> memo = Sets.newIdentityHashSet();
    ImmutableList.Builder<Map.Entry<String, DataSlot>> result = ImmutableList.builder();
    for (Map.Entry<String, CompositeObject> module : modules) {
      module
          .getValue()
          .parameters
          .forEach(
              (name, param) -> {
                if (!removeDuplicate || memo.add(param)) {
                  result.add(Maps.immutableEntry(join(module.getKey(), name), param));
                }
              });
    }
    return result.build();
  }

  private static String join(String prefix, String name) {
    return prefix.isEmpty() ? name : prefix + "." + name;
  }

  private boolean holdsParameters() {
    return type.isSubclassOf(BuiltinClasses.PARAMETER_LIST)
        || type.isSubclassOf(BuiltinClasses.PARAMETER_DICT);
  }

  /** The table a built-in container stores its elements in. */
  private Map<String, ?> elementTable() {
    if (type.containerKind() == ContainerKind.GENERIC) {
      throw unsupported("object of type %s is not a container", type);
    }
    return holdsParameters() ? parameters : children;
  }

  /** The number of elements in this container. */
  public int size() {
    return elementTable().size();
  }

  /**
   * The result of iterating over this container: its elements for an ordered container, or its
   * keys for a dict-like one.
   */
  public ImmutableList<Object> elements() {
    Map<String, ?> table = elementTable();
    if (type.containerKind() == ContainerKind.KEYED) {
      return ImmutableList.copyOf(table.keySet());
    }
    return ImmutableList.copyOf(table.values());
  }

  /** The (key, element) pairs of a dict-like container. */
  public ImmutableMap<String, Object> items() {
    if (type.containerKind() != ContainerKind.KEYED) {
      throw unsupported("'%s' object has no attribute 'items'", type);
    }
    return ImmutableMap.copyOf(elementTable());
  }

  /** Returns the element at {@code key}: an int for an ordered container, a String for a dict. */
  public Object getItem(Object key) {
    if (type.containerKind() == ContainerKind.KEYED) {
      Object result = (key instanceof String s) ? elementTable().get(s) : null;
      if (result == null) {
        throw unsupported("KeyError: %s", key);
      }
      return result;
    } else if (key instanceof Integer i) {
      return elements().get(Integer.parseInt(absoluteIndex(i)));
    }
    throw unsupported("%s indices must be integers, not %s", type, typeName(key));
  }

  /** Returns the elements of an ordered container selected by {@code slice}. */
  public ImmutableList<Object> getSlice(Slice slice) {
    if (!type.containerKind().isSequence()) {
      throw unsupported("%s cannot be sliced", type);
    }
    ImmutableList<Object> elements = elements();
    return slice.indices(elements.size()).stream()
        .map(elements::get)
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Converts a possibly-negative index into the non-negative string key it refers to, failing if
   * it is out of range.
   */
  public String absoluteIndex(int index) {
    int size = size();
    if (index < -size || index >= size) {
      throw unsupported("index %s is out of range", index);
    }
    return String.valueOf(index < 0 ? index + size : index);
  }

  private static String typeName(@Nullable Object x) {
    return (x == null) ? "None" : x.getClass().getSimpleName();
  }

  @Override
  public String toString() {
    return type.name() + "()";
  }
}
