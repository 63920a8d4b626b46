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

import com.google.common.collect.ImmutableSet;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The built-in composite classes of the host library, and predicates that compare a class's
 * behavior against theirs.
 *
 * <p>User-defined composite classes extend {@link #COMPOSITE} or one of the containers; whether a
 * user class "overrides" a built-in behavior is decided by comparing the {@link HostFunction} its
 * static lookup finds with the built-in one.
 */
public final class BuiltinClasses {

  static final String BASE_FILE = "lib/composite/base.py";
  static final String CONTAINER_FILE = "lib/composite/container.py";

  /** The root of every composite class. */
  public static final HostClass COMPOSITE =
      HostClass.builder("Composite")
          .method("forward", BASE_FILE)
          .method("__call__", BASE_FILE)
          .method("children", BASE_FILE)
          .method("named_children", BASE_FILE)
          .method("parameters", BASE_FILE)
          .method("named_parameters", BASE_FILE)
          .method("buffers", BASE_FILE)
          .method("named_buffers", BASE_FILE)
          .method("modules", BASE_FILE)
          .method("named_modules", BASE_FILE)
          .method("train", BASE_FILE)
          .method("eval", BASE_FILE)
          .method("state_dict", BASE_FILE)
          .method("zero_grad", BASE_FILE)
          .method("apply", BASE_FILE)
          .method("register_buffer", BASE_FILE)
          .method("register_parameter", BASE_FILE)
          .method("add_module", BASE_FILE)
          .build();

  /** A container whose default call feeds its input through each child in order. */
  public static final HostClass SEQUENTIAL =
      HostClass.builder("Sequential")
          .extending(COMPOSITE)
          .containerKind(ContainerKind.SEQUENTIAL)
          .method("forward", CONTAINER_FILE)
          .method("__iter__", CONTAINER_FILE)
          .method("__len__", CONTAINER_FILE)
          .method("__getitem__", CONTAINER_FILE)
          .method("append", CONTAINER_FILE)
          .build();

  /** An integer-indexed list of child composites. */
  public static final HostClass COMPOSITE_LIST =
      HostClass.builder("CompositeList")
          .extending(COMPOSITE)
          .containerKind(ContainerKind.INDEXED)
          .method("__iter__", CONTAINER_FILE)
          .method("__len__", CONTAINER_FILE)
          .method("__getitem__", CONTAINER_FILE)
          .method("append", CONTAINER_FILE)
          .method("extend", CONTAINER_FILE)
          .method("insert", CONTAINER_FILE)
          .method("_get_abs_string_index", CONTAINER_FILE)
          .build();

  /** A string-keyed table of child composites. */
  public static final HostClass COMPOSITE_DICT =
      HostClass.builder("CompositeDict")
          .extending(COMPOSITE)
          .containerKind(ContainerKind.KEYED)
          .method("__iter__", CONTAINER_FILE)
          .method("__len__", CONTAINER_FILE)
          .method("__getitem__", CONTAINER_FILE)
          .method("__contains__", CONTAINER_FILE)
          .method("keys", CONTAINER_FILE)
          .method("items", CONTAINER_FILE)
          .method("values", CONTAINER_FILE)
          .build();

  /** An integer-indexed list of parameters. */
  public static final HostClass PARAMETER_LIST =
      HostClass.builder("ParameterList")
          .extending(COMPOSITE)
          .containerKind(ContainerKind.INDEXED)
          .method("__iter__", CONTAINER_FILE)
          .method("__len__", CONTAINER_FILE)
          .method("__getitem__", CONTAINER_FILE)
          .method("append", CONTAINER_FILE)
          .build();

  /** A string-keyed table of parameters. */
  public static final HostClass PARAMETER_DICT =
      HostClass.builder("ParameterDict")
          .extending(COMPOSITE)
          .containerKind(ContainerKind.KEYED)
          .method("__iter__", CONTAINER_FILE)
          .method("__len__", CONTAINER_FILE)
          .method("__getitem__", CONTAINER_FILE)
          .method("__contains__", CONTAINER_FILE)
          .method("keys", CONTAINER_FILE)
          .method("items", CONTAINER_FILE)
          .method("values", CONTAINER_FILE)
          .build();

  public static final Signature NAMED_PARAMETERS =
      Signature.of("named_parameters", "prefix", "", "recurse", true, "remove_duplicate", true);

  public static final Signature NAMED_MODULES =
      Signature.of("named_modules", "memo", null, "prefix", "", "remove_duplicate", true);

  public static final Signature PARAMETERS = Signature.of("parameters", "recurse", true);

  private static final ImmutableSet<HostFunction> BASE_BEHAVIORS =
      COMPOSITE.declaredMembers().values().stream()
          .map(ClassMember::function)
          .filter(Objects::nonNull)
          .collect(ImmutableSet.toImmutableSet());

  private static final ImmutableSet<HostFunction> TRUE_GET_ITEMS =
      ImmutableSet.of(
          COMPOSITE_DICT.lookupFunction("__getitem__"),
          COMPOSITE_LIST.lookupFunction("__getitem__"),
          PARAMETER_LIST.lookupFunction("__getitem__"));

  private static final ImmutableSet<HostFunction> DEFAULT_ITERATORS =
      ImmutableSet.of(
          COMPOSITE_LIST.lookupFunction("__iter__"),
          PARAMETER_LIST.lookupFunction("__iter__"),
          SEQUENTIAL.lookupFunction("__iter__"));

  private BuiltinClasses() {}

  /** True if {@code fn} is one of the behaviors declared on {@link #COMPOSITE} itself. */
  public static boolean isBaseBehavior(@Nullable HostFunction fn) {
    return fn != null && BASE_BEHAVIORS.contains(fn);
  }

  /** True if {@code cls} is a sequential container that has not overridden its default call. */
  public static boolean hasDefaultSequentialCall(HostClass cls) {
    return cls.isSubclassOf(SEQUENTIAL)
        && cls.lookupFunction("forward") == SEQUENTIAL.lookupFunction("forward");
  }

  /**
   * True if {@code cls} indexes with one of the built-in container {@code __getitem__}
   * implementations (rather than an override).
   */
  public static boolean hasTrueGetItem(HostClass cls) {
    HostFunction fn = cls.lookupFunction("__getitem__");
    return fn != null && TRUE_GET_ITEMS.contains(fn);
  }

  /** True if {@code cls} iterates with one of the built-in sequence iterators. */
  public static boolean hasDefaultIteration(HostClass cls) {
    HostFunction fn = cls.lookupFunction("__iter__");
    return fn != null && DEFAULT_ITERATORS.contains(fn);
  }

  /** True if {@code cls} is a dict-like container of composites or parameters. */
  public static boolean isDictLike(HostClass cls) {
    return cls.isSubclassOf(COMPOSITE_DICT) || cls.isSubclassOf(PARAMETER_DICT);
  }
}
