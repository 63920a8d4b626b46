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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A snapshot of one class in the host program's class hierarchy: its name, its (single) superclass,
 * and the attributes it declares.
 *
 * <p>HostClasses are immutable and compared by identity. Attribute lookup ({@link #lookup}) is a
 * pure function of the class and its ancestors; it replays the host's static lookup order without
 * binding or calling anything.
 */
public final class HostClass {
  private final String name;
  private final @Nullable HostClass superclass;
  private final ImmutableMap<String, ClassMember> members;

  /**
   * If non-null, this is a lazily-initialized composite class; after its first invocation an
   * instance's class changes to {@code classToBecome}.
   */
  private final @Nullable HostClass classToBecome;

  /** Only set on the built-in container classes; everything else inherits its kind. */
  private final @Nullable ContainerKind declaredKind;

  private final ContainerKind containerKind;
  private final ImmutableList<HostClass> mro;
  private final ImmutableSet<String> attributeNames;

  private HostClass(Builder builder) {
    this.name = builder.name;
    this.superclass = builder.superclass;
    this.members = ImmutableMap.copyOf(builder.members);
    this.classToBecome = builder.classToBecome;
    this.declaredKind = builder.declaredKind;
    ImmutableList.Builder<HostClass> mro = ImmutableList.builder();
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    ContainerKind kind = null;
    for (HostClass c = this; c != null; c = c.superclass) {
      mro.add(c);
      names.addAll(c.members.keySet());
      if (kind == null) {
        kind = c.declaredKind;
      }
    }
    this.mro = mro.build();
    this.attributeNames = names.build();
    this.containerKind = (kind == null) ? ContainerKind.GENERIC : kind;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String name() {
    return name;
  }

  public @Nullable HostClass superclass() {
    return superclass;
  }

  /** The attributes declared directly on this class, in declaration order. */
  public ImmutableMap<String, ClassMember> declaredMembers() {
    return members;
  }

  /** This class followed by each of its ancestors, nearest first. */
  public ImmutableList<HostClass> mro() {
    return mro;
  }

  /** The names of all attributes declared on this class or any of its ancestors. */
  public ImmutableSet<String> attributeNames() {
    return attributeNames;
  }

  /**
   * Returns the first declaration of {@code name} found by walking {@link #mro}, or null if no
   * class in the hierarchy declares it.
   */
  public @Nullable ClassMember lookup(String name) {
    for (HostClass c : mro) {
      ClassMember member = c.members.get(name);
      if (member != null) {
        return member;
      }
    }
    return null;
  }

  /** Returns the function found by {@link #lookup}, or null if there is none. */
  public @Nullable HostFunction lookupFunction(String name) {
    ClassMember member = lookup(name);
    return (member == null) ? null : member.function();
  }

  public ContainerKind containerKind() {
    return containerKind;
  }

  /** True if {@code other} is this class or one of its ancestors. */
  public boolean isSubclassOf(HostClass other) {
    return mro.contains(other);
  }

  /** True if instances of this class are lazily initialized. */
  public boolean isLazy() {
    return classToBecome != null;
  }

  /** The class a lazily-initialized instance becomes after its first invocation. */
  public HostClass classToBecome() {
    checkState(classToBecome != null, "%s is not lazily initialized", name);
    return classToBecome;
  }

  @Override
  public String toString() {
    return name;
  }

  /** Builds a HostClass. */
  public static final class Builder {
    private final String name;
    private HostClass superclass;
    private final Map<String, ClassMember> members = new LinkedHashMap<>();
    private HostClass classToBecome;
    private ContainerKind declaredKind;

    private Builder(String name) {
      this.name = checkNotNull(name);
    }

    @CanIgnoreReturnValue
    public Builder extending(HostClass superclass) {
      this.superclass = checkNotNull(superclass);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder member(String name, ClassMember member) {
      ClassMember prev = members.put(checkNotNull(name), checkNotNull(member));
      checkState(prev == null, "%s declared twice on %s", name, this.name);
      return this;
    }

    /** Declares a plain function named {@code name}, defined in {@code sourceFile}. */
    @CanIgnoreReturnValue
    public Builder method(String name, String sourceFile) {
      HostFunction fn = new HostFunction(this.name, name, sourceFile);
      return member(name, ClassMember.instanceMethod(fn));
    }

    /** Marks this as a lazily-initialized class whose instances become {@code target}. */
    @CanIgnoreReturnValue
    public Builder becomes(HostClass target) {
      this.classToBecome = checkNotNull(target);
      return this;
    }

    @CanIgnoreReturnValue
    Builder containerKind(ContainerKind kind) {
      this.declaredKind = kind;
      return this;
    }

    public HostClass build() {
      return new HostClass(this);
    }
  }
}
