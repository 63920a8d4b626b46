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

import org.jspecify.annotations.Nullable;

/**
 * A ClassMember is the static description of an attribute declared on a {@link HostClass}: enough
 * to know how the attribute would bind if it were looked up on an instance, without running any of
 * the host's descriptor machinery.
 *
 * <p>There are exactly five implementations, all defined in this file: Property, ClassMethod,
 * StaticMethod, InstanceMethod, and Opaque.
 */
public sealed interface ClassMember {

  /** Returns the underlying function, or null if this is an Opaque member. */
  @Nullable HostFunction function();

  /** Returns a short description of this member's kind, for diagnostics. */
  String kindName();

  static Property property(HostFunction getter) {
    return new Property(getter);
  }

  static ClassMethod classMethod(HostFunction fn) {
    return new ClassMethod(fn);
  }

  static StaticMethod staticMethod(HostFunction fn) {
    return new StaticMethod(fn);
  }

  static InstanceMethod instanceMethod(HostFunction fn) {
    return new InstanceMethod(fn);
  }

  static Opaque opaque(Object value) {
    return new Opaque(value);
  }

  /** A computed attribute; reading it calls {@code getter} with the instance as its argument. */
  record Property(HostFunction getter) implements ClassMember {
    public Property {
      checkNotNull(getter);
    }

    @Override
    public HostFunction function() {
      return getter;
    }

    @Override
    public String kindName() {
      return "property";
    }
  }

  /** A function that binds to the instance's class rather than to the instance. */
  record ClassMethod(HostFunction fn) implements ClassMember {
    public ClassMethod {
      checkNotNull(fn);
    }

    @Override
    public HostFunction function() {
      return fn;
    }

    @Override
    public String kindName() {
      return "classmethod";
    }
  }

  /** A function that does not bind to anything. */
  record StaticMethod(HostFunction fn) implements ClassMember {
    public StaticMethod {
      checkNotNull(fn);
    }

    @Override
    public HostFunction function() {
      return fn;
    }

    @Override
    public String kindName() {
      return "staticmethod";
    }
  }

  /** A plain function, which binds to the instance it is looked up on. */
  record InstanceMethod(HostFunction fn) implements ClassMember {
    public InstanceMethod {
      checkNotNull(fn);
    }

    @Override
    public HostFunction function() {
      return fn;
    }

    @Override
    public String kindName() {
      return "function";
    }
  }

  /**
   * Any other class-level attribute (a constant, a nested class, a descriptor of some other kind).
   * The tracer does not know how these bind.
   */
  record Opaque(Object value) implements ClassMember {
    public Opaque {
      checkNotNull(value);
    }

    @Override
    public @Nullable HostFunction function() {
      return null;
    }

    @Override
    public String kindName() {
      return value.getClass().getSimpleName();
    }
  }
}
