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

package org.tracegraph.source;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import org.tracegraph.util.StringUtil;

/**
 * A Source records how a traced value was reached from the inputs of the traced function: a chain
 * of attribute and index steps from a local or global root. Sources are immutable, and two Sources
 * are equal if and only if they describe the same path from equal roots, so they can be used
 * directly as (parts of) hash keys.
 *
 * <p>There are exactly six classes that implement Source, all defined in this file: Local, Global,
 * Attr, Item, Composite, and NotComposite. The last two do not add a step; they mark whether the
 * value reached is a composite object under identity tracking, which decides what kind of guards
 * are installed for it (see {@link GuardSource}).
 */
public sealed interface Source {

  /** A Python-like expression for the value this Source reaches, used when printing guards. */
  String name();

  /** Where this Source's root lives, and whether it is identity-tracked. */
  GuardSource guardSource();

  /** True if this Source reaches a composite object under identity tracking. */
  default boolean isTrackedComposite() {
    return guardSource().isComposite();
  }

  /**
   * Returns a Source for the attribute {@code name} of this Source's value. A dotted name is
   * treated as a sequence of attribute steps, so {@code attribute("a.b")} equals {@code
   * attribute("a").attribute("b")}.
   */
  default Source attribute(String name) {
    Source result = this;
    for (String member : Splitter.on('.').split(name)) {
      result = new Attr(result, member);
    }
    return result;
  }

  /** Returns a Source for the element at {@code key} (an Integer or a String). */
  default Source item(Object key) {
    return new Item(this, key);
  }

  /** Returns this Source marked as reaching an identity-tracked composite. */
  default Source asComposite() {
    return (this instanceof Composite) ? this : new Composite(this);
  }

  /** Returns this Source explicitly marked as not identity-tracked. */
  default Source asNotComposite() {
    return (this instanceof NotComposite) ? this : new NotComposite(this);
  }

  /** Returns a Guard asserting {@code kind} of the value this Source reaches. */
  default Guard createGuard(GuardKind kind) {
    return new Guard(this, kind);
  }

  static Source local(String name) {
    return new Local(name);
  }

  static Source global(String name) {
    return new Global(name);
  }

  /** A local variable (or argument) of the traced function. */
  record Local(String localName) implements Source {
    public Local {
      checkNotNull(localName);
    }

    @Override
    public String name() {
      return localName;
    }

    @Override
    public GuardSource guardSource() {
      return GuardSource.LOCAL;
    }
  }

  /** A global variable of the traced function's module. */
  record Global(String globalName) implements Source {
    public Global {
      checkNotNull(globalName);
    }

    @Override
    public String name() {
      return "G[" + StringUtil.escape(globalName) + "]";
    }

    @Override
    public GuardSource guardSource() {
      return GuardSource.GLOBAL;
    }
  }

  /**
   * An attribute of {@code base}'s value. {@code member} is a single identifier-like name: it never
   * contains a dot or a subscript (an index step is an {@link Item}).
   */
  record Attr(Source base, String member) implements Source {
    private static final CharMatcher NOT_MEMBER = CharMatcher.anyOf(".[]");

    public Attr {
      checkNotNull(base);
      checkArgument(
          !member.isEmpty() && NOT_MEMBER.matchesNoneOf(member), "Bad member: %s", member);
    }

    @Override
    public String name() {
      return base.name() + "." + member;
    }

    @Override
    public GuardSource guardSource() {
      return base.guardSource();
    }
  }

  /** An element of {@code base}'s value; {@code index} is an Integer or a String. */
  record Item(Source base, Object index) implements Source {
    public Item {
      checkNotNull(base);
      checkArgument(index instanceof Integer || index instanceof String, "Bad index: %s", index);
    }

    @Override
    public String name() {
      String key = (index instanceof String s) ? StringUtil.escape(s) : index.toString();
      return base.name() + "[" + key + "]";
    }

    @Override
    public GuardSource guardSource() {
      return base.guardSource();
    }
  }

  /** Marks {@code base} as reaching a composite object under identity tracking. */
  record Composite(Source base) implements Source {
    public Composite {
      checkNotNull(base);
    }

    @Override
    public String name() {
      return base.name();
    }

    @Override
    public GuardSource guardSource() {
      return base.guardSource().asComposite();
    }
  }

  /**
   * Marks {@code base} as explicitly not identity-tracked, even if it reaches a composite object.
   * Guards on such a Source are always installed.
   */
  record NotComposite(Source base) implements Source {
    public NotComposite {
      checkNotNull(base);
    }

    @Override
    public String name() {
      return base.name();
    }

    @Override
    public GuardSource guardSource() {
      return base.guardSource().asPlain();
    }
  }
}
