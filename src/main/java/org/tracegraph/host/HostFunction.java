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

/**
 * A reference to a function defined in the host program. The tracer never runs a HostFunction; it
 * only passes it to the symbolic execution engine to be inlined, or compares it with the built-in
 * functions in {@link BuiltinClasses}.
 *
 * <p>HostFunctions are compared by identity: two HostFunctions with the same name and source file
 * are still different functions.
 */
public final class HostFunction {
  private final String owner;
  private final String name;
  private final String sourceFile;

  public HostFunction(String owner, String name, String sourceFile) {
    this.owner = checkNotNull(owner);
    this.name = checkNotNull(name);
    this.sourceFile = checkNotNull(sourceFile);
  }

  /** The unqualified name of this function. */
  public String name() {
    return name;
  }

  /** The name of the class (or module) that declared this function. */
  public String owner() {
    return owner;
  }

  /** The file this function was loaded from; used to decide whether it may be trusted. */
  public String sourceFile() {
    return sourceFile;
  }

  @Override
  public String toString() {
    return owner + "." + name;
  }
}
