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

import com.google.common.collect.ImmutableSet;
import org.jspecify.annotations.Nullable;
import org.tracegraph.host.HostFunction;
import org.tracegraph.source.Guard;
import org.tracegraph.source.Source;

/**
 * A host function bound to a receiver. The receiver is passed as the first argument when the
 * method is called; for a class method it is a {@link ClassValue}.
 */
public final class BoundMethodValue extends BaseValue {
  private final HostFunction fn;
  private final TracedValue receiver;

  public BoundMethodValue(
      HostFunction fn, TracedValue receiver, ImmutableSet<Guard> guards, @Nullable Source source) {
    super(guards, source);
    this.fn = checkNotNull(fn);
    this.receiver = checkNotNull(receiver);
  }

  public HostFunction function() {
    return fn;
  }

  public TracedValue receiver() {
    return receiver;
  }

  @Override
  public String typeName() {
    return "method";
  }

  @Override
  public String toString() {
    return "Method(" + fn + ", " + receiver + ")";
  }
}
