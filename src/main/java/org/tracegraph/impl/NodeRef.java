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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * A reference to a node of the computation graph being built. {@code target} is the registry key
 * of the composite or data slot the node refers to.
 */
public record NodeRef(
    int index,
    NodeKind kind,
    String target,
    ImmutableList<TracedValue> args,
    ImmutableMap<String, TracedValue> kwargs) {

  @Override
  public String toString() {
    return "%" + index + " = " + kind + "[" + target + "]";
  }
}
