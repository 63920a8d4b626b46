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

import java.util.List;
import java.util.Map;

/** Adds nodes to the computation graph being built. */
public interface GraphEmitter {

  /** Adds a node to the graph and returns a reference to it. */
  NodeRef emitGraphNode(
      NodeKind kind, String target, List<TracedValue> args, Map<String, TracedValue> kwargs);
}
