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

package org.tracegraph;

/**
 * Thrown to abandon the trace in progress so that it can be re-run from the beginning under updated
 * specialization decisions. This is not an error, and must pass unchanged through every frame
 * between the point it is thrown and the top-level trace driver; only the driver catches it.
 *
 * <p>Since it is used for control flow, it does not capture a stack trace.
 */
public class RestartAnalysis extends RuntimeException {

  public RestartAnalysis(String reason) {
    super(reason, null, false, false);
  }
}
