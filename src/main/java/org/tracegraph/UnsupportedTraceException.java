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

import com.google.errorprone.annotations.FormatMethod;

/**
 * Thrown when the tracer is asked to do something that has no safe symbolic meaning. The message
 * should identify the object's class and the attribute or method involved, since the caller has no
 * other way to find out what went wrong.
 *
 * <p>These are never recovered locally: approximating the operation would produce a compiled
 * artifact that is wrong for some future call. The surrounding system is expected to fall back to
 * running the call without tracing.
 */
public class UnsupportedTraceException extends RuntimeException {

  public UnsupportedTraceException(String message) {
    super(message);
  }

  public UnsupportedTraceException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Returns a new UnsupportedTraceException with a message built by {@link String#format}. */
  @FormatMethod
  public static UnsupportedTraceException unsupported(String format, Object... args) {
    return new UnsupportedTraceException(String.format(format, args));
  }
}
