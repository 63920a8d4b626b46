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

package org.tracegraph.util;

import java.util.function.IntFunction;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/** Static-only class with methods for building and escaping strings. */
public class StringUtil {

  private StringUtil() {}

  /**
   * Constructs a string by calling the given IntFunction for each int from 0 to size-1, calling
   * {@code String.valueOf()} on each element, separating them with {@code ", "}, and adding the
   * given prefix and suffix.
   */
  public static String joinElements(
      String prefix, String suffix, int size, IntFunction<Object> elements) {
    assert size >= 0;
    return IntStream.range(0, size)
        .mapToObj(i -> String.valueOf(elements.apply(i)))
        .collect(Collectors.joining(", ", prefix, suffix));
  }

  private static final Pattern NEEDS_ESCAPE = Pattern.compile("[\"\b\t\n\f\r\\\\]");

  private static String escapeChar(MatchResult mr, String s) {
    return switch (s.charAt(mr.start())) {
      case '\"' -> "\\\\\"";
      case '\\' -> "\\\\\\\\";
      case '\b' -> "\\\\b";
      case '\t' -> "\\\\t";
      case '\n' -> "\\\\n";
      case '\f' -> "\\\\f";
      case '\r' -> "\\\\r";
      default -> throw new AssertionError();
    };
  }

  /** Given a string, return an equivalent quoted string literal. */
  public static String escape(String s) {
    if (s == null) {
      return "null";
    }
    Matcher m = NEEDS_ESCAPE.matcher(s);
    String escaped = m.replaceAll(mr -> escapeChar(mr, s));
    return "\"" + escaped + "\"";
  }

  /** Matches a numeric segment of a dotted path, e.g. the ".0" in "layers.0.weight". */
  private static final Pattern NUMERIC_SEGMENT = Pattern.compile("[.]([0-9]+)([.]|$)");

  /**
   * Rewrites each numeric segment of a dotted path as a subscript, so that {@code "layer.0.foo"}
   * becomes {@code "layer[0].foo"}.
   */
  public static String subscriptNumericSegments(String path) {
    // Matches can't overlap, so a second pass picks up consecutive numeric segments ("a.0.1").
    String result = NUMERIC_SEGMENT.matcher(path).replaceAll("[$1]$2");
    return result.equals(path) ? result : subscriptNumericSegments(result);
  }

  /**
   * Call {@link String#valueOf} but swallow any errors; intended for debugging or formatting errors
   * when the system is already known to be in a bad state.
   *
   * <p>If {@code x} is an array of objects, formats as {@link java.util.Arrays#toString} (but uses
   * {@link #safeToString} for each element).
   */
  public static String safeToString(Object x) {
    if (x instanceof Object[] array) {
      return joinElements("[", "]", array.length, i -> safeToString(array[i]));
    }
    try {
      return String.valueOf(x);
    } catch (RuntimeException | AssertionError nested) {
      return "(can't print)";
    }
  }
}
