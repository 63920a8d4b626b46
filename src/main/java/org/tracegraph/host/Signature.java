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

import static com.google.common.base.Preconditions.checkArgument;
import static org.tracegraph.UnsupportedTraceException.unsupported;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The parameter list of a built-in method: parameter names in order, each with a default value
 * (which may be null). Used to bind constant arguments the same way the host would.
 */
public final class Signature {
  private final String method;
  private final ImmutableList<String> names;
  private final List<@Nullable Object> defaults;

  private Signature(String method, ImmutableList<String> names, List<@Nullable Object> defaults) {
    this.method = method;
    this.names = names;
    this.defaults = defaults;
  }

  /**
   * Creates a Signature from alternating parameter names and default values, e.g. {@code
   * Signature.of("named_parameters", "prefix", "", "recurse", true)}.
   */
  public static Signature of(String method, @Nullable Object... namesAndDefaults) {
    checkArgument(namesAndDefaults.length % 2 == 0);
    ImmutableList.Builder<String> names = ImmutableList.builder();
    @Nullable Object[] defaults = new Object[namesAndDefaults.length / 2];
    for (int i = 0; i < defaults.length; i++) {
      names.add((String) namesAndDefaults[2 * i]);
      defaults[i] = namesAndDefaults[2 * i + 1];
    }
    return new Signature(
        method, names.build(), Collections.unmodifiableList(Arrays.asList(defaults)));
  }

  public String method() {
    return method;
  }

  public ImmutableList<String> parameterNames() {
    return names;
  }

  /**
   * Binds the given positional and keyword arguments to this signature's parameters and fills in
   * defaults for any that were not given. Returns an unmodifiable map with an entry for every
   * parameter, in declaration order.
   */
  public Map<String, @Nullable Object> bind(
      List<@Nullable Object> args, Map<String, @Nullable Object> kwargs) {
    if (args.size() > names.size()) {
      throw unsupported(
          "%s() takes %s positional arguments but %s were given",
          method, names.size(), args.size());
    }
    Map<String, @Nullable Object> bound = new LinkedHashMap<>();
    for (int i = 0; i < args.size(); i++) {
      bound.put(names.get(i), args.get(i));
    }
    for (Map.Entry<String, @Nullable Object> kwarg : kwargs.entrySet()) {
      String key = kwarg.getKey();
      if (!names.contains(key)) {
        throw unsupported("%s() got an unexpected keyword argument '%s'", method, key);
      } else if (bound.containsKey(key)) {
        throw unsupported("%s() got multiple values for argument '%s'", method, key);
      }
      bound.put(key, kwarg.getValue());
    }
    Map<String, @Nullable Object> result = new LinkedHashMap<>();
    for (int i = 0; i < names.size(); i++) {
      String name = names.get(i);
      result.put(name, bound.containsKey(name) ? bound.get(name) : defaults.get(i));
    }
    return Collections.unmodifiableMap(result);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(method).append('(');
    for (int i = 0; i < names.size(); i++) {
      if (i != 0) {
        sb.append(", ");
      }
      sb.append(names.get(i)).append('=').append(defaults.get(i));
    }
    return sb.append(')').toString();
  }
}
