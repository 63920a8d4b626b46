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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.tracegraph.UnsupportedTraceException;

@RunWith(JUnit4.class)
public class SignatureTest {
  private static final Signature NAMED_PARAMETERS = BuiltinClasses.NAMED_PARAMETERS;

  @Test
  public void defaults() {
    Map<String, Object> bound = NAMED_PARAMETERS.bind(ImmutableList.of(), ImmutableMap.of());
    assertThat(bound)
        .containsExactly("prefix", "", "recurse", true, "remove_duplicate", true)
        .inOrder();
  }

  @Test
  public void positionalAndKeyword() {
    Map<String, Object> bound =
        NAMED_PARAMETERS.bind(ImmutableList.of("net"), ImmutableMap.of("recurse", false));
    assertThat(bound).containsEntry("prefix", "net");
    assertThat(bound).containsEntry("recurse", false);
    assertThat(bound).containsEntry("remove_duplicate", true);
  }

  @Test
  public void nullDefault() {
    Map<String, Object> bound =
        BuiltinClasses.NAMED_MODULES.bind(ImmutableList.of(), ImmutableMap.of());
    assertThat(bound).containsKey("memo");
    assertThat(bound.get("memo")).isNull();
  }

  @Test
  public void errors() {
    UnsupportedTraceException e =
        assertThrows(
            UnsupportedTraceException.class,
            () -> BuiltinClasses.PARAMETERS.bind(ImmutableList.of(true, true), ImmutableMap.of()));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("parameters() takes 1 positional arguments but 2 were given");
    assertThrows(
        UnsupportedTraceException.class,
        () -> NAMED_PARAMETERS.bind(ImmutableList.of(), ImmutableMap.of("depth", 1)));
    assertThrows(
        UnsupportedTraceException.class,
        () -> NAMED_PARAMETERS.bind(ImmutableList.of("a"), ImmutableMap.of("prefix", "b")));
  }

  @Test
  public void printing() {
    assertThat(BuiltinClasses.PARAMETERS.toString()).isEqualTo("parameters(recurse=true)");
  }
}
