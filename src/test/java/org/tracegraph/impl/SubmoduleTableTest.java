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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.tracegraph.UnsupportedTraceException;
import org.tracegraph.host.BuiltinClasses;
import org.tracegraph.host.CompositeObject;
import org.tracegraph.host.DataSlot;
import org.tracegraph.source.GuardKind;
import org.tracegraph.source.Source;

@RunWith(JUnit4.class)
public class SubmoduleTableTest {
  private final GenerationTracker generations = new GenerationTracker();
  private final List<String> emitted = new ArrayList<>();
  private final SubmoduleTable table =
      new SubmoduleTable(
          generations,
          (kind, target, args, kwargs) -> {
            emitted.add(kind + " " + target);
            return new NodeRef(
                emitted.size() - 1, kind, target, ImmutableList.of(), ImmutableMap.of());
          });

  private static CompositeObject composite() {
    return new CompositeObject(BuiltinClasses.COMPOSITE);
  }

  private String register(Object value, String name) {
    TracedValue result =
        table.registerAttribute(value, name, Source.local("x"), ImmutableSet.of());
    return ((CompositeHandle) result).key();
  }

  @Test
  public void sanitizesKeys() {
    assertThat(register(composite(), "self.layers[0]")).isEqualTo("self_layers_0_");
    assertThat(register(composite(), "0")).isEqualTo("sub0");
    assertThat(register(composite(), "_private")).isEqualTo("sub_private");
  }

  @Test
  public void uniquifiesKeys() {
    CompositeObject first = composite();
    CompositeObject second = composite();
    CompositeObject third = composite();
    assertThat(register(first, "net")).isEqualTo("net");
    assertThat(register(second, "net")).isEqualTo("net_0");
    assertThat(register(third, "net")).isEqualTo("net_1");
    assertThat(table.getSubmodule("net_0")).isSameInstanceAs(second);
  }

  @Test
  public void reusesKeyForSameObject() {
    CompositeObject net = composite();
    assertThat(register(net, "net")).isEqualTo("net");
    assertThat(register(net, "other")).isEqualTo("net");
    assertThat(table.entries()).hasSize(1);
  }

  @Test
  public void childKeys() {
    CompositeObject child = composite();
    TracedValue result =
        table.addSubmodule(
            child, "net", 3, Source.local("net").item(3).asComposite(), ImmutableSet.of());
    assertThat(((CompositeHandle) result).key()).isEqualTo("net_3");
    // Only attributes reached from the program's state are guarded by identity.
    assertThat(result.guards()).isEmpty();
  }

  @Test
  public void attributesAreGuardedByIdentity() {
    Source source = Source.local("net");
    TracedValue result =
        table.registerAttribute(composite(), "net", source, ImmutableSet.of());
    assertThat(result.guards())
        .containsExactly(source.asComposite().createGuard(GuardKind.ID_MATCH));
    assertThat(result.source()).isEqualTo(source.asComposite());
  }

  @Test
  public void dataSlotsBecomeGraphNodes() {
    DataSlot weight = new DataSlot("w", 3);
    TensorValue result =
        (TensorValue)
            table.registerAttribute(
                weight, "net.weight", Source.local("net").attribute("weight"), ImmutableSet.of());
    assertThat(emitted).containsExactly("GET_ATTR net_weight");
    assertThat(result.node().target()).isEqualTo("net_weight");
    assertThat(table.getSubmodule("net_weight")).isSameInstanceAs(weight);
  }

  @Test
  public void taggedCompositesAreNotEntered() {
    CompositeObject net = composite();
    generations.tag(net);
    TracedValue result =
        table.registerAttribute(net, "net", Source.local("net"), ImmutableSet.of());
    assertThat(result).isInstanceOf(UnspecializedCompositeHandle.class);
    assertThat(table.entries()).isEmpty();
  }

  @Test
  public void otherValuesAreUnsupported() {
    assertThrows(
        UnsupportedTraceException.class,
        () -> table.registerAttribute("str", "s", Source.local("s"), ImmutableSet.of()));
  }

  @Test
  public void unknownKey() {
    assertThrows(IllegalArgumentException.class, () -> table.getSubmodule("missing"));
  }
}
