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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class HostClassTest {

  @Test
  public void lookupFollowsMro() {
    HostClass base =
        HostClass.builder("Base")
            .extending(BuiltinClasses.COMPOSITE)
            .method("forward", "base.py")
            .method("helper", "base.py")
            .build();
    HostClass derived =
        HostClass.builder("Derived").extending(base).method("forward", "derived.py").build();

    assertThat(derived.mro()).containsExactly(derived, base, BuiltinClasses.COMPOSITE).inOrder();
    assertThat(derived.lookupFunction("forward").sourceFile()).isEqualTo("derived.py");
    assertThat(derived.lookupFunction("helper").owner()).isEqualTo("Base");
    assertThat(derived.lookupFunction("children"))
        .isSameInstanceAs(BuiltinClasses.COMPOSITE.lookupFunction("children"));
    assertThat(derived.lookup("missing")).isNull();
    assertThat(derived.attributeNames()).containsAtLeast("forward", "helper", "children");
  }

  @Test
  public void containerKindIsInherited() {
    HostClass myList = HostClass.builder("MyList").extending(BuiltinClasses.COMPOSITE_LIST).build();
    assertThat(myList.containerKind()).isEqualTo(ContainerKind.INDEXED);
    assertThat(BuiltinClasses.COMPOSITE.containerKind()).isEqualTo(ContainerKind.GENERIC);
    assertThat(BuiltinClasses.SEQUENTIAL.containerKind().isSequence()).isTrue();
    assertThat(BuiltinClasses.COMPOSITE_DICT.containerKind().isSequence()).isFalse();
  }

  @Test
  public void lazyClasses() {
    HostClass linear = HostClass.builder("Linear").extending(BuiltinClasses.COMPOSITE).build();
    HostClass lazy =
        HostClass.builder("LazyLinear").extending(BuiltinClasses.COMPOSITE).becomes(linear).build();
    assertThat(lazy.isLazy()).isTrue();
    assertThat(lazy.classToBecome()).isSameInstanceAs(linear);
    assertThat(linear.isLazy()).isFalse();
    assertThrows(IllegalStateException.class, linear::classToBecome);
  }

  @Test
  public void duplicateMember() {
    HostClass.Builder builder = HostClass.builder("Net").method("forward", "a.py");
    assertThrows(IllegalStateException.class, () -> builder.method("forward", "b.py"));
  }

  @Test
  public void builtinPredicates() {
    HostClass overridden =
        HostClass.builder("MySequential")
            .extending(BuiltinClasses.SEQUENTIAL)
            .method("forward", "model.py")
            .method("__getitem__", "model.py")
            .method("__iter__", "model.py")
            .build();
    HostClass plain = HostClass.builder("Plain").extending(BuiltinClasses.SEQUENTIAL).build();

    assertThat(BuiltinClasses.hasDefaultSequentialCall(plain)).isTrue();
    assertThat(BuiltinClasses.hasDefaultSequentialCall(overridden)).isFalse();
    assertThat(BuiltinClasses.hasDefaultSequentialCall(BuiltinClasses.COMPOSITE_LIST)).isFalse();

    assertThat(BuiltinClasses.hasTrueGetItem(BuiltinClasses.COMPOSITE_LIST)).isTrue();
    assertThat(BuiltinClasses.hasTrueGetItem(BuiltinClasses.PARAMETER_DICT)).isFalse();
    assertThat(BuiltinClasses.hasTrueGetItem(overridden)).isFalse();

    assertThat(BuiltinClasses.hasDefaultIteration(plain)).isTrue();
    assertThat(BuiltinClasses.hasDefaultIteration(overridden)).isFalse();
    assertThat(BuiltinClasses.hasDefaultIteration(BuiltinClasses.COMPOSITE_DICT)).isFalse();

    assertThat(BuiltinClasses.isBaseBehavior(plain.lookupFunction("train"))).isTrue();
    assertThat(BuiltinClasses.isBaseBehavior(overridden.lookupFunction("forward"))).isFalse();
    assertThat(BuiltinClasses.isDictLike(BuiltinClasses.PARAMETER_DICT)).isTrue();
  }
}
