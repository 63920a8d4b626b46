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

import com.google.common.collect.ImmutableSet;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.tracegraph.RestartAnalysis;
import org.tracegraph.UnsupportedTraceException;
import org.tracegraph.host.BuiltinClasses;
import org.tracegraph.host.ClassMember;
import org.tracegraph.host.CompositeObject;
import org.tracegraph.host.DataSlot;
import org.tracegraph.host.HostClass;
import org.tracegraph.host.HostFunction;
import org.tracegraph.source.Guard;
import org.tracegraph.source.GuardKind;
import org.tracegraph.source.Source;

@RunWith(TestParameterInjector.class)
public class CompositeHandleTest {

  /** The kinds of class member that can shadow a child composite of the same name. */
  enum Shadow {
    PROPERTY,
    CLASS_METHOD,
    STATIC_METHOD,
    INSTANCE_METHOD;

    ClassMember member(HostFunction fn) {
      return switch (this) {
        case PROPERTY -> ClassMember.property(fn);
        case CLASS_METHOD -> ClassMember.classMethod(fn);
        case STATIC_METHOD -> ClassMember.staticMethod(fn);
        case INSTANCE_METHOD -> ClassMember.instanceMethod(fn);
      };
    }
  }

  private final FakeTraceContext ctx = new FakeTraceContext();

  private static final Source MODEL = Source.local("model").asComposite();

  private CompositeHandle local(CompositeObject obj) {
    return (CompositeHandle) ctx.local("model", obj);
  }

  @Test
  public void classMemberShadowsChild(
      @TestParameter Shadow shadow, @TestParameter boolean declaredOnAncestor) {
    HostFunction fn = new HostFunction("Base", "n", "net.py");
    HostClass base =
        HostClass.builder("Base")
            .extending(BuiltinClasses.COMPOSITE)
            .member(declaredOnAncestor ? "n" : "unrelated", shadow.member(fn))
            .build();
    HostClass.Builder netBuilder = HostClass.builder("Net").extending(base);
    if (!declaredOnAncestor) {
      netBuilder.member("n", shadow.member(fn));
    }
    CompositeObject net = new CompositeObject(netBuilder.build());
    net.addChild("n", new CompositeObject(BuiltinClasses.COMPOSITE));
    CompositeHandle handle = local(net);

    TracedValue result = handle.resolveAttribute(ctx, "n");

    assertThat(result).isNotInstanceOf(CompositeHandle.class);
    switch (shadow) {
      case PROPERTY -> assertThat(ctx.log).containsExactly("inline Function(Base.n) 1");
      case CLASS_METHOD -> {
        BoundMethodValue method = (BoundMethodValue) result;
        assertThat(method.function()).isSameInstanceAs(fn);
        assertThat(((ClassValue) method.receiver()).hostClass()).isSameInstanceAs(net.type());
      }
      case STATIC_METHOD -> assertThat(((FunctionValue) result).function()).isSameInstanceAs(fn);
      case INSTANCE_METHOD -> {
        BoundMethodValue method = (BoundMethodValue) result;
        assertThat(method.function()).isSameInstanceAs(fn);
        assertThat(method.receiver()).isSameInstanceAs(handle);
      }
    }
  }

  @Test
  public void unshadowedChild() {
    CompositeObject net = new CompositeObject(BuiltinClasses.COMPOSITE);
    CompositeObject encoder = new CompositeObject(BuiltinClasses.COMPOSITE);
    net.addChild("encoder", encoder);
    CompositeHandle handle = local(net);

    CompositeHandle child = (CompositeHandle) handle.resolveAttribute(ctx, "encoder");

    Source expected = MODEL.attribute("encoder").asComposite();
    assertThat(child.source()).isEqualTo(expected);
    assertThat(child.key()).isEqualTo("model_encoder");
    assertThat(ctx.table.getSubmodule(child.key())).isSameInstanceAs(encoder);
    assertThat(child.guards())
        .containsAtLeast(
            MODEL.createGuard(GuardKind.ID_MATCH), expected.createGuard(GuardKind.ID_MATCH));
  }

  @Test
  public void slotsBeforeChildren() {
    CompositeObject net = new CompositeObject(BuiltinClasses.COMPOSITE);
    net.addChild("encoder", new CompositeObject(BuiltinClasses.COMPOSITE));
    net.setSlot("encoder", 42);
    TracedValue result = local(net).resolveAttribute(ctx, "encoder");
    assertThat(result.asConstant()).isEqualTo(42);
  }

  @Test
  public void parametersAndBuffers() {
    CompositeObject net = new CompositeObject(BuiltinClasses.COMPOSITE);
    net.addParameter("weight", new DataSlot("w", 3, 4));
    net.addBuffer("mean", new DataSlot("m", 4));
    CompositeHandle handle = local(net);

    TensorValue weight = (TensorValue) handle.resolveAttribute(ctx, "weight");
    TensorValue mean = (TensorValue) handle.resolveAttribute(ctx, "mean");

    assertThat(weight.node().kind()).isEqualTo(NodeKind.GET_ATTR);
    assertThat(weight.node().target()).isEqualTo("model_weight");
    assertThat(mean.node().target()).isEqualTo("model_mean");
    assertThat(ctx.nodes).hasSize(2);
  }

  @Test
  public void classAttribute() {
    CompositeObject net = new CompositeObject(BuiltinClasses.SEQUENTIAL);
    ClassValue result = (ClassValue) local(net).resolveAttribute(ctx, "__class__");
    assertThat(result.hostClass()).isSameInstanceAs(BuiltinClasses.SEQUENTIAL);
  }

  @Test
  public void opaqueClassMember() {
    HostClass cls =
        HostClass.builder("Net")
            .extending(BuiltinClasses.COMPOSITE)
            .member("table", ClassMember.opaque(new int[0]))
            .build();
    CompositeHandle handle = local(new CompositeObject(cls));
    UnsupportedTraceException e =
        assertThrows(UnsupportedTraceException.class, () -> handle.resolveAttribute(ctx, "table"));
    assertThat(e).hasMessageThat().isEqualTo("class property Net int[]");
  }

  @Test
  public void missingAttribute() {
    CompositeHandle handle = local(new CompositeObject(BuiltinClasses.COMPOSITE));
    UnsupportedTraceException e =
        assertThrows(UnsupportedTraceException.class, () -> handle.resolveAttribute(ctx, "nope"));
    assertThat(e).hasMessageThat().contains("'Composite' object has no attribute 'nope'");
  }

  @Test
  public void hasAttribute(@TestParameter boolean present) {
    CompositeObject net = new CompositeObject(BuiltinClasses.COMPOSITE);
    if (present) {
      net.addChild("head", new CompositeObject(BuiltinClasses.COMPOSITE));
    }
    TracedValue result = local(net).hasAttribute(ctx, "head");

    assertThat(result.asConstant()).isEqualTo(present);
    Guard guard = MODEL.attribute("head").asComposite().createGuard(GuardKind.HASATTR);
    assertThat(result.guards()).contains(guard);
    assertThat(guard.attributeName()).isEqualTo("head");
  }

  @Test
  public void trainingMode() {
    CompositeObject net = new CompositeObject(BuiltinClasses.COMPOSITE);
    CompositeHandle handle = local(net);
    assertThat(handle.isInTrainingMode(ctx)).isTrue();
    net.setSlot("training", false);
    assertThat(handle.isInTrainingMode(ctx)).isFalse();
    net.removeSlot("training");
    assertThat(handle.isInTrainingMode(ctx)).isFalse();
  }

  @Test
  public void forceUnspecialize() {
    CompositeObject net = new CompositeObject(BuiltinClasses.COMPOSITE);
    CompositeHandle handle = local(net);
    assertThrows(RestartAnalysis.class, () -> handle.forceUnspecialize(ctx));
    assertThat(ctx.generations.isTagged(net)).isTrue();
  }

  @Test
  public void expandToSequence() {
    CompositeObject a = new CompositeObject(BuiltinClasses.COMPOSITE);
    CompositeObject b = new CompositeObject(BuiltinClasses.COMPOSITE);
    CompositeHandle handle =
        local(CompositeObject.sequenceOf(BuiltinClasses.COMPOSITE_LIST, a, b));

    var elements = handle.expandToSequence(ctx);

    assertThat(elements).hasSize(2);
    CompositeHandle second = (CompositeHandle) elements.get(1);
    assertThat(second.source()).isEqualTo(MODEL.item(1).asComposite());
    assertThat(second.key()).isEqualTo("model_1");
    assertThat(ctx.table.getSubmodule("model_1")).isSameInstanceAs(b);
  }

  @Test
  public void expandGenericComposite() {
    CompositeHandle handle = local(new CompositeObject(BuiltinClasses.COMPOSITE));
    assertThrows(UnsupportedTraceException.class, () -> handle.expandToSequence(ctx));
  }

  @Test
  public void requiresSource() {
    assertThrows(
        NullPointerException.class,
        () -> new CompositeHandle(BuiltinClasses.COMPOSITE, "k", null, ImmutableSet.of()));
  }
}
