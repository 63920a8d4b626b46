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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.tracegraph.host.BuiltinClasses;
import org.tracegraph.host.CompositeObject;
import org.tracegraph.host.HostClass;

@RunWith(JUnit4.class)
public class CompositeHandleCallTest {
  private final FakeTraceContext ctx = new FakeTraceContext();

  private static HostClass layer(String name) {
    return HostClass.builder(name)
        .extending(BuiltinClasses.COMPOSITE)
        .method("forward", "model.py")
        .build();
  }

  private CompositeHandle local(CompositeObject obj) {
    return (CompositeHandle) ctx.local("model", obj);
  }

  @Test
  public void unrollsSequential() {
    HostClass a = layer("A");
    HostClass b = layer("B");
    HostClass c = layer("C");
    ctx.primitive.addAll(ImmutableList.of(a, b, c));
    CompositeHandle handle =
        local(
            CompositeObject.sequenceOf(
                BuiltinClasses.SEQUENTIAL,
                new CompositeObject(a),
                new CompositeObject(b),
                new CompositeObject(c)));
    TracedValue v0 = ConstantValue.of("v0");

    TensorValue result =
        (TensorValue) handle.invoke(ctx, ImmutableList.of(v0), ImmutableMap.of());

    assertThat(ctx.log)
        .containsExactly(
            "call Composite(A, model_0)",
            "call Composite(B, model_1)",
            "call Composite(C, model_2)")
        .inOrder();
    assertThat(ctx.nodes).hasSize(3);
    NodeRef first = ctx.nodes.get(0);
    NodeRef second = ctx.nodes.get(1);
    NodeRef third = ctx.nodes.get(2);
    assertThat(first.target()).isEqualTo("model_0");
    assertThat(first.args()).containsExactly(v0);
    assertThat(((TensorValue) second.args().get(0)).node()).isEqualTo(first);
    assertThat(((TensorValue) third.args().get(0)).node()).isEqualTo(second);
    assertThat(result.node()).isEqualTo(third);
  }

  @Test
  public void overriddenSequentialForwardIsInlined() {
    HostClass mySequential =
        HostClass.builder("MySequential")
            .extending(BuiltinClasses.SEQUENTIAL)
            .method("forward", "model.py")
            .build();
    CompositeHandle handle =
        local(
            CompositeObject.sequenceOf(
                mySequential, new CompositeObject(BuiltinClasses.COMPOSITE)));

    handle.invoke(ctx, ImmutableList.of(ConstantValue.of(1)), ImmutableMap.of());

    assertThat(ctx.log).containsExactly("inline Function(MySequential.forward) 2");
    assertThat(ctx.nodes).isEmpty();
  }

  @Test
  public void sequentialWithTwoArgumentsIsInlined() {
    CompositeHandle handle =
        local(
            CompositeObject.sequenceOf(
                BuiltinClasses.SEQUENTIAL, new CompositeObject(BuiltinClasses.COMPOSITE)));

    handle.invoke(
        ctx, ImmutableList.of(ConstantValue.of(1), ConstantValue.of(2)), ImmutableMap.of());

    assertThat(ctx.log).containsExactly("inline Function(Sequential.forward) 3");
  }

  @Test
  public void primitiveCallEmitsOneNode() {
    HostClass linear = layer("Linear");
    ctx.primitive.add(linear);
    CompositeHandle handle = local(new CompositeObject(linear));
    TracedValue x = ConstantValue.of("x");

    TensorValue result =
        (TensorValue) handle.invoke(ctx, ImmutableList.of(x), ImmutableMap.of("bias", x));

    assertThat(result.node().kind()).isEqualTo(NodeKind.CALL_MODULE);
    assertThat(result.node().target()).isEqualTo("model");
    assertThat(result.node().args()).containsExactly(x);
    assertThat(result.node().kwargs()).containsExactly("bias", x);
    assertThat(handle.typeOf()).isSameInstanceAs(linear);
  }

  @Test
  public void lazyPrimitiveChangesType() {
    HostClass linear = layer("Linear");
    HostClass lazy =
        HostClass.builder("LazyLinear").extending(BuiltinClasses.COMPOSITE).becomes(linear).build();
    ctx.primitive.add(lazy);
    CompositeHandle handle = local(new CompositeObject(lazy));
    assertThat(handle.typeOf()).isSameInstanceAs(lazy);

    handle.invoke(ctx, ImmutableList.of(ConstantValue.of("x")), ImmutableMap.of());

    assertThat(handle.typeOf()).isSameInstanceAs(linear);
    assertThat(ctx.nodes).hasSize(1);
  }

  @Test
  public void lazyNonPrimitiveInlinesCall() {
    HostClass lazy =
        HostClass.builder("LazyNet")
            .extending(BuiltinClasses.COMPOSITE)
            .becomes(layer("Net"))
            .build();
    CompositeHandle handle = local(new CompositeObject(lazy));

    handle.invoke(ctx, ImmutableList.of(ConstantValue.of("x")), ImmutableMap.of());

    assertThat(ctx.log).containsExactly("inline Function(Composite.__call__) 2");
    assertThat(handle.typeOf()).isSameInstanceAs(lazy);
  }

  @Test
  public void forwardMethodIsCall() {
    HostClass net = layer("Net");
    CompositeHandle handle = local(new CompositeObject(net));

    handle.invokeMethod(ctx, "forward", ImmutableList.of(ConstantValue.of("x")), ImmutableMap.of());

    assertThat(ctx.log).containsExactly("inline Function(Net.forward) 2");
  }
}
