/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.lambdalowering.lowering;

import static com.google.common.truth.Truth.assertThat;

import com.google.lambdalowering.ir.FunctionSymbol;
import com.google.lambdalowering.ir.IR;
import com.google.lambdalowering.ir.Node;
import com.google.lambdalowering.ir.TypeRef;
import com.google.lambdalowering.ir.Variable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class EnvironmentOptimizerTest extends ClosureConversionTestCase {

  @Test
  public void testReceiverOnlyReferenceEnvironmentIsRemoved() {
    Node lambda = lambda(OWNER, IR.returnNode(IR.thisNode()));
    Node method = instanceMethod("m", IR.var(func("f"), lambda));

    ScopeTree tree = analyze(method);

    assertThat(tree.getEnvironments()).isEmpty();
    assertThat(tree.getRoot().getEnvironment()).isNull();
    assertThat(tree.getHoistingEnvironment(tree.getReceiver())).isNull();
    Closure closure = tree.getClosures().get(0);
    assertThat(closure.getContainingEnvironment()).isNull();
    assertThat(closure.getCapturedEnvironments()).isEmpty();
    assertThat(closure.capturesReceiver()).isTrue();
  }

  @Test
  public void testReceiverOnlyEnvironmentKeptWhenDisabled() {
    options.setOptimizeReceiverEnvironments(false);
    Node lambda = lambda(OWNER, IR.returnNode(IR.thisNode()));
    Node method = instanceMethod("m", IR.var(func("f"), lambda));

    ScopeTree tree = analyze(method);

    assertThat(tree.getEnvironments()).hasSize(1);
    assertThat(tree.getClosures().get(0).getContainingEnvironment())
        .isSameInstanceAs(tree.getEnvironments().get(0));
  }

  @Test
  public void testChildEnvironmentIsRelinkedToReceiver() {
    Variable y = local("y");
    Node inner =
        lambda(
            TypeRef.OBJECT,
            IR.returnNode(IR.add(IR.getprop(IR.thisNode(), "foo"), IR.name(y))));
    Node outer = lambda(TypeRef.VOID, IR.var(y, IR.number(1)), IR.var(func("g"), inner));
    Node method = instanceMethod("m", IR.var(func("f"), outer));

    ScopeTree tree = analyze(method);

    assertThat(tree.getEnvironments()).hasSize(1);
    ClosureEnvironment env = tree.getEnvironments().get(0);
    assertThat(env.getIndex()).isEqualTo(1);
    assertThat(env.isParentReceiver()).isTrue();
    assertThat(tree.getClosure(outer.getFunction()).getContainingEnvironment()).isNull();
    assertThat(tree.getClosure(inner.getFunction()).getContainingEnvironment())
        .isSameInstanceAs(env);
    assertThat(tree.getClosure(inner.getFunction()).getCapturedEnvironments())
        .containsExactly(env);
  }

  @Test
  public void testEnvironmentHoistingMoreThanReceiverIsKept() {
    Variable x = local("x");
    Node lambda =
        lambda(
            TypeRef.OBJECT,
            IR.returnNode(IR.add(IR.getprop(IR.thisNode(), "foo"), IR.name(x))));
    Node method = instanceMethod("m", IR.var(x, IR.number(1)), IR.var(func("f"), lambda));

    ScopeTree tree = analyze(method);

    assertThat(tree.getEnvironments()).hasSize(1);
    assertThat(tree.getEnvironments().get(0).getHoistedVariables())
        .containsExactly(tree.getReceiver(), x);
  }

  @Test
  public void testReceiverOnlyValueEnvironmentIsRemoved() {
    FunctionSymbol f = function("f");
    Node method =
        instanceMethod(
            "m",
            localFunction(f, IR.returnNode(IR.getprop(IR.thisNode(), "foo"))),
            IR.exprResult(callFunction(f)));

    ScopeTree tree = analyze(method);

    assertThat(tree.getEnvironments()).isEmpty();
    assertThat(tree.getClosures().get(0).getCapturedEnvironments()).isEmpty();
  }

  @Test
  public void testReceiverOnlyValueEnvironmentKeptForFunctionOnEnvironment() {
    Variable y = local("y");
    FunctionSymbol f = function("f");
    Node method =
        instanceMethod(
            "m",
            block(
                IR.var(y, IR.number(1)),
                IR.var(func("g"), lambda(TypeRef.INT, IR.returnNode(IR.name(y)))),
                localFunction(
                    f, IR.returnNode(IR.add(IR.getprop(IR.thisNode(), "foo"), IR.name(y)))),
                IR.exprResult(callFunction(f))));

    ScopeTree tree = analyze(method);

    assertThat(tree.getEnvironments()).hasSize(2);
    ClosureEnvironment receiverEnv = tree.getEnvironments().get(0);
    assertThat(receiverEnv.isValueType()).isTrue();
    assertThat(receiverEnv.hoistsOnlyReceiver()).isTrue();
    Closure closure = tree.getClosure(f);
    assertThat(closure.getContainingEnvironment()).isSameInstanceAs(tree.getEnvironments().get(1));
  }
}
