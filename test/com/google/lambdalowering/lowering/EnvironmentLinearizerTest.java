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
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class EnvironmentLinearizerTest extends ClosureConversionTestCase {

  @Override
  @Before
  public void setUp() throws Exception {
    super.setUp();
    options.setOptimizeReceiverEnvironments(false);
  }

  @Test
  public void testClosureIsPlacedOnInnermostEnvironment() {
    Variable x = local("x");
    Variable y = local("y");
    Node lambda = lambda(TypeRef.INT, IR.returnNode(IR.add(IR.name(x), IR.name(y))));
    Node method =
        staticMethod(
            "m",
            IR.paramList(),
            IR.var(x, IR.number(1)),
            block(block(IR.var(y, IR.number(2)), IR.var(func("f"), lambda))));

    ScopeTree tree = analyze(method);

    ClosureEnvironment outer = tree.getEnvironments().get(0);
    ClosureEnvironment inner = tree.getEnvironments().get(1);
    Closure closure = tree.getClosures().get(0);
    assertThat(closure.getContainingEnvironment()).isSameInstanceAs(inner);
    assertThat(inner.getLoweredClosures()).containsExactly(closure);
    // The block in between has no environment and is skipped.
    assertThat(inner.capturesParent()).isTrue();
    assertThat(inner.getParent()).isSameInstanceAs(outer);
    assertThat(outer.capturesParent()).isFalse();
  }

  @Test
  public void testChainCrossesEnclosingFunction() {
    Variable x = Variable.parameter("x", TypeRef.INT);
    Variable y = local("y");
    Node inner = lambda(TypeRef.INT, IR.returnNode(IR.add(IR.name(x), IR.name(y))));
    Node outer = lambda(TypeRef.VOID, IR.var(y, IR.number(2)), IR.var(func("g"), inner));
    Node method = staticMethod("m", IR.paramList(x), IR.var(func("f"), outer));

    ScopeTree tree = analyze(method);

    ClosureEnvironment methodEnv = tree.getEnvironments().get(0);
    ClosureEnvironment lambdaEnv = tree.getEnvironments().get(1);
    assertThat(tree.getClosure(outer.getFunction()).getContainingEnvironment())
        .isSameInstanceAs(methodEnv);
    assertThat(tree.getClosure(inner.getFunction()).getContainingEnvironment())
        .isSameInstanceAs(lambdaEnv);
    assertThat(lambdaEnv.getParent()).isSameInstanceAs(methodEnv);
  }

  @Test
  public void testUnusedOuterEnvironmentIsNotLinked() {
    Variable x = local("x");
    Variable y = local("y");
    Node method =
        staticMethod(
            "m",
            IR.paramList(),
            IR.var(x, IR.number(1)),
            IR.var(func("f"), lambda(TypeRef.INT, IR.returnNode(IR.name(x)))),
            block(
                IR.var(y, IR.number(2)),
                IR.var(func("g"), lambda(TypeRef.INT, IR.returnNode(IR.name(y))))));

    ScopeTree tree = analyze(method);

    ClosureEnvironment blockEnv = tree.getEnvironments().get(1);
    assertThat(blockEnv.capturesParent()).isFalse();
  }

  @Test
  public void testValueEnvironmentsAreNotContaining() {
    Variable x = local("x");
    FunctionSymbol f = function("f");
    Node method =
        staticMethod(
            "m",
            IR.paramList(),
            IR.var(x, IR.number(1)),
            localFunction(f, IR.returnNode(IR.name(x))),
            IR.exprResult(callFunction(f)));

    ScopeTree tree = analyze(method);

    assertThat(tree.getEnvironments().get(0).isValueType()).isTrue();
    assertThat(tree.getClosures().get(0).getContainingEnvironment()).isNull();
    assertThat(tree.getEnvironments().get(0).capturesParent()).isFalse();
  }

  @Test
  public void testReferenceChainSkipsValueEnvironment() {
    Variable a = local("a");
    Variable b = local("b");
    Variable c = local("c");
    FunctionSymbol f = function("f");
    Node lambda = lambda(TypeRef.INT, IR.returnNode(IR.add(IR.name(a), IR.name(c))));
    Node method =
        staticMethod(
            "m",
            IR.paramList(),
            IR.var(a, IR.number(1)),
            block(
                IR.var(b, IR.number(2)),
                localFunction(f, IR.returnNode(IR.name(b))),
                IR.exprResult(callFunction(f)),
                block(IR.var(c, IR.number(3)), IR.var(func("g"), lambda))));

    ScopeTree tree = analyze(method);

    ClosureEnvironment rootEnv = tree.getEnvironments().get(0);
    ClosureEnvironment valueEnv = tree.getEnvironments().get(1);
    ClosureEnvironment innerEnv = tree.getEnvironments().get(2);
    assertThat(valueEnv.isValueType()).isTrue();
    assertThat(innerEnv.getParent()).isSameInstanceAs(rootEnv);
  }
}
