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
public final class EnvironmentAllocatorTest extends ClosureConversionTestCase {

  private ScopeTree allocate(Node method) {
    ScopeTree tree = ScopeTreeBuilder.build(method);
    CaptureAnalyzer.analyze(tree);
    EnvironmentAllocator.allocate(tree, options);
    return tree;
  }

  @Test
  public void testNoCapturesNoEnvironments() {
    Variable x = local("x");
    Node method =
        staticMethod(
            "m",
            IR.paramList(),
            IR.var(x, IR.number(1)),
            IR.var(func("f"), lambda(TypeRef.INT, IR.returnNode(IR.number(2)))));

    ScopeTree tree = allocate(method);

    assertThat(tree.getEnvironments()).isEmpty();
    assertThat(tree.getClosures().get(0).getCapturedEnvironments()).isEmpty();
  }

  @Test
  public void testOneEnvironmentPerScopeHoistingOnlyCapturedVariables() {
    Variable x = local("x");
    Variable unused = local("unused");
    Variable y = local("y");
    Node lambda = lambda(TypeRef.INT, IR.returnNode(IR.add(IR.name(x), IR.name(y))));
    Node method =
        staticMethod(
            "m",
            IR.paramList(),
            IR.var(x, IR.number(1)),
            IR.var(unused, IR.number(2)),
            block(IR.var(y, IR.number(3)), IR.var(func("f"), lambda)));

    ScopeTree tree = allocate(method);

    assertThat(tree.getEnvironments()).hasSize(2);
    ClosureEnvironment rootEnv = tree.getEnvironments().get(0);
    ClosureEnvironment blockEnv = tree.getEnvironments().get(1);
    assertThat(rootEnv.getIndex()).isEqualTo(0);
    assertThat(rootEnv.getScope()).isSameInstanceAs(tree.getRoot());
    assertThat(rootEnv.getHoistedVariables()).containsExactly(x);
    assertThat(blockEnv.getIndex()).isEqualTo(1);
    assertThat(blockEnv.getHoistedVariables()).containsExactly(y);
    assertThat(tree.getHoistingEnvironment(unused)).isNull();
    assertThat(tree.getHoistingEnvironment(y)).isSameInstanceAs(blockEnv);
    assertThat(tree.getClosures().get(0).getCapturedEnvironments())
        .containsExactly(rootEnv, blockEnv)
        .inOrder();
  }

  @Test
  public void testLambdaForcesReferenceEnvironment() {
    Variable x = local("x");
    FunctionSymbol f = function("f");
    Node method =
        staticMethod(
            "m",
            IR.paramList(),
            IR.var(x, IR.number(1)),
            localFunction(f, IR.returnNode(IR.name(x))),
            IR.exprResult(callFunction(f)),
            IR.var(func("g"), lambda(TypeRef.INT, IR.returnNode(IR.name(x)))));

    ScopeTree tree = allocate(method);

    assertThat(tree.getEnvironments()).hasSize(1);
    assertThat(tree.getEnvironments().get(0).isReferenceType()).isTrue();
  }

  @Test
  public void testDirectlyCalledFunctionsGetValueEnvironment() {
    Variable x = local("x");
    FunctionSymbol f = function("f");
    Node method =
        staticMethod(
            "m",
            IR.paramList(),
            IR.var(x, IR.number(1)),
            localFunction(f, IR.returnNode(IR.name(x))),
            IR.exprResult(callFunction(f)));

    ScopeTree tree = allocate(method);

    assertThat(tree.getEnvironments().get(0).isValueType()).isTrue();
  }

  @Test
  public void testValueEnvironmentsDisabled() {
    options.setValueTypeEnvironments(false);
    Variable x = local("x");
    FunctionSymbol f = function("f");
    Node method =
        staticMethod(
            "m",
            IR.paramList(),
            IR.var(x, IR.number(1)),
            localFunction(f, IR.returnNode(IR.name(x))),
            IR.exprResult(callFunction(f)));

    ScopeTree tree = allocate(method);

    assertThat(tree.getEnvironments().get(0).isReferenceType()).isTrue();
  }

  @Test
  public void testIteratorForcesReferenceEnvironment() {
    Variable x = local("x");
    FunctionSymbol f = function("f").setIterator(true);
    Node method =
        staticMethod(
            "m",
            IR.paramList(),
            IR.var(x, IR.number(1)),
            localFunction(f, IR.returnNode(IR.name(x))),
            IR.exprResult(callFunction(f)));

    ScopeTree tree = allocate(method);

    assertThat(tree.getEnvironments().get(0).isReferenceType()).isTrue();
  }

  @Test
  public void testReceiverIsHoistedIntoRootEnvironment() {
    Node method =
        instanceMethod("m", IR.var(func("f"), lambda(OWNER, IR.returnNode(IR.thisNode()))));

    ScopeTree tree = allocate(method);

    ClosureEnvironment env = tree.getEnvironments().get(0);
    assertThat(env.getScope()).isSameInstanceAs(tree.getRoot());
    assertThat(env.hoistsOnlyReceiver()).isTrue();
    assertThat(tree.getHoistingEnvironment(tree.getReceiver())).isSameInstanceAs(env);
  }
}
