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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.lambdalowering.ir.IR;
import com.google.lambdalowering.ir.Node;
import com.google.lambdalowering.ir.TypeRef;
import com.google.lambdalowering.ir.Variable;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CompilerTest extends ClosureConversionTestCase {

  @After
  public void clearInterrupt() {
    Thread.interrupted();
  }

  private static Node methodWithLambda(String name) {
    Variable x = local("x");
    return staticMethod(
        name,
        IR.paramList(),
        IR.var(x, IR.number(1)),
        IR.var(func("f"), lambda(TypeRef.INT, IR.returnNode(IR.name(x)))));
  }

  @Test
  public void testMethodWithoutNestedFunctionsIsPassedThrough() {
    Node method = staticMethod("m", IR.paramList(), IR.returnNode());
    Compiler compiler = new Compiler(options);

    compiler.compile(ImmutableList.of(method));

    assertThat(compiler.getResults()).hasSize(1);
    ClosureConversionResult result = compiler.getResults().get(0);
    assertThat(result.method()).isSameInstanceAs(method);
    assertThat(result.environmentTypes()).isEmpty();
    assertThat(result.loweredMethods()).isEmpty();
  }

  @Test
  public void testMethodBodyIsReplacedInPlace() {
    Node method = methodWithLambda("m");
    Compiler compiler = new Compiler(options);

    compiler.compile(ImmutableList.of(method));

    assertThat(compiler.hasErrors()).isFalse();
    ClosureConversionResult result = compiler.getResults().get(0);
    assertThat(result.method()).isSameInstanceAs(method);
    assertThat(TreePrinter.print(method))
        .isEqualTo("m() { var $env0 = new Env$m$0(); $env0.x = 1; var f = $env0::m$lambda$0; }");
    assertThat(printTypes(result)).containsExactly("class Env$m$0 { int x; }");
  }

  @Test
  public void testNamesAreUniqueAcrossMethods() {
    Compiler compiler = new Compiler(options);

    compiler.compile(ImmutableList.of(methodWithLambda("m"), methodWithLambda("m")));

    assertThat(compiler.getResults()).hasSize(2);
    assertThat(printMethods(compiler.getResults().get(0)))
        .containsExactly("int Env$m$0.m$lambda$0() { return this.x; }");
    assertThat(printMethods(compiler.getResults().get(1)))
        .containsExactly("int Env$m$1.m$lambda$1() { return this.x; }");
  }

  @Test
  public void testFailedMethodIsReportedAndLeftUnchanged() {
    Node bad =
        staticMethod(
            "bad",
            IR.paramList(),
            IR.var(func("f"), lambda(OWNER, IR.returnNode(IR.thisNode()))));
    String before = TreePrinter.print(bad);
    Node good = methodWithLambda("good");
    Compiler compiler = new Compiler(options);

    compiler.compile(ImmutableList.of(bad, good));

    assertThat(compiler.hasErrors()).isTrue();
    CompilerError error = compiler.getErrors().get(0);
    assertThat(error.type()).isEqualTo(ClosureConversionErrors.MALFORMED_INPUT);
    assertThat(error.methodName()).isEqualTo("bad");
    assertThat(TreePrinter.print(bad)).isEqualTo(before);
    assertThat(compiler.getResults()).hasSize(1);
    assertThat(compiler.getResults().get(0).method()).isSameInstanceAs(good);
  }

  @Test
  public void testInterruptedBeforeMethod() {
    Compiler compiler = new Compiler(options);
    ImmutableList<Node> methods = ImmutableList.of(methodWithLambda("m"));
    Thread.currentThread().interrupt();

    RuntimeException e = assertThrows(RuntimeException.class, () -> compiler.compile(methods));

    assertThat(e).hasCauseThat().isInstanceOf(InterruptedException.class);
    assertThat(compiler.getResults()).isEmpty();
  }

  @Test
  public void testConvertIgnoresInterruptFlag() {
    Node method = methodWithLambda("m");
    Thread.currentThread().interrupt();

    ClosureConversionResult result = convert(method);

    assertThat(printTypes(result)).containsExactly("class Env$m$0 { int x; }");
    assertThat(Thread.currentThread().isInterrupted()).isTrue();
  }

  @Test
  public void testConvertRejectsAttachedMethod() {
    Node method = methodWithLambda("m");
    Node parent = block();
    parent.addChildToBack(method);

    assertConversionFails(method, ClosureConversionErrors.MALFORMED_INPUT);
    assertThat(method.getParent()).isSameInstanceAs(parent);
  }

  @Test
  public void testAttachedMethodIsReportedAndOthersConverted() {
    Node attached = methodWithLambda("attached");
    block().addChildToBack(attached);
    Node good = methodWithLambda("good");
    Compiler compiler = new Compiler(options);

    compiler.compile(ImmutableList.of(attached, good));

    assertThat(compiler.getErrors()).hasSize(1);
    CompilerError error = compiler.getErrors().get(0);
    assertThat(error.type()).isEqualTo(ClosureConversionErrors.MALFORMED_INPUT);
    assertThat(error.methodName()).isEqualTo("attached");
    assertThat(compiler.getResults()).hasSize(1);
    assertThat(compiler.getResults().get(0).method()).isSameInstanceAs(good);
  }
}
