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
import static com.google.common.truth.Truth.assertWithMessage;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.lambdalowering.ir.FunctionSymbol;
import com.google.lambdalowering.ir.IR;
import com.google.lambdalowering.ir.Node;
import com.google.lambdalowering.ir.SynthesizedMethod;
import com.google.lambdalowering.ir.SynthesizedType;
import com.google.lambdalowering.ir.Token;
import com.google.lambdalowering.ir.TypeRef;
import com.google.lambdalowering.ir.Variable;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LoweredTreeValidatorTest extends ClosureConversionTestCase {

  private final List<String> violations = new ArrayList<>();

  @Override
  @Before
  public void setUp() throws Exception {
    super.setUp();
    violations.clear();
  }

  private void valid(ClosureConversionResult result) {
    new LoweredTreeValidator((message, n) -> violations.add(message)).validate(result);
    assertWithMessage("Unexpected violations").that(violations).isEmpty();
  }

  private void invalid(ClosureConversionResult result, String expectedMessage) {
    new LoweredTreeValidator((message, n) -> violations.add(message)).validate(result);
    assertThat(violations).isNotEmpty();
    assertThat(violations.get(0)).contains(expectedMessage);
  }

  private static SynthesizedMethod staticLowered(String name, Variable... params) {
    return new SynthesizedMethod(
        name,
        function(name),
        null,
        OWNER,
        true,
        ImmutableList.of(),
        ImmutableList.copyOf(params),
        TypeRef.INT);
  }

  @Test
  public void testConversionOutputIsValid() {
    Variable x = Variable.parameter("x", TypeRef.INT);
    Variable y = local("y");
    FunctionSymbol f = function("f");
    Node inner = lambda(TypeRef.INT, IR.returnNode(IR.add(IR.name(x), IR.name(y))));
    Node method =
        staticMethod(
            "m",
            IR.paramList(x),
            IR.var(y, IR.number(0)),
            localFunction(f, IR.returnNode(IR.name(y))),
            IR.exprResult(callFunction(f)),
            IR.var(func("g"), inner));
    options.setValidateOutput(false);

    valid(convert(method));
  }

  @Test
  public void testNestedFunctionLeftOver() {
    Node method =
        staticMethod("m", IR.paramList(), IR.var(func("f"), lambda(TypeRef.VOID)));

    invalid(ClosureConversionResult.unchanged(method), "Nested function left after lowering");
  }

  @Test
  public void testThisInStaticMethod() {
    Node method = staticMethod("m", IR.paramList(), IR.exprResult(IR.thisNode()));

    invalid(ClosureConversionResult.unchanged(method), "THIS in a static method");
  }

  @Test
  public void testHoistedLocalAccessedDirectly() {
    Variable x = local("x");
    SynthesizedType env =
        new SynthesizedType("Env$m$0", SynthesizedType.Kind.REFERENCE, ImmutableList.of());
    env.addHoistedField("x", TypeRef.INT, x);
    Node method = staticMethod("m", IR.paramList(), IR.var(x, IR.number(1)));

    invalid(
        new ClosureConversionResult(method, ImmutableList.of(env), ImmutableList.of()),
        "accessed through its local slot");
  }

  @Test
  public void testHoistedParameterReadInPrologue() {
    Variable p = Variable.parameter("p", TypeRef.INT);
    SynthesizedType env =
        new SynthesizedType("Env$m$0", SynthesizedType.Kind.REFERENCE, ImmutableList.of());
    env.addHoistedField("p", TypeRef.INT, p);
    Node method = staticMethod("m", IR.paramList(p), IR.returnNode(IR.name(p)));

    valid(new ClosureConversionResult(method, ImmutableList.of(env), ImmutableList.of()));
  }

  @Test
  public void testReceiverMismatch() {
    SynthesizedMethod lowered = staticLowered("m$f$0");
    lowered.setBody(block(IR.returnNode(IR.number(0))));
    Node badRef = new Node(Token.METHOD_REF, IR.thisNode()).setMethod(lowered);
    Node method = instanceMethod("m", IR.exprResult(badRef));

    invalid(
        new ClosureConversionResult(method, ImmutableList.of(), ImmutableList.of(lowered)),
        "Receiver mismatch");
  }

  @Test
  public void testArgumentCountMismatch() {
    SynthesizedMethod lowered = staticLowered("m$f$0", Variable.parameter("a", TypeRef.INT));
    lowered.setBody(block(IR.returnNode(IR.number(0))));
    Node method =
        staticMethod("m", IR.paramList(), IR.exprResult(IR.call(IR.getmethod(null, lowered))));

    invalid(
        new ClosureConversionResult(method, ImmutableList.of(), ImmutableList.of(lowered)),
        "Expected 1 arguments");
  }

  @Test
  public void testRefOfOrdinaryLocal() {
    Variable x = local("x");
    SynthesizedMethod lowered = staticLowered("m$f$0", Variable.parameter("a", TypeRef.INT));
    lowered.setBody(block(IR.returnNode(IR.number(0))));
    Node method =
        staticMethod(
            "m",
            IR.paramList(),
            IR.var(x, IR.number(1)),
            IR.exprResult(IR.call(IR.getmethod(null, lowered), IR.ref(IR.name(x)))));

    invalid(
        new ClosureConversionResult(method, ImmutableList.of(), ImmutableList.of(lowered)),
        "which is not an environment");
  }

  @Test
  public void testLoweredMethodWithoutBody() {
    Node method = staticMethod("m", IR.paramList());

    invalid(
        new ClosureConversionResult(
            method, ImmutableList.of(), ImmutableList.of(staticLowered("m$f$0"))),
        "has no body");
  }

  @Test
  public void testDefaultHandlerThrows() {
    Node method = staticMethod("m", IR.paramList(), IR.exprResult(IR.thisNode()));

    ClosureConversionException e =
        assertThrows(
            ClosureConversionException.class,
            () -> new LoweredTreeValidator().validate(ClosureConversionResult.unchanged(method)));
    assertThat(e.getType()).isEqualTo(ClosureConversionErrors.INVALID_OUTPUT);
  }
}
