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

package com.google.lambdalowering.ir;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class IRTest {
  private static final TypeRef OWNER = TypeRef.named("C");

  @Test
  public void testVarRejectsParametersAndReceiver() {
    Variable param = Variable.parameter("p", TypeRef.INT);
    Variable receiver = FunctionSymbol.instanceMethod("m", OWNER, TypeRef.VOID).getReceiver();

    assertThrows(IllegalArgumentException.class, () -> IR.var(param));
    assertThrows(IllegalArgumentException.class, () -> IR.var(receiver));
  }

  @Test
  public void testBlockRejectsExpressions() {
    assertThrows(IllegalStateException.class, () -> IR.block(IR.number(1)));
  }

  @Test
  public void testAssignTarget() {
    assertThrows(IllegalStateException.class, () -> IR.assign(IR.number(1), IR.number(2)));
  }

  @Test
  public void testMethodAccessReceiverMatchesStaticness() {
    SynthesizedMethod staticMethod =
        new SynthesizedMethod(
            "m$lambda$0",
            FunctionSymbol.lambda("l", TypeRef.VOID),
            null,
            OWNER,
            true,
            ImmutableList.of(),
            ImmutableList.of(),
            TypeRef.VOID);

    assertThat(IR.methodRef(null, staticMethod).hasChildren()).isFalse();
    assertThrows(
        IllegalArgumentException.class, () -> IR.getmethod(IR.thisNode(), staticMethod));
  }

  @Test
  public void testRefTakesOnlyNames() {
    assertThrows(IllegalStateException.class, () -> IR.ref(IR.thisNode()));
  }

  @Test
  public void testInstanceMethodHasReceiver() {
    FunctionSymbol instance = FunctionSymbol.instanceMethod("m", OWNER, TypeRef.VOID);
    FunctionSymbol statik = FunctionSymbol.staticMethod("s", OWNER, TypeRef.VOID);

    assertThat(instance.isStatic()).isFalse();
    assertThat(instance.getReceiver().isReceiver()).isTrue();
    assertThat(instance.getReceiver().getType()).isEqualTo(OWNER);
    assertThat(statik.isStatic()).isTrue();
    assertThat(statik.getReceiver()).isNull();
  }

  @Test
  public void testStateMachines() {
    assertThat(FunctionSymbol.localFunction("f", TypeRef.INT).isStateMachine()).isFalse();
    assertThat(FunctionSymbol.localFunction("f", TypeRef.INT).setAsync(true).isStateMachine())
        .isTrue();
    FunctionSymbol iterator = FunctionSymbol.localFunction("f", TypeRef.INT).setIterator(true);
    assertThat(iterator.isIterator()).isTrue();
    assertThat(iterator.isStateMachine()).isTrue();
  }
}
