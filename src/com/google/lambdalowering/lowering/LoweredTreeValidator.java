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

import com.google.lambdalowering.ir.Node;
import com.google.lambdalowering.ir.SynthesizedField;
import com.google.lambdalowering.ir.SynthesizedMethod;
import com.google.lambdalowering.ir.SynthesizedType;
import com.google.lambdalowering.ir.Token;
import com.google.lambdalowering.ir.Variable;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/** This class walks a lowered method tree and verifies that it is valid for the code emitter. */
public final class LoweredTreeValidator {

  /** Violation handler */
  public interface ViolationHandler {
    void handleViolation(String message, Node n);
  }

  private final ViolationHandler violationHandler;
  private final Set<Variable> hoistedVariables =
      Collections.newSetFromMap(new IdentityHashMap<>());

  public LoweredTreeValidator(ViolationHandler handler) {
    this.violationHandler = handler;
  }

  public LoweredTreeValidator() {
    this(
        new ViolationHandler() {
          @Override
          public void handleViolation(String message, Node n) {
            throw new ClosureConversionException(
                ClosureConversionErrors.INVALID_OUTPUT,
                message + ". Reference node:\n" + n.toStringTree());
          }
        });
  }

  public void validate(ClosureConversionResult result) {
    hoistedVariables.clear();
    for (SynthesizedType type : result.environmentTypes()) {
      for (SynthesizedField field : type.getFields()) {
        if (field.getHoistedVariable() != null) {
          hoistedVariables.add(field.getHoistedVariable());
        }
      }
    }

    Node method = result.method();
    if (!method.isMethod()) {
      violation("Expected METHOD", method);
      return;
    }
    validateBlock(method.getLastChild(), method.getFunction().isStatic());

    for (SynthesizedMethod lowered : result.loweredMethods()) {
      if (lowered.getBody() == null) {
        violation("Lowered method " + lowered + " has no body", method);
        continue;
      }
      validateBlock(lowered.getBody(), lowered.isStatic());
    }
  }

  private void validateBlock(Node block, boolean isStatic) {
    if (!block.isBlock()) {
      violation("Expected BLOCK", block);
    }
    validateNode(block, isStatic);
  }

  private void validateNode(Node n, boolean isStatic) {
    switch (n.getToken()) {
      case METHOD:
      case LAMBDA:
      case LOCAL_FUNCTION:
      case FUNCTION_NAME:
        violation("Nested function left after lowering", n);
        return;
      case THIS:
        if (isStatic) {
          violation("THIS in a static method", n);
        }
        break;
      case NAME:
      case VAR:
        validateVariable(n);
        break;
      case GETMETHOD:
      case METHOD_REF:
        validateMethodAccess(n);
        break;
      case CALL:
        validateCall(n);
        break;
      case REF:
        validateRef(n);
        break;
      case GETFIELD:
        if (!n.hasOneChild()) {
          violation("GETFIELD without a target", n);
        }
        break;
      default:
        break;
    }
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      validateNode(child, isStatic);
    }
  }

  private void validateVariable(Node n) {
    Variable variable = n.getVariable();
    // Hoisted parameters keep their slot: the prologue copies them into the environment.
    if (hoistedVariables.contains(variable) && !variable.isParameter()) {
      violation("Hoisted " + variable + " accessed through its local slot", n);
    }
  }

  private void validateMethodAccess(Node n) {
    SynthesizedMethod method = n.getMethod();
    if (method.isStatic() == n.hasChildren()) {
      violation("Receiver mismatch for " + method, n);
    }
  }

  private void validateCall(Node n) {
    Node callee = n.getFirstChild();
    if (callee.getToken() != Token.GETMETHOD) {
      return;
    }
    int expected = callee.getMethod().getParameters().size();
    int actual = n.getChildCount() - 1;
    if (expected != actual) {
      violation(
          "Expected " + expected + " arguments to " + callee.getMethod() + " but found " + actual,
          n);
    }
  }

  private void validateRef(Node n) {
    if (!n.hasOneChild() || !n.getFirstChild().isName()) {
      violation("REF of a non-variable", n);
      return;
    }
    Variable variable = n.getFirstChild().getVariable();
    if (!variable.isSynthetic()) {
      violation("REF of " + variable + ", which is not an environment", n);
    }
  }

  private void violation(String message, Node n) {
    violationHandler.handleViolation(message, n);
  }
}
