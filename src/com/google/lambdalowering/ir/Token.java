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

/** The kinds of nodes in a typed method tree. */
public enum Token {
  // Function containers
  METHOD,
  LAMBDA,
  LOCAL_FUNCTION,
  PARAM_LIST,

  // Statements
  BLOCK,
  VAR,
  EXPR_RESULT,
  RETURN,
  IF,
  WHILE,

  // Expressions
  NAME,
  THIS,
  FUNCTION_NAME, // reference to a local function
  CALL,
  GETPROP, // member of an ordinary object
  NUMBER,
  STRINGLIT,
  TRUE,
  FALSE,
  NULL,
  ASSIGN,
  ADD,
  SUB,
  MUL,
  LT,
  EQ,
  NOT,

  // Only produced by closure conversion
  GETFIELD, // field of a synthesized type
  GETMETHOD, // callee naming a lowered method
  METHOD_REF, // lowered method converted to a callable value
  NEW_ENV, // allocation of a reference-typed environment
  DEFAULT_ENV, // zeroed value-typed environment
  REF; // by-reference argument

  /** Returns the operator text of a binary or unary operator, or null. */
  public static String opToStr(Token token) {
    switch (token) {
      case ASSIGN:
        return "=";
      case ADD:
        return "+";
      case SUB:
        return "-";
      case MUL:
        return "*";
      case LT:
        return "<";
      case EQ:
        return "==";
      case NOT:
        return "!";
      default:
        return null;
    }
  }

  public boolean isBinaryOperator() {
    switch (this) {
      case ASSIGN:
      case ADD:
      case SUB:
      case MUL:
      case LT:
      case EQ:
        return true;
      default:
        return false;
    }
  }

  public boolean isFunction() {
    return this == METHOD || this == LAMBDA || this == LOCAL_FUNCTION;
  }
}
