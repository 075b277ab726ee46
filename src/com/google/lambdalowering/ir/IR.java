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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.util.List;
import org.jspecify.annotations.Nullable;

/** An AST construction helper class. */
public class IR {

  private IR() {}

  public static Node method(FunctionSymbol symbol, Node params, Node body) {
    checkArgument(symbol.isMethod(), symbol);
    return function(Token.METHOD, symbol, params, body);
  }

  public static Node lambda(FunctionSymbol symbol, Node params, Node body) {
    checkArgument(symbol.isLambda(), symbol);
    return function(Token.LAMBDA, symbol, params, body);
  }

  public static Node localFunction(FunctionSymbol symbol, Node params, Node body) {
    checkArgument(symbol.isLocalFunction(), symbol);
    return function(Token.LOCAL_FUNCTION, symbol, params, body);
  }

  private static Node function(Token token, FunctionSymbol symbol, Node params, Node body) {
    checkState(params.isParamList());
    checkState(body.isBlock());
    return new Node(token, params, body).setFunction(symbol);
  }

  public static Node paramList(Variable... params) {
    Node list = new Node(Token.PARAM_LIST);
    for (Variable param : params) {
      checkArgument(param.isParameter(), "not a parameter: %s", param);
      list.addChildToBack(name(param));
    }
    return list;
  }

  public static Node paramList(List<Variable> params) {
    return paramList(params.toArray(new Variable[0]));
  }

  public static Node block(Node... statements) {
    Node block = new Node(Token.BLOCK);
    for (Node stmt : statements) {
      checkState(mayBeStatement(stmt), "not a statement: %s", stmt);
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node var(Variable variable) {
    checkArgument(!variable.isParameter() && !variable.isReceiver(), variable);
    return new Node(Token.VAR).setVariable(variable);
  }

  public static Node var(Variable variable, Node value) {
    checkState(mayBeExpression(value), value);
    Node var = var(variable);
    var.addChildToBack(value);
    return var;
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.RETURN, expr);
  }

  public static Node ifNode(Node cond, Node then) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    return new Node(Token.IF, cond, then);
  }

  public static Node ifNode(Node cond, Node then, Node elseNode) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    checkState(elseNode.isBlock());
    return new Node(Token.IF, cond, then, elseNode);
  }

  public static Node whileNode(Node cond, Node body) {
    checkState(mayBeExpression(cond));
    checkState(body.isBlock());
    return new Node(Token.WHILE, cond, body);
  }

  public static Node name(Variable variable) {
    return new Node(Token.NAME).setVariable(variable);
  }

  public static Node thisNode() {
    return new Node(Token.THIS);
  }

  public static Node functionName(FunctionSymbol function) {
    checkArgument(function.isLocalFunction(), function);
    return new Node(Token.FUNCTION_NAME).setFunction(function);
  }

  public static Node call(Node target, Node... args) {
    checkState(mayBeExpression(target), target);
    Node call = new Node(Token.CALL, target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node getprop(Node target, String prop) {
    checkState(mayBeExpression(target));
    Node getprop = Node.newString(Token.GETPROP, prop);
    getprop.addChildToBack(target);
    return getprop;
  }

  public static Node assign(Node target, Node expr) {
    checkState(target.isName() || target.getToken() == Token.GETFIELD, target);
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.ASSIGN, target, expr);
  }

  public static Node add(Node expr1, Node expr2) {
    return binaryOp(Token.ADD, expr1, expr2);
  }

  public static Node sub(Node expr1, Node expr2) {
    return binaryOp(Token.SUB, expr1, expr2);
  }

  public static Node mul(Node expr1, Node expr2) {
    return binaryOp(Token.MUL, expr1, expr2);
  }

  public static Node lt(Node expr1, Node expr2) {
    return binaryOp(Token.LT, expr1, expr2);
  }

  public static Node eq(Node expr1, Node expr2) {
    return binaryOp(Token.EQ, expr1, expr2);
  }

  public static Node not(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.NOT, expr);
  }

  private static Node binaryOp(Token token, Node expr1, Node expr2) {
    checkState(mayBeExpression(expr1), expr1);
    checkState(mayBeExpression(expr2), expr2);
    return new Node(token, expr1, expr2);
  }

  public static Node number(double d) {
    return Node.newNumber(d);
  }

  public static Node string(String s) {
    return Node.newString(Token.STRINGLIT, s);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  public static Node nullNode() {
    return new Node(Token.NULL);
  }

  // Nodes produced by closure conversion.

  public static Node getfield(Node target, SynthesizedField field) {
    checkState(mayBeExpression(target), target);
    return new Node(Token.GETFIELD, target).setField(field);
  }

  /** A callee naming {@code method}; {@code receiver} is null for a static method. */
  public static Node getmethod(@Nullable Node receiver, SynthesizedMethod method) {
    return methodAccess(Token.GETMETHOD, receiver, method);
  }

  /** Converts {@code method} to a callable value; {@code receiver} is null for a static method. */
  public static Node methodRef(@Nullable Node receiver, SynthesizedMethod method) {
    return methodAccess(Token.METHOD_REF, receiver, method);
  }

  private static Node methodAccess(
      Token token, @Nullable Node receiver, SynthesizedMethod method) {
    checkArgument((receiver == null) == method.isStatic(), "receiver mismatch for %s", method);
    Node n = new Node(token).setMethod(method);
    if (receiver != null) {
      checkState(mayBeExpression(receiver), receiver);
      n.addChildToBack(receiver);
    }
    return n;
  }

  public static Node newEnv(TypeRef type) {
    return new Node(Token.NEW_ENV).setTypeRef(type);
  }

  public static Node defaultEnv(TypeRef type) {
    return new Node(Token.DEFAULT_ENV).setTypeRef(type);
  }

  public static Node ref(Node target) {
    checkState(target.isName(), "only locals and parameters are passed by reference: %s", target);
    return new Node(Token.REF, target);
  }

  /**
   * It isn't possible to always determine if a detached node is an expression, so just reject
   * known statements.
   */
  public static boolean mayBeStatement(Node n) {
    switch (n.getToken()) {
      case BLOCK:
      case VAR:
      case EXPR_RESULT:
      case RETURN:
      case IF:
      case WHILE:
      case LOCAL_FUNCTION:
        return true;
      default:
        return false;
    }
  }

  public static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case METHOD:
      case PARAM_LIST:
      case LOCAL_FUNCTION:
        return false;
      default:
        return !mayBeStatement(n);
    }
  }
}
