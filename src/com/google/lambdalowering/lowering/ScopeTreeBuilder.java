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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.lambdalowering.ir.Node;
import com.google.lambdalowering.ir.Variable;
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;

/**
 * Mirrors the lexical nesting of a method body into a {@link ScopeTree}: one scope per block and
 * per function body, with every declared variable and nested function attached to the scope that
 * owns it. No captures are computed here.
 */
final class ScopeTreeBuilder implements NodeTraversal.Callback {
  private final Deque<Scope> scopeStack = new ArrayDeque<>();
  private @Nullable ScopeTree tree;
  private int nextScopeIndex = 0;
  private int nextClosureIndex = 0;

  private ScopeTreeBuilder() {}

  static ScopeTree build(Node methodNode) {
    if (!methodNode.isMethod()) {
      throw new ClosureConversionException(
          ClosureConversionErrors.MALFORMED_INPUT, "expected a METHOD root, found " + methodNode);
    }
    ScopeTreeBuilder builder = new ScopeTreeBuilder();
    NodeTraversal.traverse(methodNode, builder);
    checkState(builder.scopeStack.isEmpty(), "unbalanced scopes");
    return checkNotNull(builder.tree);
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    switch (n.getToken()) {
      case METHOD:
        enterMethod(n);
        break;
      case LAMBDA:
      case LOCAL_FUNCTION:
        enterNestedFunction(n);
        break;
      case BLOCK:
        if (parent != null && parent.isFunction()) {
          tree.mapBodyBlock(n, scopeStack.peek());
        } else {
          Scope block = scopeStack.peek().createChildScope(nextScopeIndex++, Scope.Kind.BLOCK, n);
          tree.addScope(block);
          scopeStack.push(block);
        }
        break;
      case VAR:
        declare(n.getVariable(), n);
        break;
      default:
        break;
    }
    return true;
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (!scopeStack.isEmpty() && scopeStack.peek().getRootNode() == n) {
      scopeStack.pop();
    }
  }

  private void enterMethod(Node n) {
    if (tree != null) {
      throw new ClosureConversionException(
          ClosureConversionErrors.MALFORMED_INPUT, "METHOD nested inside a method body: " + n);
    }
    Scope root = Scope.createRootScope(nextScopeIndex++, n);
    tree = new ScopeTree(n, root);
    tree.addScope(root);
    scopeStack.push(root);

    Variable receiver = n.getFunction().getReceiver();
    if (receiver != null) {
      declare(receiver, n);
    }
    declareParameters(n);
  }

  private void enterNestedFunction(Node n) {
    if (tree == null) {
      throw new ClosureConversionException(
          ClosureConversionErrors.MALFORMED_INPUT, "nested function outside a method: " + n);
    }
    if (tree.isDeclared(n.getFunction())) {
      throw new ClosureConversionException(
          ClosureConversionErrors.MALFORMED_INPUT, n.getFunction() + " is declared twice");
    }
    Scope declaringScope = scopeStack.peek();
    Closure closure = new Closure(nextClosureIndex++, n, declaringScope);
    declaringScope.addNestedFunction(closure);
    tree.addClosure(closure);

    Scope.Kind kind = n.isLambda() ? Scope.Kind.LAMBDA_BODY : Scope.Kind.LOCAL_FUNCTION_BODY;
    Scope body = declaringScope.createChildScope(nextScopeIndex++, kind, n);
    body.setFunction(closure);
    closure.setBodyScope(body);
    tree.addScope(body);
    scopeStack.push(body);
    declareParameters(n);
  }

  private void declareParameters(Node function) {
    for (Node param : function.getFirstChild().children()) {
      declare(param.getVariable(), param);
    }
  }

  private void declare(Variable variable, Node declaration) {
    if (tree.isDeclared(variable)) {
      throw new ClosureConversionException(
          ClosureConversionErrors.MALFORMED_INPUT,
          variable + " is declared twice, again at " + declaration);
    }
    tree.declare(variable, scopeStack.peek());
  }
}
