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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.lambdalowering.ir.IR;
import com.google.lambdalowering.ir.Node;
import com.google.lambdalowering.ir.SynthesizedField;
import com.google.lambdalowering.ir.SynthesizedMethod;
import com.google.lambdalowering.ir.Token;
import com.google.lambdalowering.ir.TypeRef;
import com.google.lambdalowering.ir.Variable;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites the method body and the body of every nested function against the declarations made
 * by {@link CodeSynthesizer}.
 *
 * <ul>
 *   <li>Every scope with an environment starts by creating it, linking it to its parent and
 *       copying hoisted parameters into it.
 *   <li>Reads and writes of hoisted variables go through environment fields.
 *   <li>Lambdas become method references and local function declarations disappear; their bodies
 *       move into the lowered methods.
 *   <li>Direct calls of local functions call the lowered method and pass value-typed environments
 *       by reference.
 * </ul>
 */
final class TreeRewriter {
  private final ScopeTree tree;

  private TreeRewriter(ScopeTree tree) {
    this.tree = tree;
  }

  /** Rewrites the method tree of {@code tree} in place. */
  static void rewrite(ScopeTree tree) {
    TreeRewriter rewriter = new TreeRewriter(tree);
    Node method = tree.getMethodNode();
    RewriteContext context =
        new RewriteContext(null, null, tree.getReceiver() != null, ImmutableMap.of());
    rewriter.rewriteFunctionBody(method.getLastChild(), tree.getRoot(), context);
  }

  /** What the code being rewritten can see: its own receiver and the environments in reach. */
  private static final class RewriteContext {
    // Null while rewriting the method itself.
    final @Nullable Closure closure;
    // The environment the code is a method of, reachable as THIS.
    final @Nullable ClosureEnvironment thisEnvironment;
    // Whether THIS is the enclosing receiver.
    final boolean hasReceiver;
    final ImmutableMap<String, TypeRef> typeSubstitution;
    final Map<ClosureEnvironment, Variable> environmentLocals = new IdentityHashMap<>();
    final Map<Variable, Variable> renamedVariables = new IdentityHashMap<>();

    RewriteContext(
        @Nullable Closure closure,
        @Nullable ClosureEnvironment thisEnvironment,
        boolean hasReceiver,
        ImmutableMap<String, TypeRef> typeSubstitution) {
      checkState(thisEnvironment == null || !hasReceiver);
      this.closure = closure;
      this.thisEnvironment = thisEnvironment;
      this.hasReceiver = hasReceiver;
      this.typeSubstitution = typeSubstitution;
    }

    Variable lookup(Variable variable) {
      return renamedVariables.getOrDefault(variable, variable);
    }
  }

  private void rewriteFunctionBody(Node body, Scope scope, RewriteContext context) {
    checkState(body.isBlock() && scope.isFunctionBody(), body);
    rewriteScope(body, scope, context);
  }

  private void rewriteScope(Node block, Scope scope, RewriteContext context) {
    ClosureEnvironment env = scope.getEnvironment();
    Variable local = null;
    if (env != null) {
      local =
          Variable.syntheticLocal(
              CodeSynthesizer.ENVIRONMENT_LOCAL_PREFIX + env.getIndex(),
              CodeSynthesizer.environmentTypeIn(env, context.typeSubstitution));
      context.environmentLocals.put(env, local);
    }

    rewriteChildren(block, context);

    if (env != null) {
      List<Node> prologue = createPrologue(env, local, context);
      for (int i = prologue.size() - 1; i >= 0; i--) {
        block.addChildToFront(prologue.get(i));
      }
    }
  }

  /** Allocates the environment, links its parent and copies hoisted parameters into it. */
  private List<Node> createPrologue(
      ClosureEnvironment env, Variable local, RewriteContext context) {
    List<Node> prologue = new ArrayList<>();
    TypeRef type = local.getType();
    prologue.add(IR.var(local, env.isValueType() ? IR.defaultEnv(type) : IR.newEnv(type)));

    SynthesizedField parentField = env.getSynthesizedType().getParentField();
    if (env.capturesParent()) {
      ClosureEnvironment parent = env.getParent();
      Node parentValue = parent == null ? receiver(context) : environment(parent, context);
      Node target = IR.getfield(IR.name(local), parentField);
      prologue.add(IR.exprResult(IR.assign(target, parentValue)));
    }

    for (Variable variable : env.getHoistedVariables()) {
      Node value;
      if (variable.isReceiver()) {
        value = IR.thisNode();
      } else if (variable.isParameter()) {
        value = IR.name(context.lookup(variable));
      } else {
        continue;
      }
      SynthesizedField field = env.getSynthesizedType().getFieldForVariable(variable);
      prologue.add(IR.exprResult(IR.assign(IR.getfield(IR.name(local), field), value)));
    }
    return prologue;
  }

  private void rewriteChildren(Node n, RewriteContext context) {
    for (Node child = n.getFirstChild(); child != null; ) {
      Node next = child.getNext();
      rewrite(child, context);
      child = next;
    }
  }

  private void rewrite(Node n, RewriteContext context) {
    switch (n.getToken()) {
      case BLOCK:
        Scope scope = checkNotNull(tree.getScopeForRoot(n), "no scope for %s", n);
        checkState(scope.getRootNode() == n, "function body reached as a block: %s", n);
        rewriteScope(n, scope, context);
        return;
      case LAMBDA:
        {
          Closure closure = closureOf(n);
          lowerBody(closure);
          n.replaceWith(IR.methodRef(receiverOf(closure, context), closure.getLoweredMethod()));
          return;
        }
      case LOCAL_FUNCTION:
        lowerBody(closureOf(n));
        n.detach();
        return;
      case VAR:
        rewriteChildren(n, context);
        rewriteDeclaration(n, context);
        return;
      case NAME:
        rewriteName(n, context);
        return;
      case THIS:
        n.replaceWith(receiver(context));
        return;
      case CALL:
        if (n.getFirstChild().isFunctionName()) {
          rewriteDirectCall(n, context);
          return;
        }
        break;
      case FUNCTION_NAME:
        {
          Closure closure = closureOf(n);
          n.replaceWith(IR.methodRef(receiverOf(closure, context), closure.getLoweredMethod()));
          return;
        }
      default:
        break;
    }
    rewriteChildren(n, context);
  }

  private void rewriteDeclaration(Node var, RewriteContext context) {
    Variable variable = var.getVariable();
    ClosureEnvironment env = tree.getHoistingEnvironment(variable);
    if (env != null) {
      if (var.hasChildren()) {
        Node value = var.getOnlyChild().detach();
        Node target = IR.getfield(environment(env, context), fieldOf(env, variable));
        var.replaceWith(IR.exprResult(IR.assign(target, value)));
      } else {
        var.detach();
      }
      return;
    }
    TypeRef type = variable.getType().substitute(context.typeSubstitution);
    if (!type.equals(variable.getType())) {
      Variable renamed = Variable.local(variable.getName(), type);
      context.renamedVariables.put(variable, renamed);
      var.setVariable(renamed);
    }
  }

  private void rewriteName(Node name, RewriteContext context) {
    Variable variable = name.getVariable();
    ClosureEnvironment env = tree.getHoistingEnvironment(variable);
    if (env != null) {
      name.replaceWith(IR.getfield(environment(env, context), fieldOf(env, variable)));
    } else {
      name.setVariable(context.lookup(variable));
    }
  }

  private void rewriteDirectCall(Node call, RewriteContext context) {
    Node callee = call.getFirstChild();
    Closure closure = closureOf(callee);
    for (Node arg = callee.getNext(); arg != null; ) {
      Node next = arg.getNext();
      rewrite(arg, context);
      arg = next;
    }

    SynthesizedMethod method = closure.getLoweredMethod();
    Node loweredCall = new Node(Token.CALL, IR.getmethod(receiverOf(closure, context), method));
    callee.detach();
    while (call.hasChildren()) {
      loweredCall.addChildToBack(call.getFirstChild().detach());
    }
    for (ClosureEnvironment env : closure.getRefParameterEnvironments()) {
      Variable local = context.environmentLocals.get(env);
      if (local == null) {
        throw new ClosureConversionException(
            ClosureConversionErrors.UNREACHABLE_ENVIRONMENT, env, describe(context));
      }
      loweredCall.addChildToBack(IR.ref(IR.name(local)));
    }
    call.replaceWith(loweredCall);
  }

  /** Moves the body of {@code closure} into its lowered method, rewritten. */
  private void lowerBody(Closure closure) {
    SynthesizedMethod method = closure.getLoweredMethod();
    ClosureEnvironment containing = closure.getContainingEnvironment();
    RewriteContext context =
        new RewriteContext(
            closure,
            containing,
            containing == null && !method.isStatic(),
            closure.getTypeSubstitution());

    for (Variable parameter : closure.getParameters()) {
      Variable lowered = closure.getLoweredParameter(parameter);
      if (lowered != parameter) {
        context.renamedVariables.put(parameter, lowered);
      }
    }
    ImmutableList<ClosureEnvironment> refEnvironments = closure.getRefParameterEnvironments();
    ImmutableList<Variable> refParameters = method.getRefParameters();
    checkState(refEnvironments.size() == refParameters.size(), method);
    for (int i = 0; i < refEnvironments.size(); i++) {
      context.environmentLocals.put(refEnvironments.get(i), refParameters.get(i));
    }

    Node body = closure.getNode().getLastChild().detach();
    rewriteFunctionBody(body, closure.getBodyScope(), context);
    method.setBody(body);
  }

  /** The receiver to call the lowered method of {@code closure} on, or null if it is static. */
  private @Nullable Node receiverOf(Closure closure, RewriteContext context) {
    if (closure.getLoweredMethod().isStatic()) {
      return null;
    }
    ClosureEnvironment containing = closure.getContainingEnvironment();
    return containing != null ? environment(containing, context) : receiver(context);
  }

  /** An expression evaluating to the environment {@code env}. */
  private Node environment(ClosureEnvironment env, RewriteContext context) {
    Variable local = context.environmentLocals.get(env);
    if (local != null) {
      return IR.name(local);
    }
    Node expr = IR.thisNode();
    for (ClosureEnvironment current = context.thisEnvironment; current != env; ) {
      if (current == null || !current.capturesParent() || current.isParentReceiver()) {
        throw new ClosureConversionException(
            ClosureConversionErrors.UNREACHABLE_ENVIRONMENT, env, describe(context));
      }
      expr = IR.getfield(expr, current.getSynthesizedType().getParentField());
      current = current.getParent();
    }
    return expr;
  }

  /** An expression evaluating to the receiver of the method being converted. */
  private Node receiver(RewriteContext context) {
    if (context.hasReceiver) {
      return IR.thisNode();
    }
    Variable receiver = checkNotNull(tree.getReceiver(), "no receiver in a static method");
    ClosureEnvironment env = tree.getHoistingEnvironment(receiver);
    if (env != null) {
      return IR.getfield(environment(env, context), fieldOf(env, receiver));
    }
    // The chain from THIS ends in a link to the receiver.
    Node expr = IR.thisNode();
    for (ClosureEnvironment current = context.thisEnvironment; ; ) {
      if (current == null || !current.capturesParent()) {
        throw new ClosureConversionException(
            ClosureConversionErrors.UNREACHABLE_ENVIRONMENT, "the receiver", describe(context));
      }
      expr = IR.getfield(expr, current.getSynthesizedType().getParentField());
      if (current.isParentReceiver()) {
        return expr;
      }
      current = current.getParent();
    }
  }

  private Closure closureOf(Node n) {
    return checkNotNull(tree.getClosure(n.getFunction()), "unknown function %s", n);
  }

  private static SynthesizedField fieldOf(ClosureEnvironment env, Variable variable) {
    return checkNotNull(
        env.getSynthesizedType().getFieldForVariable(variable), "%s not in %s", variable, env);
  }

  private String describe(RewriteContext context) {
    return context.closure != null ? context.closure.toString() : tree.getMethodSymbol().getName();
  }
}
