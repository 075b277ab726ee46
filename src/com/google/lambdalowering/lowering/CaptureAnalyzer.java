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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.lambdalowering.ir.Node;
import com.google.lambdalowering.ir.Variable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Computes, for every lambda and local function, the set of variables it captures from outside
 * its own body.
 *
 * <p>A function captures what its body reads or writes from an enclosing scope, the enclosing
 * receiver when its body mentions {@code this}, and everything captured by the local functions it
 * calls or converts to a callable value, minus what those functions declare inside the caller.
 * The last rule is applied until nothing changes.
 */
final class CaptureAnalyzer implements NodeTraversal.Callback {
  private static final Logger logger = Logger.getLogger(CaptureAnalyzer.class.getName());

  private final ScopeTree tree;
  private final int maxSteps;

  // Innermost first.
  private final Deque<Scope> scopeStack = new ArrayDeque<>();
  private final Deque<Closure> closureStack = new ArrayDeque<>();

  private CaptureAnalyzer(ScopeTree tree, int maxSteps) {
    this.tree = tree;
    this.maxSteps = maxSteps;
  }

  static void analyze(ScopeTree tree) {
    int n = tree.getClosures().size();
    analyze(tree, n * n + n);
  }

  @VisibleForTesting
  static void analyze(ScopeTree tree, int maxSteps) {
    CaptureAnalyzer analyzer = new CaptureAnalyzer(tree, maxSteps);
    NodeTraversal.traverse(tree.getMethodNode(), analyzer);
    checkState(analyzer.scopeStack.isEmpty() && analyzer.closureStack.isEmpty());
    analyzer.propagateTransitiveCaptures();
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    if (n.isParamList()) {
      // Declarations only.
      return false;
    }
    Scope scope = tree.getScopeForRoot(n);
    if (scope != null && scope.getRootNode() == n) {
      scopeStack.push(scope);
      if (scope.isNestedFunctionBody()) {
        closureStack.push(scope.getFunction());
      }
    }
    return true;
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    switch (n.getToken()) {
      case NAME:
        recordVariableReference(n.getVariable(), n);
        break;
      case THIS:
        Variable receiver = tree.getReceiver();
        if (receiver == null) {
          throw new ClosureConversionException(
              ClosureConversionErrors.MALFORMED_INPUT,
              "THIS inside static method " + tree.getMethodSymbol().getName());
        }
        recordVariableReference(receiver, n);
        break;
      case FUNCTION_NAME:
        recordFunctionReference(n);
        break;
      default:
        break;
    }

    if (!scopeStack.isEmpty() && scopeStack.peek().getRootNode() == n) {
      Scope scope = scopeStack.pop();
      if (scope.isNestedFunctionBody()) {
        closureStack.pop();
      }
    }
  }

  private void recordVariableReference(Variable variable, Node n) {
    Scope declaringScope = tree.getDeclaringScope(variable);
    if (declaringScope == null) {
      throw new ClosureConversionException(
          ClosureConversionErrors.MALFORMED_INPUT, "reference to undeclared " + variable);
    }
    if (!declaringScope.contains(scopeStack.peek())) {
      throw new ClosureConversionException(
          ClosureConversionErrors.MALFORMED_INPUT, variable + " referenced out of scope at " + n);
    }
    for (Closure closure : closureStack) {
      if (closure.getBodyScope().contains(declaringScope)) {
        break;
      }
      closure.addDirectCapture(variable);
    }
  }

  private void recordFunctionReference(Node n) {
    Closure target = tree.getClosure(n.getFunction());
    if (target == null) {
      throw new ClosureConversionException(
          ClosureConversionErrors.MALFORMED_INPUT, "reference to unknown function " + n);
    }
    if (!target.getDeclaringScope().contains(scopeStack.peek())) {
      throw new ClosureConversionException(
          ClosureConversionErrors.MALFORMED_INPUT, target + " referenced out of scope");
    }
    if (!n.isCallee()) {
      target.markConvertedToCallable();
    }
    for (Closure closure : closureStack) {
      closure.addReferencedClosure(target);
    }
  }

  /**
   * Round-based propagation along the "references" edges. Each round pushes the captures of the
   * closures that changed in the previous round to their referrers, so the work is bounded by the
   * square of the closure count.
   */
  private void propagateTransitiveCaptures() {
    SetMultimap<Closure, Closure> referrers = LinkedHashMultimap.create();
    for (Closure closure : tree.getClosures()) {
      for (Closure referenced : closure.getReferencedClosures()) {
        referrers.put(referenced, closure);
      }
    }

    Set<Closure> changed = new LinkedHashSet<>(tree.getClosures());
    int steps = 0;
    while (!changed.isEmpty()) {
      Set<Closure> next = new LinkedHashSet<>();
      for (Closure callee : changed) {
        if (++steps > maxSteps) {
          throw new ClosureConversionException(
              ClosureConversionErrors.NON_CONVERGENT_CAPTURES,
              tree.getClosures().size(),
              maxSteps);
        }
        for (Closure caller : referrers.get(callee)) {
          if (inheritCaptures(caller, callee)) {
            next.add(caller);
          }
        }
      }
      changed = next;
    }
    logger.fine("Capture analysis converged after " + steps + " steps");
  }

  /** Copies to {@code caller} what {@code callee} captures from outside the caller's body. */
  private boolean inheritCaptures(Closure caller, Closure callee) {
    boolean changed = false;
    Scope callerBody = caller.getBodyScope();
    for (Variable variable : callee.getCapturedVariables()) {
      if (!callerBody.contains(tree.getDeclaringScopeOrFail(variable))) {
        changed |= caller.addTransitiveCapture(variable);
      }
    }
    return changed;
  }
}
