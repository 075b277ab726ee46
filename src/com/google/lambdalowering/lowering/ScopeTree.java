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
import com.google.lambdalowering.ir.FunctionSymbol;
import com.google.lambdalowering.ir.Node;
import com.google.lambdalowering.ir.Variable;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The per-method graph of scopes, closures and environments that the lowering micropasses work
 * on. It is private to one conversion and discarded once the method has been rewritten.
 */
final class ScopeTree {
  private final Node methodNode;
  private final Scope root;

  // Pre-order: parents before children, siblings in source order.
  private final List<Scope> scopes = new ArrayList<>();
  private final List<Closure> closures = new ArrayList<>();
  private final List<ClosureEnvironment> environments = new ArrayList<>();

  private final Map<Node, Scope> scopesByRoot = new IdentityHashMap<>();
  private final Map<FunctionSymbol, Closure> closuresBySymbol = new LinkedHashMap<>();
  private final Map<Variable, Scope> declaringScopes = new IdentityHashMap<>();

  ScopeTree(Node methodNode, Scope root) {
    checkState(root.getRootNode() == methodNode);
    this.methodNode = methodNode;
    this.root = root;
  }

  Node getMethodNode() {
    return methodNode;
  }

  FunctionSymbol getMethodSymbol() {
    return methodNode.getFunction();
  }

  /** The receiver of the method being converted, or null for a static method. */
  @Nullable Variable getReceiver() {
    return getMethodSymbol().getReceiver();
  }

  Scope getRoot() {
    return root;
  }

  ImmutableList<Scope> getScopes() {
    return ImmutableList.copyOf(scopes);
  }

  ImmutableList<Closure> getClosures() {
    return ImmutableList.copyOf(closures);
  }

  /** Live environments, in creation order. */
  ImmutableList<ClosureEnvironment> getEnvironments() {
    return ImmutableList.copyOf(environments);
  }

  void addScope(Scope scope) {
    scopes.add(scope);
    scopesByRoot.put(scope.getRootNode(), scope);
  }

  /** Maps a function body BLOCK to the scope of its function. */
  void mapBodyBlock(Node block, Scope functionScope) {
    checkState(block.isBlock() && functionScope.isFunctionBody());
    scopesByRoot.put(block, functionScope);
  }

  /**
   * The scope whose root is {@code n}, or null if {@code n} does not open a scope. Function body
   * blocks map to the scope of their function.
   */
  @Nullable Scope getScopeForRoot(Node n) {
    return scopesByRoot.get(n);
  }

  void addClosure(Closure closure) {
    closures.add(closure);
    closuresBySymbol.put(closure.getSymbol(), closure);
  }

  @Nullable Closure getClosure(FunctionSymbol symbol) {
    return closuresBySymbol.get(symbol);
  }

  boolean isDeclared(FunctionSymbol symbol) {
    return closuresBySymbol.containsKey(symbol);
  }

  void declare(Variable variable, Scope scope) {
    scope.declareVariable(variable);
    declaringScopes.put(variable, scope);
  }

  boolean isDeclared(Variable variable) {
    return declaringScopes.containsKey(variable);
  }

  @Nullable Scope getDeclaringScope(Variable variable) {
    return declaringScopes.get(variable);
  }

  void addEnvironment(ClosureEnvironment environment) {
    environment.getScope().setEnvironment(environment);
    environments.add(environment);
  }

  void removeEnvironment(ClosureEnvironment environment) {
    checkState(environments.remove(environment), "%s is not live", environment);
    environment.getScope().setEnvironment(null);
  }

  /** The live environment hoisting {@code variable}, or null if the variable stays local. */
  @Nullable ClosureEnvironment getHoistingEnvironment(Variable variable) {
    Scope scope = declaringScopes.get(variable);
    if (scope == null || scope.getEnvironment() == null) {
      return null;
    }
    ClosureEnvironment env = scope.getEnvironment();
    return env.hoists(variable) ? env : null;
  }

  Scope getDeclaringScopeOrFail(Variable variable) {
    return checkNotNull(declaringScopes.get(variable), "%s is not declared", variable);
  }
}
