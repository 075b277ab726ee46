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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.lambdalowering.ir.Node;
import com.google.lambdalowering.ir.Variable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Analysis-only mirror of one lexical block or function body of the method being converted. A
 * scope points back to its parent scope and owns its child scopes. Scopes nest across function
 * boundaries: the body scope of a lambda is a child of the scope the lambda is written in.
 */
final class Scope {

  /** What the scope mirrors. */
  enum Kind {
    METHOD_BODY,
    BLOCK,
    LAMBDA_BODY,
    LOCAL_FUNCTION_BODY
  }

  private final int index;
  private final Kind kind;
  private final Node rootNode;
  private final @Nullable Scope parent;
  private final int depth;
  private final List<Scope> children = new ArrayList<>();
  private final Set<Variable> declaredVariables = new LinkedHashSet<>();
  private final List<Closure> nestedFunctions = new ArrayList<>();
  private @Nullable Closure function;
  private @Nullable ClosureEnvironment environment;

  private Scope(int index, Kind kind, Node rootNode, @Nullable Scope parent) {
    this.index = index;
    this.kind = checkNotNull(kind);
    this.rootNode = checkNotNull(rootNode);
    this.parent = parent;
    this.depth = parent == null ? 0 : parent.depth + 1;
  }

  static Scope createRootScope(int index, Node methodNode) {
    checkArgument(methodNode.isMethod(), methodNode);
    return new Scope(index, Kind.METHOD_BODY, methodNode, null);
  }

  Scope createChildScope(int childIndex, Kind childKind, Node childRoot) {
    checkArgument(childKind != Kind.METHOD_BODY, "only the root is a method body");
    Scope child = new Scope(childIndex, childKind, childRoot, this);
    children.add(child);
    return child;
  }

  /** Stable creation-order identity, used wherever ordering must be deterministic. */
  int getIndex() {
    return index;
  }

  Kind getKind() {
    return kind;
  }

  /** The METHOD, LAMBDA, LOCAL_FUNCTION or BLOCK node the scope mirrors. */
  Node getRootNode() {
    return rootNode;
  }

  @Nullable Scope getParent() {
    return parent;
  }

  /** The depth of the scope. The method body scope has depth 0. */
  int getDepth() {
    return depth;
  }

  ImmutableList<Scope> getChildren() {
    return ImmutableList.copyOf(children);
  }

  boolean isFunctionBody() {
    return kind != Kind.BLOCK;
  }

  boolean isNestedFunctionBody() {
    return kind == Kind.LAMBDA_BODY || kind == Kind.LOCAL_FUNCTION_BODY;
  }

  void declareVariable(Variable variable) {
    checkState(declaredVariables.add(variable), "%s declared twice in %s", variable, this);
  }

  ImmutableSet<Variable> getDeclaredVariables() {
    return ImmutableSet.copyOf(declaredVariables);
  }

  void addNestedFunction(Closure closure) {
    nestedFunctions.add(closure);
  }

  /** Lambdas and local functions written directly in this scope. */
  ImmutableList<Closure> getNestedFunctions() {
    return ImmutableList.copyOf(nestedFunctions);
  }

  /** The closure whose body this scope is, or null for blocks and the method body. */
  @Nullable Closure getFunction() {
    return function;
  }

  void setFunction(Closure function) {
    checkState(isNestedFunctionBody() && this.function == null);
    this.function = function;
  }

  @Nullable ClosureEnvironment getEnvironment() {
    return environment;
  }

  void setEnvironment(@Nullable ClosureEnvironment environment) {
    checkArgument(environment == null || environment.getScope() == this);
    this.environment = environment;
  }

  /** True if this scope contains {@code other}, or is the same scope as {@code other}. */
  boolean contains(Scope other) {
    for (Scope s = checkNotNull(other); s != null; s = s.parent) {
      if (s == this) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return "Scope#" + index + "@" + rootNode;
  }
}
