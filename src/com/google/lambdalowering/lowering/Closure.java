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
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.lambdalowering.ir.FunctionSymbol;
import com.google.lambdalowering.ir.Node;
import com.google.lambdalowering.ir.SynthesizedMethod;
import com.google.lambdalowering.ir.TypeRef;
import com.google.lambdalowering.ir.Variable;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The analysis record of one lambda or local function. This is not the run-time callable value
 * the function may produce.
 */
final class Closure {

  /** Lambdas always become callable values; local functions may be called directly. */
  enum Kind {
    LAMBDA,
    LOCAL_FUNCTION
  }

  private final int index;
  private final Kind kind;
  private final FunctionSymbol symbol;
  private final Node node;
  private final Scope declaringScope;
  private @Nullable Scope bodyScope;
  private final ImmutableList<Variable> parameters;

  private final Set<Variable> directCaptures = new LinkedHashSet<>();
  private final Set<Variable> capturedVariables = new LinkedHashSet<>();
  private final Set<Closure> referencedClosures = new LinkedHashSet<>();
  private boolean convertedToCallable;

  private final Set<ClosureEnvironment> capturedEnvironments = new LinkedHashSet<>();
  private @Nullable ClosureEnvironment containingEnvironment;
  private final List<ClosureEnvironment> refParameterEnvironments = new ArrayList<>();
  private @Nullable SynthesizedMethod loweredMethod;
  private final Map<Variable, Variable> loweredParameters = new IdentityHashMap<>();
  private ImmutableMap<String, TypeRef> typeSubstitution = ImmutableMap.of();

  Closure(int index, Node node, Scope declaringScope) {
    checkState(node.isNestedFunction(), node);
    this.index = index;
    this.node = node;
    this.symbol = node.getFunction();
    this.kind = symbol.isLambda() ? Kind.LAMBDA : Kind.LOCAL_FUNCTION;
    this.declaringScope = checkNotNull(declaringScope);
    this.convertedToCallable = symbol.isConvertedToCallable();
    ImmutableList.Builder<Variable> params = ImmutableList.builder();
    for (Node param : node.getFirstChild().children()) {
      params.add(param.getVariable());
    }
    this.parameters = params.build();
  }

  int getIndex() {
    return index;
  }

  Kind getKind() {
    return kind;
  }

  boolean isLambda() {
    return kind == Kind.LAMBDA;
  }

  FunctionSymbol getSymbol() {
    return symbol;
  }

  /** The LAMBDA or LOCAL_FUNCTION node. */
  Node getNode() {
    return node;
  }

  /** The scope the function is written in. */
  Scope getDeclaringScope() {
    return declaringScope;
  }

  /** The scope mirroring the function's own body. */
  Scope getBodyScope() {
    return checkNotNull(bodyScope, "%s has no body scope yet", this);
  }

  void setBodyScope(Scope bodyScope) {
    checkState(this.bodyScope == null);
    this.bodyScope = bodyScope;
  }

  ImmutableList<Variable> getParameters() {
    return parameters;
  }

  // Capture analysis

  /** Records a capture seen in the body; returns whether it was new. */
  @CanIgnoreReturnValue
  boolean addDirectCapture(Variable variable) {
    capturedVariables.add(variable);
    return directCaptures.add(variable);
  }

  /** Adds a capture inherited from a referenced closure; returns whether it was new. */
  boolean addTransitiveCapture(Variable variable) {
    return capturedVariables.add(variable);
  }

  /** Captures seen in the body itself, including those inside nested functions. */
  ImmutableSet<Variable> getDirectCaptures() {
    return ImmutableSet.copyOf(directCaptures);
  }

  /** All captured variables, closed over calls and conversions of other closures. */
  ImmutableSet<Variable> getCapturedVariables() {
    return ImmutableSet.copyOf(capturedVariables);
  }

  boolean captures(Variable variable) {
    return capturedVariables.contains(variable);
  }

  boolean capturesReceiver() {
    for (Variable v : capturedVariables) {
      if (v.isReceiver()) {
        return true;
      }
    }
    return false;
  }

  void addReferencedClosure(Closure other) {
    if (other != this) {
      referencedClosures.add(other);
    }
  }

  /** Closures this one calls or converts to a callable value. */
  ImmutableSet<Closure> getReferencedClosures() {
    return ImmutableSet.copyOf(referencedClosures);
  }

  void markConvertedToCallable() {
    convertedToCallable = true;
  }

  boolean isConvertedToCallable() {
    return convertedToCallable;
  }

  /**
   * Whether captured state may be passed to this function through by-reference parameters. Only
   * functions that are always called directly, and not rewritten into a state machine, qualify.
   */
  boolean canTakeRefParameters() {
    return !convertedToCallable && !symbol.isStateMachine();
  }

  // Environment assignment

  Set<ClosureEnvironment> getCapturedEnvironments() {
    return capturedEnvironments;
  }

  @Nullable ClosureEnvironment getContainingEnvironment() {
    return containingEnvironment;
  }

  void setContainingEnvironment(@Nullable ClosureEnvironment containingEnvironment) {
    this.containingEnvironment = containingEnvironment;
  }

  /** Value-typed environments passed by reference, in parameter order. */
  ImmutableList<ClosureEnvironment> getRefParameterEnvironments() {
    return ImmutableList.copyOf(refParameterEnvironments);
  }

  void setRefParameterEnvironments(List<ClosureEnvironment> environments) {
    refParameterEnvironments.clear();
    refParameterEnvironments.addAll(environments);
  }

  @Nullable SynthesizedMethod getLoweredMethod() {
    return loweredMethod;
  }

  void setLoweredMethod(SynthesizedMethod loweredMethod) {
    checkState(this.loweredMethod == null, "%s already lowered", this);
    this.loweredMethod = loweredMethod;
  }

  /** Maps each original parameter to the parameter of the lowered method. */
  Variable getLoweredParameter(Variable original) {
    return loweredParameters.getOrDefault(original, original);
  }

  void setLoweredParameter(Variable original, Variable lowered) {
    checkState(parameters.contains(original), "%s is not a parameter of %s", original, this);
    loweredParameters.put(original, lowered);
  }

  /** Renames the type parameters of enclosing functions as seen from the lowered method. */
  ImmutableMap<String, TypeRef> getTypeSubstitution() {
    return typeSubstitution;
  }

  void setTypeSubstitution(Map<String, TypeRef> typeSubstitution) {
    this.typeSubstitution = ImmutableMap.copyOf(typeSubstitution);
  }

  @Override
  public String toString() {
    return "Closure#" + index + " " + symbol.getName();
  }
}
