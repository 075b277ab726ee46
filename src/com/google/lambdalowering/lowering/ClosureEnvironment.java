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
import com.google.lambdalowering.ir.SynthesizedType;
import com.google.lambdalowering.ir.Variable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** The aggregate that owns the captured variables declared in one scope. */
final class ClosureEnvironment {

  /** Storage kind of an environment. */
  enum Kind {
    /** Lives in the stack frame that created it; reaches callees as a by-reference argument. */
    VALUE_TYPE,
    /** Heap-allocated; reachable through stored references. */
    REFERENCE_TYPE
  }

  private final int index;
  private final Scope scope;
  private final Kind kind;
  private final Set<Variable> hoistedVariables;
  private final List<Closure> loweredClosures = new ArrayList<>();

  private boolean capturesParent;
  // When capturesParent is set, null means the parent link holds the enclosing receiver.
  private @Nullable ClosureEnvironment parent;

  private @Nullable SynthesizedType synthesizedType;
  // The type parameters of the enclosing functions that the synthesized type renames, in order.
  private ImmutableList<String> sourceTypeParameters = ImmutableList.of();

  ClosureEnvironment(int index, Scope scope, Kind kind, Set<Variable> hoistedVariables) {
    checkArgument(!hoistedVariables.isEmpty(), "an environment must hoist something");
    this.index = index;
    this.scope = checkNotNull(scope);
    this.kind = checkNotNull(kind);
    this.hoistedVariables = new LinkedHashSet<>(hoistedVariables);
  }

  int getIndex() {
    return index;
  }

  Scope getScope() {
    return scope;
  }

  Kind getKind() {
    return kind;
  }

  boolean isValueType() {
    return kind == Kind.VALUE_TYPE;
  }

  boolean isReferenceType() {
    return kind == Kind.REFERENCE_TYPE;
  }

  ImmutableSet<Variable> getHoistedVariables() {
    return ImmutableSet.copyOf(hoistedVariables);
  }

  boolean hoists(Variable variable) {
    return hoistedVariables.contains(variable);
  }

  /** Whether the only hoisted value is the enclosing receiver. */
  boolean hoistsOnlyReceiver() {
    return hoistedVariables.size() == 1 && hoistedVariables.iterator().next().isReceiver();
  }

  boolean capturesParent() {
    return capturesParent;
  }

  /** The environment the parent link points to; null if it points to the enclosing receiver. */
  @Nullable ClosureEnvironment getParent() {
    checkState(capturesParent, "%s does not capture its parent", this);
    return parent;
  }

  boolean isParentReceiver() {
    return capturesParent && parent == null;
  }

  /** Links this environment to {@code parent}, or to the enclosing receiver if null. */
  void setCapturedParent(@Nullable ClosureEnvironment parent) {
    checkState(isReferenceType(), "value-typed %s cannot hold a parent link", this);
    checkArgument(parent == null || parent.isReferenceType(), "no parent link to %s", parent);
    checkState(
        !capturesParent || this.parent == parent,
        "%s already links to %s, not %s",
        this,
        this.parent,
        parent);
    this.capturesParent = true;
    this.parent = parent;
  }

  /** Redirects the parent link to the enclosing receiver once the parent has been removed. */
  void relinkParentToReceiver() {
    checkState(capturesParent && parent != null, "%s has no environment parent", this);
    this.parent = null;
  }

  void addLoweredClosure(Closure closure) {
    loweredClosures.add(closure);
  }

  void removeLoweredClosure(Closure closure) {
    loweredClosures.remove(closure);
  }

  ImmutableList<Closure> getLoweredClosures() {
    return ImmutableList.copyOf(loweredClosures);
  }

  @Nullable SynthesizedType getSynthesizedType() {
    return synthesizedType;
  }

  void setSynthesizedType(SynthesizedType synthesizedType, List<String> sourceTypeParameters) {
    checkState(this.synthesizedType == null);
    checkArgument(synthesizedType.getTypeParameters().size() == sourceTypeParameters.size());
    this.synthesizedType = synthesizedType;
    this.sourceTypeParameters = ImmutableList.copyOf(sourceTypeParameters);
  }

  ImmutableList<String> getSourceTypeParameters() {
    return sourceTypeParameters;
  }

  @Override
  public String toString() {
    return "Environment#" + index + (isValueType() ? "(value)" : "(reference)") + " of " + scope;
  }
}
