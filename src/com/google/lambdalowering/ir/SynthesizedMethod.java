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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * The method a lambda or local function is lowered into. Its signature is final when it is
 * created; the body is attached once the rewriter has produced it.
 */
public final class SynthesizedMethod {
  private final String name;
  private final FunctionSymbol original;
  private final @Nullable SynthesizedType owner;
  private final TypeRef enclosingType;
  private final boolean isStatic;
  private final ImmutableList<String> typeParameters;
  private final ImmutableList<Variable> parameters;
  private final TypeRef returnType;
  private @Nullable Node body;

  public SynthesizedMethod(
      String name,
      FunctionSymbol original,
      @Nullable SynthesizedType owner,
      TypeRef enclosingType,
      boolean isStatic,
      ImmutableList<String> typeParameters,
      ImmutableList<Variable> parameters,
      TypeRef returnType) {
    checkArgument(!name.isEmpty());
    checkArgument(owner == null || !isStatic, "methods on an environment are instance methods");
    this.name = name;
    this.original = checkNotNull(original);
    this.owner = owner;
    this.enclosingType = checkNotNull(enclosingType);
    this.isStatic = isStatic;
    this.typeParameters = checkNotNull(typeParameters);
    this.parameters = checkNotNull(parameters);
    this.returnType = checkNotNull(returnType);
  }

  public String getName() {
    return name;
  }

  /** The lambda or local function this method was lowered from. */
  public FunctionSymbol getOriginal() {
    return original;
  }

  /** The environment hosting the method, or null when it lives on the enclosing type. */
  public @Nullable SynthesizedType getOwner() {
    return owner;
  }

  public TypeRef getEnclosingType() {
    return enclosingType;
  }

  /** Name of the type the method is declared on. */
  public String getOwnerName() {
    return owner != null ? owner.getName() : enclosingType.name();
  }

  public boolean isStatic() {
    return isStatic;
  }

  public ImmutableList<String> getTypeParameters() {
    return typeParameters;
  }

  /** Original parameters followed by by-reference environment parameters. */
  public ImmutableList<Variable> getParameters() {
    return parameters;
  }

  public ImmutableList<Variable> getRefParameters() {
    return parameters.stream()
        .filter(Variable::isByReference)
        .collect(ImmutableList.toImmutableList());
  }

  public TypeRef getReturnType() {
    return returnType;
  }

  public @Nullable Node getBody() {
    return body;
  }

  public void setBody(Node body) {
    checkState(this.body == null, "body of %s already set", name);
    checkArgument(body.isBlock() && body.getParent() == null);
    this.body = body;
  }

  @Override
  public String toString() {
    return getOwnerName() + "." + name;
  }
}
