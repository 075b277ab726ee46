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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;

/**
 * The binder's symbol for a top-level method, a lambda or a local function.
 *
 * <p>Lambdas are always converted to a callable value. Local functions carry the binder's findings
 * about whether they are ever converted to one, and whether they are rewritten into an
 * asynchronous or iterator state machine.
 */
public final class FunctionSymbol {

  /** The kind of function. */
  public enum Kind {
    METHOD,
    LAMBDA,
    LOCAL_FUNCTION
  }

  private final String name;
  private final Kind kind;
  private final TypeRef returnType;
  private ImmutableList<String> typeParameters = ImmutableList.of();

  // Only for METHOD.
  private @Nullable TypeRef ownerType;
  private @Nullable Variable receiver;

  // Only for LOCAL_FUNCTION.
  private boolean convertedToCallable;

  private boolean async;
  private boolean iterator;

  private FunctionSymbol(String name, Kind kind, TypeRef returnType) {
    checkArgument(!name.isEmpty());
    this.name = name;
    this.kind = checkNotNull(kind);
    this.returnType = checkNotNull(returnType);
  }

  /** Creates a static method of {@code ownerType}. */
  public static FunctionSymbol staticMethod(String name, TypeRef ownerType, TypeRef returnType) {
    FunctionSymbol method = new FunctionSymbol(name, Kind.METHOD, returnType);
    method.ownerType = checkNotNull(ownerType);
    return method;
  }

  /** Creates an instance method of {@code ownerType}, with its receiver. */
  public static FunctionSymbol instanceMethod(String name, TypeRef ownerType, TypeRef returnType) {
    FunctionSymbol method = staticMethod(name, ownerType, returnType);
    method.receiver = Variable.receiver(ownerType);
    return method;
  }

  public static FunctionSymbol lambda(String name, TypeRef returnType) {
    return new FunctionSymbol(name, Kind.LAMBDA, returnType);
  }

  public static FunctionSymbol localFunction(String name, TypeRef returnType) {
    return new FunctionSymbol(name, Kind.LOCAL_FUNCTION, returnType);
  }

  @CanIgnoreReturnValue
  public FunctionSymbol setTypeParameters(String... typeParameters) {
    checkState(kind != Kind.LAMBDA, "lambdas have no type parameters of their own");
    this.typeParameters = ImmutableList.copyOf(typeParameters);
    return this;
  }

  /** Records that the binder found a conversion of this local function to a callable value. */
  @CanIgnoreReturnValue
  public FunctionSymbol setConvertedToCallable(boolean convertedToCallable) {
    checkState(kind == Kind.LOCAL_FUNCTION, "only local functions are optionally converted");
    this.convertedToCallable = convertedToCallable;
    return this;
  }

  @CanIgnoreReturnValue
  public FunctionSymbol setAsync(boolean async) {
    this.async = async;
    return this;
  }

  @CanIgnoreReturnValue
  public FunctionSymbol setIterator(boolean iterator) {
    this.iterator = iterator;
    return this;
  }

  public String getName() {
    return name;
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isLambda() {
    return kind == Kind.LAMBDA;
  }

  public boolean isLocalFunction() {
    return kind == Kind.LOCAL_FUNCTION;
  }

  public boolean isMethod() {
    return kind == Kind.METHOD;
  }

  public TypeRef getReturnType() {
    return returnType;
  }

  public ImmutableList<String> getTypeParameters() {
    return typeParameters;
  }

  /** The type declaring a METHOD. */
  public TypeRef getOwnerType() {
    checkState(kind == Kind.METHOD, "not a method: %s", this);
    return checkNotNull(ownerType);
  }

  /** The receiver of an instance METHOD, or null for a static one. */
  public @Nullable Variable getReceiver() {
    return receiver;
  }

  public boolean isStatic() {
    return receiver == null;
  }

  /** Whether the function becomes a callable value somewhere. Always true for lambdas. */
  public boolean isConvertedToCallable() {
    return kind == Kind.LAMBDA || convertedToCallable;
  }

  public boolean isAsync() {
    return async;
  }

  public boolean isIterator() {
    return iterator;
  }

  /** Whether the function body is rewritten into an asynchronous or iterator state machine. */
  public boolean isStateMachine() {
    return async || iterator;
  }

  @Override
  public String toString() {
    return kind + " " + name;
  }
}
