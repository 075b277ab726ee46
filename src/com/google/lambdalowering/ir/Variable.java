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

/**
 * A variable symbol bound by the binder. Variables have identity semantics: two declarations with
 * the same name in different scopes are different variables.
 */
public final class Variable {

  /** What declared the variable. */
  public enum Kind {
    LOCAL,
    PARAMETER,
    /** The enclosing receiver, {@code this}, of an instance method. */
    RECEIVER
  }

  private final String name;
  private final TypeRef type;
  private final Kind kind;
  private final boolean byReference;
  private final boolean synthetic;

  private Variable(String name, TypeRef type, Kind kind, boolean byReference, boolean synthetic) {
    checkArgument(!name.isEmpty());
    this.name = name;
    this.type = checkNotNull(type);
    this.kind = checkNotNull(kind);
    this.byReference = byReference;
    this.synthetic = synthetic;
  }

  public static Variable local(String name, TypeRef type) {
    return new Variable(name, type, Kind.LOCAL, false, false);
  }

  public static Variable parameter(String name, TypeRef type) {
    return new Variable(name, type, Kind.PARAMETER, false, false);
  }

  public static Variable receiver(TypeRef type) {
    return new Variable("this", type, Kind.RECEIVER, false, false);
  }

  /** A local introduced by closure conversion to hold an environment instance. */
  public static Variable syntheticLocal(String name, TypeRef type) {
    return new Variable(name, type, Kind.LOCAL, false, true);
  }

  /** A by-reference parameter introduced by closure conversion. */
  public static Variable syntheticRefParameter(String name, TypeRef type) {
    return new Variable(name, type, Kind.PARAMETER, true, true);
  }

  public String getName() {
    return name;
  }

  public TypeRef getType() {
    return type;
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isReceiver() {
    return kind == Kind.RECEIVER;
  }

  public boolean isParameter() {
    return kind == Kind.PARAMETER;
  }

  public boolean isByReference() {
    return byReference;
  }

  public boolean isSynthetic() {
    return synthetic;
  }

  @Override
  public String toString() {
    return "Variable " + name;
  }
}
