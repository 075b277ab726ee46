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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Map;

/**
 * A declared type as resolved by the binder.
 *
 * @param name the type name, or the type parameter name
 * @param typeArguments type arguments of a generic instantiation
 * @param isTypeParameter whether this is a reference to a type parameter
 */
public record TypeRef(String name, ImmutableList<TypeRef> typeArguments, boolean isTypeParameter) {

  public static final TypeRef INT = named("int");
  public static final TypeRef BOOLEAN = named("boolean");
  public static final TypeRef VOID = named("void");
  public static final TypeRef OBJECT = named("Object");

  public TypeRef {
    requireNonNull(name, "name");
    requireNonNull(typeArguments, "typeArguments");
    checkArgument(!name.isEmpty());
    checkArgument(!isTypeParameter || typeArguments.isEmpty(), "type parameter with arguments");
  }

  public static TypeRef named(String name) {
    return new TypeRef(name, ImmutableList.of(), false);
  }

  public static TypeRef generic(String name, TypeRef... typeArguments) {
    return new TypeRef(name, ImmutableList.copyOf(typeArguments), false);
  }

  public static TypeRef generic(String name, Iterable<TypeRef> typeArguments) {
    return new TypeRef(name, ImmutableList.copyOf(typeArguments), false);
  }

  public static TypeRef typeParameter(String name) {
    return new TypeRef(name, ImmutableList.of(), true);
  }

  /** Replaces type parameters named in {@code substitution}; other types are left as they are. */
  public TypeRef substitute(Map<String, TypeRef> substitution) {
    if (substitution.isEmpty()) {
      return this;
    }
    if (isTypeParameter) {
      TypeRef replacement = substitution.get(name);
      return replacement != null ? replacement : this;
    }
    if (typeArguments.isEmpty()) {
      return this;
    }
    ImmutableList.Builder<TypeRef> args = ImmutableList.builder();
    for (TypeRef arg : typeArguments) {
      args.add(arg.substitute(substitution));
    }
    return new TypeRef(name, args.build(), false);
  }

  @Override
  public String toString() {
    if (typeArguments.isEmpty()) {
      return name;
    }
    StringBuilder sb = new StringBuilder(name).append('<');
    for (int i = 0; i < typeArguments.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(typeArguments.get(i));
    }
    return sb.append('>').toString();
  }
}
