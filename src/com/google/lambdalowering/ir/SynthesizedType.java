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
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A type declaration synthesized by closure conversion to hold hoisted variables. It is handed to
 * the code emitter, which merges it into the enclosing type.
 */
public final class SynthesizedType {

  /** Storage kind of the aggregate. */
  public enum Kind {
    /** Stack-allocated, only ever passed by reference to direct callees. */
    VALUE,
    /** Heap-allocated, reachable by stored references. */
    REFERENCE
  }

  private final String name;
  private final Kind kind;
  private final ImmutableList<String> typeParameters;
  private final List<SynthesizedField> fields = new ArrayList<>();
  private final List<SynthesizedMethod> methods = new ArrayList<>();
  private @Nullable SynthesizedField parentField;

  public SynthesizedType(String name, Kind kind, ImmutableList<String> typeParameters) {
    checkArgument(!name.isEmpty());
    this.name = name;
    this.kind = checkNotNull(kind);
    this.typeParameters = checkNotNull(typeParameters);
  }

  public String getName() {
    return name;
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isValueType() {
    return kind == Kind.VALUE;
  }

  public ImmutableList<String> getTypeParameters() {
    return typeParameters;
  }

  /** Fields in declaration order: hoisted variables first, then the parent link if any. */
  public ImmutableList<SynthesizedField> getFields() {
    return ImmutableList.copyOf(fields);
  }

  public ImmutableList<SynthesizedMethod> getMethods() {
    return ImmutableList.copyOf(methods);
  }

  public @Nullable SynthesizedField getParentField() {
    return parentField;
  }

  public @Nullable SynthesizedField getFieldForVariable(Variable variable) {
    for (SynthesizedField field : fields) {
      if (field.getHoistedVariable() == variable) {
        return field;
      }
    }
    return null;
  }

  public SynthesizedField addHoistedField(String fieldName, TypeRef type, Variable variable) {
    checkState(parentField == null, "hoisted fields precede the parent link");
    checkState(getFieldForVariable(variable) == null, "%s hoisted twice into %s", variable, name);
    SynthesizedField field = new SynthesizedField(fieldName, type, this, variable);
    fields.add(field);
    return field;
  }

  public SynthesizedField addParentField(String fieldName, TypeRef type) {
    checkState(parentField == null, "%s already links to a parent", name);
    parentField = new SynthesizedField(fieldName, type, this, null);
    fields.add(parentField);
    return parentField;
  }

  public void addMethod(SynthesizedMethod method) {
    checkArgument(method.getOwner() == this);
    methods.add(method);
  }

  /** A reference to this type instantiated with {@code typeArguments}. */
  public TypeRef asTypeRef(List<TypeRef> typeArguments) {
    checkArgument(typeArguments.size() == typeParameters.size(), "arity mismatch for %s", name);
    return TypeRef.generic(name, typeArguments);
  }

  @Override
  public String toString() {
    return (kind == Kind.VALUE ? "struct " : "class ") + name;
  }
}
