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

import static com.google.common.base.Preconditions.checkNotNull;

import org.jspecify.annotations.Nullable;

/** A field of a {@link SynthesizedType}: a hoisted variable or the link to the parent. */
public final class SynthesizedField {
  private final String name;
  private final TypeRef type;
  private final SynthesizedType owner;
  private final @Nullable Variable hoistedVariable;

  SynthesizedField(
      String name, TypeRef type, SynthesizedType owner, @Nullable Variable hoistedVariable) {
    this.name = checkNotNull(name);
    this.type = checkNotNull(type);
    this.owner = checkNotNull(owner);
    this.hoistedVariable = hoistedVariable;
  }

  public String getName() {
    return name;
  }

  public TypeRef getType() {
    return type;
  }

  public SynthesizedType getOwner() {
    return owner;
  }

  /** The variable whose storage moved into this field, or null for the parent link. */
  public @Nullable Variable getHoistedVariable() {
    return hoistedVariable;
  }

  public boolean isParentLink() {
    return hoistedVariable == null;
  }

  @Override
  public String toString() {
    return owner.getName() + "." + name;
  }
}
