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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.lambdalowering.ir.Node;
import com.google.lambdalowering.ir.SynthesizedMethod;
import com.google.lambdalowering.ir.SynthesizedType;

/**
 * The lowered form of one method.
 *
 * @param method the METHOD tree with every nested function removed
 * @param environmentTypes synthesized environment types, in creation order
 * @param loweredMethods one method per lambda or local function, outer functions first
 */
public record ClosureConversionResult(
    Node method,
    ImmutableList<SynthesizedType> environmentTypes,
    ImmutableList<SynthesizedMethod> loweredMethods) {
  public ClosureConversionResult {
    requireNonNull(method, "method");
    requireNonNull(environmentTypes, "environmentTypes");
    requireNonNull(loweredMethods, "loweredMethods");
  }

  /** A result for a method that had nothing to lower. */
  static ClosureConversionResult unchanged(Node method) {
    return new ClosureConversionResult(method, ImmutableList.of(), ImmutableList.of());
  }

  /** Methods the emitter adds to the enclosing type rather than to an environment type. */
  public ImmutableList<SynthesizedMethod> methodsOnEnclosingType() {
    return loweredMethods.stream()
        .filter(m -> m.getOwner() == null)
        .collect(ImmutableList.toImmutableList());
  }

  ClosureConversionResult withMethod(Node newMethod) {
    return new ClosureConversionResult(newMethod, environmentTypes, loweredMethods);
  }
}
