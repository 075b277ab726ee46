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

import com.google.common.collect.ImmutableList;

/**
 * An abstract compiler, to help remove the circular dependency of passes on the compiler.
 *
 * <p>This is an abstract class, so that we can make the methods package-private.
 */
public abstract class AbstractCompiler {

  public abstract CompilerOptions getOptions();

  /** Supplies the names of synthesized declarations, unique for the lifetime of the compiler. */
  abstract UniqueNameSupplier getUniqueNameSupplier();

  /** Records the lowered form of a method, once its conversion has fully succeeded. */
  abstract void addResult(ClosureConversionResult result);

  /** Records that the conversion of a method was abandoned. */
  abstract void report(CompilerError error);

  public abstract ImmutableList<ClosureConversionResult> getResults();

  public abstract ImmutableList<CompilerError> getErrors();

  public boolean hasErrors() {
    return !getErrors().isEmpty();
  }
}
