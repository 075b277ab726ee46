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

/**
 * A failed method compilation.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param methodName Name of the method whose conversion was abandoned.
 */
public record CompilerError(DiagnosticType type, String description, String methodName) {
  public CompilerError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(methodName, "methodName");
  }

  static CompilerError fromException(ClosureConversionException e, String methodName) {
    return new CompilerError(e.getType(), e.getMessage(), methodName);
  }

  @Override
  public String toString() {
    return type.key + " in " + methodName + ": " + description;
  }
}
