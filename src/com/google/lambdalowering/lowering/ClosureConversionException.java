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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Aborts the conversion of one method. The method produces no output; the compiler may go on
 * with other methods.
 */
public final class ClosureConversionException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final DiagnosticType type;

  ClosureConversionException(DiagnosticType type, Object... arguments) {
    super("INTERNAL COMPILER ERROR.\n" + type.key + ": " + type.format(arguments));
    this.type = checkNotNull(type);
  }

  public DiagnosticType getType() {
    return type;
  }
}
