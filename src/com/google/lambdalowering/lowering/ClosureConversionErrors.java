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

/** Errors raised by closure conversion. */
final class ClosureConversionErrors {

  static final DiagnosticType NON_CONVERGENT_CAPTURES =
      DiagnosticType.error(
          "LAMBDA_LOWERING_NON_CONVERGENT_CAPTURES",
          "Capture sets of {0} nested functions did not converge after {1} steps");

  static final DiagnosticType ILLEGAL_REFERENCE_CAPTURE =
      DiagnosticType.error(
          "LAMBDA_LOWERING_ILLEGAL_REFERENCE_CAPTURE", "Illegal environment capture: {0}");

  static final DiagnosticType MALFORMED_INPUT =
      DiagnosticType.error("LAMBDA_LOWERING_MALFORMED_INPUT", "Malformed input tree: {0}");

  static final DiagnosticType UNREACHABLE_ENVIRONMENT =
      DiagnosticType.error(
          "LAMBDA_LOWERING_UNREACHABLE_ENVIRONMENT", "{0} cannot be reached from {1}");

  static final DiagnosticType INVALID_OUTPUT =
      DiagnosticType.error("LAMBDA_LOWERING_INVALID_OUTPUT", "Invalid lowered tree: {0}");

  private ClosureConversionErrors() {}
}
