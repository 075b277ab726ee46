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

import com.google.common.collect.ImmutableList;
import com.google.lambdalowering.ir.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Compiler (and the other classes in this package) does the following:
 *
 * <ul>
 *   <li>takes the bound METHOD trees of a compilation unit
 *   <li>lowers the nested functions of each method, one method at a time
 *   <li>collects the lowered trees and synthesized declarations for the code emitter
 * </ul>
 *
 * A method whose conversion fails is reported as a {@link CompilerError} and left as it was; the
 * other methods are still converted.
 */
public class Compiler extends AbstractCompiler {
  private static final Logger logger = Logger.getLogger(Compiler.class.getName());

  private final CompilerOptions options;
  private final UniqueNameSupplier uniqueNameSupplier = new UniqueNameSupplier();
  private final List<ClosureConversionResult> results = new ArrayList<>();
  private final List<CompilerError> errors = new ArrayList<>();

  public Compiler() {
    this(new CompilerOptions());
  }

  public Compiler(CompilerOptions options) {
    this.options = checkNotNull(options);
  }

  /**
   * Converts {@code methods} in order. The thread's interrupt flag is checked before each method,
   * never in the middle of one.
   */
  public void compile(List<Node> methods) {
    ClosureConversion pass = new ClosureConversion(this);
    int lowered = 0;
    for (Node method : methods) {
      if (Thread.interrupted()) {
        throw new RuntimeException(new InterruptedException());
      }
      if (method.isMethod() && !containsNestedFunction(method.getLastChild())) {
        addResult(ClosureConversionResult.unchanged(method));
        continue;
      }
      try {
        pass.process(method);
        lowered++;
      } catch (ClosureConversionException e) {
        String name = method.isMethod() ? method.getFunction().getName() : method.toString();
        logger.warning("Conversion of " + name + " failed: " + e.getMessage());
        report(CompilerError.fromException(e, name));
      }
    }
    logger.info(
        "Lowered nested functions in "
            + lowered
            + " of "
            + methods.size()
            + " methods, "
            + errors.size()
            + " errors");
  }

  private static boolean containsNestedFunction(Node n) {
    if (n.isNestedFunction()) {
      return true;
    }
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      if (containsNestedFunction(child)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public CompilerOptions getOptions() {
    return options;
  }

  @Override
  UniqueNameSupplier getUniqueNameSupplier() {
    return uniqueNameSupplier;
  }

  @Override
  void addResult(ClosureConversionResult result) {
    results.add(result);
  }

  @Override
  void report(CompilerError error) {
    errors.add(error);
  }

  @Override
  public ImmutableList<ClosureConversionResult> getResults() {
    return ImmutableList.copyOf(results);
  }

  @Override
  public ImmutableList<CompilerError> getErrors() {
    return ImmutableList.copyOf(errors);
  }
}
