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
import com.google.lambdalowering.ir.SynthesizedMethod;
import com.google.lambdalowering.ir.SynthesizedType;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lowers the lambdas and local functions of a method into ordinary methods.
 *
 * <p>Captured variables move out of the stack frame into synthesized environment types, one per
 * scope that declares them. Each nested function becomes a method on the innermost heap
 * environment it captures, or on the enclosing type when it captures none; environments it needs
 * but cannot reach through parent links are passed to it by reference. Lambdas are replaced by
 * references to their lowered methods, and direct calls of local functions by direct calls of
 * theirs.
 *
 * <p>The conversion is all or nothing: it works on a copy of the method and nothing is reported
 * to the compiler unless every step succeeds.
 */
public final class ClosureConversion implements CompilerPass {
  private static final Logger logger = Logger.getLogger(ClosureConversion.class.getName());

  private final AbstractCompiler compiler;
  private final LoweredTreeValidator validator;

  public ClosureConversion(AbstractCompiler compiler) {
    this(compiler, new LoweredTreeValidator());
  }

  ClosureConversion(AbstractCompiler compiler, LoweredTreeValidator validator) {
    this.compiler = checkNotNull(compiler);
    this.validator = checkNotNull(validator);
  }

  @Override
  public void process(Node method) {
    ClosureConversionResult result = convert(method);
    Node loweredBody = result.method().getLastChild().detach();
    method.getLastChild().replaceWith(loweredBody);
    compiler.addResult(result.withMethod(method));
  }

  /**
   * Converts a copy of {@code method}, leaving the input untouched.
   *
   * @throws ClosureConversionException if the method cannot be lowered
   */
  public ClosureConversionResult convert(Node method) {
    if (method.getParent() != null) {
      throw new ClosureConversionException(
          ClosureConversionErrors.MALFORMED_INPUT, "expected a detached METHOD, found " + method);
    }
    CompilerOptions options = compiler.getOptions();
    Node copy = method.cloneTree();

    ScopeTree tree = ScopeTreeBuilder.build(copy);
    CaptureAnalyzer.analyze(tree);
    EnvironmentAllocator.allocate(tree, options);
    EnvironmentLinearizer.linearize(tree);
    if (options.getOptimizeReceiverEnvironments()) {
      EnvironmentOptimizer.optimize(tree);
    }
    CodeSynthesizer.synthesize(tree, options, compiler.getUniqueNameSupplier());
    TreeRewriter.rewrite(tree);

    ImmutableList.Builder<SynthesizedType> types = ImmutableList.builder();
    for (ClosureEnvironment env : tree.getEnvironments()) {
      types.add(env.getSynthesizedType());
    }
    ImmutableList.Builder<SynthesizedMethod> methods = ImmutableList.builder();
    for (Closure closure : tree.getClosures()) {
      methods.add(closure.getLoweredMethod());
    }
    ClosureConversionResult result =
        new ClosureConversionResult(copy, types.build(), methods.build());

    if (options.getValidateOutput()) {
      validator.validate(result);
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
          "Lowered "
              + tree.getClosures().size()
              + " nested functions of "
              + tree.getMethodSymbol().getName()
              + " into "
              + result.environmentTypes().size()
              + " environments");
    }
    return result;
  }
}
