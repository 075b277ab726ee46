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

import com.google.lambdalowering.ir.Variable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Creates one environment for every scope that declares a captured variable, and decides whether
 * it can live on the stack.
 *
 * <p>An environment is value-typed only when every function capturing one of its variables is
 * called directly and is not a state machine; such functions receive it as a by-reference
 * argument. Any function that escapes as a callable value forces a heap allocation.
 */
final class EnvironmentAllocator {
  private static final Logger logger = Logger.getLogger(EnvironmentAllocator.class.getName());

  private final ScopeTree tree;
  private final boolean allowValueTypes;

  private EnvironmentAllocator(ScopeTree tree, boolean allowValueTypes) {
    this.tree = tree;
    this.allowValueTypes = allowValueTypes;
  }

  static void allocate(ScopeTree tree, CompilerOptions options) {
    new EnvironmentAllocator(tree, options.getValueTypeEnvironments()).allocate();
  }

  private void allocate() {
    int nextIndex = 0;
    for (Scope scope : tree.getScopes()) {
      Set<Variable> hoisted = new LinkedHashSet<>();
      List<Closure> readers = new ArrayList<>();
      for (Variable variable : scope.getDeclaredVariables()) {
        for (Closure closure : tree.getClosures()) {
          if (closure.captures(variable)) {
            hoisted.add(variable);
            if (!readers.contains(closure)) {
              readers.add(closure);
            }
          }
        }
      }
      if (hoisted.isEmpty()) {
        continue;
      }

      ClosureEnvironment.Kind kind =
          allowValueTypes && readers.stream().allMatch(Closure::canTakeRefParameters)
              ? ClosureEnvironment.Kind.VALUE_TYPE
              : ClosureEnvironment.Kind.REFERENCE_TYPE;
      ClosureEnvironment env = new ClosureEnvironment(nextIndex++, scope, kind, hoisted);
      tree.addEnvironment(env);
      logger.fine(() -> "Allocated " + env + " hoisting " + hoisted);
    }

    for (Closure closure : tree.getClosures()) {
      List<ClosureEnvironment> captured = new ArrayList<>();
      for (Variable variable : closure.getCapturedVariables()) {
        ClosureEnvironment env = tree.getHoistingEnvironment(variable);
        if (!captured.contains(env)) {
          captured.add(env);
        }
      }
      captured.sort(Comparator.comparingInt(ClosureEnvironment::getIndex));
      closure.getCapturedEnvironments().addAll(captured);
    }
  }
}
