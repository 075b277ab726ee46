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

import java.util.logging.Logger;

/**
 * Removes environments whose only hoisted value is the enclosing receiver.
 *
 * <p>Functions that were to be lowered onto such an environment become instance methods of the
 * enclosing type instead, and read the receiver directly. A value-typed environment holding only
 * the receiver is removed when none of the functions capturing it is lowered onto another
 * environment. Removals can enable further removals, so the pass runs to a fixed point.
 */
final class EnvironmentOptimizer {
  private static final Logger logger = Logger.getLogger(EnvironmentOptimizer.class.getName());

  private final ScopeTree tree;

  private EnvironmentOptimizer(ScopeTree tree) {
    this.tree = tree;
  }

  static void optimize(ScopeTree tree) {
    new EnvironmentOptimizer(tree).optimize();
  }

  private void optimize() {
    boolean changed;
    do {
      changed = false;
      for (ClosureEnvironment env : tree.getEnvironments()) {
        if (!env.hoistsOnlyReceiver()) {
          continue;
        }
        if (env.isValueType()) {
          if (!allReadersOnEnclosingType(env)) {
            continue;
          }
        } else {
          moveClosuresToEnclosingType(env);
        }
        remove(env);
        changed = true;
      }
    } while (changed);
  }

  private boolean allReadersOnEnclosingType(ClosureEnvironment env) {
    for (Closure closure : tree.getClosures()) {
      if (closure.getCapturedEnvironments().contains(env)
          && closure.getContainingEnvironment() != null) {
        return false;
      }
    }
    return true;
  }

  private void moveClosuresToEnclosingType(ClosureEnvironment env) {
    for (Closure closure : env.getLoweredClosures()) {
      closure.setContainingEnvironment(null);
      env.removeLoweredClosure(closure);
    }
    for (ClosureEnvironment other : tree.getEnvironments()) {
      if (other.capturesParent() && other.getParent() == env) {
        other.relinkParentToReceiver();
      }
    }
  }

  private void remove(ClosureEnvironment env) {
    for (Closure closure : tree.getClosures()) {
      closure.getCapturedEnvironments().remove(env);
    }
    tree.removeEnvironment(env);
    logger.fine(() -> "Removed receiver-only " + env);
  }
}
