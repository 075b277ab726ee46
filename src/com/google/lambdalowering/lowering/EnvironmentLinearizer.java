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

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Picks the environment each function is lowered onto and links reference-typed environments
 * into parent chains.
 *
 * <p>A function is placed on the innermost heap environment it captures. Every other heap
 * environment it captures must then be reachable from there by following parent links, so the
 * linearizer walks outwards from the containing environment, linking each environment to the
 * next heap frame above it, until all of them are on the chain. Value-typed environments never
 * take part in chains; functions reach them through by-reference parameters.
 */
final class EnvironmentLinearizer {
  private static final Logger logger = Logger.getLogger(EnvironmentLinearizer.class.getName());

  private final ScopeTree tree;

  private EnvironmentLinearizer(ScopeTree tree) {
    this.tree = tree;
  }

  static void linearize(ScopeTree tree) {
    new EnvironmentLinearizer(tree).linearize();
  }

  private void linearize() {
    // Closures come outer first, so the containing environment of an enclosing function is
    // always known by the time a chain has to cross its body.
    for (Closure closure : tree.getClosures()) {
      Set<ClosureEnvironment> unreached = new LinkedHashSet<>();
      for (ClosureEnvironment env : closure.getCapturedEnvironments()) {
        if (env.isReferenceType()) {
          unreached.add(env);
        }
      }
      if (unreached.isEmpty()) {
        closure.setContainingEnvironment(null);
        continue;
      }

      ClosureEnvironment containing = innermostOf(unreached, closure.getDeclaringScope());
      closure.setContainingEnvironment(containing);
      containing.addLoweredClosure(closure);
      unreached.remove(containing);

      ClosureEnvironment env = containing;
      while (!unreached.isEmpty()) {
        ClosureEnvironment next = frameAbove(env.getScope());
        if (next == null) {
          throw new ClosureConversionException(
              ClosureConversionErrors.UNREACHABLE_ENVIRONMENT, unreached, closure);
        }
        env.setCapturedParent(next);
        unreached.remove(next);
        env = next;
      }
      logger.fine(() -> closure + " lowered onto " + containing);
    }
  }

  private static ClosureEnvironment innermostOf(Set<ClosureEnvironment> candidates, Scope from) {
    for (Scope s = from; s != null; s = s.getParent()) {
      ClosureEnvironment env = s.getEnvironment();
      if (env != null && candidates.contains(env)) {
        return env;
      }
    }
    throw new IllegalStateException("captured environments are not in scope of " + from);
  }

  /**
   * The heap environment a frame for {@code scope} can hold a link to: the nearest one in an
   * enclosing scope of the same function, or, on leaving a nested function, the environment that
   * function is lowered onto. Returns null when there is none.
   */
  private static @Nullable ClosureEnvironment frameAbove(Scope scope) {
    for (Scope s = scope; ; ) {
      if (s.isNestedFunctionBody()) {
        return s.getFunction().getContainingEnvironment();
      }
      s = s.getParent();
      if (s == null) {
        return null;
      }
      ClosureEnvironment env = s.getEnvironment();
      if (env != null && env.isReferenceType()) {
        return env;
      }
    }
  }
}
