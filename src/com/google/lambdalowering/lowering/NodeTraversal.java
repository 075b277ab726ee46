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

import com.google.lambdalowering.ir.Node;
import org.jspecify.annotations.Nullable;

/** Walks a method tree, calling back before and after the children of each node. */
public final class NodeTraversal {
  private final Callback callback;

  /** Receives the nodes of a traversal. */
  public interface Callback {
    /**
     * Called before the children of {@code n}. Returning false skips {@code n} and its whole
     * subtree, including the {@link #visit} call for {@code n}. Children are walked in order.
     */
    boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent);

    /**
     * Called after the children of {@code n}. The callback may detach or replace {@code n}, but
     * not its ancestors or their other children.
     */
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  private NodeTraversal(Callback cb) {
    this.callback = cb;
  }

  /** Traverses {@code root} and everything below it. */
  public static void traverse(Node root, Callback cb) {
    new NodeTraversal(cb).traverseBranch(root, root.getParent());
  }

  private void traverseBranch(Node n, @Nullable Node parent) {
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }

    for (Node child = n.getFirstChild(); child != null; ) {
      // The callback may replace child.
      Node next = child.getNext();
      traverseBranch(child, n);
      child = next;
    }

    callback.visit(this, n, parent);
  }
}
