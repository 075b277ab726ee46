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

/**
 * <p>Interface for classes that transform one method.</p>
 *
 * <p>Class has single function "process", which is passed the METHOD node of the tree to
 * transform.</p>
 */
public interface CompilerPass {

  /**
   * Process the method with root node method.
   * Can modify the contents of the Node tree
   * @param method Top of the method tree
   */
  void process(Node method);
}
