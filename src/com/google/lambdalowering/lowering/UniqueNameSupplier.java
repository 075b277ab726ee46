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

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import java.io.Serializable;

/**
 * Generates unique names for synthesized types and methods.
 *
 * <p>Names are deterministic: the n-th request for a prefix gets {@code prefix + n}, counting
 * from zero, for the lifetime of one compiler.
 */
public final class UniqueNameSupplier implements Serializable {
  private final Multiset<String> counter;

  UniqueNameSupplier() {
    counter = HashMultiset.create();
  }

  public String getUniqueName(String prefix) {
    int id = counter.add(prefix, 1);
    return prefix + id;
  }
}
