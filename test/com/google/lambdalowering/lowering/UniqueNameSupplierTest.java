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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class UniqueNameSupplierTest {

  @Test
  public void testCountsPerPrefix() {
    UniqueNameSupplier names = new UniqueNameSupplier();

    assertThat(names.getUniqueName("m$lambda$")).isEqualTo("m$lambda$0");
    assertThat(names.getUniqueName("m$lambda$")).isEqualTo("m$lambda$1");
    assertThat(names.getUniqueName("Env$m$")).isEqualTo("Env$m$0");
    assertThat(names.getUniqueName("m$lambda$")).isEqualTo("m$lambda$2");
  }
}
