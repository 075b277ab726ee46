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

import static com.google.common.base.Preconditions.checkArgument;

import java.io.Serializable;

/** Compiler options */
public class CompilerOptions implements Serializable {
  private static final long serialVersionUID = 7L;

  /**
   * Removes environments that would only hold the enclosing receiver, and lowers the functions
   * that capture it to instance methods of the enclosing type.
   */
  private boolean optimizeReceiverEnvironments = true;

  public void setOptimizeReceiverEnvironments(boolean x) {
    this.optimizeReceiverEnvironments = x;
  }

  public boolean getOptimizeReceiverEnvironments() {
    return optimizeReceiverEnvironments;
  }

  /**
   * Allows stack-allocated environments for variables captured only by directly called
   * functions. When false every environment is heap-allocated.
   */
  private boolean valueTypeEnvironments = true;

  public void setValueTypeEnvironments(boolean valueTypeEnvironments) {
    this.valueTypeEnvironments = valueTypeEnvironments;
  }

  public boolean getValueTypeEnvironments() {
    return valueTypeEnvironments;
  }

  /** Runs the lowered tree validator on every converted method. */
  private boolean validateOutput = true;

  public void setValidateOutput(boolean validateOutput) {
    this.validateOutput = validateOutput;
  }

  public boolean getValidateOutput() {
    return validateOutput;
  }

  private String environmentTypePrefix = "Env$";

  public void setEnvironmentTypePrefix(String environmentTypePrefix) {
    checkArgument(!environmentTypePrefix.isEmpty(), "empty environment type prefix");
    this.environmentTypePrefix = environmentTypePrefix;
  }

  public String getEnvironmentTypePrefix() {
    return environmentTypePrefix;
  }

  private String lambdaMethodInfix = "$lambda$";

  public void setLambdaMethodInfix(String lambdaMethodInfix) {
    checkArgument(!lambdaMethodInfix.isEmpty(), "empty lambda method infix");
    this.lambdaMethodInfix = lambdaMethodInfix;
  }

  public String getLambdaMethodInfix() {
    return lambdaMethodInfix;
  }
}
