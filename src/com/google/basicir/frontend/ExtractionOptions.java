/*
 * Copyright 2026 The Basic IR Authors.
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

package com.google.basicir.frontend;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.Serializable;

/** Options for extracting Basic IR programs from an AST. */
public class ExtractionOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /**
   * Whether literals of a universal type are rewritten into literals of the type their context
   * expects.
   */
  private boolean normalizeUniversalTypes = true;

  /** Whether every lowered program is checked for structural well-formedness. */
  private boolean validateIr = false;

  /** Base name of the temporaries introduced for intermediate values. */
  private String temporaryPrefix = "tmp";

  public ExtractionOptions() {}

  public boolean shouldNormalizeUniversalTypes() {
    return normalizeUniversalTypes;
  }

  public void setNormalizeUniversalTypes(boolean normalizeUniversalTypes) {
    this.normalizeUniversalTypes = normalizeUniversalTypes;
  }

  public boolean shouldValidateIr() {
    return validateIr;
  }

  public void setValidateIr(boolean validateIr) {
    this.validateIr = validateIr;
  }

  public String getTemporaryPrefix() {
    return temporaryPrefix;
  }

  /**
   * Sets the base name of generated temporaries. It must be a valid identifier so that printed
   * programs stay readable.
   */
  public void setTemporaryPrefix(String temporaryPrefix) {
    checkArgument(
        !temporaryPrefix.isEmpty() && Character.isLetter(temporaryPrefix.charAt(0)),
        "Invalid temporary prefix: %s",
        temporaryPrefix);
    this.temporaryPrefix = temporaryPrefix;
  }
}
