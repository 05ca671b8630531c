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

import static java.util.Objects.requireNonNull;

import com.google.basicir.ast.AstNode;
import org.jspecify.annotations.Nullable;

/**
 * Describes why a subprogram was rejected.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param subprogram Name of the rejected subprogram.
 * @param node Node where the error occurred.
 * @param defaultLevel The level of the diagnostic type.
 */
public record ExtractionError(
    DiagnosticType type,
    String description,
    String subprogram,
    @Nullable AstNode node,
    CheckLevel defaultLevel) {
  public ExtractionError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(subprogram, "subprogram");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  /** Creates an error for {@code subprogram} from the exception that aborted its lowering. */
  public static ExtractionError fromException(String subprogram, LoweringException e) {
    return new ExtractionError(
        e.getType(), e.getMessage(), subprogram, e.getNode(), e.getType().level());
  }

  /** Formats this error as a single line. */
  public String format() {
    return defaultLevel + " - [" + type.key() + "] in " + subprogram + ": " + description;
  }

  @Override
  public String toString() {
    return format();
  }
}
