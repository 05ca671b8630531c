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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.basicir.ast.AstNode;
import org.jspecify.annotations.Nullable;

/**
 * Aborts the lowering of one subprogram. The subprogram produces no IR at all; the other
 * subprograms of the unit are not affected.
 */
public final class LoweringException extends RuntimeException {
  private final DiagnosticType type;
  private final AstNode node;

  LoweringException(DiagnosticType type, AstNode node, String... arguments) {
    this(type, node, (Throwable) null, arguments);
  }

  LoweringException(
      DiagnosticType type, AstNode node, @Nullable Throwable cause, String... arguments) {
    super(type.formatMessage(arguments), cause);
    this.type = checkNotNull(type);
    this.node = checkNotNull(node);
  }

  public DiagnosticType getType() {
    return type;
  }

  /** The AST node that could not be lowered. */
  public AstNode getNode() {
    return node;
  }
}
