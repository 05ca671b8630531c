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

package com.google.basicir.ast;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A node of the abstract syntax tree handed to the Basic IR frontend.
 *
 * <p>This is the whole of what the frontend asks of a parser: a kind, positional children laid out
 * as documented on {@link AstKind}, the resolution of names to their declarations and the static
 * type of expressions. Implementations must use identity equality: the frontend keys its
 * declaration and label tables on nodes, and two distinct declarations must never compare equal.
 */
public interface AstNode {

  AstKind getKind();

  /** The source text of this node, used for names, literal tokens and diagnostics. */
  String getText();

  @Nullable AstNode getParent();

  List<? extends AstNode> getChildren();

  /**
   * The operator of a {@link AstKind#BIN_OP} or {@link AstKind#UN_OP} node, null for every other
   * kind.
   */
  @Nullable AstOperator getOperator();

  /**
   * The declaration an {@link AstKind#IDENTIFIER} refers to, or null if the name cannot be
   * resolved.
   */
  @Nullable AstNode getReferencedDecl();

  /**
   * The declaration of the static type of an expression node. Type declarations denote themselves.
   * Null for nodes that are neither.
   */
  @Nullable AstNode getExpressionType();

  default AstNode getChild(int index) {
    return getChildren().get(index);
  }

  default int getChildCount() {
    return getChildren().size();
  }

  default boolean isEmpty() {
    return getKind() == AstKind.EMPTY;
  }

  default boolean is(AstKind kind) {
    return getKind() == kind;
  }
}
