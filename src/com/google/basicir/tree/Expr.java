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

package com.google.basicir.tree;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.basicir.ast.AstNode;
import org.jspecify.annotations.Nullable;

/**
 * The base class for expressions.
 *
 * <p>Expressions are immutable. A pass that needs a different expression builds a new one and
 * stores it in the statement that holds it, so an expression shared between several statements
 * can never be changed behind one of them.
 */
public abstract class Expr extends Node {
  private final AstNode typeHint;

  Expr(AstNode typeHint, @Nullable AstNode origNode) {
    super(origNode);
    this.typeHint = checkNotNull(typeHint);
  }

  /** The declaration of the source type of this expression. */
  public final AstNode getTypeHint() {
    return typeHint;
  }
}
