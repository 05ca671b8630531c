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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.basicir.ast.AstNode;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** Represents a unary operation, i.e. {@code op expr}. */
public final class UnExpr extends Expr {
  private final Operator op;
  private final Expr expr;

  public UnExpr(Operator op, Expr expr, AstNode typeHint, @Nullable AstNode origNode) {
    super(typeHint, origNode);
    checkArgument(op.isUnary(), "%s is not a unary operator", op.name());
    this.op = op;
    this.expr = checkNotNull(expr);
  }

  public Operator getOperator() {
    return op;
  }

  public Expr getExpr() {
    return expr;
  }

  @Override
  public ImmutableList<Expr> children() {
    return ImmutableList.of(expr);
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitUnExpr(this);
  }
}
