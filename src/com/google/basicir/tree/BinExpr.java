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

/** Represents a binary operation, i.e. {@code lhs op rhs}. */
public final class BinExpr extends Expr {
  private final Expr lhs;
  private final Operator op;
  private final Expr rhs;

  public BinExpr(Expr lhs, Operator op, Expr rhs, AstNode typeHint, @Nullable AstNode origNode) {
    super(typeHint, origNode);
    checkArgument(op.isBinary(), "%s is not a binary operator", op.name());
    this.lhs = checkNotNull(lhs);
    this.op = op;
    this.rhs = checkNotNull(rhs);
  }

  public Expr getLhs() {
    return lhs;
  }

  public Operator getOperator() {
    return op;
  }

  public Expr getRhs() {
    return rhs;
  }

  @Override
  public ImmutableList<Expr> children() {
    return ImmutableList.of(lhs, rhs);
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitBinExpr(this);
  }
}
