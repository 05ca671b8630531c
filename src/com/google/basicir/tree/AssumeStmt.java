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
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** Represents the fact that an expression is assumed to be true from this point on. */
public final class AssumeStmt extends Stmt {
  private Expr expr;
  private final @Nullable Purpose purpose;

  public AssumeStmt(Expr expr, @Nullable Purpose purpose, @Nullable AstNode origNode) {
    super(origNode);
    this.expr = checkNotNull(expr);
    this.purpose = purpose;
  }

  public Expr getExpr() {
    return expr;
  }

  /** Replaces the assumed expression. Only meant for rewriting passes. */
  public void setExpr(Expr expr) {
    this.expr = checkNotNull(expr);
  }

  public @Nullable Purpose getPurpose() {
    return purpose;
  }

  @Override
  public ImmutableList<Expr> children() {
    return ImmutableList.of(expr);
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitAssume(this);
  }
}
