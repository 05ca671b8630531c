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
import java.util.List;

/**
 * A Basic IR construction helper class, for code that does not need to link the nodes it builds
 * back to the AST.
 */
public final class IR {

  private IR() {}

  public static Program program(List<? extends Stmt> stmts) {
    return new Program(stmts, null);
  }

  public static Program program(Stmt... stmts) {
    return program(ImmutableList.copyOf(stmts));
  }

  public static AssignStmt assign(Identifier id, Expr expr) {
    return new AssignStmt(id, expr, null);
  }

  public static ReadStmt read(Identifier id) {
    return new ReadStmt(id, null);
  }

  public static UseStmt use(Identifier id) {
    return new UseStmt(id, null);
  }

  public static AssumeStmt assume(Expr expr) {
    return new AssumeStmt(expr, null, null);
  }

  public static AssumeStmt assume(Expr expr, Purpose purpose) {
    return new AssumeStmt(expr, checkNotNull(purpose), null);
  }

  public static SplitStmt split(List<? extends List<? extends Stmt>> branches) {
    return new SplitStmt(branches, null);
  }

  public static SplitStmt split(List<? extends Stmt> first, List<? extends Stmt> second) {
    return split(ImmutableList.of(first, second));
  }

  public static LoopStmt loop(List<? extends Stmt> stmts) {
    return new LoopStmt(stmts, null);
  }

  public static LabelStmt label(String name) {
    return new LabelStmt(name, null);
  }

  public static GotoStmt gotoLabel(LabelStmt label) {
    return new GotoStmt(label, null);
  }

  /** A reference to {@code var}, typed like the variable. */
  public static Identifier ident(Variable var) {
    return new Identifier(var, var.getTypeHint(), null);
  }

  public static Lit lit(Object value, AstNode typeHint) {
    return new Lit(value, typeHint, null);
  }

  public static BinExpr binExpr(Expr lhs, Operator op, Expr rhs, AstNode typeHint) {
    return new BinExpr(lhs, op, rhs, typeHint, null);
  }

  public static UnExpr unExpr(Operator op, Expr expr, AstNode typeHint) {
    return new UnExpr(op, expr, typeHint, null);
  }

  /** The negation of a condition, typed like the condition. */
  public static UnExpr not(Expr cond) {
    return unExpr(Operator.NOT, cond, cond.getTypeHint());
  }

  /** Folds {@code exprs} from the left with {@code op}: {@code ((e1 op e2) op e3) ...}. */
  public static Expr leftFold(Operator op, List<? extends Expr> exprs, AstNode typeHint) {
    checkArgument(!exprs.isEmpty(), "Nothing to fold");
    Expr result = exprs.get(0);
    for (int i = 1; i < exprs.size(); i++) {
      result = binExpr(result, op, exprs.get(i), typeHint);
    }
    return result;
  }
}
