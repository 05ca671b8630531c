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

import com.google.basicir.ast.AstNode;
import com.google.basicir.tree.AssignStmt;
import com.google.basicir.tree.AssumeStmt;
import com.google.basicir.tree.BinExpr;
import com.google.basicir.tree.Expr;
import com.google.basicir.tree.ImplicitVisitor;
import com.google.basicir.tree.Lit;
import com.google.basicir.tree.Program;
import com.google.basicir.tree.UnExpr;
import java.util.logging.Logger;

/**
 * Removes the universal types from a program.
 *
 * <p>Numeric literals and named numbers are typed by the universal integer or universal real types,
 * which have no runtime representation and mean nothing to an abstract domain. Every expression of
 * such a type is evaluated and replaced by a literal of the type its context expects:
 *
 * <ul>
 *   <li>the type of the assigned variable, for the right-hand side of an assignment;
 *   <li>the boolean type, for an assumption;
 *   <li>the type of the other operand, for an operand of a binary expression. At most one of the
 *       two operands has a universal type.
 * </ul>
 *
 * If an expression cannot be evaluated its children are converted instead.
 *
 * <p>Expressions are rebuilt, never mutated: only the expression slots of assignments and
 * assumptions are updated in place. Converting a program twice is the same as converting it once.
 */
public final class ConvertUniversalTypes extends ImplicitVisitor {
  private static final Logger logger = Logger.getLogger(ConvertUniversalTypes.class.getName());

  private final ConstExprEvaluator evaluator;

  public ConvertUniversalTypes(ConstExprEvaluator evaluator) {
    this.evaluator = evaluator;
  }

  public void process(Program program) {
    program.accept(this);
  }

  @Override
  public Void visitAssign(AssignStmt assign) {
    assign.setExpr(convert(assign.getExpr(), assign.getId().getTypeHint()));
    return null;
  }

  @Override
  public Void visitAssume(AssumeStmt assume) {
    assume.setExpr(convert(assume.getExpr(), evaluator.getBoolType()));
    return null;
  }

  /** Returns an equivalent expression in which no universal type is left, where possible. */
  Expr convert(Expr expr, AstNode expectedType) {
    if (evaluator.hasUniversalType(expr)) {
      try {
        Object value = evaluator.eval(expr);
        if (!(value instanceof ConstExprEvaluator.Range)) {
          return new Lit(value, expectedType, expr.getOrigNode());
        }
      } catch (NotConstantException e) {
        logger.fine("Universally typed expression is not static: " + e.getMessage());
      }
    }
    return convertChildren(expr, expectedType);
  }

  private Expr convertChildren(Expr expr, AstNode expectedType) {
    if (expr instanceof BinExpr) {
      BinExpr binExpr = (BinExpr) expr;
      Expr lhs = binExpr.getLhs();
      Expr rhs = binExpr.getRhs();
      AstNode operandType =
          evaluator.hasUniversalType(rhs) ? lhs.getTypeHint() : rhs.getTypeHint();
      Expr newLhs = convert(lhs, operandType);
      Expr newRhs = convert(rhs, operandType);
      if (newLhs == lhs && newRhs == rhs) {
        return expr;
      }
      return new BinExpr(
          newLhs, binExpr.getOperator(), newRhs, binExpr.getTypeHint(), binExpr.getOrigNode());
    } else if (expr instanceof UnExpr) {
      UnExpr unExpr = (UnExpr) expr;
      Expr operand = unExpr.getExpr();
      Expr newOperand = convert(operand, expectedType);
      if (newOperand == operand) {
        return expr;
      }
      return new UnExpr(
          unExpr.getOperator(), newOperand, unExpr.getTypeHint(), unExpr.getOrigNode());
    }
    return expr;
  }
}
