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
import com.google.basicir.ast.StandardTypes;
import com.google.basicir.tree.BinExpr;
import com.google.basicir.tree.Expr;
import com.google.basicir.tree.Identifier;
import com.google.basicir.tree.Lit;
import com.google.basicir.tree.Literals;
import com.google.basicir.tree.Operator;
import com.google.basicir.tree.UnExpr;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.Map;

/**
 * Evaluates Basic IR expressions statically.
 *
 * <p>Only literals and operators over them are evaluated: identifiers never are, since named
 * numbers are inlined by the frontend before evaluation. Results are memoized per expression node,
 * by identity, because the same constant expression is typically inlined at several places and two
 * structurally equal literals may still differ by their type hint.
 *
 * <p>Besides evaluation, the evaluator holds the standard types shared by every program extracted
 * through the same {@link ExtractionContext}.
 *
 * <p>This class is not thread-safe: its cache is unsynchronized.
 */
public final class ConstExprEvaluator {

  /** An inclusive range of values, the result of evaluating {@code first .. last}. */
  public record Range(Object first, Object last) {
    public Range {
      checkNotNull(first);
      checkNotNull(last);
    }
  }

  /** The rule evaluating one binary operator. */
  @FunctionalInterface
  interface BinaryRule {
    Object apply(Object lhs, Object rhs) throws NotConstantException;
  }

  /** The rule evaluating one unary operator. */
  @FunctionalInterface
  interface UnaryRule {
    Object apply(Object operand) throws NotConstantException;
  }

  static final ImmutableMap<Operator, BinaryRule> BINARY_RULES =
      ImmutableMap.<Operator, BinaryRule>builder()
          .put(Operator.AND, (x, y) -> Literals.fromBoolean(toBoolean(x) && toBoolean(y)))
          .put(Operator.OR, (x, y) -> Literals.fromBoolean(toBoolean(x) || toBoolean(y)))
          .put(Operator.NEQ, (x, y) -> Literals.fromBoolean(!x.equals(y)))
          .put(Operator.EQ, (x, y) -> Literals.fromBoolean(x.equals(y)))
          .put(Operator.LT, (x, y) -> Literals.fromBoolean(toLong(x) < toLong(y)))
          .put(Operator.LE, (x, y) -> Literals.fromBoolean(toLong(x) <= toLong(y)))
          .put(Operator.GE, (x, y) -> Literals.fromBoolean(toLong(x) >= toLong(y)))
          .put(Operator.GT, (x, y) -> Literals.fromBoolean(toLong(x) > toLong(y)))
          .put(Operator.DOT_DOT, Range::new)
          .put(Operator.PLUS, (x, y) -> exactly(() -> Math.addExact(toLong(x), toLong(y))))
          .put(Operator.MINUS, (x, y) -> exactly(() -> Math.subtractExact(toLong(x), toLong(y))))
          .buildOrThrow();

  static final ImmutableMap<Operator, UnaryRule> UNARY_RULES =
      ImmutableMap.<Operator, UnaryRule>builder()
          .put(Operator.NOT, x -> Literals.fromBoolean(!toBoolean(x)))
          .put(Operator.NEG, x -> exactly(() -> Math.negateExact(toLong(x))))
          .put(Operator.GET_FIRST, x -> toRange(x).first())
          .put(Operator.GET_LAST, x -> toRange(x).last())
          .buildOrThrow();

  private final StandardTypes standardTypes;
  private final ImmutableMap<Operator, BinaryRule> binaryRules;
  private final ImmutableMap<Operator, UnaryRule> unaryRules;
  private final Map<Expr, Object> cache = Maps.newIdentityHashMap();

  public ConstExprEvaluator(StandardTypes standardTypes) {
    this(standardTypes, BINARY_RULES, UNARY_RULES);
  }

  @VisibleForTesting
  ConstExprEvaluator(
      StandardTypes standardTypes,
      ImmutableMap<Operator, BinaryRule> binaryRules,
      ImmutableMap<Operator, UnaryRule> unaryRules) {
    this.standardTypes = checkNotNull(standardTypes);
    this.binaryRules = binaryRules;
    this.unaryRules = unaryRules;
  }

  public AstNode getBoolType() {
    return standardTypes.getBoolType();
  }

  public AstNode getIntType() {
    return standardTypes.getIntType();
  }

  public AstNode getUniversalIntType() {
    return standardTypes.getUniversalIntType();
  }

  public AstNode getUniversalRealType() {
    return standardTypes.getUniversalRealType();
  }

  /** Whether {@code expr} is typed by the universal integer or universal real type. */
  public boolean hasUniversalType(Expr expr) {
    AstNode hint = expr.getTypeHint();
    return hint == getUniversalIntType() || hint == getUniversalRealType();
  }

  /**
   * Returns the value {@code expr} evaluates to: a {@code Long}, a boolean or enumeration literal
   * {@code String}, {@link Literals#NULL} or a {@link Range}.
   *
   * @throws NotConstantException if the expression has no static value
   */
  public Object eval(Expr expr) throws NotConstantException {
    Object cached = cache.get(expr);
    if (cached != null) {
      return cached;
    }
    Object value = compute(expr);
    cache.put(expr, value);
    return value;
  }

  private Object compute(Expr expr) throws NotConstantException {
    if (expr instanceof Lit) {
      return ((Lit) expr).getValue();
    } else if (expr instanceof Identifier) {
      throw new NotConstantException(
          "Variable " + ((Identifier) expr).getVar().getName() + " has no static value");
    } else if (expr instanceof BinExpr) {
      BinExpr binExpr = (BinExpr) expr;
      BinaryRule rule = binaryRules.get(binExpr.getOperator());
      if (rule == null) {
        throw new NotConstantException("Cannot evaluate operator " + binExpr.getOperator().name());
      }
      return rule.apply(eval(binExpr.getLhs()), eval(binExpr.getRhs()));
    } else if (expr instanceof UnExpr) {
      UnExpr unExpr = (UnExpr) expr;
      UnaryRule rule = unaryRules.get(unExpr.getOperator());
      if (rule == null) {
        throw new NotConstantException("Cannot evaluate operator " + unExpr.getOperator().name());
      }
      return rule.apply(eval(unExpr.getExpr()));
    }
    throw new IllegalStateException("Unexpected expression " + expr);
  }

  private static boolean toBoolean(Object value) throws NotConstantException {
    if (!Literals.isBoolean(value)) {
      throw new NotConstantException(value + " is not a boolean");
    }
    return Literals.toBoolean(value);
  }

  private static long toLong(Object value) throws NotConstantException {
    if (!(value instanceof Long)) {
      throw new NotConstantException(value + " is not an integer");
    }
    return (Long) value;
  }

  private static Range toRange(Object value) throws NotConstantException {
    if (!(value instanceof Range)) {
      throw new NotConstantException(value + " is not a range");
    }
    return (Range) value;
  }

  /** Integer arithmetic which may overflow; an overflowing expression has no static value. */
  @FunctionalInterface
  private interface LongComputation {
    long compute() throws NotConstantException;
  }

  private static Object exactly(LongComputation computation) throws NotConstantException {
    try {
      return computation.compute();
    } catch (ArithmeticException e) {
      throw new NotConstantException("Integer overflow: " + e.getMessage());
    }
  }
}
