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

/**
 * The operators of the Basic IR. There is exactly one instance per symbol, so operators may be
 * compared with {@code ==}.
 */
public enum Operator {
  PLUS("+", 2),
  MINUS("-", 2),
  LT("<", 2),
  LE("<=", 2),
  EQ("==", 2),
  NEQ("!=", 2),
  GE(">=", 2),
  GT(">", 2),
  AND("&&", 2),
  OR("||", 2),
  DOT_DOT("..", 2),

  NOT("!", 1),
  NEG("-", 1),
  ADDRESS("&", 1),
  DEREF("*", 1),
  GET_FIRST("GetFirst", 1),
  GET_LAST("GetLast", 1);

  private final String symbol;
  private final int arity;

  Operator(String symbol, int arity) {
    this.symbol = symbol;
    this.arity = arity;
  }

  public String getSymbol() {
    return symbol;
  }

  public boolean isBinary() {
    return arity == 2;
  }

  public boolean isUnary() {
    return arity == 1;
  }

  @Override
  public String toString() {
    return symbol;
  }
}
