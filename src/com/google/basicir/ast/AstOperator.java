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

/** Operators carried by {@link AstKind#BIN_OP} and {@link AstKind#UN_OP} nodes. */
public enum AstOperator {
  LT,
  LTE,
  EQ,
  NEQ,
  GTE,
  GT,
  AND,
  OR,
  XOR,
  AND_THEN,
  OR_ELSE,
  PLUS,
  MINUS,
  MULT,
  DIV,
  MOD,
  REM,
  POW,
  CONCAT,
  ABS,
  NOT,
  DOUBLE_DOT;

  /** Whether the right operand of this operator is only evaluated on demand. */
  public boolean isShortCircuit() {
    return this == AND_THEN || this == OR_ELSE;
  }
}
