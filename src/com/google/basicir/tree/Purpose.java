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

/**
 * Tells downstream checkers why a variable or an assumption was generated. The frontend attaches
 * purposes but never reads them.
 */
public abstract class Purpose {
  /** Shared instance for compiler temporaries. */
  public static final SyntheticVariable SYNTHETIC_VARIABLE = new SyntheticVariable();

  private Purpose() {}

  /**
   * Attached to variables the frontend introduces for its own needs. Checkers must not report
   * messages about them.
   */
  public static final class SyntheticVariable extends Purpose {
    private SyntheticVariable() {}

    @Override
    public String toString() {
      return "SyntheticVariable";
    }
  }

  /**
   * Attached to the assumption that guards a dereference, so that a checker can tell a possible
   * null dereference apart from any other unsatisfiable assumption.
   */
  public static final class DerefCheck extends Purpose {
    private final Expr derefedExpr;

    public DerefCheck(Expr derefedExpr) {
      this.derefedExpr = checkNotNull(derefedExpr);
    }

    /** The expression being dereferenced. */
    public Expr getDerefedExpr() {
      return derefedExpr;
    }

    @Override
    public String toString() {
      return "DerefCheck(" + derefedExpr + ")";
    }
  }
}
