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

import com.google.basicir.ast.AstNode;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Represents a nondeterministic loop: its body is executed any number of times, possibly none. */
public final class LoopStmt extends Stmt {
  private final ImmutableList<Stmt> stmts;

  public LoopStmt(List<? extends Stmt> stmts, @Nullable AstNode origNode) {
    super(origNode);
    this.stmts = ImmutableList.copyOf(stmts);
  }

  public ImmutableList<Stmt> getStmts() {
    return stmts;
  }

  @Override
  public ImmutableList<Stmt> children() {
    return stmts;
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitLoop(this);
  }
}
