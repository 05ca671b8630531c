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

import com.google.basicir.ast.AstNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A control-flow statement representing a nondeterministic choice of execution path: every branch
 * is visited, independently of the others.
 *
 * <p>A split has at least two branches. An if statement yields two; a case statement yields one per
 * alternative.
 */
public final class SplitStmt extends Stmt {
  private final ImmutableList<ImmutableList<Stmt>> branches;

  public SplitStmt(List<? extends List<? extends Stmt>> branches, @Nullable AstNode origNode) {
    super(origNode);
    checkArgument(
        branches.size() >= 2, "A split needs at least two branches, got %s", branches.size());
    ImmutableList.Builder<ImmutableList<Stmt>> builder = ImmutableList.builder();
    for (List<? extends Stmt> branch : branches) {
      builder.add(ImmutableList.copyOf(branch));
    }
    this.branches = builder.build();
  }

  public ImmutableList<ImmutableList<Stmt>> getBranches() {
    return branches;
  }

  public int getBranchCount() {
    return branches.size();
  }

  @Override
  public ImmutableList<Stmt> children() {
    return ImmutableList.copyOf(Iterables.concat(branches));
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitSplit(this);
  }
}
