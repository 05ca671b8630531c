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

/** An unconditional jump to a label of the same program. */
public final class GotoStmt extends Stmt {
  private final LabelStmt label;

  public GotoStmt(LabelStmt label, @Nullable AstNode origNode) {
    super(origNode);
    this.label = checkNotNull(label);
  }

  public LabelStmt getLabel() {
    return label;
  }

  /** The target label is not a child: it lives elsewhere in the program. */
  @Override
  public ImmutableList<Node> children() {
    return ImmutableList.of();
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitGoto(this);
  }
}
