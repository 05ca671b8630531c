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
import org.jspecify.annotations.Nullable;

/** The base class for any Basic IR tree node. */
public abstract class Node {
  private final @Nullable AstNode origNode;

  Node(@Nullable AstNode origNode) {
    this.origNode = origNode;
  }

  /** The AST node this IR node was generated from, kept for diagnostics. */
  public final @Nullable AstNode getOrigNode() {
    return origNode;
  }

  /** The direct children of this node, in order. */
  public abstract ImmutableList<? extends Node> children();

  public abstract <T> T accept(Visitor<T> visitor);

  @Override
  public String toString() {
    return PrettyPrinter.print(this);
  }
}
