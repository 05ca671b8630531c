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
import org.jspecify.annotations.Nullable;

/**
 * A variable of the Basic IR.
 *
 * <p>Variables compare by identity: every {@link Identifier} referring to the same declared object
 * holds the same {@code Variable} instance.
 */
public final class Variable {
  private final String name;
  private final AstNode typeHint;
  private final @Nullable Purpose purpose;
  private final @Nullable AstNode origNode;

  public Variable(
      String name, AstNode typeHint, @Nullable Purpose purpose, @Nullable AstNode origNode) {
    this.name = checkNotNull(name);
    this.typeHint = checkNotNull(typeHint);
    this.purpose = purpose;
    this.origNode = origNode;
  }

  public String getName() {
    return name;
  }

  public AstNode getTypeHint() {
    return typeHint;
  }

  /** Why this variable was introduced, or null for a variable declared in the source. */
  public @Nullable Purpose getPurpose() {
    return purpose;
  }

  public @Nullable AstNode getOrigNode() {
    return origNode;
  }

  /** Whether this variable was introduced by the frontend rather than declared by the user. */
  public boolean isSynthetic() {
    return purpose instanceof Purpose.SyntheticVariable;
  }

  @Override
  public String toString() {
    return name;
  }
}
