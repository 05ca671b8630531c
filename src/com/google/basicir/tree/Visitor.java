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
 * Visits the nodes of a Basic IR tree. Each node type dispatches to its own method through {@link
 * Node#accept}.
 *
 * @param <T> the result of visiting a node
 */
public interface Visitor<T> {
  T visitProgram(Program program);

  T visitAssign(AssignStmt assign);

  T visitSplit(SplitStmt split);

  T visitLoop(LoopStmt loop);

  T visitRead(ReadStmt read);

  T visitUse(UseStmt use);

  T visitAssume(AssumeStmt assume);

  T visitGoto(GotoStmt gotoStmt);

  T visitLabel(LabelStmt label);

  T visitIdentifier(Identifier ident);

  T visitLit(Lit lit);

  T visitBinExpr(BinExpr binExpr);

  T visitUnExpr(UnExpr unExpr);
}
