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
 * A visitor that walks the whole tree by default: every method visits the children of its node in
 * order. Subclasses override the methods of the nodes they care about, and call {@link
 * #visitChildren} when they still want to descend.
 */
public abstract class ImplicitVisitor implements Visitor<Void> {

  /** Visits every child of {@code n}, in order. */
  protected final Void visitChildren(Node n) {
    for (Node child : n.children()) {
      child.accept(this);
    }
    return null;
  }

  @Override
  public Void visitProgram(Program program) {
    return visitChildren(program);
  }

  @Override
  public Void visitAssign(AssignStmt assign) {
    return visitChildren(assign);
  }

  @Override
  public Void visitSplit(SplitStmt split) {
    return visitChildren(split);
  }

  @Override
  public Void visitLoop(LoopStmt loop) {
    return visitChildren(loop);
  }

  @Override
  public Void visitRead(ReadStmt read) {
    return visitChildren(read);
  }

  @Override
  public Void visitUse(UseStmt use) {
    return visitChildren(use);
  }

  @Override
  public Void visitAssume(AssumeStmt assume) {
    return visitChildren(assume);
  }

  @Override
  public Void visitGoto(GotoStmt gotoStmt) {
    return visitChildren(gotoStmt);
  }

  @Override
  public Void visitLabel(LabelStmt label) {
    return visitChildren(label);
  }

  @Override
  public Void visitIdentifier(Identifier ident) {
    return visitChildren(ident);
  }

  @Override
  public Void visitLit(Lit lit) {
    return visitChildren(lit);
  }

  @Override
  public Void visitBinExpr(BinExpr binExpr) {
    return visitChildren(binExpr);
  }

  @Override
  public Void visitUnExpr(UnExpr unExpr) {
    return visitChildren(unExpr);
  }
}
