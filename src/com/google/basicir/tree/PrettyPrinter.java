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

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a Basic IR tree as indented text, two spaces per nesting level:
 *
 * <pre>
 * Program:
 *   split:
 *     assume(x > 0)
 *     y = 1
 *   |:
 *     assume(!(x > 0))
 *     y = -1
 * </pre>
 *
 * Operands which are themselves binary expressions are parenthesized.
 */
public final class PrettyPrinter implements Visitor<String> {
  private static final Joiner LINES = Joiner.on('\n');
  private static final CharMatcher LETTERS =
      CharMatcher.inRange('A', 'Z').or(CharMatcher.inRange('a', 'z'));

  private final int indent;

  private PrettyPrinter(int indent) {
    this.indent = indent;
  }

  /** Returns a human-readable representation of {@code n} and everything below it. */
  public static String print(Node n) {
    return n.accept(new PrettyPrinter(0));
  }

  private String indents(int offset) {
    return Strings.repeat("  ", indent + offset);
  }

  private void addStmts(List<String> lines, List<Stmt> stmts) {
    PrettyPrinter nested = new PrettyPrinter(indent + 1);
    for (Stmt stmt : stmts) {
      lines.add(indents(1) + stmt.accept(nested));
    }
  }

  private String block(String header, List<Stmt> stmts) {
    List<String> lines = new ArrayList<>();
    lines.add(header);
    addStmts(lines, stmts);
    return LINES.join(lines);
  }

  private String operand(Expr e) {
    String printed = e.accept(this);
    return e instanceof BinExpr ? "(" + printed + ")" : printed;
  }

  @Override
  public String visitProgram(Program program) {
    return block("Program:", program.getStmts());
  }

  @Override
  public String visitAssign(AssignStmt assign) {
    return assign.getId().accept(this) + " = " + assign.getExpr().accept(this);
  }

  @Override
  public String visitSplit(SplitStmt split) {
    List<String> lines = new ArrayList<>();
    lines.add("split:");
    boolean first = true;
    for (List<Stmt> branch : split.getBranches()) {
      if (!first) {
        lines.add(indents(0) + "|:");
      }
      first = false;
      addStmts(lines, branch);
    }
    return LINES.join(lines);
  }

  @Override
  public String visitLoop(LoopStmt loop) {
    return block("loop:", loop.getStmts());
  }

  @Override
  public String visitRead(ReadStmt read) {
    return "read(" + read.getId().accept(this) + ")";
  }

  @Override
  public String visitUse(UseStmt use) {
    return "use(" + use.getId().accept(this) + ")";
  }

  @Override
  public String visitAssume(AssumeStmt assume) {
    return "assume(" + assume.getExpr().accept(this) + ")";
  }

  @Override
  public String visitGoto(GotoStmt gotoStmt) {
    return "goto " + gotoStmt.getLabel().getName();
  }

  @Override
  public String visitLabel(LabelStmt label) {
    return label.getName() + ":";
  }

  @Override
  public String visitIdentifier(Identifier ident) {
    return ident.getVar().getName();
  }

  @Override
  public String visitLit(Lit lit) {
    return String.valueOf(lit.getValue());
  }

  @Override
  public String visitBinExpr(BinExpr binExpr) {
    return operand(binExpr.getLhs())
        + " "
        + binExpr.getOperator()
        + " "
        + operand(binExpr.getRhs());
  }

  @Override
  public String visitUnExpr(UnExpr unExpr) {
    String symbol = unExpr.getOperator().getSymbol();
    if (LETTERS.matchesAllOf(symbol)) {
      return symbol + "(" + unExpr.getExpr().accept(this) + ")";
    }
    return symbol + operand(unExpr.getExpr());
  }
}
