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

package com.google.basicir.frontend;

import com.google.basicir.tree.GotoStmt;
import com.google.basicir.tree.Identifier;
import com.google.basicir.tree.ImplicitVisitor;
import com.google.basicir.tree.LabelStmt;
import com.google.basicir.tree.Node;
import com.google.basicir.tree.Program;
import com.google.basicir.tree.SplitStmt;
import com.google.basicir.tree.Variable;
import com.google.common.base.Ascii;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks the structural well-formedness of a lowered program: every label appears exactly once,
 * every goto jumps to a label of the same program, every split has at least two branches, and
 * distinct variables have distinct names.
 */
public final class IrValidator {

  /** Receives every violation found. */
  public interface ViolationHandler {
    void handleViolation(String message, Node n);
  }

  private final ViolationHandler violationHandler;

  public IrValidator(ViolationHandler handler) {
    this.violationHandler = handler;
  }

  /** Creates a validator which throws an {@link IllegalStateException} on the first violation. */
  public IrValidator() {
    this(
        new ViolationHandler() {
          @Override
          public void handleViolation(String message, Node n) {
            throw new IllegalStateException(message + ". Reference node:\n" + n);
          }
        });
  }

  public void validateProgram(Program program) {
    Collector collector = new Collector();
    program.accept(collector);

    for (GotoStmt gotoStmt : collector.gotos) {
      if (!collector.labels.contains(gotoStmt.getLabel())) {
        violation(
            "Goto to label " + gotoStmt.getLabel().getName() + " outside the program", gotoStmt);
      }
    }
  }

  private void violation(String message, Node n) {
    violationHandler.handleViolation(message, n);
  }

  /** Walks the program, reporting local violations and collecting what needs a global check. */
  private final class Collector extends ImplicitVisitor {
    private final Set<LabelStmt> labels = Sets.newIdentityHashSet();
    private final List<GotoStmt> gotos = new ArrayList<>();
    private final Map<String, Variable> variablesByName = new HashMap<>();

    @Override
    public Void visitLabel(LabelStmt label) {
      if (!labels.add(label)) {
        violation("Label " + label.getName() + " appears more than once", label);
      }
      return null;
    }

    @Override
    public Void visitGoto(GotoStmt gotoStmt) {
      gotos.add(gotoStmt);
      return null;
    }

    @Override
    public Void visitSplit(SplitStmt split) {
      if (split.getBranchCount() < 2) {
        violation("Split with " + split.getBranchCount() + " branch(es)", split);
      }
      return visitChildren(split);
    }

    @Override
    public Void visitIdentifier(Identifier ident) {
      Variable var = ident.getVar();
      Variable previous = variablesByName.putIfAbsent(Ascii.toLowerCase(var.getName()), var);
      if (previous != null && previous != var) {
        violation("Distinct variables named " + var.getName(), ident);
      }
      return null;
    }
  }
}
