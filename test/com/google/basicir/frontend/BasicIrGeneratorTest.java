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

import static com.google.basicir.ast.TestAst.accessTypeDef;
import static com.google.basicir.ast.TestAst.assign;
import static com.google.basicir.ast.TestAst.attributeRef;
import static com.google.basicir.ast.TestAst.binOp;
import static com.google.basicir.ast.TestAst.callStmt;
import static com.google.basicir.ast.TestAst.caseStmt;
import static com.google.basicir.ast.TestAst.deref;
import static com.google.basicir.ast.TestAst.elsif;
import static com.google.basicir.ast.TestAst.elsifExpr;
import static com.google.basicir.ast.TestAst.enumLiteral;
import static com.google.basicir.ast.TestAst.enumRef;
import static com.google.basicir.ast.TestAst.enumTypeDef;
import static com.google.basicir.ast.TestAst.exit;
import static com.google.basicir.ast.TestAst.exitNamed;
import static com.google.basicir.ast.TestAst.exitWhen;
import static com.google.basicir.ast.TestAst.exprFunction;
import static com.google.basicir.ast.TestAst.forLoop;
import static com.google.basicir.ast.TestAst.gotoStmt;
import static com.google.basicir.ast.TestAst.ifExpr;
import static com.google.basicir.ast.TestAst.ifStmt;
import static com.google.basicir.ast.TestAst.intLit;
import static com.google.basicir.ast.TestAst.label;
import static com.google.basicir.ast.TestAst.labelDecl;
import static com.google.basicir.ast.TestAst.loop;
import static com.google.basicir.ast.TestAst.named;
import static com.google.basicir.ast.TestAst.namedStmtDecl;
import static com.google.basicir.ast.TestAst.nullLit;
import static com.google.basicir.ast.TestAst.nullStmt;
import static com.google.basicir.ast.TestAst.numberDecl;
import static com.google.basicir.ast.TestAst.objectDecl;
import static com.google.basicir.ast.TestAst.objectDeclOfUnresolvedType;
import static com.google.basicir.ast.TestAst.others;
import static com.google.basicir.ast.TestAst.paramSpec;
import static com.google.basicir.ast.TestAst.paren;
import static com.google.basicir.ast.TestAst.range;
import static com.google.basicir.ast.TestAst.ref;
import static com.google.basicir.ast.TestAst.signedIntTypeDef;
import static com.google.basicir.ast.TestAst.subpBody;
import static com.google.basicir.ast.TestAst.typeDecl;
import static com.google.basicir.ast.TestAst.unOp;
import static com.google.basicir.ast.TestAst.when;
import static com.google.basicir.ast.TestAst.whileLoop;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.basicir.ast.AstNode;
import com.google.basicir.ast.AstOperator;
import com.google.basicir.ast.TestStandardTypes;
import com.google.basicir.tree.AssignStmt;
import com.google.basicir.tree.AssumeStmt;
import com.google.basicir.tree.GotoStmt;
import com.google.basicir.tree.Identifier;
import com.google.basicir.tree.Literals;
import com.google.basicir.tree.PrettyPrinter;
import com.google.basicir.tree.Program;
import com.google.basicir.tree.Purpose;
import com.google.basicir.tree.Variable;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link BasicIrGenerator}. */
@RunWith(JUnit4.class)
public final class BasicIrGeneratorTest {
  private final TestStandardTypes std = new TestStandardTypes();
  private final AstNode boolType = std.getBoolType();
  private final AstNode intType = std.getIntType();
  private final AstNode uint = std.getUniversalIntType();

  private Program lower(AstNode subprogram) {
    Program program =
        new BasicIrGenerator(new ConstExprEvaluator(std), subprogram, new ExtractionOptions())
            .generate();
    new IrValidator().validateProgram(program);
    return program;
  }

  private void assertLowering(AstNode subprogram, String... expected) {
    assertThat(PrettyPrinter.print(lower(subprogram))).isEqualTo(Joiner.on('\n').join(expected));
  }

  private LoweringException assertRejected(AstNode subprogram, DiagnosticType type) {
    LoweringException e = assertThrows(LoweringException.class, () -> lower(subprogram));
    assertThat(e.getType()).isEqualTo(type);
    return e;
  }

  private AstNode num(long value) {
    return intLit(value, uint);
  }

  private AstNode cmp(AstOperator op, AstNode lhs, AstNode rhs) {
    return binOp(op, lhs, rhs, boolType);
  }

  private static AstNode procedure(
      ImmutableList<AstNode> params, ImmutableList<AstNode> decls, AstNode... stmts) {
    return subpBody("P", params, decls, stmts);
  }

  // Declarations

  @Test
  public void testParametersAreRead() {
    AstNode ij = paramSpec(intType, "I", "J");
    AstNode b = paramSpec(boolType, "B");
    assertLowering(
        procedure(ImmutableList.of(ij, b), ImmutableList.of()),
        "Program:",
        "  read(I)",
        "  read(J)",
        "  read(B)");
  }

  @Test
  public void testUninitializedObjectIsRead() {
    AstNode z = objectDecl(intType, "Z");
    assertLowering(procedure(ImmutableList.of(), ImmutableList.of(z)), "Program:", "  read(Z)");
  }

  @Test
  public void testInitializerIsSharedByAllNames() {
    AstNode ab = objectDecl(intType, num(0), "A", "B");
    Program program = lower(procedure(ImmutableList.of(), ImmutableList.of(ab)));

    assertThat(program.toString()).isEqualTo("Program:\n  A = 0\n  B = 0");
    AssignStmt first = (AssignStmt) program.getStmts().get(0);
    AssignStmt second = (AssignStmt) program.getStmts().get(1);
    assertThat(first.getExpr()).isSameInstanceAs(second.getExpr());
    assertThat(first.getId().getVar()).isNotSameInstanceAs(second.getId().getVar());
  }

  @Test
  public void testTypesNumbersAndNestedSubprogramsAreErased() {
    AstNode color = typeDecl("Color", enumTypeDef("Red", "Green"));
    AstNode n = numberDecl("N", num(3));
    AstNode inner = subpBody("Inner", ImmutableList.of(), ImmutableList.of(), nullStmt());
    assertLowering(
        procedure(ImmutableList.of(), ImmutableList.of(color, n, inner), nullStmt()), "Program:");
  }

  @Test
  public void testReferencesShareTheDeclaredVariable() {
    AstNode x = paramSpec(intType, "X");
    AstNode y = objectDecl(intType, "Y");
    Program program =
        lower(
            procedure(
                ImmutableList.of(x),
                ImmutableList.of(y),
                assign(ref(y), ref(x)),
                assign(ref(y, "y"), ref(x, "x"))));

    AssignStmt first = (AssignStmt) program.getStmts().get(2);
    AssignStmt second = (AssignStmt) program.getStmts().get(3);
    assertThat(second.getId().getVar()).isSameInstanceAs(first.getId().getVar());
    Variable xVar = ((Identifier) first.getExpr()).getVar();
    assertThat(((Identifier) second.getExpr()).getVar()).isSameInstanceAs(xVar);
    assertThat(xVar.isSynthetic()).isFalse();
  }

  // Conditionals

  @Test
  public void testIfElse() {
    AstNode x = paramSpec(intType, "X");
    AstNode y = objectDecl(intType, "Y");
    assertLowering(
        procedure(
            ImmutableList.of(x),
            ImmutableList.of(y),
            ifStmt(
                cmp(AstOperator.GT, ref(x), num(0)),
                ImmutableList.of(assign(ref(y), num(1))),
                ImmutableList.of(assign(ref(y), unOp(AstOperator.MINUS, num(1), uint))))),
        "Program:",
        "  read(X)",
        "  read(Y)",
        "  split:",
        "    assume(X > 0)",
        "    Y = 1",
        "  |:",
        "    assume(!(X > 0))",
        "    Y = -1");
  }

  @Test
  public void testIfWithoutElse() {
    AstNode b = paramSpec(boolType, "B");
    AstNode y = objectDecl(intType, "Y");
    assertLowering(
        procedure(
            ImmutableList.of(b),
            ImmutableList.of(y),
            ifStmt(ref(b), ImmutableList.of(assign(ref(y), num(1))))),
        "Program:",
        "  read(B)",
        "  read(Y)",
        "  split:",
        "    assume(B)",
        "    Y = 1",
        "  |:",
        "    assume(!B)");
  }

  @Test
  public void testElsifBecomesNestedSplit() {
    AstNode x = paramSpec(intType, "X");
    AstNode y = objectDecl(intType, "Y");
    assertLowering(
        procedure(
            ImmutableList.of(x),
            ImmutableList.of(y),
            ifStmt(
                cmp(AstOperator.GT, ref(x), num(0)),
                ImmutableList.of(assign(ref(y), num(1))),
                ImmutableList.of(
                    elsif(cmp(AstOperator.LT, ref(x), num(0)), assign(ref(y), num(2)))),
                ImmutableList.of(assign(ref(y), num(3))))),
        "Program:",
        "  read(X)",
        "  read(Y)",
        "  split:",
        "    assume(X > 0)",
        "    Y = 1",
        "  |:",
        "    assume(!(X > 0))",
        "    split:",
        "      assume(X < 0)",
        "      Y = 2",
        "    |:",
        "      assume(!(X < 0))",
        "      Y = 3");
  }

  // Case statements

  private AstNode caseProcedure(AstNode x, AstNode y, AstNode... alternatives) {
    return procedure(
        ImmutableList.of(x), ImmutableList.of(y), caseStmt(ref(x), alternatives));
  }

  @Test
  public void testCaseGuards() {
    AstNode x = paramSpec(intType, "X");
    AstNode y = objectDecl(intType, "Y");
    assertLowering(
        caseProcedure(
            x,
            y,
            when(ImmutableList.of(num(1)), assign(ref(y), num(1))),
            when(ImmutableList.of(num(2), num(3)), assign(ref(y), num(2))),
            when(ImmutableList.of(others()), nullStmt())),
        "Program:",
        "  read(X)",
        "  read(Y)",
        "  split:",
        "    assume(X == 1)",
        "    Y = 1",
        "  |:",
        "    assume((X == 2) || (X == 3))",
        "    Y = 2",
        "  |:",
        "    assume(!((X == 1) || ((X == 2) || (X == 3))))");
  }

  @Test
  public void testCaseGuardsPartitionTheSelector() {
    AstNode x = paramSpec(intType, "X");
    AstNode y = objectDecl(intType, "Y");
    AstNode n = numberDecl("N", num(6));
    Program program =
        lower(
            caseProcedure(
                x,
                y,
                when(ImmutableList.of(num(1)), assign(ref(y), num(1))),
                when(ImmutableList.of(num(2), paren(num(3))), assign(ref(y), num(2))),
                when(ImmutableList.of(range(num(4), num(5), uint)), assign(ref(y), num(3))),
                when(ImmutableList.of(ref(n, "N", uint)), assign(ref(y), num(4))),
                when(ImmutableList.of(others()), assign(ref(y), num(5)))));

    ImmutableMap<Long, Long> expected =
        ImmutableMap.<Long, Long>builder()
            .put(-1L, 5L)
            .put(0L, 5L)
            .put(1L, 1L)
            .put(2L, 2L)
            .put(3L, 2L)
            .put(4L, 3L)
            .put(5L, 3L)
            .put(6L, 4L)
            .put(7L, 5L)
            .buildOrThrow();
    for (long value : expected.keySet()) {
      ImmutableList<PathEnumerator.Path> paths =
          PathEnumerator.run(program, ImmutableMap.<String, Object>of("X", value));
      assertThat(paths).hasSize(1);
      assertThat(paths.get(0).valueOf("Y")).isEqualTo(expected.get(value));
    }
  }

  @Test
  public void testCaseRangeChoice() {
    AstNode x = paramSpec(intType, "X");
    AstNode y = objectDecl(intType, "Y");
    assertLowering(
        caseProcedure(
            x,
            y,
            when(ImmutableList.of(range(num(1), num(5), uint)), nullStmt()),
            when(ImmutableList.of(others()), assign(ref(y), num(0)))),
        "Program:",
        "  read(X)",
        "  read(Y)",
        "  split:",
        "    assume((X >= 1) && (X <= 5))",
        "  |:",
        "    assume(!((X >= 1) && (X <= 5)))",
        "    Y = 0");
  }

  @Test
  public void testCaseOnEnumeration() {
    AstNode color = typeDecl("Color", enumTypeDef("Red", "Green", "Blue"));
    AstNode c = paramSpec(color, "C");
    AstNode y = objectDecl(intType, "Y");
    assertLowering(
        subpBody(
            "P",
            ImmutableList.of(c),
            ImmutableList.of(color, y),
            caseStmt(
                ref(c),
                when(ImmutableList.of(enumRef(enumLiteral(color, "Red"))), assign(ref(y), num(1))),
                when(
                    ImmutableList.of(
                        enumRef(enumLiteral(color, "Green")), enumRef(enumLiteral(color, "Blue"))),
                    assign(ref(y), num(2))))),
        "Program:",
        "  read(C)",
        "  read(Y)",
        "  split:",
        "    assume(C == Red)",
        "    Y = 1",
        "  |:",
        "    assume((C == Green) || (C == Blue))",
        "    Y = 2");
  }

  @Test
  public void testCaseWithOnlyOthersIsInlined() {
    AstNode x = paramSpec(intType, "X");
    AstNode y = objectDecl(intType, "Y");
    assertLowering(
        caseProcedure(x, y, when(ImmutableList.of(others()), assign(ref(y), num(0)))),
        "Program:",
        "  read(X)",
        "  read(Y)",
        "  assume(True)",
        "  Y = 0");
  }

  @Test
  public void testNonStaticCaseChoice() {
    AstNode x = paramSpec(intType, "X");
    AstNode y = objectDecl(intType, "Y");
    LoweringException e =
        assertRejected(
            caseProcedure(
                x,
                y,
                when(ImmutableList.of(ref(y)), nullStmt()),
                when(ImmutableList.of(others()), nullStmt())),
            BasicIrGenerator.NON_STATIC_CASE_CHOICE);
    assertThat(e).hasMessageThat().startsWith("Case choice \"Y\" is not static");
    assertThat(e.getNode().getText()).isEqualTo("Y");
  }

  // Short-circuit operators

  private AstNode shortCircuitProcedure(AstOperator op, String... params) {
    ImmutableList.Builder<AstNode> specs = ImmutableList.builder();
    AstNode condition = null;
    for (String name : params) {
      AstNode spec = paramSpec(boolType, name);
      specs.add(spec);
      condition = condition == null ? ref(spec) : binOp(op, condition, ref(spec), boolType);
    }
    AstNode r = objectDecl(boolType, "R");
    return procedure(specs.build(), ImmutableList.of(r), assign(ref(r), condition));
  }

  @Test
  public void testAndThen() {
    assertLowering(
        shortCircuitProcedure(AstOperator.AND_THEN, "A", "B"),
        "Program:",
        "  read(A)",
        "  read(B)",
        "  read(R)",
        "  split:",
        "    assume(A)",
        "    split:",
        "      assume(B)",
        "      tmp0 = True",
        "    |:",
        "      assume(!B)",
        "      tmp0 = False",
        "  |:",
        "    assume(!A)",
        "    tmp0 = False",
        "  R = tmp0");
  }

  @Test
  public void testOrElse() {
    assertLowering(
        shortCircuitProcedure(AstOperator.OR_ELSE, "A", "B"),
        "Program:",
        "  read(A)",
        "  read(B)",
        "  read(R)",
        "  split:",
        "    assume(A)",
        "    tmp0 = True",
        "  |:",
        "    assume(!A)",
        "    split:",
        "      assume(B)",
        "      tmp0 = True",
        "    |:",
        "      assume(!B)",
        "      tmp0 = False",
        "  R = tmp0");
  }

  @Test
  public void testShortCircuitTruthTables() {
    Program andThen = lower(shortCircuitProcedure(AstOperator.AND_THEN, "A", "B"));
    Program orElse = lower(shortCircuitProcedure(AstOperator.OR_ELSE, "A", "B"));
    for (boolean a : new boolean[] {false, true}) {
      for (boolean b : new boolean[] {false, true}) {
        ImmutableMap<String, Object> inputs =
            ImmutableMap.of("A", Literals.fromBoolean(a), "B", Literals.fromBoolean(b));

        ImmutableList<PathEnumerator.Path> paths = PathEnumerator.run(andThen, inputs);
        assertThat(paths).hasSize(1);
        assertThat(paths.get(0).valueOf("R")).isEqualTo(Literals.fromBoolean(a && b));
        assertThat(paths.get(0).inspected("B")).isEqualTo(a);

        paths = PathEnumerator.run(orElse, inputs);
        assertThat(paths).hasSize(1);
        assertThat(paths.get(0).valueOf("R")).isEqualTo(Literals.fromBoolean(a || b));
        assertThat(paths.get(0).inspected("B")).isEqualTo(!a);
      }
    }
  }

  @Test
  public void testChainedShortCircuitEvaluatesLazily() {
    // ((A and then B) and then C)
    Program program = lower(shortCircuitProcedure(AstOperator.AND_THEN, "A", "B", "C"));
    for (int bits = 0; bits < 8; bits++) {
      boolean a = (bits & 1) != 0;
      boolean b = (bits & 2) != 0;
      boolean c = (bits & 4) != 0;
      ImmutableList<PathEnumerator.Path> paths =
          PathEnumerator.run(
              program,
              ImmutableMap.<String, Object>of(
                  "A", Literals.fromBoolean(a),
                  "B", Literals.fromBoolean(b),
                  "C", Literals.fromBoolean(c)));
      assertThat(paths).hasSize(1);
      assertThat(paths.get(0).valueOf("R")).isEqualTo(Literals.fromBoolean(a && b && c));
      assertThat(paths.get(0).inspected("B")).isEqualTo(a);
      assertThat(paths.get(0).inspected("C")).isEqualTo(a && b);
    }
  }

  @Test
  public void testTemporaryNamesAvoidDeclaredNames() {
    AstNode a = paramSpec(boolType, "A");
    AstNode b = paramSpec(boolType, "B");
    AstNode taken = objectDecl(boolType, "TMP0");
    Program program =
        lower(
            procedure(
                ImmutableList.of(a, b),
                ImmutableList.of(taken),
                assign(ref(taken), binOp(AstOperator.OR_ELSE, ref(a), ref(b), boolType))));

    AssignStmt last = (AssignStmt) program.getStmts().get(program.getStmts().size() - 1);
    Variable temporary = ((Identifier) last.getExpr()).getVar();
    assertThat(temporary.getName()).isEqualTo("tmp1");
    assertThat(temporary.isSynthetic()).isTrue();
  }

  // Other expressions

  @Test
  public void testIfExpression() {
    AstNode b = paramSpec(boolType, "B");
    AstNode x = objectDecl(intType, "X");
    assertLowering(
        procedure(
            ImmutableList.of(b),
            ImmutableList.of(x),
            assign(ref(x), ifExpr(ref(b), num(1), num(2), intType))),
        "Program:",
        "  read(B)",
        "  read(X)",
        "  split:",
        "    assume(B)",
        "    tmp0 = 1",
        "  |:",
        "    assume(!B)",
        "    tmp0 = 2",
        "  X = tmp0");
  }

  @Test
  public void testIfExpressionWithElsif() {
    AstNode b = paramSpec(boolType, "B");
    AstNode c = paramSpec(boolType, "C");
    AstNode x = objectDecl(intType, "X");
    assertLowering(
        procedure(
            ImmutableList.of(b, c),
            ImmutableList.of(x),
            assign(
                ref(x),
                ifExpr(
                    ref(b), num(1), ImmutableList.of(elsifExpr(ref(c), num(2))), num(3), intType))),
        "Program:",
        "  read(B)",
        "  read(C)",
        "  read(X)",
        "  split:",
        "    assume(B)",
        "    tmp0 = 1",
        "  |:",
        "    assume(!B)",
        "    split:",
        "      assume(C)",
        "      tmp0 = 2",
        "    |:",
        "      assume(!C)",
        "      tmp0 = 3",
        "  X = tmp0");
  }

  @Test
  public void testDereferenceIsGuarded() {
    AstNode intAccess = typeDecl("Int_Access", accessTypeDef(intType));
    AstNode p = paramSpec(intAccess, "P");
    AstNode x = objectDecl(intType, "X");
    Program program =
        lower(
            subpBody(
                "P",
                ImmutableList.of(p),
                ImmutableList.of(intAccess, x),
                assign(ref(x), deref(ref(p), intType))));

    assertThat(program.toString())
        .isEqualTo(
            Joiner.on('\n')
                .join("Program:", "  read(P)", "  read(X)", "  assume(P != null)", "  X = *P"));
    AssumeStmt check = (AssumeStmt) program.getStmts().get(2);
    assertThat(check.getPurpose()).isInstanceOf(Purpose.DerefCheck.class);
    Purpose.DerefCheck purpose = (Purpose.DerefCheck) check.getPurpose();
    assertThat(purpose.getDerefedExpr().toString()).isEqualTo("P");
  }

  @Test
  public void testNullAndAttributes() {
    AstNode intAccess = typeDecl("Int_Access", accessTypeDef(intType));
    AstNode small = typeDecl("Small", signedIntTypeDef(range(num(1), num(10), uint)));
    AstNode p = objectDecl(intAccess, "P");
    AstNode x = objectDecl(intType, "X");
    assertLowering(
        subpBody(
            "P",
            ImmutableList.of(),
            ImmutableList.of(intAccess, small, x, p),
            assign(ref(p), nullLit(intAccess)),
            assign(ref(p), attributeRef(ref(x), "Access", intAccess)),
            assign(ref(x), attributeRef(ref(small, "Small", small), "First", uint)),
            assign(ref(x), attributeRef(ref(small, "Small", small), "LAST", uint))),
        "Program:",
        "  read(X)",
        "  read(P)",
        "  P = null",
        "  P = &X",
        "  X = GetFirst(1 .. 10)",
        "  X = GetLast(1 .. 10)");
  }

  @Test
  public void testEnumerationLiteralAndNamedNumber() {
    AstNode color = typeDecl("Color", enumTypeDef("Red", "Green"));
    AstNode c = objectDecl(color, "C");
    AstNode n = numberDecl("N", binOp(AstOperator.PLUS, num(1), num(2), uint));
    AstNode x = objectDecl(intType, "X");
    assertLowering(
        subpBody(
            "P",
            ImmutableList.of(),
            ImmutableList.of(color, c, n, x),
            assign(ref(c), enumRef(enumLiteral(color, "Green"))),
            assign(ref(x), ref(n, "N", uint))),
        "Program:",
        "  read(C)",
        "  read(X)",
        "  C = Green",
        "  X = 1 + 2");
  }

  @Test
  public void testIntegerLiteralForms() {
    AstNode x = objectDecl(intType, "X");
    assertLowering(
        procedure(
            ImmutableList.of(),
            ImmutableList.of(x),
            assign(ref(x), intLit("16#FF#", uint)),
            assign(ref(x), intLit("1_000", uint))),
        "Program:",
        "  read(X)",
        "  X = 255",
        "  X = 1000");
  }

  @Test
  public void testExpressionFunction() {
    AstNode x = paramSpec(intType, "X");
    Program program =
        lower(
            exprFunction("Is_Positive", ImmutableList.of(x), cmp(AstOperator.GT, ref(x), num(0))));

    assertThat(program.toString()).isEqualTo("Program:\n  read(X)\n  result0 = X > 0");
    AssignStmt result = (AssignStmt) program.getStmts().get(1);
    assertThat(result.getId().getVar().isSynthetic()).isTrue();
    assertThat(result.getId().getTypeHint()).isSameInstanceAs(boolType);
  }

  // Loops and jumps

  @Test
  public void testLoopWithExitWhen() {
    AstNode x = objectDecl(intType, "X");
    assertLowering(
        procedure(
            ImmutableList.of(),
            ImmutableList.of(x),
            loop(
                assign(ref(x), binOp(AstOperator.PLUS, ref(x), num(1), intType)),
                exitWhen(cmp(AstOperator.GT, ref(x), num(10))))),
        "Program:",
        "  read(X)",
        "  loop:",
        "    X = X + 1",
        "    split:",
        "      assume(X > 10)",
        "      goto exit_loop0",
        "    |:",
        "      assume(!(X > 10))",
        "  exit_loop0:");
  }

  @Test
  public void testWhileLoop() {
    AstNode x = objectDecl(intType, "X");
    assertLowering(
        procedure(
            ImmutableList.of(),
            ImmutableList.of(x),
            whileLoop(
                cmp(AstOperator.LT, ref(x), num(10)),
                assign(ref(x), binOp(AstOperator.PLUS, ref(x), num(1), intType)))),
        "Program:",
        "  read(X)",
        "  loop:",
        "    assume(X < 10)",
        "    X = X + 1",
        "  assume(!(X < 10))",
        "  exit_while_loop0:");
  }

  @Test
  public void testExitInsideWhileLoop() {
    AstNode b = paramSpec(boolType, "B");
    assertLowering(
        procedure(ImmutableList.of(b), ImmutableList.of(), whileLoop(ref(b), exit())),
        "Program:",
        "  read(B)",
        "  loop:",
        "    assume(B)",
        "    goto exit_while_loop0",
        "  assume(!B)",
        "  exit_while_loop0:");
  }

  @Test
  public void testNamedExitLeavesOuterLoop() {
    AstNode outer = namedStmtDecl("Outer");
    assertLowering(
        procedure(
            ImmutableList.of(),
            ImmutableList.of(),
            named(outer, loop(loop(exitNamed(outer)), exit()))),
        "Program:",
        "  loop:",
        "    loop:",
        "      goto exit_loop0",
        "    exit_loop1:",
        "    goto exit_loop0",
        "  exit_loop0:");
  }

  @Test
  public void testGotoAndLabels() {
    AstNode again = labelDecl("Again");
    AstNode done = labelDecl("Done");
    AstNode x = objectDecl(intType, "X");
    assertLowering(
        procedure(
            ImmutableList.of(),
            ImmutableList.of(x),
            label(again),
            ifStmt(
                cmp(AstOperator.GT, ref(x), num(0)),
                ImmutableList.of(gotoStmt(done)),
                ImmutableList.of(gotoStmt(again))),
            label(done)),
        "Program:",
        "  read(X)",
        "  Again:",
        "  split:",
        "    assume(X > 0)",
        "    goto Done",
        "  |:",
        "    assume(!(X > 0))",
        "    goto Again",
        "  Done:");
  }

  @Test
  public void testGotoTargetsTheSameLabelStatement() {
    AstNode done = labelDecl("Done");
    Program program =
        lower(procedure(ImmutableList.of(), ImmutableList.of(), gotoStmt(done), label(done)));

    GotoStmt jump = (GotoStmt) program.getStmts().get(0);
    assertThat(jump.getLabel()).isSameInstanceAs(program.getStmts().get(1));
  }

  // Rejected subprograms

  @Test
  public void testForLoopIsRejected() {
    LoweringException e =
        assertRejected(
            procedure(ImmutableList.of(), ImmutableList.of(), forLoop(nullStmt())),
            BasicIrGenerator.UNSUPPORTED_CONSTRUCT);
    assertThat(e).hasMessageThat().isEqualTo("Cannot transform \"for\" (FOR_LOOP_STMT)");
  }

  @Test
  public void testUnsupportedOperatorIsRejected() {
    AstNode x = objectDecl(intType, "X");
    assertRejected(
        procedure(
            ImmutableList.of(),
            ImmutableList.of(x),
            assign(ref(x), binOp(AstOperator.MULT, ref(x), num(2), intType))),
        BasicIrGenerator.UNSUPPORTED_CONSTRUCT);
  }

  @Test
  public void testUnsupportedStatementIsRejected() {
    assertRejected(
        procedure(ImmutableList.of(), ImmutableList.of(), callStmt("Put_Line")),
        BasicIrGenerator.UNSUPPORTED_CONSTRUCT);
  }

  @Test
  public void testExitOutsideLoopIsRejected() {
    assertRejected(
        procedure(ImmutableList.of(), ImmutableList.of(), exit()),
        BasicIrGenerator.UNSUPPORTED_CONSTRUCT);
  }

  @Test
  public void testObjectDeclaredElsewhereIsRejected() {
    AstNode global = objectDecl(intType, "Global");
    AstNode x = objectDecl(intType, "X");
    LoweringException e =
        assertRejected(
            procedure(ImmutableList.of(), ImmutableList.of(x), assign(ref(x), ref(global))),
            BasicIrGenerator.UNSUPPORTED_CONSTRUCT);
    assertThat(e.getNode().getText()).isEqualTo("Global");
  }

  @Test
  public void testUnresolvedObjectTypeIsRejected() {
    LoweringException e =
        assertRejected(
            procedure(
                ImmutableList.of(),
                ImmutableList.<AstNode>of(objectDeclOfUnresolvedType("Unknown_T", "X")),
                nullStmt()),
            BasicIrGenerator.UNSUPPORTED_CONSTRUCT);
    assertThat(e).hasMessageThat().isEqualTo("Cannot transform \"Unknown_T\" (IDENTIFIER)");
  }
}
