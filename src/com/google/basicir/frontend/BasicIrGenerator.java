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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.basicir.ast.AstKind;
import com.google.basicir.ast.AstNode;
import com.google.basicir.ast.AstOperator;
import com.google.basicir.ast.AstUtil;
import com.google.basicir.tree.AssignStmt;
import com.google.basicir.tree.AssumeStmt;
import com.google.basicir.tree.BinExpr;
import com.google.basicir.tree.Expr;
import com.google.basicir.tree.GotoStmt;
import com.google.basicir.tree.IR;
import com.google.basicir.tree.Identifier;
import com.google.basicir.tree.LabelStmt;
import com.google.basicir.tree.Lit;
import com.google.basicir.tree.Literals;
import com.google.basicir.tree.LoopStmt;
import com.google.basicir.tree.Operator;
import com.google.basicir.tree.Program;
import com.google.basicir.tree.Purpose;
import com.google.basicir.tree.ReadStmt;
import com.google.basicir.tree.SplitStmt;
import com.google.basicir.tree.Stmt;
import com.google.basicir.tree.UnExpr;
import com.google.basicir.tree.Variable;
import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Lowers one subprogram of the AST into a Basic IR {@link Program}.
 *
 * <p>Structured control flow becomes splits, loops, labels and gotos. Every condition is turned
 * into a pair of assumptions, short-circuit operators and if expressions are expanded into
 * statements writing a temporary, and every dereference is preceded by an assumption that the
 * dereferenced pointer is not null.
 *
 * <p>An instance lowers exactly one subprogram. Constructs that cannot be lowered abort the whole
 * subprogram with a {@link LoweringException}.
 */
final class BasicIrGenerator {

  static final DiagnosticType UNSUPPORTED_CONSTRUCT =
      DiagnosticType.error("BASIC_IR_UNSUPPORTED_CONSTRUCT", "Cannot transform \"{0}\" ({1})");

  static final DiagnosticType NON_STATIC_CASE_CHOICE =
      DiagnosticType.error(
          "BASIC_IR_NON_STATIC_CASE_CHOICE", "Case choice \"{0}\" is not static: {1}");

  private static final ImmutableMap<AstOperator, Operator> BINARY_OPERATORS =
      ImmutableMap.<AstOperator, Operator>builder()
          .put(AstOperator.LT, Operator.LT)
          .put(AstOperator.LTE, Operator.LE)
          .put(AstOperator.EQ, Operator.EQ)
          .put(AstOperator.NEQ, Operator.NEQ)
          .put(AstOperator.GTE, Operator.GE)
          .put(AstOperator.GT, Operator.GT)
          .put(AstOperator.AND, Operator.AND)
          .put(AstOperator.OR, Operator.OR)
          .put(AstOperator.PLUS, Operator.PLUS)
          .put(AstOperator.MINUS, Operator.MINUS)
          .put(AstOperator.DOUBLE_DOT, Operator.DOT_DOT)
          .buildOrThrow();

  private static final ImmutableMap<AstOperator, Operator> UNARY_OPERATORS =
      ImmutableMap.of(AstOperator.MINUS, Operator.NEG, AstOperator.NOT, Operator.NOT);

  /** Attributes, by lower-case name. */
  private static final ImmutableMap<String, Operator> ATTRIBUTES =
      ImmutableMap.of(
          "access", Operator.ADDRESS,
          "first", Operator.GET_FIRST,
          "last", Operator.GET_LAST);

  /** Identifies the variable of one name declared by one declaration. */
  @AutoValue
  abstract static class VarKey {
    abstract AstNode declaration();

    /** The declared name in lower case, since identifiers are not case-sensitive. */
    abstract String name();

    static VarKey of(AstNode declaration, String name) {
      return new AutoValue_BasicIrGenerator_VarKey(declaration, Ascii.toLowerCase(name));
    }
  }

  /** A loop being lowered, and the label its exit statements jump to. */
  private record LoopContext(AstNode loop, LabelStmt exitLabel) {}

  /** A lowered expression and the statements which must run before it is evaluated. */
  private record Lowered(ImmutableList<Stmt> preStmts, Expr expr) {
    static Lowered of(Expr expr) {
      return new Lowered(ImmutableList.of(), expr);
    }
  }

  private final ConstExprEvaluator evaluator;
  private final AstNode subprogram;
  private final String temporaryPrefix;
  private final TemporaryNameSupplier names;

  private final Map<VarKey, Variable> variables = new HashMap<>();
  private final Map<AstNode, LabelStmt> labels = Maps.newIdentityHashMap();
  private final Deque<LoopContext> loops = new ArrayDeque<>();

  BasicIrGenerator(ConstExprEvaluator evaluator, AstNode subprogram, ExtractionOptions options) {
    checkArgument(
        subprogram.is(AstKind.SUBP_BODY) || subprogram.is(AstKind.EXPR_FUNCTION),
        "Not a subprogram: %s",
        subprogram.getKind());
    this.evaluator = evaluator;
    this.subprogram = subprogram;
    this.temporaryPrefix = options.getTemporaryPrefix();
    this.names = new TemporaryNameSupplier(collectDeclaredNames(subprogram));
  }

  private static ImmutableSet<String> collectDeclaredNames(AstNode subprogram) {
    ImmutableSet.Builder<String> declared = ImmutableSet.builder();
    for (AstNode n :
        AstUtil.findAll(
            subprogram,
            AstKind.DEFINING_NAME,
            AstKind.LABEL_DECL,
            AstKind.NAMED_STMT_DECL,
            AstKind.ENUM_LITERAL_DECL)) {
      declared.add(Ascii.toLowerCase(n.getText()));
    }
    return declared.build();
  }

  /**
   * Lowers the subprogram. Must be called at most once.
   *
   * @throws LoweringException if the subprogram uses a construct which cannot be lowered
   */
  Program generate() {
    // Labels may be jumped to before their statement is reached.
    for (AstNode labelDecl : AstUtil.findAll(subprogram, AstKind.LABEL_DECL)) {
      labels.put(labelDecl, new LabelStmt(labelDecl.getText(), labelDecl));
    }

    ImmutableList.Builder<Stmt> stmts = ImmutableList.builder();
    for (AstNode param : subprogram.getChild(1).getChildren()) {
      stmts.addAll(transformDecl(param));
    }
    if (subprogram.is(AstKind.SUBP_BODY)) {
      for (AstNode decl : subprogram.getChild(2).getChildren()) {
        stmts.addAll(transformDecl(decl));
      }
      stmts.addAll(transformStmts(subprogram.getChild(3)));
    } else {
      AstNode expr = subprogram.getChild(2);
      Lowered result = transformExpr(expr);
      Variable resultVar = newTemporary("result", result.expr().getTypeHint(), expr);
      stmts.addAll(result.preStmts());
      stmts.add(new AssignStmt(IR.ident(resultVar), result.expr(), expr));
    }
    return new Program(stmts.build(), subprogram);
  }

  // Declarations

  private ImmutableList<Stmt> transformDecl(AstNode decl) {
    switch (decl.getKind()) {
      case TYPE_DECL:
      case SUBTYPE_DECL:
      case NUMBER_DECL:
      case SUBP_BODY:
      case EXPR_FUNCTION:
        return ImmutableList.of();
      case PARAM_SPEC:
        {
          ImmutableList.Builder<Stmt> reads = ImmutableList.builder();
          for (AstNode name : AstUtil.getDeclaredNames(decl)) {
            Variable var = declareVariable(decl, name);
            reads.add(new ReadStmt(new Identifier(var, var.getTypeHint(), name), decl));
          }
          return reads.build();
        }
      case OBJECT_DECL:
        return transformObjectDecl(decl);
      default:
        throw unsupported(decl);
    }
  }

  private ImmutableList<Stmt> transformObjectDecl(AstNode decl) {
    AstNode defaultExpr = AstUtil.getDefaultExpr(decl);
    ImmutableList.Builder<Stmt> stmts = ImmutableList.builder();
    // The initializer is evaluated once and its value assigned to every declared name.
    @Nullable Lowered init = null;
    if (defaultExpr != null) {
      init = transformExpr(defaultExpr);
      stmts.addAll(init.preStmts());
    }
    for (AstNode name : AstUtil.getDeclaredNames(decl)) {
      Variable var = declareVariable(decl, name);
      Identifier id = new Identifier(var, var.getTypeHint(), name);
      if (init == null) {
        stmts.add(new ReadStmt(id, decl));
      } else {
        stmts.add(new AssignStmt(id, init.expr(), decl));
      }
    }
    return stmts.build();
  }

  private Variable declareVariable(AstNode decl, AstNode name) {
    AstNode typeExpr = decl.getChild(1);
    if (typeExpr.getReferencedDecl() == null) {
      throw unsupported(typeExpr);
    }
    Variable var = new Variable(name.getText(), AstUtil.getDesignatedTypeDecl(decl), null, name);
    Variable previous = variables.put(VarKey.of(decl, name.getText()), var);
    checkState(previous == null, "%s declared twice", name.getText());
    return var;
  }

  private Variable lookupVariable(AstNode decl, AstNode ref) {
    Variable var = variables.get(VarKey.of(decl, ref.getText()));
    if (var == null) {
      // An object declared outside of the subprogram.
      throw unsupported(ref);
    }
    return var;
  }

  private Variable newTemporary(String base, AstNode typeHint, @Nullable AstNode origNode) {
    return new Variable(names.get(base), typeHint, Purpose.SYNTHETIC_VARIABLE, origNode);
  }

  // Statements

  private ImmutableList<Stmt> transformStmts(AstNode stmtList) {
    checkArgument(stmtList.is(AstKind.STMT_LIST), stmtList.getKind());
    ImmutableList.Builder<Stmt> stmts = ImmutableList.builder();
    for (AstNode stmt : stmtList.getChildren()) {
      stmts.addAll(transformStmt(stmt));
    }
    return stmts.build();
  }

  private ImmutableList<Stmt> transformStmt(AstNode stmt) {
    switch (stmt.getKind()) {
      case NULL_STMT:
      case EXCEPTION_HANDLER:
        return ImmutableList.of();
      case ASSIGN_STMT:
        return transformAssign(stmt);
      case IF_STMT:
        return transformIf(stmt);
      case CASE_STMT:
        return transformCase(stmt);
      case LOOP_STMT:
        return transformLoop(stmt);
      case WHILE_LOOP_STMT:
        return transformWhileLoop(stmt);
      case EXIT_STMT:
        return transformExit(stmt);
      case NAMED_STMT:
        return transformStmt(stmt.getChild(1));
      case LABEL:
        {
          LabelStmt label = labels.get(stmt.getChild(0));
          checkState(label != null, "Label %s was not allocated", stmt.getText());
          return ImmutableList.of(label);
        }
      case GOTO_STMT:
        {
          AstNode labelDecl = stmt.getChild(0).getReferencedDecl();
          LabelStmt label = labelDecl == null ? null : labels.get(labelDecl);
          if (label == null) {
            throw unsupported(stmt);
          }
          return ImmutableList.of(new GotoStmt(label, stmt));
        }
      default:
        throw unsupported(stmt);
    }
  }

  private ImmutableList<Stmt> transformAssign(AstNode stmt) {
    AstNode dest = stmt.getChild(0);
    if (!dest.is(AstKind.IDENTIFIER)) {
      throw unsupported(dest);
    }
    AstNode decl = dest.getReferencedDecl();
    if (decl == null || !(decl.is(AstKind.OBJECT_DECL) || decl.is(AstKind.PARAM_SPEC))) {
      throw unsupported(dest);
    }
    Variable var = lookupVariable(decl, dest);
    AstNode destType = dest.getExpressionType();
    Identifier id = new Identifier(var, destType != null ? destType : var.getTypeHint(), dest);
    Lowered value = transformExpr(stmt.getChild(1));
    return ImmutableList.<Stmt>builder()
        .addAll(value.preStmts())
        .add(new AssignStmt(id, value.expr(), stmt))
        .build();
  }

  private ImmutableList<Stmt> transformIf(AstNode stmt) {
    ImmutableList<Stmt> thenStmts = transformStmts(stmt.getChild(1));
    List<AstNode> elsifParts = new ArrayList<>(stmt.getChild(2).getChildren());
    List<ImmutableList<Stmt>> elsifStmts = new ArrayList<>();
    for (AstNode part : elsifParts) {
      elsifStmts.add(transformStmts(part.getChild(1)));
    }
    ImmutableList<Stmt> elseStmts = transformStmts(stmt.getChild(3));

    // "if A then X elsif B then Y else Z" is "if A then X else (if B then Y else Z)".
    for (int i = elsifParts.size() - 1; i >= 0; i--) {
      AstNode part = elsifParts.get(i);
      elseStmts = genSplit(part.getChild(0), elsifStmts.get(i), elseStmts, part);
    }
    return genSplit(stmt.getChild(0), thenStmts, elseStmts, stmt);
  }

  /**
   * Lowers {@code if cond then thenStmts else elseStmts}: the statements of the condition, then a
   * split with one branch assuming the condition and the other assuming its negation.
   */
  private ImmutableList<Stmt> genSplit(
      AstNode cond, List<Stmt> thenStmts, List<Stmt> elseStmts, @Nullable AstNode origNode) {
    Lowered lowered = transformExpr(cond);
    Expr condExpr = lowered.expr();
    ImmutableList<Stmt> thenBranch =
        ImmutableList.<Stmt>builder()
            .add(new AssumeStmt(condExpr, null, null))
            .addAll(thenStmts)
            .build();
    ImmutableList<Stmt> elseBranch =
        ImmutableList.<Stmt>builder()
            .add(new AssumeStmt(IR.not(condExpr), null, null))
            .addAll(elseStmts)
            .build();
    return ImmutableList.<Stmt>builder()
        .addAll(lowered.preStmts())
        .add(new SplitStmt(ImmutableList.of(thenBranch, elseBranch), origNode))
        .build();
  }

  private ImmutableList<Stmt> transformCase(AstNode stmt) {
    Lowered selector = transformExpr(stmt.getChild(0));
    Expr selectorExpr = selector.expr();
    AstNode boolType = evaluator.getBoolType();

    List<Expr> guards = new ArrayList<>();
    List<ImmutableList<Stmt>> branches = new ArrayList<>();
    @Nullable AstNode othersAlt = null;
    for (AstNode alt : stmt.getChildren().subList(1, stmt.getChildCount())) {
      if (AstUtil.isOthersAlternative(alt)) {
        othersAlt = alt;
        continue;
      }
      List<Expr> choiceGuards = new ArrayList<>();
      for (AstNode choice : alt.getChild(0).getChildren()) {
        choiceGuards.add(genChoiceGuard(selectorExpr, choice));
      }
      guards.add(IR.leftFold(Operator.OR, choiceGuards, boolType));
      branches.add(transformStmts(alt.getChild(1)));
    }
    if (othersAlt != null) {
      Expr othersGuard =
          guards.isEmpty()
              ? IR.lit(Literals.TRUE, boolType)
              : IR.not(IR.leftFold(Operator.OR, guards, boolType));
      guards.add(othersGuard);
      branches.add(transformStmts(othersAlt.getChild(1)));
    }

    List<ImmutableList<Stmt>> guardedBranches = new ArrayList<>();
    for (int i = 0; i < branches.size(); i++) {
      guardedBranches.add(
          ImmutableList.<Stmt>builder()
              .add(new AssumeStmt(guards.get(i), null, null))
              .addAll(branches.get(i))
              .build());
    }

    ImmutableList.Builder<Stmt> stmts = ImmutableList.<Stmt>builder().addAll(selector.preStmts());
    if (guardedBranches.size() == 1) {
      // A single alternative needs no dispatch.
      stmts.addAll(guardedBranches.get(0));
    } else if (guardedBranches.size() > 1) {
      stmts.add(new SplitStmt(guardedBranches, stmt));
    }
    return stmts.build();
  }

  /** The condition under which {@code selector} matches the static choice {@code choice}. */
  private Expr genChoiceGuard(Expr selector, AstNode choice) {
    Lowered lowered = transformExpr(choice);
    Object value;
    try {
      if (!lowered.preStmts().isEmpty()) {
        throw new NotConstantException("the choice needs statements to be evaluated");
      }
      value = evaluator.eval(lowered.expr());
    } catch (NotConstantException e) {
      throw new LoweringException(
          NON_STATIC_CASE_CHOICE, choice, e, choice.getText(), e.getMessage());
    }

    AstNode boolType = evaluator.getBoolType();
    AstNode selectorType = selector.getTypeHint();
    if (value instanceof ConstExprEvaluator.Range) {
      ConstExprEvaluator.Range range = (ConstExprEvaluator.Range) value;
      return IR.binExpr(
          IR.binExpr(selector, Operator.GE, IR.lit(range.first(), selectorType), boolType),
          Operator.AND,
          IR.binExpr(selector, Operator.LE, IR.lit(range.last(), selectorType), boolType),
          boolType);
    }
    return IR.binExpr(selector, Operator.EQ, IR.lit(value, selectorType), boolType);
  }

  private ImmutableList<Stmt> transformLoop(AstNode stmt) {
    LabelStmt exitLabel = new LabelStmt(names.get("exit_loop"), null);
    loops.push(new LoopContext(stmt, exitLabel));
    ImmutableList<Stmt> body = transformStmts(stmt.getChild(0));
    loops.pop();
    return ImmutableList.of(new LoopStmt(body, stmt), exitLabel);
  }

  /**
   * Lowers {@code while C loop S end loop} into a loop which assumes the condition on entry to
   * each iteration, followed by the assumption that the condition does not hold.
   */
  private ImmutableList<Stmt> transformWhileLoop(AstNode stmt) {
    Lowered cond = transformExpr(stmt.getChild(0));
    LabelStmt exitLabel = new LabelStmt(names.get("exit_while_loop"), null);
    loops.push(new LoopContext(stmt, exitLabel));
    ImmutableList<Stmt> body = transformStmts(stmt.getChild(1));
    loops.pop();

    ImmutableList<Stmt> loopBody =
        ImmutableList.<Stmt>builder()
            .addAll(cond.preStmts())
            .add(new AssumeStmt(cond.expr(), null, null))
            .addAll(body)
            .build();
    return ImmutableList.of(
        new LoopStmt(loopBody, stmt),
        new AssumeStmt(IR.not(cond.expr()), null, null),
        exitLabel);
  }

  private ImmutableList<Stmt> transformExit(AstNode stmt) {
    LoopContext exited = findExitedLoop(stmt, AstUtil.getOptionalChild(stmt, 0));
    ImmutableList<Stmt> jump = ImmutableList.of(new GotoStmt(exited.exitLabel(), stmt));
    AstNode cond = AstUtil.getOptionalChild(stmt, 1);
    if (cond == null) {
      return jump;
    }
    return genSplit(cond, jump, ImmutableList.of(), stmt);
  }

  private LoopContext findExitedLoop(AstNode exitStmt, @Nullable AstNode loopName) {
    if (loopName == null) {
      if (loops.isEmpty()) {
        throw unsupported(exitStmt);
      }
      return loops.peek();
    }
    AstNode nameDecl = loopName.getReferencedDecl();
    if (nameDecl != null && nameDecl.is(AstKind.NAMED_STMT_DECL)) {
      AstNode loop = AstUtil.getNamedStatement(nameDecl);
      for (LoopContext context : loops) {
        if (context.loop() == loop) {
          return context;
        }
      }
    }
    throw unsupported(exitStmt);
  }

  // Expressions

  private Lowered transformExpr(AstNode expr) {
    switch (expr.getKind()) {
      case PAREN_EXPR:
        return transformExpr(expr.getChild(0));
      case BIN_OP:
        return transformBinOp(expr);
      case UN_OP:
        return transformUnOp(expr);
      case IF_EXPR:
        return transformIfExpr(expr);
      case IDENTIFIER:
        return transformIdentifier(expr);
      case INT_LITERAL:
        {
          Long value = AstUtil.parseIntLiteral(expr.getText());
          if (value == null) {
            throw unsupported(expr);
          }
          return Lowered.of(new Lit(value, typeOf(expr), expr));
        }
      case NULL_LITERAL:
        return Lowered.of(new Lit(Literals.NULL, typeOf(expr), expr));
      case EXPLICIT_DEREF:
        return transformDeref(expr);
      case ATTRIBUTE_REF:
        return transformAttributeRef(expr);
      default:
        throw unsupported(expr);
    }
  }

  private Lowered transformBinOp(AstNode expr) {
    AstOperator astOp = expr.getOperator();
    if (astOp != null && astOp.isShortCircuit()) {
      return transformShortCircuit(expr, astOp);
    }
    Operator op = astOp == null ? null : BINARY_OPERATORS.get(astOp);
    if (op == null) {
      throw unsupported(expr);
    }
    Lowered lhs = transformExpr(expr.getChild(0));
    Lowered rhs = transformExpr(expr.getChild(1));
    return new Lowered(
        concat(lhs.preStmts(), rhs.preStmts()),
        new BinExpr(lhs.expr(), op, rhs.expr(), typeOf(expr), expr));
  }

  /**
   * Expands {@code A and then B} and {@code A or else B} into a split writing a boolean temporary,
   * so that {@code B} is only evaluated where the language evaluates it.
   */
  private Lowered transformShortCircuit(AstNode expr, AstOperator op) {
    AstNode boolType = typeOf(expr);
    Variable result = newTemporary(temporaryPrefix, boolType, expr);
    AstNode lhs = expr.getChild(0);
    AstNode rhs = expr.getChild(1);

    ImmutableList<Stmt> stmts;
    if (op == AstOperator.AND_THEN) {
      stmts =
          genSplit(
              lhs,
              genSplit(rhs, assignBool(result, true), assignBool(result, false), null),
              assignBool(result, false),
              expr);
    } else {
      stmts =
          genSplit(
              lhs,
              assignBool(result, true),
              genSplit(rhs, assignBool(result, true), assignBool(result, false), null),
              expr);
    }
    return new Lowered(stmts, new Identifier(result, boolType, expr));
  }

  private static ImmutableList<Stmt> assignBool(Variable var, boolean value) {
    return ImmutableList.of(
        IR.assign(IR.ident(var), IR.lit(Literals.fromBoolean(value), var.getTypeHint())));
  }

  private Lowered transformUnOp(AstNode expr) {
    AstOperator astOp = expr.getOperator();
    if (astOp == AstOperator.PLUS) {
      return transformExpr(expr.getChild(0));
    }
    Operator op = astOp == null ? null : UNARY_OPERATORS.get(astOp);
    if (op == null) {
      throw unsupported(expr);
    }
    Lowered operand = transformExpr(expr.getChild(0));
    return new Lowered(operand.preStmts(), new UnExpr(op, operand.expr(), typeOf(expr), expr));
  }

  /** Lowers an if expression into a split assigning the value of each branch to a temporary. */
  private Lowered transformIfExpr(AstNode expr) {
    Variable result = newTemporary(temporaryPrefix, typeOf(expr), expr);
    ImmutableList<Stmt> thenStmts = assignLowered(result, transformExpr(expr.getChild(1)));
    List<AstNode> elsifParts = new ArrayList<>(expr.getChild(2).getChildren());
    List<ImmutableList<Stmt>> elsifStmts = new ArrayList<>();
    for (AstNode part : elsifParts) {
      elsifStmts.add(assignLowered(result, transformExpr(part.getChild(1))));
    }
    ImmutableList<Stmt> elseStmts = assignLowered(result, transformExpr(expr.getChild(3)));

    for (int i = elsifParts.size() - 1; i >= 0; i--) {
      AstNode part = elsifParts.get(i);
      elseStmts = genSplit(part.getChild(0), elsifStmts.get(i), elseStmts, part);
    }
    ImmutableList<Stmt> stmts = genSplit(expr.getChild(0), thenStmts, elseStmts, expr);
    return new Lowered(stmts, new Identifier(result, result.getTypeHint(), expr));
  }

  private static ImmutableList<Stmt> assignLowered(Variable var, Lowered value) {
    return ImmutableList.<Stmt>builder()
        .addAll(value.preStmts())
        .add(IR.assign(IR.ident(var), value.expr()))
        .build();
  }

  private Lowered transformIdentifier(AstNode expr) {
    AstNode decl = expr.getReferencedDecl();
    if (decl == null) {
      throw unsupported(expr);
    }
    switch (decl.getKind()) {
      case OBJECT_DECL:
      case PARAM_SPEC:
        return Lowered.of(new Identifier(lookupVariable(decl, expr), typeOf(expr), expr));
      case ENUM_LITERAL_DECL:
        return Lowered.of(new Lit(decl.getText(), AstUtil.getEnclosingTypeDecl(decl), expr));
      case NUMBER_DECL:
        // Named numbers are replaced by their value.
        return transformExpr(decl.getChild(1));
      case TYPE_DECL:
        if (AstUtil.isTypeDeclOf(decl, AstKind.SIGNED_INT_TYPE_DEF)) {
          return transformExpr(AstUtil.getSignedIntRange(decl));
        }
        throw unsupported(expr);
      default:
        throw unsupported(expr);
    }
  }

  /** Lowers {@code P.all} into an assumption that {@code P} is not null and the dereference. */
  private Lowered transformDeref(AstNode expr) {
    Lowered prefix = transformExpr(expr.getChild(0));
    Expr pointer = prefix.expr();
    Expr notNull =
        IR.binExpr(
            pointer,
            Operator.NEQ,
            IR.lit(Literals.NULL, pointer.getTypeHint()),
            evaluator.getBoolType());
    AssumeStmt check = new AssumeStmt(notNull, new Purpose.DerefCheck(pointer), expr);
    return new Lowered(
        ImmutableList.<Stmt>builder().addAll(prefix.preStmts()).add(check).build(),
        new UnExpr(Operator.DEREF, pointer, typeOf(expr), expr));
  }

  private Lowered transformAttributeRef(AstNode expr) {
    Operator op = ATTRIBUTES.get(Ascii.toLowerCase(expr.getChild(1).getText()));
    if (op == null) {
      throw unsupported(expr);
    }
    Lowered prefix = transformExpr(expr.getChild(0));
    return new Lowered(prefix.preStmts(), new UnExpr(op, prefix.expr(), typeOf(expr), expr));
  }

  private AstNode typeOf(AstNode expr) {
    AstNode type = expr.getExpressionType();
    if (type == null) {
      throw unsupported(expr);
    }
    return type;
  }

  private static ImmutableList<Stmt> concat(List<Stmt> first, List<Stmt> second) {
    return ImmutableList.<Stmt>builder().addAll(first).addAll(second).build();
  }

  private static LoweringException unsupported(AstNode node) {
    return new LoweringException(
        UNSUPPORTED_CONSTRUCT, node, node.getText(), node.getKind().name());
  }
}
