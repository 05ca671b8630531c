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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.basicir.ast.AstKind;
import com.google.basicir.ast.AstNode;
import com.google.basicir.ast.AstUtil;
import com.google.basicir.ast.StandardTypes;
import com.google.basicir.tree.Program;
import com.google.basicir.types.Typer;
import com.google.common.collect.ImmutableList;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Extracts Basic IR programs from the subprograms of compilation units.
 *
 * <p>Programs extracted with the same context share the same standard types, hence compatible
 * typers. A context is not thread-safe: the evaluator it owns caches results.
 */
public final class ExtractionContext {
  private static final Logger logger = Logger.getLogger(ExtractionContext.class.getName());

  private final ConstExprEvaluator evaluator;
  private final ExtractionOptions options;
  private final ErrorManager errorManager;

  public ExtractionContext(
      StandardTypes standardTypes, ExtractionOptions options, ErrorManager errorManager) {
    this.evaluator = new ConstExprEvaluator(standardTypes);
    this.options = checkNotNull(options);
    this.errorManager = checkNotNull(errorManager);
  }

  /** Creates a context with default options, logging errors. */
  public ExtractionContext(StandardTypes standardTypes) {
    this(standardTypes, new ExtractionOptions(), new LoggerErrorManager());
  }

  public ConstExprEvaluator getEvaluator() {
    return evaluator;
  }

  public ExtractionOptions getOptions() {
    return options;
  }

  public ErrorManager getErrorManager() {
    return errorManager;
  }

  /** The typer for the type hints of programs extracted with this context. */
  public Typer<AstNode> getDefaultTyper() {
    return AdaTypers.defaultTyper(evaluator);
  }

  /**
   * Extracts a program from every subprogram body and expression function below {@code unitRoot},
   * in source order. Subprograms which cannot be lowered are reported to the error manager and
   * left out.
   */
  public ImmutableList<Program> extractPrograms(AstNode unitRoot) {
    ImmutableList.Builder<Program> programs = ImmutableList.builder();
    for (AstNode subprogram : AstUtil.findAll(unitRoot, AstKind.SUBP_BODY, AstKind.EXPR_FUNCTION)) {
      Program program = extractProgram(subprogram);
      if (program != null) {
        programs.add(program);
      }
    }
    return programs.build();
  }

  /**
   * Extracts the program of one subprogram body or expression function.
   *
   * @return the program, or null if the subprogram was rejected and the error reported
   */
  public @Nullable Program extractProgram(AstNode subprogram) {
    String name = AstUtil.getSubprogramName(subprogram);
    Program program;
    try {
      program = new BasicIrGenerator(evaluator, subprogram, options).generate();
    } catch (LoweringException e) {
      ExtractionError error = ExtractionError.fromException(name, e);
      errorManager.report(error.defaultLevel(), error);
      return null;
    }

    if (options.shouldNormalizeUniversalTypes()) {
      new ConvertUniversalTypes(evaluator).process(program);
    }
    if (options.shouldValidateIr()) {
      new IrValidator().validateProgram(program);
    }
    logger.fine("Extracted program " + name);
    return program;
  }
}
