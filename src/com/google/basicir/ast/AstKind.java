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

package com.google.basicir.ast;

/**
 * The kinds of nodes an AST adapter exposes to the Basic IR frontend.
 *
 * <p>Children are positional. The layout of each kind is given next to it; a child written as
 * {@code name?} is optional and is represented by an {@link #EMPTY} node when absent, and a child
 * written as {@code name*} stands for any number of trailing children.
 */
public enum AstKind {
  // Placeholder for an absent optional child.
  EMPTY,

  // Roots and bodies.
  COMPILATION_UNIT, // [item*]
  SUBP_BODY, // [DEFINING_NAME, PARAM_LIST, DECL_LIST, STMT_LIST]
  EXPR_FUNCTION, // [DEFINING_NAME, PARAM_LIST, expr]

  // Lists.
  PARAM_LIST, // [PARAM_SPEC*]
  DECL_LIST, // [decl*]
  STMT_LIST, // [stmt*]
  NAME_LIST, // [DEFINING_NAME*]
  CHOICE_LIST, // [expr or OTHERS_DESIGNATOR *]
  ELSIF_LIST, // [ELSIF_STMT_PART* or ELSIF_EXPR_PART*]

  // Declarations.
  DEFINING_NAME, // leaf, the text is the declared name
  PARAM_SPEC, // [NAME_LIST, type IDENTIFIER, default expr?]
  OBJECT_DECL, // [NAME_LIST, type IDENTIFIER, default expr?]
  NUMBER_DECL, // [NAME_LIST, expr]
  TYPE_DECL, // [DEFINING_NAME, type definition?]
  SUBTYPE_DECL, // [DEFINING_NAME, base type IDENTIFIER]
  ENUM_TYPE_DEF, // [ENUM_LITERAL_DECL*]
  ENUM_LITERAL_DECL, // leaf, the text is the literal name
  SIGNED_INT_TYPE_DEF, // [range BIN_OP with DOUBLE_DOT operator]
  ACCESS_TYPE_DEF, // [designated type IDENTIFIER]
  LABEL_DECL, // leaf, the text is the label name
  NAMED_STMT_DECL, // leaf, the text is the statement name

  // Statements.
  NULL_STMT,
  ASSIGN_STMT, // [destination IDENTIFIER, expr]
  IF_STMT, // [cond, STMT_LIST then, ELSIF_LIST, STMT_LIST else]
  ELSIF_STMT_PART, // [cond, STMT_LIST]
  CASE_STMT, // [selector, CASE_ALT*]
  CASE_ALT, // [CHOICE_LIST, STMT_LIST]
  LOOP_STMT, // [STMT_LIST]
  WHILE_LOOP_STMT, // [cond, STMT_LIST]
  FOR_LOOP_STMT, // [loop spec*, STMT_LIST]
  EXIT_STMT, // [loop name IDENTIFIER?, cond?]
  LABEL, // [LABEL_DECL]
  GOTO_STMT, // [label IDENTIFIER]
  NAMED_STMT, // [NAMED_STMT_DECL, stmt]
  CALL_STMT, // [callee, arg*]
  RETURN_STMT, // [expr?]
  EXCEPTION_HANDLER, // [choice*, STMT_LIST]

  // Expressions.
  PAREN_EXPR, // [expr]
  BIN_OP, // [lhs, rhs], see AstNode#getOperator
  UN_OP, // [operand], see AstNode#getOperator
  IF_EXPR, // [cond, then expr, ELSIF_LIST, else expr]
  ELSIF_EXPR_PART, // [cond, then expr]
  IDENTIFIER, // leaf, see AstNode#getReferencedDecl
  INT_LITERAL, // leaf, the text is the literal token
  NULL_LITERAL, // leaf
  EXPLICIT_DEREF, // [prefix]
  ATTRIBUTE_REF, // [prefix, attribute IDENTIFIER]
  CALL_EXPR, // [callee, arg*]
  OTHERS_DESIGNATOR, // leaf
}
