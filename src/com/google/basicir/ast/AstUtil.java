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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Static helpers over the {@link AstNode} contract. */
public final class AstUtil {
  private static final CharMatcher UNDERSCORE = CharMatcher.is('_');
  private static final CharMatcher EXTENDED_DIGITS =
      CharMatcher.inRange('0', '9').or(CharMatcher.inRange('a', 'f'));

  private AstUtil() {}

  /**
   * Collects every node below and including {@code root} whose kind is one of {@code kinds}, in
   * pre-order.
   */
  public static ImmutableList<AstNode> findAll(AstNode root, AstKind... kinds) {
    ImmutableSet<AstKind> wanted = ImmutableSet.copyOf(kinds);
    ImmutableList.Builder<AstNode> result = ImmutableList.builder();
    Deque<AstNode> worklist = new ArrayDeque<>();
    worklist.push(root);
    while (!worklist.isEmpty()) {
      AstNode n = worklist.pop();
      if (wanted.contains(n.getKind())) {
        result.add(n);
      }
      List<? extends AstNode> children = n.getChildren();
      for (int i = children.size() - 1; i >= 0; i--) {
        worklist.push(children.get(i));
      }
    }
    return result.build();
  }

  /** Returns the optional child at {@code index}, or null if it is an EMPTY placeholder. */
  public static @Nullable AstNode getOptionalChild(AstNode n, int index) {
    if (index >= n.getChildCount()) {
      return null;
    }
    AstNode child = n.getChild(index);
    return child.isEmpty() ? null : child;
  }

  /** The name of a subprogram body or expression function. */
  public static String getSubprogramName(AstNode subp) {
    checkArgument(subp.is(AstKind.SUBP_BODY) || subp.is(AstKind.EXPR_FUNCTION), subp.getKind());
    return subp.getChild(0).getText();
  }

  /** The names declared by a parameter, object or number declaration. */
  public static List<? extends AstNode> getDeclaredNames(AstNode decl) {
    checkArgument(
        decl.is(AstKind.PARAM_SPEC) || decl.is(AstKind.OBJECT_DECL) || decl.is(AstKind.NUMBER_DECL),
        decl.getKind());
    AstNode names = decl.getChild(0);
    checkState(names.is(AstKind.NAME_LIST), names.getKind());
    return names.getChildren();
  }

  /** The type declaration named by the type of a parameter or object declaration. */
  public static AstNode getDesignatedTypeDecl(AstNode decl) {
    checkArgument(decl.is(AstKind.PARAM_SPEC) || decl.is(AstKind.OBJECT_DECL), decl.getKind());
    AstNode typeExpr = decl.getChild(1);
    AstNode typeDecl = typeExpr.getReferencedDecl();
    checkState(typeDecl != null, "Unresolved type %s", typeExpr.getText());
    return typeDecl;
  }

  /** The default expression of a parameter or object declaration, if any. */
  public static @Nullable AstNode getDefaultExpr(AstNode decl) {
    checkArgument(decl.is(AstKind.PARAM_SPEC) || decl.is(AstKind.OBJECT_DECL), decl.getKind());
    return getOptionalChild(decl, 2);
  }

  /** The type definition of a type declaration, if any. */
  public static @Nullable AstNode getTypeDef(AstNode typeDecl) {
    if (!typeDecl.is(AstKind.TYPE_DECL)) {
      return null;
    }
    return getOptionalChild(typeDecl, 1);
  }

  /** Whether {@code n} declares a type whose definition has the given kind. */
  public static boolean isTypeDeclOf(AstNode n, AstKind typeDefKind) {
    AstNode typeDef = getTypeDef(n);
    return typeDef != null && typeDef.is(typeDefKind);
  }

  /** The range expression of a signed integer type declaration. */
  public static AstNode getSignedIntRange(AstNode typeDecl) {
    checkArgument(isTypeDeclOf(typeDecl, AstKind.SIGNED_INT_TYPE_DEF), typeDecl.getKind());
    return getTypeDef(typeDecl).getChild(0);
  }

  /** The type declaration which declares the given enumeration literal. */
  public static AstNode getEnclosingTypeDecl(AstNode enumLiteral) {
    checkArgument(enumLiteral.is(AstKind.ENUM_LITERAL_DECL), enumLiteral.getKind());
    AstNode typeDef = enumLiteral.getParent();
    checkState(typeDef != null && typeDef.is(AstKind.ENUM_TYPE_DEF));
    AstNode typeDecl = typeDef.getParent();
    checkState(typeDecl != null && typeDecl.is(AstKind.TYPE_DECL));
    return typeDecl;
  }

  /** Whether one of the choices of a case alternative is {@code others}. */
  public static boolean isOthersAlternative(AstNode caseAlt) {
    checkArgument(caseAlt.is(AstKind.CASE_ALT), caseAlt.getKind());
    for (AstNode choice : caseAlt.getChild(0).getChildren()) {
      if (choice.is(AstKind.OTHERS_DESIGNATOR)) {
        return true;
      }
    }
    return false;
  }

  /**
   * The statement named by a {@link AstKind#NAMED_STMT_DECL}, e.g. the loop an {@code exit Outer}
   * statement leaves.
   */
  public static AstNode getNamedStatement(AstNode namedStmtDecl) {
    checkArgument(namedStmtDecl.is(AstKind.NAMED_STMT_DECL), namedStmtDecl.getKind());
    AstNode namedStmt = namedStmtDecl.getParent();
    checkState(namedStmt != null && namedStmt.is(AstKind.NAMED_STMT));
    return namedStmt.getChild(1);
  }

  /**
   * Parses a decimal or based integer literal such as {@code 1_000}, {@code 2E3} or {@code
   * 16#FF#}. Returns null if the literal is malformed or does not fit in a long.
   */
  public static @Nullable Long parseIntLiteral(String text) {
    String literal = UNDERSCORE.removeFrom(Ascii.toLowerCase(text));
    int radix = 10;
    String digits = literal;
    String exponent = "";
    int hash = literal.indexOf('#');
    try {
      if (hash >= 0) {
        int closingHash = literal.indexOf('#', hash + 1);
        if (closingHash < 0) {
          return null;
        }
        radix = Integer.parseInt(literal.substring(0, hash));
        digits = literal.substring(hash + 1, closingHash);
        exponent = literal.substring(closingHash + 1);
      } else {
        int e = literal.indexOf('e');
        if (e >= 0) {
          digits = literal.substring(0, e);
          exponent = literal.substring(e);
        }
      }
      if (radix < 2 || radix > 16 || !EXTENDED_DIGITS.matchesAllOf(digits)) {
        return null;
      }
      long value = Long.parseLong(digits, radix);
      if (!exponent.isEmpty()) {
        if (exponent.charAt(0) != 'e') {
          return null;
        }
        int exp = Integer.parseInt(exponent.substring(exponent.startsWith("e+") ? 2 : 1));
        if (exp < 0) {
          return null;
        }
        for (int i = 0; i < exp; i++) {
          value = Math.multiplyExact(value, radix);
        }
      }
      return value;
    } catch (NumberFormatException | ArithmeticException e) {
      return null;
    }
  }
}
