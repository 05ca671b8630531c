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

import com.google.basicir.ast.AstKind;
import com.google.basicir.ast.AstNode;
import com.google.basicir.ast.AstOperator;
import com.google.basicir.ast.AstUtil;
import com.google.basicir.types.AbstractType;
import com.google.basicir.types.BooleanType;
import com.google.basicir.types.EnumType;
import com.google.basicir.types.IntRangeType;
import com.google.basicir.types.PointerType;
import com.google.basicir.types.Typer;
import com.google.basicir.types.Typers;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * Typers for the type declarations which Basic IR nodes use as type hints.
 *
 * <p>{@link #defaultTyper} combines all of them; the others are exposed so that clients can
 * assemble their own combination.
 */
public final class AdaTypers {

  private AdaTypers() {}

  /** Types the standard {@code Boolean} and {@code Integer} of the given context. */
  public static Typer<AstNode> standardTyper(ConstExprEvaluator evaluator) {
    AstNode boolType = evaluator.getBoolType();
    AstNode intType = evaluator.getIntType();
    return hint -> {
      if (hint == boolType) {
        return BooleanType.create();
      } else if (hint == intType) {
        return IntRangeType.create(Integer.MIN_VALUE, Integer.MAX_VALUE);
      }
      return null;
    };
  }

  /** Types {@code type T is range L .. H} when both bounds are integer literals. */
  public static Typer<AstNode> intRangeTyper() {
    return hint -> {
      if (!AstUtil.isTypeDeclOf(hint, AstKind.SIGNED_INT_TYPE_DEF)) {
        return null;
      }
      AstNode range = AstUtil.getSignedIntRange(hint);
      Long low = literalBound(range.getChild(0));
      Long high = literalBound(range.getChild(1));
      if (low == null || high == null || low > high) {
        return null;
      }
      return IntRangeType.create(low, high);
    };
  }

  private static @Nullable Long literalBound(AstNode bound) {
    switch (bound.getKind()) {
      case INT_LITERAL:
        return AstUtil.parseIntLiteral(bound.getText());
      case PAREN_EXPR:
        return literalBound(bound.getChild(0));
      case UN_OP:
        {
          Long operand = literalBound(bound.getChild(0));
          if (operand == null) {
            return null;
          } else if (bound.getOperator() == AstOperator.MINUS) {
            return -operand;
          } else if (bound.getOperator() == AstOperator.PLUS) {
            return operand;
          }
          return null;
        }
      default:
        return null;
    }
  }

  /** Types enumeration type declarations by their literals. */
  public static Typer<AstNode> enumTyper() {
    return hint -> {
      if (!AstUtil.isTypeDeclOf(hint, AstKind.ENUM_TYPE_DEF)) {
        return null;
      }
      ImmutableList.Builder<String> literals = ImmutableList.builder();
      for (AstNode literal : AstUtil.getTypeDef(hint).getChildren()) {
        literals.add(literal.getText());
      }
      return EnumType.create(literals.build());
    };
  }

  /** Types access types as pointers to whatever {@code inner} makes of the designated type. */
  public static Typer<AstNode> accessTyper(Typer<AstNode> inner) {
    return hint -> {
      if (!AstUtil.isTypeDeclOf(hint, AstKind.ACCESS_TYPE_DEF)) {
        return null;
      }
      AstNode designated = AstUtil.getTypeDef(hint).getChild(0).getReferencedDecl();
      AbstractType elementType = designated == null ? null : inner.apply(designated);
      return elementType == null ? null : PointerType.create(elementType);
    };
  }

  /** Types a subtype like its base type. */
  public static Typer<AstNode> subtypeTyper(Typer<AstNode> inner) {
    return hint -> {
      if (!hint.is(AstKind.SUBTYPE_DECL)) {
        return null;
      }
      AstNode base = hint.getChild(1).getReferencedDecl();
      return base == null ? null : inner.apply(base);
    };
  }

  /** All of the above, tried in order. */
  public static Typer<AstNode> defaultTyper(ConstExprEvaluator evaluator) {
    Typer<AstNode> standard = standardTyper(evaluator);
    return Typers.delegating(
        self ->
            standard
                .or(intRangeTyper())
                .or(enumTyper())
                .or(accessTyper(self))
                .or(subtypeTyper(self)));
  }
}
