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
import static com.google.basicir.ast.TestAst.enumTypeDef;
import static com.google.basicir.ast.TestAst.intLit;
import static com.google.basicir.ast.TestAst.objectDecl;
import static com.google.basicir.ast.TestAst.paren;
import static com.google.basicir.ast.TestAst.range;
import static com.google.basicir.ast.TestAst.ref;
import static com.google.basicir.ast.TestAst.signedIntTypeDef;
import static com.google.basicir.ast.TestAst.subtypeDecl;
import static com.google.basicir.ast.TestAst.typeDecl;
import static com.google.basicir.ast.TestAst.unOp;
import static com.google.common.truth.Truth.assertThat;

import com.google.basicir.ast.AstNode;
import com.google.basicir.ast.AstOperator;
import com.google.basicir.ast.TestStandardTypes;
import com.google.basicir.types.BooleanType;
import com.google.basicir.types.EnumType;
import com.google.basicir.types.IntRangeType;
import com.google.basicir.types.PointerType;
import com.google.basicir.types.Typer;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link AdaTypers}. */
@RunWith(JUnit4.class)
public final class AdaTypersTest {
  private final TestStandardTypes std = new TestStandardTypes();
  private final AstNode uint = std.getUniversalIntType();
  private final ConstExprEvaluator evaluator = new ConstExprEvaluator(std);
  private final Typer<AstNode> typer = AdaTypers.defaultTyper(evaluator);

  private AstNode rangeType(String name, AstNode low, AstNode high) {
    return typeDecl(name, signedIntTypeDef(range(low, high, uint)));
  }

  @Test
  public void testStandardTypes() {
    Typer<AstNode> standard = AdaTypers.standardTyper(evaluator);
    assertThat(standard.apply(std.getBoolType())).isEqualTo(BooleanType.create());
    assertThat(standard.apply(std.getIntType()))
        .isEqualTo(IntRangeType.create(-(1L << 31), (1L << 31) - 1));
    assertThat(standard.apply(uint)).isNull();
  }

  @Test
  public void testIntRange() {
    AstNode small = rangeType("Small", intLit(1, uint), intLit(10, uint));
    assertThat(typer.apply(small)).isEqualTo(IntRangeType.create(1, 10));

    AstNode signed =
        rangeType(
            "Signed", unOp(AstOperator.MINUS, intLit(5, uint), uint), paren(intLit("1_0", uint)));
    assertThat(typer.apply(signed)).isEqualTo(IntRangeType.create(-5, 10));
  }

  @Test
  public void testIntRangeWithNonLiteralBoundIsNotTyped() {
    AstNode x = objectDecl(std.getIntType(), "X");
    AstNode dynamic = rangeType("Dynamic", intLit(1, uint), ref(x));
    assertThat(AdaTypers.intRangeTyper().apply(dynamic)).isNull();
    assertThat(AdaTypers.intRangeTyper().apply(std.getBoolType())).isNull();
  }

  @Test
  public void testEnum() {
    AstNode color = typeDecl("Color", enumTypeDef("Red", "Green", "Blue"));
    assertThat(typer.apply(color))
        .isEqualTo(EnumType.create(ImmutableList.of("Red", "Green", "Blue")));
    assertThat(AdaTypers.enumTyper().apply(std.getIntType())).isNull();
  }

  @Test
  public void testAccessTypesUseTheCompleteTyper() {
    AstNode intAccess = typeDecl("Int_Access", accessTypeDef(std.getIntType()));
    AstNode intAccessAccess = typeDecl("Int_Access_Access", accessTypeDef(intAccess));

    assertThat(typer.apply(intAccessAccess))
        .isEqualTo(
            PointerType.create(
                PointerType.create(IntRangeType.create(Integer.MIN_VALUE, Integer.MAX_VALUE))));
  }

  @Test
  public void testAccessToUntypedIsNotTyped() {
    AstNode opaque = typeDecl("Opaque", accessTypeDef(uint));
    assertThat(typer.apply(opaque)).isNull();
  }

  @Test
  public void testSubtype() {
    AstNode natural = subtypeDecl("Natural", std.getIntType());
    assertThat(typer.apply(natural)).isEqualTo(typer.apply(std.getIntType()));
  }
}
