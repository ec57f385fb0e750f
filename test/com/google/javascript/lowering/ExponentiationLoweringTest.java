/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.javascript.lowering;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.javascript.lowering.ast.IR;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.NodeList;
import com.google.javascript.lowering.ast.SyntaxKind;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Test cases for the pass that replaces the exponentiation operators with {@code Math.pow}. */
@RunWith(JUnit4.class)
public final class ExponentiationLoweringTest {

  private static final String MATH_POW =
      "(PROPERTY_ACCESS_EXPRESSION (IDENTIFIER Math) (IDENTIFIER pow))";

  private TransformationPipeline pipeline;

  @Before
  public void setUp() {
    pipeline =
        new TransformationPipeline(
            new RewriterOptions(), ImmutableList.of(new ExponentiationLowering()));
  }

  @Test
  public void testExponentiationOperator() {
    Node result = transform(IR.expressionStatement(pow(number("2"), number("2"))));

    assertThat(statement(result, 0))
        .isEqualTo(
            "(EXPRESSION_STATEMENT (CALL_EXPRESSION "
                + MATH_POW
                + " (NUMERIC_LITERAL 2) (NUMERIC_LITERAL 2)))");
    assertThat(result.getStatements().size()).isEqualTo(1);
  }

  @Test
  public void testExponentiationAssignmentOperator() {
    Node result =
        transform(
            IR.expressionStatement(
                IR.binary(
                    IR.identifier("x"),
                    SyntaxKind.ASTERISK_ASTERISK_EQUALS_TOKEN,
                    number("2"))));

    assertThat(statement(result, 0))
        .isEqualTo(
            "(EXPRESSION_STATEMENT (BINARY_EXPRESSION = (IDENTIFIER x) (CALL_EXPRESSION "
                + MATH_POW
                + " (IDENTIFIER x) (NUMERIC_LITERAL 2))))");
    assertThat(result.getStatements().size()).isEqualTo(1);
  }

  @Test
  public void testExponentialOperatorInIfCondition() {
    Node condition =
        IR.binary(pow(number("2"), number("3")), SyntaxKind.GREATER_THAN_TOKEN, number("0"));

    Node result = transform(IR.ifStatement(condition, IR.block(), null));

    assertThat(statement(result, 0))
        .isEqualTo(
            "(IF_STATEMENT (BINARY_EXPRESSION > (CALL_EXPRESSION "
                + MATH_POW
                + " (NUMERIC_LITERAL 2) (NUMERIC_LITERAL 3)) (NUMERIC_LITERAL 0)) (BLOCK))");
  }

  @Test
  public void testNestedExponentiation() {
    // a ** b ** c
    Node expression = pow(IR.identifier("a"), pow(IR.identifier("b"), IR.identifier("c")));

    Node result = transform(IR.expressionStatement(expression));

    assertThat(statement(result, 0))
        .isEqualTo(
            "(EXPRESSION_STATEMENT (CALL_EXPRESSION "
                + MATH_POW
                + " (IDENTIFIER a) (CALL_EXPRESSION "
                + MATH_POW
                + " (IDENTIFIER b) (IDENTIFIER c))))");
  }

  @Test
  public void testPropertyAssignmentEvaluatesObjectOnce() {
    Node target = IR.propertyAccess(IR.identifier("o"), "p");

    Node result = transform(IR.expressionStatement(powAssign(target, number("2"))));

    assertThat(statement(result, 0))
        .isEqualTo(
            "(EXPRESSION_STATEMENT (BINARY_EXPRESSION = (PROPERTY_ACCESS_EXPRESSION"
                + " (PARENTHESIZED_EXPRESSION (BINARY_EXPRESSION = (IDENTIFIER _a) (IDENTIFIER o)))"
                + " (IDENTIFIER p)) (CALL_EXPRESSION "
                + MATH_POW
                + " (PROPERTY_ACCESS_EXPRESSION (IDENTIFIER _a) (IDENTIFIER p))"
                + " (NUMERIC_LITERAL 2))))");
    assertThat(statement(result, 1)).isEqualTo(varStatement("_a"));
  }

  @Test
  public void testElementAssignmentEvaluatesObjectAndKeyOnce() {
    Node target = IR.elementAccess(IR.identifier("o"), IR.identifier("k"));

    Node result = transform(IR.expressionStatement(powAssign(target, number("2"))));

    assertThat(statement(result, 0))
        .isEqualTo(
            "(EXPRESSION_STATEMENT (BINARY_EXPRESSION = (ELEMENT_ACCESS_EXPRESSION"
                + " (PARENTHESIZED_EXPRESSION (BINARY_EXPRESSION = (IDENTIFIER _a) (IDENTIFIER o)))"
                + " (BINARY_EXPRESSION = (IDENTIFIER _b) (IDENTIFIER k))) (CALL_EXPRESSION "
                + MATH_POW
                + " (ELEMENT_ACCESS_EXPRESSION (IDENTIFIER _a) (IDENTIFIER _b))"
                + " (NUMERIC_LITERAL 2))))");
    assertThat(statement(result, 1)).isEqualTo(varStatement("_a", "_b"));
  }

  @Test
  public void testParenthesizedTargetIsReused() {
    // (x) **= 2
    Node target = IR.paren(IR.identifier("x"));

    Node result = transform(IR.expressionStatement(powAssign(target, number("2"))));

    assertThat(statement(result, 0))
        .isEqualTo(
            "(EXPRESSION_STATEMENT (BINARY_EXPRESSION = (PARENTHESIZED_EXPRESSION (IDENTIFIER x))"
                + " (CALL_EXPRESSION "
                + MATH_POW
                + " (PARENTHESIZED_EXPRESSION (IDENTIFIER x)) (NUMERIC_LITERAL 2))))");
    assertThat(result.getStatements().size()).isEqualTo(1);
    Node assignment = result.getStatements().get(0).getExpression();
    assertThat(assignment.getLeft()).isSameInstanceAs(target);
    Node base = assignment.getRight().getArguments().get(0);
    assertThat(base).isNotSameInstanceAs(target);
    assertThat(base.getOriginal()).isSameInstanceAs(target);
  }

  @Test
  public void testTemporariesAreHoistedIntoEnclosingFunction() {
    Node body =
        IR.block(
            IR.expressionStatement(
                powAssign(IR.propertyAccess(IR.identifier("o"), "p"), number("2"))));
    Node function = IR.functionDeclaration("f", NodeList.of(), body);

    Node result = transform(function);

    assertThat(result.getStatements().size()).isEqualTo(1);
    Node newBody = result.getStatements().get(0).getBody();
    assertThat(newBody.getStatements().size()).isEqualTo(2);
    assertThat(newBody.getStatements().get(1).toStringTree()).isEqualTo(varStatement("_a"));
  }

  @Test
  public void testArrowExpressionBodyWithTemporary() {
    Node arrow =
        IR.arrowFunction(
            NodeList.of(IR.parameter("o")),
            powAssign(IR.propertyAccess(IR.identifier("o"), "p"), number("2")));

    Node result = transform(IR.expressionStatement(arrow));

    Node body = result.getStatements().get(0).getExpression().getBody();
    assertThat(body.isBlock()).isTrue();
    assertThat(body.getStatements().get(0).isReturnStatement()).isTrue();
    assertThat(body.getStatements().get(1).toStringTree()).isEqualTo(varStatement("_a"));
  }

  @Test
  public void testReplacementKeepsPositionAndOriginal() {
    Node expression = pow(number("2"), number("3"));
    expression.setSourceRange(0, 6);

    Node result = transform(IR.expressionStatement(expression));

    Node call = result.getStatements().get(0).getExpression();
    assertThat(call.isCall()).isTrue();
    assertThat(call.getPos()).isEqualTo(0);
    assertThat(call.getEnd()).isEqualTo(6);
    assertThat(call.getOriginal()).isSameInstanceAs(expression);
  }

  @Test
  public void testResultNoLongerNeedsLowering() {
    Node result = transform(IR.expressionStatement(pow(number("2"), number("3"))));

    assertThat(TransformFlags.has(result.getTransformFlags(), TransformFlags.CONTAINS_ES2016))
        .isFalse();
  }

  @Test
  public void testFileWithoutExponentiationIsUnchanged() {
    Node file =
        IR.sourceFile(
            "a.js",
            IR.expressionStatement(
                IR.binary(IR.identifier("a"), SyntaxKind.ASTERISK_TOKEN, IR.identifier("b"))));

    assertThat(pipeline.transform(file)).isSameInstanceAs(file);
  }

  private Node transform(Node... statements) {
    return pipeline.transform(IR.sourceFile("input.js", statements));
  }

  private static String statement(Node file, int index) {
    return file.getStatements().get(index).toStringTree();
  }

  private static String varStatement(String... names) {
    StringBuilder sb = new StringBuilder("(VARIABLE_STATEMENT (VARIABLE_DECLARATION_LIST");
    for (String name : names) {
      sb.append(" (VARIABLE_DECLARATION (IDENTIFIER ").append(name).append("))");
    }
    return sb.append("))").toString();
  }

  private static Node pow(Node base, Node exponent) {
    return IR.binary(base, SyntaxKind.ASTERISK_ASTERISK_TOKEN, exponent);
  }

  private static Node powAssign(Node target, Node exponent) {
    return IR.binary(target, SyntaxKind.ASTERISK_ASTERISK_EQUALS_TOKEN, exponent);
  }

  private static Node number(String text) {
    return IR.numericLiteral(text);
  }
}
