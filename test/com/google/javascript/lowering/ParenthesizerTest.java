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

import com.google.javascript.lowering.ast.IR;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.NodeList;
import com.google.javascript.lowering.ast.SyntaxKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ParenthesizerTest {

  @Test
  public void testForAccess() {
    Node name = IR.identifier("a");
    Node call = IR.call(IR.identifier("f"));
    Node newWithArguments = IR.newExpression(IR.identifier("C"), null, NodeList.of());

    assertThat(Parenthesizer.parenthesizeForAccess(name)).isSameInstanceAs(name);
    assertThat(Parenthesizer.parenthesizeForAccess(call)).isSameInstanceAs(call);
    assertThat(Parenthesizer.parenthesizeForAccess(newWithArguments))
        .isSameInstanceAs(newWithArguments);
    assertParenthesized(Parenthesizer.parenthesizeForAccess(IR.numericLiteral("1")));
    assertParenthesized(Parenthesizer.parenthesizeForAccess(sum("a", "b")));
    assertParenthesized(
        Parenthesizer.parenthesizeForAccess(IR.newExpression(IR.identifier("C"), null, null)));
  }

  @Test
  public void testForNew() {
    Node name = IR.identifier("C");

    assertThat(Parenthesizer.parenthesizeForNew(name)).isSameInstanceAs(name);
    assertParenthesized(Parenthesizer.parenthesizeForNew(IR.call(IR.identifier("f"))));
  }

  @Test
  public void testExpressionForList() {
    Node assignment = IR.assignment(IR.identifier("a"), IR.identifier("b"));

    assertThat(Parenthesizer.parenthesizeExpressionForList(assignment))
        .isSameInstanceAs(assignment);
    assertParenthesized(
        Parenthesizer.parenthesizeExpressionForList(
            IR.comma(IR.identifier("a"), IR.identifier("b"))));
  }

  @Test
  public void testExpressionStatementStartingWithObjectLiteral() {
    Node assignment =
        IR.assignment(IR.propertyAccess(IR.objectLiteral(), "x"), IR.numericLiteral("1"));

    assertParenthesized(Parenthesizer.parenthesizeExpressionForExpressionStatement(assignment));
  }

  @Test
  public void testExpressionStatementCallingFunctionExpression() {
    Node function = IR.functionExpression(NodeList.of(), IR.block());
    Node call = IR.call(function);

    Node result = Parenthesizer.parenthesizeExpressionForExpressionStatement(call);

    assertThat(result.isCall()).isTrue();
    assertThat(result.getOriginal()).isSameInstanceAs(call);
    assertParenthesized(result.getExpression());
    assertThat(call.getExpression()).isSameInstanceAs(function);
  }

  @Test
  public void testExpressionStatementCallingFunctionExpressionUnderPartiallyEmitted() {
    Node function = IR.functionExpression(NodeList.of(), IR.block());
    Node call = IR.call(function);
    Node wrapper = IR.partiallyEmittedExpression(call, null);

    Node result = Parenthesizer.parenthesizeExpressionForExpressionStatement(wrapper);

    assertThat(result.getKind()).isEqualTo(SyntaxKind.PARTIALLY_EMITTED_EXPRESSION);
    assertThat(result.getOriginal()).isSameInstanceAs(wrapper);
    Node newCall = result.getExpression();
    assertThat(newCall.isCall()).isTrue();
    assertThat(newCall.getOriginal()).isSameInstanceAs(call);
    assertParenthesized(newCall.getExpression());
    assertThat(wrapper.getExpression()).isSameInstanceAs(call);
  }

  @Test
  public void testExpressionStatementCallOnObjectLiteral() {
    // ({}).toString()
    Node call = IR.call(IR.propertyAccess(IR.objectLiteral(), "toString"));

    assertParenthesized(Parenthesizer.parenthesizeExpressionForExpressionStatement(call));
  }

  @Test
  public void testExpressionStatementUnchanged() {
    Node call = IR.call(IR.identifier("f"));
    Node assignment = IR.assignment(IR.identifier("a"), IR.numericLiteral("1"));

    assertThat(Parenthesizer.parenthesizeExpressionForExpressionStatement(call))
        .isSameInstanceAs(call);
    assertThat(Parenthesizer.parenthesizeExpressionForExpressionStatement(assignment))
        .isSameInstanceAs(assignment);
  }

  @Test
  public void testConciseBody() {
    Node block = IR.block();

    assertThat(Parenthesizer.parenthesizeConciseBody(block)).isSameInstanceAs(block);
    assertParenthesized(Parenthesizer.parenthesizeConciseBody(IR.objectLiteral()));
  }

  @Test
  public void testUnaryOperands() {
    Node name = IR.identifier("a");

    assertThat(Parenthesizer.parenthesizePrefixOperand(name)).isSameInstanceAs(name);
    assertThat(Parenthesizer.parenthesizePostfixOperand(name)).isSameInstanceAs(name);
    assertParenthesized(Parenthesizer.parenthesizePrefixOperand(sum("a", "b")));
    assertParenthesized(Parenthesizer.parenthesizePostfixOperand(sum("a", "b")));
  }

  @Test
  public void testLowerPrecedenceOperand() {
    assertParenthesized(
        Parenthesizer.parenthesizeBinaryOperand(SyntaxKind.ASTERISK_TOKEN, sum("a", "b"), true));
    assertParenthesized(
        Parenthesizer.parenthesizeBinaryOperand(SyntaxKind.ASTERISK_TOKEN, sum("a", "b"), false));
  }

  @Test
  public void testHigherPrecedenceOperand() {
    Node product = binary("a", SyntaxKind.ASTERISK_TOKEN, "b");

    assertThat(Parenthesizer.parenthesizeBinaryOperand(SyntaxKind.PLUS_TOKEN, product, false))
        .isSameInstanceAs(product);
  }

  @Test
  public void testEqualPrecedenceOperand() {
    Node product = binary("a", SyntaxKind.ASTERISK_TOKEN, "b");
    Node quotient = binary("a", SyntaxKind.SLASH_TOKEN, "b");
    Node difference = binary("a", SyntaxKind.MINUS_TOKEN, "b");
    Node power = binary("a", SyntaxKind.ASTERISK_ASTERISK_TOKEN, "b");

    // a * (b * c) needs none, a / (b * c) and a - (b - c) do.
    assertThat(Parenthesizer.parenthesizeBinaryOperand(SyntaxKind.ASTERISK_TOKEN, product, false))
        .isSameInstanceAs(product);
    assertParenthesized(
        Parenthesizer.parenthesizeBinaryOperand(SyntaxKind.SLASH_TOKEN, product, false));
    assertParenthesized(
        Parenthesizer.parenthesizeBinaryOperand(SyntaxKind.MINUS_TOKEN, difference, false));
    assertThat(Parenthesizer.parenthesizeBinaryOperand(SyntaxKind.SLASH_TOKEN, quotient, true))
        .isSameInstanceAs(quotient);
    // ** is right associative.
    assertParenthesized(
        Parenthesizer.parenthesizeBinaryOperand(SyntaxKind.ASTERISK_ASTERISK_TOKEN, power, true));
    assertThat(
            Parenthesizer.parenthesizeBinaryOperand(
                SyntaxKind.ASTERISK_ASTERISK_TOKEN, power, false))
        .isSameInstanceAs(power);
  }

  @Test
  public void testYieldOnRightOfAssignment() {
    Node yield = IR.yield(false, IR.identifier("b"));

    assertThat(Parenthesizer.parenthesizeBinaryOperand(SyntaxKind.EQUALS_TOKEN, yield, false))
        .isSameInstanceAs(yield);
    assertParenthesized(
        Parenthesizer.parenthesizeBinaryOperand(SyntaxKind.PLUS_TOKEN, yield, false));
  }

  @Test
  public void testParenthesesCoverOperandRange() {
    Node operand = sum("a", "b");
    operand.setSourceRange(3, 8);

    Node result = Parenthesizer.parenthesizeForAccess(operand);

    assertThat(result.getPos()).isEqualTo(3);
    assertThat(result.getEnd()).isEqualTo(8);
    assertThat(result.getExpression()).isSameInstanceAs(operand);
  }

  private static Node sum(String left, String right) {
    return binary(left, SyntaxKind.PLUS_TOKEN, right);
  }

  private static Node binary(String left, SyntaxKind operator, String right) {
    return IR.binary(IR.identifier(left), operator, IR.identifier(right));
  }

  private static void assertParenthesized(Node node) {
    assertThat(node.getKind()).isEqualTo(SyntaxKind.PARENTHESIZED_EXPRESSION);
  }
}
