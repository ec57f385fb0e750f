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

import com.google.javascript.lowering.OperatorPrecedence.Associativity;
import com.google.javascript.lowering.ast.Field;
import com.google.javascript.lowering.ast.IR;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.SyntaxKind;

/**
 * Inserts the parentheses an expression needs to keep its meaning in a new position.
 *
 * <p>Every method returns its argument when no parentheses are needed, and otherwise a new
 * parenthesized expression covering the same source range.
 */
public final class Parenthesizer {

  private Parenthesizer() {}

  /** For the object of a property access, element access, call or tagged template. */
  public static Node parenthesizeForAccess(Node expression) {
    Node emitted = OperatorPrecedence.skipPartiallyEmittedExpressions(expression);
    if (emitted.getKind().isLeftHandSideExpression()
        && (!emitted.isNew() || emitted.getArguments() != null)
        && emitted.getKind() != SyntaxKind.NUMERIC_LITERAL) {
      return expression;
    }
    return paren(expression);
  }

  /** For the callee of a {@code new} expression. */
  public static Node parenthesizeForNew(Node expression) {
    Node emitted = OperatorPrecedence.skipPartiallyEmittedExpressions(expression);
    switch (emitted.getKind()) {
      case CALL_EXPRESSION:
        return paren(expression);
      case NEW_EXPRESSION:
        return emitted.getArguments() != null ? expression : paren(expression);
      default:
        return parenthesizeForAccess(expression);
    }
  }

  public static Node parenthesizePrefixOperand(Node operand) {
    return operand.getKind().isUnaryExpression() ? operand : paren(operand);
  }

  public static Node parenthesizePostfixOperand(Node operand) {
    return operand.getKind().isLeftHandSideExpression() ? operand : paren(operand);
  }

  /** For an element of a comma-separated list: arguments, array elements, initializers. */
  public static Node parenthesizeExpressionForList(Node expression) {
    return OperatorPrecedence.getExpressionPrecedence(expression) > OperatorPrecedence.COMMA
        ? expression
        : paren(expression);
  }

  /**
   * For the expression of an expression statement, which must not start with an object literal
   * or a function expression.
   */
  public static Node parenthesizeExpressionForExpressionStatement(Node expression) {
    Node emitted = OperatorPrecedence.skipPartiallyEmittedExpressions(expression);
    if (emitted.isCall()) {
      Node callee = emitted.getExpression();
      SyntaxKind calleeKind = OperatorPrecedence.skipPartiallyEmittedExpressions(callee).getKind();
      if (calleeKind == SyntaxKind.FUNCTION_EXPRESSION || calleeKind == SyntaxKind.ARROW_FUNCTION) {
        Node call = IR.getMutableClone(emitted);
        call.setField(Field.EXPRESSION, paren(callee));
        return rewrapPartiallyEmitted(expression, call);
      }
    }
    SyntaxKind leftmost = getLeftmostExpression(emitted).getKind();
    if (leftmost == SyntaxKind.OBJECT_LITERAL_EXPRESSION
        || leftmost == SyntaxKind.FUNCTION_EXPRESSION) {
      return paren(expression);
    }
    return expression;
  }

  /** Replaces the innermost expression under the partially emitted wrappers of {@code outer}. */
  private static Node rewrapPartiallyEmitted(Node outer, Node inner) {
    if (outer.getKind() != SyntaxKind.PARTIALLY_EMITTED_EXPRESSION) {
      return inner;
    }
    Node wrapper = IR.getMutableClone(outer);
    wrapper.setField(Field.EXPRESSION, rewrapPartiallyEmitted(outer.getExpression(), inner));
    return wrapper;
  }

  /** For the expression body of an arrow function, which must not start with an object literal. */
  public static Node parenthesizeConciseBody(Node body) {
    if (!body.isBlock()
        && getLeftmostExpression(body).getKind() == SyntaxKind.OBJECT_LITERAL_EXPRESSION) {
      return paren(body);
    }
    return body;
  }

  /**
   * For an operand of a binary expression.
   *
   * @param operator the operator of the binary expression
   * @param operand the operand to check
   * @param isLeftSide whether {@code operand} is the left operand
   */
  public static Node parenthesizeBinaryOperand(
      SyntaxKind operator, Node operand, boolean isLeftSide) {
    return binaryOperandNeedsParentheses(operator, operand, isLeftSide) ? paren(operand) : operand;
  }

  private static boolean binaryOperandNeedsParentheses(
      SyntaxKind operator, Node operand, boolean isLeftSide) {
    int operatorPrecedence = OperatorPrecedence.getBinaryOperatorPrecedence(operator);
    Associativity operatorAssociativity =
        OperatorPrecedence.getBinaryOperatorAssociativity(operator);
    Node emitted = OperatorPrecedence.skipPartiallyEmittedExpressions(operand);
    int operandPrecedence = OperatorPrecedence.getExpressionPrecedence(emitted);

    if (operandPrecedence < operatorPrecedence) {
      // a = yield b
      return isLeftSide
          || operatorAssociativity != Associativity.RIGHT
          || emitted.getKind() != SyntaxKind.YIELD_EXPRESSION;
    } else if (operandPrecedence > operatorPrecedence) {
      return false;
    } else if (isLeftSide) {
      // (a/b)**x, (a**b)**x
      return operatorAssociativity == Associativity.RIGHT;
    } else {
      // x*(a*b) -> x*a*b
      if (emitted.isBinaryExpression()
          && emitted.getOperator() == operator
          && OperatorPrecedence.hasAssociativeProperty(operator)) {
        return false;
      }
      // x/(a**b) -> x/a**b, but x/(a*b) keeps its parentheses
      return OperatorPrecedence.getExpressionAssociativity(emitted) == Associativity.LEFT;
    }
  }

  private static Node getLeftmostExpression(Node node) {
    while (true) {
      switch (node.getKind()) {
        case POSTFIX_UNARY_EXPRESSION:
          node = node.getChild(Field.OPERAND);
          continue;
        case BINARY_EXPRESSION:
          node = node.getLeft();
          continue;
        case CONDITIONAL_EXPRESSION:
          node = node.getChild(Field.CONDITION);
          continue;
        case TAGGED_TEMPLATE_EXPRESSION:
          node = node.getChild(Field.TAG);
          continue;
        case CALL_EXPRESSION:
        case ELEMENT_ACCESS_EXPRESSION:
        case PROPERTY_ACCESS_EXPRESSION:
        case AS_EXPRESSION:
        case NON_NULL_EXPRESSION:
        case PARTIALLY_EMITTED_EXPRESSION:
          node = node.getExpression();
          continue;
        default:
          return node;
      }
    }
  }

  private static Node paren(Node expression) {
    Node paren = IR.paren(expression);
    paren.setSourceRange(expression);
    return paren;
  }
}
