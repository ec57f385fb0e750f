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

import com.google.javascript.lowering.ast.Field;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.SyntaxKind;

/** Operator precedence and associativity of expressions, as used for parenthesization. */
final class OperatorPrecedence {

  enum Associativity {
    LEFT,
    RIGHT
  }

  static final int COMMA = 0;
  static final int SPREAD = 1;
  static final int YIELD = 2;
  static final int ASSIGNMENT = 3;
  static final int CONDITIONAL = 4;
  static final int PREFIX = 16;
  static final int POSTFIX = 17;
  static final int CALL = 18;
  static final int MEMBER = 19;
  static final int PRIMARY = 20;
  static final int UNKNOWN = -1;

  private OperatorPrecedence() {}

  /** Returns the precedence of {@code node}, looking through synthesized wrappers. */
  static int getExpressionPrecedence(Node node) {
    Node expression = skipPartiallyEmittedExpressions(node);
    switch (expression.getKind()) {
      case BINARY_EXPRESSION:
        return getBinaryOperatorPrecedence(expression.getOperator());
      case NEW_EXPRESSION:
        return expression.getArguments() != null ? MEMBER : CALL;
      default:
        return getPrecedence(expression.getKind());
    }
  }

  private static int getPrecedence(SyntaxKind kind) {
    switch (kind) {
      case THIS_KEYWORD:
      case SUPER_KEYWORD:
      case IDENTIFIER:
      case NULL_KEYWORD:
      case TRUE_KEYWORD:
      case FALSE_KEYWORD:
      case NUMERIC_LITERAL:
      case STRING_LITERAL:
      case REGULAR_EXPRESSION_LITERAL:
      case NO_SUBSTITUTION_TEMPLATE_LITERAL:
      case TEMPLATE_EXPRESSION:
      case ARRAY_LITERAL_EXPRESSION:
      case OBJECT_LITERAL_EXPRESSION:
      case FUNCTION_EXPRESSION:
      case CLASS_EXPRESSION:
      case JSX_ELEMENT:
      case JSX_SELF_CLOSING_ELEMENT:
      case PARENTHESIZED_EXPRESSION:
      case OMITTED_EXPRESSION:
        return PRIMARY;
      case PROPERTY_ACCESS_EXPRESSION:
      case ELEMENT_ACCESS_EXPRESSION:
      case TAGGED_TEMPLATE_EXPRESSION:
      case NON_NULL_EXPRESSION:
        return MEMBER;
      case CALL_EXPRESSION:
        return CALL;
      case POSTFIX_UNARY_EXPRESSION:
        return POSTFIX;
      case PREFIX_UNARY_EXPRESSION:
      case TYPE_OF_EXPRESSION:
      case VOID_EXPRESSION:
      case DELETE_EXPRESSION:
      case AWAIT_EXPRESSION:
      case TYPE_ASSERTION_EXPRESSION:
        return PREFIX;
      case AS_EXPRESSION:
        return getBinaryOperatorPrecedence(SyntaxKind.INSTANCEOF_KEYWORD);
      case CONDITIONAL_EXPRESSION:
        return CONDITIONAL;
      case YIELD_EXPRESSION:
      case ARROW_FUNCTION:
        return YIELD;
      case SPREAD_ELEMENT:
        return SPREAD;
      default:
        return UNKNOWN;
    }
  }

  static int getBinaryOperatorPrecedence(SyntaxKind operator) {
    switch (operator) {
      case COMMA_TOKEN:
        return COMMA;
      case BAR_BAR_TOKEN:
        return 5;
      case AMPERSAND_AMPERSAND_TOKEN:
        return 6;
      case BAR_TOKEN:
        return 7;
      case CARET_TOKEN:
        return 8;
      case AMPERSAND_TOKEN:
        return 9;
      case EQUALS_EQUALS_TOKEN:
      case EXCLAMATION_EQUALS_TOKEN:
      case EQUALS_EQUALS_EQUALS_TOKEN:
      case EXCLAMATION_EQUALS_EQUALS_TOKEN:
        return 10;
      case LESS_THAN_TOKEN:
      case GREATER_THAN_TOKEN:
      case LESS_THAN_EQUALS_TOKEN:
      case GREATER_THAN_EQUALS_TOKEN:
      case INSTANCEOF_KEYWORD:
      case IN_KEYWORD:
        return 11;
      case LESS_THAN_LESS_THAN_TOKEN:
      case GREATER_THAN_GREATER_THAN_TOKEN:
      case GREATER_THAN_GREATER_THAN_GREATER_THAN_TOKEN:
        return 12;
      case PLUS_TOKEN:
      case MINUS_TOKEN:
        return 13;
      case ASTERISK_TOKEN:
      case SLASH_TOKEN:
      case PERCENT_TOKEN:
        return 14;
      case ASTERISK_ASTERISK_TOKEN:
        return 15;
      default:
        return operator.isAssignmentOperator() ? ASSIGNMENT : UNKNOWN;
    }
  }

  static Associativity getExpressionAssociativity(Node node) {
    Node expression = skipPartiallyEmittedExpressions(node);
    switch (expression.getKind()) {
      case NEW_EXPRESSION:
        return expression.getArguments() != null ? Associativity.LEFT : Associativity.RIGHT;
      case PREFIX_UNARY_EXPRESSION:
      case TYPE_OF_EXPRESSION:
      case VOID_EXPRESSION:
      case DELETE_EXPRESSION:
      case AWAIT_EXPRESSION:
      case CONDITIONAL_EXPRESSION:
      case YIELD_EXPRESSION:
        return Associativity.RIGHT;
      case BINARY_EXPRESSION:
        return getBinaryOperatorAssociativity(expression.getOperator());
      default:
        return Associativity.LEFT;
    }
  }

  static Associativity getBinaryOperatorAssociativity(SyntaxKind operator) {
    return operator == SyntaxKind.ASTERISK_ASTERISK_TOKEN || operator.isAssignmentOperator()
        ? Associativity.RIGHT
        : Associativity.LEFT;
  }

  /** Whether {@code (a op b) op c} and {@code a op (b op c)} always evaluate alike. */
  static boolean hasAssociativeProperty(SyntaxKind operator) {
    switch (operator) {
      case ASTERISK_TOKEN:
      case BAR_TOKEN:
      case AMPERSAND_TOKEN:
      case CARET_TOKEN:
        return true;
      default:
        return false;
    }
  }

  static Node skipPartiallyEmittedExpressions(Node node) {
    while (node.getKind() == SyntaxKind.PARTIALLY_EMITTED_EXPRESSION) {
      node = node.getChild(Field.EXPRESSION);
    }
    return node;
  }
}
