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

package com.google.javascript.lowering.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * An AST construction helper class.
 *
 * <p>The {@code updateXxx} methods return their first argument when every replacement is
 * identical to the corresponding current child, and otherwise a new node that records the old one
 * as its {@link Node#getOriginal() original} and takes over its source range.
 */
public class IR {

  private IR() {}

  // Tokens and literals

  public static Node identifier(String name) {
    checkArgument(!name.isEmpty());
    Node node = new Node(SyntaxKind.IDENTIFIER);
    node.setString(name);
    return node;
  }

  public static Node numericLiteral(String text) {
    return literal(SyntaxKind.NUMERIC_LITERAL, text);
  }

  public static Node stringLiteral(String text) {
    return literal(SyntaxKind.STRING_LITERAL, text);
  }

  public static Node regularExpressionLiteral(String text) {
    return literal(SyntaxKind.REGULAR_EXPRESSION_LITERAL, text);
  }

  public static Node noSubstitutionTemplateLiteral(String text) {
    return literal(SyntaxKind.NO_SUBSTITUTION_TEMPLATE_LITERAL, text);
  }

  public static Node templateHead(String text) {
    return literal(SyntaxKind.TEMPLATE_HEAD, text);
  }

  public static Node templateMiddle(String text) {
    return literal(SyntaxKind.TEMPLATE_MIDDLE, text);
  }

  public static Node templateTail(String text) {
    return literal(SyntaxKind.TEMPLATE_TAIL, text);
  }

  public static Node jsxText(String text) {
    return literal(SyntaxKind.JSX_TEXT, text);
  }

  private static Node literal(SyntaxKind kind, String text) {
    Node node = new Node(kind);
    node.setString(text);
    return node;
  }

  /** Creates a keyword or punctuation node. */
  public static Node token(SyntaxKind kind) {
    checkArgument(
        kind.isToken() && kind.getText() != null, "Not a keyword or punctuator: %s", kind);
    return new Node(kind);
  }

  public static Node modifier(SyntaxKind kind) {
    checkArgument(kind.isModifier(), "Not a modifier: %s", kind);
    return new Node(kind);
  }

  public static Node thisKeyword() {
    return new Node(SyntaxKind.THIS_KEYWORD);
  }

  public static Node superKeyword() {
    return new Node(SyntaxKind.SUPER_KEYWORD);
  }

  public static Node nullLiteral() {
    return new Node(SyntaxKind.NULL_KEYWORD);
  }

  public static Node trueLiteral() {
    return new Node(SyntaxKind.TRUE_KEYWORD);
  }

  public static Node falseLiteral() {
    return new Node(SyntaxKind.FALSE_KEYWORD);
  }

  // Names

  public static Node qualifiedName(Node left, Node right) {
    check(NodePredicate.ENTITY_NAME, left);
    check(NodePredicate.IDENTIFIER, right);
    Node node = new Node(SyntaxKind.QUALIFIED_NAME);
    node.setField(Field.LEFT, left);
    node.setField(Field.RIGHT, right);
    return node;
  }

  public static Node computedPropertyName(Node expression) {
    check(NodePredicate.EXPRESSION, expression);
    Node node = new Node(SyntaxKind.COMPUTED_PROPERTY_NAME);
    node.setField(Field.EXPRESSION, expression);
    return node;
  }

  // Signature elements

  public static Node typeParameter(Node name, @Nullable Node constraint) {
    check(NodePredicate.IDENTIFIER, name);
    checkOptional(NodePredicate.TYPE_NODE, constraint);
    Node node = new Node(SyntaxKind.TYPE_PARAMETER);
    node.setField(Field.NAME, name);
    node.setField(Field.CONSTRAINT, constraint);
    return node;
  }

  public static Node parameter(
      @Nullable NodeList decorators,
      @Nullable NodeList modifiers,
      boolean dotDotDot,
      Node name,
      boolean question,
      @Nullable Node type,
      @Nullable Node initializer) {
    check(NodePredicate.BINDING_NAME, name);
    checkOptional(NodePredicate.TYPE_NODE, type);
    checkOptional(NodePredicate.EXPRESSION, initializer);
    Node node = new Node(SyntaxKind.PARAMETER);
    node.setField(Field.DECORATORS, decorators);
    node.setField(Field.MODIFIERS, modifiers);
    node.setDotDotDot(dotDotDot);
    node.setField(Field.NAME, name);
    node.setQuestion(question);
    node.setField(Field.TYPE, type);
    node.setField(Field.INITIALIZER, initializer);
    return node;
  }

  public static Node parameter(Node name) {
    return parameter(null, null, false, name, false, null, null);
  }

  public static Node parameter(String name) {
    return parameter(identifier(name));
  }

  public static Node decorator(Node expression) {
    check(NodePredicate.LEFT_HAND_SIDE_EXPRESSION, expression);
    Node node = new Node(SyntaxKind.DECORATOR);
    node.setField(Field.EXPRESSION, expression);
    return node;
  }

  // Class and type members

  public static Node propertySignature(
      @Nullable NodeList modifiers, Node name, boolean question, @Nullable Node type) {
    check(NodePredicate.PROPERTY_NAME, name);
    checkOptional(NodePredicate.TYPE_NODE, type);
    Node node = new Node(SyntaxKind.PROPERTY_SIGNATURE);
    node.setField(Field.MODIFIERS, modifiers);
    node.setField(Field.NAME, name);
    node.setQuestion(question);
    node.setField(Field.TYPE, type);
    return node;
  }

  public static Node propertyDeclaration(
      @Nullable NodeList decorators,
      @Nullable NodeList modifiers,
      Node name,
      @Nullable Node type,
      @Nullable Node initializer) {
    check(NodePredicate.PROPERTY_NAME, name);
    checkOptional(NodePredicate.TYPE_NODE, type);
    checkOptional(NodePredicate.EXPRESSION, initializer);
    Node node = new Node(SyntaxKind.PROPERTY_DECLARATION);
    node.setField(Field.DECORATORS, decorators);
    node.setField(Field.MODIFIERS, modifiers);
    node.setField(Field.NAME, name);
    node.setField(Field.TYPE, type);
    node.setField(Field.INITIALIZER, initializer);
    return node;
  }

  public static Node method(
      @Nullable NodeList decorators,
      @Nullable NodeList modifiers,
      boolean asterisk,
      Node name,
      @Nullable NodeList typeParameters,
      NodeList parameters,
      @Nullable Node type,
      @Nullable Node body) {
    check(NodePredicate.PROPERTY_NAME, name);
    Node node = functionLike(SyntaxKind.METHOD_DECLARATION, decorators, modifiers, name);
    node.setAsterisk(asterisk);
    setSignature(node, typeParameters, parameters, type, body);
    return node;
  }

  public static Node constructor(
      @Nullable NodeList decorators,
      @Nullable NodeList modifiers,
      NodeList parameters,
      @Nullable Node body) {
    Node node = functionLike(SyntaxKind.CONSTRUCTOR, decorators, modifiers, null);
    setSignature(node, null, parameters, null, body);
    return node;
  }

  public static Node getAccessor(
      @Nullable NodeList decorators,
      @Nullable NodeList modifiers,
      Node name,
      NodeList parameters,
      @Nullable Node type,
      @Nullable Node body) {
    check(NodePredicate.PROPERTY_NAME, name);
    Node node = functionLike(SyntaxKind.GET_ACCESSOR, decorators, modifiers, name);
    setSignature(node, null, parameters, type, body);
    return node;
  }

  public static Node setAccessor(
      @Nullable NodeList decorators,
      @Nullable NodeList modifiers,
      Node name,
      NodeList parameters,
      @Nullable Node body) {
    check(NodePredicate.PROPERTY_NAME, name);
    Node node = functionLike(SyntaxKind.SET_ACCESSOR, decorators, modifiers, name);
    setSignature(node, null, parameters, null, body);
    return node;
  }

  public static Node semicolonClassElement() {
    return new Node(SyntaxKind.SEMICOLON_CLASS_ELEMENT);
  }

  private static Node functionLike(
      SyntaxKind kind,
      @Nullable NodeList decorators,
      @Nullable NodeList modifiers,
      @Nullable Node name) {
    Node node = new Node(kind);
    node.setField(Field.DECORATORS, decorators);
    node.setField(Field.MODIFIERS, modifiers);
    node.setField(Field.NAME, name);
    return node;
  }

  private static void setSignature(
      Node node,
      @Nullable NodeList typeParameters,
      NodeList parameters,
      @Nullable Node type,
      @Nullable Node body) {
    checkNotNull(parameters);
    checkOptional(NodePredicate.TYPE_NODE, type);
    checkOptional(
        node.isArrowFunction() ? NodePredicate.CONCISE_BODY : NodePredicate.FUNCTION_BODY, body);
    node.setField(Field.TYPE_PARAMETERS, typeParameters);
    node.setField(Field.PARAMETERS, parameters);
    node.setField(Field.TYPE, type);
    node.setField(Field.BODY, body);
  }

  // Types

  public static Node typeReference(Node typeName, @Nullable NodeList typeArguments) {
    check(NodePredicate.ENTITY_NAME, typeName);
    Node node = new Node(SyntaxKind.TYPE_REFERENCE);
    node.setField(Field.NAME, typeName);
    node.setField(Field.TYPE_ARGUMENTS, typeArguments);
    return node;
  }

  /** Creates a type keyword such as {@code number} or {@code string}. */
  public static Node keywordType(SyntaxKind kind) {
    checkArgument(kind.isToken() && kind.isTypeNode(), "Not a type keyword: %s", kind);
    return new Node(kind);
  }

  public static Node arrayType(Node elementType) {
    check(NodePredicate.TYPE_NODE, elementType);
    Node node = new Node(SyntaxKind.ARRAY_TYPE);
    node.setField(Field.TYPE, elementType);
    return node;
  }

  public static Node unionType(Node... types) {
    for (Node type : types) {
      check(NodePredicate.TYPE_NODE, type);
    }
    Node node = new Node(SyntaxKind.UNION_TYPE);
    node.setField(Field.TYPES, NodeList.of(types));
    return node;
  }

  public static Node typeLiteral(NodeList members) {
    Node node = new Node(SyntaxKind.TYPE_LITERAL);
    node.setField(Field.MEMBERS, members);
    return node;
  }

  public static Node literalType(Node literal) {
    checkArgument(literal.getKind().isToken(), literal);
    Node node = new Node(SyntaxKind.LITERAL_TYPE);
    node.setField(Field.LITERAL, literal);
    return node;
  }

  public static Node thisType() {
    return new Node(SyntaxKind.THIS_TYPE);
  }

  // Binding patterns

  public static Node objectBindingPattern(NodeList elements) {
    return bindingPattern(SyntaxKind.OBJECT_BINDING_PATTERN, elements);
  }

  public static Node arrayBindingPattern(NodeList elements) {
    return bindingPattern(SyntaxKind.ARRAY_BINDING_PATTERN, elements);
  }

  private static Node bindingPattern(SyntaxKind kind, NodeList elements) {
    checkAll(NodePredicate.BINDING_ELEMENT, elements);
    Node node = new Node(kind);
    node.setField(Field.ELEMENTS, elements);
    return node;
  }

  public static Node bindingElement(
      @Nullable Node propertyName, boolean dotDotDot, Node name, @Nullable Node initializer) {
    checkOptional(NodePredicate.PROPERTY_NAME, propertyName);
    check(NodePredicate.BINDING_NAME, name);
    checkOptional(NodePredicate.EXPRESSION, initializer);
    Node node = new Node(SyntaxKind.BINDING_ELEMENT);
    node.setField(Field.PROPERTY_NAME, propertyName);
    node.setDotDotDot(dotDotDot);
    node.setField(Field.NAME, name);
    node.setField(Field.INITIALIZER, initializer);
    return node;
  }

  // Expressions

  public static Node arrayLiteral(NodeList elements, boolean multiLine) {
    checkAll(NodePredicate.EXPRESSION, elements);
    Node node = new Node(SyntaxKind.ARRAY_LITERAL_EXPRESSION);
    node.setField(Field.ELEMENTS, elements);
    node.setMultiLine(multiLine);
    return node;
  }

  public static Node arrayLiteral(Node... elements) {
    return arrayLiteral(NodeList.of(elements), false);
  }

  public static Node objectLiteral(NodeList properties, boolean multiLine) {
    checkAll(NodePredicate.OBJECT_LITERAL_ELEMENT, properties);
    Node node = new Node(SyntaxKind.OBJECT_LITERAL_EXPRESSION);
    node.setField(Field.PROPERTIES, properties);
    node.setMultiLine(multiLine);
    return node;
  }

  public static Node objectLiteral(Node... properties) {
    return objectLiteral(NodeList.of(properties), false);
  }

  public static Node propertyAccess(Node expression, Node name) {
    check(NodePredicate.LEFT_HAND_SIDE_EXPRESSION, expression);
    check(NodePredicate.IDENTIFIER, name);
    Node node = new Node(SyntaxKind.PROPERTY_ACCESS_EXPRESSION);
    node.setField(Field.EXPRESSION, expression);
    node.setField(Field.NAME, name);
    return node;
  }

  public static Node propertyAccess(Node expression, String name) {
    return propertyAccess(expression, identifier(name));
  }

  public static Node elementAccess(Node expression, Node argumentExpression) {
    check(NodePredicate.LEFT_HAND_SIDE_EXPRESSION, expression);
    check(NodePredicate.EXPRESSION, argumentExpression);
    Node node = new Node(SyntaxKind.ELEMENT_ACCESS_EXPRESSION);
    node.setField(Field.EXPRESSION, expression);
    node.setField(Field.ARGUMENT_EXPRESSION, argumentExpression);
    return node;
  }

  public static Node call(Node expression, @Nullable NodeList typeArguments, NodeList arguments) {
    return callOrNew(SyntaxKind.CALL_EXPRESSION, expression, typeArguments, arguments);
  }

  public static Node call(Node callee, Node... arguments) {
    return call(callee, null, NodeList.of(arguments));
  }

  public static Node newExpression(
      Node expression, @Nullable NodeList typeArguments, @Nullable NodeList arguments) {
    return callOrNew(SyntaxKind.NEW_EXPRESSION, expression, typeArguments, arguments);
  }

  private static Node callOrNew(
      SyntaxKind kind,
      Node expression,
      @Nullable NodeList typeArguments,
      @Nullable NodeList arguments) {
    check(NodePredicate.LEFT_HAND_SIDE_EXPRESSION, expression);
    if (arguments != null) {
      checkAll(NodePredicate.EXPRESSION, arguments);
    }
    Node node = new Node(kind);
    node.setField(Field.EXPRESSION, expression);
    node.setField(Field.TYPE_ARGUMENTS, typeArguments);
    node.setField(Field.ARGUMENTS, arguments);
    return node;
  }

  public static Node taggedTemplate(Node tag, Node template) {
    check(NodePredicate.LEFT_HAND_SIDE_EXPRESSION, tag);
    check(NodePredicate.TEMPLATE, template);
    Node node = new Node(SyntaxKind.TAGGED_TEMPLATE_EXPRESSION);
    node.setField(Field.TAG, tag);
    node.setField(Field.TEMPLATE, template);
    return node;
  }

  public static Node typeAssertion(Node type, Node expression) {
    check(NodePredicate.TYPE_NODE, type);
    check(NodePredicate.UNARY_EXPRESSION, expression);
    Node node = new Node(SyntaxKind.TYPE_ASSERTION_EXPRESSION);
    node.setField(Field.TYPE, type);
    node.setField(Field.EXPRESSION, expression);
    return node;
  }

  public static Node paren(Node expression) {
    check(NodePredicate.EXPRESSION, expression);
    Node node = new Node(SyntaxKind.PARENTHESIZED_EXPRESSION);
    node.setField(Field.EXPRESSION, expression);
    return node;
  }

  public static Node functionExpression(
      @Nullable NodeList modifiers,
      boolean asterisk,
      @Nullable Node name,
      @Nullable NodeList typeParameters,
      NodeList parameters,
      @Nullable Node type,
      Node body) {
    checkOptional(NodePredicate.IDENTIFIER, name);
    Node node = functionLike(SyntaxKind.FUNCTION_EXPRESSION, null, modifiers, name);
    node.setAsterisk(asterisk);
    setSignature(node, typeParameters, parameters, type, checkNotNull(body));
    return node;
  }

  public static Node functionExpression(NodeList parameters, Node body) {
    return functionExpression(null, false, null, null, parameters, null, body);
  }

  public static Node arrowFunction(
      @Nullable NodeList modifiers,
      @Nullable NodeList typeParameters,
      NodeList parameters,
      @Nullable Node type,
      Node body) {
    Node node = functionLike(SyntaxKind.ARROW_FUNCTION, null, modifiers, null);
    setSignature(node, typeParameters, parameters, type, checkNotNull(body));
    return node;
  }

  public static Node arrowFunction(NodeList parameters, Node body) {
    return arrowFunction(null, null, parameters, null, body);
  }

  public static Node deleteExpression(Node expression) {
    return unaryKeyword(SyntaxKind.DELETE_EXPRESSION, expression);
  }

  public static Node typeOf(Node expression) {
    return unaryKeyword(SyntaxKind.TYPE_OF_EXPRESSION, expression);
  }

  public static Node voidExpression(Node expression) {
    return unaryKeyword(SyntaxKind.VOID_EXPRESSION, expression);
  }

  public static Node await(Node expression) {
    return unaryKeyword(SyntaxKind.AWAIT_EXPRESSION, expression);
  }

  /** Creates {@code void 0}. */
  public static Node voidZero() {
    return voidExpression(numericLiteral("0"));
  }

  private static Node unaryKeyword(SyntaxKind kind, Node expression) {
    check(NodePredicate.UNARY_EXPRESSION, expression);
    Node node = new Node(kind);
    node.setField(Field.EXPRESSION, expression);
    return node;
  }

  public static Node prefix(SyntaxKind operator, Node operand) {
    checkArgument(isPrefixOperator(operator), "Not a prefix operator: %s", operator);
    check(NodePredicate.UNARY_EXPRESSION, operand);
    Node node = new Node(SyntaxKind.PREFIX_UNARY_EXPRESSION);
    node.setOperator(operator);
    node.setField(Field.OPERAND, operand);
    return node;
  }

  public static Node postfix(Node operand, SyntaxKind operator) {
    checkArgument(
        operator == SyntaxKind.PLUS_PLUS_TOKEN || operator == SyntaxKind.MINUS_MINUS_TOKEN,
        "Not a postfix operator: %s",
        operator);
    check(NodePredicate.LEFT_HAND_SIDE_EXPRESSION, operand);
    Node node = new Node(SyntaxKind.POSTFIX_UNARY_EXPRESSION);
    node.setField(Field.OPERAND, operand);
    node.setOperator(operator);
    return node;
  }

  private static boolean isPrefixOperator(SyntaxKind operator) {
    switch (operator) {
      case PLUS_TOKEN:
      case MINUS_TOKEN:
      case PLUS_PLUS_TOKEN:
      case MINUS_MINUS_TOKEN:
      case EXCLAMATION_TOKEN:
      case TILDE_TOKEN:
        return true;
      default:
        return false;
    }
  }

  public static Node binary(Node left, SyntaxKind operator, Node right) {
    checkArgument(operator.isToken() && operator.getText() != null, operator);
    check(NodePredicate.EXPRESSION, left);
    check(NodePredicate.EXPRESSION, right);
    Node node = new Node(SyntaxKind.BINARY_EXPRESSION);
    node.setField(Field.LEFT, left);
    node.setOperator(operator);
    node.setField(Field.RIGHT, right);
    return node;
  }

  public static Node assignment(Node left, Node right) {
    return binary(left, SyntaxKind.EQUALS_TOKEN, right);
  }

  public static Node comma(Node left, Node right) {
    return binary(left, SyntaxKind.COMMA_TOKEN, right);
  }

  public static Node conditional(Node condition, Node whenTrue, Node whenFalse) {
    check(NodePredicate.EXPRESSION, condition);
    check(NodePredicate.EXPRESSION, whenTrue);
    check(NodePredicate.EXPRESSION, whenFalse);
    Node node = new Node(SyntaxKind.CONDITIONAL_EXPRESSION);
    node.setField(Field.CONDITION, condition);
    node.setField(Field.WHEN_TRUE, whenTrue);
    node.setField(Field.WHEN_FALSE, whenFalse);
    return node;
  }

  public static Node templateExpression(Node head, NodeList templateSpans) {
    check(NodePredicate.TEMPLATE_LITERAL_FRAGMENT, head);
    checkAll(NodePredicate.TEMPLATE_SPAN, templateSpans);
    Node node = new Node(SyntaxKind.TEMPLATE_EXPRESSION);
    node.setField(Field.HEAD, head);
    node.setField(Field.TEMPLATE_SPANS, templateSpans);
    return node;
  }

  public static Node templateSpan(Node expression, Node literal) {
    check(NodePredicate.EXPRESSION, expression);
    check(NodePredicate.TEMPLATE_LITERAL_FRAGMENT, literal);
    Node node = new Node(SyntaxKind.TEMPLATE_SPAN);
    node.setField(Field.EXPRESSION, expression);
    node.setField(Field.LITERAL, literal);
    return node;
  }

  public static Node yield(boolean asterisk, @Nullable Node expression) {
    checkOptional(NodePredicate.EXPRESSION, expression);
    Node node = new Node(SyntaxKind.YIELD_EXPRESSION);
    node.setAsterisk(asterisk);
    node.setField(Field.EXPRESSION, expression);
    return node;
  }

  public static Node spread(Node expression) {
    check(NodePredicate.EXPRESSION, expression);
    Node node = new Node(SyntaxKind.SPREAD_ELEMENT);
    node.setField(Field.EXPRESSION, expression);
    return node;
  }

  public static Node classExpression(
      @Nullable NodeList modifiers,
      @Nullable Node name,
      @Nullable NodeList typeParameters,
      @Nullable NodeList heritageClauses,
      NodeList members) {
    return classLike(
        SyntaxKind.CLASS_EXPRESSION,
        null,
        modifiers,
        name,
        typeParameters,
        heritageClauses,
        members);
  }

  private static Node classLike(
      SyntaxKind kind,
      @Nullable NodeList decorators,
      @Nullable NodeList modifiers,
      @Nullable Node name,
      @Nullable NodeList typeParameters,
      @Nullable NodeList heritageClauses,
      NodeList members) {
    checkOptional(NodePredicate.IDENTIFIER, name);
    checkAll(NodePredicate.CLASS_ELEMENT, members);
    Node node = new Node(kind);
    node.setField(Field.DECORATORS, decorators);
    node.setField(Field.MODIFIERS, modifiers);
    node.setField(Field.NAME, name);
    node.setField(Field.TYPE_PARAMETERS, typeParameters);
    node.setField(Field.HERITAGE_CLAUSES, heritageClauses);
    node.setField(Field.MEMBERS, members);
    return node;
  }

  public static Node omittedExpression() {
    return new Node(SyntaxKind.OMITTED_EXPRESSION);
  }

  public static Node expressionWithTypeArguments(
      @Nullable NodeList typeArguments, Node expression) {
    check(NodePredicate.LEFT_HAND_SIDE_EXPRESSION, expression);
    Node node = new Node(SyntaxKind.EXPRESSION_WITH_TYPE_ARGUMENTS);
    node.setField(Field.TYPE_ARGUMENTS, typeArguments);
    node.setField(Field.EXPRESSION, expression);
    return node;
  }

  public static Node as(Node expression, Node type) {
    check(NodePredicate.EXPRESSION, expression);
    check(NodePredicate.TYPE_NODE, type);
    Node node = new Node(SyntaxKind.AS_EXPRESSION);
    node.setField(Field.EXPRESSION, expression);
    node.setField(Field.TYPE, type);
    return node;
  }

  public static Node nonNull(Node expression) {
    check(NodePredicate.LEFT_HAND_SIDE_EXPRESSION, expression);
    Node node = new Node(SyntaxKind.NON_NULL_EXPRESSION);
    node.setField(Field.EXPRESSION, expression);
    return node;
  }

  // Statements

  public static Node block(NodeList statements, boolean multiLine) {
    checkAll(NodePredicate.STATEMENT, statements);
    Node node = new Node(SyntaxKind.BLOCK);
    node.setField(Field.STATEMENTS, statements);
    node.setMultiLine(multiLine);
    return node;
  }

  public static Node block(Node... statements) {
    return block(NodeList.of(statements), false);
  }

  public static Node variableStatement(@Nullable NodeList modifiers, Node declarationList) {
    check(NodePredicate.VARIABLE_DECLARATION_LIST, declarationList);
    Node node = new Node(SyntaxKind.VARIABLE_STATEMENT);
    node.setField(Field.MODIFIERS, modifiers);
    node.setField(Field.DECLARATION_LIST, declarationList);
    return node;
  }

  /** Creates {@code var name = initializer;}, or {@code var name;} if there is no initializer. */
  public static Node var(String name, @Nullable Node initializer) {
    return variableStatement(
        null,
        variableDeclarationList(
            NodeList.of(variableDeclaration(identifier(name), null, initializer)),
            NodeFlags.NONE));
  }

  public static Node emptyStatement() {
    return new Node(SyntaxKind.EMPTY_STATEMENT);
  }

  public static Node expressionStatement(Node expression) {
    check(NodePredicate.EXPRESSION, expression);
    Node node = new Node(SyntaxKind.EXPRESSION_STATEMENT);
    node.setField(Field.EXPRESSION, expression);
    return node;
  }

  public static Node ifStatement(
      Node expression, Node thenStatement, @Nullable Node elseStatement) {
    check(NodePredicate.EXPRESSION, expression);
    check(NodePredicate.STATEMENT, thenStatement);
    checkOptional(NodePredicate.STATEMENT, elseStatement);
    Node node = new Node(SyntaxKind.IF_STATEMENT);
    node.setField(Field.EXPRESSION, expression);
    node.setField(Field.THEN_STATEMENT, thenStatement);
    node.setField(Field.ELSE_STATEMENT, elseStatement);
    return node;
  }

  public static Node doStatement(Node statement, Node expression) {
    check(NodePredicate.STATEMENT, statement);
    check(NodePredicate.EXPRESSION, expression);
    Node node = new Node(SyntaxKind.DO_STATEMENT);
    node.setField(Field.STATEMENT, statement);
    node.setField(Field.EXPRESSION, expression);
    return node;
  }

  public static Node whileStatement(Node expression, Node statement) {
    check(NodePredicate.EXPRESSION, expression);
    check(NodePredicate.STATEMENT, statement);
    Node node = new Node(SyntaxKind.WHILE_STATEMENT);
    node.setField(Field.EXPRESSION, expression);
    node.setField(Field.STATEMENT, statement);
    return node;
  }

  public static Node forStatement(
      @Nullable Node initializer,
      @Nullable Node condition,
      @Nullable Node incrementor,
      Node statement) {
    checkOptional(NodePredicate.FOR_INITIALIZER, initializer);
    checkOptional(NodePredicate.EXPRESSION, condition);
    checkOptional(NodePredicate.EXPRESSION, incrementor);
    check(NodePredicate.STATEMENT, statement);
    Node node = new Node(SyntaxKind.FOR_STATEMENT);
    node.setField(Field.INITIALIZER, initializer);
    node.setField(Field.CONDITION, condition);
    node.setField(Field.INCREMENTOR, incrementor);
    node.setField(Field.STATEMENT, statement);
    return node;
  }

  public static Node forIn(Node initializer, Node expression, Node statement) {
    return forInOrOf(SyntaxKind.FOR_IN_STATEMENT, initializer, expression, statement);
  }

  public static Node forOf(Node initializer, Node expression, Node statement) {
    return forInOrOf(SyntaxKind.FOR_OF_STATEMENT, initializer, expression, statement);
  }

  private static Node forInOrOf(
      SyntaxKind kind, Node initializer, Node expression, Node statement) {
    check(NodePredicate.FOR_INITIALIZER, initializer);
    check(NodePredicate.EXPRESSION, expression);
    check(NodePredicate.STATEMENT, statement);
    Node node = new Node(kind);
    node.setField(Field.INITIALIZER, initializer);
    node.setField(Field.EXPRESSION, expression);
    node.setField(Field.STATEMENT, statement);
    return node;
  }

  public static Node continueStatement(@Nullable Node label) {
    return jump(SyntaxKind.CONTINUE_STATEMENT, label);
  }

  public static Node breakStatement(@Nullable Node label) {
    return jump(SyntaxKind.BREAK_STATEMENT, label);
  }

  private static Node jump(SyntaxKind kind, @Nullable Node label) {
    checkOptional(NodePredicate.IDENTIFIER, label);
    Node node = new Node(kind);
    node.setField(Field.LABEL, label);
    return node;
  }

  public static Node returnStatement(@Nullable Node expression) {
    checkOptional(NodePredicate.EXPRESSION, expression);
    Node node = new Node(SyntaxKind.RETURN_STATEMENT);
    node.setField(Field.EXPRESSION, expression);
    return node;
  }

  public static Node returnStatement() {
    return returnStatement(null);
  }

  public static Node withStatement(Node expression, Node statement) {
    check(NodePredicate.EXPRESSION, expression);
    check(NodePredicate.STATEMENT, statement);
    Node node = new Node(SyntaxKind.WITH_STATEMENT);
    node.setField(Field.EXPRESSION, expression);
    node.setField(Field.STATEMENT, statement);
    return node;
  }

  public static Node switchStatement(Node expression, Node caseBlock) {
    check(NodePredicate.EXPRESSION, expression);
    check(NodePredicate.CASE_BLOCK, caseBlock);
    Node node = new Node(SyntaxKind.SWITCH_STATEMENT);
    node.setField(Field.EXPRESSION, expression);
    node.setField(Field.CASE_BLOCK, caseBlock);
    return node;
  }

  public static Node labeled(Node label, Node statement) {
    check(NodePredicate.IDENTIFIER, label);
    check(NodePredicate.STATEMENT, statement);
    Node node = new Node(SyntaxKind.LABELED_STATEMENT);
    node.setField(Field.LABEL, label);
    node.setField(Field.STATEMENT, statement);
    return node;
  }

  public static Node throwStatement(Node expression) {
    check(NodePredicate.EXPRESSION, expression);
    Node node = new Node(SyntaxKind.THROW_STATEMENT);
    node.setField(Field.EXPRESSION, expression);
    return node;
  }

  public static Node tryStatement(
      Node tryBlock, @Nullable Node catchClause, @Nullable Node finallyBlock) {
    check(NodePredicate.BLOCK, tryBlock);
    checkOptional(NodePredicate.CATCH_CLAUSE, catchClause);
    checkOptional(NodePredicate.BLOCK, finallyBlock);
    checkArgument(catchClause != null || finallyBlock != null, "try without catch or finally");
    Node node = new Node(SyntaxKind.TRY_STATEMENT);
    node.setField(Field.TRY_BLOCK, tryBlock);
    node.setField(Field.CATCH_CLAUSE, catchClause);
    node.setField(Field.FINALLY_BLOCK, finallyBlock);
    return node;
  }

  public static Node debuggerStatement() {
    return new Node(SyntaxKind.DEBUGGER_STATEMENT);
  }

  // Declarations

  public static Node variableDeclaration(
      Node name, @Nullable Node type, @Nullable Node initializer) {
    check(NodePredicate.BINDING_NAME, name);
    checkOptional(NodePredicate.TYPE_NODE, type);
    checkOptional(NodePredicate.EXPRESSION, initializer);
    Node node = new Node(SyntaxKind.VARIABLE_DECLARATION);
    node.setField(Field.NAME, name);
    node.setField(Field.TYPE, type);
    node.setField(Field.INITIALIZER, initializer);
    return node;
  }

  public static Node variableDeclaration(String name, @Nullable Node initializer) {
    return variableDeclaration(identifier(name), null, initializer);
  }

  /**
   * @param flags {@link NodeFlags#LET}, {@link NodeFlags#CONST} or {@link NodeFlags#NONE} for var
   */
  public static Node variableDeclarationList(NodeList declarations, int flags) {
    checkAll(NodePredicate.VARIABLE_DECLARATION, declarations);
    Node node = new Node(SyntaxKind.VARIABLE_DECLARATION_LIST);
    node.setField(Field.DECLARATIONS, declarations);
    node.setNodeFlags(flags);
    return node;
  }

  public static Node functionDeclaration(
      @Nullable NodeList decorators,
      @Nullable NodeList modifiers,
      boolean asterisk,
      @Nullable Node name,
      @Nullable NodeList typeParameters,
      NodeList parameters,
      @Nullable Node type,
      @Nullable Node body) {
    checkOptional(NodePredicate.IDENTIFIER, name);
    Node node = functionLike(SyntaxKind.FUNCTION_DECLARATION, decorators, modifiers, name);
    node.setAsterisk(asterisk);
    setSignature(node, typeParameters, parameters, type, body);
    return node;
  }

  public static Node functionDeclaration(String name, NodeList parameters, Node body) {
    return functionDeclaration(null, null, false, identifier(name), null, parameters, null, body);
  }

  public static Node classDeclaration(
      @Nullable NodeList decorators,
      @Nullable NodeList modifiers,
      @Nullable Node name,
      @Nullable NodeList typeParameters,
      @Nullable NodeList heritageClauses,
      NodeList members) {
    return classLike(
        SyntaxKind.CLASS_DECLARATION,
        decorators,
        modifiers,
        name,
        typeParameters,
        heritageClauses,
        members);
  }

  public static Node interfaceDeclaration(
      @Nullable NodeList modifiers,
      Node name,
      @Nullable NodeList typeParameters,
      @Nullable NodeList heritageClauses,
      NodeList members) {
    check(NodePredicate.IDENTIFIER, name);
    Node node = new Node(SyntaxKind.INTERFACE_DECLARATION);
    node.setField(Field.MODIFIERS, modifiers);
    node.setField(Field.NAME, name);
    node.setField(Field.TYPE_PARAMETERS, typeParameters);
    node.setField(Field.HERITAGE_CLAUSES, heritageClauses);
    node.setField(Field.MEMBERS, members);
    return node;
  }

  public static Node typeAliasDeclaration(
      @Nullable NodeList modifiers, Node name, @Nullable NodeList typeParameters, Node type) {
    check(NodePredicate.IDENTIFIER, name);
    check(NodePredicate.TYPE_NODE, type);
    Node node = new Node(SyntaxKind.TYPE_ALIAS_DECLARATION);
    node.setField(Field.MODIFIERS, modifiers);
    node.setField(Field.NAME, name);
    node.setField(Field.TYPE_PARAMETERS, typeParameters);
    node.setField(Field.TYPE, type);
    return node;
  }

  public static Node enumDeclaration(@Nullable NodeList modifiers, Node name, NodeList members) {
    check(NodePredicate.IDENTIFIER, name);
    checkAll(NodePredicate.ENUM_MEMBER, members);
    Node node = new Node(SyntaxKind.ENUM_DECLARATION);
    node.setField(Field.MODIFIERS, modifiers);
    node.setField(Field.NAME, name);
    node.setField(Field.MEMBERS, members);
    return node;
  }

  public static Node enumMember(Node name, @Nullable Node initializer) {
    check(NodePredicate.PROPERTY_NAME, name);
    checkOptional(NodePredicate.EXPRESSION, initializer);
    Node node = new Node(SyntaxKind.ENUM_MEMBER);
    node.setField(Field.NAME, name);
    node.setField(Field.INITIALIZER, initializer);
    return node;
  }

  public static Node moduleDeclaration(@Nullable NodeList modifiers, Node name, Node body) {
    check(NodePredicate.MODULE_NAME, name);
    check(NodePredicate.MODULE_BODY, body);
    Node node = new Node(SyntaxKind.MODULE_DECLARATION);
    node.setField(Field.MODIFIERS, modifiers);
    node.setField(Field.NAME, name);
    node.setField(Field.BODY, body);
    return node;
  }

  public static Node moduleBlock(NodeList statements) {
    checkAll(NodePredicate.STATEMENT, statements);
    Node node = new Node(SyntaxKind.MODULE_BLOCK);
    node.setField(Field.STATEMENTS, statements);
    return node;
  }

  public static Node moduleBlock(Node... statements) {
    return moduleBlock(NodeList.of(statements));
  }

  public static Node caseBlock(NodeList clauses) {
    checkAll(NodePredicate.CASE_OR_DEFAULT_CLAUSE, clauses);
    Node node = new Node(SyntaxKind.CASE_BLOCK);
    node.setField(Field.CLAUSES, clauses);
    return node;
  }

  public static Node caseClause(Node expression, NodeList statements) {
    check(NodePredicate.EXPRESSION, expression);
    checkAll(NodePredicate.STATEMENT, statements);
    Node node = new Node(SyntaxKind.CASE_CLAUSE);
    node.setField(Field.EXPRESSION, expression);
    node.setField(Field.STATEMENTS, statements);
    return node;
  }

  public static Node defaultClause(NodeList statements) {
    checkAll(NodePredicate.STATEMENT, statements);
    Node node = new Node(SyntaxKind.DEFAULT_CLAUSE);
    node.setField(Field.STATEMENTS, statements);
    return node;
  }

  public static Node heritageClause(SyntaxKind token, NodeList types) {
    checkAll(NodePredicate.EXPRESSION_WITH_TYPE_ARGUMENTS, types);
    Node node = new Node(SyntaxKind.HERITAGE_CLAUSE);
    node.setHeritageToken(token);
    node.setField(Field.TYPES, types);
    return node;
  }

  public static Node catchClause(Node variableDeclaration, Node block) {
    check(NodePredicate.VARIABLE_DECLARATION, variableDeclaration);
    check(NodePredicate.BLOCK, block);
    Node node = new Node(SyntaxKind.CATCH_CLAUSE);
    node.setField(Field.VARIABLE_DECLARATION, variableDeclaration);
    node.setField(Field.BLOCK, block);
    return node;
  }

  public static Node propertyAssignment(Node name, Node initializer) {
    check(NodePredicate.PROPERTY_NAME, name);
    check(NodePredicate.EXPRESSION, initializer);
    Node node = new Node(SyntaxKind.PROPERTY_ASSIGNMENT);
    node.setField(Field.NAME, name);
    node.setField(Field.INITIALIZER, initializer);
    return node;
  }

  public static Node shorthandPropertyAssignment(
      Node name, @Nullable Node objectAssignmentInitializer) {
    check(NodePredicate.IDENTIFIER, name);
    checkOptional(NodePredicate.EXPRESSION, objectAssignmentInitializer);
    Node node = new Node(SyntaxKind.SHORTHAND_PROPERTY_ASSIGNMENT);
    node.setField(Field.NAME, name);
    node.setField(Field.OBJECT_ASSIGNMENT_INITIALIZER, objectAssignmentInitializer);
    return node;
  }

  // Modules

  public static Node importEquals(@Nullable NodeList modifiers, Node name, Node moduleReference) {
    check(NodePredicate.IDENTIFIER, name);
    check(NodePredicate.MODULE_REFERENCE, moduleReference);
    Node node = new Node(SyntaxKind.IMPORT_EQUALS_DECLARATION);
    node.setField(Field.MODIFIERS, modifiers);
    node.setField(Field.NAME, name);
    node.setField(Field.MODULE_REFERENCE, moduleReference);
    return node;
  }

  public static Node externalModuleReference(@Nullable Node expression) {
    checkOptional(NodePredicate.EXPRESSION, expression);
    Node node = new Node(SyntaxKind.EXTERNAL_MODULE_REFERENCE);
    node.setField(Field.EXPRESSION, expression);
    return node;
  }

  public static Node importDeclaration(@Nullable Node importClause, Node moduleSpecifier) {
    checkOptional(NodePredicate.IMPORT_CLAUSE, importClause);
    check(NodePredicate.EXPRESSION, moduleSpecifier);
    Node node = new Node(SyntaxKind.IMPORT_DECLARATION);
    node.setField(Field.IMPORT_CLAUSE, importClause);
    node.setField(Field.MODULE_SPECIFIER, moduleSpecifier);
    return node;
  }

  public static Node importClause(@Nullable Node name, @Nullable Node namedBindings) {
    checkOptional(NodePredicate.IDENTIFIER, name);
    checkOptional(NodePredicate.NAMED_IMPORT_BINDINGS, namedBindings);
    Node node = new Node(SyntaxKind.IMPORT_CLAUSE);
    node.setField(Field.NAME, name);
    node.setField(Field.NAMED_BINDINGS, namedBindings);
    return node;
  }

  public static Node namespaceImport(Node name) {
    check(NodePredicate.IDENTIFIER, name);
    Node node = new Node(SyntaxKind.NAMESPACE_IMPORT);
    node.setField(Field.NAME, name);
    return node;
  }

  public static Node namedImports(NodeList elements) {
    checkAll(NodePredicate.IMPORT_SPECIFIER, elements);
    Node node = new Node(SyntaxKind.NAMED_IMPORTS);
    node.setField(Field.ELEMENTS, elements);
    return node;
  }

  public static Node importSpecifier(@Nullable Node propertyName, Node name) {
    return specifier(SyntaxKind.IMPORT_SPECIFIER, propertyName, name);
  }

  public static Node exportAssignment(Node expression) {
    check(NodePredicate.EXPRESSION, expression);
    Node node = new Node(SyntaxKind.EXPORT_ASSIGNMENT);
    node.setField(Field.EXPRESSION, expression);
    return node;
  }

  public static Node exportDeclaration(
      @Nullable Node exportClause, @Nullable Node moduleSpecifier) {
    checkOptional(NodePredicate.NAMED_EXPORTS, exportClause);
    checkOptional(NodePredicate.EXPRESSION, moduleSpecifier);
    Node node = new Node(SyntaxKind.EXPORT_DECLARATION);
    node.setField(Field.EXPORT_CLAUSE, exportClause);
    node.setField(Field.MODULE_SPECIFIER, moduleSpecifier);
    return node;
  }

  public static Node namedExports(NodeList elements) {
    checkAll(NodePredicate.EXPORT_SPECIFIER, elements);
    Node node = new Node(SyntaxKind.NAMED_EXPORTS);
    node.setField(Field.ELEMENTS, elements);
    return node;
  }

  public static Node exportSpecifier(@Nullable Node propertyName, Node name) {
    return specifier(SyntaxKind.EXPORT_SPECIFIER, propertyName, name);
  }

  private static Node specifier(SyntaxKind kind, @Nullable Node propertyName, Node name) {
    checkOptional(NodePredicate.IDENTIFIER, propertyName);
    check(NodePredicate.IDENTIFIER, name);
    Node node = new Node(kind);
    node.setField(Field.PROPERTY_NAME, propertyName);
    node.setField(Field.NAME, name);
    return node;
  }

  // JSX

  public static Node jsxElement(Node openingElement, NodeList children, Node closingElement) {
    check(NodePredicate.JSX_OPENING_ELEMENT, openingElement);
    checkAll(NodePredicate.JSX_CHILD, children);
    check(NodePredicate.JSX_CLOSING_ELEMENT, closingElement);
    Node node = new Node(SyntaxKind.JSX_ELEMENT);
    node.setField(Field.OPENING_ELEMENT, openingElement);
    node.setField(Field.CHILDREN, children);
    node.setField(Field.CLOSING_ELEMENT, closingElement);
    return node;
  }

  public static Node jsxSelfClosingElement(Node tagName, NodeList attributes) {
    return jsxTag(SyntaxKind.JSX_SELF_CLOSING_ELEMENT, tagName, attributes);
  }

  public static Node jsxOpeningElement(Node tagName, NodeList attributes) {
    return jsxTag(SyntaxKind.JSX_OPENING_ELEMENT, tagName, attributes);
  }

  private static Node jsxTag(SyntaxKind kind, Node tagName, NodeList attributes) {
    check(NodePredicate.ENTITY_NAME, tagName);
    checkAll(NodePredicate.JSX_ATTRIBUTE_LIKE, attributes);
    Node node = new Node(kind);
    node.setField(Field.TAG_NAME, tagName);
    node.setField(Field.ATTRIBUTES, attributes);
    return node;
  }

  public static Node jsxClosingElement(Node tagName) {
    check(NodePredicate.ENTITY_NAME, tagName);
    Node node = new Node(SyntaxKind.JSX_CLOSING_ELEMENT);
    node.setField(Field.TAG_NAME, tagName);
    return node;
  }

  public static Node jsxAttribute(Node name, @Nullable Node initializer) {
    check(NodePredicate.IDENTIFIER, name);
    checkOptional(NodePredicate.STRING_LITERAL_OR_JSX_EXPRESSION, initializer);
    Node node = new Node(SyntaxKind.JSX_ATTRIBUTE);
    node.setField(Field.NAME, name);
    node.setField(Field.INITIALIZER, initializer);
    return node;
  }

  public static Node jsxSpreadAttribute(Node expression) {
    check(NodePredicate.EXPRESSION, expression);
    Node node = new Node(SyntaxKind.JSX_SPREAD_ATTRIBUTE);
    node.setField(Field.EXPRESSION, expression);
    return node;
  }

  public static Node jsxExpression(@Nullable Node expression) {
    checkOptional(NodePredicate.EXPRESSION, expression);
    Node node = new Node(SyntaxKind.JSX_EXPRESSION);
    node.setField(Field.EXPRESSION, expression);
    return node;
  }

  // Top level and synthesized nodes

  public static Node sourceFile(String fileName, NodeList statements) {
    checkAll(NodePredicate.STATEMENT, statements);
    Node node = new Node(SyntaxKind.SOURCE_FILE);
    node.setFileName(fileName);
    node.setField(Field.STATEMENTS, statements);
    return node;
  }

  public static Node sourceFile(String fileName, Node... statements) {
    return sourceFile(fileName, NodeList.of(statements));
  }

  /** Creates a placeholder for a statement that was removed, keeping its position. */
  public static Node notEmittedStatement(Node original) {
    Node node = new Node(SyntaxKind.NOT_EMITTED_STATEMENT);
    updateNode(node, original);
    return node;
  }

  public static Node partiallyEmittedExpression(Node expression, @Nullable Node original) {
    check(NodePredicate.EXPRESSION, expression);
    Node node = new Node(SyntaxKind.PARTIALLY_EMITTED_EXPRESSION);
    node.setField(Field.EXPRESSION, expression);
    if (original != null) {
      updateNode(node, original);
    }
    return node;
  }

  // Cloning and updating

  /**
   * Returns a shallow copy of {@code node} that may be edited freely. The copy shares its children
   * with {@code node}, has no cached transform flags and records {@code node} as its original.
   */
  public static Node getMutableClone(Node node) {
    Node clone = node.shallowCopy();
    clone.setOriginal(node);
    return clone;
  }

  /**
   * Records {@code original} as the node {@code updated} was derived from, and carries over its
   * position and line-break hint.
   */
  public static Node updateNode(Node updated, Node original) {
    if (updated != original) {
      updated.setOriginal(original);
      updated.setSourceRange(original);
      if (original.startsOnNewLine()) {
        updated.setStartsOnNewLine(true);
      }
    }
    return updated;
  }

  public static Node updateParameter(
      Node node,
      @Nullable NodeList decorators,
      @Nullable NodeList modifiers,
      Node name,
      @Nullable Node type,
      @Nullable Node initializer) {
    if (node.getDecorators() == decorators
        && node.getModifiers() == modifiers
        && node.getName() == name
        && node.getType() == type
        && node.getInitializer() == initializer) {
      return node;
    }
    return updateNode(
        parameter(
            decorators,
            modifiers,
            node.hasDotDotDot(),
            name,
            node.hasQuestion(),
            type,
            initializer),
        node);
  }

  public static Node updateMethod(
      Node node,
      @Nullable NodeList decorators,
      @Nullable NodeList modifiers,
      Node name,
      @Nullable NodeList typeParameters,
      NodeList parameters,
      @Nullable Node type,
      @Nullable Node body) {
    if (node.getDecorators() == decorators
        && node.getModifiers() == modifiers
        && node.getName() == name
        && node.getTypeParameters() == typeParameters
        && node.getParameters() == parameters
        && node.getType() == type
        && node.getBody() == body) {
      return node;
    }
    Node updated =
        method(
            decorators,
            modifiers,
            node.hasAsterisk(),
            name,
            typeParameters,
            parameters,
            type,
            body);
    updated.setQuestion(node.hasQuestion());
    return updateNode(updated, node);
  }

  public static Node updateConstructor(
      Node node,
      @Nullable NodeList decorators,
      @Nullable NodeList modifiers,
      NodeList parameters,
      @Nullable Node body) {
    if (node.getDecorators() == decorators
        && node.getModifiers() == modifiers
        && node.getParameters() == parameters
        && node.getBody() == body) {
      return node;
    }
    return updateNode(constructor(decorators, modifiers, parameters, body), node);
  }

  public static Node updateGetAccessor(
      Node node,
      @Nullable NodeList decorators,
      @Nullable NodeList modifiers,
      Node name,
      NodeList parameters,
      @Nullable Node type,
      @Nullable Node body) {
    if (node.getDecorators() == decorators
        && node.getModifiers() == modifiers
        && node.getName() == name
        && node.getParameters() == parameters
        && node.getType() == type
        && node.getBody() == body) {
      return node;
    }
    return updateNode(getAccessor(decorators, modifiers, name, parameters, type, body), node);
  }

  public static Node updateSetAccessor(
      Node node,
      @Nullable NodeList decorators,
      @Nullable NodeList modifiers,
      Node name,
      NodeList parameters,
      @Nullable Node body) {
    if (node.getDecorators() == decorators
        && node.getModifiers() == modifiers
        && node.getName() == name
        && node.getParameters() == parameters
        && node.getBody() == body) {
      return node;
    }
    return updateNode(setAccessor(decorators, modifiers, name, parameters, body), node);
  }

  public static Node updatePropertyAccess(Node node, Node expression, Node name) {
    if (node.getExpression() == expression && node.getName() == name) {
      return node;
    }
    return updateNode(propertyAccess(expression, name), node);
  }

  public static Node updateCall(
      Node node, Node expression, @Nullable NodeList typeArguments, NodeList arguments) {
    if (node.getExpression() == expression
        && node.getTypeArguments() == typeArguments
        && node.getArguments() == arguments) {
      return node;
    }
    return updateNode(call(expression, typeArguments, arguments), node);
  }

  public static Node updateNew(
      Node node,
      Node expression,
      @Nullable NodeList typeArguments,
      @Nullable NodeList arguments) {
    if (node.getExpression() == expression
        && node.getTypeArguments() == typeArguments
        && node.getArguments() == arguments) {
      return node;
    }
    return updateNode(newExpression(expression, typeArguments, arguments), node);
  }

  public static Node updateBinary(Node node, Node left, Node right) {
    if (node.getLeft() == left && node.getRight() == right) {
      return node;
    }
    return updateNode(binary(left, node.getOperator(), right), node);
  }

  public static Node updateFunctionExpression(
      Node node,
      @Nullable NodeList modifiers,
      @Nullable Node name,
      @Nullable NodeList typeParameters,
      NodeList parameters,
      @Nullable Node type,
      Node body) {
    if (node.getModifiers() == modifiers
        && node.getName() == name
        && node.getTypeParameters() == typeParameters
        && node.getParameters() == parameters
        && node.getType() == type
        && node.getBody() == body) {
      return node;
    }
    return updateNode(
        functionExpression(
            modifiers, node.hasAsterisk(), name, typeParameters, parameters, type, body),
        node);
  }

  public static Node updateArrowFunction(
      Node node,
      @Nullable NodeList modifiers,
      @Nullable NodeList typeParameters,
      NodeList parameters,
      @Nullable Node type,
      Node body) {
    if (node.getModifiers() == modifiers
        && node.getTypeParameters() == typeParameters
        && node.getParameters() == parameters
        && node.getType() == type
        && node.getBody() == body) {
      return node;
    }
    return updateNode(arrowFunction(modifiers, typeParameters, parameters, type, body), node);
  }

  public static Node updateBlock(Node node, NodeList statements) {
    if (node.getStatements() == statements) {
      return node;
    }
    return updateNode(block(statements, node.isMultiLine()), node);
  }

  public static Node updateVariableStatement(
      Node node, @Nullable NodeList modifiers, Node declarationList) {
    if (node.getModifiers() == modifiers && node.getDeclarationList() == declarationList) {
      return node;
    }
    Node updated = variableStatement(modifiers, declarationList);
    updated.setField(Field.DECORATORS, node.getDecorators());
    return updateNode(updated, node);
  }

  public static Node updateExpressionStatement(Node node, Node expression) {
    if (node.getExpression() == expression) {
      return node;
    }
    return updateNode(expressionStatement(expression), node);
  }

  public static Node updateVariableDeclarationList(Node node, NodeList declarations) {
    if (node.getDeclarations() == declarations) {
      return node;
    }
    return updateNode(variableDeclarationList(declarations, node.getNodeFlags()), node);
  }

  public static Node updateVariableDeclaration(
      Node node, Node name, @Nullable Node type, @Nullable Node initializer) {
    if (node.getName() == name && node.getType() == type && node.getInitializer() == initializer) {
      return node;
    }
    return updateNode(variableDeclaration(name, type, initializer), node);
  }

  public static Node updateIf(
      Node node, Node expression, Node thenStatement, @Nullable Node elseStatement) {
    if (node.getExpression() == expression
        && node.getThenStatement() == thenStatement
        && node.getElseStatement() == elseStatement) {
      return node;
    }
    return updateNode(ifStatement(expression, thenStatement, elseStatement), node);
  }

  public static Node updateReturn(Node node, @Nullable Node expression) {
    if (node.getExpression() == expression) {
      return node;
    }
    return updateNode(returnStatement(expression), node);
  }

  public static Node updateFunctionDeclaration(
      Node node,
      @Nullable NodeList decorators,
      @Nullable NodeList modifiers,
      @Nullable Node name,
      @Nullable NodeList typeParameters,
      NodeList parameters,
      @Nullable Node type,
      @Nullable Node body) {
    if (node.getDecorators() == decorators
        && node.getModifiers() == modifiers
        && node.getName() == name
        && node.getTypeParameters() == typeParameters
        && node.getParameters() == parameters
        && node.getType() == type
        && node.getBody() == body) {
      return node;
    }
    return updateNode(
        functionDeclaration(
            decorators,
            modifiers,
            node.hasAsterisk(),
            name,
            typeParameters,
            parameters,
            type,
            body),
        node);
  }

  public static Node updateSourceFile(Node node, NodeList statements) {
    if (node.getStatements() == statements) {
      return node;
    }
    Node updated = getMutableClone(node);
    updated.setField(Field.STATEMENTS, statements);
    return updateNode(updated, node);
  }

  // Checks

  private static void check(Predicate<Node> test, Node node) {
    checkState(test.test(node), "Unexpected node %s (expected %s)", node, test);
  }

  private static void checkOptional(Predicate<Node> test, @Nullable Node node) {
    if (node != null) {
      check(test, node);
    }
  }

  private static void checkAll(Predicate<Node> test, NodeList nodes) {
    for (Node node : nodes) {
      check(test, node);
    }
  }
}
