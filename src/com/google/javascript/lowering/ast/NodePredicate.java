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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * The validity tests applied to children replaced during a rewrite.
 *
 * <p>Every test looks at the kind of a node only. The constant's name doubles as the tag used in
 * diagnostics when a replacement fails its test.
 */
public enum NodePredicate implements Predicate<@Nullable Node> {
  ENTITY_NAME(kinds(SyntaxKind.IDENTIFIER, SyntaxKind.QUALIFIED_NAME)),
  IDENTIFIER(kinds(SyntaxKind.IDENTIFIER)),
  EXPRESSION(SyntaxKind::isExpression),
  LEFT_HAND_SIDE_EXPRESSION(SyntaxKind::isLeftHandSideExpression),
  UNARY_EXPRESSION(SyntaxKind::isUnaryExpression),
  DECORATOR(kinds(SyntaxKind.DECORATOR)),
  MODIFIER(SyntaxKind::isModifier),
  BINDING_NAME(
      kinds(
          SyntaxKind.IDENTIFIER,
          SyntaxKind.OBJECT_BINDING_PATTERN,
          SyntaxKind.ARRAY_BINDING_PATTERN)),
  TYPE_NODE(SyntaxKind::isTypeNode),
  PROPERTY_NAME(
      kinds(
          SyntaxKind.IDENTIFIER,
          SyntaxKind.STRING_LITERAL,
          SyntaxKind.NUMERIC_LITERAL,
          SyntaxKind.COMPUTED_PROPERTY_NAME)),
  TYPE_PARAMETER(kinds(SyntaxKind.TYPE_PARAMETER)),
  PARAMETER(kinds(SyntaxKind.PARAMETER)),
  BLOCK(kinds(SyntaxKind.BLOCK)),
  FUNCTION_BODY(kinds(SyntaxKind.BLOCK)),
  CONCISE_BODY(kind -> kind == SyntaxKind.BLOCK || kind.isExpression()),
  BINDING_ELEMENT(kinds(SyntaxKind.BINDING_ELEMENT, SyntaxKind.OMITTED_EXPRESSION)),
  OBJECT_LITERAL_ELEMENT(
      kinds(
          SyntaxKind.PROPERTY_ASSIGNMENT,
          SyntaxKind.SHORTHAND_PROPERTY_ASSIGNMENT,
          SyntaxKind.METHOD_DECLARATION,
          SyntaxKind.GET_ACCESSOR,
          SyntaxKind.SET_ACCESSOR)),
  TEMPLATE(kinds(SyntaxKind.TEMPLATE_EXPRESSION, SyntaxKind.NO_SUBSTITUTION_TEMPLATE_LITERAL)),
  TEMPLATE_LITERAL_FRAGMENT(
      kinds(SyntaxKind.TEMPLATE_HEAD, SyntaxKind.TEMPLATE_MIDDLE, SyntaxKind.TEMPLATE_TAIL)),
  TEMPLATE_SPAN(kinds(SyntaxKind.TEMPLATE_SPAN)),
  HERITAGE_CLAUSE(kinds(SyntaxKind.HERITAGE_CLAUSE)),
  CLASS_ELEMENT(
      kinds(
          SyntaxKind.PROPERTY_DECLARATION,
          SyntaxKind.METHOD_DECLARATION,
          SyntaxKind.CONSTRUCTOR,
          SyntaxKind.GET_ACCESSOR,
          SyntaxKind.SET_ACCESSOR,
          SyntaxKind.INDEX_SIGNATURE,
          SyntaxKind.SEMICOLON_CLASS_ELEMENT)),
  EXPRESSION_WITH_TYPE_ARGUMENTS(kinds(SyntaxKind.EXPRESSION_WITH_TYPE_ARGUMENTS)),
  STATEMENT(SyntaxKind::isStatement),
  VARIABLE_DECLARATION_LIST(kinds(SyntaxKind.VARIABLE_DECLARATION_LIST)),
  VARIABLE_DECLARATION(kinds(SyntaxKind.VARIABLE_DECLARATION)),
  FOR_INITIALIZER(kind -> kind == SyntaxKind.VARIABLE_DECLARATION_LIST || kind.isExpression()),
  CASE_BLOCK(kinds(SyntaxKind.CASE_BLOCK)),
  CATCH_CLAUSE(kinds(SyntaxKind.CATCH_CLAUSE)),
  ENUM_MEMBER(kinds(SyntaxKind.ENUM_MEMBER)),
  MODULE_NAME(kinds(SyntaxKind.IDENTIFIER, SyntaxKind.STRING_LITERAL)),
  MODULE_BODY(
      kinds(SyntaxKind.MODULE_BLOCK, SyntaxKind.MODULE_DECLARATION, SyntaxKind.IDENTIFIER)),
  CASE_OR_DEFAULT_CLAUSE(kinds(SyntaxKind.CASE_CLAUSE, SyntaxKind.DEFAULT_CLAUSE)),
  MODULE_REFERENCE(
      kinds(
          SyntaxKind.IDENTIFIER,
          SyntaxKind.QUALIFIED_NAME,
          SyntaxKind.EXTERNAL_MODULE_REFERENCE)),
  IMPORT_CLAUSE(kinds(SyntaxKind.IMPORT_CLAUSE)),
  NAMED_IMPORT_BINDINGS(kinds(SyntaxKind.NAMESPACE_IMPORT, SyntaxKind.NAMED_IMPORTS)),
  IMPORT_SPECIFIER(kinds(SyntaxKind.IMPORT_SPECIFIER)),
  NAMED_EXPORTS(kinds(SyntaxKind.NAMED_EXPORTS)),
  EXPORT_SPECIFIER(kinds(SyntaxKind.EXPORT_SPECIFIER)),
  JSX_OPENING_ELEMENT(kinds(SyntaxKind.JSX_OPENING_ELEMENT)),
  JSX_CHILD(
      kinds(
          SyntaxKind.JSX_TEXT,
          SyntaxKind.JSX_EXPRESSION,
          SyntaxKind.JSX_ELEMENT,
          SyntaxKind.JSX_SELF_CLOSING_ELEMENT)),
  JSX_CLOSING_ELEMENT(kinds(SyntaxKind.JSX_CLOSING_ELEMENT)),
  JSX_ATTRIBUTE_LIKE(kinds(SyntaxKind.JSX_ATTRIBUTE, SyntaxKind.JSX_SPREAD_ATTRIBUTE)),
  STRING_LITERAL_OR_JSX_EXPRESSION(kinds(SyntaxKind.STRING_LITERAL, SyntaxKind.JSX_EXPRESSION));

  private final Predicate<SyntaxKind> kindTest;

  NodePredicate(Predicate<SyntaxKind> kindTest) {
    this.kindTest = kindTest;
  }

  private static Predicate<SyntaxKind> kinds(SyntaxKind first, SyntaxKind... rest) {
    ImmutableSet<SyntaxKind> kinds = Sets.immutableEnumSet(first, rest);
    return kinds::contains;
  }

  /** Whether a node of {@code kind} passes this test. */
  public boolean matches(SyntaxKind kind) {
    return kindTest.test(kind);
  }

  @Override
  public boolean test(@Nullable Node node) {
    return node != null && kindTest.test(node.getKind());
  }
}
