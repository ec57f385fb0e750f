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
import java.util.Collections;
import java.util.EnumSet;
import org.jspecify.annotations.Nullable;

/**
 * The kinds of syntax that make up a tree handed to the lowering passes.
 *
 * <p>The set is closed: every {@link Node} carries exactly one of these kinds, and the traversal
 * tables in the rewriter are keyed by it. Tokens (punctuation, keywords, identifiers and literals)
 * never have children.
 */
public enum SyntaxKind {
  // Punctuation and operators
  COMMA_TOKEN(","),
  LESS_THAN_TOKEN("<"),
  GREATER_THAN_TOKEN(">"),
  LESS_THAN_EQUALS_TOKEN("<="),
  GREATER_THAN_EQUALS_TOKEN(">="),
  EQUALS_EQUALS_TOKEN("=="),
  EXCLAMATION_EQUALS_TOKEN("!="),
  EQUALS_EQUALS_EQUALS_TOKEN("==="),
  EXCLAMATION_EQUALS_EQUALS_TOKEN("!=="),
  EQUALS_GREATER_THAN_TOKEN("=>"),
  PLUS_TOKEN("+"),
  MINUS_TOKEN("-"),
  ASTERISK_TOKEN("*"),
  ASTERISK_ASTERISK_TOKEN("**"),
  SLASH_TOKEN("/"),
  PERCENT_TOKEN("%"),
  PLUS_PLUS_TOKEN("++"),
  MINUS_MINUS_TOKEN("--"),
  LESS_THAN_LESS_THAN_TOKEN("<<"),
  GREATER_THAN_GREATER_THAN_TOKEN(">>"),
  GREATER_THAN_GREATER_THAN_GREATER_THAN_TOKEN(">>>"),
  AMPERSAND_TOKEN("&"),
  BAR_TOKEN("|"),
  CARET_TOKEN("^"),
  EXCLAMATION_TOKEN("!"),
  TILDE_TOKEN("~"),
  AMPERSAND_AMPERSAND_TOKEN("&&"),
  BAR_BAR_TOKEN("||"),
  QUESTION_TOKEN("?"),
  COLON_TOKEN(":"),
  DOT_DOT_DOT_TOKEN("..."),
  EQUALS_TOKEN("="),
  PLUS_EQUALS_TOKEN("+="),
  MINUS_EQUALS_TOKEN("-="),
  ASTERISK_EQUALS_TOKEN("*="),
  ASTERISK_ASTERISK_EQUALS_TOKEN("**="),
  SLASH_EQUALS_TOKEN("/="),
  PERCENT_EQUALS_TOKEN("%="),
  LESS_THAN_LESS_THAN_EQUALS_TOKEN("<<="),
  GREATER_THAN_GREATER_THAN_EQUALS_TOKEN(">>="),
  GREATER_THAN_GREATER_THAN_GREATER_THAN_EQUALS_TOKEN(">>>="),
  AMPERSAND_EQUALS_TOKEN("&="),
  BAR_EQUALS_TOKEN("|="),
  CARET_EQUALS_TOKEN("^="),

  // Identifiers and literals
  IDENTIFIER,
  NUMERIC_LITERAL,
  STRING_LITERAL,
  REGULAR_EXPRESSION_LITERAL,
  NO_SUBSTITUTION_TEMPLATE_LITERAL,
  TEMPLATE_HEAD,
  TEMPLATE_MIDDLE,
  TEMPLATE_TAIL,
  JSX_TEXT,

  // Keywords
  EXTENDS_KEYWORD("extends"),
  IMPLEMENTS_KEYWORD("implements"),
  IN_KEYWORD("in"),
  INSTANCEOF_KEYWORD("instanceof"),
  THIS_KEYWORD("this"),
  SUPER_KEYWORD("super"),
  NULL_KEYWORD("null"),
  TRUE_KEYWORD("true"),
  FALSE_KEYWORD("false"),

  // Modifier keywords
  ABSTRACT_KEYWORD("abstract"),
  ASYNC_KEYWORD("async"),
  CONST_KEYWORD("const"),
  DECLARE_KEYWORD("declare"),
  DEFAULT_KEYWORD("default"),
  EXPORT_KEYWORD("export"),
  PUBLIC_KEYWORD("public"),
  PRIVATE_KEYWORD("private"),
  PROTECTED_KEYWORD("protected"),
  READONLY_KEYWORD("readonly"),
  STATIC_KEYWORD("static"),

  // Type keywords
  ANY_KEYWORD("any"),
  BOOLEAN_KEYWORD("boolean"),
  NEVER_KEYWORD("never"),
  NUMBER_KEYWORD("number"),
  STRING_KEYWORD("string"),
  SYMBOL_KEYWORD("symbol"),
  UNDEFINED_KEYWORD("undefined"),
  VOID_KEYWORD("void"),

  // Names
  QUALIFIED_NAME,
  COMPUTED_PROPERTY_NAME,

  // Signature elements
  TYPE_PARAMETER,
  PARAMETER,
  DECORATOR,

  // Type and class members
  PROPERTY_SIGNATURE,
  PROPERTY_DECLARATION,
  METHOD_SIGNATURE,
  METHOD_DECLARATION,
  CONSTRUCTOR,
  GET_ACCESSOR,
  SET_ACCESSOR,
  CALL_SIGNATURE,
  CONSTRUCT_SIGNATURE,
  INDEX_SIGNATURE,

  // Types
  TYPE_PREDICATE,
  TYPE_REFERENCE,
  FUNCTION_TYPE,
  CONSTRUCTOR_TYPE,
  TYPE_QUERY,
  TYPE_LITERAL,
  ARRAY_TYPE,
  TUPLE_TYPE,
  UNION_TYPE,
  INTERSECTION_TYPE,
  PARENTHESIZED_TYPE,
  THIS_TYPE,
  LITERAL_TYPE,

  // Binding patterns
  OBJECT_BINDING_PATTERN,
  ARRAY_BINDING_PATTERN,
  BINDING_ELEMENT,

  // Expressions
  ARRAY_LITERAL_EXPRESSION,
  OBJECT_LITERAL_EXPRESSION,
  PROPERTY_ACCESS_EXPRESSION,
  ELEMENT_ACCESS_EXPRESSION,
  CALL_EXPRESSION,
  NEW_EXPRESSION,
  TAGGED_TEMPLATE_EXPRESSION,
  TYPE_ASSERTION_EXPRESSION,
  PARENTHESIZED_EXPRESSION,
  FUNCTION_EXPRESSION,
  ARROW_FUNCTION,
  DELETE_EXPRESSION,
  TYPE_OF_EXPRESSION,
  VOID_EXPRESSION,
  AWAIT_EXPRESSION,
  PREFIX_UNARY_EXPRESSION,
  POSTFIX_UNARY_EXPRESSION,
  BINARY_EXPRESSION,
  CONDITIONAL_EXPRESSION,
  TEMPLATE_EXPRESSION,
  YIELD_EXPRESSION,
  SPREAD_ELEMENT,
  CLASS_EXPRESSION,
  OMITTED_EXPRESSION,
  EXPRESSION_WITH_TYPE_ARGUMENTS,
  AS_EXPRESSION,
  NON_NULL_EXPRESSION,

  // Misc
  TEMPLATE_SPAN,
  SEMICOLON_CLASS_ELEMENT,

  // Statements
  BLOCK,
  VARIABLE_STATEMENT,
  EMPTY_STATEMENT,
  EXPRESSION_STATEMENT,
  IF_STATEMENT,
  DO_STATEMENT,
  WHILE_STATEMENT,
  FOR_STATEMENT,
  FOR_IN_STATEMENT,
  FOR_OF_STATEMENT,
  CONTINUE_STATEMENT,
  BREAK_STATEMENT,
  RETURN_STATEMENT,
  WITH_STATEMENT,
  SWITCH_STATEMENT,
  LABELED_STATEMENT,
  THROW_STATEMENT,
  TRY_STATEMENT,
  DEBUGGER_STATEMENT,

  // Declarations
  VARIABLE_DECLARATION,
  VARIABLE_DECLARATION_LIST,
  FUNCTION_DECLARATION,
  CLASS_DECLARATION,
  INTERFACE_DECLARATION,
  TYPE_ALIAS_DECLARATION,
  ENUM_DECLARATION,
  MODULE_DECLARATION,
  MODULE_BLOCK,
  CASE_BLOCK,
  IMPORT_EQUALS_DECLARATION,
  IMPORT_DECLARATION,
  IMPORT_CLAUSE,
  NAMESPACE_IMPORT,
  NAMED_IMPORTS,
  IMPORT_SPECIFIER,
  EXPORT_ASSIGNMENT,
  EXPORT_DECLARATION,
  NAMED_EXPORTS,
  EXPORT_SPECIFIER,
  EXTERNAL_MODULE_REFERENCE,

  // JSX
  JSX_ELEMENT,
  JSX_SELF_CLOSING_ELEMENT,
  JSX_OPENING_ELEMENT,
  JSX_CLOSING_ELEMENT,
  JSX_ATTRIBUTE,
  JSX_SPREAD_ATTRIBUTE,
  JSX_EXPRESSION,

  // Clauses
  CASE_CLAUSE,
  DEFAULT_CLAUSE,
  HERITAGE_CLAUSE,
  CATCH_CLAUSE,

  // Object literal members
  PROPERTY_ASSIGNMENT,
  SHORTHAND_PROPERTY_ASSIGNMENT,

  ENUM_MEMBER,

  SOURCE_FILE,

  // Synthesized by transformations; never produced by a parser.
  NOT_EMITTED_STATEMENT,
  PARTIALLY_EMITTED_EXPRESSION;

  private final @Nullable String text;

  SyntaxKind() {
    this.text = null;
  }

  SyntaxKind(String text) {
    this.text = text;
  }

  /** Returns the source text of a punctuation or keyword kind, or null for other kinds. */
  public @Nullable String getText() {
    return text;
  }

  private static final ImmutableSet<SyntaxKind> TOKENS =
      Sets.immutableEnumSet(EnumSet.range(COMMA_TOKEN, VOID_KEYWORD));

  private static final ImmutableSet<SyntaxKind> MODIFIERS =
      Sets.immutableEnumSet(EnumSet.range(ABSTRACT_KEYWORD, STATIC_KEYWORD));

  private static final ImmutableSet<SyntaxKind> ASSIGNMENT_OPERATORS =
      Sets.immutableEnumSet(EnumSet.range(EQUALS_TOKEN, CARET_EQUALS_TOKEN));

  private static final ImmutableSet<SyntaxKind> TYPE_NODES =
      union(
          EnumSet.range(TYPE_PREDICATE, LITERAL_TYPE),
          ANY_KEYWORD,
          BOOLEAN_KEYWORD,
          NEVER_KEYWORD,
          NUMBER_KEYWORD,
          STRING_KEYWORD,
          SYMBOL_KEYWORD,
          UNDEFINED_KEYWORD,
          VOID_KEYWORD);

  private static final ImmutableSet<SyntaxKind> LEFT_HAND_SIDE_EXPRESSIONS =
      Sets.immutableEnumSet(
          IDENTIFIER,
          NUMERIC_LITERAL,
          STRING_LITERAL,
          REGULAR_EXPRESSION_LITERAL,
          NO_SUBSTITUTION_TEMPLATE_LITERAL,
          THIS_KEYWORD,
          SUPER_KEYWORD,
          NULL_KEYWORD,
          TRUE_KEYWORD,
          FALSE_KEYWORD,
          ARRAY_LITERAL_EXPRESSION,
          OBJECT_LITERAL_EXPRESSION,
          PROPERTY_ACCESS_EXPRESSION,
          ELEMENT_ACCESS_EXPRESSION,
          CALL_EXPRESSION,
          NEW_EXPRESSION,
          TAGGED_TEMPLATE_EXPRESSION,
          PARENTHESIZED_EXPRESSION,
          FUNCTION_EXPRESSION,
          TEMPLATE_EXPRESSION,
          CLASS_EXPRESSION,
          NON_NULL_EXPRESSION,
          JSX_ELEMENT,
          JSX_SELF_CLOSING_ELEMENT,
          PARTIALLY_EMITTED_EXPRESSION);

  private static final ImmutableSet<SyntaxKind> UNARY_EXPRESSIONS =
      ImmutableSet.<SyntaxKind>builder()
          .addAll(LEFT_HAND_SIDE_EXPRESSIONS)
          .add(
              PREFIX_UNARY_EXPRESSION,
              POSTFIX_UNARY_EXPRESSION,
              DELETE_EXPRESSION,
              TYPE_OF_EXPRESSION,
              VOID_EXPRESSION,
              AWAIT_EXPRESSION,
              TYPE_ASSERTION_EXPRESSION)
          .build();

  private static final ImmutableSet<SyntaxKind> EXPRESSIONS =
      ImmutableSet.<SyntaxKind>builder()
          .addAll(UNARY_EXPRESSIONS)
          .add(
              CONDITIONAL_EXPRESSION,
              YIELD_EXPRESSION,
              ARROW_FUNCTION,
              BINARY_EXPRESSION,
              SPREAD_ELEMENT,
              AS_EXPRESSION,
              OMITTED_EXPRESSION)
          .build();

  private static final ImmutableSet<SyntaxKind> STATEMENTS =
      union(
          EnumSet.range(BLOCK, DEBUGGER_STATEMENT),
          FUNCTION_DECLARATION,
          CLASS_DECLARATION,
          INTERFACE_DECLARATION,
          TYPE_ALIAS_DECLARATION,
          ENUM_DECLARATION,
          MODULE_DECLARATION,
          IMPORT_EQUALS_DECLARATION,
          IMPORT_DECLARATION,
          EXPORT_ASSIGNMENT,
          EXPORT_DECLARATION,
          NOT_EMITTED_STATEMENT);

  private static final ImmutableSet<SyntaxKind> FUNCTION_LIKE =
      Sets.immutableEnumSet(
          FUNCTION_DECLARATION,
          FUNCTION_EXPRESSION,
          ARROW_FUNCTION,
          METHOD_DECLARATION,
          CONSTRUCTOR,
          GET_ACCESSOR,
          SET_ACCESSOR);

  private static ImmutableSet<SyntaxKind> union(
      EnumSet<SyntaxKind> range, SyntaxKind... others) {
    EnumSet<SyntaxKind> kinds = EnumSet.copyOf(range);
    Collections.addAll(kinds, others);
    return Sets.immutableEnumSet(kinds);
  }

  /** Whether nodes of this kind are leaves: punctuation, identifiers, literals and keywords. */
  public boolean isToken() {
    return TOKENS.contains(this);
  }

  public boolean isModifier() {
    return MODIFIERS.contains(this);
  }

  public boolean isAssignmentOperator() {
    return ASSIGNMENT_OPERATORS.contains(this);
  }

  /** Whether nodes of this kind only ever appear as type annotations. */
  public boolean isTypeNode() {
    return TYPE_NODES.contains(this);
  }

  public boolean isLeftHandSideExpression() {
    return LEFT_HAND_SIDE_EXPRESSIONS.contains(this);
  }

  public boolean isUnaryExpression() {
    return UNARY_EXPRESSIONS.contains(this);
  }

  public boolean isExpression() {
    return EXPRESSIONS.contains(this);
  }

  public boolean isStatement() {
    return STATEMENTS.contains(this);
  }

  /** Whether this kind has parameters and a body. Signatures are not function-like here. */
  public boolean isFunctionLike() {
    return FUNCTION_LIKE.contains(this);
  }
}
