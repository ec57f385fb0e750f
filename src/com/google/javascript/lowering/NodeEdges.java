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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.javascript.lowering.NodeEdge.LiftFunction;
import com.google.javascript.lowering.NodeEdge.ParenthesizeFunction;
import com.google.javascript.lowering.ast.Field;
import com.google.javascript.lowering.ast.NodePredicate;
import com.google.javascript.lowering.ast.SyntaxKind;
import java.util.EnumMap;

/**
 * The traversal schema: for each node kind, the fields {@link TreeRewriter#visitEachChild} visits,
 * in the order it visits them.
 *
 * <p>The schema only covers what matters to rewriting. Type annotations are visited as opaque
 * children of the declarations that carry them, but kinds that only occur inside types have no
 * entry, and neither do tokens. Fields missing from an entry are never visited even if they hold
 * nodes.
 */
public final class NodeEdges {

  private static final LiftFunction LIFT_TO_BLOCK = TreeRewriter::liftToBlock;

  private static final ParenthesizeFunction FOR_ACCESS =
      (value, parent) -> Parenthesizer.parenthesizeForAccess(value);
  private static final ParenthesizeFunction FOR_NEW =
      (value, parent) -> Parenthesizer.parenthesizeForNew(value);
  private static final ParenthesizeFunction FOR_LIST =
      (value, parent) -> Parenthesizer.parenthesizeExpressionForList(value);
  private static final ParenthesizeFunction PREFIX_OPERAND =
      (value, parent) -> Parenthesizer.parenthesizePrefixOperand(value);
  private static final ParenthesizeFunction POSTFIX_OPERAND =
      (value, parent) -> Parenthesizer.parenthesizePostfixOperand(value);
  private static final ParenthesizeFunction LEFT_OPERAND =
      (value, parent) -> Parenthesizer.parenthesizeBinaryOperand(parent.getOperator(), value, true);
  private static final ParenthesizeFunction RIGHT_OPERAND =
      (value, parent) ->
          Parenthesizer.parenthesizeBinaryOperand(parent.getOperator(), value, false);
  private static final ParenthesizeFunction FOR_EXPRESSION_STATEMENT =
      (value, parent) -> Parenthesizer.parenthesizeExpressionForExpressionStatement(value);
  private static final ParenthesizeFunction CONCISE_BODY =
      (value, parent) -> Parenthesizer.parenthesizeConciseBody(value);

  private static final NodeEdge DECORATORS = edge(Field.DECORATORS, NodePredicate.DECORATOR);
  private static final NodeEdge MODIFIERS = edge(Field.MODIFIERS, NodePredicate.MODIFIER);
  private static final NodeEdge OPTIONAL_TYPE = optional(Field.TYPE, NodePredicate.TYPE_NODE);
  private static final NodeEdge TYPE_PARAMETERS =
      edge(Field.TYPE_PARAMETERS, NodePredicate.TYPE_PARAMETER);
  private static final NodeEdge PARAMETERS = edge(Field.PARAMETERS, NodePredicate.PARAMETER);
  private static final NodeEdge TYPE_ARGUMENTS =
      edge(Field.TYPE_ARGUMENTS, NodePredicate.TYPE_NODE);
  private static final NodeEdge OPTIONAL_BODY = optional(Field.BODY, NodePredicate.BLOCK);
  private static final NodeEdge STATEMENTS = edge(Field.STATEMENTS, NodePredicate.STATEMENT);
  private static final NodeEdge EXPRESSION = edge(Field.EXPRESSION, NodePredicate.EXPRESSION);
  private static final NodeEdge OPTIONAL_EXPRESSION =
      optional(Field.EXPRESSION, NodePredicate.EXPRESSION);
  private static final NodeEdge IDENTIFIER_NAME = edge(Field.NAME, NodePredicate.IDENTIFIER);
  private static final NodeEdge OPTIONAL_IDENTIFIER_NAME =
      optional(Field.NAME, NodePredicate.IDENTIFIER);
  private static final NodeEdge PROPERTY_NAME = edge(Field.NAME, NodePredicate.PROPERTY_NAME);
  private static final NodeEdge EMBEDDED_STATEMENT =
      NodeEdge.builder(Field.STATEMENT, NodePredicate.STATEMENT).setLift(LIFT_TO_BLOCK).build();
  private static final NodeEdge LIST_INITIALIZER =
      NodeEdge.builder(Field.INITIALIZER, NodePredicate.EXPRESSION)
          .setOptional(true)
          .setParenthesize(FOR_LIST)
          .build();
  private static final NodeEdge ACCESSED_EXPRESSION =
      NodeEdge.builder(Field.EXPRESSION, NodePredicate.LEFT_HAND_SIDE_EXPRESSION)
          .setParenthesize(FOR_ACCESS)
          .build();
  private static final NodeEdge PREFIX_OPERAND_EXPRESSION =
      NodeEdge.builder(Field.EXPRESSION, NodePredicate.UNARY_EXPRESSION)
          .setParenthesize(PREFIX_OPERAND)
          .build();
  private static final NodeEdge LIST_ARGUMENTS =
      NodeEdge.builder(Field.ARGUMENTS, NodePredicate.EXPRESSION)
          .setParenthesize(FOR_LIST)
          .build();

  private static final ImmutableList<NodeEdge> FUNCTION_LIKE =
      ImmutableList.of(
          DECORATORS,
          MODIFIERS,
          PROPERTY_NAME,
          TYPE_PARAMETERS,
          PARAMETERS,
          OPTIONAL_TYPE,
          OPTIONAL_BODY);

  private static final ImmutableList<NodeEdge> NAMED_FUNCTION =
      ImmutableList.of(
          DECORATORS,
          MODIFIERS,
          OPTIONAL_IDENTIFIER_NAME,
          TYPE_PARAMETERS,
          PARAMETERS,
          OPTIONAL_TYPE,
          OPTIONAL_BODY);

  private static final ImmutableList<NodeEdge> CLASS_LIKE =
      ImmutableList.of(
          DECORATORS,
          MODIFIERS,
          OPTIONAL_IDENTIFIER_NAME,
          TYPE_PARAMETERS,
          edge(Field.HERITAGE_CLAUSES, NodePredicate.HERITAGE_CLAUSE),
          edge(Field.MEMBERS, NodePredicate.CLASS_ELEMENT));

  private static final ImmutableList<NodeEdge> FOR_IN_OR_OF =
      ImmutableList.of(
          edge(Field.INITIALIZER, NodePredicate.FOR_INITIALIZER), EXPRESSION, EMBEDDED_STATEMENT);

  private static final ImmutableList<NodeEdge> SPECIFIER =
      ImmutableList.of(optional(Field.PROPERTY_NAME, NodePredicate.IDENTIFIER), IDENTIFIER_NAME);

  private static final ImmutableList<NodeEdge> JSX_TAG =
      ImmutableList.of(
          edge(Field.TAG_NAME, NodePredicate.ENTITY_NAME),
          edge(Field.ATTRIBUTES, NodePredicate.JSX_ATTRIBUTE_LIKE));

  private static final ImmutableMap<SyntaxKind, ImmutableList<NodeEdge>> SCHEMA = buildSchema();

  private NodeEdges() {}

  private static NodeEdge edge(Field field, NodePredicate test) {
    return NodeEdge.builder(field, test).build();
  }

  private static NodeEdge optional(Field field, NodePredicate test) {
    return NodeEdge.builder(field, test).setOptional(true).build();
  }

  private static ImmutableMap<SyntaxKind, ImmutableList<NodeEdge>> buildSchema() {
    EnumMap<SyntaxKind, ImmutableList<NodeEdge>> map = new EnumMap<>(SyntaxKind.class);

    // Names
    map.put(
        SyntaxKind.QUALIFIED_NAME,
        ImmutableList.of(
            edge(Field.LEFT, NodePredicate.ENTITY_NAME),
            edge(Field.RIGHT, NodePredicate.IDENTIFIER)));
    map.put(SyntaxKind.COMPUTED_PROPERTY_NAME, ImmutableList.of(EXPRESSION));

    // Signature elements
    map.put(
        SyntaxKind.PARAMETER,
        ImmutableList.of(
            DECORATORS,
            MODIFIERS,
            edge(Field.NAME, NodePredicate.BINDING_NAME),
            OPTIONAL_TYPE,
            LIST_INITIALIZER));
    map.put(
        SyntaxKind.DECORATOR,
        ImmutableList.of(edge(Field.EXPRESSION, NodePredicate.LEFT_HAND_SIDE_EXPRESSION)));

    // Class members
    map.put(
        SyntaxKind.PROPERTY_DECLARATION,
        ImmutableList.of(
            DECORATORS,
            MODIFIERS,
            PROPERTY_NAME,
            OPTIONAL_TYPE,
            optional(Field.INITIALIZER, NodePredicate.EXPRESSION)));
    map.put(SyntaxKind.METHOD_DECLARATION, FUNCTION_LIKE);
    map.put(
        SyntaxKind.CONSTRUCTOR,
        ImmutableList.of(
            DECORATORS, MODIFIERS, TYPE_PARAMETERS, PARAMETERS, OPTIONAL_TYPE, OPTIONAL_BODY));
    map.put(SyntaxKind.GET_ACCESSOR, FUNCTION_LIKE);
    map.put(SyntaxKind.SET_ACCESSOR, FUNCTION_LIKE);

    // Binding patterns
    map.put(
        SyntaxKind.OBJECT_BINDING_PATTERN,
        ImmutableList.of(edge(Field.ELEMENTS, NodePredicate.BINDING_ELEMENT)));
    map.put(
        SyntaxKind.ARRAY_BINDING_PATTERN,
        ImmutableList.of(edge(Field.ELEMENTS, NodePredicate.BINDING_ELEMENT)));
    map.put(
        SyntaxKind.BINDING_ELEMENT,
        ImmutableList.of(
            optional(Field.PROPERTY_NAME, NodePredicate.PROPERTY_NAME),
            edge(Field.NAME, NodePredicate.BINDING_NAME),
            LIST_INITIALIZER));

    // Expressions
    map.put(
        SyntaxKind.ARRAY_LITERAL_EXPRESSION,
        ImmutableList.of(
            NodeEdge.builder(Field.ELEMENTS, NodePredicate.EXPRESSION)
                .setParenthesize(FOR_LIST)
                .build()));
    map.put(
        SyntaxKind.OBJECT_LITERAL_EXPRESSION,
        ImmutableList.of(edge(Field.PROPERTIES, NodePredicate.OBJECT_LITERAL_ELEMENT)));
    map.put(
        SyntaxKind.PROPERTY_ACCESS_EXPRESSION,
        ImmutableList.of(ACCESSED_EXPRESSION, IDENTIFIER_NAME));
    map.put(
        SyntaxKind.ELEMENT_ACCESS_EXPRESSION,
        ImmutableList.of(
            ACCESSED_EXPRESSION, edge(Field.ARGUMENT_EXPRESSION, NodePredicate.EXPRESSION)));
    map.put(
        SyntaxKind.CALL_EXPRESSION,
        ImmutableList.of(ACCESSED_EXPRESSION, TYPE_ARGUMENTS, LIST_ARGUMENTS));
    map.put(
        SyntaxKind.NEW_EXPRESSION,
        ImmutableList.of(
            NodeEdge.builder(Field.EXPRESSION, NodePredicate.LEFT_HAND_SIDE_EXPRESSION)
                .setParenthesize(FOR_NEW)
                .build(),
            TYPE_ARGUMENTS,
            LIST_ARGUMENTS));
    map.put(
        SyntaxKind.TAGGED_TEMPLATE_EXPRESSION,
        ImmutableList.of(
            NodeEdge.builder(Field.TAG, NodePredicate.LEFT_HAND_SIDE_EXPRESSION)
                .setParenthesize(FOR_ACCESS)
                .build(),
            edge(Field.TEMPLATE, NodePredicate.TEMPLATE)));
    map.put(
        SyntaxKind.TYPE_ASSERTION_EXPRESSION,
        ImmutableList.of(
            edge(Field.TYPE, NodePredicate.TYPE_NODE),
            edge(Field.EXPRESSION, NodePredicate.UNARY_EXPRESSION)));
    map.put(SyntaxKind.PARENTHESIZED_EXPRESSION, ImmutableList.of(EXPRESSION));
    map.put(SyntaxKind.FUNCTION_EXPRESSION, NAMED_FUNCTION);
    map.put(
        SyntaxKind.ARROW_FUNCTION,
        ImmutableList.of(
            DECORATORS,
            MODIFIERS,
            TYPE_PARAMETERS,
            PARAMETERS,
            OPTIONAL_TYPE,
            NodeEdge.builder(Field.BODY, NodePredicate.CONCISE_BODY)
                .setLift(LIFT_TO_BLOCK)
                .setParenthesize(CONCISE_BODY)
                .build()));
    map.put(SyntaxKind.DELETE_EXPRESSION, ImmutableList.of(PREFIX_OPERAND_EXPRESSION));
    map.put(SyntaxKind.TYPE_OF_EXPRESSION, ImmutableList.of(PREFIX_OPERAND_EXPRESSION));
    map.put(SyntaxKind.VOID_EXPRESSION, ImmutableList.of(PREFIX_OPERAND_EXPRESSION));
    map.put(SyntaxKind.AWAIT_EXPRESSION, ImmutableList.of(PREFIX_OPERAND_EXPRESSION));
    map.put(
        SyntaxKind.PREFIX_UNARY_EXPRESSION,
        ImmutableList.of(
            NodeEdge.builder(Field.OPERAND, NodePredicate.UNARY_EXPRESSION)
                .setParenthesize(PREFIX_OPERAND)
                .build()));
    map.put(
        SyntaxKind.POSTFIX_UNARY_EXPRESSION,
        ImmutableList.of(
            NodeEdge.builder(Field.OPERAND, NodePredicate.LEFT_HAND_SIDE_EXPRESSION)
                .setParenthesize(POSTFIX_OPERAND)
                .build()));
    map.put(
        SyntaxKind.BINARY_EXPRESSION,
        ImmutableList.of(
            NodeEdge.builder(Field.LEFT, NodePredicate.EXPRESSION)
                .setParenthesize(LEFT_OPERAND)
                .build(),
            NodeEdge.builder(Field.RIGHT, NodePredicate.EXPRESSION)
                .setParenthesize(RIGHT_OPERAND)
                .build()));
    map.put(
        SyntaxKind.CONDITIONAL_EXPRESSION,
        ImmutableList.of(
            edge(Field.CONDITION, NodePredicate.EXPRESSION),
            edge(Field.WHEN_TRUE, NodePredicate.EXPRESSION),
            edge(Field.WHEN_FALSE, NodePredicate.EXPRESSION)));
    map.put(
        SyntaxKind.TEMPLATE_EXPRESSION,
        ImmutableList.of(
            edge(Field.HEAD, NodePredicate.TEMPLATE_LITERAL_FRAGMENT),
            edge(Field.TEMPLATE_SPANS, NodePredicate.TEMPLATE_SPAN)));
    map.put(SyntaxKind.YIELD_EXPRESSION, ImmutableList.of(OPTIONAL_EXPRESSION));
    map.put(
        SyntaxKind.SPREAD_ELEMENT,
        ImmutableList.of(
            NodeEdge.builder(Field.EXPRESSION, NodePredicate.EXPRESSION)
                .setParenthesize(FOR_LIST)
                .build()));
    map.put(SyntaxKind.CLASS_EXPRESSION, CLASS_LIKE);
    map.put(
        SyntaxKind.EXPRESSION_WITH_TYPE_ARGUMENTS,
        ImmutableList.of(ACCESSED_EXPRESSION, TYPE_ARGUMENTS));
    map.put(
        SyntaxKind.AS_EXPRESSION,
        ImmutableList.of(EXPRESSION, edge(Field.TYPE, NodePredicate.TYPE_NODE)));
    map.put(
        SyntaxKind.NON_NULL_EXPRESSION,
        ImmutableList.of(edge(Field.EXPRESSION, NodePredicate.LEFT_HAND_SIDE_EXPRESSION)));

    // Misc
    map.put(
        SyntaxKind.TEMPLATE_SPAN,
        ImmutableList.of(EXPRESSION, edge(Field.LITERAL, NodePredicate.TEMPLATE_LITERAL_FRAGMENT)));

    // Statements
    map.put(SyntaxKind.BLOCK, ImmutableList.of(STATEMENTS));
    map.put(
        SyntaxKind.VARIABLE_STATEMENT,
        ImmutableList.of(
            DECORATORS,
            MODIFIERS,
            edge(Field.DECLARATION_LIST, NodePredicate.VARIABLE_DECLARATION_LIST)));
    map.put(
        SyntaxKind.EXPRESSION_STATEMENT,
        ImmutableList.of(
            NodeEdge.builder(Field.EXPRESSION, NodePredicate.EXPRESSION)
                .setParenthesize(FOR_EXPRESSION_STATEMENT)
                .build()));
    map.put(
        SyntaxKind.IF_STATEMENT,
        ImmutableList.of(
            EXPRESSION,
            NodeEdge.builder(Field.THEN_STATEMENT, NodePredicate.STATEMENT)
                .setLift(LIFT_TO_BLOCK)
                .build(),
            NodeEdge.builder(Field.ELSE_STATEMENT, NodePredicate.STATEMENT)
                .setLift(LIFT_TO_BLOCK)
                .setOptional(true)
                .build()));
    map.put(SyntaxKind.DO_STATEMENT, ImmutableList.of(EMBEDDED_STATEMENT, EXPRESSION));
    map.put(SyntaxKind.WHILE_STATEMENT, ImmutableList.of(EXPRESSION, EMBEDDED_STATEMENT));
    map.put(
        SyntaxKind.FOR_STATEMENT,
        ImmutableList.of(
            optional(Field.INITIALIZER, NodePredicate.FOR_INITIALIZER),
            optional(Field.CONDITION, NodePredicate.EXPRESSION),
            optional(Field.INCREMENTOR, NodePredicate.EXPRESSION),
            EMBEDDED_STATEMENT));
    map.put(SyntaxKind.FOR_IN_STATEMENT, FOR_IN_OR_OF);
    map.put(SyntaxKind.FOR_OF_STATEMENT, FOR_IN_OR_OF);
    map.put(
        SyntaxKind.CONTINUE_STATEMENT,
        ImmutableList.of(optional(Field.LABEL, NodePredicate.IDENTIFIER)));
    map.put(
        SyntaxKind.BREAK_STATEMENT,
        ImmutableList.of(optional(Field.LABEL, NodePredicate.IDENTIFIER)));
    map.put(SyntaxKind.RETURN_STATEMENT, ImmutableList.of(OPTIONAL_EXPRESSION));
    map.put(SyntaxKind.WITH_STATEMENT, ImmutableList.of(EXPRESSION, EMBEDDED_STATEMENT));
    map.put(
        SyntaxKind.SWITCH_STATEMENT,
        ImmutableList.of(EXPRESSION, edge(Field.CASE_BLOCK, NodePredicate.CASE_BLOCK)));
    map.put(
        SyntaxKind.LABELED_STATEMENT,
        ImmutableList.of(edge(Field.LABEL, NodePredicate.IDENTIFIER), EMBEDDED_STATEMENT));
    map.put(SyntaxKind.THROW_STATEMENT, ImmutableList.of(EXPRESSION));
    map.put(
        SyntaxKind.TRY_STATEMENT,
        ImmutableList.of(
            edge(Field.TRY_BLOCK, NodePredicate.BLOCK),
            optional(Field.CATCH_CLAUSE, NodePredicate.CATCH_CLAUSE),
            optional(Field.FINALLY_BLOCK, NodePredicate.BLOCK)));

    // Declarations
    map.put(
        SyntaxKind.VARIABLE_DECLARATION,
        ImmutableList.of(
            edge(Field.NAME, NodePredicate.BINDING_NAME), OPTIONAL_TYPE, LIST_INITIALIZER));
    map.put(
        SyntaxKind.VARIABLE_DECLARATION_LIST,
        ImmutableList.of(edge(Field.DECLARATIONS, NodePredicate.VARIABLE_DECLARATION)));
    map.put(SyntaxKind.FUNCTION_DECLARATION, NAMED_FUNCTION);
    map.put(SyntaxKind.CLASS_DECLARATION, CLASS_LIKE);
    map.put(
        SyntaxKind.ENUM_DECLARATION,
        ImmutableList.of(
            DECORATORS,
            MODIFIERS,
            IDENTIFIER_NAME,
            edge(Field.MEMBERS, NodePredicate.ENUM_MEMBER)));
    map.put(
        SyntaxKind.MODULE_DECLARATION,
        ImmutableList.of(
            DECORATORS,
            MODIFIERS,
            edge(Field.NAME, NodePredicate.MODULE_NAME),
            edge(Field.BODY, NodePredicate.MODULE_BODY)));
    map.put(SyntaxKind.MODULE_BLOCK, ImmutableList.of(STATEMENTS));
    map.put(
        SyntaxKind.CASE_BLOCK,
        ImmutableList.of(edge(Field.CLAUSES, NodePredicate.CASE_OR_DEFAULT_CLAUSE)));

    // Modules
    map.put(
        SyntaxKind.IMPORT_EQUALS_DECLARATION,
        ImmutableList.of(
            DECORATORS,
            MODIFIERS,
            IDENTIFIER_NAME,
            edge(Field.MODULE_REFERENCE, NodePredicate.MODULE_REFERENCE)));
    map.put(
        SyntaxKind.IMPORT_DECLARATION,
        ImmutableList.of(
            DECORATORS,
            MODIFIERS,
            optional(Field.IMPORT_CLAUSE, NodePredicate.IMPORT_CLAUSE),
            edge(Field.MODULE_SPECIFIER, NodePredicate.EXPRESSION)));
    map.put(
        SyntaxKind.IMPORT_CLAUSE,
        ImmutableList.of(
            OPTIONAL_IDENTIFIER_NAME,
            optional(Field.NAMED_BINDINGS, NodePredicate.NAMED_IMPORT_BINDINGS)));
    map.put(SyntaxKind.NAMESPACE_IMPORT, ImmutableList.of(IDENTIFIER_NAME));
    map.put(
        SyntaxKind.NAMED_IMPORTS,
        ImmutableList.of(edge(Field.ELEMENTS, NodePredicate.IMPORT_SPECIFIER)));
    map.put(SyntaxKind.IMPORT_SPECIFIER, SPECIFIER);
    map.put(SyntaxKind.EXPORT_ASSIGNMENT, ImmutableList.of(DECORATORS, MODIFIERS, EXPRESSION));
    map.put(
        SyntaxKind.EXPORT_DECLARATION,
        ImmutableList.of(
            DECORATORS,
            MODIFIERS,
            optional(Field.EXPORT_CLAUSE, NodePredicate.NAMED_EXPORTS),
            optional(Field.MODULE_SPECIFIER, NodePredicate.EXPRESSION)));
    map.put(
        SyntaxKind.NAMED_EXPORTS,
        ImmutableList.of(edge(Field.ELEMENTS, NodePredicate.EXPORT_SPECIFIER)));
    map.put(SyntaxKind.EXPORT_SPECIFIER, SPECIFIER);
    map.put(SyntaxKind.EXTERNAL_MODULE_REFERENCE, ImmutableList.of(OPTIONAL_EXPRESSION));

    // JSX
    map.put(
        SyntaxKind.JSX_ELEMENT,
        ImmutableList.of(
            edge(Field.OPENING_ELEMENT, NodePredicate.JSX_OPENING_ELEMENT),
            edge(Field.CHILDREN, NodePredicate.JSX_CHILD),
            edge(Field.CLOSING_ELEMENT, NodePredicate.JSX_CLOSING_ELEMENT)));
    map.put(SyntaxKind.JSX_SELF_CLOSING_ELEMENT, JSX_TAG);
    map.put(SyntaxKind.JSX_OPENING_ELEMENT, JSX_TAG);
    map.put(
        SyntaxKind.JSX_CLOSING_ELEMENT,
        ImmutableList.of(edge(Field.TAG_NAME, NodePredicate.ENTITY_NAME)));
    map.put(
        SyntaxKind.JSX_ATTRIBUTE,
        ImmutableList.of(
            IDENTIFIER_NAME,
            optional(Field.INITIALIZER, NodePredicate.STRING_LITERAL_OR_JSX_EXPRESSION)));
    map.put(SyntaxKind.JSX_SPREAD_ATTRIBUTE, ImmutableList.of(EXPRESSION));
    map.put(SyntaxKind.JSX_EXPRESSION, ImmutableList.of(OPTIONAL_EXPRESSION));

    // Clauses
    map.put(
        SyntaxKind.CASE_CLAUSE,
        ImmutableList.of(
            NodeEdge.builder(Field.EXPRESSION, NodePredicate.EXPRESSION)
                .setParenthesize(FOR_LIST)
                .build(),
            STATEMENTS));
    map.put(SyntaxKind.DEFAULT_CLAUSE, ImmutableList.of(STATEMENTS));
    map.put(
        SyntaxKind.HERITAGE_CLAUSE,
        ImmutableList.of(edge(Field.TYPES, NodePredicate.EXPRESSION_WITH_TYPE_ARGUMENTS)));
    map.put(
        SyntaxKind.CATCH_CLAUSE,
        ImmutableList.of(
            edge(Field.VARIABLE_DECLARATION, NodePredicate.VARIABLE_DECLARATION),
            edge(Field.BLOCK, NodePredicate.BLOCK)));

    // Property assignments
    map.put(
        SyntaxKind.PROPERTY_ASSIGNMENT,
        ImmutableList.of(
            PROPERTY_NAME,
            NodeEdge.builder(Field.INITIALIZER, NodePredicate.EXPRESSION)
                .setParenthesize(FOR_LIST)
                .build()));
    map.put(
        SyntaxKind.SHORTHAND_PROPERTY_ASSIGNMENT,
        ImmutableList.of(
            IDENTIFIER_NAME,
            optional(Field.OBJECT_ASSIGNMENT_INITIALIZER, NodePredicate.EXPRESSION)));

    // Enum
    map.put(SyntaxKind.ENUM_MEMBER, ImmutableList.of(PROPERTY_NAME, LIST_INITIALIZER));

    // Top level and synthesized
    map.put(SyntaxKind.SOURCE_FILE, ImmutableList.of(STATEMENTS));
    map.put(SyntaxKind.NOT_EMITTED_STATEMENT, ImmutableList.of());
    map.put(SyntaxKind.PARTIALLY_EMITTED_EXPRESSION, ImmutableList.of(EXPRESSION));

    return Maps.immutableEnumMap(map);
  }

  /** Returns the edges of {@code kind} in traversal order; empty if the kind has no schema. */
  public static ImmutableList<NodeEdge> forKind(SyntaxKind kind) {
    ImmutableList<NodeEdge> edges = SCHEMA.get(kind);
    return edges != null ? edges : ImmutableList.of();
  }

  /** Whether {@code kind} has an entry, possibly an empty one. */
  public static boolean hasSchema(SyntaxKind kind) {
    return SCHEMA.containsKey(kind);
  }

  /** Returns the edge of {@code kind} for {@code field}. */
  public static NodeEdge getEdge(SyntaxKind kind, Field field) {
    for (NodeEdge edge : forKind(kind)) {
      if (edge.getField() == field) {
        return edge;
      }
    }
    throw new IllegalArgumentException("No edge " + field + " on " + kind);
  }
}
