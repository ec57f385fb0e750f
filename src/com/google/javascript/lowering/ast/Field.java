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

/**
 * Names of the child-bearing fields of a {@link Node}.
 *
 * <p>A field holds either a single node or a {@link NodeList}, never both; {@link #isList()} says
 * which. The declaration order is the order {@link Node#toStringTree()} prints children in.
 */
public enum Field {
  DECORATORS(true),
  MODIFIERS(true),
  TAG(false),
  LEFT(false),
  EXPRESSION(false),
  OPERAND(false),
  PROPERTY_NAME(false),
  NAME(false),
  IMPORT_CLAUSE(false),
  NAMED_BINDINGS(false),
  EXPORT_CLAUSE(false),
  MODULE_REFERENCE(false),
  MODULE_SPECIFIER(false),
  TYPE_PARAMETERS(true),
  CONSTRAINT(false),
  PARAMETERS(true),
  TYPE(false),
  INITIALIZER(false),
  OBJECT_ASSIGNMENT_INITIALIZER(false),
  ARGUMENT_EXPRESSION(false),
  TYPE_ARGUMENTS(true),
  ARGUMENTS(true),
  TEMPLATE(false),
  RIGHT(false),
  CONDITION(false),
  WHEN_TRUE(false),
  WHEN_FALSE(false),
  HEAD(false),
  TEMPLATE_SPANS(true),
  LITERAL(false),
  HERITAGE_CLAUSES(true),
  MEMBERS(true),
  ELEMENTS(true),
  PROPERTIES(true),
  DECLARATION_LIST(false),
  DECLARATIONS(true),
  LABEL(false),
  THEN_STATEMENT(false),
  ELSE_STATEMENT(false),
  INCREMENTOR(false),
  STATEMENT(false),
  CASE_BLOCK(false),
  CLAUSES(true),
  TRY_BLOCK(false),
  VARIABLE_DECLARATION(false),
  BLOCK(false),
  CATCH_CLAUSE(false),
  FINALLY_BLOCK(false),
  OPENING_ELEMENT(false),
  TAG_NAME(false),
  ATTRIBUTES(true),
  CHILDREN(true),
  CLOSING_ELEMENT(false),
  TYPES(true),
  BODY(false),
  STATEMENTS(true);

  private final boolean list;

  Field(boolean list) {
    this.list = list;
  }

  /** Whether this field holds a {@link NodeList} rather than a single node. */
  public boolean isList() {
    return list;
  }
}
