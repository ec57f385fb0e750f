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

import static com.google.javascript.lowering.TransformFlags.has;

import com.google.javascript.lowering.ast.ModifierFlags;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.NodeFlags;
import com.google.javascript.lowering.ast.NodeList;
import com.google.javascript.lowering.ast.SyntaxKind;
import org.jspecify.annotations.Nullable;

/**
 * The default {@link LoweringPolicy}. Marks TypeScript, JSX, ES2017, ES2016 and ES2015 syntax and
 * the finer grained facts (lexical {@code this}, spread, binding patterns, ...) that lowering
 * passes for those language levels look for.
 */
public class StandardLoweringPolicy implements LoweringPolicy {

  @Override
  public int getOwnFlags(Node node) {
    SyntaxKind kind = node.getKind();
    if (kind.isTypeNode()) {
      return TransformFlags.ASSERT_TYPESCRIPT;
    }

    int flags = TransformFlags.NONE;
    int modifiers = node.getModifierFlags();
    if ((modifiers & ModifierFlags.TYPESCRIPT_MODIFIER) != 0
        || hasNodes(node.getTypeParameters())
        || hasNodes(node.getTypeArguments())
        || node.getType() != null
        || node.hasQuestion()) {
      flags |= TransformFlags.ASSERT_TYPESCRIPT;
    }
    if ((modifiers & ModifierFlags.ASYNC) != 0) {
      flags |= TransformFlags.ASSERT_ES2017;
    }

    switch (kind) {
      case DECORATOR:
        return flags | TransformFlags.ASSERT_TYPESCRIPT | TransformFlags.CONTAINS_DECORATORS;

      case PUBLIC_KEYWORD:
      case PRIVATE_KEYWORD:
      case PROTECTED_KEYWORD:
      case ABSTRACT_KEYWORD:
      case DECLARE_KEYWORD:
      case READONLY_KEYWORD:
      case CONST_KEYWORD:
        return flags | TransformFlags.ASSERT_TYPESCRIPT;

      case ASYNC_KEYWORD:
        return flags | TransformFlags.ASSERT_ES2017;

      case TYPE_PARAMETER:
      case PROPERTY_SIGNATURE:
      case METHOD_SIGNATURE:
      case CALL_SIGNATURE:
      case CONSTRUCT_SIGNATURE:
      case INDEX_SIGNATURE:
      case INTERFACE_DECLARATION:
      case TYPE_ALIAS_DECLARATION:
      case ENUM_DECLARATION:
      case IMPORT_EQUALS_DECLARATION:
      case EXPORT_ASSIGNMENT:
      case MODULE_DECLARATION:
      case AS_EXPRESSION:
      case NON_NULL_EXPRESSION:
      case TYPE_ASSERTION_EXPRESSION:
        return flags | TransformFlags.ASSERT_TYPESCRIPT;

      case JSX_ELEMENT:
      case JSX_SELF_CLOSING_ELEMENT:
      case JSX_OPENING_ELEMENT:
      case JSX_CLOSING_ELEMENT:
      case JSX_ATTRIBUTE:
      case JSX_SPREAD_ATTRIBUTE:
      case JSX_EXPRESSION:
      case JSX_TEXT:
        return flags | TransformFlags.ASSERT_JSX;

      case SPREAD_ELEMENT:
        return flags | TransformFlags.ASSERT_ES2015 | TransformFlags.CONTAINS_SPREAD_ELEMENT;

      case BINARY_EXPRESSION:
        return flags | getBinaryFlags(node);

      case PARAMETER:
        if (node.hasDotDotDot()) {
          flags |= TransformFlags.ASSERT_ES2015;
        }
        if (node.getInitializer() != null) {
          flags |= TransformFlags.ASSERT_ES2015 | TransformFlags.CONTAINS_DEFAULT_VALUE_ASSIGNMENTS;
        }
        if ((modifiers & ModifierFlags.ACCESSIBILITY_MODIFIER) != 0) {
          flags |=
              TransformFlags.ASSERT_TYPESCRIPT
                  | TransformFlags.CONTAINS_PARAMETER_PROPERTY_ASSIGNMENTS;
        }
        return flags;

      case OBJECT_BINDING_PATTERN:
      case ARRAY_BINDING_PATTERN:
        return flags | TransformFlags.ASSERT_ES2015 | TransformFlags.CONTAINS_BINDING_PATTERN;

      case ARROW_FUNCTION:
        return flags | TransformFlags.ASSERT_ES2015;

      case FUNCTION_DECLARATION:
      case FUNCTION_EXPRESSION:
        if (node.hasAsterisk()) {
          flags |= TransformFlags.ASSERT_GENERATOR;
        }
        if (node.getBody() == null) {
          flags |= TransformFlags.ASSERT_TYPESCRIPT;
        } else if (kind == SyntaxKind.FUNCTION_DECLARATION) {
          flags |= TransformFlags.CONTAINS_HOISTED_DECLARATION_OR_COMPLETION;
        }
        return flags;

      case METHOD_DECLARATION:
        flags |= TransformFlags.ASSERT_ES2015;
        if (node.hasAsterisk()) {
          flags |= TransformFlags.ASSERT_GENERATOR;
        }
        if (node.getBody() == null) {
          flags |= TransformFlags.ASSERT_TYPESCRIPT;
        }
        return flags;

      case GET_ACCESSOR:
      case SET_ACCESSOR:
      case CONSTRUCTOR:
        if (node.getBody() == null) {
          flags |= TransformFlags.ASSERT_TYPESCRIPT;
        }
        return flags;

      case CLASS_DECLARATION:
      case CLASS_EXPRESSION:
        return flags | TransformFlags.ASSERT_ES2015;

      case HERITAGE_CLAUSE:
        return flags
            | (node.getHeritageToken() == SyntaxKind.IMPLEMENTS_KEYWORD
                ? TransformFlags.ASSERT_TYPESCRIPT
                : TransformFlags.ASSERT_ES2015);

      case PROPERTY_DECLARATION:
        flags |= TransformFlags.ASSERT_TYPESCRIPT;
        if (node.getInitializer() != null) {
          flags |= TransformFlags.CONTAINS_PROPERTY_INITIALIZER;
        }
        return flags;

      case THIS_KEYWORD:
        return flags | TransformFlags.CONTAINS_LEXICAL_THIS;

      case SUPER_KEYWORD:
        return flags | TransformFlags.ASSERT_ES2015;

      case COMPUTED_PROPERTY_NAME:
        return flags | TransformFlags.CONTAINS_COMPUTED_PROPERTY_NAME;

      case SHORTHAND_PROPERTY_ASSIGNMENT:
        return flags | TransformFlags.ASSERT_ES2015;

      case VARIABLE_DECLARATION_LIST:
        flags |= TransformFlags.CONTAINS_HOISTED_DECLARATION_OR_COMPLETION;
        if ((node.getNodeFlags() & NodeFlags.BLOCK_SCOPED) != 0) {
          flags |= TransformFlags.ASSERT_ES2015 | TransformFlags.CONTAINS_BLOCK_SCOPED_BINDING;
        }
        return flags;

      case NO_SUBSTITUTION_TEMPLATE_LITERAL:
      case TEMPLATE_HEAD:
      case TEMPLATE_MIDDLE:
      case TEMPLATE_TAIL:
      case TEMPLATE_EXPRESSION:
      case TEMPLATE_SPAN:
      case TAGGED_TEMPLATE_EXPRESSION:
      case FOR_OF_STATEMENT:
      case EXPRESSION_WITH_TYPE_ARGUMENTS:
        return flags | TransformFlags.ASSERT_ES2015;

      case YIELD_EXPRESSION:
        return flags | TransformFlags.ASSERT_ES2015 | TransformFlags.CONTAINS_YIELD;

      case AWAIT_EXPRESSION:
        return flags | TransformFlags.ASSERT_ES2017;

      case RETURN_STATEMENT:
      case BREAK_STATEMENT:
      case CONTINUE_STATEMENT:
        return flags | TransformFlags.CONTAINS_HOISTED_DECLARATION_OR_COMPLETION;

      default:
        return flags;
    }
  }

  private static int getBinaryFlags(Node node) {
    SyntaxKind operator = node.getOperator();
    if (operator == SyntaxKind.ASTERISK_ASTERISK_TOKEN
        || operator == SyntaxKind.ASTERISK_ASTERISK_EQUALS_TOKEN) {
      return TransformFlags.ASSERT_ES2016;
    }
    if (operator == SyntaxKind.EQUALS_TOKEN) {
      SyntaxKind left = node.getLeft().getKind();
      if (left == SyntaxKind.OBJECT_LITERAL_EXPRESSION
          || left == SyntaxKind.ARRAY_LITERAL_EXPRESSION) {
        return TransformFlags.ASSERT_ES2015 | TransformFlags.ASSERT_DESTRUCTURING_ASSIGNMENT;
      }
    }
    return TransformFlags.NONE;
  }

  private static boolean hasNodes(@Nullable NodeList list) {
    return list != null && !list.isEmpty();
  }

  @Override
  public int combine(Node node, int ownFlags, int subtreeFlags) {
    int flags = ownFlags | subtreeFlags;
    switch (node.getKind()) {
      case CALL_EXPRESSION:
      case NEW_EXPRESSION:
      case ARRAY_LITERAL_EXPRESSION:
        if (has(subtreeFlags, TransformFlags.CONTAINS_SPREAD_ELEMENT)) {
          flags |= TransformFlags.ASSERT_ES2015;
        }
        break;
      case ARROW_FUNCTION:
        if (has(subtreeFlags, TransformFlags.CONTAINS_LEXICAL_THIS)) {
          flags |= TransformFlags.CONTAINS_CAPTURED_LEXICAL_THIS;
        }
        break;
      case FUNCTION_DECLARATION:
      case FUNCTION_EXPRESSION:
        if (has(subtreeFlags, TransformFlags.ES2015_FUNCTION_SYNTAX_MASK)) {
          flags |= TransformFlags.ASSERT_ES2015;
        }
        break;
      case CLASS_DECLARATION:
      case CLASS_EXPRESSION:
        if (has(
            subtreeFlags,
            TransformFlags.CONTAINS_PROPERTY_INITIALIZER
                | TransformFlags.CONTAINS_LEXICAL_THIS_IN_COMPUTED_PROPERTY_NAME)) {
          flags |= TransformFlags.ASSERT_TYPESCRIPT;
        }
        break;
      case COMPUTED_PROPERTY_NAME:
        if (has(subtreeFlags, TransformFlags.CONTAINS_LEXICAL_THIS)) {
          flags |= TransformFlags.CONTAINS_LEXICAL_THIS_IN_COMPUTED_PROPERTY_NAME;
        }
        break;
      case OBJECT_LITERAL_EXPRESSION:
        if (has(subtreeFlags, TransformFlags.CONTAINS_COMPUTED_PROPERTY_NAME)) {
          flags |= TransformFlags.ASSERT_ES2015;
        }
        if (has(subtreeFlags, TransformFlags.CONTAINS_LEXICAL_THIS_IN_COMPUTED_PROPERTY_NAME)) {
          flags |= TransformFlags.CONTAINS_LEXICAL_THIS;
        }
        break;
      case VARIABLE_DECLARATION_LIST:
        if (has(subtreeFlags, TransformFlags.CONTAINS_BINDING_PATTERN)) {
          flags |= TransformFlags.ASSERT_ES2015;
        }
        break;
      default:
        break;
    }
    return flags;
  }

  @Override
  public int getSubtreeExclusions(SyntaxKind kind) {
    if (kind.isTypeNode()) {
      return TransformFlags.TYPE_EXCLUDES;
    }
    switch (kind) {
      case TYPE_PARAMETER:
      case PROPERTY_SIGNATURE:
      case METHOD_SIGNATURE:
      case CALL_SIGNATURE:
      case CONSTRUCT_SIGNATURE:
      case INDEX_SIGNATURE:
      case INTERFACE_DECLARATION:
      case TYPE_ALIAS_DECLARATION:
      case ANY_KEYWORD:
      case BOOLEAN_KEYWORD:
      case NEVER_KEYWORD:
      case NUMBER_KEYWORD:
      case STRING_KEYWORD:
      case SYMBOL_KEYWORD:
      case UNDEFINED_KEYWORD:
        return TransformFlags.TYPE_EXCLUDES;
      case CALL_EXPRESSION:
      case NEW_EXPRESSION:
      case ARRAY_LITERAL_EXPRESSION:
        return TransformFlags.ARRAY_LITERAL_OR_CALL_OR_NEW_EXCLUDES;
      case MODULE_DECLARATION:
        return TransformFlags.MODULE_EXCLUDES;
      case PARAMETER:
        return TransformFlags.PARAMETER_EXCLUDES;
      case ARROW_FUNCTION:
        return TransformFlags.ARROW_FUNCTION_EXCLUDES;
      case FUNCTION_EXPRESSION:
      case FUNCTION_DECLARATION:
        return TransformFlags.FUNCTION_EXCLUDES;
      case VARIABLE_DECLARATION_LIST:
        return TransformFlags.VARIABLE_DECLARATION_LIST_EXCLUDES;
      case CLASS_DECLARATION:
      case CLASS_EXPRESSION:
        return TransformFlags.CLASS_EXCLUDES;
      case CONSTRUCTOR:
        return TransformFlags.CONSTRUCTOR_EXCLUDES;
      case METHOD_DECLARATION:
      case GET_ACCESSOR:
      case SET_ACCESSOR:
        return TransformFlags.METHOD_OR_ACCESSOR_EXCLUDES;
      case OBJECT_LITERAL_EXPRESSION:
        return TransformFlags.OBJECT_LITERAL_EXCLUDES;
      default:
        return TransformFlags.NODE_EXCLUDES;
    }
  }

  @Override
  public boolean startsNewLexicalEnvironment(Node node) {
    switch (node.getKind()) {
      case CONSTRUCTOR:
      case METHOD_DECLARATION:
      case GET_ACCESSOR:
      case SET_ACCESSOR:
      case FUNCTION_DECLARATION:
      case FUNCTION_EXPRESSION:
      case ARROW_FUNCTION:
      case MODULE_DECLARATION:
      case SOURCE_FILE:
        return true;
      default:
        return false;
    }
  }
}
