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

/**
 * Bits summarizing which lowering concerns a subtree touches.
 *
 * <p>Most concerns come in pairs: the plain bit says the node itself needs the transformation, the
 * {@code CONTAINS_} bit says something in its subtree does. The plain bits are in {@link
 * #NODE_EXCLUDES}, so a parent only ever sees the {@code CONTAINS_} half. The remaining {@code
 * CONTAINS_} bits describe scoped facts and are stopped at the boundaries given by the per-kind
 * exclusion masks.
 */
public final class TransformFlags {
  public static final int NONE = 0;

  public static final int TYPESCRIPT = 1 << 0;
  public static final int CONTAINS_TYPESCRIPT = 1 << 1;
  public static final int JSX = 1 << 2;
  public static final int CONTAINS_JSX = 1 << 3;
  public static final int ES2017 = 1 << 4;
  public static final int CONTAINS_ES2017 = 1 << 5;
  public static final int ES2016 = 1 << 6;
  public static final int CONTAINS_ES2016 = 1 << 7;
  public static final int ES2015 = 1 << 8;
  public static final int CONTAINS_ES2015 = 1 << 9;
  public static final int GENERATOR = 1 << 10;
  public static final int CONTAINS_GENERATOR = 1 << 11;
  public static final int DESTRUCTURING_ASSIGNMENT = 1 << 12;
  public static final int CONTAINS_DESTRUCTURING_ASSIGNMENT = 1 << 13;

  // Markers for scoped facts
  public static final int CONTAINS_DECORATORS = 1 << 14;
  public static final int CONTAINS_PROPERTY_INITIALIZER = 1 << 15;
  public static final int CONTAINS_LEXICAL_THIS = 1 << 16;
  public static final int CONTAINS_CAPTURED_LEXICAL_THIS = 1 << 17;
  public static final int CONTAINS_LEXICAL_THIS_IN_COMPUTED_PROPERTY_NAME = 1 << 18;
  public static final int CONTAINS_DEFAULT_VALUE_ASSIGNMENTS = 1 << 19;
  public static final int CONTAINS_PARAMETER_PROPERTY_ASSIGNMENTS = 1 << 20;
  public static final int CONTAINS_SPREAD_ELEMENT = 1 << 21;
  public static final int CONTAINS_COMPUTED_PROPERTY_NAME = 1 << 22;
  public static final int CONTAINS_BLOCK_SCOPED_BINDING = 1 << 23;
  public static final int CONTAINS_BINDING_PATTERN = 1 << 24;
  public static final int CONTAINS_YIELD = 1 << 25;
  public static final int CONTAINS_HOISTED_DECLARATION_OR_COMPLETION = 1 << 26;

  /** Set once the flags of a node have been computed; never propagated to a parent. */
  public static final int HAS_COMPUTED_FLAGS = 1 << 29;

  public static final int ASSERT_TYPESCRIPT = TYPESCRIPT | CONTAINS_TYPESCRIPT;
  public static final int ASSERT_JSX = JSX | CONTAINS_JSX;
  public static final int ASSERT_ES2017 = ES2017 | CONTAINS_ES2017;
  public static final int ASSERT_ES2016 = ES2016 | CONTAINS_ES2016;
  public static final int ASSERT_ES2015 = ES2015 | CONTAINS_ES2015;
  public static final int ASSERT_GENERATOR = GENERATOR | CONTAINS_GENERATOR;
  public static final int ASSERT_DESTRUCTURING_ASSIGNMENT =
      DESTRUCTURING_ASSIGNMENT | CONTAINS_DESTRUCTURING_ASSIGNMENT;

  // A function needs ES2015 lowering if its subtree captures "this" or assigns parameter defaults.
  public static final int ES2015_FUNCTION_SYNTAX_MASK =
      CONTAINS_CAPTURED_LEXICAL_THIS | CONTAINS_DEFAULT_VALUE_ASSIGNMENTS;

  // Subtree exclusions

  public static final int NODE_EXCLUDES =
      TYPESCRIPT
          | JSX
          | ES2017
          | ES2016
          | ES2015
          | DESTRUCTURING_ASSIGNMENT
          | GENERATOR
          | HAS_COMPUTED_FLAGS;

  public static final int ARROW_FUNCTION_EXCLUDES =
      NODE_EXCLUDES
          | CONTAINS_DECORATORS
          | CONTAINS_DEFAULT_VALUE_ASSIGNMENTS
          | CONTAINS_LEXICAL_THIS
          | CONTAINS_PARAMETER_PROPERTY_ASSIGNMENTS
          | CONTAINS_BLOCK_SCOPED_BINDING
          | CONTAINS_YIELD
          | CONTAINS_HOISTED_DECLARATION_OR_COMPLETION
          | CONTAINS_BINDING_PATTERN;

  public static final int FUNCTION_EXCLUDES =
      NODE_EXCLUDES
          | CONTAINS_DECORATORS
          | CONTAINS_DEFAULT_VALUE_ASSIGNMENTS
          | CONTAINS_CAPTURED_LEXICAL_THIS
          | CONTAINS_LEXICAL_THIS
          | CONTAINS_PARAMETER_PROPERTY_ASSIGNMENTS
          | CONTAINS_BLOCK_SCOPED_BINDING
          | CONTAINS_YIELD
          | CONTAINS_HOISTED_DECLARATION_OR_COMPLETION
          | CONTAINS_BINDING_PATTERN;

  public static final int CONSTRUCTOR_EXCLUDES =
      NODE_EXCLUDES
          | CONTAINS_DEFAULT_VALUE_ASSIGNMENTS
          | CONTAINS_LEXICAL_THIS
          | CONTAINS_CAPTURED_LEXICAL_THIS
          | CONTAINS_BLOCK_SCOPED_BINDING
          | CONTAINS_YIELD
          | CONTAINS_HOISTED_DECLARATION_OR_COMPLETION
          | CONTAINS_BINDING_PATTERN;

  public static final int METHOD_OR_ACCESSOR_EXCLUDES = CONSTRUCTOR_EXCLUDES;

  public static final int CLASS_EXCLUDES =
      NODE_EXCLUDES
          | CONTAINS_DECORATORS
          | CONTAINS_PROPERTY_INITIALIZER
          | CONTAINS_LEXICAL_THIS
          | CONTAINS_CAPTURED_LEXICAL_THIS
          | CONTAINS_COMPUTED_PROPERTY_NAME
          | CONTAINS_PARAMETER_PROPERTY_ASSIGNMENTS
          | CONTAINS_LEXICAL_THIS_IN_COMPUTED_PROPERTY_NAME;

  public static final int MODULE_EXCLUDES =
      NODE_EXCLUDES
          | CONTAINS_DECORATORS
          | CONTAINS_LEXICAL_THIS
          | CONTAINS_CAPTURED_LEXICAL_THIS
          | CONTAINS_BLOCK_SCOPED_BINDING
          | CONTAINS_HOISTED_DECLARATION_OR_COMPLETION;

  // Types only ever tell their parent that TypeScript syntax is present.
  public static final int TYPE_EXCLUDES = ~CONTAINS_TYPESCRIPT;

  public static final int OBJECT_LITERAL_EXCLUDES =
      NODE_EXCLUDES
          | CONTAINS_DECORATORS
          | CONTAINS_COMPUTED_PROPERTY_NAME
          | CONTAINS_LEXICAL_THIS_IN_COMPUTED_PROPERTY_NAME;

  public static final int ARRAY_LITERAL_OR_CALL_OR_NEW_EXCLUDES =
      NODE_EXCLUDES | CONTAINS_SPREAD_ELEMENT;

  public static final int VARIABLE_DECLARATION_LIST_EXCLUDES =
      NODE_EXCLUDES | CONTAINS_BINDING_PATTERN;

  public static final int PARAMETER_EXCLUDES = NODE_EXCLUDES | CONTAINS_BINDING_PATTERN;

  private TransformFlags() {}

  /** Whether {@code flags} has any of the bits in {@code mask}. */
  public static boolean has(int flags, int mask) {
    return (flags & mask) != 0;
  }
}
