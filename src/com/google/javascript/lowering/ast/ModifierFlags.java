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

/** Bit flags summarizing the modifier keywords attached to a declaration. */
public final class ModifierFlags {
  public static final int NONE = 0;
  public static final int EXPORT = 1 << 0;
  // "declare": the declaration has no runtime representation.
  public static final int AMBIENT = 1 << 1;
  public static final int PUBLIC = 1 << 2;
  public static final int PRIVATE = 1 << 3;
  public static final int PROTECTED = 1 << 4;
  public static final int STATIC = 1 << 5;
  public static final int READONLY = 1 << 6;
  public static final int ABSTRACT = 1 << 7;
  public static final int ASYNC = 1 << 8;
  public static final int DEFAULT = 1 << 9;
  public static final int CONST = 1 << 10;

  public static final int ACCESSIBILITY_MODIFIER = PUBLIC | PRIVATE | PROTECTED;
  // Modifiers that only exist in TypeScript and are erased by lowering.
  public static final int TYPESCRIPT_MODIFIER =
      AMBIENT | ACCESSIBILITY_MODIFIER | READONLY | ABSTRACT | CONST;

  private ModifierFlags() {}

  /** Returns the flag for a single modifier keyword, or {@link #NONE} for other kinds. */
  public static int fromKind(SyntaxKind kind) {
    switch (kind) {
      case EXPORT_KEYWORD:
        return EXPORT;
      case DECLARE_KEYWORD:
        return AMBIENT;
      case PUBLIC_KEYWORD:
        return PUBLIC;
      case PRIVATE_KEYWORD:
        return PRIVATE;
      case PROTECTED_KEYWORD:
        return PROTECTED;
      case STATIC_KEYWORD:
        return STATIC;
      case READONLY_KEYWORD:
        return READONLY;
      case ABSTRACT_KEYWORD:
        return ABSTRACT;
      case ASYNC_KEYWORD:
        return ASYNC;
      case DEFAULT_KEYWORD:
        return DEFAULT;
      case CONST_KEYWORD:
        return CONST;
      default:
        return NONE;
    }
  }
}
