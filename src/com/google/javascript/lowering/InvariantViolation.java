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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.FormatString;

/**
 * Thrown when a transformation breaks a structural rule of the tree: a visitor dropped a required
 * node, produced a node of the wrong kind or too many nodes, or generated declarations where they
 * cannot be hosted.
 *
 * <p>These are programming errors in a pass. The current transformation is abandoned; there is no
 * recovery.
 */
public final class InvariantViolation extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  /** What kind of rule was broken. */
  public enum Kind {
    /** A visitor returned nothing for a child that must be present. */
    NOT_OPTIONAL,
    /** A replacement failed its validity test or a list could not be reduced to one node. */
    UNEXPECTED_NODE,
    /** Declarations were merged into a node that cannot host them. */
    INVALID_ENVIRONMENT_HOST,
    /** Lexical environment frames were not started and ended in pairs. */
    UNBALANCED_ENVIRONMENT
  }

  private final Kind kind;

  public InvariantViolation(Kind kind, String message) {
    super(message);
    this.kind = checkNotNull(kind);
  }

  @FormatMethod
  static InvariantViolation create(Kind kind, @FormatString String format, Object... args) {
    return new InvariantViolation(kind, Strings.lenientFormat(format, args));
  }

  public Kind getKind() {
    return kind;
  }
}
