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

import com.google.javascript.lowering.ast.Node;

/**
 * A lowering pass. It is handed a source file and returns the rewritten file, or the same file if
 * there was nothing to do.
 */
public interface Transformer {

  /**
   * Rewrites {@code sourceFile}.
   *
   * @param context the rewriter and lexical environment to use
   * @param sourceFile a {@code SOURCE_FILE} node whose transform flags are up to date
   * @return a {@code SOURCE_FILE} node
   */
  Node transformSourceFile(TransformationContext context, Node sourceFile);

  /** A short name for logging. */
  String getName();
}
