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
import com.google.javascript.lowering.ast.SyntaxKind;

/**
 * Decides what the {@link TransformFlags} of a node are: which syntax at the node itself needs
 * lowering, how that combines with what its subtree needs, which flags stop at the node, and which
 * nodes collect hoisted declarations.
 */
public interface LoweringPolicy {

  /** Flags for syntax present at {@code node} itself, ignoring its children. */
  int getOwnFlags(Node node);

  /**
   * Combines the own flags of {@code node} with the aggregated flags of its children. Policies may
   * add flags that only follow from the two together.
   */
  default int combine(Node node, int ownFlags, int subtreeFlags) {
    return ownFlags | subtreeFlags;
  }

  /** Flags a node of {@code kind} does not pass on to its parent. */
  int getSubtreeExclusions(SyntaxKind kind);

  /** Whether declarations hoisted while visiting the children of {@code node} belong to it. */
  boolean startsNewLexicalEnvironment(Node node);
}
