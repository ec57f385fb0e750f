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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.javascript.lowering.ast.ModifierFlags;
import com.google.javascript.lowering.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * Computes and caches the {@link TransformFlags} of nodes. The flags of a node cover its whole
 * subtree, except for what the {@link LoweringPolicy} excludes at each boundary.
 *
 * <p>Flags are computed once. A node whose cached flags carry {@link
 * TransformFlags#HAS_COMPUTED_FLAGS} is not descended into again; replacing a child through {@link
 * Node#setField} clears the cache of the parent.
 */
public final class TransformFlagAggregator {

  private final LoweringPolicy policy;

  public TransformFlagAggregator(LoweringPolicy policy) {
    this.policy = checkNotNull(policy);
  }

  public LoweringPolicy getPolicy() {
    return policy;
  }

  /**
   * Makes sure the flags of {@code node} and its subtree are cached, and returns the flags that
   * {@code node} contributes to its parent.
   */
  @CanIgnoreReturnValue
  public int aggregateTransformFlags(@Nullable Node node) {
    if (node == null) {
      return TransformFlags.NONE;
    }
    int excludes = policy.getSubtreeExclusions(node.getKind());
    int cached = node.getTransformFlags();
    if (TransformFlags.has(cached, TransformFlags.HAS_COMPUTED_FLAGS)) {
      return cached & ~excludes;
    }
    int flags =
        policy.combine(node, policy.getOwnFlags(node), aggregateTransformFlagsForSubtree(node));
    node.setTransformFlags(flags | TransformFlags.HAS_COMPUTED_FLAGS);
    return flags & ~excludes;
  }

  private int aggregateTransformFlagsForSubtree(Node node) {
    // Types and ambient declarations are never lowered.
    if (node.hasModifier(ModifierFlags.AMBIENT) || node.getKind().isTypeNode()) {
      return TransformFlags.NONE;
    }
    return TreeRewriter.reduceEachChild(
        node, (flags, child) -> flags | aggregateTransformFlags(child), TransformFlags.NONE);
  }
}
