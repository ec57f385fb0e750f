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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.javascript.lowering.ast.Field;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.NodePredicate;
import org.jspecify.annotations.Nullable;

/**
 * Describes one child-bearing field of a node kind: which field it is, whether it may be absent,
 * what a replacement must look like, and how to fix up a replacement that does not fit as is.
 */
@AutoValue
public abstract class NodeEdge {

  /** Collapses the list a visitor returned for a single-node field into one node. */
  @FunctionalInterface
  public interface LiftFunction {
    @Nullable Node lift(ImmutableList<Node> nodes);
  }

  /** Wraps a replacement in parentheses if its parent's grammar requires it. */
  @FunctionalInterface
  public interface ParenthesizeFunction {
    Node parenthesize(Node value, Node parent);
  }

  public abstract Field getField();

  /** Whether the field may be left empty. Meaningless for list fields. */
  public abstract boolean isOptional();

  /** The test every replacement (or every list element) must pass. */
  public abstract NodePredicate getTest();

  public abstract @Nullable LiftFunction getLift();

  public abstract @Nullable ParenthesizeFunction getParenthesize();

  public static Builder builder(Field field, NodePredicate test) {
    return new AutoValue_NodeEdge.Builder().setField(field).setTest(test).setOptional(false);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    abstract Builder setField(Field field);

    abstract Builder setTest(NodePredicate test);

    public abstract Builder setOptional(boolean optional);

    public abstract Builder setLift(@Nullable LiftFunction lift);

    public abstract Builder setParenthesize(@Nullable ParenthesizeFunction parenthesize);

    public abstract NodeEdge build();
  }
}
