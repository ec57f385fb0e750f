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

import com.google.common.collect.ImmutableList;

/**
 * What a rewriting visitor produces for a node: the node itself, a single replacement, or an
 * ordered list of replacements. "No node" is expressed by returning {@code null}.
 *
 * <p>A {@link Node} is its own single-node result and a {@link NodeList} is a list result, so a
 * visitor can return either directly.
 */
public interface VisitResult {
  /** The nodes of this result in order. */
  ImmutableList<Node> asList();

  static VisitResult of(Node... nodes) {
    return NodeList.of(nodes);
  }

  static VisitResult of(Iterable<Node> nodes) {
    return NodeList.create(nodes);
  }

  /** An empty list result, which a single-node slot treats like "no node". */
  static VisitResult empty() {
    return NodeList.of();
  }
}
