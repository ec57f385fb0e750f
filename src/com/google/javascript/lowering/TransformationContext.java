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

import com.google.javascript.lowering.TreeRewriter.Visitor;
import com.google.javascript.lowering.ast.IR;
import com.google.javascript.lowering.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * What a {@link Transformer} works with: the options, a {@link TreeRewriter}, and the {@link
 * LexicalEnvironment} into which it hoists declarations. One context serves one run of a pipeline.
 */
public final class TransformationContext {

  private final RewriterOptions options;
  private final TreeRewriter rewriter;
  private final LexicalEnvironment environment = new LexicalEnvironment();
  private int tempCount;

  public TransformationContext(RewriterOptions options) {
    this.options = checkNotNull(options);
    this.rewriter = new TreeRewriter(options);
  }

  public RewriterOptions getOptions() {
    return options;
  }

  public TreeRewriter getRewriter() {
    return rewriter;
  }

  public LexicalEnvironment getEnvironment() {
    return environment;
  }

  /** Shorthand for {@link TreeRewriter#visitEachChild} with this context's environment. */
  public @Nullable Node visitEachChild(@Nullable Node node, Visitor visitor) {
    return rewriter.visitEachChild(node, visitor, environment);
  }

  /**
   * Returns an identifier for a new temporary variable and hoists its declaration into the
   * innermost lexical environment.
   */
  public Node createTempVariable() {
    String name = newTempName();
    environment.hoistVariableDeclaration(name);
    return IR.identifier(name);
  }

  /**
   * Returns a new temporary name: the prefix followed by {@code a} to {@code z}, then by {@code
   * 0}, {@code 1}, ... Names are unique within this context. They are not checked against names
   * already used in the tree.
   */
  public String newTempName() {
    int count = tempCount++;
    String prefix = options.getTempVariablePrefix();
    return count < 26 ? prefix + (char) ('a' + count) : prefix + (count - 26);
  }

  public void hoistVariableDeclaration(String name) {
    environment.hoistVariableDeclaration(name);
  }

  public void hoistFunctionDeclaration(Node function) {
    environment.hoistFunctionDeclaration(function);
  }
}
