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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.javascript.lowering.InvariantViolation.Kind;
import com.google.javascript.lowering.ast.Node;
import java.util.List;
import java.util.logging.Logger;

/** Runs a list of {@link Transformer}s, in order, over source files. */
public final class TransformationPipeline {

  private static final Logger logger = Logger.getLogger(TransformationPipeline.class.getName());

  private final RewriterOptions options;
  private final ImmutableList<Transformer> transformers;

  public TransformationPipeline(RewriterOptions options, List<? extends Transformer> transformers) {
    this.options = checkNotNull(options);
    this.transformers = ImmutableList.copyOf(transformers);
  }

  public ImmutableList<Transformer> getTransformers() {
    return transformers;
  }

  /**
   * Runs every transformer over {@code sourceFile} and returns the result of the last one. The
   * transform flags of the result are up to date.
   *
   * @throws InvariantViolation if a transformer broke a tree invariant or left a lexical
   *     environment open
   */
  public Node transform(Node sourceFile) {
    checkArgument(sourceFile.isSourceFile(), "Not a source file: %s", sourceFile);
    TransformationContext context = new TransformationContext(options);
    TransformFlagAggregator aggregator = context.getRewriter().getFlagAggregator();
    aggregator.aggregateTransformFlags(sourceFile);

    Node result = sourceFile;
    for (Transformer transformer : transformers) {
      String name = transformer.getName();
      logger.fine("Running transformer " + name + " on " + result.getFileName());
      Stopwatch stopwatch = Stopwatch.createStarted();
      result = transformer.transformSourceFile(context, result);
      checkState(
          result != null && result.isSourceFile(),
          "Transformer %s did not return a source file: %s",
          name,
          result);
      if (!context.getEnvironment().isEmpty()) {
        throw InvariantViolation.create(
            Kind.UNBALANCED_ENVIRONMENT,
            "Transformer %s left %s lexical environment(s) open",
            name,
            context.getEnvironment().getDepth());
      }
      aggregator.aggregateTransformFlags(result);
      logger.fine("Finished transformer " + name + " in " + stopwatch);
    }
    return result;
  }
}
