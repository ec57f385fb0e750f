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

import com.google.common.collect.ImmutableList;
import com.google.javascript.lowering.InvariantViolation.Kind;
import com.google.javascript.lowering.ast.Field;
import com.google.javascript.lowering.ast.IR;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.NodeList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Merges the statements collected by a {@link LexicalEnvironment} frame into the node that hosts
 * the frame. Declarations are always appended after the existing statements.
 *
 * <p>Every method returns its input unchanged when there is nothing to merge.
 */
public final class LexicalEnvironmentMerger {

  private static final Logger logger = Logger.getLogger(LexicalEnvironmentMerger.class.getName());

  private LexicalEnvironmentMerger() {}

  /**
   * Merges {@code declarations} into a source file, module declaration or function-like node.
   *
   * @throws InvariantViolation if {@code node} cannot host declarations, or lacks the body it
   *     would host them in
   */
  public static Node mergeLexicalEnvironment(Node node, List<Node> declarations) {
    if (declarations.isEmpty()) {
      return node;
    }
    switch (node.getKind()) {
      case SOURCE_FILE:
        return mergeSourceFile(node, declarations);
      case MODULE_DECLARATION:
        return mergeModuleDeclaration(node, declarations);
      case FUNCTION_DECLARATION:
      case FUNCTION_EXPRESSION:
      case METHOD_DECLARATION:
      case GET_ACCESSOR:
      case SET_ACCESSOR:
      case CONSTRUCTOR:
      case ARROW_FUNCTION:
        return mergeFunctionLike(node, declarations);
      default:
        throw InvariantViolation.create(
            Kind.INVALID_ENVIRONMENT_HOST, "Node is not a valid lexical environment: %s", node);
    }
  }

  public static Node mergeSourceFile(Node node, List<Node> declarations) {
    if (declarations.isEmpty()) {
      return node;
    }
    log(node, declarations);
    Node mutableNode = IR.getMutableClone(node);
    mutableNode.setField(Field.STATEMENTS, mergeStatements(node.getStatements(), declarations));
    return mutableNode;
  }

  public static Node mergeModuleDeclaration(Node node, List<Node> declarations) {
    if (declarations.isEmpty()) {
      return node;
    }
    Node body = node.getBody();
    if (body == null || !body.isModuleBlock()) {
      throw InvariantViolation.create(
          Kind.INVALID_ENVIRONMENT_HOST, "Module %s has no block to hold declarations", node);
    }
    Node mutableNode = IR.getMutableClone(node);
    mutableNode.setField(Field.BODY, mergeBlock(body, declarations));
    return mutableNode;
  }

  /** Merges into the block body of a function that is not an arrow function. */
  public static @Nullable Node mergeFunctionBody(@Nullable Node body, List<Node> declarations) {
    if (declarations.isEmpty()) {
      return body;
    }
    if (body == null) {
      throw InvariantViolation.create(
          Kind.INVALID_ENVIRONMENT_HOST, "Cannot merge declarations into a missing body");
    }
    return mergeBlock(body, declarations);
  }

  /**
   * Merges into the body of an arrow function. An expression body is replaced by a multi-line
   * block that returns the expression and then runs the declarations.
   */
  public static Node mergeConciseBody(Node body, List<Node> declarations) {
    if (declarations.isEmpty()) {
      return body;
    }
    if (body.isBlock()) {
      return mergeBlock(body, declarations);
    }
    log(body, declarations);
    Node returnStatement = IR.returnStatement(body);
    returnStatement.setSourceRange(body);
    NodeList statements =
        NodeList.create(
            ImmutableList.<Node>builder().add(returnStatement).addAll(declarations).build(),
            body,
            false);
    Node block = IR.block(statements, true);
    block.setSourceRange(body);
    return block;
  }

  private static Node mergeFunctionLike(Node node, List<Node> declarations) {
    Node body = node.getBody();
    if (body == null) {
      throw InvariantViolation.create(
          Kind.INVALID_ENVIRONMENT_HOST, "Function %s has no body to hold declarations", node);
    }
    Node mutableNode = IR.getMutableClone(node);
    mutableNode.setField(Field.BODY, mergeConciseBody(body, declarations));
    return mutableNode;
  }

  private static Node mergeBlock(Node block, List<Node> declarations) {
    log(block, declarations);
    Node mutableNode = IR.getMutableClone(block);
    mutableNode.setField(Field.STATEMENTS, mergeStatements(block.getStatements(), declarations));
    return mutableNode;
  }

  /** Appends {@code declarations}, keeping the position of {@code statements}. */
  public static NodeList mergeStatements(@Nullable NodeList statements, List<Node> declarations) {
    if (statements == null) {
      return NodeList.create(declarations);
    }
    if (declarations.isEmpty()) {
      return statements;
    }
    return statements.concat(declarations);
  }

  private static void log(Node host, List<Node> declarations) {
    if (logger.isLoggable(Level.FINER)) {
      logger.finer("Merging " + declarations.size() + " declaration(s) into " + host);
    }
  }
}
