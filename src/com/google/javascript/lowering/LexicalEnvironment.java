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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.MustBeClosed;
import com.google.javascript.lowering.InvariantViolation.Kind;
import com.google.javascript.lowering.ast.IR;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.NodeFlags;
import com.google.javascript.lowering.ast.NodeList;
import com.google.javascript.lowering.ast.SyntaxKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A stack of frames collecting statements that a pass synthesizes while it visits a scope, to be
 * merged into the body of that scope when the visit of the scope is done.
 *
 * <p>A frame is pushed by {@link #start()} and popped by {@link #end()}. Code that may fail between
 * the two should use {@link #openScope()}, which pops the frame on close even if the visit threw.
 *
 * <p>Not thread safe. One instance is used by a single traversal at a time.
 */
public final class LexicalEnvironment {

  private static final class Frame {
    final List<Node> functions = new ArrayList<>();
    final List<Node> statements = new ArrayList<>();
    final Set<String> variableNames = new LinkedHashSet<>();
  }

  private final Deque<Frame> frames = new ArrayDeque<>();

  /** Pushes a new, empty frame. */
  public void start() {
    frames.push(new Frame());
  }

  /** Appends {@code statement} to the innermost frame. */
  public void registerDeclaration(Node statement) {
    checkArgument(statement.getKind().isStatement(), "Not a statement: %s", statement);
    current().statements.add(statement);
  }

  /**
   * Declares {@code name} in the innermost frame. All names of a frame end up in a single {@code
   * var} statement; declaring a name twice has no further effect.
   */
  public void hoistVariableDeclaration(String name) {
    checkArgument(!name.isEmpty(), "Empty variable name");
    current().variableNames.add(name);
  }

  /** Adds a function declaration to the innermost frame, ahead of any other statement. */
  public void hoistFunctionDeclaration(Node function) {
    checkArgument(
        function.getKind() == SyntaxKind.FUNCTION_DECLARATION,
        "Not a function declaration: %s",
        function);
    current().functions.add(function);
  }

  /**
   * Pops the innermost frame and returns its statements: hoisted functions first, then registered
   * statements in registration order, then one {@code var} statement declaring every hoisted
   * variable name. The result is empty if nothing was collected.
   */
  public ImmutableList<Node> end() {
    if (frames.isEmpty()) {
      throw InvariantViolation.create(
          Kind.UNBALANCED_ENVIRONMENT, "Lexical environment ended without being started");
    }
    Frame frame = frames.pop();
    ImmutableList.Builder<Node> declarations = ImmutableList.builder();
    declarations.addAll(frame.functions);
    declarations.addAll(frame.statements);
    if (!frame.variableNames.isEmpty()) {
      List<Node> variables = new ArrayList<>();
      for (String name : frame.variableNames) {
        variables.add(IR.variableDeclaration(name, null));
      }
      declarations.add(
          IR.variableStatement(
              null, IR.variableDeclarationList(NodeList.create(variables), NodeFlags.NONE)));
    }
    return declarations.build();
  }

  public boolean isEmpty() {
    return frames.isEmpty();
  }

  /** The number of open frames. */
  public int getDepth() {
    return frames.size();
  }

  /**
   * Starts a frame and returns a handle that ends it. Closing the handle without calling {@link
   * Scope#end()} discards the frame, and any frame opened inside it and left open.
   */
  @MustBeClosed
  public Scope openScope() {
    start();
    return new Scope(frames.size());
  }

  private Frame current() {
    if (frames.isEmpty()) {
      throw InvariantViolation.create(
          Kind.UNBALANCED_ENVIRONMENT, "No lexical environment has been started");
    }
    return frames.peek();
  }

  /** A frame opened by {@link #openScope()}. */
  public final class Scope implements AutoCloseable {
    private final int depth;
    private boolean ended;

    private Scope(int depth) {
      this.depth = depth;
    }

    /** Ends the frame of this scope. See {@link LexicalEnvironment#end()}. */
    public ImmutableList<Node> end() {
      checkState(!ended, "Scope already ended");
      if (frames.size() != depth) {
        throw InvariantViolation.create(
            Kind.UNBALANCED_ENVIRONMENT,
            "Expected %s open lexical environments but found %s",
            depth,
            frames.size());
      }
      ended = true;
      return LexicalEnvironment.this.end();
    }

    @Override
    public void close() {
      if (!ended) {
        ended = true;
        while (frames.size() >= depth) {
          frames.pop();
        }
      }
    }
  }
}
