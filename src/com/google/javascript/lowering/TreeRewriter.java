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

import com.google.common.collect.ImmutableList;
import com.google.javascript.lowering.InvariantViolation.Kind;
import com.google.javascript.lowering.NodeEdge.LiftFunction;
import com.google.javascript.lowering.NodeEdge.ParenthesizeFunction;
import com.google.javascript.lowering.ast.Field;
import com.google.javascript.lowering.ast.IR;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.NodeList;
import com.google.javascript.lowering.ast.SyntaxKind;
import com.google.javascript.lowering.ast.VisitResult;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * Rebuilds syntax trees bottom up. A {@link Visitor} decides what replaces each node; the rewriter
 * puts the replacements back into a copy of the parent, following the schema in {@link NodeEdges}.
 *
 * <p>Rewriting is copy-on-write. A node none of whose children changed is returned as is, so a
 * visitor that changes nothing gets back the very tree it was given. Every node the rewriter
 * creates or receives from a visitor has its {@link TransformFlags} computed before it is
 * returned.
 *
 * <p>Statements that a visitor hoists while a function, module or source file is visited are
 * merged into that node's body, see {@link LexicalEnvironment}.
 */
public final class TreeRewriter {

  /** Decides what replaces a node: the node itself, another node, several nodes or nothing. */
  @FunctionalInterface
  public interface Visitor {
    /**
     * @return {@code node} to keep it, a replacement, a {@link NodeList} of replacements, or null
     *     to drop it
     */
    @Nullable VisitResult visit(Node node);
  }

  /** A list window count that reaches the end of any list. */
  private static final int TO_END = Integer.MAX_VALUE;

  private final AssertionLevel assertionLevel;
  private final LoweringPolicy policy;
  private final TransformFlagAggregator flagAggregator;

  public TreeRewriter(RewriterOptions options) {
    this.assertionLevel = checkNotNull(options.getAssertionLevel());
    this.policy = checkNotNull(options.getLoweringPolicy());
    this.flagAggregator = new TransformFlagAggregator(policy);
  }

  public AssertionLevel getAssertionLevel() {
    return assertionLevel;
  }

  public TransformFlagAggregator getFlagAggregator() {
    return flagAggregator;
  }

  // Single nodes

  /** Visits a required node. */
  public @Nullable Node visitNode(
      @Nullable Node node, Visitor visitor, Predicate<? super Node> test) {
    return visitNode(node, visitor, test, false, null);
  }

  public @Nullable Node visitNode(
      @Nullable Node node, Visitor visitor, Predicate<? super Node> test, boolean optional) {
    return visitNode(node, visitor, test, optional, null);
  }

  /**
   * Visits a node, possibly returning a new node in its place.
   *
   * @param node the node to visit; null is returned as is without calling the visitor
   * @param visitor decides the replacement
   * @param test that the replacement must pass
   * @param optional whether the visitor may drop the node
   * @param lift turns a list of replacements into one node; by default a list may hold at most
   *     one node
   * @throws InvariantViolation if a required node was dropped or the replacement is unfit
   */
  public @Nullable Node visitNode(
      @Nullable Node node,
      Visitor visitor,
      Predicate<? super Node> test,
      boolean optional,
      @Nullable LiftFunction lift) {
    return visitNodeWorker(node, visitor, test, optional, lift, null, null);
  }

  private @Nullable Node visitNodeWorker(
      @Nullable Node node,
      Visitor visitor,
      Predicate<? super Node> test,
      boolean optional,
      @Nullable LiftFunction lift,
      @Nullable ParenthesizeFunction parenthesize,
      @Nullable Node parent) {
    if (node == null) {
      return null;
    }

    VisitResult visited = visitor.visit(node);
    if (visited == node) {
      return node;
    }

    Node visitedNode;
    if (visited == null) {
      visitedNode = null;
    } else if (visited instanceof Node) {
      visitedNode = (Node) visited;
    } else {
      ImmutableList<Node> nodes = visited.asList();
      visitedNode = lift != null ? lift.lift(nodes) : extractSingleNode(nodes);
    }

    if (visitedNode == null) {
      if (!optional) {
        failNotOptional(node);
      }
      return null;
    }

    if (parenthesize != null) {
      visitedNode = parenthesize.parenthesize(visitedNode, checkNotNull(parent));
    }
    assertNode(visitedNode, test);
    flagAggregator.aggregateTransformFlags(visitedNode);
    return visitedNode;
  }

  // Node lists

  public @Nullable NodeList visitNodes(
      @Nullable NodeList nodes, Visitor visitor, Predicate<? super Node> test) {
    return visitNodes(nodes, visitor, test, 0, TO_END);
  }

  /** Visits the elements of a list from {@code start} to its end. */
  public @Nullable NodeList visitNodes(
      @Nullable NodeList nodes, Visitor visitor, Predicate<? super Node> test, int start) {
    return visitNodes(nodes, visitor, test, start, TO_END);
  }

  /**
   * Visits the elements {@code [start, start + count)} of a list. Replacements that are lists are
   * flattened into the result and dropped elements are left out.
   *
   * <p>A negative {@code start} means 0. A {@code count} that reaches past the end of the list
   * means up to the end of the list, and a negative one visits nothing. When the window is the
   * whole list and no element changed, {@code nodes} itself is returned; a partial window always
   * yields a new list holding only the visited window.
   */
  public @Nullable NodeList visitNodes(
      @Nullable NodeList nodes,
      Visitor visitor,
      Predicate<? super Node> test,
      int start,
      int count) {
    return visitNodesWorker(nodes, visitor, test, null, null, start, count);
  }

  private @Nullable NodeList visitNodesWorker(
      @Nullable NodeList nodes,
      Visitor visitor,
      Predicate<? super Node> test,
      @Nullable ParenthesizeFunction parenthesize,
      @Nullable Node parent,
      int start,
      int count) {
    if (nodes == null) {
      return null;
    }

    int length = nodes.size();
    if (start < 0) {
      start = 0;
    } else if (start > length) {
      start = length;
    }
    if (count > length - start) {
      count = length - start;
    }

    // A window that is not the whole list never aliases it.
    boolean partial = start > 0 || count < length;
    List<Node> updated = partial ? new ArrayList<>() : null;

    for (int i = 0; i < count; i++) {
      Node node = nodes.get(i + start);
      VisitResult visited = visitor.visit(node);
      if (updated != null || visited != node) {
        if (updated == null) {
          updated = new ArrayList<>(nodes.asList().subList(0, i));
        }
        addVisitedNodes(updated, visited, test, parenthesize, parent, visited != node);
      } else if (assertionLevel.isAtLeast(AssertionLevel.AGGRESSIVE)) {
        assertNode(node, test);
      }
    }

    if (updated == null) {
      return nodes;
    }
    if (partial) {
      return NodeList.create(
          updated, null, nodes.hasTrailingComma() && start + count == length);
    }
    return NodeList.create(updated, nodes, nodes.hasTrailingComma());
  }

  private void addVisitedNodes(
      List<Node> to,
      @Nullable VisitResult from,
      Predicate<? super Node> test,
      @Nullable ParenthesizeFunction parenthesize,
      @Nullable Node parent,
      boolean isVisiting) {
    if (from == null) {
      return;
    }
    for (Node node : from.asList()) {
      if (parenthesize != null) {
        node = parenthesize.parenthesize(node, checkNotNull(parent));
      }
      assertNode(node, test);
      if (isVisiting) {
        flagAggregator.aggregateTransformFlags(node);
      }
      to.add(node);
    }
  }

  /** Appends the nodes of {@code from} to {@code to}. Nothing is appended for null. */
  public static void addNode(List<Node> to, @Nullable VisitResult from) {
    addNode(to, from, false);
  }

  /**
   * Appends the nodes of {@code from} to {@code to}, marking each to start on a new line if {@code
   * startOnNewLine} is set.
   */
  public static void addNode(List<Node> to, @Nullable VisitResult from, boolean startOnNewLine) {
    if (from == null) {
      return;
    }
    for (Node node : from.asList()) {
      if (startOnNewLine) {
        node.setStartsOnNewLine(true);
      }
      to.add(node);
    }
  }

  public static void addNodes(List<Node> to, Iterable<? extends @Nullable VisitResult> from) {
    addNodes(to, from, false);
  }

  public static void addNodes(
      List<Node> to, Iterable<? extends @Nullable VisitResult> from, boolean startOnNewLine) {
    for (VisitResult result : from) {
      addNode(to, result, startOnNewLine);
    }
  }

  // Children

  /**
   * Visits each child of {@code node}, returning {@code node} if no child changed and otherwise a
   * node of the same kind holding the replacements.
   *
   * <p>When {@code node} hosts a lexical environment (a source file, module or function-like node),
   * a frame is opened on {@code environment} for the visit of its children, and the statements it
   * collects are merged into the body of the result.
   */
  public @Nullable Node visitEachChild(
      @Nullable Node node, Visitor visitor, LexicalEnvironment environment) {
    if (node == null) {
      return null;
    }

    SyntaxKind kind = node.getKind();
    if (kind.isToken()) {
      return node;
    }

    Node visited;
    switch (kind) {
      case THIS_TYPE:
      case LITERAL_TYPE:
      case SEMICOLON_CLASS_ELEMENT:
      case EMPTY_STATEMENT:
      case OMITTED_EXPRESSION:
      case DEBUGGER_STATEMENT:
        // No children.
        return node;

      // Signature elements
      case PARAMETER:
        visited = visitParameter(node, visitor);
        break;

      // Class members
      case METHOD_DECLARATION:
        visited = visitMethod(node, visitor, environment);
        break;
      case CONSTRUCTOR:
        visited = visitConstructor(node, visitor, environment);
        break;
      case GET_ACCESSOR:
        visited = visitGetAccessor(node, visitor, environment);
        break;
      case SET_ACCESSOR:
        visited = visitSetAccessor(node, visitor, environment);
        break;

      // Expressions
      case PROPERTY_ACCESS_EXPRESSION:
        visited =
            IR.updatePropertyAccess(
                node,
                visitEdge(node, Field.EXPRESSION, visitor),
                visitEdge(node, Field.NAME, visitor));
        break;
      case CALL_EXPRESSION:
        visited =
            IR.updateCall(
                node,
                visitEdge(node, Field.EXPRESSION, visitor),
                visitEdgeList(node, Field.TYPE_ARGUMENTS, visitor),
                visitEdgeList(node, Field.ARGUMENTS, visitor));
        break;
      case NEW_EXPRESSION:
        visited =
            IR.updateNew(
                node,
                visitEdge(node, Field.EXPRESSION, visitor),
                visitEdgeList(node, Field.TYPE_ARGUMENTS, visitor),
                visitEdgeList(node, Field.ARGUMENTS, visitor));
        break;
      case BINARY_EXPRESSION:
        visited =
            IR.updateBinary(
                node, visitEdge(node, Field.LEFT, visitor), visitEdge(node, Field.RIGHT, visitor));
        break;
      case FUNCTION_EXPRESSION:
        visited = visitFunctionExpression(node, visitor, environment);
        break;
      case ARROW_FUNCTION:
        visited = visitArrowFunction(node, visitor, environment);
        break;

      // Statements
      case BLOCK:
        visited = IR.updateBlock(node, visitEdgeList(node, Field.STATEMENTS, visitor));
        break;
      case VARIABLE_STATEMENT:
        visited =
            IR.updateVariableStatement(
                node,
                visitEdgeList(node, Field.MODIFIERS, visitor),
                visitEdge(node, Field.DECLARATION_LIST, visitor));
        break;
      case EXPRESSION_STATEMENT:
        visited =
            IR.updateExpressionStatement(node, visitEdge(node, Field.EXPRESSION, visitor));
        break;
      case IF_STATEMENT:
        visited =
            IR.updateIf(
                node,
                visitEdge(node, Field.EXPRESSION, visitor),
                visitEdge(node, Field.THEN_STATEMENT, visitor),
                visitEdge(node, Field.ELSE_STATEMENT, visitor));
        break;
      case RETURN_STATEMENT:
        visited = IR.updateReturn(node, visitEdge(node, Field.EXPRESSION, visitor));
        break;

      // Declarations
      case VARIABLE_DECLARATION:
        visited =
            IR.updateVariableDeclaration(
                node,
                visitEdge(node, Field.NAME, visitor),
                visitEdge(node, Field.TYPE, visitor),
                visitEdge(node, Field.INITIALIZER, visitor));
        break;
      case VARIABLE_DECLARATION_LIST:
        visited =
            IR.updateVariableDeclarationList(
                node, visitEdgeList(node, Field.DECLARATIONS, visitor));
        break;
      case FUNCTION_DECLARATION:
        visited = visitFunctionDeclaration(node, visitor, environment);
        break;

      // Top level
      case SOURCE_FILE:
        visited = visitSourceFile(node, visitor, environment);
        break;

      default:
        visited = visitEachChildOfNode(node, visitor, environment);
        break;
    }

    if (visited != node) {
      flagAggregator.aggregateTransformFlags(visited);
      if (assertionLevel.isAtLeast(AssertionLevel.VERY_AGGRESSIVE)) {
        assertEdges(visited);
      }
    }
    return visited;
  }

  private Node visitParameter(Node node, Visitor visitor) {
    return IR.updateParameter(
        node,
        visitEdgeList(node, Field.DECORATORS, visitor),
        visitEdgeList(node, Field.MODIFIERS, visitor),
        visitEdge(node, Field.NAME, visitor),
        visitEdge(node, Field.TYPE, visitor),
        visitEdge(node, Field.INITIALIZER, visitor));
  }

  private Node visitMethod(Node node, Visitor visitor, LexicalEnvironment environment) {
    NodeList decorators = visitEdgeList(node, Field.DECORATORS, visitor);
    NodeList modifiers = visitEdgeList(node, Field.MODIFIERS, visitor);
    Node name = visitEdge(node, Field.NAME, visitor);
    NodeList typeParameters = visitEdgeList(node, Field.TYPE_PARAMETERS, visitor);
    try (LexicalEnvironment.Scope scope = environment.openScope()) {
      NodeList parameters = visitEdgeList(node, Field.PARAMETERS, visitor);
      Node type = visitEdge(node, Field.TYPE, visitor);
      Node body = visitEdge(node, Field.BODY, visitor);
      return IR.updateMethod(
          node,
          decorators,
          modifiers,
          name,
          typeParameters,
          parameters,
          type,
          LexicalEnvironmentMerger.mergeFunctionBody(body, scope.end()));
    }
  }

  private Node visitConstructor(Node node, Visitor visitor, LexicalEnvironment environment) {
    NodeList decorators = visitEdgeList(node, Field.DECORATORS, visitor);
    NodeList modifiers = visitEdgeList(node, Field.MODIFIERS, visitor);
    try (LexicalEnvironment.Scope scope = environment.openScope()) {
      NodeList parameters = visitEdgeList(node, Field.PARAMETERS, visitor);
      Node body = visitEdge(node, Field.BODY, visitor);
      return IR.updateConstructor(
          node,
          decorators,
          modifiers,
          parameters,
          LexicalEnvironmentMerger.mergeFunctionBody(body, scope.end()));
    }
  }

  private Node visitGetAccessor(Node node, Visitor visitor, LexicalEnvironment environment) {
    NodeList decorators = visitEdgeList(node, Field.DECORATORS, visitor);
    NodeList modifiers = visitEdgeList(node, Field.MODIFIERS, visitor);
    Node name = visitEdge(node, Field.NAME, visitor);
    try (LexicalEnvironment.Scope scope = environment.openScope()) {
      NodeList parameters = visitEdgeList(node, Field.PARAMETERS, visitor);
      Node type = visitEdge(node, Field.TYPE, visitor);
      Node body = visitEdge(node, Field.BODY, visitor);
      return IR.updateGetAccessor(
          node,
          decorators,
          modifiers,
          name,
          parameters,
          type,
          LexicalEnvironmentMerger.mergeFunctionBody(body, scope.end()));
    }
  }

  private Node visitSetAccessor(Node node, Visitor visitor, LexicalEnvironment environment) {
    NodeList decorators = visitEdgeList(node, Field.DECORATORS, visitor);
    NodeList modifiers = visitEdgeList(node, Field.MODIFIERS, visitor);
    Node name = visitEdge(node, Field.NAME, visitor);
    try (LexicalEnvironment.Scope scope = environment.openScope()) {
      NodeList parameters = visitEdgeList(node, Field.PARAMETERS, visitor);
      Node body = visitEdge(node, Field.BODY, visitor);
      return IR.updateSetAccessor(
          node,
          decorators,
          modifiers,
          name,
          parameters,
          LexicalEnvironmentMerger.mergeFunctionBody(body, scope.end()));
    }
  }

  private Node visitFunctionExpression(
      Node node, Visitor visitor, LexicalEnvironment environment) {
    NodeList modifiers = visitEdgeList(node, Field.MODIFIERS, visitor);
    Node name = visitEdge(node, Field.NAME, visitor);
    NodeList typeParameters = visitEdgeList(node, Field.TYPE_PARAMETERS, visitor);
    try (LexicalEnvironment.Scope scope = environment.openScope()) {
      NodeList parameters = visitEdgeList(node, Field.PARAMETERS, visitor);
      Node type = visitEdge(node, Field.TYPE, visitor);
      Node body = visitEdge(node, Field.BODY, visitor);
      return IR.updateFunctionExpression(
          node,
          modifiers,
          name,
          typeParameters,
          parameters,
          type,
          LexicalEnvironmentMerger.mergeFunctionBody(body, scope.end()));
    }
  }

  private Node visitArrowFunction(Node node, Visitor visitor, LexicalEnvironment environment) {
    NodeList modifiers = visitEdgeList(node, Field.MODIFIERS, visitor);
    NodeList typeParameters = visitEdgeList(node, Field.TYPE_PARAMETERS, visitor);
    try (LexicalEnvironment.Scope scope = environment.openScope()) {
      NodeList parameters = visitEdgeList(node, Field.PARAMETERS, visitor);
      Node type = visitEdge(node, Field.TYPE, visitor);
      Node body = visitEdge(node, Field.BODY, visitor);
      return IR.updateArrowFunction(
          node,
          modifiers,
          typeParameters,
          parameters,
          type,
          LexicalEnvironmentMerger.mergeConciseBody(body, scope.end()));
    }
  }

  private Node visitFunctionDeclaration(
      Node node, Visitor visitor, LexicalEnvironment environment) {
    NodeList decorators = visitEdgeList(node, Field.DECORATORS, visitor);
    NodeList modifiers = visitEdgeList(node, Field.MODIFIERS, visitor);
    Node name = visitEdge(node, Field.NAME, visitor);
    NodeList typeParameters = visitEdgeList(node, Field.TYPE_PARAMETERS, visitor);
    try (LexicalEnvironment.Scope scope = environment.openScope()) {
      NodeList parameters = visitEdgeList(node, Field.PARAMETERS, visitor);
      Node type = visitEdge(node, Field.TYPE, visitor);
      Node body = visitEdge(node, Field.BODY, visitor);
      return IR.updateFunctionDeclaration(
          node,
          decorators,
          modifiers,
          name,
          typeParameters,
          parameters,
          type,
          LexicalEnvironmentMerger.mergeFunctionBody(body, scope.end()));
    }
  }

  private Node visitSourceFile(Node node, Visitor visitor, LexicalEnvironment environment) {
    try (LexicalEnvironment.Scope scope = environment.openScope()) {
      NodeList statements = visitEdgeList(node, Field.STATEMENTS, visitor);
      return IR.updateSourceFile(
          node, LexicalEnvironmentMerger.mergeStatements(statements, scope.end()));
    }
  }

  /** Visits the children of any kind, driven by its schema. */
  private Node visitEachChildOfNode(Node node, Visitor visitor, LexicalEnvironment environment) {
    if (!policy.startsNewLexicalEnvironment(node)) {
      return visitEdges(node, visitor);
    }
    try (LexicalEnvironment.Scope scope = environment.openScope()) {
      Node updated = visitEdges(node, visitor);
      updated = LexicalEnvironmentMerger.mergeLexicalEnvironment(updated, scope.end());
      return updated != node ? IR.updateNode(updated, node) : node;
    }
  }

  /** Returns {@code node}, or a single clone of it holding every changed child. */
  private Node visitEdges(Node node, Visitor visitor) {
    Node updated = null;
    for (NodeEdge edge : NodeEdges.forKind(node.getKind())) {
      Field field = edge.getField();
      Object value = node.getField(field);
      if (value == null) {
        continue;
      }
      Object visited =
          field.isList()
              ? visitNodesWorker(
                  (NodeList) value,
                  visitor,
                  edge.getTest(),
                  edge.getParenthesize(),
                  node,
                  0,
                  TO_END)
              : visitNodeWorker(
                  (Node) value,
                  visitor,
                  edge.getTest(),
                  edge.isOptional(),
                  edge.getLift(),
                  edge.getParenthesize(),
                  node);
      if (visited != value) {
        if (updated == null) {
          updated = IR.getMutableClone(node);
        }
        updated.setField(field, visited);
      }
    }
    return updated != null ? updated : node;
  }

  private @Nullable Node visitEdge(Node node, Field field, Visitor visitor) {
    NodeEdge edge = NodeEdges.getEdge(node.getKind(), field);
    return visitNodeWorker(
        node.getChild(field),
        visitor,
        edge.getTest(),
        edge.isOptional(),
        edge.getLift(),
        edge.getParenthesize(),
        node);
  }

  private @Nullable NodeList visitEdgeList(Node node, Field field, Visitor visitor) {
    NodeEdge edge = NodeEdges.getEdge(node.getKind(), field);
    return visitNodesWorker(
        node.getChildList(field), visitor, edge.getTest(), edge.getParenthesize(), node, 0, TO_END);
  }

  // Reducing

  /**
   * Folds {@code reducer} over the children of {@code node} in schema order, starting from {@code
   * initial}. Lists contribute each of their elements. Returns {@code initial} for null.
   */
  public static <T> T reduceEachChild(
      @Nullable Node node, BiFunction<T, ? super Node, T> reducer, T initial) {
    if (node == null) {
      return initial;
    }
    T result = initial;
    for (NodeEdge edge : NodeEdges.forKind(node.getKind())) {
      Object value = node.getField(edge.getField());
      if (value instanceof NodeList) {
        for (Node child : (NodeList) value) {
          result = reducer.apply(result, child);
        }
      } else if (value != null) {
        result = reducer.apply(result, (Node) value);
      }
    }
    return result;
  }

  // Lifting

  /**
   * Turns statements into one statement: the statement itself if there is exactly one, otherwise a
   * block holding all of them.
   */
  public static Node liftToBlock(List<Node> nodes) {
    for (Node node : nodes) {
      if (!node.getKind().isStatement()) {
        throw InvariantViolation.create(
            Kind.UNEXPECTED_NODE, "Cannot lift %s to a block", node);
      }
    }
    return nodes.size() == 1 ? nodes.get(0) : IR.block(NodeList.create(nodes), false);
  }

  /** Returns the only node of {@code nodes}, or null if there is none. */
  static @Nullable Node extractSingleNode(List<Node> nodes) {
    if (nodes.size() > 1) {
      throw InvariantViolation.create(
          Kind.UNEXPECTED_NODE, "Too many nodes written to output: %s", nodes);
    }
    return nodes.isEmpty() ? null : nodes.get(0);
  }

  // Checks

  private void failNotOptional(Node node) {
    if (assertionLevel.isAtLeast(AssertionLevel.NORMAL)) {
      throw InvariantViolation.create(Kind.NOT_OPTIONAL, "Node not optional: %s", node);
    }
  }

  /** Checks every child of a rebuilt node against its edge, including children nobody replaced. */
  private void assertEdges(Node node) {
    for (NodeEdge edge : NodeEdges.forKind(node.getKind())) {
      Field field = edge.getField();
      if (field.isList()) {
        NodeList children = node.getChildList(field);
        if (children != null) {
          for (Node child : children) {
            assertNode(child, edge.getTest());
          }
        }
        continue;
      }
      Node child = node.getChild(field);
      if (child != null) {
        assertNode(child, edge.getTest());
      } else if (!edge.isOptional()) {
        throw InvariantViolation.create(
            Kind.NOT_OPTIONAL, "Node %s is missing its %s", node, field);
      }
    }
  }

  private void assertNode(Node node, Predicate<? super Node> test) {
    if (assertionLevel.isAtLeast(AssertionLevel.NORMAL) && !test.test(node)) {
      throw InvariantViolation.create(
          Kind.UNEXPECTED_NODE, "Node %s did not pass test '%s'", node, test);
    }
  }
}
