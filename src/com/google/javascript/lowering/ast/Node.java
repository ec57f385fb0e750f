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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.EnumMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A node of the syntax tree.
 *
 * <p>Every node has a {@link SyntaxKind}. Its children live in {@link Field} slots, each holding a
 * node or a {@link NodeList}; everything else (identifier text, operator, formatting hints) is
 * metadata stored as a {@link Prop}. Nodes are mutable, but a node that is already part of a tree
 * must not be edited in place: the rewriter clones it with {@link IR#getMutableClone} and edits the
 * clone, so subtrees that did not change keep their identity.
 *
 * <p>Each node also caches the transform flags of its subtree. Changing a child clears the cache.
 */
public class Node implements TextRange, VisitResult {

  enum Prop {
    // Identifier name or literal text
    TEXT,
    // Operator of a binary, prefix or postfix expression (a SyntaxKind)
    OPERATOR,
    // Formatting hint for blocks and literals
    MULTI_LINE,
    // Formatting hint set by TreeRewriter.addNode
    START_ON_NEW_LINE,
    // Generator functions and methods, yield*
    ASTERISK,
    // Rest parameters and rest binding elements
    DOT_DOT_DOT,
    // Optional parameters and properties
    QUESTION,
    // NodeFlags of a variable declaration list
    NODE_FLAGS,
    // "extends" or "implements" of a heritage clause (a SyntaxKind)
    HERITAGE_TOKEN,
    // File name of a source file
    FILE_NAME
  }

  private final SyntaxKind kind;
  private final EnumMap<Field, Object> fields = new EnumMap<>(Field.class);
  private final EnumMap<Prop, Object> props = new EnumMap<>(Prop.class);
  private int transformFlags;
  private @Nullable Node original;
  private int pos = -1;
  private int end = -1;

  public Node(SyntaxKind kind) {
    this.kind = checkNotNull(kind);
  }

  public final SyntaxKind getKind() {
    return kind;
  }

  // Children

  /** Returns the value of a field: a {@link Node}, a {@link NodeList} or null. */
  public final @Nullable Object getField(Field field) {
    return fields.get(field);
  }

  public final @Nullable Node getChild(Field field) {
    checkArgument(!field.isList(), "%s is a list field", field);
    return (Node) fields.get(field);
  }

  public final @Nullable NodeList getChildList(Field field) {
    checkArgument(field.isList(), "%s is not a list field", field);
    return (NodeList) fields.get(field);
  }

  /**
   * Sets or clears a field. The value must be a {@link NodeList} for list fields and a {@link Node}
   * otherwise. Clears the cached transform flags of this node.
   */
  public final void setField(Field field, @Nullable Object value) {
    if (value == null) {
      fields.remove(field);
    } else {
      checkArgument(
          field.isList() ? value instanceof NodeList : value instanceof Node,
          "Bad value for %s: %s",
          field,
          value);
      fields.put(field, value);
    }
    transformFlags = 0;
  }

  /** Whether any field of this node holds a value. */
  public final boolean hasFields() {
    return !fields.isEmpty();
  }

  public final @Nullable NodeList getDecorators() {
    return getChildList(Field.DECORATORS);
  }

  public final @Nullable NodeList getModifiers() {
    return getChildList(Field.MODIFIERS);
  }

  public final @Nullable Node getName() {
    return getChild(Field.NAME);
  }

  public final @Nullable Node getExpression() {
    return getChild(Field.EXPRESSION);
  }

  public final @Nullable NodeList getTypeParameters() {
    return getChildList(Field.TYPE_PARAMETERS);
  }

  public final @Nullable NodeList getParameters() {
    return getChildList(Field.PARAMETERS);
  }

  public final @Nullable Node getType() {
    return getChild(Field.TYPE);
  }

  public final @Nullable Node getInitializer() {
    return getChild(Field.INITIALIZER);
  }

  public final @Nullable Node getBody() {
    return getChild(Field.BODY);
  }

  public final @Nullable NodeList getStatements() {
    return getChildList(Field.STATEMENTS);
  }

  public final @Nullable Node getLeft() {
    return getChild(Field.LEFT);
  }

  public final @Nullable Node getRight() {
    return getChild(Field.RIGHT);
  }

  public final @Nullable NodeList getTypeArguments() {
    return getChildList(Field.TYPE_ARGUMENTS);
  }

  public final @Nullable NodeList getArguments() {
    return getChildList(Field.ARGUMENTS);
  }

  public final @Nullable Node getDeclarationList() {
    return getChild(Field.DECLARATION_LIST);
  }

  public final @Nullable NodeList getDeclarations() {
    return getChildList(Field.DECLARATIONS);
  }

  public final @Nullable Node getThenStatement() {
    return getChild(Field.THEN_STATEMENT);
  }

  public final @Nullable Node getElseStatement() {
    return getChild(Field.ELSE_STATEMENT);
  }

  public final @Nullable Node getArgumentExpression() {
    return getChild(Field.ARGUMENT_EXPRESSION);
  }

  // Metadata

  final @Nullable Object getProp(Prop prop) {
    return props.get(prop);
  }

  final void putProp(Prop prop, @Nullable Object value) {
    if (value == null) {
      props.remove(prop);
    } else {
      props.put(prop, value);
    }
  }

  private boolean getBooleanProp(Prop prop) {
    return props.containsKey(prop);
  }

  private void putBooleanProp(Prop prop, boolean value) {
    putProp(prop, value ? Boolean.TRUE : null);
  }

  /** Returns the text of an identifier, literal or template fragment. */
  public final String getString() {
    Object text = props.get(Prop.TEXT);
    checkState(text != null, "%s has no text", this);
    return (String) text;
  }

  public final void setString(String text) {
    putProp(Prop.TEXT, checkNotNull(text));
  }

  /** Returns the operator token kind of a binary, prefix or postfix expression. */
  public final SyntaxKind getOperator() {
    Object operator = props.get(Prop.OPERATOR);
    checkState(operator != null, "%s has no operator", this);
    return (SyntaxKind) operator;
  }

  public final void setOperator(SyntaxKind operator) {
    putProp(Prop.OPERATOR, checkNotNull(operator));
  }

  public final boolean isMultiLine() {
    return getBooleanProp(Prop.MULTI_LINE);
  }

  public final void setMultiLine(boolean multiLine) {
    putBooleanProp(Prop.MULTI_LINE, multiLine);
  }

  public final boolean startsOnNewLine() {
    return getBooleanProp(Prop.START_ON_NEW_LINE);
  }

  public final void setStartsOnNewLine(boolean value) {
    putBooleanProp(Prop.START_ON_NEW_LINE, value);
  }

  public final boolean hasAsterisk() {
    return getBooleanProp(Prop.ASTERISK);
  }

  public final void setAsterisk(boolean value) {
    putBooleanProp(Prop.ASTERISK, value);
  }

  public final boolean hasDotDotDot() {
    return getBooleanProp(Prop.DOT_DOT_DOT);
  }

  public final void setDotDotDot(boolean value) {
    putBooleanProp(Prop.DOT_DOT_DOT, value);
  }

  public final boolean hasQuestion() {
    return getBooleanProp(Prop.QUESTION);
  }

  public final void setQuestion(boolean value) {
    putBooleanProp(Prop.QUESTION, value);
  }

  /** Returns the {@link NodeFlags} of a variable declaration list. */
  public final int getNodeFlags() {
    Object flags = props.get(Prop.NODE_FLAGS);
    return flags == null ? NodeFlags.NONE : (Integer) flags;
  }

  public final void setNodeFlags(int flags) {
    putProp(Prop.NODE_FLAGS, flags == NodeFlags.NONE ? null : flags);
  }

  public final @Nullable SyntaxKind getHeritageToken() {
    return (SyntaxKind) props.get(Prop.HERITAGE_TOKEN);
  }

  public final void setHeritageToken(SyntaxKind token) {
    checkArgument(
        token == SyntaxKind.EXTENDS_KEYWORD || token == SyntaxKind.IMPLEMENTS_KEYWORD, token);
    putProp(Prop.HERITAGE_TOKEN, token);
  }

  public final @Nullable String getFileName() {
    return (String) props.get(Prop.FILE_NAME);
  }

  public final void setFileName(String fileName) {
    putProp(Prop.FILE_NAME, checkNotNull(fileName));
  }

  /** Returns the union of the {@link ModifierFlags} of this node's modifier keywords. */
  public final int getModifierFlags() {
    NodeList modifiers = getModifiers();
    if (modifiers == null) {
      return ModifierFlags.NONE;
    }
    int flags = ModifierFlags.NONE;
    for (Node modifier : modifiers) {
      flags |= ModifierFlags.fromKind(modifier.getKind());
    }
    return flags;
  }

  /** Whether this node carries any of the given {@link ModifierFlags}. */
  public final boolean hasModifier(int flags) {
    return (getModifierFlags() & flags) != 0;
  }

  // Transform flags

  /** Returns the cached transform flags of this node, or 0 if they have not been computed. */
  public final int getTransformFlags() {
    return transformFlags;
  }

  public final void setTransformFlags(int transformFlags) {
    this.transformFlags = transformFlags;
  }

  // Provenance and position

  /** Returns the node this node was derived from by a transformation, if any. */
  public final @Nullable Node getOriginal() {
    return original;
  }

  public final void setOriginal(@Nullable Node original) {
    this.original = original;
  }

  /** Follows {@link #getOriginal()} to the node that started the chain. */
  public final Node getOriginalNode() {
    Node node = this;
    while (node.original != null) {
      node = node.original;
    }
    return node;
  }

  @Override
  public final int getPos() {
    return pos;
  }

  @Override
  public final int getEnd() {
    return end;
  }

  public final void setSourceRange(int pos, int end) {
    checkArgument(pos <= end, "Bad range %s..%s", pos, end);
    this.pos = pos;
    this.end = end;
  }

  /** Copies the source range of {@code location}, if there is one. */
  public final void setSourceRange(@Nullable TextRange location) {
    if (location != null) {
      this.pos = location.getPos();
      this.end = location.getEnd();
    }
  }

  /**
   * Returns a new node of the same kind with the same fields, metadata and position. Children are
   * shared, not copied. The copy has no cached transform flags.
   */
  Node shallowCopy() {
    Node copy = new Node(kind);
    copy.fields.putAll(fields);
    copy.props.putAll(props);
    copy.pos = pos;
    copy.end = end;
    return copy;
  }

  // Kind tests

  public final boolean isIdentifier() {
    return kind == SyntaxKind.IDENTIFIER;
  }

  public final boolean isBlock() {
    return kind == SyntaxKind.BLOCK;
  }

  public final boolean isSourceFile() {
    return kind == SyntaxKind.SOURCE_FILE;
  }

  public final boolean isArrowFunction() {
    return kind == SyntaxKind.ARROW_FUNCTION;
  }

  public final boolean isBinaryExpression() {
    return kind == SyntaxKind.BINARY_EXPRESSION;
  }

  public final boolean isPropertyAccess() {
    return kind == SyntaxKind.PROPERTY_ACCESS_EXPRESSION;
  }

  public final boolean isElementAccess() {
    return kind == SyntaxKind.ELEMENT_ACCESS_EXPRESSION;
  }

  public final boolean isCall() {
    return kind == SyntaxKind.CALL_EXPRESSION;
  }

  public final boolean isNew() {
    return kind == SyntaxKind.NEW_EXPRESSION;
  }

  public final boolean isReturnStatement() {
    return kind == SyntaxKind.RETURN_STATEMENT;
  }

  public final boolean isModuleBlock() {
    return kind == SyntaxKind.MODULE_BLOCK;
  }

  public final boolean isBindingPattern() {
    return kind == SyntaxKind.OBJECT_BINDING_PATTERN || kind == SyntaxKind.ARRAY_BINDING_PATTERN;
  }

  // VisitResult

  @Override
  public final ImmutableList<Node> asList() {
    return ImmutableList.of(this);
  }

  // Debugging

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendHeader(sb);
    return sb.toString();
  }

  /** Renders this subtree as a one-line S-expression, children in {@link Field} order. */
  public final String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendTree(sb);
    return sb.toString();
  }

  private void appendHeader(StringBuilder sb) {
    sb.append(kind);
    Object text = props.get(Prop.TEXT);
    if (text != null) {
      sb.append(' ').append(text);
    }
    Object operator = props.get(Prop.OPERATOR);
    if (operator != null) {
      sb.append(' ').append(((SyntaxKind) operator).getText());
    }
  }

  private void appendTree(StringBuilder sb) {
    sb.append('(');
    appendHeader(sb);
    for (Map.Entry<Field, Object> entry : fields.entrySet()) {
      if (entry.getValue() instanceof NodeList) {
        for (Node child : (NodeList) entry.getValue()) {
          sb.append(' ');
          child.appendTree(sb);
        }
      } else {
        sb.append(' ');
        ((Node) entry.getValue()).appendTree(sb);
      }
    }
    sb.append(')');
  }
}
