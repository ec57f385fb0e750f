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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.javascript.lowering.ast.Field;
import com.google.javascript.lowering.ast.IR;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.NodeList;
import com.google.javascript.lowering.ast.NodePredicate;
import com.google.javascript.lowering.ast.SyntaxKind;
import java.util.EnumSet;
import java.util.Set;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeEdgesTest {

  @Test
  public void testLeavesHaveNoEdges() {
    assertThat(NodeEdges.hasSchema(SyntaxKind.IDENTIFIER)).isFalse();
    assertThat(NodeEdges.forKind(SyntaxKind.IDENTIFIER)).isEmpty();
    assertThat(NodeEdges.forKind(SyntaxKind.PLUS_TOKEN)).isEmpty();
  }

  @Test
  public void testEdgesAreInSourceOrder() {
    assertThat(Lists.transform(NodeEdges.forKind(SyntaxKind.FOR_STATEMENT), NodeEdge::getField))
        .containsExactly(Field.INITIALIZER, Field.CONDITION, Field.INCREMENTOR, Field.STATEMENT)
        .inOrder();
  }

  @Test
  public void testNoFieldIsListedTwice() {
    for (SyntaxKind kind : SyntaxKind.values()) {
      Set<Field> fields = EnumSet.noneOf(Field.class);
      for (NodeEdge edge : NodeEdges.forKind(kind)) {
        assertThat(fields.add(edge.getField())).isTrue();
      }
    }
  }

  @Test
  public void testListEdgesAreNotLifted() {
    for (SyntaxKind kind : SyntaxKind.values()) {
      for (NodeEdge edge : NodeEdges.forKind(kind)) {
        if (edge.getField().isList()) {
          assertThat(edge.getLift()).isNull();
        }
      }
    }
  }

  @Test
  public void testGetEdge() {
    NodeEdge elseEdge = NodeEdges.getEdge(SyntaxKind.IF_STATEMENT, Field.ELSE_STATEMENT);
    NodeEdge thenEdge = NodeEdges.getEdge(SyntaxKind.IF_STATEMENT, Field.THEN_STATEMENT);

    assertThat(elseEdge.isOptional()).isTrue();
    assertThat(elseEdge.getLift()).isNotNull();
    assertThat(elseEdge.getTest()).isEqualTo(NodePredicate.STATEMENT);
    assertThat(thenEdge.isOptional()).isFalse();
  }

  @Test
  public void testGetMissingEdge() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> NodeEdges.getEdge(SyntaxKind.BLOCK, Field.EXPRESSION));
    assertThat(e).hasMessageThat().isEqualTo("No edge EXPRESSION on BLOCK");
  }

  @Test
  public void testArrowBody() {
    NodeEdge body = NodeEdges.getEdge(SyntaxKind.ARROW_FUNCTION, Field.BODY);
    Node arrow = IR.arrowFunction(NodeList.of(), IR.block());

    assertThat(body.getTest()).isEqualTo(NodePredicate.CONCISE_BODY);
    assertThat(body.getParenthesize().parenthesize(IR.objectLiteral(), arrow).getKind())
        .isEqualTo(SyntaxKind.PARENTHESIZED_EXPRESSION);
    assertThat(body.getLift().lift(ImmutableList.of()).isBlock())
        .isTrue();
  }

  @Test
  public void testBinaryOperandsUseParentOperator() {
    Node product = IR.binary(IR.identifier("a"), SyntaxKind.ASTERISK_TOKEN, IR.identifier("b"));
    Node sum = IR.binary(IR.identifier("c"), SyntaxKind.PLUS_TOKEN, IR.identifier("d"));
    NodeEdge left = NodeEdges.getEdge(SyntaxKind.BINARY_EXPRESSION, Field.LEFT);
    NodeEdge right = NodeEdges.getEdge(SyntaxKind.BINARY_EXPRESSION, Field.RIGHT);

    assertThat(left.getParenthesize().parenthesize(sum, product).getKind())
        .isEqualTo(SyntaxKind.PARENTHESIZED_EXPRESSION);
    assertThat(right.getParenthesize().parenthesize(product, sum)).isSameInstanceAs(product);
  }

  @Test
  public void testCallArgumentsAreParenthesizedForList() {
    Node call = IR.call(IR.identifier("f"));
    Node comma = IR.comma(IR.identifier("a"), IR.identifier("b"));
    NodeEdge arguments = NodeEdges.getEdge(SyntaxKind.CALL_EXPRESSION, Field.ARGUMENTS);

    assertThat(arguments.getParenthesize().parenthesize(comma, call).getKind())
        .isEqualTo(SyntaxKind.PARENTHESIZED_EXPRESSION);
  }
}
