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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class IRTest {

  @Test
  public void testFactoriesCheckChildKinds() {
    Node statement = IR.emptyStatement();

    IllegalStateException e =
        assertThrows(
            IllegalStateException.class, () -> IR.binary(statement, SyntaxKind.PLUS_TOKEN, one()));
    assertThat(e).hasMessageThat().contains("Unexpected node EMPTY_STATEMENT");
    assertThrows(IllegalStateException.class, () -> IR.block(IR.identifier("a")));
    assertThrows(IllegalStateException.class, () -> IR.expressionStatement(statement));
  }

  @Test
  public void testBinaryRejectsNonOperator() {
    assertThrows(
        IllegalArgumentException.class,
        () -> IR.binary(one(), SyntaxKind.IDENTIFIER, one()));
  }

  @Test
  public void testIdentifierRejectsEmptyName() {
    assertThrows(IllegalArgumentException.class, () -> IR.identifier(""));
  }

  @Test
  public void testVar() {
    Node var = IR.var("x", one());

    assertThat(var.toStringTree())
        .isEqualTo(
            "(VARIABLE_STATEMENT (VARIABLE_DECLARATION_LIST"
                + " (VARIABLE_DECLARATION (IDENTIFIER x) (NUMERIC_LITERAL 1))))");
  }

  @Test
  public void testGetMutableClone() {
    Node original = IR.expressionStatement(IR.identifier("a"));
    original.setSourceRange(2, 4);
    original.setTransformFlags(7);

    Node clone = IR.getMutableClone(original);

    assertThat(clone).isNotSameInstanceAs(original);
    assertThat(clone.getOriginal()).isSameInstanceAs(original);
    assertThat(clone.getExpression()).isSameInstanceAs(original.getExpression());
    assertThat(clone.getPos()).isEqualTo(2);
    assertThat(clone.getEnd()).isEqualTo(4);
    assertThat(clone.getTransformFlags()).isEqualTo(0);
  }

  @Test
  public void testUpdateReturnsSameNodeWhenChildrenAreIdentical() {
    Node left = IR.identifier("a");
    Node right = IR.identifier("b");
    Node binary = IR.binary(left, SyntaxKind.PLUS_TOKEN, right);

    assertThat(IR.updateBinary(binary, left, right)).isSameInstanceAs(binary);
  }

  @Test
  public void testUpdateRecordsOriginalAndPosition() {
    Node left = IR.identifier("a");
    Node binary = IR.binary(left, SyntaxKind.PLUS_TOKEN, IR.identifier("b"));
    binary.setSourceRange(10, 15);
    Node replacement = IR.identifier("c");

    Node updated = IR.updateBinary(binary, left, replacement);

    assertThat(updated).isNotSameInstanceAs(binary);
    assertThat(updated.getOperator()).isEqualTo(SyntaxKind.PLUS_TOKEN);
    assertThat(updated.getLeft()).isSameInstanceAs(left);
    assertThat(updated.getRight()).isSameInstanceAs(replacement);
    assertThat(updated.getOriginal()).isSameInstanceAs(binary);
    assertThat(updated.getPos()).isEqualTo(10);
    assertThat(updated.getEnd()).isEqualTo(15);
  }

  @Test
  public void testUpdateBlockKeepsMultiLine() {
    Node block = IR.block(NodeList.of(IR.emptyStatement()), true);

    Node updated = IR.updateBlock(block, NodeList.of(IR.emptyStatement(), IR.emptyStatement()));

    assertThat(updated.isMultiLine()).isTrue();
    assertThat(updated.getStatements().size()).isEqualTo(2);
  }

  @Test
  public void testUpdateSourceFileKeepsFileName() {
    Node file = IR.sourceFile("a.ts", IR.emptyStatement());

    Node updated = IR.updateSourceFile(file, NodeList.of());

    assertThat(updated.getFileName()).isEqualTo("a.ts");
    assertThat(updated.getStatements().isEmpty()).isTrue();
    assertThat(updated.getOriginal()).isSameInstanceAs(file);
  }

  @Test
  public void testUpdateKeepsStartsOnNewLine() {
    Node statement = IR.expressionStatement(IR.identifier("a"));
    statement.setStartsOnNewLine(true);

    Node updated = IR.updateExpressionStatement(statement, IR.identifier("b"));

    assertThat(updated).isNotSameInstanceAs(statement);
    assertThat(updated.startsOnNewLine()).isTrue();
  }

  @Test
  public void testUpdateMethodKeepsQuestion() {
    Node method =
        IR.method(null, null, false, IR.identifier("m"), null, NodeList.of(), null, IR.block());
    method.setQuestion(true);

    Node updated =
        IR.updateMethod(
            method,
            null,
            null,
            method.getName(),
            null,
            method.getParameters(),
            null,
            IR.block(IR.emptyStatement()));

    assertThat(updated).isNotSameInstanceAs(method);
    assertThat(updated.hasQuestion()).isTrue();
    assertThat(updated.getOriginal()).isSameInstanceAs(method);
  }

  @Test
  public void testUpdateNodeWithSameNode() {
    Node node = IR.identifier("a");

    assertThat(IR.updateNode(node, node)).isSameInstanceAs(node);
    assertThat(node.getOriginal()).isNull();
  }

  private static Node one() {
    return IR.numericLiteral("1");
  }
}
