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
import com.google.javascript.lowering.InvariantViolation.Kind;
import com.google.javascript.lowering.ast.IR;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.NodeList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LexicalEnvironmentMergerTest {

  private static final ImmutableList<Node> NONE = ImmutableList.of();

  @Test
  public void testNothingToMerge() {
    Node file = IR.sourceFile("a.js", statement("a"));
    Node body = IR.block();

    assertThat(LexicalEnvironmentMerger.mergeLexicalEnvironment(file, NONE)).isSameInstanceAs(file);
    assertThat(LexicalEnvironmentMerger.mergeFunctionBody(body, NONE)).isSameInstanceAs(body);
    assertThat(LexicalEnvironmentMerger.mergeFunctionBody(null, NONE)).isNull();
    assertThat(LexicalEnvironmentMerger.mergeConciseBody(IR.identifier("a"), NONE).isIdentifier())
        .isTrue();
  }

  @Test
  public void testMergeIntoSourceFileAppends() {
    Node existing = statement("a");
    Node file = IR.sourceFile("a.js", existing);
    Node declaration = statement("b");

    Node merged =
        LexicalEnvironmentMerger.mergeLexicalEnvironment(file, ImmutableList.of(declaration));

    assertThat(merged).isNotSameInstanceAs(file);
    assertThat(merged.getOriginal()).isSameInstanceAs(file);
    assertThat(merged.getStatements().asList()).containsExactly(existing, declaration).inOrder();
    assertThat(file.getStatements().asList()).containsExactly(existing);
  }

  @Test
  public void testMergeIntoFunctionLikeBody() {
    Node declaration = statement("b");
    Node function =
        IR.functionExpression(NodeList.of(), IR.block(IR.returnStatement(IR.identifier("a"))));

    Node merged =
        LexicalEnvironmentMerger.mergeLexicalEnvironment(function, ImmutableList.of(declaration));

    assertThat(merged.getBody().toStringTree())
        .isEqualTo(
            "(BLOCK (RETURN_STATEMENT (IDENTIFIER a)) (EXPRESSION_STATEMENT (IDENTIFIER b)))");
  }

  @Test
  public void testMergeIntoArrowExpressionBody() {
    Node expression = IR.identifier("a");
    expression.setSourceRange(6, 7);
    Node arrow = IR.arrowFunction(NodeList.of(), expression);

    Node merged =
        LexicalEnvironmentMerger.mergeLexicalEnvironment(arrow, ImmutableList.of(statement("b")));

    Node body = merged.getBody();
    assertThat(body.isMultiLine()).isTrue();
    assertThat(body.getPos()).isEqualTo(6);
    assertThat(body.getEnd()).isEqualTo(7);
    assertThat(body.getStatements().get(0).getPos()).isEqualTo(6);
    assertThat(body.toStringTree())
        .isEqualTo(
            "(BLOCK (RETURN_STATEMENT (IDENTIFIER a)) (EXPRESSION_STATEMENT (IDENTIFIER b)))");
  }

  @Test
  public void testMergeIntoModule() {
    Node module = IR.moduleDeclaration(null, IR.identifier("M"), IR.moduleBlock());

    Node merged =
        LexicalEnvironmentMerger.mergeLexicalEnvironment(module, ImmutableList.of(statement("b")));

    assertThat(merged.getBody().toStringTree())
        .isEqualTo("(MODULE_BLOCK (EXPRESSION_STATEMENT (IDENTIFIER b)))");
  }

  @Test
  public void testModuleWithoutBlock() {
    Node inner = IR.moduleDeclaration(null, IR.identifier("B"), IR.moduleBlock());
    Node module = IR.moduleDeclaration(null, IR.identifier("A"), inner);

    InvariantViolation e =
        assertThrows(
            InvariantViolation.class,
            () ->
                LexicalEnvironmentMerger.mergeLexicalEnvironment(
                    module, ImmutableList.of(statement("b"))));
    assertThat(e.getKind()).isEqualTo(Kind.INVALID_ENVIRONMENT_HOST);
  }

  @Test
  public void testFunctionWithoutBody() {
    Node overload =
        IR.functionDeclaration(
            null, null, false, IR.identifier("f"), null, NodeList.of(), null, null);

    InvariantViolation e =
        assertThrows(
            InvariantViolation.class,
            () ->
                LexicalEnvironmentMerger.mergeLexicalEnvironment(
                    overload, ImmutableList.of(statement("b"))));
    assertThat(e.getKind()).isEqualTo(Kind.INVALID_ENVIRONMENT_HOST);
    assertThrows(
        InvariantViolation.class,
        () -> LexicalEnvironmentMerger.mergeFunctionBody(null, ImmutableList.of(statement("b"))));
  }

  @Test
  public void testInvalidHost() {
    InvariantViolation e =
        assertThrows(
            InvariantViolation.class,
            () ->
                LexicalEnvironmentMerger.mergeLexicalEnvironment(
                    IR.block(), ImmutableList.of(statement("b"))));
    assertThat(e.getKind()).isEqualTo(Kind.INVALID_ENVIRONMENT_HOST);
    assertThat(e).hasMessageThat().isEqualTo("Node is not a valid lexical environment: BLOCK");
  }

  @Test
  public void testMergeStatements() {
    Node a = statement("a");
    Node b = statement("b");
    NodeList statements = NodeList.of(a);

    assertThat(LexicalEnvironmentMerger.mergeStatements(statements, NONE))
        .isSameInstanceAs(statements);
    assertThat(LexicalEnvironmentMerger.mergeStatements(null, ImmutableList.of(b)).asList())
        .containsExactly(b);
    assertThat(LexicalEnvironmentMerger.mergeStatements(statements, ImmutableList.of(b)).asList())
        .containsExactly(a, b)
        .inOrder();
  }

  private static Node statement(String name) {
    return IR.expressionStatement(IR.identifier(name));
  }
}
