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

import com.google.javascript.lowering.ast.IR;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.NodeFlags;
import com.google.javascript.lowering.ast.NodeList;
import com.google.javascript.lowering.ast.SyntaxKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class StandardLoweringPolicyTest {

  private final StandardLoweringPolicy policy = new StandardLoweringPolicy();

  @Test
  public void testTypeScriptSyntax() {
    assertThat(own(IR.keywordType(SyntaxKind.STRING_KEYWORD)))
        .isEqualTo(TransformFlags.ASSERT_TYPESCRIPT);
    assertThat(own(IR.modifier(SyntaxKind.PUBLIC_KEYWORD)))
        .isEqualTo(TransformFlags.ASSERT_TYPESCRIPT);
    assertThat(own(IR.heritageClause(SyntaxKind.IMPLEMENTS_KEYWORD, NodeList.of())))
        .isEqualTo(TransformFlags.ASSERT_TYPESCRIPT);
    assertThat(own(IR.decorator(IR.identifier("d"))))
        .isEqualTo(TransformFlags.ASSERT_TYPESCRIPT | TransformFlags.CONTAINS_DECORATORS);
  }

  @Test
  public void testExponentiation() {
    Node pow = IR.binary(one(), SyntaxKind.ASTERISK_ASTERISK_TOKEN, one());
    Node assign = IR.binary(IR.identifier("x"), SyntaxKind.ASTERISK_ASTERISK_EQUALS_TOKEN, one());

    assertThat(own(pow)).isEqualTo(TransformFlags.ASSERT_ES2016);
    assertThat(own(assign)).isEqualTo(TransformFlags.ASSERT_ES2016);
    assertThat(own(IR.binary(one(), SyntaxKind.ASTERISK_TOKEN, one())))
        .isEqualTo(TransformFlags.NONE);
  }

  @Test
  public void testDestructuringAssignment() {
    Node assignment = IR.assignment(IR.arrayLiteral(IR.identifier("a")), IR.identifier("b"));

    assertThat(own(assignment))
        .isEqualTo(TransformFlags.ASSERT_ES2015 | TransformFlags.ASSERT_DESTRUCTURING_ASSIGNMENT);
    assertThat(own(IR.assignment(IR.identifier("a"), IR.identifier("b"))))
        .isEqualTo(TransformFlags.NONE);
  }

  @Test
  public void testAsyncAndGenerator() {
    Node async =
        IR.functionDeclaration(
            null,
            NodeList.of(IR.modifier(SyntaxKind.ASYNC_KEYWORD)),
            false,
            IR.identifier("f"),
            null,
            NodeList.of(),
            null,
            IR.block());
    Node generator = IR.functionExpression(null, true, null, null, NodeList.of(), null, IR.block());

    assertThat(own(async))
        .isEqualTo(
            TransformFlags.ASSERT_ES2017
                | TransformFlags.CONTAINS_HOISTED_DECLARATION_OR_COMPLETION);
    assertThat(own(generator)).isEqualTo(TransformFlags.ASSERT_GENERATOR);
    assertThat(own(IR.await(IR.identifier("p")))).isEqualTo(TransformFlags.ASSERT_ES2017);
    assertThat(own(IR.yield(false, null)))
        .isEqualTo(TransformFlags.ASSERT_ES2015 | TransformFlags.CONTAINS_YIELD);
  }

  @Test
  public void testParameters() {
    Node withDefault = IR.parameter(null, null, false, IR.identifier("a"), false, null, one());
    Node property =
        IR.parameter(
            null,
            NodeList.of(IR.modifier(SyntaxKind.PRIVATE_KEYWORD)),
            false,
            IR.identifier("a"),
            false,
            null,
            null);

    assertThat(own(withDefault))
        .isEqualTo(
            TransformFlags.ASSERT_ES2015 | TransformFlags.CONTAINS_DEFAULT_VALUE_ASSIGNMENTS);
    assertThat(own(property))
        .isEqualTo(
            TransformFlags.ASSERT_TYPESCRIPT
                | TransformFlags.CONTAINS_PARAMETER_PROPERTY_ASSIGNMENTS);
  }

  @Test
  public void testBlockScopedDeclarationList() {
    Node let =
        IR.variableDeclarationList(
            NodeList.of(IR.variableDeclaration("x", null)), NodeFlags.LET);

    assertThat(own(let))
        .isEqualTo(
            TransformFlags.ASSERT_ES2015
                | TransformFlags.CONTAINS_BLOCK_SCOPED_BINDING
                | TransformFlags.CONTAINS_HOISTED_DECLARATION_OR_COMPLETION);
  }

  @Test
  public void testCombineSpread() {
    Node call = IR.call(IR.identifier("f"));

    assertThat(policy.combine(call, TransformFlags.NONE, TransformFlags.CONTAINS_SPREAD_ELEMENT))
        .isEqualTo(TransformFlags.ASSERT_ES2015 | TransformFlags.CONTAINS_SPREAD_ELEMENT);
    assertThat(policy.combine(call, TransformFlags.NONE, TransformFlags.NONE))
        .isEqualTo(TransformFlags.NONE);
  }

  @Test
  public void testCombineClassWithPropertyInitializer() {
    Node classDeclaration =
        IR.classDeclaration(null, null, IR.identifier("C"), null, null, NodeList.of());

    int flags =
        policy.combine(
            classDeclaration,
            TransformFlags.ASSERT_ES2015,
            TransformFlags.CONTAINS_PROPERTY_INITIALIZER);

    assertThat(TransformFlags.has(flags, TransformFlags.TYPESCRIPT)).isTrue();
  }

  @Test
  public void testCombineComputedPropertyName() {
    Node name = IR.computedPropertyName(IR.thisKeyword());
    Node literal = IR.objectLiteral(IR.propertyAssignment(name, one()));

    assertThat(
            policy.combine(
                name,
                TransformFlags.CONTAINS_COMPUTED_PROPERTY_NAME,
                TransformFlags.CONTAINS_LEXICAL_THIS))
        .isEqualTo(
            TransformFlags.CONTAINS_COMPUTED_PROPERTY_NAME
                | TransformFlags.CONTAINS_LEXICAL_THIS
                | TransformFlags.CONTAINS_LEXICAL_THIS_IN_COMPUTED_PROPERTY_NAME);
    int literalFlags =
        policy.combine(
            literal,
            TransformFlags.NONE,
            TransformFlags.CONTAINS_COMPUTED_PROPERTY_NAME
                | TransformFlags.CONTAINS_LEXICAL_THIS_IN_COMPUTED_PROPERTY_NAME);
    assertThat(TransformFlags.has(literalFlags, TransformFlags.ES2015)).isTrue();
    assertThat(TransformFlags.has(literalFlags, TransformFlags.CONTAINS_LEXICAL_THIS)).isTrue();
  }

  @Test
  public void testSubtreeExclusions() {
    assertThat(policy.getSubtreeExclusions(SyntaxKind.NUMBER_KEYWORD))
        .isEqualTo(TransformFlags.TYPE_EXCLUDES);
    assertThat(policy.getSubtreeExclusions(SyntaxKind.INTERFACE_DECLARATION))
        .isEqualTo(TransformFlags.TYPE_EXCLUDES);
    assertThat(policy.getSubtreeExclusions(SyntaxKind.ARROW_FUNCTION))
        .isEqualTo(TransformFlags.ARROW_FUNCTION_EXCLUDES);
    assertThat(policy.getSubtreeExclusions(SyntaxKind.CLASS_EXPRESSION))
        .isEqualTo(TransformFlags.CLASS_EXCLUDES);
    assertThat(policy.getSubtreeExclusions(SyntaxKind.BLOCK))
        .isEqualTo(TransformFlags.NODE_EXCLUDES);
  }

  @Test
  public void testLexicalEnvironmentHosts() {
    assertThat(policy.startsNewLexicalEnvironment(IR.sourceFile("a.js"))).isTrue();
    assertThat(
            policy.startsNewLexicalEnvironment(IR.arrowFunction(NodeList.of(), IR.identifier("a"))))
        .isTrue();
    assertThat(
            policy.startsNewLexicalEnvironment(
                IR.moduleDeclaration(null, IR.identifier("M"), IR.moduleBlock())))
        .isTrue();
    assertThat(policy.startsNewLexicalEnvironment(IR.block())).isFalse();
    assertThat(
            policy.startsNewLexicalEnvironment(
                IR.classDeclaration(null, null, IR.identifier("C"), null, null, NodeList.of())))
        .isFalse();
  }

  private int own(Node node) {
    return policy.getOwnFlags(node);
  }

  private static Node one() {
    return IR.numericLiteral("1");
  }
}
