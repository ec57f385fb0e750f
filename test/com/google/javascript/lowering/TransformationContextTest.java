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
import com.google.javascript.lowering.ast.NodeList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TransformationContextTest {

  @Test
  public void testTempNames() {
    TransformationContext context = new TransformationContext(new RewriterOptions());

    assertThat(context.newTempName()).isEqualTo("_a");
    assertThat(context.newTempName()).isEqualTo("_b");
    for (int i = 2; i < 26; i++) {
      context.newTempName();
    }
    assertThat(context.newTempName()).isEqualTo("_0");
    assertThat(context.newTempName()).isEqualTo("_1");
  }

  @Test
  public void testTempPrefix() {
    RewriterOptions options = new RewriterOptions();
    options.setTempVariablePrefix("$tmp");
    TransformationContext context = new TransformationContext(options);

    assertThat(context.newTempName()).isEqualTo("$tmpa");
  }

  @Test
  public void testCreateTempVariableHoistsIntoInnermostFrame() {
    TransformationContext context = new TransformationContext(new RewriterOptions());
    LexicalEnvironment environment = context.getEnvironment();
    environment.start();
    environment.start();

    Node temp = context.createTempVariable();

    assertThat(temp.isIdentifier()).isTrue();
    assertThat(temp.getString()).isEqualTo("_a");
    assertThat(environment.end()).hasSize(1);
    assertThat(environment.end()).isEmpty();
  }

  @Test
  public void testHoistFunctionDeclaration() {
    TransformationContext context = new TransformationContext(new RewriterOptions());
    Node function = IR.functionDeclaration("f", NodeList.of(), IR.block());
    context.getEnvironment().start();

    context.hoistFunctionDeclaration(function);
    context.hoistVariableDeclaration("x");

    assertThat(context.getEnvironment().end().get(0)).isSameInstanceAs(function);
  }

  @Test
  public void testVisitEachChildUsesContextEnvironment() {
    TransformationContext context = new TransformationContext(new RewriterOptions());
    Node file = IR.sourceFile("a.js", IR.expressionStatement(IR.identifier("a")));

    Node result =
        context.visitEachChild(
            file,
            node -> {
              context.createTempVariable();
              return node;
            });

    assertThat(result.getStatements().size()).isEqualTo(2);
    assertThat(result.getStatements().get(1).toStringTree()).contains("(IDENTIFIER _a)");
    assertThat(context.getEnvironment().isEmpty()).isTrue();
    assertThat(context.getRewriter().getAssertionLevel()).isEqualTo(AssertionLevel.NORMAL);
  }
}
