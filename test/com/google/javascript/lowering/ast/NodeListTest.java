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

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeListTest {

  @Test
  public void testEmptyListsAreShared() {
    assertThat(NodeList.of()).isSameInstanceAs(NodeList.of());
    assertThat(NodeList.of().isEmpty()).isTrue();
  }

  @Test
  public void testCreateTakesPositionFromLocation() {
    Node a = IR.identifier("a");
    NodeList location = NodeList.create(ImmutableList.of(a), rangeOf(3, 9), true);

    NodeList list = NodeList.create(ImmutableList.of(a), location, false);

    assertThat(list.getPos()).isEqualTo(3);
    assertThat(list.getEnd()).isEqualTo(9);
    assertThat(list.hasTrailingComma()).isFalse();
  }

  @Test
  public void testCreateWithoutLocationHasNoPosition() {
    NodeList list = NodeList.of(IR.identifier("a"));

    assertThat(list.getPos()).isEqualTo(-1);
    assertThat(list.getEnd()).isEqualTo(-1);
  }

  @Test
  public void testConcatKeepsPositionAndTrailingComma() {
    Node a = IR.identifier("a");
    Node b = IR.identifier("b");
    NodeList list = NodeList.create(ImmutableList.of(a), rangeOf(0, 4), true);

    NodeList result = list.concat(ImmutableList.of(b));

    assertThat(result.asList()).containsExactly(a, b).inOrder();
    assertThat(result.getPos()).isEqualTo(0);
    assertThat(result.getEnd()).isEqualTo(4);
    assertThat(result.hasTrailingComma()).isTrue();
    assertThat(list.asList()).containsExactly(a);
  }

  @Test
  public void testListIsImmutable() {
    NodeList list = NodeList.of(IR.identifier("a"));

    assertThrows(UnsupportedOperationException.class, () -> list.asList().add(IR.identifier("b")));
  }

  @Test
  public void testIteratesInOrder() {
    Node a = IR.identifier("a");
    Node b = IR.identifier("b");

    assertThat(NodeList.of(a, b)).containsExactly(a, b).inOrder();
    assertThat(NodeList.of(a, b).get(1)).isSameInstanceAs(b);
  }

  private static TextRange rangeOf(int pos, int end) {
    Node node = IR.identifier("range");
    node.setSourceRange(pos, end);
    return node;
  }
}
