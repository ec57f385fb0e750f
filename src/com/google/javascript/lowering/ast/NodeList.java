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

import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import org.jspecify.annotations.Nullable;

/**
 * An immutable ordered sequence of nodes, such as the statements of a block or the arguments of a
 * call.
 *
 * <p>Besides its elements a list remembers whether the source had a trailing comma and, when it
 * was produced by a parser or derived from such a list, the source range it covers. Editing a list
 * always produces a new instance; an unchanged list is passed around by reference so that callers
 * can detect "nothing changed" with {@code ==}.
 */
public final class NodeList implements Iterable<Node>, TextRange, VisitResult {

  private static final NodeList EMPTY = new NodeList(ImmutableList.of(), false, -1, -1);

  private final ImmutableList<Node> nodes;
  private final boolean hasTrailingComma;
  private final int pos;
  private final int end;

  private NodeList(ImmutableList<Node> nodes, boolean hasTrailingComma, int pos, int end) {
    this.nodes = nodes;
    this.hasTrailingComma = hasTrailingComma;
    this.pos = pos;
    this.end = end;
  }

  public static NodeList of(Node... nodes) {
    return nodes.length == 0 ? EMPTY : create(ImmutableList.copyOf(nodes));
  }

  public static NodeList create(Iterable<Node> nodes) {
    return create(nodes, null, false);
  }

  /**
   * Creates a list.
   *
   * @param nodes the elements
   * @param location a range whose position the new list takes over, if any
   * @param hasTrailingComma whether the list ends with a separator
   */
  public static NodeList create(
      Iterable<Node> nodes, @Nullable TextRange location, boolean hasTrailingComma) {
    return new NodeList(
        ImmutableList.copyOf(nodes),
        hasTrailingComma,
        location != null ? location.getPos() : -1,
        location != null ? location.getEnd() : -1);
  }

  /** Returns a new list with {@code additions} appended, keeping this list's position. */
  public NodeList concat(Iterable<Node> additions) {
    return new NodeList(
        ImmutableList.<Node>builder().addAll(nodes).addAll(additions).build(),
        hasTrailingComma,
        pos,
        end);
  }

  public int size() {
    return nodes.size();
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  public Node get(int index) {
    return nodes.get(index);
  }

  public boolean hasTrailingComma() {
    return hasTrailingComma;
  }

  @Override
  public int getPos() {
    return pos;
  }

  @Override
  public int getEnd() {
    return end;
  }

  @Override
  public ImmutableList<Node> asList() {
    return nodes;
  }

  @Override
  public Iterator<Node> iterator() {
    return nodes.iterator();
  }

  @Override
  public String toString() {
    return nodes.toString();
  }
}
