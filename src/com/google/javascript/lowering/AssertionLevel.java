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

/** How much checking the rewriter does on the results of a visitor. */
public enum AssertionLevel {
  /** No gated checks: a missing required node is dropped and a wrong kind is accepted. */
  NONE,
  /** Replacements are checked: required nodes stay and each passes the test of its edge. */
  NORMAL,
  /** Also tests the list elements a visitor kept, not only the ones it replaced. */
  AGGRESSIVE,
  /** Also checks every child of each rebuilt node against the schema. */
  VERY_AGGRESSIVE;

  /** Whether checks that require {@code level} run at this level. */
  public boolean isAtLeast(AssertionLevel level) {
    return compareTo(level) >= 0;
  }
}
