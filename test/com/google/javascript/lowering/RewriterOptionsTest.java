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

import java.util.Properties;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RewriterOptionsTest {

  @Test
  public void testDefaults() {
    RewriterOptions options = new RewriterOptions();

    assertThat(options.getAssertionLevel()).isEqualTo(AssertionLevel.NORMAL);
    assertThat(options.getTempVariablePrefix()).isEqualTo("_");
    assertThat(options.getLoweringPolicy()).isInstanceOf(StandardLoweringPolicy.class);
  }

  @Test
  public void testFromEmptyProperties() {
    RewriterOptions options = RewriterOptions.fromProperties(new Properties());

    assertThat(options.getAssertionLevel()).isEqualTo(AssertionLevel.NORMAL);
    assertThat(options.getTempVariablePrefix()).isEqualTo("_");
  }

  @Test
  public void testFromProperties() {
    Properties properties = new Properties();
    properties.setProperty(RewriterOptions.ASSERTION_LEVEL_PROPERTY, " very_aggressive ");
    properties.setProperty(RewriterOptions.TEMP_PREFIX_PROPERTY, "$t ");

    RewriterOptions options = RewriterOptions.fromProperties(properties);

    assertThat(options.getAssertionLevel()).isEqualTo(AssertionLevel.VERY_AGGRESSIVE);
    assertThat(options.getTempVariablePrefix()).isEqualTo("$t");
  }

  @Test
  public void testBadAssertionLevel() {
    Properties properties = new Properties();
    properties.setProperty(RewriterOptions.ASSERTION_LEVEL_PROPERTY, "paranoid");

    assertThrows(IllegalArgumentException.class, () -> RewriterOptions.fromProperties(properties));
  }

  @Test
  public void testEmptyTempPrefix() {
    Properties properties = new Properties();
    properties.setProperty(RewriterOptions.TEMP_PREFIX_PROPERTY, "  ");

    assertThrows(IllegalArgumentException.class, () -> RewriterOptions.fromProperties(properties));
  }

  @Test
  public void testAssertionLevelOrder() {
    assertThat(AssertionLevel.AGGRESSIVE.isAtLeast(AssertionLevel.NORMAL)).isTrue();
    assertThat(AssertionLevel.NORMAL.isAtLeast(AssertionLevel.NORMAL)).isTrue();
    assertThat(AssertionLevel.NONE.isAtLeast(AssertionLevel.NORMAL)).isFalse();
  }

  @Test
  public void testSettersRejectNull() {
    RewriterOptions options = new RewriterOptions();

    assertThrows(NullPointerException.class, () -> options.setAssertionLevel(null));
    assertThrows(NullPointerException.class, () -> options.setLoweringPolicy(null));
  }
}
