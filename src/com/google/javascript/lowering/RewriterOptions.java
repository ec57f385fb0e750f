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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Ascii;
import java.util.Properties;

/** Options for a {@link TreeRewriter} and the transformations run with it. */
public class RewriterOptions {

  /** Property naming the {@link AssertionLevel}, case insensitive. */
  public static final String ASSERTION_LEVEL_PROPERTY = "lowering.assertionLevel";

  /** Property naming the prefix of generated temporary variables. */
  public static final String TEMP_PREFIX_PROPERTY = "lowering.tempPrefix";

  private AssertionLevel assertionLevel = AssertionLevel.NORMAL;

  private LoweringPolicy loweringPolicy = new StandardLoweringPolicy();

  private String tempVariablePrefix = "_";

  /**
   * Reads options from {@code properties}. Options without a property keep their defaults.
   *
   * @throws IllegalArgumentException if a property has a value that is not allowed
   */
  public static RewriterOptions fromProperties(Properties properties) {
    RewriterOptions options = new RewriterOptions();
    String level = properties.getProperty(ASSERTION_LEVEL_PROPERTY);
    if (level != null) {
      options.setAssertionLevel(AssertionLevel.valueOf(Ascii.toUpperCase(level.trim())));
    }
    String prefix = properties.getProperty(TEMP_PREFIX_PROPERTY);
    if (prefix != null) {
      options.setTempVariablePrefix(prefix.trim());
    }
    return options;
  }

  public AssertionLevel getAssertionLevel() {
    return assertionLevel;
  }

  /** Sets how thoroughly visit results are checked. {@link AssertionLevel#NONE} skips checks. */
  public void setAssertionLevel(AssertionLevel assertionLevel) {
    this.assertionLevel = checkNotNull(assertionLevel);
  }

  public LoweringPolicy getLoweringPolicy() {
    return loweringPolicy;
  }

  public void setLoweringPolicy(LoweringPolicy loweringPolicy) {
    this.loweringPolicy = checkNotNull(loweringPolicy);
  }

  public String getTempVariablePrefix() {
    return tempVariablePrefix;
  }

  public void setTempVariablePrefix(String tempVariablePrefix) {
    checkArgument(!tempVariablePrefix.isEmpty(), "Empty temp variable prefix");
    this.tempVariablePrefix = tempVariablePrefix;
  }
}
