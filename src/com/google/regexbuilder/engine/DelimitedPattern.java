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

package com.google.regexbuilder.engine;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;

/**
 * A pattern string split into its parts. The first character is the
 * delimiter. Bracket style delimiters are closed by their counterpart, every
 * other delimiter by itself. The expression ends at the last closing
 * delimiter, everything after it is a modifier letter.
 */
@AutoValue
@Immutable
public abstract class DelimitedPattern {

  private static final String OPENING_BRACKETS = "([{<";
  private static final String CLOSING_BRACKETS = ")]}>";

  public abstract char getDelimiter();

  /** Returns the expression between the delimiters. */
  public abstract String getExpression();

  /** Returns the modifier letters in the order in which they were written. */
  public abstract String getModifiers();

  /**
   * Splits a pattern string.
   *
   * @throws EngineExecutionException if the pattern has no valid delimiters
   */
  public static DelimitedPattern parse(String pattern) {
    if (pattern.isEmpty()) {
      throw new EngineExecutionException("Empty regular expression");
    }
    char start = pattern.charAt(0);
    if (Character.isLetterOrDigit(start) || start == '\\' || Character.isWhitespace(start)) {
      throw new EngineExecutionException(
          "Delimiter must not be alphanumeric, backslash or whitespace: " + pattern);
    }

    int bracket = OPENING_BRACKETS.indexOf(start);
    char end = bracket == -1 ? start : CLOSING_BRACKETS.charAt(bracket);
    int endPos = pattern.lastIndexOf(end);
    if (endPos < 1) {
      throw new EngineExecutionException("No ending delimiter '" + end + "' found: " + pattern);
    }

    return new AutoValue_DelimitedPattern(
        start, pattern.substring(1, endPos), pattern.substring(endPos + 1));
  }
}
