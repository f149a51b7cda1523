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

package com.google.regexbuilder.expr;

import com.google.regexbuilder.engine.LiteralEscaper;
import java.util.List;

/**
 * Its parts have to appear {@code min} to {@code max} times. The quantifier
 * is appended to the concatenated children, so it applies to the last atom
 * of the children only.
 *
 * <ul>
 *   <li>{@code repetition(0, 1, "ab")} produces {@code ab?}
 *   <li>{@code repetition(1, 1, "ab")} produces {@code ab}
 *   <li>{@code repetition(3, 3, "ab")} produces {@code ab{3}}
 *   <li>{@code repetition(0, INFINITE, "ab")} produces {@code ab*}
 *   <li>{@code repetition(1, INFINITE, "ab")} produces {@code ab+}
 *   <li>{@code repetition(2, INFINITE, "ab")} produces <code>ab{2,}</code>
 *   <li>{@code repetition(1, 2, "ab")} produces <code>ab{1,2}</code>
 * </ul>
 */
public final class RepetitionExpression extends Expression {

  /** Use as maximum for an unbounded number of repetitions. */
  public static final int INFINITE = -1;

  private final int min;
  private final int max;

  RepetitionExpression(int min, int max, List<?> children) {
    super(
        ExpressionType.REPETITION,
        ExpressionValidator.checkChildren(ExpressionType.REPETITION, children));
    ExpressionValidator.checkRepetitionBounds(min, max);
    this.min = min;
    this.max = max;
  }

  public int getMin() {
    return min;
  }

  /** Returns the maximum, or {@link #INFINITE}. */
  public int getMax() {
    return max;
  }

  @Override
  public void appendTo(StringBuilder sb, LiteralEscaper escaper) {
    appendChildren(sb, escaper);
    sb.append(getQuantifier());
  }

  /** Returns the quantifier suffix. The order of the checks matters. */
  String getQuantifier() {
    if (min == 0 && max == 1) {
      return "?";
    }
    if (min == 1 && max == 1) {
      return "";
    }
    if (min == max) {
      return "{" + min + "}";
    }
    if (min == 0 && max == INFINITE) {
      return "*";
    }
    if (min == 1 && max == INFINITE) {
      return "+";
    }
    if (max == INFINITE) {
      return "{" + min + ",}";
    }
    return "{" + min + "," + max + "}";
  }
}
