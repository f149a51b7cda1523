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

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Checks the raw input of partial expressions before they are constructed.
 * All methods are side effect free and throw an {@link ExpressionException}
 * on the first violation they find.
 */
public final class ExpressionValidator {

  private static final String SCALAR = "scalar (CharSequence / Number / Boolean / Character)";
  private static final String SCALAR_OR_EXPRESSION = "an expression or " + SCALAR;

  private ExpressionValidator() {}

  /** Whether the value may be used as a leaf of the expression tree. */
  public static boolean isScalar(@Nullable Object value) {
    return value instanceof CharSequence
        || value instanceof Number
        || value instanceof Boolean
        || value instanceof Character;
  }

  /**
   * Checks the arity of an expression and that every child is an expression or a scalar.
   *
   * @return the children
   */
  public static <T extends List<?>> T checkChildren(ExpressionType type, T children) {
    checkArity(type, children);
    for (int i = 0; i < children.size(); i++) {
      Object child = children.get(i);
      if (!(child instanceof Expression) && !isScalar(child)) {
        throw invalidArgument(i, "partial expression", SCALAR_OR_EXPRESSION, child);
      }
    }
    return children;
  }

  /**
   * Checks the fragments of a range. Square brackets inside a range have to be
   * escaped, otherwise the bracket expression would end prematurely.
   *
   * @return the ranges
   */
  public static <T extends List<?>> T checkRanges(T ranges) {
    checkArity(ExpressionType.RANGE, ranges);
    for (int i = 0; i < ranges.size(); i++) {
      Object range = ranges.get(i);
      if (!isScalar(range)) {
        throw invalidArgument(i, "range", SCALAR, range);
      }

      // Only "]" terminates a bracket expression, so an unescaped "[" is fine.
      String text = String.valueOf(range);
      if (countOccurrences(text, "]") > countOccurrences(text, "\\]")) {
        throw new ExpressionException(
            ExpressionErrors.MALFORMED_RANGE, String.valueOf(i + 1), text);
      }
    }
    return ranges;
  }

  /**
   * Checks the texts of a comment. A closing parenthesis would end the comment
   * and it cannot be escaped inside of it. Its position is reported in code
   * points.
   *
   * @return the comments
   */
  public static <T extends List<?>> T checkComments(T comments) {
    checkArity(ExpressionType.COMMENT, comments);
    for (int i = 0; i < comments.size(); i++) {
      Object comment = comments.get(i);
      if (!isScalar(comment)) {
        throw invalidArgument(i, "comment", SCALAR, comment);
      }

      String text = String.valueOf(comment);
      int pos = text.indexOf(')');
      if (pos != -1) {
        throw new ExpressionException(
            ExpressionErrors.MALFORMED_COMMENT,
            String.valueOf(i + 1),
            String.valueOf(text.codePointCount(0, pos)));
      }
    }
    return comments;
  }

  /**
   * Checks the bounds of a repetition. {@code max} may be
   * {@link RepetitionExpression#INFINITE}.
   */
  public static void checkRepetitionBounds(int min, int max) {
    String reason = null;
    if (min < 0) {
      reason = "the minimum must be >= 0";
    } else if (max != RepetitionExpression.INFINITE && max < 0) {
      reason = "the maximum must be >= 0 or INFINITE";
    } else if (max != RepetitionExpression.INFINITE && max < min) {
      reason = "the maximum must be >= the minimum";
    }
    if (reason != null) {
      throw new ExpressionException(
          ExpressionErrors.INVALID_REPETITION_BOUNDS,
          String.valueOf(min),
          max == RepetitionExpression.INFINITE ? "INFINITE" : String.valueOf(max),
          reason);
    }
  }

  private static void checkArity(ExpressionType type, List<?> children) {
    if (children.size() < type.getMinChildren()) {
      throw new ExpressionException(
          ExpressionErrors.INSUFFICIENT_CHILDREN,
          type.getLabel(),
          String.valueOf(type.getMinChildren()),
          String.valueOf(children.size()));
    }
  }

  private static ExpressionException invalidArgument(
      int index, String what, String expected, @Nullable Object actual) {
    return new ExpressionException(
        ExpressionErrors.INVALID_ARGUMENT,
        String.valueOf(index + 1),
        what,
        expected,
        actual == null ? "null" : actual.getClass().getName());
  }

  private static int countOccurrences(String text, String needle) {
    int count = 0;
    for (int pos = text.indexOf(needle); pos != -1; pos = text.indexOf(needle, pos + 1)) {
      count++;
    }
    return count;
  }
}
