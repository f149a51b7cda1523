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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Arrays;
import java.util.List;

/**
 * An expression construction helper class. Every factory validates its input
 * and throws an {@link ExpressionException} if it is malformed.
 */
public final class Expressions {

  private Expressions() {}

  public static AndExpression and(Object... children) {
    return new AndExpression(asList(children));
  }

  public static OrExpression or(Object... children) {
    return new OrExpression(asList(children));
  }

  public static OptionExpression option(Object... children) {
    return new OptionExpression(asList(children));
  }

  /**
   * @param min the minimum number of repetitions, at least 0
   * @param max the maximum number of repetitions, at least {@code min}, or
   *     {@link RepetitionExpression#INFINITE}
   */
  public static RepetitionExpression repetition(int min, int max, Object... children) {
    return new RepetitionExpression(min, max, asList(children));
  }

  public static RangeExpression range(Object... ranges) {
    return new RangeExpression(asList(ranges));
  }

  public static RangeExpression invertedRange(Object... ranges) {
    RangeExpression range = range(ranges);
    range.makeInverted();
    return range;
  }

  public static CapturingGroupExpression capturingGroup(Object... children) {
    return new CapturingGroupExpression(asList(children));
  }

  public static CommentExpression comment(Object... comments) {
    return new CommentExpression(asList(comments));
  }

  public static RawExpression raw(Object... children) {
    return new RawExpression(asList(children));
  }

  // Arrays.asList keeps null elements so the validator can report them.
  private static List<Object> asList(Object[] values) {
    return Arrays.asList(checkNotNull(values));
  }
}
