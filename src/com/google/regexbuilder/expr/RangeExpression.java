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
 * A bracket expression that expects a single character out of its ranges,
 * e.g. {@code a-z} or {@code 0-9}. The ranges are inserted verbatim, closing
 * square brackets have to be escaped.
 *
 * <p>Example: {@code range("a-z", "123\\-")} produces {@code [a-z123\-]}.
 */
public final class RangeExpression extends Expression {

  private boolean inverted = false;

  RangeExpression(List<?> ranges) {
    super(ExpressionType.RANGE, ExpressionValidator.checkRanges(ranges));
  }

  /** Whether the range expects any character that is not part of it. */
  public boolean isInverted() {
    return inverted;
  }

  /** Inverts the range: {@code [a-z]} becomes {@code [^a-z]}. */
  public void makeInverted() {
    inverted = true;
  }

  @Override
  public void appendTo(StringBuilder sb, LiteralEscaper escaper) {
    sb.append(inverted ? "[^" : "[");
    appendChildren(sb, escaper);
    sb.append(']');
  }
}
