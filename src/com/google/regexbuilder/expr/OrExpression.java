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
 * Expects exactly one of at least two alternatives.
 *
 * <p>Example: {@code or("http", "https")} produces {@code (http|https)}. The
 * parentheses form a capturing group.
 */
public final class OrExpression extends Expression {

  OrExpression(List<?> children) {
    super(ExpressionType.OR, ExpressionValidator.checkChildren(ExpressionType.OR, children));
  }

  @Override
  public void appendTo(StringBuilder sb, LiteralEscaper escaper) {
    sb.append('(');
    boolean first = true;
    for (Object child : getChildren()) {
      if (!first) {
        sb.append('|');
      }
      appendChild(sb, child, escaper);
      first = false;
    }
    sb.append(')');
  }
}
