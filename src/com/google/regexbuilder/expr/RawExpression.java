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
 * Inserts its parts as they are. Scalars are not escaped, which makes this
 * the way to add regular expression syntax that has no expression type.
 *
 * <p>Example: {@code raw("\\d+")} produces {@code \d+}.
 */
public final class RawExpression extends Expression {

  RawExpression(List<?> children) {
    super(ExpressionType.RAW, ExpressionValidator.checkChildren(ExpressionType.RAW, children));
  }

  @Override
  public void appendTo(StringBuilder sb, LiteralEscaper escaper) {
    appendChildren(sb, escaper);
  }
}
