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

package com.google.regexbuilder;

import com.google.common.base.Strings;
import com.google.common.html.HtmlEscapers;
import com.google.regexbuilder.engine.LiteralEscaper;
import com.google.regexbuilder.expr.Expression;
import com.google.regexbuilder.expr.ExpressionTraversal;

/**
 * <p>ExpressionVisualizer prints one line per expression and per scalar of
 * an expression tree, indented by depth. Expressions are printed with their
 * type, their size and their serialized form, scalars with their Java type
 * and their value:</p>
 * <pre>
 * And (Size: 3): http(a|b)
 *   String: http
 *   Or (Size: 2): (a|b)
 *     String: a
 *     String: b
 * </pre>
 * <p>In HTML mode, types are wrapped in {@code <strong class="regex-vis-type">},
 * values in {@code <code class="regex-vis-value">}, lines end with
 * {@code <br>} and the whole output is wrapped in
 * {@code <pre class="regex-vis">}.</p>
 * <p>This class is <b>not</b> thread safe; use one instance per
 * visualisation.</p>
 */
final class ExpressionVisualizer implements ExpressionTraversal.Callback {
  private static final String HTML_LINE_BREAK = "<br>";
  private static final String HTML_SPACE = "&nbsp;";

  // the builder used to generate the visualisation
  private final StringBuilder builder = new StringBuilder();

  private final boolean html;
  private final int tabSize;
  private final LiteralEscaper escaper;

  private ExpressionVisualizer(boolean html, int tabSize, LiteralEscaper escaper) {
    this.html = html;
    this.tabSize = tabSize;
    this.escaper = escaper;
  }

  /**
   * Visualises expression trees.
   *
   * @param roots the roots of the trees, printed in iteration order
   * @param html whether to decorate the output with HTML tags
   * @param tabSize the number of spaces per level
   * @param escaper escapes literals in the serialized form of expressions
   */
  static String visualise(
      Iterable<? extends Expression> roots, boolean html, int tabSize, LiteralEscaper escaper) {
    ExpressionVisualizer visualizer = new ExpressionVisualizer(html, tabSize, escaper);
    ExpressionTraversal.traverse(roots, visualizer);
    String output = visualizer.builder.toString();
    return html ? "<pre class=\"regex-vis\">" + output + "</pre>" : output;
  }

  @Override
  public void visit(Object item, int level, boolean hasChildren) {
    String type;
    String info;
    String value;
    if (item instanceof Expression) {
      Expression expression = (Expression) item;
      type = expression.getTypeName();
      info = " (Size: " + expression.getSize() + "): ";
      value = expression.toString(escaper);
    } else {
      type = item.getClass().getSimpleName();
      info = ": ";
      value = String.valueOf(item);
    }

    if (html) {
      type = "<strong class=\"regex-vis-type\">" + type + "</strong>";
      if (!value.isEmpty()) {
        value =
            "<code class=\"regex-vis-value\" style=\"background-color: #DDD\">"
                + HtmlEscapers.htmlEscaper().escape(value)
                + "</code>";
      }
    }

    builder.append(Strings.repeat(html ? HTML_SPACE : " ", level * tabSize));
    builder.append(type).append(info).append(value);
    builder.append(html ? HTML_LINE_BREAK : "\n");
  }
}
