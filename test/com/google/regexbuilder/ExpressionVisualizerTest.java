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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.regexbuilder.engine.LiteralEscapers;
import com.google.regexbuilder.expr.Expression;
import com.google.regexbuilder.expr.Expressions;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ExpressionVisualizerTest {

  @Test
  public void testNoExpressions() {
    assertThat(visualise(false, 2)).isEmpty();
    assertThat(visualise(true, 2)).isEqualTo("<pre class=\"regex-vis\"></pre>");
  }

  @Test
  public void testNestedTree() {
    String expected =
        "And (Size: 3): http(a|b)\n"
            + "  String: http\n"
            + "  Or (Size: 2): (a|b)\n"
            + "    String: a\n"
            + "    String: b\n";
    assertThat(visualise(false, 2, Expressions.and("http", Expressions.or("a", "b"))))
        .isEqualTo(expected);
  }

  @Test
  public void testSeveralRoots() {
    String expected = "Raw (Size: 1): ^\n" + "String: ^\n" + "CapturingGroup (Size: 1): (x)\n"
        + "String: x\n";
    assertThat(visualise(false, 0, Expressions.raw("^"), Expressions.capturingGroup("x")))
        .isEqualTo(expected);
  }

  @Test
  public void testScalarTypes() {
    String expected =
        "And (Size: 3): 42truea\n"
            + "   Integer: 42\n"
            + "   Boolean: true\n"
            + "   Character: a\n";
    assertThat(visualise(false, 3, Expressions.and(42, true, 'a'))).isEqualTo(expected);
  }

  @Test
  public void testEmptyExpression() {
    assertThat(visualise(false, 2, Expressions.and())).isEqualTo("And (Size: 0): \n");
    assertThat(visualise(true, 2, Expressions.and()))
        .isEqualTo(
            "<pre class=\"regex-vis\"><strong class=\"regex-vis-type\">And</strong>"
                + " (Size: 0): <br></pre>");
  }

  @Test
  public void testHtml() {
    String code = "<code class=\"regex-vis-value\" style=\"background-color: #DDD\">";
    String expected =
        "<pre class=\"regex-vis\">"
            + "<strong class=\"regex-vis-type\">Raw</strong> (Size: 1): "
            + code
            + "&lt;a&gt;</code><br>"
            + "&nbsp;&nbsp;<strong class=\"regex-vis-type\">String</strong>: "
            + code
            + "&lt;a&gt;</code><br>"
            + "</pre>";
    assertThat(visualise(true, 2, Expressions.raw("<a>"))).isEqualTo(expected);
  }

  @Test
  public void testEscapedValueIsShown() {
    assertThat(visualise(false, 2, Expressions.option("a.b")))
        .isEqualTo("Option (Size: 1): (a\\.b)?\n" + "  String: a.b\n");
  }

  private static String visualise(boolean html, int tabSize, Expression... roots) {
    return ExpressionVisualizer.visualise(
        ImmutableList.copyOf(roots), html, tabSize, LiteralEscapers.defaultEscaper());
  }
}
