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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DelimitedPatternTest {

  @Test
  public void testSlashes() {
    DelimitedPattern pattern = DelimitedPattern.parse("/ab/im");
    assertThat(pattern.getDelimiter()).isEqualTo('/');
    assertThat(pattern.getExpression()).isEqualTo("ab");
    assertThat(pattern.getModifiers()).isEqualTo("im");
  }

  @Test
  public void testEmptyExpression() {
    DelimitedPattern pattern = DelimitedPattern.parse("//");
    assertThat(pattern.getExpression()).isEmpty();
    assertThat(pattern.getModifiers()).isEmpty();
  }

  @Test
  public void testExpressionEndsAtLastDelimiter() {
    DelimitedPattern pattern = DelimitedPattern.parse("#a#b#s");
    assertThat(pattern.getExpression()).isEqualTo("a#b");
    assertThat(pattern.getModifiers()).isEqualTo("s");
  }

  @Test
  public void testBrackets() {
    assertThat(DelimitedPattern.parse("{a{2}}x").getExpression()).isEqualTo("a{2}");
    assertThat(DelimitedPattern.parse("(a)").getExpression()).isEqualTo("a");
    assertThat(DelimitedPattern.parse("[a]").getExpression()).isEqualTo("a");
    assertThat(DelimitedPattern.parse("<a>i").getModifiers()).isEqualTo("i");
  }

  @Test
  public void testInvalidPatterns() {
    assertThrows(EngineExecutionException.class, () -> DelimitedPattern.parse(""));
    assertThrows(EngineExecutionException.class, () -> DelimitedPattern.parse("abca"));
    assertThrows(EngineExecutionException.class, () -> DelimitedPattern.parse("\\a\\"));
    assertThrows(EngineExecutionException.class, () -> DelimitedPattern.parse(" a "));
    assertThrows(EngineExecutionException.class, () -> DelimitedPattern.parse("/abc"));
    assertThrows(EngineExecutionException.class, () -> DelimitedPattern.parse("{abc"));
  }

  @Test
  public void testEquality() {
    assertThat(DelimitedPattern.parse("/a/i")).isEqualTo(DelimitedPattern.parse("/a/i"));
    assertThat(DelimitedPattern.parse("/a/i")).isNotEqualTo(DelimitedPattern.parse("#a#i"));
  }
}
