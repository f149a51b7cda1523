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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LiteralEscapersTest {

  @Test
  public void testMetaCharacters() {
    assertThat(LiteralEscapers.defaultEscaper().escape(".\\+*?[^]$(){}=!<>|:-#"))
        .isEqualTo("\\.\\\\\\+\\*\\?\\[\\^\\]\\$\\(\\)\\{\\}\\=\\!\\<\\>\\|\\:\\-\\#");
  }

  @Test
  public void testNul() {
    assertThat(LiteralEscapers.defaultEscaper().escape("a\0b")).isEqualTo("a\\000b");
  }

  @Test
  public void testDefaultDelimiter() {
    assertThat(LiteralEscapers.defaultEscaper().escape("a/b.c")).isEqualTo("a\\/b\\.c");
    assertThat(LiteralEscapers.forDelimiter('/'))
        .isSameInstanceAs(LiteralEscapers.defaultEscaper());
  }

  @Test
  public void testCustomDelimiter() {
    LiteralEscaper escaper = LiteralEscapers.forDelimiter('~');
    assertThat(escaper.escape("a~b/c")).isEqualTo("a\\~b/c");
    assertThat(LiteralEscapers.forDelimiter('#').escape("a#b")).isEqualTo("a\\#b");
  }

  @Test
  public void testPlainText() {
    assertThat(LiteralEscapers.defaultEscaper().escape("abc 123 ä")).isEqualTo("abc 123 ä");
  }
}
