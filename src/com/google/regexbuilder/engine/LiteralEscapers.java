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

import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;

/**
 * Factories for {@link LiteralEscaper}s that escape like PCRE's
 * {@code preg_quote}: every regular expression meta character and the
 * delimiter get a backslash, NUL becomes {@code \000}.
 */
public final class LiteralEscapers {

  public static final char DEFAULT_DELIMITER = '/';

  /** Characters that are always escaped, in addition to the delimiter. */
  private static final String META_CHARACTERS = ".\\+*?[^]$(){}=!<>|:-#";

  private static final LiteralEscaper DEFAULT = build(DEFAULT_DELIMITER);

  private LiteralEscapers() {}

  /** Returns the escaper for patterns delimited by {@code /}. */
  public static LiteralEscaper defaultEscaper() {
    return DEFAULT;
  }

  /** Returns an escaper for patterns delimited by {@code delimiter}. */
  public static LiteralEscaper forDelimiter(char delimiter) {
    return delimiter == DEFAULT_DELIMITER ? DEFAULT : build(delimiter);
  }

  private static LiteralEscaper build(char delimiter) {
    Escapers.Builder builder = Escapers.builder();
    for (char c : META_CHARACTERS.toCharArray()) {
      builder.addEscape(c, "\\" + c);
    }
    builder.addEscape(delimiter, "\\" + delimiter);
    builder.addEscape('\0', "\\000");
    Escaper escaper = builder.build();
    return escaper::escape;
  }
}
