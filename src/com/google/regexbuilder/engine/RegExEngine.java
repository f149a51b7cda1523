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

import com.google.common.collect.ImmutableList;

/**
 * The regular expression engine that executes composed patterns. Patterns are
 * complete pattern strings: a start delimiter, the expression, an end
 * delimiter and the modifier letters, e.g. {@code /ab+/i}.
 *
 * <p>Implementations report engine failures with an
 * {@link EngineExecutionException}. A subject that does not match is not a
 * failure.
 */
public interface RegExEngine {

  /**
   * Escapes all regular expression meta characters of {@code literal} and
   * every occurrence of {@code delimiter}.
   */
  String quote(String literal, char delimiter);

  /**
   * Searches {@code subject} for the first match of {@code pattern}.
   *
   * @return an empty list if nothing matched, otherwise the whole match
   *     followed by the capturing groups. Groups that did not participate are
   *     empty strings, trailing ones are omitted.
   */
  ImmutableList<String> match(String pattern, String subject);

  /**
   * Replaces matches of {@code pattern} in {@code subject}. The replacement may
   * refer to groups as {@code $n}.
   *
   * <p>Unlike PCRE, which substitutes an empty string for a reference to a
   * group that does not exist, {@link JavaRegExEngine} rejects such a
   * replacement with an {@link EngineExecutionException}.
   *
   * @param limit the maximum number of replacements, a negative value means no limit
   */
  Replacement replace(String pattern, String replacement, String subject, int limit);
}
