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

import com.google.errorprone.annotations.Immutable;
import java.io.Serializable;
import java.text.MessageFormat;

/**
 * The kind of a construction error. Every {@link ExpressionException} carries
 * exactly one of the types declared in {@link ExpressionErrors}.
 */
@Immutable
public final class ErrorType implements Serializable {
  private static final long serialVersionUID = 1;

  /** A unique identifier, e.g. {@code REGEX_MALFORMED_RANGE}. */
  public final String key;

  /** The message template. The style of format is java.text.MessageFormat. */
  public final String format;

  /**
   * Create an ErrorType.
   *
   * @param key An identifier
   * @param descriptionFormat A format string
   * @return A new ErrorType
   */
  public static ErrorType make(String key, String descriptionFormat) {
    return new ErrorType(key, descriptionFormat);
  }

  /** Private to force use of the static factory method. */
  private ErrorType(String key, String format) {
    this.key = checkNotNull(key);
    this.format = checkNotNull(format);
  }

  /**
   * Fills the message template. Arguments are passed as strings so that
   * MessageFormat does not apply locale specific number grouping.
   */
  public String format(String... arguments) {
    return MessageFormat.format(format, (Object[]) arguments);
  }

  @Override
  public boolean equals(Object type) {
    return type instanceof ErrorType && ((ErrorType) type).key.equals(key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }
}
