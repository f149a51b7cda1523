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

/**
 * Thrown when a partial expression cannot be built from the given input.
 * The message is the formatted {@link ErrorType} template.
 */
public class ExpressionException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final ErrorType type;

  public ExpressionException(ErrorType type, String... arguments) {
    super(checkNotNull(type).format(arguments));
    this.type = type;
  }

  public ErrorType getType() {
    return type;
  }
}
