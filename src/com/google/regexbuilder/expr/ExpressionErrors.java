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

/** Errors that are reported while partial expressions are constructed. */
public final class ExpressionErrors {

  private ExpressionErrors() {}

  public static final ErrorType INVALID_ARGUMENT =
      ErrorType.make(
          "REGEX_INVALID_ARGUMENT",
          "Expected the {0}. {1} to be {2} but it is: {3}");

  public static final ErrorType MALFORMED_RANGE =
      ErrorType.make(
          "REGEX_MALFORMED_RANGE",
          "Closing square brackets have to be escaped, see the {0}. range: {1}");

  public static final ErrorType MALFORMED_COMMENT =
      ErrorType.make(
          "REGEX_MALFORMED_COMMENT",
          "Comments are not allowed to include a closing bracket"
              + " but there is one in the {0}. comment at position {1}");

  public static final ErrorType INVALID_MODIFIER =
      ErrorType.make(
          "REGEX_INVALID_MODIFIER",
          "Invalid modifier shortcut given: \"{0}\", use one of these: {1}");

  public static final ErrorType INVALID_REPETITION_BOUNDS =
      ErrorType.make(
          "REGEX_INVALID_REPETITION_BOUNDS",
          "Invalid repetition bounds min={0}, max={1}: {2}");

  public static final ErrorType INSUFFICIENT_CHILDREN =
      ErrorType.make(
          "REGEX_INSUFFICIENT_CHILDREN",
          "{0} expression expects at least {1} partial expression(s) but got {2}");
}
