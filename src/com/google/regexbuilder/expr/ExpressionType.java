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

/** The kinds of partial expressions. */
public enum ExpressionType {
  AND("And", 0, true),
  OR("Or", 2, true),
  OPTION("Option", 1, true),
  REPETITION("Repetition", 1, true),
  RANGE("Range", 1, false),
  CAPTURING_GROUP("CapturingGroup", 1, true),
  COMMENT("Comment", 1, false),
  RAW("Raw", 0, false);

  private final String label;
  private final int minChildren;
  private final boolean quotesScalars;

  ExpressionType(String label, int minChildren, boolean quotesScalars) {
    this.label = label;
    this.minChildren = minChildren;
    this.quotesScalars = quotesScalars;
  }

  /** The name used when the expression tree is visualised. */
  public String getLabel() {
    return label;
  }

  /** The minimum number of children an expression of this type accepts. */
  public int getMinChildren() {
    return minChildren;
  }

  /** Whether scalar children are escaped before they are inserted. */
  public boolean quotesScalars() {
    return quotesScalars;
  }
}
