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

import com.google.common.collect.ImmutableList;
import com.google.regexbuilder.engine.LiteralEscaper;
import com.google.regexbuilder.engine.LiteralEscapers;
import java.util.List;

/**
 * A partial expression: one node of the expression tree.
 *
 * <p>The children of an expression are other expressions or scalars
 * ({@link CharSequence}, {@link Number}, {@link Boolean}, {@link Character}).
 * Character sequences are stored as strings. Scalars are rendered with
 * {@link String#valueOf(Object)}, so booleans become {@code true} and
 * {@code false}. Whether a scalar is escaped when the expression is serialized
 * depends on the {@link ExpressionType}.
 *
 * <p>Expressions are built bottom-up and never reattached, so the children
 * of an expression form a tree. Use {@link Expressions} to create them.
 */
public abstract class Expression {

  private final ExpressionType type;
  private final ImmutableList<Object> children;

  Expression(ExpressionType type, List<?> children) {
    this.type = checkNotNull(type);
    ImmutableList.Builder<Object> builder = ImmutableList.builder();
    for (Object child : children) {
      builder.add(child instanceof CharSequence ? child.toString() : child);
    }
    this.children = builder.build();
  }

  public final ExpressionType getType() {
    return type;
  }

  /** Returns the name of the type, e.g. "CapturingGroup". */
  public String getTypeName() {
    return type.getLabel();
  }

  /** Returns the children: expressions and scalars, in insertion order. */
  public final ImmutableList<Object> getChildren() {
    return children;
  }

  /** Returns the number of leaves below this expression. */
  public int getSize() {
    return ExpressionTraversal.countLeaves(ImmutableList.of(this));
  }

  /**
   * Appends the serialized form of this expression.
   *
   * @param escaper escapes scalar children of types that quote them
   */
  public abstract void appendTo(StringBuilder sb, LiteralEscaper escaper);

  /** Returns the serialized form of this expression. */
  public final String toString(LiteralEscaper escaper) {
    StringBuilder sb = new StringBuilder();
    appendTo(sb, escaper);
    return sb.toString();
  }

  /** Returns the serialized form, escaping literals for the default delimiter. */
  @Override
  public String toString() {
    return toString(LiteralEscapers.defaultEscaper());
  }

  /** Appends all children, one after another. */
  final void appendChildren(StringBuilder sb, LiteralEscaper escaper) {
    for (Object child : children) {
      appendChild(sb, child, escaper);
    }
  }

  final void appendChild(StringBuilder sb, Object child, LiteralEscaper escaper) {
    if (child instanceof Expression) {
      ((Expression) child).appendTo(sb, escaper);
    } else if (type.quotesScalars()) {
      sb.append(escaper.escape(String.valueOf(child)));
    } else {
      sb.append(child);
    }
  }
}
