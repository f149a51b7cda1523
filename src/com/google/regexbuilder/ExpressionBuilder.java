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

/**
 * Builds a partial expression while it is being added to a
 * {@link RegExComposer}. The composer calls the builder exactly once, before
 * the surrounding expression is constructed, and uses the returned
 * {@link com.google.regexbuilder.expr.Expression} or scalar in its place.
 *
 * <pre>
 * composer.addAnd(
 *     "http",
 *     (ExpressionBuilder) c -&gt; Expressions.option("s"));
 * </pre>
 */
@FunctionalInterface
public interface ExpressionBuilder {
  Object build(RegExComposer composer);
}
