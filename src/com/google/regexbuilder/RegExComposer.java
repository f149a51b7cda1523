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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.regexbuilder.engine.EngineExecutionException;
import com.google.regexbuilder.engine.LiteralEscaper;
import com.google.regexbuilder.engine.Replacement;
import com.google.regexbuilder.expr.Expression;
import com.google.regexbuilder.expr.ExpressionTraversal;
import com.google.regexbuilder.expr.ExpressionValidator;
import com.google.regexbuilder.expr.Expressions;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The API frontend for composing regular expressions. Call its
 * {@code add<Something>()} methods to append partial expressions, then call
 * {@link #toString()} to retrieve the complete pattern string:
 *
 * <pre>
 * RegExComposer regEx = new RegExComposer()
 *     .addLineBeginning()
 *     .addAnd("http")
 *     .addOption("s")
 *     .addAnd("://")
 *     .setInsensitiveModifier();
 * regEx.toString(); // "/^http(s)?\:\/\//i"
 * </pre>
 *
 * <p>Arguments that are partial expressions accept {@link Expression}s, scalars
 * (strings, numbers, booleans and characters) and {@link ExpressionBuilder}s.
 * Builders are called once, in argument order, before the new expression is
 * constructed. If an argument is invalid an
 * {@link com.google.regexbuilder.expr.ExpressionException} is thrown and the
 * composer is left unchanged.
 *
 * <p>This class is <b>not</b> thread safe. Read-only methods may be called
 * concurrently as long as no thread modifies the composer.
 */
public class RegExComposer {

  /** Indicates the start and the end of a regular expression. */
  public static final String DELIMITER = "/";

  private static final String DEFAULT_LINE_BREAK = "\\r?\\n";

  private final ComposerOptions options;

  /** The start of the regular expression (prefix). */
  private String start = DELIMITER;

  private final List<Expression> expressions = new ArrayList<>();

  /** The end of the regular expression (suffix). */
  private String end = DELIMITER;

  /** The active modifiers, in activation order. */
  private final Set<Modifier> modifiers = new LinkedHashSet<>();

  /**
   * Creates a composer that uses default options. Partial expressions passed
   * to the constructor are wrapped in an "and" expression.
   */
  public RegExComposer(Object... partialExpressions) {
    this(new ComposerOptions());
    if (partialExpressions.length > 0) {
      addAnd(partialExpressions);
    }
  }

  private RegExComposer(ComposerOptions options) {
    this.options = checkNotNull(options);
  }

  /**
   * Creates a composer that uses the given options. Partial expressions are
   * wrapped in an "and" expression.
   */
  public static RegExComposer create(ComposerOptions options, Object... partialExpressions) {
    RegExComposer regEx = new RegExComposer(options);
    if (partialExpressions.length > 0) {
      regEx.addAnd(partialExpressions);
    }
    return regEx;
  }

  /**
   * Quotes (escapes) regular expression characters and the delimiter.
   * Example: "Hello." becomes "Hello\."
   */
  public String quote(Object value) {
    checkArgument(ExpressionValidator.isScalar(value), "Expected a scalar but got %s", value);
    return options.getEngine().quote(String.valueOf(value), getDelimiter());
  }

  /** Adds a partial expression that expects any single character except a new line: {@code .} */
  @CanIgnoreReturnValue
  public RegExComposer addAnyChar() {
    return addRaw(".");
  }

  /** Adds a partial expression that expects 1..n of any characters: {@code .+} */
  @CanIgnoreReturnValue
  public RegExComposer addAnyChars() {
    return addRaw(".+");
  }

  /** Adds a partial expression that expects 0..n of any characters: {@code .*} */
  @CanIgnoreReturnValue
  public RegExComposer addMaybeAnyChars() {
    return addRaw(".*");
  }

  /** Adds a partial expression that expects a single digit: {@code \d} */
  @CanIgnoreReturnValue
  public RegExComposer addDigit() {
    return addRaw("\\d");
  }

  /** Adds a partial expression that expects 1..n digits: {@code \d+} */
  @CanIgnoreReturnValue
  public RegExComposer addDigits() {
    return addRaw("\\d+");
  }

  /** Adds a partial expression that expects 0..n digits: {@code \d*} */
  @CanIgnoreReturnValue
  public RegExComposer addMaybeDigits() {
    return addRaw("\\d*");
  }

  /** Adds a partial expression that expects a character that is not a digit: {@code \D} */
  @CanIgnoreReturnValue
  public RegExComposer addNonDigit() {
    return addRaw("\\D");
  }

  /** Adds a partial expression that expects 1..n characters that are not digits: {@code \D+} */
  @CanIgnoreReturnValue
  public RegExComposer addNonDigits() {
    return addRaw("\\D+");
  }

  /** Adds a partial expression that expects 0..n characters that are not digits: {@code \D*} */
  @CanIgnoreReturnValue
  public RegExComposer addMaybeNonDigits() {
    return addRaw("\\D*");
  }

  /** Adds a partial expression that expects a letter: {@code [a-zA-Z]} */
  @CanIgnoreReturnValue
  public RegExComposer addLetter() {
    return addRange("a-zA-Z");
  }

  /** Adds a partial expression that expects 1..n letters: {@code [a-zA-Z]+} */
  @CanIgnoreReturnValue
  public RegExComposer addLetters() {
    return addRaw(Expressions.range("a-zA-Z"), "+");
  }

  /** Adds a partial expression that expects 0..n letters: {@code [a-zA-Z]*} */
  @CanIgnoreReturnValue
  public RegExComposer addMaybeLetters() {
    return addRaw(Expressions.range("a-zA-Z"), "*");
  }

  /**
   * Adds a partial expression that expects a word character, that is a letter,
   * a digit or the underscore: {@code \w}
   */
  @CanIgnoreReturnValue
  public RegExComposer addWordChar() {
    return addRaw("\\w");
  }

  /** Adds a partial expression that expects 1..n word characters: {@code \w+} */
  @CanIgnoreReturnValue
  public RegExComposer addWordChars() {
    return addRaw("\\w+");
  }

  /** Adds a partial expression that expects 0..n word characters: {@code \w*} */
  @CanIgnoreReturnValue
  public RegExComposer addMaybeWordChars() {
    return addRaw("\\w*");
  }

  /** Adds a partial expression that expects a character that is not a word character: {@code \W} */
  @CanIgnoreReturnValue
  public RegExComposer addNonWordChar() {
    return addRaw("\\W");
  }

  /** Adds a partial expression that expects 1..n characters that are not word characters. */
  @CanIgnoreReturnValue
  public RegExComposer addNonWordChars() {
    return addRaw("\\W+");
  }

  /** Adds a partial expression that expects 0..n characters that are not word characters. */
  @CanIgnoreReturnValue
  public RegExComposer addMaybeNonWordChars() {
    return addRaw("\\W*");
  }

  /** Adds a partial expression that expects a white space character: {@code \s} */
  @CanIgnoreReturnValue
  public RegExComposer addWhiteSpaceChar() {
    return addRaw("\\s");
  }

  /** Adds a partial expression that expects 1..n white space characters: {@code \s+} */
  @CanIgnoreReturnValue
  public RegExComposer addWhiteSpaceChars() {
    return addRaw("\\s+");
  }

  /** Adds a partial expression that expects 0..n white space characters: {@code \s*} */
  @CanIgnoreReturnValue
  public RegExComposer addMaybeWhiteSpaceChars() {
    return addRaw("\\s*");
  }

  /** Adds a partial expression that expects a tab: {@code \t} */
  @CanIgnoreReturnValue
  public RegExComposer addTabChar() {
    return addRaw("\\t");
  }

  /** Adds a partial expression that expects 1..n tabs: {@code \t+} */
  @CanIgnoreReturnValue
  public RegExComposer addTabChars() {
    return addRaw("\\t+");
  }

  /** Adds a partial expression that expects 0..n tabs: {@code \t*} */
  @CanIgnoreReturnValue
  public RegExComposer addMaybeTabChars() {
    return addRaw("\\t*");
  }

  /** Adds a partial expression that expects a line break, {@code \n} or {@code \r\n}. */
  @CanIgnoreReturnValue
  public RegExComposer addLineBreak() {
    return addLineBreak(null);
  }

  /**
   * Adds a partial expression that expects a line break.
   *
   * @param which the raw line break pattern, null for {@code \r?\n}
   */
  @CanIgnoreReturnValue
  public RegExComposer addLineBreak(@Nullable String which) {
    return addRaw(lineBreak(which));
  }

  /** Adds a partial expression that expects 1..n line breaks. */
  @CanIgnoreReturnValue
  public RegExComposer addLineBreaks() {
    return addLineBreaks(null);
  }

  /**
   * Adds a partial expression that expects 1..n line breaks. The quantifier is
   * appended to the line break pattern as it is.
   *
   * @param which the raw line break pattern, null for {@code \r?\n}
   */
  @CanIgnoreReturnValue
  public RegExComposer addLineBreaks(@Nullable String which) {
    return addRaw(lineBreak(which) + "+");
  }

  /** Adds a partial expression that expects 0..n line breaks. */
  @CanIgnoreReturnValue
  public RegExComposer addMaybeLineBreaks() {
    return addMaybeLineBreaks(null);
  }

  /**
   * Adds a partial expression that expects 0..n line breaks. The quantifier is
   * appended to the line break pattern as it is.
   *
   * @param which the raw line break pattern, null for {@code \r?\n}
   */
  @CanIgnoreReturnValue
  public RegExComposer addMaybeLineBreaks(@Nullable String which) {
    return addRaw(lineBreak(which) + "*");
  }

  /** Adds a partial expression that expects the beginning of a line: {@code ^} */
  @CanIgnoreReturnValue
  public RegExComposer addLineBeginning() {
    return addRaw("^");
  }

  /** Adds a partial expression that expects the end of a line: {@code $} */
  @CanIgnoreReturnValue
  public RegExComposer addLineEnd() {
    return addRaw("$");
  }

  /**
   * Adds one or more ranges wrapped in a "range" expression, e.g.
   * {@code addRange("a-z", "123\\-")} adds {@code [a-z123\-]}. Ranges are not
   * quoted; closing square brackets have to be escaped.
   */
  @CanIgnoreReturnValue
  public RegExComposer addRange(Object... ranges) {
    return append(Expressions.range(ranges));
  }

  /** Like {@link #addRange} but expects any character that is not in the ranges. */
  @CanIgnoreReturnValue
  public RegExComposer addInvertedRange(Object... ranges) {
    return append(Expressions.invertedRange(ranges));
  }

  /**
   * Adds partial expressions wrapped in an "and" expression. All of them have
   * to appear, in order. Example: {@code addAnd("http")} adds {@code http}.
   */
  @CanIgnoreReturnValue
  public RegExComposer addAnd(Object... partialExpressions) {
    return append(Expressions.and(resolve(partialExpressions)));
  }

  /**
   * Adds at least two partial expressions wrapped in an "or" expression.
   * Example: {@code addOr("http", "https")} adds {@code (http|https)}.
   */
  @CanIgnoreReturnValue
  public RegExComposer addOr(Object... partialExpressions) {
    return append(Expressions.or(resolve(partialExpressions)));
  }

  /**
   * Adds partial expressions wrapped in an "option" expression; they may or
   * may not appear. Example: {@code addOption("s")} adds {@code (s)?}.
   */
  @CanIgnoreReturnValue
  public RegExComposer addOption(Object... partialExpressions) {
    return append(Expressions.option(resolve(partialExpressions)));
  }

  /**
   * Adds partial expressions wrapped in a "repetition" expression. They have
   * to appear {@code min} to {@code max} times. Example:
   * {@code addRepetition(2, RepetitionExpression.INFINITE, "ab")} adds
   * <code>ab{2,}</code>.
   *
   * @param min the minimum of repetitions, at least 0
   * @param max the maximum of repetitions, at least {@code min}, or
   *     {@link com.google.regexbuilder.expr.RepetitionExpression#INFINITE}
   */
  @CanIgnoreReturnValue
  public RegExComposer addRepetition(int min, int max, Object... partialExpressions) {
    return append(Expressions.repetition(min, max, resolve(partialExpressions)));
  }

  /**
   * Adds partial expressions wrapped in a "capturing group" expression. The
   * group is reported by {@link #test}. Example: {@code addCapturingGroup("test")}
   * adds {@code (test)}.
   */
  @CanIgnoreReturnValue
  public RegExComposer addCapturingGroup(Object... partialExpressions) {
    return append(Expressions.capturingGroup(resolve(partialExpressions)));
  }

  /**
   * Alias for {@link #addAnd}. The partial expressions are concatenated
   * without any group syntax.
   */
  @CanIgnoreReturnValue
  public RegExComposer addNonCapturingGroup(Object... partialExpressions) {
    return addAnd(partialExpressions);
  }

  /**
   * Adds comments wrapped in a "comment" expression, e.g.
   * {@code (?#This is a comment)}. Comments are not quoted and must not
   * contain closing parentheses.
   */
  @CanIgnoreReturnValue
  public RegExComposer addComment(Object... comments) {
    return append(Expressions.comment(comments));
  }

  /** Adds partial expressions wrapped in a "raw" expression. Nothing is quoted. */
  @CanIgnoreReturnValue
  public RegExComposer addRaw(Object... partialExpressions) {
    return append(Expressions.raw(resolve(partialExpressions)));
  }

  /** Activates the "insensitive" ("i") modifier. */
  @CanIgnoreReturnValue
  public RegExComposer setInsensitiveModifier() {
    return setInsensitiveModifier(true);
  }

  /** Activates or deactivates the "insensitive" ("i") modifier. */
  @CanIgnoreReturnValue
  public RegExComposer setInsensitiveModifier(boolean active) {
    return setModifier(Modifier.INSENSITIVE, active);
  }

  /** Activates the "multi line" ("m") modifier. */
  @CanIgnoreReturnValue
  public RegExComposer setMultiLineModifier() {
    return setMultiLineModifier(true);
  }

  /** Activates or deactivates the "multi line" ("m") modifier. */
  @CanIgnoreReturnValue
  public RegExComposer setMultiLineModifier(boolean active) {
    return setModifier(Modifier.MULTI_LINE, active);
  }

  /** Activates the "single line" ("s") modifier. */
  @CanIgnoreReturnValue
  public RegExComposer setSingleLineModifier() {
    return setSingleLineModifier(true);
  }

  /** Activates or deactivates the "single line" ("s") modifier. */
  @CanIgnoreReturnValue
  public RegExComposer setSingleLineModifier(boolean active) {
    return setModifier(Modifier.SINGLE_LINE, active);
  }

  /** Activates the "extended" ("x") modifier. */
  @CanIgnoreReturnValue
  public RegExComposer setExtendedModifier() {
    return setExtendedModifier(true);
  }

  /** Activates or deactivates the "extended" ("x") modifier. */
  @CanIgnoreReturnValue
  public RegExComposer setExtendedModifier(boolean active) {
    return setModifier(Modifier.EXTENDED, active);
  }

  /**
   * Activates or deactivates a modifier by its shortcut.
   *
   * @throws com.google.regexbuilder.expr.ExpressionException if the shortcut is unknown
   */
  @CanIgnoreReturnValue
  public RegExComposer setModifier(String shortcut, boolean active) {
    return setModifier(Modifier.fromShortcut(checkNotNull(shortcut)), active);
  }

  /**
   * Activates or deactivates a modifier by its shortcut letter.
   *
   * @throws com.google.regexbuilder.expr.ExpressionException if the shortcut is unknown
   */
  @CanIgnoreReturnValue
  public RegExComposer setModifier(char shortcut, boolean active) {
    return setModifier(String.valueOf(shortcut), active);
  }

  /**
   * Activates or deactivates a modifier. Activating an active modifier or
   * deactivating an inactive one does nothing.
   */
  @CanIgnoreReturnValue
  public RegExComposer setModifier(Modifier modifier, boolean active) {
    checkNotNull(modifier);
    if (active) {
      modifiers.add(modifier);
    } else {
      modifiers.remove(modifier);
    }
    return this;
  }

  /** Returns the active modifiers in the order in which they were activated. */
  public ImmutableList<Modifier> getActiveModifiers() {
    return ImmutableList.copyOf(modifiers);
  }

  public boolean isModifierActive(Modifier modifier) {
    return modifiers.contains(modifier);
  }

  public boolean isModifierActive(char shortcut) {
    return isModifierActive(String.valueOf(shortcut));
  }

  /** Returns whether the modifier with the shortcut is active; false for unknown shortcuts. */
  public boolean isModifierActive(String shortcut) {
    Modifier modifier = Modifier.lookup(checkNotNull(shortcut));
    return modifier != null && modifiers.contains(modifier);
  }

  /**
   * Tests a subject against the regular expression.
   *
   * @return an empty list if the subject does not match, otherwise the whole
   *     match followed by the capturing groups
   * @throws EngineExecutionException if the engine fails to execute the pattern
   */
  public ImmutableList<String> test(String subject) {
    return options.getEngine().match(toString(), subject);
  }

  /**
   * Replaces all matches of the regular expression in {@code source}.
   *
   * @throws EngineExecutionException if the engine fails to execute the pattern
   */
  public String replace(String replacement, String source) {
    return replace(replacement, source, -1);
  }

  /**
   * Replaces at most {@code limit} matches of the regular expression in
   * {@code source}. A negative limit means no limit.
   *
   * @throws EngineExecutionException if the engine fails to execute the pattern
   */
  public String replace(String replacement, String source, int limit) {
    return replaceWithCount(replacement, source, limit).getResult();
  }

  /**
   * Like {@link #replace(String, String, int)} but also reports how many
   * matches were replaced.
   */
  public Replacement replaceWithCount(String replacement, String source, int limit) {
    return options.getEngine().replace(toString(), replacement, source, limit);
  }

  /**
   * Traverses all partial expressions and their children, no matter how deep
   * they are nested. See {@link ExpressionTraversal} for the order.
   */
  public void traverse(ExpressionTraversal.Callback callback) {
    ExpressionTraversal.traverse(expressions, callback);
  }

  /** Returns an HTML visualisation of the structure of the regular expression. */
  public String getVisualisation() {
    return getVisualisation(true);
  }

  /**
   * Returns a visualisation of the structure of the regular expression.
   *
   * @param html if true, the result is decorated with HTML tags
   */
  public String getVisualisation(boolean html) {
    return ExpressionVisualizer.visualise(
        expressions, html, options.getVisualisationTabSize(), getEscaper());
  }

  /** Returns the number of leaves of the expression tree. */
  public int getSize() {
    return getSize(true);
  }

  /**
   * Returns the number of partial expressions.
   *
   * @param recursive if false, only the expressions on the root level are
   *     counted; if true, the leaves of the expression tree are counted
   */
  public int getSize(boolean recursive) {
    return recursive ? ExpressionTraversal.countLeaves(expressions) : expressions.size();
  }

  /** Returns the partial expressions on the root level. */
  public ImmutableList<Expression> getExpressions() {
    return ImmutableList.copyOf(expressions);
  }

  /** Removes all partial expressions and modifiers and restores the default delimiters. */
  @CanIgnoreReturnValue
  public RegExComposer clear() {
    expressions.clear();
    modifiers.clear();
    start = DELIMITER;
    end = DELIMITER;
    return this;
  }

  public String getStart() {
    return start;
  }

  /** Sets the start of the regular expression. This is a raw string. */
  @CanIgnoreReturnValue
  public RegExComposer setStart(String start) {
    this.start = checkNotNull(start);
    return this;
  }

  public String getEnd() {
    return end;
  }

  /** Sets the end of the regular expression. This is a raw string. */
  @CanIgnoreReturnValue
  public RegExComposer setEnd(String end) {
    this.end = checkNotNull(end);
    return this;
  }

  /** Returns the complete pattern string: start, expressions, end and modifiers. */
  @Override
  public String toString() {
    LiteralEscaper escaper = getEscaper();
    StringBuilder sb = new StringBuilder(start);
    for (Expression expression : expressions) {
      expression.appendTo(sb, escaper);
    }
    sb.append(end);
    for (Modifier modifier : modifiers) {
      sb.append(modifier.getShortcut());
    }
    return sb.toString();
  }

  @CanIgnoreReturnValue
  private RegExComposer append(Expression expression) {
    expressions.add(expression);
    return this;
  }

  /** Replaces builders by what they build. */
  private Object[] resolve(Object[] partialExpressions) {
    Object[] resolved = checkNotNull(partialExpressions).clone();
    for (int i = 0; i < resolved.length; i++) {
      if (resolved[i] instanceof ExpressionBuilder) {
        resolved[i] = ((ExpressionBuilder) resolved[i]).build(this);
      }
    }
    return resolved;
  }

  /** The delimiter is the first character of the start. */
  private char getDelimiter() {
    return start.isEmpty() ? DELIMITER.charAt(0) : start.charAt(0);
  }

  private LiteralEscaper getEscaper() {
    char delimiter = getDelimiter();
    return literal -> options.getEngine().quote(literal, delimiter);
  }

  private static String lineBreak(@Nullable String which) {
    return which == null ? DEFAULT_LINE_BREAK : which;
  }
}
