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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.UncheckedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A {@link RegExEngine} backed by {@link java.util.regex}.
 *
 * <p>Pattern strings are split with {@link DelimitedPattern}. The modifier
 * letters are mapped onto {@link Pattern} flags and inline comments
 * ({@code (?#...)}), which the JDK does not understand, are removed before
 * the expression is compiled. Compiled patterns are cached; the size of the
 * cache can be set with the {@code regexbuilder.pattern.cachesize} system
 * property.
 *
 * <p>This class is thread safe.
 */
public final class JavaRegExEngine implements RegExEngine {

  private static final Logger logger = Logger.getLogger(JavaRegExEngine.class.getName());

  private static final int PATTERN_CACHE_SIZE =
      Integer.parseInt(System.getProperty("regexbuilder.pattern.cachesize", "500"));

  private static final JavaRegExEngine DEFAULT_INSTANCE =
      new JavaRegExEngine(PATTERN_CACHE_SIZE);

  private final LoadingCache<String, Pattern> patternCache;

  /** Returns the shared instance that uses the configured cache size. */
  public static JavaRegExEngine getDefault() {
    return DEFAULT_INSTANCE;
  }

  public JavaRegExEngine(int cacheSize) {
    checkArgument(cacheSize >= 0, "Negative cache size: %s", cacheSize);
    this.patternCache =
        CacheBuilder.newBuilder()
            .maximumSize(cacheSize)
            .build(
                new CacheLoader<String, Pattern>() {
                  @Override
                  public Pattern load(String pattern) {
                    return compile(pattern);
                  }
                });
  }

  @Override
  public String quote(String literal, char delimiter) {
    return LiteralEscapers.forDelimiter(delimiter).escape(literal);
  }

  @Override
  public ImmutableList<String> match(String pattern, String subject) {
    checkNotNull(subject);
    Matcher matcher = getPattern(pattern).matcher(subject);
    try {
      if (!matcher.find()) {
        return ImmutableList.of();
      }
    } catch (StackOverflowError e) {
      throw failure("Pattern execution exhausted the stack: " + pattern, e);
    }

    int last = matcher.groupCount();
    while (last > 0 && matcher.start(last) == -1) {
      last--;
    }
    ImmutableList.Builder<String> groups = ImmutableList.builder();
    for (int i = 0; i <= last; i++) {
      String group = matcher.group(i);
      groups.add(group == null ? "" : group);
    }
    return groups.build();
  }

  @Override
  public Replacement replace(String pattern, String replacement, String subject, int limit) {
    checkNotNull(replacement);
    checkNotNull(subject);
    Matcher matcher = getPattern(pattern).matcher(subject);
    StringBuilder result = new StringBuilder();
    int count = 0;
    try {
      while ((limit < 0 || count < limit) && matcher.find()) {
        matcher.appendReplacement(result, replacement);
        count++;
      }
    } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
      throw failure("Invalid replacement \"" + replacement + "\" for " + pattern, e);
    } catch (StackOverflowError e) {
      throw failure("Pattern execution exhausted the stack: " + pattern, e);
    }
    matcher.appendTail(result);
    return Replacement.create(result.toString(), count);
  }

  private Pattern getPattern(String pattern) {
    checkNotNull(pattern);
    try {
      return patternCache.getUnchecked(pattern);
    } catch (UncheckedExecutionException e) {
      if (e.getCause() instanceof EngineExecutionException) {
        throw (EngineExecutionException) e.getCause();
      }
      throw failure("Could not compile " + pattern, e.getCause());
    }
  }

  private static Pattern compile(String pattern) {
    DelimitedPattern parts = DelimitedPattern.parse(pattern);
    int flags = toPatternFlags(parts.getModifiers());
    String expression = removeComments(parts.getExpression());
    logger.log(Level.FINE, "Compiling {0} with flags {1}", new Object[] {expression, flags});
    try {
      return Pattern.compile(expression, flags);
    } catch (PatternSyntaxException e) {
      throw failure("Malformed regular expression " + pattern + ": " + e.getDescription(), e);
    }
  }

  @VisibleForTesting
  static int toPatternFlags(String modifiers) {
    int flags = 0;
    for (int i = 0; i < modifiers.length(); i++) {
      char modifier = modifiers.charAt(i);
      switch (modifier) {
        case 'i':
          flags |= Pattern.CASE_INSENSITIVE;
          break;
        case 'm':
          flags |= Pattern.MULTILINE;
          break;
        case 's':
          flags |= Pattern.DOTALL;
          break;
        case 'x':
          flags |= Pattern.COMMENTS;
          break;
        case 'u':
          flags |= Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;
          break;
        default:
          throw new EngineExecutionException("Unknown modifier '" + modifier + "'");
      }
    }
    return flags;
  }

  /** Removes inline comments outside of character classes. */
  @VisibleForTesting
  static String removeComments(String expression) {
    StringBuilder sb = new StringBuilder(expression.length());
    boolean inCharClass = false;
    for (int i = 0; i < expression.length(); i++) {
      char c = expression.charAt(i);
      if (c == '\\' && i + 1 < expression.length()) {
        sb.append(c).append(expression.charAt(++i));
      } else if (inCharClass) {
        inCharClass = c != ']';
        sb.append(c);
      } else if (c == '[') {
        inCharClass = true;
        sb.append(c);
      } else if (expression.startsWith("(?#", i)) {
        int end = expression.indexOf(')', i + 3);
        if (end == -1) {
          throw new EngineExecutionException("Missing ) after comment: " + expression);
        }
        i = end;
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  private static EngineExecutionException failure(String message, Throwable cause) {
    logger.log(Level.WARNING, message, cause);
    return new EngineExecutionException(message, cause);
  }
}
