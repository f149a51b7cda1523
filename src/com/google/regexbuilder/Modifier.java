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

import com.google.common.base.Joiner;
import com.google.regexbuilder.expr.ExpressionErrors;
import com.google.regexbuilder.expr.ExpressionException;
import org.jspecify.annotations.Nullable;

/**
 * Flags that alter how the whole regular expression is matched. Each modifier
 * is written as a single letter after the end delimiter.
 */
public enum Modifier {
  /** Letters in the pattern match both upper and lower case letters. */
  INSENSITIVE('i'),

  /** Treats the subject as multiple lines, ^ and $ match at line breaks. */
  MULTI_LINE('m'),

  /** A dot matches all characters, including new lines. */
  SINGLE_LINE('s'),

  /** Whitespace in the pattern is ignored. */
  EXTENDED('x');

  private final char shortcut;

  Modifier(char shortcut) {
    this.shortcut = shortcut;
  }

  public char getShortcut() {
    return shortcut;
  }

  /**
   * Returns the modifier with the given shortcut.
   *
   * @throws ExpressionException if there is no such modifier
   */
  public static Modifier fromShortcut(String shortcut) {
    Modifier modifier = lookup(shortcut);
    if (modifier == null) {
      throw new ExpressionException(
          ExpressionErrors.INVALID_MODIFIER, shortcut, Joiner.on(", ").join(shortcuts()));
    }
    return modifier;
  }

  /** Returns the modifier with the given shortcut or null. */
  static @Nullable Modifier lookup(String shortcut) {
    for (Modifier modifier : values()) {
      if (shortcut.length() == 1 && shortcut.charAt(0) == modifier.shortcut) {
        return modifier;
      }
    }
    return null;
  }

  private static Character[] shortcuts() {
    Modifier[] modifiers = values();
    Character[] shortcuts = new Character[modifiers.length];
    for (int i = 0; i < modifiers.length; i++) {
      shortcuts[i] = modifiers[i].shortcut;
    }
    return shortcuts;
  }
}
