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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.regexbuilder.expr.ExpressionErrors;
import com.google.regexbuilder.expr.ExpressionException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ModifierTest {

  @Test
  public void testFromShortcut() {
    assertThat(Modifier.fromShortcut("i")).isEqualTo(Modifier.INSENSITIVE);
    assertThat(Modifier.fromShortcut("m")).isEqualTo(Modifier.MULTI_LINE);
    assertThat(Modifier.fromShortcut("s")).isEqualTo(Modifier.SINGLE_LINE);
    assertThat(Modifier.fromShortcut("x")).isEqualTo(Modifier.EXTENDED);
  }

  @Test
  public void testShortcutsAreSingleLetters() {
    assertThat(Modifier.lookup("")).isNull();
    assertThat(Modifier.lookup("im")).isNull();
    assertThat(Modifier.lookup("I")).isNull();
  }

  @Test
  public void testUnknownShortcut() {
    ExpressionException e =
        assertThrows(ExpressionException.class, () -> Modifier.fromShortcut("u"));
    assertThat(e.getType()).isEqualTo(ExpressionErrors.INVALID_MODIFIER);
    assertThat(e).hasMessageThat().contains("\"u\"");
  }
}
