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

import com.google.regexbuilder.engine.JavaRegExEngine;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ComposerOptionsTest {

  @Test
  public void testDefaults() {
    ComposerOptions options = new ComposerOptions();
    assertThat(options.getVisualisationTabSize()).isEqualTo(2);
    assertThat(options.getEngine()).isSameInstanceAs(JavaRegExEngine.getDefault());
  }

  @Test
  public void testNegativeTabSize() {
    ComposerOptions options = new ComposerOptions();
    assertThrows(IllegalArgumentException.class, () -> options.setVisualisationTabSize(-1));
    assertThat(options.getVisualisationTabSize()).isEqualTo(2);
  }

  @Test
  public void testCustomEngine() {
    ComposerOptions options = new ComposerOptions();
    JavaRegExEngine engine = new JavaRegExEngine(0);
    options.setEngine(engine);

    RegExComposer regEx = RegExComposer.create(options).addDigits();
    assertThat(options.getEngine()).isSameInstanceAs(engine);
    assertThat(regEx.test("ab12")).containsExactly("12");
    assertThat(regEx.test("ab12")).containsExactly("12");
  }
}
