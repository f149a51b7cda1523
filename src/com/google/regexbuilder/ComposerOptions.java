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

import com.google.regexbuilder.engine.JavaRegExEngine;
import com.google.regexbuilder.engine.RegExEngine;

/** Options for a {@link RegExComposer}. */
public class ComposerOptions {

  /** Number of spaces per level when the expression is visualised. */
  private int visualisationTabSize = 2;

  /** Executes the composed patterns and escapes literals. */
  private RegExEngine engine = JavaRegExEngine.getDefault();

  public int getVisualisationTabSize() {
    return visualisationTabSize;
  }

  public void setVisualisationTabSize(int visualisationTabSize) {
    checkArgument(visualisationTabSize >= 0, "Negative tab size: %s", visualisationTabSize);
    this.visualisationTabSize = visualisationTabSize;
  }

  public RegExEngine getEngine() {
    return engine;
  }

  public void setEngine(RegExEngine engine) {
    this.engine = checkNotNull(engine);
  }
}
