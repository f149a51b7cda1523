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

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;

/** The outcome of a search and replace. */
@AutoValue
@Immutable
public abstract class Replacement {

  public static Replacement create(String result, int count) {
    return new AutoValue_Replacement(result, count);
  }

  /** Returns the subject with all replacements applied. */
  public abstract String getResult();

  /** Returns how many matches were replaced. */
  public abstract int getCount();
}
