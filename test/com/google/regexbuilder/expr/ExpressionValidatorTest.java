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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ExpressionValidatorTest {

  @Test
  public void testIsScalar() {
    assertThat(ExpressionValidator.isScalar("a")).isTrue();
    assertThat(ExpressionValidator.isScalar(new StringBuilder())).isTrue();
    assertThat(ExpressionValidator.isScalar(1.5)).isTrue();
    assertThat(ExpressionValidator.isScalar(false)).isTrue();
    assertThat(ExpressionValidator.isScalar('c')).isTrue();
    assertThat(ExpressionValidator.isScalar(null)).isFalse();
    assertThat(ExpressionValidator.isScalar(new Object())).isFalse();
    assertThat(ExpressionValidator.isScalar(Expressions.and())).isFalse();
  }

  @Test
  public void testCheckChildren() {
    List<Object> children = Arrays.<Object>asList("a", Expressions.raw("b"), 3);
    assertThat(ExpressionValidator.checkChildren(ExpressionType.AND, children))
        .isSameInstanceAs(children);
  }

  @Test
  public void testCheckChildrenArity() {
    ExpressionException e =
        assertThrows(
            ExpressionException.class,
            () ->
                ExpressionValidator.checkChildren(
                    ExpressionType.CAPTURING_GROUP, ImmutableList.of()));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("CapturingGroup expression expects at least 1 partial expression(s) but got 0");
  }

  @Test
  public void testCheckChildrenInvalidChild() {
    ExpressionException e =
        assertThrows(
            ExpressionException.class,
            () ->
                ExpressionValidator.checkChildren(
                    ExpressionType.AND, Arrays.<Object>asList("a", "b", new int[0])));
    assertThat(e.getType()).isEqualTo(ExpressionErrors.INVALID_ARGUMENT);
    assertThat(e).hasMessageThat().startsWith("Expected the 3. partial expression to be");
  }

  @Test
  public void testCheckRanges() {
    ExpressionValidator.checkRanges(ImmutableList.of("a-z", "[", "\\]", 0));

    ExpressionException e =
        assertThrows(
            ExpressionException.class,
            () -> ExpressionValidator.checkRanges(ImmutableList.of("a-z", "a]")));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("Closing square brackets have to be escaped, see the 2. range: a]");
  }

  @Test
  public void testCheckRangesCountsEscapes() {
    assertThrows(
        ExpressionException.class,
        () -> ExpressionValidator.checkRanges(ImmutableList.of("\\]]")));
  }

  @Test
  public void testCheckComments() {
    ExpressionValidator.checkComments(ImmutableList.of("a comment (", 12));

    ExpressionException e =
        assertThrows(
            ExpressionException.class,
            () -> ExpressionValidator.checkComments(ImmutableList.of("ab)c")));
    assertThat(e.getType()).isEqualTo(ExpressionErrors.MALFORMED_COMMENT);
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            "Comments are not allowed to include a closing bracket"
                + " but there is one in the 1. comment at position 2");
  }

  @Test
  public void testCheckCommentsCountsCodePoints() {
    ExpressionException e =
        assertThrows(
            ExpressionException.class,
            () -> ExpressionValidator.checkComments(ImmutableList.of("\uD83D\uDE00a)")));
    assertThat(e).hasMessageThat().endsWith("1. comment at position 2");
  }

  @Test
  public void testCheckRepetitionBounds() {
    ExpressionValidator.checkRepetitionBounds(0, 0);
    ExpressionValidator.checkRepetitionBounds(3, RepetitionExpression.INFINITE);
    ExpressionValidator.checkRepetitionBounds(1000, 1000);

    ExpressionException e =
        assertThrows(
            ExpressionException.class, () -> ExpressionValidator.checkRepetitionBounds(-1, 2));
    assertThat(e).hasMessageThat().isEqualTo(
        "Invalid repetition bounds min=-1, max=2: the minimum must be >= 0");

    e = assertThrows(
        ExpressionException.class, () -> ExpressionValidator.checkRepetitionBounds(2, 1));
    assertThat(e).hasMessageThat().endsWith("the maximum must be >= the minimum");

    e = assertThrows(
        ExpressionException.class, () -> ExpressionValidator.checkRepetitionBounds(0, -5));
    assertThat(e).hasMessageThat().endsWith("the maximum must be >= 0 or INFINITE");
  }

  @Test
  public void testErrorTypeIdentity() {
    ErrorType copy = ErrorType.make("REGEX_MALFORMED_RANGE", "other");
    assertThat(copy).isEqualTo(ExpressionErrors.MALFORMED_RANGE);
    assertThat(copy.hashCode()).isEqualTo(ExpressionErrors.MALFORMED_RANGE.hashCode());
    assertThat(ExpressionErrors.INVALID_ARGUMENT).isNotEqualTo(ExpressionErrors.MALFORMED_RANGE);
  }
}
