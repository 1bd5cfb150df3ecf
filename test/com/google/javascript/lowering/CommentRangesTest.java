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

package com.google.javascript.lowering;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.javascript.lowering.ast.CommentKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CommentRangesTest {

  @Test
  public void testAllLeadingCommentsIncludeTheFirstLine() {
    String code = "/* a */ // b\nx";
    assertThat(CommentRanges.getAllLeadingCommentRanges(code, 0, 13))
        .containsExactly(
            new CommentRange(CommentKind.BLOCK, 0, 7, false),
            new CommentRange(CommentKind.LINE, 8, 12, true))
        .inOrder();
  }

  @Test
  public void testAllLeadingCommentsStopAtEnd() {
    String code = "/* a */ /* b */x";
    assertThat(CommentRanges.getAllLeadingCommentRanges(code, 0, 10))
        .containsExactly(new CommentRange(CommentKind.BLOCK, 0, 7, false));
  }

  @Test
  public void testCommentsBetweenTokens() {
    assertThat(CommentRanges.getCommentRangesBetweenTokens("f(/* a */)", 1, 9))
        .containsExactly(new CommentRange(CommentKind.BLOCK, 2, 9, false));
    assertThat(CommentRanges.getCommentRangesBetweenTokens("return /* c */;", 0, 14))
        .containsExactly(new CommentRange(CommentKind.BLOCK, 7, 14, false));
    assertThat(CommentRanges.getCommentRangesBetweenTokens("f(a\n  // c\n)", 3, 11))
        .containsExactly(new CommentRange(CommentKind.LINE, 6, 10, true));
    assertThat(CommentRanges.getCommentRangesBetweenTokens("f(a, b)", 3, 6)).isEmpty();
  }

  @Test
  public void testAllLeadingCommentsOfInvalidStart() {
    assertThat(CommentRanges.getAllLeadingCommentRanges("// a", -1, 4)).isEmpty();
  }

  @Test
  public void testAllLeadingCommentsOfBadRange() {
    assertThrows(
        IllegalArgumentException.class,
        () -> CommentRanges.getAllLeadingCommentRanges("// a", 3, 2));
    assertThrows(
        IllegalArgumentException.class,
        () -> CommentRanges.getAllLeadingCommentRanges("// a", 0, 5));
  }

  @Test
  public void testBlockCommentFollowedByLineBreak() {
    String code = "/* a */\nx";
    assertThat(CommentRanges.getAllLeadingCommentRanges(code, 0, 8))
        .containsExactly(new CommentRange(CommentKind.BLOCK, 0, 7, true));
  }

  @Test
  public void testLeadingCommentsSkipTheLineOfPos() {
    String code = "x; // t\n/* l */ y";
    assertThat(CommentRanges.getLeadingCommentRanges(code, 2))
        .containsExactly(new CommentRange(CommentKind.BLOCK, 8, 15, false));
  }

  @Test
  public void testLeadingCommentsAtStartOfFile() {
    String code = "// a\nx";
    assertThat(CommentRanges.getLeadingCommentRanges(code, 0))
        .containsExactly(new CommentRange(CommentKind.LINE, 0, 4, true));
  }

  @Test
  public void testTrailingCommentsStopAtLineBreak() {
    String code = "x; // t\n/* l */ y";
    assertThat(CommentRanges.getTrailingCommentRanges(code, 2))
        .containsExactly(new CommentRange(CommentKind.LINE, 3, 7, true));
  }

  @Test
  public void testTrailingBlockComments() {
    String code = "f(a /* b */ /* c */, d)";
    assertThat(CommentRanges.getTrailingCommentRanges(code, 3))
        .containsExactly(
            new CommentRange(CommentKind.BLOCK, 4, 11, false),
            new CommentRange(CommentKind.BLOCK, 12, 19, false))
        .inOrder();
  }

  @Test
  public void testNoComments() {
    assertThat(CommentRanges.getTrailingCommentRanges("x;\n// a", 2)).isEmpty();
    assertThat(CommentRanges.getLeadingCommentRanges("x;", 0)).isEmpty();
  }

  @Test
  public void testSkipTrivia() {
    assertThat(CommentRanges.skipTrivia(" /* c */ x", 0)).isEqualTo(9);
    assertThat(CommentRanges.skipTrivia("// c\n  x", 0)).isEqualTo(7);
    assertThat(CommentRanges.skipTrivia("x", 0)).isEqualTo(0);
    assertThat(CommentRanges.skipTrivia("  ", 0)).isEqualTo(2);
  }

  @Test
  public void testCommentText() {
    String code = "x /* c */";
    CommentRange range = CommentRanges.getTrailingCommentRanges(code, 1).get(0);
    assertThat(range.getText(code)).isEqualTo("/* c */");
  }

  @Test
  public void testInvalidCommentRange() {
    assertThrows(
        IllegalArgumentException.class, () -> new CommentRange(CommentKind.LINE, 3, 3, false));
  }
}
