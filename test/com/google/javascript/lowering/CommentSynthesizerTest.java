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
import static com.google.javascript.lowering.LoweringTestUtil.lines;

import com.google.common.collect.ImmutableList;
import com.google.javascript.lowering.ast.CommentKind;
import com.google.javascript.lowering.ast.SynthesizedComment;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CommentSynthesizerTest {

  private static ImmutableList<SynthesizedComment> synthesize(String code) {
    return CommentSynthesizer.synthesizeCommentRanges(
        code, CommentRanges.getAllLeadingCommentRanges(code, 0, code.length()));
  }

  @Test
  public void testDelimitersAreStripped() {
    ImmutableList<SynthesizedComment> comments =
        synthesize(lines("/** doc */", "// line", "/*  padded  */"));
    assertThat(comments)
        .containsExactly(
            new SynthesizedComment(CommentKind.BLOCK, "* doc ", true),
            new SynthesizedComment(CommentKind.LINE, " line", true),
            new SynthesizedComment(CommentKind.BLOCK, "  padded  ", false))
        .inOrder();
  }

  @Test
  public void testTripleSlashDirectivesAreDropped() {
    assertThat(synthesize(lines("/// <reference path=\"x.d.ts\"/>", "// kept")))
        .containsExactly(new SynthesizedComment(CommentKind.LINE, " kept", false));
  }

  @Test
  public void testCommentsPrintAsTheyWereWritten() {
    ImmutableList<SynthesizedComment> comments =
        synthesize(lines("/**", " * Multi", " * line.", " */", "//x"));
    assertThat(comments.get(0).toSource()).isEqualTo(lines("/**", " * Multi", " * line.", " */"));
    assertThat(comments.get(1).toSource()).isEqualTo("//x");
  }

  @Test
  public void testEmptyInput() {
    assertThat(CommentSynthesizer.synthesizeCommentRanges("x", ImmutableList.of())).isEmpty();
  }
}
