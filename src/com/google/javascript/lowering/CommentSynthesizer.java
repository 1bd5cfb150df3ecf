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

import com.google.common.collect.ImmutableList;
import com.google.javascript.lowering.ast.CommentKind;
import com.google.javascript.lowering.ast.SynthesizedComment;
import java.util.List;

/** Turns comments found in the source text into comments that can be attached to nodes. */
public final class CommentSynthesizer {

  private CommentSynthesizer() {}

  /**
   * Converts the given ranges of {@code code}, keeping their order and line break flags. Line
   * comments starting with {@code ///} are dropped.
   */
  public static ImmutableList<SynthesizedComment> synthesizeCommentRanges(
      String code, List<CommentRange> ranges) {
    ImmutableList.Builder<SynthesizedComment> result = ImmutableList.builder();
    for (CommentRange range : ranges) {
      String text = range.getText(code).trim();
      if (range.getKind() == CommentKind.BLOCK) {
        text = stripBlockDelimiters(text);
      } else {
        if (text.startsWith("///")) {
          continue;
        }
        text = text.substring(2);
      }
      result.add(new SynthesizedComment(range.getKind(), text, range.hasTrailingNewline()));
    }
    return result.build();
  }

  private static String stripBlockDelimiters(String text) {
    if (text.startsWith("/*")) {
      text = text.substring(2);
    }
    if (text.endsWith("*/")) {
      text = text.substring(0, text.length() - 2);
    }
    return text;
  }
}
