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
import com.google.javascript.lowering.ast.EmitFlag;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.StaticSourceFile;
import com.google.javascript.lowering.ast.SynthesizedComment;
import com.google.javascript.lowering.ast.Token;
import java.util.List;

/** Creates statements that print nothing except the comments they carry. */
public final class PlaceholderStatements {

  private PlaceholderStatements() {}

  /**
   * Creates a placeholder with an empty range at {@code pos}, or no range when {@code pos} is
   * {@link Node#INVALID_POSITION}.
   */
  public static Node create(
      StaticSourceFile file,
      int pos,
      List<SynthesizedComment> leadingComments,
      List<SynthesizedComment> trailingComments) {
    return Node.builder(Token.NOT_EMITTED)
        .setRange(pos, pos, pos)
        .setStaticSourceFile(file)
        .setLeadingComments(leadingComments)
        .setTrailingComments(trailingComments)
        .addEmitFlag(EmitFlag.NO_COMMENTS)
        .build();
  }

  /**
   * Creates a placeholder that keeps the comments of {@code original}, for rewrites that remove a
   * statement. Synthesized comments are taken over; if {@code original} still reads its comments
   * from the source, those are synthesized first.
   */
  public static Node createWithCommentsFrom(StaticSourceFile file, Node original) {
    ImmutableList.Builder<SynthesizedComment> leading = ImmutableList.builder();
    ImmutableList.Builder<SynthesizedComment> trailing = ImmutableList.builder();
    leading.addAll(original.getLeadingComments());
    if (original.hasValidTextRange() && !original.hasEmitFlag(EmitFlag.NO_COMMENTS)) {
      String code = file.getCode();
      leading.addAll(
          CommentSynthesizer.synthesizeCommentRanges(
              code, CommentRanges.getLeadingCommentRanges(code, original.getPos())));
      trailing.addAll(
          CommentSynthesizer.synthesizeCommentRanges(
              code, CommentRanges.getTrailingCommentRanges(code, original.getEnd())));
    }
    trailing.addAll(original.getTrailingComments());
    return create(file, Node.INVALID_POSITION, leading.build(), trailing.build());
  }
}
