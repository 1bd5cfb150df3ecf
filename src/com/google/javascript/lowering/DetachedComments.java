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
import com.google.javascript.lowering.ast.StaticSourceFile;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Decides which comments at the edges of a statement list stand on their own, such as a license
 * header at the top of a file or notes after the last statement of a block.
 *
 * <p>A comment is detached when a blank line separates it from the statement next to it.
 */
public final class DetachedComments {

  private DetachedComments() {}

  /**
   * Returns the comment group at the start of {@code [start, end)} when it is detached from the
   * node that begins at {@code end}.
   *
   * <p>The group is the run of comments up to the first blank line between two comments. It is
   * detached only if a blank line also separates it from {@code end}; otherwise it documents that
   * node and the result is empty.
   */
  public static ImmutableList<CommentRange> getDetachedLeadingCommentRanges(
      StaticSourceFile file, int start, int end) {
    ImmutableList<CommentRange> leadingComments =
        CommentRanges.getAllLeadingCommentRanges(file.getCode(), start, end);
    if (leadingComments.isEmpty()) {
      return ImmutableList.of();
    }
    List<CommentRange> detachedComments = new ArrayList<>();
    @Nullable CommentRange lastComment = null;
    for (CommentRange comment : leadingComments) {
      if (lastComment != null) {
        int lastCommentLine = file.getLineOfOffset(lastComment.getEnd());
        int commentLine = file.getLineOfOffset(comment.getPos());
        if (commentLine >= lastCommentLine + 2) {
          break;
        }
      }
      detachedComments.add(comment);
      lastComment = comment;
    }
    CommentRange lastDetached = detachedComments.get(detachedComments.size() - 1);
    int lastCommentLine = file.getLineOfOffset(lastDetached.getEnd());
    int nodeLine = file.getLineOfOffset(end);
    if (nodeLine >= lastCommentLine + 2) {
      return ImmutableList.copyOf(detachedComments);
    }
    return ImmutableList.of();
  }

  /**
   * Returns every comment in {@code [start, end)} as one group. Callers pass the end of the last
   * statement's own trailing comments as {@code start}, so whatever remains belongs to no
   * statement.
   */
  public static ImmutableList<CommentRange> getDetachedTrailingCommentRanges(
      StaticSourceFile file, int start, int end) {
    return CommentRanges.getAllLeadingCommentRanges(file.getCode(), start, end);
  }
}
