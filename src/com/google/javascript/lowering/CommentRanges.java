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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.javascript.lowering.ast.CommentKind;
import org.jspecify.annotations.Nullable;

/**
 * Finds comments in source text. The scans only look at characters; they work on any region of a
 * file, whether or not it lines up with a node boundary.
 */
public final class CommentRanges {

  private CommentRanges() {}

  /**
   * Returns every comment in {@code [start, end)}, in source order. Unlike {@link
   * #getLeadingCommentRanges}, a comment on the same line as {@code start} is not skipped. The scan
   * ends at the first character that is neither whitespace nor part of a comment, and a comment
   * that runs past {@code end} is not reported.
   */
  public static ImmutableList<CommentRange> getAllLeadingCommentRanges(
      String code, int start, int end) {
    checkArgument(start <= end && end <= code.length(), "Bad range [%s, %s)", start, end);
    if (start < 0) {
      return ImmutableList.of();
    }
    return scan(code, start, end, false, true);
  }

  /**
   * Returns the comments that lead the token after {@code pos}. When {@code pos} is not the start
   * of the file, comments on the line of {@code pos} are taken to trail the previous token and are
   * skipped.
   */
  public static ImmutableList<CommentRange> getLeadingCommentRanges(String code, int pos) {
    if (pos < 0 || pos > code.length()) {
      return ImmutableList.of();
    }
    return scan(code, pos, code.length(), false, pos == 0);
  }

  /** Returns the comments after {@code pos} up to the next line break. */
  public static ImmutableList<CommentRange> getTrailingCommentRanges(String code, int pos) {
    if (pos < 0 || pos > code.length()) {
      return ImmutableList.of();
    }
    return scan(code, pos, code.length(), true, true);
  }

  /**
   * Returns every comment in {@code [start, end)}, skipping punctuation and keywords between them.
   * The range must not contain string literals.
   */
  public static ImmutableList<CommentRange> getCommentRangesBetweenTokens(
      String code, int start, int end) {
    checkArgument(start <= end && end <= code.length(), "Bad range [%s, %s)", start, end);
    ImmutableList.Builder<CommentRange> result = ImmutableList.builder();
    int pos = Math.max(start, 0);
    while (pos < end) {
      if (startsComment(code, pos, end)) {
        ImmutableList<CommentRange> run = scan(code, pos, end, false, true);
        if (run.isEmpty()) {
          break;
        }
        result.addAll(run);
        pos = run.get(run.size() - 1).getEnd();
      } else {
        pos++;
      }
    }
    return result.build();
  }

  /** Returns the offset of the first character at or after {@code pos} that is not trivia. */
  public static int skipTrivia(String code, int pos) {
    while (pos < code.length()) {
      char ch = code.charAt(pos);
      if (isLineBreak(ch) || isWhiteSpaceSingleLine(ch)) {
        pos++;
      } else if (ch == '/' && pos + 1 < code.length() && code.charAt(pos + 1) == '/') {
        pos += 2;
        while (pos < code.length() && !isLineBreak(code.charAt(pos))) {
          pos++;
        }
      } else if (ch == '/' && pos + 1 < code.length() && code.charAt(pos + 1) == '*') {
        int close = code.indexOf("*/", pos + 2);
        pos = close < 0 ? code.length() : close + 2;
      } else {
        break;
      }
    }
    return pos;
  }

  private static ImmutableList<CommentRange> scan(
      String code, int pos, int end, boolean trailing, boolean collecting) {
    ImmutableList.Builder<CommentRange> result = ImmutableList.builder();

    // The last comment is held back until we know whether a line break follows it.
    @Nullable CommentKind pendingKind = null;
    int pendingPos = 0;
    int pendingEnd = 0;
    boolean pendingHasTrailingNewline = false;

    scan:
    while (pos < end) {
      char ch = code.charAt(pos);
      if (isLineBreak(ch)) {
        if (ch == '\r' && pos + 1 < end && code.charAt(pos + 1) == '\n') {
          pos++;
        }
        pos++;
        if (trailing) {
          break;
        }
        collecting = true;
        if (pendingKind != null) {
          pendingHasTrailingNewline = true;
        }
        continue;
      }
      if (isWhiteSpaceSingleLine(ch)) {
        pos++;
        continue;
      }
      if (ch != '/' || pos + 1 >= end) {
        break;
      }
      char next = code.charAt(pos + 1);
      CommentKind kind;
      boolean hasTrailingNewline = false;
      int commentStart = pos;
      if (next == '/') {
        kind = CommentKind.LINE;
        pos += 2;
        while (pos < code.length()) {
          if (isLineBreak(code.charAt(pos))) {
            hasTrailingNewline = true;
            break;
          }
          pos++;
        }
      } else if (next == '*') {
        kind = CommentKind.BLOCK;
        int close = code.indexOf("*/", pos + 2);
        pos = close < 0 ? code.length() : close + 2;
      } else {
        break;
      }
      if (pos > end) {
        break scan;
      }
      if (collecting) {
        if (pendingKind != null) {
          result.add(
              new CommentRange(pendingKind, pendingPos, pendingEnd, pendingHasTrailingNewline));
        }
        pendingKind = kind;
        pendingPos = commentStart;
        pendingEnd = pos;
        pendingHasTrailingNewline = hasTrailingNewline;
      }
    }
    if (pendingKind != null) {
      result.add(new CommentRange(pendingKind, pendingPos, pendingEnd, pendingHasTrailingNewline));
    }
    return result.build();
  }

  private static boolean startsComment(String code, int pos, int end) {
    if (code.charAt(pos) != '/' || pos + 1 >= end) {
      return false;
    }
    char next = code.charAt(pos + 1);
    return next == '/' || next == '*';
  }

  static boolean isLineBreak(char ch) {
    return ch == '\n' || ch == '\r' || ch == '\u2028' || ch == '\u2029';
  }

  private static boolean isWhiteSpaceSingleLine(char ch) {
    switch (ch) {
      case ' ':
      case '\t':
      case '\u000B':
      case '\f':
      case '\u00A0':
      case '\uFEFF':
        return true;
      default:
        return ch > 127 && Character.isSpaceChar(ch);
    }
  }
}
