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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.Immutable;
import com.google.javascript.lowering.ast.CommentKind;
import java.util.Objects;

/** The location of one comment in a source text. */
@Immutable
public final class CommentRange {
  private final CommentKind kind;
  private final int pos;
  private final int end;
  private final boolean hasTrailingNewline;

  public CommentRange(CommentKind kind, int pos, int end, boolean hasTrailingNewline) {
    checkArgument(0 <= pos && pos < end, "Invalid comment range [%s, %s)", pos, end);
    this.kind = checkNotNull(kind);
    this.pos = pos;
    this.end = end;
    this.hasTrailingNewline = hasTrailingNewline;
  }

  public CommentKind getKind() {
    return kind;
  }

  /** Offset of the first delimiter character. */
  public int getPos() {
    return pos;
  }

  /** Offset just past the comment; a line comment ends before its line break. */
  public int getEnd() {
    return end;
  }

  public boolean hasTrailingNewline() {
    return hasTrailingNewline;
  }

  /** Returns the raw comment text, delimiters included. */
  public String getText(String code) {
    return code.substring(pos, end);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof CommentRange)) {
      return false;
    }
    CommentRange that = (CommentRange) o;
    return kind == that.kind
        && pos == that.pos
        && end == that.end
        && hasTrailingNewline == that.hasTrailingNewline;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, pos, end, hasTrailingNewline);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("kind", kind)
        .add("pos", pos)
        .add("end", end)
        .add("hasTrailingNewline", hasTrailingNewline)
        .toString();
  }
}
