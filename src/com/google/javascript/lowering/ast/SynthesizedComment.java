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

package com.google.javascript.lowering.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.Immutable;
import java.io.Serializable;
import java.util.Objects;

/**
 * A comment that is attached to a node instead of being read from the source text by the printer.
 *
 * <p>The text has its delimiters removed: a line comment {@code // note} is stored as {@code "
 * note"} and a block comment {@code /* note *}{@code /} as {@code " note "}. Synthesized comments
 * are never positioned; {@link #getPos()} and {@link #getEnd()} always return -1.
 */
@Immutable
public final class SynthesizedComment implements Serializable {
  /** The position of every synthesized comment. */
  public static final int NOT_POSITIONED = -1;

  private final CommentKind kind;
  private final String text;
  private final boolean hasTrailingNewline;

  public SynthesizedComment(CommentKind kind, String text, boolean hasTrailingNewline) {
    this.kind = checkNotNull(kind);
    this.text = checkNotNull(text);
    this.hasTrailingNewline = hasTrailingNewline;
  }

  public static SynthesizedComment line(String text) {
    return new SynthesizedComment(CommentKind.LINE, text, true);
  }

  public static SynthesizedComment block(String text, boolean hasTrailingNewline) {
    return new SynthesizedComment(CommentKind.BLOCK, text, hasTrailingNewline);
  }

  public CommentKind getKind() {
    return kind;
  }

  public boolean isLineComment() {
    return kind == CommentKind.LINE;
  }

  public String getText() {
    return text;
  }

  public boolean hasTrailingNewline() {
    return hasTrailingNewline;
  }

  public int getPos() {
    return NOT_POSITIONED;
  }

  public int getEnd() {
    return NOT_POSITIONED;
  }

  /** Returns the comment with its delimiters put back. */
  public String toSource() {
    return isLineComment() ? "//" + text : "/*" + text + "*/";
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof SynthesizedComment)) {
      return false;
    }
    SynthesizedComment that = (SynthesizedComment) o;
    return kind == that.kind
        && text.equals(that.text)
        && hasTrailingNewline == that.hasTrailingNewline;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, text, hasTrailingNewline);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("kind", kind)
        .add("text", text)
        .add("hasTrailingNewline", hasTrailingNewline)
        .toString();
  }
}
