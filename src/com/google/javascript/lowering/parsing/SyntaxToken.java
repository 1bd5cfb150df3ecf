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

package com.google.javascript.lowering.parsing;

import org.jspecify.annotations.Nullable;

/**
 * A token of the source text.
 *
 * <p>{@code fullStart} is where the trivia before the token begins, that is, the end of the
 * previous token.
 */
final class SyntaxToken {
  final TokenType type;
  /** Identifier name, keyword, decoded string value or number source. */
  final @Nullable String value;

  final int fullStart;
  final int start;
  final int end;
  final boolean precededByLineBreak;

  SyntaxToken(
      TokenType type,
      @Nullable String value,
      int fullStart,
      int start,
      int end,
      boolean precededByLineBreak) {
    this.type = type;
    this.value = value;
    this.fullStart = fullStart;
    this.start = start;
    this.end = end;
    this.precededByLineBreak = precededByLineBreak;
  }

  boolean isIdentifier(String name) {
    return type == TokenType.IDENTIFIER && name.equals(value);
  }

  @Override
  public String toString() {
    return value != null ? value : type.toString();
  }
}
