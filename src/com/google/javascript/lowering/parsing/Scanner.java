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

import com.google.common.collect.ImmutableList;
import com.google.javascript.lowering.CommentRange;
import com.google.javascript.lowering.ast.CommentKind;
import com.google.javascript.lowering.ast.StaticSourceFile;
import java.util.ArrayList;
import java.util.List;

/** Splits a source file into tokens and records the comments between them. */
final class Scanner {
  private final StaticSourceFile file;
  private final String code;
  private int offset = 0;
  private final List<CommentRange> comments = new ArrayList<>();

  Scanner(StaticSourceFile file) {
    this.file = file;
    this.code = file.getCode();
  }

  /** Scans the whole file. The last token is always {@link TokenType#END_OF_FILE}. */
  ImmutableList<SyntaxToken> scanAll() {
    ImmutableList.Builder<SyntaxToken> tokens = ImmutableList.builder();
    SyntaxToken token;
    do {
      token = nextToken();
      tokens.add(token);
    } while (token.type != TokenType.END_OF_FILE);
    return tokens.build();
  }

  ImmutableList<CommentRange> getComments() {
    return ImmutableList.copyOf(comments);
  }

  private SyntaxToken nextToken() {
    int fullStart = offset;
    boolean lineBreak = skipTrivia();
    int start = offset;
    if (offset >= code.length()) {
      return new SyntaxToken(TokenType.END_OF_FILE, null, fullStart, start, start, lineBreak);
    }
    char ch = code.charAt(offset);
    if (isIdentifierStart(ch)) {
      while (offset < code.length() && isIdentifierPart(code.charAt(offset))) {
        offset++;
      }
      String word = code.substring(start, offset);
      TokenType keyword = TokenType.getKeyword(word);
      TokenType type = keyword != null ? keyword : TokenType.IDENTIFIER;
      return new SyntaxToken(type, word, fullStart, start, offset, lineBreak);
    }
    if (isDigit(ch)
        || (ch == '.' && offset + 1 < code.length() && isDigit(code.charAt(offset + 1)))) {
      scanNumber();
      return new SyntaxToken(
          TokenType.NUMBER, code.substring(start, offset), fullStart, start, offset, lineBreak);
    }
    if (ch == '\'' || ch == '"') {
      String value = scanString(ch);
      return new SyntaxToken(TokenType.STRING, value, fullStart, start, offset, lineBreak);
    }
    TokenType type = scanPunctuator(ch);
    return new SyntaxToken(type, null, fullStart, start, offset, lineBreak);
  }

  private TokenType scanPunctuator(char ch) {
    int start = offset;
    offset++;
    switch (ch) {
      case '{':
        return TokenType.OPEN_CURLY;
      case '}':
        return TokenType.CLOSE_CURLY;
      case '(':
        return TokenType.OPEN_PAREN;
      case ')':
        return TokenType.CLOSE_PAREN;
      case ';':
        return TokenType.SEMI_COLON;
      case ',':
        return TokenType.COMMA;
      case '.':
        if (code.startsWith("..", offset)) {
          offset += 2;
          return TokenType.SPREAD;
        }
        return TokenType.PERIOD;
      case '=':
        if (peekChar('>')) {
          offset++;
          return TokenType.ARROW;
        }
        if (peekChar('=')) {
          throw reportError(start, "Comparison operators are not supported");
        }
        return TokenType.EQUAL;
      case '+':
        return TokenType.PLUS;
      case '-':
        return TokenType.MINUS;
      case '*':
        return TokenType.STAR;
      case '/':
        return TokenType.SLASH;
      default:
        throw reportError(start, "Unexpected character '" + ch + "'");
    }
  }

  private boolean peekChar(char expected) {
    return offset < code.length() && code.charAt(offset) == expected;
  }

  private void scanNumber() {
    if (code.startsWith("0x", offset) || code.startsWith("0X", offset)) {
      offset += 2;
      while (offset < code.length() && Character.digit(code.charAt(offset), 16) != -1) {
        offset++;
      }
      return;
    }
    while (offset < code.length() && isDigit(code.charAt(offset))) {
      offset++;
    }
    if (peekChar('.')) {
      offset++;
      while (offset < code.length() && isDigit(code.charAt(offset))) {
        offset++;
      }
    }
    if (peekChar('e') || peekChar('E')) {
      offset++;
      if (peekChar('+') || peekChar('-')) {
        offset++;
      }
      while (offset < code.length() && isDigit(code.charAt(offset))) {
        offset++;
      }
    }
  }

  private String scanString(char quote) {
    int start = offset;
    offset++;
    StringBuilder value = new StringBuilder();
    while (true) {
      if (offset >= code.length() || isLineBreak(code.charAt(offset))) {
        throw reportError(start, "Unterminated string literal");
      }
      char ch = code.charAt(offset++);
      if (ch == quote) {
        return value.toString();
      }
      if (ch != '\\') {
        value.append(ch);
        continue;
      }
      if (offset >= code.length()) {
        throw reportError(start, "Unterminated string literal");
      }
      char escaped = code.charAt(offset++);
      switch (escaped) {
        case 'n':
          value.append('\n');
          break;
        case 'r':
          value.append('\r');
          break;
        case 't':
          value.append('\t');
          break;
        case 'b':
          value.append('\b');
          break;
        case 'f':
          value.append('\f');
          break;
        case 'v':
          value.append('\u000B');
          break;
        case '0':
          value.append('\0');
          break;
        case 'u':
          if (offset + 4 > code.length()) {
            throw reportError(offset, "Invalid unicode escape");
          }
          try {
            value.append((char) Integer.parseInt(code.substring(offset, offset + 4), 16));
          } catch (NumberFormatException e) {
            throw reportError(offset, "Invalid unicode escape");
          }
          offset += 4;
          break;
        default:
          value.append(escaped);
      }
    }
  }

  /**
   * Skips whitespace and comments, recording the comments.
   *
   * @return whether a line break was skipped
   */
  private boolean skipTrivia() {
    boolean lineBreak = false;
    while (offset < code.length()) {
      char ch = code.charAt(offset);
      if (isLineBreak(ch)) {
        lineBreak = true;
        offset++;
      } else if (Character.isWhitespace(ch) || Character.isSpaceChar(ch) || ch == '\uFEFF') {
        offset++;
      } else if (code.startsWith("//", offset)) {
        int start = offset;
        while (offset < code.length() && !isLineBreak(code.charAt(offset))) {
          offset++;
        }
        comments.add(new CommentRange(CommentKind.LINE, start, offset, offset < code.length()));
      } else if (code.startsWith("/*", offset)) {
        int start = offset;
        int close = code.indexOf("*/", offset + 2);
        if (close < 0) {
          throw reportError(start, "Unterminated comment");
        }
        offset = close + 2;
        if (code.substring(start, offset).indexOf('\n') != -1) {
          lineBreak = true;
        }
        comments.add(new CommentRange(CommentKind.BLOCK, start, offset, isLineBreakNext(offset)));
      } else {
        break;
      }
    }
    return lineBreak;
  }

  private boolean isLineBreakNext(int pos) {
    while (pos < code.length()) {
      char ch = code.charAt(pos);
      if (isLineBreak(ch)) {
        return true;
      }
      if (ch != ' ' && ch != '\t') {
        return false;
      }
      pos++;
    }
    return false;
  }

  ParseException reportError(int pos, String message) {
    return new ParseException(
        message, file.getName(), file.getLineOfOffset(pos), file.getColumnOfOffset(pos));
  }

  private static boolean isLineBreak(char ch) {
    return ch == '\n' || ch == '\r' || ch == '\u2028' || ch == '\u2029';
  }

  private static boolean isDigit(char ch) {
    return ch >= '0' && ch <= '9';
  }

  private static boolean isIdentifierStart(char ch) {
    return Character.isLetter(ch) || ch == '$' || ch == '_';
  }

  private static boolean isIdentifierPart(char ch) {
    return isIdentifierStart(ch) || Character.isDigit(ch);
  }
}
