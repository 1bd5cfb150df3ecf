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

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/** The kinds of tokens the scanner produces. */
enum TokenType {
  END_OF_FILE("end of input"),
  IDENTIFIER("identifier"),
  NUMBER("number"),
  STRING("string"),

  CLASS("class"),
  CONST("const"),
  DEFAULT("default"),
  ELSE("else"),
  EXPORT("export"),
  EXTENDS("extends"),
  FALSE("false"),
  FUNCTION("function"),
  IF("if"),
  IMPORT("import"),
  LET("let"),
  NEW("new"),
  NULL("null"),
  RETURN("return"),
  SUPER("super"),
  THIS("this"),
  TRUE("true"),
  VAR("var"),

  OPEN_CURLY("{"),
  CLOSE_CURLY("}"),
  OPEN_PAREN("("),
  CLOSE_PAREN(")"),
  SEMI_COLON(";"),
  COMMA(","),
  PERIOD("."),
  SPREAD("..."),
  EQUAL("="),
  ARROW("=>"),
  PLUS("+"),
  MINUS("-"),
  STAR("*"),
  SLASH("/");

  private static final ImmutableMap<String, TokenType> KEYWORDS;

  static {
    ImmutableMap.Builder<String, TokenType> keywords = ImmutableMap.builder();
    for (TokenType type : values()) {
      if (type.isKeyword()) {
        keywords.put(type.value, type);
      }
    }
    KEYWORDS = keywords.buildOrThrow();
  }

  private final String value;

  TokenType(String value) {
    this.value = value;
  }

  boolean isKeyword() {
    return compareTo(CLASS) >= 0 && compareTo(VAR) <= 0;
  }

  static @Nullable TokenType getKeyword(String word) {
    return KEYWORDS.get(word);
  }

  @Override
  public String toString() {
    return value;
  }
}
