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

/**
 * The {@code StaticSourceFile} contains information about an input file.
 *
 * <p>Implementations must be immutable: many trees may share one file.
 */
public interface StaticSourceFile {
  /** The name of the file. Must be unique across all files in one run. */
  String getName();

  /** The full source text. */
  String getCode();

  /**
   * Returns the offset of the given line number relative to the file start.
   *
   * @param lineNumber the 1-based line of the input to get the absolute offset of.
   * @throws IllegalArgumentException if lineNumber is less than 1 or greater than the number of
   *     lines in the source.
   */
  int getLineOffset(int lineNumber);

  /**
   * Gets the 1-based line number of the given source offset.
   *
   * @param offset An absolute file offset.
   * @return The 1-based line number of that offset. The behavior is undefined if this offset does
   *     not exist in the source file.
   */
  int getLineOfOffset(int offset);

  /**
   * Gets the 0-based column number of the given source offset.
   *
   * @param offset An absolute file offset.
   */
  int getColumnOfOffset(int offset);
}
