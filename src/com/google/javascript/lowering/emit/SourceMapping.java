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

package com.google.javascript.lowering.emit;

import com.google.errorprone.annotations.Immutable;
import java.util.Objects;

/**
 * Maps a position in the printed code to a position in the source file. Lines are 1-based,
 * columns 0-based.
 */
@Immutable
public final class SourceMapping {
  private final int generatedLine;
  private final int generatedColumn;
  private final int originalLine;
  private final int originalColumn;

  public SourceMapping(
      int generatedLine, int generatedColumn, int originalLine, int originalColumn) {
    this.generatedLine = generatedLine;
    this.generatedColumn = generatedColumn;
    this.originalLine = originalLine;
    this.originalColumn = originalColumn;
  }

  public int getGeneratedLine() {
    return generatedLine;
  }

  public int getGeneratedColumn() {
    return generatedColumn;
  }

  public int getOriginalLine() {
    return originalLine;
  }

  public int getOriginalColumn() {
    return originalColumn;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof SourceMapping)) {
      return false;
    }
    SourceMapping that = (SourceMapping) o;
    return generatedLine == that.generatedLine
        && generatedColumn == that.generatedColumn
        && originalLine == that.originalLine
        && originalColumn == that.originalColumn;
  }

  @Override
  public int hashCode() {
    return Objects.hash(generatedLine, generatedColumn, originalLine, originalColumn);
  }

  @Override
  public String toString() {
    return generatedLine + ":" + generatedColumn + " -> " + originalLine + ":" + originalColumn;
  }
}
