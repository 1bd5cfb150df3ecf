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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Strings.isNullOrEmpty;
import static java.lang.Math.min;

import com.google.javascript.lowering.ast.StaticSourceFile;
import java.util.Arrays;
import org.jspecify.annotations.Nullable;

/**
 * A source file held in memory.
 *
 * <p>Instances are immutable once created; the line table is computed on first use and never
 * changes after that.
 */
public final class SourceFile implements StaticSourceFile {
  private static final String UTF8_BOM = "\uFEFF";

  /**
   * The file name of the source file.
   *
   * <p>It does not necessarily need to correspond to a real path. But it should be unique. Will
   * appear in error messages.
   */
  private final String fileName;

  private final String code;

  // Source Line Information
  private volatile int @Nullable [] lineOffsets = null;

  private SourceFile(String fileName, String code) {
    if (isNullOrEmpty(fileName)) {
      throw new IllegalArgumentException("a source must have a name");
    }
    this.fileName = fileName;
    // Strip the BOM so that offsets match what the parser sees.
    this.code = code.startsWith(UTF8_BOM) ? code.substring(UTF8_BOM.length()) : code;
  }

  public static SourceFile fromCode(String fileName, String code) {
    return new SourceFile(fileName, checkNotNull(code));
  }

  @Override
  public String getName() {
    return fileName;
  }

  @Override
  public String getCode() {
    return code;
  }

  @Override
  public int getLineOffset(int lineno) {
    int[] offsets = findLineOffsets();
    if (lineno < 1 || lineno > offsets.length) {
      throw new IllegalArgumentException(
          "Expected line number between 1 and " + offsets.length + "\nActual: " + lineno);
    }
    return offsets[lineno - 1];
  }

  @Override
  public int getLineOfOffset(int offset) {
    int[] offsets = findLineOffsets();
    int search = Arrays.binarySearch(offsets, offset);
    if (search >= 0) {
      return search + 1; // lines are 1-based.
    } else {
      int insertionPoint = -1 * (search + 1);
      return min(insertionPoint - 1, offsets.length - 1) + 1;
    }
  }

  @Override
  public int getColumnOfOffset(int offset) {
    int line = getLineOfOffset(offset);
    return offset - findLineOffsets()[line - 1];
  }

  private int[] findLineOffsets() {
    int[] offsets = this.lineOffsets;
    if (offsets != null) {
      return offsets;
    }
    int numLines = 1;
    for (int i = 0; i < code.length(); i++) {
      if (code.charAt(i) == '\n') {
        numLines++;
      }
    }
    offsets = new int[numLines];
    int index = 1; // start at 1 since the offset for line 0 is always at byte 0
    int offset = 0;
    while ((offset = code.indexOf('\n', offset)) != -1) {
      // +1 because this is the offset of the next line which is one past the newline
      offset++;
      offsets[index++] = offset;
    }
    this.lineOffsets = offsets;
    return offsets;
  }

  @Override
  public String toString() {
    return fileName;
  }
}
