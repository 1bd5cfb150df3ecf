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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import com.google.javascript.lowering.CommentRanges;
import com.google.javascript.lowering.LoweringOptions;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.StaticSourceFile;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** CodePrinter prints out code from a tree, one statement per line. */
public final class CodePrinter {

  private CodePrinter() {}

  private static final class PrettyCodePrinter extends CodeConsumer {
    private final StringBuilder code = new StringBuilder(1024);
    private final String indent;
    private final String lineSeparator;
    private final @Nullable StaticSourceFile sourceFile;
    private final @Nullable List<SourceMapping> mappings;

    private int indentLevel = 0;
    private int lineIndex = 0;
    private int lineLength = 0;

    PrettyCodePrinter(
        String indent,
        String lineSeparator,
        @Nullable StaticSourceFile sourceFile,
        @Nullable List<SourceMapping> mappings) {
      this.indent = indent;
      this.lineSeparator = lineSeparator;
      this.sourceFile = sourceFile;
      this.mappings = mappings;
    }

    String getCode() {
      return code.toString();
    }

    @Override
    void startSourceMapping(Node node) {
      int pos = node.getSourceMapPos();
      if (mappings == null || sourceFile == null || pos < 0) {
        return;
      }
      int originalOffset = CommentRanges.skipTrivia(sourceFile.getCode(), pos);
      int column = lineLength == 0 ? indentLevel * indent.length() : lineLength;
      mappings.add(
          new SourceMapping(
              lineIndex + 1,
              column,
              sourceFile.getLineOfOffset(originalOffset),
              sourceFile.getColumnOfOffset(originalOffset)));
    }

    /**
     * Appends a string to the code, keeping track of the current line. Code that starts a line is
     * indented.
     */
    @Override
    void append(String str) {
      if (str.isEmpty()) {
        return;
      }
      if (lineLength == 0 && indentLevel > 0) {
        String indentation = Strings.repeat(indent, indentLevel);
        code.append(indentation);
        lineLength = indentation.length();
      }
      code.append(str);
      // Source comments may span lines.
      int lastNewline = str.lastIndexOf('\n');
      if (lastNewline == -1) {
        lineLength += str.length();
      } else {
        for (int i = 0; i <= lastNewline; i++) {
          if (str.charAt(i) == '\n') {
            lineIndex++;
          }
        }
        lineLength = str.length() - lastNewline - 1;
      }
    }

    @Override
    void startNewLine() {
      if (lineLength > 0) {
        code.append(lineSeparator);
        lineIndex++;
        lineLength = 0;
      }
    }

    @Override
    boolean isAtLineStart() {
      return lineLength == 0;
    }

    @Override
    void increaseIndent() {
      indentLevel++;
    }

    @Override
    void decreaseIndent() {
      indentLevel--;
    }
  }

  public static final class Builder {
    private final Node root;
    private LoweringOptions options = new LoweringOptions();
    private @Nullable StaticSourceFile sourceFile = null;
    private @Nullable List<SourceMapping> sourceMappings = null;

    /**
     * Sets the root node from which to generate the source code.
     *
     * @param node The root node.
     */
    public Builder(Node node) {
      root = checkNotNull(node);
    }

    /** Sets the indentation and line separator. */
    public Builder setOptions(LoweringOptions options) {
      this.options = checkNotNull(options);
      return this;
    }

    /**
     * Sets the file the tree was parsed from. Without it, no source comments are printed and no
     * source mappings are recorded.
     */
    public Builder setSourceFile(@Nullable StaticSourceFile sourceFile) {
      this.sourceFile = sourceFile;
      return this;
    }

    /** Collects a mapping for each printed statement that has a source map range. */
    public Builder setSourceMappings(List<SourceMapping> sourceMappings) {
      this.sourceMappings = checkNotNull(sourceMappings);
      return this;
    }

    /** Generates the source code and returns it. */
    public String build() {
      PrettyCodePrinter printer =
          new PrettyCodePrinter(
              options.getIndent(), options.getLineSeparator(), sourceFile, sourceMappings);
      new CodeGenerator(printer, sourceFile).add(root);
      return printer.getCode();
    }
  }
}
