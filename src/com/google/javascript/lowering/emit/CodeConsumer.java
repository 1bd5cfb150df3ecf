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

import com.google.javascript.lowering.ast.Node;

/** Abstracts the output of the {@link CodeGenerator}. */
abstract class CodeConsumer {

  /** Called when the code for a statement is about to be appended. */
  void startSourceMapping(Node node) {}

  /** Appends code, indenting it if it starts a line. */
  abstract void append(String str);

  /** Ends the current line unless it is empty. */
  abstract void startNewLine();

  /** Returns whether nothing has been appended to the current line. */
  abstract boolean isAtLineStart();

  abstract void increaseIndent();

  abstract void decreaseIndent();

  void add(String newcode) {
    append(newcode);
  }

  void beginBlock() {
    append("{");
    increaseIndent();
    startNewLine();
  }

  void endBlock() {
    decreaseIndent();
    startNewLine();
    append("}");
  }
}
