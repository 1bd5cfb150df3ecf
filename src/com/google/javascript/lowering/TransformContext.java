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

import static com.google.common.base.Preconditions.checkState;

import com.google.javascript.lowering.ast.StaticSourceFile;
import org.jspecify.annotations.Nullable;

/**
 * Holds the {@link FileContext} of the file being transformed.
 *
 * <p>Files are transformed one at a time. This class is not thread-safe; each thread that runs a
 * transformation needs its own instance.
 */
public final class TransformContext {
  private @Nullable FileContext fileContext;

  /** Starts a new file, discarding whatever state an earlier file left behind. */
  public FileContext beginFile(StaticSourceFile file) {
    fileContext = new FileContext(file);
    return fileContext;
  }

  /** Drops the state of the current file. */
  public void endFile() {
    fileContext = null;
  }

  public @Nullable FileContext getFileContext() {
    return fileContext;
  }

  /**
   * Returns the context of {@code file}.
   *
   * @throws IllegalStateException if no file was started or a different file was
   */
  public FileContext assertFileContext(StaticSourceFile file) {
    FileContext current = fileContext;
    checkState(
        current != null,
        "Illegal State: FileContext not initialized. "
            + "Did you forget to run the comment preparation pass first? File: %s",
        file.getName());
    checkState(
        current.getFile().getName().equals(file.getName()),
        "Illegal State: File of the FileContext does not match. File: %s",
        file.getName());
    return current;
  }
}
