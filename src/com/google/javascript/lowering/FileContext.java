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

import com.google.common.collect.ImmutableList;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.StaticSourceFile;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * State shared by the comment passes while one file is transformed.
 *
 * <p>A context belongs to exactly one file. It is created when the comments of the file are
 * prepared and dropped when they have been repaired.
 */
public final class FileContext {
  private final StaticSourceFile file;

  /** Parents recorded after the rewrites ran, keyed by node handle. */
  private final Map<Integer, Node> parentsByHandle = new HashMap<>();

  /** IMPORT and EXPORT statements that name a module. */
  private final List<Node> importOrReexportDeclarations = new ArrayList<>();

  /** Comments ending at or before this offset have been attached already. */
  private int lastCommentEnd = -1;

  FileContext(StaticSourceFile file) {
    this.file = checkNotNull(file);
  }

  public StaticSourceFile getFile() {
    return file;
  }

  public int getLastCommentEnd() {
    return lastCommentEnd;
  }

  /** Moves the comment cursor forward. The cursor never moves back. */
  void advanceLastCommentEnd(int offset) {
    if (offset > lastCommentEnd) {
      lastCommentEnd = offset;
    }
  }

  void recordParent(Node child, Node parent) {
    parentsByHandle.put(child.getHandle(), parent);
  }

  /** Returns the parent recorded for {@code node}, or null if none was recorded. */
  public @Nullable Node getRecordedParent(Node node) {
    return parentsByHandle.get(node.getHandle());
  }

  void recordImportOrReexportDeclaration(Node declaration) {
    importOrReexportDeclarations.add(declaration);
  }

  void clearRecordedNodes() {
    parentsByHandle.clear();
    importOrReexportDeclarations.clear();
  }

  public ImmutableList<Node> getImportOrReexportDeclarations() {
    return ImmutableList.copyOf(importOrReexportDeclarations);
  }

  @Override
  public String toString() {
    return "FileContext(" + file.getName() + ")";
  }
}
