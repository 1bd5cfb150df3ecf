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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.StaticSourceFile;

/**
 * Runs after the rewrites and before the emitter. Gives every synthetic node the parent it has in
 * the rewritten tree, records all parents in the {@link FileContext} so that they can still be
 * looked up once the emitter has moved nodes around, and records the imports and re-exports the
 * emitter will turn into {@code require} calls.
 */
public final class RecordNodeParentsPass implements ScriptPass {
  private final TransformContext context;

  public RecordNodeParentsPass(TransformContext context) {
    this.context = context;
  }

  @Override
  public Node process(Node script) {
    checkArgument(script.isScript(), script);
    StaticSourceFile file = script.getStaticSourceFile();
    checkState(file != null, "Script without a source file: %s", script);
    FileContext fileContext = context.assertFileContext(file);
    fileContext.clearRecordedNodes();
    record(fileContext, script);
    return script;
  }

  private static void record(FileContext fileContext, Node n) {
    if (TextRanges.hasModuleSpecifier(n)) {
      fileContext.recordImportOrReexportDeclaration(n);
    }
    for (Node child : n.children()) {
      if (child.isSynthetic()) {
        child.setSyntheticParent(n);
      }
      fileContext.recordParent(child, n);
      record(fileContext, child);
    }
  }
}
