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
import java.util.logging.Logger;

/**
 * Starts the comment handling of a file: creates its {@link FileContext} and moves every comment
 * of the parsed tree onto a node.
 *
 * <p>Must run before any other pass changes the tree, since it reads comments from the source text
 * at the positions of parsed nodes.
 */
public final class PrepareCommentsPass implements ScriptPass {
  private static final Logger logger = Logger.getLogger(PrepareCommentsPass.class.getName());

  private final TransformContext context;
  private FileContext fileContext;

  public PrepareCommentsPass(TransformContext context) {
    this.context = context;
  }

  @Override
  public Node process(Node script) {
    checkArgument(script.isScript(), script);
    checkState(script.isOriginal(), "Comments must be prepared on the parsed tree: %s", script);
    StaticSourceFile file = script.getStaticSourceFile();
    checkState(file != null, "Script without a source file: %s", script);
    logger.fine("Preparing comments: " + file.getName());
    fileContext = context.beginFile(file);
    return visit(script);
  }

  private Node visit(Node n) {
    return CommentSynthesis.visitNodeWithSynthesizedComments(fileContext, n, this::visitChildren);
  }

  private Node visitChildren(Node n) {
    return Visitors.visitEachChild(n, this::visit);
  }
}
