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

import com.google.common.collect.ImmutableList;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.emit.RewriteClassFields;
import com.google.javascript.lowering.emit.RewriteModulesToCommonJs;
import java.util.List;
import java.util.logging.Logger;

/**
 * Runs the passes of one file in order: comment preparation, the semantic rewrites, the emitter's
 * own lowering, and comment repair.
 *
 * <p>Instances hold the {@link TransformContext} of the file being transformed and must not be
 * shared between threads.
 */
public final class CommentPreservingTransformer {
  private static final Logger logger =
      Logger.getLogger(CommentPreservingTransformer.class.getName());

  private final LoweringOptions options;
  private final ImmutableList<ScriptPass> rewrites;
  private final TransformContext context = new TransformContext();

  public CommentPreservingTransformer(LoweringOptions options, List<ScriptPass> rewrites) {
    this.options = options;
    this.rewrites = ImmutableList.copyOf(rewrites);
  }

  /** Transforms the parsed SCRIPT {@code script}. */
  public Node transform(Node script) {
    checkArgument(script.isScript(), script);
    boolean preserveComments = options.getPreserveComments();
    Node result = script;
    if (preserveComments) {
      result = new PrepareCommentsPass(context).process(result);
    }
    for (ScriptPass rewrite : rewrites) {
      result = rewrite.process(result);
    }
    if (preserveComments) {
      result = new RecordNodeParentsPass(context).process(result);
    }
    for (ScriptPass pass : getEmitterPasses()) {
      result = pass.process(result);
    }
    if (preserveComments) {
      if (options.getRepairMissingComments()) {
        result = new RepairMissingCommentsPass(context).process(result);
      } else {
        logger.fine("Not repairing comments of " + script.getStaticSourceFile());
        context.endFile();
      }
    }
    return result;
  }

  private ImmutableList<ScriptPass> getEmitterPasses() {
    ImmutableList.Builder<ScriptPass> passes = ImmutableList.builder();
    if (options.getRewriteClassFields()) {
      passes.add(new RewriteClassFields());
    }
    if (options.getRewriteModulesToCommonJs()) {
      passes.add(new RewriteModulesToCommonJs());
    }
    return passes.build();
  }
}
