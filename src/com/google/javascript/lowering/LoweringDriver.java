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

import com.google.common.collect.ImmutableList;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.emit.CodePrinter;
import com.google.javascript.lowering.emit.SourceMapping;
import com.google.javascript.lowering.parsing.Parser;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Parses, lowers and prints source files.
 *
 * <p>Files are processed one after the other. A {@link
 * com.google.javascript.lowering.parsing.ParseException} or an {@link IllegalStateException} ends
 * the compilation of the file it was thrown for and is passed on to the caller.
 */
public final class LoweringDriver {
  private static final Logger logger = Logger.getLogger(LoweringDriver.class.getName());

  private final LoweringOptions options;
  private final CommentPreservingTransformer transformer;

  public LoweringDriver(LoweringOptions options) {
    this(options, ImmutableList.of());
  }

  /**
   * @param rewrites semantic rewrites, run after comments are prepared and before the emitter
   *     lowers the tree
   */
  public LoweringDriver(LoweringOptions options, List<ScriptPass> rewrites) {
    this.options = options;
    this.transformer = new CommentPreservingTransformer(options, rewrites);
  }

  public LoweringResult compile(SourceFile file) {
    logger.fine("Parsing: " + file.getName());
    Node script = new Parser(file).parse();
    Node lowered = transformer.transform(script);
    List<SourceMapping> mappings = new ArrayList<>();
    String code =
        new CodePrinter.Builder(lowered)
            .setOptions(options)
            .setSourceFile(file)
            .setSourceMappings(mappings)
            .build();
    logger.fine("Printed " + file.getName() + ": " + mappings.size() + " mappings");
    return new LoweringResult(file.getName(), code, mappings);
  }

  public ImmutableList<LoweringResult> compile(List<SourceFile> files) {
    ImmutableList.Builder<LoweringResult> results = ImmutableList.builder();
    for (SourceFile file : files) {
      results.add(compile(file));
    }
    return results.build();
  }
}
