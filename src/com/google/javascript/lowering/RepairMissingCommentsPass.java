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

import com.google.common.collect.ImmutableList;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.StaticSourceFile;
import com.google.javascript.lowering.ast.SynthesizedComment;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Puts back comments that the emitter loses when it lowers certain constructs:
 *
 * <ul>
 *   <li>a class field with an initializer, which becomes an assignment statement;
 *   <li>an exported variable statement, which becomes assignments to {@code exports};
 *   <li>an import or re-export, which becomes a {@code require} call.
 * </ul>
 *
 * <p>The first two are found through the identifiers the emitter moves into the new statements:
 * the parents recorded for them by {@link RecordNodeParentsPass} lead back to the field or the
 * variable statement. The {@code require} statements start where the import they replace started.
 *
 * <p>This is the last pass of a file; it drops the file's {@link FileContext}.
 */
public final class RepairMissingCommentsPass implements ScriptPass {
  private static final Logger logger = Logger.getLogger(RepairMissingCommentsPass.class.getName());

  private final TransformContext context;

  public RepairMissingCommentsPass(TransformContext context) {
    this.context = context;
  }

  @Override
  public Node process(Node script) {
    checkArgument(script.isScript(), script);
    StaticSourceFile file = script.getStaticSourceFile();
    checkState(file != null, "Script without a source file: %s", script);
    FileContext fileContext = context.assertFileContext(file);
    Node result = new Repairer(fileContext).visit(script);
    context.endFile();
    return result;
  }

  /** A node on the path from the root to the node being visited. */
  private static final class Frame {
    final Node node;
    final List<SynthesizedComment> addedLeadingComments = new ArrayList<>();

    Frame(Node node) {
      this.node = node;
    }
  }

  private static final class Repairer {
    private final FileContext fileContext;
    private final List<Frame> path = new ArrayList<>();
    /** Handles of the nodes whose comments have been copied already. */
    private final Set<Integer> repairedSources = new HashSet<>();

    Repairer(FileContext fileContext) {
      this.fileContext = fileContext;
    }

    Node visit(Node n) {
      Frame frame = new Frame(n);
      if (n.isName()) {
        repairIdentifier(n);
      }
      boolean isRequire = isCommonJsRequireStatement(n);
      if (isRequire) {
        Node declaration = findImportOrReexportAt(n.getPos());
        if (declaration != null) {
          copyComments(declaration, frame);
        } else {
          logger.fine("No import found for " + n);
        }
      }

      path.add(frame);
      ImmutableList.Builder<Node> children = ImmutableList.builder();
      for (Node child : n.children()) {
        children.add(visit(child));
      }
      path.remove(path.size() - 1);

      Node result = n.withChildren(children.build());
      // The restored comments replace any the rewrite carried over itself.
      if (!frame.addedLeadingComments.isEmpty()) {
        result = result.withLeadingComments(ImmutableList.copyOf(frame.addedLeadingComments));
      }
      if (isRequire) {
        result = TextRanges.resetTextRange(result);
      }
      return result;
    }

    private void repairIdentifier(Node name) {
      Node parent1 = fileContext.getRecordedParent(name);
      Node parent2 = parent1 == null ? null : fileContext.getRecordedParent(parent1);
      Node parent3 = parent2 == null ? null : fileContext.getRecordedParent(parent2);
      if (parent1 != null && parent1.isMemberFieldDef() && parent1.getChildCount() == 2) {
        Frame statement = nearestExpressionStatement();
        if (statement != null && !isOnPath(parent1)) {
          copyComments(parent1, statement);
        }
      } else if (parent3 != null && parent3.isVarStatement() && parent3.isExported()) {
        Frame statement = nearestExpressionStatement();
        if (statement != null && !isOnPath(parent3)) {
          copyComments(parent3, statement);
        }
      }
    }

    /** Whether {@code n} is still an ancestor, that is, the emitter did not lower it. */
    private boolean isOnPath(Node n) {
      for (Frame frame : path) {
        if (frame.node.getOriginalNode() == n.getOriginalNode()) {
          return true;
        }
      }
      return false;
    }

    private @Nullable Frame nearestExpressionStatement() {
      for (int i = path.size() - 1; i >= 0; i--) {
        if (path.get(i).node.isExprResult()) {
          return path.get(i);
        }
      }
      return null;
    }

    private @Nullable Node findImportOrReexportAt(int pos) {
      if (pos == Node.INVALID_POSITION) {
        return null;
      }
      for (Node declaration : fileContext.getImportOrReexportDeclarations()) {
        if (declaration.getPos() == pos) {
          return declaration;
        }
      }
      return null;
    }

    /** Copies the comments of {@code source} to the front of the statement in {@code target}. */
    private void copyComments(Node source, Frame target) {
      if (!repairedSources.add(source.getHandle())) {
        return;
      }
      if (source.getLeadingComments().isEmpty() && source.getTrailingComments().isEmpty()) {
        return;
      }
      logger.fine("Restoring comments of " + source + " on " + target.node);
      target.addedLeadingComments.addAll(source.getLeadingComments());
      target.addedLeadingComments.addAll(source.getTrailingComments());
    }
  }

  /**
   * Whether {@code n} is {@code require('m');} or a declaration with the single declarator {@code
   * x = require('m')}.
   */
  static boolean isCommonJsRequireStatement(Node n) {
    if (n.isExprResult()) {
      return isRequireCall(n.getFirstChild());
    }
    if (n.isVarStatement()) {
      Node declList = n.getFirstChild();
      if (declList == null || declList.getChildCount() != 1) {
        return false;
      }
      Node decl = declList.getFirstChild();
      return decl.getChildCount() == 2 && isRequireCall(decl.getSecondChild());
    }
    return false;
  }

  private static boolean isRequireCall(@Nullable Node n) {
    if (n == null || !n.isCall() || n.getChildCount() != 2) {
      return false;
    }
    Node callee = n.getFirstChild();
    return callee.isName()
        && callee.getString().equals("require")
        && n.getSecondChild().isStringLit();
  }
}
