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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.StaticSourceFile;
import com.google.javascript.lowering.ast.SynthesizedComment;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Moves the comments of parsed nodes from the source text onto the nodes themselves.
 *
 * <p>A rewrite that replaces or clones a node loses the comments the printer would have read from
 * the source text at the node's position. Synthesized comments travel with the node instead. Every
 * comment is claimed by at most one node: the {@link FileContext} cursor records how far comments
 * have been claimed, and later nodes never look before it.
 */
public final class CommentSynthesis {

  private CommentSynthesis() {}

  /**
   * Visits {@code node} with {@code visitor}, synthesizing the comments of {@code node} around the
   * visit.
   *
   * <p>Comments in front of the node are claimed before the visitor runs, so that they are not
   * given to the node's first child; comments after the node are claimed after the visitor ran.
   * Comments that belong to no statement of a SCRIPT or BLOCK, or to no member of a class body, are
   * put on placeholders. The result is prepared for the printer with {@link
   * TextRanges#prepareForEmit}. Synthetic nodes are only visited, as they have no comments in the
   * source.
   */
  public static Node visitNodeWithSynthesizedComments(
      FileContext fileContext, Node node, UnaryOperator<Node> visitor) {
    if (node.isSynthetic()) {
      return visitor.apply(node);
    }
    if (node.isScript()) {
      return TextRanges.prepareForEmit(
          visitStatementsWithSynthesizedComments(fileContext, node, visitor));
    }
    // Comments in front of the expression body of an arrow function are left to the printer.
    // Moving a line comment there would put it between `return` and the expression once the
    // body is lowered to a block.
    Node parent = node.getParent();
    if (!node.isBlock()
        && parent != null
        && parent.isArrowFunction()
        && parent.getLastChild() == node) {
      return visitor.apply(node);
    }

    StaticSourceFile file = fileContext.getFile();
    ImmutableList<SynthesizedComment> leading =
        synthesizeLeadingComments(fileContext, file.getCode(), node);
    Node result;
    if (node.isBlock()) {
      result = visitStatementsWithSynthesizedComments(fileContext, node, visitor);
    } else if (node.isClassMembers()) {
      result = visitClassMembersWithSynthesizedComments(fileContext, node, visitor);
    } else {
      result = visitor.apply(node);
    }
    ImmutableList<SynthesizedComment> trailing =
        ImmutableList.<SynthesizedComment>builder()
            .addAll(synthesizeCommentsBeforeClosingToken(fileContext, file.getCode(), node))
            .addAll(synthesizeTrailingComments(fileContext, file.getCode(), node))
            .build();
    if (!leading.isEmpty() || !trailing.isEmpty()) {
      Node.Builder builder = result.toBuilder();
      if (!leading.isEmpty()) {
        builder.setLeadingComments(leading);
      }
      if (!trailing.isEmpty()) {
        builder.setTrailingComments(trailing);
      }
      result = builder.build();
    }
    return TextRanges.prepareForEmit(result);
  }

  private static ImmutableList<SynthesizedComment> synthesizeLeadingComments(
      FileContext fileContext, String code, Node node) {
    Node parent = node.getParent();
    boolean sharesStartWithParent =
        parent != null
            && !parent.getToken().isStatementContainer()
            && parent.getPos() == node.getPos();
    int lastCommentEnd = fileContext.getLastCommentEnd();
    if (sharesStartWithParent || lastCommentEnd >= node.getStart()) {
      return ImmutableList.of();
    }
    int scanStart = Math.max(lastCommentEnd, node.getPos());
    ImmutableList<CommentRange> ranges =
        CommentRanges.getAllLeadingCommentRanges(code, scanStart, node.getStart());
    if (ranges.isEmpty()) {
      return ImmutableList.of();
    }
    fileContext.advanceLastCommentEnd(node.getStart());
    return CommentSynthesizer.synthesizeCommentRanges(code, ranges);
  }

  private static ImmutableList<SynthesizedComment> synthesizeTrailingComments(
      FileContext fileContext, String code, Node node) {
    Node parent = node.getParent();
    boolean sharesEndWithParent =
        parent != null
            && !parent.getToken().isStatementContainer()
            && parent.getEnd() == node.getEnd();
    if (sharesEndWithParent) {
      return ImmutableList.of();
    }
    int lastCommentEnd = fileContext.getLastCommentEnd();
    ImmutableList<CommentRange> ranges =
        CommentRanges.getTrailingCommentRanges(code, node.getEnd()).stream()
            .filter(range -> range.getPos() >= lastCommentEnd)
            .collect(toImmutableList());
    if (ranges.isEmpty()) {
      return ImmutableList.of();
    }
    fileContext.advanceLastCommentEnd(ranges.get(ranges.size() - 1).getEnd());
    return CommentSynthesizer.synthesizeCommentRanges(code, ranges);
  }

  /**
   * Claims the comments in front of the closing token of {@code node} that none of its children
   * claimed, like a comment on its own line after the last argument of a call, or one between
   * {@code return} and the semicolon.
   */
  private static ImmutableList<SynthesizedComment> synthesizeCommentsBeforeClosingToken(
      FileContext fileContext, String code, Node node) {
    if (!hasClosingToken(node)) {
      return ImmutableList.of();
    }
    int start = node.getStart();
    if (node.hasChildren()) {
      Node last = node.getLastChild();
      if (!last.hasValidTextRange()) {
        return ImmutableList.of();
      }
      start = last.getEnd();
    }
    int end = node.getEnd() - 1;
    if (start >= end) {
      return ImmutableList.of();
    }
    int lastCommentEnd = fileContext.getLastCommentEnd();
    ImmutableList<CommentRange> ranges =
        CommentRanges.getCommentRangesBetweenTokens(code, start, end).stream()
            .filter(range -> range.getPos() >= lastCommentEnd)
            .collect(toImmutableList());
    if (ranges.isEmpty()) {
      return ImmutableList.of();
    }
    fileContext.advanceLastCommentEnd(ranges.get(ranges.size() - 1).getEnd());
    return CommentSynthesizer.synthesizeCommentRanges(code, ranges);
  }

  /** Whether nodes of the kind of {@code node} end with a bracket or a semicolon. */
  private static boolean hasClosingToken(Node node) {
    switch (node.getToken()) {
      case EXPR_RESULT:
      case VAR_STATEMENT:
      case RETURN:
      case IMPORT:
      case EXPORT:
      case IMPORT_SPECS:
      case EXPORT_SPECS:
      case PARAM_LIST:
      case CALL:
      case NEW:
        return true;
      default:
        return false;
    }
  }

  /**
   * Returns the comments between the last of {@code children} and {@code end} that are not
   * trailing comments of that child.
   */
  private static ImmutableList<CommentRange> getFooterCommentRanges(
      StaticSourceFile file, List<Node> children, int start, int end) {
    int scanStart = start;
    if (!children.isEmpty()) {
      Node last = children.get(children.size() - 1);
      scanStart = Math.max(scanStart, last.getEnd());
      ImmutableList<CommentRange> lastTrailing =
          CommentRanges.getTrailingCommentRanges(file.getCode(), last.getEnd());
      if (!lastTrailing.isEmpty()) {
        scanStart = Math.max(scanStart, lastTrailing.get(lastTrailing.size() - 1).getEnd());
      }
    }
    return scanStart < end
        ? DetachedComments.getDetachedTrailingCommentRanges(file, scanStart, end)
        : ImmutableList.of();
  }

  /**
   * Handles the body of a class. Comments in front of the closing brace are put on a placeholder
   * member at the end of the body.
   */
  private static Node visitClassMembersWithSynthesizedComments(
      FileContext fileContext, Node members, UnaryOperator<Node> visitor) {
    StaticSourceFile file = fileContext.getFile();
    int membersStart = Math.max(members.getStart() + 1, fileContext.getLastCommentEnd());
    ImmutableList<CommentRange> footer =
        getFooterCommentRanges(file, members.children(), membersStart, members.getEnd() - 1);
    if (footer.isEmpty()) {
      return visitor.apply(members);
    }
    List<Node> newMembers = new ArrayList<>(members.children());
    newMembers.add(
        PlaceholderStatements.create(
            file,
            footer.get(0).getPos(),
            CommentSynthesizer.synthesizeCommentRanges(file.getCode(), footer),
            ImmutableList.of()));
    Node result = visitor.apply(members.withChildren(newMembers));
    fileContext.advanceLastCommentEnd(footer.get(footer.size() - 1).getEnd());
    return result;
  }

  /**
   * Handles SCRIPT and BLOCK. Comment groups that are detached from the first and the last
   * statement are put on placeholders at the front and the back of the statement list.
   */
  private static Node visitStatementsWithSynthesizedComments(
      FileContext fileContext, Node container, UnaryOperator<Node> visitor) {
    StaticSourceFile file = fileContext.getFile();
    String code = file.getCode();
    ImmutableList<Node> statements = container.children();
    int statementsStart = container.isScript() ? container.getPos() : container.getStart() + 1;
    int statementsEnd = container.isScript() ? container.getEnd() : container.getEnd() - 1;

    int leadingScanStart = Math.max(statementsStart, fileContext.getLastCommentEnd());
    int leadingScanEnd = statements.isEmpty() ? statementsEnd : statements.get(0).getStart();
    ImmutableList<CommentRange> leading =
        leadingScanStart < leadingScanEnd
            ? DetachedComments.getDetachedLeadingCommentRanges(
                file, leadingScanStart, leadingScanEnd)
            : ImmutableList.of();
    int leadingEnd = leading.isEmpty() ? -1 : leading.get(leading.size() - 1).getEnd();

    ImmutableList<CommentRange> trailing =
        getFooterCommentRanges(
            file, statements, Math.max(statementsStart, leadingEnd), statementsEnd);
    int trailingEnd = trailing.isEmpty() ? -1 : trailing.get(trailing.size() - 1).getEnd();

    Node updated = container;
    if (!leading.isEmpty() || !trailing.isEmpty()) {
      List<Node> newStatements = new ArrayList<>(statements.size() + 2);
      if (!leading.isEmpty()) {
        newStatements.add(
            PlaceholderStatements.create(
                file,
                leading.get(0).getPos(),
                ImmutableList.of(),
                CommentSynthesizer.synthesizeCommentRanges(code, leading)));
      }
      newStatements.addAll(statements);
      if (!trailing.isEmpty()) {
        newStatements.add(
            PlaceholderStatements.create(
                file,
                trailing.get(0).getPos(),
                CommentSynthesizer.synthesizeCommentRanges(code, trailing),
                ImmutableList.of()));
      }
      updated = Visitors.updateStatements(container, newStatements);
    }

    if (leadingEnd != -1) {
      fileContext.advanceLastCommentEnd(leadingEnd);
    }
    Node result = visitor.apply(updated);
    if (trailingEnd != -1) {
      fileContext.advanceLastCommentEnd(trailingEnd);
    }
    return result;
  }
}
