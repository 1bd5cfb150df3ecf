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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.javascript.lowering.CommentRange;
import com.google.javascript.lowering.CommentRanges;
import com.google.javascript.lowering.ast.CommentKind;
import com.google.javascript.lowering.ast.EmitFlag;
import com.google.javascript.lowering.ast.IR;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.StaticSourceFile;
import com.google.javascript.lowering.ast.SynthesizedComment;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * CodeGenerator generates codes from a parse tree, sending it to the specified CodeConsumer.
 *
 * <p>Two kinds of comments are printed. Synthesized comments are attached to the nodes. Source
 * comments are read from the text of the source file at the range of a node, unless the node has
 * {@link EmitFlag#NO_COMMENTS}. A source comment is printed at most once.
 */
final class CodeGenerator {
  private static final int LOWEST_PRECEDENCE = 0;
  private static final int ASSIGNMENT_PRECEDENCE = 1;
  private static final int MEMBER_PRECEDENCE = 5;
  private static final int PRIMARY_PRECEDENCE = 6;

  private final CodeConsumer cc;
  private final @Nullable StaticSourceFile sourceFile;
  private final Set<Integer> printedSourceComments = new HashSet<>();

  /** The end of the statement being printed. Source comments there belong to the statement. */
  private int statementEnd = Node.INVALID_POSITION;

  CodeGenerator(CodeConsumer consumer, @Nullable StaticSourceFile sourceFile) {
    this.cc = consumer;
    this.sourceFile = sourceFile;
  }

  void add(Node n) {
    if (n.isScript()) {
      printLeadingComments(n.getLeadingComments(), false);
      for (Node statement : n.children()) {
        printStatement(statement);
      }
      printRemainingSourceComments(n);
      printTrailingComments(n.getTrailingComments(), true);
      cc.startNewLine();
    } else if (IR.mayBeStatement(n)) {
      printStatement(n);
    } else {
      add(n, LOWEST_PRECEDENCE);
    }
  }

  private void printStatement(Node n) {
    cc.startNewLine();
    int enclosingStatementEnd = statementEnd;
    statementEnd = n.getEnd();
    boolean emitted = !n.isNotEmitted();
    skipSourceComments(n);
    printLeadingSourceComments(n, emitted);
    printLeadingComments(n.getLeadingComments(), emitted);
    if (emitted) {
      cc.startSourceMapping(n);
      printStatementBody(n);
      printTrailingComments(n.getTrailingComments(), false);
    } else {
      printTrailingComments(n.getTrailingComments(), true);
    }
    printTrailingSourceComments(n);
    statementEnd = enclosingStatementEnd;
    cc.startNewLine();
  }

  private void printStatementBody(Node n) {
    switch (n.getToken()) {
      case EMPTY:
        cc.add(";");
        break;
      case EXPR_RESULT:
        add(n.getFirstChild(), LOWEST_PRECEDENCE);
        cc.add(";");
        break;
      case VAR_STATEMENT:
        addExportPrefix(n);
        add(n.getFirstChild(), LOWEST_PRECEDENCE);
        cc.add(";");
        break;
      case FUNCTION:
        addExportPrefix(n);
        printFunction(n);
        break;
      case RETURN:
        cc.add("return");
        if (n.hasChildren()) {
          cc.add(" ");
          add(n.getFirstChild(), LOWEST_PRECEDENCE);
        }
        cc.add(";");
        break;
      case IF:
        printIf(n);
        break;
      case BLOCK:
        printBlockBody(n);
        break;
      case CLASS:
        {
          addExportPrefix(n);
          cc.add("class ");
          add(n.getFirstChild(), PRIMARY_PRECEDENCE);
          Node superClass = n.getSecondChild();
          if (!superClass.isEmpty()) {
            cc.add(" extends ");
            add(superClass, MEMBER_PRECEDENCE);
          }
          cc.add(" ");
          printClassMembers(n.getLastChild());
          break;
        }
      case MEMBER_FIELD_DEF:
        addStaticPrefix(n);
        add(n.getFirstChild(), PRIMARY_PRECEDENCE);
        if (n.getChildCount() == 2) {
          cc.add(" = ");
          add(n.getSecondChild(), ASSIGNMENT_PRECEDENCE);
        }
        cc.add(";");
        break;
      case MEMBER_FUNCTION_DEF:
        {
          addStaticPrefix(n);
          add(n.getFirstChild(), PRIMARY_PRECEDENCE);
          Node function = n.getSecondChild();
          printLeadingComments(function.getLeadingComments(), true);
          add(function.getSecondChild(), PRIMARY_PRECEDENCE);
          cc.add(" ");
          printBlock(function.getLastChild());
          break;
        }
      case NAMESPACE:
        addExportPrefix(n);
        cc.add("namespace ");
        add(n.getFirstChild(), PRIMARY_PRECEDENCE);
        cc.add(" ");
        printBlock(n.getLastChild());
        break;
      case IMPORT:
        printImport(n);
        break;
      case EXPORT:
        printExport(n);
        break;
      default:
        throw new IllegalStateException("Unexpected statement: " + n.getToken());
    }
  }

  private void addExportPrefix(Node n) {
    if (n.isExported()) {
      cc.add("export ");
    }
  }

  private void addStaticPrefix(Node n) {
    if (n.isStaticMember()) {
      cc.add("static ");
    }
  }

  private void printIf(Node n) {
    cc.add("if (");
    add(n.getFirstChild(), LOWEST_PRECEDENCE);
    cc.add(")");
    Node thenBranch = n.getSecondChild();
    printBranch(thenBranch);
    if (n.getChildCount() == 3) {
      if (thenBranch.isBlock() && !cc.isAtLineStart()) {
        cc.add(" else");
      } else {
        cc.startNewLine();
        cc.add("else");
      }
      printBranch(n.getLastChild());
    }
  }

  private void printBranch(Node branch) {
    if (branch.isBlock()) {
      cc.add(" ");
      printBlock(branch);
    } else {
      cc.increaseIndent();
      printStatement(branch);
      cc.decreaseIndent();
    }
  }

  private void printBlock(Node block) {
    checkState(block.isBlock(), block);
    skipSourceComments(block);
    printLeadingComments(block.getLeadingComments(), true);
    printBlockBody(block);
    printTrailingComments(block.getTrailingComments(), false);
    if (block.getEnd() != statementEnd) {
      printTrailingSourceComments(block);
    }
  }

  /** Prints the braces and the statements of a block without the comments around it. */
  private void printBlockBody(Node block) {
    cc.beginBlock();
    for (Node statement : block.children()) {
      printStatement(statement);
    }
    printRemainingSourceComments(block);
    cc.endBlock();
  }

  private void printClassMembers(Node members) {
    printLeadingComments(members.getLeadingComments(), true);
    cc.beginBlock();
    for (Node member : members.children()) {
      printStatement(member);
    }
    printRemainingSourceComments(members);
    cc.endBlock();
  }

  private void printFunction(Node n) {
    cc.add("function");
    Node name = n.getFirstChild();
    if (!name.isEmpty()) {
      cc.add(" ");
      add(name, PRIMARY_PRECEDENCE);
    }
    add(n.getSecondChild(), PRIMARY_PRECEDENCE);
    cc.add(" ");
    printBlock(n.getLastChild());
  }

  private void printArrowFunction(Node n) {
    add(n.getSecondChild(), PRIMARY_PRECEDENCE);
    cc.add(" => ");
    Node body = n.getLastChild();
    if (body.isBlock()) {
      printBlock(body);
      return;
    }
    if (printsSourceComments(body)) {
      printSourceComments(
          CommentRanges.getAllLeadingCommentRanges(
              sourceFile.getCode(), body.getPos(), body.getStart()),
          true);
    }
    add(body, ASSIGNMENT_PRECEDENCE);
  }

  private void printImport(Node n) {
    cc.add("import ");
    boolean hasBindings = false;
    Node defaultBinding = n.getFirstChild();
    if (!defaultBinding.isEmpty()) {
      add(defaultBinding, PRIMARY_PRECEDENCE);
      hasBindings = true;
    }
    Node bindings = n.getSecondChild();
    if (!bindings.isEmpty()) {
      if (hasBindings) {
        cc.add(", ");
      }
      add(bindings, PRIMARY_PRECEDENCE);
      hasBindings = true;
    }
    if (hasBindings) {
      cc.add(" from ");
    }
    add(n.getLastChild(), PRIMARY_PRECEDENCE);
    cc.add(";");
  }

  private void printExport(Node n) {
    cc.add("export ");
    if (n.getBooleanProp(Node.Prop.EXPORT_ALL_FROM)) {
      cc.add("* from ");
      add(n.getLastChild(), PRIMARY_PRECEDENCE);
    } else {
      add(n.getFirstChild(), PRIMARY_PRECEDENCE);
      if (n.getChildCount() == 2) {
        cc.add(" from ");
        add(n.getSecondChild(), PRIMARY_PRECEDENCE);
      }
    }
    cc.add(";");
  }

  /** Prints an expression or another part of a statement, with parentheses if needed. */
  private void add(Node n, int minPrecedence) {
    skipSourceComments(n);
    printLeadingSourceComments(n, true);
    printLeadingComments(n.getLeadingComments(), true);
    boolean needsParens = precedence(n) < minPrecedence;
    if (needsParens) {
      cc.add("(");
    }
    printExpressionBody(n);
    if (needsParens) {
      cc.add(")");
    }
    printTrailingComments(n.getTrailingComments(), false);
    if (n.getEnd() != statementEnd) {
      printTrailingSourceComments(n);
    }
  }

  private void printExpressionBody(Node n) {
    switch (n.getToken()) {
      case EMPTY:
        break;
      case NAME:
      case NUMBER:
        cc.add(n.getString());
        break;
      case STRINGLIT:
        cc.add(quote(n.getString()));
        break;
      case TRUE:
        cc.add("true");
        break;
      case FALSE:
        cc.add("false");
        break;
      case NULL:
        cc.add("null");
        break;
      case THIS:
        cc.add("this");
        break;
      case SUPER:
        cc.add("super");
        break;
      case ASSIGN:
        add(n.getFirstChild(), MEMBER_PRECEDENCE);
        cc.add(" = ");
        add(n.getSecondChild(), ASSIGNMENT_PRECEDENCE);
        break;
      case ADD:
      case SUB:
      case MUL:
      case DIV:
        {
          int precedence = precedence(n);
          add(n.getFirstChild(), precedence);
          cc.add(" " + operator(n) + " ");
          add(n.getSecondChild(), precedence + 1);
          break;
        }
      case CALL:
        add(n.getFirstChild(), MEMBER_PRECEDENCE);
        printArguments(n);
        break;
      case NEW:
        {
          cc.add("new ");
          Node target = n.getFirstChild();
          add(target, target.isCall() ? PRIMARY_PRECEDENCE : MEMBER_PRECEDENCE);
          printArguments(n);
          break;
        }
      case GETPROP:
        add(n.getFirstChild(), MEMBER_PRECEDENCE);
        cc.add(".");
        add(n.getSecondChild(), PRIMARY_PRECEDENCE);
        break;
      case SPREAD:
        cc.add("...");
        add(n.getFirstChild(), ASSIGNMENT_PRECEDENCE);
        break;
      case FUNCTION:
        if (n.isArrowFunction()) {
          printArrowFunction(n);
        } else {
          printFunction(n);
        }
        break;
      case PARAM_LIST:
        cc.add("(");
        printList(n.children(), ASSIGNMENT_PRECEDENCE);
        cc.add(")");
        break;
      case VAR_DECL_LIST:
        cc.add(n.getString() + " ");
        printList(n.children(), LOWEST_PRECEDENCE);
        break;
      case VAR_DECL:
        add(n.getFirstChild(), PRIMARY_PRECEDENCE);
        if (n.getChildCount() == 2) {
          cc.add(" = ");
          add(n.getSecondChild(), ASSIGNMENT_PRECEDENCE);
        }
        break;
      case IMPORT_SPECS:
      case EXPORT_SPECS:
        cc.add("{");
        printList(n.children(), LOWEST_PRECEDENCE);
        cc.add("}");
        break;
      case IMPORT_SPEC:
      case EXPORT_SPEC:
        add(n.getFirstChild(), PRIMARY_PRECEDENCE);
        if (!n.getFirstChild().getString().equals(n.getSecondChild().getString())) {
          cc.add(" as ");
          add(n.getSecondChild(), PRIMARY_PRECEDENCE);
        }
        break;
      case IMPORT_STAR:
        cc.add("* as " + n.getString());
        break;
      default:
        throw new IllegalStateException("Unexpected expression: " + n.getToken());
    }
  }

  private void printArguments(Node n) {
    cc.add("(");
    List<Node> children = n.children();
    printList(children.subList(1, children.size()), ASSIGNMENT_PRECEDENCE);
    cc.add(")");
  }

  private void printList(List<Node> nodes, int minPrecedence) {
    boolean first = true;
    for (Node node : nodes) {
      if (!first) {
        cc.add(", ");
      }
      add(node, minPrecedence);
      first = false;
    }
  }

  // Comments

  /**
   * Prints comments in front of code.
   *
   * @param beforeCode whether code follows the comments on the same line
   */
  private void printLeadingComments(List<SynthesizedComment> comments, boolean beforeCode) {
    for (int i = 0; i < comments.size(); i++) {
      SynthesizedComment comment = comments.get(i);
      cc.add(comment.toSource());
      endComment(comment.getKind(), comment.hasTrailingNewline(), beforeCode, i, comments.size());
    }
  }

  /**
   * Prints comments after code.
   *
   * @param ownLines whether each comment goes on its own line, as for a statement that prints
   *     nothing but its comments
   */
  private void printTrailingComments(List<SynthesizedComment> comments, boolean ownLines) {
    if (ownLines) {
      printLeadingComments(comments, false);
      return;
    }
    for (SynthesizedComment comment : comments) {
      cc.add(" " + comment.toSource());
      if (comment.isLineComment()) {
        cc.startNewLine();
      }
    }
  }

  private void endComment(
      CommentKind kind, boolean hasTrailingNewline, boolean beforeCode, int index, int count) {
    if (kind == CommentKind.LINE || hasTrailingNewline) {
      cc.startNewLine();
    } else if (beforeCode || index < count - 1) {
      cc.add(" ");
    }
  }

  private boolean printsSourceComments(Node n) {
    return sourceFile != null && n.hasValidTextRange() && !n.hasEmitFlag(EmitFlag.NO_COMMENTS);
  }

  /**
   * Marks the source comments around {@code n} as printed if {@code n} has {@link
   * EmitFlag#NO_COMMENTS}, so that children starting or ending at the same position do not print
   * them either.
   */
  private void skipSourceComments(Node n) {
    if (sourceFile == null || !n.hasValidTextRange() || !n.hasEmitFlag(EmitFlag.NO_COMMENTS)) {
      return;
    }
    String code = sourceFile.getCode();
    for (CommentRange range : CommentRanges.getLeadingCommentRanges(code, n.getPos())) {
      printedSourceComments.add(range.getPos());
    }
    for (CommentRange range : CommentRanges.getTrailingCommentRanges(code, n.getEnd())) {
      printedSourceComments.add(range.getPos());
    }
  }

  private void printLeadingSourceComments(Node n, boolean beforeCode) {
    if (printsSourceComments(n)) {
      printSourceComments(
          CommentRanges.getLeadingCommentRanges(sourceFile.getCode(), n.getPos()), beforeCode);
    }
  }

  private void printTrailingSourceComments(Node n) {
    if (!printsSourceComments(n)) {
      return;
    }
    String code = sourceFile.getCode();
    for (CommentRange range : CommentRanges.getTrailingCommentRanges(code, n.getEnd())) {
      if (printedSourceComments.add(range.getPos())) {
        cc.add(" " + range.getText(code));
        if (range.getKind() == CommentKind.LINE) {
          cc.startNewLine();
        }
      }
    }
  }

  /** Prints the source comments after the last statement of a statement list. */
  private void printRemainingSourceComments(Node container) {
    if (!printsSourceComments(container)) {
      return;
    }
    int pos;
    if (container.hasChildren()) {
      pos = container.getLastChild().getEnd();
    } else {
      pos = container.isScript() ? container.getPos() : container.getStart() + 1;
    }
    if (pos < 0) {
      return;
    }
    printSourceComments(CommentRanges.getLeadingCommentRanges(sourceFile.getCode(), pos), false);
  }

  private void printSourceComments(ImmutableList<CommentRange> ranges, boolean beforeCode) {
    String code = sourceFile.getCode();
    for (int i = 0; i < ranges.size(); i++) {
      CommentRange range = ranges.get(i);
      if (!printedSourceComments.add(range.getPos())) {
        continue;
      }
      cc.add(range.getText(code));
      endComment(range.getKind(), range.hasTrailingNewline(), beforeCode, i, ranges.size());
    }
  }

  // Operators

  private static int precedence(Node n) {
    switch (n.getToken()) {
      case ASSIGN:
        return ASSIGNMENT_PRECEDENCE;
      case FUNCTION:
        return n.isArrowFunction() ? ASSIGNMENT_PRECEDENCE : PRIMARY_PRECEDENCE;
      case ADD:
      case SUB:
        return 2;
      case MUL:
      case DIV:
        return 3;
      case NEW:
        return 4;
      case CALL:
      case GETPROP:
        return MEMBER_PRECEDENCE;
      default:
        return PRIMARY_PRECEDENCE;
    }
  }

  private static String operator(Node n) {
    switch (n.getToken()) {
      case ADD:
        return "+";
      case SUB:
        return "-";
      case MUL:
        return "*";
      case DIV:
        return "/";
      default:
        throw new IllegalStateException("Not an operator: " + n.getToken());
    }
  }

  /** Quotes a string with single quotes, escaping what a string literal cannot contain. */
  static String quote(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2);
    sb.append('\'');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\'':
          sb.append("\\'");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\u2028':
        case '\u2029':
          appendHexJavaScriptRepresentation(sb, c);
          break;
        default:
          if (c < 0x20) {
            appendHexJavaScriptRepresentation(sb, c);
          } else {
            sb.append(c);
          }
      }
    }
    sb.append('\'');
    return sb.toString();
  }

  private static void appendHexJavaScriptRepresentation(StringBuilder sb, char c) {
    sb.append(String.format("\\u%04x", (int) c));
  }
}
