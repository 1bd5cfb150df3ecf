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

package com.google.javascript.lowering.parsing;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.javascript.lowering.CommentRange;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.StaticSourceFile;
import com.google.javascript.lowering.ast.Token;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Parses a source file into a tree of original nodes.
 *
 * <p>The supported language is a subset of JavaScript and TypeScript: variable, function, class
 * and namespace declarations, {@code if}, {@code return}, blocks and expression statements, ES
 * module imports and exports, and simple expressions including calls, {@code new}, property
 * access, assignment, arithmetic and arrow functions.
 *
 * <p>Every node gets the range of the tokens it was built from: its full start is where the trivia
 * in front of its first token begins, and statements end after their semicolon. Nodes that stand
 * for a missing part of a construct, like the name of an arrow function, have no range.
 */
public final class Parser {
  private final StaticSourceFile file;
  private final Scanner scanner;
  private @Nullable ImmutableList<SyntaxToken> tokens;
  private int index = 0;

  public Parser(StaticSourceFile file) {
    this.file = file;
    this.scanner = new Scanner(file);
  }

  /**
   * Parses the file.
   *
   * @throws ParseException if the file is not in the supported language
   */
  public Node parse() {
    checkState(tokens == null, "A parser can only be used once");
    tokens = scanner.scanAll();
    List<Node> statements = new ArrayList<>();
    while (!peek(TokenType.END_OF_FILE)) {
      statements.add(parseStatement());
    }
    SyntaxToken eof = current();
    int start = statements.isEmpty() ? eof.start : statements.get(0).getStart();
    return Node.builder(Token.SCRIPT)
        .setChildren(statements)
        .setRange(0, start, file.getCode().length())
        .setStaticSourceFile(file)
        .markOriginal()
        .build();
  }

  /** Returns every comment of the file in source order. Available after {@link #parse}. */
  public ImmutableList<CommentRange> getComments() {
    return scanner.getComments();
  }

  // Statements

  private Node parseStatement() {
    SyntaxToken token = current();
    switch (token.type) {
      case VAR:
      case LET:
      case CONST:
        return parseVariableStatement(index, false);
      case FUNCTION:
        return parseFunctionDeclaration(index, false);
      case CLASS:
        return parseClass(index, false);
      case IF:
        return parseIf();
      case RETURN:
        return parseReturn();
      case OPEN_CURLY:
        return parseBlock();
      case SEMI_COLON:
        {
          int first = index;
          next();
          return build(Node.builder(Token.EMPTY), first);
        }
      case IMPORT:
        return parseImport();
      case EXPORT:
        return parseExport();
      case IDENTIFIER:
        if (isNamespaceStart()) {
          return parseNamespace(index, false);
        }
        return parseExpressionStatement();
      default:
        return parseExpressionStatement();
    }
  }

  private boolean isNamespaceStart() {
    return current().isIdentifier("namespace")
        && peekAhead(1).type == TokenType.IDENTIFIER
        && !peekAhead(1).precededByLineBreak;
  }

  private Node parseExpressionStatement() {
    int first = index;
    Node expr = parseExpression();
    consumeSemicolon();
    return build(Node.builder(Token.EXPR_RESULT).setChildren(expr), first);
  }

  /**
   * Parses {@code var}, {@code let} and {@code const} statements.
   *
   * @param first index of the first token, which is {@code export} for exported statements
   */
  private Node parseVariableStatement(int first, boolean exported) {
    int listFirst = index;
    String keyword = next().value;
    List<Node> decls = new ArrayList<>();
    do {
      int declFirst = index;
      Node name = parseIdentifier();
      Node.Builder decl = Node.builder(Token.VAR_DECL);
      if (consumeIf(TokenType.EQUAL)) {
        decl.setChildren(name, parseAssignment());
      } else {
        decl.setChildren(name);
      }
      decls.add(build(decl, declFirst));
    } while (consumeIf(TokenType.COMMA));
    Node list =
        build(Node.builder(Token.VAR_DECL_LIST).setString(keyword).setChildren(decls), listFirst);
    consumeSemicolon();
    return build(
        Node.builder(Token.VAR_STATEMENT)
            .setChildren(list)
            .putBooleanProp(Node.Prop.EXPORTED, exported),
        first);
  }

  private Node parseFunctionDeclaration(int first, boolean exported) {
    expect(TokenType.FUNCTION);
    Node name = parseIdentifier();
    Node params = parseParameters();
    Node body = parseBlock();
    return build(
        Node.builder(Token.FUNCTION)
            .setChildren(name, params, body)
            .putBooleanProp(Node.Prop.EXPORTED, exported),
        first);
  }

  private Node parseParameters() {
    int first = index;
    expect(TokenType.OPEN_PAREN);
    List<Node> params = new ArrayList<>();
    if (!peek(TokenType.CLOSE_PAREN)) {
      do {
        params.add(parseParameter());
      } while (consumeIf(TokenType.COMMA));
    }
    expect(TokenType.CLOSE_PAREN);
    return build(Node.builder(Token.PARAM_LIST).setChildren(params), first);
  }

  private Node parseParameter() {
    int first = index;
    if (consumeIf(TokenType.SPREAD)) {
      Node name = parseIdentifier();
      return build(Node.builder(Token.SPREAD).setChildren(name), first);
    }
    return parseIdentifier();
  }

  private Node parseClass(int first, boolean exported) {
    expect(TokenType.CLASS);
    Node name = parseIdentifier();
    Node superClass = consumeIf(TokenType.EXTENDS) ? parseMemberOrCall() : missing(Token.EMPTY);
    int membersFirst = index;
    expect(TokenType.OPEN_CURLY);
    List<Node> members = new ArrayList<>();
    while (!peek(TokenType.CLOSE_CURLY)) {
      if (consumeIf(TokenType.SEMI_COLON)) {
        continue;
      }
      members.add(parseClassMember());
    }
    expect(TokenType.CLOSE_CURLY);
    Node body = build(Node.builder(Token.CLASS_MEMBERS).setChildren(members), membersFirst);
    return build(
        Node.builder(Token.CLASS)
            .setChildren(name, superClass, body)
            .putBooleanProp(Node.Prop.EXPORTED, exported),
        first);
  }

  private Node parseClassMember() {
    int first = index;
    boolean isStatic = false;
    if (current().isIdentifier("static")) {
      TokenType following = peekAhead(1).type;
      isStatic =
          following != TokenType.OPEN_PAREN
              && following != TokenType.EQUAL
              && following != TokenType.SEMI_COLON
              && following != TokenType.CLOSE_CURLY;
      if (isStatic) {
        next();
      }
    }
    Node name = parseIdentifierName();
    if (peek(TokenType.OPEN_PAREN)) {
      int functionFirst = index;
      Node params = parseParameters();
      Node body = parseBlock();
      Node function =
          build(
              Node.builder(Token.FUNCTION).setChildren(missing(Token.EMPTY), params, body),
              functionFirst);
      return build(
          Node.builder(Token.MEMBER_FUNCTION_DEF)
              .setChildren(name, function)
              .putBooleanProp(Node.Prop.STATIC_MEMBER, isStatic),
          first);
    }
    Node.Builder field =
        Node.builder(Token.MEMBER_FIELD_DEF).putBooleanProp(Node.Prop.STATIC_MEMBER, isStatic);
    if (consumeIf(TokenType.EQUAL)) {
      field.setChildren(name, parseAssignment());
    } else {
      field.setChildren(name);
    }
    consumeSemicolon();
    return build(field, first);
  }

  private Node parseNamespace(int first, boolean exported) {
    next();
    Node name = parseIdentifier();
    Node body = parseBlock();
    return build(
        Node.builder(Token.NAMESPACE)
            .setChildren(name, body)
            .putBooleanProp(Node.Prop.EXPORTED, exported),
        first);
  }

  private Node parseIf() {
    int first = index;
    expect(TokenType.IF);
    expect(TokenType.OPEN_PAREN);
    Node condition = parseExpression();
    expect(TokenType.CLOSE_PAREN);
    Node thenBranch = parseStatement();
    Node.Builder ifNode = Node.builder(Token.IF);
    if (consumeIf(TokenType.ELSE)) {
      ifNode.setChildren(condition, thenBranch, parseStatement());
    } else {
      ifNode.setChildren(condition, thenBranch);
    }
    return build(ifNode, first);
  }

  private Node parseReturn() {
    int first = index;
    expect(TokenType.RETURN);
    Node.Builder returnNode = Node.builder(Token.RETURN);
    if (!peek(TokenType.SEMI_COLON)
        && !peek(TokenType.CLOSE_CURLY)
        && !peek(TokenType.END_OF_FILE)
        && !current().precededByLineBreak) {
      returnNode.setChildren(parseExpression());
    }
    consumeSemicolon();
    return build(returnNode, first);
  }

  private Node parseBlock() {
    int first = index;
    expect(TokenType.OPEN_CURLY);
    List<Node> statements = new ArrayList<>();
    while (!peek(TokenType.CLOSE_CURLY)) {
      if (peek(TokenType.END_OF_FILE)) {
        throw reportError(current(), "'}' expected");
      }
      statements.add(parseStatement());
    }
    expect(TokenType.CLOSE_CURLY);
    return build(Node.builder(Token.BLOCK).setChildren(statements), first);
  }

  // Modules

  private Node parseImport() {
    int first = index;
    expect(TokenType.IMPORT);
    if (peek(TokenType.STRING)) {
      Node moduleSpecifier = parseString();
      consumeSemicolon();
      return build(
          Node.builder(Token.IMPORT)
              .setChildren(missing(Token.EMPTY), missing(Token.EMPTY), moduleSpecifier),
          first);
    }
    Node defaultBinding = missing(Token.EMPTY);
    Node bindings = missing(Token.EMPTY);
    if (peek(TokenType.IDENTIFIER)) {
      defaultBinding = parseIdentifier();
      if (!consumeIf(TokenType.COMMA)) {
        return finishImport(first, defaultBinding, bindings);
      }
    }
    if (peek(TokenType.STAR)) {
      int starFirst = index;
      next();
      expectContextualKeyword("as");
      String alias = parseIdentifier().getString();
      bindings = build(Node.builder(Token.IMPORT_STAR).setString(alias), starFirst);
    } else {
      int specsFirst = index;
      expect(TokenType.OPEN_CURLY);
      List<Node> specs = new ArrayList<>();
      while (!peek(TokenType.CLOSE_CURLY)) {
        specs.add(parseSpecifier(Token.IMPORT_SPEC));
        if (!consumeIf(TokenType.COMMA)) {
          break;
        }
      }
      expect(TokenType.CLOSE_CURLY);
      bindings = build(Node.builder(Token.IMPORT_SPECS).setChildren(specs), specsFirst);
    }
    return finishImport(first, defaultBinding, bindings);
  }

  private Node finishImport(int first, Node defaultBinding, Node bindings) {
    expectContextualKeyword("from");
    Node moduleSpecifier = parseString();
    consumeSemicolon();
    return build(
        Node.builder(Token.IMPORT).setChildren(defaultBinding, bindings, moduleSpecifier), first);
  }

  /** Parses {@code a} or {@code a as b}. Both children are NAME nodes. */
  private Node parseSpecifier(Token token) {
    int first = index;
    Node name = parseIdentifierName();
    Node alias;
    if (current().isIdentifier("as")) {
      next();
      alias = parseIdentifierName();
    } else {
      alias = build(Node.builder(Token.NAME).setString(name.getString()), first);
    }
    return build(Node.builder(token).setChildren(name, alias), first);
  }

  private Node parseExport() {
    int first = index;
    expect(TokenType.EXPORT);
    switch (current().type) {
      case VAR:
      case LET:
      case CONST:
        return parseVariableStatement(first, true);
      case FUNCTION:
        return parseFunctionDeclaration(first, true);
      case CLASS:
        return parseClass(first, true);
      case STAR:
        {
          next();
          expectContextualKeyword("from");
          Node moduleSpecifier = parseString();
          consumeSemicolon();
          return build(
              Node.builder(Token.EXPORT)
                  .setChildren(missing(Token.EMPTY), moduleSpecifier)
                  .putBooleanProp(Node.Prop.EXPORT_ALL_FROM, true),
              first);
        }
      case OPEN_CURLY:
        {
          int specsFirst = index;
          next();
          List<Node> specs = new ArrayList<>();
          while (!peek(TokenType.CLOSE_CURLY)) {
            specs.add(parseSpecifier(Token.EXPORT_SPEC));
            if (!consumeIf(TokenType.COMMA)) {
              break;
            }
          }
          expect(TokenType.CLOSE_CURLY);
          Node specsNode = build(Node.builder(Token.EXPORT_SPECS).setChildren(specs), specsFirst);
          Node.Builder export = Node.builder(Token.EXPORT);
          if (current().isIdentifier("from")) {
            next();
            export.setChildren(specsNode, parseString());
          } else {
            export.setChildren(specsNode);
          }
          consumeSemicolon();
          return build(export, first);
        }
      case IDENTIFIER:
        if (isNamespaceStart()) {
          return parseNamespace(first, true);
        }
        break;
      default:
        break;
    }
    throw reportError(current(), "Unsupported export");
  }

  // Expressions

  private Node parseExpression() {
    return parseAssignment();
  }

  private Node parseAssignment() {
    if (isArrowFunctionStart()) {
      return parseArrowFunction();
    }
    int first = index;
    Node left = parseAdditive();
    if (peek(TokenType.EQUAL)) {
      if (!left.isName() && !left.isGetProp()) {
        throw reportError(current(), "Invalid assignment target");
      }
      next();
      Node right = parseAssignment();
      return build(Node.builder(Token.ASSIGN).setChildren(left, right), first);
    }
    return left;
  }

  private boolean isArrowFunctionStart() {
    if (peek(TokenType.IDENTIFIER)) {
      return peekAhead(1).type == TokenType.ARROW;
    }
    if (!peek(TokenType.OPEN_PAREN)) {
      return false;
    }
    int depth = 0;
    for (int i = index; i < tokens.size(); i++) {
      TokenType type = tokens.get(i).type;
      if (type == TokenType.OPEN_PAREN) {
        depth++;
      } else if (type == TokenType.CLOSE_PAREN) {
        depth--;
        if (depth == 0) {
          return i + 1 < tokens.size() && tokens.get(i + 1).type == TokenType.ARROW;
        }
      } else if (type == TokenType.END_OF_FILE) {
        return false;
      }
    }
    return false;
  }

  private Node parseArrowFunction() {
    int first = index;
    Node params;
    if (peek(TokenType.IDENTIFIER)) {
      Node param = parseIdentifier();
      params = build(Node.builder(Token.PARAM_LIST).setChildren(param), first);
    } else {
      params = parseParameters();
    }
    expect(TokenType.ARROW);
    Node body = peek(TokenType.OPEN_CURLY) ? parseBlock() : parseAssignment();
    return build(
        Node.builder(Token.FUNCTION)
            .setChildren(missing(Token.EMPTY), params, body)
            .putBooleanProp(Node.Prop.ARROW, true),
        first);
  }

  private Node parseAdditive() {
    int first = index;
    Node left = parseMultiplicative();
    while (peek(TokenType.PLUS) || peek(TokenType.MINUS)) {
      Token operator = next().type == TokenType.PLUS ? Token.ADD : Token.SUB;
      Node right = parseMultiplicative();
      left = build(Node.builder(operator).setChildren(left, right), first);
    }
    return left;
  }

  private Node parseMultiplicative() {
    int first = index;
    Node left = parseMemberOrCall();
    while (peek(TokenType.STAR) || peek(TokenType.SLASH)) {
      Token operator = next().type == TokenType.STAR ? Token.MUL : Token.DIV;
      Node right = parseMemberOrCall();
      left = build(Node.builder(operator).setChildren(left, right), first);
    }
    return left;
  }

  private Node parseMemberOrCall() {
    int first = index;
    Node expr = peek(TokenType.NEW) ? parseNew() : parsePrimary();
    while (true) {
      if (consumeIf(TokenType.PERIOD)) {
        Node property = parseIdentifierName();
        expr = build(Node.builder(Token.GETPROP).setChildren(expr, property), first);
      } else if (peek(TokenType.OPEN_PAREN)) {
        List<Node> children = new ArrayList<>();
        children.add(expr);
        children.addAll(parseArguments());
        expr = build(Node.builder(Token.CALL).setChildren(children), first);
      } else {
        return expr;
      }
    }
  }

  private Node parseNew() {
    int first = index;
    expect(TokenType.NEW);
    int targetFirst = index;
    Node target = parsePrimary();
    while (consumeIf(TokenType.PERIOD)) {
      Node property = parseIdentifierName();
      target = build(Node.builder(Token.GETPROP).setChildren(target, property), targetFirst);
    }
    List<Node> children = new ArrayList<>();
    children.add(target);
    if (peek(TokenType.OPEN_PAREN)) {
      children.addAll(parseArguments());
    }
    return build(Node.builder(Token.NEW).setChildren(children), first);
  }

  private List<Node> parseArguments() {
    expect(TokenType.OPEN_PAREN);
    List<Node> args = new ArrayList<>();
    while (!peek(TokenType.CLOSE_PAREN)) {
      int first = index;
      if (consumeIf(TokenType.SPREAD)) {
        Node expr = parseAssignment();
        args.add(build(Node.builder(Token.SPREAD).setChildren(expr), first));
      } else {
        args.add(parseAssignment());
      }
      if (!consumeIf(TokenType.COMMA)) {
        break;
      }
    }
    expect(TokenType.CLOSE_PAREN);
    return args;
  }

  private Node parsePrimary() {
    int first = index;
    SyntaxToken token = current();
    switch (token.type) {
      case IDENTIFIER:
        return parseIdentifier();
      case NUMBER:
        next();
        return build(Node.builder(Token.NUMBER).setString(token.value), first);
      case STRING:
        return parseString();
      case TRUE:
        next();
        return build(Node.builder(Token.TRUE), first);
      case FALSE:
        next();
        return build(Node.builder(Token.FALSE), first);
      case NULL:
        next();
        return build(Node.builder(Token.NULL), first);
      case THIS:
        next();
        return build(Node.builder(Token.THIS), first);
      case SUPER:
        next();
        return build(Node.builder(Token.SUPER), first);
      case OPEN_PAREN:
        {
          next();
          Node expr = parseExpression();
          expect(TokenType.CLOSE_PAREN);
          return expr;
        }
      default:
        throw reportError(token, "Expression expected, found '" + token + "'");
    }
  }

  private Node parseIdentifier() {
    int first = index;
    SyntaxToken token = current();
    if (token.type != TokenType.IDENTIFIER) {
      throw reportError(token, "Identifier expected, found '" + token + "'");
    }
    next();
    return build(Node.builder(Token.NAME).setString(token.value), first);
  }

  /** Parses an identifier or a keyword used as a property name. */
  private Node parseIdentifierName() {
    int first = index;
    SyntaxToken token = current();
    if (token.type != TokenType.IDENTIFIER && !token.type.isKeyword()) {
      throw reportError(token, "Identifier expected, found '" + token + "'");
    }
    next();
    return build(Node.builder(Token.NAME).setString(token.value), first);
  }

  private Node parseString() {
    int first = index;
    SyntaxToken token = current();
    if (token.type != TokenType.STRING) {
      throw reportError(token, "String literal expected, found '" + token + "'");
    }
    next();
    return build(Node.builder(Token.STRINGLIT).setString(token.value), first);
  }

  // Token helpers

  /**
   * Consumes the semicolon ending a statement. The semicolon may be left out before a line break,
   * a closing brace or the end of the file.
   */
  private void consumeSemicolon() {
    if (consumeIf(TokenType.SEMI_COLON)) {
      return;
    }
    if (peek(TokenType.CLOSE_CURLY)
        || peek(TokenType.END_OF_FILE)
        || current().precededByLineBreak) {
      return;
    }
    throw reportError(current(), "';' expected");
  }

  private Node build(Node.Builder builder, int firstToken) {
    SyntaxToken first = tokens.get(firstToken);
    SyntaxToken last = tokens.get(index - 1);
    return builder
        .setRange(first.fullStart, first.start, last.end)
        .setStaticSourceFile(file)
        .markOriginal()
        .build();
  }

  /** Creates a node for a part of a construct that is not in the source. */
  private Node missing(Token token) {
    return Node.builder(token).setStaticSourceFile(file).markOriginal().build();
  }

  private SyntaxToken current() {
    return tokens.get(index);
  }

  private SyntaxToken peekAhead(int distance) {
    return tokens.get(Math.min(index + distance, tokens.size() - 1));
  }

  private boolean peek(TokenType type) {
    return current().type == type;
  }

  private SyntaxToken next() {
    SyntaxToken token = current();
    if (token.type != TokenType.END_OF_FILE) {
      index++;
    }
    return token;
  }

  private boolean consumeIf(TokenType type) {
    if (peek(type)) {
      next();
      return true;
    }
    return false;
  }

  private void expect(TokenType type) {
    if (!consumeIf(type)) {
      throw reportError(current(), "'" + type + "' expected, found '" + current() + "'");
    }
  }

  private void expectContextualKeyword(String keyword) {
    if (!current().isIdentifier(keyword)) {
      throw reportError(current(), "'" + keyword + "' expected, found '" + current() + "'");
    }
    next();
  }

  private ParseException reportError(SyntaxToken token, String message) {
    return scanner.reportError(token.start, message);
  }
}
