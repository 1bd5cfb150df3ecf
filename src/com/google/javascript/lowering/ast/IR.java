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

package com.google.javascript.lowering.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Factories for synthetic nodes. */
public final class IR {

  private IR() {}

  public static Node script(List<Node> stmts) {
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Script cannot contain %s", stmt.getToken());
    }
    return Node.builder(Token.SCRIPT).setChildren(stmts).build();
  }

  public static Node block(List<Node> stmts) {
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block cannot contain %s", stmt.getToken());
    }
    return Node.builder(Token.BLOCK).setChildren(stmts).build();
  }

  public static Node block(Node... stmts) {
    return block(ImmutableList.copyOf(stmts));
  }

  public static Node empty() {
    return Node.builder(Token.EMPTY).build();
  }

  /** A statement that prints nothing but its comments. */
  public static Node notEmitted() {
    return Node.builder(Token.NOT_EMITTED).build();
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return Node.builder(Token.EXPR_RESULT).setChildren(expr).build();
  }

  public static Node var(Node name, Node value) {
    return declaration("var", varDecl(name, value));
  }

  /** Creates a VAR_STATEMENT with the given keyword and VAR_DECL children. */
  public static Node declaration(String keyword, Node... decls) {
    checkArgument(
        keyword.equals("var") || keyword.equals("let") || keyword.equals("const"), keyword);
    for (Node decl : decls) {
      checkState(decl.isVarDecl(), decl);
    }
    Node list = Node.builder(Token.VAR_DECL_LIST).setString(keyword).setChildren(decls).build();
    return Node.builder(Token.VAR_STATEMENT).setChildren(list).build();
  }

  public static Node varDecl(Node name, Node value) {
    checkState(name.isName(), name);
    checkState(mayBeExpression(value), value);
    return Node.builder(Token.VAR_DECL).setChildren(name, value).build();
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return Node.builder(Token.RETURN).setChildren(expr).build();
  }

  public static Node paramList(List<Node> params) {
    for (Node param : params) {
      checkState(param.isName() || param.getToken() == Token.SPREAD, param);
    }
    return Node.builder(Token.PARAM_LIST).setChildren(params).build();
  }

  public static Node function(Node name, Node params, Node body) {
    checkState(name.isName() || name.isEmpty(), name);
    checkState(params.isParamList(), params);
    checkState(body.isBlock(), body);
    return Node.builder(Token.FUNCTION).setChildren(name, params, body).build();
  }

  public static Node memberFunctionDef(String name, Node function) {
    checkState(function.isFunction(), function);
    return Node.builder(Token.MEMBER_FUNCTION_DEF).setChildren(name(name), function).build();
  }

  public static Node name(String name) {
    checkState(name.indexOf('.') == -1, "Invalid name '%s'.", name);
    return Node.builder(Token.NAME).setString(name).build();
  }

  public static Node string(String value) {
    return Node.builder(Token.STRINGLIT).setString(value).build();
  }

  public static Node number(String source) {
    return Node.builder(Token.NUMBER).setString(source).build();
  }

  public static Node thisNode() {
    return Node.builder(Token.THIS).build();
  }

  public static Node superNode() {
    return Node.builder(Token.SUPER).build();
  }

  public static Node call(Node target, Node... args) {
    return call(target, ImmutableList.copyOf(args));
  }

  public static Node call(Node target, List<Node> args) {
    checkState(mayBeExpression(target), target);
    ImmutableList.Builder<Node> children = ImmutableList.builder();
    children.add(target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg) || arg.getToken() == Token.SPREAD, arg);
      children.add(arg);
    }
    return Node.builder(Token.CALL).setChildren(children.build()).build();
  }

  public static Node spread(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return Node.builder(Token.SPREAD).setChildren(expr).build();
  }

  public static Node getprop(Node target, String prop) {
    return getprop(target, name(prop));
  }

  /** Creates {@code target.prop}. The property NAME node is used as is. */
  public static Node getprop(Node target, Node prop) {
    checkState(mayBeExpression(target), target);
    checkState(prop.isName(), prop);
    return Node.builder(Token.GETPROP).setChildren(target, prop).build();
  }

  public static Node assign(Node target, Node expr) {
    checkState(target.isName() || target.isGetProp(), target);
    checkState(mayBeExpression(expr), expr);
    return Node.builder(Token.ASSIGN).setChildren(target, expr).build();
  }

  public static boolean mayBeStatement(Node n) {
    switch (n.getToken()) {
      case EMPTY:
      case NOT_EMITTED:
      case EXPR_RESULT:
      case VAR_STATEMENT:
      case FUNCTION:
      case RETURN:
      case IF:
      case CLASS:
      case NAMESPACE:
      case IMPORT:
      case EXPORT:
      case BLOCK:
        return true;
      default:
        return false;
    }
  }

  public static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case NAME:
      case STRINGLIT:
      case NUMBER:
      case TRUE:
      case FALSE:
      case NULL:
      case THIS:
      case SUPER:
      case CALL:
      case NEW:
      case GETPROP:
      case ASSIGN:
      case ADD:
      case SUB:
      case MUL:
      case DIV:
        return true;
      case FUNCTION:
        return n.isArrowFunction();
      default:
        return false;
    }
  }
}
