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

import com.google.common.collect.ImmutableList;
import com.google.javascript.lowering.ScriptPass;
import com.google.javascript.lowering.ast.IR;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Moves class fields out of class bodies.
 *
 * <pre>
 * class C extends B {              class C extends B {
 *   static s = 1;                    constructor() {
 *   x = 2;                  =>         super(...arguments);
 * }                                    this.x = 2;
 *                                    }
 *                                  }
 *                                  C.s = 1;
 * </pre>
 *
 * <p>Instance fields are initialized in the constructor, after the {@code super} call if there is
 * one. Fields without an initializer are dropped. The new statements are mapped to the fields in
 * source maps, but they do not carry the comments of the fields.
 */
public final class RewriteClassFields implements ScriptPass {
  private static final Logger logger = Logger.getLogger(RewriteClassFields.class.getName());

  @Override
  public Node process(Node script) {
    return visit(script);
  }

  private Node visit(Node n) {
    List<Node> children = new ArrayList<>(n.getChildCount());
    for (Node child : n.children()) {
      Node newChild = visit(child);
      if (n.getToken().isStatementContainer() && newChild.isClass() && hasFields(newChild)) {
        children.addAll(lowerClass(newChild));
      } else {
        children.add(newChild);
      }
    }
    return n.withChildren(children);
  }

  private static boolean hasFields(Node classNode) {
    for (Node member : classNode.getLastChild().children()) {
      if (member.isMemberFieldDef()) {
        return true;
      }
    }
    return false;
  }

  /** Returns the class without its fields, followed by the static field initializers. */
  private ImmutableList<Node> lowerClass(Node classNode) {
    Node className = classNode.getFirstChild();
    Node superClass = classNode.getSecondChild();
    Node members = classNode.getLastChild();
    logger.fine("Lowering fields of class " + className.getString());

    List<Node> keptMembers = new ArrayList<>();
    List<Node> instanceInitializers = new ArrayList<>();
    ImmutableList.Builder<Node> staticInitializers = ImmutableList.builder();
    for (Node member : members.children()) {
      if (!member.isMemberFieldDef()) {
        keptMembers.add(member);
        continue;
      }
      if (member.getChildCount() < 2) {
        continue;
      }
      // The NAME of the field becomes the property of the assignment target.
      Node fieldName = member.getFirstChild();
      Node value = member.getSecondChild();
      if (member.isStaticMember()) {
        Node target = IR.getprop(IR.name(className.getString()), fieldName);
        staticInitializers.add(
            IR.exprResult(IR.assign(target, value)).withSourceMapRangeFrom(member));
      } else {
        Node target = IR.getprop(IR.thisNode(), fieldName);
        instanceInitializers.add(
            IR.exprResult(IR.assign(target, value)).withSourceMapRangeFrom(member));
      }
    }

    if (!instanceInitializers.isEmpty()) {
      int constructorIndex = findConstructor(keptMembers);
      if (constructorIndex == -1) {
        keptMembers.add(0, createConstructor(!superClass.isEmpty(), instanceInitializers));
      } else {
        Node constructor = keptMembers.get(constructorIndex);
        keptMembers.set(constructorIndex, addToConstructor(constructor, instanceInitializers));
      }
    }

    Node newClass =
        classNode.withChildren(
            ImmutableList.of(className, superClass, members.withChildren(keptMembers)));
    return ImmutableList.<Node>builder().add(newClass).addAll(staticInitializers.build()).build();
  }

  private static int findConstructor(List<Node> members) {
    for (int i = 0; i < members.size(); i++) {
      Node member = members.get(i);
      if (member.isMemberFunctionDef()
          && !member.isStaticMember()
          && member.getFirstChild().getString().equals("constructor")) {
        return i;
      }
    }
    return -1;
  }

  private static Node createConstructor(boolean isDerived, List<Node> initializers) {
    List<Node> statements = new ArrayList<>();
    if (isDerived) {
      statements.add(IR.exprResult(IR.call(IR.superNode(), IR.spread(IR.name("arguments")))));
    }
    statements.addAll(initializers);
    Node function = IR.function(IR.empty(), IR.paramList(ImmutableList.of()), IR.block(statements));
    return IR.memberFunctionDef("constructor", function);
  }

  /** Inserts the initializers after the {@code super} call, or at the start of the body. */
  private static Node addToConstructor(Node constructor, List<Node> initializers) {
    Node function = constructor.getSecondChild();
    Node body = function.getLastChild();
    List<Node> statements = new ArrayList<>(body.children());
    int index = 0;
    while (index < statements.size() && statements.get(index).isNotEmitted()) {
      index++;
    }
    if (index < statements.size() && isSuperCall(statements.get(index))) {
      index++;
    }
    statements.addAll(index, initializers);
    Node newBody = body.withChildren(statements);
    Node newFunction =
        function.withChildren(
            ImmutableList.of(function.getFirstChild(), function.getSecondChild(), newBody));
    return constructor.withChildren(ImmutableList.of(constructor.getFirstChild(), newFunction));
  }

  private static boolean isSuperCall(@Nullable Node statement) {
    if (statement == null || !statement.isExprResult()) {
      return false;
    }
    Node expr = statement.getFirstChild();
    return expr.isCall() && expr.getFirstChild().getToken() == Token.SUPER;
  }
}
