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
import java.util.List;
import java.util.function.UnaryOperator;

/** Copy-on-write traversal helpers for rewrites. */
public final class Visitors {

  private Visitors() {}

  /**
   * Applies {@code visitor} to every child of {@code node} and returns {@code node} rebuilt with
   * the results. Returns {@code node} itself if the visitor returned every child unchanged.
   * Statement lists go through {@link #updateStatements}, so placeholders the visitor added stay
   * in place.
   */
  public static Node visitEachChild(Node node, UnaryOperator<Node> visitor) {
    if (!node.hasChildren()) {
      return node;
    }
    ImmutableList.Builder<Node> newChildren = ImmutableList.builder();
    for (Node child : node.children()) {
      newChildren.add(visitor.apply(child));
    }
    if (node.getToken().isStatementContainer()) {
      return updateStatements(node, newChildren.build());
    }
    return node.withChildren(newChildren.build());
  }

  /**
   * Returns a SCRIPT or BLOCK with the given statements. The container is only rebuilt if the
   * statements differ from the ones it has.
   */
  public static Node updateStatements(Node container, List<Node> statements) {
    checkArgument(container.getToken().isStatementContainer(), container);
    return container.withChildren(statements);
  }
}
