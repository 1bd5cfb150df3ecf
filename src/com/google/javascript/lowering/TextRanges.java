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

import com.google.javascript.lowering.ast.EmitFlag;
import com.google.javascript.lowering.ast.Node;

/**
 * Takes source text ranges away from nodes whose comments have been synthesized, so that the
 * printer does not read the same comments from the source again.
 */
public final class TextRanges {

  private TextRanges() {}

  /**
   * Returns a clone of {@code n} without a text range. The old range stays available as the source
   * map range. A node that has no text range is returned as is.
   */
  public static Node resetTextRange(Node n) {
    if (!n.hasValidTextRange()) {
      return n;
    }
    return n.toBuilder()
        .setSourceMapRange(n.getSourceMapPos(), n.getSourceMapEnd())
        .setRange(Node.INVALID_POSITION, Node.INVALID_POSITION, Node.INVALID_POSITION)
        .build();
  }

  /**
   * Marks {@code n} so that the printer only prints its synthesized comments and resets its text
   * range, unless the node is one whose range is still needed by a later pass.
   */
  public static Node prepareForEmit(Node n) {
    Node result = n.hasEmitFlag(EmitFlag.NO_COMMENTS) ? n : n.withEmitFlag(EmitFlag.NO_COMMENTS);
    if (keepsTextRange(result)) {
      return result;
    }
    return resetTextRange(result);
  }

  /**
   * Nodes the emitter lowers into statements that must be traced back to them by position. Lowered
   * {@code require} statements are matched to imports and re-exports this way.
   */
  static boolean keepsTextRange(Node n) {
    switch (n.getToken()) {
      case SCRIPT:
      case BLOCK:
      case CLASS:
      case VAR_DECL:
      case NAMESPACE:
        return true;
      case VAR_STATEMENT:
        return n.isExported();
      case MEMBER_FIELD_DEF:
        return n.getChildCount() == 2;
      case IMPORT:
        return hasModuleSpecifier(n);
      case EXPORT:
        return hasModuleSpecifier(n);
      default:
        return false;
    }
  }

  /** Whether an IMPORT or EXPORT names the module it reads from. */
  static boolean hasModuleSpecifier(Node n) {
    if (!n.isImport() && !n.isExport()) {
      return false;
    }
    Node last = n.getLastChild();
    return last != null && last.isStringLit();
  }
}
