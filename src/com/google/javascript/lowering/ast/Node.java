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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import org.jspecify.annotations.Nullable;

/**
 * A node in the syntax tree.
 *
 * <p>Nodes are values: every field except the parent reference is final, and a "change" to a node
 * is made by building a modified copy through {@link #toBuilder()} or one of the {@code with*}
 * methods. Nodes built by a parser are <em>original</em>; their parent reference is fixed when the
 * parent is built and never changes afterwards, so a parsed tree can be shared between any number
 * of transformations. Every other node is <em>synthetic</em>. A synthetic node starts without a
 * parent and may be given one later through {@link #setSyntheticParent}.
 *
 * <p>Each node has two ranges into the source text. The text range {@code [pos, end)} is what the
 * printer uses to find source comments; {@code pos} is the full start of the node, including the
 * whitespace and comments that precede its first token, and {@code start} is the offset of the
 * first token. The source map range is what the printer reports in source mappings; unless set
 * explicitly it is the text range.
 */
public final class Node {

  /** Boolean properties of a node. */
  public enum Prop {
    /** A declaration carrying the {@code export} modifier. */
    EXPORTED,
    /** A {@code static} class member. */
    STATIC_MEMBER,
    /** A FUNCTION written as {@code () => ...}. */
    ARROW,
    /** An EXPORT of the form {@code export * from 'm'}. */
    EXPORT_ALL_FROM;

    private int mask() {
      return 1 << ordinal();
    }
  }

  public static final int INVALID_POSITION = -1;

  private static final AtomicInteger nextHandle = new AtomicInteger();

  private final Token token;
  private final ImmutableList<Node> children;
  private final @Nullable String string;
  private final int props;
  private final int emitFlags;

  private final int pos;
  private final int start;
  private final int end;
  private final int sourceMapPos;
  private final int sourceMapEnd;

  private final ImmutableList<SynthesizedComment> leadingComments;
  private final ImmutableList<SynthesizedComment> trailingComments;

  private final boolean original;
  private final @Nullable Node originalNode;
  private final @Nullable StaticSourceFile sourceFile;
  private final int handle;

  private @Nullable Node parent;

  private Node(Builder b) {
    this.token = b.token;
    this.children = ImmutableList.copyOf(b.children);
    this.string = b.string;
    this.props = b.props;
    this.emitFlags = b.emitFlags;
    this.pos = b.pos;
    this.start = b.start;
    this.end = b.end;
    this.sourceMapPos = b.sourceMapPos;
    this.sourceMapEnd = b.sourceMapEnd;
    this.leadingComments = ImmutableList.copyOf(b.leadingComments);
    this.trailingComments = ImmutableList.copyOf(b.trailingComments);
    this.original = b.original;
    this.originalNode = b.originalNode;
    this.sourceFile = b.sourceFile;
    this.parent = b.parent;
    this.handle = nextHandle.incrementAndGet();

    if (original) {
      for (Node child : children) {
        checkState(child.original, "Original %s cannot contain synthetic %s", token, child);
        checkState(child.parent == null, "%s already has a parent", child);
        child.parent = this;
      }
    }
  }

  public static Builder builder(Token token) {
    return new Builder(token);
  }

  /**
   * Returns a builder initialized with the state of this node. The node it builds is a synthetic
   * clone: it keeps the parent reference of this node but gets a handle of its own and remembers
   * this node (or the node this one was cloned from) as its original node.
   */
  public Builder toBuilder() {
    Builder b = new Builder(token);
    b.children = children;
    b.string = string;
    b.props = props;
    b.emitFlags = emitFlags;
    b.pos = pos;
    b.start = start;
    b.end = end;
    b.sourceMapPos = sourceMapPos;
    b.sourceMapEnd = sourceMapEnd;
    b.leadingComments = leadingComments;
    b.trailingComments = trailingComments;
    b.originalNode = getOriginalNode();
    b.sourceFile = sourceFile;
    b.parent = parent;
    return b;
  }

  public Token getToken() {
    return token;
  }

  /** A stable identity for this node, usable as a key in side tables. */
  public int getHandle() {
    return handle;
  }

  public ImmutableList<Node> children() {
    return children;
  }

  public int getChildCount() {
    return children.size();
  }

  public boolean hasChildren() {
    return !children.isEmpty();
  }

  public Node getChildAtIndex(int i) {
    return children.get(i);
  }

  public @Nullable Node getFirstChild() {
    return children.isEmpty() ? null : children.get(0);
  }

  public @Nullable Node getSecondChild() {
    return children.size() < 2 ? null : children.get(1);
  }

  public @Nullable Node getLastChild() {
    return children.isEmpty() ? null : children.get(children.size() - 1);
  }

  /** Returns the string value of NAME, STRINGLIT, NUMBER, IMPORT_STAR and VAR_DECL_LIST nodes. */
  public String getString() {
    checkState(string != null, "%s has no string value", token);
    return string;
  }

  public boolean getBooleanProp(Prop prop) {
    return (props & prop.mask()) != 0;
  }

  public boolean hasEmitFlag(EmitFlag flag) {
    return (emitFlags & flag.mask()) != 0;
  }

  /** The full start of the node, or {@link #INVALID_POSITION}. */
  public int getPos() {
    return pos;
  }

  /** The offset of the first token of the node, or {@link #INVALID_POSITION}. */
  public int getStart() {
    return start;
  }

  public int getEnd() {
    return end;
  }

  public boolean hasValidTextRange() {
    return pos >= 0 && end >= 0;
  }

  /** Returns the start of the source map range, which defaults to the text range. */
  public int getSourceMapPos() {
    return hasSourceMapRange() ? sourceMapPos : pos;
  }

  public int getSourceMapEnd() {
    return hasSourceMapRange() ? sourceMapEnd : end;
  }

  private boolean hasSourceMapRange() {
    return sourceMapPos != INVALID_POSITION || sourceMapEnd != INVALID_POSITION;
  }

  public ImmutableList<SynthesizedComment> getLeadingComments() {
    return leadingComments;
  }

  public ImmutableList<SynthesizedComment> getTrailingComments() {
    return trailingComments;
  }

  /** Whether this node was built by a parser. Original nodes never change. */
  public boolean isOriginal() {
    return original;
  }

  public boolean isSynthetic() {
    return !original;
  }

  /** Returns the parsed node this node was cloned from, or this node if it was not cloned. */
  public Node getOriginalNode() {
    return originalNode == null ? this : originalNode;
  }

  public @Nullable StaticSourceFile getStaticSourceFile() {
    return sourceFile;
  }

  public @Nullable Node getParent() {
    return parent;
  }

  /**
   * Sets the parent reference of a synthetic node. The parent of an original node is fixed when its
   * parent is built.
   */
  public void setSyntheticParent(@Nullable Node parent) {
    checkState(!original, "Cannot change the parent of original node %s", this);
    this.parent = parent;
  }

  // Copy-on-write helpers. All of them return a synthetic clone.

  public Node withChildren(List<Node> newChildren) {
    if (sameElements(children, newChildren)) {
      return this;
    }
    return toBuilder().setChildren(newChildren).build();
  }

  public Node withLeadingComments(List<SynthesizedComment> comments) {
    return toBuilder().setLeadingComments(comments).build();
  }

  public Node withTrailingComments(List<SynthesizedComment> comments) {
    return toBuilder().setTrailingComments(comments).build();
  }

  public Node withEmitFlag(EmitFlag flag) {
    return toBuilder().addEmitFlag(flag).build();
  }

  public Node withBooleanProp(Prop prop, boolean value) {
    return toBuilder().putBooleanProp(prop, value).build();
  }

  /** Returns a clone that has the text range and the source map range of {@code other}. */
  public Node withRangeFrom(Node other) {
    return toBuilder()
        .setRange(other.pos, other.start, other.end)
        .setSourceMapRange(other.getSourceMapPos(), other.getSourceMapEnd())
        .build();
  }

  /** Returns a clone that reports {@code other}'s range in source mappings only. */
  public Node withSourceMapRangeFrom(Node other) {
    return toBuilder().setSourceMapRange(other.getSourceMapPos(), other.getSourceMapEnd()).build();
  }

  private static boolean sameElements(List<Node> a, List<Node> b) {
    if (a.size() != b.size()) {
      return false;
    }
    for (int i = 0; i < a.size(); i++) {
      if (a.get(i) != b.get(i)) {
        return false;
      }
    }
    return true;
  }

  public boolean isScript() {
    return token == Token.SCRIPT;
  }

  public boolean isBlock() {
    return token == Token.BLOCK;
  }

  public boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public boolean isNotEmitted() {
    return token == Token.NOT_EMITTED;
  }

  public boolean isExprResult() {
    return token == Token.EXPR_RESULT;
  }

  public boolean isVarStatement() {
    return token == Token.VAR_STATEMENT;
  }

  public boolean isVarDeclList() {
    return token == Token.VAR_DECL_LIST;
  }

  public boolean isVarDecl() {
    return token == Token.VAR_DECL;
  }

  public boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public boolean isArrowFunction() {
    return token == Token.FUNCTION && getBooleanProp(Prop.ARROW);
  }

  public boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public boolean isReturn() {
    return token == Token.RETURN;
  }

  public boolean isIf() {
    return token == Token.IF;
  }

  public boolean isClass() {
    return token == Token.CLASS;
  }

  public boolean isClassMembers() {
    return token == Token.CLASS_MEMBERS;
  }

  public boolean isMemberFieldDef() {
    return token == Token.MEMBER_FIELD_DEF;
  }

  public boolean isMemberFunctionDef() {
    return token == Token.MEMBER_FUNCTION_DEF;
  }

  public boolean isNamespace() {
    return token == Token.NAMESPACE;
  }

  public boolean isImport() {
    return token == Token.IMPORT;
  }

  public boolean isExport() {
    return token == Token.EXPORT;
  }

  public boolean isName() {
    return token == Token.NAME;
  }

  public boolean isStringLit() {
    return token == Token.STRINGLIT;
  }

  public boolean isCall() {
    return token == Token.CALL;
  }

  public boolean isGetProp() {
    return token == Token.GETPROP;
  }

  public boolean isAssign() {
    return token == Token.ASSIGN;
  }

  public boolean isExported() {
    return getBooleanProp(Prop.EXPORTED);
  }

  public boolean isStaticMember() {
    return getBooleanProp(Prop.STATIC_MEMBER);
  }

  /**
   * Whether this node and {@code other} have the same kind, value, properties and, recursively,
   * children. Ranges and comments are not compared.
   */
  public boolean isEquivalentTo(Node other) {
    if (token != other.token
        || props != other.props
        || children.size() != other.children.size()
        || !Objects.equals(string, other.string)) {
      return false;
    }
    for (int i = 0; i < children.size(); i++) {
      if (!children.get(i).isEquivalentTo(other.children.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (string != null) {
      sb.append(' ').append(string);
    }
    if (hasValidTextRange()) {
      sb.append(" [").append(pos).append(", ").append(end).append(')');
    }
    return sb.toString();
  }

  /** Prints the tree rooted here, one node per line. */
  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int level) {
    for (int i = 0; i < level; i++) {
      sb.append("    ");
    }
    sb.append(this);
    for (Prop prop : Prop.values()) {
      if (getBooleanProp(prop)) {
        sb.append(' ').append(prop);
      }
    }
    if (!leadingComments.isEmpty() || !trailingComments.isEmpty()) {
      sb.append(" comments: ")
          .append(leadingComments.size())
          .append('/')
          .append(trailingComments.size());
    }
    sb.append('\n');
    for (Node child : children) {
      child.appendStringTree(sb, level + 1);
    }
  }

  /** Builds nodes. Obtained from {@link Node#builder} or {@link Node#toBuilder}. */
  public static final class Builder {
    private final Token token;
    private List<Node> children = ImmutableList.of();
    private @Nullable String string;
    private int props;
    private int emitFlags;
    private int pos = INVALID_POSITION;
    private int start = INVALID_POSITION;
    private int end = INVALID_POSITION;
    private int sourceMapPos = INVALID_POSITION;
    private int sourceMapEnd = INVALID_POSITION;
    private List<SynthesizedComment> leadingComments = ImmutableList.of();
    private List<SynthesizedComment> trailingComments = ImmutableList.of();
    private boolean original;
    private @Nullable Node originalNode;
    private @Nullable StaticSourceFile sourceFile;
    private @Nullable Node parent;

    private Builder(Token token) {
      this.token = checkNotNull(token);
    }

    @CanIgnoreReturnValue
    public Builder setChildren(List<Node> children) {
      this.children = ImmutableList.copyOf(children);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setChildren(Node... children) {
      this.children = ImmutableList.copyOf(children);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setString(@Nullable String string) {
      this.string = string;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder putBooleanProp(Prop prop, boolean value) {
      if (value) {
        props |= prop.mask();
      } else {
        props &= ~prop.mask();
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addEmitFlag(EmitFlag flag) {
      emitFlags |= flag.mask();
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setRange(int pos, int start, int end) {
      checkArgument(
          (pos == INVALID_POSITION && start == INVALID_POSITION && end == INVALID_POSITION)
              || (0 <= pos && pos <= start && start <= end),
          "Invalid range [%s, %s, %s)",
          pos,
          start,
          end);
      this.pos = pos;
      this.start = start;
      this.end = end;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSourceMapRange(int pos, int end) {
      this.sourceMapPos = pos;
      this.sourceMapEnd = end;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setLeadingComments(List<SynthesizedComment> comments) {
      this.leadingComments = ImmutableList.copyOf(comments);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setTrailingComments(List<SynthesizedComment> comments) {
      this.trailingComments = ImmutableList.copyOf(comments);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setStaticSourceFile(@Nullable StaticSourceFile sourceFile) {
      this.sourceFile = sourceFile;
      return this;
    }

    /**
     * Marks the node as original. Only parsers call this; the children of an original node must be
     * original and get this node as their parent.
     */
    @CanIgnoreReturnValue
    public Builder markOriginal() {
      checkState(originalNode == null, "A clone cannot be original");
      this.original = true;
      this.parent = null;
      return this;
    }

    public Node build() {
      return new Node(this);
    }
  }
}
