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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeTest {

  private static Node original(Token token, Node... children) {
    return Node.builder(token).setChildren(children).setRange(0, 0, 4).markOriginal().build();
  }

  @Test
  public void testOriginalParentIsSetOnBuild() {
    Node name = Node.builder(Token.NAME).setString("x").setRange(0, 0, 1).markOriginal().build();
    Node statement = original(Token.EXPR_RESULT, name);
    assertThat(name.getParent()).isSameInstanceAs(statement);
    assertThat(statement.getParent()).isNull();
  }

  @Test
  public void testChildCannotHaveTwoOriginalParents() {
    Node name = Node.builder(Token.NAME).setString("x").markOriginal().build();
    original(Token.EXPR_RESULT, name);
    assertThrows(IllegalStateException.class, () -> original(Token.EXPR_RESULT, name));
  }

  @Test
  public void testOriginalCannotContainSyntheticNode() {
    assertThrows(IllegalStateException.class, () -> original(Token.EXPR_RESULT, IR.name("x")));
  }

  @Test
  public void testCloneKeepsOriginalNodeAndParent() {
    Node name = Node.builder(Token.NAME).setString("x").setRange(0, 0, 1).markOriginal().build();
    Node statement = original(Token.EXPR_RESULT, name);

    Node clone = name.withLeadingComments(ImmutableList.of(SynthesizedComment.line(" c")));
    assertThat(clone.isSynthetic()).isTrue();
    assertThat(clone.getHandle()).isNotEqualTo(name.getHandle());
    assertThat(clone.getOriginalNode()).isSameInstanceAs(name);
    assertThat(clone.getParent()).isSameInstanceAs(statement);
    assertThat(clone.withEmitFlag(EmitFlag.NO_COMMENTS).getOriginalNode()).isSameInstanceAs(name);
    assertThat(name.getLeadingComments()).isEmpty();
  }

  @Test
  public void testWithSameChildrenReturnsSameNode() {
    Node call = IR.call(IR.name("f"), IR.name("x"));
    assertThat(call.withChildren(call.children())).isSameInstanceAs(call);
    assertThat(call.withChildren(ImmutableList.of(IR.name("g")))).isNotSameInstanceAs(call);
  }

  @Test
  public void testSyntheticParent() {
    Node name = IR.name("x");
    Node statement = IR.exprResult(name);
    assertThat(name.getParent()).isNull();
    name.setSyntheticParent(statement);
    assertThat(name.getParent()).isSameInstanceAs(statement);

    Node parsed = Node.builder(Token.NAME).setString("y").markOriginal().build();
    assertThrows(IllegalStateException.class, () -> parsed.setSyntheticParent(statement));
  }

  @Test
  public void testRanges() {
    Node node = Node.builder(Token.NAME).setString("x").setRange(2, 4, 5).build();
    assertThat(node.hasValidTextRange()).isTrue();
    assertThat(node.getSourceMapPos()).isEqualTo(2);
    assertThat(node.getSourceMapEnd()).isEqualTo(5);

    Node mapped = IR.name("y").withSourceMapRangeFrom(node);
    assertThat(mapped.hasValidTextRange()).isFalse();
    assertThat(mapped.getSourceMapPos()).isEqualTo(2);

    Node moved = IR.name("z").withRangeFrom(node);
    assertThat(moved.getStart()).isEqualTo(4);

    assertThrows(
        IllegalArgumentException.class, () -> Node.builder(Token.NAME).setRange(4, 2, 5));
  }

  @Test
  public void testEquivalence() {
    Node a = IR.call(IR.name("f"), IR.string("m"));
    Node b = IR.call(IR.name("f"), IR.string("m")).withRangeFrom(a);
    assertThat(a.isEquivalentTo(b)).isTrue();
    assertThat(a.isEquivalentTo(IR.call(IR.name("f"), IR.string("n")))).isFalse();
  }
}
