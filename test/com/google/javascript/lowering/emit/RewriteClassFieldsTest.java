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

import static com.google.common.truth.Truth.assertThat;
import static com.google.javascript.lowering.LoweringTestUtil.lines;
import static com.google.javascript.lowering.LoweringTestUtil.parse;

import com.google.javascript.lowering.ast.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RewriteClassFieldsTest {

  private static void test(String code, String expected) {
    Node lowered = new RewriteClassFields().process(parse(code));
    assertThat(new CodePrinter.Builder(lowered).build()).isEqualTo(expected);
  }

  @Test
  public void testDerivedClassGetsConstructor() {
    test(
        "class C extends B { static s = 1; x = 2; y; m() {} }",
        lines(
            "class C extends B {",
            "  constructor() {",
            "    super(...arguments);",
            "    this.x = 2;",
            "  }",
            "  m() {",
            "  }",
            "}",
            "C.s = 1;",
            ""));
  }

  @Test
  public void testBaseClassGetsConstructor() {
    test(
        "class C { x = 1; }",
        lines("class C {", "  constructor() {", "    this.x = 1;", "  }", "}", ""));
  }

  @Test
  public void testFieldsGoAfterSuperCall() {
    test(
        lines(
            "class C extends B {",
            "  x = 1;",
            "  constructor(a) {",
            "    super(a);",
            "    f();",
            "  }",
            "}"),
        lines(
            "class C extends B {",
            "  constructor(a) {",
            "    super(a);",
            "    this.x = 1;",
            "    f();",
            "  }",
            "}",
            ""));
  }

  @Test
  public void testFieldsGoFirstWithoutSuperCall() {
    test(
        lines("class C {", "  constructor() {", "    f();", "  }", "  x = a.b;", "}"),
        lines("class C {", "  constructor() {", "    this.x = a.b;", "    f();", "  }", "}", ""));
  }

  @Test
  public void testStaticFieldsKeepOrder() {
    test(
        "export class C { static a = 1; static b = C.a + 1; }",
        lines("export class C {", "}", "C.a = 1;", "C.b = C.a + 1;", ""));
  }

  @Test
  public void testNestedClass() {
    test(
        lines("function f() {", "  class C {", "    static s = 1;", "  }", "}"),
        lines("function f() {", "  class C {", "  }", "  C.s = 1;", "}", ""));
  }

  @Test
  public void testFieldsWithoutInitializerAreDropped() {
    test("class C { x; static y; }", lines("class C {", "}", ""));
  }

  @Test
  public void testClassWithoutFieldsIsUnchanged() {
    Node script = parse(lines("class C {", "  m() {}", "}", "f();"));
    assertThat(new RewriteClassFields().process(script)).isSameInstanceAs(script);
  }

  @Test
  public void testInitializerIsMappedToField() {
    Node script = parse(lines("class C {", "  static s = 1;", "}"));
    Node lowered = new RewriteClassFields().process(script);
    Node field = script.getFirstChild().getLastChild().getFirstChild();
    Node initializer = lowered.getSecondChild();
    assertThat(initializer.isExprResult()).isTrue();
    assertThat(initializer.hasValidTextRange()).isFalse();
    assertThat(initializer.getSourceMapPos()).isEqualTo(field.getPos());
    assertThat(initializer.getSourceMapEnd()).isEqualTo(field.getEnd());
  }
}
