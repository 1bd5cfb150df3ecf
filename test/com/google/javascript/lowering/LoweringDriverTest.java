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
import static com.google.common.truth.Truth.assertThat;
import static com.google.javascript.lowering.LoweringTestUtil.lines;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.javascript.lowering.ast.IR;
import com.google.javascript.lowering.emit.SourceMapping;
import com.google.javascript.lowering.parsing.ParseException;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LoweringDriverTest {

  /** Replaces every expression statement with a call to {@code bar}, keeping the statement. */
  private static final ScriptPass CALL_BAR =
      script ->
          script.withChildren(
              script.children().stream()
                  .map(
                      statement ->
                          statement.isExprResult()
                              ? statement.withChildren(ImmutableList.of(IR.call(IR.name("bar"))))
                              : statement)
                  .collect(toImmutableList()));

  private LoweringOptions options;

  @Before
  public void setUp() {
    options = new LoweringOptions();
  }

  private String compile(String code) {
    return new LoweringDriver(options).compile(SourceFile.fromCode("test.js", code)).getCode();
  }

  @Test
  public void testLicenseHeaderAndExportedClass() {
    String code = lines("/**", " * @license MIT", " */", "", "export class A {} // inline", "");
    assertThat(compile(code))
        .isEqualTo(
            lines(
                "/**", " * @license MIT", " */", "class A {", "} // inline", "exports.A = A;", ""));
  }

  @Test
  public void testDocCommentWithoutBlankLine() {
    assertThat(compile(lines("/** Doc. */", "var x = 1;")))
        .isEqualTo(lines("/** Doc. */", "var x = 1;", ""));
  }

  @Test
  public void testRewriteKeepsComments() {
    String code = lines("// keep me", "foo();");
    LoweringDriver driver = new LoweringDriver(options, ImmutableList.of(CALL_BAR));
    assertThat(driver.compile(SourceFile.fromCode("test.js", code)).getCode())
        .isEqualTo(lines("// keep me", "bar();", ""));
  }

  @Test
  public void testCommentAtEndOfClassBody() {
    assertThat(compile(lines("class A {", "  m() {}", "  // end of class", "}")))
        .isEqualTo(lines("class A {", "  m() {", "  }", "  // end of class", "}", ""));
  }

  @Test
  public void testCommentBeforeElse() {
    String code = lines("if (a) {", "  b();", "} // after if", "else {", "  c();", "}");
    String expected = lines("if (a) {", "  b();", "} // after if", "else {", "  c();", "}", "");
    assertThat(compile(code)).isEqualTo(expected);

    options.setPreserveComments(false);
    assertThat(compile(code)).isEqualTo(expected);
  }

  @Test
  public void testCommentBeforeSemicolon() {
    assertThat(compile(lines("function f() {", "  return /* c */;", "}")))
        .isEqualTo(lines("function f() {", "  return; /* c */", "}", ""));
  }

  @Test
  public void testModulesWithoutLowering() {
    options.setRewriteModulesToCommonJs(false);
    assertThat(compile(lines("// m", "import {a} from 'm';", "a();")))
        .isEqualTo(lines("// m", "import {a} from 'm';", "a();", ""));
  }

  @Test
  public void testSourceCommentsWithoutPreparation() {
    options.setPreserveComments(false);
    assertThat(compile(lines("// a", "var x = 1; // b", "/* c */", "f(x);", "// d")))
        .isEqualTo(lines("// a", "var x = 1; // b", "/* c */", "f(x);", "// d", ""));
  }

  @Test
  public void testSourceMappings() {
    LoweringResult result =
        new LoweringDriver(options).compile(SourceFile.fromCode("test.js", "var a = 1;\n  b();"));
    assertThat(result.getCode()).isEqualTo(lines("var a = 1;", "b();", ""));
    assertThat(result.getMappings())
        .containsExactly(new SourceMapping(1, 0, 1, 0), new SourceMapping(2, 0, 2, 2))
        .inOrder();
  }

  @Test
  public void testMappingOfLoweredField() {
    LoweringResult result =
        new LoweringDriver(options)
            .compile(SourceFile.fromCode("test.js", lines("class C {", "  static x = 1;", "}")));
    assertThat(result.getCode()).isEqualTo(lines("class C {", "}", "C.x = 1;", ""));
    assertThat(result.getMappings())
        .containsExactly(new SourceMapping(1, 0, 1, 0), new SourceMapping(3, 0, 2, 2))
        .inOrder();
  }

  @Test
  public void testCompileSeveralFiles() {
    ImmutableList<LoweringResult> results =
        new LoweringDriver(options)
            .compile(
                ImmutableList.of(
                    SourceFile.fromCode("a.js", "// a\na();"),
                    SourceFile.fromCode("b.js", "// b\nb();")));
    assertThat(results).hasSize(2);
    assertThat(results.get(0).getFileName()).isEqualTo("a.js");
    assertThat(results.get(0).getCode()).isEqualTo(lines("// a", "a();", ""));
    assertThat(results.get(1).getFileName()).isEqualTo("b.js");
    assertThat(results.get(1).getCode()).isEqualTo(lines("// b", "b();", ""));
  }

  @Test
  public void testParseErrorIsReported() {
    LoweringDriver driver = new LoweringDriver(options);
    ParseException e =
        assertThrows(
            ParseException.class, () -> driver.compile(SourceFile.fromCode("bad.js", "var = 1;")));
    assertThat(e.sourceName()).isEqualTo("bad.js");
    assertThat(e.lineNumber()).isEqualTo(1);
    assertThat(e.columnNumber()).isEqualTo(4);

    assertThat(driver.compile(SourceFile.fromCode("good.js", "x;")).getCode())
        .isEqualTo(lines("x;", ""));
  }

  @Test
  public void testFailedFileDoesNotAffectTheNextOne() {
    ScriptPass failOnFirstFile =
        script -> {
          if (script.getStaticSourceFile().getName().equals("fail.js")) {
            throw new IllegalStateException("rewrite failed");
          }
          return script;
        };
    LoweringDriver driver = new LoweringDriver(options, ImmutableList.of(failOnFirstFile));

    assertThrows(
        IllegalStateException.class,
        () -> driver.compile(SourceFile.fromCode("fail.js", "// one\na();")));
    assertThat(driver.compile(SourceFile.fromCode("ok.js", "// two\nb();")).getCode())
        .isEqualTo(lines("// two", "b();", ""));
  }

  @Test
  public void testLineSeparatorAndIndent() {
    options.setLineSeparator("\r\n");
    options.setIndent("\t");
    assertThat(compile(lines("if (a) {", "  b();", "}"))).isEqualTo("if (a) {\r\n\tb();\r\n}\r\n");
  }

  @Test
  public void testInvalidOptions() {
    assertThrows(IllegalArgumentException.class, () -> options.setIndent("x"));
    assertThrows(IllegalArgumentException.class, () -> options.setLineSeparator("\r"));
  }
}
