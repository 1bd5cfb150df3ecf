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

import com.google.common.collect.ImmutableList;
import com.google.javascript.lowering.LoweringOptions;
import com.google.javascript.lowering.SourceFile;
import com.google.javascript.lowering.ast.EmitFlag;
import com.google.javascript.lowering.ast.IR;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.SynthesizedComment;
import com.google.javascript.lowering.parsing.Parser;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CodePrinterTest {

  private static String print(Node root) {
    return new CodePrinter.Builder(root).build();
  }

  private static String printWithSourceComments(String code) {
    SourceFile file = SourceFile.fromCode("test.js", code);
    return new CodePrinter.Builder(new Parser(file).parse()).setSourceFile(file).build();
  }

  private static void assertPrintSame(String code) {
    assertThat(print(parse(code))).isEqualTo(code + "\n");
  }

  private static void assertPrint(String code, String expected) {
    assertThat(print(parse(code))).isEqualTo(expected);
  }

  @Test
  public void testPrecedence() {
    assertPrintSame("a = (b + c) * d;");
    assertPrintSame("x = a - (b - c);");
    assertPrintSame("x = a - b - c;");
    assertPrintSame("a.b = c = d / e;");
    assertPrintSame("new (f())();");
    assertPrintSame("new a.B(1);");
    assertPrintSame("f(...args);");
    assertPrintSame("const g = (a, b) => a + b;");
    assertPrint("x = ((a));", "x = a;\n");
  }

  @Test
  public void testStrings() {
    assertPrint("x = \"it's\";", "x = 'it\\'s';\n");
    assertPrint("x = \"a\";", "x = 'a';\n");
    assertThat(CodeGenerator.quote("a\nb\\")).isEqualTo("'a\\nb\\\\'");
    assertThat(CodeGenerator.quote("\u2028\u0001")).isEqualTo("'\\u2028\\u0001'");
  }

  @Test
  public void testModules() {
    assertPrintSame(
        lines(
            "import 'side';",
            "import d from 'a';",
            "import * as ns from 'b';",
            "import e, {f, g as h} from 'c';",
            "export * from 'a';",
            "export {b as c} from 'd';",
            "export {e};",
            "export let g = 1;"));
  }

  @Test
  public void testIf() {
    assertPrintSame(lines("if (a) {", "  b();", "} else {", "  c();", "}"));
    assertPrint("if (a) b(); else c();", lines("if (a)", "  b();", "else", "  c();", ""));
    assertPrint(
        "if (a) b(); else { c(); }", lines("if (a)", "  b();", "else {", "  c();", "}", ""));
  }

  @Test
  public void testDeclarations() {
    assertPrint("function f() {}", lines("function f() {", "}", ""));
    assertPrintSame(
        lines(
            "export class C extends a.B {",
            "  static s = 1;",
            "  x;",
            "  m(p, ...rest) {",
            "    return p;",
            "  }",
            "}"));
    assertPrintSame(lines("export namespace N {", "  export const x = 1;", "}"));
    assertPrintSame(lines("var a = 1, b;", "let c = () => {", "  return;", "};"));
  }

  @Test
  public void testIndentAndLineSeparator() {
    LoweringOptions options = new LoweringOptions();
    options.setIndent("\t");
    options.setLineSeparator("\r\n");
    Node script = parse(lines("function f() {", "  if (a) {", "    b();", "  }", "}"));
    assertThat(new CodePrinter.Builder(script).setOptions(options).build())
        .isEqualTo("function f() {\r\n\tif (a) {\r\n\t\tb();\r\n\t}\r\n}\r\n");
  }

  @Test
  public void testSourceComments() {
    String code = lines("// a", "var x = 1; // b", "/* c */", "f(x);", "// d");
    assertThat(printWithSourceComments(code))
        .isEqualTo(lines("// a", "var x = 1; // b", "/* c */", "f(x);", "// d", ""));
  }

  @Test
  public void testSourceCommentIsPrintedOnce() {
    assertThat(printWithSourceComments(lines("a(); /* c */", "b();")))
        .isEqualTo(lines("a(); /* c */", "b();", ""));
  }

  @Test
  public void testSourceCommentsInsideBlock() {
    assertThat(printWithSourceComments(lines("function f() {", "  g();", "  // end", "}")))
        .isEqualTo(lines("function f() {", "  g();", "  // end", "}", ""));
  }

  @Test
  public void testSourceCommentAfterBlock() {
    assertThat(printWithSourceComments(lines("if (a) {", "} /* x */ else {", "}")))
        .isEqualTo(lines("if (a) {", "} /* x */ else {", "}", ""));
    assertThat(printWithSourceComments(lines("if (a) {", "} // x", "else {", "}")))
        .isEqualTo(lines("if (a) {", "} // x", "else {", "}", ""));
  }

  @Test
  public void testNoCommentsFlagSuppressesSourceComments() {
    SourceFile file = SourceFile.fromCode("test.js", lines("// a", "x;"));
    Node script = new Parser(file).parse();
    Node statement = script.getFirstChild().withEmitFlag(EmitFlag.NO_COMMENTS);
    Node printed = script.withChildren(ImmutableList.of(statement));
    assertThat(new CodePrinter.Builder(printed).setSourceFile(file).build())
        .isEqualTo(lines("x;", ""));
  }

  @Test
  public void testSynthesizedComments() {
    Node call =
        IR.exprResult(IR.call(IR.name("f")))
            .withLeadingComments(ImmutableList.of(SynthesizedComment.block(" a ", false)))
            .withTrailingComments(ImmutableList.of(SynthesizedComment.line(" b")));
    Node placeholder =
        IR.notEmitted()
            .withLeadingComments(
                ImmutableList.of(
                    SynthesizedComment.line(" c"), SynthesizedComment.block(" d ", false)));
    assertThat(print(IR.script(ImmutableList.of(call, placeholder))))
        .isEqualTo(lines("/* a */ f(); // b", "// c", "/* d */", ""));
  }

  @Test
  public void testCommentWithTrailingNewlineEndsTheLine() {
    Node statement =
        IR.exprResult(IR.name("x"))
            .withLeadingComments(ImmutableList.of(SynthesizedComment.block("* Doc. ", true)));
    assertThat(print(IR.script(ImmutableList.of(statement))))
        .isEqualTo(lines("/** Doc. */", "x;", ""));
  }

  @Test
  public void testSourceMappings() {
    SourceFile file = SourceFile.fromCode("test.js", lines("if (a) {", "    b();", "}"));
    List<SourceMapping> mappings = new ArrayList<>();
    String code =
        new CodePrinter.Builder(new Parser(file).parse())
            .setSourceFile(file)
            .setSourceMappings(mappings)
            .build();
    assertThat(code).isEqualTo(lines("if (a) {", "  b();", "}", ""));
    assertThat(mappings)
        .containsExactly(new SourceMapping(1, 0, 1, 0), new SourceMapping(2, 2, 2, 4))
        .inOrder();
  }

  @Test
  public void testNoMappingsWithoutSourceFile() {
    List<SourceMapping> mappings = new ArrayList<>();
    new CodePrinter.Builder(parse("x;")).setSourceMappings(mappings).build();
    assertThat(mappings).isEmpty();
  }
}
