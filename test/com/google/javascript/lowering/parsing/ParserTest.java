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

import static com.google.common.truth.Truth.assertThat;
import static com.google.javascript.lowering.LoweringTestUtil.lines;
import static org.junit.Assert.assertThrows;

import com.google.javascript.lowering.SourceFile;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ParserTest {

  private static Node parse(String code) {
    return new Parser(SourceFile.fromCode("test.js", code)).parse();
  }

  private static ParseException parseError(String code) {
    return assertThrows(ParseException.class, () -> parse(code));
  }

  @Test
  public void testRanges() {
    Node script = parse("  var x = 1;");
    assertThat(script.getPos()).isEqualTo(0);
    assertThat(script.getStart()).isEqualTo(2);
    assertThat(script.getEnd()).isEqualTo(12);

    Node statement = script.getFirstChild();
    assertThat(statement.getPos()).isEqualTo(0);
    assertThat(statement.getStart()).isEqualTo(2);
    assertThat(statement.getEnd()).isEqualTo(12);

    Node decl = statement.getFirstChild().getFirstChild();
    assertThat(decl.getToken()).isEqualTo(Token.VAR_DECL);
    assertThat(decl.getPos()).isEqualTo(5);
    assertThat(decl.getStart()).isEqualTo(6);
    assertThat(decl.getEnd()).isEqualTo(11);
  }

  @Test
  public void testCommentsAreTrivia() {
    Node script = parse(lines("/* a */", "x; // b"));
    Node statement = script.getFirstChild();
    assertThat(statement.getPos()).isEqualTo(0);
    assertThat(statement.getStart()).isEqualTo(8);
    assertThat(statement.getEnd()).isEqualTo(10);
  }

  @Test
  public void testNodesAreOriginal() {
    Node script = parse("f(x);");
    Node call = script.getFirstChild().getFirstChild();
    assertThat(script.isOriginal()).isTrue();
    assertThat(call.isOriginal()).isTrue();
    assertThat(call.getParent()).isSameInstanceAs(script.getFirstChild());
    assertThat(call.getStaticSourceFile().getName()).isEqualTo("test.js");
  }

  @Test
  public void testEmptyFile() {
    Node script = parse("// only a comment\n");
    assertThat(script.isScript()).isTrue();
    assertThat(script.hasChildren()).isFalse();
    assertThat(script.getEnd()).isEqualTo(18);
  }

  @Test
  public void testAutomaticSemicolons() {
    Node script = parse(lines("a()", "b = c", "function f() { return }"));
    assertThat(script.getChildCount()).isEqualTo(3);
    assertThat(script.getChildAtIndex(1).getFirstChild().isAssign()).isTrue();
    Node returnNode = script.getLastChild().getLastChild().getFirstChild();
    assertThat(returnNode.isReturn()).isTrue();
    assertThat(returnNode.hasChildren()).isFalse();
  }

  @Test
  public void testReturnBeforeLineBreak() {
    Node function = parse(lines("function f() {", "  return", "  x;", "}")).getFirstChild();
    Node body = function.getLastChild();
    assertThat(body.getChildCount()).isEqualTo(2);
    assertThat(body.getFirstChild().hasChildren()).isFalse();
  }

  @Test
  public void testClass() {
    Node classNode =
        parse(lines("export class C extends a.B {", "  static s = 1;", "  x;", "  m() {}", "}"))
            .getFirstChild();
    assertThat(classNode.isClass()).isTrue();
    assertThat(classNode.isExported()).isTrue();
    assertThat(classNode.getSecondChild().isGetProp()).isTrue();

    Node members = classNode.getLastChild();
    assertThat(members.getChildCount()).isEqualTo(3);
    Node staticField = members.getFirstChild();
    assertThat(staticField.isMemberFieldDef()).isTrue();
    assertThat(staticField.isStaticMember()).isTrue();
    assertThat(staticField.getChildCount()).isEqualTo(2);
    Node field = members.getSecondChild();
    assertThat(field.isStaticMember()).isFalse();
    assertThat(field.getChildCount()).isEqualTo(1);
    assertThat(members.getLastChild().isMemberFunctionDef()).isTrue();
  }

  @Test
  public void testStaticAsMemberName() {
    Node members = parse("class C { static = 1; static() {} }").getFirstChild().getLastChild();
    assertThat(members.getFirstChild().isStaticMember()).isFalse();
    assertThat(members.getFirstChild().getFirstChild().getString()).isEqualTo("static");
    assertThat(members.getSecondChild().isMemberFunctionDef()).isTrue();
  }

  @Test
  public void testNamespace() {
    Node script = parse(lines("namespace N {", "  export const x = 1;", "}", "namespace", "y;"));
    assertThat(script.getFirstChild().isNamespace()).isTrue();
    assertThat(script.getFirstChild().getLastChild().getFirstChild().isExported()).isTrue();
    assertThat(script.getSecondChild().isExprResult()).isTrue();
  }

  @Test
  public void testImports() {
    Node script =
        parse(
            lines(
                "import 'side';",
                "import d from 'a';",
                "import * as ns from 'b';",
                "import e, {f, g as h} from 'c';"));

    Node sideEffect = script.getChildAtIndex(0);
    assertThat(sideEffect.getFirstChild().isEmpty()).isTrue();
    assertThat(sideEffect.getSecondChild().isEmpty()).isTrue();
    assertThat(sideEffect.getLastChild().getString()).isEqualTo("side");

    assertThat(script.getChildAtIndex(1).getFirstChild().getString()).isEqualTo("d");

    Node star = script.getChildAtIndex(2).getSecondChild();
    assertThat(star.getToken()).isEqualTo(Token.IMPORT_STAR);
    assertThat(star.getString()).isEqualTo("ns");

    Node specs = script.getChildAtIndex(3).getSecondChild();
    assertThat(specs.getToken()).isEqualTo(Token.IMPORT_SPECS);
    Node renamed = specs.getSecondChild();
    assertThat(renamed.getFirstChild().getString()).isEqualTo("g");
    assertThat(renamed.getSecondChild().getString()).isEqualTo("h");
    Node plain = specs.getFirstChild();
    assertThat(plain.getSecondChild().getString()).isEqualTo("f");
  }

  @Test
  public void testExports() {
    Node script =
        parse(
            lines(
                "export * from 'a';",
                "export {b as c} from 'd';",
                "export {e};",
                "export function f() {}",
                "export let g = 1;"));

    Node all = script.getChildAtIndex(0);
    assertThat(all.getBooleanProp(Node.Prop.EXPORT_ALL_FROM)).isTrue();
    assertThat(all.getLastChild().getString()).isEqualTo("a");
    assertThat(script.getChildAtIndex(1).getChildCount()).isEqualTo(2);
    assertThat(script.getChildAtIndex(2).getChildCount()).isEqualTo(1);
    assertThat(script.getChildAtIndex(3).isFunction()).isTrue();
    assertThat(script.getChildAtIndex(3).isExported()).isTrue();
    Node variable = script.getChildAtIndex(4);
    assertThat(variable.isVarStatement()).isTrue();
    assertThat(variable.isExported()).isTrue();
    assertThat(variable.getFirstChild().getString()).isEqualTo("let");
    assertThat(variable.getPos()).isEqualTo(script.getChildAtIndex(3).getEnd());
  }

  @Test
  public void testExpressions() {
    Node assign = parse("a.b = (c + d) * e / f;").getFirstChild().getFirstChild();
    assertThat(assign.isAssign()).isTrue();
    assertThat(assign.getFirstChild().isGetProp()).isTrue();
    Node div = assign.getSecondChild();
    assertThat(div.getToken()).isEqualTo(Token.DIV);
    assertThat(div.getFirstChild().getToken()).isEqualTo(Token.MUL);
    assertThat(div.getFirstChild().getFirstChild().getToken()).isEqualTo(Token.ADD);
  }

  @Test
  public void testArrowFunctions() {
    Node call =
        parse("f(x => x, (a, ...b) => { return a; }, (c));").getFirstChild().getFirstChild();
    Node concise = call.getSecondChild();
    assertThat(concise.isArrowFunction()).isTrue();
    assertThat(concise.getSecondChild().getChildCount()).isEqualTo(1);
    assertThat(concise.getLastChild().isName()).isTrue();

    Node withBlock = call.getChildAtIndex(2);
    assertThat(withBlock.isArrowFunction()).isTrue();
    assertThat(withBlock.getSecondChild().getLastChild().getToken()).isEqualTo(Token.SPREAD);
    assertThat(withBlock.getLastChild().isBlock()).isTrue();

    assertThat(call.getLastChild().isName()).isTrue();
  }

  @Test
  public void testNewAndSpread() {
    Node call = parse("new a.B(1)(...rest);").getFirstChild().getFirstChild();
    assertThat(call.isCall()).isTrue();
    assertThat(call.getFirstChild().getToken()).isEqualTo(Token.NEW);
    assertThat(call.getFirstChild().getFirstChild().isGetProp()).isTrue();
    assertThat(call.getSecondChild().getToken()).isEqualTo(Token.SPREAD);
  }

  @Test
  public void testStringEscapes() {
    Node string = parse("'a\\n\\u0041\\''").getFirstChild().getFirstChild();
    assertThat(string.getString()).isEqualTo("a\nA'");
  }

  @Test
  public void testCommentsAreCollected() {
    Parser parser = new Parser(SourceFile.fromCode("test.js", lines("// a", "x; /* b */")));
    parser.parse();
    assertThat(parser.getComments()).hasSize(2);
    assertThat(parser.getComments().get(1).getPos()).isEqualTo(8);
  }

  @Test
  public void testParserIsSingleUse() {
    Parser parser = new Parser(SourceFile.fromCode("test.js", "x;"));
    parser.parse();
    assertThrows(IllegalStateException.class, parser::parse);
  }

  @Test
  public void testMissingExpression() {
    ParseException e = parseError("var x = ;");
    assertThat(e.details()).startsWith("Expression expected");
    assertThat(e.lineNumber()).isEqualTo(1);
    assertThat(e.columnNumber()).isEqualTo(8);
  }

  @Test
  public void testMissingSemicolon() {
    ParseException e = parseError("a b");
    assertThat(e.details()).isEqualTo("';' expected");
    assertThat(e).hasMessageThat().isEqualTo("';' expected (test.js#1:2)");
  }

  @Test
  public void testUnsupportedSyntax() {
    ParseException e = parseError("a == b");
    assertThat(e.details()).isEqualTo("Comparison operators are not supported");
    assertThat(e.columnNumber()).isEqualTo(2);

    assertThat(parseError(lines("x;", "y = 'open")).details())
        .isEqualTo("Unterminated string literal");
    assertThat(parseError("/* open").details()).isEqualTo("Unterminated comment");
    assertThat(parseError("f() = 1;").details()).isEqualTo("Invalid assignment target");
    assertThat(parseError("export default x;").details()).isEqualTo("Unsupported export");
  }

  @Test
  public void testUnclosedBlock() {
    ParseException e = parseError(lines("function f() {", "  g();"));
    assertThat(e.details()).isEqualTo("'}' expected");
    assertThat(e.lineNumber()).isEqualTo(2);
  }
}
