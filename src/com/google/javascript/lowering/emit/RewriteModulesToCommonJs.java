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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.javascript.lowering.PlaceholderStatements;
import com.google.javascript.lowering.ScriptPass;
import com.google.javascript.lowering.ast.IR;
import com.google.javascript.lowering.ast.Node;
import com.google.javascript.lowering.ast.StaticSourceFile;
import com.google.javascript.lowering.ast.Token;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites ES module syntax at the top level of a script to CommonJS.
 *
 * <pre>
 * import d, {a} from './m';          var m_1 = require('./m');
 * export const x = d(a);       =>    exports.x = m_1.default(m_1.a);
 * export function f() {}             function f() {
 *                                    }
 *                                    exports.f = f;
 * </pre>
 *
 * <p>References to imported bindings and exported variables are rewritten to property accesses.
 * Shadowing is not taken into account. The {@code require} statements start where the import
 * they replace started, so they can be traced back to it; they, and the assignments to {@code
 * exports} that replace exported variable statements, do not carry the comments of the code they
 * replace.
 */
public final class RewriteModulesToCommonJs implements ScriptPass {
  private static final Logger logger = Logger.getLogger(RewriteModulesToCommonJs.class.getName());

  private static final CharMatcher IDENTIFIER_PART =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("_$"));

  private static final String EXPORTS = "exports";

  @Override
  public Node process(Node script) {
    checkState(script.isScript(), script);
    if (!hasModuleSyntax(script)) {
      return script;
    }
    StaticSourceFile file = script.getStaticSourceFile();
    logger.fine("Rewriting modules of " + (file == null ? "<synthetic>" : file.getName()));
    return new ModuleRewriter().rewrite(script);
  }

  private static boolean hasModuleSyntax(Node script) {
    for (Node statement : script.children()) {
      if (statement.isImport() || statement.isExport() || statement.isExported()) {
        return true;
      }
    }
    return false;
  }

  /** A module binding that references are rewritten to: {@code alias} or {@code alias.property}. */
  private static final class Binding {
    final String alias;
    final @Nullable String property;

    Binding(String alias, @Nullable String property) {
      this.alias = alias;
      this.property = property;
    }

    Node createReference() {
      Node target = IR.name(alias);
      return property == null ? target : IR.getprop(target, property);
    }
  }

  private static final class ModuleRewriter {
    private final Map<String, Binding> bindings = new LinkedHashMap<>();
    private final Map<String, Integer> aliasCounts = new HashMap<>();

    Node rewrite(Node script) {
      List<Node> statements = new ArrayList<>();
      for (Node statement : script.children()) {
        if (statement.isImport()) {
          statements.add(rewriteImport(statement));
        } else if (statement.isExport()) {
          statements.addAll(rewriteExport(statement));
        } else if (statement.isExported()) {
          statements.addAll(rewriteExportedDeclaration(statement));
        } else {
          statements.add(statement);
        }
      }
      List<Node> rewritten = new ArrayList<>(statements.size());
      for (Node statement : statements) {
        rewritten.add(rewriteReferences(statement));
      }
      return script.withChildren(rewritten);
    }

    private Node rewriteImport(Node importNode) {
      Node defaultBinding = importNode.getFirstChild();
      Node importBindings = importNode.getSecondChild();
      String moduleName = importNode.getLastChild().getString();
      if (defaultBinding.isEmpty() && importBindings.isEmpty()) {
        return IR.exprResult(createRequire(moduleName)).withRangeFrom(importNode);
      }
      if (defaultBinding.isEmpty() && importBindings.getToken() == Token.IMPORT_STAR) {
        return IR.var(IR.name(importBindings.getString()), createRequire(moduleName))
            .withRangeFrom(importNode);
      }
      String alias = createModuleAlias(moduleName);
      if (!defaultBinding.isEmpty()) {
        bindings.put(defaultBinding.getString(), new Binding(alias, "default"));
      }
      if (importBindings.getToken() == Token.IMPORT_STAR) {
        bindings.put(importBindings.getString(), new Binding(alias, null));
      } else if (importBindings.getToken() == Token.IMPORT_SPECS) {
        for (Node spec : importBindings.children()) {
          bindings.put(
              spec.getSecondChild().getString(),
              new Binding(alias, spec.getFirstChild().getString()));
        }
      }
      return IR.var(IR.name(alias), createRequire(moduleName)).withRangeFrom(importNode);
    }

    private ImmutableList<Node> rewriteExport(Node export) {
      ImmutableList.Builder<Node> statements = ImmutableList.builder();
      if (export.getBooleanProp(Node.Prop.EXPORT_ALL_FROM)) {
        String alias = createModuleAlias(export.getLastChild().getString());
        statements.add(
            IR.var(IR.name(alias), createRequire(export.getLastChild().getString()))
                .withRangeFrom(export));
        statements.add(
            IR.exprResult(IR.call(IR.name("__exportStar"), IR.name(alias), IR.name(EXPORTS))));
        return statements.build();
      }

      Node specs = export.getFirstChild();
      if (export.getChildCount() == 2) {
        String moduleName = export.getSecondChild().getString();
        String alias = createModuleAlias(moduleName);
        statements.add(IR.var(IR.name(alias), createRequire(moduleName)).withRangeFrom(export));
        for (Node spec : specs.children()) {
          Node value = IR.getprop(IR.name(alias), spec.getFirstChild().getString());
          statements.add(createExportAssignment(spec.getSecondChild().getString(), value, spec));
        }
        return statements.build();
      }

      // A local export keeps its comments on the first statement it is lowered to.
      List<Node> assignments = new ArrayList<>();
      for (Node spec : specs.children()) {
        Node value = IR.name(spec.getFirstChild().getString());
        assignments.add(createExportAssignment(spec.getSecondChild().getString(), value, spec));
      }
      if (assignments.isEmpty()) {
        StaticSourceFile file = export.getStaticSourceFile();
        checkState(file != null, "Export without a source file: %s", export);
        return ImmutableList.of(PlaceholderStatements.createWithCommentsFrom(file, export));
      }
      Node first =
          assignments
              .get(0)
              .toBuilder()
              .setLeadingComments(export.getLeadingComments())
              .setTrailingComments(export.getTrailingComments())
              .build();
      assignments.set(0, first);
      return ImmutableList.copyOf(assignments);
    }

    private ImmutableList<Node> rewriteExportedDeclaration(Node declaration) {
      if (declaration.isVarStatement()) {
        ImmutableList.Builder<Node> statements = ImmutableList.builder();
        for (Node decl : declaration.getFirstChild().children()) {
          Node name = decl.getFirstChild();
          bindings.put(name.getString(), new Binding(EXPORTS, name.getString()));
          if (decl.getChildCount() == 2) {
            // The declared NAME becomes the property of the assignment target.
            Node target = IR.getprop(IR.name(EXPORTS), name);
            statements.add(
                IR.exprResult(IR.assign(target, decl.getSecondChild()))
                    .withSourceMapRangeFrom(decl));
          }
        }
        return statements.build();
      }
      Node local = declaration.withBooleanProp(Node.Prop.EXPORTED, false);
      String name = declaration.getFirstChild().getString();
      return ImmutableList.of(local, createExportAssignment(name, IR.name(name), declaration));
    }

    private static Node createExportAssignment(String exportedName, Node value, Node source) {
      return IR.exprResult(IR.assign(IR.getprop(IR.name(EXPORTS), exportedName), value))
          .withSourceMapRangeFrom(source);
    }

    private static Node createRequire(String moduleName) {
      return IR.call(IR.name("require"), IR.string(moduleName));
    }

    /** Returns a name for the module object, like {@code m_1} for {@code './lib/m'}. */
    private String createModuleAlias(String moduleName) {
      String base = moduleName.substring(moduleName.lastIndexOf('/') + 1);
      base = IDENTIFIER_PART.negate().replaceFrom(base, '_');
      if (base.isEmpty() || CharMatcher.inRange('0', '9').matches(base.charAt(0))) {
        base = "_" + base;
      }
      int count = aliasCounts.merge(base, 1, Integer::sum);
      return base + "_" + count;
    }

    /** Rewrites the references to module bindings in {@code n}. */
    private Node rewriteReferences(Node n) {
      if (bindings.isEmpty()) {
        return n;
      }
      if (n.isName()) {
        Binding binding = bindings.get(n.getString());
        if (binding == null) {
          return n;
        }
        return binding
            .createReference()
            .toBuilder()
            .setLeadingComments(n.getLeadingComments())
            .setTrailingComments(n.getTrailingComments())
            .setSourceMapRange(n.getSourceMapPos(), n.getSourceMapEnd())
            .build();
      }
      List<Node> children = new ArrayList<>(n.getChildCount());
      for (int i = 0; i < n.getChildCount(); i++) {
        Node child = n.getChildAtIndex(i);
        children.add(isDeclarationOrPropertyName(n, i) ? child : rewriteReferences(child));
      }
      return n.withChildren(children);
    }

    private static boolean isDeclarationOrPropertyName(Node parent, int index) {
      switch (parent.getToken()) {
        case GETPROP:
          return index == 1;
        case VAR_DECL:
        case FUNCTION:
        case CLASS:
        case NAMESPACE:
        case MEMBER_FIELD_DEF:
        case MEMBER_FUNCTION_DEF:
          return index == 0;
        case PARAM_LIST:
        case IMPORT_SPEC:
        case EXPORT_SPEC:
          return true;
        default:
          return false;
      }
    }
  }
}
