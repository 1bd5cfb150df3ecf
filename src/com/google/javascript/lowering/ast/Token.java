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

/**
 * The kinds of nodes in the syntax tree.
 *
 * <p>Child layouts:
 *
 * <pre>
 * SCRIPT, BLOCK, CLASS_MEMBERS     statements / members
 * EXPR_RESULT                      expression
 * VAR_STATEMENT                    VAR_DECL_LIST
 * VAR_DECL_LIST                    VAR_DECL+              (keyword in getString())
 * VAR_DECL                         NAME [initializer]
 * FUNCTION                         NAME|EMPTY PARAM_LIST body
 * PARAM_LIST                       NAME*
 * CLASS                            NAME EMPTY|superclass CLASS_MEMBERS
 * MEMBER_FIELD_DEF                 NAME [initializer]
 * MEMBER_FUNCTION_DEF              NAME FUNCTION
 * NAMESPACE                        NAME BLOCK
 * IMPORT                           NAME|EMPTY IMPORT_SPECS|IMPORT_STAR|EMPTY STRINGLIT
 * IMPORT_SPECS / EXPORT_SPECS      IMPORT_SPEC* / EXPORT_SPEC*
 * IMPORT_SPEC / EXPORT_SPEC        NAME NAME
 * EXPORT                           EXPORT_SPECS|EMPTY [STRINGLIT]
 * </pre>
 */
public enum Token {
  SCRIPT,
  BLOCK,
  EMPTY,
  NOT_EMITTED,
  EXPR_RESULT,
  VAR_STATEMENT,
  VAR_DECL_LIST,
  VAR_DECL,
  FUNCTION,
  PARAM_LIST,
  RETURN,
  IF,
  CLASS,
  CLASS_MEMBERS,
  MEMBER_FIELD_DEF,
  MEMBER_FUNCTION_DEF,
  NAMESPACE,

  IMPORT,
  IMPORT_SPECS,
  IMPORT_SPEC,
  IMPORT_STAR,
  EXPORT,
  EXPORT_SPECS,
  EXPORT_SPEC,

  NAME,
  STRINGLIT,
  NUMBER,
  TRUE,
  FALSE,
  NULL,
  THIS,
  SUPER,
  CALL,
  NEW,
  GETPROP,
  SPREAD,
  ASSIGN,
  ADD,
  SUB,
  MUL,
  DIV;

  /** Whether nodes of this kind hold a list of statements. */
  public boolean isStatementContainer() {
    return this == SCRIPT || this == BLOCK;
  }
}
