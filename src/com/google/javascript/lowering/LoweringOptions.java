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

import com.google.common.base.CharMatcher;
import com.google.common.base.MoreObjects;
import java.io.Serializable;

/** Options for {@link LoweringDriver}. */
public class LoweringOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Move source comments onto nodes so that rewrites keep them. */
  private boolean preserveComments = true;

  private boolean rewriteClassFields = true;

  private boolean rewriteModulesToCommonJs = true;

  /** Put back the comments the emitter drops. Only matters when comments are preserved. */
  private boolean repairMissingComments = true;

  private String indent = "  ";

  private String lineSeparator = "\n";

  public void setPreserveComments(boolean preserveComments) {
    this.preserveComments = preserveComments;
  }

  public boolean getPreserveComments() {
    return preserveComments;
  }

  public void setRewriteClassFields(boolean rewriteClassFields) {
    this.rewriteClassFields = rewriteClassFields;
  }

  public boolean getRewriteClassFields() {
    return rewriteClassFields;
  }

  public void setRewriteModulesToCommonJs(boolean rewriteModulesToCommonJs) {
    this.rewriteModulesToCommonJs = rewriteModulesToCommonJs;
  }

  public boolean getRewriteModulesToCommonJs() {
    return rewriteModulesToCommonJs;
  }

  public void setRepairMissingComments(boolean repairMissingComments) {
    this.repairMissingComments = repairMissingComments;
  }

  public boolean getRepairMissingComments() {
    return repairMissingComments;
  }

  /** Sets the indentation of one nesting level. Only spaces and tabs are allowed. */
  public void setIndent(String indent) {
    checkArgument(
        CharMatcher.anyOf(" \t").matchesAllOf(indent), "Indent must be blank: '%s'", indent);
    this.indent = indent;
  }

  public String getIndent() {
    return indent;
  }

  public void setLineSeparator(String lineSeparator) {
    checkArgument(
        lineSeparator.equals("\n") || lineSeparator.equals("\r\n"),
        "Unsupported line separator: '%s'",
        lineSeparator);
    this.lineSeparator = lineSeparator;
  }

  public String getLineSeparator() {
    return lineSeparator;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("preserveComments", preserveComments)
        .add("rewriteClassFields", rewriteClassFields)
        .add("rewriteModulesToCommonJs", rewriteModulesToCommonJs)
        .add("repairMissingComments", repairMissingComments)
        .add("indent", indent)
        .add("lineSeparator", lineSeparator)
        .toString();
  }
}
