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

/** Requests to the printer that are carried on individual nodes. */
public enum EmitFlag {
  /**
   * Do not print comments read from the source text for this node. Synthesized comments are still
   * printed.
   */
  NO_COMMENTS;

  int mask() {
    return 1 << ordinal();
  }
}
