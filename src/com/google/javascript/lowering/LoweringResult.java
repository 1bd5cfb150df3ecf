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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import com.google.javascript.lowering.emit.SourceMapping;
import java.util.List;

/** The output for one source file. */
@Immutable
public final class LoweringResult {
  private final String fileName;
  private final String code;
  private final ImmutableList<SourceMapping> mappings;

  LoweringResult(String fileName, String code, List<SourceMapping> mappings) {
    this.fileName = checkNotNull(fileName);
    this.code = checkNotNull(code);
    this.mappings = ImmutableList.copyOf(mappings);
  }

  public String getFileName() {
    return fileName;
  }

  public String getCode() {
    return code;
  }

  /** Mappings from the start of printed statements back to the source file. */
  public ImmutableList<SourceMapping> getMappings() {
    return mappings;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("fileName", fileName)
        .add("mappings", mappings.size())
        .toString();
  }
}
