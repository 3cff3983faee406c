/*
 * Copyright 2025 The Retrospect Authors
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

package org.loopform.ir;

import com.google.common.base.Preconditions;

/**
 * The source range an IR node was created from, as a pair of character offsets into the file.
 * Synthesized nodes copy the position of the node they replace so that diagnostics still point at
 * the user's code.
 */
public record SourcePosition(int startOffset, int endOffset) {

  /** Used for nodes that have no corresponding source, e.g. nodes built directly by tests. */
  public static final SourcePosition UNDEFINED = new SourcePosition(-1, -1);

  public SourcePosition {
    Preconditions.checkArgument(
        startOffset <= endOffset, "start %s after end %s", startOffset, endOffset);
  }

  @Override
  public String toString() {
    return (this == UNDEFINED) ? "?" : startOffset + ":" + endOffset;
  }
}
