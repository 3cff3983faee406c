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

package org.loopform.loops;

import com.google.errorprone.annotations.FormatMethod;
import org.loopform.ir.SourcePosition;

/**
 * Thrown when the IR handed to the loop lowering is inconsistent with the built-in declarations it
 * relies on (e.g. an array type without a {@code size} property). Failing to recognize an idiom is
 * not an error and never throws.
 */
public class LoweringError extends RuntimeException {
  public final String msg;
  public final SourcePosition position;

  public LoweringError(SourcePosition position, String msg) {
    super(msg);
    this.msg = msg;
    this.position = position;
  }

  @FormatMethod
  static LoweringError of(SourcePosition position, String fmt, Object... fmtArgs) {
    return new LoweringError(position, String.format(fmt, fmtArgs));
  }

  @Override
  public String getMessage() {
    return String.format("%s (%s)", msg, position);
  }
}
