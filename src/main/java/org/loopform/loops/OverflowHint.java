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

/**
 * Whether the arithmetic that advances a loop's induction variable past {@link HeaderInfo#last}
 * might wrap around. Consumers must treat {@link #UNKNOWN} the same as {@link #UNSAFE}.
 */
public enum OverflowHint {
  /** The bound is known to be at most one step short of the element type's limit. */
  SAFE,
  /**
   * The bound may be the element type's limit. No handler produces this; it is only supplied by
   * hosts that build their own HeaderInfos.
   */
  UNSAFE,
  /** Nothing is known about the bound. */
  UNKNOWN;

  /** True unless overflow has been ruled out. */
  public boolean mayOverflow() {
    return this != SAFE;
  }
}
