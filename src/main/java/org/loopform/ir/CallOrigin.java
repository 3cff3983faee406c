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

/**
 * Records which source construct an {@link IrCall} was created for, when that isn't apparent from
 * the called function alone.
 */
public enum CallOrigin {
  /** The implicit {@code iterable.iterator()} call that starts a for-loop. */
  FOR_LOOP_ITERATOR,
  /** A property read such as {@code array.indices}. */
  GET_PROPERTY,
  /** A {@code ..} operator. */
  RANGE
}
