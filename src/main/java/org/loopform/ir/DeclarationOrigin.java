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

/** Records why an {@link IrVariable} exists. */
public enum DeclarationOrigin {
  /** Declared by the user's code (including function parameters). */
  DEFINED,
  /** Introduced by for-loop lowering, e.g. to hold an array that must only be evaluated once. */
  FOR_LOOP_IMPLICIT_VARIABLE
}
