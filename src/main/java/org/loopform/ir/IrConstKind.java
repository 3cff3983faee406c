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
 * The kinds of literal that an {@link IrConst} may hold. Each kind has a fixed Java representation
 * for its value; {@link IrConst} checks that the two agree.
 */
public enum IrConstKind {
  BYTE(Byte.class),
  SHORT(Short.class),
  INT(Integer.class),
  LONG(Long.class),
  CHAR(Character.class);

  /** The boxed Java class used to store values of this kind. */
  public final Class<?> valueClass;

  IrConstKind(Class<?> valueClass) {
    this.valueClass = valueClass;
  }

  /** True for the kinds whose values are {@link Number}s. */
  public boolean isIntegral() {
    return this != CHAR;
  }
}
