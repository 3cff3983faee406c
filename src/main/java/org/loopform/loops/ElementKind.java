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

import org.jspecify.annotations.Nullable;
import org.loopform.ir.IrBuilder;
import org.loopform.ir.IrConst;
import org.loopform.ir.IrType;

/**
 * The types of induction variable a lowered loop may have. Byte and Short progressions count with
 * an INT induction variable, since their {@code rangeTo} produces an {@code IntRange}.
 */
public enum ElementKind {
  INT,
  LONG,
  CHAR;

  /**
   * Returns the ElementKind of a progression class or of a primitive element type, or null if
   * {@code type} is neither.
   */
  public static @Nullable ElementKind of(IrType type) {
    IrType element = (type.kind == IrType.Kind.PROGRESSION) ? type.elementType : type;
    if (element == null || element.kind != IrType.Kind.PRIMITIVE) {
      return null;
    }
    return switch (element.simpleName()) {
      case "Byte", "Short", "Int" -> INT;
      case "Long" -> LONG;
      case "Char" -> CHAR;
      default -> null;
    };
  }

  /**
   * Returns a literal step of the given value. LONG progressions step by a Long; INT and CHAR
   * progressions step by an Int.
   */
  IrConst step(IrBuilder irb, int value) {
    return (this == LONG) ? irb.irLong(value) : irb.irInt(value);
  }
}
