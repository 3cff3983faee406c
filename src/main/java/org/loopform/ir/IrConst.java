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
import java.util.Objects;

/** A literal value. */
public final class IrConst extends IrExpression {
  public final IrConstKind kind;

  /** The value; its class is always {@code kind.valueClass}. */
  public final Object value;

  private final IrType type;

  /** Use {@link IrBuilder} to create IrConsts. */
  IrConst(SourcePosition position, IrType type, IrConstKind kind, Object value) {
    super(position);
    Preconditions.checkArgument(
        kind.valueClass.isInstance(value), "%s is not a valid %s", value, kind);
    this.type = type;
    this.kind = kind;
    this.value = value;
  }

  @Override
  public IrType type() {
    return type;
  }

  @Override
  public boolean hasSideEffect() {
    return false;
  }

  /** Should only be called on integral constants; returns the value as a long. */
  public long longValue() {
    Preconditions.checkState(kind.isIntegral(), "%s is not integral", this);
    return ((Number) value).longValue();
  }

  /** Two constants are equal if they have the same kind and value, regardless of position. */
  @Override
  public boolean equals(Object other) {
    return other instanceof IrConst c && kind == c.kind && value.equals(c.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case LONG -> value + "L";
      case CHAR -> "'" + value + "'";
      default -> String.valueOf(value);
    };
  }
}
