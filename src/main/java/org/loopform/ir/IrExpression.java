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
 * An IrExpression represents a single value computed by the program being compiled. There are
 * three subclasses:
 *
 * <ul>
 *   <li>{@link IrConst}: a literal value
 *   <li>{@link IrGetValue}: a read of a variable
 *   <li>{@link IrCall}: the result of calling a function (or property getter) with other
 *       IrExpressions as its receivers and arguments
 * </ul>
 *
 * <p>IrExpressions are immutable, and may be shared; a rewrite that needs a different expression
 * constructs a new one. Sharing an expression is not the same as evaluating it twice, though.
 * Hosts that consume the lowering's output can use {@link #hasSideEffect} to decide whether an
 * expression may be emitted more than once; the lowering itself always hoists the arrays it reads
 * repeatedly.
 */
public abstract class IrExpression {

  private final SourcePosition position;

  IrExpression(SourcePosition position) {
    this.position = position;
  }

  /** This expression's statically-resolved type. */
  public abstract IrType type();

  /** Where this expression (or the source construct it was synthesized for) came from. */
  public final SourcePosition position() {
    return position;
  }

  /**
   * True if evaluating this expression may have an observable effect, or may return a different
   * result if evaluated again. Conservatively true for any call other than a property getter on
   * an effect-free receiver.
   */
  public abstract boolean hasSideEffect();
}
