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

import org.loopform.ir.FunctionSymbol;
import org.loopform.ir.IrBuilder;
import org.loopform.ir.IrConst;
import org.loopform.ir.IrExpression;

/** A static-only class for negating loop steps. */
public final class Negation {

  /**
   * Returns an expression for {@code -step}. Int and Long literals are folded into a new literal
   * of the same kind; anything else becomes a call of its type's {@code unaryMinus}, positioned at
   * {@code step}.
   */
  public static IrExpression negate(IrBuilder irb, IrExpression step) {
    if (step instanceof IrConst c) {
      switch (c.kind) {
        case INT:
          return IrBuilder.copyConst(c, -(Integer) c.value);
        case LONG:
          return IrBuilder.copyConst(c, -(Long) c.value);
        default:
          break;
      }
    }
    FunctionSymbol unaryMinus = step.type().function("unaryMinus");
    if (unaryMinus == null) {
      throw LoweringError.of(step.position(), "Can't negate step of type %s", step.type());
    }
    return irb.at(step).irCall(unaryMinus, step, null);
  }

  private Negation() {}
}
