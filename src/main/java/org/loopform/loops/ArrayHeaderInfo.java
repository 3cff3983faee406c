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

import com.google.common.collect.ImmutableList;
import org.loopform.ir.IrExpression;
import org.loopform.ir.IrVariable;

/**
 * A {@link HeaderInfo} for a loop over the indices of an array. The array itself has been hoisted
 * into {@link #arrayVariable}, which the lowered loop body should index instead of re-evaluating
 * the original expression.
 */
public final class ArrayHeaderInfo extends HeaderInfo {
  public final IrVariable arrayVariable;

  /**
   * Iterates from {@code first} (inclusive) to {@code last} (exclusive). {@code arrayVariable} is
   * the only additional variable.
   */
  public ArrayHeaderInfo(
      IrExpression first, IrExpression last, IrExpression step, IrVariable arrayVariable) {
    this(
        first,
        last,
        step,
        /* isFirstInclusive= */ true,
        /* isLastInclusive= */ false,
        /* isReversed= */ false,
        // Array sizes are never more than Int.MAX_VALUE - 1.
        OverflowHint.SAFE,
        arrayVariable,
        ImmutableList.of(arrayVariable));
  }

  private ArrayHeaderInfo(
      IrExpression first,
      IrExpression last,
      IrExpression step,
      boolean isFirstInclusive,
      boolean isLastInclusive,
      boolean isReversed,
      OverflowHint canOverflow,
      IrVariable arrayVariable,
      ImmutableList<IrVariable> additionalVariables) {
    super(
        ElementKind.INT,
        first,
        last,
        step,
        isFirstInclusive,
        isLastInclusive,
        isReversed,
        canOverflow,
        additionalVariables);
    this.arrayVariable = arrayVariable;
  }

  @Override
  ArrayHeaderInfo reversed(IrExpression negatedStep) {
    return new ArrayHeaderInfo(
        last,
        first,
        negatedStep,
        isLastInclusive,
        isFirstInclusive,
        !isReversed,
        OverflowHint.UNKNOWN,
        arrayVariable,
        additionalVariables);
  }
}
