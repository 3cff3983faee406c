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

/** A {@link HeaderInfo} for a loop over a progression ({@code a..b}, {@code a downTo b}, etc.). */
public final class ProgressionHeaderInfo extends HeaderInfo {

  public ProgressionHeaderInfo(
      ElementKind elementKind,
      IrExpression first,
      IrExpression last,
      IrExpression step,
      boolean isFirstInclusive,
      boolean isLastInclusive,
      boolean isReversed,
      OverflowHint canOverflow,
      ImmutableList<IrVariable> additionalVariables) {
    super(
        elementKind,
        first,
        last,
        step,
        isFirstInclusive,
        isLastInclusive,
        isReversed,
        canOverflow,
        additionalVariables);
  }

  /** A closed, non-reversed progression with nothing known about overflow. */
  public ProgressionHeaderInfo(
      ElementKind elementKind, IrExpression first, IrExpression last, IrExpression step) {
    this(
        elementKind,
        first,
        last,
        step,
        /* isFirstInclusive= */ true,
        /* isLastInclusive= */ true,
        /* isReversed= */ false,
        OverflowHint.UNKNOWN,
        ImmutableList.of());
  }

  @Override
  ProgressionHeaderInfo reversed(IrExpression negatedStep) {
    return new ProgressionHeaderInfo(
        elementKind,
        last,
        first,
        negatedStep,
        isLastInclusive,
        isFirstInclusive,
        !isReversed,
        OverflowHint.UNKNOWN,
        additionalVariables);
  }
}
