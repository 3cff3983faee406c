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
 * A HeaderInfo describes a for-loop iterable in a form that can be lowered to a counted loop: the
 * induction variable starts at {@link #first}, advances by {@link #step}, and stops at {@link
 * #last}, with the two inclusivity flags saying whether the bounds themselves are visited.
 *
 * <p>The consumer must declare each of the {@link #additionalVariables}, in order, before
 * evaluating {@link #first}, {@link #last} and {@link #step} (in that order, once each).
 *
 * <p>HeaderInfos are created for one loop, consumed by the same lowering pass, and then discarded.
 */
public abstract class HeaderInfo {
  public final ElementKind elementKind;
  public final IrExpression first;
  public final IrExpression last;

  /** The increment; negative for descending progressions, but may not be a constant. */
  public final IrExpression step;

  public final boolean isFirstInclusive;
  public final boolean isLastInclusive;

  /**
   * True if this HeaderInfo was produced by an odd number of reversals. The sign of {@link #step}
   * can't be used to determine this since {@link #step} may not be constant.
   */
  public final boolean isReversed;

  public final OverflowHint canOverflow;

  /** Temporaries to be declared before the loop, in order; later ones may read earlier ones. */
  public final ImmutableList<IrVariable> additionalVariables;

  HeaderInfo(
      ElementKind elementKind,
      IrExpression first,
      IrExpression last,
      IrExpression step,
      boolean isFirstInclusive,
      boolean isLastInclusive,
      boolean isReversed,
      OverflowHint canOverflow,
      ImmutableList<IrVariable> additionalVariables) {
    this.elementKind = elementKind;
    this.first = first;
    this.last = last;
    this.step = step;
    this.isFirstInclusive = isFirstInclusive;
    this.isLastInclusive = isLastInclusive;
    this.isReversed = isReversed;
    this.canOverflow = canOverflow;
    this.additionalVariables = additionalVariables;
  }

  /**
   * Returns the HeaderInfo for iterating this one backwards: the bounds and their inclusivity are
   * swapped, {@code negatedStep} replaces the step, and {@link #isReversed} is flipped. Nothing
   * carries over about overflow, since the bounds have changed roles.
   */
  abstract HeaderInfo reversed(IrExpression negatedStep);

  @Override
  public String toString() {
    return String.format(
        "%s%s%s, %s%s step %s%s%s%s",
        elementKind,
        isFirstInclusive ? "[" : "(",
        first,
        last,
        isLastInclusive ? "]" : ")",
        step,
        isReversed ? " reversed" : "",
        canOverflow.mayOverflow() ? "" : " safe",
        additionalVariables.isEmpty() ? "" : " with " + additionalVariables);
  }
}
