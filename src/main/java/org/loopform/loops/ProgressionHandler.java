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
import org.loopform.ir.IrCall;
import org.loopform.ir.IrExpression;
import org.loopform.matchers.CallMatcher;

/**
 * A ProgressionHandler recognizes one source idiom and builds the {@link HeaderInfo} for it. The
 * set of handlers is closed (see {@link Kind}); {@link ProgressionHandlers#create} returns one of
 * each, in the order they should be tried.
 */
public final class ProgressionHandler {

  /** The recognized idioms, in priority order. */
  public enum Kind {
    /** {@code for (x in array)}. */
    ARRAY_ITERATION,
    /** {@code array.indices}. */
    INDICES,
    /** {@code a until b}. */
    UNTIL,
    /** {@code a downTo b}. */
    DOWN_TO,
    /** {@code a..b}. */
    RANGE_TO,
    /** {@code progression.reversed()}. */
    REVERSED,
    /** {@code array.reversed()} or {@code array.reversedArray()}. */
    REVERSED_ARRAY;

    /**
     * True if the handler's result describes the iterable's own elements, so the loop's expected
     * element kind must agree with the call's type. Array handlers always count indices.
     */
    boolean countsElements() {
      return this != ARRAY_ITERATION && this != REVERSED_ARRAY;
    }
  }

  /** What a handler's build function has access to besides the call. */
  interface Context {
    /** Returns an IrBuilder that positions new nodes at {@code at}. */
    IrBuilder irBuilder(IrExpression at);

    /** Tries every enabled handler on {@code iterable}; see {@link HeaderInfoBuilder#build}. */
    @Nullable HeaderInfo dispatch(IrExpression iterable, ElementKind elementKind);
  }

  /** Builds the HeaderInfo for a call that has been accepted by the handler's matcher. */
  @FunctionalInterface
  interface Build {
    /**
     * Returns the HeaderInfo, or null if the call has the right shape but can't be lowered
     * anyway.
     */
    @Nullable HeaderInfo build(IrCall call, ElementKind elementKind, Context context);
  }

  public final Kind kind;
  public final CallMatcher matcher;
  private final Build build;

  ProgressionHandler(Kind kind, CallMatcher matcher, Build build) {
    this.kind = kind;
    this.matcher = matcher;
    this.build = build;
  }

  /** Should only be called with a call accepted by {@link #matcher}. */
  @Nullable HeaderInfo build(IrCall call, ElementKind elementKind, Context context) {
    assert matcher.test(call);
    return build.build(call, elementKind, context);
  }

  @Override
  public String toString() {
    return kind + ": " + matcher;
  }
}
