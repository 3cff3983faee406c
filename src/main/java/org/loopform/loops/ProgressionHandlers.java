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
import com.google.common.collect.ImmutableSet;
import org.jspecify.annotations.Nullable;
import org.loopform.ir.BuiltIns;
import org.loopform.ir.CallOrigin;
import org.loopform.ir.DeclarationOrigin;
import org.loopform.ir.FunctionSymbol;
import org.loopform.ir.IrBuilder;
import org.loopform.ir.IrCall;
import org.loopform.ir.IrExpression;
import org.loopform.ir.IrType;
import org.loopform.ir.IrVariable;
import org.loopform.loops.ProgressionHandler.Context;
import org.loopform.loops.ProgressionHandler.Kind;
import org.loopform.matchers.CallMatcher;

/** A static-only class that defines the matcher and build function for each handler kind. */
public final class ProgressionHandlers {

  static final String DOWN_TO = BuiltIns.RANGES_PACKAGE + ".downTo";
  static final String UNTIL = BuiltIns.RANGES_PACKAGE + ".until";
  static final String REVERSED = BuiltIns.RANGES_PACKAGE + ".reversed";
  static final String INDICES = BuiltIns.COLLECTIONS_PACKAGE + ".<get-indices>";
  static final String ARRAY_REVERSED = BuiltIns.COLLECTIONS_PACKAGE + ".reversed";
  static final String REVERSED_ARRAY = BuiltIns.COLLECTIONS_PACKAGE + ".reversedArray";

  /** Returns one handler of each {@link Kind}, in the order in which they should be tried. */
  public static ImmutableList<ProgressionHandler> create(BuiltIns builtIns) {
    ImmutableSet<IrType> elementTypes = builtIns.progressionElementTypes;
    ImmutableList<ProgressionHandler> result =
        ImmutableList.of(
            new ProgressionHandler(
                Kind.ARRAY_ITERATION,
                CallMatcher.builder()
                    .origin(CallOrigin.FOR_LOOP_ITERATOR)
                    // TODO: also accept type parameters bounded by an array type (T : IntArray)
                    .dispatchReceiver("dispatchReceiver is array", ProgressionHandlers::isArray)
                    .parameterCount(0)
                    .build(),
                ProgressionHandlers::buildArrayIteration),
            new ProgressionHandler(
                Kind.INDICES,
                CallMatcher.builder()
                    .extensionReceiver("extensionReceiver is array", ProgressionHandlers::isArray)
                    .fqName(INDICES)
                    .parameterCount(0)
                    .build(),
                ProgressionHandlers::buildIndices),
            new ProgressionHandler(
                Kind.UNTIL,
                CallMatcher.builder().singleArgumentExtension(UNTIL, elementTypes).build(),
                ProgressionHandlers::buildUntil),
            new ProgressionHandler(
                Kind.DOWN_TO,
                CallMatcher.builder().singleArgumentExtension(DOWN_TO, elementTypes).build(),
                ProgressionHandlers::buildDownTo),
            new ProgressionHandler(
                Kind.RANGE_TO,
                CallMatcher.builder()
                    .dispatchReceiverTypeIn(elementTypes)
                    .name("rangeTo")
                    .parameterCount(1)
                    .parameterTypeIn(0, elementTypes)
                    .build(),
                ProgressionHandlers::buildRangeTo),
            new ProgressionHandler(
                Kind.REVERSED,
                CallMatcher.builder()
                    .fqName(REVERSED)
                    .extensionReceiverTypeIn(builtIns.progressionClassTypes)
                    .parameterCount(0)
                    .build(),
                ProgressionHandlers::buildReversed),
            new ProgressionHandler(
                Kind.REVERSED_ARRAY,
                CallMatcher.builder()
                    .fqName(
                        "fqName in [reversed, reversedArray]",
                        n -> n.equals(ARRAY_REVERSED) || n.equals(REVERSED_ARRAY))
                    .extensionReceiver("extensionReceiver is array", ProgressionHandlers::isArray)
                    .parameterCount(0)
                    .build(),
                ProgressionHandlers::buildReversedArray));
    assert result.size() == Kind.values().length;
    return result;
  }

  private static boolean isArray(@Nullable IrExpression receiver) {
    return receiver != null && receiver.type().isArrayOrPrimitiveArray();
  }

  private static HeaderInfo buildRangeTo(IrCall call, ElementKind elementKind, Context context) {
    IrBuilder irb = context.irBuilder(call);
    return new ProgressionHeaderInfo(
        elementKind, call.dispatchReceiver, call.argument(0), elementKind.step(irb, 1));
  }

  private static HeaderInfo buildDownTo(IrCall call, ElementKind elementKind, Context context) {
    IrBuilder irb = context.irBuilder(call);
    return new ProgressionHeaderInfo(
        elementKind, call.extensionReceiver, call.argument(0), elementKind.step(irb, -1));
  }

  private static HeaderInfo buildUntil(IrCall call, ElementKind elementKind, Context context) {
    IrBuilder irb = context.irBuilder(call);
    return new ProgressionHeaderInfo(
        elementKind,
        call.extensionReceiver,
        call.argument(0),
        elementKind.step(irb, 1),
        /* isFirstInclusive= */ true,
        /* isLastInclusive= */ false,
        /* isReversed= */ false,
        // The exclusive bound is never reached, so the induction variable can't pass it.
        OverflowHint.SAFE,
        ImmutableList.of());
  }

  private static HeaderInfo buildIndices(IrCall call, ElementKind elementKind, Context context) {
    IrBuilder irb = context.irBuilder(call);
    // The array is only read once (by `last`), so it doesn't need to be hoisted.
    IrExpression array = call.extensionReceiver;
    return new ProgressionHeaderInfo(
        ElementKind.INT,
        irb.irInt(0),
        irb.irCall(sizeGetter(array), array, null),
        irb.irInt(1),
        /* isFirstInclusive= */ true,
        /* isLastInclusive= */ false,
        /* isReversed= */ false,
        // `last` is at most Int.MAX_VALUE - 1.
        OverflowHint.SAFE,
        ImmutableList.of());
  }

  private static @Nullable HeaderInfo buildReversed(
      IrCall call, ElementKind elementKind, Context context) {
    if (!(context.dispatch(call.extensionReceiver, elementKind)
        instanceof ProgressionHeaderInfo nested)) {
      return null;
    }
    return nested.reversed(Negation.negate(context.irBuilder(call), nested.step));
  }

  private static HeaderInfo buildArrayIteration(
      IrCall call, ElementKind elementKind, Context context) {
    return arrayHeader(context.irBuilder(call), call.dispatchReceiver);
  }

  private static @Nullable HeaderInfo buildReversedArray(
      IrCall call, ElementKind elementKind, Context context) {
    IrExpression receiver = call.extensionReceiver;
    // The receiver may itself be a reversed array; otherwise it's the array to iterate over.
    HeaderInfo nested = context.dispatch(receiver, elementKind);
    if (nested == null) {
      nested = arrayHeader(context.irBuilder(receiver), receiver);
    } else if (!(nested instanceof ArrayHeaderInfo)) {
      return null;
    }
    return nested.reversed(Negation.negate(context.irBuilder(call), nested.step));
  }

  /**
   * Returns a HeaderInfo for the indices of {@code array}, after hoisting it into a temporary.
   *
   * <p>Lowering {@code for (elem in A) f(elem)} to {@code for (i in A.indices) f(A[i])} would
   * evaluate {@code A} on every iteration, which changes the program's behavior if {@code A} has a
   * side effect (and if it's a variable that the body reassigns). Instead we lower it to
   *
   * <pre>
   *   val a = A
   *   for (i in a.indices) f(a[i])
   * </pre>
   */
  static ArrayHeaderInfo arrayHeader(IrBuilder irb, IrExpression array) {
    IrVariable arrayVariable =
        irb.irTemporary(array, "array", DeclarationOrigin.FOR_LOOP_IMPLICIT_VARIABLE);
    IrExpression last = irb.irCall(sizeGetter(array), irb.irGet(arrayVariable), null);
    return new ArrayHeaderInfo(irb.irInt(0), last, irb.irInt(1), arrayVariable);
  }

  private static FunctionSymbol sizeGetter(IrExpression array) {
    FunctionSymbol getter = array.type().propertyGetter("size");
    if (getter == null) {
      throw LoweringError.of(array.position(), "%s has no size property", array.type());
    }
    return getter;
  }

  private ProgressionHandlers() {}
}
