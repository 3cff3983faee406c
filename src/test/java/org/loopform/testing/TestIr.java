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

package org.loopform.testing;

import static com.google.common.base.Preconditions.checkNotNull;

import org.loopform.ir.BuiltIns;
import org.loopform.ir.CallOrigin;
import org.loopform.ir.FunctionSymbol;
import org.loopform.ir.IrBuilder;
import org.loopform.ir.IrCall;
import org.loopform.ir.IrConst;
import org.loopform.ir.IrExpression;
import org.loopform.ir.IrType;
import org.loopform.ir.IrVariable;
import org.loopform.ir.Scope;
import org.loopform.ir.SourcePosition;

/** Shorthand for building the IR of common for-loop iterables in tests. */
public final class TestIr {
  public final BuiltIns builtIns = new BuiltIns();
  public final Scope scope = new Scope("test");
  public final IrBuilder irb = new IrBuilder(builtIns, scope, new SourcePosition(10, 20));

  /** Returns a literal of the given primitive type. */
  public IrConst constOf(IrType type, long value) {
    if (type == builtIns.byteType) {
      return irb.irByte((byte) value);
    } else if (type == builtIns.shortType) {
      return irb.irShort((short) value);
    } else if (type == builtIns.longType) {
      return irb.irLong(value);
    } else if (type == builtIns.charType) {
      return irb.irChar((char) value);
    }
    return irb.irInt(Math.toIntExact(value));
  }

  public IrVariable parameter(String name, IrType type) {
    return IrVariable.parameter(name, type);
  }

  public IrExpression get(IrVariable variable) {
    return irb.irGet(variable);
  }

  /** {@code a..b} */
  public IrCall rangeTo(IrExpression a, IrExpression b) {
    FunctionSymbol fn = checkNotNull(builtIns.rangeTo(a.type(), b.type()));
    return irb.irCall(fn, fn.returnType, a, null, CallOrigin.RANGE, b);
  }

  /** {@code a downTo b} */
  public IrCall downTo(IrExpression a, IrExpression b) {
    return irb.irCall(checkNotNull(builtIns.downTo(a.type(), b.type())), null, a, b);
  }

  /** {@code a until b} */
  public IrCall until(IrExpression a, IrExpression b) {
    return irb.irCall(checkNotNull(builtIns.until(a.type(), b.type())), null, a, b);
  }

  /** {@code progression.reversed()} */
  public IrCall reversed(IrExpression progression) {
    return irb.irCall(checkNotNull(builtIns.reversed(progression.type())), null, progression);
  }

  /** {@code array.indices} */
  public IrCall indices(IrExpression array) {
    FunctionSymbol fn = checkNotNull(builtIns.indices(array.type()));
    return irb.irCall(fn, fn.returnType, null, array, CallOrigin.GET_PROPERTY);
  }

  /** {@code array.reversed()} */
  public IrCall arrayReversed(IrExpression array) {
    return irb.irCall(checkNotNull(builtIns.arrayReversed(array.type())), null, array);
  }

  /** {@code array.reversedArray()} */
  public IrCall reversedArray(IrExpression array) {
    return irb.irCall(checkNotNull(builtIns.reversedArray(array.type())), null, array);
  }

  /** The implicit {@code iterable.iterator()} call of {@code for (x in iterable)}. */
  public IrCall forLoop(IrExpression iterable) {
    FunctionSymbol fn = checkNotNull(iterable.type().function("iterator"));
    return irb.irCall(fn, fn.returnType, iterable, null, CallOrigin.FOR_LOOP_ITERATOR);
  }
}
