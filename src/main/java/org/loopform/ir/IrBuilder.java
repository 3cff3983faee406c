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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * Creates new IR nodes. Every node created by an IrBuilder gets the builder's {@link #position},
 * so a rewrite that constructs its replacement through an IrBuilder positioned at the original
 * node keeps diagnostics pointing at the user's code.
 *
 * <p>IrBuilders hold no mutable state of their own; temporaries are allocated from the {@link
 * Scope} supplied at construction.
 */
public final class IrBuilder {
  public final BuiltIns builtIns;
  public final Scope scope;
  public final SourcePosition position;

  public IrBuilder(BuiltIns builtIns, Scope scope, SourcePosition position) {
    this.builtIns = builtIns;
    this.scope = scope;
    this.position = position;
  }

  /** Returns an IrBuilder that positions new nodes at {@code expression}. */
  public IrBuilder at(IrExpression expression) {
    return new IrBuilder(builtIns, scope, expression.position());
  }

  public IrConst irInt(int value) {
    return new IrConst(position, builtIns.intType, IrConstKind.INT, value);
  }

  public IrConst irLong(long value) {
    return new IrConst(position, builtIns.longType, IrConstKind.LONG, value);
  }

  public IrConst irChar(char value) {
    return new IrConst(position, builtIns.charType, IrConstKind.CHAR, value);
  }

  public IrConst irByte(byte value) {
    return new IrConst(position, builtIns.byteType, IrConstKind.BYTE, value);
  }

  public IrConst irShort(short value) {
    return new IrConst(position, builtIns.shortType, IrConstKind.SHORT, value);
  }

  /** Returns a read of the given variable. */
  public IrGetValue irGet(IrVariable variable) {
    return new IrGetValue(position, variable);
  }

  /** Returns a call of {@code symbol}, whose type is the symbol's declared return type. */
  public IrCall irCall(
      FunctionSymbol symbol,
      @Nullable IrExpression dispatchReceiver,
      @Nullable IrExpression extensionReceiver,
      IrExpression... arguments) {
    return irCall(
        symbol, symbol.returnType, dispatchReceiver, extensionReceiver, null, arguments);
  }

  /** Returns a call of {@code symbol} with an explicit result type and origin. */
  public IrCall irCall(
      FunctionSymbol symbol,
      IrType type,
      @Nullable IrExpression dispatchReceiver,
      @Nullable IrExpression extensionReceiver,
      @Nullable CallOrigin origin,
      IrExpression... arguments) {
    return new IrCall(
        position,
        type,
        symbol,
        dispatchReceiver,
        extensionReceiver,
        ImmutableList.copyOf(arguments),
        origin);
  }

  /**
   * Declares a temporary in {@link #scope} that holds the value of {@code initializer}, and
   * returns it.
   */
  public IrVariable irTemporary(
      IrExpression initializer, String nameHint, DeclarationOrigin origin) {
    return scope.createTemporaryVariable(initializer, nameHint, origin);
  }

  /**
   * Returns a constant with the same position, type and kind as {@code original} but a different
   * value.
   */
  public static IrConst copyConst(IrConst original, Object newValue) {
    return new IrConst(original.position(), original.type(), original.kind, newValue);
  }
}
