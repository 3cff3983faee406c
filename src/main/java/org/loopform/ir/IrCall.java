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
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A call of a function or property getter. Each receiver slot is populated exactly when the
 * called {@link FunctionSymbol} declares the corresponding receiver type, and there is one
 * argument for each declared parameter.
 */
public final class IrCall extends IrExpression {
  public final FunctionSymbol symbol;
  public final @Nullable IrExpression dispatchReceiver;
  public final @Nullable IrExpression extensionReceiver;
  public final ImmutableList<IrExpression> arguments;

  /** The source construct this call was created for, if it matters; otherwise null. */
  public final @Nullable CallOrigin origin;

  private final IrType type;

  IrCall(
      SourcePosition position,
      IrType type,
      FunctionSymbol symbol,
      @Nullable IrExpression dispatchReceiver,
      @Nullable IrExpression extensionReceiver,
      ImmutableList<IrExpression> arguments,
      @Nullable CallOrigin origin) {
    super(position);
    Preconditions.checkArgument(
        (dispatchReceiver != null) == (symbol.dispatchReceiverType != null),
        "Dispatch receiver mismatch calling %s",
        symbol);
    Preconditions.checkArgument(
        (extensionReceiver != null) == (symbol.extensionReceiverType != null),
        "Extension receiver mismatch calling %s",
        symbol);
    Preconditions.checkArgument(
        arguments.size() == symbol.parameterTypes.size(),
        "%s expects %s arguments, got %s",
        symbol,
        symbol.parameterTypes.size(),
        arguments.size());
    this.type = type;
    this.symbol = symbol;
    this.dispatchReceiver = dispatchReceiver;
    this.extensionReceiver = extensionReceiver;
    this.arguments = arguments;
    this.origin = origin;
  }

  @Override
  public IrType type() {
    return type;
  }

  /** Returns the argument at the given position. */
  public IrExpression argument(int index) {
    Preconditions.checkElementIndex(index, arguments.size());
    return arguments.get(index);
  }

  @Override
  public boolean hasSideEffect() {
    if (!symbol.isPropertyGetter) {
      return true;
    }
    return (dispatchReceiver != null && dispatchReceiver.hasSideEffect())
        || (extensionReceiver != null && extensionReceiver.hasSideEffect());
  }

  @Override
  public String toString() {
    List<String> parts = new ArrayList<>();
    if (dispatchReceiver != null) {
      parts.add("this=" + dispatchReceiver);
    }
    if (extensionReceiver != null) {
      parts.add("ext=" + extensionReceiver);
    }
    arguments.forEach(arg -> parts.add(String.valueOf(arg)));
    return symbol.name() + "(" + String.join(", ", parts) + ")";
  }
}
