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
 * A FunctionSymbol identifies a function (or property getter) that an {@link IrCall} may invoke.
 *
 * <p>A function has at most one dispatch receiver (for member functions) and at most one extension
 * receiver (for extension functions); neither counts as one of its {@link #parameterTypes}.
 */
public final class FunctionSymbol {

  /**
   * The fully-qualified name, e.g. {@code "kotlin.ranges.downTo"}. Property getters are named
   * {@code "<get-name>"} in their final segment, e.g. {@code "kotlin.collections.<get-indices>"}.
   */
  public final String fqName;

  public final IrType returnType;
  public final @Nullable IrType dispatchReceiverType;
  public final @Nullable IrType extensionReceiverType;
  public final ImmutableList<IrType> parameterTypes;
  public final boolean isPropertyGetter;

  public FunctionSymbol(
      String fqName,
      IrType returnType,
      @Nullable IrType dispatchReceiverType,
      @Nullable IrType extensionReceiverType,
      ImmutableList<IrType> parameterTypes,
      boolean isPropertyGetter) {
    this.fqName = fqName;
    this.returnType = returnType;
    this.dispatchReceiverType = dispatchReceiverType;
    this.extensionReceiverType = extensionReceiverType;
    this.parameterTypes = parameterTypes;
    this.isPropertyGetter = isPropertyGetter;
  }

  /** Creates a symbol for a top-level extension function. */
  public static FunctionSymbol extension(
      String fqName, IrType returnType, IrType receiverType, IrType... parameterTypes) {
    return new FunctionSymbol(
        fqName, returnType, null, receiverType, ImmutableList.copyOf(parameterTypes), false);
  }

  /** Creates a symbol for a top-level extension property getter. */
  public static FunctionSymbol extensionProperty(
      String packageName, String name, IrType type, IrType receiverType) {
    return new FunctionSymbol(
        packageName + ".<get-" + name + ">", type, null, receiverType, ImmutableList.of(), true);
  }

  /** Creates a symbol for a top-level function with no receivers. */
  public static FunctionSymbol topLevel(
      String fqName, IrType returnType, IrType... parameterTypes) {
    return new FunctionSymbol(
        fqName, returnType, null, null, ImmutableList.copyOf(parameterTypes), false);
  }

  /** The final segment of {@link #fqName}. */
  public String name() {
    return lastSegment(fqName);
  }

  /** Returns the portion of a dotted name following the last dot. */
  public static String lastSegment(String fqName) {
    return fqName.substring(fqName.lastIndexOf('.') + 1);
  }

  @Override
  public String toString() {
    return fqName;
  }
}
