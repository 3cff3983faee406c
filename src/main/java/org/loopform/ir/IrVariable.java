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

import org.jspecify.annotations.Nullable;

/**
 * An IrVariable is a local variable declaration. Variables are compared by identity; two
 * declarations with the same name are distinct variables.
 */
public final class IrVariable {
  public final String name;
  public final IrType type;

  /**
   * The expression whose value is stored in this variable when its declaration executes, or null
   * for variables whose value is bound some other way (e.g. function parameters).
   */
  public final @Nullable IrExpression initializer;

  public final DeclarationOrigin origin;

  public IrVariable(
      String name, IrType type, @Nullable IrExpression initializer, DeclarationOrigin origin) {
    this.name = name;
    this.type = type;
    this.initializer = initializer;
    this.origin = origin;
  }

  /** Creates a user-declared variable (or parameter) with no initializer. */
  public static IrVariable parameter(String name, IrType type) {
    return new IrVariable(name, type, null, DeclarationOrigin.DEFINED);
  }

  @Override
  public String toString() {
    return (initializer == null)
        ? String.format("val %s: %s", name, type)
        : String.format("val %s: %s = %s", name, type, initializer);
  }
}
