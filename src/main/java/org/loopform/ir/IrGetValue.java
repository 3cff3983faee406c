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

/** A read of an {@link IrVariable}. */
public final class IrGetValue extends IrExpression {
  public final IrVariable variable;

  IrGetValue(SourcePosition position, IrVariable variable) {
    super(position);
    this.variable = variable;
  }

  @Override
  public IrType type() {
    return variable.type;
  }

  @Override
  public boolean hasSideEffect() {
    // Variables read by a loop header are never reassigned between the header's reads.
    return false;
  }

  @Override
  public String toString() {
    return variable.name;
  }
}
