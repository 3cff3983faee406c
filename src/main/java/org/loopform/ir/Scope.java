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
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.List;

/**
 * A Scope allocates the temporary variables introduced while lowering a single function body.
 * Temporaries are named {@code tmp<N>_<hint>} with N increasing from zero, so names are unique
 * within the function.
 *
 * <p>A Scope is confined to the thread compiling its function; it is not safe for concurrent use.
 */
public final class Scope {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** The name of the function this Scope belongs to; used only for logging. */
  public final String owner;

  private final List<IrVariable> temporaries = new ArrayList<>();

  public Scope(String owner) {
    this.owner = owner;
  }

  /**
   * Returns a new variable that will hold the value of {@code initializer}. The caller is
   * responsible for arranging that the variable's declaration is emitted before any read of it.
   */
  public IrVariable createTemporaryVariable(
      IrExpression initializer, String nameHint, DeclarationOrigin origin) {
    String name = String.format("tmp%d_%s", temporaries.size(), nameHint);
    IrVariable result = new IrVariable(name, initializer.type(), initializer, origin);
    temporaries.add(result);
    logger.atFinest().log("%s: hoisted %s", owner, result);
    return result;
  }

  /** All temporaries created so far, in creation order. */
  public ImmutableList<IrVariable> temporaries() {
    return ImmutableList.copyOf(temporaries);
  }

  @Override
  public String toString() {
    return "Scope(" + owner + ")";
  }
}
