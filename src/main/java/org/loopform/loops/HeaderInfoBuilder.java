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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import java.util.logging.Level;
import org.jspecify.annotations.Nullable;
import org.loopform.ir.BuiltIns;
import org.loopform.ir.CallOrigin;
import org.loopform.ir.IrBuilder;
import org.loopform.ir.IrCall;
import org.loopform.ir.IrExpression;
import org.loopform.ir.Scope;

/**
 * Recognizes for-loop iterables that can be lowered to counted loops, and describes each with a
 * {@link HeaderInfo}.
 *
 * <p>A HeaderInfoBuilder holds only immutable configuration, so it may be shared by any number of
 * compilations (and threads); the only mutable state touched while building is the {@link Scope}
 * of the function being lowered, which receives any temporaries the HeaderInfo needs.
 */
public final class HeaderInfoBuilder {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final BuiltIns builtIns;
  private final LoweringOptions options;

  /** The enabled handlers, in the order they will be tried. */
  private final ImmutableList<ProgressionHandler> handlers;

  public HeaderInfoBuilder(BuiltIns builtIns) {
    this(builtIns, LoweringOptions.DEFAULT);
  }

  public HeaderInfoBuilder(BuiltIns builtIns, LoweringOptions options) {
    this.builtIns = builtIns;
    this.options = options;
    this.handlers =
        ProgressionHandlers.create(builtIns).stream()
            .filter(h -> !options.disabledHandlers.contains(h.kind))
            .collect(toImmutableList());
  }

  /** The enabled handlers, in the order they will be tried. */
  public ImmutableList<ProgressionHandler> handlers() {
    return handlers;
  }

  /**
   * Returns a HeaderInfo for iterating over {@code iterable}, whose elements are expected to be of
   * the given kind, or null if it isn't a recognized idiom (in which case the loop should use its
   * iterator). Any temporaries the HeaderInfo uses are created in {@code scope}.
   */
  public @Nullable HeaderInfo build(IrExpression iterable, ElementKind elementKind, Scope scope) {
    return new Dispatch(scope).dispatch(iterable, elementKind);
  }

  /**
   * Returns a HeaderInfo for the loop started by {@code iteratorCall} (the implicit {@code
   * iterator()} call on the loop's iterable), or null if the loop should use the iterator.
   */
  public @Nullable HeaderInfo buildForLoop(IrCall iteratorCall, Scope scope) {
    Preconditions.checkArgument(
        iteratorCall.origin == CallOrigin.FOR_LOOP_ITERATOR, "Not a for-loop: %s", iteratorCall);
    Dispatch dispatch = new Dispatch(scope);
    IrExpression iterable = iteratorCall.dispatchReceiver;
    if (iterable != null) {
      // Anything that isn't a progression (e.g. a reversed array) counts its indices.
      ElementKind elementKind =
          MoreObjects.firstNonNull(ElementKind.of(iterable.type()), ElementKind.INT);
      HeaderInfo result = dispatch.dispatch(iterable, elementKind);
      if (result != null) {
        return result;
      }
    }
    // Array iteration is recognized from the iterator call itself.
    return dispatch.dispatch(iteratorCall, ElementKind.INT);
  }

  private Level level() {
    return options.verbose ? Level.INFO : Level.FINE;
  }

  /**
   * The Context passed to handlers while building one HeaderInfo. Handlers that recognize a
   * wrapper (such as {@code reversed()}) re-enter {@link #dispatch} on the wrapped expression.
   */
  private final class Dispatch implements ProgressionHandler.Context {
    final Scope scope;

    Dispatch(Scope scope) {
      this.scope = scope;
    }

    @Override
    public IrBuilder irBuilder(IrExpression at) {
      return new IrBuilder(builtIns, scope, at.position());
    }

    @Override
    public @Nullable HeaderInfo dispatch(IrExpression iterable, ElementKind elementKind) {
      if (!(iterable instanceof IrCall call)) {
        logger.at(level()).log("%s: not a call: %s", scope.owner, iterable);
        return null;
      }
      for (ProgressionHandler handler : handlers) {
        if (!handler.matcher.test(call)) {
          continue;
        }
        if (handler.kind.countsElements() && ElementKind.of(call.type()) != elementKind) {
          logger.at(level()).log(
              "%s: %s produces %s, expected %s",
              scope.owner, handler.kind, call.type(), elementKind);
          continue;
        }
        HeaderInfo result = handler.build(call, elementKind, this);
        if (result != null) {
          logger.at(level()).log("%s: %s matched %s: %s", scope.owner, handler.kind, call, result);
          return result;
        }
        logger.at(level()).log(
            "%s: %s matched %s but couldn't build", scope.owner, handler.kind, call);
      }
      logger.at(level()).log("%s: unrecognized iterable %s", scope.owner, call);
      return null;
    }
  }
}
