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

package org.loopform.matchers;

import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Collection;
import java.util.function.IntPredicate;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;
import org.loopform.ir.CallOrigin;
import org.loopform.ir.IrCall;
import org.loopform.ir.IrExpression;
import org.loopform.ir.IrType;

/**
 * A CallMatcher is a predicate on {@link IrCall}s, used to recognize the source idioms that the
 * loop lowering knows how to optimize.
 *
 * <p>CallMatchers are immutable and have no side effects, so a single CallMatcher may be tested
 * against any number of calls, from any thread. Most CallMatchers are constructed with a {@link
 * Builder}, which combines independent clauses (each checking a single aspect of the call) with
 * {@link #and}.
 */
public abstract class CallMatcher {

  /** Returns true if this CallMatcher accepts the given call. */
  public abstract boolean test(IrCall call);

  /** The trivial CallMatcher that accepts any call. */
  public static final CallMatcher TRUE =
      new CallMatcher() {
        @Override
        public boolean test(IrCall call) {
          return true;
        }

        @Override
        public String toString() {
          return "TRUE";
        }
      };

  /** A CallMatcher that checks one aspect of a call. */
  static final class Clause extends CallMatcher {
    final String description;
    final Predicate<IrCall> predicate;

    Clause(String description, Predicate<IrCall> predicate) {
      this.description = description;
      this.predicate = predicate;
    }

    @Override
    public boolean test(IrCall call) {
      return predicate.test(call);
    }

    @Override
    public String toString() {
      return description;
    }
  }

  /** Returns a CallMatcher that accepts a call only if both this and {@code other} accept it. */
  public CallMatcher and(CallMatcher other) {
    return and(this, other);
  }

  private static CallMatcher and(CallMatcher m1, CallMatcher m2) {
    if (m1 == TRUE) {
      return m2;
    } else if (m2 == TRUE) {
      return m1;
    }
    return new CallMatcher() {
      @Override
      public boolean test(IrCall call) {
        return m1.test(call) && m2.test(call);
      }

      @Override
      public String toString() {
        return String.format("%s and %s", m1, m2);
      }
    };
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Accumulates clauses; the built CallMatcher accepts a call only if every clause does. */
  public static final class Builder {
    private CallMatcher result = TRUE;

    private Builder() {}

    @CanIgnoreReturnValue
    private Builder add(String description, Predicate<IrCall> predicate) {
      result = result.and(new Clause(description, predicate));
      return this;
    }

    /** Requires the callee's fully-qualified name to satisfy {@code predicate}. */
    @CanIgnoreReturnValue
    public Builder fqName(String description, Predicate<String> predicate) {
      return add(description, call -> predicate.test(call.symbol.fqName));
    }

    /** Requires the callee's fully-qualified name to equal {@code fqName}. */
    @CanIgnoreReturnValue
    public Builder fqName(String fqName) {
      return fqName("fqName == " + fqName, fqName::equals);
    }

    /**
     * Requires the final segment of the callee's name to equal {@code name}, so that overloads
     * declared in different classes or packages all match.
     */
    @CanIgnoreReturnValue
    public Builder name(String name) {
      return add("name == " + name, call -> call.symbol.name().equals(name));
    }

    /** Requires the dispatch receiver (which may be null) to satisfy {@code predicate}. */
    @CanIgnoreReturnValue
    public Builder dispatchReceiver(
        String description, Predicate<@Nullable IrExpression> predicate) {
      return add(description, call -> predicate.test(call.dispatchReceiver));
    }

    /** Requires a dispatch receiver whose type is one of {@code types}. */
    @CanIgnoreReturnValue
    public Builder dispatchReceiverTypeIn(Collection<IrType> types) {
      ImmutableSet<IrType> allowed = ImmutableSet.copyOf(types);
      return dispatchReceiver(
          "dispatchReceiver in " + allowed, r -> r != null && allowed.contains(r.type()));
    }

    /** Requires the extension receiver (which may be null) to satisfy {@code predicate}. */
    @CanIgnoreReturnValue
    public Builder extensionReceiver(
        String description, Predicate<@Nullable IrExpression> predicate) {
      return add(description, call -> predicate.test(call.extensionReceiver));
    }

    /** Requires an extension receiver whose type is one of {@code types}. */
    @CanIgnoreReturnValue
    public Builder extensionReceiverTypeIn(Collection<IrType> types) {
      ImmutableSet<IrType> allowed = ImmutableSet.copyOf(types);
      return extensionReceiver(
          "extensionReceiver in " + allowed, r -> r != null && allowed.contains(r.type()));
    }

    /** Requires the number of (non-receiver) arguments to satisfy {@code predicate}. */
    @CanIgnoreReturnValue
    public Builder parameterCount(String description, IntPredicate predicate) {
      return add(description, call -> predicate.test(call.arguments.size()));
    }

    /** Requires exactly {@code count} (non-receiver) arguments. */
    @CanIgnoreReturnValue
    public Builder parameterCount(int count) {
      return parameterCount("parameterCount == " + count, n -> n == count);
    }

    /**
     * Requires that there be an argument at position {@code index}, and that it satisfy {@code
     * predicate}.
     */
    @CanIgnoreReturnValue
    public Builder parameter(int index, String description, Predicate<IrExpression> predicate) {
      return add(
          String.format("parameter(%s) %s", index, description),
          call -> index < call.arguments.size() && predicate.test(call.argument(index)));
    }

    /** Requires an argument at position {@code index} whose type is one of {@code types}. */
    @CanIgnoreReturnValue
    public Builder parameterTypeIn(int index, Collection<IrType> types) {
      ImmutableSet<IrType> allowed = ImmutableSet.copyOf(types);
      return parameter(index, "in " + allowed, arg -> allowed.contains(arg.type()));
    }

    /** Requires the call's origin (which may be null) to be {@code origin}. */
    @CanIgnoreReturnValue
    public Builder origin(@Nullable CallOrigin origin) {
      return add("origin == " + origin, call -> call.origin == origin);
    }

    /**
     * Requires a call of the extension function {@code fqName} with a single argument, where both
     * the extension receiver and the argument have types in {@code types}.
     */
    @CanIgnoreReturnValue
    public Builder singleArgumentExtension(String fqName, Collection<IrType> types) {
      return fqName(fqName)
          .extensionReceiverTypeIn(types)
          .parameterCount(1)
          .parameterTypeIn(0, types);
    }

    public CallMatcher build() {
      return result;
    }
  }
}
