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

import com.google.common.base.Ascii;
import com.google.common.base.Enums;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.jspecify.annotations.Nullable;
import org.loopform.loops.ProgressionHandler.Kind;

/** Settings that control which idioms {@link HeaderInfoBuilder} recognizes, and how it logs. */
public final class LoweringOptions {

  /** System property listing handler kinds to disable, separated by commas. */
  public static final String DISABLED_HANDLERS_PROPERTY = "loopform.disabledHandlers";

  /** System property that, if "true", logs each recognition attempt at INFO rather than FINE. */
  public static final String VERBOSE_PROPERTY = "loopform.verbose";

  /** All handlers enabled, quiet logging. */
  public static final LoweringOptions DEFAULT = builder().build();

  /** Handlers of these kinds are skipped, as if their matchers never accepted anything. */
  public final ImmutableSet<Kind> disabledHandlers;

  public final boolean verbose;

  private LoweringOptions(Builder builder) {
    this.disabledHandlers = ImmutableSet.copyOf(builder.disabledHandlers);
    this.verbose = builder.verbose;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the options specified by the {@code loopform.*} system properties. */
  public static LoweringOptions fromSystemProperties() {
    return fromProperties(System::getProperty);
  }

  /**
   * Returns the options specified by the given property lookup (which should return null for
   * properties that aren't set).
   *
   * @throws IllegalArgumentException if the disabled handlers list names an unknown kind
   */
  static LoweringOptions fromProperties(UnaryOperator<@Nullable String> properties) {
    Builder builder = builder();
    String disabled = properties.apply(DISABLED_HANDLERS_PROPERTY);
    if (disabled != null) {
      for (String name : Splitter.on(',').trimResults().omitEmptyStrings().split(disabled)) {
        Kind kind = Enums.getIfPresent(Kind.class, Ascii.toUpperCase(name)).orNull();
        if (kind == null) {
          throw new IllegalArgumentException(
              String.format("Unknown handler '%s' in %s", name, DISABLED_HANDLERS_PROPERTY));
        }
        builder.disable(kind);
      }
    }
    builder.verbose(Boolean.parseBoolean(properties.apply(VERBOSE_PROPERTY)));
    return builder.build();
  }

  @Override
  public String toString() {
    return String.format("LoweringOptions(disabled=%s, verbose=%s)", disabledHandlers, verbose);
  }

  /** A Builder is used to construct a new LoweringOptions. */
  public static final class Builder {
    private final Set<Kind> disabledHandlers = EnumSet.noneOf(Kind.class);
    private boolean verbose = false;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder disable(Kind... kinds) {
      for (Kind kind : kinds) {
        disabledHandlers.add(kind);
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder verbose(boolean verbose) {
      this.verbose = verbose;
      return this;
    }

    public LoweringOptions build() {
      return new LoweringOptions(this);
    }
  }
}
