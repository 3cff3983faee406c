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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.loopform.loops.ProgressionHandler.Kind;

@RunWith(JUnit4.class)
public class LoweringOptionsTest {

  @After
  public void clearProperties() {
    System.clearProperty(LoweringOptions.DISABLED_HANDLERS_PROPERTY);
    System.clearProperty(LoweringOptions.VERBOSE_PROPERTY);
  }

  private static LoweringOptions parse(ImmutableMap<String, String> properties) {
    return LoweringOptions.fromProperties(properties::get);
  }

  @Test
  public void defaults() {
    assertThat(LoweringOptions.DEFAULT.disabledHandlers).isEmpty();
    assertThat(LoweringOptions.DEFAULT.verbose).isFalse();
    LoweringOptions options = parse(ImmutableMap.of());
    assertThat(options.disabledHandlers).isEmpty();
    assertThat(options.verbose).isFalse();
  }

  @Test
  public void disabledHandlers() {
    LoweringOptions options =
        parse(
            ImmutableMap.of(
                LoweringOptions.DISABLED_HANDLERS_PROPERTY, " reversed_array, Down_To,,UNTIL "));
    assertThat(options.disabledHandlers)
        .containsExactly(Kind.REVERSED_ARRAY, Kind.DOWN_TO, Kind.UNTIL);
  }

  @Test
  public void unknownHandler() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                parse(
                    ImmutableMap.of(
                        LoweringOptions.DISABLED_HANDLERS_PROPERTY, "RANGE_TO,STEP")));
    assertThat(e).hasMessageThat().isEqualTo("Unknown handler 'STEP' in loopform.disabledHandlers");
  }

  @Test
  public void verbose() {
    assertThat(parse(ImmutableMap.of(LoweringOptions.VERBOSE_PROPERTY, "true")).verbose).isTrue();
    assertThat(parse(ImmutableMap.of(LoweringOptions.VERBOSE_PROPERTY, "TRUE")).verbose).isTrue();
    assertThat(parse(ImmutableMap.of(LoweringOptions.VERBOSE_PROPERTY, "yes")).verbose).isFalse();
  }

  @Test
  public void systemProperties() {
    System.setProperty(LoweringOptions.DISABLED_HANDLERS_PROPERTY, "indices");
    System.setProperty(LoweringOptions.VERBOSE_PROPERTY, "true");
    LoweringOptions options = LoweringOptions.fromSystemProperties();
    assertThat(options.disabledHandlers).containsExactly(Kind.INDICES);
    assertThat(options.verbose).isTrue();
    assertThat(options.toString())
        .isEqualTo("LoweringOptions(disabled=[INDICES], verbose=true)");
  }

  @Test
  public void builder() {
    LoweringOptions options =
        LoweringOptions.builder().disable(Kind.RANGE_TO).disable(Kind.RANGE_TO).build();
    assertThat(options.disabledHandlers).containsExactly(Kind.RANGE_TO);
  }
}
