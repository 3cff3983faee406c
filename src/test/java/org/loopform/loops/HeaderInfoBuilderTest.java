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
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.loopform.ir.IrCall;
import org.loopform.ir.IrType;
import org.loopform.ir.IrVariable;
import org.loopform.loops.ProgressionHandler.Kind;
import org.loopform.testing.Interpreter;
import org.loopform.testing.LoopRunner;
import org.loopform.testing.TestIr;

@RunWith(JUnit4.class)
public class HeaderInfoBuilderTest {

  private final TestIr ir = new TestIr();

  private HeaderInfoBuilder builder(Kind... disabled) {
    return new HeaderInfoBuilder(
        ir.builtIns, LoweringOptions.builder().disable(disabled).build());
  }

  @Test
  public void handlersAreTriedInOrder() {
    assertThat(builder().handlers().stream().map(h -> h.kind).collect(toImmutableList()))
        .containsExactlyElementsIn(Kind.values())
        .inOrder();
  }

  @Test
  public void userDefinedIterable() {
    IrType bag = IrType.newClass("test.Bag");
    bag.declareFunction("iterator", ir.builtIns.iteratorType, ImmutableList.of());
    IrVariable b = ir.parameter("b", bag);

    assertThat(builder().buildForLoop(ir.forLoop(ir.get(b)), ir.scope)).isNull();
    assertThat(ir.scope.temporaries()).isEmpty();
  }

  @Test
  public void variableRangeIsNotRecognized() {
    IrVariable r = ir.parameter("r", ir.builtIns.intRange);
    assertThat(builder().buildForLoop(ir.forLoop(ir.get(r)), ir.scope)).isNull();
  }

  @Test
  public void forLoopOverRange() {
    IrCall range = ir.rangeTo(ir.irb.irInt(1), ir.irb.irInt(3));
    HeaderInfo header = builder().buildForLoop(ir.forLoop(range), ir.scope);
    assertThat(header).isInstanceOf(ProgressionHeaderInfo.class);
    assertThat(LoopRunner.inductionValues(header, new Interpreter()))
        .containsExactly(1L, 2L, 3L)
        .inOrder();
  }

  @Test
  public void forLoopTakesElementKindFromIterable() {
    IrCall range = ir.downTo(ir.irb.irChar('c'), ir.irb.irChar('a'));
    HeaderInfo header = builder().buildForLoop(ir.forLoop(range), ir.scope);
    assertThat(header.elementKind).isEqualTo(ElementKind.CHAR);

    IrCall longRange = ir.until(ir.irb.irLong(0), ir.irb.irInt(2));
    assertThat(builder().buildForLoop(ir.forLoop(longRange), ir.scope).elementKind)
        .isEqualTo(ElementKind.LONG);
  }

  @Test
  public void notAForLoop() {
    IrCall range = ir.until(ir.irb.irInt(0), ir.irb.irInt(3));
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class, () -> builder().buildForLoop(range, ir.scope));
    assertThat(e).hasMessageThat().startsWith("Not a for-loop");
  }

  @Test
  public void disabledHandlersAreSkipped() {
    HeaderInfoBuilder noUntil = builder(Kind.UNTIL);
    assertThat(noUntil.handlers().stream().map(h -> h.kind).collect(toImmutableList()))
        .doesNotContain(Kind.UNTIL);

    IrCall until = ir.until(ir.irb.irInt(0), ir.irb.irInt(3));
    assertThat(noUntil.build(until, ElementKind.INT, ir.scope)).isNull();
    assertThat(noUntil.build(ir.reversed(until), ElementKind.INT, ir.scope)).isNull();
    IrCall range = ir.rangeTo(ir.irb.irInt(0), ir.irb.irInt(3));
    assertThat(noUntil.build(range, ElementKind.INT, ir.scope)).isNotNull();
  }

  @Test
  public void disabledArrayIteration() {
    IrVariable arr = ir.parameter("arr", ir.builtIns.primitiveArrayOf(ir.builtIns.intType));
    HeaderInfoBuilder builder = builder(Kind.ARRAY_ITERATION);
    assertThat(builder.buildForLoop(ir.forLoop(ir.get(arr)), ir.scope)).isNull();
    // Nothing was hoisted.
    assertThat(ir.scope.temporaries()).isEmpty();
    // Reversed arrays don't depend on ARRAY_ITERATION.
    assertThat(builder.buildForLoop(ir.forLoop(ir.arrayReversed(ir.get(arr))), ir.scope))
        .isInstanceOf(ArrayHeaderInfo.class);
  }

  @Test
  public void nestedMismatchIsRejected() {
    // (0L..3L).reversed() when an Int loop is expected
    IrCall range = ir.rangeTo(ir.irb.irLong(0), ir.irb.irLong(3));
    assertThat(builder().build(ir.reversed(range), ElementKind.INT, ir.scope)).isNull();
  }

  @Test
  public void verboseBuilderBuildsTheSameHeaders() {
    HeaderInfoBuilder verbose =
        new HeaderInfoBuilder(ir.builtIns, LoweringOptions.builder().verbose(true).build());
    IrCall until = ir.until(ir.irb.irInt(0), ir.irb.irInt(3));
    HeaderInfo header = verbose.build(until, ElementKind.INT, ir.scope);
    HeaderInfo quiet = builder().build(until, ElementKind.INT, ir.scope);
    assertThat(header.toString()).isEqualTo(quiet.toString());
  }

  @Test
  public void headerToString() {
    IrCall until = ir.until(ir.irb.irInt(0), ir.irb.irInt(3));
    assertThat(builder().build(until, ElementKind.INT, ir.scope).toString())
        .isEqualTo("INT[0, 3) step 1 safe");
    assertThat(builder().build(ir.reversed(until), ElementKind.INT, ir.scope).toString())
        .isEqualTo("INT(3, 0] step -1 reversed");
  }
}
