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

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import junitparams.naming.TestCaseName;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.loopform.ir.IrBuilder;
import org.loopform.ir.IrCall;
import org.loopform.ir.IrConst;
import org.loopform.ir.IrConstKind;
import org.loopform.ir.IrExpression;
import org.loopform.ir.IrVariable;
import org.loopform.ir.SourcePosition;
import org.loopform.testing.Interpreter;
import org.loopform.testing.TestIr;

@RunWith(JUnitParamsRunner.class)
public class NegationTest {

  private final TestIr ir = new TestIr();

  /** Positions new nodes somewhere other than {@link TestIr#irb}, so we can tell them apart. */
  private final IrBuilder elsewhere =
      new IrBuilder(ir.builtIns, ir.scope, new SourcePosition(30, 35));

  @SuppressWarnings("unused") // used by @Parameters
  private Object[] literalSteps() {
    return new Object[] {
      new Object[] {IrConstKind.INT, 1L},
      new Object[] {IrConstKind.INT, -1L},
      new Object[] {IrConstKind.INT, 7L},
      new Object[] {IrConstKind.INT, 0L},
      new Object[] {IrConstKind.LONG, 1L},
      new Object[] {IrConstKind.LONG, -3_000_000_000L},
    };
  }

  private IrConst literal(IrConstKind kind, long value) {
    return (kind == IrConstKind.LONG) ? elsewhere.irLong(value) : elsewhere.irInt((int) value);
  }

  @Test
  @Parameters(method = "literalSteps")
  @TestCaseName("literalIsFolded_{0}_{1}")
  public void literalIsFolded(IrConstKind kind, long value) {
    IrConst step = literal(kind, value);
    IrExpression negated = Negation.negate(ir.irb, step);
    assertThat(negated).isInstanceOf(IrConst.class);
    IrConst c = (IrConst) negated;
    assertThat(c.kind).isEqualTo(kind);
    assertThat(c.longValue()).isEqualTo(-value);
    assertThat(c.type()).isSameInstanceAs(step.type());
    assertThat(c.position()).isEqualTo(step.position());
  }

  @Test
  @Parameters(method = "literalSteps")
  @TestCaseName("selfInverse_{0}_{1}")
  public void selfInverse(IrConstKind kind, long value) {
    IrConst step = literal(kind, value);
    IrExpression twice = Negation.negate(ir.irb, Negation.negate(ir.irb, step));
    assertThat(twice).isEqualTo(step);
    assertThat(((IrConst) twice).value.getClass()).isEqualTo(step.value.getClass());
  }

  @Test
  public void minValueWraps() {
    // Matches what unaryMinus would compute at runtime.
    IrConst min = ir.irb.irInt(Integer.MIN_VALUE);
    assertThat(Negation.negate(ir.irb, min)).isEqualTo(min);
  }

  @Test
  public void nonLiteralCallsUnaryMinus() {
    IrVariable s = ir.parameter("s", ir.builtIns.intType);
    IrExpression step = elsewhere.irGet(s);
    IrExpression negated = Negation.negate(ir.irb, step);

    assertThat(negated).isInstanceOf(IrCall.class);
    IrCall call = (IrCall) negated;
    assertThat(call.symbol.fqName).isEqualTo("kotlin.Int.unaryMinus");
    assertThat(call.dispatchReceiver).isSameInstanceAs(step);
    assertThat(call.type()).isSameInstanceAs(ir.builtIns.intType);
    assertThat(call.position()).isEqualTo(new SourcePosition(30, 35));

    Interpreter interpreter = new Interpreter();
    interpreter.bind(s, 3);
    assertThat(interpreter.evaluate(negated)).isEqualTo(-3);
  }

  @Test
  public void byteLiteralCallsUnaryMinus() {
    // Only Int and Long literals are folded; -Byte is an Int.
    IrConst step = ir.irb.irByte((byte) 2);
    IrExpression negated = Negation.negate(ir.irb, step);
    assertThat(negated).isInstanceOf(IrCall.class);
    assertThat(negated.type()).isSameInstanceAs(ir.builtIns.intType);
    assertThat(new Interpreter().evaluate(negated)).isEqualTo(-2);
  }

  @Test
  public void charStepIsAnError() {
    IrConst step = elsewhere.irChar('x');
    LoweringError e = assertThrows(LoweringError.class, () -> Negation.negate(ir.irb, step));
    assertThat(e.position).isEqualTo(new SourcePosition(30, 35));
    assertThat(e).hasMessageThat().contains("Char");
  }
}
