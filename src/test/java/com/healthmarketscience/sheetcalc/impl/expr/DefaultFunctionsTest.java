/*
Copyright (c) 2018 James Ahlborn

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package com.healthmarketscience.sheetcalc.impl.expr;

import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.EvalException;
import com.healthmarketscience.sheetcalc.expr.Function;
import com.healthmarketscience.sheetcalc.expr.NumberList;
import com.healthmarketscience.sheetcalc.expr.Value;
import static com.healthmarketscience.sheetcalc.TestUtil.*;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

/**
 *
 */
public class DefaultFunctionsTest
{
  private static final EvalContext CTX = createContext(NO_CELLS);

  @Test
  public void testLookup() throws Exception
  {
    assertSame(DefaultFunctions.SUM, DefaultFunctions.LOOKUP.getFunction("sum"));
    assertSame(DefaultFunctions.SUM, DefaultFunctions.LOOKUP.getFunction("SuM"));
    assertSame(DefaultFunctions.IDENTITY,
               DefaultFunctions.LOOKUP.getFunction(""));
    assertNull(DefaultFunctions.LOOKUP.getFunction("foo"));

    assertEquals(14, DefaultFunctions.getFunctionNames().size());
    assertTrue(DefaultFunctions.getFunctionNames().contains("nodupes"));
  }

  @Test
  public void testAggregateFuncs() throws Exception
  {
    assertEquals("1,2", eval(DefaultFunctions.IDENTITY, 1, 2));
    assertEquals("6", eval(DefaultFunctions.SUM, 1, 2, 3));
    assertEquals("0", eval(DefaultFunctions.SUM));
    assertEquals("0.6000000000000001",
                 eval(DefaultFunctions.SUM, 0.1, 0.2, 0.3));
    assertEquals("2.5", eval(DefaultFunctions.AVERAGE, 1, 2, 3, 4));
    assertEquals("NaN", eval(DefaultFunctions.AVERAGE));
    assertEquals("2", eval(DefaultFunctions.MEDIAN, 3, 1, 2));
    assertEquals("2.5", eval(DefaultFunctions.MEDIAN, 4, 1, 3, 2));
    assertEquals("5", eval(DefaultFunctions.MEDIAN, 5));

    EvalException e = assertThrows(EvalException.class,
                                   () -> eval(DefaultFunctions.MEDIAN));
    assertEquals("Invalid function call {median()}", e.getMessage());
  }

  @Test
  public void testEvenFuncs() throws Exception
  {
    assertEquals("2,4,-6", eval(DefaultFunctions.EVEN, 1, 2, 3, 4, -6));
    assertEquals("", eval(DefaultFunctions.EVEN, 1, 3, 2.5));
    assertEquals("true", eval(DefaultFunctions.SOME_EVEN, 1, 2));
    assertEquals("false", eval(DefaultFunctions.SOME_EVEN, 1, 3));
    assertEquals("true", eval(DefaultFunctions.EVERY_EVEN, 2, 4, 6));
    assertEquals("false", eval(DefaultFunctions.EVERY_EVEN, 2, 3));
    assertEquals("true", eval(DefaultFunctions.EVERY_EVEN));
    assertEquals("false", eval(DefaultFunctions.EVERY_EVEN, Double.NaN));
  }

  @Test
  public void testListFuncs() throws Exception
  {
    assertEquals("1,2", eval(DefaultFunctions.FIRST_TWO, 1, 2, 3));
    assertEquals("5", eval(DefaultFunctions.FIRST_TWO, 5));
    assertEquals("2,3", eval(DefaultFunctions.LAST_TWO, 1, 2, 3));
    assertEquals("5", eval(DefaultFunctions.LAST_TWO, 5));
    assertEquals("true", eval(DefaultFunctions.HAS_2, 1, 2.0));
    assertEquals("false", eval(DefaultFunctions.HAS_2, 1, 2.5));
    assertEquals("2,3.5,0", eval(DefaultFunctions.INCREMENT, 1, 2.5, -1));
    assertEquals("1,2,3", eval(DefaultFunctions.NO_DUPES, 1, 1, 2, 3, 3));
    assertEquals("3,1", eval(DefaultFunctions.NO_DUPES, 3, 1, 3, 1));
    assertEquals("0", eval(DefaultFunctions.NO_DUPES, -0d, 0d));
  }

  @Test
  public void testRange() throws Exception
  {
    assertEquals("1,2,3", eval(DefaultFunctions.RANGE, 1, 3));
    assertEquals("-1,0,1", eval(DefaultFunctions.RANGE, -1, 1));
    assertEquals("4", eval(DefaultFunctions.RANGE, 4, 4));
    assertEquals("", eval(DefaultFunctions.RANGE, 3, 1));

    assertThrows(EvalException.class,
                 () -> eval(DefaultFunctions.RANGE, 1));
    assertThrows(EvalException.class,
                 () -> eval(DefaultFunctions.RANGE, 1.5, 3));
    assertThrows(EvalException.class,
                 () -> eval(DefaultFunctions.RANGE, 1, Double.NaN));
    assertThrows(EvalException.class,
                 () -> eval(DefaultFunctions.RANGE, 1,
                            DefaultFunctions.MAX_RANGE_SIZE + 1));
  }

  @Test
  public void testRandom() throws Exception
  {
    EvalContext ctx = createContext(NO_CELLS, fixedRandom(0.5d));
    assertEquals("12", eval(ctx, DefaultFunctions.RANDOM, 10, 4));
    assertEquals("-3", eval(ctx, DefaultFunctions.RANDOM, -4, 3));

    ctx = createContext(NO_CELLS, fixedRandom(0.99d));
    assertEquals("13", eval(ctx, DefaultFunctions.RANDOM, 10, 4));

    assertThrows(EvalException.class,
                 () -> eval(DefaultFunctions.RANDOM, 1));
  }

  @Test
  public void testValueTypes() throws Exception
  {
    Value val = DefaultFunctions.SUM.eval(CTX, NumberList.of(1d, 2d));
    assertEquals(Value.Type.NUMBER, val.getType());
    assertEquals(Double.valueOf(3d), val.get());
    assertEquals("3", val.getAsString());

    Value boolVal = DefaultFunctions.HAS_2.eval(CTX, NumberList.of(2d));
    assertEquals(Value.Type.BOOLEAN, boolVal.getType());
    assertEquals(Boolean.TRUE, boolVal.get());
    assertEquals("true", boolVal.getAsString());

    Value listVal = DefaultFunctions.EVEN.eval(CTX, NumberList.of(2d, 4d));
    assertEquals(Value.Type.LIST, listVal.getType());
    assertEquals(NumberList.of(2d, 4d), listVal.get());
    assertEquals("2,4", listVal.getAsString());
  }

  private static String eval(Function func, double... params) {
    return eval(CTX, func, params);
  }

  private static String eval(EvalContext ctx, Function func,
                             double... params) {
    return func.eval(ctx, NumberList.of(params)).getAsString();
  }
}
