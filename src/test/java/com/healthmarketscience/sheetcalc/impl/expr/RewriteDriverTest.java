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

import java.util.Arrays;
import java.util.List;

import com.healthmarketscience.sheetcalc.expr.CellStore;
import com.healthmarketscience.sheetcalc.expr.NonConvergenceException;
import com.healthmarketscience.sheetcalc.expr.UndefinedReferenceException;
import static com.healthmarketscience.sheetcalc.TestUtil.*;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

/**
 *
 */
public class RewriteDriverTest
{
  private static final CellStore GRID =
    cells("A1", "1", "B1", "2", "A2", "3", "B2", "4");

  @Test
  public void testArithmetic() throws Exception
  {
    double[] lefts = {-3d, 0d, 1.5d, 7d};
    double[] rights = {2d, -4d, 0.25d};
    for(double a : lefts) {
      for(double b : rights) {
        String aStr = NumberFormatter.format(a);
        String bStr = NumberFormatter.format(b);
        assertEquals(NumberFormatter.format(a + b), evalDriver(aStr + "+" + bStr));
        assertEquals(NumberFormatter.format(a - b), evalDriver(aStr + "-" + bStr));
        assertEquals(NumberFormatter.format(a * b), evalDriver(aStr + "*" + bStr));
        assertEquals(NumberFormatter.format(a / b), evalDriver(aStr + "/" + bStr));
      }
    }
  }

  @Test
  public void testPrecedence() throws Exception
  {
    assertEquals("14", evalDriver("2+3*4"));
    assertEquals("4", evalDriver("8/4*2"));
    assertEquals("10", evalDriver("1+2+3+4"));
    assertEquals("2", evalDriver("1-2+3"));
    assertEquals("1", evalDriver("3-1-1"));
    assertEquals("6", evalDriver("2*(3)"));
    assertEquals("Infinity", evalDriver("1/0"));
  }

  @Test
  public void testCells() throws Exception
  {
    assertEquals("10", evalDriver("sum(A1:B2)", GRID));
    assertEquals("1,2,3,4", evalDriver("A1:B2", GRID));
    assertEquals("9", evalDriver("a2*b1+a1*3", GRID));

    // referenced text is evaluated as part of the formula
    CellStore cells = cells("A1", "2*3", "B1", "A1+1", "C1", "sum(A1,B1)");
    assertEquals("7", evalDriver("B1", cells));
    assertEquals("13", evalDriver("C1", cells));
  }

  @Test
  public void testFunctions() throws Exception
  {
    assertEquals("2.5", evalDriver("median(1,2,3,4)"));
    assertEquals("1,2,3", evalDriver("nodupes(1,1,2,3,3)"));
    assertEquals("true", evalDriver("everyeven(2,4,6)"));
    assertEquals("6", evalDriver("sum(range(1,3))"));
    assertEquals("15", evalDriver("sum(increment(range(1,2)),A1:B2)", GRID));
    assertEquals("foo(1,2)", evalDriver("foo(1,2)"));
    assertEquals("foo(3)", evalDriver("foo(sum(1,2))"));
    assertEquals("true", evalDriver("has2(lasttwo(firsttwo(1,2,3)))"));
  }

  @Test
  public void testIdempotence() throws Exception
  {
    List<String> formulas = Arrays.asList(
        "2+3*4", "8/4*2", "sum(A1:B2)", "median(1,2,3,4)",
        "nodupes(1,1,2,3,3)", "everyeven(2,4,6)", "sum(range(1,3))",
        "foo(1,2)", "even(1,3)", "-1/0", "0/0", "sum(1,2)+foo(3)");
    for(String formula : formulas) {
      String result = evalDriver(formula, GRID);
      assertEquals(result, evalDriver(result, GRID));
    }
  }

  @Test
  public void testWhitespace() throws Exception
  {
    assertEquals("3", evalDriver(" 1 + 2 "));
    assertEquals("6", evalDriver("sum( 1 ,\t2 , 3 )"));
    assertEquals("", evalDriver("   "));
  }

  @Test
  public void testUndefinedReference() throws Exception
  {
    UndefinedReferenceException e = assertThrows(
        UndefinedReferenceException.class, () -> evalDriver("A1+1"));
    assertEquals("A1", e.getAddress());

    assertThrows(UndefinedReferenceException.class,
                 () -> evalDriver("sum(A1:C1)", GRID));
  }

  @Test
  public void testNonConvergence() throws Exception
  {
    CellStore cycle = cells("A1", "B1", "B1", "A1");

    NonConvergenceException e = assertThrows(
        NonConvergenceException.class,
        () -> RewriteDriver.evaluate("A1", createContext(cycle), 10));
    assertEquals("A1", e.getFormula());
    assertEquals("A1", e.getLastText());
    assertEquals(10, e.getNumPasses());

    e = assertThrows(
        NonConvergenceException.class,
        () -> RewriteDriver.evaluate("A1", createContext(cycle), 5));
    assertEquals("B1", e.getLastText());

    // a cell referencing itself through a formula keeps growing
    CellStore growing = cells("A1", "A1+1");
    assertThrows(NonConvergenceException.class,
                 () -> RewriteDriver.evaluate("A1", createContext(growing), 50));
  }

  @Test
  public void testLongArithmetic() throws Exception
  {
    // each pass removes one '+', so these are not limited by the passes
    assertEquals("1001", RewriteDriver.evaluate(
                     ones(1001), createContext(NO_CELLS), 1000));
    assertEquals("20", RewriteDriver.evaluate(
                     ones(20), createContext(NO_CELLS), 2));
    assertEquals("2000", RewriteDriver.evaluate(
                     "sum(" + ones(1000) + "," + ones(1000) + ")",
                     createContext(NO_CELLS), 10));
  }

  @Test
  public void testInvalidArgs() throws Exception
  {
    assertThrows(IllegalArgumentException.class,
                 () -> RewriteDriver.evaluate(null, createContext(NO_CELLS), 10));
    assertThrows(IllegalArgumentException.class,
                 () -> RewriteDriver.evaluate("1", createContext(NO_CELLS), 0));
  }

  private static String ones(int num) {
    StringBuilder sb = new StringBuilder("1");
    for(int i = 1; i < num; ++i) {
      sb.append("+1");
    }
    return sb.toString();
  }

  private static String evalDriver(String formula) {
    return evalDriver(formula, NO_CELLS);
  }

  private static String evalDriver(String formula, CellStore cells) {
    return RewriteDriver.evaluate(formula, createContext(cells), 1000);
  }
}
