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

package com.healthmarketscience.sheetcalc;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.healthmarketscience.sheetcalc.expr.CellAddress;
import com.healthmarketscience.sheetcalc.expr.UndefinedReferenceException;
import com.healthmarketscience.sheetcalc.util.EvalErrorHandler;
import com.healthmarketscience.sheetcalc.util.LastResultErrorHandler;
import com.healthmarketscience.sheetcalc.util.ReplacementErrorHandler;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

/**
 *
 */
public class SheetTest
{
  @Test
  public void testGrid() throws Exception
  {
    Sheet sheet = new SheetBuilder().toSheet();
    assertEquals(6, sheet.getColumnCount());
    assertEquals(19, sheet.getRowCount());

    List<CellAddress> addrs = sheet.getAddresses();
    assertEquals(6 * 19, addrs.size());
    assertEquals("A1", addrs.get(0).toString());
    assertEquals("B1", addrs.get(1).toString());
    assertEquals("A2", addrs.get(6).toString());
    assertEquals("F19", addrs.get(addrs.size() - 1).toString());

    assertEquals("", sheet.getCellText("a1"));
    assertEquals("", sheet.lookup("F19"));
    assertNull(sheet.lookup("G1"));
    assertNull(sheet.lookup("A20"));
    assertNull(sheet.lookup("foo"));

    assertThrows(IllegalArgumentException.class,
                 () -> sheet.getCellText("G1"));
    assertThrows(IllegalArgumentException.class,
                 () -> sheet.setCellText("A20", "1"));

    Sheet small = new SheetBuilder()
      .setColumnCount(2)
      .setRowCount(3)
      .toSheet();
    assertEquals(6, small.getAddresses().size());
    assertNull(small.lookup("C1"));

    assertThrows(IllegalArgumentException.class,
                 () -> new SheetBuilder().setColumnCount(11));
    assertThrows(IllegalArgumentException.class,
                 () -> new SheetBuilder().setRowCount(0));
  }

  @Test
  public void testEnterCellText() throws Exception
  {
    Sheet sheet = new SheetBuilder().toSheet();

    assertEquals("1", sheet.enterCellText("A1", "1"));
    assertEquals("2", sheet.enterCellText("B1", "2"));
    assertEquals("3", sheet.enterCellText("C1", "= sum( A1:B1 )"));
    assertEquals("3", sheet.getCellText("C1"));
    assertEquals("9", sheet.enterCellText("c2", "=C1*3"));

    // non-formulas are stored as typed
    assertEquals("hello world", sheet.enterCellText("D1", "hello world"));
    assertEquals("1 + 2", sheet.enterCellText("D2", "1 + 2"));

    // no recalculation of dependent cells
    sheet.enterCellText("A1", "10");
    assertEquals("3", sheet.getCellText("C1"));
    assertEquals("12", sheet.evaluate("A1+B1"));
    assertEquals("3", sheet.getCellText("C1"));
  }

  @Test
  public void testSelfReference() throws Exception
  {
    Sheet sheet = new SheetBuilder().toSheet();
    sheet.enterCellText("A1", "1");

    assertEquals("=A2 + 1", sheet.enterCellText("A2", "=A2 + 1"));
    assertEquals("=A2 + 1", sheet.getCellText("A2"));
    assertEquals("=sum(A1:C3)", sheet.enterCellText("B2", "=sum(A1:C3)"));

    // other cells with similar names are fine
    assertEquals("1", sheet.enterCellText("A11", "=A1"));
  }

  @Test
  public void testErrorHandling() throws Exception
  {
    Sheet sheet = new SheetBuilder().setColumnCount(2).toSheet();
    assertSame(EvalErrorHandler.DEFAULT, sheet.getErrorHandler());

    UndefinedReferenceException e = assertThrows(
        UndefinedReferenceException.class,
        () -> sheet.enterCellText("A1", "=C1+1"));
    assertEquals("C1", e.getAddress());
    assertEquals("", sheet.getCellText("A1"));

    sheet.setErrorHandler(new ReplacementErrorHandler("#REF"));
    assertEquals("#REF", sheet.enterCellText("A1", "=C1+1"));
    assertEquals("#REF", sheet.getCellText("A1"));

    sheet.setErrorHandler(null);
    assertSame(EvalErrorHandler.DEFAULT, sheet.getErrorHandler());
  }

  @Test
  public void testCycle() throws Exception
  {
    Sheet sheet = new SheetBuilder()
      .setEvaluator(new EvaluatorBuilder().setMaxPasses(5).toEvaluator())
      .setErrorHandler(new LastResultErrorHandler())
      .toSheet();

    sheet.setCellText("A1", "B1");
    sheet.setCellText("B1", "A1");

    assertEquals("B1", sheet.enterCellText("C1", "=A1"));
    assertEquals("B1", sheet.getCellText("C1"));

    // other failures are still thrown
    assertThrows(UndefinedReferenceException.class,
                 () -> sheet.enterCellText("C2", "=J1"));
  }

  @Test
  public void testRandomSheets() throws Exception
  {
    Set<String> vals = new HashSet<String>();
    for(int i = 0; i < 50; ++i) {
      Sheet sheet = new SheetBuilder().toSheet();
      vals.add(sheet.enterCellText("A1", "=random(0,1000000000)"));
    }
    assertEquals(50, vals.size());
  }
}
