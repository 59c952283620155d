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

import com.healthmarketscience.sheetcalc.expr.CellAddress;
import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.UndefinedReferenceException;
import static com.healthmarketscience.sheetcalc.TestUtil.*;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

/**
 *
 */
public class ReferenceResolverTest
{
  private static final EvalContext CTX = createContext(
      cells("A1", "1", "B1", "2", "A2", "3", "B2", "4",
            "C1", "=A1", "C2", "sum(A1:B1)"));

  @Test
  public void testExpandRanges() throws Exception
  {
    // row-major
    assertEquals("1,2,3,4", ReferenceResolver.expandRanges("A1:B2", CTX));
    assertEquals("1,3", ReferenceResolver.expandRanges("A1:A2", CTX));
    assertEquals("sum(1,2,3,4)+A1",
                 ReferenceResolver.expandRanges("sum(a1:b2)+A1", CTX));
    assertEquals("1,2*3,4", ReferenceResolver.expandRanges("A1:B1*A2:B2", CTX));

    // reversed bounds are an empty block
    assertEquals("", ReferenceResolver.expandRanges("B2:A1", CTX));
  }

  @Test
  public void testExpandCells() throws Exception
  {
    assertEquals("1+4", ReferenceResolver.expandCells("A1+b2", CTX));
    assertEquals("12", ReferenceResolver.expandCells("A1B1", CTX));
    assertEquals("foo(3)", ReferenceResolver.expandCells("foo(A2)", CTX));

    // cell text is substituted as is, without expanding it again
    assertEquals("=A1", ReferenceResolver.expandCells("C1", CTX));
    assertEquals("sum(A1:B1)", ReferenceResolver.resolve("C2", CTX));

    // not cell references
    assertEquals("A123+K1", ReferenceResolver.expandCells("A123+K1", CTX));
  }

  @Test
  public void testUndefinedReference() throws Exception
  {
    UndefinedReferenceException e = assertThrows(
        UndefinedReferenceException.class,
        () -> ReferenceResolver.resolve("sum(A1:A3)", CTX));
    assertEquals("A3", e.getAddress());

    e = assertThrows(UndefinedReferenceException.class,
                     () -> ReferenceResolver.resolve("1+j9", CTX));
    assertEquals("J9", e.getAddress());
  }

  @Test
  public void testIsReferenced() throws Exception
  {
    CellAddress b2 = CellAddress.parse("B2");

    assertTrue(ReferenceResolver.isReferenced("B2", b2));
    assertTrue(ReferenceResolver.isReferenced("1+b2", b2));
    assertTrue(ReferenceResolver.isReferenced("sum(A1:C3)", b2));
    assertTrue(ReferenceResolver.isReferenced("A1B2", b2));

    assertFalse(ReferenceResolver.isReferenced("B22", b2));
    assertFalse(ReferenceResolver.isReferenced("sum(C1:D3)", b2));
    assertFalse(ReferenceResolver.isReferenced("sum(1,2)", b2));
  }
}
