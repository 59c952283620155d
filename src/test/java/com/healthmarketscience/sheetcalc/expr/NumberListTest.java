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

package com.healthmarketscience.sheetcalc.expr;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

/**
 *
 */
public class NumberListTest
{
  @Test
  public void testParse() throws Exception
  {
    assertEquals(NumberList.of(1d, 2.5d, -3d), NumberList.parse("1,2.5,-3"));
    assertEquals(NumberList.of(1d, Double.NaN, Double.NaN),
                 NumberList.parse("1,x,"));
    assertEquals(NumberList.of(Double.NaN, Double.NaN, Double.NaN),
                 NumberList.parse("1.2.3,,."));

    // an empty argument text is a single empty item
    NumberList nums = NumberList.parse("");
    assertEquals(1, nums.size());
    assertTrue(Double.isNaN(nums.get(0)));

    assertEquals(Double.POSITIVE_INFINITY,
                 NumberList.parseNumber("Infinity"));
    assertEquals(3d, NumberList.parseNumber(" 3 "));
    assertTrue(Double.isNaN(NumberList.parseNumber("three")));
  }

  @Test
  public void testSubList() throws Exception
  {
    NumberList nums = NumberList.of(1d, 2d, 3d);

    assertEquals(NumberList.of(1d, 2d), nums.subList(0, 2));
    assertEquals(NumberList.of(2d, 3d), nums.subList(1, 5));
    assertEquals(NumberList.of(1d, 2d, 3d), nums.subList(-1, 3));
    assertSame(NumberList.EMPTY, nums.subList(2, 1));
    assertTrue(NumberList.EMPTY.subList(0, 2).isEmpty());
  }

  @Test
  public void testImmutable() throws Exception
  {
    double[] vals = {1d, 2d};
    NumberList nums = NumberList.of(vals);
    vals[0] = 5d;
    nums.toArray()[1] = 7d;

    assertEquals(NumberList.of(1d, 2d), nums);
    assertEquals(3d, nums.stream().sum());
  }
}
