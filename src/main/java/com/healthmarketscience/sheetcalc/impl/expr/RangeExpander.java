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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Generates ascending, inclusive sequences of row numbers and column
 * letters.
 */
public class RangeExpander
{
  private RangeExpander() {}

  /**
   * @return the integers from {@code start} to {@code end} (inclusive), empty
   *         if {@code end < start}
   *
   * @throws IllegalArgumentException if the range has more values than a
   *         list can hold
   */
  public static List<Integer> range(int start, int end) {
    if(end < start) {
      return Collections.emptyList();
    }
    long size = (long)end - start + 1;
    if(size > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("Range too large " + start + ":" +
                                         end);
    }
    List<Integer> nums = new ArrayList<Integer>((int)size);
    for(long i = start; i <= end; ++i) {
      nums.add((int)i);
    }
    return nums;
  }

  /**
   * @return the letters from {@code start} to {@code end} (inclusive), empty
   *         if {@code end < start}
   *
   * @throws IllegalArgumentException if either bound is not an ASCII letter
   */
  public static List<Character> charRange(char start, char end) {
    validateLetter(start);
    validateLetter(end);
    List<Character> chars = new ArrayList<Character>();
    for(int c : range(start, end)) {
      chars.add((char)c);
    }
    return chars;
  }

  private static void validateLetter(char c) {
    if(!(((c >= 'a') && (c <= 'z')) || ((c >= 'A') && (c <= 'Z')))) {
      throw new IllegalArgumentException("Invalid range letter '" + c + "'");
    }
  }
}
