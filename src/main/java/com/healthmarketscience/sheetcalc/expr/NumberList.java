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

import java.util.Arrays;
import java.util.stream.DoubleStream;

/**
 * An immutable, ordered list of double values.  This is the unit of input
 * (and, for list results, output) of every formula {@link Function}.
 */
public final class NumberList
{
  public static final NumberList EMPTY = new NumberList(new double[0]);

  private static final String SEPARATOR = ",";

  private final double[] _nums;

  private NumberList(double[] nums) {
    _nums = nums;
  }

  public static NumberList of(double... nums) {
    return ((nums.length == 0) ? EMPTY : new NumberList(nums.clone()));
  }

  public static NumberList of(DoubleStream nums) {
    return wrap(nums.toArray());
  }

  static NumberList wrap(double[] nums) {
    return ((nums.length == 0) ? EMPTY : new NumberList(nums));
  }

  /**
   * Parses a comma separated list of numbers.  Every item is parsed as a
   * double, empty or malformed items become {@link Double#NaN}.  Note that
   * this means that an empty string results in a list with a single
   * {@code NaN} value.
   */
  public static NumberList parse(String argText) {
    String[] items = argText.split(SEPARATOR, -1);
    double[] nums = new double[items.length];
    for(int i = 0; i < items.length; ++i) {
      nums[i] = parseNumber(items[i]);
    }
    return new NumberList(nums);
  }

  /**
   * @return the given string parsed as a double, or {@link Double#NaN} if it
   *         is not a valid number
   */
  public static double parseNumber(String str) {
    try {
      return Double.parseDouble(str.trim());
    } catch(NumberFormatException e) {
      // malformed numbers propagate as NaN
      return Double.NaN;
    }
  }

  public int size() {
    return _nums.length;
  }

  public boolean isEmpty() {
    return (_nums.length == 0);
  }

  public double get(int idx) {
    return _nums[idx];
  }

  /**
   * @return a new list containing the values from {@code fromIdx}
   *         (inclusive) to {@code toIdx} (exclusive), clipped to the bounds of
   *         this list
   */
  public NumberList subList(int fromIdx, int toIdx) {
    fromIdx = Math.max(fromIdx, 0);
    toIdx = Math.min(toIdx, _nums.length);
    if(fromIdx >= toIdx) {
      return EMPTY;
    }
    return wrap(Arrays.copyOfRange(_nums, fromIdx, toIdx));
  }

  public double[] toArray() {
    return _nums.clone();
  }

  public DoubleStream stream() {
    return Arrays.stream(_nums);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(_nums);
  }

  @Override
  public boolean equals(Object o) {
    return ((o instanceof NumberList) &&
            Arrays.equals(_nums, ((NumberList)o)._nums));
  }

  @Override
  public String toString() {
    return "NumberList" + Arrays.toString(_nums);
  }
}
