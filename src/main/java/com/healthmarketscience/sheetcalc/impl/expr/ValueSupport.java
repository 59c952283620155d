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

import java.util.stream.DoubleStream;

import com.healthmarketscience.sheetcalc.expr.NumberList;
import com.healthmarketscience.sheetcalc.expr.Value;

/**
 *
 */
public class ValueSupport
{
  public static final Value TRUE_VAL = new BooleanValue(true);
  public static final Value FALSE_VAL = new BooleanValue(false);
  public static final Value EMPTY_LIST_VAL = new ListValue(NumberList.EMPTY);

  private ValueSupport() {}

  public static Value toValue(boolean b) {
    return (b ? TRUE_VAL : FALSE_VAL);
  }

  public static Value toValue(double d) {
    return new NumberValue(d);
  }

  public static Value toValue(NumberList nums) {
    return (nums.isEmpty() ? EMPTY_LIST_VAL : new ListValue(nums));
  }

  public static Value toValue(DoubleStream nums) {
    return toValue(NumberList.of(nums));
  }
}
