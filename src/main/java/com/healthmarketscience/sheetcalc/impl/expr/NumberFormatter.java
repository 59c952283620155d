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

import java.math.BigDecimal;
import java.util.stream.Collectors;

import com.healthmarketscience.sheetcalc.expr.NumberList;

/**
 * Formats numbers the way they are substituted back into a formula: plain
 * decimal notation (never exponent notation, so the text can always be read
 * back as a number literal), no trailing zeros and no decimal point for
 * integral values.
 */
public class NumberFormatter
{
  static final String NAN_STR = "NaN";
  static final String POS_INF_STR = "Infinity";
  static final String NEG_INF_STR = "-Infinity";
  static final String LIST_SEPARATOR = ",";

  private NumberFormatter() {}

  public static String format(double d) {

    if(Double.isNaN(d)) {
      return NAN_STR;
    }
    if(Double.isInfinite(d)) {
      return ((d < 0d) ? NEG_INF_STR : POS_INF_STR);
    }

    // BigDecimal.valueOf uses the canonical (shortest) double string
    return normalize(BigDecimal.valueOf(d)).toPlainString();
  }

  public static String format(NumberList nums) {
    return nums.stream().mapToObj(NumberFormatter::format)
      .collect(Collectors.joining(LIST_SEPARATOR));
  }

  /**
   * Converts the given BigDecimal to the minimal scale >= 0;
   */
  static BigDecimal normalize(BigDecimal bd) {
    if(bd.scale() == 0) {
      return bd;
    }
    // handle a bug in the jdk which doesn't strip zero values
    if(bd.compareTo(BigDecimal.ZERO) == 0) {
      return BigDecimal.ZERO;
    }
    bd = bd.stripTrailingZeros();
    if(bd.scale() < 0) {
      bd = bd.setScale(0);
    }
    return bd;
  }
}
