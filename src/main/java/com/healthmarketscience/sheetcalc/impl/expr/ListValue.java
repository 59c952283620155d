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

import com.healthmarketscience.sheetcalc.expr.NumberList;

/**
 *
 */
public class ListValue extends BaseValue
{
  private final NumberList _val;

  public ListValue(NumberList val)
  {
    _val = val;
  }

  @Override
  public Type getType() {
    return Type.LIST;
  }

  @Override
  public Object get() {
    return _val;
  }

  /**
   * @return the values of this list joined with commas (an empty list is an
   *         empty string)
   */
  @Override
  public String getAsString() {
    return NumberFormatter.format(_val);
  }
}
