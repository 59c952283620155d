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

/**
 *
 */
public class NumberValue extends BaseValue
{
  private final double _val;

  public NumberValue(double val)
  {
    _val = val;
  }

  @Override
  public Type getType() {
    return Type.NUMBER;
  }

  @Override
  public Object get() {
    return _val;
  }

  @Override
  public String getAsString() {
    return NumberFormatter.format(_val);
  }
}
