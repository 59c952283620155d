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

/**
 * Wrapper for the result of a formula {@link Function}.
 */
public interface Value
{
  /** the types of values which functions may produce */
  public enum Type
  {
    NUMBER, LIST, BOOLEAN;
  }

  /**
   * @return the type of this value
   */
  public Type getType();

  /**
   * @return the raw value
   */
  public Object get();

  /**
   * @return the textual form of this value, as it is substituted back into
   *         a formula
   */
  public String getAsString();
}
