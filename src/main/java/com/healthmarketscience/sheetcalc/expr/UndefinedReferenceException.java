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
 * Thrown when a formula references a cell which the {@link CellStore} in use
 * does not know about.  This is fatal for the current evaluation.
 */
public class UndefinedReferenceException extends EvalException
{
  private static final long serialVersionUID = 20180402L;

  private final String _address;

  public UndefinedReferenceException(String address) {
    super("Undefined cell reference '" + address + "'");
    _address = address;
  }

  /**
   * @return the (canonical) address of the cell which could not be found
   */
  public String getAddress() {
    return _address;
  }
}
