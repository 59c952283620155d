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
 * EvalContext encapsulates all shared state for a single formula
 * evaluation.  It provides a bridge between the evaluation engine and the
 * cells referenced by the formula.
 */
public interface EvalContext
{
  /**
   * @return the current raw text of the cell with the given address
   *
   * @throws UndefinedReferenceException if no such cell exists
   */
  public String getCellText(CellAddress address);

  /**
   * @return the currently configured FunctionLookup (from the
   *         {@link EvalConfig})
   */
  public FunctionLookup getFunctionLookup();

  /**
   * @return a random value in the range {@code [0, 1)} (for the "random"
   *         function)
   */
  public double getRandom();
}
