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

package com.healthmarketscience.sheetcalc.util;

import com.healthmarketscience.sheetcalc.expr.CellAddress;
import com.healthmarketscience.sheetcalc.expr.EvalException;

/**
 * Handler for errors encountered while evaluating a formula entered into a
 * cell of a {@link com.healthmarketscience.sheetcalc.Sheet}.  Users may wish
 * to provide their own implementation to recover from (some) evaluation
 * failures instead of aborting the cell entry.
 */
@FunctionalInterface
public interface EvalErrorHandler
{
  /**
   * default error handler used if none provided (just rethrows exception)
   */
  public static final EvalErrorHandler DEFAULT = new EvalErrorHandler() {
      @Override
      public String handleError(CellAddress address, String formula,
                                EvalException error)
      {
        throw error;
      }
    };

  /**
   * Handles an error encountered while evaluating the formula entered into a
   * cell.  Handler may either throw an exception (which will be propagated
   * back to the caller, in which case the cell is left unchanged) or return
   * a replacement for the value of the formula (which will be stored in the
   * cell).
   *
   * @param address the address of the cell being entered
   * @param formula the formula being evaluated (without the leading
   *                {@code '='} marker)
   * @param error the error that was encountered
   *
   * @return replacement text for the cell
   */
  public String handleError(CellAddress address, String formula,
                            EvalException error);
}
