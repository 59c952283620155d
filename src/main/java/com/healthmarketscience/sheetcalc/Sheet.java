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

package com.healthmarketscience.sheetcalc;

import java.util.List;

import com.healthmarketscience.sheetcalc.expr.CellAddress;
import com.healthmarketscience.sheetcalc.expr.CellStore;
import com.healthmarketscience.sheetcalc.util.EvalErrorHandler;

/**
 * A rectangular grid of text cells, addressed by column letter and row
 * number (e.g. {@code "B3"}).  Cell text starting with {@code '='} entered
 * through {@link #enterCellText} is evaluated as a formula and replaced by
 * its value.
 * <p/>
 * A Sheet is the {@link CellStore} for the formulas evaluated against it:
 * addresses outside of the grid are undefined.  Note that cells are not
 * recalculated when the cells they were computed from change.
 * <p/>
 * A Sheet instance is not thread-safe.  Instances are created using the
 * {@link SheetBuilder}.
 */
public interface Sheet extends CellStore
{
  /** default number of columns ({@code A} through {@code F}) */
  public static final int DEFAULT_COLUMN_COUNT = 6;
  /** default number of rows */
  public static final int DEFAULT_ROW_COUNT = 19;

  public int getColumnCount();

  public int getRowCount();

  /**
   * @return the addresses of all the cells of this sheet, in row-major order
   */
  public List<CellAddress> getAddresses();

  /**
   * @return the current text of the given cell
   * @throws IllegalArgumentException if the address is not part of this sheet
   */
  public String getCellText(String address);

  /**
   * Stores the given text in the given cell as is, without any evaluation.
   *
   * @throws IllegalArgumentException if the address is not part of this sheet
   */
  public void setCellText(String address, String text);

  /**
   * Enters the given input into the given cell the way a user would.  All
   * whitespace is removed from the input.  If the result is a formula (starts
   * with {@code '='}) which does not reference the given cell, the formula is
   * evaluated and the cell set to its value.  Otherwise, the cell is set to
   * the input as given.
   * <p/>
   * Evaluation failures are passed to the configured
   * {@link #getErrorHandler EvalErrorHandler}.
   *
   * @return the text stored in the cell
   * @throws IllegalArgumentException if the address is not part of this sheet
   */
  public String enterCellText(String address, String input);

  /**
   * Evaluates the given formula (without the leading {@code '='} marker)
   * against the cells of this sheet, without storing the result.
   *
   * @see FormulaEvaluator#evaluate
   */
  public String evaluate(String formula);

  /**
   * Gets the currently configured EvalErrorHandler (always non-{@code null}).
   */
  public EvalErrorHandler getErrorHandler();

  /**
   * Sets a new EvalErrorHandler.  If {@code null}, resets to the
   * {@link EvalErrorHandler#DEFAULT}.
   */
  public void setErrorHandler(EvalErrorHandler newErrorHandler);
}
