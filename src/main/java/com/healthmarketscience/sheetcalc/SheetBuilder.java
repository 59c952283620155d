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

import com.healthmarketscience.sheetcalc.expr.CellAddress;
import com.healthmarketscience.sheetcalc.impl.SheetImpl;
import com.healthmarketscience.sheetcalc.util.EvalErrorHandler;

/**
 * Builder style class for constructing a {@link Sheet}.
 * <p/>
 * Example usage:
 * <pre>
 *   Sheet sheet = new SheetBuilder()
 *     .setColumnCount(3)
 *     .setRowCount(10)
 *     .toSheet();
 *   sheet.enterCellText("A1", "=sum(1,2)");
 * </pre>
 */
public class SheetBuilder
{
  /** the max number of columns, {@code A} through {@code J} */
  public static final int MAX_COLUMN_COUNT =
    CellAddress.MAX_COLUMN - CellAddress.MIN_COLUMN + 1;

  private int _columnCount = Sheet.DEFAULT_COLUMN_COUNT;
  private int _rowCount = Sheet.DEFAULT_ROW_COUNT;
  /** optional evaluator, if not set, uses a default evaluator */
  private FormulaEvaluator _evaluator;
  /** optional error handler */
  private EvalErrorHandler _errorHandler;

  public SheetBuilder() {}

  /**
   * Sets the number of columns, from 1 to {@value #MAX_COLUMN_COUNT}.
   */
  public SheetBuilder setColumnCount(int columnCount) {
    if((columnCount < 1) || (columnCount > MAX_COLUMN_COUNT)) {
      throw new IllegalArgumentException(
          "Invalid column count " + columnCount);
    }
    _columnCount = columnCount;
    return this;
  }

  /**
   * Sets the number of rows, from 1 to {@value CellAddress#MAX_ROW}.
   */
  public SheetBuilder setRowCount(int rowCount) {
    if((rowCount < CellAddress.MIN_ROW) || (rowCount > CellAddress.MAX_ROW)) {
      throw new IllegalArgumentException("Invalid row count " + rowCount);
    }
    _rowCount = rowCount;
    return this;
  }

  public SheetBuilder setEvaluator(FormulaEvaluator evaluator) {
    _evaluator = evaluator;
    return this;
  }

  public SheetBuilder setErrorHandler(EvalErrorHandler errorHandler) {
    _errorHandler = errorHandler;
    return this;
  }

  /**
   * Creates a new, empty Sheet using the current configuration of this
   * builder.
   */
  public Sheet toSheet() {
    FormulaEvaluator evaluator = ((_evaluator != null) ? _evaluator :
                                  new EvaluatorBuilder().toEvaluator());
    SheetImpl sheet = new SheetImpl(_columnCount, _rowCount, evaluator);
    sheet.setErrorHandler(_errorHandler);
    return sheet;
  }
}
