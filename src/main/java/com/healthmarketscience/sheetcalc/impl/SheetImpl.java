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

package com.healthmarketscience.sheetcalc.impl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.healthmarketscience.sheetcalc.FormulaEvaluator;
import com.healthmarketscience.sheetcalc.Sheet;
import com.healthmarketscience.sheetcalc.expr.CellAddress;
import com.healthmarketscience.sheetcalc.expr.EvalException;
import com.healthmarketscience.sheetcalc.impl.expr.ReferenceResolver;
import com.healthmarketscience.sheetcalc.util.EvalErrorHandler;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 *
 */
public class SheetImpl implements Sheet
{
  private static final Log LOG = LogFactory.getLog(SheetImpl.class);

  /** marks cell input which is a formula */
  public static final String FORMULA_MARKER = "=";

  private final int _columnCount;
  private final int _rowCount;
  private final FormulaEvaluator _evaluator;
  /** the cell text by address, in row-major order */
  private final Map<CellAddress,String> _cells =
    new LinkedHashMap<CellAddress,String>();
  private EvalErrorHandler _errorHandler = EvalErrorHandler.DEFAULT;

  public SheetImpl(int columnCount, int rowCount, FormulaEvaluator evaluator)
  {
    _columnCount = columnCount;
    _rowCount = rowCount;
    _evaluator = evaluator;
    for(int row = CellAddress.MIN_ROW; row <= rowCount; ++row) {
      for(int col = 0; col < columnCount; ++col) {
        _cells.put(new CellAddress((char)(CellAddress.MIN_COLUMN + col), row),
                   "");
      }
    }
  }

  @Override
  public int getColumnCount() {
    return _columnCount;
  }

  @Override
  public int getRowCount() {
    return _rowCount;
  }

  @Override
  public List<CellAddress> getAddresses() {
    return Collections.unmodifiableList(
        new ArrayList<CellAddress>(_cells.keySet()));
  }

  @Override
  public EvalErrorHandler getErrorHandler() {
    return _errorHandler;
  }

  @Override
  public void setErrorHandler(EvalErrorHandler newErrorHandler) {
    _errorHandler = ((newErrorHandler != null) ? newErrorHandler :
                     EvalErrorHandler.DEFAULT);
  }

  @Override
  public String lookup(String address) {
    if(!CellAddress.isAddress(address)) {
      return null;
    }
    return _cells.get(CellAddress.parse(address));
  }

  @Override
  public String getCellText(String address) {
    return _cells.get(toSheetAddress(address));
  }

  @Override
  public void setCellText(String address, String text) {
    _cells.put(toSheetAddress(address), ((text != null) ? text : ""));
  }

  @Override
  public String enterCellText(String address, String input) {
    CellAddress cellAddr = toSheetAddress(address);
    String text = StringUtils.defaultString(input);
    String value = StringUtils.deleteWhitespace(text);

    if(value.startsWith(FORMULA_MARKER)) {
      String formula = value.substring(FORMULA_MARKER.length());
      if(!ReferenceResolver.isReferenced(formula, cellAddr)) {
        text = evaluate(cellAddr, formula);
      } else if(LOG.isDebugEnabled()) {
        LOG.debug("Formula '" + formula + "' for cell " + cellAddr +
                  " references itself, storing as is");
      }
    }

    _cells.put(cellAddr, text);
    return text;
  }

  @Override
  public String evaluate(String formula) {
    return _evaluator.evaluate(formula, this);
  }

  private String evaluate(CellAddress cellAddr, String formula) {
    try {
      return evaluate(formula);
    } catch(EvalException e) {
      String replacement = _errorHandler.handleError(cellAddr, formula, e);
      return ((replacement != null) ? replacement : "");
    }
  }

  private CellAddress toSheetAddress(String address) {
    CellAddress cellAddr = CellAddress.parse(address);
    if(!_cells.containsKey(cellAddr)) {
      throw new IllegalArgumentException(
          "Cell " + cellAddr + " is not part of this sheet");
    }
    return cellAddr;
  }

  @Override
  public String toString() {
    return "Sheet[" + _columnCount + "x" + _rowCount + "]";
  }
}
