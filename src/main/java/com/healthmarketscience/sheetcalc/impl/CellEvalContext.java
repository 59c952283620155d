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

import com.healthmarketscience.sheetcalc.expr.CellAddress;
import com.healthmarketscience.sheetcalc.expr.CellStore;
import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.FunctionLookup;
import com.healthmarketscience.sheetcalc.expr.UndefinedReferenceException;

/**
 * EvalContext for a single evaluation, bridging the engine to the cells of
 * a {@link CellStore}.
 */
public class CellEvalContext implements EvalContext
{
  private final CellStore _cells;
  private final FormulaEvalConfig _config;

  public CellEvalContext(CellStore cells, FormulaEvalConfig config) {
    _cells = cells;
    _config = config;
  }

  @Override
  public String getCellText(CellAddress address) {
    String text = _cells.lookup(address.toString());
    if(text == null) {
      throw new UndefinedReferenceException(address.toString());
    }
    return text;
  }

  @Override
  public FunctionLookup getFunctionLookup() {
    return _config.getFunctionLookup();
  }

  @Override
  public double getRandom() {
    return _config.getRandomContext().getRandom();
  }
}
