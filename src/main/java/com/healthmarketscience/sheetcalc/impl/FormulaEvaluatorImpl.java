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

import com.healthmarketscience.sheetcalc.FormulaEvaluator;
import com.healthmarketscience.sheetcalc.expr.CellStore;
import com.healthmarketscience.sheetcalc.expr.EvalConfig;
import com.healthmarketscience.sheetcalc.impl.expr.RewriteDriver;
import org.apache.commons.lang3.math.NumberUtils;

/**
 *
 */
public class FormulaEvaluatorImpl implements FormulaEvaluator
{
  private final FormulaEvalConfig _config;

  public FormulaEvaluatorImpl() {
    this(new FormulaEvalConfig());
  }

  public FormulaEvaluatorImpl(FormulaEvalConfig config) {
    _config = config;
  }

  @Override
  public String evaluate(String formula, CellStore cells) {
    if(cells == null) {
      throw new IllegalArgumentException("cells is null");
    }
    return RewriteDriver.evaluate(formula, new CellEvalContext(cells, _config),
                                  _config.getMaxPasses());
  }

  @Override
  public EvalConfig getEvalConfig() {
    return _config;
  }

  /**
   * Returns the default maximum number of rewrite passes.  This defaults to
   * {@link FormulaEvaluator#DEFAULT_MAX_PASSES}, but can be overridden using
   * the system property
   * {@value com.healthmarketscience.sheetcalc.FormulaEvaluator#MAX_PASSES_PROPERTY}.
   */
  public static int getDefaultMaxPasses()
  {
    String mpProp = System.getProperty(MAX_PASSES_PROPERTY);
    if(mpProp != null) {
      int maxPasses = NumberUtils.toInt(mpProp.trim(), 0);
      if(maxPasses > 0) {
        return maxPasses;
      }
    }

    // use default
    return DEFAULT_MAX_PASSES;
  }
}
