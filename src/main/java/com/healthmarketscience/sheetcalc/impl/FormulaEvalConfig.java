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

import java.util.Random;

import com.healthmarketscience.sheetcalc.expr.EvalConfig;
import com.healthmarketscience.sheetcalc.expr.FunctionLookup;
import com.healthmarketscience.sheetcalc.impl.expr.DefaultFunctions;
import com.healthmarketscience.sheetcalc.impl.expr.RandomContext;

/**
 * The configuration shared by all the evaluations of one
 * {@link FormulaEvaluatorImpl}.
 */
public class FormulaEvalConfig implements EvalConfig
{
  private FunctionLookup _funcs = DefaultFunctions.LOOKUP;
  private int _maxPasses = FormulaEvaluatorImpl.getDefaultMaxPasses();
  private final RandomContext _rndCtx;

  public FormulaEvalConfig() {
    _rndCtx = new RandomContext();
  }

  public FormulaEvalConfig(Random rnd) {
    _rndCtx = new RandomContext(rnd);
  }

  @Override
  public int getMaxPasses() {
    return _maxPasses;
  }

  @Override
  public void setMaxPasses(int maxPasses) {
    if(maxPasses < 1) {
      throw new IllegalArgumentException("Invalid max passes " + maxPasses);
    }
    _maxPasses = maxPasses;
  }

  @Override
  public FunctionLookup getFunctionLookup() {
    return _funcs;
  }

  @Override
  public void setFunctionLookup(FunctionLookup lookup) {
    _funcs = ((lookup != null) ? lookup : DefaultFunctions.LOOKUP);
  }

  public RandomContext getRandomContext() {
    return _rndCtx;
  }
}
