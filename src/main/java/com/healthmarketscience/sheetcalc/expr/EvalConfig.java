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
 * The EvalConfig allows for customization of formula evaluation for a given
 * {@link com.healthmarketscience.sheetcalc.FormulaEvaluator} instance.
 *
 * @see com.healthmarketscience.sheetcalc.expr formula package docs
 */
public interface EvalConfig
{
  /**
   * @return the maximum number of rewrite passes allowed for one evaluation
   */
  public int getMaxPasses();

  /**
   * Sets the maximum number of rewrite passes allowed for one evaluation.
   * Passes which shrink the formula are not limited.  A formula which is
   * still changing after this many passes which do not shrink it fails with
   * a {@link NonConvergenceException}.
   */
  public void setMaxPasses(int maxPasses);

  /**
   * @return the currently configured FunctionLookup
   */
  public FunctionLookup getFunctionLookup();

  /**
   * Sets the {@link Function} provider to use during formula evaluation.
   * Custom Functions can be provided to the evaluation engine by installing a
   * custom FunctionLookup instance (which would presumably wrap and delegate
   * to the default FunctionLookup instance for any default implementations).
   */
  public void setFunctionLookup(FunctionLookup lookup);
}
