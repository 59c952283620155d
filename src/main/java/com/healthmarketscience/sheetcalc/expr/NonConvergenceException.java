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
 * Thrown when the rewriting of a formula does not reach a stable value
 * within the configured number of passes (e.g. for cells which reference each
 * other).  The text computed by the last pass is retained so that callers
 * may still make use of it.
 */
public class NonConvergenceException extends EvalException
{
  private static final long serialVersionUID = 20180402L;

  private final String _formula;
  private final String _lastText;
  private final int _numPasses;

  public NonConvergenceException(String formula, String lastText,
                                 int numPasses) {
    super("Formula '" + formula + "' did not converge after " + numPasses +
          " passes, last value '" + lastText + "'");
    _formula = formula;
    _lastText = lastText;
    _numPasses = numPasses;
  }

  /**
   * @return the formula which was being evaluated
   */
  public String getFormula() {
    return _formula;
  }

  /**
   * @return the text produced by the last completed pass
   */
  public String getLastText() {
    return _lastText;
  }

  public int getNumPasses() {
    return _numPasses;
  }
}
