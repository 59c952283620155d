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

import com.healthmarketscience.sheetcalc.expr.CellStore;
import com.healthmarketscience.sheetcalc.expr.EvalConfig;

/**
 * Evaluates spreadsheet formulas against the cells of a {@link CellStore}.
 * A formula may contain number literals, the arithmetic operators
 * {@code + - * /}, cell references (e.g. {@code A1}), cell ranges (e.g.
 * {@code A1:B3}) and function calls (e.g. {@code sum(A1:A3)}).  See the
 * {@link com.healthmarketscience.sheetcalc.expr expr package docs} for the
 * available functions.
 * <p/>
 * Instances are created using the {@link EvaluatorBuilder}.
 */
public interface FormulaEvaluator
{
  /** system property which can be used to set the default maximum number of
      rewrite passes for a single evaluation */
  public static final String MAX_PASSES_PROPERTY =
    "com.healthmarketscience.sheetcalc.maxPasses";

  /** default maximum number of rewrite passes for a single evaluation */
  public static final int DEFAULT_MAX_PASSES = 1000;

  /**
   * Evaluates the given formula.
   *
   * @param formula the formula text, <i>without</i> the leading {@code '='}
   *                marker
   * @param cells the source of the referenced cell contents
   *
   * @return the final (textual) value of the formula.  Any parts which
   *         cannot be evaluated (e.g. calls to unknown functions) are
   *         returned as is.
   *
   * @throws com.healthmarketscience.sheetcalc.expr.UndefinedReferenceException
   *         if the formula references a cell unknown to the given store
   * @throws com.healthmarketscience.sheetcalc.expr.NonConvergenceException
   *         if the formula does not reach a stable value
   * @throws com.healthmarketscience.sheetcalc.expr.EvalException if a
   *         function is called with invalid parameters
   */
  public String evaluate(String formula, CellStore cells);

  /**
   * @return the EvalConfig for configuring the evaluation of formulas by
   *         this evaluator
   */
  public EvalConfig getEvalConfig();
}
