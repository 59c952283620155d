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

import java.util.Random;

import com.healthmarketscience.sheetcalc.expr.CellStore;
import com.healthmarketscience.sheetcalc.expr.FunctionLookup;
import com.healthmarketscience.sheetcalc.impl.FormulaEvalConfig;
import com.healthmarketscience.sheetcalc.impl.FormulaEvaluatorImpl;

/**
 * Builder style class for constructing a {@link FormulaEvaluator}.
 * <p/>
 * Simple example usage:
 * <pre>
 *   String val = EvaluatorBuilder.evaluate("sum(A1:A3)", cells);
 * </pre>
 * <p/>
 * Advanced example usage:
 * <pre>
 *   FormulaEvaluator eval = new EvaluatorBuilder()
 *     .setMaxPasses(100)
 *     .setRandom(new Random(42L))
 *     .toEvaluator();
 * </pre>
 */
public class EvaluatorBuilder
{
  /** max number of rewrite passes, if not set, uses default */
  private Integer _maxPasses;
  /** optional custom function provider */
  private FunctionLookup _funcs;
  /** optional random source for the non-pure functions */
  private Random _rnd;

  public EvaluatorBuilder() {}

  /**
   * Sets the maximum number of rewrite passes for a single evaluation.  If
   * not set, uses {@link FormulaEvaluatorImpl#getDefaultMaxPasses}.
   */
  public EvaluatorBuilder setMaxPasses(int maxPasses) {
    if(maxPasses < 1) {
      throw new IllegalArgumentException("Invalid max passes " + maxPasses);
    }
    _maxPasses = maxPasses;
    return this;
  }

  /**
   * Sets the {@link FunctionLookup} used to resolve function names.  If
   * {@code null}, uses the built-in functions.
   */
  public EvaluatorBuilder setFunctionLookup(FunctionLookup funcs) {
    _funcs = funcs;
    return this;
  }

  /**
   * Sets the random source used by the "random" function.  If {@code null},
   * uses a time seeded source.
   */
  public EvaluatorBuilder setRandom(Random rnd) {
    _rnd = rnd;
    return this;
  }

  /**
   * Creates a new FormulaEvaluator using the current configuration of this
   * builder.
   */
  public FormulaEvaluator toEvaluator() {
    FormulaEvalConfig config = ((_rnd != null) ?
                                new FormulaEvalConfig(_rnd) :
                                new FormulaEvalConfig());
    if(_maxPasses != null) {
      config.setMaxPasses(_maxPasses);
    }
    if(_funcs != null) {
      config.setFunctionLookup(_funcs);
    }
    return new FormulaEvaluatorImpl(config);
  }

  /**
   * Evaluates the given formula using a default configured evaluator.
   *
   * @see FormulaEvaluator#evaluate
   */
  public static String evaluate(String formula, CellStore cells) {
    return new EvaluatorBuilder().toEvaluator().evaluate(formula, cells);
  }
}
