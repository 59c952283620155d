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

package com.healthmarketscience.sheetcalc.impl.expr;

import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.NonConvergenceException;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Drives the evaluation of a formula by rewriting it until it no longer
 * changes.  Each pass resolves the cell references, reduces the arithmetic
 * and then applies a single function call.  The text produced by the first
 * pass which makes no change is the value of the formula.
 * <p/>
 * Passes which shrink the formula (in tokens) always make progress, so only
 * the passes which do not are limited.  Long arithmetic chains therefore
 * finish regardless of the limit, while cell reference cycles and formulas
 * which keep growing fail with a {@link NonConvergenceException}.
 * <p/>
 * A function call is consumed by its own substitution, so a function which
 * is not pure (e.g. "random") is invoked exactly once per call in the
 * formula, even though the formula is rewritten many times.
 */
public class RewriteDriver
{
  private static final Log LOG = LogFactory.getLog(RewriteDriver.class);

  private RewriteDriver() {}

  /**
   * Evaluates the given formula (without any leading formula marker).
   *
   * @param formula the formula to evaluate, whitespace is ignored
   * @param ctx the context supplying cell contents and functions
   * @param maxPasses the maximum number of passes which do not shrink the
   *                  formula
   * @return the final value of the formula
   * @throws NonConvergenceException if the formula is still changing after
   *         the given number of non-shrinking passes
   * @throws com.healthmarketscience.sheetcalc.expr.UndefinedReferenceException
   *         if the formula references a non-existent cell
   */
  public static String evaluate(String formula, EvalContext ctx,
                                int maxPasses)
  {
    if(formula == null) {
      throw new IllegalArgumentException("formula is null");
    }
    if(maxPasses < 1) {
      throw new IllegalArgumentException("Invalid max passes " + maxPasses);
    }

    String text = StringUtils.deleteWhitespace(formula);
    int numTokens = FormulaTokenizer.tokenize(text).size();
    int pass = 0;
    int numLimitedPasses = 0;
    while(numLimitedPasses < maxPasses) {

      ++pass;
      String next = rewrite(text, ctx);

      if(LOG.isTraceEnabled()) {
        LOG.trace("Pass " + pass + ": '" + text + "' -> '" + next + "'");
      }

      if(next.equals(text)) {
        if(LOG.isDebugEnabled()) {
          LOG.debug("Formula '" + formula + "' evaluated to '" + text +
                    "' in " + pass + " passes");
        }
        return text;
      }

      // a pass which removes tokens is always progress, only the others
      // count against the limit
      int nextNumTokens = FormulaTokenizer.tokenize(next).size();
      if(nextNumTokens >= numTokens) {
        ++numLimitedPasses;
      }
      text = next;
      numTokens = nextNumTokens;
    }

    throw new NonConvergenceException(formula, text, pass);
  }

  /**
   * Runs one full rewrite pass over the given text.
   */
  static String rewrite(String text, EvalContext ctx) {
    String next = ReferenceResolver.resolve(text, ctx);
    next = ArithmeticReducer.reduce(next);
    return FunctionDispatcher.apply(next, ctx);
  }
}
