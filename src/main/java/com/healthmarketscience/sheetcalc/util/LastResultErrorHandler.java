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

package com.healthmarketscience.sheetcalc.util;

import com.healthmarketscience.sheetcalc.expr.CellAddress;
import com.healthmarketscience.sheetcalc.expr.EvalException;
import com.healthmarketscience.sheetcalc.expr.NonConvergenceException;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * EvalErrorHandler which recovers from formulas which do not converge by
 * using the text computed by the last rewrite pass.  All other errors are
 * handled by the given delegate handler (which rethrows by default).
 */
public class LastResultErrorHandler implements EvalErrorHandler
{
  private static final Log LOG =
    LogFactory.getLog(LastResultErrorHandler.class);

  private final EvalErrorHandler _delegate;

  public LastResultErrorHandler() {
    this(EvalErrorHandler.DEFAULT);
  }

  public LastResultErrorHandler(EvalErrorHandler delegate) {
    _delegate = delegate;
  }

  @Override
  public String handleError(CellAddress address, String formula,
                            EvalException error)
  {
    if(error instanceof NonConvergenceException) {
      String lastText = ((NonConvergenceException)error).getLastText();
      if(LOG.isWarnEnabled()) {
        LOG.warn("Formula '" + formula + "' for cell " + address +
                 " did not converge, using last value '" + lastText + "'");
      }
      return lastText;
    }
    return _delegate.handleError(address, formula, error);
  }
}
