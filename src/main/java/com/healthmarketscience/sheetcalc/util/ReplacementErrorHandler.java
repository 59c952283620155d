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
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Simple concrete implementation of EvalErrorHandler which replaces the value
 * of every failed formula with a fixed text.
 */
public class ReplacementErrorHandler implements EvalErrorHandler
{
  private static final Log LOG =
    LogFactory.getLog(ReplacementErrorHandler.class);

  private final String _replacement;

  /**
   * Constructs a ReplacementErrorHandler which replaces all failed values
   * with the empty string.
   */
  public ReplacementErrorHandler() {
    this("");
  }

  /**
   * Constructs a ReplacementErrorHandler which replaces all failed values
   * with the given text.
   */
  public ReplacementErrorHandler(String replacement) {
    _replacement = replacement;
  }

  @Override
  public String handleError(CellAddress address, String formula,
                            EvalException error)
  {
    if(LOG.isWarnEnabled()) {
      LOG.warn("Replacing value of formula '" + formula + "' for cell " +
               address + " with '" + _replacement + "'", error);
    }
    return _replacement;
  }
}
