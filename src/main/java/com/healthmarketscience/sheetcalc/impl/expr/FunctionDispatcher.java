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

import java.util.List;

import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.Function;
import com.healthmarketscience.sheetcalc.expr.NumberList;
import com.healthmarketscience.sheetcalc.impl.expr.FormulaTokenizer.Token;
import com.healthmarketscience.sheetcalc.impl.expr.FormulaTokenizer.TokenType;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Applies (at most) one function call to a formula.  The only candidate is
 * the call opened by the last {@code '('} in the formula, so nested calls are
 * evaluated inside-out over successive passes (e.g. {@code sum(range(1,3))}
 * first becomes {@code sum(1,2,3)}).  The call is only applied if its
 * arguments are already reduced to a (possibly empty) list of numbers and its
 * name is known, otherwise the formula is returned unchanged.
 */
public class FunctionDispatcher
{
  private static final Log LOG = LogFactory.getLog(FunctionDispatcher.class);

  private FunctionDispatcher() {}

  /**
   * Replaces the innermost, rightmost function call in the given formula with
   * its result.
   *
   * @return the rewritten formula, or the given formula if there is no
   *         applicable call
   */
  public static String apply(String formula, EvalContext ctx) {
    List<Token> tokens = FormulaTokenizer.tokenize(formula);

    int openIdx = findLastOpenParen(tokens);
    if(openIdx < 0) {
      return formula;
    }

    int closeIdx = findArgsEnd(tokens, openIdx + 1);
    if(closeIdx < 0) {
      return formula;
    }

    int nameIdx = findNameStart(tokens, openIdx);
    String name = FormulaTokenizer.toText(tokens, nameIdx, openIdx);

    Function func = ctx.getFunctionLookup().getFunction(name);
    if(func == null) {
      if(LOG.isDebugEnabled()) {
        LOG.debug("Unknown function '" + name + "', leaving '" + formula +
                  "' unevaluated");
      }
      return formula;
    }

    NumberList params = NumberList.parse(
        FormulaTokenizer.toText(tokens, openIdx + 1, closeIdx));
    String result = func.eval(ctx, params).getAsString();

    return FormulaTokenizer.toText(tokens, 0, nameIdx) + result +
      FormulaTokenizer.toText(tokens, closeIdx + 1, tokens.size());
  }

  private static int findLastOpenParen(List<Token> tokens) {
    for(int i = tokens.size() - 1; i >= 0; --i) {
      if(tokens.get(i).isDelim(FormulaTokenizer.OPEN_PAREN)) {
        return i;
      }
    }
    return -1;
  }

  /**
   * @return the index of the closing paren of an argument list consisting
   *         only of (possibly signed) numbers and list separators, -1 if the
   *         arguments are not of that form
   */
  private static int findArgsEnd(List<Token> tokens, int idx) {
    boolean itemStart = true;
    while(idx < tokens.size()) {
      Token t = tokens.get(idx);
      if(t.isDelim(FormulaTokenizer.CLOSE_PAREN)) {
        return idx;
      }
      if(t.isDelim(FormulaTokenizer.LIST_SEP)) {
        itemStart = true;
      } else if(t.getType() == TokenType.NUMBER) {
        itemStart = false;
      } else if(!(itemStart && t.isOp(FormulaTokenizer.MINUS) &&
                  isNumber(tokens, idx + 1))) {
        return -1;
      }
      ++idx;
    }
    // unterminated call
    return -1;
  }

  /**
   * @return the index of the first token of the (possibly empty) function
   *         name preceding the open paren at the given index
   */
  private static int findNameStart(List<Token> tokens, int openIdx) {
    int idx = openIdx;
    while(idx > 0) {
      TokenType type = tokens.get(idx - 1).getType();
      if((type != TokenType.WORD) && (type != TokenType.CELL) &&
         (type != TokenType.NUMBER)) {
        break;
      }
      --idx;
    }
    return idx;
  }

  private static boolean isNumber(List<Token> tokens, int idx) {
    return ((idx < tokens.size()) &&
            (tokens.get(idx).getType() == TokenType.NUMBER));
  }
}
