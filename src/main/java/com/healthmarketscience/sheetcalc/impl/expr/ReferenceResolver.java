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

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.healthmarketscience.sheetcalc.expr.CellAddress;
import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.impl.expr.FormulaTokenizer.Token;
import com.healthmarketscience.sheetcalc.impl.expr.FormulaTokenizer.TokenType;

/**
 * Replaces the cell references in a formula with the raw text of the
 * referenced cells.  Ranges (e.g. {@code "A1:B2"}) are expanded first, into
 * the comma separated texts of the block in row-major order.  The remaining
 * single cell references are expanded afterwards.
 * <p/>
 * Cell text is substituted exactly as stored.  Text which is itself a formula
 * is <i>not</i> evaluated here, the composite text is simply processed again
 * by the following rewrite passes.
 */
public class ReferenceResolver
{
  private ReferenceResolver() {}

  /**
   * Expands all the range and cell references in the given formula.
   *
   * @throws com.healthmarketscience.sheetcalc.expr.UndefinedReferenceException
   *         if a referenced cell does not exist
   */
  public static String resolve(String formula, EvalContext ctx) {
    return expandCells(expandRanges(formula, ctx), ctx);
  }

  /**
   * Replaces every range in the given formula with the comma separated texts
   * of the cells in that range.
   */
  static String expandRanges(String formula, EvalContext ctx) {
    List<Token> tokens = FormulaTokenizer.tokenize(formula);
    StringBuilder sb = new StringBuilder();

    int i = 0;
    while(i < tokens.size()) {
      if(isRange(tokens, i)) {
        sb.append(expandRange(tokens.get(i).getAddress(),
                              tokens.get(i + 2).getAddress(), ctx));
        i += 3;
        continue;
      }
      sb.append(tokens.get(i).getText());
      ++i;
    }

    return sb.toString();
  }

  /**
   * Replaces every single cell reference in the given formula with the text
   * of that cell.  Substituted text is not searched for further references.
   */
  static String expandCells(String formula, EvalContext ctx) {
    List<Token> tokens = FormulaTokenizer.tokenize(formula);
    StringBuilder sb = new StringBuilder();

    for(Token t : tokens) {
      if(t.getType() == TokenType.CELL) {
        sb.append(ctx.getCellText(t.getAddress()));
      } else {
        sb.append(t.getText());
      }
    }

    return sb.toString();
  }

  /**
   * @return {@code true} if the given formula references the given cell,
   *         either directly or as part of a range, {@code false} otherwise
   */
  public static boolean isReferenced(String formula, CellAddress address) {
    List<Token> tokens = FormulaTokenizer.tokenize(formula);
    for(int i = 0; i < tokens.size(); ++i) {
      if(isRange(tokens, i)) {
        if(address.isWithin(tokens.get(i).getAddress(),
                            tokens.get(i + 2).getAddress())) {
          return true;
        }
        i += 2;
        continue;
      }
      Token t = tokens.get(i);
      if((t.getType() == TokenType.CELL) && address.equals(t.getAddress())) {
        return true;
      }
    }
    return false;
  }

  private static String expandRange(CellAddress start, CellAddress end,
                                    EvalContext ctx) {
    List<String> texts = new ArrayList<String>();
    List<Character> columns = RangeExpander.charRange(
        start.getColumn(), end.getColumn());
    for(int row : RangeExpander.range(start.getRow(), end.getRow())) {
      for(char column : columns) {
        texts.add(ctx.getCellText(new CellAddress(column, row)));
      }
    }
    return StringUtils.join(texts, FormulaTokenizer.LIST_SEP);
  }

  private static boolean isRange(List<Token> tokens, int idx) {
    return (((idx + 2) < tokens.size()) &&
            (tokens.get(idx).getType() == TokenType.CELL) &&
            tokens.get(idx + 1).isDelim(FormulaTokenizer.RANGE_SEP) &&
            (tokens.get(idx + 2).getType() == TokenType.CELL));
  }
}
