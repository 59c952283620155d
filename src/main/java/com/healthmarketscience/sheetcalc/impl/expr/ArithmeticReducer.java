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

import com.healthmarketscience.sheetcalc.impl.expr.FormulaTokenizer.Token;
import com.healthmarketscience.sheetcalc.impl.expr.FormulaTokenizer.TokenType;

/**
 * Collapses infix arithmetic between two number literals.  Multiplication
 * and division are reduced first: the leftmost {@code <num> (*|/) <num>} is
 * replaced by its value, repeatedly, until none are left (so chains evaluate
 * left to right).  Afterwards exactly <i>one</i> (the leftmost) addition or
 * subtraction is reduced.  Further additive terms are handled by subsequent
 * rewrite passes.
 * <p/>
 * A {@code '-'} which does not follow an operand (a number, a word or a
 * closing paren) is a sign and belongs to the number literal following it.
 * All arithmetic follows IEEE-754 double semantics, so division by zero
 * results in an infinite value or NaN instead of an error.
 */
public class ArithmeticReducer
{
  enum BinaryOp {
    MULTIPLY('*', true) {
      @Override public double eval(double param1, double param2) {
        return param1 * param2;
      }
    },
    DIVIDE('/', true) {
      @Override public double eval(double param1, double param2) {
        return param1 / param2;
      }
    },
    ADD('+', false) {
      @Override public double eval(double param1, double param2) {
        return param1 + param2;
      }
    },
    SUBTRACT('-', false) {
      @Override public double eval(double param1, double param2) {
        return param1 - param2;
      }
    };

    private final char _opChar;
    private final boolean _highPrecedence;

    private BinaryOp(char opChar, boolean highPrecedence) {
      _opChar = opChar;
      _highPrecedence = highPrecedence;
    }

    public boolean isHighPrecedence() {
      return _highPrecedence;
    }

    public abstract double eval(double param1, double param2);

    static BinaryOp fromToken(Token t) {
      if(t.getType() == TokenType.OP) {
        for(BinaryOp op : values()) {
          if(t.isOp(op._opChar)) {
            return op;
          }
        }
      }
      return null;
    }

    @Override
    public String toString() {
      return String.valueOf(_opChar);
    }
  }

  private ArithmeticReducer() {}

  /**
   * Reduces all multiplications/divisions followed by (at most) one
   * addition/subtraction.
   */
  public static String reduce(String formula) {
    return reduceLowPrecedence(reduceHighPrecedence(formula));
  }

  static String reduceHighPrecedence(String formula) {
    // every reduction removes at least one token, so this terminates
    String next = null;
    while((next = reduceLeftmost(formula, true)) != null) {
      formula = next;
    }
    return formula;
  }

  static String reduceLowPrecedence(String formula) {
    String next = reduceLeftmost(formula, false);
    return ((next != null) ? next : formula);
  }

  /**
   * @return the formula with the leftmost operation of the given precedence
   *         replaced by its value, {@code null} if there is no such operation
   */
  private static String reduceLeftmost(String formula,
                                       boolean highPrecedence) {
    List<Token> tokens = FormulaTokenizer.tokenize(formula);
    int numTokens = tokens.size();

    for(int start = 0; start < numTokens; ++start) {

      int opIdx = findOperandEnd(tokens, start);
      if((opIdx < 0) || (opIdx >= numTokens)) {
        continue;
      }

      BinaryOp op = BinaryOp.fromToken(tokens.get(opIdx));
      if((op == null) || (op.isHighPrecedence() != highPrecedence)) {
        continue;
      }

      int end = findOperandEnd(tokens, opIdx + 1);
      if(end < 0) {
        continue;
      }

      double result = op.eval(getOperandValue(tokens, start),
                              getOperandValue(tokens, opIdx + 1));

      return FormulaTokenizer.toText(tokens, 0, start) +
        NumberFormatter.format(result) +
        FormulaTokenizer.toText(tokens, end, numTokens);
    }

    return null;
  }

  /**
   * @return the index following the (possibly signed) number literal
   *         starting at the given index, -1 if there is none
   */
  private static int findOperandEnd(List<Token> tokens, int idx) {
    if(idx >= tokens.size()) {
      return -1;
    }

    Token t = tokens.get(idx);
    if(t.getType() == TokenType.NUMBER) {
      return idx + 1;
    }

    if(t.isOp(FormulaTokenizer.MINUS) && isSignPosition(tokens, idx) &&
       ((idx + 1) < tokens.size()) &&
       (tokens.get(idx + 1).getType() == TokenType.NUMBER)) {
      return idx + 2;
    }

    return -1;
  }

  private static double getOperandValue(List<Token> tokens, int idx) {
    Token t = tokens.get(idx);
    if(t.getType() == TokenType.NUMBER) {
      return t.getNumber();
    }
    // signed literal
    return -tokens.get(idx + 1).getNumber();
  }

  /**
   * @return {@code true} if a minus at the given index is a sign rather than
   *         a subtraction
   */
  private static boolean isSignPosition(List<Token> tokens, int idx) {
    if(idx == 0) {
      return true;
    }

    Token prev = tokens.get(idx - 1);
    switch(prev.getType()) {
    case NUMBER:
    case CELL:
    case WORD:
      return false;
    case DELIM:
      return !prev.isDelim(FormulaTokenizer.CLOSE_PAREN);
    default:
      return true;
    }
  }
}
