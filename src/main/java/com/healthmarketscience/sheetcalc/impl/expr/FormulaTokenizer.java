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
import java.util.Collections;
import java.util.List;

import com.healthmarketscience.sheetcalc.expr.CellAddress;
import com.healthmarketscience.sheetcalc.expr.NumberList;

/**
 * Splits formula text into tokens.  Tokenization is lossless apart from
 * whitespace (which is not significant in a formula): the concatenated text of
 * the tokens of a whitespace free formula is the formula itself.  This allows
 * the rewrite stages to work on tokens while handing plain text from one stage
 * to the next.
 */
public class FormulaTokenizer
{
  private static final int EOF = -1;
  static final char OPEN_PAREN = '(';
  static final char CLOSE_PAREN = ')';
  static final char LIST_SEP = ',';
  static final char RANGE_SEP = ':';
  static final char MINUS = '-';
  private static final char DECIMAL_SEP = '.';

  private static final byte IS_OP_FLAG =     0x01;
  private static final byte IS_DELIM_FLAG =  0x02;
  private static final byte IS_SPACE_FLAG =  0x04;

  public enum TokenType {
    /** decimal number literal (including "Infinity" and "NaN") */
    NUMBER,
    /** a word which is a cell address */
    CELL,
    /** any other word, e.g. a function name */
    WORD,
    /** one of the arithmetic operators */
    OP,
    /** parens, list and range separators */
    DELIM,
    /** any other character, passed through untouched */
    OTHER;
  }

  private static final byte[] CHAR_FLAGS = new byte[128];

  static {
    setCharFlag(IS_OP_FLAG, '+', '-', '*', '/');
    setCharFlag(IS_DELIM_FLAG, OPEN_PAREN, CLOSE_PAREN, LIST_SEP, RANGE_SEP);
    setCharFlag(IS_SPACE_FLAG, ' ', '\n', '\r', '\t', '\f');
  }

  private FormulaTokenizer() {}

  /**
   * Tokenizes the given formula text.
   */
  public static List<Token> tokenize(String formula) {

    if(formula.isEmpty()) {
      return Collections.emptyList();
    }

    List<Token> tokens = new ArrayList<Token>();

    ExprBuf buf = new ExprBuf(formula);

    while(buf.hasNext()) {
      char c = buf.next();

      byte charFlag = getCharFlag(c);
      if(charFlag != 0) {

        switch(charFlag) {
        case IS_OP_FLAG:
          tokens.add(new Token(TokenType.OP, String.valueOf(c)));
          break;

        case IS_DELIM_FLAG:
          tokens.add(new Token(TokenType.DELIM, String.valueOf(c)));
          break;

        case IS_SPACE_FLAG:
          consumeWhitespace(buf);
          break;

        default:
          throw new RuntimeException("unknown char flag " + charFlag);
        }

      } else if(isDigit(c) || (c == DECIMAL_SEP)) {

        tokens.add(new Token(TokenType.NUMBER, parseNumberLiteral(c, buf)));

      } else if(isLetter(c)) {

        tokens.add(parseWord(c, buf));

      } else {

        // anything else is passed through as is
        tokens.add(new Token(TokenType.OTHER, String.valueOf(c)));
      }
    }

    return tokens;
  }

  /**
   * @return the concatenated text of the given tokens
   */
  public static String toText(List<Token> tokens) {
    return toText(tokens, 0, tokens.size());
  }

  /**
   * @return the concatenated text of the given range of tokens
   */
  public static String toText(List<Token> tokens, int start, int end) {
    StringBuilder sb = new StringBuilder();
    for(int i = start; i < end; ++i) {
      sb.append(tokens.get(i).getText());
    }
    return sb.toString();
  }

  private static byte getCharFlag(char c) {
    return ((c < 128) ? CHAR_FLAGS[c] : 0);
  }

  private static void consumeWhitespace(ExprBuf buf) {
    int c = EOF;
    while(((c = buf.peekNext()) != EOF) &&
          hasFlag(getCharFlag((char)c), IS_SPACE_FLAG)) {
        buf.next();
    }
  }

  private static String parseNumberLiteral(char firstChar, ExprBuf buf) {
    StringBuilder sb = buf.getScratchBuffer().append(firstChar);

    // a number literal is a run of digits and decimal separators.  malformed
    // runs (e.g. "1.2.3") are kept intact and evaluate to NaN
    int c = EOF;
    while(((c = buf.peekNext()) != EOF) &&
          (isDigit(c) || (c == DECIMAL_SEP))) {
      sb.append(buf.next());
    }

    return sb.toString();
  }

  private static Token parseWord(char firstChar, ExprBuf buf) {
    StringBuilder sb = buf.getScratchBuffer().append(firstChar);

    // words are letters followed by digits, so "A1B2" is two cell references
    int c = EOF;
    while(((c = buf.peekNext()) != EOF) && isLetter(c)) {
      sb.append(buf.next());
    }
    while(((c = buf.peekNext()) != EOF) && isDigit(c)) {
      sb.append(buf.next());
    }

    String word = sb.toString();
    if(CellAddress.isAddress(word)) {
      return new Token(TokenType.CELL, word);
    }
    if(NumberFormatter.POS_INF_STR.equals(word) ||
       NumberFormatter.NAN_STR.equals(word)) {
      // the textual forms of the non-finite numbers read back as numbers
      return new Token(TokenType.NUMBER, word);
    }
    return new Token(TokenType.WORD, word);
  }

  private static boolean hasFlag(byte charFlag, byte flag) {
    return ((charFlag & flag) != 0);
  }

  private static void setCharFlag(byte flag, char... chars) {
    for(char c : chars) {
      CHAR_FLAGS[c] |= flag;
    }
  }

  private static boolean isDigit(int c) {
    return ((c >= '0') && (c <= '9'));
  }

  private static boolean isLetter(int c) {
    return (((c >= 'a') && (c <= 'z')) || ((c >= 'A') && (c <= 'Z')));
  }

  private static final class ExprBuf
  {
    private final String _str;
    private int _pos;
    private final StringBuilder _scratch = new StringBuilder();

    private ExprBuf(String str) {
      _str = str;
    }

    private int len() {
      return _str.length();
    }

    public boolean hasNext() {
      return _pos < len();
    }

    public char next() {
      return _str.charAt(_pos++);
    }

    public int peekNext() {
      if(!hasNext()) {
        return EOF;
      }
      return _str.charAt(_pos);
    }

    public StringBuilder getScratchBuffer() {
      _scratch.setLength(0);
      return _scratch;
    }

    @Override
    public String toString() {
      return "[char " + _pos + "] '" + _str + "'";
    }
  }


  public static final class Token
  {
    private final TokenType _type;
    private final String _text;

    private Token(TokenType type, String text) {
      _type = type;
      _text = text;
    }

    public TokenType getType() {
      return _type;
    }

    public String getText() {
      return _text;
    }

    public boolean isOp(char op) {
      return ((_type == TokenType.OP) && (_text.charAt(0) == op));
    }

    public boolean isDelim(char delim) {
      return ((_type == TokenType.DELIM) && (_text.charAt(0) == delim));
    }

    /**
     * @return the value of this NUMBER token ({@code NaN} if malformed)
     */
    public double getNumber() {
      return NumberList.parseNumber(_text);
    }

    /**
     * @return the address of this CELL token
     */
    public CellAddress getAddress() {
      return CellAddress.parse(_text);
    }

    @Override
    public String toString() {
      return "[" + _type + "] '" + _text + "'";
    }
  }

}
