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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

/**
 * Identifies a single cell: one column letter ({@value #MIN_COLUMN} through
 * {@value #MAX_COLUMN}, case-insensitive) followed by a row number
 * ({@value #MIN_ROW} through {@value #MAX_ROW}, without leading zeros).  The
 * canonical form of an address uses an upper case column letter, e.g.
 * {@code "A1"}.
 */
public final class CellAddress
{
  public static final char MIN_COLUMN = 'A';
  public static final char MAX_COLUMN = 'J';
  public static final int MIN_ROW = 1;
  public static final int MAX_ROW = 99;

  private static final Pattern ADDRESS_PAT =
    Pattern.compile("([A-Ja-j])([1-9][0-9]?)");

  private final char _column;
  private final int _row;

  public CellAddress(char column, int row)
  {
    char upperCol = Character.toUpperCase(column);
    if((upperCol < MIN_COLUMN) || (upperCol > MAX_COLUMN)) {
      throw new IllegalArgumentException("Invalid column '" + column + "'");
    }
    if((row < MIN_ROW) || (row > MAX_ROW)) {
      throw new IllegalArgumentException("Invalid row " + row);
    }
    _column = upperCol;
    _row = row;
  }

  /**
   * @return {@code true} if the given string is exactly one cell address,
   *         {@code false} otherwise
   */
  public static boolean isAddress(String str) {
    return (!StringUtils.isEmpty(str) && ADDRESS_PAT.matcher(str).matches());
  }

  /**
   * Parses the given cell address (case-insensitive).
   *
   * @throws IllegalArgumentException if the given string is not a valid
   *         address
   */
  public static CellAddress parse(String str) {
    Matcher m = ((str != null) ? ADDRESS_PAT.matcher(str) : null);
    if((m == null) || !m.matches()) {
      throw new IllegalArgumentException("Invalid cell address '" + str + "'");
    }
    return new CellAddress(m.group(1).charAt(0),
                           Integer.parseInt(m.group(2)));
  }

  public char getColumn() {
    return _column;
  }

  public int getRow() {
    return _row;
  }

  /**
   * @return {@code true} if this address lies within the rectangular block
   *         spanned by the given corner addresses, {@code false} otherwise
   */
  public boolean isWithin(CellAddress start, CellAddress end) {
    return ((start.getColumn() <= _column) && (_column <= end.getColumn()) &&
            (start.getRow() <= _row) && (_row <= end.getRow()));
  }

  @Override
  public int hashCode() {
    return (31 * _column) + _row;
  }

  @Override
  public boolean equals(Object o) {
    if(!(o instanceof CellAddress)) {
      return false;
    }

    CellAddress oa = (CellAddress)o;
    return ((_column == oa._column) && (_row == oa._row));
  }

  @Override
  public String toString() {
    return String.valueOf(_column) + _row;
  }
}
