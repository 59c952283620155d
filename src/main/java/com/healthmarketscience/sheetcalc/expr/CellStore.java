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

/**
 * A CellStore provides the current raw text of the cells referenced by a
 * formula.  The text is returned exactly as stored, which may itself be an
 * unevaluated formula.  The evaluation engine only ever reads from a
 * CellStore.
 */
@FunctionalInterface
public interface CellStore
{
  /**
   * @param address the canonical (upper case) address of the cell, e.g.
   *                {@code "A1"}
   *
   * @return the current raw text of the given cell, or {@code null} if no
   *         such cell exists
   */
  public String lookup(String address);
}
