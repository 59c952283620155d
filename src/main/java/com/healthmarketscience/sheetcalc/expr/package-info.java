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

/**
 * The public api for formula evaluation.  A formula is reduced to its value
 * by repeatedly rewriting its text: cell ranges and cell references are
 * replaced by the text of the referenced cells, arithmetic between number
 * literals is collapsed ({@code *} and {@code /} before {@code +} and
 * {@code -}, left to right) and function calls are replaced by their results,
 * innermost first.  Evaluation ends when a rewrite pass no longer changes the
 * text.
 * <p/>
 * <h2>Supporting Classes</h2>
 * <p/>
 * <ul>
 * <li>{@link com.healthmarketscience.sheetcalc.expr.EvalConfig} allows for customization of the formula
 *     evaluation of a given {@link com.healthmarketscience.sheetcalc.FormulaEvaluator} instance.</li>
 * <li>{@link com.healthmarketscience.sheetcalc.expr.CellStore} provides the contents of the cells referenced
 *     by a formula.</li>
 * <li>{@link com.healthmarketscience.sheetcalc.expr.CellAddress} identifies a single cell.</li>
 * <li>{@link com.healthmarketscience.sheetcalc.expr.FunctionLookup} provides a source for {@link com.healthmarketscience.sheetcalc.expr.Function} instances
 *     used during formula evaluation.</li>
 * <li>{@link com.healthmarketscience.sheetcalc.expr.EvalException} wrapper exception thrown for failures which occur
 *     during formula evaluation.</li>
 * <li>{@link com.healthmarketscience.sheetcalc.expr.UndefinedReferenceException} thrown when a formula
 *     references a cell which does not exist.</li>
 * <li>{@link com.healthmarketscience.sheetcalc.expr.NonConvergenceException} thrown when a formula does not
 *     reach a stable value, e.g. for cells which reference each other.</li>
 * </ul>
 * <p/>
 * <h2>Function Support</h2>
 * <p/>
 * Function names are case-insensitive.  All functions take a list of
 * numbers.  Calls to unknown functions are left in the formula unevaluated.
 *
 * <table border="1" width="50%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th><th>Result</th></tr>
 * <tr class="TableRowColor"><td><i>(empty)</i></td><td>the given list</td></tr>
 * <tr class="TableRowColor"><td>sum</td><td>sum of the values</td></tr>
 * <tr class="TableRowColor"><td>average</td><td>mean of the values</td></tr>
 * <tr class="TableRowColor"><td>median</td><td>middle value (mean of the middle values for an even count)</td></tr>
 * <tr class="TableRowColor"><td>even</td><td>the even values</td></tr>
 * <tr class="TableRowColor"><td>someeven</td><td>true if any value is even</td></tr>
 * <tr class="TableRowColor"><td>everyeven</td><td>true if all values are even</td></tr>
 * <tr class="TableRowColor"><td>firsttwo</td><td>the first two values</td></tr>
 * <tr class="TableRowColor"><td>lasttwo</td><td>the last two values</td></tr>
 * <tr class="TableRowColor"><td>has2</td><td>true if a value is 2</td></tr>
 * <tr class="TableRowColor"><td>increment</td><td>every value plus 1</td></tr>
 * <tr class="TableRowColor"><td>random</td><td>random(x,y): a random integer from x (inclusive) to x+y (exclusive)</td></tr>
 * <tr class="TableRowColor"><td>range</td><td>range(x,y): the integers from x to y (inclusive)</td></tr>
 * <tr class="TableRowColor"><td>nodupes</td><td>the values without duplicates</td></tr>
 * </table>
 */
package com.healthmarketscience.sheetcalc.expr;
