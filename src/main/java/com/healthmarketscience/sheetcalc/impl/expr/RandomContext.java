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

import java.util.Random;

/**
 * This class encapsulates the random source used by the "random" function.
 * The source is shared by all the evaluations of an evaluator, so seeding it
 * makes a sequence of evaluations reproducible.
 */
public class RandomContext
{
  private final Random _rnd;

  public RandomContext()
  {
    // each instance gets its own seed, even when created at the same time
    this(new Random());
  }

  public RandomContext(Random rnd)
  {
    _rnd = rnd;
  }

  /**
   * @return the next random value in the range {@code [0, 1)}
   */
  public double getRandom() {
    return _rnd.nextDouble();
  }
}
