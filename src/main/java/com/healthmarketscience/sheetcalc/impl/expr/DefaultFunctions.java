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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.EvalException;
import com.healthmarketscience.sheetcalc.expr.Function;
import com.healthmarketscience.sheetcalc.expr.FunctionLookup;
import com.healthmarketscience.sheetcalc.expr.NumberList;
import com.healthmarketscience.sheetcalc.expr.Value;
import static com.healthmarketscience.sheetcalc.impl.expr.FunctionSupport.*;

/**
 * The built-in formula functions.  The function table is filled once, when
 * this class is initialized, and is read-only afterwards.
 */
public class DefaultFunctions
{
  /** the largest number of values the "range" function will produce */
  public static final int MAX_RANGE_SIZE = 100000;

  private static final Map<String,Function> FUNCS =
    new HashMap<String,Function>();

  public static final FunctionLookup LOOKUP = new FunctionLookup() {
    @Override
    public Function getFunction(String name) {
      return FUNCS.get(toLookupName(name));
    }
  };

  private DefaultFunctions() {}


  public static final Function IDENTITY = registerFunc(new FuncList("") {
    @Override
    protected Value evalList(EvalContext ctx, NumberList params) {
      return ValueSupport.toValue(params);
    }
  });

  public static final Function SUM = registerFunc(new FuncList("sum") {
    @Override
    protected Value evalList(EvalContext ctx, NumberList params) {
      return ValueSupport.toValue(sum(params));
    }
  });

  public static final Function AVERAGE = registerFunc(new FuncList("average") {
    @Override
    protected Value evalList(EvalContext ctx, NumberList params) {
      return ValueSupport.toValue(sum(params) / params.size());
    }
  });

  public static final Function MEDIAN = registerFunc(new FuncList("median") {
    @Override
    protected Value evalList(EvalContext ctx, NumberList params) {
      if(params.isEmpty()) {
        throw new EvalException("No values");
      }
      double[] sorted = params.toArray();
      Arrays.sort(sorted);
      int mid = sorted.length / 2;
      if(isEven(sorted.length)) {
        return ValueSupport.toValue((sorted[mid - 1] + sorted[mid]) / 2);
      }
      return ValueSupport.toValue(sorted[mid]);
    }
  });

  public static final Function EVEN = registerFunc(new FuncList("even") {
    @Override
    protected Value evalList(EvalContext ctx, NumberList params) {
      return ValueSupport.toValue(
          params.stream().filter(DefaultFunctions::isEven));
    }
  });

  public static final Function SOME_EVEN = registerFunc(new FuncList("someeven") {
    @Override
    protected Value evalList(EvalContext ctx, NumberList params) {
      return ValueSupport.toValue(
          params.stream().anyMatch(DefaultFunctions::isEven));
    }
  });

  public static final Function EVERY_EVEN = registerFunc(new FuncList("everyeven") {
    @Override
    protected Value evalList(EvalContext ctx, NumberList params) {
      return ValueSupport.toValue(
          params.stream().allMatch(DefaultFunctions::isEven));
    }
  });

  public static final Function FIRST_TWO = registerFunc(new FuncList("firsttwo") {
    @Override
    protected Value evalList(EvalContext ctx, NumberList params) {
      return ValueSupport.toValue(params.subList(0, 2));
    }
  });

  public static final Function LAST_TWO = registerFunc(new FuncList("lasttwo") {
    @Override
    protected Value evalList(EvalContext ctx, NumberList params) {
      return ValueSupport.toValue(
          params.subList(params.size() - 2, params.size()));
    }
  });

  public static final Function HAS_2 = registerFunc(new FuncList("has2") {
    @Override
    protected Value evalList(EvalContext ctx, NumberList params) {
      return ValueSupport.toValue(params.stream().anyMatch(d -> (d == 2d)));
    }
  });

  public static final Function INCREMENT = registerFunc(new FuncList("increment") {
    @Override
    protected Value evalList(EvalContext ctx, NumberList params) {
      return ValueSupport.toValue(params.stream().map(d -> d + 1));
    }
  });

  // not deterministic, a fresh value for every call in the formula
  public static final Function RANDOM = registerFunc(new Func2("random") {
    @Override
    protected Value eval2(EvalContext ctx, double param1, double param2) {
      // an integer in [param1, param1 + param2)
      return ValueSupport.toValue(
          Math.floor((ctx.getRandom() * param2) + param1));
    }
  });

  public static final Function RANGE = registerFunc(new Func2("range") {
    @Override
    protected Value eval2(EvalContext ctx, double param1, double param2) {
      int start = toRangeBound(param1);
      int end = toRangeBound(param2);
      if(((long)end - start + 1) > MAX_RANGE_SIZE) {
        throw new EvalException("Range larger than " + MAX_RANGE_SIZE +
                                " values");
      }
      return ValueSupport.toValue(
          RangeExpander.range(start, end).stream().mapToDouble(i -> i));
    }
  });

  public static final Function NO_DUPES = registerFunc(new FuncList("nodupes") {
    @Override
    protected Value evalList(EvalContext ctx, NumberList params) {
      Set<Double> unique = new LinkedHashSet<Double>();
      for(double d : params.toArray()) {
        // -0 and 0 are the same value here
        unique.add((d == 0d) ? 0d : d);
      }
      return ValueSupport.toValue(
          unique.stream().mapToDouble(Double::doubleValue));
    }
  });

  /**
   * @return the names of all the built-in functions
   */
  public static Set<String> getFunctionNames() {
    return Collections.unmodifiableSet(FUNCS.keySet());
  }

  static String toLookupName(String name) {
    return name.toLowerCase(Locale.ROOT);
  }

  static double sum(NumberList params) {
    // plain left to right addition, the same as a chain of '+' operators
    double sum = 0d;
    for(int i = 0; i < params.size(); ++i) {
      sum += params.get(i);
    }
    return sum;
  }

  static boolean isEven(double d) {
    return ((d % 2) == 0d);
  }

  private static int toRangeBound(double d) {
    if((d != Math.rint(d)) || (d < Integer.MIN_VALUE) ||
       (d > Integer.MAX_VALUE)) {
      throw new EvalException("Range bound " + NumberFormatter.format(d) +
                              " is not an integer");
    }
    return (int)d;
  }

  private static Function registerFunc(Function func) {
    String lookupFname = toLookupName(func.getName());
    if(FUNCS.put(lookupFname, func) != null) {
      throw new IllegalStateException("Duplicate function " + func);
    }
    return func;
  }
}
