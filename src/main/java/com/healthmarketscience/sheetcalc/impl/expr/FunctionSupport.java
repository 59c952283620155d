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

import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.EvalException;
import com.healthmarketscience.sheetcalc.expr.Function;
import com.healthmarketscience.sheetcalc.expr.NumberList;
import com.healthmarketscience.sheetcalc.expr.Value;

/**
 *
 */
public class FunctionSupport
{
  private FunctionSupport() {}

  public static abstract class BaseFunction implements Function
  {
    private final String _name;
    private final int _minParams;
    private final int _maxParams;

    protected BaseFunction(String name, int minParams, int maxParams)
    {
      _name = name;
      _minParams = minParams;
      _maxParams = maxParams;
    }

    @Override
    public String getName() {
      return _name;
    }

    protected void validateNumParams(NumberList params) {
      int num = params.size();
      if((num < _minParams) || (num > _maxParams)) {
        String range = ((_minParams == _maxParams) ? "" + _minParams :
                        _minParams + " to " + _maxParams);
        throw new EvalException(
            "Invalid number of parameters " +
            num + " passed, expected " + range);
      }
    }

    protected EvalException invalidFunctionCall(
        Throwable t, NumberList params)
    {
      String msg = "Invalid function call {" + _name + "(" +
        NumberFormatter.format(params) + ")}";
      return new EvalException(msg, t);
    }

    @Override
    public String toString() {
      return getName() + "()";
    }
  }

  /**
   * Base class for functions which accept any number of parameters.
   */
  public static abstract class FuncList extends BaseFunction
  {
    protected FuncList(String name) {
      super(name, 0, Integer.MAX_VALUE);
    }

    @Override
    public final Value eval(EvalContext ctx, NumberList params) {
      try {
        validateNumParams(params);
        return evalList(ctx, params);
      } catch(Exception e) {
        throw invalidFunctionCall(e, params);
      }
    }

    protected abstract Value evalList(EvalContext ctx, NumberList params);
  }

  /**
   * Base class for functions which require exactly two parameters.
   */
  public static abstract class Func2 extends BaseFunction
  {
    protected Func2(String name) {
      super(name, 2, 2);
    }

    @Override
    public final Value eval(EvalContext ctx, NumberList params) {
      try {
        validateNumParams(params);
        return eval2(ctx, params.get(0), params.get(1));
      } catch(Exception e) {
        throw invalidFunctionCall(e, params);
      }
    }

    protected abstract Value eval2(EvalContext ctx,
                                   double param1, double param2);
  }
}
