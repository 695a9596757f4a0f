// This file is part of ChronoQL.
// Copyright (C) 2024  The ChronoQL Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.chronoql.query.compile.function;

import java.util.Set;

import com.google.common.collect.ImmutableMap;

import net.chronoql.exceptions.QueryCompileException;
import net.chronoql.exceptions.QueryCompileException.Reason;
import net.chronoql.query.ast.Call;
import net.chronoql.query.ast.Expr;

/**
 * The registry of supported functions keyed by name along with argument
 * checks shared by the validators.
 *
 * @since 1.0
 */
public final class FunctionValidators {

  /** The validators keyed on function name. */
  private static final ImmutableMap<String, FunctionValidator> VALIDATORS;
  static {
    final AggregateValidator selector = new AggregateValidator(true);
    final AggregateValidator aggregate = new AggregateValidator(false);
    final TransformValidator derivative =
        new TransformValidator(TransformValidator.Argument.DURATION);
    final TransformValidator difference =
        new TransformValidator(TransformValidator.Argument.NONE);
    final TopBottomValidator top_bottom = new TopBottomValidator();
    final HoltWintersValidator holt_winters = new HoltWintersValidator();

    VALIDATORS = ImmutableMap.<String, FunctionValidator>builder()
        .put("max", selector)
        .put("min", selector)
        .put("first", selector)
        .put("last", selector)
        .put("count", aggregate)
        .put("sum", aggregate)
        .put("mean", aggregate)
        .put("median", aggregate)
        .put("mode", aggregate)
        .put("stddev", aggregate)
        .put("spread", aggregate)
        .put("percentile", new PercentileValidator())
        .put("sample", new SampleValidator())
        .put("distinct", new DistinctValidator())
        .put("top", top_bottom)
        .put("bottom", top_bottom)
        .put("derivative", derivative)
        .put("non_negative_derivative", derivative)
        .put("elapsed", derivative)
        .put("difference", difference)
        .put("non_negative_difference", difference)
        .put("cumulative_sum", difference)
        .put("moving_average",
            new TransformValidator(TransformValidator.Argument.WINDOW))
        .put("integral", new IntegralValidator())
        .put("holt_winters", holt_winters)
        .put("holt_winters_with_fit", holt_winters)
        .build();
  }

  private FunctionValidators() {
    // static
  }

  /**
   * @param name A function name.
   * @return The validator for the function or null if the function isn't
   * supported.
   */
  public static FunctionValidator get(final String name) {
    return VALIDATORS.get(name);
  }

  /** @return The names of all supported functions. */
  public static Set<String> names() {
    return VALIDATORS.keySet();
  }

  /**
   * Ensures the call has exactly the expected number of arguments.
   * @param call A non-null call.
   * @param expected The expected count.
   * @throws QueryCompileException if the count differs.
   */
  static void checkArity(final Call call, final int expected) {
    if (call.getArgs().size() != expected) {
      throw new QueryCompileException(Reason.INVALID_ARGUMENT,
          "invalid number of arguments for " + call.getName() + ", expected "
          + expected + ", got " + call.getArgs().size());
    }
  }

  /**
   * Ensures the argument count of the call is within the bounds.
   * @param call A non-null call.
   * @param min The minimum count, inclusive.
   * @param max The maximum count, inclusive.
   * @throws QueryCompileException if the count is out of bounds.
   */
  static void checkArity(final Call call, final int min, final int max) {
    final int got = call.getArgs().size();
    if (got < min || got > max) {
      throw new QueryCompileException(Reason.INVALID_ARGUMENT,
          "invalid number of arguments for " + call.getName()
          + ", expected at least " + min + " but no more than " + max
          + ", got " + got);
    }
  }

  /**
   * @param expr A non-null expression.
   * @return A short name for the kind of expression for error messages.
   */
  static String typeName(final Expr expr) {
    return expr.getClass().getSimpleName();
  }
}
