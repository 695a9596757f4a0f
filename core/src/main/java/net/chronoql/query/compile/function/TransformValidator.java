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

import net.chronoql.exceptions.QueryCompileException;
import net.chronoql.exceptions.QueryCompileException.Reason;
import net.chronoql.query.ast.Call;
import net.chronoql.query.ast.DurationLiteral;
import net.chronoql.query.ast.Expr;
import net.chronoql.query.ast.IntegerLiteral;
import net.chronoql.query.compile.CompiledField;

/**
 * Functions computed over consecutive points, e.g. {@code derivative()} or
 * {@code moving_average()}. The first argument is either a field, read raw
 * when there is no GROUP BY interval, or an aggregate call evaluated per
 * interval. Mixing the two forms is rejected.
 *
 * @since 1.0
 */
class TransformValidator implements FunctionValidator {

  /** The optional trailing argument accepted by the function. */
  enum Argument {
    /** No further argument. */
    NONE,

    /** An optional positive duration, e.g. the derivative unit. */
    DURATION,

    /** A required window size greater than 1. */
    WINDOW
  }

  /** The trailing argument. */
  private final Argument argument;

  /**
   * @param argument The trailing argument accepted.
   */
  TransformValidator(final Argument argument) {
    this.argument = argument;
  }

  @Override
  public void validate(final Call call, final CompiledField field) {
    switch (argument) {
    case NONE:
      FunctionValidators.checkArity(call, 1);
      break;
    case DURATION:
      FunctionValidators.checkArity(call, 1, 2);
      if (call.getArgs().size() == 2) {
        checkDuration(call, call.getArgs().get(1));
      }
      break;
    case WINDOW:
      FunctionValidators.checkArity(call, 2);
      checkWindow(call, call.getArgs().get(1));
      break;
    }
    field.statement().clearOnlySelectors();

    final Expr arg = call.getArgs().get(0);
    final boolean grouped = !field.statement().getInterval().isZero();
    if (arg instanceof Call) {
      if (!grouped) {
        throw new QueryCompileException(Reason.MISSING_AGGREGATE,
            call.getName() + " aggregate requires a GROUP BY interval");
      }
      field.compileExpr(arg);
    } else {
      if (grouped) {
        throw new QueryCompileException(Reason.MISSING_AGGREGATE,
            "aggregate function required inside the call to "
            + call.getName());
      }
      field.compileSymbol(call.getName(), arg);
    }
  }

  private static void checkDuration(final Call call, final Expr arg) {
    if (!(arg instanceof DurationLiteral)) {
      throw new QueryCompileException(Reason.INVALID_ARGUMENT,
          "second argument to " + call.getName() + " must be a duration, "
          + "got " + FunctionValidators.typeName(arg));
    }
    if (((DurationLiteral) arg).getValue() <= 0) {
      throw new QueryCompileException(Reason.INVALID_ARGUMENT,
          "duration argument must be positive, got " + arg);
    }
  }

  private static void checkWindow(final Call call, final Expr arg) {
    if (!(arg instanceof IntegerLiteral)) {
      throw new QueryCompileException(Reason.INVALID_ARGUMENT,
          "second argument for " + call.getName() + " must be an integer, "
          + "got " + FunctionValidators.typeName(arg));
    }
    if (((IntegerLiteral) arg).getValue() <= 1) {
      throw new QueryCompileException(Reason.INVALID_ARGUMENT,
          call.getName() + " window must be greater than 1, got "
          + ((IntegerLiteral) arg).getValue());
    }
  }
}
