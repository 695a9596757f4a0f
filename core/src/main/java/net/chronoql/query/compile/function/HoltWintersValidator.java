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
import net.chronoql.query.ast.Expr;
import net.chronoql.query.ast.IntegerLiteral;
import net.chronoql.query.compile.CompiledField;

/**
 * {@code holt_winters(aggregate, N, S)} and
 * {@code holt_winters_with_fit(aggregate, N, S)}: a forecast of N points
 * with seasonal pattern S over an aggregate computed per GROUP BY interval.
 *
 * @since 1.0
 */
class HoltWintersValidator implements FunctionValidator {

  @Override
  public void validate(final Call call, final CompiledField field) {
    final String name = call.getName();
    FunctionValidators.checkArity(call, 3);

    final Expr points = call.getArgs().get(1);
    if (!(points instanceof IntegerLiteral)) {
      throw new QueryCompileException(Reason.INVALID_ARGUMENT,
          "expected integer argument as second arg in " + name);
    }
    if (((IntegerLiteral) points).getValue() <= 0) {
      throw new QueryCompileException(Reason.INVALID_ARGUMENT,
          "second arg to " + name + " must be greater than 0, got "
          + ((IntegerLiteral) points).getValue());
    }

    final Expr season = call.getArgs().get(2);
    if (!(season instanceof IntegerLiteral)) {
      throw new QueryCompileException(Reason.INVALID_ARGUMENT,
          "expected integer argument as third arg in " + name);
    }
    if (((IntegerLiteral) season).getValue() < 0) {
      throw new QueryCompileException(Reason.INVALID_ARGUMENT,
          "third arg to " + name + " cannot be negative, got "
          + ((IntegerLiteral) season).getValue());
    }
    field.statement().clearOnlySelectors();

    final Expr arg = call.getArgs().get(0);
    if (!(arg instanceof Call)) {
      throw new QueryCompileException(Reason.MISSING_AGGREGATE,
          "must use aggregate function with " + name);
    }
    if (field.statement().getInterval().isZero()) {
      throw new QueryCompileException(Reason.MISSING_AGGREGATE,
          name + " aggregate requires a GROUP BY interval");
    }
    field.compileExpr(arg);
  }
}
