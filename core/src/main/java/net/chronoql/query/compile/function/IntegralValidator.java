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
import net.chronoql.query.compile.CompiledField;

/**
 * {@code integral(field[, unit])}. Always reads the raw field.
 *
 * @since 1.0
 */
class IntegralValidator implements FunctionValidator {

  @Override
  public void validate(final Call call, final CompiledField field) {
    FunctionValidators.checkArity(call, 1, 2);
    if (call.getArgs().size() == 2) {
      final Expr unit = call.getArgs().get(1);
      if (!(unit instanceof DurationLiteral)) {
        throw new QueryCompileException(Reason.INVALID_ARGUMENT,
            "second argument must be a duration");
      }
      if (((DurationLiteral) unit).getValue() <= 0) {
        throw new QueryCompileException(Reason.INVALID_ARGUMENT,
            "duration argument must be positive, got " + unit);
      }
    }
    field.statement().clearOnlySelectors();
    field.compileSymbol(call.getName(), call.getArgs().get(0));
  }
}
