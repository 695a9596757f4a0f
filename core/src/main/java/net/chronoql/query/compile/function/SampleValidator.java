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
 * {@code sample(field, N)} where N is a positive integer. Returns input
 * points so it counts as a selector.
 *
 * @since 1.0
 */
class SampleValidator implements FunctionValidator {

  @Override
  public void validate(final Call call, final CompiledField field) {
    FunctionValidators.checkArity(call, 2);
    final Expr size = call.getArgs().get(1);
    if (!(size instanceof IntegerLiteral)) {
      throw new QueryCompileException(Reason.INVALID_ARGUMENT,
          "expected integer argument in sample()");
    }
    if (((IntegerLiteral) size).getValue() <= 0) {
      throw new QueryCompileException(Reason.INVALID_ARGUMENT,
          "sample window must be greater than 1, got "
          + ((IntegerLiteral) size).getValue());
    }
    field.compileSymbol(call.getName(), call.getArgs().get(0));
  }
}
