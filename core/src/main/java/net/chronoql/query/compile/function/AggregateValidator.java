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

import net.chronoql.query.ast.Call;
import net.chronoql.query.ast.Distinct;
import net.chronoql.query.ast.Expr;
import net.chronoql.query.compile.CompiledField;

/**
 * Single argument aggregates over a field. Selectors return one of the
 * input points unchanged and can be combined with raw fields. Everything
 * else synthesizes a value. {@code count()} also accepts a distinct
 * argument, which is validated as distinct.
 *
 * @since 1.0
 */
class AggregateValidator implements FunctionValidator {

  /** Whether the functions are selectors. */
  private final boolean selector;

  /**
   * @param selector Whether the functions are selectors.
   */
  AggregateValidator(final boolean selector) {
    this.selector = selector;
  }

  @Override
  public void validate(final Call call, final CompiledField field) {
    if (!selector) {
      field.statement().clearOnlySelectors();
    }
    FunctionValidators.checkArity(call, 1);

    final Expr arg = call.getArgs().get(0);
    if (call.getName().equals("count")) {
      if (arg instanceof Call && ((Call) arg).getName().equals("distinct")) {
        DistinctValidator.validateArgs((Call) arg, field);
        return;
      }
      if (arg instanceof Distinct) {
        DistinctValidator.validateArgs(((Distinct) arg).toCall(), field);
        return;
      }
    }
    field.compileSymbol(call.getName(), arg);
  }
}
