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
import net.chronoql.query.ast.VarRef;
import net.chronoql.query.compile.CompiledField;

/**
 * {@code distinct(field)}: exactly one plain field reference. The statement
 * is marked so that the validator can reject other functions and fields.
 *
 * @since 1.0
 */
class DistinctValidator implements FunctionValidator {

  @Override
  public void validate(final Call call, final CompiledField field) {
    validateArgs(call, field);
  }

  /**
   * Validates the arguments of a distinct call, also when nested in
   * {@code count()}.
   * @param call A non-null distinct call.
   * @param field The field being compiled.
   */
  static void validateArgs(final Call call, final CompiledField field) {
    if (call.getArgs().isEmpty()) {
      throw new QueryCompileException(Reason.INVALID_ARGUMENT,
          "distinct function requires at least one argument");
    }
    if (call.getArgs().size() != 1) {
      throw new QueryCompileException(Reason.INVALID_ARGUMENT,
          "distinct function can only have one argument");
    }
    if (!(call.getArgs().get(0) instanceof VarRef)) {
      throw new QueryCompileException(Reason.INVALID_ARGUMENT,
          "expected field argument in distinct()");
    }
    field.statement().markDistinct();
    field.statement().clearOnlySelectors();
  }
}
