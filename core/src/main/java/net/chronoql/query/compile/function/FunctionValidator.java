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
import net.chronoql.query.ast.Call;
import net.chronoql.query.compile.CompiledField;

/**
 * Validates the arguments of a function call and records what the call
 * means for the statement, e.g. whether it is a selector. Implementations
 * are stateless and shared.
 *
 * @since 1.0
 */
public interface FunctionValidator {

  /**
   * Validates the call, descending into nested calls through the field.
   * @param call The non-null call, already recorded on the statement.
   * @param field The non-null field being compiled.
   * @throws QueryCompileException if the call is invalid.
   */
  public void validate(final Call call, final CompiledField field);
}
