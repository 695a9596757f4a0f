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
package net.chronoql.query.compile;

import net.chronoql.exceptions.QueryCompileException;
import net.chronoql.exceptions.QueryCompileException.Reason;

/**
 * Cross checks the attributes gathered while compiling the fields of a
 * statement. Runs once per statement after every field compiled.
 *
 * @since 1.0
 */
final class StatementValidator {

  private StatementValidator() {
    // static
  }

  /**
   * @param statement The statement with compiled fields.
   * @throws QueryCompileException if the fields can't be combined.
   */
  static void validate(final CompiledStatement statement) {
    if (statement.getFields().isEmpty()) {
      throw new QueryCompileException(Reason.EMPTY_FIELD_LIST,
          "at least 1 non-time field must be queried");
    }

    final int calls = statement.getFunctionCalls().size();
    if (calls > 1 && !statement.getTopBottomFunction().isEmpty()) {
      throw new QueryCompileException(Reason.SELECTOR_CONFLICT,
          "selector function " + statement.getTopBottomFunction()
          + "() cannot be combined with other functions");
    }
    if (calls == 0) {
      switch (statement.getFill()) {
      case NONE:
        throw new QueryCompileException(Reason.ILLEGAL_FILL,
            "fill(none) must be used with a function");
      case LINEAR:
        throw new QueryCompileException(Reason.ILLEGAL_FILL,
            "fill(linear) must be used with a function");
      default:
        break;
      }
      if (!statement.getInterval().isZero() &&
          !statement.isInheritedInterval()) {
        throw new QueryCompileException(Reason.MISSING_AGGREGATE,
            "GROUP BY requires at least one aggregate function");
      }
    }

    if (statement.hasDistinct() &&
        (calls != 1 || statement.hasAuxiliaryFields())) {
      throw new QueryCompileException(Reason.DISTINCT_CONFLICT,
          "aggregate function distinct() cannot be combined with other "
          + "functions or fields");
    }

    if (statement.hasAuxiliaryFields()) {
      if (!statement.isOnlySelectors()) {
        throw new QueryCompileException(Reason.MIXED_AGGREGATE,
            "mixing aggregate and non-aggregate queries is not supported");
      }
      if (calls > 1) {
        throw new QueryCompileException(Reason.MIXED_AGGREGATE,
            "mixing multiple selector functions with tags or fields is not "
            + "supported");
      }
    }
  }
}
