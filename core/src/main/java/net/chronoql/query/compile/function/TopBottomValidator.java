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

import java.util.List;

import net.chronoql.exceptions.QueryCompileException;
import net.chronoql.exceptions.QueryCompileException.Reason;
import net.chronoql.query.ast.Call;
import net.chronoql.query.ast.Expr;
import net.chronoql.query.ast.Field;
import net.chronoql.query.ast.IntegerLiteral;
import net.chronoql.query.ast.VarRef;
import net.chronoql.query.compile.CompiledField;
import net.chronoql.query.compile.CompiledStatement;

/**
 * {@code top(field[, tag...], N)} and {@code bottom(field[, tag...], N)}.
 * Only one may appear in a statement and nothing else may be called next to
 * it. The tags listed between the field and the limit become output columns
 * unless the results are written to a target.
 *
 * @since 1.0
 */
class TopBottomValidator implements FunctionValidator {

  @Override
  public void validate(final Call call, final CompiledField field) {
    final CompiledStatement statement = field.statement();
    final String name = call.getName();
    if (!statement.getTopBottomFunction().isEmpty()) {
      throw new QueryCompileException(Reason.SELECTOR_CONFLICT,
          "selector function " + statement.getTopBottomFunction()
          + "() cannot be combined with other functions");
    }

    final List<Expr> args = call.getArgs();
    if (args.size() < 2) {
      throw new QueryCompileException(Reason.INVALID_ARGUMENT,
          "invalid number of arguments for " + name
          + ", expected at least 2, got " + args.size());
    }

    final Expr last = args.get(args.size() - 1);
    if (!(last instanceof IntegerLiteral)) {
      throw new QueryCompileException(Reason.INVALID_ARGUMENT,
          "expected integer as last argument in " + name + "(), found "
          + last);
    }
    final long limit = ((IntegerLiteral) last).getValue();
    if (limit <= 0) {
      throw new QueryCompileException(Reason.INVALID_ARGUMENT,
          "limit (" + limit + ") in " + name + " function must be at least 1");
    }
    if (statement.getLimit() > 0 && limit > statement.getLimit()) {
      throw new QueryCompileException(Reason.INVALID_ARGUMENT,
          "limit (" + limit + ") in " + name + " function can not be larger "
          + "than the LIMIT (" + statement.getLimit()
          + ") in the select statement");
    }

    if (!(args.get(0) instanceof VarRef)) {
      throw new QueryCompileException(Reason.INVALID_ARGUMENT,
          "expected first argument to be a field in " + name + "(), found "
          + args.get(0));
    }

    for (final Expr arg : args.subList(1, args.size() - 1)) {
      if (!(arg instanceof VarRef)) {
        throw new QueryCompileException(Reason.INVALID_ARGUMENT,
            "only fields or tags are allowed in " + name + "(), found "
            + arg);
      }
      if (!statement.hasTarget()) {
        final CompiledField tag = new CompiledField(statement,
            new Field(arg), false);
        statement.addField(tag);
        tag.compileExpr(arg);
      }
    }
    statement.setTopBottomFunction(name);
  }
}
