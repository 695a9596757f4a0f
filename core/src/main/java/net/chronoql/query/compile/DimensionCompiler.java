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

import java.util.List;

import net.chronoql.exceptions.QueryCompileException;
import net.chronoql.exceptions.QueryCompileException.Reason;
import net.chronoql.query.Interval;
import net.chronoql.query.ast.Call;
import net.chronoql.query.ast.Dimension;
import net.chronoql.query.ast.DurationLiteral;
import net.chronoql.query.ast.Expr;
import net.chronoql.query.ast.RegexLiteral;
import net.chronoql.query.ast.SelectStatement;
import net.chronoql.query.ast.StringLiteral;
import net.chronoql.query.ast.TimeLiteral;
import net.chronoql.query.ast.VarRef;
import net.chronoql.query.ast.Wildcard;

/**
 * Validates the GROUP BY clause and extracts the time interval from the
 * single {@code time()} dimension, if any. Offsets are normalized to the
 * range {@code [0, duration)} against the Unix epoch.
 *
 * @since 1.0
 */
final class DimensionCompiler {

  private DimensionCompiler() {
    // static
  }

  /**
   * Validates the dimensions of the statement.
   * @param stmt A non-null statement.
   * @param now The fixed now used for {@code now()} offsets.
   * @return The interval, {@link Interval#ZERO} if there is no time
   * dimension.
   * @throws QueryCompileException if a dimension is invalid.
   */
  static Interval compile(final SelectStatement stmt, final long now) {
    Interval interval = Interval.ZERO;
    for (final Dimension dimension : stmt.getDimensions()) {
      final Expr expr = dimension.getExpr();
      if (expr instanceof VarRef) {
        if (((VarRef) expr).getName().equalsIgnoreCase(
            SelectStatement.TIME_FIELD)) {
          throw new QueryCompileException(Reason.UNSUPPORTED_DIMENSION,
              "time() is a function and expects at least one argument");
        }
      } else if (expr instanceof Call) {
        final Call call = (Call) expr;
        if (!call.getName().equals("time")) {
          throw new QueryCompileException(Reason.UNSUPPORTED_DIMENSION,
              "only time() calls allowed in dimensions");
        }
        final List<Expr> args = call.getArgs();
        if (args.size() < 1 || args.size() > 2) {
          throw new QueryCompileException(Reason.INVALID_ARGUMENT,
              "time dimension expected 1 or 2 arguments");
        }
        if (!(args.get(0) instanceof DurationLiteral)) {
          throw new QueryCompileException(Reason.INVALID_ARGUMENT,
              "time dimension must have duration argument");
        }
        if (!interval.isZero()) {
          throw new QueryCompileException(Reason.MULTIPLE_INTERVAL,
              "multiple time dimensions not allowed");
        }
        final long duration = ((DurationLiteral) args.get(0)).getValue();
        if (duration <= 0) {
          throw new QueryCompileException(Reason.INVALID_ARGUMENT,
              "time dimension must have a positive duration, got "
              + args.get(0));
        }
        final long offset = args.size() == 2
            ? offset(args.get(1), duration, stmt, now) : 0;
        interval = new Interval(duration, offset);
      } else if (!(expr instanceof Wildcard) &&
                 !(expr instanceof RegexLiteral)) {
        throw new QueryCompileException(Reason.UNSUPPORTED_DIMENSION,
            "only time and tag dimensions allowed");
      }
    }
    return interval;
  }

  private static long offset(final Expr arg,
                             final long duration,
                             final SelectStatement stmt,
                             final long now) {
    if (arg instanceof DurationLiteral) {
      return Math.floorMod(((DurationLiteral) arg).getValue(), duration);
    }
    if (arg instanceof TimeLiteral) {
      return Math.floorMod(((TimeLiteral) arg).getValue(), duration);
    }
    if (arg instanceof Call) {
      final Call call = (Call) arg;
      if (!call.getName().equals("now")) {
        throw new QueryCompileException(Reason.INVALID_ARGUMENT,
            "time dimension offset function must be now()");
      }
      if (!call.getArgs().isEmpty()) {
        throw new QueryCompileException(Reason.INVALID_ARGUMENT,
            "time dimension offset now() function requires no arguments");
      }
      return Math.floorMod(now, duration);
    }
    if (arg instanceof StringLiteral &&
        ((StringLiteral) arg).isTimeLiteral()) {
      final TimeLiteral time;
      try {
        time = ((StringLiteral) arg).toTimeLiteral(stmt.getLocation());
      } catch (IllegalArgumentException e) {
        throw new QueryCompileException(Reason.INVALID_ARGUMENT,
            e.getMessage(), e);
      }
      return Math.floorMod(time.getValue(), duration);
    }
    throw new QueryCompileException(Reason.INVALID_ARGUMENT,
        "time dimension offset must be duration or now(), got "
        + arg.getClass().getSimpleName());
  }
}
