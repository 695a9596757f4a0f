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
package net.chronoql.query.condition;

import java.time.ZoneId;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.chronoql.exceptions.QueryCompileException;
import net.chronoql.exceptions.QueryCompileException.Reason;
import net.chronoql.query.TimeRange;
import net.chronoql.query.ast.BinaryExpr;
import net.chronoql.query.ast.BinaryOp;
import net.chronoql.query.ast.BooleanLiteral;
import net.chronoql.query.ast.DurationLiteral;
import net.chronoql.query.ast.Expr;
import net.chronoql.query.ast.IntegerLiteral;
import net.chronoql.query.ast.NumberLiteral;
import net.chronoql.query.ast.ParenExpr;
import net.chronoql.query.ast.StringLiteral;
import net.chronoql.query.ast.TimeLiteral;
import net.chronoql.query.ast.VarRef;
import net.chronoql.utils.DateTime;

/**
 * Splits a WHERE condition into the predicates on the implicit
 * {@code time} column, folded into a {@link TimeRange}, and the remaining
 * filter. {@code now()} is substituted through the valuer.
 * <p>
 * Time predicates combined with OR are still intersected; there is no way
 * to express a disjoint time range.
 *
 * @since 1.0
 */
public final class ConditionResolver {
  private static final Logger LOG = LoggerFactory.getLogger(
      ConditionResolver.class);

  private ConditionResolver() { }

  /** The outcome of resolving a condition. */
  public static final class Result {
    private final Expr condition;
    private final TimeRange time_range;

    Result(final Expr condition, final TimeRange time_range) {
      this.condition = condition;
      this.time_range = time_range;
    }

    /** @return The condition without time predicates, null if none left. */
    public Expr getCondition() {
      return condition;
    }

    /** @return The non-null time range, bounds may be unset. */
    public TimeRange getTimeRange() {
      return time_range;
    }

    @Override
    public String toString() {
      return new StringBuilder()
          .append("{condition=")
          .append(condition)
          .append(", timeRange=")
          .append(time_range)
          .append("}")
          .toString();
    }
  }

  /**
   * Resolves the condition.
   * @param condition The condition, may be null.
   * @param valuer A non-null valuer.
   * @return A non-null result.
   * @throws QueryCompileException with {@link Reason#CONDITION} if the
   * condition contains an invalid time comparison or an expression that
   * can't be used as a condition.
   */
  public static Result resolve(final Expr condition, final NowValuer valuer) {
    if (valuer == null) {
      throw new IllegalArgumentException("Valuer cannot be null.");
    }
    final Result result = resolveExpr(condition, valuer);
    Expr expr = result.condition;
    if (expr instanceof ParenExpr) {
      expr = ((ParenExpr) expr).getExpr();
    }
    if (expr instanceof BooleanLiteral && ((BooleanLiteral) expr).getValue()) {
      expr = null;
    }
    if (LOG.isTraceEnabled()) {
      LOG.trace("Resolved condition [" + condition + "] to " + result);
    }
    return new Result(expr, result.time_range);
  }

  private static Result resolveExpr(final Expr condition,
                                    final NowValuer valuer) {
    if (condition == null) {
      return new Result(null, TimeRange.UNBOUNDED);
    }

    if (condition instanceof BinaryExpr) {
      final BinaryExpr binary = (BinaryExpr) condition;
      final BinaryOp op = binary.getOp();
      if (op == BinaryOp.AND || op == BinaryOp.OR) {
        final Result lhs = resolveExpr(binary.getLhs(), valuer);
        final Result rhs = resolveExpr(binary.getRhs(), valuer);
        final TimeRange range = lhs.time_range.intersect(rhs.time_range);
        if (rhs.condition == null) {
          return new Result(lhs.condition, range);
        } else if (lhs.condition == null) {
          return new Result(rhs.condition, range);
        }
        return new Result(ExprReducer.reduce(
            new BinaryExpr(op, lhs.condition, rhs.condition), null), range);
      }

      if (isTimeRef(binary.getLhs())) {
        return new Result(null, timeRange(op, binary.getRhs(), valuer));
      } else if (isTimeRef(binary.getRhs())) {
        return new Result(null,
            timeRange(op.mirror(), binary.getLhs(), valuer));
      }
      return new Result(ExprReducer.reduce(binary, valuer),
          TimeRange.UNBOUNDED);
    } else if (condition instanceof ParenExpr) {
      final Result inner = resolveExpr(((ParenExpr) condition).getExpr(),
          valuer);
      if (inner.condition == null) {
        return inner;
      }
      return new Result(ExprReducer.reduce(
          new ParenExpr(inner.condition), null), inner.time_range);
    } else if (condition instanceof BooleanLiteral) {
      return new Result(condition, TimeRange.UNBOUNDED);
    }
    throw new QueryCompileException(Reason.CONDITION,
        "invalid condition expression: " + condition);
  }

  /**
   * Converts a comparison against {@code time} into a range.
   * @param op The operator with {@code time} on the left.
   * @param value The other operand.
   * @param valuer The valuer.
   * @return A range with one or both bounds set.
   */
  private static TimeRange timeRange(final BinaryOp op,
                                     final Expr value,
                                     final NowValuer valuer) {
    Expr rhs = value;
    if (rhs instanceof StringLiteral && ((StringLiteral) rhs).isTimeLiteral()) {
      final ZoneId location = valuer.getLocation();
      try {
        rhs = ((StringLiteral) rhs).toTimeLiteral(location);
      } catch (IllegalArgumentException e) {
        throw new QueryCompileException(Reason.CONDITION, e.getMessage(), e);
      }
    }
    rhs = ExprReducer.reduce(rhs, valuer);

    final long timestamp;
    if (rhs instanceof TimeLiteral) {
      timestamp = ((TimeLiteral) rhs).getValue();
    } else if (rhs instanceof DurationLiteral) {
      timestamp = ((DurationLiteral) rhs).getValue();
    } else if (rhs instanceof NumberLiteral) {
      final double number = ((NumberLiteral) rhs).getValue();
      if (Double.isNaN(number)) {
        throw new QueryCompileException(Reason.CONDITION,
            "invalid operation: time and NaN are not compatible");
      }
      // saturates, caught by the range check below
      timestamp = (long) number;
    } else if (rhs instanceof IntegerLiteral) {
      timestamp = ((IntegerLiteral) rhs).getValue();
    } else {
      throw new QueryCompileException(Reason.CONDITION,
          "invalid operation: time and " + rhs.getClass().getSimpleName()
          + " are not compatible");
    }

    // within these bounds the +/- 1ns adjustments can't reach UNSET
    if (timestamp > TimeRange.MAX_TIME) {
      throw new QueryCompileException(Reason.CONDITION, "time "
          + DateTime.formatTimestamp(timestamp) + " overflows time literal");
    } else if (timestamp < TimeRange.MIN_TIME + 1) {
      throw new QueryCompileException(Reason.CONDITION, "time "
          + DateTime.formatTimestamp(timestamp) + " underflows time literal");
    }

    switch (op) {
    case GT:
      return new TimeRange(timestamp + 1, TimeRange.UNSET);
    case GTE:
      return new TimeRange(timestamp, TimeRange.UNSET);
    case LT:
      return new TimeRange(TimeRange.UNSET, timestamp - 1);
    case LTE:
      return new TimeRange(TimeRange.UNSET, timestamp);
    case EQ:
      return new TimeRange(timestamp, timestamp);
    default:
      throw new QueryCompileException(Reason.CONDITION,
          "invalid time comparison operator: " + op.symbol());
    }
  }

  private static boolean isTimeRef(final Expr expr) {
    return expr instanceof VarRef &&
        ((VarRef) expr).getName().equalsIgnoreCase("time");
  }
}
