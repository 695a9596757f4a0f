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
import java.util.List;

import com.google.common.collect.Lists;
import com.google.common.math.LongMath;

import net.chronoql.query.ast.BinaryExpr;
import net.chronoql.query.ast.BinaryOp;
import net.chronoql.query.ast.BooleanLiteral;
import net.chronoql.query.ast.Call;
import net.chronoql.query.ast.Distinct;
import net.chronoql.query.ast.DurationLiteral;
import net.chronoql.query.ast.Expr;
import net.chronoql.query.ast.ExprVisitor;
import net.chronoql.query.ast.IntegerLiteral;
import net.chronoql.query.ast.Literal;
import net.chronoql.query.ast.NumberLiteral;
import net.chronoql.query.ast.ParenExpr;
import net.chronoql.query.ast.RegexLiteral;
import net.chronoql.query.ast.StringLiteral;
import net.chronoql.query.ast.TimeLiteral;
import net.chronoql.query.ast.VarRef;
import net.chronoql.query.ast.Wildcard;

/**
 * Folds constant sub-expressions. {@code now()} becomes a time literal when
 * the valuer has a now, arithmetic and comparisons over literals are
 * evaluated, boolean AND/OR short circuit and parentheses around anything
 * but a binary expression are dropped. Expressions that can't be folded are
 * rebuilt from their reduced children so reducing twice is a no-op.
 *
 * @since 1.0
 */
public class ExprReducer implements ExprVisitor<Expr> {

  /** The valuer, may be null. */
  private final NowValuer valuer;

  /**
   * Default ctor.
   * @param valuer An optional valuer.
   */
  public ExprReducer(final NowValuer valuer) {
    this.valuer = valuer;
  }

  /**
   * Reduces the expression.
   * @param expr An expression, may be null.
   * @param valuer An optional valuer.
   * @return The reduced expression or null if the input was null.
   */
  public static Expr reduce(final Expr expr, final NowValuer valuer) {
    if (expr == null) {
      return null;
    }
    return expr.accept(new ExprReducer(valuer));
  }

  @Override
  public Expr visitVarRef(final VarRef expr) {
    return expr;
  }

  @Override
  public Expr visitWildcard(final Wildcard expr) {
    return expr;
  }

  @Override
  public Expr visitRegex(final RegexLiteral expr) {
    return expr;
  }

  @Override
  public Expr visitCall(final Call expr) {
    final List<Expr> args = Lists.newArrayListWithCapacity(
        expr.getArgs().size());
    boolean literals_only = true;
    for (final Expr arg : expr.getArgs()) {
      final Expr reduced = arg.accept(this);
      if (!(reduced instanceof Literal)) {
        literals_only = false;
      }
      args.add(reduced);
    }
    if (literals_only && valuer != null) {
      final Literal value = valuer.call(expr.getName(), args.size());
      if (value != null) {
        return value;
      }
    }
    return new Call(expr.getName(), args);
  }

  @Override
  public Expr visitDistinct(final Distinct expr) {
    return expr;
  }

  @Override
  public Expr visitParen(final ParenExpr expr) {
    final Expr inner = expr.getExpr().accept(this);
    if (inner instanceof BinaryExpr) {
      return new ParenExpr(inner);
    }
    return inner;
  }

  @Override
  public Expr visitInteger(final IntegerLiteral expr) {
    return expr;
  }

  @Override
  public Expr visitNumber(final NumberLiteral expr) {
    return expr;
  }

  @Override
  public Expr visitString(final StringLiteral expr) {
    return expr;
  }

  @Override
  public Expr visitBoolean(final BooleanLiteral expr) {
    return expr;
  }

  @Override
  public Expr visitDuration(final DurationLiteral expr) {
    return expr;
  }

  @Override
  public Expr visitTime(final TimeLiteral expr) {
    return expr;
  }

  @Override
  public Expr visitBinary(final BinaryExpr expr) {
    final BinaryOp op = expr.getOp();
    final Expr lhs = expr.getLhs().accept(this);
    final Expr rhs = expr.getRhs().accept(this);

    if (op == BinaryOp.AND) {
      if (isBoolean(lhs, false) || isBoolean(rhs, false)) {
        return BooleanLiteral.FALSE;
      } else if (isBoolean(lhs, true)) {
        return rhs;
      } else if (isBoolean(rhs, true)) {
        return lhs;
      }
    } else if (op == BinaryOp.OR) {
      if (isBoolean(lhs, true) || isBoolean(rhs, true)) {
        return BooleanLiteral.TRUE;
      } else if (isBoolean(lhs, false)) {
        return rhs;
      } else if (isBoolean(rhs, false)) {
        return lhs;
      }
    }

    if (lhs instanceof BooleanLiteral) {
      return reduceBoolean(op, (BooleanLiteral) lhs, rhs);
    } else if (lhs instanceof DurationLiteral) {
      return reduceDuration(op, (DurationLiteral) lhs, rhs);
    } else if (lhs instanceof IntegerLiteral) {
      return reduceInteger(op, (IntegerLiteral) lhs, rhs);
    } else if (lhs instanceof NumberLiteral) {
      return reduceNumber(op, (NumberLiteral) lhs, rhs);
    } else if (lhs instanceof StringLiteral) {
      return reduceString(op, (StringLiteral) lhs, rhs);
    } else if (lhs instanceof TimeLiteral) {
      return reduceTime(op, (TimeLiteral) lhs, rhs);
    }
    return new BinaryExpr(op, lhs, rhs);
  }

  private Expr reduceBoolean(final BinaryOp op,
                             final BooleanLiteral lhs,
                             final Expr rhs) {
    if (rhs instanceof BooleanLiteral) {
      final boolean l = lhs.getValue();
      final boolean r = ((BooleanLiteral) rhs).getValue();
      switch (op) {
      case EQ:
        return BooleanLiteral.of(l == r);
      case NEQ:
        return BooleanLiteral.of(l != r);
      case AND:
        return BooleanLiteral.of(l && r);
      case OR:
        return BooleanLiteral.of(l || r);
      default:
        break;
      }
    }
    return new BinaryExpr(op, lhs, rhs);
  }

  private Expr reduceDuration(final BinaryOp op,
                              final DurationLiteral lhs,
                              final Expr rhs) {
    final long l = lhs.getValue();
    if (rhs instanceof DurationLiteral) {
      final long r = ((DurationLiteral) rhs).getValue();
      switch (op) {
      case ADD:
        return new DurationLiteral(LongMath.saturatedAdd(l, r));
      case SUB:
        return new DurationLiteral(LongMath.saturatedSubtract(l, r));
      default:
        final Boolean compared = compare(op, Long.compare(l, r));
        if (compared != null) {
          return BooleanLiteral.of(compared);
        }
      }
    } else if (rhs instanceof NumberLiteral) {
      final long r = (long) ((NumberLiteral) rhs).getValue();
      switch (op) {
      case MUL:
        return new DurationLiteral(LongMath.saturatedMultiply(l, r));
      case DIV:
        return new DurationLiteral(r == 0 ? 0 : l / r);
      default:
        break;
      }
    } else if (rhs instanceof IntegerLiteral) {
      final long r = ((IntegerLiteral) rhs).getValue();
      switch (op) {
      case MUL:
        return new DurationLiteral(LongMath.saturatedMultiply(l, r));
      case DIV:
        return new DurationLiteral(r == 0 ? 0 : l / r);
      default:
        break;
      }
    } else if (rhs instanceof TimeLiteral) {
      if (op == BinaryOp.ADD) {
        return new TimeLiteral(
            LongMath.saturatedAdd(((TimeLiteral) rhs).getValue(), l));
      }
    } else if (rhs instanceof StringLiteral) {
      final TimeLiteral t = toTime((StringLiteral) rhs);
      if (t != null) {
        final Expr reduced = reduceDuration(op, lhs, t);
        if (!(reduced instanceof BinaryExpr)) {
          return reduced;
        }
      }
    }
    return new BinaryExpr(op, lhs, rhs);
  }

  private Expr reduceInteger(final BinaryOp op,
                             final IntegerLiteral lhs,
                             final Expr rhs) {
    final long l = lhs.getValue();
    if (rhs instanceof NumberLiteral) {
      return reduceNumber(op, new NumberLiteral((double) l), rhs);
    } else if (rhs instanceof IntegerLiteral) {
      final long r = ((IntegerLiteral) rhs).getValue();
      switch (op) {
      case ADD:
        return new IntegerLiteral(l + r);
      case SUB:
        return new IntegerLiteral(l - r);
      case MUL:
        return new IntegerLiteral(l * r);
      case DIV:
        if (r == 0) {
          return new NumberLiteral(0);
        }
        return new NumberLiteral((double) l / (double) r);
      case MOD:
        if (r == 0) {
          return new IntegerLiteral(0);
        }
        return new IntegerLiteral(l % r);
      default:
        final Boolean compared = compare(op, Long.compare(l, r));
        if (compared != null) {
          return BooleanLiteral.of(compared);
        }
      }
    } else if (rhs instanceof DurationLiteral || rhs instanceof TimeLiteral) {
      // the integer is treated as a nanosecond duration
      final Expr reduced = reduceDuration(op, new DurationLiteral(l), rhs);
      if (!(reduced instanceof BinaryExpr)) {
        return reduced;
      }
    } else if (rhs instanceof StringLiteral) {
      final TimeLiteral t = toTime((StringLiteral) rhs);
      if (t != null) {
        final Expr reduced = reduceDuration(op, new DurationLiteral(l), t);
        if (!(reduced instanceof BinaryExpr)) {
          return reduced;
        }
      }
    }
    return new BinaryExpr(op, lhs, rhs);
  }

  private Expr reduceNumber(final BinaryOp op,
                            final NumberLiteral lhs,
                            final Expr rhs) {
    final double l = lhs.getValue();
    final double r;
    if (rhs instanceof NumberLiteral) {
      r = ((NumberLiteral) rhs).getValue();
    } else if (rhs instanceof IntegerLiteral) {
      r = (double) ((IntegerLiteral) rhs).getValue();
    } else {
      return new BinaryExpr(op, lhs, rhs);
    }
    switch (op) {
    case ADD:
      return new NumberLiteral(l + r);
    case SUB:
      return new NumberLiteral(l - r);
    case MUL:
      return new NumberLiteral(l * r);
    case DIV:
      return new NumberLiteral(r == 0 ? 0 : l / r);
    case MOD:
      return new NumberLiteral(r == 0 ? 0 : l % r);
    default:
      final Boolean compared = compare(op, Double.compare(l, r));
      if (compared != null) {
        return BooleanLiteral.of(compared);
      }
      return new BinaryExpr(op, lhs, rhs);
    }
  }

  private Expr reduceString(final BinaryOp op,
                            final StringLiteral lhs,
                            final Expr rhs) {
    if (rhs instanceof StringLiteral) {
      final StringLiteral r = (StringLiteral) rhs;
      switch (op) {
      case EQ:
      case NEQ:
        Expr result = BooleanLiteral.of(
            lhs.getValue().equals(r.getValue()) == (op == BinaryOp.EQ));
        // the same instant may be written in different formats
        if (lhs.isTimeLiteral() && r.isTimeLiteral()) {
          final TimeLiteral tl = toTime(lhs);
          final TimeLiteral tr = toTime(r);
          if (tl != null && tr != null) {
            final Expr reduced = reduceTime(op, tl, tr);
            if (!(reduced instanceof BinaryExpr)) {
              result = reduced;
            }
          }
        }
        return result;
      case ADD:
        return new StringLiteral(lhs.getValue() + r.getValue());
      default:
        break;
      }
    }
    final TimeLiteral t = toTime(lhs);
    if (t != null) {
      final Expr reduced = reduceTime(op, t, rhs);
      if (!(reduced instanceof BinaryExpr)) {
        return reduced;
      }
    }
    return new BinaryExpr(op, lhs, rhs);
  }

  private Expr reduceTime(final BinaryOp op,
                          final TimeLiteral lhs,
                          final Expr rhs) {
    final long l = lhs.getValue();
    if (rhs instanceof DurationLiteral) {
      final long r = ((DurationLiteral) rhs).getValue();
      switch (op) {
      case ADD:
        return new TimeLiteral(LongMath.saturatedAdd(l, r));
      case SUB:
        return new TimeLiteral(LongMath.saturatedSubtract(l, r));
      default:
        break;
      }
    } else if (rhs instanceof TimeLiteral) {
      final long r = ((TimeLiteral) rhs).getValue();
      if (op == BinaryOp.SUB) {
        return new DurationLiteral(LongMath.saturatedSubtract(l, r));
      }
      final Boolean compared = compare(op, Long.compare(l, r));
      if (compared != null) {
        return BooleanLiteral.of(compared);
      }
    } else if (rhs instanceof StringLiteral) {
      final TimeLiteral t = toTime((StringLiteral) rhs);
      if (t != null) {
        return reduceTime(op, lhs, t);
      }
    }
    return new BinaryExpr(op, lhs, rhs);
  }

  /**
   * @param literal A non-null string.
   * @return The parsed time or null if the string isn't a valid timestamp.
   */
  private TimeLiteral toTime(final StringLiteral literal) {
    if (!literal.isTimeLiteral()) {
      return null;
    }
    try {
      return literal.toTimeLiteral(location());
    } catch (IllegalArgumentException e) {
      // looked like a time but wasn't one, leave it as a string
      return null;
    }
  }

  private ZoneId location() {
    return valuer == null ? null : valuer.getLocation();
  }

  private static boolean isBoolean(final Expr expr, final boolean value) {
    return expr instanceof BooleanLiteral &&
        ((BooleanLiteral) expr).getValue() == value;
  }

  /**
   * @param op The operator.
   * @param cmp A comparison result.
   * @return The outcome for comparison operators or null for others.
   */
  private static Boolean compare(final BinaryOp op, final int cmp) {
    switch (op) {
    case EQ:
      return cmp == 0;
    case NEQ:
      return cmp != 0;
    case LT:
      return cmp < 0;
    case LTE:
      return cmp <= 0;
    case GT:
      return cmp > 0;
    case GTE:
      return cmp >= 0;
    default:
      return null;
    }
  }
}
