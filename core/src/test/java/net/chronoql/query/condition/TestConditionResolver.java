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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;
import java.time.ZoneId;

import org.junit.Test;

import net.chronoql.exceptions.QueryCompileException;
import net.chronoql.exceptions.QueryCompileException.Reason;
import net.chronoql.query.TimeRange;
import net.chronoql.query.ast.BinaryExpr;
import net.chronoql.query.ast.BinaryOp;
import net.chronoql.query.ast.BooleanLiteral;
import net.chronoql.query.ast.Call;
import net.chronoql.query.ast.DurationLiteral;
import net.chronoql.query.ast.Expr;
import net.chronoql.query.ast.IntegerLiteral;
import net.chronoql.query.ast.NumberLiteral;
import net.chronoql.query.ast.ParenExpr;
import net.chronoql.query.ast.StringLiteral;
import net.chronoql.query.ast.TimeLiteral;
import net.chronoql.query.ast.VarRef;
import net.chronoql.utils.DateTime;

public class TestConditionResolver {
  private static final long NOW = nanos("2024-01-15T12:00:00Z");
  private static final NowValuer VALUER = new NowValuer(NOW, null);

  @Test
  public void nullCondition() throws Exception {
    final ConditionResolver.Result result =
        ConditionResolver.resolve(null, VALUER);
    assertNull(result.getCondition());
    assertSame(TimeRange.UNBOUNDED, result.getTimeRange());
  }

  @Test
  public void nullValuer() throws Exception {
    try {
      ConditionResolver.resolve(null, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void timeBoundsAndFilter() throws Exception {
    final Expr host = new BinaryExpr(BinaryOp.EQ, new VarRef("host"),
        new StringLiteral("a"));
    final Expr condition = and(and(
        new BinaryExpr(BinaryOp.GTE, new VarRef("time"),
            new StringLiteral("2024-01-01T00:00:00Z")),
        new BinaryExpr(BinaryOp.LT, new VarRef("time"),
            new StringLiteral("2024-01-02T00:00:00Z"))),
        host);
    final ConditionResolver.Result result =
        ConditionResolver.resolve(condition, VALUER);
    assertEquals(host, result.getCondition());
    assertEquals(new TimeRange(nanos("2024-01-01T00:00:00Z"),
        nanos("2024-01-02T00:00:00Z") - 1), result.getTimeRange());
  }

  @Test
  public void relativeToNow() throws Exception {
    final ConditionResolver.Result result = ConditionResolver.resolve(
        new BinaryExpr(BinaryOp.GT, new VarRef("time"),
            new BinaryExpr(BinaryOp.SUB, new Call("now"),
                new DurationLiteral(DateTime.HOUR))), VALUER);
    assertNull(result.getCondition());
    assertEquals(NOW - DateTime.HOUR + 1, result.getTimeRange().getMin());
    assertEquals(TimeRange.UNSET, result.getTimeRange().getMax());
  }

  @Test
  public void mirrored() throws Exception {
    ConditionResolver.Result result = ConditionResolver.resolve(
        new BinaryExpr(BinaryOp.LT, new IntegerLiteral(10),
            new VarRef("time")), VALUER);
    assertEquals(new TimeRange(11, TimeRange.UNSET), result.getTimeRange());

    result = ConditionResolver.resolve(
        new BinaryExpr(BinaryOp.EQ, new VarRef("time"),
            new IntegerLiteral(10)), VALUER);
    assertEquals(new TimeRange(10, 10), result.getTimeRange());
  }

  @Test
  public void localTimeLiteral() throws Exception {
    final ConditionResolver.Result result = ConditionResolver.resolve(
        new BinaryExpr(BinaryOp.GTE, new VarRef("time"),
            new StringLiteral("2024-01-15 00:00:00")),
        new NowValuer(NOW, ZoneId.of("America/New_York")));
    assertEquals(nanos("2024-01-15T05:00:00Z"),
        result.getTimeRange().getMin());
  }

  @Test
  public void orIntersectsTime() throws Exception {
    final Expr host = new BinaryExpr(BinaryOp.EQ, new VarRef("host"),
        new StringLiteral("a"));
    final ConditionResolver.Result result = ConditionResolver.resolve(
        new BinaryExpr(BinaryOp.OR, new BinaryExpr(BinaryOp.GT,
            new VarRef("time"), new IntegerLiteral(10)), host), VALUER);
    assertEquals(host, result.getCondition());
    assertEquals(11, result.getTimeRange().getMin());
  }

  @Test
  public void parensKept() throws Exception {
    final Expr host = new BinaryExpr(BinaryOp.EQ, new VarRef("host"),
        new StringLiteral("a"));
    final Expr region = new ParenExpr(new BinaryExpr(BinaryOp.EQ,
        new VarRef("region"), new StringLiteral("b")));
    final ConditionResolver.Result result = ConditionResolver.resolve(
        and(host, region), VALUER);
    assertEquals(and(host, region), result.getCondition());

    // parens around time only
    assertNull(ConditionResolver.resolve(new ParenExpr(
        new BinaryExpr(BinaryOp.GT, new VarRef("time"),
            new IntegerLiteral(10))), VALUER).getCondition());
  }

  @Test
  public void trueRemoved() throws Exception {
    assertNull(ConditionResolver.resolve(BooleanLiteral.TRUE, VALUER)
        .getCondition());
  }

  @Test
  public void invalidOperator() throws Exception {
    try {
      ConditionResolver.resolve(new BinaryExpr(BinaryOp.NEQ,
          new VarRef("time"), new IntegerLiteral(10)), VALUER);
      fail("Expected QueryCompileException");
    } catch (QueryCompileException e) {
      assertEquals(Reason.CONDITION, e.getReason());
      assertEquals("invalid time comparison operator: !=", e.getMessage());
    }
  }

  @Test
  public void incompatibleOperand() throws Exception {
    try {
      ConditionResolver.resolve(new BinaryExpr(BinaryOp.GT,
          new VarRef("time"), new StringLiteral("yesterday")), VALUER);
      fail("Expected QueryCompileException");
    } catch (QueryCompileException e) {
      assertEquals(Reason.CONDITION, e.getReason());
      assertEquals("invalid operation: time and StringLiteral are not "
          + "compatible", e.getMessage());
    }
  }

  @Test
  public void invalidCondition() throws Exception {
    try {
      ConditionResolver.resolve(new VarRef("host"), VALUER);
      fail("Expected QueryCompileException");
    } catch (QueryCompileException e) {
      assertEquals(Reason.CONDITION, e.getReason());
    }
  }

  @Test
  public void resolvedRangeIsStable() throws Exception {
    final Expr host = new BinaryExpr(BinaryOp.EQ, new VarRef("host"),
        new StringLiteral("a"));
    final Expr condition = and(and(
        new BinaryExpr(BinaryOp.GT, new VarRef("time"),
            new BinaryExpr(BinaryOp.SUB, new Call("now"),
                new DurationLiteral(DateTime.HOUR))),
        host),
        new BinaryExpr(BinaryOp.LT, new VarRef("time"), new Call("now")));
    final ConditionResolver.Result first =
        ConditionResolver.resolve(condition, VALUER);
    assertEquals(host, first.getCondition());
    assertEquals(new TimeRange(NOW - DateTime.HOUR + 1, NOW - 1),
        first.getTimeRange());

    // feed the resolved pair back in
    final Expr rebuilt = and(and(first.getCondition(),
        new BinaryExpr(BinaryOp.GTE, new VarRef("time"),
            new IntegerLiteral(first.getTimeRange().getMin()))),
        new BinaryExpr(BinaryOp.LTE, new VarRef("time"),
            new IntegerLiteral(first.getTimeRange().getMax())));
    final ConditionResolver.Result second =
        ConditionResolver.resolve(rebuilt, VALUER);
    assertEquals(first.getCondition(), second.getCondition());
    assertEquals(first.getTimeRange(), second.getTimeRange());

    // and again with time literals
    final Expr literals = and(first.getCondition(), and(
        new BinaryExpr(BinaryOp.GTE, new VarRef("time"),
            new TimeLiteral(first.getTimeRange().getMin())),
        new BinaryExpr(BinaryOp.LTE, new VarRef("time"),
            new TimeLiteral(first.getTimeRange().getMax()))));
    final ConditionResolver.Result third =
        ConditionResolver.resolve(literals, VALUER);
    assertEquals(first.getCondition(), third.getCondition());
    assertEquals(first.getTimeRange(), third.getTimeRange());
  }

  @Test
  public void extremeBounds() throws Exception {
    assertOutOfRange(BinaryOp.GT, new IntegerLiteral(Long.MAX_VALUE),
        "overflows");
    assertOutOfRange(BinaryOp.GTE, new IntegerLiteral(Long.MAX_VALUE),
        "overflows");
    assertOutOfRange(BinaryOp.GT, new NumberLiteral(1e300), "overflows");
    assertOutOfRange(BinaryOp.GT, new NumberLiteral(
        Double.POSITIVE_INFINITY), "overflows");
    assertOutOfRange(BinaryOp.LT, new NumberLiteral(-1e300), "underflows");
    assertOutOfRange(BinaryOp.LT, new IntegerLiteral(Long.MIN_VALUE + 1),
        "underflows");
    assertOutOfRange(BinaryOp.LTE, new IntegerLiteral(Long.MIN_VALUE),
        "underflows");
    assertOutOfRange(BinaryOp.GT, new DurationLiteral(Long.MAX_VALUE),
        "overflows");
    assertOutOfRange(BinaryOp.EQ, new TimeLiteral(Long.MAX_VALUE),
        "overflows");

    try {
      ConditionResolver.resolve(new BinaryExpr(BinaryOp.GT,
          new VarRef("time"), new NumberLiteral(Double.NaN)), VALUER);
      fail("Expected QueryCompileException");
    } catch (QueryCompileException e) {
      assertEquals(Reason.CONDITION, e.getReason());
    }
  }

  @Test
  public void boundaryBoundsKept() throws Exception {
    // the last representable values still produce set bounds
    ConditionResolver.Result result = ConditionResolver.resolve(
        new BinaryExpr(BinaryOp.GT, new VarRef("time"),
            new IntegerLiteral(TimeRange.MAX_TIME)), VALUER);
    assertTrue(result.getTimeRange().hasMin());
    assertEquals(Long.MAX_VALUE, result.getTimeRange().getMin());

    result = ConditionResolver.resolve(
        new BinaryExpr(BinaryOp.LT, new VarRef("time"),
            new IntegerLiteral(TimeRange.MIN_TIME + 1)), VALUER);
    assertTrue(result.getTimeRange().hasMax());
    assertEquals(TimeRange.MIN_TIME, result.getTimeRange().getMax());
  }

  private static void assertOutOfRange(final BinaryOp op,
                                       final Expr value,
                                       final String message) {
    try {
      ConditionResolver.resolve(new BinaryExpr(op, new VarRef("time"),
          value), VALUER);
      fail("Expected QueryCompileException for " + op.symbol() + " "
          + value);
    } catch (QueryCompileException e) {
      assertEquals(Reason.CONDITION, e.getReason());
      assertTrue(e.getMessage(), e.getMessage().endsWith(message
          + " time literal"));
    }
  }

  private static Expr and(final Expr lhs, final Expr rhs) {
    return new BinaryExpr(BinaryOp.AND, lhs, rhs);
  }

  private static long nanos(final String iso) {
    return DateTime.toNanos(Instant.parse(iso));
  }
}
