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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;

import org.junit.Test;

import net.chronoql.exceptions.QueryCompileException;
import net.chronoql.exceptions.QueryCompileException.Reason;
import net.chronoql.query.Interval;
import net.chronoql.query.TimeRange;
import net.chronoql.query.ast.BinaryExpr;
import net.chronoql.query.ast.BinaryOp;
import net.chronoql.query.ast.Call;
import net.chronoql.query.ast.Distinct;
import net.chronoql.query.ast.DurationLiteral;
import net.chronoql.query.ast.Expr;
import net.chronoql.query.ast.Field;
import net.chronoql.query.ast.FillOption;
import net.chronoql.query.ast.IntegerLiteral;
import net.chronoql.query.ast.Measurement;
import net.chronoql.query.ast.RegexLiteral;
import net.chronoql.query.ast.SelectStatement;
import net.chronoql.query.ast.StringLiteral;
import net.chronoql.query.ast.Target;
import net.chronoql.query.ast.VarRef;
import net.chronoql.query.ast.Wildcard;
import net.chronoql.utils.DateTime;

public class TestQueryCompiler {
  private static final long NOW = DateTime.toNanos(
      Instant.parse("2024-01-15T12:00:17Z"));
  private static final CompileOptions OPTIONS = CompileOptions.newBuilder()
      .setNow(NOW)
      .build();

  @Test
  public void nullStatement() throws Exception {
    try {
      QueryCompiler.compile(null, OPTIONS);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void currentTimeWhenNoNow() throws Exception {
    final long before = DateTime.currentTimeNanos();
    final CompiledStatement compiled = (CompiledStatement)
        QueryCompiler.compile(select(new VarRef("value")).build());
    assertTrue(compiled.getOptions().hasNow());
    assertTrue(compiled.getOptions().getNow() >= before);

    final CompiledStatement unset = (CompiledStatement) QueryCompiler.compile(
        select(new VarRef("value")).build(),
        CompileOptions.newBuilder().build());
    assertTrue(unset.getOptions().hasNow());
  }

  @Test
  public void meanWithInterval() throws Exception {
    final CompiledStatement compiled = compile(
        select(mean())
          .setCondition(new BinaryExpr(BinaryOp.GT, new VarRef("time"),
              new BinaryExpr(BinaryOp.SUB, new Call("now"),
                  new DurationLiteral(DateTime.HOUR))))
          .addDimension(time(10 * DateTime.MINUTE))
          .build());
    assertEquals(new Interval(10 * DateTime.MINUTE, 0),
        compiled.getInterval());
    assertFalse(compiled.isOnlySelectors());
    assertEquals(1, compiled.getFunctionCalls().size());
    assertEquals(NOW - DateTime.HOUR + 1, compiled.getTimeRange().getMin());
    assertEquals(NOW, compiled.getTimeRange().getMax());
    assertNull(compiled.getCondition());
    assertNotNull(compiled.getStatement());
    assertNull(compiled.getStatement().getCondition());
  }

  @Test
  public void rawTimeRangeDefaults() throws Exception {
    final CompiledStatement compiled = compile(
        select(new VarRef("value")).build());
    assertEquals(TimeRange.MIN_TIME, compiled.getTimeRange().getMin());
    assertEquals(TimeRange.MAX_TIME, compiled.getTimeRange().getMax());
    assertTrue(compiled.getInterval().isZero());
    assertTrue(compiled.hasAuxiliaryFields());
    assertTrue(compiled.isAscending());
    assertEquals(FillOption.NULL, compiled.getFill());
  }

  @Test
  public void topLimitExceedsStatementLimit() throws Exception {
    assertFails(select(new Call("top", new VarRef("value"),
            new IntegerLiteral(3))).setLimit(2).build(),
        Reason.INVALID_ARGUMENT, "limit (3) in top function can not be "
            + "larger than the LIMIT (2) in the select statement");

    final CompiledStatement compiled = compile(select(new Call("top",
        new VarRef("value"), new IntegerLiteral(2))).setLimit(2).build());
    assertEquals("top", compiled.getTopBottomFunction());
  }

  @Test
  public void topWithTags() throws Exception {
    final CompiledStatement compiled = compile(select(new Call("bottom",
        new VarRef("value"), new VarRef("host"), new IntegerLiteral(3)))
        .build());
    assertEquals("bottom", compiled.getTopBottomFunction());
    assertEquals(2, compiled.getFields().size());
    assertEquals(new Field(new VarRef("host")),
        compiled.getFields().get(1).field());
    assertFalse(compiled.getFields().get(1).allowWildcard());
    assertTrue(compiled.isOnlySelectors());

    // no extra fields when writing into a target
    final CompiledStatement into = compile(select(new Call("top",
        new VarRef("value"), new VarRef("host"), new IntegerLiteral(3)))
        .setTarget(new Target(
            Measurement.of("top_cpu")))
        .build());
    assertEquals(1, into.getFields().size());
    assertTrue(into.hasTarget());
  }

  @Test
  public void topErrors() throws Exception {
    assertFails(select(new Call("top", new VarRef("value"))).build(),
        Reason.INVALID_ARGUMENT,
        "invalid number of arguments for top, expected at least 2, got 1");
    assertFails(select(new Call("top", new VarRef("value"),
            new StringLiteral("3"))).build(),
        Reason.INVALID_ARGUMENT,
        "expected integer as last argument in top(), found '3'");
    assertFails(select(new Call("top", new VarRef("value"),
            new IntegerLiteral(0))).build(),
        Reason.INVALID_ARGUMENT, "limit (0) in top function must be at least 1");
    assertFails(select(new Call("top", mean(), new IntegerLiteral(1)))
            .build(),
        Reason.INVALID_ARGUMENT,
        "expected first argument to be a field in top(), found mean(value)");
    assertFails(select(new Call("top", new VarRef("value"),
            new StringLiteral("host"), new IntegerLiteral(1))).build(),
        Reason.INVALID_ARGUMENT,
        "only fields or tags are allowed in top(), found 'host'");
    assertFails(select(new Call("top", new VarRef("value"),
            new IntegerLiteral(1)), new Call("max", new VarRef("value")))
            .build(),
        Reason.SELECTOR_CONFLICT,
        "selector function top() cannot be combined with other functions");
    assertFails(select(new Call("top", new VarRef("value"),
            new IntegerLiteral(1)), new Call("bottom", new VarRef("value"),
            new IntegerLiteral(1))).build(),
        Reason.SELECTOR_CONFLICT,
        "selector function top() cannot be combined with other functions");
  }

  @Test
  public void derivative() throws Exception {
    CompiledStatement compiled = compile(select(new Call("derivative",
        new VarRef("value"))).build());
    assertFalse(compiled.isOnlySelectors());

    compiled = compile(select(new Call("derivative", mean(),
        new DurationLiteral(DateTime.SECOND)))
        .addDimension(time(DateTime.MINUTE))
        .build());
    assertEquals(2, compiled.getFunctionCalls().size());

    assertFails(select(new Call("derivative", mean())).build(),
        Reason.MISSING_AGGREGATE,
        "derivative aggregate requires a GROUP BY interval");
    assertFails(select(new Call("derivative", new VarRef("value")))
            .addDimension(time(DateTime.MINUTE)).build(),
        Reason.MISSING_AGGREGATE,
        "aggregate function required inside the call to derivative");
    assertFails(select(new Call("derivative", new VarRef("value"),
            new StringLiteral("1s"))).build(),
        Reason.INVALID_ARGUMENT,
        "second argument to derivative must be a duration, got StringLiteral");
    assertFails(select(new Call("non_negative_derivative",
            new VarRef("value"), new DurationLiteral(-DateTime.SECOND)))
            .build(),
        Reason.INVALID_ARGUMENT, "duration argument must be positive, got -1s");
    assertFails(select(new Call("elapsed")).build(),
        Reason.INVALID_ARGUMENT, "invalid number of arguments for elapsed, "
            + "expected at least 1 but no more than 2, got 0");
  }

  @Test
  public void transforms() throws Exception {
    compile(select(new Call("difference", new VarRef("value"))).build());
    compile(select(new Call("cumulative_sum", new Call("max",
        new VarRef("value")))).addDimension(time(DateTime.MINUTE)).build());
    compile(select(new Call("moving_average", new VarRef("value"),
        new IntegerLiteral(3))).build());

    assertFails(select(new Call("moving_average", new VarRef("value"),
            new IntegerLiteral(1))).build(),
        Reason.INVALID_ARGUMENT,
        "moving_average window must be greater than 1, got 1");
    assertFails(select(new Call("moving_average", new VarRef("value"),
            new DurationLiteral(DateTime.SECOND))).build(),
        Reason.INVALID_ARGUMENT, "second argument for moving_average must be "
            + "an integer, got DurationLiteral");
    assertFails(select(new Call("difference", new VarRef("value"),
            new IntegerLiteral(1))).build(),
        Reason.INVALID_ARGUMENT,
        "invalid number of arguments for difference, expected 1, got 2");
  }

  @Test
  public void auxiliaryWithAggregate() throws Exception {
    assertFails(select(mean(), new VarRef("host"))
            .addDimension(time(DateTime.MINUTE)).build(),
        Reason.MIXED_AGGREGATE,
        "mixing aggregate and non-aggregate queries is not supported");
    assertFails(select(new Call("max", new VarRef("value")),
            new Call("min", new VarRef("value")), new VarRef("host")).build(),
        Reason.MIXED_AGGREGATE, "mixing multiple selector functions with "
            + "tags or fields is not supported");

    final CompiledStatement compiled = compile(select(
        new Call("max", new VarRef("value")), new VarRef("host")).build());
    assertTrue(compiled.isOnlySelectors());
    assertTrue(compiled.hasAuxiliaryFields());
  }

  @Test
  public void selectorsKeepOnlySelectors() throws Exception {
    for (final String name : new String[] { "max", "min", "first", "last" }) {
      assertTrue(name, compile(select(new Call(name, new VarRef("value")))
          .build()).isOnlySelectors());
    }
    assertTrue(compile(select(new Call("percentile", new VarRef("value"),
        new IntegerLiteral(90))).build()).isOnlySelectors());
    assertTrue(compile(select(new Call("sample", new VarRef("value"),
        new IntegerLiteral(2))).build()).isOnlySelectors());
    for (final String name : new String[] { "count", "sum", "mean", "median",
        "mode", "stddev", "spread", "integral" }) {
      assertFalse(name, compile(select(new Call(name, new VarRef("value")))
          .build()).isOnlySelectors());
    }
  }

  @Test
  public void aggregateErrors() throws Exception {
    assertFails(select(new Call("mean", new VarRef("value"),
            new IntegerLiteral(1))).build(),
        Reason.INVALID_ARGUMENT,
        "invalid number of arguments for mean, expected 1, got 2");
    assertFails(select(new Call("sum", new StringLiteral("value"))).build(),
        Reason.INVALID_ARGUMENT, "expected field argument in sum()");
    assertFails(select(new Call("percentile", new VarRef("value"),
            new StringLiteral("90"))).build(),
        Reason.INVALID_ARGUMENT, "expected float argument in percentile()");
    assertFails(select(new Call("sample", new VarRef("value"),
            new IntegerLiteral(0))).build(),
        Reason.INVALID_ARGUMENT, "sample window must be greater than 1, got 0");
    assertFails(select(new Call("integral", new VarRef("value"),
            new IntegerLiteral(1))).build(),
        Reason.INVALID_ARGUMENT, "second argument must be a duration");
    assertFails(select(new Call("foo", new VarRef("value"))).build(),
        Reason.UNDEFINED_FUNCTION, "undefined function foo()");
  }

  @Test
  public void holtWinters() throws Exception {
    compile(select(new Call("holt_winters", mean(), new IntegerLiteral(10),
        new IntegerLiteral(4))).addDimension(time(DateTime.HOUR)).build());

    assertFails(select(new Call("holt_winters", new VarRef("value"),
            new IntegerLiteral(10), new IntegerLiteral(4))).build(),
        Reason.MISSING_AGGREGATE, "must use aggregate function with "
            + "holt_winters");
    assertFails(select(new Call("holt_winters_with_fit", mean(),
            new IntegerLiteral(10), new IntegerLiteral(4))).build(),
        Reason.MISSING_AGGREGATE,
        "holt_winters_with_fit aggregate requires a GROUP BY interval");
    assertFails(select(new Call("holt_winters", mean(),
            new IntegerLiteral(0), new IntegerLiteral(4))).build(),
        Reason.INVALID_ARGUMENT,
        "second arg to holt_winters must be greater than 0, got 0");
    assertFails(select(new Call("holt_winters", mean(),
            new IntegerLiteral(10), new IntegerLiteral(-1))).build(),
        Reason.INVALID_ARGUMENT,
        "third arg to holt_winters cannot be negative, got -1");
  }

  @Test
  public void distinct() throws Exception {
    CompiledStatement compiled = compile(select(new Distinct("host"))
        .build());
    assertTrue(compiled.hasDistinct());
    assertFalse(compiled.isOnlySelectors());
    assertEquals(new Call("distinct", new VarRef("host")),
        compiled.getStatement().getFields().get(0).getExpr());

    compiled = compile(select(new Call("count",
        new Call("distinct", new VarRef("host")))).build());
    assertTrue(compiled.hasDistinct());

    assertFails(select(new Call("distinct", new VarRef("host")),
            new Call("max", new VarRef("value"))).build(),
        Reason.DISTINCT_CONFLICT, "aggregate function distinct() cannot be "
            + "combined with other functions or fields");
    assertFails(select(new Call("distinct", new VarRef("host")),
            new VarRef("value")).build(),
        Reason.DISTINCT_CONFLICT, "aggregate function distinct() cannot be "
            + "combined with other functions or fields");
    assertFails(select(new Call("distinct")).build(),
        Reason.INVALID_ARGUMENT,
        "distinct function requires at least one argument");
    assertFails(select(new Call("distinct", new Wildcard())).build(),
        Reason.INVALID_ARGUMENT, "expected field argument in distinct()");
  }

  @Test
  public void wildcards() throws Exception {
    CompiledStatement compiled = compile(select(new Wildcard()).build());
    assertTrue(compiled.hasAuxiliaryFields());

    compiled = compile(select(new Call("mean", new Wildcard())).build());
    assertFalse(compiled.isOnlySelectors());
    compiled = compile(select(new Call("max",
        new RegexLiteral("^cpu"))).build());
    assertFalse(compiled.isOnlySelectors());

    assertFails(select(new BinaryExpr(BinaryOp.ADD, new Wildcard(),
            new IntegerLiteral(1))).build(),
        Reason.INVALID_EXPRESSION,
        "unable to use wildcard in a binary expression");
    assertFails(select(new BinaryExpr(BinaryOp.ADD,
            new Call("mean", new Wildcard()), new IntegerLiteral(1))).build(),
        Reason.INVALID_ARGUMENT, "unsupported expression with wildcard: mean()");
    assertFails(select(new BinaryExpr(BinaryOp.MUL,
            new Call("max", new RegexLiteral("^a")), new VarRef("b"))).build(),
        Reason.INVALID_ARGUMENT,
        "unsupported expression with regex field: max()");
  }

  @Test
  public void binaryExpressions() throws Exception {
    final CompiledStatement compiled = compile(select(
        new BinaryExpr(BinaryOp.MUL, new VarRef("value"),
            new IntegerLiteral(2))).build());
    assertTrue(compiled.hasAuxiliaryFields());

    assertFails(select(new BinaryExpr(BinaryOp.ADD, new IntegerLiteral(1),
            new IntegerLiteral(2))).build(),
        Reason.INVALID_EXPRESSION,
        "cannot perform a binary expression on two literals");
    assertFails(select(new IntegerLiteral(1)).build(),
        Reason.UNIMPLEMENTED_EXPRESSION, "unimplemented expression: 1");
  }

  @Test
  public void timeField() throws Exception {
    assertFails(select(new VarRef("time")).build(),
        Reason.EMPTY_FIELD_LIST, "at least 1 non-time field must be queried");

    final CompiledStatement compiled = compile(SelectStatement.newBuilder()
        .addField(new Field(new VarRef("time"), "ts"))
        .addField(new VarRef("value"))
        .addSource(Measurement.of("cpu"))
        .build());
    assertEquals("ts", compiled.getTimeFieldName());
    assertEquals(1, compiled.getFields().size());
    assertEquals("ts", compiled.getStatement().getTimeAlias());
    assertEquals(1, compiled.getStatement().getFields().size());
  }

  @Test
  public void fill() throws Exception {
    assertFails(select(new VarRef("value")).setFill(FillOption.NONE).build(),
        Reason.ILLEGAL_FILL, "fill(none) must be used with a function");
    assertFails(select(new VarRef("value")).setFill(FillOption.LINEAR)
            .build(),
        Reason.ILLEGAL_FILL, "fill(linear) must be used with a function");
    final CompiledStatement compiled = compile(select(mean())
        .addDimension(time(DateTime.MINUTE))
        .setFill(FillOption.PREVIOUS).build());
    assertEquals(FillOption.PREVIOUS, compiled.getFill());
  }

  @Test
  public void groupByWithoutAggregate() throws Exception {
    assertFails(select(new VarRef("value"))
            .addDimension(time(DateTime.MINUTE)).build(),
        Reason.MISSING_AGGREGATE,
        "GROUP BY requires at least one aggregate function");
  }

  @Test
  public void dimensions() throws Exception {
    CompiledStatement compiled = compile(select(mean())
        .addDimension(new VarRef("host"))
        .addDimension(time(5 * DateTime.MINUTE))
        .addDimension(new RegexLiteral("^r"))
        .build());
    assertEquals(new Interval(5 * DateTime.MINUTE, 0), compiled.getInterval());

    compiled = compile(select(mean())
        .addDimension(new Call("time", new DurationLiteral(DateTime.MINUTE),
            new DurationLiteral(30 * DateTime.SECOND)))
        .build());
    assertEquals(30 * DateTime.SECOND, compiled.getInterval().getOffset());

    // negative offsets wrap
    compiled = compile(select(mean())
        .addDimension(new Call("time",
            new DurationLiteral(10 * DateTime.MINUTE),
            new DurationLiteral(-DateTime.MINUTE)))
        .build());
    assertEquals(9 * DateTime.MINUTE, compiled.getInterval().getOffset());

    compiled = compile(select(mean())
        .addDimension(new Call("time", new DurationLiteral(DateTime.MINUTE),
            new Call("now")))
        .build());
    assertEquals(17 * DateTime.SECOND, compiled.getInterval().getOffset());

    compiled = compile(select(mean())
        .addDimension(new Call("time", new DurationLiteral(DateTime.HOUR),
            new StringLiteral("2024-01-01T00:15:00Z")))
        .build());
    assertEquals(15 * DateTime.MINUTE, compiled.getInterval().getOffset());
  }

  @Test
  public void dimensionErrors() throws Exception {
    assertFails(select(mean()).addDimension(new VarRef("time")).build(),
        Reason.UNSUPPORTED_DIMENSION,
        "time() is a function and expects at least one argument");
    assertFails(select(mean()).addDimension(new Call("floor",
            new VarRef("x"))).build(),
        Reason.UNSUPPORTED_DIMENSION, "only time() calls allowed in dimensions");
    assertFails(select(mean()).addDimension(new IntegerLiteral(1)).build(),
        Reason.UNSUPPORTED_DIMENSION, "only time and tag dimensions allowed");
    assertFails(select(mean()).addDimension(new Call("time")).build(),
        Reason.INVALID_ARGUMENT, "time dimension expected 1 or 2 arguments");
    assertFails(select(mean()).addDimension(new Call("time",
            new VarRef("x"))).build(),
        Reason.INVALID_ARGUMENT, "time dimension must have duration argument");
    assertFails(select(mean()).addDimension(time(0)).build(),
        Reason.INVALID_ARGUMENT,
        "time dimension must have a positive duration, got 0s");
    assertFails(select(mean())
            .addDimension(time(DateTime.MINUTE))
            .addDimension(time(5 * DateTime.MINUTE)).build(),
        Reason.MULTIPLE_INTERVAL, "multiple time dimensions not allowed");
    assertFails(select(mean()).addDimension(new Call("time",
            new DurationLiteral(DateTime.MINUTE), new StringLiteral("x")))
            .build(),
        Reason.INVALID_ARGUMENT,
        "time dimension offset must be duration or now(), got StringLiteral");
    assertFails(select(mean()).addDimension(new Call("time",
            new DurationLiteral(DateTime.MINUTE), new Call("today")))
            .build(),
        Reason.INVALID_ARGUMENT, "time dimension offset function must be now()");
    assertFails(select(mean()).addDimension(new Call("time",
            new DurationLiteral(DateTime.MINUTE),
            new Call("now", new IntegerLiteral(1)))).build(),
        Reason.INVALID_ARGUMENT,
        "time dimension offset now() function requires no arguments");
  }

  @Test
  public void regexConditionRewritten() throws Exception {
    final CompiledStatement compiled = compile(select(new VarRef("value"))
        .setCondition(new BinaryExpr(BinaryOp.EQREGEX, new VarRef("host"),
            new RegexLiteral("^server01$")))
        .build());
    assertEquals(new BinaryExpr(BinaryOp.EQ, new VarRef("host"),
        new StringLiteral("server01")), compiled.getStatement().getCondition());
    // the resolved condition keeps the regex
    assertEquals(new BinaryExpr(BinaryOp.EQREGEX, new VarRef("host"),
        new RegexLiteral("^server01$")), compiled.getCondition());
  }

  @Test
  public void invalidCondition() throws Exception {
    assertFails(select(new VarRef("value"))
            .setCondition(new BinaryExpr(BinaryOp.NEQ, new VarRef("time"),
                new IntegerLiteral(1))).build(),
        Reason.CONDITION, "invalid time comparison operator: !=");
  }

  static SelectStatement.Builder select(final Expr... fields) {
    final SelectStatement.Builder builder = SelectStatement.newBuilder()
        .addSource(Measurement.of("cpu"));
    for (final Expr field : fields) {
      builder.addField(field);
    }
    return builder;
  }

  static Call mean() {
    return new Call("mean", new VarRef("value"));
  }

  static Call time(final long duration) {
    return new Call("time", new DurationLiteral(duration));
  }

  static CompiledStatement compile(final SelectStatement stmt) {
    return (CompiledStatement) QueryCompiler.compile(stmt, OPTIONS);
  }

  static void assertFails(final SelectStatement stmt,
                          final Reason reason,
                          final String message) {
    try {
      compile(stmt);
      fail("Expected QueryCompileException");
    } catch (QueryCompileException e) {
      assertEquals(reason, e.getReason());
      assertEquals(message, e.getMessage());
    }
  }
}
