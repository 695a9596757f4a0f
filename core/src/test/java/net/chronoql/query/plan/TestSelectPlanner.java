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
package net.chronoql.query.plan;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.Map;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import net.chronoql.exceptions.BucketLimitExceededException;
import net.chronoql.exceptions.QueryCompileException;
import net.chronoql.exceptions.QueryExecutionException;
import net.chronoql.query.Interval;
import net.chronoql.query.TimeRange;
import net.chronoql.query.ast.BinaryExpr;
import net.chronoql.query.ast.BinaryOp;
import net.chronoql.query.ast.Call;
import net.chronoql.query.ast.DataType;
import net.chronoql.query.ast.DurationLiteral;
import net.chronoql.query.ast.Expr;
import net.chronoql.query.ast.FillOption;
import net.chronoql.query.ast.Measurement;
import net.chronoql.query.ast.SelectStatement;
import net.chronoql.query.ast.SortField;
import net.chronoql.query.ast.StringLiteral;
import net.chronoql.query.ast.Target;
import net.chronoql.query.ast.VarRef;
import net.chronoql.query.ast.Wildcard;
import net.chronoql.query.ast.Wildcard.WildcardType;
import net.chronoql.query.compile.CompileOptions;
import net.chronoql.query.compile.CompiledStatement;
import net.chronoql.query.compile.QueryCompiler;
import net.chronoql.query.compile.Statement;
import net.chronoql.utils.DateTime;
import net.chronoql.utils.Pair;

public class TestSelectPlanner {
  private static final long MINUTE = DateTime.MINUTE;
  private static final long NOW = DateTime.toNanos(
      Instant.parse("2024-01-15T12:00:00Z"));
  private static final CompileOptions OPTIONS = CompileOptions.newBuilder()
      .setNow(NOW)
      .build();
  private static final SelectOptions BUDGET = SelectOptions.newBuilder()
      .setMaxBuckets(100)
      .build();

  private ShardMapper mapper;
  private ShardGroup shards;

  @Before
  public void before() throws Exception {
    mapper = mock(ShardMapper.class);
    shards = mock(ShardGroup.class);
    when(mapper.mapShards(anyList(), any(TimeRange.class),
        any(SelectOptions.class))).thenReturn(shards);
    when(shards.mapType(any(Measurement.class), anyString()))
        .thenAnswer(invocation -> {
          final String name = invocation.getArgument(1);
          return "host".equals(name) ? DataType.TAG : DataType.FLOAT;
        });
    final Map<String, DataType> fields = ImmutableMap.of(
        "value", DataType.FLOAT);
    final Set<String> tags = ImmutableSet.of("host");
    when(shards.fieldDimensions(any(Measurement.class))).thenReturn(
        new Pair<Map<String, DataType>, Set<String>>(fields, tags));
  }

  @Test
  public void ctor() throws Exception {
    try {
      new SelectPlanner(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void nullArguments() throws Exception {
    final Statement statement = compile(grouped(null).build());
    try {
      statement.prepare(null, BUDGET);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      statement.prepare(mapper, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    verify(mapper, never()).mapShards(anyList(), any(TimeRange.class),
        any(SelectOptions.class));
  }

  @Test
  public void narrowsShardRangeWithoutLowerBound() throws Exception {
    final PreparedStatement prepared = compile(grouped(null).build())
        .prepare(mapper, BUDGET);

    final ArgumentCaptor<TimeRange> range =
        ArgumentCaptor.forClass(TimeRange.class);
    verify(mapper, times(1)).mapShards(anyList(), range.capture(),
        any(SelectOptions.class));
    // the latest 100 windows of 10 minutes
    assertEquals(NOW - 1000 * MINUTE, range.getValue().getMin());
    assertEquals(NOW, range.getValue().getMax());

    // the statement keeps its range
    assertEquals(TimeRange.MIN_TIME,
        prepared.getIteratorOptions().getStartTime());
    assertEquals(NOW, prepared.getIteratorOptions().getEndTime());
    assertSame(shards, prepared.getShardGroup());
    verify(shards, never()).close();
  }

  @Test
  public void noNarrowingWithoutBudget() throws Exception {
    compile(grouped(null).build()).prepare(mapper,
        SelectOptions.newBuilder().build());
    final ArgumentCaptor<TimeRange> range =
        ArgumentCaptor.forClass(TimeRange.class);
    verify(mapper).mapShards(anyList(), range.capture(),
        any(SelectOptions.class));
    assertEquals(new TimeRange(TimeRange.MIN_TIME, NOW), range.getValue());
  }

  @Test
  public void noNarrowingForRawQueries() throws Exception {
    compile(SelectStatement.newBuilder()
        .addField(new VarRef("value"))
        .addSource(Measurement.of("cpu"))
        .build()).prepare(mapper, BUDGET);
    final ArgumentCaptor<TimeRange> range =
        ArgumentCaptor.forClass(TimeRange.class);
    verify(mapper).mapShards(anyList(), range.capture(),
        any(SelectOptions.class));
    assertEquals(new TimeRange(TimeRange.MIN_TIME, TimeRange.MAX_TIME),
        range.getValue());
  }

  @Test
  public void explicitLowerBoundOverBudget() throws Exception {
    final Statement statement = compile(grouped(since(2000 * MINUTE))
        .build());
    try {
      statement.prepare(mapper, BUDGET);
      fail("Expected BucketLimitExceededException");
    } catch (BucketLimitExceededException e) {
      assertEquals(200, e.getBuckets());
      assertEquals(100, e.getLimit());
      assertEquals(400, e.getStatusCode());
      assertEquals("max-select-buckets limit exceeded: (200/100)",
          e.getMessage());
    }
    verify(shards, times(1)).close();
  }

  @Test
  public void explicitLowerBoundWithinBudget() throws Exception {
    final PreparedStatement prepared = compile(grouped(since(500 * MINUTE))
        .build()).prepare(mapper, BUDGET);
    final ArgumentCaptor<TimeRange> range =
        ArgumentCaptor.forClass(TimeRange.class);
    verify(mapper).mapShards(anyList(), range.capture(),
        any(SelectOptions.class));
    assertEquals(NOW - 500 * MINUTE, range.getValue().getMin());
    assertEquals(NOW - 500 * MINUTE,
        prepared.getIteratorOptions().getStartTime());
    verify(shards, never()).close();
  }

  @Test
  public void closeFailureSuppressed() throws Exception {
    final IOException close = new IOException("Boom!");
    doThrow(close).when(shards).close();
    try {
      compile(grouped(since(2000 * MINUTE)).build()).prepare(mapper, BUDGET);
      fail("Expected BucketLimitExceededException");
    } catch (BucketLimitExceededException e) {
      assertEquals(1, e.getSuppressed().length);
      assertSame(close, e.getSuppressed()[0]);
    }
  }

  @Test
  public void rewriteFailureClosesShards() throws Exception {
    final Statement statement = compile(SelectStatement.newBuilder()
        .addField(new Call("mean", new Wildcard(WildcardType.TAG)))
        .addSource(Measurement.of("cpu"))
        .build());
    try {
      statement.prepare(mapper, BUDGET);
      fail("Expected QueryCompileException");
    } catch (QueryCompileException e) {
      assertEquals("unable to use tag wildcard in mean()", e.getMessage());
    }
    verify(shards, times(1)).close();
  }

  @Test
  public void mapperFailurePropagates() throws Exception {
    final QueryExecutionException failure =
        new QueryExecutionException("No shards", 500);
    when(mapper.mapShards(anyList(), any(TimeRange.class),
        any(SelectOptions.class))).thenThrow(failure);
    try {
      compile(grouped(null).build()).prepare(mapper, BUDGET);
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertSame(failure, e);
    }
    verify(shards, never()).close();
  }

  @Test
  public void narrowingHonoursLocation() throws Exception {
    compile(SelectStatement.newBuilder()
        .addField(new Call("mean", new VarRef("value")))
        .addSource(Measurement.of("cpu"))
        .addDimension(new Call("time", new DurationLiteral(DateTime.DAY)))
        .setLocation(ZoneId.of("Asia/Tokyo"))
        .build()).prepare(mapper, SelectOptions.newBuilder()
            .setMaxBuckets(10)
            .build());
    final ArgumentCaptor<TimeRange> range =
        ArgumentCaptor.forClass(TimeRange.class);
    verify(mapper).mapShards(anyList(), range.capture(),
        any(SelectOptions.class));
    // the latest local day starts at 15:00 UTC the day before
    assertEquals(DateTime.toNanos(Instant.parse("2024-01-05T15:00:00Z")),
        range.getValue().getMin());
    assertEquals(NOW, range.getValue().getMax());
  }

  @Test
  public void errorClosesShards() throws Exception {
    final StackOverflowError error = new StackOverflowError();
    when(shards.fieldDimensions(any(Measurement.class))).thenThrow(error);
    final IOException close = new IOException("Boom!");
    doThrow(close).when(shards).close();
    try {
      compile(SelectStatement.newBuilder()
          .addField(new Wildcard())
          .addSource(Measurement.of("cpu"))
          .build()).prepare(mapper, BUDGET);
      fail("Expected StackOverflowError");
    } catch (StackOverflowError e) {
      assertSame(error, e);
      assertSame(close, e.getSuppressed()[0]);
    }
    verify(shards, times(1)).close();
  }

  @Test
  public void preparedOwnsShards() throws Exception {
    final PreparedStatement prepared = compile(grouped(null).build())
        .prepare(mapper, BUDGET);
    verify(shards, never()).close();
    prepared.close();
    verify(shards, times(1)).close();
  }

  @Test
  public void iteratorOptions() throws Exception {
    final SelectOptions options = SelectOptions.newBuilder()
        .setMaxSeries(10)
        .setMaxPoints(1000)
        .setDedupe(true)
        .build();
    final Expr host = new BinaryExpr(BinaryOp.EQ, new VarRef("host"),
        new StringLiteral("a"));
    final PreparedStatement prepared = compile(grouped(host)
        .addDimension(new VarRef("host"))
        .setFill(FillOption.NUMBER)
        .setFillValue(0L)
        .setLimit(5)
        .setOffset(1)
        .setSeriesLimit(2)
        .addSortField(new SortField("time", false))
        .build()).prepare(mapper, options);

    final IteratorOptions iterator = prepared.getIteratorOptions();
    assertEquals(new Interval(10 * MINUTE, 0), iterator.getInterval());
    assertEquals(Arrays.asList("host"), iterator.getDimensions());
    assertEquals(new BinaryExpr(BinaryOp.EQ, new VarRef("host", DataType.TAG),
        new StringLiteral("a")), iterator.getCondition());
    assertEquals(FillOption.NUMBER, iterator.getFill());
    assertEquals(0L, iterator.getFillValue());
    assertEquals(5, iterator.getLimit());
    assertEquals(1, iterator.getOffset());
    assertEquals(2, iterator.getSeriesLimit());
    assertEquals(10, iterator.getMaxSeries());
    assertEquals(1000, iterator.getMaxPoints());
    assertTrue(iterator.isDedupe());
    assertTrue(iterator.isOrdered());
    assertFalse(iterator.isAscending());
    assertNull(iterator.getLocation());

    assertEquals(Arrays.asList("time", "mean"), prepared.getColumnNames());
    assertEquals("SELECT mean(value::float) FROM cpu WHERE host::tag = 'a' "
        + "GROUP BY time(10m), host fill(0) ORDER BY time DESC LIMIT 5 "
        + "OFFSET 1 SLIMIT 2", prepared.getStatement().toString());
  }

  @Test
  public void targetDropsNullFill() throws Exception {
    final PreparedStatement prepared = compile(grouped(null)
        .setTarget(new Target(Measurement.of("cpu_10m")))
        .build()).prepare(mapper, BUDGET);
    assertEquals(FillOption.NONE, prepared.getIteratorOptions().getFill());
  }

  @Test
  public void wildcardsExpandedAgainstShards() throws Exception {
    final PreparedStatement prepared = compile(SelectStatement.newBuilder()
        .addField(new Wildcard())
        .addSource(Measurement.of("cpu"))
        .build()).prepare(mapper, BUDGET);
    assertEquals(Arrays.asList("time", "host", "value"),
        prepared.getColumnNames());
    assertTrue(prepared.getIteratorOptions().getInterval().isZero());
  }

  @Test
  public void window() throws Exception {
    final PreparedStatement prepared = compile(grouped(null).build())
        .prepare(mapper, BUDGET);
    final long ts = NOW + 3 * MINUTE;
    final long[] window = prepared.getIteratorOptions().window(ts);
    assertEquals(NOW, window[0]);
    assertEquals(NOW + 10 * MINUTE, window[1]);

    final IteratorOptions raw = IteratorOptions.newBuilder()
        .setStartTime(10)
        .setEndTime(20)
        .build();
    assertEquals(10, raw.window(15)[0]);
    assertEquals(21, raw.window(15)[1]);
  }

  /** SELECT mean(value) FROM cpu [WHERE ...] GROUP BY time(10m) */
  private static SelectStatement.Builder grouped(final Expr condition) {
    return SelectStatement.newBuilder()
        .addField(new Call("mean", new VarRef("value")))
        .addSource(Measurement.of("cpu"))
        .setCondition(condition)
        .addDimension(new Call("time", new DurationLiteral(10 * MINUTE)));
  }

  private static Expr since(final long duration) {
    return new BinaryExpr(BinaryOp.GTE, new VarRef("time"),
        new BinaryExpr(BinaryOp.SUB, new Call("now"),
            new DurationLiteral(duration)));
  }

  private static Statement compile(final SelectStatement stmt) {
    final Statement statement = QueryCompiler.compile(stmt, OPTIONS);
    assertTrue(statement instanceof CompiledStatement);
    return statement;
  }
}
