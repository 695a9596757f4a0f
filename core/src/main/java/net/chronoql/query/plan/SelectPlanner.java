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

import java.io.IOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.math.LongMath;

import net.chronoql.exceptions.BucketLimitExceededException;
import net.chronoql.query.Interval;
import net.chronoql.query.TimeRange;
import net.chronoql.query.ast.Dimension;
import net.chronoql.query.ast.FillOption;
import net.chronoql.query.ast.SelectStatement;
import net.chronoql.query.ast.VarRef;
import net.chronoql.query.compile.CompiledStatement;
import net.chronoql.query.condition.ConditionResolver;
import net.chronoql.query.condition.NowValuer;
import net.chronoql.query.rewrite.ColumnNames;
import net.chronoql.query.rewrite.FieldRewriter;

/**
 * Plans a compiled statement against the shards: maps the shards, expands
 * wildcards against their schema, builds the iterator options and enforces
 * the bucket budget.
 * <p>
 * The budget is applied twice. Without an explicit lower time bound the
 * range used to map shards is narrowed to the most recent windows that fit
 * in the budget. That only limits which shards are read, the statement
 * keeps its range. With an explicit lower bound the window count of the
 * real range is checked after mapping and the statement rejected if it is
 * over budget.
 * <p>
 * The shard handle is closed on every failure after it was acquired and
 * handed to the {@link PreparedStatement} on success.
 *
 * @since 1.0
 */
public class SelectPlanner {
  private static final Logger LOG = LoggerFactory.getLogger(
      SelectPlanner.class);

  /** The statement to plan. */
  private final CompiledStatement compiled;

  /**
   * Default ctor.
   * @param compiled A non-null compiled statement.
   */
  public SelectPlanner(final CompiledStatement compiled) {
    if (compiled == null || compiled.getStatement() == null) {
      throw new IllegalArgumentException("Compiled statement cannot be "
          + "null.");
    }
    this.compiled = compiled;
  }

  /**
   * Plans the statement.
   * @param mapper A non-null shard mapper.
   * @param options Non-null select options.
   * @return The prepared statement owning the shard handle.
   * @throws BucketLimitExceededException if the statement spans more
   * windows than the budget allows.
   * @throws net.chronoql.exceptions.QueryCompileException if a wildcard
   * can't be expanded.
   */
  public PreparedStatement prepare(final ShardMapper mapper,
                                   final SelectOptions options) {
    if (mapper == null) {
      throw new IllegalArgumentException("Shard mapper cannot be null.");
    }
    if (options == null) {
      throw new IllegalArgumentException("Options cannot be null.");
    }
    final SelectStatement stmt = compiled.getStatement();
    final TimeRange shard_range = shardRange(stmt, options);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Mapping shards for " + stmt.getSources() + " over "
          + shard_range);
    }

    final ShardGroup shards = mapper.mapShards(stmt.getSources(),
        shard_range, options);
    try {
      final SelectStatement rewritten = FieldRewriter.rewrite(stmt, shards);
      final IteratorOptions iterator_options =
          iteratorOptions(rewritten, options).toBuilder()
            .setStartTime(compiled.getTimeRange().minTime())
            .setEndTime(compiled.getTimeRange().maxTime())
            .setAscending(compiled.isAscending())
            .build();
      checkBuckets(rewritten, iterator_options, options);
      final List<String> columns = ColumnNames.of(rewritten);
      return new PreparedStatement(rewritten, iterator_options, shards,
          columns);
    } catch (RuntimeException | Error e) {
      release(shards, e);
      throw e;
    }
  }

  /**
   * Narrows the lower bound of the shard range to the windows that fit in
   * the budget if the statement doesn't have one.
   */
  private TimeRange shardRange(final SelectStatement stmt,
                               final SelectOptions options) {
    final TimeRange range = compiled.getTimeRange();
    final Interval interval = compiled.getInterval();
    if (options.getMaxBuckets() <= 0 || stmt.isRawQuery() ||
        range.minTime() != TimeRange.MIN_TIME || interval.isZero()) {
      return range;
    }

    final long duration = interval.getDuration();
    final long last = interval.window(range.maxTime() - 1,
        stmt.getLocation())[0];
    final long windows = LongMath.saturatedSubtract(last,
        TimeRange.MIN_TIME) / duration;
    if (windows <= options.getMaxBuckets()) {
      return range;
    }
    final long min = LongMath.saturatedSubtract(last,
        LongMath.saturatedMultiply(duration, options.getMaxBuckets() - 1));
    if (LOG.isDebugEnabled()) {
      LOG.debug("Narrowed the shard range lower bound to " + min
          + " for a budget of " + options.getMaxBuckets() + " buckets");
    }
    return range.withMin(min);
  }

  /** Rejects statements with an explicit lower bound over the budget. */
  private void checkBuckets(final SelectStatement stmt,
                            final IteratorOptions iterator_options,
                            final SelectOptions options) {
    if (options.getMaxBuckets() <= 0 || stmt.isRawQuery() ||
        compiled.getTimeRange().minTime() <= TimeRange.MIN_TIME ||
        iterator_options.getInterval().isZero()) {
      return;
    }
    final long duration = iterator_options.getInterval().getDuration();
    final long first = iterator_options.window(
        iterator_options.getStartTime())[0];
    final long last = iterator_options.window(
        iterator_options.getEndTime() - 1)[0];
    final long buckets = LongMath.saturatedAdd(
        LongMath.saturatedSubtract(last, first), duration) / duration;
    if (buckets > options.getMaxBuckets()) {
      LOG.warn("Rejecting statement spanning " + buckets
          + " buckets over the limit of " + options.getMaxBuckets() + ": "
          + stmt);
      throw new BucketLimitExceededException(buckets,
          options.getMaxBuckets());
    }
  }

  /**
   * Builds the base iterator options from the rewritten statement. The
   * time range is taken from the condition which has no time predicates
   * left at this point, so the caller replaces it.
   */
  private IteratorOptions iteratorOptions(final SelectStatement stmt,
                                          final SelectOptions options) {
    final ConditionResolver.Result resolved = ConditionResolver.resolve(
        stmt.getCondition(), NowValuer.withoutNow(stmt.getLocation()));

    final List<String> dimensions = Lists.newArrayList();
    for (final Dimension dimension : stmt.getDimensions()) {
      if (dimension.getExpr() instanceof VarRef) {
        dimensions.add(((VarRef) dimension.getExpr()).getName());
      }
    }

    FillOption fill = stmt.getFill();
    if (fill == FillOption.NULL && stmt.getTarget() != null) {
      // nulls are dropped when writing to a target
      fill = FillOption.NONE;
    }

    return IteratorOptions.newBuilder()
        .setStartTime(resolved.getTimeRange().minTime())
        .setEndTime(resolved.getTimeRange().maxTime())
        .setLocation(stmt.getLocation())
        .setInterval(compiled.getInterval())
        .setDimensions(dimensions)
        .setCondition(stmt.getCondition())
        .setAscending(stmt.isTimeAscending())
        .setOrdered(true)
        .setDedupe(options.isDedupe())
        .setFill(fill)
        .setFillValue(stmt.getFillValue())
        .setLimit(stmt.getLimit())
        .setOffset(stmt.getOffset())
        .setSeriesLimit(stmt.getSeriesLimit())
        .setSeriesOffset(stmt.getSeriesOffset())
        .setMaxSeries(options.getMaxSeries())
        .setMaxPoints(options.getMaxPoints())
        .build();
  }

  /**
   * Closes the shards after a failure, attaching a close failure to the
   * original exception.
   */
  private static void release(final ShardGroup shards,
                              final Throwable cause) {
    try {
      shards.close();
    } catch (IOException e) {
      LOG.error("Failed to close shards after a planning failure", e);
      cause.addSuppressed(e);
    }
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{compiled=")
        .append(compiled)
        .append("}")
        .toString();
  }
}
