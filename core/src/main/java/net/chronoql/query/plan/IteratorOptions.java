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

import java.time.ZoneId;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import net.chronoql.query.Interval;
import net.chronoql.query.TimeRange;
import net.chronoql.query.ast.Expr;
import net.chronoql.query.ast.FillOption;

/**
 * The options the executor needs to build the iterators of a prepared
 * statement. Immutable.
 *
 * @since 1.0
 */
public class IteratorOptions {

  /** The inclusive start time in nanoseconds. */
  private final long start_time;

  /** The inclusive end time in nanoseconds. */
  private final long end_time;

  /** The zone windows are aligned to, null for UTC. */
  private final ZoneId location;

  /** The GROUP BY time interval. */
  private final Interval interval;

  /** The GROUP BY tags in order. */
  private final List<String> dimensions;

  /** The GROUP BY tags. */
  private final Set<String> group_by;

  /** The remaining filter, may be null. */
  private final Expr condition;

  private final boolean ascending;

  /** Whether the output must be sorted. */
  private final boolean ordered;

  private final boolean dedupe;

  private final FillOption fill;

  private final Object fill_value;

  private final int limit;

  private final int offset;

  private final int series_limit;

  private final int series_offset;

  private final int max_series;

  private final int max_points;

  /**
   * Protected ctor.
   * @param builder A non-null builder.
   */
  protected IteratorOptions(final Builder builder) {
    start_time = builder.start_time;
    end_time = builder.end_time;
    location = builder.location;
    interval = builder.interval == null ? Interval.ZERO : builder.interval;
    dimensions = builder.dimensions == null ? Collections.<String>emptyList()
        : ImmutableList.copyOf(builder.dimensions);
    group_by = ImmutableSet.copyOf(dimensions);
    condition = builder.condition;
    ascending = builder.ascending;
    ordered = builder.ordered;
    dedupe = builder.dedupe;
    fill = builder.fill == null ? FillOption.NULL : builder.fill;
    fill_value = builder.fill_value;
    limit = builder.limit;
    offset = builder.offset;
    series_limit = builder.series_limit;
    series_offset = builder.series_offset;
    max_series = builder.max_series;
    max_points = builder.max_points;
  }

  /**
   * Returns the window the timestamp falls into. Without a GROUP BY
   * interval the whole time range is one window.
   * @param timestamp A timestamp in nanoseconds.
   * @return A two element array with the inclusive start and exclusive end.
   */
  public long[] window(final long timestamp) {
    if (interval.isZero()) {
      return new long[] { start_time, end_time + 1 };
    }
    return interval.window(timestamp, location);
  }

  public long getStartTime() {
    return start_time;
  }

  public long getEndTime() {
    return end_time;
  }

  public ZoneId getLocation() {
    return location;
  }

  public Interval getInterval() {
    return interval;
  }

  public List<String> getDimensions() {
    return dimensions;
  }

  public Set<String> getGroupBy() {
    return group_by;
  }

  public Expr getCondition() {
    return condition;
  }

  public boolean isAscending() {
    return ascending;
  }

  public boolean isOrdered() {
    return ordered;
  }

  public boolean isDedupe() {
    return dedupe;
  }

  public FillOption getFill() {
    return fill;
  }

  public Object getFillValue() {
    return fill_value;
  }

  public int getLimit() {
    return limit;
  }

  public int getOffset() {
    return offset;
  }

  public int getSeriesLimit() {
    return series_limit;
  }

  public int getSeriesOffset() {
    return series_offset;
  }

  public int getMaxSeries() {
    return max_series;
  }

  public int getMaxPoints() {
    return max_points;
  }

  /** @return A builder initialized with these options. */
  public Builder toBuilder() {
    return newBuilder()
        .setStartTime(start_time)
        .setEndTime(end_time)
        .setLocation(location)
        .setInterval(interval)
        .setDimensions(dimensions)
        .setCondition(condition)
        .setAscending(ascending)
        .setOrdered(ordered)
        .setDedupe(dedupe)
        .setFill(fill)
        .setFillValue(fill_value)
        .setLimit(limit)
        .setOffset(offset)
        .setSeriesLimit(series_limit)
        .setSeriesOffset(series_offset)
        .setMaxSeries(max_series)
        .setMaxPoints(max_points);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{startTime=")
        .append(start_time)
        .append(", endTime=")
        .append(end_time)
        .append(", location=")
        .append(location)
        .append(", interval=")
        .append(interval)
        .append(", dimensions=")
        .append(dimensions)
        .append(", condition=")
        .append(condition)
        .append(", ascending=")
        .append(ascending)
        .append(", fill=")
        .append(fill)
        .append(", limit=")
        .append(limit)
        .append(", seriesLimit=")
        .append(series_limit)
        .append("}")
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private long start_time = TimeRange.MIN_TIME;
    private long end_time = TimeRange.MAX_TIME;
    private ZoneId location;
    private Interval interval;
    private List<String> dimensions;
    private Expr condition;
    private boolean ascending = true;
    private boolean ordered;
    private boolean dedupe;
    private FillOption fill;
    private Object fill_value;
    private int limit;
    private int offset;
    private int series_limit;
    private int series_offset;
    private int max_series;
    private int max_points;

    public Builder setStartTime(final long start_time) {
      this.start_time = start_time;
      return this;
    }

    public Builder setEndTime(final long end_time) {
      this.end_time = end_time;
      return this;
    }

    public Builder setLocation(final ZoneId location) {
      this.location = location;
      return this;
    }

    public Builder setInterval(final Interval interval) {
      this.interval = interval;
      return this;
    }

    public Builder setDimensions(final List<String> dimensions) {
      this.dimensions = dimensions;
      return this;
    }

    public Builder setCondition(final Expr condition) {
      this.condition = condition;
      return this;
    }

    public Builder setAscending(final boolean ascending) {
      this.ascending = ascending;
      return this;
    }

    public Builder setOrdered(final boolean ordered) {
      this.ordered = ordered;
      return this;
    }

    public Builder setDedupe(final boolean dedupe) {
      this.dedupe = dedupe;
      return this;
    }

    public Builder setFill(final FillOption fill) {
      this.fill = fill;
      return this;
    }

    public Builder setFillValue(final Object fill_value) {
      this.fill_value = fill_value;
      return this;
    }

    public Builder setLimit(final int limit) {
      this.limit = limit;
      return this;
    }

    public Builder setOffset(final int offset) {
      this.offset = offset;
      return this;
    }

    public Builder setSeriesLimit(final int series_limit) {
      this.series_limit = series_limit;
      return this;
    }

    public Builder setSeriesOffset(final int series_offset) {
      this.series_offset = series_offset;
      return this;
    }

    public Builder setMaxSeries(final int max_series) {
      this.max_series = max_series;
      return this;
    }

    public Builder setMaxPoints(final int max_points) {
      this.max_points = max_points;
      return this;
    }

    public IteratorOptions build() {
      return new IteratorOptions(this);
    }
  }
}
