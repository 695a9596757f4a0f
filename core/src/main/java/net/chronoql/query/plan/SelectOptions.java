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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import net.chronoql.configuration.Configuration;

/**
 * Limits and policies applied when preparing a statement. A limit of 0
 * means unlimited.
 *
 * @since 1.0
 */
@JsonDeserialize(builder = SelectOptions.Builder.class)
public class SelectOptions {
  /** The configuration key for the bucket budget. */
  public static final String MAX_BUCKETS_KEY = "query.select.max_buckets";

  /** The configuration key for the series limit. */
  public static final String MAX_SERIES_KEY = "query.select.max_series";

  /** The configuration key for the point limit. */
  public static final String MAX_POINTS_KEY = "query.select.max_points";

  /** The configuration key for deduplication. */
  public static final String DEDUPE_KEY = "query.select.dedupe";

  /** The maximum number of GROUP BY time windows. */
  private final int max_buckets;

  /** The maximum number of series, enforced by the executor. */
  private final int max_series;

  /** The maximum number of points, enforced by the executor. */
  private final int max_points;

  /** Whether to drop duplicate rows. */
  private final boolean dedupe;

  /**
   * Protected ctor.
   * @param builder A non-null builder.
   */
  protected SelectOptions(final Builder builder) {
    if (builder.maxBuckets < 0) {
      throw new IllegalArgumentException("Max buckets cannot be negative: "
          + builder.maxBuckets);
    }
    if (builder.maxSeries < 0) {
      throw new IllegalArgumentException("Max series cannot be negative: "
          + builder.maxSeries);
    }
    if (builder.maxPoints < 0) {
      throw new IllegalArgumentException("Max points cannot be negative: "
          + builder.maxPoints);
    }
    max_buckets = builder.maxBuckets;
    max_series = builder.maxSeries;
    max_points = builder.maxPoints;
    dedupe = builder.dedupe;
  }

  /** @return The maximum number of GROUP BY windows, 0 for no limit. */
  public int getMaxBuckets() {
    return max_buckets;
  }

  /** @return The maximum number of series, 0 for no limit. */
  public int getMaxSeries() {
    return max_series;
  }

  /** @return The maximum number of points, 0 for no limit. */
  public int getMaxPoints() {
    return max_points;
  }

  public boolean isDedupe() {
    return dedupe;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{maxBuckets=")
        .append(max_buckets)
        .append(", maxSeries=")
        .append(max_series)
        .append(", maxPoints=")
        .append(max_points)
        .append(", dedupe=")
        .append(dedupe)
        .append("}")
        .toString();
  }

  /**
   * Registers the select keys if needed and loads the options.
   * @param config A non-null configuration.
   * @return The options.
   */
  public static SelectOptions fromConfiguration(final Configuration config) {
    if (!config.hasProperty(MAX_BUCKETS_KEY)) {
      config.register(MAX_BUCKETS_KEY, 0, true,
          "The maximum number of GROUP BY time windows a select statement "
          + "may produce. 0 means unlimited.");
    }
    if (!config.hasProperty(MAX_SERIES_KEY)) {
      config.register(MAX_SERIES_KEY, 0, true,
          "The maximum number of series a select statement may read. "
          + "0 means unlimited.");
    }
    if (!config.hasProperty(MAX_POINTS_KEY)) {
      config.register(MAX_POINTS_KEY, 0, true,
          "The maximum number of points a select statement may read. "
          + "0 means unlimited.");
    }
    if (!config.hasProperty(DEDUPE_KEY)) {
      config.register(DEDUPE_KEY, false, true,
          "Whether or not to drop duplicate rows from select results.");
    }
    return newBuilder()
        .setMaxBuckets(config.getInt(MAX_BUCKETS_KEY))
        .setMaxSeries(config.getInt(MAX_SERIES_KEY))
        .setMaxPoints(config.getInt(MAX_POINTS_KEY))
        .setDedupe(config.getBoolean(DEDUPE_KEY))
        .build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private int maxBuckets;
    @JsonProperty
    private int maxSeries;
    @JsonProperty
    private int maxPoints;
    @JsonProperty
    private boolean dedupe;

    public Builder setMaxBuckets(final int max_buckets) {
      this.maxBuckets = max_buckets;
      return this;
    }

    public Builder setMaxSeries(final int max_series) {
      this.maxSeries = max_series;
      return this;
    }

    public Builder setMaxPoints(final int max_points) {
      this.maxPoints = max_points;
      return this;
    }

    public Builder setDedupe(final boolean dedupe) {
      this.dedupe = dedupe;
      return this;
    }

    public SelectOptions build() {
      return new SelectOptions(this);
    }
  }
}
