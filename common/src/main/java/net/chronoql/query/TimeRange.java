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
package net.chronoql.query;

import com.google.common.base.Objects;

import net.chronoql.utils.DateTime;

/**
 * An inclusive range of Unix epoch nanosecond timestamps where either bound
 * may be unset. Unset bounds read as {@link #MIN_TIME} or {@link #MAX_TIME}
 * through {@link #minTime()} and {@link #maxTime()}.
 *
 * @since 1.0
 */
public final class TimeRange {
  /** The smallest timestamp a query may use. Lower values are sentinels. */
  public static final long MIN_TIME = Long.MIN_VALUE + 2;

  /** The largest timestamp a query may use. */
  public static final long MAX_TIME = Long.MAX_VALUE - 1;

  /** Marker for a bound that hasn't been set. */
  public static final long UNSET = Long.MIN_VALUE;

  /** A range with neither bound set. */
  public static final TimeRange UNBOUNDED = new TimeRange(UNSET, UNSET);

  /** The lower bound or {@link #UNSET}. */
  private final long min;

  /** The upper bound or {@link #UNSET}. */
  private final long max;

  /**
   * Default ctor.
   * @param min The inclusive lower bound or {@link #UNSET}.
   * @param max The inclusive upper bound or {@link #UNSET}.
   */
  public TimeRange(final long min, final long max) {
    this.min = min;
    this.max = max;
  }

  /** @return Whether or not a lower bound was set. */
  public boolean hasMin() {
    return min != UNSET;
  }

  /** @return Whether or not an upper bound was set. */
  public boolean hasMax() {
    return max != UNSET;
  }

  /** @return The raw lower bound, may be {@link #UNSET}. */
  public long getMin() {
    return min;
  }

  /** @return The raw upper bound, may be {@link #UNSET}. */
  public long getMax() {
    return max;
  }

  /** @return The lower bound or {@link #MIN_TIME} if unset. */
  public long minTime() {
    return hasMin() ? min : MIN_TIME;
  }

  /** @return The upper bound or {@link #MAX_TIME} if unset. */
  public long maxTime() {
    return hasMax() ? max : MAX_TIME;
  }

  /**
   * @param min The new lower bound or {@link #UNSET}.
   * @return A copy with the lower bound replaced.
   */
  public TimeRange withMin(final long min) {
    return new TimeRange(min, max);
  }

  /**
   * @param max The new upper bound or {@link #UNSET}.
   * @return A copy with the upper bound replaced.
   */
  public TimeRange withMax(final long max) {
    return new TimeRange(min, max);
  }

  /**
   * Returns the intersection of the two ranges. For each bound the other
   * range sets, the tighter of the two is kept. Bounds the other range
   * leaves unset are taken from this range. The result may be empty, i.e.
   * min greater than max.
   * @param other A non-null range.
   * @return A non-null range.
   */
  public TimeRange intersect(final TimeRange other) {
    long new_min = min;
    if (other.hasMin() && (!hasMin() || other.min > min)) {
      new_min = other.min;
    }
    long new_max = max;
    if (other.hasMax() && (!hasMax() || other.max < max)) {
      new_max = other.max;
    }
    return new TimeRange(new_min, new_max);
  }

  /**
   * @param other A non-null range.
   * @return True if this range lies within the other after resolving
   * unset bounds to the sentinels.
   */
  public boolean within(final TimeRange other) {
    return minTime() >= other.minTime() && maxTime() <= other.maxTime();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final TimeRange other = (TimeRange) o;
    return min == other.min && max == other.max;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(min, max);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{min=")
        .append(hasMin() ? DateTime.formatTimestamp(min) : "unset")
        .append(", max=")
        .append(hasMax() ? DateTime.formatTimestamp(max) : "unset")
        .append("}")
        .toString();
  }
}
