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

import java.time.Instant;
import java.time.ZoneId;

import com.google.common.base.Objects;

import net.chronoql.utils.DateTime;

/**
 * A time grouping interval from a {@code GROUP BY time(duration[, offset])}
 * dimension. A zero duration means the statement is not grouped by time.
 *
 * @since 1.0
 */
public final class Interval {
  /** The interval of a statement without time grouping. */
  public static final Interval ZERO = new Interval(0, 0);

  /** The bucket width in nanoseconds. */
  private final long duration;

  /** The phase offset in nanoseconds, 0 <= offset < duration. */
  private final long offset;

  /**
   * Default ctor.
   * @param duration The bucket width in nanoseconds, zero or positive.
   * @param offset The offset in nanoseconds.
   * @throws IllegalArgumentException if the duration was negative or the
   * offset out of range for a non-zero duration.
   */
  public Interval(final long duration, final long offset) {
    if (duration < 0) {
      throw new IllegalArgumentException("Duration cannot be negative: "
          + duration);
    }
    if (duration > 0 && (offset < 0 || offset >= duration)) {
      throw new IllegalArgumentException("Offset " + offset
          + " must be within [0, " + duration + ")");
    }
    this.duration = duration;
    this.offset = duration == 0 ? 0 : offset;
  }

  /** @return The bucket width in nanoseconds. */
  public long getDuration() {
    return duration;
  }

  /** @return The offset in nanoseconds. */
  public long getOffset() {
    return offset;
  }

  /** @return True if there is no time grouping. */
  public boolean isZero() {
    return duration == 0;
  }

  /**
   * Returns the window the timestamp falls into. Windows are aligned to the
   * Unix epoch shifted by the offset, or to local wall clock time when a
   * zone is given. The start is clamped to {@link TimeRange#MIN_TIME} and
   * the end to {@link TimeRange#MAX_TIME}.
   * @param timestamp A timestamp in nanoseconds.
   * @param zone An optional zone, null for UTC.
   * @return A two element array with the inclusive start and exclusive end.
   * @throws IllegalStateException if the interval is zero.
   */
  public long[] window(final long timestamp, final ZoneId zone) {
    if (isZero()) {
      throw new IllegalStateException("Cannot compute a window for a zero "
          + "interval.");
    }
    final long t = timestamp - offset;
    final long zone_offset = zoneOffset(t, zone);

    final long dt = Math.floorMod(t + zone_offset, duration);
    long start;
    if (TimeRange.MIN_TIME + dt >= t) {
      start = TimeRange.MIN_TIME;
    } else {
      start = t - dt;
    }
    if (zone != null) {
      // the window may start on the other side of a zone transition
      final long shift = zone_offset - zoneOffset(start, zone);
      if (shift != 0 && Math.abs(shift) < duration) {
        start += shift;
      }
    }
    start += offset;

    long end;
    final long remaining = duration - dt;
    if (TimeRange.MAX_TIME - remaining <= t) {
      end = TimeRange.MAX_TIME;
    } else {
      end = t + remaining;
    }
    end += offset;
    if (zone != null) {
      final long shift = zone_offset - zoneOffset(end, zone);
      if (shift != 0 && Math.abs(shift) < duration) {
        end += shift;
      }
    }
    return new long[] { start, end };
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Interval other = (Interval) o;
    return duration == other.duration && offset == other.offset;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(duration, offset);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{duration=")
        .append(DateTime.formatDuration(duration))
        .append(", offset=")
        .append(DateTime.formatDuration(offset))
        .append("}")
        .toString();
  }

  /**
   * @param timestamp A nanosecond timestamp.
   * @param zone An optional zone.
   * @return The zone's UTC offset at the instant, in nanoseconds.
   */
  private static long zoneOffset(final long timestamp, final ZoneId zone) {
    if (zone == null) {
      return 0;
    }
    final Instant instant = Instant.ofEpochSecond(
        Math.floorDiv(timestamp, DateTime.SECOND));
    return zone.getRules().getOffset(instant).getTotalSeconds()
        * DateTime.SECOND;
  }
}
