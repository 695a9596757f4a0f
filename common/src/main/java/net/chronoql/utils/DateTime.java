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
package net.chronoql.utils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

import com.google.common.base.Strings;

/**
 * Utility class that provides helpers for dealing with durations and
 * timestamps. All values are handled as nanoseconds, either a duration or
 * a Unix epoch timestamp.
 *
 * @since 1.0
 */
public class DateTime {
  /** ID of the UTC timezone */
  public static final String UTC_ID = "UTC";

  /** Nanosecond multipliers for the duration units. */
  public static final long NANOSECOND = 1L;
  public static final long MICROSECOND = 1000L * NANOSECOND;
  public static final long MILLISECOND = 1000L * MICROSECOND;
  public static final long SECOND = 1000L * MILLISECOND;
  public static final long MINUTE = 60L * SECOND;
  public static final long HOUR = 60L * MINUTE;
  public static final long DAY = 24L * HOUR;
  public static final long WEEK = 7L * DAY;

  /** Matches a date without a time, e.g. 2024-01-31. */
  private static final Pattern DATE_REX =
      Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

  /** Matches a date and time with optional fraction and zone. */
  private static final Pattern DATE_TIME_REX = Pattern.compile(
      "^\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}(\\.\\d{1,9})?"
      + "(Z|[+-]\\d{2}:\\d{2})?$");

  /** Parses the local portion of a date time literal. */
  private static final DateTimeFormatter LOCAL_DATE_TIME =
      new DateTimeFormatterBuilder()
        .appendPattern("yyyy-MM-dd")
        .optionalStart().appendLiteral('T').optionalEnd()
        .optionalStart().appendLiteral(' ').optionalEnd()
        .appendPattern("HH:mm:ss")
        .optionalStart()
        .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
        .optionalEnd()
        .toFormatter();

  /**
   * Parses a human-readable duration (e.g, "10m", "3h", "14d") into
   * nanoseconds.
   * <p>
   * Formats supported:<ul>
   * <li>{@code ns}: nanoseconds</li>
   * <li>{@code u} or {@code µ}: microseconds</li>
   * <li>{@code ms}: milliseconds</li>
   * <li>{@code s}: seconds</li>
   * <li>{@code m}: minutes</li>
   * <li>{@code h}: hours</li>
   * <li>{@code d}: days</li>
   * <li>{@code w}: weeks</li></ul>
   * Multiple segments may be chained, e.g. "1h30m".
   * @param duration The human-readable duration to parse.
   * @return A non-negative number of nanoseconds.
   * @throws IllegalArgumentException if the duration was malformed.
   */
  public static long parseDuration(final String duration) {
    if (Strings.isNullOrEmpty(duration)) {
      throw new IllegalArgumentException("Duration cannot be null or empty.");
    }

    long total = 0;
    int idx = 0;
    while (idx < duration.length()) {
      int unit = idx;
      while (unit < duration.length() &&
          Character.isDigit(duration.charAt(unit))) {
        unit++;
      }
      if (unit == idx || unit >= duration.length()) {
        throw new IllegalArgumentException("Invalid duration, must have an "
            + "integer and unit: " + duration);
      }
      final long interval;
      try {
        interval = Long.parseLong(duration.substring(idx, unit));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid duration (number): "
            + duration, e);
      }

      int end = unit;
      while (end < duration.length() &&
          !Character.isDigit(duration.charAt(end))) {
        end++;
      }
      final long multiplier = unitMultiplier(duration.substring(unit, end));
      if (multiplier < 0) {
        throw new IllegalArgumentException("Invalid duration (suffix): "
            + duration);
      }
      try {
        total = Math.addExact(total, Math.multiplyExact(interval, multiplier));
      } catch (ArithmeticException e) {
        throw new IllegalArgumentException("Duration overflows a 64 bit "
            + "nanosecond value: " + duration, e);
      }
      idx = end;
    }
    return total;
  }

  /**
   * Formats the nanosecond duration using the largest unit that divides
   * it evenly, e.g. 600000000000 becomes "10m". Zero becomes "0s".
   * @param duration The duration in nanoseconds.
   * @return A non-null string.
   */
  public static String formatDuration(final long duration) {
    if (duration == 0) {
      return "0s";
    }
    if (duration % WEEK == 0) {
      return (duration / WEEK) + "w";
    } else if (duration % DAY == 0) {
      return (duration / DAY) + "d";
    } else if (duration % HOUR == 0) {
      return (duration / HOUR) + "h";
    } else if (duration % MINUTE == 0) {
      return (duration / MINUTE) + "m";
    } else if (duration % SECOND == 0) {
      return (duration / SECOND) + "s";
    } else if (duration % MILLISECOND == 0) {
      return (duration / MILLISECOND) + "ms";
    } else if (duration % MICROSECOND == 0) {
      return (duration / MICROSECOND) + "u";
    }
    return duration + "ns";
  }

  /**
   * Whether or not the string looks like a date or date time literal, i.e.
   * "2024-01-31", "2024-01-31 10:00:00" or "2024-01-31T10:00:00.5Z". It
   * does not validate the calendar values.
   * @param value The string to check, may be null.
   * @return True if the string looks like a timestamp.
   */
  public static boolean isTimeLiteral(final String value) {
    if (Strings.isNullOrEmpty(value)) {
      return false;
    }
    return DATE_REX.matcher(value).matches() ||
        DATE_TIME_REX.matcher(value).matches();
  }

  /**
   * Parses a date or date time literal into a Unix epoch timestamp in
   * nanoseconds. Literals without an explicit zone are interpreted in the
   * given location, or UTC if the location was null.
   * @param value A non-null literal matching {@link #isTimeLiteral(String)}.
   * @param location An optional location.
   * @return The timestamp in nanoseconds.
   * @throws IllegalArgumentException if the value could not be parsed.
   */
  public static long parseTimeLiteral(final String value,
                                      final ZoneId location) {
    if (!isTimeLiteral(value)) {
      throw new IllegalArgumentException("Invalid timestamp string: " + value);
    }
    final ZoneId zone = location == null ? ZoneOffset.UTC : location;
    try {
      if (DATE_REX.matcher(value).matches()) {
        return toNanos(LocalDate.parse(value).atStartOfDay(zone).toInstant());
      }

      final char last = value.charAt(value.length() - 1);
      if (last == 'Z' || value.lastIndexOf('+') > 10 ||
          value.lastIndexOf('-') > 10) {
        final String normalized = value.replace(' ', 'T');
        return toNanos(OffsetDateTime.parse(normalized).toInstant());
      }
      return toNanos(LocalDateTime.parse(value, LOCAL_DATE_TIME)
          .atZone(zone).toInstant());
    } catch (DateTimeParseException | ArithmeticException e) {
      throw new IllegalArgumentException("Unable to parse timestamp: "
          + value, e);
    }
  }

  /**
   * Formats the nanosecond timestamp as an RFC3339 string in UTC.
   * @param timestamp The Unix epoch timestamp in nanoseconds.
   * @return A non-null string.
   */
  public static String formatTimestamp(final long timestamp) {
    return Instant.ofEpochSecond(Math.floorDiv(timestamp, SECOND),
        Math.floorMod(timestamp, SECOND)).toString();
  }

  /**
   * Converts the instant to nanoseconds since the Unix epoch.
   * @param instant A non-null instant.
   * @return The nanosecond timestamp.
   * @throws ArithmeticException if the instant can't be represented.
   */
  public static long toNanos(final Instant instant) {
    return Math.addExact(
        Math.multiplyExact(instant.getEpochSecond(), SECOND),
        instant.getNano());
  }

  /**
   * Pass through to {@link Instant#now()} for use in classes to make unit
   * testing easier.
   * @return The current epoch time in nanoseconds.
   */
  public static long currentTimeNanos() {
    return toNanos(Instant.now());
  }

  /**
   * Pass through to {@link System#currentTimeMillis()}.
   * @return The current epoch time in milliseconds.
   */
  public static long currentTimeMillis() {
    return System.currentTimeMillis();
  }

  /**
   * Converts the nanosecond value to a double in milliseconds.
   * @param ts The timestamp or value in nanoseconds.
   * @return The value in milliseconds.
   */
  public static double msFromNano(final long ts) {
    return (double) ts / TimeUnit.MILLISECONDS.toNanos(1);
  }

  /**
   * @param units A unit suffix.
   * @return The nanosecond multiplier or -1 if not recognized.
   */
  private static long unitMultiplier(final String units) {
    switch (units.toLowerCase()) {
    case "ns":
      return NANOSECOND;
    case "u":
    case "µ":
      return MICROSECOND;
    case "ms":
      return MILLISECOND;
    case "s":
      return SECOND;
    case "m":
      return MINUTE;
    case "h":
      return HOUR;
    case "d":
      return DAY;
    case "w":
      return WEEK;
    default:
      return -1;
    }
  }
}
