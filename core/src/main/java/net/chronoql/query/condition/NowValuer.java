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

import net.chronoql.query.TimeRange;
import net.chronoql.query.ast.TimeLiteral;

/**
 * Supplies the fixed "now" and the statement zone while reducing
 * expressions. A valuer without a now leaves {@code now()} calls in place.
 *
 * @since 1.0
 */
public class NowValuer {
  /** The now timestamp in nanoseconds or {@link TimeRange#UNSET}. */
  private final long now;

  /** The statement's zone, may be null for UTC. */
  private final ZoneId location;

  /**
   * Default ctor.
   * @param now The now timestamp in nanoseconds.
   * @param location An optional zone.
   */
  public NowValuer(final long now, final ZoneId location) {
    this.now = now;
    this.location = location;
  }

  /**
   * @param location An optional zone.
   * @return A valuer that only supplies the zone.
   */
  public static NowValuer withoutNow(final ZoneId location) {
    return new NowValuer(TimeRange.UNSET, location);
  }

  /** @return Whether or not a now timestamp was given. */
  public boolean hasNow() {
    return now != TimeRange.UNSET;
  }

  /** @return The now timestamp in nanoseconds. */
  public long getNow() {
    return now;
  }

  /** @return The zone, may be null. */
  public ZoneId getLocation() {
    return location;
  }

  /**
   * Evaluates a call with literal arguments.
   * @param name The function name.
   * @param arg_count The number of arguments.
   * @return The literal value or null if the call can't be evaluated.
   */
  public TimeLiteral call(final String name, final int arg_count) {
    if (hasNow() && arg_count == 0 && "now".equals(name)) {
      return new TimeLiteral(now);
    }
    return null;
  }
}
