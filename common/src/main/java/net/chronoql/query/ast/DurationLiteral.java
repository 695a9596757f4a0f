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
package net.chronoql.query.ast;

import net.chronoql.utils.DateTime;

/**
 * A duration constant such as {@code 10m}, held in nanoseconds.
 *
 * @since 1.0
 */
public class DurationLiteral extends Literal {
  private final long value;

  /**
   * Default ctor.
   * @param value The duration in nanoseconds.
   */
  public DurationLiteral(final long value) {
    this.value = value;
  }

  /**
   * @param duration A duration string like "10m".
   * @return The parsed literal.
   * @throws IllegalArgumentException if the duration was invalid.
   */
  public static DurationLiteral parse(final String duration) {
    return new DurationLiteral(DateTime.parseDuration(duration));
  }

  /** @return The duration in nanoseconds. */
  public long getValue() {
    return value;
  }

  @Override
  public <R> R accept(final ExprVisitor<R> visitor) {
    return visitor.visitDuration(this);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return value == ((DurationLiteral) o).value;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }

  @Override
  public String toString() {
    if (value < 0) {
      return "-" + DateTime.formatDuration(-value);
    }
    return DateTime.formatDuration(value);
  }
}
