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

import java.time.ZoneId;

import net.chronoql.utils.DateTime;

/**
 * A single quoted string constant. Strings that look like timestamps are
 * treated as times when compared against {@code time}.
 *
 * @since 1.0
 */
public class StringLiteral extends Literal {
  private final String value;

  /**
   * Default ctor.
   * @param value A non-null value.
   */
  public StringLiteral(final String value) {
    if (value == null) {
      throw new IllegalArgumentException("Value cannot be null.");
    }
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /** @return True if the value looks like a date or date time. */
  public boolean isTimeLiteral() {
    return DateTime.isTimeLiteral(value);
  }

  /**
   * @param location An optional zone for values without an explicit zone.
   * @return The value as a time literal.
   * @throws IllegalArgumentException if the value isn't a valid timestamp.
   */
  public TimeLiteral toTimeLiteral(final ZoneId location) {
    return new TimeLiteral(DateTime.parseTimeLiteral(value, location));
  }

  @Override
  public <R> R accept(final ExprVisitor<R> visitor) {
    return visitor.visitString(this);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return value.equals(((StringLiteral) o).value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return Identifiers.quoteString(value);
  }
}
