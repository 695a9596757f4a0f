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
 * An absolute timestamp constant in Unix epoch nanoseconds.
 *
 * @since 1.0
 */
public class TimeLiteral extends Literal {
  private final long value;

  /**
   * Default ctor.
   * @param value The timestamp in nanoseconds.
   */
  public TimeLiteral(final long value) {
    this.value = value;
  }

  /** @return The timestamp in nanoseconds. */
  public long getValue() {
    return value;
  }

  @Override
  public <R> R accept(final ExprVisitor<R> visitor) {
    return visitor.visitTime(this);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return value == ((TimeLiteral) o).value;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }

  @Override
  public String toString() {
    return "'" + DateTime.formatTimestamp(value) + "'";
  }
}
