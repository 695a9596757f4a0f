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

/**
 * The value types a field or reference may resolve to.
 *
 * @since 1.0
 */
public enum DataType {
  UNKNOWN(0),
  FLOAT(1),
  INTEGER(2),
  UNSIGNED(3),
  STRING(4),
  BOOLEAN(5),
  TAG(6);

  /** Lower ranks win when merging types across sources. */
  private final int rank;

  private DataType(final int rank) {
    this.rank = rank;
  }

  /** @return True for float, integer and unsigned. */
  public boolean isNumeric() {
    return this == FLOAT || this == INTEGER || this == UNSIGNED;
  }

  /**
   * Whether the other type should replace this one when the same name has
   * different types in different sources. Float beats integer beats
   * unsigned beats string beats boolean, and anything beats unknown.
   * @param other A non-null type.
   * @return True if the other type takes precedence.
   */
  public boolean lessThan(final DataType other) {
    if (this == UNKNOWN) {
      return other != UNKNOWN;
    }
    return other != UNKNOWN && rank > other.rank;
  }

  /** @return The lower case name used in {@code ref::type} casts. */
  public String castName() {
    return name().toLowerCase();
  }
}
