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

import com.google.common.base.Objects;

/**
 * An ORDER BY entry. Only {@code time} is meaningful to the compiler.
 *
 * @since 1.0
 */
public class SortField {
  private final String name;
  private final boolean ascending;

  /**
   * Default ctor.
   * @param name The field name, may be null for a bare direction.
   * @param ascending Whether or not the order is ascending.
   */
  public SortField(final String name, final boolean ascending) {
    this.name = name;
    this.ascending = ascending;
  }

  public String getName() {
    return name;
  }

  public boolean isAscending() {
    return ascending;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final SortField other = (SortField) o;
    return Objects.equal(name, other.name) && ascending == other.ascending;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, ascending);
  }

  @Override
  public String toString() {
    final String direction = ascending ? "ASC" : "DESC";
    return name == null ? direction : Identifiers.quote(name) + " " + direction;
  }
}
