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
 * A nested select statement used as a source.
 *
 * @since 1.0
 */
public class SubQuery implements Source {
  private final SelectStatement statement;

  /**
   * Default ctor.
   * @param statement A non-null statement.
   */
  public SubQuery(final SelectStatement statement) {
    if (statement == null) {
      throw new IllegalArgumentException("Statement cannot be null.");
    }
    this.statement = statement;
  }

  public SelectStatement getStatement() {
    return statement;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return statement.equals(((SubQuery) o).statement);
  }

  @Override
  public int hashCode() {
    return statement.hashCode();
  }

  @Override
  public String toString() {
    return "(" + statement + ")";
  }
}
