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

import com.google.common.base.Strings;

/**
 * The {@code DISTINCT field} keyword form, equivalent to
 * {@code distinct(field)}.
 *
 * @since 1.0
 */
public class Distinct extends Expr {
  private final String name;

  /**
   * Default ctor.
   * @param name A non-null and non-empty field name.
   */
  public Distinct(final String name) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Name cannot be null or empty.");
    }
    this.name = name;
  }

  public String getName() {
    return name;
  }

  /** @return The equivalent {@code distinct(ref)} call. */
  public Call toCall() {
    return new Call("distinct", new VarRef(name));
  }

  @Override
  public <R> R accept(final ExprVisitor<R> visitor) {
    return visitor.visitDistinct(this);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return name.equals(((Distinct) o).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return "DISTINCT " + Identifiers.quote(name);
  }
}
