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
 * A {@code *} in a field list, a function argument or a GROUP BY clause,
 * optionally restricted to fields or tags ({@code *::field}, {@code *::tag}).
 *
 * @since 1.0
 */
public class Wildcard extends Expr {
  /** What the wildcard expands to. */
  public static enum WildcardType {
    ALL,
    FIELD,
    TAG
  }

  private final WildcardType type;

  /** Ctor for a wildcard matching fields and tags. */
  public Wildcard() {
    this(WildcardType.ALL);
  }

  /**
   * Ctor with a type restriction.
   * @param type A type, null is treated as {@link WildcardType#ALL}.
   */
  public Wildcard(final WildcardType type) {
    this.type = type == null ? WildcardType.ALL : type;
  }

  public WildcardType getType() {
    return type;
  }

  @Override
  public <R> R accept(final ExprVisitor<R> visitor) {
    return visitor.visitWildcard(this);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return type == ((Wildcard) o).type;
  }

  @Override
  public int hashCode() {
    return type.hashCode();
  }

  @Override
  public String toString() {
    switch (type) {
    case FIELD:
      return "*::field";
    case TAG:
      return "*::tag";
    default:
      return "*";
    }
  }
}
