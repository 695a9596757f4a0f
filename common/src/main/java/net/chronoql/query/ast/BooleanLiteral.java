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
 * A {@code true} or {@code false} constant.
 *
 * @since 1.0
 */
public class BooleanLiteral extends Literal {
  public static final BooleanLiteral TRUE = new BooleanLiteral(true);
  public static final BooleanLiteral FALSE = new BooleanLiteral(false);

  private final boolean value;

  public BooleanLiteral(final boolean value) {
    this.value = value;
  }

  /**
   * @param value The value.
   * @return One of the shared instances.
   */
  public static BooleanLiteral of(final boolean value) {
    return value ? TRUE : FALSE;
  }

  public boolean getValue() {
    return value;
  }

  @Override
  public <R> R accept(final ExprVisitor<R> visitor) {
    return visitor.visitBoolean(this);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return value == ((BooleanLiteral) o).value;
  }

  @Override
  public int hashCode() {
    return Boolean.hashCode(value);
  }

  @Override
  public String toString() {
    return value ? "true" : "false";
  }
}
