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
 * A parenthesized expression.
 *
 * @since 1.0
 */
public class ParenExpr extends Expr {
  private final Expr expr;

  /**
   * Default ctor.
   * @param expr A non-null inner expression.
   */
  public ParenExpr(final Expr expr) {
    if (expr == null) {
      throw new IllegalArgumentException("Expression cannot be null.");
    }
    this.expr = expr;
  }

  public Expr getExpr() {
    return expr;
  }

  @Override
  public <R> R accept(final ExprVisitor<R> visitor) {
    return visitor.visitParen(this);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return expr.equals(((ParenExpr) o).expr);
  }

  @Override
  public int hashCode() {
    return 31 * expr.hashCode() + 7;
  }

  @Override
  public String toString() {
    return "(" + expr + ")";
  }
}
