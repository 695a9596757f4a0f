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
 * A binary operation, e.g. {@code value * 2} or {@code host = 'a'}.
 *
 * @since 1.0
 */
public class BinaryExpr extends Expr {
  private final BinaryOp op;
  private final Expr lhs;
  private final Expr rhs;

  /**
   * Default ctor.
   * @param op A non-null operator.
   * @param lhs A non-null left hand side.
   * @param rhs A non-null right hand side.
   */
  public BinaryExpr(final BinaryOp op, final Expr lhs, final Expr rhs) {
    if (op == null) {
      throw new IllegalArgumentException("Operator cannot be null.");
    }
    if (lhs == null || rhs == null) {
      throw new IllegalArgumentException("Operands cannot be null.");
    }
    this.op = op;
    this.lhs = lhs;
    this.rhs = rhs;
  }

  public BinaryOp getOp() {
    return op;
  }

  public Expr getLhs() {
    return lhs;
  }

  public Expr getRhs() {
    return rhs;
  }

  @Override
  public <R> R accept(final ExprVisitor<R> visitor) {
    return visitor.visitBinary(this);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final BinaryExpr other = (BinaryExpr) o;
    return op == other.op && lhs.equals(other.lhs) && rhs.equals(other.rhs);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(op, lhs, rhs);
  }

  @Override
  public String toString() {
    return lhs + " " + op.symbol() + " " + rhs;
  }
}
