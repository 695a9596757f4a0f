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
 * Operators of a {@link BinaryExpr}.
 *
 * @since 1.0
 */
public enum BinaryOp {
  ADD("+"),
  SUB("-"),
  MUL("*"),
  DIV("/"),
  MOD("%"),
  AND("AND"),
  OR("OR"),
  EQ("="),
  NEQ("!="),
  LT("<"),
  LTE("<="),
  GT(">"),
  GTE(">="),
  EQREGEX("=~"),
  NEQREGEX("!~");

  private final String symbol;

  private BinaryOp(final String symbol) {
    this.symbol = symbol;
  }

  /** @return The operator as written in a query. */
  public String symbol() {
    return symbol;
  }

  /** @return True for ADD, SUB, MUL, DIV and MOD. */
  public boolean isArithmetic() {
    return this == ADD || this == SUB || this == MUL || this == DIV
        || this == MOD;
  }

  /** @return True for EQ, NEQ, LT, LTE, GT and GTE. */
  public boolean isComparison() {
    return this == EQ || this == NEQ || this == LT || this == LTE
        || this == GT || this == GTE;
  }

  /**
   * @return The operator to use when the operands are swapped, e.g. GT for
   * LT. Symmetric operators return themselves.
   */
  public BinaryOp mirror() {
    switch (this) {
    case LT:
      return GT;
    case GT:
      return LT;
    case LTE:
      return GTE;
    case GTE:
      return LTE;
    default:
      return this;
    }
  }
}
