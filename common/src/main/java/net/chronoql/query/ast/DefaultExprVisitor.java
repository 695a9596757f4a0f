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
 * A visitor that routes every node type to {@link #visitDefault(Expr)}.
 * Extend and override the node types you care about.
 *
 * @param <R> The type returned by the visitor.
 *
 * @since 1.0
 */
public abstract class DefaultExprVisitor<R> implements ExprVisitor<R> {

  /**
   * Called for every node type that isn't overridden.
   * @param expr The non-null node.
   * @return The result for the node.
   */
  protected abstract R visitDefault(final Expr expr);

  @Override
  public R visitVarRef(final VarRef expr) {
    return visitDefault(expr);
  }

  @Override
  public R visitWildcard(final Wildcard expr) {
    return visitDefault(expr);
  }

  @Override
  public R visitRegex(final RegexLiteral expr) {
    return visitDefault(expr);
  }

  @Override
  public R visitCall(final Call expr) {
    return visitDefault(expr);
  }

  @Override
  public R visitDistinct(final Distinct expr) {
    return visitDefault(expr);
  }

  @Override
  public R visitBinary(final BinaryExpr expr) {
    return visitDefault(expr);
  }

  @Override
  public R visitParen(final ParenExpr expr) {
    return visitDefault(expr);
  }

  @Override
  public R visitInteger(final IntegerLiteral expr) {
    return visitDefault(expr);
  }

  @Override
  public R visitNumber(final NumberLiteral expr) {
    return visitDefault(expr);
  }

  @Override
  public R visitString(final StringLiteral expr) {
    return visitDefault(expr);
  }

  @Override
  public R visitBoolean(final BooleanLiteral expr) {
    return visitDefault(expr);
  }

  @Override
  public R visitDuration(final DurationLiteral expr) {
    return visitDefault(expr);
  }

  @Override
  public R visitTime(final TimeLiteral expr) {
    return visitDefault(expr);
  }
}
