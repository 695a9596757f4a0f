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
 * Visitor over the closed set of expression node types.
 *
 * @param <R> The type returned by the visitor.
 *
 * @since 1.0
 */
public interface ExprVisitor<R> {

  public R visitVarRef(final VarRef expr);

  public R visitWildcard(final Wildcard expr);

  public R visitRegex(final RegexLiteral expr);

  public R visitCall(final Call expr);

  public R visitDistinct(final Distinct expr);

  public R visitBinary(final BinaryExpr expr);

  public R visitParen(final ParenExpr expr);

  public R visitInteger(final IntegerLiteral expr);

  public R visitNumber(final NumberLiteral expr);

  public R visitString(final StringLiteral expr);

  public R visitBoolean(final BooleanLiteral expr);

  public R visitDuration(final DurationLiteral expr);

  public R visitTime(final TimeLiteral expr);

}
