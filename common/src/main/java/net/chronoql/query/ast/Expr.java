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
 * The base of every node in a query expression tree. Trees are immutable,
 * rewrites always produce new nodes.
 *
 * @since 1.0
 */
public abstract class Expr {

  /**
   * Dispatches to the visitor method for the concrete node type.
   * @param visitor A non-null visitor.
   * @return The visitor's result.
   */
  public abstract <R> R accept(final ExprVisitor<R> visitor);

  /** @return The expression rendered in query syntax. */
  @Override
  public abstract String toString();
}
