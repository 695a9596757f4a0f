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

import java.util.function.Predicate;

/**
 * Static helpers for walking expression trees.
 *
 * @since 1.0
 */
public final class Exprs {

  private Exprs() { }

  /**
   * Walks the tree depth first, parents before children, and returns true
   * as soon as the predicate matches a node.
   * @param expr An expression, may be null.
   * @param predicate A non-null predicate.
   * @return True if any node matched.
   */
  public static boolean any(final Expr expr, final Predicate<Expr> predicate) {
    if (expr == null) {
      return false;
    }
    if (predicate.test(expr)) {
      return true;
    }
    if (expr instanceof Call) {
      for (final Expr arg : ((Call) expr).getArgs()) {
        if (any(arg, predicate)) {
          return true;
        }
      }
    } else if (expr instanceof BinaryExpr) {
      return any(((BinaryExpr) expr).getLhs(), predicate)
          || any(((BinaryExpr) expr).getRhs(), predicate);
    } else if (expr instanceof ParenExpr) {
      return any(((ParenExpr) expr).getExpr(), predicate);
    }
    return false;
  }

  /**
   * @param expr An expression, may be null.
   * @param type The node class to look for.
   * @return True if a node of the given class is in the tree.
   */
  public static boolean contains(final Expr expr,
                                 final Class<? extends Expr> type) {
    return any(expr, e -> type.isInstance(e));
  }

  /**
   * @param expr An expression, may be null.
   * @return The expression with any enclosing parentheses removed.
   */
  public static Expr unwrap(final Expr expr) {
    Expr e = expr;
    while (e instanceof ParenExpr) {
      e = ((ParenExpr) e).getExpr();
    }
    return e;
  }
}
