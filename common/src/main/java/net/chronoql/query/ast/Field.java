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

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;

/**
 * One selected expression with an optional {@code AS} alias.
 *
 * @since 1.0
 */
public class Field {
  private final Expr expr;
  private final String alias;

  /**
   * Ctor without an alias.
   * @param expr A non-null expression.
   */
  public Field(final Expr expr) {
    this(expr, null);
  }

  /**
   * Default ctor.
   * @param expr A non-null expression.
   * @param alias An optional alias, empty is treated as null.
   */
  public Field(final Expr expr, final String alias) {
    if (expr == null) {
      throw new IllegalArgumentException("Expression cannot be null.");
    }
    this.expr = expr;
    this.alias = Strings.emptyToNull(alias);
  }

  public Expr getExpr() {
    return expr;
  }

  /** @return The alias or null if none was given. */
  public String getAlias() {
    return alias;
  }

  /**
   * The display name of the field: the alias if present, otherwise the
   * function name for calls, the reference name for references and the
   * names of the references and calls in a binary expression joined with
   * underscores. Other expressions have an empty name.
   * @return A non-null name.
   */
  public String name() {
    if (alias != null) {
      return alias;
    }
    return nameOf(expr);
  }

  private static String nameOf(final Expr expr) {
    if (expr instanceof Call) {
      return ((Call) expr).getName();
    } else if (expr instanceof Distinct) {
      return "distinct";
    } else if (expr instanceof VarRef) {
      return ((VarRef) expr).getName();
    } else if (expr instanceof ParenExpr) {
      return nameOf(((ParenExpr) expr).getExpr());
    } else if (expr instanceof BinaryExpr) {
      final List<String> names = Lists.newArrayList();
      binaryNames(expr, names);
      return Joiner.on('_').join(names);
    }
    return "";
  }

  private static void binaryNames(final Expr expr, final List<String> names) {
    if (expr instanceof VarRef) {
      names.add(((VarRef) expr).getName());
    } else if (expr instanceof Call) {
      names.add(((Call) expr).getName());
    } else if (expr instanceof BinaryExpr) {
      binaryNames(((BinaryExpr) expr).getLhs(), names);
      binaryNames(((BinaryExpr) expr).getRhs(), names);
    } else if (expr instanceof ParenExpr) {
      binaryNames(((ParenExpr) expr).getExpr(), names);
    }
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Field other = (Field) o;
    return expr.equals(other.expr) && Objects.equal(alias, other.alias);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(expr, alias);
  }

  @Override
  public String toString() {
    if (alias == null) {
      return expr.toString();
    }
    return expr + " AS " + Identifiers.quote(alias);
  }
}
