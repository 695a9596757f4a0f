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
package net.chronoql.query.rewrite;

import java.util.List;

import com.google.common.collect.Lists;

import net.chronoql.query.ast.BinaryExpr;
import net.chronoql.query.ast.BinaryOp;
import net.chronoql.query.ast.Call;
import net.chronoql.query.ast.Distinct;
import net.chronoql.query.ast.Expr;
import net.chronoql.query.ast.Field;
import net.chronoql.query.ast.ParenExpr;
import net.chronoql.query.ast.RegexLiteral;
import net.chronoql.query.ast.SelectStatement;
import net.chronoql.query.ast.StringLiteral;
import net.chronoql.query.ast.VarRef;

/**
 * Normalizations applied to a statement after it compiled successfully.
 * Each returns a new statement and leaves the argument untouched.
 *
 * @since 1.0
 */
public final class StatementRewriter {

  /** Characters with a special meaning in a regular expression. */
  private static final String META_CHARACTERS = ".^$|?*+()[]{}\\";

  private StatementRewriter() {
    // static
  }

  /**
   * Records the time column alias and the resolved condition, then applies
   * {@link #rewriteDistinct(SelectStatement)},
   * {@link #rewriteTimeFields(SelectStatement)} and
   * {@link #rewriteRegexConditions(SelectStatement)}.
   * @param stmt A non-null compiled statement.
   * @param time_alias The name of the time column.
   * @param condition The condition without time predicates, may be null.
   * @return The rewritten statement.
   */
  public static SelectStatement rewrite(final SelectStatement stmt,
                                        final String time_alias,
                                        final Expr condition) {
    SelectStatement rewritten = stmt.toBuilder()
        .setTimeAlias(time_alias)
        .setCondition(condition)
        .build();
    rewritten = rewriteDistinct(rewritten);
    rewritten = rewriteTimeFields(rewritten);
    return rewriteRegexConditions(rewritten);
  }

  /**
   * Replaces {@code DISTINCT x} expressions with {@code distinct(x)} calls.
   * @param stmt A non-null statement.
   * @return The rewritten statement.
   */
  public static SelectStatement rewriteDistinct(final SelectStatement stmt) {
    final List<Field> fields = Lists.newArrayListWithCapacity(
        stmt.getFields().size());
    for (final Field field : stmt.getFields()) {
      fields.add(new Field(distinctToCall(field.getExpr()),
          field.getAlias()));
    }
    return stmt.toBuilder()
        .setFields(fields)
        .build();
  }

  private static Expr distinctToCall(final Expr expr) {
    if (expr instanceof Distinct) {
      return ((Distinct) expr).toCall();
    }
    if (expr instanceof Call) {
      final Call call = (Call) expr;
      final List<Expr> args = Lists.newArrayListWithCapacity(
          call.getArgs().size());
      for (final Expr arg : call.getArgs()) {
        args.add(distinctToCall(arg));
      }
      return call.withArgs(args);
    }
    if (expr instanceof BinaryExpr) {
      final BinaryExpr binary = (BinaryExpr) expr;
      return new BinaryExpr(binary.getOp(), distinctToCall(binary.getLhs()),
          distinctToCall(binary.getRhs()));
    }
    if (expr instanceof ParenExpr) {
      return new ParenExpr(distinctToCall(((ParenExpr) expr).getExpr()));
    }
    return expr;
  }

  /**
   * Removes fields that reference the time column directly. It's always
   * part of the output.
   * @param stmt A non-null statement.
   * @return The rewritten statement.
   */
  public static SelectStatement rewriteTimeFields(final SelectStatement stmt) {
    final List<Field> fields = Lists.newArrayListWithCapacity(
        stmt.getFields().size());
    for (final Field field : stmt.getFields()) {
      if (field.getExpr() instanceof VarRef &&
          ((VarRef) field.getExpr()).getName().equals(
              SelectStatement.TIME_FIELD)) {
        continue;
      }
      fields.add(field);
    }
    return stmt.toBuilder()
        .setFields(fields)
        .build();
  }

  /**
   * Turns regex comparisons that can only match one exact string, e.g.
   * {@code host =~ /^server01$/}, into plain (in)equality comparisons.
   * @param stmt A non-null statement.
   * @return The rewritten statement.
   */
  public static SelectStatement rewriteRegexConditions(
      final SelectStatement stmt) {
    if (stmt.getCondition() == null) {
      return stmt;
    }
    return stmt.toBuilder()
        .setCondition(rewriteRegex(stmt.getCondition()))
        .build();
  }

  private static Expr rewriteRegex(final Expr expr) {
    if (expr instanceof ParenExpr) {
      return new ParenExpr(rewriteRegex(((ParenExpr) expr).getExpr()));
    }
    if (!(expr instanceof BinaryExpr)) {
      return expr;
    }
    final BinaryExpr binary = (BinaryExpr) expr;
    if (binary.getOp() != BinaryOp.EQREGEX &&
        binary.getOp() != BinaryOp.NEQREGEX) {
      return new BinaryExpr(binary.getOp(), rewriteRegex(binary.getLhs()),
          rewriteRegex(binary.getRhs()));
    }
    if (!(binary.getRhs() instanceof RegexLiteral)) {
      return binary;
    }
    final String literal = exactMatch(
        ((RegexLiteral) binary.getRhs()).getPattern().pattern());
    if (literal == null) {
      return binary;
    }
    return new BinaryExpr(
        binary.getOp() == BinaryOp.EQREGEX ? BinaryOp.EQ : BinaryOp.NEQ,
        binary.getLhs(), new StringLiteral(literal));
  }

  /**
   * @param regex A regular expression.
   * @return The only string the expression matches if it is an anchored
   * literal, null otherwise.
   */
  static String exactMatch(final String regex) {
    if (regex.length() < 2 || regex.charAt(0) != '^' ||
        regex.charAt(regex.length() - 1) != '$') {
      return null;
    }
    final String middle = regex.substring(1, regex.length() - 1);
    final StringBuilder buf = new StringBuilder(middle.length());
    for (int i = 0; i < middle.length(); i++) {
      final char c = middle.charAt(i);
      if (c == '\\') {
        // escaped punctuation is literal, classes like \d are not
        if (i + 1 >= middle.length() ||
            Character.isLetterOrDigit(middle.charAt(i + 1))) {
          return null;
        }
        buf.append(middle.charAt(++i));
      } else if (META_CHARACTERS.indexOf(c) >= 0) {
        return null;
      } else {
        buf.append(c);
      }
    }
    return buf.toString();
  }
}
