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
package net.chronoql.query.compile;

import net.chronoql.exceptions.QueryCompileException;
import net.chronoql.exceptions.QueryCompileException.Reason;
import net.chronoql.query.ast.BinaryExpr;
import net.chronoql.query.ast.BooleanLiteral;
import net.chronoql.query.ast.Call;
import net.chronoql.query.ast.Distinct;
import net.chronoql.query.ast.DurationLiteral;
import net.chronoql.query.ast.Expr;
import net.chronoql.query.ast.ExprVisitor;
import net.chronoql.query.ast.Field;
import net.chronoql.query.ast.IntegerLiteral;
import net.chronoql.query.ast.Literal;
import net.chronoql.query.ast.NumberLiteral;
import net.chronoql.query.ast.ParenExpr;
import net.chronoql.query.ast.RegexLiteral;
import net.chronoql.query.ast.StringLiteral;
import net.chronoql.query.ast.TimeLiteral;
import net.chronoql.query.ast.VarRef;
import net.chronoql.query.ast.Wildcard;
import net.chronoql.query.compile.function.FunctionValidator;
import net.chronoql.query.compile.function.FunctionValidators;

/**
 * One output field bound to the statement it belongs to. Compiling the
 * field walks its expression, validating every call through the
 * {@link FunctionValidators} and recording what it finds on the owning
 * {@link CompiledStatement}.
 * <p>
 * Wildcards are allowed until the walk descends into a binary expression.
 * They can't be expanded inside an operator later on so the flag stays off
 * for the rest of the field.
 *
 * @since 1.0
 */
public class CompiledField implements ExprVisitor<Void> {

  /** The statement this field belongs to. */
  private final CompiledStatement statement;

  /** The source field. */
  private final Field field;

  /** Whether wildcards and regexes are allowed at this point of the walk. */
  private boolean allow_wildcard;

  /**
   * Default ctor.
   * @param statement The non-null owning statement.
   * @param field The non-null field.
   * @param allow_wildcard Whether wildcards are initially allowed.
   */
  public CompiledField(final CompiledStatement statement,
                       final Field field,
                       final boolean allow_wildcard) {
    if (statement == null) {
      throw new IllegalArgumentException("Statement cannot be null.");
    }
    if (field == null) {
      throw new IllegalArgumentException("Field cannot be null.");
    }
    this.statement = statement;
    this.field = field;
    this.allow_wildcard = allow_wildcard;
  }

  /** @return The owning statement. */
  public CompiledStatement statement() {
    return statement;
  }

  /** @return The source field. */
  public Field field() {
    return field;
  }

  /** @return Whether wildcards are currently allowed. */
  public boolean allowWildcard() {
    return allow_wildcard;
  }

  /**
   * Validates the expression and records its attributes on the statement.
   * @param expr A non-null expression.
   * @throws QueryCompileException if the expression is invalid.
   */
  public void compileExpr(final Expr expr) {
    expr.accept(this);
  }

  /**
   * Validates a terminal function argument. Field references are always
   * fine, wildcards and regexes only where they can be expanded later.
   * @param name The name of the function the argument belongs to.
   * @param arg The non-null argument.
   * @throws QueryCompileException if the argument isn't a field.
   */
  public void compileSymbol(final String name, final Expr arg) {
    if (arg instanceof VarRef) {
      return;
    }
    if (arg instanceof Wildcard) {
      if (!allow_wildcard) {
        throw new QueryCompileException(Reason.INVALID_ARGUMENT,
            "unsupported expression with wildcard: " + name + "()");
      }
      statement.clearOnlySelectors();
      return;
    }
    if (arg instanceof RegexLiteral) {
      if (!allow_wildcard) {
        throw new QueryCompileException(Reason.INVALID_ARGUMENT,
            "unsupported expression with regex field: " + name + "()");
      }
      statement.clearOnlySelectors();
      return;
    }
    throw new QueryCompileException(Reason.INVALID_ARGUMENT,
        "expected field argument in " + name + "()");
  }

  @Override
  public Void visitVarRef(final VarRef expr) {
    statement.markAuxiliaryFields();
    return null;
  }

  @Override
  public Void visitWildcard(final Wildcard expr) {
    // assume at least one expansion
    statement.markAuxiliaryFields();
    if (!allow_wildcard) {
      throw new QueryCompileException(Reason.INVALID_EXPRESSION,
          "unable to use wildcard in a binary expression");
    }
    return null;
  }

  @Override
  public Void visitRegex(final RegexLiteral expr) {
    if (!allow_wildcard) {
      throw new QueryCompileException(Reason.INVALID_EXPRESSION,
          "unable to use regex in a binary expression");
    }
    statement.markAuxiliaryFields();
    return null;
  }

  @Override
  public Void visitCall(final Call expr) {
    statement.addFunctionCall(expr);
    final FunctionValidator validator = FunctionValidators.get(expr.getName());
    if (validator == null) {
      throw new QueryCompileException(Reason.UNDEFINED_FUNCTION,
          "undefined function " + expr.getName() + "()");
    }
    validator.validate(expr, this);
    return null;
  }

  @Override
  public Void visitDistinct(final Distinct expr) {
    final Call call = expr.toCall();
    statement.addFunctionCall(call);
    FunctionValidators.get(call.getName()).validate(call, this);
    return null;
  }

  @Override
  public Void visitBinary(final BinaryExpr expr) {
    allow_wildcard = false;

    // a literal side has nothing to resolve
    if (expr.getLhs() instanceof Literal) {
      if (expr.getRhs() instanceof Literal) {
        throw new QueryCompileException(Reason.INVALID_EXPRESSION,
            "cannot perform a binary expression on two literals");
      }
      compileExpr(expr.getRhs());
    } else if (expr.getRhs() instanceof Literal) {
      compileExpr(expr.getLhs());
    } else {
      compileExpr(expr.getLhs());
      compileExpr(expr.getRhs());
    }
    return null;
  }

  @Override
  public Void visitParen(final ParenExpr expr) {
    compileExpr(expr.getExpr());
    return null;
  }

  @Override
  public Void visitInteger(final IntegerLiteral expr) {
    return unimplemented(expr);
  }

  @Override
  public Void visitNumber(final NumberLiteral expr) {
    return unimplemented(expr);
  }

  @Override
  public Void visitString(final StringLiteral expr) {
    return unimplemented(expr);
  }

  @Override
  public Void visitBoolean(final BooleanLiteral expr) {
    return unimplemented(expr);
  }

  @Override
  public Void visitDuration(final DurationLiteral expr) {
    return unimplemented(expr);
  }

  @Override
  public Void visitTime(final TimeLiteral expr) {
    return unimplemented(expr);
  }

  private Void unimplemented(final Expr expr) {
    throw new QueryCompileException(Reason.UNIMPLEMENTED_EXPRESSION,
        "unimplemented expression: " + expr);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{field=")
        .append(field)
        .append(", allowWildcard=")
        .append(allow_wildcard)
        .append("}")
        .toString();
  }
}
