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
package net.chronoql.exceptions;

/**
 * Thrown when a select statement fails semantic compilation. The reason
 * classifies the failure while the message names the offending function
 * or argument. Compilation is aborted as soon as this is thrown.
 *
 * @since 1.0
 */
public class QueryCompileException extends IllegalArgumentException {
  private static final long serialVersionUID = -5817340934523376154L;

  /** Classification of compile failures. */
  public static enum Reason {
    /** The condition could not be evaluated, e.g. a bad time comparison. */
    CONDITION,

    /** More than one time() call in the GROUP BY clause. */
    MULTIPLE_INTERVAL,

    /** A GROUP BY expression that can't be used as a dimension. */
    UNSUPPORTED_DIMENSION,

    /** A call to a function that doesn't exist. */
    UNDEFINED_FUNCTION,

    /** Wrong arity or a wrong or out of range literal argument. */
    INVALID_ARGUMENT,

    /** An expression that is structurally illegal, e.g. literal op literal. */
    INVALID_EXPRESSION,

    /** An expression kind the compiler does not handle. */
    UNIMPLEMENTED_EXPRESSION,

    /** top() or bottom() combined with another function. */
    SELECTOR_CONFLICT,

    /** No non-time field was selected. */
    EMPTY_FIELD_LIST,

    /** A GROUP BY interval without aggregate or vice versa. */
    MISSING_AGGREGATE,

    /** A fill option that needs a function but has none. */
    ILLEGAL_FILL,

    /** distinct() combined with other functions or fields. */
    DISTINCT_CONFLICT,

    /** Raw fields mixed with aggregates or multiple selectors. */
    MIXED_AGGREGATE,

    /** A subquery sorted differently than its parent. */
    SORT_DIRECTION_MISMATCH
  }

  /** The failure classification. */
  private final Reason reason;

  /**
   * Default ctor.
   * @param reason A non-null reason.
   * @param message A non-null descriptive message.
   */
  public QueryCompileException(final Reason reason, final String message) {
    super(message);
    this.reason = reason;
  }

  /**
   * Ctor with a cause.
   * @param reason A non-null reason.
   * @param message A non-null descriptive message.
   * @param cause The underlying cause.
   */
  public QueryCompileException(final Reason reason,
                               final String message,
                               final Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  /** @return The failure classification. */
  public Reason getReason() {
    return reason;
  }
}
