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
 * Base for failures while preparing a compiled statement against the
 * shards, e.g. a shard mapper error or an exhausted budget. Carries a
 * status code, usually an HTTP code, for the layer reporting the failure.
 *
 * @since 1.0
 */
public class QueryExecutionException extends RuntimeException {
  private static final long serialVersionUID = 6214907151263520187L;

  /** The status code to report. */
  protected final int status_code;

  /**
   * Ctor without a cause.
   * @param msg A non-null message.
   * @param status_code The status code to report.
   */
  public QueryExecutionException(final String msg, final int status_code) {
    this(msg, status_code, null);
  }

  /**
   * Ctor with the underlying failure, e.g. from a shard mapper.
   * @param msg A non-null message.
   * @param status_code The status code to report.
   * @param cause An optional cause.
   */
  public QueryExecutionException(final String msg,
                                 final int status_code,
                                 final Throwable cause) {
    super(msg, cause);
    this.status_code = status_code;
  }

  /** @return The status code to report. */
  public int getStatusCode() {
    return status_code;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append(getClass().getSimpleName())
        .append(" [")
        .append(status_code)
        .append("]: ")
        .append(getMessage())
        .toString();
  }
}
