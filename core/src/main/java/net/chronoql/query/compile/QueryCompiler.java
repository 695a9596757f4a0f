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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.chronoql.exceptions.QueryCompileException;
import net.chronoql.query.ast.SelectStatement;
import net.chronoql.query.rewrite.StatementRewriter;
import net.chronoql.utils.DateTime;

/**
 * Entry point for the semantic compilation of a select statement. The
 * statement tree is validated, its time range and interval resolved and
 * the result returned as a {@link Statement} ready to be prepared against
 * the shards.
 * <p>
 * If the options don't carry a now, the current time is captured once here
 * and shared by the whole tree so every {@code now()} in the statement,
 * its subqueries and its dimensions resolves to the same instant.
 * <p>
 * Compilation holds no shared state so statements may be compiled
 * concurrently.
 *
 * @since 1.0
 */
public final class QueryCompiler {
  private static final Logger LOG = LoggerFactory.getLogger(
      QueryCompiler.class);

  private QueryCompiler() {
    // static
  }

  /**
   * Compiles the statement with the current time as now.
   * @param stmt A non-null statement.
   * @return The compiled statement.
   * @throws QueryCompileException if the statement is invalid.
   */
  public static Statement compile(final SelectStatement stmt) {
    return compile(stmt, null);
  }

  /**
   * Compiles the statement.
   * @param stmt A non-null statement.
   * @param options Optional options. When null or without a now, the
   * current time is used.
   * @return The compiled statement.
   * @throws QueryCompileException if the statement is invalid.
   * @throws IllegalArgumentException if the statement was null.
   */
  public static Statement compile(final SelectStatement stmt,
                                  final CompileOptions options) {
    if (stmt == null) {
      throw new IllegalArgumentException("Statement cannot be null.");
    }
    CompileOptions resolved = options;
    if (resolved == null || !resolved.hasNow()) {
      resolved = CompileOptions.newBuilder()
          .setNow(DateTime.currentTimeNanos())
          .build();
    }

    final CompiledStatement compiled = new CompiledStatement(resolved);
    compiled.preprocess(stmt);
    final SelectStatement validated = compiled.compile(stmt);
    compiled.setStatement(StatementRewriter.rewrite(validated,
        compiled.getTimeFieldName(), compiled.getCondition()));
    if (LOG.isDebugEnabled()) {
      LOG.debug("Compiled statement [" + stmt + "] to " + compiled);
    }
    return compiled;
  }
}
