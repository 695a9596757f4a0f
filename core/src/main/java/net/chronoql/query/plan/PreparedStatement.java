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
package net.chronoql.query.plan;

import java.io.Closeable;
import java.io.IOException;
import java.util.Collections;
import java.util.List;

import net.chronoql.query.ast.SelectStatement;

/**
 * A statement planned against its shards, ready for the executor. Owns the
 * shard handle: closing this closes the shards.
 *
 * @since 1.0
 */
public class PreparedStatement implements Closeable {

  /** The statement with wildcards expanded. */
  private final SelectStatement statement;

  /** The options for the iterators. */
  private final IteratorOptions options;

  /** The mapped shards. */
  private final ShardGroup shards;

  /** The output column names. */
  private final List<String> columns;

  /**
   * Package private ctor.
   * @param statement The rewritten statement.
   * @param options The iterator options.
   * @param shards The shard handle.
   * @param columns The column names.
   */
  PreparedStatement(final SelectStatement statement,
                    final IteratorOptions options,
                    final ShardGroup shards,
                    final List<String> columns) {
    this.statement = statement;
    this.options = options;
    this.shards = shards;
    this.columns = Collections.unmodifiableList(columns);
  }

  /** @return The statement with wildcards expanded. */
  public SelectStatement getStatement() {
    return statement;
  }

  public IteratorOptions getIteratorOptions() {
    return options;
  }

  /** @return The shard handle, owned by this statement. */
  public ShardGroup getShardGroup() {
    return shards;
  }

  /** @return The output column names, time first unless omitted. */
  public List<String> getColumnNames() {
    return columns;
  }

  @Override
  public void close() throws IOException {
    shards.close();
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{statement=")
        .append(statement)
        .append(", options=")
        .append(options)
        .append(", columns=")
        .append(columns)
        .append("}")
        .toString();
  }
}
