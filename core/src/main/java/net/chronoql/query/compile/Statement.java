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

import net.chronoql.query.plan.PreparedStatement;
import net.chronoql.query.plan.SelectOptions;
import net.chronoql.query.plan.ShardMapper;

/**
 * A compiled select statement ready to be planned.
 *
 * @since 1.0
 */
public interface Statement {

  /**
   * Maps the shards for the statement and finishes the query plan. The
   * shard group is closed on failure, on success the caller owns it
   * through the returned statement.
   *
   * @param mapper A non-null shard mapper.
   * @param options Non-null select options.
   * @return A non-null prepared statement.
   * @throws net.chronoql.exceptions.QueryExecutionException if planning
   * failed, e.g. the bucket limit was exceeded.
   */
  public PreparedStatement prepare(final ShardMapper mapper,
                                   final SelectOptions options);

}
