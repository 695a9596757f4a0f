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

import java.util.List;

import net.chronoql.query.TimeRange;
import net.chronoql.query.ast.Source;

/**
 * Maps the sources of a statement to the shards that hold data in a time
 * range. Calls may block.
 *
 * @since 1.0
 */
public interface ShardMapper {

  /**
   * @param sources The non-null sources of the statement.
   * @param time_range The time range to map, both bounds set.
   * @param options The select options.
   * @return A non-null handle the caller must close.
   */
  public ShardGroup mapShards(final List<Source> sources,
                              final TimeRange time_range,
                              final SelectOptions options);
}
