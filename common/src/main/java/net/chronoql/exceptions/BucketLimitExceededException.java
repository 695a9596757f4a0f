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
 * Thrown by the planner when an aggregate query would produce more time
 * windows than the configured bucket budget allows. The shard group has
 * already been released by the time this reaches the caller.
 *
 * @since 1.0
 */
public class BucketLimitExceededException extends QueryExecutionException {
  private static final long serialVersionUID = 2240930172880446515L;

  /** The number of buckets the query would produce. */
  private final long buckets;

  /** The configured limit. */
  private final int limit;

  /**
   * Default ctor.
   * @param buckets The number of buckets the query would produce.
   * @param limit The configured bucket limit.
   */
  public BucketLimitExceededException(final long buckets, final int limit) {
    super("max-select-buckets limit exceeded: (" + buckets + "/" + limit
        + ")", 400);
    this.buckets = buckets;
    this.limit = limit;
  }

  /** @return The number of buckets the query would produce. */
  public long getBuckets() {
    return buckets;
  }

  /** @return The configured limit. */
  public int getLimit() {
    return limit;
  }
}
