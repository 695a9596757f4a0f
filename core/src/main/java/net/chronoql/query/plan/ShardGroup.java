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

import net.chronoql.query.rewrite.FieldMapper;

/**
 * A handle over the shards mapped for a statement. It exposes their schema
 * for wildcard expansion and is later consumed by the executor. Whoever
 * holds the handle must close it.
 *
 * @since 1.0
 */
public interface ShardGroup extends FieldMapper, Closeable {

}
