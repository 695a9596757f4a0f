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
package net.chronoql.query.ast;

/**
 * How empty GROUP BY time windows are filled.
 *
 * @since 1.0
 */
public enum FillOption {
  /** Emit nulls for empty windows, the default. */
  NULL,
  /** Skip empty windows. */
  NONE,
  /** Emit the statement's fill value. */
  NUMBER,
  /** Repeat the previous value. */
  PREVIOUS,
  /** Interpolate linearly between neighbours. */
  LINEAR
}
