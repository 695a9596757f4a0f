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
package net.chronoql.configuration;

/**
 * A callback for dynamic configuration entries called any time a runtime
 * override changes the flattened value.
 *
 * @param <T> The type of data the config entry is encoded as.
 *
 * @since 1.0
 */
public interface ConfigurationCallback<T> {

  /**
   * Called from the config only when a value has been updated.
   *
   * @param key The key of the setting.
   * @param value The new value. May be null if the schema is nullable.
   */
  public void update(final String key, final T value);
}
