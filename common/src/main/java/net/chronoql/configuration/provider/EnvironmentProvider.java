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
package net.chronoql.configuration.provider;

import java.io.IOException;

import net.chronoql.configuration.ConfigurationOverride;

/**
 * Reads settings from the process environment. Keys are upper cased and
 * periods replaced with underscores, so {@code query.select.max_buckets}
 * is read from {@code QUERY_SELECT_MAX_BUCKETS}.
 *
 * @since 1.0
 */
public class EnvironmentProvider implements Provider {
  public static final String SOURCE = "Environment";

  @Override
  public ConfigurationOverride getSetting(final String key) {
    final String value = getenv(toEnvironmentKey(key));
    if (value == null) {
      return null;
    }
    return ConfigurationOverride.newBuilder()
        .setSource(SOURCE)
        .setValue(value)
        .build();
  }

  @Override
  public String source() {
    return SOURCE;
  }

  @Override
  public void close() throws IOException {
    // no-op
  }

  /**
   * @param key A non-null key.
   * @return The environment variable name for the key.
   */
  public static String toEnvironmentKey(final String key) {
    return key.toUpperCase().replace('.', '_');
  }

  /** Pass through to make unit testing easier. */
  protected String getenv(final String key) {
    return System.getenv(key);
  }
}
