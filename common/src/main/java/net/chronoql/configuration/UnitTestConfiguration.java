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

import java.io.IOException;
import java.util.Collections;
import java.util.Map;

import com.google.common.collect.ImmutableList;

import net.chronoql.configuration.provider.Provider;

/**
 * A helper for unit testing Configuration consumers. Only a single map
 * backed provider is used so the environment and system properties of
 * the build host can't leak into tests.
 *
 * @since 1.0
 */
public class UnitTestConfiguration extends Configuration {

  /**
   * Ctor with the settings to load.
   * @param settings A non-null map of key values. Mutations after a key
   * is registered are not seen.
   */
  public UnitTestConfiguration(final Map<String, String> settings) {
    super(ImmutableList.<Provider>of(new UnitTestProvider(settings)));
  }

  /** @return A configuration with no settings, only defaults. */
  public static UnitTestConfiguration getConfiguration() {
    return new UnitTestConfiguration(Collections.<String, String>emptyMap());
  }

  /**
   * @param settings A non-null map of key values.
   * @return A configuration backed by the map.
   */
  public static UnitTestConfiguration getConfiguration(
      final Map<String, String> settings) {
    return new UnitTestConfiguration(settings);
  }

  /** Provider reading from the map. */
  static class UnitTestProvider implements Provider {
    static final String SOURCE = "UnitTest";

    private final Map<String, String> kvs;

    UnitTestProvider(final Map<String, String> kvs) {
      if (kvs == null) {
        throw new IllegalArgumentException("Settings cannot be null.");
      }
      this.kvs = kvs;
    }

    @Override
    public ConfigurationOverride getSetting(final String key) {
      final String value = kvs.get(key);
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
  }
}
