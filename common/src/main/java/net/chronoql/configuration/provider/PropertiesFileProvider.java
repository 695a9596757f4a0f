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

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Files;

import net.chronoql.configuration.ConfigurationException;
import net.chronoql.configuration.ConfigurationOverride;

/**
 * Parses a Java style properties file, i.e. key = value. The file is read
 * once at construction.
 *
 * @since 1.0
 */
public class PropertiesFileProvider implements Provider {
  private static final Logger LOG = LoggerFactory.getLogger(
      PropertiesFileProvider.class);

  /** The file name. */
  private final String file_name;

  /** The entries loaded from the file. */
  private final Map<String, String> cache;

  /**
   * Default ctor.
   * @param file_name A non-null and non-empty file name.
   * @throws IllegalArgumentException if the file name was null or empty.
   * @throws ConfigurationException if the file couldn't be read.
   */
  public PropertiesFileProvider(final String file_name) {
    if (Strings.isNullOrEmpty(file_name)) {
      throw new IllegalArgumentException("File name cannot be null or empty.");
    }
    this.file_name = file_name;

    final File file = new File(file_name);
    final Properties properties = new Properties();
    try (final Reader reader =
             Files.newReader(file, StandardCharsets.UTF_8)) {
      properties.load(reader);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to load config file: "
          + file_name, e);
    }

    final ImmutableMap.Builder<String, String> builder =
        ImmutableMap.builder();
    for (final Entry<Object, Object> entry : properties.entrySet()) {
      builder.put(entry.getKey().toString().trim(),
          entry.getValue().toString().trim());
    }
    cache = builder.build();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Loaded " + cache.size() + " entries from " + file_name);
    }
  }

  @Override
  public ConfigurationOverride getSetting(final String key) {
    final String value = cache.get(key);
    if (value == null) {
      return null;
    }
    return ConfigurationOverride.newBuilder()
        .setSource(file_name)
        .setValue(value)
        .build();
  }

  @Override
  public String source() {
    return file_name;
  }

  @Override
  public void close() throws IOException {
    // no-op
  }

}
