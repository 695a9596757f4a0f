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

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import net.chronoql.configuration.provider.EnvironmentProvider;
import net.chronoql.configuration.provider.PropertiesFileProvider;
import net.chronoql.configuration.provider.Provider;
import net.chronoql.configuration.provider.SystemPropertiesProvider;

/**
 * The main configuration class. Components register the keys they consume
 * along with a type, default and description, then read the flattened
 * value. Values are resolved from the providers in priority order:
 * <ol>
 * <li>A runtime override set via {@link #addOverride(String, Object)}
 * (dynamic keys only).</li>
 * <li>JVM system properties.</li>
 * <li>Environment variables, see {@link EnvironmentProvider}.</li>
 * <li>A properties file named by the {@code config.file} system
 * property, if set.</li>
 * <li>The registered default.</li>
 * </ol>
 * Values are converted to the registered type with Jackson so strings
 * like "42" or "true" from files and the environment work as expected.
 *
 * @since 1.0
 */
public class Configuration implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(
      Configuration.class);

  /** The system property naming an optional properties file. */
  public static final String CONFIG_FILE_KEY = "config.file";

  /** The mapper used for type conversions. */
  public static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  /** The providers, lowest priority first. */
  private final List<Provider> providers;

  /** The registered entries. */
  private final Map<String, ConfigurationEntry> merged_config;

  /**
   * Default ctor that loads the file (if configured), environment and
   * system property providers.
   * @throws ConfigurationException if the config file couldn't be read.
   */
  public Configuration() {
    this(defaultProviders());
  }

  /**
   * Ctor with a specific list of providers.
   * @param providers A non-null list of providers, lowest priority first.
   * @throws IllegalArgumentException if the list was null.
   */
  protected Configuration(final List<Provider> providers) {
    if (providers == null) {
      throw new IllegalArgumentException("Providers cannot be null.");
    }
    this.providers = ImmutableList.copyOf(providers);
    merged_config = Maps.newConcurrentMap();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Initialized configuration with " + this.providers.size()
          + " providers.");
    }
  }

  /**
   * Registers the schema and loads any values the providers have for it.
   * @param schema A non-null schema.
   * @throws IllegalArgumentException if the schema was null.
   * @throws ConfigurationException if the key was already registered or a
   * provider value couldn't be converted to the type.
   */
  public void register(final ConfigurationEntrySchema schema) {
    if (schema == null) {
      throw new IllegalArgumentException("Schema cannot be null.");
    }
    final ConfigurationEntry entry = new ConfigurationEntry(schema);
    for (final Provider provider : providers) {
      final ConfigurationOverride setting =
          provider.getSetting(schema.getKey());
      if (setting != null) {
        entry.addProviderSetting(setting);
      }
    }
    final ConfigurationEntry extant =
        merged_config.putIfAbsent(schema.getKey(), entry);
    if (extant != null) {
      throw new ConfigurationException("[" + schema.getKey()
          + "] Failed to set the schema as another source ["
          + extant.schema().getSource() + "] already registered it.");
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Registered schema: " + schema);
    }
  }

  /**
   * Registers a nullable {@link String} key.
   * @param key A non-null and non-empty key.
   * @param default_value A default value, may be null.
   * @param is_dynamic Whether or not the value can be overridden.
   * @param description A non-null and non-empty description.
   */
  public void register(final String key,
                       final String default_value,
                       final boolean is_dynamic,
                       final String description) {
    final ConfigurationEntrySchema.Builder builder = builder(key, String.class,
        default_value, is_dynamic, description);
    register(builder.isNullable().build());
  }

  /**
   * Registers an integer key.
   * @param key A non-null and non-empty key.
   * @param default_value A default value.
   * @param is_dynamic Whether or not the value can be overridden.
   * @param description A non-null and non-empty description.
   */
  public void register(final String key,
                       final int default_value,
                       final boolean is_dynamic,
                       final String description) {
    register(builder(key, int.class, default_value, is_dynamic, description)
        .build());
  }

  /**
   * Registers a long integer key.
   * @param key A non-null and non-empty key.
   * @param default_value A default value.
   * @param is_dynamic Whether or not the value can be overridden.
   * @param description A non-null and non-empty description.
   */
  public void register(final String key,
                       final long default_value,
                       final boolean is_dynamic,
                       final String description) {
    register(builder(key, long.class, default_value, is_dynamic, description)
        .build());
  }

  /**
   * Registers a boolean key.
   * @param key A non-null and non-empty key.
   * @param default_value A default value.
   * @param is_dynamic Whether or not the value can be overridden.
   * @param description A non-null and non-empty description.
   */
  public void register(final String key,
                       final boolean default_value,
                       final boolean is_dynamic,
                       final String description) {
    register(builder(key, boolean.class, default_value, is_dynamic,
        description).build());
  }

  /**
   * Sets a runtime override for a dynamic key. Bound callbacks are called
   * if the value changed.
   * @param key A non-null and non-empty key.
   * @param value The value, may be null if the schema is nullable.
   * @throws ConfigurationException if the key wasn't registered, isn't
   * dynamic or the value couldn't be converted.
   */
  public void addOverride(final String key, final Object value) {
    entry(key).addRuntimeOverride(ConfigurationOverride.newBuilder()
        .setSource(ConfigurationEntry.RUNTIME_SOURCE)
        .setValue(value)
        .build());
  }

  /**
   * Removes the runtime override for the key if present.
   * @param key A non-null and non-empty key.
   * @return True if an override was removed.
   * @throws ConfigurationException if the key wasn't registered.
   */
  public boolean removeRuntimeOverride(final String key) {
    return entry(key).removeRuntimeOverride();
  }

  /**
   * Binds a callback to the key. The callback is called immediately with
   * the current value, then on every change.
   * @param key A non-null and non-empty key.
   * @param callback A non-null callback.
   * @throws ConfigurationException if the key wasn't registered.
   */
  public void bind(final String key,
                   final ConfigurationCallback<?> callback) {
    if (callback == null) {
      throw new IllegalArgumentException("Callback cannot be null.");
    }
    entry(key).addCallback(callback);
  }

  /**
   * Returns the given config value converted to the given type.
   * @param key The non-null and non-empty config key entry.
   * @param type A non-null class to cast to.
   * @return The value found, may be null for non-primitive types.
   * @throws IllegalArgumentException if the key was null or empty or
   * the data types were incompatible.
   * @throws ConfigurationException if the key was not registered or a
   * null was requested as a primitive.
   */
  @SuppressWarnings("unchecked")
  public <T> T getTyped(final String key, final Class<?> type) {
    if (type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    final Object value = entry(key).getValue();
    if (value == null) {
      if (type.isPrimitive()) {
        throw new ConfigurationException("Cannot cast null to a "
            + "primitive type: " + type);
      }
      return null;
    }
    if (!value.getClass().equals(type)) {
      return (T) OBJECT_MAPPER.convertValue(value, type);
    }
    return (T) value;
  }

  /**
   * @param key A non-null and non-empty key.
   * @return The value as a string, may be null.
   */
  public String getString(final String key) {
    return getTyped(key, String.class);
  }

  /**
   * @param key A non-null and non-empty key.
   * @return The value as an integer.
   */
  public int getInt(final String key) {
    return (int) getTyped(key, int.class);
  }

  /**
   * @param key A non-null and non-empty key.
   * @return The value as a long.
   */
  public long getLong(final String key) {
    return (long) getTyped(key, long.class);
  }

  /**
   * @param key A non-null and non-empty key.
   * @return The value as a boolean.
   */
  public boolean getBoolean(final String key) {
    return (boolean) getTyped(key, boolean.class);
  }

  /**
   * @param key A non-null and non-empty key.
   * @return True if the key was registered.
   */
  public boolean hasProperty(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    return merged_config.containsKey(key);
  }

  @Override
  public void close() throws IOException {
    for (final Provider provider : providers) {
      try {
        provider.close();
      } catch (IOException e) {
        LOG.error("Failed to close provider: " + provider.source(), e);
      }
    }
  }

  @VisibleForTesting
  List<Provider> providers() {
    return providers;
  }

  private ConfigurationEntry entry(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    final ConfigurationEntry entry = merged_config.get(key);
    if (entry == null) {
      throw new ConfigurationException("No registration found for key: "
          + key);
    }
    return entry;
  }

  private static ConfigurationEntrySchema.Builder builder(
      final String key,
      final Class<?> type,
      final Object default_value,
      final boolean is_dynamic,
      final String description) {
    final ConfigurationEntrySchema.Builder builder =
        ConfigurationEntrySchema.newBuilder()
        .setKey(key)
        .setType(type)
        .setDefaultValue(default_value)
        .setSource(callerClassName())
        .setDescription(description);
    if (is_dynamic) {
      builder.isDynamic();
    }
    return builder;
  }

  /** @return The class that called one of the register overloads. */
  private static String callerClassName() {
    final StackTraceElement[] stack = Thread.currentThread().getStackTrace();
    // getStackTrace, callerClassName, builder, register, caller
    return stack.length > 4 ? stack[4].getClassName()
        : Configuration.class.getName();
  }

  private static List<Provider> defaultProviders() {
    final ImmutableList.Builder<Provider> builder = ImmutableList.builder();
    final String file = System.getProperty(CONFIG_FILE_KEY);
    if (!Strings.isNullOrEmpty(file)) {
      builder.add(new PropertiesFileProvider(file));
    }
    builder.add(new EnvironmentProvider());
    builder.add(new SystemPropertiesProvider());
    return builder.build();
  }
}
