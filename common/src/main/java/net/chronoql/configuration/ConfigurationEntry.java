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

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.Sets;

/**
 * A package private container for the schema, provider settings and
 * callbacks of a single registered key. Settings are kept with the
 * highest priority at index 0 and runtime overrides always go on top.
 *
 * @since 1.0
 */
@SuppressWarnings("rawtypes")
class ConfigurationEntry {
  private static final Logger LOG = LoggerFactory.getLogger(
      ConfigurationEntry.class);

  /** The source name used for runtime overrides. */
  static final String RUNTIME_SOURCE = "RuntimeOverride";

  /** The non-null schema. */
  private final ConfigurationEntrySchema schema;

  /** The settings, highest priority first. */
  private final List<ConfigurationOverride> settings;

  /** A set of callbacks, lazily initialized. */
  private volatile Set<ConfigurationCallback> callbacks;

  /**
   * Package private ctor.
   * @param schema A non-null schema.
   */
  ConfigurationEntry(final ConfigurationEntrySchema schema) {
    if (schema == null) {
      throw new IllegalArgumentException("Schema cannot be null.");
    }
    this.schema = schema;
    settings = new CopyOnWriteArrayList<ConfigurationOverride>();
  }

  /** @return The current value, may be null. */
  Object getValue() {
    if (!settings.isEmpty()) {
      return settings.get(0).getValue();
    }
    return schema.getDefaultValue();
  }

  /**
   * Adds a value loaded from a provider at registration time. Providers
   * are loaded lowest priority first so each new one goes on top, below
   * any runtime override.
   * @param override A non-null override.
   * @throws IllegalArgumentException if the value was incompatible.
   */
  synchronized void addProviderSetting(final ConfigurationOverride override) {
    validate(override);
    if (!settings.isEmpty() &&
        settings.get(0).getSource().equals(RUNTIME_SOURCE)) {
      settings.add(1, override);
    } else {
      settings.add(0, override);
    }
  }

  /**
   * Sets or replaces the runtime override. Callbacks fire if the value
   * changed.
   * @param override A non-null override with the runtime source.
   * @throws IllegalArgumentException if the value was incompatible.
   * @throws ConfigurationException if the schema is not dynamic.
   */
  void addRuntimeOverride(final ConfigurationOverride override) {
    if (override == null) {
      throw new IllegalArgumentException("The setting cannot be null.");
    }
    if (!schema.isDynamic()) {
      throw new ConfigurationException("[" + schema.getKey()
          + "] Schema was marked as not dynamic. Updates not allowed.");
    }
    validate(override);
    synchronized (this) {
      if (!settings.isEmpty() &&
          settings.get(0).getSource().equals(RUNTIME_SOURCE)) {
        final Object extant = settings.get(0).getValue();
        if (extant == null ? override.getValue() == null
            : extant.equals(override.getValue())) {
          return;
        }
        settings.set(0, override);
      } else {
        settings.add(0, override);
      }
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("[" + schema.getKey() + "] Added runtime override: "
          + override);
    }
    executeCallbacks();
  }

  /**
   * Removes the runtime override if present.
   * @return True if an override was removed.
   */
  boolean removeRuntimeOverride() {
    synchronized (this) {
      if (settings.isEmpty() ||
          !settings.get(0).getSource().equals(RUNTIME_SOURCE)) {
        return false;
      }
      settings.remove(0);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("[" + schema.getKey() + "] Removed runtime override.");
    }
    executeCallbacks();
    return true;
  }

  /**
   * Adds the callback after calling it with the current value.
   * @param callback A non-null callback.
   */
  @SuppressWarnings("unchecked")
  void addCallback(final ConfigurationCallback callback) {
    if (callback == null) {
      throw new IllegalArgumentException("Callback cannot be null.");
    }
    if (callbacks == null) {
      synchronized (this) {
        if (callbacks == null) {
          callbacks = Sets.newConcurrentHashSet();
        }
      }
    }
    callback.update(schema.getKey(), convert());
    callbacks.add(callback);
  }

  @VisibleForTesting
  ConfigurationEntrySchema schema() {
    return schema;
  }

  @VisibleForTesting
  List<ConfigurationOverride> settings() {
    return settings;
  }

  private void validate(final ConfigurationOverride override) {
    if (Strings.isNullOrEmpty(override.getSource())) {
      throw new IllegalArgumentException("The setting's source cannot "
          + "be null or empty.");
    }
    try {
      override.validate(schema);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("[" + schema.getKey()
          + "] Invalid value from source [" + override.getSource()
          + "]: " + override.getValue(), e);
    }
  }

  private Object convert() {
    final Object value = getValue();
    if (value == null) {
      return null;
    }
    return Configuration.OBJECT_MAPPER.convertValue(value, schema.getType());
  }

  @SuppressWarnings("unchecked")
  private void executeCallbacks() {
    if (callbacks == null || callbacks.isEmpty()) {
      return;
    }
    final Object value = convert();
    for (final ConfigurationCallback callback : callbacks) {
      try {
        callback.update(schema.getKey(), value);
      } catch (Exception e) {
        LOG.error("Failed to update callback: " + callback
            + " with key [" + schema.getKey() + "]", e);
      }
    }
  }
}
