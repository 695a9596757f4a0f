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

import com.google.common.base.Strings;

/**
 * A value for a particular setting from a single source. Must be
 * associated with a {@link ConfigurationEntrySchema} to determine the key
 * and type.
 *
 * @since 1.0
 */
public class ConfigurationOverride {

  /** The source of the override. */
  protected final String source;

  /** The value of the override. */
  protected final Object value;

  /**
   * Protected builder ctor.
   * @param builder A non-null builder to load from.
   */
  protected ConfigurationOverride(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.source)) {
      throw new IllegalArgumentException("Source cannot be null or empty.");
    }
    source = builder.source;
    value = builder.value;
  }

  /** @return The non-null and non-empty source of this setting override. */
  public String getSource() {
    return source;
  }

  /** @return The value of this setting entry. May be null. */
  public Object getValue() {
    return value;
  }

  /**
   * Validates that the value can be converted to the schema's type.
   * @param schema The non-null schema to use to compare against.
   * @throws IllegalArgumentException if the value was incompatible.
   */
  public void validate(final ConfigurationEntrySchema schema) {
    if (schema == null) {
      throw new IllegalArgumentException("Schema cannot be null.");
    }
    if (value == null) {
      if (!schema.isNullable() || schema.getType().isPrimitive()) {
        throw new IllegalArgumentException("Null value is not allowed for "
            + "key: " + schema.getKey());
      }
      return;
    }
    Configuration.OBJECT_MAPPER.convertValue(value, schema.getType());
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{ value=")
        .append(value)
        .append(", source=")
        .append(source)
        .append(" }")
        .toString();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private String source;
    private Object value;

    public Builder setSource(final String source) {
      this.source = source;
      return this;
    }

    public Builder setValue(final Object value) {
      this.value = value;
      return this;
    }

    public ConfigurationOverride build() {
      return new ConfigurationOverride(this);
    }
  }
}
