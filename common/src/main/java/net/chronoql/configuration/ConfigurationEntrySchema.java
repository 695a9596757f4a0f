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
 * The schema for a configuration key: its type, default, whether it can be
 * overridden at runtime and a description to help users.
 *
 * @since 1.0
 */
public class ConfigurationEntrySchema {

  /** The non-null and non-empty key. */
  protected final String key;

  /** The non-null type of the value. */
  protected final Class<?> type;

  /** The default value, may be null if nullable. */
  protected Object default_value;

  /** The non-null and non-empty description. */
  protected final String description;

  /** The class or component that registered the key. */
  protected final String source;

  /** Whether or not runtime overrides are allowed. */
  protected final boolean dynamic;

  /** Whether or not null values are allowed. */
  protected final boolean nullable;

  /**
   * Protected ctor.
   * @param builder A non-null builder.
   */
  protected ConfigurationEntrySchema(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    if (builder.type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    if (Strings.isNullOrEmpty(builder.description)) {
      throw new IllegalArgumentException("Description cannot be null or "
          + "empty. Help the users!");
    }
    if (builder.default_value == null && builder.type.isPrimitive()) {
      throw new IllegalArgumentException("The type of this schema was a "
          + "primitive value yet the default value was null.");
    }
    key = builder.key;
    type = builder.type;
    default_value = builder.default_value;
    description = builder.description;
    source = builder.source;
    dynamic = builder.dynamic;
    nullable = builder.nullable;
  }

  /** @return The key. */
  public String getKey() {
    return key;
  }

  /** @return The type. */
  public Class<?> getType() {
    return type;
  }

  /** @return The default value, may be null. */
  public Object getDefaultValue() {
    return default_value;
  }

  /** @return The description. */
  public String getDescription() {
    return description;
  }

  /** @return The source that registered the schema. May be null. */
  public String getSource() {
    return source;
  }

  /** @return Whether or not the value may be overridden at runtime. */
  public boolean isDynamic() {
    return dynamic;
  }

  /** @return Whether or not the value may be null. */
  public boolean isNullable() {
    return nullable;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{key=")
        .append(key)
        .append(", type=")
        .append(type.getSimpleName())
        .append(", default=")
        .append(default_value)
        .append(", dynamic=")
        .append(dynamic)
        .append(", source=")
        .append(source)
        .append("}")
        .toString();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private String key;
    private Class<?> type;
    private Object default_value;
    private String description;
    private String source;
    private boolean dynamic;
    private boolean nullable;

    public Builder setKey(final String key) {
      this.key = key;
      return this;
    }

    public Builder setType(final Class<?> type) {
      this.type = type;
      return this;
    }

    public Builder setDefaultValue(final Object default_value) {
      this.default_value = default_value;
      return this;
    }

    public Builder setDescription(final String description) {
      this.description = description;
      return this;
    }

    public Builder setSource(final String source) {
      this.source = source;
      return this;
    }

    public Builder isDynamic() {
      dynamic = true;
      return this;
    }

    public Builder isNullable() {
      nullable = true;
      return this;
    }

    public ConfigurationEntrySchema build() {
      return new ConfigurationEntrySchema(this);
    }
  }
}
