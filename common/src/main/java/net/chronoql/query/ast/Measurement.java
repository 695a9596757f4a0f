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

import java.util.regex.Pattern;

import com.google.common.base.Objects;
import com.google.common.base.Strings;

/**
 * A measurement source, either named or matched by a regular expression,
 * optionally qualified with a database and retention policy.
 *
 * @since 1.0
 */
public class Measurement implements Source {
  private final String database;
  private final String retention_policy;
  private final String name;
  private final Pattern regex;

  /**
   * Protected ctor.
   * @param builder A non-null builder.
   */
  protected Measurement(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.name) && builder.regex == null) {
      throw new IllegalArgumentException("Either a name or regex must be "
          + "given.");
    }
    if (!Strings.isNullOrEmpty(builder.name) && builder.regex != null) {
      throw new IllegalArgumentException("Only one of name or regex may be "
          + "given.");
    }
    database = Strings.emptyToNull(builder.database);
    retention_policy = Strings.emptyToNull(builder.retention_policy);
    name = Strings.emptyToNull(builder.name);
    regex = builder.regex;
  }

  /** @return The database or null for the default. */
  public String getDatabase() {
    return database;
  }

  /** @return The retention policy or null for the default. */
  public String getRetentionPolicy() {
    return retention_policy;
  }

  /** @return The name or null if matched by regex. */
  public String getName() {
    return name;
  }

  /** @return The regex or null if named. */
  public Pattern getRegex() {
    return regex;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Measurement other = (Measurement) o;
    return Objects.equal(database, other.database)
        && Objects.equal(retention_policy, other.retention_policy)
        && Objects.equal(name, other.name)
        && Objects.equal(regex == null ? null : regex.pattern(),
            other.regex == null ? null : other.regex.pattern());
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(database, retention_policy, name,
        regex == null ? null : regex.pattern());
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    if (database != null) {
      buf.append(Identifiers.quote(database)).append('.');
    }
    if (retention_policy != null) {
      buf.append(Identifiers.quote(retention_policy));
    }
    if (database != null || retention_policy != null) {
      buf.append('.');
    }
    if (name != null) {
      buf.append(Identifiers.quote(name));
    } else {
      buf.append(new RegexLiteral(regex));
    }
    return buf.toString();
  }

  /**
   * @param name A non-null and non-empty name.
   * @return A measurement in the default database and retention policy.
   */
  public static Measurement of(final String name) {
    return newBuilder().setName(name).build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private String database;
    private String retention_policy;
    private String name;
    private Pattern regex;

    public Builder setDatabase(final String database) {
      this.database = database;
      return this;
    }

    public Builder setRetentionPolicy(final String retention_policy) {
      this.retention_policy = retention_policy;
      return this;
    }

    public Builder setName(final String name) {
      this.name = name;
      return this;
    }

    public Builder setRegex(final Pattern regex) {
      this.regex = regex;
      return this;
    }

    public Measurement build() {
      return new Measurement(this);
    }
  }
}
