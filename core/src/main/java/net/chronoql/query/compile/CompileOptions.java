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
package net.chronoql.query.compile;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import net.chronoql.query.TimeRange;

/**
 * Options for compiling a statement tree.
 *
 * @since 1.0
 */
@JsonDeserialize(builder = CompileOptions.Builder.class)
public class CompileOptions {

  /** The fixed now in nanoseconds or {@link TimeRange#UNSET}. */
  private final long now;

  /**
   * Protected ctor.
   * @param builder A non-null builder.
   */
  protected CompileOptions(final Builder builder) {
    now = builder.now;
  }

  /** @return The now timestamp in nanoseconds, may be unset. */
  public long getNow() {
    return now;
  }

  /** @return Whether or not a now timestamp was given. */
  @JsonIgnore
  public boolean hasNow() {
    return now != TimeRange.UNSET;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{now=")
        .append(hasNow() ? now : "unset")
        .append("}")
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private long now = TimeRange.UNSET;

    /**
     * @param now The fixed now in Unix epoch nanoseconds.
     * @return The builder.
     */
    public Builder setNow(final long now) {
      this.now = now;
      return this;
    }

    public CompileOptions build() {
      return new CompileOptions(this);
    }
  }
}
