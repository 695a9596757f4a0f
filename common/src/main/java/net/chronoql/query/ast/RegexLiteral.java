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

/**
 * A regular expression, {@code /pattern/}, used to match field or tag names
 * or in {@code =~} and {@code !~} conditions.
 *
 * @since 1.0
 */
public class RegexLiteral extends Literal {
  private final Pattern pattern;

  /**
   * Default ctor.
   * @param pattern A non-null pattern.
   */
  public RegexLiteral(final Pattern pattern) {
    if (pattern == null) {
      throw new IllegalArgumentException("Pattern cannot be null.");
    }
    this.pattern = pattern;
  }

  /**
   * Compiles the given regular expression.
   * @param regex A non-null expression.
   * @throws java.util.regex.PatternSyntaxException if the expression was
   * invalid.
   */
  public RegexLiteral(final String regex) {
    this(Pattern.compile(regex));
  }

  public Pattern getPattern() {
    return pattern;
  }

  /**
   * @param value A non-null string.
   * @return True if the pattern is found anywhere in the value.
   */
  public boolean matches(final String value) {
    return pattern.matcher(value).find();
  }

  @Override
  public <R> R accept(final ExprVisitor<R> visitor) {
    return visitor.visitRegex(this);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return pattern.pattern().equals(((RegexLiteral) o).pattern.pattern());
  }

  @Override
  public int hashCode() {
    return pattern.pattern().hashCode();
  }

  @Override
  public String toString() {
    return "/" + pattern.pattern().replace("/", "\\/") + "/";
  }
}
