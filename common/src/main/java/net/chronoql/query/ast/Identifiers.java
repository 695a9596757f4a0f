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
 * Renders identifiers and strings for {@code toString()} output.
 */
final class Identifiers {
  private static final Pattern BARE = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

  private Identifiers() { }

  /**
   * @param name A non-null identifier.
   * @return The identifier, double quoted if it isn't a bare word.
   */
  static String quote(final String name) {
    if (BARE.matcher(name).matches()) {
      return name;
    }
    return "\"" + name.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }

  /**
   * @param value A non-null string.
   * @return The value single quoted with quotes and newlines escaped.
   */
  static String quoteString(final String value) {
    return "'" + value.replace("\\", "\\\\").replace("'", "\\'")
        .replace("\n", "\\n") + "'";
  }
}
