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
package net.chronoql.query.rewrite;

import java.util.Map;
import java.util.Set;

import net.chronoql.query.ast.DataType;
import net.chronoql.query.ast.Measurement;
import net.chronoql.utils.Pair;

/**
 * Schema lookups used to type field references and to expand wildcards.
 *
 * @since 1.0
 */
public interface FieldMapper {

  /**
   * Returns the fields with their types and the tag keys of a measurement.
   * @param measurement A non-null measurement.
   * @return A pair with a non-null field map as the key and a non-null set
   * of tag keys as the value.
   */
  public Pair<Map<String, DataType>, Set<String>> fieldDimensions(
      final Measurement measurement);

  /**
   * Returns the type of a field or tag in a measurement.
   * @param measurement A non-null measurement.
   * @param name A non-null field or tag name.
   * @return The type, {@link DataType#TAG} for tags and
   * {@link DataType#UNKNOWN} if the name doesn't exist.
   */
  public DataType mapType(final Measurement measurement, final String name);
}
