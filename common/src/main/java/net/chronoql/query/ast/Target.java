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

/**
 * The {@code INTO} clause of a statement writing its results.
 *
 * @since 1.0
 */
public class Target {
  private final Measurement measurement;

  /**
   * Default ctor.
   * @param measurement A non-null measurement to write into.
   */
  public Target(final Measurement measurement) {
    if (measurement == null) {
      throw new IllegalArgumentException("Measurement cannot be null.");
    }
    this.measurement = measurement;
  }

  public Measurement getMeasurement() {
    return measurement;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return measurement.equals(((Target) o).measurement);
  }

  @Override
  public int hashCode() {
    return measurement.hashCode();
  }

  @Override
  public String toString() {
    return "INTO " + measurement;
  }
}
