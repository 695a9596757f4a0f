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
package net.chronoql.utils;

import com.google.common.base.Objects;

/**
 * An immutable pair of related values, e.g. the fields and the tag keys
 * of a measurement. Either side may be null.
 *
 * @param <K> The left hand type.
 * @param <V> The right hand type.
 *
 * @since 1.0
 */
public final class Pair<K, V> {
  private final K key;
  private final V value;

  /**
   * Default ctor.
   * @param key The left hand value, may be null.
   * @param value The right hand value, may be null.
   */
  public Pair(final K key, final V value) {
    this.key = key;
    this.value = value;
  }

  /** @return The left hand value, may be null. */
  public K getKey() {
    return key;
  }

  /** @return The right hand value, may be null. */
  public V getValue() {
    return value;
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof Pair)) {
      return false;
    }
    final Pair<?, ?> other = (Pair<?, ?>) o;
    return Objects.equal(key, other.key) && Objects.equal(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(key, value);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{key=")
        .append(key)
        .append(", value=")
        .append(value)
        .append("}")
        .toString();
  }
}
