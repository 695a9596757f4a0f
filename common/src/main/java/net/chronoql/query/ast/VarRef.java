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

import com.google.common.base.Objects;
import com.google.common.base.Strings;

/**
 * A reference to a field or tag by name with an optional type hint.
 *
 * @since 1.0
 */
public class VarRef extends Expr {
  private final String name;
  private final DataType type;

  /**
   * Ctor for an untyped reference.
   * @param name A non-null and non-empty name.
   */
  public VarRef(final String name) {
    this(name, DataType.UNKNOWN);
  }

  /**
   * Ctor with a type hint.
   * @param name A non-null and non-empty name.
   * @param type A type, null is treated as {@link DataType#UNKNOWN}.
   */
  public VarRef(final String name, final DataType type) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Name cannot be null or empty.");
    }
    this.name = name;
    this.type = type == null ? DataType.UNKNOWN : type;
  }

  public String getName() {
    return name;
  }

  public DataType getType() {
    return type;
  }

  @Override
  public <R> R accept(final ExprVisitor<R> visitor) {
    return visitor.visitVarRef(this);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final VarRef other = (VarRef) o;
    return name.equals(other.name) && type == other.type;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, type);
  }

  @Override
  public String toString() {
    if (type == DataType.UNKNOWN) {
      return Identifiers.quote(name);
    }
    return Identifiers.quote(name) + "::" + type.castName();
  }
}
