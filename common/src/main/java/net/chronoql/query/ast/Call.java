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

import java.util.Collections;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * A function call such as {@code mean(value)} or {@code now()}.
 *
 * @since 1.0
 */
public class Call extends Expr {
  private final String name;
  private final List<Expr> args;

  /**
   * Default ctor.
   * @param name A non-null and non-empty function name.
   * @param args The arguments, null is treated as none.
   */
  public Call(final String name, final List<Expr> args) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Name cannot be null or empty.");
    }
    this.name = name;
    this.args = args == null ? Collections.<Expr>emptyList()
        : ImmutableList.copyOf(args);
  }

  /**
   * Varargs ctor.
   * @param name A non-null and non-empty function name.
   * @param args The arguments.
   */
  public Call(final String name, final Expr... args) {
    this(name, ImmutableList.copyOf(args));
  }

  public String getName() {
    return name;
  }

  /** @return An immutable list of arguments. */
  public List<Expr> getArgs() {
    return args;
  }

  /**
   * @param args The new arguments.
   * @return A copy of the call with the arguments replaced.
   */
  public Call withArgs(final List<Expr> args) {
    return new Call(name, args);
  }

  @Override
  public <R> R accept(final ExprVisitor<R> visitor) {
    return visitor.visitCall(this);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Call other = (Call) o;
    return name.equals(other.name) && args.equals(other.args);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, args);
  }

  @Override
  public String toString() {
    return name + "(" + Joiner.on(", ").join(args) + ")";
  }
}
