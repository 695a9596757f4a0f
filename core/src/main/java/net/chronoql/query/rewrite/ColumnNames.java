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

import java.util.List;
import java.util.Map;

import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.chronoql.query.ast.Call;
import net.chronoql.query.ast.Expr;
import net.chronoql.query.ast.Field;
import net.chronoql.query.ast.SelectStatement;
import net.chronoql.query.ast.VarRef;

/**
 * Computes the output column names of a statement. The time column comes
 * first unless omitted, followed by one column per field plus one per tag
 * listed in {@code top()} or {@code bottom()}. Aliases are taken as is,
 * derived names that collide get a numeric suffix, e.g. {@code mean_1}.
 *
 * @since 1.0
 */
public final class ColumnNames {

  private ColumnNames() {
    // static
  }

  /**
   * @param stmt A non-null statement with expanded wildcards.
   * @return The non-null list of column names.
   */
  public static List<String> of(final SelectStatement stmt) {
    final List<Field> columns = Lists.newArrayList();
    for (final Field field : stmt.getFields()) {
      columns.add(field);
      if (stmt.getTarget() == null && field.getExpr() instanceof Call) {
        final Call call = (Call) field.getExpr();
        if (call.getName().equals("top") || call.getName().equals("bottom")) {
          for (final Expr arg : call.getArgs().subList(1,
              call.getArgs().size())) {
            if (arg instanceof VarRef) {
              columns.add(new Field(arg));
            }
          }
        }
      }
    }

    final int offset = stmt.isOmitTime() ? 0 : 1;
    final String[] names = new String[columns.size() + offset];
    if (!stmt.isOmitTime()) {
      names[0] = stmt.getTimeFieldName();
    }

    final Map<String, Integer> counts = Maps.newHashMap();
    for (int i = 0; i < columns.size(); i++) {
      final String alias = columns.get(i).getAlias();
      if (!Strings.isNullOrEmpty(alias)) {
        names[i + offset] = alias;
        counts.put(alias, 1);
      }
    }

    for (int i = 0; i < columns.size(); i++) {
      if (names[i + offset] != null) {
        continue;
      }
      String name = columns.get(i).name();
      final Integer existing = counts.get(name);
      if (existing != null) {
        int count = existing;
        while (true) {
          final String resolved = name + "_" + count;
          if (!counts.containsKey(resolved)) {
            counts.put(name, count + 1);
            name = resolved;
            break;
          }
          count++;
        }
      }
      final Integer current = counts.get(name);
      counts.put(name, current == null ? 1 : current + 1);
      names[i + offset] = name;
    }
    return Lists.newArrayList(names);
  }
}
