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

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.chronoql.exceptions.QueryCompileException;
import net.chronoql.exceptions.QueryCompileException.Reason;
import net.chronoql.query.ast.BinaryExpr;
import net.chronoql.query.ast.Call;
import net.chronoql.query.ast.DataType;
import net.chronoql.query.ast.Dimension;
import net.chronoql.query.ast.Expr;
import net.chronoql.query.ast.Exprs;
import net.chronoql.query.ast.Field;
import net.chronoql.query.ast.Measurement;
import net.chronoql.query.ast.ParenExpr;
import net.chronoql.query.ast.RegexLiteral;
import net.chronoql.query.ast.SelectStatement;
import net.chronoql.query.ast.Source;
import net.chronoql.query.ast.SubQuery;
import net.chronoql.query.ast.VarRef;
import net.chronoql.query.ast.Wildcard;
import net.chronoql.query.ast.Wildcard.WildcardType;
import net.chronoql.utils.Pair;

/**
 * Expands wildcards and regexes in the fields and GROUP BY clause of a
 * statement against the schema of its sources and assigns types to field
 * references that don't have one. Subqueries are rewritten first so their
 * output can be used as the schema of the parent.
 *
 * @since 1.0
 */
public final class FieldRewriter {
  private static final Logger LOG = LoggerFactory.getLogger(
      FieldRewriter.class);

  /** Types any function can expand to. */
  private static final Set<DataType> NUMERIC_TYPES = Collections
      .unmodifiableSet(EnumSet.of(DataType.FLOAT, DataType.INTEGER,
          DataType.UNSIGNED));

  private FieldRewriter() {
    // static
  }

  /**
   * Rewrites the statement.
   * @param stmt A non-null statement.
   * @param mapper A non-null mapper for measurement schemas.
   * @return The rewritten statement.
   * @throws QueryCompileException if a wildcard is used where it can't be
   * expanded.
   */
  public static SelectStatement rewrite(final SelectStatement stmt,
                                        final FieldMapper mapper) {
    final List<Source> sources = Lists.newArrayListWithCapacity(
        stmt.getSources().size());
    for (final Source source : stmt.getSources()) {
      if (source instanceof SubQuery) {
        sources.add(new SubQuery(
            rewrite(((SubQuery) source).getStatement(), mapper)));
      } else {
        sources.add(source);
      }
    }

    final List<Field> typed = Lists.newArrayListWithCapacity(
        stmt.getFields().size());
    for (final Field field : stmt.getFields()) {
      typed.add(new Field(typeRefs(field.getExpr(), sources, mapper),
          field.getAlias()));
    }
    final SelectStatement other = stmt.toBuilder()
        .setSources(sources)
        .setFields(typed)
        .setCondition(typeRefs(stmt.getCondition(), sources, mapper))
        .build();

    final boolean field_wildcard = other.hasFieldWildcard();
    final boolean dimension_wildcard = other.hasDimensionWildcard();
    if (!field_wildcard && !dimension_wildcard) {
      return other;
    }

    final Pair<Map<String, DataType>, Set<String>> schema =
        fieldDimensions(sources, mapper);
    final Set<String> tags = schema.getValue();

    if (!dimension_wildcard) {
      // grouped tags are already part of every row
      for (final Dimension dimension : other.getDimensions()) {
        if (dimension.getExpr() instanceof VarRef) {
          tags.remove(((VarRef) dimension.getExpr()).getName());
        }
      }
    }

    final List<VarRef> refs = Lists.newArrayList();
    if (!schema.getKey().isEmpty()) {
      for (final Map.Entry<String, DataType> entry :
          schema.getKey().entrySet()) {
        refs.add(new VarRef(entry.getKey(), entry.getValue()));
      }
      if (!dimension_wildcard) {
        for (final String tag : tags) {
          refs.add(new VarRef(tag, DataType.TAG));
        }
        tags.clear();
      }
      Collections.sort(refs, (a, b) -> {
        final int cmp = a.getName().compareTo(b.getName());
        return cmp != 0 ? cmp : a.getType().compareTo(b.getType());
      });
    }
    final List<String> dimensions = Lists.newArrayList(tags);
    Collections.sort(dimensions);

    final SelectStatement.Builder builder = other.toBuilder();
    if (field_wildcard) {
      builder.setFields(expandFields(other.getFields(), refs));
    }
    if (dimension_wildcard) {
      builder.setDimensions(expandDimensions(other.getDimensions(),
          dimensions));
    }
    final SelectStatement rewritten = builder.build();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Expanded wildcards in [" + stmt + "] to [" + rewritten
          + "]");
    }
    return rewritten;
  }

  /**
   * Merges the fields and tag keys of all sources. When a field has
   * different types in different sources the one with the highest
   * precedence wins.
   * @param sources The non-null sources.
   * @param mapper The mapper for measurement schemas.
   * @return A pair of mutable collections: the fields with their types and
   * the tag keys.
   */
  public static Pair<Map<String, DataType>, Set<String>> fieldDimensions(
      final List<Source> sources, final FieldMapper mapper) {
    final Map<String, DataType> fields = Maps.newHashMap();
    final Set<String> dimensions = Sets.newHashSet();
    for (final Source source : sources) {
      if (source instanceof Measurement) {
        final Pair<Map<String, DataType>, Set<String>> schema =
            mapper.fieldDimensions((Measurement) source);
        for (final Map.Entry<String, DataType> entry :
            schema.getKey().entrySet()) {
          merge(fields, entry.getKey(), entry.getValue());
        }
        dimensions.addAll(schema.getValue());
      } else if (source instanceof SubQuery) {
        final SelectStatement inner = ((SubQuery) source).getStatement();
        for (final Field field : inner.getFields()) {
          merge(fields, field.name(), TypeEvaluator.evalType(
              field.getExpr(), inner.getSources(), mapper));
        }
        for (final Dimension dimension : inner.getDimensions()) {
          if (dimension.getExpr() instanceof VarRef) {
            dimensions.add(((VarRef) dimension.getExpr()).getName());
          }
        }
      }
    }
    return new Pair<Map<String, DataType>, Set<String>>(fields, dimensions);
  }

  private static void merge(final Map<String, DataType> fields,
                            final String name,
                            final DataType type) {
    final DataType existing = fields.get(name);
    if (existing == null || existing.lessThan(type)) {
      fields.put(name, type);
    }
  }

  private static List<Field> expandFields(final List<Field> fields,
                                          final List<VarRef> refs) {
    final List<Field> expanded = Lists.newArrayList();
    for (final Field field : fields) {
      final Expr expr = field.getExpr();
      if (expr instanceof Wildcard) {
        final WildcardType type = ((Wildcard) expr).getType();
        for (final VarRef ref : refs) {
          if (type == WildcardType.FIELD && ref.getType() == DataType.TAG) {
            continue;
          }
          if (type == WildcardType.TAG && ref.getType() != DataType.TAG) {
            continue;
          }
          expanded.add(new Field(ref));
        }
      } else if (expr instanceof RegexLiteral) {
        for (final VarRef ref : refs) {
          if (((RegexLiteral) expr).matches(ref.getName())) {
            expanded.add(new Field(ref));
          }
        }
      } else if (expr instanceof Call) {
        expandCall(field, (Call) expr, refs, expanded);
      } else if (expr instanceof BinaryExpr) {
        if (Exprs.contains(expr, Wildcard.class)) {
          throw new QueryCompileException(Reason.INVALID_EXPRESSION,
              "unable to use wildcard in a binary expression");
        }
        if (Exprs.contains(expr, RegexLiteral.class)) {
          throw new QueryCompileException(Reason.INVALID_EXPRESSION,
              "unable to use regex in a binary expression");
        }
        expanded.add(field);
      } else {
        expanded.add(field);
      }
    }
    return expanded;
  }

  private static void expandCall(final Field field,
                                 final Call call,
                                 final List<VarRef> refs,
                                 final List<Field> expanded) {
    // the wildcard sits in the innermost call
    Call inner = call;
    while (!inner.getArgs().isEmpty() &&
           inner.getArgs().get(0) instanceof Call) {
      inner = (Call) inner.getArgs().get(0);
    }
    if (inner.getArgs().isEmpty()) {
      expanded.add(field);
      return;
    }

    final Expr arg = inner.getArgs().get(0);
    Pattern regex = null;
    if (arg instanceof Wildcard) {
      if (((Wildcard) arg).getType() == WildcardType.TAG) {
        throw new QueryCompileException(Reason.INVALID_EXPRESSION,
            "unable to use tag wildcard in " + inner.getName() + "()");
      }
    } else if (arg instanceof RegexLiteral) {
      regex = ((RegexLiteral) arg).getPattern();
    } else {
      expanded.add(field);
      return;
    }

    final Set<DataType> supported = supportedTypes(inner.getName());
    for (final VarRef ref : refs) {
      // tags in a function are almost never what was meant
      if (ref.getType() == DataType.TAG ||
          !supported.contains(ref.getType())) {
        continue;
      }
      if (regex != null && !regex.matcher(ref.getName()).find()) {
        continue;
      }
      expanded.add(new Field(replaceFirstArg(call, inner, ref),
          field.name() + "_" + ref.getName()));
    }
  }

  private static Set<DataType> supportedTypes(final String function) {
    final Set<DataType> types = EnumSet.copyOf(NUMERIC_TYPES);
    switch (function) {
    case "count":
    case "first":
    case "last":
    case "distinct":
    case "elapsed":
    case "mode":
    case "sample":
      types.add(DataType.STRING);
      types.add(DataType.BOOLEAN);
      break;
    case "min":
    case "max":
      types.add(DataType.BOOLEAN);
      break;
    case "holt_winters":
    case "holt_winters_with_fit":
      types.remove(DataType.UNSIGNED);
      break;
    default:
      break;
    }
    return types;
  }

  /** Rebuilds the call chain down to the target with a new first arg. */
  private static Call replaceFirstArg(final Call call,
                                      final Call target,
                                      final Expr replacement) {
    final List<Expr> args = Lists.newArrayList(call.getArgs());
    if (call == target) {
      args.set(0, replacement);
    } else {
      args.set(0, replaceFirstArg((Call) call.getArgs().get(0), target,
          replacement));
    }
    return call.withArgs(args);
  }

  private static List<Dimension> expandDimensions(
      final List<Dimension> dimensions, final List<String> tags) {
    final List<Dimension> expanded = Lists.newArrayList();
    for (final Dimension dimension : dimensions) {
      final Expr expr = dimension.getExpr();
      if (expr instanceof Wildcard) {
        for (final String tag : tags) {
          expanded.add(new Dimension(new VarRef(tag)));
        }
      } else if (expr instanceof RegexLiteral) {
        for (final String tag : tags) {
          if (((RegexLiteral) expr).matches(tag)) {
            expanded.add(new Dimension(new VarRef(tag)));
          }
        }
      } else {
        expanded.add(dimension);
      }
    }
    return expanded;
  }

  /** Assigns types to untyped references in the expression. */
  private static Expr typeRefs(final Expr expr,
                               final List<Source> sources,
                               final FieldMapper mapper) {
    if (expr instanceof VarRef) {
      final VarRef ref = (VarRef) expr;
      if (ref.getType() != DataType.UNKNOWN) {
        return ref;
      }
      return new VarRef(ref.getName(),
          TypeEvaluator.evalType(ref, sources, mapper));
    } else if (expr instanceof Call) {
      final Call call = (Call) expr;
      final List<Expr> args = Lists.newArrayListWithCapacity(
          call.getArgs().size());
      for (final Expr arg : call.getArgs()) {
        args.add(typeRefs(arg, sources, mapper));
      }
      return call.withArgs(args);
    } else if (expr instanceof BinaryExpr) {
      final BinaryExpr binary = (BinaryExpr) expr;
      return new BinaryExpr(binary.getOp(),
          typeRefs(binary.getLhs(), sources, mapper),
          typeRefs(binary.getRhs(), sources, mapper));
    } else if (expr instanceof ParenExpr) {
      return new ParenExpr(typeRefs(((ParenExpr) expr).getExpr(), sources,
          mapper));
    }
    return expr;
  }
}
