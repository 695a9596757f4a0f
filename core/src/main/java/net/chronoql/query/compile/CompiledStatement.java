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

import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import net.chronoql.exceptions.QueryCompileException;
import net.chronoql.exceptions.QueryCompileException.Reason;
import net.chronoql.query.Interval;
import net.chronoql.query.TimeRange;
import net.chronoql.query.ast.Call;
import net.chronoql.query.ast.Expr;
import net.chronoql.query.ast.Field;
import net.chronoql.query.ast.FillOption;
import net.chronoql.query.ast.SelectStatement;
import net.chronoql.query.ast.Source;
import net.chronoql.query.ast.SubQuery;
import net.chronoql.query.ast.VarRef;
import net.chronoql.query.condition.ConditionResolver;
import net.chronoql.query.condition.ExprReducer;
import net.chronoql.query.condition.NowValuer;
import net.chronoql.query.plan.PreparedStatement;
import net.chronoql.query.plan.SelectOptions;
import net.chronoql.query.plan.SelectPlanner;
import net.chronoql.query.plan.ShardMapper;

/**
 * The state accumulated while compiling one select statement. Each
 * statement and each subquery gets its own instance; the only state shared
 * down the tree is the {@link CompileOptions} with the fixed now.
 * <p>
 * The mutators are used by the field compiler and the function validators
 * while compiling and should not be called afterwards.
 *
 * @since 1.0
 */
public class CompiledStatement implements Statement {
  private static final Logger LOG = LoggerFactory.getLogger(
      CompiledStatement.class);

  /** The options with a resolved now. */
  private final CompileOptions options;

  /** The condition with the time predicates removed. */
  private Expr condition;

  /** The resolved time range. */
  private TimeRange time_range = TimeRange.UNBOUNDED;

  /** The GROUP BY time interval. */
  private Interval interval = Interval.ZERO;

  /** Whether the interval came from the parent statement. */
  private boolean inherited_interval;

  /** Whether the results are sorted by ascending time. */
  private boolean ascending = true;

  /** Every call encountered, including nested calls. */
  private final List<Call> function_calls = Lists.newArrayList();

  /** True until an aggregate that isn't a selector is encountered. */
  private boolean only_selectors = true;

  /** Whether distinct() was used. */
  private boolean has_distinct;

  /** The fill option. */
  private FillOption fill = FillOption.NULL;

  /** "top" or "bottom" when used, empty otherwise. */
  private String top_bottom_function = "";

  /** Whether raw fields, wildcards or regexes were selected. */
  private boolean has_auxiliary_fields;

  /** The compiled output fields in order. */
  private final List<CompiledField> fields = Lists.newArrayList();

  /** The name of the time column. */
  private String time_field_name = SelectStatement.TIME_FIELD;

  /** The per series row limit, 0 for none. */
  private int limit;

  /** Whether the statement writes INTO a target. */
  private boolean has_target;

  /** The compiled subqueries in source order. */
  private final List<CompiledStatement> subqueries = Lists.newArrayList();

  /** The rewritten statement after compilation. */
  private SelectStatement statement;

  /**
   * Package private ctor.
   * @param options Non-null options with a now.
   */
  CompiledStatement(final CompileOptions options) {
    if (options == null || !options.hasNow()) {
      throw new IllegalArgumentException("Options with a now are required.");
    }
    this.options = options;
  }

  /**
   * Records the statement wide attributes: sort direction, limit, target,
   * the resolved condition and time range, the GROUP BY interval and fill.
   * Unset time bounds default to the sentinels, except that the upper
   * bound of a statement with an interval defaults to now.
   * @param stmt A non-null statement.
   * @throws QueryCompileException if the condition or dimensions are
   * invalid.
   */
  void preprocess(final SelectStatement stmt) {
    ascending = stmt.isTimeAscending();
    limit = stmt.getLimit();
    has_target = stmt.getTarget() != null;

    final ConditionResolver.Result resolved = ConditionResolver.resolve(
        stmt.getCondition(), new NowValuer(options.getNow(),
            stmt.getLocation()));
    condition = resolved.getCondition();
    time_range = resolved.getTimeRange();

    interval = DimensionCompiler.compile(stmt, options.getNow());
    fill = stmt.getFill();

    if (!time_range.hasMin()) {
      time_range = time_range.withMin(TimeRange.MIN_TIME);
    }
    if (!time_range.hasMax()) {
      time_range = time_range.withMax(interval.isZero()
          ? TimeRange.MAX_TIME : options.getNow());
    }
  }

  /**
   * Compiles and validates the fields, then compiles each subquery source.
   * @param stmt A non-null statement.
   * @return The statement with subquery sources replaced by their compiled
   * forms.
   * @throws QueryCompileException if the statement is invalid.
   */
  SelectStatement compile(final SelectStatement stmt) {
    compileFields(stmt);
    StatementValidator.validate(this);

    // subqueries inherit state from this statement so they go last
    boolean rewritten = false;
    final List<Source> sources = Lists.newArrayListWithCapacity(
        stmt.getSources().size());
    for (final Source source : stmt.getSources()) {
      if (source instanceof SubQuery) {
        sources.add(new SubQuery(
            subquery(((SubQuery) source).getStatement())));
        rewritten = true;
      } else {
        sources.add(source);
      }
    }
    if (!rewritten) {
      return stmt;
    }
    return stmt.toBuilder()
        .setSources(sources)
        .build();
  }

  private void compileFields(final SelectStatement stmt) {
    for (final Field field : stmt.getFields()) {
      // time is always selected, an alias renames the column
      if (field.getExpr() instanceof VarRef &&
          ((VarRef) field.getExpr()).getName().equals(
              SelectStatement.TIME_FIELD)) {
        if (field.getAlias() != null) {
          time_field_name = field.getAlias();
        }
        continue;
      }

      final CompiledField compiled = new CompiledField(this, field, true);
      fields.add(compiled);
      compiled.compileExpr(field.getExpr());
    }
  }

  /**
   * Compiles a nested statement using this statement as the parent.
   * @param stmt A non-null nested statement.
   * @return The nested statement with now() reduced in its condition.
   */
  private SelectStatement subquery(final SelectStatement stmt) {
    final CompiledStatement subquery = new CompiledStatement(options);
    subquery.preprocess(stmt);

    // now() can't be resolved later so reduce it in the stored condition
    final SelectStatement reduced = stmt.toBuilder()
        .setCondition(ExprReducer.reduce(stmt.getCondition(),
            new NowValuer(options.getNow(), stmt.getLocation())))
        .build();

    if (!stmt.getSortFields().isEmpty() && subquery.ascending != ascending) {
      throw new QueryCompileException(Reason.SORT_DIRECTION_MISMATCH,
          "subqueries must be ordered in the same direction as the query "
          + "itself");
    }
    subquery.ascending = ascending;

    subquery.time_range = subquery.time_range.intersect(time_range);

    // fill(null) without a fill iterator is cheaper and equivalent
    if (!subquery.interval.isZero() && subquery.fill == FillOption.NULL) {
      subquery.fill = FillOption.NONE;
    }

    if (!interval.isZero() && subquery.interval.isZero()) {
      subquery.interval = interval;
      subquery.inherited_interval = true;
    }

    if (LOG.isDebugEnabled()) {
      LOG.debug("Compiling subquery with time range "
          + subquery.time_range + " and interval " + subquery.interval);
    }
    final SelectStatement compiled = subquery.compile(reduced);
    subquery.statement = compiled;
    subqueries.add(subquery);
    return compiled;
  }

  @Override
  public PreparedStatement prepare(final ShardMapper mapper,
                                   final SelectOptions options) {
    if (statement == null) {
      throw new IllegalStateException("Statement has not been compiled.");
    }
    return new SelectPlanner(this).prepare(mapper, options);
  }

  /** @return The options this statement was compiled with. */
  public CompileOptions getOptions() {
    return options;
  }

  /** @return The condition without time predicates, may be null. */
  public Expr getCondition() {
    return condition;
  }

  /** @return The resolved time range with both bounds set. */
  public TimeRange getTimeRange() {
    return time_range;
  }

  /** @return The GROUP BY time interval, may be zero. */
  public Interval getInterval() {
    return interval;
  }

  /** @return Whether the interval was inherited from the parent. */
  public boolean isInheritedInterval() {
    return inherited_interval;
  }

  public boolean isAscending() {
    return ascending;
  }

  /** @return An unmodifiable view of the calls encountered. */
  public List<Call> getFunctionCalls() {
    return Collections.unmodifiableList(function_calls);
  }

  public boolean isOnlySelectors() {
    return only_selectors;
  }

  public boolean hasDistinct() {
    return has_distinct;
  }

  public FillOption getFill() {
    return fill;
  }

  /** @return "top", "bottom" or an empty string. */
  public String getTopBottomFunction() {
    return top_bottom_function;
  }

  public boolean hasAuxiliaryFields() {
    return has_auxiliary_fields;
  }

  /** @return An unmodifiable view of the compiled fields. */
  public List<CompiledField> getFields() {
    return Collections.unmodifiableList(fields);
  }

  public String getTimeFieldName() {
    return time_field_name;
  }

  public int getLimit() {
    return limit;
  }

  public boolean hasTarget() {
    return has_target;
  }

  /** @return An unmodifiable view of the compiled subqueries. */
  public List<CompiledStatement> getSubqueries() {
    return Collections.unmodifiableList(subqueries);
  }

  /** @return The rewritten statement, null until compiled. */
  public SelectStatement getStatement() {
    return statement;
  }

  /**
   * Records a function call.
   * @param call A non-null call.
   */
  public void addFunctionCall(final Call call) {
    function_calls.add(call);
  }

  /** Marks the statement as using an aggregate that isn't a selector. */
  public void clearOnlySelectors() {
    only_selectors = false;
  }

  /** Marks the statement as using distinct(). */
  public void markDistinct() {
    has_distinct = true;
  }

  /** Marks the statement as selecting raw fields. */
  public void markAuxiliaryFields() {
    has_auxiliary_fields = true;
  }

  /**
   * @param name "top" or "bottom".
   */
  public void setTopBottomFunction(final String name) {
    top_bottom_function = name;
  }

  /**
   * Appends a field that wasn't in the select list, e.g. a tag named in
   * top() or bottom().
   * @param field A non-null compiled field.
   */
  public void addField(final CompiledField field) {
    fields.add(field);
  }

  /**
   * @param statement The rewritten statement.
   */
  void setStatement(final SelectStatement statement) {
    this.statement = statement;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{timeRange=")
        .append(time_range)
        .append(", interval=")
        .append(interval)
        .append(", inheritedInterval=")
        .append(inherited_interval)
        .append(", ascending=")
        .append(ascending)
        .append(", calls=")
        .append(function_calls)
        .append(", onlySelectors=")
        .append(only_selectors)
        .append(", hasDistinct=")
        .append(has_distinct)
        .append(", fill=")
        .append(fill)
        .append(", topBottom=")
        .append(top_bottom_function)
        .append(", hasAuxiliaryFields=")
        .append(has_auxiliary_fields)
        .append(", condition=")
        .append(condition)
        .append("}")
        .toString();
  }
}
