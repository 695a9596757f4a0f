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

import java.time.ZoneId;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * A parsed SELECT statement. Instances are immutable; use
 * {@link #toBuilder()} to derive a modified copy.
 *
 * @since 1.0
 */
public class SelectStatement {
  /** The default name of the time column. */
  public static final String TIME_FIELD = "time";

  private final List<Field> fields;
  private final Target target;
  private final List<Dimension> dimensions;
  private final List<Source> sources;
  private final Expr condition;
  private final List<SortField> sort_fields;
  private final int limit;
  private final int offset;
  private final int series_limit;
  private final int series_offset;
  private final FillOption fill;
  private final Object fill_value;
  private final ZoneId location;
  private final String time_alias;
  private final boolean omit_time;

  /**
   * Protected ctor.
   * @param builder A non-null builder.
   */
  protected SelectStatement(final Builder builder) {
    if (builder.limit < 0 || builder.offset < 0 || builder.series_limit < 0
        || builder.series_offset < 0) {
      throw new IllegalArgumentException("Limits and offsets cannot be "
          + "negative.");
    }
    if (builder.fill == FillOption.NUMBER && builder.fill_value == null) {
      throw new IllegalArgumentException("A fill value is required for a "
          + "number fill.");
    }
    fields = ImmutableList.copyOf(builder.fields);
    target = builder.target;
    dimensions = ImmutableList.copyOf(builder.dimensions);
    sources = ImmutableList.copyOf(builder.sources);
    condition = builder.condition;
    sort_fields = ImmutableList.copyOf(builder.sort_fields);
    limit = builder.limit;
    offset = builder.offset;
    series_limit = builder.series_limit;
    series_offset = builder.series_offset;
    fill = builder.fill == null ? FillOption.NULL : builder.fill;
    fill_value = builder.fill_value;
    location = builder.location;
    time_alias = Strings.emptyToNull(builder.time_alias);
    omit_time = builder.omit_time;
  }

  public List<Field> getFields() {
    return fields;
  }

  /** @return The INTO target or null. */
  public Target getTarget() {
    return target;
  }

  public List<Dimension> getDimensions() {
    return dimensions;
  }

  public List<Source> getSources() {
    return sources;
  }

  /** @return The WHERE condition or null. */
  public Expr getCondition() {
    return condition;
  }

  public List<SortField> getSortFields() {
    return sort_fields;
  }

  /** @return The per series row limit, 0 for none. */
  public int getLimit() {
    return limit;
  }

  public int getOffset() {
    return offset;
  }

  /** @return The series limit, 0 for none. */
  public int getSeriesLimit() {
    return series_limit;
  }

  public int getSeriesOffset() {
    return series_offset;
  }

  public FillOption getFill() {
    return fill;
  }

  /** @return The fill value for {@link FillOption#NUMBER} or null. */
  public Object getFillValue() {
    return fill_value;
  }

  /** @return The zone from a {@code tz()} clause or null for UTC. */
  public ZoneId getLocation() {
    return location;
  }

  /** @return The alias of the time column or null. */
  public String getTimeAlias() {
    return time_alias;
  }

  public boolean isOmitTime() {
    return omit_time;
  }

  /** @return The time column name, the alias if set. */
  public String getTimeFieldName() {
    return time_alias == null ? TIME_FIELD : time_alias;
  }

  /** @return True unless the first sort field is descending. */
  public boolean isTimeAscending() {
    return sort_fields.isEmpty() || sort_fields.get(0).isAscending();
  }

  /** @return True if no field contains a function call. */
  public boolean isRawQuery() {
    for (final Field field : fields) {
      if (Exprs.any(field.getExpr(),
          e -> e instanceof Call || e instanceof Distinct)) {
        return false;
      }
    }
    return true;
  }

  /** @return True if a field contains a wildcard or regex. */
  public boolean hasFieldWildcard() {
    for (final Field field : fields) {
      if (Exprs.any(field.getExpr(),
          e -> e instanceof Wildcard || e instanceof RegexLiteral)) {
        return true;
      }
    }
    return false;
  }

  /** @return True if a GROUP BY dimension is a wildcard or regex. */
  public boolean hasDimensionWildcard() {
    for (final Dimension dimension : dimensions) {
      if (dimension.getExpr() instanceof Wildcard ||
          dimension.getExpr() instanceof RegexLiteral) {
        return true;
      }
    }
    return false;
  }

  /** @return A builder initialized with this statement's values. */
  public Builder toBuilder() {
    return newBuilder()
        .setFields(fields)
        .setTarget(target)
        .setDimensions(dimensions)
        .setSources(sources)
        .setCondition(condition)
        .setSortFields(sort_fields)
        .setLimit(limit)
        .setOffset(offset)
        .setSeriesLimit(series_limit)
        .setSeriesOffset(series_offset)
        .setFill(fill)
        .setFillValue(fill_value)
        .setLocation(location)
        .setTimeAlias(time_alias)
        .setOmitTime(omit_time);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final SelectStatement other = (SelectStatement) o;
    return fields.equals(other.fields)
        && Objects.equal(target, other.target)
        && dimensions.equals(other.dimensions)
        && sources.equals(other.sources)
        && Objects.equal(condition, other.condition)
        && sort_fields.equals(other.sort_fields)
        && limit == other.limit
        && offset == other.offset
        && series_limit == other.series_limit
        && series_offset == other.series_offset
        && fill == other.fill
        && Objects.equal(fill_value, other.fill_value)
        && Objects.equal(location, other.location)
        && Objects.equal(time_alias, other.time_alias)
        && omit_time == other.omit_time;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(fields, target, dimensions, sources, condition,
        sort_fields, limit, offset, series_limit, series_offset, fill,
        fill_value, location, time_alias, omit_time);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append("SELECT ")
        .append(Joiner.on(", ").join(fields));
    if (target != null) {
      buf.append(' ').append(target);
    }
    if (!sources.isEmpty()) {
      buf.append(" FROM ").append(Joiner.on(", ").join(sources));
    }
    if (condition != null) {
      buf.append(" WHERE ").append(condition);
    }
    if (!dimensions.isEmpty()) {
      buf.append(" GROUP BY ").append(Joiner.on(", ").join(dimensions));
    }
    switch (fill) {
    case NONE:
      buf.append(" fill(none)");
      break;
    case NUMBER:
      buf.append(" fill(").append(fill_value).append(')');
      break;
    case PREVIOUS:
      buf.append(" fill(previous)");
      break;
    case LINEAR:
      buf.append(" fill(linear)");
      break;
    default:
      break;
    }
    if (!sort_fields.isEmpty()) {
      buf.append(" ORDER BY ").append(Joiner.on(", ").join(sort_fields));
    }
    if (limit > 0) {
      buf.append(" LIMIT ").append(limit);
    }
    if (offset > 0) {
      buf.append(" OFFSET ").append(offset);
    }
    if (series_limit > 0) {
      buf.append(" SLIMIT ").append(series_limit);
    }
    if (series_offset > 0) {
      buf.append(" SOFFSET ").append(series_offset);
    }
    if (location != null) {
      buf.append(" tz('").append(location.getId()).append("')");
    }
    return buf.toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private List<Field> fields = Lists.newArrayList();
    private Target target;
    private List<Dimension> dimensions = Lists.newArrayList();
    private List<Source> sources = Lists.newArrayList();
    private Expr condition;
    private List<SortField> sort_fields = Lists.newArrayList();
    private int limit;
    private int offset;
    private int series_limit;
    private int series_offset;
    private FillOption fill = FillOption.NULL;
    private Object fill_value;
    private ZoneId location;
    private String time_alias;
    private boolean omit_time;

    public Builder setFields(final List<Field> fields) {
      this.fields = fields == null ? Lists.<Field>newArrayList()
          : Lists.newArrayList(fields);
      return this;
    }

    public Builder addField(final Field field) {
      fields.add(field);
      return this;
    }

    /**
     * Adds a field without an alias.
     * @param expr A non-null expression.
     * @return The builder.
     */
    public Builder addField(final Expr expr) {
      fields.add(new Field(expr));
      return this;
    }

    public Builder setTarget(final Target target) {
      this.target = target;
      return this;
    }

    public Builder setDimensions(final List<Dimension> dimensions) {
      this.dimensions = dimensions == null ? Lists.<Dimension>newArrayList()
          : Lists.newArrayList(dimensions);
      return this;
    }

    public Builder addDimension(final Expr expr) {
      dimensions.add(new Dimension(expr));
      return this;
    }

    public Builder setSources(final List<Source> sources) {
      this.sources = sources == null ? Lists.<Source>newArrayList()
          : Lists.newArrayList(sources);
      return this;
    }

    public Builder addSource(final Source source) {
      sources.add(source);
      return this;
    }

    public Builder setCondition(final Expr condition) {
      this.condition = condition;
      return this;
    }

    public Builder setSortFields(final List<SortField> sort_fields) {
      this.sort_fields = sort_fields == null
          ? Lists.<SortField>newArrayList()
          : Lists.newArrayList(sort_fields);
      return this;
    }

    public Builder addSortField(final SortField sort_field) {
      sort_fields.add(sort_field);
      return this;
    }

    public Builder setLimit(final int limit) {
      this.limit = limit;
      return this;
    }

    public Builder setOffset(final int offset) {
      this.offset = offset;
      return this;
    }

    public Builder setSeriesLimit(final int series_limit) {
      this.series_limit = series_limit;
      return this;
    }

    public Builder setSeriesOffset(final int series_offset) {
      this.series_offset = series_offset;
      return this;
    }

    public Builder setFill(final FillOption fill) {
      this.fill = fill;
      return this;
    }

    public Builder setFillValue(final Object fill_value) {
      this.fill_value = fill_value;
      return this;
    }

    public Builder setLocation(final ZoneId location) {
      this.location = location;
      return this;
    }

    public Builder setTimeAlias(final String time_alias) {
      this.time_alias = time_alias;
      return this;
    }

    public Builder setOmitTime(final boolean omit_time) {
      this.omit_time = omit_time;
      return this;
    }

    public SelectStatement build() {
      return new SelectStatement(this);
    }
  }
}
