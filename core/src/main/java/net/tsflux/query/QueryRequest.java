// This file is part of TSFlux.
// Copyright (C) 2024  The TSFlux Authors.
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
package net.tsflux.query;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.tsflux.data.FluxTable;
import net.tsflux.exceptions.QueryValidationException;
import net.tsflux.query.flux.FluxSyntax;
import net.tsflux.utils.DateTime;

/**
 * Immutable description of one logical fetch: where to read, which fields,
 * how to filter, group, aggregate and scale them and how to cut the range
 * into sub-windows. Everything is validated in {@link Builder#build()} so a
 * request that exists can always be rendered.
 * <p>
 * Requests can be parsed from JSON or YAML, e.g.:
 * <pre>
 * bucket: sensors
 * measurement: air
 * start: 2023/01/15 00:00:00
 * end: 2023-04-03T00:00:00Z
 * fields: [pm25, pm10]
 * groups: [site]
 * booleanFilters:
 *   status: ok
 *   flag: {value: valid, column: pm25}
 * splitUnit: month
 * </pre>
 *
 * @since 1.0
 */
@JsonDeserialize(builder = QueryRequest.Builder.class)
public class QueryRequest {

  /** The source bucket. */
  private final String bucket;

  /** The measurement all rows must belong to. */
  private final String measurement;

  /** The inclusive start of the range. */
  private final Instant start;

  /** The exclusive end of the range. */
  private final Instant end;

  /** The non-empty fields requested in the output. */
  private final List<String> fields;

  /** The possibly empty tag keys to group by. */
  private final List<String> groups;

  /** Tag key to filter, in insertion order. */
  private final Map<String, BooleanFilter> boolean_filters;

  /** Range filters in order. */
  private final List<RangeFilter> range_filters;

  /** The window settings, defaults when not given. */
  private final WindowConfig window;

  /** Scaling entries in order. */
  private final List<ScalingConfig> scaling;

  /** How to cut the range. */
  private final SplitUnit split_unit;

  /** Whether column names are decomposed into (group, field) keys. */
  private final boolean multiindex;

  /** Whether the window stage is emitted. */
  private final boolean aggregate;

  /**
   * Protected ctor.
   * @param builder The non-null builder.
   * @throws QueryValidationException if the request was malformed.
   */
  protected QueryRequest(final Builder builder) {
    bucket = FluxSyntax.validateIdentifier("Bucket", builder.bucket);
    measurement = FluxSyntax.validateIdentifier("Measurement",
        builder.measurement);
    if (builder.start == null || builder.end == null) {
      throw new QueryValidationException("Start and end cannot be null.");
    }
    if (!builder.start.isBefore(builder.end)) {
      throw new QueryValidationException("Start " + builder.start
          + " must be before end " + builder.end);
    }
    start = builder.start;
    end = builder.end;

    if (builder.fields == null || builder.fields.isEmpty()) {
      throw new QueryValidationException("At least one field is required.");
    }
    for (final String field : builder.fields) {
      FluxSyntax.validateIdentifier("Field", field);
    }
    fields = ImmutableList.copyOf(builder.fields);

    if (builder.groups != null) {
      for (final String group : builder.groups) {
        FluxSyntax.validateIdentifier("Group", group);
      }
      groups = ImmutableList.copyOf(builder.groups);
    } else {
      groups = Collections.emptyList();
    }

    if (builder.booleanFilters != null) {
      final Map<String, BooleanFilter> filters = Maps.newLinkedHashMap();
      for (final Entry<String, BooleanFilter> entry :
          builder.booleanFilters.entrySet()) {
        FluxSyntax.validateIdentifier("Filter key", entry.getKey());
        if (entry.getValue() == null) {
          throw new QueryValidationException("Filter for key "
              + entry.getKey() + " cannot be null.");
        }
        filters.put(entry.getKey(), entry.getValue());
      }
      boolean_filters = Collections.unmodifiableMap(filters);
    } else {
      boolean_filters = Collections.emptyMap();
    }

    range_filters = builder.rangeFilters == null
        ? Collections.<RangeFilter>emptyList()
        : ImmutableList.copyOf(builder.rangeFilters);
    scaling = builder.scaling == null
        ? Collections.<ScalingConfig>emptyList()
        : ImmutableList.copyOf(builder.scaling);
    WindowConfig window_config = builder.window == null
        ? WindowConfig.newBuilder().build() : builder.window;
    // flat keys override the window block
    if (builder.winRange != null || builder.winFunc != null
        || builder.hourBeginning != null) {
      final WindowConfig.Builder merged = WindowConfig.newBuilder(window_config);
      if (builder.winRange != null) {
        merged.setEvery(builder.winRange);
      }
      if (builder.winFunc != null) {
        merged.setFunction(builder.winFunc);
      }
      if (builder.hourBeginning != null) {
        merged.setAlignToStart(builder.hourBeginning);
      }
      window_config = merged.build();
    }
    window = window_config;
    split_unit = builder.splitUnit == null ? SplitUnit.NONE : builder.splitUnit;
    multiindex = builder.multiindex;
    aggregate = builder.aggregate;
  }

  /** @return The source bucket. */
  public String getBucket() {
    return bucket;
  }

  /** @return The measurement. */
  public String getMeasurement() {
    return measurement;
  }

  /** @return The inclusive start. */
  public Instant getStart() {
    return start;
  }

  /** @return The exclusive end. */
  public Instant getEnd() {
    return end;
  }

  /** @return The non-empty requested fields. */
  public List<String> getFields() {
    return fields;
  }

  /** @return The group keys, possibly empty. */
  public List<String> getGroups() {
    return groups;
  }

  /** @return Boolean filters by tag key, plain and targeted. */
  public Map<String, BooleanFilter> getBooleanFilters() {
    return boolean_filters;
  }

  /** @return The range filters, possibly empty. */
  public List<RangeFilter> getRangeFilters() {
    return range_filters;
  }

  /** @return The window settings, never null. */
  public WindowConfig getWindow() {
    return window;
  }

  /** @return The scaling entries, possibly empty. */
  public List<ScalingConfig> getScaling() {
    return scaling;
  }

  /** @return The split unit, never null. */
  public SplitUnit getSplitUnit() {
    return split_unit;
  }

  /** @return Whether output columns are decomposed into (group, field). */
  public boolean isMultiindex() {
    return multiindex;
  }

  /** @return Whether the window stage is emitted. */
  public boolean isAggregate() {
    return aggregate;
  }

  /**
   * @return Fields referenced by range filters but not requested. They are
   * fetched so the bounds can be evaluated and dropped from the output.
   */
  public List<String> getExtraFields() {
    final List<String> extra = Lists.newArrayList();
    for (final RangeFilter filter : range_filters) {
      if (!fields.contains(filter.getField())
          && !extra.contains(filter.getField())) {
        extra.add(filter.getField());
      }
    }
    return extra;
  }

  /** @return The requested fields followed by the extra fields. */
  public List<String> getQueriedFields() {
    final List<String> all = Lists.newArrayList(fields);
    all.addAll(getExtraFields());
    return all;
  }

  /**
   * @return The column key of the final pivot. The field name is part of the
   * key when several fields are requested, in multi-index mode or when
   * there are no groups.
   */
  public List<String> getPivotColumns() {
    final List<String> columns = Lists.newArrayList(groups);
    if (fields.size() > 1 || multiindex || groups.isEmpty()) {
      columns.add(FluxTable.FIELD_COLUMN);
    }
    return columns;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{bucket=")
        .append(bucket)
        .append(", measurement=")
        .append(measurement)
        .append(", start=")
        .append(start)
        .append(", end=")
        .append(end)
        .append(", fields=")
        .append(fields)
        .append(", groups=")
        .append(groups)
        .append(", booleanFilters=")
        .append(boolean_filters)
        .append(", rangeFilters=")
        .append(range_filters)
        .append(", window=")
        .append(window)
        .append(", scaling=")
        .append(scaling)
        .append(", splitUnit=")
        .append(split_unit)
        .append(", multiindex=")
        .append(multiindex)
        .append(", aggregate=")
        .append(aggregate)
        .append("}")
        .toString();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Builder {
    @JsonProperty
    private String bucket;
    @JsonProperty
    private String measurement;
    private Instant start;
    private Instant end;
    @JsonProperty
    private List<String> fields;
    @JsonProperty
    private List<String> groups;
    private Map<String, BooleanFilter> booleanFilters;
    @JsonProperty
    private List<RangeFilter> rangeFilters;
    @JsonProperty
    private WindowConfig window;
    /** Window settings given at the top level of older config files. */
    @JsonProperty("win_range")
    private String winRange;
    @JsonProperty("win_func")
    private String winFunc;
    @JsonProperty("hour_beginning")
    private Boolean hourBeginning;
    @JsonProperty
    private List<ScalingConfig> scaling;
    @JsonProperty
    @JsonAlias("time_split")
    private SplitUnit splitUnit;
    @JsonProperty
    private boolean multiindex;
    @JsonProperty
    private boolean aggregate;

    public Builder setBucket(final String bucket) {
      this.bucket = bucket;
      return this;
    }

    public Builder setMeasurement(final String measurement) {
      this.measurement = measurement;
      return this;
    }

    public Builder setStart(final Instant start) {
      this.start = start;
      return this;
    }

    /**
     * @param start A timestamp parsed with
     * {@link DateTime#parseTimestamp(String)}.
     * @return The builder.
     */
    @JsonProperty("start")
    public Builder setStart(final String start) {
      this.start = DateTime.parseTimestamp(start);
      return this;
    }

    public Builder setEnd(final Instant end) {
      this.end = end;
      return this;
    }

    /**
     * @param end A timestamp parsed with
     * {@link DateTime#parseTimestamp(String)}.
     * @return The builder.
     */
    @JsonProperty("end")
    public Builder setEnd(final String end) {
      this.end = DateTime.parseTimestamp(end);
      return this;
    }

    public Builder setFields(final List<String> fields) {
      this.fields = fields;
      return this;
    }

    public Builder addField(final String field) {
      if (fields == null) {
        fields = Lists.newArrayList();
      }
      fields.add(field);
      return this;
    }

    public Builder setGroups(final List<String> groups) {
      this.groups = groups;
      return this;
    }

    public Builder addGroup(final String group) {
      if (groups == null) {
        groups = Lists.newArrayList();
      }
      groups.add(group);
      return this;
    }

    public Builder setBooleanFilters(
        final Map<String, BooleanFilter> boolean_filters) {
      this.booleanFilters = boolean_filters;
      return this;
    }

    /**
     * Adds a plain filter keeping only rows where the tag equals the value.
     * @param key The tag key.
     * @param value The expected value.
     * @return The builder.
     */
    public Builder addBooleanFilter(final String key, final String value) {
      return addBooleanFilter(key, BooleanFilter.plain(value));
    }

    public Builder addBooleanFilter(final String key,
                                    final BooleanFilter filter) {
      if (booleanFilters == null) {
        booleanFilters = Maps.newLinkedHashMap();
      }
      booleanFilters.put(key, filter);
      return this;
    }

    /**
     * Parses filters from configuration where a value is either a string
     * for a plain filter or a map with "value" and "column" entries for a
     * targeted filter.
     * @param config The filter map.
     * @return The builder.
     * @throws QueryValidationException if an entry had an unexpected shape.
     */
    @JsonProperty("booleanFilters")
    @JsonAlias("bool_filters")
    public Builder setBooleanFilterConfig(final Map<String, Object> config) {
      booleanFilters = Maps.newLinkedHashMap();
      if (config == null) {
        return this;
      }
      for (final Entry<String, Object> entry : config.entrySet()) {
        booleanFilters.put(entry.getKey(),
            BooleanFilter.fromConfig(entry.getKey(), entry.getValue()));
      }
      return this;
    }

    public Builder setRangeFilters(final List<RangeFilter> range_filters) {
      this.rangeFilters = range_filters;
      return this;
    }

    public Builder addRangeFilter(final RangeFilter filter) {
      if (rangeFilters == null) {
        rangeFilters = Lists.newArrayList();
      }
      rangeFilters.add(filter);
      return this;
    }

    public Builder setWindow(final WindowConfig window) {
      this.window = window;
      return this;
    }

    public Builder setScaling(final List<ScalingConfig> scaling) {
      this.scaling = scaling;
      return this;
    }

    public Builder addScaling(final ScalingConfig scaling) {
      if (this.scaling == null) {
        this.scaling = Lists.newArrayList();
      }
      this.scaling.add(scaling);
      return this;
    }

    public Builder setSplitUnit(final SplitUnit split_unit) {
      this.splitUnit = split_unit;
      return this;
    }

    public Builder setMultiindex(final boolean multiindex) {
      this.multiindex = multiindex;
      return this;
    }

    public Builder setAggregate(final boolean aggregate) {
      this.aggregate = aggregate;
      return this;
    }

    /**
     * @return The validated request.
     * @throws QueryValidationException if the request was malformed.
     */
    public QueryRequest build() {
      return new QueryRequest(this);
    }
  }

  /**
   * A tag equality filter. Without a column it drops rows whose tag does not
   * match. With a column it is a mask: the column's value is nulled on rows
   * where the tag does not match and every other column is left alone.
   */
  public static class BooleanFilter {
    private final String value;
    private final String column;

    protected BooleanFilter(final String value, final String column) {
      this.value = FluxSyntax.validateIdentifier("Filter value", value);
      if (column != null) {
        FluxSyntax.validateIdentifier("Filter column", column);
      }
      this.column = column;
    }

    /**
     * @param value The expected tag value.
     * @return A row dropping filter.
     */
    public static BooleanFilter plain(final String value) {
      return new BooleanFilter(value, null);
    }

    /**
     * @param value The expected tag value.
     * @param column The field whose value is trusted only on a match.
     * @return A masking filter.
     */
    public static BooleanFilter targeted(final String value,
                                         final String column) {
      if (Strings.isNullOrEmpty(column)) {
        throw new QueryValidationException("Targeted filter column cannot "
            + "be null or empty.");
      }
      return new BooleanFilter(value, column);
    }

    static BooleanFilter fromConfig(final String key, final Object config) {
      if (config instanceof String) {
        return plain((String) config);
      }
      if (config instanceof Map) {
        final Map<?, ?> map = (Map<?, ?>) config;
        final Object value = map.containsKey("value")
            ? map.get("value") : map.get("Value");
        final Object column = map.containsKey("column")
            ? map.get("column") : map.get("Col");
        if (!(value instanceof String) || !(column instanceof String)) {
          throw new QueryValidationException("Targeted filter for key " + key
              + " requires string 'value' and 'column' entries: " + config);
        }
        return targeted((String) value, (String) column);
      }
      throw new QueryValidationException("Filter for key " + key
          + " must be a string or a map: " + config);
    }

    /** @return The expected tag value. */
    public String getValue() {
      return value;
    }

    /** @return The masked column, null for a plain filter. */
    public String getColumn() {
      return column;
    }

    /** @return Whether this is a mask rather than a row filter. */
    public boolean isTargeted() {
      return column != null;
    }

    @Override
    public boolean equals(final Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof BooleanFilter)) {
        return false;
      }
      final BooleanFilter other = (BooleanFilter) o;
      return Objects.equal(value, other.value) &&
          Objects.equal(column, other.column);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(value, column);
    }

    @Override
    public String toString() {
      return column == null ? value : "{value=" + value + ", column="
          + column + "}";
    }
  }

  /**
   * Bounds on a field evaluated on the pivoted row. Each bound is inclusive
   * or exclusive independently.
   */
  @JsonDeserialize(builder = RangeFilter.Builder.class)
  public static class RangeFilter {
    private final String field;
    private final Number min;
    private final Number max;
    private final boolean min_inclusive;
    private final boolean max_inclusive;

    protected RangeFilter(final Builder builder) {
      field = FluxSyntax.validateIdentifier("Range filter field",
          builder.field);
      if (builder.min == null || builder.max == null) {
        throw new QueryValidationException("Range filter on " + field
            + " requires both min and max.");
      }
      // validates finiteness
      FluxSyntax.number("Range filter min", builder.min);
      FluxSyntax.number("Range filter max", builder.max);
      if (builder.min.doubleValue() > builder.max.doubleValue()) {
        throw new QueryValidationException("Range filter on " + field
            + " has min " + builder.min + " greater than max " + builder.max);
      }
      min = builder.min;
      max = builder.max;
      min_inclusive = builder.minInclusive;
      max_inclusive = builder.maxInclusive;
    }

    public String getField() {
      return field;
    }

    public Number getMin() {
      return min;
    }

    public Number getMax() {
      return max;
    }

    public boolean isMinInclusive() {
      return min_inclusive;
    }

    public boolean isMaxInclusive() {
      return max_inclusive;
    }

    @Override
    public String toString() {
      return (min_inclusive ? "[" : "(") + min + ", " + max
          + (max_inclusive ? "]" : ")") + " on " + field;
    }

    public static Builder newBuilder() {
      return new Builder();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
      @JsonProperty
      @JsonAlias("Field")
      private String field;
      @JsonProperty
      @JsonAlias("Min")
      private Number min;
      @JsonProperty
      @JsonAlias("Max")
      private Number max;
      @JsonProperty
      @JsonAlias("Min Equal")
      private boolean minInclusive;
      @JsonProperty
      @JsonAlias("Max Equal")
      private boolean maxInclusive;

      public Builder setField(final String field) {
        this.field = field;
        return this;
      }

      public Builder setMin(final Number min) {
        this.min = min;
        return this;
      }

      public Builder setMax(final Number max) {
        this.max = max;
        return this;
      }

      public Builder setMinInclusive(final boolean min_inclusive) {
        this.minInclusive = min_inclusive;
        return this;
      }

      public Builder setMaxInclusive(final boolean max_inclusive) {
        this.maxInclusive = max_inclusive;
        return this;
      }

      public RangeFilter build() {
        return new RangeFilter(this);
      }
    }
  }

  /**
   * Settings of the windowed aggregation stage. Defaults to hourly means
   * stamped with the window end, aggregating "_value" and emitting nulls for
   * empty windows.
   */
  @JsonDeserialize(builder = WindowConfig.Builder.class)
  public static class WindowConfig {
    public static final String DEFAULT_EVERY = "1h";
    public static final String DEFAULT_FUNCTION = "mean";

    private final String every;
    private final String function;
    private final boolean align_to_start;
    private final String column;
    private final boolean create_empty;

    protected WindowConfig(final Builder builder) {
      every = FluxSyntax.duration("Window size",
          Strings.isNullOrEmpty(builder.every) ? DEFAULT_EVERY : builder.every);
      function = FluxSyntax.function("Window function",
          Strings.isNullOrEmpty(builder.function)
              ? DEFAULT_FUNCTION : builder.function);
      column = FluxSyntax.validateIdentifier("Window column",
          Strings.isNullOrEmpty(builder.column)
              ? FluxTable.VALUE_COLUMN : builder.column);
      align_to_start = builder.alignToStart;
      create_empty = builder.createEmpty;
    }

    /** @return The window size literal, e.g. "1h". */
    public String getEvery() {
      return every;
    }

    /** @return The aggregation function, e.g. "mean". */
    public String getFunction() {
      return function;
    }

    /** @return True to stamp rows with the window start, false for the end. */
    public boolean isAlignToStart() {
      return align_to_start;
    }

    /** @return The aggregated column. */
    public String getColumn() {
      return column;
    }

    /** @return Whether empty windows produce a null row. */
    public boolean isCreateEmpty() {
      return create_empty;
    }

    @Override
    public String toString() {
      return "{every=" + every + ", function=" + function + ", alignToStart="
          + align_to_start + ", column=" + column + ", createEmpty="
          + create_empty + "}";
    }

    public static Builder newBuilder() {
      return new Builder();
    }

    /**
     * @param config The settings to start from.
     * @return A builder seeded with the given settings.
     */
    public static Builder newBuilder(final WindowConfig config) {
      return new Builder()
          .setEvery(config.every)
          .setFunction(config.function)
          .setAlignToStart(config.align_to_start)
          .setColumn(config.column)
          .setCreateEmpty(config.create_empty);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
      @JsonProperty
      @JsonAlias("win_range")
      private String every;
      @JsonProperty
      @JsonAlias("win_func")
      private String function;
      @JsonProperty
      @JsonAlias("hour_beginning")
      private boolean alignToStart;
      @JsonProperty
      private String column;
      @JsonProperty
      private boolean createEmpty = true;

      public Builder setEvery(final String every) {
        this.every = every;
        return this;
      }

      public Builder setFunction(final String function) {
        this.function = function;
        return this;
      }

      public Builder setAlignToStart(final boolean align_to_start) {
        this.alignToStart = align_to_start;
        return this;
      }

      public Builder setColumn(final String column) {
        this.column = column;
        return this;
      }

      public Builder setCreateEmpty(final boolean create_empty) {
        this.createEmpty = create_empty;
        return this;
      }

      public WindowConfig build() {
        return new WindowConfig(this);
      }
    }
  }

  /**
   * A linear correction {@code value * slope + offset} applied to one column
   * for timestamps within {@code [start, end)}. Missing bounds default to the
   * bounds of the sub-window being rendered.
   */
  @JsonDeserialize(builder = ScalingConfig.Builder.class)
  public static class ScalingConfig {
    private final String field;
    private final Instant start;
    private final Instant end;
    private final Number slope;
    private final Number offset;

    protected ScalingConfig(final Builder builder) {
      field = FluxSyntax.validateIdentifier("Scaling field", builder.field);
      if (builder.start != null && builder.end != null
          && builder.end.isBefore(builder.start)) {
        throw new QueryValidationException("Scaling of " + field
            + " ends at " + builder.end + " before its start "
            + builder.start);
      }
      start = builder.start;
      end = builder.end;
      slope = builder.slope == null ? Integer.valueOf(1) : builder.slope;
      offset = builder.offset == null ? Integer.valueOf(0) : builder.offset;
      FluxSyntax.number("Scaling slope", slope);
      FluxSyntax.number("Scaling offset", offset);
    }

    public String getField() {
      return field;
    }

    /** @return The inclusive start or null to use the sub-window start. */
    public Instant getStart() {
      return start;
    }

    /** @return The exclusive end or null to use the sub-window end. */
    public Instant getEnd() {
      return end;
    }

    public Number getSlope() {
      return slope;
    }

    public Number getOffset() {
      return offset;
    }

    @Override
    public String toString() {
      return "{field=" + field + ", start=" + start + ", end=" + end
          + ", slope=" + slope + ", offset=" + offset + "}";
    }

    public static Builder newBuilder() {
      return new Builder();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
      @JsonProperty
      @JsonAlias("Field")
      private String field;
      private Instant start;
      private Instant end;
      @JsonProperty
      @JsonAlias("Slope")
      private Number slope;
      @JsonProperty
      @JsonAlias("Offset")
      private Number offset;

      public Builder setField(final String field) {
        this.field = field;
        return this;
      }

      public Builder setStart(final Instant start) {
        this.start = start;
        return this;
      }

      /**
       * @param start A timestamp such as "2023/01/15 00:00:00" (UTC) or
       * RFC3339.
       * @return The builder.
       */
      @JsonProperty("start")
      @JsonAlias("Start")
      public Builder setStart(final String start) {
        this.start = DateTime.parseTimestamp(start);
        return this;
      }

      public Builder setEnd(final Instant end) {
        this.end = end;
        return this;
      }

      /**
       * @param end A timestamp such as "2023/01/15 00:00:00" (UTC) or
       * RFC3339.
       * @return The builder.
       */
      @JsonProperty("end")
      @JsonAlias("End")
      public Builder setEnd(final String end) {
        this.end = DateTime.parseTimestamp(end);
        return this;
      }

      public Builder setSlope(final Number slope) {
        this.slope = slope;
        return this;
      }

      public Builder setOffset(final Number offset) {
        this.offset = offset;
        return this;
      }

      public ScalingConfig build() {
        return new ScalingConfig(this);
      }
    }
  }
}
