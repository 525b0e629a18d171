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
package net.tsflux.query.flux;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map.Entry;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import net.tsflux.data.FluxTable;
import net.tsflux.exceptions.QueryValidationException;
import net.tsflux.query.QueryRequest;
import net.tsflux.query.QueryRequest.BooleanFilter;
import net.tsflux.query.QueryRequest.RangeFilter;
import net.tsflux.query.QueryRequest.ScalingConfig;
import net.tsflux.query.QueryRequest.WindowConfig;
import net.tsflux.query.SubWindow;

/**
 * Accumulates pipeline stages and renders them as newline separated text.
 * The source stage is always first. Every caller supplied token is checked
 * by {@link FluxSyntax} before it is appended so rendering a built pipeline
 * cannot fail.
 * <p>
 * {@link #fromRequest(QueryRequest, SubWindow, StageOrder)} assembles the
 * stages of a fetch in their protocol order. The individual stage methods
 * are public for hand built pipelines.
 * <p>
 * Not thread safe.
 *
 * @since 1.0
 */
public class FluxPipelineBuilder {
  private static final Joiner LINE_JOINER = Joiner.on('\n');
  private static final Joiner COLUMN_JOINER = Joiner.on(", ");

  /** The rendered stages, in order. */
  private final List<String> stages;

  /** Range start, used as the default scaling start. */
  private final Instant start;

  /** Range end, used as the default scaling end. */
  private final Instant end;

  /**
   * Ctor that renders the source stage.
   * @param bucket The bucket to read.
   * @param start The inclusive start.
   * @param end The exclusive end.
   * @param measurement The measurement to keep.
   * @throws QueryValidationException if an argument was invalid.
   */
  public FluxPipelineBuilder(final String bucket,
                             final Instant start,
                             final Instant end,
                             final String measurement) {
    if (start != null && end != null && end.isBefore(start)) {
      throw new QueryValidationException("End " + end
          + " cannot be before start " + start);
    }
    this.start = start;
    this.end = end;
    stages = Lists.newArrayList();
    stages.add("import \"internal/debug\"");
    stages.add("import \"experimental\"");
    stages.add("from(bucket: " + FluxSyntax.quote("Bucket", bucket) + ")");
    stages.add("  |> range(start: " + FluxSyntax.time("Start", start)
        + ", stop: " + FluxSyntax.time("End", end) + ")");
    stages.add("  |> filter(fn: (r) => r._measurement == "
        + FluxSyntax.quote("Measurement", measurement) + ")");
  }

  /**
   * Keeps rows of any of the given fields.
   * @param fields A non-empty list of field names.
   * @return The builder.
   */
  public FluxPipelineBuilder addFields(final List<String> fields) {
    if (fields == null || fields.isEmpty()) {
      throw new QueryValidationException("At least one field is required.");
    }
    final StringBuilder buf = new StringBuilder("  |> filter(fn: (r) => ");
    for (int i = 0; i < fields.size(); i++) {
      if (i > 0) {
        buf.append(" or ");
      }
      buf.append("r[\"_field\"] == ")
         .append(FluxSyntax.quote("Field", fields.get(i)));
    }
    stages.add(buf.append(")").toString());
    return this;
  }

  /**
   * Groups by the given columns.
   * @param columns The columns, may be empty.
   * @return The builder.
   */
  public FluxPipelineBuilder addGroups(final List<String> columns) {
    stages.add("  |> group(columns: " + columnList("Group", columns) + ")");
    return this;
  }

  /**
   * Drops rows whose tag does not equal the value.
   * @param key The tag key.
   * @param value The expected value.
   * @return The builder.
   */
  public FluxPipelineBuilder addFilter(final String key, final String value) {
    stages.add("  |> filter(fn: (r) => r[" + FluxSyntax.quote("Filter key", key)
        + "] == " + FluxSyntax.quote("Filter value", value) + ")");
    return this;
  }

  /**
   * Nulls "_value" of the target field on rows whose tag does not equal the
   * value. Rows of other fields are untouched. Narrow form only.
   * @param key The tag key.
   * @param value The expected value.
   * @param column The field to mask.
   * @return The builder.
   */
  public FluxPipelineBuilder addTargetedFilter(final String key,
                                               final String value,
                                               final String column) {
    stages.add("  |> map(fn: (r) => ({ r with \"_value\": if r["
        + FluxSyntax.quote("Filter key", key) + "] == "
        + FluxSyntax.quote("Filter value", value) + " or r[\"_field\"] != "
        + FluxSyntax.quote("Filter column", column)
        + " then r[\"_value\"] else debug.null(type: \"float\")}))");
    return this;
  }

  /**
   * Nulls a column on rows whose tag does not equal the value. Wide form
   * only.
   * @param key The tag key.
   * @param value The expected value.
   * @param column The column to mask.
   * @return The builder.
   */
  public FluxPipelineBuilder addColumnMask(final String key,
                                           final String value,
                                           final String column) {
    final String target = FluxSyntax.quote("Filter column", column);
    stages.add("  |> map(fn: (r) => ({ r with " + target + ": if r["
        + FluxSyntax.quote("Filter key", key) + "] == "
        + FluxSyntax.quote("Filter value", value) + " then r[" + target
        + "] else debug.null(type: \"float\")}))");
    return this;
  }

  /**
   * Pivots on the field name, applies each bound and unpivots back to narrow
   * form. A no-op for an empty list.
   * @param filters The filters.
   * @return The builder.
   */
  public FluxPipelineBuilder addRangeFilters(final List<RangeFilter> filters) {
    if (filters == null || filters.isEmpty()) {
      return this;
    }
    addPivot(Collections.singletonList(FluxTable.FIELD_COLUMN));
    for (final RangeFilter filter : filters) {
      final String column = "r[" + FluxSyntax.quote("Range filter field",
          filter.getField()) + "]";
      stages.add("  |> filter(fn: (r) => " + column
          + (filter.isMinInclusive() ? " >= " : " > ")
          + FluxSyntax.number("Range filter min", filter.getMin())
          + " and " + column
          + (filter.isMaxInclusive() ? " <= " : " < ")
          + FluxSyntax.number("Range filter max", filter.getMax()) + ")");
    }
    stages.add("  |> experimental.unpivot()");
    return this;
  }

  /**
   * Aggregates over fixed windows. Empty windows yield a null row when the
   * config asks for it.
   * @param window The non-null window config.
   * @return The builder.
   */
  public FluxPipelineBuilder addWindow(final WindowConfig window) {
    if (window == null) {
      throw new QueryValidationException("Window config cannot be null.");
    }
    stages.add("  |> aggregateWindow(every: "
        + FluxSyntax.duration("Window size", window.getEvery())
        + ", fn: " + FluxSyntax.function("Window function",
            window.getFunction())
        + ", column: " + FluxSyntax.quote("Window column", window.getColumn())
        + ", timeSrc: \"" + (window.isAlignToStart()
            ? FluxTable.START_COLUMN : FluxTable.STOP_COLUMN)
        + "\", timeDst: \"_time\", createEmpty: "
        + window.isCreateEmpty() + ")");
    return this;
  }

  /**
   * Reshapes to one column per distinct combination of the column key.
   * @param columns The column key.
   * @return The builder.
   */
  public FluxPipelineBuilder addPivot(final List<String> columns) {
    stages.add("  |> pivot(rowKey: [\"_time\"], columnKey: "
        + columnList("Pivot column", columns)
        + ", valueColumn: \"_value\")");
    return this;
  }

  /**
   * Applies {@code value * slope + offset} to the column for timestamps in
   * the scaling range, leaving others untouched. Missing bounds default to
   * the bounds of this pipeline.
   * @param scaling The non-null scaling entry.
   * @return The builder.
   */
  public FluxPipelineBuilder addScaling(final ScalingConfig scaling) {
    if (scaling == null) {
      throw new QueryValidationException("Scaling config cannot be null.");
    }
    final String column = "r[" + FluxSyntax.quote("Scaling field",
        scaling.getField()) + "]";
    final Instant from = scaling.getStart() == null ? start : scaling.getStart();
    final Instant to = scaling.getEnd() == null ? end : scaling.getEnd();
    stages.add("  |> map(fn: (r) => ({ r with "
        + FluxSyntax.quote("Scaling field", scaling.getField())
        + ": if r[\"_time\"] >= " + FluxSyntax.time("Scaling start", from)
        + " and r[\"_time\"] < " + FluxSyntax.time("Scaling end", to)
        + " then (" + column + " * float(v: "
        + FluxSyntax.number("Scaling slope", scaling.getSlope())
        + ")) + float(v: "
        + FluxSyntax.number("Scaling offset", scaling.getOffset())
        + ") else " + column + "}))");
    return this;
  }

  /** @return The builder after keeping only "_time" and "_value". */
  public FluxPipelineBuilder keepTimeAndValue() {
    stages.add("  |> keep(columns: [\"_time\", \"_value\"])");
    return this;
  }

  /** @return The builder after dropping the window echo columns. */
  public FluxPipelineBuilder dropStartStop() {
    stages.add("  |> drop(columns: [\"_start\", \"_stop\"])");
    return this;
  }

  /**
   * Names the output of the pipeline.
   * @param name The result name.
   * @return The builder.
   */
  public FluxPipelineBuilder yieldAs(final String name) {
    stages.add("  |> yield(name: " + FluxSyntax.quote("Yield name", name)
        + ")");
    return this;
  }

  /** @return An unmodifiable view of the rendered stages. */
  public List<String> stages() {
    return Collections.unmodifiableList(stages);
  }

  /** @return The pipeline text. */
  public String build() {
    return LINE_JOINER.join(stages);
  }

  @Override
  public String toString() {
    return build();
  }

  /**
   * Renders the pipeline of one sub-window of a fetch.
   * @param request The non-null request.
   * @param window The sub-window to scope the source stage to.
   * @param order The stage order policy, null for
   * {@link StageOrder#STANDARD}.
   * @return The builder holding every stage.
   */
  public static FluxPipelineBuilder fromRequest(final QueryRequest request,
                                                final SubWindow window,
                                                final StageOrder order) {
    if (request == null) {
      throw new IllegalArgumentException("Request cannot be null.");
    }
    if (window == null) {
      throw new IllegalArgumentException("Window cannot be null.");
    }
    final StageOrder stage_order = order == null ? StageOrder.STANDARD : order;
    final FluxPipelineBuilder builder = new FluxPipelineBuilder(
        request.getBucket(), window.start(), window.end(),
        request.getMeasurement());
    builder.addFields(request.getQueriedFields());

    final List<String> groups = Lists.newArrayList(request.getGroups());
    groups.add(FluxTable.FIELD_COLUMN);
    builder.addGroups(groups);

    for (final Entry<String, BooleanFilter> entry :
        request.getBooleanFilters().entrySet()) {
      if (!entry.getValue().isTargeted()) {
        builder.addFilter(entry.getKey(), entry.getValue().getValue());
      }
    }
    if (stage_order == StageOrder.STANDARD) {
      addTargetedFilters(builder, request, false);
    }

    builder.addRangeFilters(request.getRangeFilters());
    if (request.isAggregate()) {
      builder.addWindow(request.getWindow());
    }
    builder.addPivot(request.getPivotColumns());

    if (stage_order == StageOrder.LEGACY) {
      addTargetedFilters(builder, request, true);
    }
    for (final ScalingConfig scaling : request.getScaling()) {
      builder.addScaling(scaling);
    }
    return builder;
  }

  private static void addTargetedFilters(final FluxPipelineBuilder builder,
                                         final QueryRequest request,
                                         final boolean wide) {
    for (final Entry<String, BooleanFilter> entry :
        request.getBooleanFilters().entrySet()) {
      final BooleanFilter filter = entry.getValue();
      if (!filter.isTargeted()) {
        continue;
      }
      if (wide) {
        builder.addColumnMask(entry.getKey(), filter.getValue(),
            filter.getColumn());
      } else {
        builder.addTargetedFilter(entry.getKey(), filter.getValue(),
            filter.getColumn());
      }
    }
  }

  private static String columnList(final String what,
                                   final List<String> columns) {
    if (columns == null) {
      throw new QueryValidationException(what + " list cannot be null.");
    }
    final List<String> quoted = Lists.newArrayListWithCapacity(columns.size());
    for (final String column : columns) {
      quoted.add(FluxSyntax.quote(what, column));
    }
    return "[" + COLUMN_JOINER.join(quoted) + "]";
  }
}
