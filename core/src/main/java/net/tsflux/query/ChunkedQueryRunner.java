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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;

import net.tsflux.data.ColumnKey;
import net.tsflux.data.FluxTable;
import net.tsflux.data.ResultTable;
import net.tsflux.exceptions.QueryExecutionException;
import net.tsflux.exceptions.QueryValidationException;
import net.tsflux.query.flux.FluxPipelineBuilder;
import net.tsflux.query.flux.StageOrder;
import net.tsflux.utils.DateTime;

/**
 * Drives chunked fetches: plans the sub-windows of a request, renders and
 * executes one pipeline per sub-window in order, normalizes each answer and
 * folds the chunks into the accumulated result.
 * <p>
 * The first executor failure aborts the fetch and is rethrown as is, after
 * logging the sub-window and the rendered query. Nothing is retried. Chunks
 * of a failed fetch are discarded and the accumulated result is left as it
 * was.
 * <p>
 * One fetch at a time per instance.
 *
 * @since 1.0
 */
public class ChunkedQueryRunner {
  private static final Logger LOG = LoggerFactory.getLogger(
      ChunkedQueryRunner.class);

  /** Column of the table built by {@link #fetchRaw(String)}. */
  public static final ColumnKey RAW_VALUES_COLUMN = ColumnKey.of("Values");

  private final QueryExecutor executor;
  private final String organisation;
  private final StageOrder stage_order;
  private final TimeWindowPlanner planner;
  private final ChunkNormalizer normalizer;
  private final ResultAccumulator accumulator;

  /**
   * Ctor using {@link StageOrder#STANDARD}.
   * @param executor The non-null executor.
   * @param organisation The non-empty organisation queries run under.
   */
  public ChunkedQueryRunner(final QueryExecutor executor,
                            final String organisation) {
    this(executor, organisation, StageOrder.STANDARD);
  }

  /**
   * Default ctor.
   * @param executor The non-null executor.
   * @param organisation The non-empty organisation queries run under.
   * @param stage_order The stage order policy, null for the standard one.
   */
  public ChunkedQueryRunner(final QueryExecutor executor,
                            final String organisation,
                            final StageOrder stage_order) {
    if (executor == null) {
      throw new IllegalArgumentException("Executor cannot be null.");
    }
    if (Strings.isNullOrEmpty(organisation)) {
      throw new IllegalArgumentException("Organisation cannot be null or empty.");
    }
    this.executor = executor;
    this.organisation = organisation;
    this.stage_order = stage_order == null ? StageOrder.STANDARD : stage_order;
    planner = new TimeWindowPlanner();
    normalizer = new ChunkNormalizer();
    accumulator = new ResultAccumulator();
  }

  /**
   * Runs the fetch and folds its rows into the accumulated result. Rows
   * already accumulated by earlier fetches win on equal timestamps.
   * @param request The non-null request.
   * @return The accumulated result, sorted by timestamp.
   * @throws QueryValidationException if the request is null.
   * @throws QueryExecutionException if a chunk could not be executed or its
   * answer had an unexpected shape. Other runtime exceptions of the executor
   * are rethrown unchanged as well.
   */
  public ResultTable fetch(final QueryRequest request) {
    if (request == null) {
      throw new QueryValidationException("Request cannot be null.");
    }
    final long start = DateTime.nanoTime();
    final List<SubWindow> windows = planner.plan(request.getStart(),
        request.getEnd(), request.getSplitUnit());
    final List<ResultTable> chunks = Lists.newArrayListWithCapacity(
        windows.size());
    int rows = 0;
    for (final SubWindow window : windows) {
      final ResultTable chunk = fetchWindow(request, window);
      if (chunk.isEmpty()) {
        LOG.info("No data for sub-window " + window + " of "
            + request.getMeasurement());
        continue;
      }
      rows += chunk.size();
      chunks.add(chunk);
    }

    final ResultTable merged = accumulator.merge(chunks);
    LOG.info("Fetched " + request.getMeasurement() + " " + request.getFields()
        + " from " + request.getBucket() + " in " + windows.size()
        + " sub-windows, " + rows + " chunk rows, " + merged.size()
        + " accumulated rows in "
        + DateTime.msFromNanoDiff(DateTime.nanoTime(), start) + "ms");
    return merged;
  }

  /**
   * Executes caller supplied pipeline text and REPLACES the accumulated
   * result with a single "Values" column holding the "_value" of each row
   * of the first store table. An empty answer leaves the accumulated result
   * as it was.
   * @param query The non-empty pipeline text.
   * @return The accumulated result.
   * @throws QueryValidationException if the query was null or empty.
   * @throws QueryExecutionException if the query failed or the answer had no
   * "_time" column.
   */
  public ResultTable fetchRaw(final String query) {
    if (Strings.isNullOrEmpty(query) || query.trim().isEmpty()) {
      throw new QueryValidationException("Query cannot be null or empty.");
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Executing raw query:\n" + query);
    }
    final FluxTable raw;
    try {
      raw = executor.execute(query, organisation);
    } catch (RuntimeException e) {
      LOG.error("Failed to execute raw query:\n" + query, e);
      throw e;
    }
    if (raw == null || raw.isEmpty()) {
      LOG.info("Raw query returned no data, keeping the current result.");
      return accumulator.current();
    }
    if (!raw.hasColumn(FluxTable.TIME_COLUMN)) {
      throw new QueryExecutionException("Raw query answer has no "
          + FluxTable.TIME_COLUMN + " column: " + raw.columns(), 0, -1, query);
    }

    final ResultTable.Builder builder = ResultTable.newBuilder()
        .addColumn(RAW_VALUES_COLUMN);
    final Object first_table = raw.value(0, FluxTable.TABLE_COLUMN);
    for (final Map<String, Object> row : raw.rows()) {
      if (!Objects.equal(first_table, row.get(FluxTable.TABLE_COLUMN))) {
        continue;
      }
      final Instant timestamp;
      try {
        timestamp = ChunkNormalizer.toInstant(row.get(FluxTable.TIME_COLUMN));
      } catch (IllegalStateException e) {
        throw new QueryExecutionException("Unexpected raw query answer: "
            + e.getMessage(), 0, -1, query, e);
      }
      final Map<ColumnKey, Object> cells =
          new LinkedHashMap<ColumnKey, Object>();
      cells.put(RAW_VALUES_COLUMN, row.get(FluxTable.VALUE_COLUMN));
      builder.addRow(timestamp, cells);
    }
    final ResultTable table = builder.build();
    LOG.info("Raw query returned " + table.size() + " rows.");
    return accumulator.replace(table);
  }

  /** @return The accumulated result, never null. */
  public ResultTable measurements() {
    return accumulator.current();
  }

  /** Discards the accumulated result. */
  public void clear() {
    accumulator.clear();
    LOG.info("Cleared the accumulated result.");
  }

  /** @return The stage order policy in use. */
  public StageOrder stageOrder() {
    return stage_order;
  }

  /**
   * Renders the pipelines a fetch would execute without executing them.
   * @param request The non-null request.
   * @return One pipeline per sub-window, in order.
   */
  public List<String> render(final QueryRequest request) {
    if (request == null) {
      throw new QueryValidationException("Request cannot be null.");
    }
    final List<String> queries = Lists.newArrayList();
    for (final SubWindow window : planner.plan(request.getStart(),
        request.getEnd(), request.getSplitUnit())) {
      queries.add(FluxPipelineBuilder.fromRequest(request, window, stage_order)
          .build());
    }
    return Collections.unmodifiableList(queries);
  }

  private ResultTable fetchWindow(final QueryRequest request,
                                  final SubWindow window) {
    final String query = FluxPipelineBuilder.fromRequest(request, window,
        stage_order).build();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Executing sub-window " + window + ":\n" + query);
    }
    final long start = DateTime.nanoTime();
    final FluxTable raw;
    try {
      raw = executor.execute(query, organisation);
    } catch (RuntimeException e) {
      LOG.error("Failed to execute sub-window " + window + " of "
          + request.getMeasurement() + ":\n" + query, e);
      throw e;
    }

    final ResultTable chunk;
    try {
      chunk = normalizer.normalize(request, raw);
    } catch (IllegalStateException e) {
      throw new QueryExecutionException("Unexpected answer for sub-window "
          + window + ": " + e.getMessage(), 0, window.order(), query, e);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Sub-window " + window + " returned "
          + (raw == null ? 0 : raw.size()) + " raw rows, " + chunk.size()
          + " normalized rows in "
          + DateTime.msFromNanoDiff(DateTime.nanoTime(), start) + "ms");
    }
    return chunk;
  }
}
