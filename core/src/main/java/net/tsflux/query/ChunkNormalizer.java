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
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.tsflux.data.ColumnKey;
import net.tsflux.data.FluxTable;
import net.tsflux.data.ResultTable;
import net.tsflux.utils.DateTime;

/**
 * Turns the raw table of one sub-window into a {@link ResultTable}.
 * <ul>
 * <li>drops the result, table, window start and window stop columns</li>
 * <li>indexes rows by "_time", folding rows of several store tables that
 * share a timestamp</li>
 * <li>drops fields fetched only for range filtering</li>
 * <li>drops "_field" when a single field was requested</li>
 * <li>in multi-index mode decomposes each column into (group..., field)</li>
 * </ul>
 * Anything that does not fit raises an {@link IllegalStateException} so data
 * is never silently lost.
 *
 * @since 1.0
 */
public class ChunkNormalizer {
  private static final Set<String> BOOKKEEPING = ImmutableSet.of(
      FluxTable.RESULT_COLUMN, FluxTable.TABLE_COLUMN,
      FluxTable.START_COLUMN, FluxTable.STOP_COLUMN);

  private static final Comparator<String> LONGEST_FIRST =
      new Comparator<String>() {
    @Override
    public int compare(final String a, final String b) {
      return Integer.compare(b.length(), a.length());
    }
  };

  /**
   * Normalizes the raw table.
   * @param request The request the table answers.
   * @param raw The raw table, may be null.
   * @return The normalized table, {@link ResultTable#EMPTY} when the raw
   * table had no rows.
   * @throws IllegalStateException if the table had rows but an unexpected
   * shape.
   */
  public ResultTable normalize(final QueryRequest request, final FluxTable raw) {
    if (raw == null || raw.isEmpty()) {
      return ResultTable.EMPTY;
    }
    if (!raw.hasColumn(FluxTable.TIME_COLUMN)) {
      throw new IllegalStateException("Table has " + raw.size()
          + " rows but no " + FluxTable.TIME_COLUMN + " column: "
          + raw.columns());
    }

    final List<String> extra = request.getExtraFields();
    final List<String> queried = Lists.newArrayList(request.getQueriedFields());
    Collections.sort(queried, LONGEST_FIRST);

    final Map<String, ColumnKey> keys = Maps.newLinkedHashMap();
    for (final String column : raw.columns()) {
      if (BOOKKEEPING.contains(column)
          || column.equals(FluxTable.TIME_COLUMN)) {
        continue;
      }
      if (column.equals(FluxTable.FIELD_COLUMN)) {
        if (request.getFields().size() == 1) {
          continue;
        }
      } else {
        final String field = matchField(column, queried);
        if (field != null && extra.contains(field)) {
          continue;
        }
      }
      keys.put(column, request.isMultiindex()
          ? decompose(column, request, queried) : ColumnKey.of(column));
    }

    final ResultTable.Builder builder = ResultTable.newBuilder();
    for (final ColumnKey key : keys.values()) {
      builder.addColumn(key);
    }
    final Set<String> extra_set = Sets.newHashSet(extra);
    for (final Map<String, Object> row : raw.rows()) {
      // narrow rows of a range-filter-only field
      final Object field = row.get(FluxTable.FIELD_COLUMN);
      if (field != null && extra_set.contains(field.toString())) {
        continue;
      }
      final Map<ColumnKey, Object> cells =
          new LinkedHashMap<ColumnKey, Object>();
      for (final Map.Entry<String, ColumnKey> key : keys.entrySet()) {
        if (row.containsKey(key.getKey())) {
          cells.put(key.getValue(), row.get(key.getKey()));
        }
      }
      builder.addRow(toInstant(row.get(FluxTable.TIME_COLUMN)), cells);
    }
    return builder.build();
  }

  /**
   * @return The longest queried field the column is named after, either
   * exactly or as the suffix of a flattened pivot key. Null if none.
   */
  static String matchField(final String column, final List<String> fields) {
    for (final String field : fields) {
      if (column.equals(field)
          || column.endsWith(ColumnKey.SEPARATOR + field)) {
        return field;
      }
    }
    return null;
  }

  /**
   * Splits a flattened pivot key into one part per group and the field.
   */
  static ColumnKey decompose(final String column,
                             final QueryRequest request,
                             final List<String> fields) {
    final String field = matchField(column, fields);
    if (field == null) {
      throw new IllegalStateException("Column " + column + " does not end "
          + "with any of the requested fields " + request.getFields());
    }
    final int groups = request.getGroups().size();
    if (groups == 0) {
      if (!column.equals(field)) {
        throw new IllegalStateException("Column " + column + " has a group "
            + "prefix but no groups were requested");
      }
      return ColumnKey.of(field);
    }
    final String prefix = column.length() == field.length() ? ""
        : column.substring(0, column.length() - field.length() - 1);
    final List<String> parts = Lists.newArrayList(
        Splitter.on(ColumnKey.SEPARATOR).limit(groups).split(prefix));
    if (parts.size() != groups) {
      throw new IllegalStateException("Column " + column + " cannot be "
          + "split into " + groups + " group values and a field");
    }
    parts.add(field);
    return ColumnKey.of(parts.toArray(new String[parts.size()]));
  }

  static Instant toInstant(final Object time) {
    if (time instanceof Instant) {
      return (Instant) time;
    }
    if (time instanceof OffsetDateTime) {
      return ((OffsetDateTime) time).toInstant();
    }
    if (time instanceof ZonedDateTime) {
      return ((ZonedDateTime) time).toInstant();
    }
    if (time instanceof String) {
      try {
        return DateTime.parseTimestamp((String) time);
      } catch (IllegalArgumentException e) {
        throw new IllegalStateException("Unparseable "
            + FluxTable.TIME_COLUMN + " value: " + time, e);
      }
    }
    throw new IllegalStateException("Unsupported " + FluxTable.TIME_COLUMN
        + " value: " + time);
  }
}
