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
package net.tsflux.data;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * A table indexed by timestamp with one row per distinct timestamp and
 * ordered columns. Missing cells read as null.
 * <p>
 * Instances are immutable so a table handed to a caller can never change
 * underneath it.
 *
 * @since 1.0
 */
public class ResultTable {

  /** The shared empty table. */
  public static final ResultTable EMPTY = newBuilder().build();

  private final List<ColumnKey> columns;
  private final List<Instant> timestamps;
  private final Map<Instant, Map<ColumnKey, Object>> rows;

  protected ResultTable(final Builder builder) {
    columns = ImmutableList.copyOf(builder.columns);
    timestamps = ImmutableList.copyOf(builder.rows.keySet());
    final Map<Instant, Map<ColumnKey, Object>> copy =
        Maps.newLinkedHashMapWithExpectedSize(builder.rows.size());
    for (final Entry<Instant, Map<ColumnKey, Object>> entry :
        builder.rows.entrySet()) {
      copy.put(entry.getKey(), Collections.unmodifiableMap(
          new LinkedHashMap<ColumnKey, Object>(entry.getValue())));
    }
    rows = Collections.unmodifiableMap(copy);
  }

  /** @return The ordered column keys. */
  public List<ColumnKey> columns() {
    return columns;
  }

  /** @return The row timestamps in table order. */
  public List<Instant> timestamps() {
    return timestamps;
  }

  /** @return The number of rows. */
  public int size() {
    return rows.size();
  }

  /** @return True if there are no rows. */
  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /**
   * @param timestamp The row timestamp.
   * @return The row cells or null if there is no such row.
   */
  public Map<ColumnKey, Object> row(final Instant timestamp) {
    return rows.get(timestamp);
  }

  /**
   * @param timestamp The row timestamp.
   * @param column The column.
   * @return The cell, null if the row or the cell is missing.
   */
  public Object value(final Instant timestamp, final ColumnKey column) {
    final Map<ColumnKey, Object> row = rows.get(timestamp);
    return row == null ? null : row.get(column);
  }

  /**
   * Shortcut for single level columns.
   * @param timestamp The row timestamp.
   * @param column The column name.
   * @return The cell, null if the row or the cell is missing.
   */
  public Object value(final Instant timestamp, final String column) {
    return value(timestamp, ColumnKey.of(column));
  }

  /**
   * @param column The column.
   * @return The column cells in table order, nulls included.
   */
  public List<Object> column(final ColumnKey column) {
    final List<Object> values = Lists.newArrayListWithCapacity(rows.size());
    for (final Map<ColumnKey, Object> row : rows.values()) {
      values.add(row.get(column));
    }
    return values;
  }

  /** @return True if the timestamps are strictly increasing. */
  public boolean isSorted() {
    for (int i = 1; i < timestamps.size(); i++) {
      if (!timestamps.get(i - 1).isBefore(timestamps.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ResultTable)) {
      return false;
    }
    final ResultTable other = (ResultTable) o;
    return columns.equals(other.columns) &&
        timestamps.equals(other.timestamps) &&
        rows.equals(other.rows);
  }

  @Override
  public int hashCode() {
    return rows.hashCode();
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{columns=")
        .append(columns)
        .append(", rows=")
        .append(rows.size())
        .append(timestamps.isEmpty() ? "" : ", first=" + timestamps.get(0)
            + ", last=" + timestamps.get(timestamps.size() - 1))
        .append("}")
        .toString();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private final Set<ColumnKey> columns = new LinkedHashSet<ColumnKey>();
    private final Map<Instant, Map<ColumnKey, Object>> rows = Maps.newLinkedHashMap();

    public Builder addColumn(final ColumnKey column) {
      if (column == null) {
        throw new IllegalArgumentException("Column cannot be null.");
      }
      columns.add(column);
      return this;
    }

    /**
     * Adds a row. When a row with the same timestamp exists the cells are
     * folded into it and cells already holding a non-null value win.
     * @param timestamp The non-null timestamp.
     * @param cells The cells, values may be null.
     * @return The builder.
     */
    public Builder addRow(final Instant timestamp,
                          final Map<ColumnKey, Object> cells) {
      if (timestamp == null) {
        throw new IllegalArgumentException("Timestamp cannot be null.");
      }
      if (cells == null) {
        throw new IllegalArgumentException("Cells cannot be null.");
      }
      Map<ColumnKey, Object> row = rows.get(timestamp);
      if (row == null) {
        row = new LinkedHashMap<ColumnKey, Object>();
        rows.put(timestamp, row);
      }
      for (final Entry<ColumnKey, Object> cell : cells.entrySet()) {
        addColumn(cell.getKey());
        if (row.get(cell.getKey()) == null) {
          row.put(cell.getKey(), cell.getValue());
        }
      }
      return this;
    }

    public ResultTable build() {
      return new ResultTable(this);
    }
  }
}
