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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * The raw tabular answer of the store for one pipeline: an ordered set of
 * column names and a list of rows keyed by those names. Rows from several
 * store-side tables are concatenated and the columns unioned so a row may not
 * carry every column; missing cells read as null.
 * <p>
 * Instances are immutable.
 *
 * @since 1.0
 */
public class FluxTable {

  /** Column holding the row timestamp. */
  public static final String TIME_COLUMN = "_time";

  /** Column holding the value in narrow (tall) form. */
  public static final String VALUE_COLUMN = "_value";

  /** Column holding the field name in narrow (tall) form. */
  public static final String FIELD_COLUMN = "_field";

  /** Window start echo column. */
  public static final String START_COLUMN = "_start";

  /** Window stop echo column. */
  public static final String STOP_COLUMN = "_stop";

  /** Result name bookkeeping column. */
  public static final String RESULT_COLUMN = "result";

  /** Table index bookkeeping column. */
  public static final String TABLE_COLUMN = "table";

  /** The shared empty table. */
  public static final FluxTable EMPTY = newBuilder().build();

  /** The ordered column names. */
  private final List<String> columns;

  /** The rows. */
  private final List<Map<String, Object>> rows;

  /**
   * Protected ctor.
   * @param builder The non-null builder.
   */
  protected FluxTable(final Builder builder) {
    columns = ImmutableList.copyOf(builder.columns);
    final List<Map<String, Object>> copy =
        Lists.newArrayListWithCapacity(builder.rows.size());
    for (final Map<String, Object> row : builder.rows) {
      copy.add(Collections.unmodifiableMap(row));
    }
    rows = Collections.unmodifiableList(copy);
  }

  /** @return The ordered, unique column names. */
  public List<String> columns() {
    return columns;
  }

  /** @return The rows in the order the store returned them. */
  public List<Map<String, Object>> rows() {
    return rows;
  }

  /** @return The number of rows. */
  public int size() {
    return rows.size();
  }

  /** @return True if the table has no rows. */
  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /**
   * @param column The column name.
   * @return True if the column was present in the response.
   */
  public boolean hasColumn(final String column) {
    return columns.contains(column);
  }

  /**
   * Fetches a single cell.
   * @param row The row index.
   * @param column The column name.
   * @return The value, null if missing.
   * @throws IndexOutOfBoundsException if the row is out of range.
   */
  public Object value(final int row, final String column) {
    return rows.get(row).get(column);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{columns=")
        .append(columns)
        .append(", rows=")
        .append(rows.size())
        .append("}")
        .toString();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private final Set<String> columns = new LinkedHashSet<String>();
    private final List<Map<String, Object>> rows = Lists.newArrayList();

    /**
     * Registers a column even if no row carries a value for it.
     * @param column A non-null and non-empty column name.
     * @return The builder.
     */
    public Builder addColumn(final String column) {
      if (Strings.isNullOrEmpty(column)) {
        throw new IllegalArgumentException("Column name cannot be null or empty.");
      }
      columns.add(column);
      return this;
    }

    /**
     * Adds a row, unioning its keys into the column set.
     * @param row A non-null row. Values may be null.
     * @return The builder.
     */
    public Builder addRow(final Map<String, Object> row) {
      if (row == null) {
        throw new IllegalArgumentException("Row cannot be null.");
      }
      for (final String column : row.keySet()) {
        addColumn(column);
      }
      rows.add(new LinkedHashMap<String, Object>(row));
      return this;
    }

    /**
     * Adds a row as alternating column and value pairs.
     * @param kvs Pairs of column name and value.
     * @return The builder.
     */
    public Builder addRow(final Object... kvs) {
      if (kvs == null || kvs.length % 2 != 0) {
        throw new IllegalArgumentException("Row must be given as column/value pairs.");
      }
      final Map<String, Object> row = new LinkedHashMap<String, Object>();
      for (int i = 0; i < kvs.length; i += 2) {
        row.put((String) kvs[i], kvs[i + 1]);
      }
      return addRow(row);
    }

    public FluxTable build() {
      return new FluxTable(this);
    }
  }
}
