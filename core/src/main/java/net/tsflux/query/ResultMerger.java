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
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.TreeMap;

import com.google.common.collect.Lists;

import net.tsflux.data.ColumnKey;
import net.tsflux.data.ResultTable;

/**
 * Folds chunk tables into one table sorted by timestamp. Tables are visited
 * in list order and a timestamp already taken from an earlier table is
 * skipped entirely, so re-fetching an overlapping range never changes rows
 * that are already present.
 *
 * @since 1.0
 */
public final class ResultMerger {

  private ResultMerger() {
    // static helper
  }

  /**
   * Merges the tables.
   * @param tables The tables in processing order. Null entries are skipped.
   * @return The merged table, {@link ResultTable#EMPTY} if nothing had rows.
   */
  public static ResultTable merge(final List<ResultTable> tables) {
    if (tables == null || tables.isEmpty()) {
      return ResultTable.EMPTY;
    }
    final ResultTable.Builder builder = ResultTable.newBuilder();
    final TreeMap<Instant, Map<ColumnKey, Object>> sorted =
        new TreeMap<Instant, Map<ColumnKey, Object>>();
    boolean has_columns = false;
    for (final ResultTable table : tables) {
      if (table == null) {
        continue;
      }
      for (final ColumnKey column : table.columns()) {
        builder.addColumn(column);
        has_columns = true;
      }
      for (final Instant timestamp : table.timestamps()) {
        if (!sorted.containsKey(timestamp)) {
          sorted.put(timestamp, table.row(timestamp));
        }
      }
    }
    if (sorted.isEmpty() && !has_columns) {
      return ResultTable.EMPTY;
    }
    for (final Entry<Instant, Map<ColumnKey, Object>> entry :
        sorted.entrySet()) {
      builder.addRow(entry.getKey(), entry.getValue());
    }
    return builder.build();
  }

  /**
   * Two table variant.
   * @param first The table whose rows win.
   * @param second The table to fold in.
   * @return The merged table.
   */
  public static ResultTable merge(final ResultTable first,
                                  final ResultTable second) {
    return merge(Lists.newArrayList(first, second));
  }
}
