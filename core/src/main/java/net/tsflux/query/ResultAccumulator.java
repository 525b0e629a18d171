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

import java.util.List;

import com.google.common.collect.Lists;

import net.tsflux.data.ResultTable;

/**
 * The result state of a runner across calls. Successful fetches fold into
 * it with rows already held taking precedence, {@link #clear()} resets it.
 * Tables are immutable so handing out the current one never aliases state
 * that can still change.
 * <p>
 * Not synchronized. Callers must not clear while a fetch is running on the
 * same runner.
 *
 * @since 1.0
 */
public class ResultAccumulator {
  private ResultTable current = ResultTable.EMPTY;

  /** @return The accumulated table, never null. */
  public ResultTable current() {
    return current;
  }

  /**
   * Folds the chunks of one fetch into the accumulated table.
   * @param chunks The chunks in sub-window order.
   * @return The new accumulated table.
   */
  public ResultTable merge(final List<ResultTable> chunks) {
    final List<ResultTable> tables = Lists.newArrayListWithCapacity(
        chunks.size() + 1);
    tables.add(current);
    tables.addAll(chunks);
    current = ResultMerger.merge(tables);
    return current;
  }

  /**
   * Replaces the accumulated table.
   * @param table The non-null table.
   * @return The table.
   */
  public ResultTable replace(final ResultTable table) {
    if (table == null) {
      throw new IllegalArgumentException("Table cannot be null.");
    }
    current = table;
    return current;
  }

  /** Resets to the empty table. */
  public void clear() {
    current = ResultTable.EMPTY;
  }
}
