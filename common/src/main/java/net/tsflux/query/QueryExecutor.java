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

import java.util.Collection;

import net.tsflux.data.FluxTable;
import net.tsflux.data.Point;

/**
 * The capability to run pipeline text against a store and to persist points.
 * Calls block until the store answers. Implementations own transport,
 * authentication and any retry policy.
 *
 * @since 1.0
 */
public interface QueryExecutor {

  /**
   * Runs the pipeline and returns its rows.
   * @param query The non-null pipeline text.
   * @param organisation The organisation the query runs under.
   * @return A non-null table, {@link FluxTable#EMPTY} if nothing matched.
   * @throws net.tsflux.exceptions.QueryExecutionException if the query was
   * rejected or the store could not be reached.
   */
  public FluxTable execute(final String query, final String organisation);

  /**
   * Persists the points synchronously.
   * @param bucket The target bucket.
   * @param organisation The organisation owning the bucket.
   * @param points The non-null points to write.
   * @throws net.tsflux.exceptions.QueryExecutionException if the write failed.
   */
  public void write(final String bucket,
                    final String organisation,
                    final Collection<Point> points);
}
