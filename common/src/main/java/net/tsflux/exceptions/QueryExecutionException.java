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
package net.tsflux.exceptions;

/**
 * High level exception thrown when a pipeline could not be executed against
 * the store or when the returned table could not be turned into a result.
 * It bubbles up to the caller unchanged.
 *
 * @since 1.0
 */
public class QueryExecutionException extends RuntimeException {
  private static final long serialVersionUID = -2178905733211063472L;

  /** The order of the sub-window within a chunked fetch. E.g. if a fetch
   * has 4 sub-windows, this order will be an integer from 0 to 3. */
  protected final int order;

  /** A status code associated with the exception. The code value depends on
   * the remote source. */
  protected final int status_code;

  /** The rendered pipeline text that failed, may be null. */
  protected final String query;

  /**
   * Default ctor that sets a message describing this exception.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   */
  public QueryExecutionException(final String msg, final int status_code) {
    this(msg, status_code, -1, null, null);
  }

  /**
   * Ctor that sets the original cause.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   * @param e The original exception that caused this to be thrown.
   */
  public QueryExecutionException(final String msg,
                                 final int status_code,
                                 final Throwable e) {
    this(msg, status_code, -1, null, e);
  }

  /**
   * Ctor that sets the sub-window order and the query text.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   * @param order An optional order of the sub-window in a chunked fetch.
   * @param query The optional rendered query.
   */
  public QueryExecutionException(final String msg,
                                 final int status_code,
                                 final int order,
                                 final String query) {
    this(msg, status_code, order, query, null);
  }

  /**
   * Ctor setting a message, order, status code, query and cause.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   * @param order An optional order of the sub-window in a chunked fetch.
   * @param query The optional rendered query.
   * @param e The original exception that caused this to be thrown.
   */
  public QueryExecutionException(final String msg,
                                 final int status_code,
                                 final int order,
                                 final String query,
                                 final Throwable e) {
    super(msg, e);
    this.status_code = status_code;
    this.order = order;
    this.query = query;
  }

  /** @return The sub-window order if pertaining to a chunked fetch, -1
   * otherwise. */
  public int getOrder() {
    return order;
  }

  /** @return An optional status code, e.g. HTTP code. */
  public int getStatusCode() {
    return status_code;
  }

  /** @return The rendered query that failed, may be null. */
  public String getQuery() {
    return query;
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append(getClass())
        .append(": ")
        .append(getMessage());
    if (order >= 0) {
      buf.append(" order[")
         .append(order)
         .append("]");
    }
    if (query != null) {
      buf.append(" query[")
         .append(query)
         .append("]");
    }
    return buf.toString();
  }
}
