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
 * Thrown when a request is malformed, e.g. an empty field list, inverted
 * range bounds or an identifier that would break out of its quotes in the
 * generated pipeline. Always raised before any query is sent.
 *
 * @since 1.0
 */
public class QueryValidationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1940346207728193508L;

  /**
   * Default ctor.
   * @param msg A non-null message to be given.
   */
  public QueryValidationException(final String msg) {
    super(msg);
  }

  /**
   * Ctor with a cause.
   * @param msg A non-null message to be given.
   * @param e The original exception.
   */
  public QueryValidationException(final String msg, final Throwable e) {
    super(msg, e);
  }
}
