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

import com.google.common.base.Objects;

/**
 * One half-open slice {@code [start, end)} of a fetch, with its position in
 * the plan.
 *
 * @since 1.0
 */
public class SubWindow {
  private final Instant start;
  private final Instant end;
  private final int order;

  /**
   * Default ctor.
   * @param start The inclusive start.
   * @param end The exclusive end, never before the start.
   * @param order The 0 based index within the plan.
   */
  public SubWindow(final Instant start, final Instant end, final int order) {
    if (start == null || end == null) {
      throw new IllegalArgumentException("Start and end cannot be null.");
    }
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("End " + end
          + " cannot be before start " + start);
    }
    this.start = start;
    this.end = end;
    this.order = order;
  }

  /** @return The inclusive start. */
  public Instant start() {
    return start;
  }

  /** @return The exclusive end. */
  public Instant end() {
    return end;
  }

  /** @return The 0 based index within the plan. */
  public int order() {
    return order;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SubWindow)) {
      return false;
    }
    final SubWindow other = (SubWindow) o;
    return order == other.order &&
        Objects.equal(start, other.start) &&
        Objects.equal(end, other.end);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(start, end, order);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("[")
        .append(start)
        .append(", ")
        .append(end)
        .append(") order=")
        .append(order)
        .toString();
  }
}
