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

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import net.tsflux.exceptions.QueryValidationException;

/**
 * Partitions a half-open range into contiguous, ascending sub-windows.
 * <p>
 * Hours, days and weeks are fixed durations counted from the range start and
 * the count is the ceiling of the range over the unit. Months and years are
 * cut at UTC calendar boundaries so each calendar period touched yields one
 * sub-window, partial periods at either end included. The final window is
 * always clipped to the range end.
 *
 * @since 1.0
 */
public class TimeWindowPlanner {
  private static final Logger LOG = LoggerFactory.getLogger(
      TimeWindowPlanner.class);

  /**
   * Computes the plan.
   * @param start The inclusive start.
   * @param end The exclusive end.
   * @param unit The split unit, null for {@link SplitUnit#NONE}.
   * @return A non-empty list of windows. A zero length range yields one
   * degenerate window.
   * @throws QueryValidationException if a bound is null or the end is before
   * the start.
   */
  public List<SubWindow> plan(final Instant start,
                              final Instant end,
                              final SplitUnit unit) {
    if (start == null || end == null) {
      throw new QueryValidationException("Start and end cannot be null.");
    }
    if (end.isBefore(start)) {
      throw new QueryValidationException("End " + end
          + " cannot be before start " + start);
    }
    final SplitUnit split = unit == null ? SplitUnit.NONE : unit;
    if (split == SplitUnit.NONE || start.equals(end)) {
      return Collections.singletonList(new SubWindow(start, end, 0));
    }

    final List<SubWindow> windows;
    switch (split) {
    case HOUR:
      windows = fixed(start, end, Duration.ofHours(1));
      break;
    case DAY:
      windows = fixed(start, end, Duration.ofDays(1));
      break;
    case WEEK:
      windows = fixed(start, end, Duration.ofDays(7));
      break;
    case MONTH:
      windows = calendar(start, end, ChronoUnit.MONTHS);
      break;
    case YEAR:
      windows = calendar(start, end, ChronoUnit.YEARS);
      break;
    default:
      throw new IllegalStateException("Unhandled split unit: " + split);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Planned " + windows.size() + " " + split
          + " sub-windows for [" + start + ", " + end + ")");
    }
    return windows;
  }

  private static List<SubWindow> fixed(final Instant start,
                                       final Instant end,
                                       final Duration unit) {
    // whole Durations so centuries-long ranges don't overflow nanos
    final Duration range = Duration.between(start, end);
    long count = range.dividedBy(unit);
    if (!unit.multipliedBy(count).equals(range)) {
      count++;
    }
    final List<SubWindow> windows = Lists.newArrayListWithCapacity((int) count);
    for (int i = 0; i < count; i++) {
      final Instant window_start = start.plus(unit.multipliedBy(i));
      Instant window_end = start.plus(unit.multipliedBy(i + 1));
      if (window_end.isAfter(end)) {
        window_end = end;
      }
      windows.add(new SubWindow(window_start, window_end, i));
    }
    return windows;
  }

  private static List<SubWindow> calendar(final Instant start,
                                          final Instant end,
                                          final ChronoUnit unit) {
    final List<SubWindow> windows = Lists.newArrayList();
    Instant cursor = start;
    while (cursor.isBefore(end)) {
      Instant boundary = nextBoundary(cursor, unit);
      if (boundary.isAfter(end)) {
        boundary = end;
      }
      windows.add(new SubWindow(cursor, boundary, windows.size()));
      cursor = boundary;
    }
    return windows;
  }

  /** @return The first instant of the calendar period following the one
   * holding the given instant. */
  static Instant nextBoundary(final Instant instant, final ChronoUnit unit) {
    ZonedDateTime period = instant.atZone(ZoneOffset.UTC)
        .truncatedTo(ChronoUnit.DAYS)
        .withDayOfMonth(1);
    if (unit == ChronoUnit.YEARS) {
      period = period.withMonth(1);
    }
    return period.plus(1, unit).toInstant();
  }
}
