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
package net.tsflux.utils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

import com.google.common.base.Strings;

/**
 * Utility class that provides helpers for dealing with dates and timestamps.
 * Everything is UTC.
 *
 * @since 1.0
 */
public class DateTime {

  /** Format used by configuration files, e.g. "2023/01/15 13:00:00". */
  public static final DateTimeFormatter CONFIG_FORMAT =
      DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss").withZone(ZoneOffset.UTC);

  /** Date only variant of {@link #CONFIG_FORMAT}. */
  public static final DateTimeFormatter CONFIG_DATE_FORMAT =
      DateTimeFormatter.ofPattern("yyyy/MM/dd");

  /** A duration literal of the pipeline language, e.g. "1h" or "1h30m". */
  private static final Pattern DURATION_LITERAL = Pattern.compile(
      "^([0-9]+(ns|us|µs|ms|s|mo|m|h|d|w|y))+$");

  /**
   * Renders an instant as RFC3339 in UTC, e.g. "2023-01-15T00:00:00Z".
   * Fractional seconds are only emitted when present.
   * @param instant A non-null instant.
   * @return The RFC3339 string.
   */
  public static String toRfc3339(final Instant instant) {
    if (instant == null) {
      throw new IllegalArgumentException("Instant cannot be null.");
    }
    return DateTimeFormatter.ISO_INSTANT.format(instant);
  }

  /**
   * Attempts to parse a timestamp from a given string.
   * Formats accepted are:
   * <ul>
   * <li>RFC3339, e.g. "2023-01-15T00:00:00Z" or with fractional seconds</li>
   * <li>"yyyy/MM/dd HH:mm:ss"</li>
   * <li>"yyyy/MM/dd"</li>
   * <li>Unix epoch in seconds (10 digits or fewer) or milliseconds</li>
   * </ul>
   * @param datetime The string to parse.
   * @return The instant.
   * @throws IllegalArgumentException if the string was null, empty or could
   * not be parsed.
   */
  public static Instant parseTimestamp(final String datetime) {
    if (Strings.isNullOrEmpty(datetime)) {
      throw new IllegalArgumentException("Timestamp cannot be null or empty.");
    }
    final String trimmed = datetime.trim();
    try {
      if (trimmed.contains("T")) {
        return Instant.parse(trimmed);
      }
      if (trimmed.contains("/")) {
        if (trimmed.length() == 10) {
          return LocalDate.parse(trimmed, CONFIG_DATE_FORMAT)
              .atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        return LocalDateTime.parse(trimmed, CONFIG_FORMAT)
            .toInstant(ZoneOffset.UTC);
      }
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid date: " + datetime
          + ". " + e.getMessage(), e);
    }

    final long time;
    try {
      time = Long.parseLong(trimmed);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid time: " + datetime
          + ". " + e.getMessage(), e);
    }
    if (time < 0) {
      throw new IllegalArgumentException("Invalid time: " + datetime
          + ". Negative timestamps are not supported.");
    }
    // seconds vs milliseconds, valid until November 2286
    if (trimmed.length() <= 10) {
      return Instant.ofEpochSecond(time);
    }
    return Instant.ofEpochMilli(time);
  }

  /**
   * Whether or not the string is a valid pipeline duration literal such as
   * "1h", "15m" or "1mo". Compound literals like "1h30m" are accepted.
   * @param duration The string to test, may be null.
   * @return True if the literal can be placed into a query verbatim.
   */
  public static boolean isDurationLiteral(final String duration) {
    if (Strings.isNullOrEmpty(duration)) {
      return false;
    }
    return DURATION_LITERAL.matcher(duration).matches();
  }

  /**
   * Pass through to {@link System#nanoTime()} for use in classes to
   * make unit testing easier.
   * @return The current monotonic time in nanoseconds.
   */
  public static long nanoTime() {
    return System.nanoTime();
  }

  /**
   * Calculates the difference between two values and returns the time in
   * milliseconds as a double.
   * @param end The end timestamp
   * @param start The start timestamp
   * @return The value in milliseconds
   * @throws IllegalArgumentException if end is less than start
   */
  public static double msFromNanoDiff(final long end, final long start) {
    if (end < start) {
      throw new IllegalArgumentException("End (" + end + ") cannot be less "
          + "than start (" + start + ")");
    }
    return ((double) end - (double) start) / 1000000;
  }
}
