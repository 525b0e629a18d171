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
package net.tsflux.query.flux;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.regex.Pattern;

import com.google.common.base.Strings;

import net.tsflux.exceptions.QueryValidationException;
import net.tsflux.utils.DateTime;

/**
 * Validation and rendering of the tokens interpolated into pipeline text.
 * Every name or literal that reaches {@link FluxPipelineBuilder} passes
 * through one of these helpers so a caller supplied value can never close a
 * string literal or start a new clause.
 *
 * @since 1.0
 */
public final class FluxSyntax {

  /** Bare identifiers such as aggregation function names. */
  private static final Pattern FUNCTION = Pattern.compile(
      "^[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?$");

  private FluxSyntax() {
    // static helper
  }

  /**
   * Validates a string that will be rendered inside double quotes, e.g. a
   * bucket, measurement, field, tag key or tag value.
   * @param what A description of the value for the error message.
   * @param value The value to check.
   * @return The value, unchanged.
   * @throws QueryValidationException if the value is null or empty,
   * contains a double quote, a backslash or a line break, or opens a string
   * interpolation with "${".
   */
  public static String validateIdentifier(final String what,
                                          final String value) {
    if (Strings.isNullOrEmpty(value)) {
      throw new QueryValidationException(what + " cannot be null or empty.");
    }
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      if (c == '"' || c == '\\' || c == '\n' || c == '\r') {
        throw new QueryValidationException(what + " contains a reserved "
            + "character at position " + i + ": " + value);
      }
      // "${expr}" inside a string literal is evaluated
      if (c == '$' && i + 1 < value.length() && value.charAt(i + 1) == '{') {
        throw new QueryValidationException(what + " contains a string "
            + "interpolation at position " + i + ": " + value);
      }
    }
    return value;
  }

  /**
   * Validates and wraps a value in double quotes.
   * @param what A description of the value for the error message.
   * @param value The value to quote.
   * @return The quoted literal.
   * @throws QueryValidationException if the value failed validation.
   */
  public static String quote(final String what, final String value) {
    return "\"" + validateIdentifier(what, value) + "\"";
  }

  /**
   * Renders a number literal. Integral types render as is, decimals in plain
   * notation without exponent.
   * @param what A description of the value for the error message.
   * @param value The number.
   * @return The literal.
   * @throws QueryValidationException if the number was null, NaN or infinite.
   */
  public static String number(final String what, final Number value) {
    if (value == null) {
      throw new QueryValidationException(what + " cannot be null.");
    }
    if (value instanceof Long || value instanceof Integer
        || value instanceof Short || value instanceof Byte
        || value instanceof BigInteger) {
      return value.toString();
    }
    if (value instanceof BigDecimal) {
      return ((BigDecimal) value).toPlainString();
    }
    final double d = value.doubleValue();
    if (Double.isNaN(d) || Double.isInfinite(d)) {
      throw new QueryValidationException(what + " must be a finite number: "
          + value);
    }
    return BigDecimal.valueOf(d).toPlainString();
  }

  /**
   * Validates a duration literal such as "1h" or "15m".
   * @param what A description of the value for the error message.
   * @param value The literal.
   * @return The literal, unchanged.
   * @throws QueryValidationException if the literal was malformed.
   */
  public static String duration(final String what, final String value) {
    if (!DateTime.isDurationLiteral(value)) {
      throw new QueryValidationException(what + " is not a valid duration: "
          + value);
    }
    return value;
  }

  /**
   * Validates a bare function identifier such as "mean".
   * @param what A description of the value for the error message.
   * @param value The identifier.
   * @return The identifier, unchanged.
   * @throws QueryValidationException if the identifier was malformed.
   */
  public static String function(final String what, final String value) {
    if (Strings.isNullOrEmpty(value) || !FUNCTION.matcher(value).matches()) {
      throw new QueryValidationException(what + " is not a valid function "
          + "name: " + value);
    }
    return value;
  }

  /**
   * Renders a time literal in RFC3339, UTC.
   * @param what A description of the value for the error message.
   * @param value The instant.
   * @return The literal.
   * @throws QueryValidationException if the instant was null.
   */
  public static String time(final String what, final Instant value) {
    if (value == null) {
      throw new QueryValidationException(what + " cannot be null.");
    }
    return DateTime.toRfc3339(value);
  }
}
