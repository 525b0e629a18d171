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
package net.tsflux.query.http;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;

import com.google.common.primitives.UnsignedLong;

import net.tsflux.data.Point;

/**
 * Encodes points in the store's line protocol, one point per line:
 * {@code measurement,tag=v field=1.5,count=3i,name="x" 1673740800000000000}.
 * Timestamps are nanoseconds since the epoch.
 *
 * @since 1.0
 */
public final class LineProtocol {

  private LineProtocol() {
    // static helper
  }

  /**
   * Encodes the points.
   * @param points The non-null points.
   * @return The newline separated lines.
   * @throws IllegalArgumentException if a point was null or a value cannot
   * be represented.
   */
  public static String encode(final Collection<Point> points) {
    if (points == null) {
      throw new IllegalArgumentException("Points cannot be null.");
    }
    final StringBuilder buf = new StringBuilder();
    for (final Point point : points) {
      if (buf.length() > 0) {
        buf.append('\n');
      }
      encode(point, buf);
    }
    return buf.toString();
  }

  static void encode(final Point point, final StringBuilder buf) {
    if (point == null) {
      throw new IllegalArgumentException("Point cannot be null.");
    }
    escape(point.measurement(), ", ", buf);
    for (final Map.Entry<String, String> tag : point.tags().entrySet()) {
      buf.append(',');
      escape(tag.getKey(), ",= ", buf);
      buf.append('=');
      escape(tag.getValue(), ",= ", buf);
    }
    buf.append(' ');
    boolean first = true;
    for (final Map.Entry<String, Object> field : point.fields().entrySet()) {
      if (!first) {
        buf.append(',');
      }
      first = false;
      escape(field.getKey(), ",= ", buf);
      buf.append('=');
      value(field.getKey(), field.getValue(), buf);
    }
    buf.append(' ')
       .append(toNanos(point.timestamp()));
  }

  static long toNanos(final Instant timestamp) {
    return Math.addExact(Math.multiplyExact(timestamp.getEpochSecond(),
        1000000000L), timestamp.getNano());
  }

  private static void value(final String key,
                            final Object value,
                            final StringBuilder buf) {
    if (value instanceof String) {
      buf.append('"');
      escape((String) value, "\"\\", buf);
      buf.append('"');
    } else if (value instanceof Boolean) {
      buf.append(value);
    } else if (value instanceof UnsignedLong) {
      buf.append(value).append('u');
    } else if (value instanceof Long || value instanceof Integer
        || value instanceof Short || value instanceof Byte
        || value instanceof BigInteger) {
      buf.append(value).append('i');
    } else if (value instanceof BigDecimal) {
      buf.append(((BigDecimal) value).toPlainString());
    } else if (value instanceof Number) {
      final double d = ((Number) value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new IllegalArgumentException("Field " + key
            + " cannot be written as " + d);
      }
      buf.append(d);
    } else {
      throw new IllegalArgumentException("Unsupported value for field "
          + key + ": " + value);
    }
  }

  private static void escape(final String value,
                             final String specials,
                             final StringBuilder buf) {
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      if (specials.indexOf(c) >= 0) {
        buf.append('\\');
      }
      buf.append(c);
    }
  }
}
