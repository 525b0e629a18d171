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
package net.tsflux.data;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.Maps;

/**
 * A single measurement to persist: a measurement name, tags, one or more
 * fields and a timestamp. Tags are kept sorted by key as the store prefers.
 *
 * @since 1.0
 */
public class Point {

  /** The measurement name. */
  private final String measurement;

  /** Tag keys to values, sorted. */
  private final Map<String, String> tags;

  /** Field keys to values. Numbers, booleans or strings. */
  private final Map<String, Object> fields;

  /** The timestamp. */
  private final Instant timestamp;

  /**
   * Protected ctor.
   * @param builder The non-null builder.
   * @throws IllegalArgumentException if the point was missing a measurement,
   * a timestamp or fields.
   */
  protected Point(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.measurement)) {
      throw new IllegalArgumentException("Measurement cannot be null or empty.");
    }
    if (builder.timestamp == null) {
      throw new IllegalArgumentException("Timestamp cannot be null.");
    }
    if (builder.fields.isEmpty()) {
      throw new IllegalArgumentException("At least one field is required for "
          + builder.measurement);
    }
    measurement = builder.measurement;
    tags = Collections.unmodifiableMap(new TreeMap<String, String>(builder.tags));
    fields = Collections.unmodifiableMap(Maps.newLinkedHashMap(builder.fields));
    timestamp = builder.timestamp;
  }

  /** @return The measurement name. */
  public String measurement() {
    return measurement;
  }

  /** @return The sorted, possibly empty tags. */
  public Map<String, String> tags() {
    return tags;
  }

  /** @return The non-empty fields. */
  public Map<String, Object> fields() {
    return fields;
  }

  /** @return The timestamp. */
  public Instant timestamp() {
    return timestamp;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Point)) {
      return false;
    }
    final Point other = (Point) o;
    return Objects.equal(measurement, other.measurement) &&
        Objects.equal(tags, other.tags) &&
        Objects.equal(fields, other.fields) &&
        Objects.equal(timestamp, other.timestamp);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(measurement, tags, fields, timestamp);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{measurement=")
        .append(measurement)
        .append(", tags=")
        .append(tags)
        .append(", fields=")
        .append(fields)
        .append(", timestamp=")
        .append(timestamp)
        .append("}")
        .toString();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private String measurement;
    private final Map<String, String> tags = Maps.newHashMap();
    private final Map<String, Object> fields = Maps.newLinkedHashMap();
    private Instant timestamp;

    public Builder setMeasurement(final String measurement) {
      this.measurement = measurement;
      return this;
    }

    public Builder addTag(final String key, final String value) {
      if (Strings.isNullOrEmpty(key) || Strings.isNullOrEmpty(value)) {
        throw new IllegalArgumentException("Tag key and value cannot be null "
            + "or empty.");
      }
      tags.put(key, value);
      return this;
    }

    public Builder addField(final String key, final Object value) {
      if (Strings.isNullOrEmpty(key)) {
        throw new IllegalArgumentException("Field key cannot be null or empty.");
      }
      if (!(value instanceof Number || value instanceof Boolean
          || value instanceof String)) {
        throw new IllegalArgumentException("Field " + key + " must be a number, "
            + "boolean or string: " + value);
      }
      fields.put(key, value);
      return this;
    }

    public Builder setTimestamp(final Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public Point build() {
      return new Point(this);
    }
  }
}
