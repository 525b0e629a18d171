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

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * The name of a result column. Flat tables use a single part, multi-index
 * tables use one part per group key followed by the field name, e.g.
 * ("north", "pm25").
 *
 * @since 1.0
 */
public class ColumnKey {
  /** Separator the store uses when it flattens a pivot key. */
  public static final String SEPARATOR = "_";
  private static final Joiner JOINER = Joiner.on(SEPARATOR);

  private final List<String> parts;

  private ColumnKey(final List<String> parts) {
    this.parts = parts;
  }

  /**
   * @param parts One or more parts, none null.
   * @return The key.
   * @throws IllegalArgumentException if no parts were given, a part was null
   * or a single part was empty.
   */
  public static ColumnKey of(final String... parts) {
    if (parts == null || parts.length == 0) {
      throw new IllegalArgumentException("A column key needs at least one part.");
    }
    if (parts.length == 1 && Strings.isNullOrEmpty(parts[0])) {
      throw new IllegalArgumentException("Column name cannot be null or empty.");
    }
    for (final String part : parts) {
      if (part == null) {
        throw new IllegalArgumentException("Column key parts cannot be null.");
      }
    }
    return new ColumnKey(ImmutableList.copyOf(parts));
  }

  /** @return The parts, outermost first. */
  public List<String> parts() {
    return parts;
  }

  /** @return The number of levels. */
  public int levels() {
    return parts.size();
  }

  /** @return The innermost part, the field name for multi-index keys. */
  public String last() {
    return parts.get(parts.size() - 1);
  }

  /** @return The parts joined with {@link #SEPARATOR}. */
  public String name() {
    return JOINER.join(parts);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnKey)) {
      return false;
    }
    return parts.equals(((ColumnKey) o).parts);
  }

  @Override
  public int hashCode() {
    return parts.hashCode();
  }

  @Override
  public String toString() {
    return parts.size() == 1 ? parts.get(0) : parts.toString();
  }
}
