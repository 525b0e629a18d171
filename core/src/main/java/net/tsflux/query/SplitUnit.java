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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.google.common.base.Strings;

/**
 * The unit used to cut a fetch into sub-windows.
 *
 * @since 1.0
 */
public enum SplitUnit {
  /** One query for the whole range. */
  NONE,
  HOUR,
  DAY,
  WEEK,
  /** Calendar months in UTC. */
  MONTH,
  /** Calendar years in UTC. */
  YEAR;

  /**
   * Case insensitive lookup.
   * @param unit The unit name, may be null or empty for {@link #NONE}.
   * @return The unit.
   * @throws IllegalArgumentException if the unit is unknown.
   */
  @JsonCreator
  public static SplitUnit fromString(final String unit) {
    if (Strings.isNullOrEmpty(unit)) {
      return NONE;
    }
    for (final SplitUnit value : values()) {
      if (value.name().equalsIgnoreCase(unit.trim())) {
        return value;
      }
    }
    throw new IllegalArgumentException("Unknown split unit: " + unit);
  }
}
