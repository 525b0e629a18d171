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

/**
 * Where targeted filters sit in a rendered pipeline.
 *
 * @since 1.0
 */
public enum StageOrder {
  /** Targeted filters mask "_value" in narrow form, right after the plain
   * filters and before range filtering, windowing and the final pivot. */
  STANDARD,

  /** Targeted filters mask the target column in wide form, after the final
   * pivot and before scaling. Aggregation therefore sees unmasked values. */
  LEGACY
}
