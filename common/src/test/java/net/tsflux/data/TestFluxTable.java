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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;
import java.util.Map;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

public class TestFluxTable {
  private static final Instant T0 = Instant.parse("2023-01-15T00:00:00Z");

  @Test
  public void empty() throws Exception {
    assertTrue(FluxTable.EMPTY.isEmpty());
    assertEquals(0, FluxTable.EMPTY.size());
    assertTrue(FluxTable.EMPTY.columns().isEmpty());
  }

  @Test
  public void builderUnionsColumns() throws Exception {
    final FluxTable table = FluxTable.newBuilder()
        .addColumn(FluxTable.TIME_COLUMN)
        .addRow(FluxTable.TIME_COLUMN, T0, "a", 1.0)
        .addRow(FluxTable.TIME_COLUMN, T0.plusSeconds(60), "b", 2L)
        .build();
    assertEquals(ImmutableList.of("_time", "a", "b"), table.columns());
    assertEquals(2, table.size());
    assertFalse(table.isEmpty());
    assertTrue(table.hasColumn("a"));
    assertFalse(table.hasColumn("c"));
    assertEquals(1.0, table.value(0, "a"));
    assertNull(table.value(0, "b"));
    assertEquals(2L, table.value(1, "b"));
    assertEquals(T0.plusSeconds(60), table.value(1, FluxTable.TIME_COLUMN));
  }

  @Test
  public void nullValuesKept() throws Exception {
    final FluxTable table = FluxTable.newBuilder()
        .addRow(FluxTable.TIME_COLUMN, T0, "a", null)
        .build();
    assertTrue(table.hasColumn("a"));
    assertNull(table.value(0, "a"));
  }

  @Test
  public void immutable() throws Exception {
    final Map<String, Object> row = Maps.newLinkedHashMap();
    row.put(FluxTable.TIME_COLUMN, T0);
    row.put("a", 1.0);
    final FluxTable table = FluxTable.newBuilder().addRow(row).build();
    row.put("a", 42.0);
    assertEquals(1.0, table.value(0, "a"));

    try {
      table.rows().get(0).put("a", 2.0);
      fail("Expected UnsupportedOperationException");
    } catch (UnsupportedOperationException e) { }

    try {
      table.columns().add("b");
      fail("Expected UnsupportedOperationException");
    } catch (UnsupportedOperationException e) { }
  }

  @Test
  public void builderErrors() throws Exception {
    try {
      FluxTable.newBuilder().addColumn(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      FluxTable.newBuilder().addColumn("");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      FluxTable.newBuilder().addRow((Map<String, Object>) null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      FluxTable.newBuilder().addRow(FluxTable.TIME_COLUMN, T0, "a");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
