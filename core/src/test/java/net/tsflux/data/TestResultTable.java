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
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

public class TestResultTable {
  private static final Instant T0 = Instant.parse("2023-01-15T00:00:00Z");
  private static final Instant T1 = T0.plusSeconds(60);

  @Test
  public void columnKey() throws Exception {
    final ColumnKey flat = ColumnKey.of("pm25");
    assertEquals(1, flat.levels());
    assertEquals("pm25", flat.name());
    assertEquals("pm25", flat.last());
    assertEquals("pm25", flat.toString());

    final ColumnKey nested = ColumnKey.of("north", "pm25");
    assertEquals(2, nested.levels());
    assertEquals("north_pm25", nested.name());
    assertEquals("pm25", nested.last());
    assertEquals(ImmutableList.of("north", "pm25"), nested.parts());
    assertEquals(ColumnKey.of("north", "pm25"), nested);
    assertEquals(ColumnKey.of("north", "pm25").hashCode(), nested.hashCode());
    assertFalse(ColumnKey.of("north_pm25").equals(nested));

    // empty group value
    assertEquals("_pm25", ColumnKey.of("", "pm25").name());

    try {
      ColumnKey.of();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      ColumnKey.of("");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      ColumnKey.of("north", null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void builder() throws Exception {
    final ColumnKey a = ColumnKey.of("a");
    final ColumnKey b = ColumnKey.of("b");
    final Map<ColumnKey, Object> first = Maps.newLinkedHashMap();
    first.put(a, 1.0);
    first.put(b, null);
    final Map<ColumnKey, Object> second = Maps.newLinkedHashMap();
    second.put(a, 10.0);
    second.put(b, 2.0);

    final ResultTable table = ResultTable.newBuilder()
        .addRow(T1, Collections.<ColumnKey, Object>singletonMap(a, 5.0))
        .addRow(T0, first)
        .addRow(T0, second)
        .build();
    assertEquals(ImmutableList.of(a, b), table.columns());
    // insertion order until merged
    assertEquals(ImmutableList.of(T1, T0), table.timestamps());
    assertFalse(table.isSorted());
    // non-null cells already present win, nulls are filled
    assertEquals(1.0, table.value(T0, a));
    assertEquals(2.0, table.value(T0, b));
    assertNull(table.value(T1, b));
    assertNull(table.value(T0.minusSeconds(1), a));
    assertNull(table.row(T0.minusSeconds(1)));
    assertEquals(Arrays.<Object>asList(5.0, 1.0), table.column(a));

    try {
      table.row(T0).put(a, 3.0);
      fail("Expected UnsupportedOperationException");
    } catch (UnsupportedOperationException e) { }
  }

  @Test
  public void empty() throws Exception {
    assertTrue(ResultTable.EMPTY.isEmpty());
    assertEquals(0, ResultTable.EMPTY.size());
    assertTrue(ResultTable.EMPTY.isSorted());
    assertTrue(ResultTable.EMPTY.columns().isEmpty());
  }

  @Test
  public void builderErrors() throws Exception {
    try {
      ResultTable.newBuilder().addRow(null,
          Collections.<ColumnKey, Object>emptyMap());
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      ResultTable.newBuilder().addRow(T0, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      ResultTable.newBuilder().addColumn(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
