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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import net.tsflux.exceptions.QueryValidationException;

public class TestTimeWindowPlanner {
  private TimeWindowPlanner planner;

  @Before
  public void before() throws Exception {
    planner = new TimeWindowPlanner();
  }

  @Test
  public void none() throws Exception {
    final List<SubWindow> windows = planner.plan(ts("2020-01-01T00:00:00Z"),
        ts("2023-01-01T00:00:00Z"), SplitUnit.NONE);
    assertEquals(1, windows.size());
    assertWindow(windows.get(0), "2020-01-01T00:00:00Z",
        "2023-01-01T00:00:00Z", 0);

    // null is none
    assertEquals(windows, planner.plan(ts("2020-01-01T00:00:00Z"),
        ts("2023-01-01T00:00:00Z"), null));
  }

  @Test
  public void zeroLength() throws Exception {
    final List<SubWindow> windows = planner.plan(ts("2023-01-01T00:00:00Z"),
        ts("2023-01-01T00:00:00Z"), SplitUnit.DAY);
    assertEquals(1, windows.size());
    assertWindow(windows.get(0), "2023-01-01T00:00:00Z",
        "2023-01-01T00:00:00Z", 0);
  }

  @Test
  public void hour() throws Exception {
    List<SubWindow> windows = planner.plan(ts("2023-01-15T10:00:00Z"),
        ts("2023-01-15T13:00:00Z"), SplitUnit.HOUR);
    assertEquals(3, windows.size());
    assertWindow(windows.get(0), "2023-01-15T10:00:00Z",
        "2023-01-15T11:00:00Z", 0);
    assertWindow(windows.get(1), "2023-01-15T11:00:00Z",
        "2023-01-15T12:00:00Z", 1);
    assertWindow(windows.get(2), "2023-01-15T12:00:00Z",
        "2023-01-15T13:00:00Z", 2);

    // partial hour at the end is kept and clipped
    windows = planner.plan(ts("2023-01-15T10:30:00Z"),
        ts("2023-01-15T12:45:00Z"), SplitUnit.HOUR);
    assertEquals(3, windows.size());
    assertWindow(windows.get(2), "2023-01-15T12:30:00Z",
        "2023-01-15T12:45:00Z", 2);
    assertPartition(windows, "2023-01-15T10:30:00Z", "2023-01-15T12:45:00Z");
  }

  @Test
  public void day() throws Exception {
    final List<SubWindow> windows = planner.plan(ts("2023-01-30T06:00:00Z"),
        ts("2023-02-02T00:00:00Z"), SplitUnit.DAY);
    assertEquals(3, windows.size());
    assertWindow(windows.get(0), "2023-01-30T06:00:00Z",
        "2023-01-31T06:00:00Z", 0);
    assertWindow(windows.get(2), "2023-02-01T06:00:00Z",
        "2023-02-02T00:00:00Z", 2);
    assertPartition(windows, "2023-01-30T06:00:00Z", "2023-02-02T00:00:00Z");
  }

  @Test
  public void week() throws Exception {
    final List<SubWindow> windows = planner.plan(ts("2023-01-01T00:00:00Z"),
        ts("2023-01-16T00:00:00Z"), SplitUnit.WEEK);
    assertEquals(3, windows.size());
    assertWindow(windows.get(0), "2023-01-01T00:00:00Z",
        "2023-01-08T00:00:00Z", 0);
    assertWindow(windows.get(1), "2023-01-08T00:00:00Z",
        "2023-01-15T00:00:00Z", 1);
    assertWindow(windows.get(2), "2023-01-15T00:00:00Z",
        "2023-01-16T00:00:00Z", 2);
  }

  @Test
  public void weekOverCenturies() throws Exception {
    // wider than a long of nanoseconds can hold
    final List<SubWindow> windows = planner.plan(ts("1700-01-01T00:00:00Z"),
        ts("2023-01-01T00:00:00Z"), SplitUnit.WEEK);
    assertEquals(16854, windows.size());
    assertPartition(windows, "1700-01-01T00:00:00Z", "2023-01-01T00:00:00Z");
    assertWindow(windows.get(16853), "2022-12-30T00:00:00Z",
        "2023-01-01T00:00:00Z", 16853);
  }

  @Test
  public void dayExactMultiple() throws Exception {
    final List<SubWindow> windows = planner.plan(ts("2023-01-01T00:00:00Z"),
        ts("2023-01-03T00:00:00Z"), SplitUnit.DAY);
    assertEquals(2, windows.size());
    assertWindow(windows.get(1), "2023-01-02T00:00:00Z",
        "2023-01-03T00:00:00Z", 1);
  }

  @Test
  public void month() throws Exception {
    final List<SubWindow> windows = planner.plan(ts("2023-01-15T00:00:00Z"),
        ts("2023-04-03T00:00:00Z"), SplitUnit.MONTH);
    assertEquals(4, windows.size());
    assertWindow(windows.get(0), "2023-01-15T00:00:00Z",
        "2023-02-01T00:00:00Z", 0);
    assertWindow(windows.get(1), "2023-02-01T00:00:00Z",
        "2023-03-01T00:00:00Z", 1);
    assertWindow(windows.get(2), "2023-03-01T00:00:00Z",
        "2023-04-01T00:00:00Z", 2);
    assertWindow(windows.get(3), "2023-04-01T00:00:00Z",
        "2023-04-03T00:00:00Z", 3);
  }

  @Test
  public void monthAligned() throws Exception {
    List<SubWindow> windows = planner.plan(ts("2024-01-01T00:00:00Z"),
        ts("2024-03-01T00:00:00Z"), SplitUnit.MONTH);
    assertEquals(2, windows.size());
    assertWindow(windows.get(1), "2024-02-01T00:00:00Z",
        "2024-03-01T00:00:00Z", 1);

    // within one month
    windows = planner.plan(ts("2024-02-10T12:00:00Z"),
        ts("2024-02-11T00:00:00Z"), SplitUnit.MONTH);
    assertEquals(1, windows.size());
    assertWindow(windows.get(0), "2024-02-10T12:00:00Z",
        "2024-02-11T00:00:00Z", 0);

    // over a year end
    windows = planner.plan(ts("2023-12-31T23:00:00Z"),
        ts("2024-01-01T01:00:00Z"), SplitUnit.MONTH);
    assertEquals(2, windows.size());
    assertWindow(windows.get(0), "2023-12-31T23:00:00Z",
        "2024-01-01T00:00:00Z", 0);
  }

  @Test
  public void year() throws Exception {
    final List<SubWindow> windows = planner.plan(ts("2021-06-15T00:00:00Z"),
        ts("2023-02-01T00:00:00Z"), SplitUnit.YEAR);
    assertEquals(3, windows.size());
    assertWindow(windows.get(0), "2021-06-15T00:00:00Z",
        "2022-01-01T00:00:00Z", 0);
    assertWindow(windows.get(1), "2022-01-01T00:00:00Z",
        "2023-01-01T00:00:00Z", 1);
    assertWindow(windows.get(2), "2023-01-01T00:00:00Z",
        "2023-02-01T00:00:00Z", 2);
  }

  @Test
  public void partitionsEveryUnit() throws Exception {
    final String[][] ranges = new String[][] {
      { "2023-01-15T00:00:00Z", "2023-04-03T00:00:00Z" },
      { "2023-02-28T13:17:00Z", "2023-03-01T02:00:00Z" },
      { "2020-02-29T00:00:00.5Z", "2021-03-01T00:00:00Z" },
      { "2023-07-01T00:00:00Z", "2023-07-01T00:00:00.001Z" },
    };
    for (final String[] range : ranges) {
      for (final SplitUnit unit : SplitUnit.values()) {
        assertPartition(planner.plan(ts(range[0]), ts(range[1]), unit),
            range[0], range[1]);
      }
    }
  }

  @Test
  public void invalid() throws Exception {
    try {
      planner.plan(ts("2023-01-02T00:00:00Z"), ts("2023-01-01T00:00:00Z"),
          SplitUnit.DAY);
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }

    try {
      planner.plan(null, ts("2023-01-01T00:00:00Z"), SplitUnit.DAY);
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }
  }

  private static void assertPartition(final List<SubWindow> windows,
                                      final String start,
                                      final String end) {
    assertFalse(windows.isEmpty());
    assertEquals(ts(start), windows.get(0).start());
    assertEquals(ts(end), windows.get(windows.size() - 1).end());
    for (int i = 0; i < windows.size(); i++) {
      final SubWindow window = windows.get(i);
      assertEquals(i, window.order());
      assertTrue(window.start().isBefore(window.end()));
      if (i > 0) {
        assertEquals(windows.get(i - 1).end(), window.start());
      }
    }
  }

  private static void assertWindow(final SubWindow window,
                                   final String start,
                                   final String end,
                                   final int order) {
    assertEquals(ts(start), window.start());
    assertEquals(ts(end), window.end());
    assertEquals(order, window.order());
  }

  private static Instant ts(final String ts) {
    return Instant.parse(ts);
  }
}
