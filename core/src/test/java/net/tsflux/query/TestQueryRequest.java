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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import net.tsflux.exceptions.QueryValidationException;
import net.tsflux.query.QueryRequest.BooleanFilter;
import net.tsflux.query.QueryRequest.RangeFilter;
import net.tsflux.query.QueryRequest.ScalingConfig;
import net.tsflux.query.QueryRequest.WindowConfig;
import net.tsflux.utils.YAML;

public class TestQueryRequest {
  private static final Instant START = Instant.parse("2023-01-15T00:00:00Z");
  private static final Instant END = Instant.parse("2023-04-03T00:00:00Z");

  @Test
  public void builderDefaults() throws Exception {
    final QueryRequest request = base().addField("pm25").build();
    assertEquals("sensors", request.getBucket());
    assertEquals("air", request.getMeasurement());
    assertEquals(START, request.getStart());
    assertEquals(END, request.getEnd());
    assertEquals(ImmutableList.of("pm25"), request.getFields());
    assertTrue(request.getGroups().isEmpty());
    assertTrue(request.getBooleanFilters().isEmpty());
    assertTrue(request.getRangeFilters().isEmpty());
    assertTrue(request.getScaling().isEmpty());
    assertEquals(SplitUnit.NONE, request.getSplitUnit());
    assertFalse(request.isMultiindex());
    assertFalse(request.isAggregate());

    final WindowConfig window = request.getWindow();
    assertEquals("1h", window.getEvery());
    assertEquals("mean", window.getFunction());
    assertEquals("_value", window.getColumn());
    assertFalse(window.isAlignToStart());
    assertTrue(window.isCreateEmpty());
  }

  @Test
  public void extraAndPivotColumns() throws Exception {
    QueryRequest request = base()
        .addField("pm25")
        .addGroup("site")
        .addRangeFilter(range("temp", 0, 10))
        .addRangeFilter(range("pm25", 0, 500))
        .addRangeFilter(range("temp", 1, 2))
        .build();
    assertEquals(ImmutableList.of("temp"), request.getExtraFields());
    assertEquals(ImmutableList.of("pm25", "temp"), request.getQueriedFields());
    assertEquals(ImmutableList.of("site"), request.getPivotColumns());

    request = base()
        .addField("pm25")
        .addGroup("site")
        .setMultiindex(true)
        .build();
    assertEquals(ImmutableList.of("site", "_field"), request.getPivotColumns());

    request = base()
        .addField("pm25")
        .addField("pm10")
        .addGroup("site")
        .build();
    assertEquals(ImmutableList.of("site", "_field"), request.getPivotColumns());

    request = base()
        .addField("pm25")
        .build();
    assertEquals(ImmutableList.of("_field"), request.getPivotColumns());
  }

  @Test
  public void validation() throws Exception {
    try {
      base().build();
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }

    try {
      base().setFields(ImmutableList.<String>of()).build();
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }

    try {
      base().addField("pm25").setStart(END).setEnd(START).build();
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }

    try {
      base().addField("pm25").setEnd(START).build();
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }

    try {
      base().addField("pm25").setStart((Instant) null).build();
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }

    try {
      base().addField("pm\"25").build();
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }

    try {
      base().addField("pm25").addGroup("si\\te").build();
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }

    try {
      base().addField("pm25").setBucket("").build();
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }

    try {
      base().addField("pm25").addBooleanFilter("site\"", "north").build();
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }

    try {
      BooleanFilter.plain("nor\nth");
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }

    try {
      BooleanFilter.targeted("valid", null);
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }

    try {
      range("temp", 10, 0);
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }

    try {
      RangeFilter.newBuilder().setField("temp").setMin(0).build();
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }

    try {
      range("temp", Double.NaN, 0);
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }

    try {
      WindowConfig.newBuilder().setEvery("an hour").build();
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }

    try {
      WindowConfig.newBuilder().setFunction("mean, x: 1").build();
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }

    try {
      ScalingConfig.newBuilder().setField("pm25")
          .setStart(END).setEnd(START).build();
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }

    try {
      ScalingConfig.newBuilder().setField("pm25")
          .setSlope(Double.POSITIVE_INFINITY).build();
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }
  }

  @Test
  public void equalBoundsAllowed() throws Exception {
    final RangeFilter filter = range("temp", 5, 5);
    assertEquals(5, filter.getMin());
    assertEquals(5, filter.getMax());
  }

  @Test
  public void booleanFilters() throws Exception {
    final QueryRequest request = base()
        .addField("pm25")
        .addBooleanFilter("status", "ok")
        .addBooleanFilter("flag", BooleanFilter.targeted("valid", "pm25"))
        .build();
    assertEquals(ImmutableList.of("status", "flag"),
        ImmutableList.copyOf(request.getBooleanFilters().keySet()));
    final BooleanFilter plain = request.getBooleanFilters().get("status");
    assertFalse(plain.isTargeted());
    assertEquals("ok", plain.getValue());
    assertNull(plain.getColumn());
    final BooleanFilter targeted = request.getBooleanFilters().get("flag");
    assertTrue(targeted.isTargeted());
    assertEquals("valid", targeted.getValue());
    assertEquals("pm25", targeted.getColumn());

    try {
      request.getBooleanFilters().put("x", plain);
      fail("Expected UnsupportedOperationException");
    } catch (UnsupportedOperationException e) { }
  }

  @Test
  public void parseYaml() throws Exception {
    final String yaml = "bucket: sensors\n"
        + "measurement: air\n"
        + "start: 2023/01/15 00:00:00\n"
        + "end: 2023-04-03T00:00:00Z\n"
        + "fields: [pm25, pm10]\n"
        + "groups: [site]\n"
        + "booleanFilters:\n"
        + "  status: ok\n"
        + "  flag: {value: valid, column: pm25}\n"
        + "rangeFilters:\n"
        + "  - field: temp\n"
        + "    min: 0\n"
        + "    max: 10.5\n"
        + "    minInclusive: true\n"
        + "window:\n"
        + "  every: 15m\n"
        + "  function: max\n"
        + "  alignToStart: true\n"
        + "scaling:\n"
        + "  - field: pm25\n"
        + "    start: 2023/02/01 00:00:00\n"
        + "    slope: 1.5\n"
        + "splitUnit: month\n"
        + "multiindex: true\n"
        + "aggregate: true\n"
        + "unknown: ignored\n";
    final QueryRequest request = YAML.parseToObject(yaml, QueryRequest.class);
    assertEquals("sensors", request.getBucket());
    assertEquals("air", request.getMeasurement());
    assertEquals(START, request.getStart());
    assertEquals(END, request.getEnd());
    assertEquals(ImmutableList.of("pm25", "pm10"), request.getFields());
    assertEquals(ImmutableList.of("site"), request.getGroups());
    assertEquals(BooleanFilter.plain("ok"),
        request.getBooleanFilters().get("status"));
    assertEquals(BooleanFilter.targeted("valid", "pm25"),
        request.getBooleanFilters().get("flag"));

    final RangeFilter range = request.getRangeFilters().get(0);
    assertEquals("temp", range.getField());
    assertEquals(0, range.getMin().intValue());
    assertEquals(10.5, range.getMax().doubleValue(), 0.0001);
    assertTrue(range.isMinInclusive());
    assertFalse(range.isMaxInclusive());

    assertEquals("15m", request.getWindow().getEvery());
    assertEquals("max", request.getWindow().getFunction());
    assertTrue(request.getWindow().isAlignToStart());
    assertTrue(request.getWindow().isCreateEmpty());

    final ScalingConfig scaling = request.getScaling().get(0);
    assertEquals("pm25", scaling.getField());
    assertEquals(Instant.parse("2023-02-01T00:00:00Z"), scaling.getStart());
    assertNull(scaling.getEnd());
    assertEquals(1.5, scaling.getSlope().doubleValue(), 0.0001);
    assertEquals(0, scaling.getOffset().intValue());

    assertEquals(SplitUnit.MONTH, request.getSplitUnit());
    assertTrue(request.isMultiindex());
    assertTrue(request.isAggregate());
  }

  @Test
  public void parseLegacyKeys() throws Exception {
    final String yaml = "bucket: sensors\n"
        + "measurement: air\n"
        + "start: 2023-01-15T00:00:00Z\n"
        + "end: 2023-04-03T00:00:00Z\n"
        + "fields: [pm25]\n"
        + "bool_filters:\n"
        + "  flag: {Value: valid, Col: pm25}\n"
        + "rangeFilters:\n"
        + "  - {Field: temp, Min: 0, Max: 10, Min Equal: true, "
          + "Max Equal: false}\n"
        + "window: {win_range: 1d, win_func: median, hour_beginning: true}\n"
        + "scaling:\n"
        + "  - Field: pm25\n"
        + "    Start: '2023/01/15 00:00:00'\n"
        + "    End: '2023/01/16 00:00:00'\n"
        + "    Slope: 2\n"
        + "    Offset: 1\n";
    final QueryRequest request = YAML.parseToObject(yaml, QueryRequest.class);
    assertEquals(BooleanFilter.targeted("valid", "pm25"),
        request.getBooleanFilters().get("flag"));
    assertTrue(request.getRangeFilters().get(0).isMinInclusive());
    assertEquals("1d", request.getWindow().getEvery());
    assertEquals("median", request.getWindow().getFunction());
    assertTrue(request.getWindow().isAlignToStart());
    assertEquals(Instant.parse("2023-01-16T00:00:00Z"),
        request.getScaling().get(0).getEnd());
    assertEquals(2, request.getScaling().get(0).getSlope().intValue());
  }

  @Test
  public void parseFlatLegacyKeys() throws Exception {
    final String yaml = "bucket: sensors\n"
        + "measurement: air\n"
        + "start: 2023-01-15T00:00:00Z\n"
        + "end: 2023-04-03T00:00:00Z\n"
        + "fields: [pm25]\n"
        + "win_range: 30m\n"
        + "win_func: max\n"
        + "hour_beginning: true\n"
        + "aggregate: true\n"
        + "time_split: week\n";
    QueryRequest request = YAML.parseToObject(yaml, QueryRequest.class);
    assertEquals(SplitUnit.WEEK, request.getSplitUnit());
    assertEquals("30m", request.getWindow().getEvery());
    assertEquals("max", request.getWindow().getFunction());
    assertTrue(request.getWindow().isAlignToStart());
    assertTrue(request.getWindow().isCreateEmpty());

    // flat keys override the window block, the rest of the block is kept
    request = YAML.parseToObject("bucket: sensors\n"
        + "measurement: air\n"
        + "start: 2023-01-15T00:00:00Z\n"
        + "end: 2023-04-03T00:00:00Z\n"
        + "fields: [pm25]\n"
        + "window: {every: 1d, function: min, column: temp, "
          + "createEmpty: false}\n"
        + "hour_beginning: true\n", QueryRequest.class);
    assertEquals("1d", request.getWindow().getEvery());
    assertEquals("min", request.getWindow().getFunction());
    assertEquals("temp", request.getWindow().getColumn());
    assertFalse(request.getWindow().isCreateEmpty());
    assertTrue(request.getWindow().isAlignToStart());

    // invalid flat values are still validated
    try {
      YAML.parseToObject("bucket: sensors\n"
          + "measurement: air\n"
          + "start: 2023-01-15T00:00:00Z\n"
          + "end: 2023-04-03T00:00:00Z\n"
          + "fields: [pm25]\n"
          + "win_func: \"mean) |> drop(\"\n", QueryRequest.class);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void parseYamlInvalid() throws Exception {
    try {
      YAML.parseToObject("bucket: sensors\n"
          + "measurement: air\n"
          + "start: 2023-01-15T00:00:00Z\n"
          + "end: 2023-04-03T00:00:00Z\n"
          + "fields: []\n", QueryRequest.class);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      YAML.parseToObject("bucket: sensors\n"
          + "measurement: air\n"
          + "start: 2023-01-15T00:00:00Z\n"
          + "end: 2023-04-03T00:00:00Z\n"
          + "fields: [pm25]\n"
          + "booleanFilters: {flag: [a, b]}\n", QueryRequest.class);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      YAML.parseToObject("bucket: sensors\n"
          + "measurement: air\n"
          + "start: 2023-01-15T00:00:00Z\n"
          + "end: 2023-04-03T00:00:00Z\n"
          + "fields: [pm25]\n"
          + "splitUnit: fortnight\n", QueryRequest.class);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void splitUnitFromString() throws Exception {
    assertEquals(SplitUnit.NONE, SplitUnit.fromString(null));
    assertEquals(SplitUnit.NONE, SplitUnit.fromString(""));
    assertEquals(SplitUnit.HOUR, SplitUnit.fromString("hour"));
    assertEquals(SplitUnit.WEEK, SplitUnit.fromString("Week"));
    assertEquals(SplitUnit.YEAR, SplitUnit.fromString(" YEAR "));
    try {
      SplitUnit.fromString("fortnight");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  private static QueryRequest.Builder base() {
    return QueryRequest.newBuilder()
        .setBucket("sensors")
        .setMeasurement("air")
        .setStart(START)
        .setEnd(END);
  }

  private static RangeFilter range(final String field,
                                   final Number min,
                                   final Number max) {
    return RangeFilter.newBuilder()
        .setField(field)
        .setMin(min)
        .setMax(max)
        .build();
  }
}
