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

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.UnsignedLong;

import net.tsflux.data.FluxTable;
import net.tsflux.exceptions.RemoteQueryExecutionException;

/**
 * Parses the annotated CSV a Flux query endpoint answers with into a single
 * {@link FluxTable}. Every result table in the response is appended, the
 * column sets are unioned. Values are typed from the {@code #datatype}
 * annotation and empty cells take the {@code #default} annotation, or null.
 * <p>
 * A block whose columns are exactly {@code error} and {@code reference} is
 * the store reporting a failure after it already answered 200 and is raised
 * as a {@link RemoteQueryExecutionException}. A data column that happens to
 * be named {@code error} is parsed like any other.
 *
 * @since 1.0
 */
public class AnnotatedCsvParser {
  private static final Logger LOG = LoggerFactory.getLogger(
      AnnotatedCsvParser.class);

  public static final String DATATYPE = "#datatype";
  public static final String GROUP = "#group";
  public static final String DEFAULT = "#default";
  public static final String ERROR_COLUMN = "error";
  public static final String REFERENCE_COLUMN = "reference";

  private static final CsvMapper MAPPER = new CsvMapper();
  static {
    MAPPER.enable(CsvParser.Feature.WRAP_AS_ARRAY);
  }

  private static final ObjectReader READER = MAPPER
      .readerFor(String[].class)
      .with(CsvSchema.emptySchema());

  /** The endpoint the body came from, for exceptions. */
  private final String remote;

  /**
   * Default ctor.
   * @param remote A description of the endpoint for error messages.
   */
  public AnnotatedCsvParser(final String remote) {
    this.remote = remote;
  }

  /**
   * Parses the body.
   * @param body The response body, may be null or empty.
   * @return The table, {@link FluxTable#EMPTY} if the body held no rows.
   * @throws RemoteQueryExecutionException if the body could not be read or
   * reported an error.
   */
  public FluxTable parse(final String body) {
    if (Strings.isNullOrEmpty(body) || body.trim().isEmpty()) {
      return FluxTable.EMPTY;
    }

    final FluxTable.Builder builder = FluxTable.newBuilder();
    Block block = new Block();
    int rows = 0;
    try (final MappingIterator<String[]> iterator = READER.readValues(body)) {
      while (iterator.hasNextValue()) {
        final String[] line = iterator.nextValue();
        if (isBlank(line)) {
          // tables are separated by an empty line, a header may follow
          block = new Block();
          continue;
        }
        if (line[0].startsWith("#")) {
          if (block.header != null) {
            block = new Block();
          }
          block.annotate(line);
          continue;
        }
        if (block.header == null) {
          block.setHeader(line);
          continue;
        }
        if (block.error >= 0) {
          throw new RemoteQueryExecutionException(
              "Query failed: " + cell(line, block.error), remote, 500);
        }
        builder.addRow(block.toRow(line));
        rows++;
      }
    } catch (IOException e) {
      throw new RemoteQueryExecutionException("Failed to read the CSV "
          + "response", remote, 500, e);
    } catch (IllegalArgumentException e) {
      throw new RemoteQueryExecutionException("Failed to parse the CSV "
          + "response: " + e.getMessage(), remote, 500, e);
    }

    if (rows == 0) {
      return FluxTable.EMPTY;
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Parsed " + rows + " rows from " + remote);
    }
    return builder.build();
  }

  /**
   * Converts a cell to the Java type for its annotated data type.
   * @param datatype The annotation, may be null for plain strings.
   * @param value The non-empty raw value.
   * @return The typed value.
   * @throws IllegalArgumentException if the value doesn't parse.
   */
  static Object convert(final String datatype, final String value) {
    if (datatype == null) {
      return value;
    }
    try {
      if (datatype.equals("double")) {
        if (value.equals("+Inf")) {
          return Double.POSITIVE_INFINITY;
        }
        if (value.equals("-Inf")) {
          return Double.NEGATIVE_INFINITY;
        }
        return Double.parseDouble(value);
      }
      if (datatype.equals("long")) {
        return Long.parseLong(value);
      }
      if (datatype.equals("unsignedLong")) {
        return UnsignedLong.valueOf(value);
      }
      if (datatype.equals("boolean")) {
        return Boolean.parseBoolean(value);
      }
      if (datatype.startsWith("dateTime")) {
        return Instant.parse(value);
      }
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid " + datatype + " value: "
          + value, e);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid " + datatype + " value: "
          + value, e);
    }
    // string, duration, base64Binary
    return value;
  }

  private static boolean isBlank(final String[] line) {
    if (line == null || line.length == 0) {
      return true;
    }
    for (final String cell : line) {
      if (!Strings.isNullOrEmpty(cell)) {
        return false;
      }
    }
    return true;
  }

  private static String cell(final String[] line, final int index) {
    return index < line.length ? line[index] : null;
  }

  private static final List<String> ERROR_TABLE =
      ImmutableList.of(ERROR_COLUMN, REFERENCE_COLUMN);

  /** The annotations and header of one block of tables. */
  private static class Block {
    private String[] datatypes;
    private String[] defaults;
    private String[] header;
    /** Index of the first real column. */
    private int first;
    private int error = -1;

    void annotate(final String[] line) {
      if (line[0].equals(DATATYPE)) {
        datatypes = line;
      } else if (line[0].equals(DEFAULT)) {
        defaults = line;
      }
      // #group only matters to the store
    }

    void setHeader(final String[] line) {
      header = line;
      // annotated responses carry an empty leading column
      first = line[0].isEmpty() ? 1 : 0;
      final List<String> columns = Arrays.asList(line)
          .subList(first, line.length);
      error = columns.equals(ERROR_TABLE) ? first : -1;
    }

    Map<String, Object> toRow(final String[] line) {
      final Map<String, Object> row = new LinkedHashMap<String, Object>();
      for (int i = first; i < header.length; i++) {
        String value = cell(line, i);
        if (Strings.isNullOrEmpty(value)) {
          value = defaults == null ? null : Strings.emptyToNull(cell(defaults, i));
        }
        row.put(header[i], value == null ? null
            : convert(datatypes == null ? null : cell(datatypes, i), value));
      }
      return row;
    }
  }
}
