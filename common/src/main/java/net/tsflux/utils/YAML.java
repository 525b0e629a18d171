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
package net.tsflux.utils;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Static initialization and configuration of a YAML flavored Jackson
 * ObjectMapper for config and request files. Since YAML is a superset of
 * JSON, JSON files parse as well.
 * <p>
 * Mapping errors are surfaced as {@link IllegalArgumentException}s, I/O
 * failures as {@link YAMLException}s.
 *
 * @since 1.0
 */
public final class YAML {
  /** Jackson de/serializer initialized, configured and shared. */
  private static final ObjectMapper MAPPER =
      new ObjectMapper(new YAMLFactory());
  static {
    MAPPER.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
    MAPPER.configure(JsonParser.Feature.ALLOW_COMMENTS, true);
  }

  private YAML() {
    // static helper
  }

  /**
   * Deserializes a YAML formatted string to a specific class type.
   * @param yaml The string to deserialize.
   * @param pojo The class type of the object used for deserialization.
   * @param <T> The type of object to parse to.
   * @return An object of the {@code pojo} type.
   * @throws IllegalArgumentException if the data or class was null or parsing
   * failed.
   * @throws YAMLException if the data could not be read.
   */
  public static <T> T parseToObject(final String yaml, final Class<T> pojo) {
    if (yaml == null || yaml.isEmpty()) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    if (pojo == null) {
      throw new IllegalArgumentException("Missing class type");
    }
    try {
      return MAPPER.readValue(yaml, pojo);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new YAMLException(e);
    }
  }

  /**
   * Deserializes a YAML formatted stream to a specific class type.
   * @param stream The stream to deserialize.
   * @param pojo The class type of the object used for deserialization.
   * @param <T> The type of object to parse to.
   * @return An object of the {@code pojo} type.
   * @throws IllegalArgumentException if the data or class was null or parsing
   * failed.
   * @throws YAMLException if the data could not be read.
   */
  public static <T> T parseToObject(final InputStream stream,
                                    final Class<T> pojo) {
    if (stream == null) {
      throw new IllegalArgumentException("Incoming data was null");
    }
    if (pojo == null) {
      throw new IllegalArgumentException("Missing class type");
    }
    try {
      return MAPPER.readValue(stream, pojo);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new YAMLException(e);
    }
  }

  /**
   * Deserializes a YAML file to a specific class type.
   * @param file The file to read.
   * @param pojo The class type of the object used for deserialization.
   * @param <T> The type of object to parse to.
   * @return An object of the {@code pojo} type.
   * @throws IllegalArgumentException if the file or class was null or parsing
   * failed.
   * @throws YAMLException if the file could not be read.
   */
  public static <T> T parseToObject(final File file, final Class<T> pojo) {
    if (file == null) {
      throw new IllegalArgumentException("File was null");
    }
    if (pojo == null) {
      throw new IllegalArgumentException("Missing class type");
    }
    try {
      return MAPPER.readValue(file, pojo);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Failed to parse " + file, e);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException("Failed to map " + file, e);
    } catch (IOException e) {
      throw new YAMLException("Failed to read " + file, e);
    }
  }

  /**
   * Exception wrapper for I/O failures while reading YAML.
   */
  public static final class YAMLException extends RuntimeException {
    private static final long serialVersionUID = -1783024119716208125L;

    public YAMLException(final Throwable cause) {
      super(cause);
    }

    public YAMLException(final String msg, final Throwable cause) {
      super(msg, cause);
    }
  }
}
