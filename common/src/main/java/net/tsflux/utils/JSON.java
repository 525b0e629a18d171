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

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Static, shared Jackson mapper plus a couple of wrappers for the common
 * calls. The mapper is thread safe and expensive to build so there is only
 * one per app.
 *
 * @since 1.0
 */
public final class JSON {
  /** Jackson de/serializer initialized, configured and shared. */
  private static final ObjectMapper MAPPER = new ObjectMapper();
  static {
    MAPPER.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
  }

  private JSON() {
    // static helper
  }

  /**
   * Deserializes a JSON formatted string to a specific class type.
   * @param json The string to deserialize.
   * @param pojo The class type of the object used for deserialization.
   * @param <T> The type of object to parse to.
   * @return An object of the {@code pojo} type.
   * @throws IllegalArgumentException if the data or class was null or parsing
   * failed.
   */
  public static <T> T parseToObject(final String json, final Class<T> pojo) {
    if (json == null || json.isEmpty()) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    if (pojo == null) {
      throw new IllegalArgumentException("Missing class type");
    }
    try {
      return MAPPER.readValue(json, pojo);
    } catch (IOException e) {
      throw new IllegalArgumentException(e);
    }
  }

  /**
   * Serializes the given object to a JSON string.
   * @param object The object to serialize.
   * @return A JSON formatted string.
   * @throws IllegalArgumentException if the object was null or could not be
   * serialized.
   */
  public static String serializeToString(final Object object) {
    if (object == null) {
      throw new IllegalArgumentException("Object was null");
    }
    try {
      return MAPPER.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(e);
    }
  }

  /** @return The shared mapper. */
  public static ObjectMapper getMapper() {
    return MAPPER;
  }
}
