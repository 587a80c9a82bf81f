// This file is part of ClimAgg.
// Copyright (C) 2026  The ClimAgg Authors.
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
package net.climagg.utils;

import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Static, shared Jackson mapper for the YAML aggregation profiles along
 * with a few wrappers around the common calls. The mapper is thread safe
 * and expensive to build so there is one per JVM.
 * <p>
 * Mapping problems, i.e. the document parsed but didn't fit the class, are
 * reported as {@link IllegalArgumentException}s. Anything else Jackson
 * throws is wrapped in a {@link YAMLException}.
 * @since 1.0
 */
public final class YAML {
  /**
   * Jackson de/serializer initialized, configured and shared
   */
  private static final ObjectMapper MAPPER = 
      new ObjectMapper(new YAMLFactory());
  static {
    MAPPER.configure(JsonParser.Feature.ALLOW_COMMENTS, true);
    // a typo in a profile key must not silently fall back to a default
    MAPPER.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
  }

  private YAML() {
    // static helpers only
  }
  
  /**
   * Deserializes a YAML formatted string to a specific class type
   * @param yaml The string to deserialize
   * @param pojo The class type of the object used for deserialization
   * @return An object of the {@code pojo} type
   * @throws IllegalArgumentException if the data or class was null or 
   * mapping failed
   * @throws YAMLException if the data could not be parsed
   * @param <T> The type of object to parse to.
   */
  public static final <T> T parseToObject(final String yaml,
      final Class<T> pojo) {
    if (yaml == null || yaml.isEmpty())
      throw new IllegalArgumentException("Incoming data was null or empty");
    if (pojo == null)
      throw new IllegalArgumentException("Missing class type");
    
    try {
      return MAPPER.readValue(yaml, pojo);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(e);
    }
  }
  
  /**
   * Deserializes a YAML formatted input stream to a specific class type.
   * The stream is not closed.
   * @param stream The stream to deserialize
   * @param pojo The class type of the object used for deserialization
   * @return An object of the {@code pojo} type
   * @throws IllegalArgumentException if the data or class was null or 
   * mapping failed
   * @throws YAMLException if the stream could not be read
   * @param <T> The type of object to parse to.
   */
  public static final <T> T parseToObject(final InputStream stream,
      final Class<T> pojo) {
    if (stream == null)
      throw new IllegalArgumentException("Incoming data was null");
    if (pojo == null)
      throw new IllegalArgumentException("Missing class type");
    try {
      return MAPPER.readValue(stream, pojo);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new YAMLException(e);
    }
  }

  /**
   * Serializes the given object to a YAML string
   * @param object The object to serialize
   * @return A YAML formatted string
   * @throws IllegalArgumentException if the object was null
   * @throws YAMLException if the object could not be serialized
   */
  public static final String serializeToString(final Object object) {
    if (object == null)
      throw new IllegalArgumentException("Object was null");
    try {
      return MAPPER.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new YAMLException(e);
    }
  }
  
  /**
   * Returns a reference to the static ObjectMapper
   * @return The ObjectMapper
   */
  public final static ObjectMapper getMapper() {
    return MAPPER;
  }

}
