/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.eventsourcing.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.github.suppierk.eventsourcing.error.AggregateException;
import io.vavr.control.Try;

/**
 * The serialization boundary used by storage adapters: aggregates and events are stored as JSON
 * documents produced by Jackson.
 *
 * <p>Failures are reported in terms of {@link AggregateException}: records which cannot be read
 * back become {@link AggregateException.Deserialization}, values which cannot be written become
 * {@link AggregateException.Unexpected}.
 */
public final class JsonCodec {
  private final ObjectMapper objectMapper;

  /**
   * @param objectMapper to use for both directions, configured by the integrator
   * @throws IllegalArgumentException if the mapper is null
   */
  public JsonCodec(final ObjectMapper objectMapper) {
    if (objectMapper == null) {
      throw new IllegalArgumentException("ObjectMapper cannot be null");
    }

    this.objectMapper = objectMapper;
  }

  /**
   * Unknown properties are rejected, a stored record must match the aggregate shape exactly.
   *
   * @return a codec with the default mapper settings
   */
  public static JsonCodec defaultCodec() {
    return new JsonCodec(
        JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .build());
  }

  /**
   * @param aggregateType the value belongs to, used for error reporting
   * @param value to serialize
   * @return JSON representation of the value
   * @throws AggregateException.Unexpected if the value cannot be serialized
   */
  public String write(final String aggregateType, final Object value) {
    return Try.of(() -> objectMapper.writeValueAsString(value))
        .getOrElseThrow(cause -> new AggregateException.Unexpected(aggregateType, cause));
  }

  /**
   * @param aggregateType the value belongs to, used for error reporting
   * @param aggregateId the value belongs to, used for error reporting
   * @param json to deserialize
   * @param type of the value
   * @param <T> is the type of the value
   * @return deserialized value
   * @throws AggregateException.Deserialization if the JSON does not match the type
   */
  public <T> T read(
      final String aggregateType,
      final String aggregateId,
      final String json,
      final Class<T> type) {
    return Try.of(() -> objectMapper.readValue(json, type))
        .getOrElseThrow(
            cause -> new AggregateException.Deserialization(aggregateType, aggregateId, cause));
  }
}
