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

package io.github.suppierk.views.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.suppierk.views.change.Change;
import io.github.suppierk.views.value.InitViewData;

/**
 * Wire codec for {@link InitViewData} and {@link Change} records.
 *
 * <p>Field names and the epoch milliseconds timestamp convention are a contract with subscribers:
 * whatever is written here must read back into an equal record.
 */
public final class ViewJson {
  private ViewJson() {
    // No instance
  }

  /**
   * @return shared {@link ObjectMapper} configured for view records
   */
  public static ObjectMapper mapper() {
    return Holder.MAPPER;
  }

  /**
   * @param value to encode
   * @return JSON text of the value
   * @throws IllegalStateException if the value cannot be encoded
   */
  public static String write(final Object value) {
    try {
      return Holder.MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(
          "Unable to encode %s".formatted(value.getClass().getSimpleName()), e);
    }
  }

  /**
   * @param value to encode, must be encoded as a JSON object
   * @return JSON tree of the value
   * @throws IllegalStateException if the value cannot be encoded as an object
   */
  public static ObjectNode toJsonTree(final Object value) {
    try {
      return Holder.MAPPER.valueToTree(value);
    } catch (IllegalArgumentException | ClassCastException e) {
      throw new IllegalStateException(
          "Unable to encode %s".formatted(value.getClass().getSimpleName()), e);
    }
  }

  /**
   * @param json text produced by {@link #write(Object)} for a {@link Change}
   * @return decoded change
   * @throws IllegalArgumentException if the text is not a valid change
   */
  public static Change readChange(final String json) {
    return read(json, Change.class);
  }

  /**
   * @param json text produced by {@link #write(Object)} for an {@link InitViewData}
   * @return decoded seed
   * @throws IllegalArgumentException if the text is not a valid seed
   */
  public static InitViewData readInitViewData(final String json) {
    return read(json, InitViewData.class);
  }

  private static <T> T read(final String json, final Class<T> type) {
    if (json == null) {
      throw new IllegalArgumentException("JSON cannot be null");
    }

    try {
      return Holder.MAPPER.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(
          "Unable to decode %s: %s".formatted(type.getSimpleName(), e.getOriginalMessage()), e);
    }
  }

  /**
   * @see <a
   *     href="https://en.wikipedia.org/wiki/Initialization-on-demand_holder_idiom">Initialization-on-demand
   *     holder idiom</a>
   */
  private static class Holder {
    private static final ObjectMapper MAPPER =
        JsonMapper.builder()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .build();
  }
}
