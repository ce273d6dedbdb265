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

package io.github.suppierk.views.value;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Describes one of the supported {@link ViewValue} kinds: its type tag, how to wrap a Java value
 * and how to read the value back from its JSON form.
 *
 * <p>Type tags are part of the wire contract and must not change.
 *
 * @param <T> is the Java type of the described values
 */
public final class ViewValueType<T> {
  public static final ViewValueType<Integer> INT =
      new ViewValueType<>("int", ViewValue.IntValue::new, ViewValueType::readInt);
  public static final ViewValueType<Long> LONG =
      new ViewValueType<>("long", ViewValue.LongValue::new, ViewValueType::readLong);
  public static final ViewValueType<String> STRING =
      new ViewValueType<>("String", ViewValue.StringValue::new, ViewValueType::readString);
  public static final ViewValueType<Boolean> BOOLEAN =
      new ViewValueType<>("bool", ViewValue.BooleanValue::new, ViewValueType::readBoolean);
  public static final ViewValueType<String> OPTIONAL_STRING =
      new ViewValueType<>(
          "String?", ViewValue.OptionalStringValue::new, ViewValueType::readOptionalString);
  public static final ViewValueType<List<String>> STRING_LIST =
      new ViewValueType<>(
          "List<String>", ViewValue.StringListValue::new, ViewValueType::readStringList);
  public static final ViewValueType<Instant> TIMESTAMP =
      new ViewValueType<>("DateTime", ViewValue.TimestampValue::new, ViewValueType::readTimestamp);

  private static final Map<String, ViewValueType<?>> BY_TAG;

  static {
    final Map<String, ViewValueType<?>> byTag = new LinkedHashMap<>();
    for (ViewValueType<?> type :
        List.of(INT, LONG, STRING, BOOLEAN, OPTIONAL_STRING, STRING_LIST, TIMESTAMP)) {
      byTag.put(type.tag(), type);
    }
    BY_TAG = Collections.unmodifiableMap(byTag);
  }

  private final String tag;
  private final Function<T, ViewValue<T>> wrapper;
  private final Function<JsonNode, T> reader;

  private ViewValueType(
      final String tag,
      final Function<T, ViewValue<T>> wrapper,
      final Function<JsonNode, T> reader) {
    this.tag = tag;
    this.wrapper = wrapper;
    this.reader = reader;
  }

  /**
   * @param tag of the type, as produced by {@link #tag()}
   * @return matching {@link ViewValueType}
   * @throws IllegalArgumentException if the tag is {@code null} or unknown
   */
  public static ViewValueType<?> forTag(final String tag) {
    if (tag == null) {
      throw new IllegalArgumentException("Value type tag cannot be null");
    }

    final ViewValueType<?> type = BY_TAG.get(tag);
    if (type == null) {
      throw new IllegalArgumentException("Unsupported value type '%s'".formatted(tag));
    }

    return type;
  }

  /**
   * @return all supported type tags
   */
  public static Set<String> supportedTags() {
    return BY_TAG.keySet();
  }

  /**
   * @return string tag describing the value's shape, e.g. {@code int} or {@code List<String>}
   */
  public String tag() {
    return tag;
  }

  /**
   * @param value to wrap
   * @return a new {@link ViewValue} of this type
   * @throws IllegalArgumentException if this type does not accept the value
   */
  public ViewValue<T> of(final T value) {
    return wrapper.apply(value);
  }

  /**
   * @param node JSON form of the value, {@code null} is treated as JSON {@code null}
   * @return a new {@link ViewValue} of this type
   * @throws IllegalArgumentException if the JSON form does not match this type
   */
  public ViewValue<T> read(final JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      if (this == OPTIONAL_STRING) {
        return wrapper.apply(null);
      }

      throw new IllegalArgumentException("Value of type '%s' cannot be null".formatted(tag));
    }

    return wrapper.apply(reader.apply(node));
  }

  @Override
  public String toString() {
    return tag;
  }

  private static Integer readInt(final JsonNode node) {
    if (!node.isIntegralNumber() || !node.canConvertToInt()) {
      throw mismatch(node, INT);
    }
    return node.intValue();
  }

  private static Long readLong(final JsonNode node) {
    if (!node.isIntegralNumber() || !node.canConvertToLong()) {
      throw mismatch(node, LONG);
    }
    return node.longValue();
  }

  private static String readString(final JsonNode node) {
    if (!node.isTextual()) {
      throw mismatch(node, STRING);
    }
    return node.textValue();
  }

  private static Boolean readBoolean(final JsonNode node) {
    if (!node.isBoolean()) {
      throw mismatch(node, BOOLEAN);
    }
    return node.booleanValue();
  }

  private static String readOptionalString(final JsonNode node) {
    if (!node.isTextual()) {
      throw mismatch(node, OPTIONAL_STRING);
    }
    return node.textValue();
  }

  private static List<String> readStringList(final JsonNode node) {
    if (!node.isArray()) {
      throw mismatch(node, STRING_LIST);
    }

    final List<String> result = new ArrayList<>(node.size());
    for (JsonNode element : node) {
      if (!element.isTextual()) {
        throw mismatch(node, STRING_LIST);
      }
      result.add(element.textValue());
    }
    return result;
  }

  private static Instant readTimestamp(final JsonNode node) {
    if (!node.isIntegralNumber() || !node.canConvertToLong()) {
      throw mismatch(node, TIMESTAMP);
    }
    return Instant.ofEpochMilli(node.longValue());
  }

  private static IllegalArgumentException mismatch(
      final JsonNode node, final ViewValueType<?> type) {
    return new IllegalArgumentException(
        "JSON %s cannot be read as '%s'".formatted(node.getNodeType(), type.tag()));
  }
}
