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

import com.fasterxml.jackson.annotation.JsonValue;
import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Closed set of values a view can be seeded with or changed to.
 *
 * <p>Each variant knows its type tag, which downstream consumers use to decode the value without
 * reflection, and its JSON form. Timestamps are encoded as epoch milliseconds, everything else as
 * is.
 *
 * @param <T> is the Java type of the wrapped value
 */
// @formatter:off
public sealed interface ViewValue<T>
extends
  Serializable
permits
  ViewValue.IntValue, ViewValue.LongValue,
  ViewValue.StringValue, ViewValue.BooleanValue,
  ViewValue.OptionalStringValue, ViewValue.StringListValue,
  ViewValue.TimestampValue
{
// @formatter:on

  /**
   * @return wrapped Java value
   */
  T value();

  /**
   * @return the type tag of this value, see {@link ViewValueType#tag()}
   */
  String type();

  /**
   * @return the value as it must appear in JSON
   */
  @JsonValue
  Object jsonValue();

  static ViewValue<Integer> ofInt(final int value) {
    return new IntValue(value);
  }

  static ViewValue<Long> ofLong(final long value) {
    return new LongValue(value);
  }

  static ViewValue<String> ofString(final String value) {
    return new StringValue(value);
  }

  static ViewValue<Boolean> ofBoolean(final boolean value) {
    return new BooleanValue(value);
  }

  static ViewValue<String> ofOptionalString(final String value) {
    return new OptionalStringValue(value);
  }

  static ViewValue<List<String>> ofStringList(final List<String> value) {
    return new StringListValue(value);
  }

  static ViewValue<Instant> ofTimestamp(final Instant value) {
    return new TimestampValue(value);
  }

  /** 32-bit integer. */
  record IntValue(Integer value) implements ViewValue<Integer> {
    public IntValue {
      requireValue(value, ViewValueType.INT);
    }

    @Override
    public String type() {
      return ViewValueType.INT.tag();
    }

    @Override
    public Object jsonValue() {
      return value;
    }
  }

  /** 64-bit integer. */
  record LongValue(Long value) implements ViewValue<Long> {
    public LongValue {
      requireValue(value, ViewValueType.LONG);
    }

    @Override
    public String type() {
      return ViewValueType.LONG.tag();
    }

    @Override
    public Object jsonValue() {
      return value;
    }
  }

  /** Non-null string. */
  record StringValue(String value) implements ViewValue<String> {
    public StringValue {
      requireValue(value, ViewValueType.STRING);
    }

    @Override
    public String type() {
      return ViewValueType.STRING.tag();
    }

    @Override
    public Object jsonValue() {
      return value;
    }
  }

  /** Boolean flag. */
  record BooleanValue(Boolean value) implements ViewValue<Boolean> {
    public BooleanValue {
      requireValue(value, ViewValueType.BOOLEAN);
    }

    @Override
    public String type() {
      return ViewValueType.BOOLEAN.tag();
    }

    @Override
    public Object jsonValue() {
      return value;
    }
  }

  /** String which may be absent, encoded as JSON {@code null}. */
  record OptionalStringValue(String value) implements ViewValue<String> {
    @Override
    public String type() {
      return ViewValueType.OPTIONAL_STRING.tag();
    }

    @Override
    public Object jsonValue() {
      return value;
    }
  }

  /** Ordered sequence of strings, copied on construction. */
  record StringListValue(List<String> value) implements ViewValue<List<String>> {
    public StringListValue {
      requireValue(value, ViewValueType.STRING_LIST);
      value = List.copyOf(value);
    }

    @Override
    public String type() {
      return ViewValueType.STRING_LIST.tag();
    }

    @Override
    public Object jsonValue() {
      return value;
    }
  }

  /**
   * Point in time, truncated to milliseconds so that the epoch milliseconds encoding is lossless.
   */
  record TimestampValue(Instant value) implements ViewValue<Instant> {
    public TimestampValue {
      requireValue(value, ViewValueType.TIMESTAMP);
      value = Instant.ofEpochMilli(value.toEpochMilli());
    }

    @Override
    public String type() {
      return ViewValueType.TIMESTAMP.tag();
    }

    @Override
    public Object jsonValue() {
      return value.toEpochMilli();
    }
  }

  private static void requireValue(final Object value, final ViewValueType<?> type) {
    if (value == null) {
      throw new IllegalArgumentException(
          "Value of type '%s' cannot be null".formatted(type.tag()));
    }
  }
}
