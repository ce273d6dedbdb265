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

package io.github.suppierk.views.change;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.suppierk.views.value.ViewValue;
import io.github.suppierk.views.value.ViewValueType;

/**
 * Value view now holds a new value.
 *
 * <p>The wire form carries {@code "valueType"} next to {@code "newValue"} so the value can be
 * decoded without knowing the view.
 *
 * @param newValue held by the view
 * @param <T> is the Java type of the value
 */
public record ValueChanged<T>(ViewValue<T> newValue) implements Change {
  public ValueChanged {
    if (newValue == null) {
      throw new IllegalArgumentException("New value cannot be null");
    }
  }

  @JsonCreator
  static ValueChanged<?> fromJson(
      @JsonProperty("valueType") final String valueType,
      @JsonProperty("newValue") final JsonNode newValue) {
    return new ValueChanged<>(ViewValueType.forTag(valueType).read(newValue));
  }

  /**
   * @return type tag of {@link #newValue()}
   */
  @JsonProperty("valueType")
  public String valueType() {
    return newValue.type();
  }
}
