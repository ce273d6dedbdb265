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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.suppierk.views.json.ViewJson;
import java.io.Serializable;

/**
 * Seed of a view, emitted exactly once per view instance when its entity is created.
 *
 * <p>Wire form: {@code {"key": entityId, "name": viewName, "value": initialValue, "type": tag}}.
 *
 * @param key identifier of the entity owning the view
 * @param name of the view, unique within the entity
 * @param value initial value of the view
 */
@JsonPropertyOrder({"key", "name", "value", "type"})
public record InitViewData(EntityId key, String name, ViewValue<?> value) implements Serializable {
  public InitViewData {
    if (key == null) {
      throw new IllegalArgumentException("Init view data key cannot be null");
    }

    if (name == null) {
      throw new IllegalArgumentException("Init view data name cannot be null");
    }

    if (value == null) {
      throw new IllegalArgumentException("Init view data value cannot be null");
    }
  }

  @JsonCreator
  static InitViewData fromJson(
      @JsonProperty("key") final EntityId key,
      @JsonProperty("name") final String name,
      @JsonProperty("type") final String type,
      @JsonProperty("value") final JsonNode value) {
    return new InitViewData(key, name, ViewValueType.forTag(type).read(value));
  }

  /**
   * @return type tag of the value used by consumers to decode it
   */
  @JsonProperty("type")
  public String type() {
    return value.type();
  }

  /**
   * @return wire representation of this seed
   */
  public ObjectNode toJson() {
    return ViewJson.toJsonTree(this);
  }
}
