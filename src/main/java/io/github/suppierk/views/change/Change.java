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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.suppierk.views.json.ViewJson;
import java.io.Serializable;

/**
 * One atomic, already decided mutation of a view or of a keyed attribute on a view item.
 *
 * <p>Changes are pure data: they are created by view mutators, drained by the hosting runtime and
 * delivered to subscribers in their JSON form, where {@code "type"} holds the simple name of the
 * variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = ValueChanged.class, name = "ValueChanged"),
  @JsonSubTypes.Type(value = CounterIncremented.class, name = "CounterIncremented"),
  @JsonSubTypes.Type(value = CounterDecremented.class, name = "CounterDecremented"),
  @JsonSubTypes.Type(value = CounterReset.class, name = "CounterReset"),
  @JsonSubTypes.Type(value = RefChanged.class, name = "RefChanged"),
  @JsonSubTypes.Type(value = ListItemAdded.class, name = "ListItemAdded"),
  @JsonSubTypes.Type(value = ListItemAddedIfAbsent.class, name = "ListItemAddedIfAbsent"),
  @JsonSubTypes.Type(value = ListItemRemoved.class, name = "ListItemRemoved"),
  @JsonSubTypes.Type(value = ListItemChanged.class, name = "ListItemChanged"),
  @JsonSubTypes.Type(value = ListItemMoved.class, name = "ListItemMoved"),
  @JsonSubTypes.Type(value = ListCleared.class, name = "ListCleared"),
  @JsonSubTypes.Type(value = CounterAttrIncremented.class, name = "CounterAttrIncremented"),
  @JsonSubTypes.Type(value = CounterAttrDecremented.class, name = "CounterAttrDecremented"),
  @JsonSubTypes.Type(value = CounterAttrReset.class, name = "CounterAttrReset"),
  @JsonSubTypes.Type(value = RefValueAttrChanged.class, name = "RefValueAttrChanged")
})
// @formatter:off
public sealed interface Change
extends
  Serializable
permits
  ValueChanged,
  CounterIncremented, CounterDecremented, CounterReset,
  RefChanged,
  ListItemAdded, ListItemAddedIfAbsent, ListItemRemoved,
  ListItemChanged, ListItemMoved, ListCleared,
  AttributeChange
{
// @formatter:on

  /**
   * @return wire representation of this change
   */
  default ObjectNode toJson() {
    return ViewJson.toJsonTree(this);
  }
}
