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
import com.fasterxml.jackson.annotation.JsonValue;
import java.io.Serializable;

/**
 * Identifier of an entity owning views, or of an entity referenced by a view.
 *
 * <p>On the wire this is a bare string.
 *
 * @param value of the identifier
 */
public record EntityId(String value) implements Serializable, Comparable<EntityId> {
  public EntityId {
    if (value == null) {
      throw new IllegalArgumentException("Entity id value cannot be null");
    }
  }

  /**
   * @param value of the identifier
   * @return a new instance of {@link EntityId}
   * @throws IllegalArgumentException if the value is {@code null}
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static EntityId of(final String value) {
    return new EntityId(value);
  }

  /**
   * @return raw identifier, also used as the JSON representation
   */
  @JsonValue
  @Override
  public String value() {
    return value;
  }

  @Override
  public int compareTo(final EntityId other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value;
  }
}
