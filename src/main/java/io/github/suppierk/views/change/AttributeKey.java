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

import io.github.suppierk.views.value.EntityId;
import java.io.Serializable;

/**
 * Identifies an attribute within one attribute map.
 *
 * @param itemId identifier of the item the attribute is attached to
 * @param attrName name of the attribute
 */
public record AttributeKey(EntityId itemId, String attrName) implements Serializable {
  public AttributeKey {
    if (itemId == null) {
      throw new IllegalArgumentException("Attribute item id cannot be null");
    }

    if (attrName == null) {
      throw new IllegalArgumentException("Attribute name cannot be null");
    }
  }
}
