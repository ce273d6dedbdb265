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

/**
 * Counter attribute of a view item was reset to a new value.
 *
 * @param attrId identifier of the item owning the attribute
 * @param attrName name of the attribute
 * @param newValue the attribute now holds
 */
public record CounterAttrReset(EntityId attrId, String attrName, int newValue)
    implements AttributeChange {
  public CounterAttrReset {
    if (attrId == null) {
      throw new IllegalArgumentException("Attribute id cannot be null");
    }

    if (attrName == null) {
      throw new IllegalArgumentException("Attribute name cannot be null");
    }
  }
}
