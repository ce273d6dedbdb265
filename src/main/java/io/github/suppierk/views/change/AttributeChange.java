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
 * A {@link Change} of a named attribute attached to an item of a reference or reference-list
 * view.
 *
 * <p>Within one drain cycle at most one attribute change per {@link AttributeKey} is kept.
 */
// @formatter:off
public sealed interface AttributeChange
extends
  Change
permits
  CounterAttrIncremented, CounterAttrDecremented, CounterAttrReset,
  RefValueAttrChanged
{
// @formatter:on

  /**
   * @return identifier of the item the attribute belongs to
   */
  EntityId attrId();

  /**
   * @return name of the attribute
   */
  String attrName();

  /**
   * @return the key this change is tracked under
   */
  default AttributeKey key() {
    return new AttributeKey(attrId(), attrName());
  }
}
