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
 * Item of a reference-list view was moved to another position.
 *
 * @param itemId of the moved item
 * @param newIndex the item now occupies
 */
public record ListItemMoved(EntityId itemId, int newIndex) implements Change {
  public ListItemMoved {
    if (itemId == null) {
      throw new IllegalArgumentException("Item id cannot be null");
    }
  }
}
