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
 * Item was appended to a reference-list view unless the list already holds it.
 *
 * @param itemId of the added item
 */
public record ListItemAddedIfAbsent(EntityId itemId) implements Change {
  public ListItemAddedIfAbsent {
    if (itemId == null) {
      throw new IllegalArgumentException("Item id cannot be null");
    }
  }
}
