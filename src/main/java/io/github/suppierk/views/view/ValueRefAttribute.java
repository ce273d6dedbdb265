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

package io.github.suppierk.views.view;

import io.github.suppierk.views.change.AttributeChange;
import io.github.suppierk.views.change.AttributeKey;
import io.github.suppierk.views.change.RefValueAttrChanged;
import io.github.suppierk.views.value.ViewValueType;
import java.util.Map;

/**
 * Typed value attribute attached to the target of a {@link RefView} or to an item of a {@link
 * RefListView}.
 *
 * <p>Each call replaces the change pending for the same attribute in the current projection cycle.
 *
 * @param <T> is the type of the attribute value
 */
public final class ValueRefAttribute<T> {
  private final AttributeKey key;
  private final ViewValueType<T> type;
  private final Map<AttributeKey, AttributeChange> changes;

  ValueRefAttribute(
      final AttributeKey key,
      final ViewValueType<T> type,
      final Map<AttributeKey, AttributeChange> changes) {
    this.key = key;
    this.type = type;
    this.changes = changes;
  }

  /**
   * @return key of this attribute
   */
  public AttributeKey key() {
    return key;
  }

  /**
   * @param newValue of the attribute
   * @throws IllegalArgumentException if the attribute type does not accept the value
   */
  public void setValue(final T newValue) {
    changes.put(key, new RefValueAttrChanged<>(key.itemId(), key.attrName(), type.of(newValue)));
  }
}
