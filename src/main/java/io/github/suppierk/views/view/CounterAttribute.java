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
import io.github.suppierk.views.change.CounterAttrDecremented;
import io.github.suppierk.views.change.CounterAttrIncremented;
import io.github.suppierk.views.change.CounterAttrReset;
import java.util.Map;

/**
 * Counter attribute attached to an item of a {@link RefListView}.
 *
 * <p>An attribute which does not exist yet is created by its first change, starting from zero.
 * Each call replaces the change pending for the same attribute in the current projection cycle.
 */
public final class CounterAttribute {
  private final AttributeKey key;
  private final Map<AttributeKey, AttributeChange> changes;

  CounterAttribute(final AttributeKey key, final Map<AttributeKey, AttributeChange> changes) {
    this.key = key;
    this.changes = changes;
  }

  /**
   * @return key of this attribute
   */
  public AttributeKey key() {
    return key;
  }

  public void increment(final int by) {
    changes.put(key, new CounterAttrIncremented(key.itemId(), key.attrName(), by));
  }

  public void decrement(final int by) {
    changes.put(key, new CounterAttrDecremented(key.itemId(), key.attrName(), by));
  }

  public void reset(final int newValue) {
    changes.put(key, new CounterAttrReset(key.itemId(), key.attrName(), newValue));
  }
}
