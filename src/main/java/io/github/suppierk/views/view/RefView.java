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
import io.github.suppierk.views.change.Change;
import io.github.suppierk.views.change.RefChanged;
import io.github.suppierk.views.value.EntityId;
import io.github.suppierk.views.value.InitViewData;
import io.github.suppierk.views.value.ViewValue;
import io.github.suppierk.views.value.ViewValueType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * View holding a reference to another entity, with optional value attributes of the referenced
 * entity.
 *
 * <p>Drained changes list the reference change first, followed by attribute changes in the order
 * their attributes were first touched within the cycle.
 */
public final class RefView extends View<Optional<EntityId>> {
  private final EntityId initValue;
  private final Map<AttributeKey, AttributeChange> attrChanges = new LinkedHashMap<>();
  private RefChanged change;

  /**
   * @param name of the view
   * @param value initially referenced entity, can be {@code null}
   */
  public RefView(final String name, final EntityId value) {
    super(name);
    this.initValue = value;
  }

  /**
   * Replaces any reference set earlier in the same projection cycle.
   *
   * @param newValue referenced entity, {@code null} to clear the reference
   * @throws IllegalStateException if the view was not added to a {@link ViewGroup} yet
   */
  public void setValue(final EntityId newValue) {
    requireBound();
    change = new RefChanged(newValue);
  }

  /**
   * @param attrId identifier the attribute is kept under
   * @param attrName name of the attribute
   * @param type of the attribute value
   * @param <T> is the type of the attribute value
   * @return attribute for modification
   * @throws IllegalStateException if the view was not added to a {@link ViewGroup} yet
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  public <T> ValueRefAttribute<T> valueAttr(
      final EntityId attrId, final String attrName, final ViewValueType<T> type) {
    requireBound();

    return new ValueRefAttribute<>(
        new AttributeKey(attrId, attrName),
        throwIllegalArgumentIfNull(type, "Attribute value type"),
        attrChanges);
  }

  @Override
  public Optional<EntityId> defaultValue() {
    return Optional.ofNullable(initValue);
  }

  @Override
  public List<InitViewData> initValues() {
    return List.of(
        new InitViewData(
            requireBound(),
            name(),
            ViewValue.ofOptionalString(initValue == null ? null : initValue.value())));
  }

  @Override
  public List<Change> changes() {
    requireBound();

    final List<Change> drained = new ArrayList<>(attrChanges.size() + 1);

    if (change != null) {
      drained.add(change);
      change = null;
    }

    drained.addAll(attrChanges.values());
    attrChanges.clear();

    return List.copyOf(drained);
  }
}
