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
import io.github.suppierk.views.change.ListCleared;
import io.github.suppierk.views.change.ListItemAdded;
import io.github.suppierk.views.change.ListItemAddedIfAbsent;
import io.github.suppierk.views.change.ListItemChanged;
import io.github.suppierk.views.change.ListItemMoved;
import io.github.suppierk.views.change.ListItemRemoved;
import io.github.suppierk.views.value.EntityId;
import io.github.suppierk.views.value.InitViewData;
import io.github.suppierk.views.value.ViewValue;
import io.github.suppierk.views.value.ViewValueType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * View holding an ordered list of references to other entities, with per-item attributes.
 *
 * <p>Structural operations are recorded in call order, because list operations do not commute.
 * Attribute changes share a single map across all items, keeping only the latest change per
 * attribute within the cycle. Drained changes list structural changes first, followed by attribute
 * changes in the order their attributes were first touched within the cycle.
 */
public final class RefListView extends View<List<EntityId>> {
  private final List<EntityId> initValue;
  private final List<Change> pending = new ArrayList<>();
  private final Map<AttributeKey, AttributeChange> attrChanges = new LinkedHashMap<>();

  /**
   * @param name of the view
   */
  public RefListView(final String name) {
    this(name, List.of());
  }

  /**
   * @param name of the view
   * @param value initial items of the list
   * @throws IllegalArgumentException if the items are {@code null} or contain {@code null}
   */
  public RefListView(final String name, final List<EntityId> value) {
    super(name);

    final List<EntityId> nonNullValue = throwIllegalArgumentIfNull(value, "Initial items");
    for (EntityId item : nonNullValue) {
      throwIllegalArgumentIfNull(item, "Initial item");
    }

    this.initValue = List.copyOf(nonNullValue);
  }

  /**
   * Appends the item even if the list already contains it.
   *
   * @param itemId to append
   * @throws IllegalStateException if the view was not added to a {@link ViewGroup} yet
   * @throws IllegalArgumentException if the item id is {@code null}
   */
  public void addItem(final EntityId itemId) {
    requireBound();
    pending.add(new ListItemAdded(itemId));
  }

  /**
   * Appends the item unless the list already contains it.
   *
   * @param itemId to append
   * @throws IllegalStateException if the view was not added to a {@link ViewGroup} yet
   * @throws IllegalArgumentException if the item id is {@code null}
   */
  public void addItemIfAbsent(final EntityId itemId) {
    requireBound();
    pending.add(new ListItemAddedIfAbsent(itemId));
  }

  /**
   * @param itemId to remove from the list
   * @throws IllegalStateException if the view was not added to a {@link ViewGroup} yet
   * @throws IllegalArgumentException if the item id is {@code null}
   */
  public void removeItem(final EntityId itemId) {
    requireBound();
    pending.add(new ListItemRemoved(itemId));
  }

  /**
   * Replaces an item keeping its position in the list.
   *
   * @param oldItemId to replace
   * @param newItemId replacing the old one
   * @throws IllegalStateException if the view was not added to a {@link ViewGroup} yet
   * @throws IllegalArgumentException if any item id is {@code null}
   */
  public void changeItem(final EntityId oldItemId, final EntityId newItemId) {
    requireBound();
    pending.add(new ListItemChanged(oldItemId, newItemId));
  }

  /**
   * @param itemId to move
   * @param newIndex of the item in the list
   * @throws IllegalStateException if the view was not added to a {@link ViewGroup} yet
   * @throws IllegalArgumentException if the item id is {@code null}
   */
  public void moveItem(final EntityId itemId, final int newIndex) {
    requireBound();
    pending.add(new ListItemMoved(itemId, newIndex));
  }

  /**
   * Removes every item of the list.
   *
   * @throws IllegalStateException if the view was not added to a {@link ViewGroup} yet
   */
  public void clear() {
    requireBound();
    pending.add(new ListCleared());
  }

  /**
   * If the attribute does not exist yet, it will be created by its first change, assuming zero as
   * its initial value.
   *
   * @param itemId identifier of the list item
   * @param attrName name of the attribute
   * @return counter attribute for modification
   * @throws IllegalStateException if the view was not added to a {@link ViewGroup} yet
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  public CounterAttribute counterAttr(final EntityId itemId, final String attrName) {
    requireBound();
    return new CounterAttribute(new AttributeKey(itemId, attrName), attrChanges);
  }

  /**
   * If the attribute does not exist yet, it will be created by its first change.
   *
   * @param itemId identifier of the list item
   * @param attrName name of the attribute
   * @param type of the attribute value
   * @param <T> is the type of the attribute value
   * @return value attribute for modification
   * @throws IllegalStateException if the view was not added to a {@link ViewGroup} yet
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  public <T> ValueRefAttribute<T> valueAttr(
      final EntityId itemId, final String attrName, final ViewValueType<T> type) {
    requireBound();

    return new ValueRefAttribute<>(
        new AttributeKey(itemId, attrName),
        throwIllegalArgumentIfNull(type, "Attribute value type"),
        attrChanges);
  }

  @Override
  public List<EntityId> defaultValue() {
    return initValue;
  }

  @Override
  public List<InitViewData> initValues() {
    return List.of(
        new InitViewData(
            requireBound(),
            name(),
            ViewValue.ofStringList(initValue.stream().map(EntityId::value).toList())));
  }

  @Override
  public List<Change> changes() {
    requireBound();

    final List<Change> drained = new ArrayList<>(pending.size() + attrChanges.size());

    drained.addAll(pending);
    pending.clear();

    drained.addAll(attrChanges.values());
    attrChanges.clear();

    return List.copyOf(drained);
  }
}
