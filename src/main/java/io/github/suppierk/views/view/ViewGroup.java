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

import io.github.suppierk.views.change.Change;
import io.github.suppierk.views.stream.ViewChangeBatch;
import io.github.suppierk.views.value.EntityId;
import io.github.suppierk.views.value.InitViewData;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of the views owned by a single entity.
 *
 * <p>An {@link EntityViewGroup} populates it once, from {@link
 * EntityViewGroup#initViews(ViewGroup)}. Adding a view binds it to the entity of this group.
 */
public final class ViewGroup extends Suspicious {
  private final EntityId entityId;
  private final Map<String, View<?>> views = new LinkedHashMap<>();

  /**
   * @param entityId identifier of the entity owning the views of this group
   * @throws IllegalArgumentException if the identifier is {@code null}
   */
  public ViewGroup(final EntityId entityId) {
    this.entityId = throwIllegalArgumentIfNull(entityId, "Entity id");
  }

  /**
   * @return identifier of the entity owning the views of this group
   */
  public EntityId entityId() {
    return entityId;
  }

  /**
   * Binds the view to the entity of this group and registers it.
   *
   * @param view to register
   * @param <V> is the type of the view
   * @return the same view, now bound
   * @throws IllegalArgumentException if the view is {@code null}
   * @throws IllegalStateException if a view with the same name is already registered, or if the
   *     view is bound to another entity
   */
  public <V extends View<?>> V add(final V view) {
    final V nonNullView = throwIllegalArgumentIfNull(view, "View");

    if (views.containsKey(nonNullView.name())) {
      throw new IllegalStateException(
          "View '%s' is already registered for entity '%s'"
              .formatted(nonNullView.name(), entityId));
    }

    nonNullView.bind(entityId);
    views.put(nonNullView.name(), nonNullView);
    return nonNullView;
  }

  /**
   * @return registered views, in registration order
   */
  public Collection<View<?>> views() {
    return Collections.unmodifiableCollection(views.values());
  }

  /**
   * @param name of the view
   * @return registered view with the given name
   */
  public Optional<View<?>> find(final String name) {
    return Optional.ofNullable(views.get(name));
  }

  /**
   * @return {@code true} if no views were registered
   */
  public boolean isEmpty() {
    return views.isEmpty();
  }

  /**
   * @return seeds of all registered views, in registration order
   */
  public List<InitViewData> initValues() {
    final List<InitViewData> result = new ArrayList<>();
    for (View<?> view : views.values()) {
      result.addAll(view.initValues());
    }
    return List.copyOf(result);
  }

  /**
   * Drains every registered view exactly once.
   *
   * @return batches of the views which had pending changes, in registration order
   */
  public List<ViewChangeBatch> drain() {
    final List<ViewChangeBatch> result = new ArrayList<>();
    for (View<?> view : views.values()) {
      final List<Change> changes = view.changes();
      if (!changes.isEmpty()) {
        result.add(new ViewChangeBatch(entityId, view.name(), changes));
      }
    }
    return List.copyOf(result);
  }

  /**
   * Drains every registered view and drops the result, so that changes of an aborted projection
   * never leak into the next cycle.
   *
   * @return number of dropped changes
   */
  public int discardChanges() {
    int dropped = 0;
    for (View<?> view : views.values()) {
      dropped += view.changes().size();
    }
    return dropped;
  }
}
