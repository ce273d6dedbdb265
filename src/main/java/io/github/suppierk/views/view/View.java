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
import io.github.suppierk.views.value.EntityId;
import io.github.suppierk.views.value.InitViewData;
import java.util.List;

/**
 * Queryable, read-optimized projection of entity data which accumulates {@link Change}s between
 * drains.
 *
 * <p>Every view goes through the following states:
 *
 * <ul>
 *   <li><b>Unbound</b> - constructed, but not yet added to a {@link ViewGroup}. Only {@link
 *       #name()} and {@link #defaultValue()} can be used, anything else throws {@link
 *       IllegalStateException}.
 *   <li><b>Bound</b> - added to a {@link ViewGroup} which assigned the identifier of the owning
 *       entity. From now on the view repeatedly accumulates changes through its mutators and gives
 *       them away through {@link #changes()}.
 * </ul>
 *
 * <p>Views are not thread-safe: they are mutated and drained by a single projection pass at a time.
 *
 * @param <T> is the type of the view's initial value
 */
public abstract sealed class View<T> extends Suspicious
    permits ValueView, CounterView, RefView, RefListView {
  private final String name;
  private EntityId entityId;

  /**
   * @param name of the view, unique within the owning {@link ViewGroup}
   * @throws IllegalArgumentException if the name is {@code null}
   */
  protected View(final String name) {
    this.name = throwIllegalArgumentIfNull(name, "View name");
  }

  /**
   * @return name of the view, unique within the owning entity
   */
  public final String name() {
    return name;
  }

  /**
   * @return identifier of the entity owning this view
   * @throws IllegalStateException if the view was not added to a {@link ViewGroup} yet
   */
  public final EntityId entityId() {
    return requireBound();
  }

  /**
   * @return {@code true} if the view was added to a {@link ViewGroup}, {@code false} otherwise
   */
  public final boolean isBound() {
    return entityId != null;
  }

  /**
   * @return the immutable value this view was constructed with, never affected by changes
   */
  public abstract T defaultValue();

  /**
   * Returns the seed records of this view, emitted once when the owning entity is created.
   *
   * @return seed records of this view
   * @throws IllegalStateException if the view was not added to a {@link ViewGroup} yet
   */
  public abstract List<InitViewData> initValues();

  /**
   * Drains the view: returns every {@link Change} accumulated since the previous call and clears
   * the pending buffer.
   *
   * <p>Calling this method again without any mutation in between returns an empty list, so the
   * caller must persist the result before the next projection cycle.
   *
   * @return pending changes, possibly empty
   * @throws IllegalStateException if the view was not added to a {@link ViewGroup} yet
   */
  public abstract List<Change> changes();

  /**
   * Invoked by {@link ViewGroup} only.
   *
   * @param owner is the identifier of the entity owning the view
   * @throws IllegalStateException if the view is already bound to another entity
   */
  final void bind(final EntityId owner) {
    final EntityId nonNullOwner = throwIllegalArgumentIfNull(owner, "Entity id");

    if (entityId != null && !entityId.equals(nonNullOwner)) {
      throw new IllegalStateException(
          "View '%s' is already bound to entity '%s', cannot bind it to '%s'"
              .formatted(name, entityId, nonNullOwner));
    }

    entityId = nonNullOwner;
  }

  /**
   * Must be called first by every operation reading or writing the view.
   *
   * @return identifier of the entity owning this view
   * @throws IllegalStateException if the view was not added to a {@link ViewGroup} yet
   */
  protected final EntityId requireBound() {
    if (entityId == null) {
      throw new IllegalStateException(
          "View '%s' has no entity id, view group host must set it".formatted(name));
    }

    return entityId;
  }
}
