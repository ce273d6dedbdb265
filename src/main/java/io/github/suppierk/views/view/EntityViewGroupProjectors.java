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

/** Registry of the event projectors of an {@link EntityViewGroup}. */
public interface EntityViewGroupProjectors {
  /**
   * Registers a projector for the given event class. Events are matched by their exact class.
   *
   * @param eventClass this projector is intended for
   * @param projector to invoke for events of this class
   * @param <E> is the type of the event
   * @throws IllegalArgumentException if any argument is {@code null}
   * @throws IllegalStateException if a projector for this event class is already registered
   */
  <E extends DomainEvent<?, ?>> void add(
      final Class<E> eventClass, final EntityViewGroupProjector<E> projector);
}
