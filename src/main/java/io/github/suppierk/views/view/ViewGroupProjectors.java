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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/** {@link EntityViewGroupProjectors} kept by {@link EntityViewHost} for one view group. */
final class ViewGroupProjectors extends Suspicious implements EntityViewGroupProjectors {
  private final Map<Class<?>, Registered<?>> projectors = new LinkedHashMap<>();

  @Override
  public <E extends DomainEvent<?, ?>> void add(
      final Class<E> eventClass, final EntityViewGroupProjector<E> projector) {
    final Class<E> nonNullEventClass = throwIllegalArgumentIfNull(eventClass, "Event class");
    final EntityViewGroupProjector<E> nonNullProjector =
        throwIllegalArgumentIfNull(projector, "Event projector");

    if (projectors.containsKey(nonNullEventClass)) {
      throw new IllegalStateException(
          "Projector for '%s' is already registered".formatted(nonNullEventClass.getSimpleName()));
    }

    projectors.put(nonNullEventClass, new Registered<>(nonNullEventClass, nonNullProjector));
  }

  /**
   * @return event classes having a projector
   */
  Set<Class<?>> getSupportedEventClasses() {
    return Collections.unmodifiableSet(projectors.keySet());
  }

  /**
   * @param event to project
   * @return {@code true} if a projector was invoked, {@code false} if the event has none
   */
  boolean project(final DomainEvent<?, ?> event) {
    final DomainEvent<?, ?> nonNullEvent = throwIllegalArgumentIfNull(event, "Event");
    final Registered<?> registered = projectors.get(nonNullEvent.getClass());

    if (registered == null) {
      return false;
    }

    registered.project(nonNullEvent);
    return true;
  }

  /** Projector together with the exact event class it was registered for. */
  private record Registered<E extends DomainEvent<?, ?>>(
      Class<E> eventClass, EntityViewGroupProjector<E> projector) {
    void project(final DomainEvent<?, ?> event) {
      projector.project(eventClass.cast(event));
    }
  }
}
