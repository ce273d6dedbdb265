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

/**
 * Creates the {@link EntityViewGroup} of a new entity from its init event.
 *
 * @param <E> is the type of the init event
 */
@FunctionalInterface
public interface EntityViewGroupInit<E extends DomainEvent<?, ?>> {
  /**
   * @param initEvent which created the entity
   * @return view group of the entity, with its initial values taken from the event
   */
  EntityViewGroup apply(E initEvent);
}
