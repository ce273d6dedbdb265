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
 * Collection of views representing queryable data derived from one entity.
 *
 * <p>Implementations are typically constructed from the entity's init event by an {@link
 * EntityViewGroupInit}, hold the concrete views as fields and mutate them from event projectors.
 */
public interface EntityViewGroup {
  /**
   * Registers all views that belong to the entity.
   *
   * @param views registry to add views to
   */
  void initViews(ViewGroup views);

  /**
   * Registers projectors that update views when events occur.
   *
   * @param projectors registry to add event projectors to
   */
  void initProjectors(EntityViewGroupProjectors projectors);
}
