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

package io.github.suppierk.views.stream;

import io.github.suppierk.views.change.Change;
import io.github.suppierk.views.value.EntityId;
import io.github.suppierk.views.value.InitViewData;
import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one projection cycle of an entity's view group, as handed to the {@link
 * ViewChangeStore}.
 *
 * @param entityId identifier of the projected entity
 * @param initValues seeds, present only for the cycle which created the view group
 * @param changes non-empty batches drained from the views, in view registration order
 */
public record ProjectionResult(
    EntityId entityId, List<InitViewData> initValues, List<ViewChangeBatch> changes)
    implements Serializable {
  public ProjectionResult {
    if (entityId == null) {
      throw new IllegalArgumentException("Entity id cannot be null");
    }

    if (initValues == null) {
      throw new IllegalArgumentException("Init values cannot be null");
    }

    if (changes == null) {
      throw new IllegalArgumentException("Changes cannot be null");
    }

    initValues = List.copyOf(initValues);
    changes = List.copyOf(changes);
  }

  /**
   * @param viewName name of the view
   * @return changes drained from the given view, empty if there were none
   */
  public List<Change> changesOf(final String viewName) {
    return findBatch(viewName).map(ViewChangeBatch::changes).orElse(List.of());
  }

  /**
   * @param viewName name of the view
   * @return batch drained from the given view
   */
  public Optional<ViewChangeBatch> findBatch(final String viewName) {
    return changes.stream().filter(batch -> batch.viewName().equals(viewName)).findFirst();
  }
}
