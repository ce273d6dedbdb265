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
import java.io.Serializable;
import java.util.List;

/**
 * Changes drained from one view in one projection cycle, in drain order.
 *
 * <p>Batches are appended to the change stream keyed by {@code (entityId, viewName)}.
 *
 * @param entityId identifier of the entity owning the view
 * @param viewName name of the view
 * @param changes drained from the view
 */
public record ViewChangeBatch(EntityId entityId, String viewName, List<Change> changes)
    implements Serializable {
  public ViewChangeBatch {
    if (entityId == null) {
      throw new IllegalArgumentException("Entity id cannot be null");
    }

    if (viewName == null) {
      throw new IllegalArgumentException("View name cannot be null");
    }

    if (changes == null) {
      throw new IllegalArgumentException("Changes cannot be null");
    }

    changes = List.copyOf(changes);
  }

  /**
   * @return {@code true} if nothing was drained
   */
  public boolean isEmpty() {
    return changes.isEmpty();
  }
}
