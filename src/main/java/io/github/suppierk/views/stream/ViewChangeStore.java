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

import io.github.suppierk.views.value.InitViewData;
import java.util.List;
import org.jooq.DSLContext;

/**
 * Abstract contract for the durable side of views: view seeds and the change stream.
 *
 * <p>Implementations are invoked within the transaction of the projection cycle - seeds and changes
 * of one cycle are either stored together or not at all. Delivery to real-time subscribers is
 * expected to happen from the stored rows, not from here.
 *
 * @see <a href="https://microservices.io/patterns/data/transactional-outbox.html">Transactional
 *     outbox</a>
 */
public interface ViewChangeStore {
  /**
   * @return an instance of store which does not perform any operations
   */
  static ViewChangeStore empty() {
    return NoOp.INSTANCE;
  }

  /**
   * Saves seeds of newly created views.
   *
   * @param readWriteDsl is a transactional context with writing capability
   * @param initValues to save
   */
  void storeInitValues(final DSLContext readWriteDsl, final List<InitViewData> initValues);

  /**
   * Appends changes drained from one view to its change stream, preserving their order.
   *
   * @param readWriteDsl is a transactional context with writing capability
   * @param batch to append
   */
  void appendChanges(final DSLContext readWriteDsl, final ViewChangeBatch batch);

  /** Default implementation of the fake store */
  final class NoOp implements ViewChangeStore {
    private static final ViewChangeStore INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public void storeInitValues(
        final DSLContext readWriteDsl, final List<InitViewData> initValues) {
      // Do nothing
    }

    @Override
    public void appendChanges(final DSLContext readWriteDsl, final ViewChangeBatch batch) {
      // Do nothing
    }
  }
}
