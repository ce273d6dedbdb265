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
import io.github.suppierk.views.change.ValueChanged;
import io.github.suppierk.views.value.InitViewData;
import io.github.suppierk.views.value.ViewValue;
import io.github.suppierk.views.value.ViewValueType;
import java.util.List;

/**
 * View holding a single typed value.
 *
 * <p>Only the last value set within a projection cycle is kept.
 *
 * @param <T> is the type of the value
 */
public final class ValueView<T> extends View<T> {
  private final ViewValueType<T> type;
  private final ViewValue<T> initValue;
  private ValueChanged<T> change;

  /**
   * @param name of the view
   * @param type of the value
   * @param value initial value of the view
   * @throws IllegalArgumentException if any argument is {@code null}, or if the type does not
   *     accept the value
   */
  public ValueView(final String name, final ViewValueType<T> type, final T value) {
    super(name);
    this.type = throwIllegalArgumentIfNull(type, "View value type");
    this.initValue = this.type.of(value);
  }

  /**
   * @return type of the value
   */
  public ViewValueType<T> type() {
    return type;
  }

  /**
   * Replaces any value set earlier in the same projection cycle.
   *
   * @param newValue of the view
   * @throws IllegalStateException if the view was not added to a {@link ViewGroup} yet
   * @throws IllegalArgumentException if the type does not accept the value
   */
  public void setValue(final T newValue) {
    requireBound();
    change = new ValueChanged<>(type.of(newValue));
  }

  @Override
  public T defaultValue() {
    return initValue.value();
  }

  @Override
  public List<InitViewData> initValues() {
    return List.of(new InitViewData(requireBound(), name(), initValue));
  }

  @Override
  public List<Change> changes() {
    requireBound();

    if (change == null) {
      return List.of();
    }

    final Change drained = change;
    change = null;
    return List.of(drained);
  }
}
