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
import io.github.suppierk.views.change.CounterDecremented;
import io.github.suppierk.views.change.CounterIncremented;
import io.github.suppierk.views.change.CounterReset;
import io.github.suppierk.views.value.InitViewData;
import io.github.suppierk.views.value.ViewValue;
import java.util.ArrayList;
import java.util.List;

/**
 * View holding an integer counter.
 *
 * <p>Every call is recorded, in order: consumers may apply the deltas one by one instead of
 * re-reading the final value.
 */
public final class CounterView extends View<Integer> {
  private final int initValue;
  private final List<Change> pending = new ArrayList<>();

  /**
   * @param name of the view
   */
  public CounterView(final String name) {
    this(name, 0);
  }

  /**
   * @param name of the view
   * @param value initial value of the counter
   */
  public CounterView(final String name, final int value) {
    super(name);
    this.initValue = value;
  }

  /**
   * @param by amount added to the counter
   * @throws IllegalStateException if the view was not added to a {@link ViewGroup} yet
   */
  public void increment(final int by) {
    requireBound();
    pending.add(new CounterIncremented(by));
  }

  /**
   * @param by amount subtracted from the counter
   * @throws IllegalStateException if the view was not added to a {@link ViewGroup} yet
   */
  public void decrement(final int by) {
    requireBound();
    pending.add(new CounterDecremented(by));
  }

  /**
   * Sets the counter to a new value, overriding the deltas recorded before it.
   *
   * @param newValue of the counter
   * @throws IllegalStateException if the view was not added to a {@link ViewGroup} yet
   */
  public void reset(final int newValue) {
    requireBound();
    pending.add(new CounterReset(newValue));
  }

  @Override
  public Integer defaultValue() {
    return initValue;
  }

  @Override
  public List<InitViewData> initValues() {
    return List.of(new InitViewData(requireBound(), name(), ViewValue.ofInt(initValue)));
  }

  @Override
  public List<Change> changes() {
    requireBound();

    if (pending.isEmpty()) {
      return List.of();
    }

    final List<Change> drained = List.copyOf(pending);
    pending.clear();
    return drained;
  }
}
