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

/**
 * Views derived from entity events and the host running their projection cycles.
 *
 * <p>Here is an example to help explain how the pieces are related to each other - let's assume
 * that we track an order in a shop:
 *
 * <ul>
 *   <li>The order is an entity, identified by an {@link io.github.suppierk.views.value.EntityId}.
 *   <li>Everything a reader wants to know about the order is an {@link
 *       io.github.suppierk.views.view.EntityViewGroup}:
 *       <ul>
 *         <li>The order status is a {@link io.github.suppierk.views.view.ValueView} - only the
 *             latest status matters, so setting it twice records a single change.
 *         <li>The number of items is a {@link io.github.suppierk.views.view.CounterView} - every
 *             increment and decrement is recorded, so readers can fold them.
 *         <li>The assigned courier is a {@link io.github.suppierk.views.view.RefView} pointing at
 *             another entity, with attributes of that entity attached to it.
 *         <li>The ordered products are a {@link io.github.suppierk.views.view.RefListView}, where
 *             each product can carry attributes like a quantity {@link
 *             io.github.suppierk.views.view.CounterAttribute}.
 *       </ul>
 *   <li>The event creating the order is turned into the group by an {@link
 *       io.github.suppierk.views.view.EntityViewGroupInit}, and each later event is handled by an
 *       {@link io.github.suppierk.views.view.EntityViewGroupProjector}.
 *   <li>{@link io.github.suppierk.views.view.EntityViewHost} binds the views to the order, stores
 *       their seeds, and after each event drains every view exactly once, handing the changes to
 *       a {@link io.github.suppierk.views.stream.ViewChangeStore}.
 * </ul>
 */
package io.github.suppierk.views.view;
