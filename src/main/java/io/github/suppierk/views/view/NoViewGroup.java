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

/** {@link EntityViewGroup} for entities which do not expose any views. */
public final class NoViewGroup implements EntityViewGroup {
  private NoViewGroup() {
    // Cannot be instantiated
  }

  /**
   * @return a default instance of the group
   */
  public static NoViewGroup getInstance() {
    return Holder.INSTANCE;
  }

  @Override
  public void initViews(final ViewGroup views) {
    // No views
  }

  @Override
  public void initProjectors(final EntityViewGroupProjectors projectors) {
    // No projectors
  }

  /**
   * @see <a
   *     href="https://en.wikipedia.org/wiki/Initialization-on-demand_holder_idiom">Initialization-on-demand
   *     holder idiom</a>
   */
  private static class Holder {
    private static final NoViewGroup INSTANCE = new NoViewGroup();
  }
}
