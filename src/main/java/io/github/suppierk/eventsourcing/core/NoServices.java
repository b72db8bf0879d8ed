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

package io.github.suppierk.eventsourcing.core;

/**
 * Default services bundle for aggregates which do not consult any external dependency during
 * execution.
 */
public final class NoServices {
  private NoServices() {
    // Cannot be instantiated
  }

  /**
   * @return a shared instance
   */
  public static NoServices getInstance() {
    return Holder.INSTANCE;
  }

  @Override
  public String toString() {
    return "NoServices";
  }

  /**
   * @see <a
   *     href="https://en.wikipedia.org/wiki/Initialization-on-demand_holder_idiom">Initialization-on-demand
   *     holder idiom</a>
   */
  private static class Holder {
    private static final NoServices INSTANCE = new NoServices();
  }
}
