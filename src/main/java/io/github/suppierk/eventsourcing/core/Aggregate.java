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

import java.io.Serializable;

/**
 * A versioned entity whose entire state is reconstructable by replaying its {@link DomainEvent}s
 * from absent state.
 *
 * <p>Implementations must be immutable values, preferably Java {@link Record}s: no field may change
 * outside the fold step, and each fold step returns a fresh value. Sub-entities are owned by value.
 *
 * <p>Aggregates must round-trip through the serialization boundary, which is why this interface
 * extends {@link Serializable} and why implementations are expected to be plain data.
 */
public interface Aggregate extends Serializable {
  /**
   * @return unique identifier assigned at creation
   */
  String aggregateId();

  /**
   * Defined separately from {@link #aggregateId()} to leave room for optimistic lookups by version.
   *
   * @return identity token callers use to correlate subsequent commands, the identifier by default
   */
  default String aggregateVersion() {
    return aggregateId();
  }
}
