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

import java.util.List;

/**
 * Outcome of a successful command: the aggregate after the fold along with the events which were
 * folded into it, in order.
 *
 * <p>Events are returned rather than discarded so that the caller can append them to a durable log
 * before, or instead of, persisting the derived state.
 *
 * @param aggregate state after all {@code events} were applied
 * @param events produced by the command
 * @param <A> is the type of the aggregate
 * @param <E> is the type of the aggregate events
 */
public record Execution<A extends Aggregate, E extends DomainEvent<A>>(
    A aggregate, List<E> events) {
  public Execution {
    if (aggregate == null) {
      throw new IllegalArgumentException("Aggregate cannot be null");
    }

    if (events == null) {
      throw new IllegalArgumentException("Events cannot be null");
    }

    events = List.copyOf(events);
  }
}
