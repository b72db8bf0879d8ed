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

package io.github.suppierk.eventsourcing.repository;

import io.github.suppierk.eventsourcing.core.DomainEvent;
import java.time.Instant;

/**
 * A {@link DomainEvent} together with its position in the history of an aggregate.
 *
 * <p>Within a single aggregate type the pair of {@code aggregateId} and {@code sequence} is unique.
 * Sequences start at {@code 1} and have no gaps.
 *
 * @param aggregateType namespace of the aggregate
 * @param aggregateId identifier of the aggregate
 * @param sequence position of the event in the aggregate history
 * @param eventType tag taken from {@link DomainEvent#eventType()}
 * @param eventVersion tag taken from {@link DomainEvent#eventVersion()}
 * @param recordedAt the time when the event was appended
 * @param event itself
 * @param <E> is the type of the aggregate events
 */
public record EventEnvelope<E extends DomainEvent<?>>(
    String aggregateType,
    String aggregateId,
    long sequence,
    String eventType,
    String eventVersion,
    Instant recordedAt,
    E event) {
  public EventEnvelope {
    if (aggregateType == null || aggregateId == null || recordedAt == null || event == null) {
      throw new IllegalArgumentException("Envelope properties cannot be null");
    }

    if (sequence < 1) {
      throw new IllegalArgumentException("Sequence must be positive, got %d".formatted(sequence));
    }
  }

  /**
   * @param aggregateType namespace of the aggregate
   * @param aggregateId identifier of the aggregate
   * @param sequence position of the event in the aggregate history
   * @param recordedAt the time when the event was appended
   * @param event to wrap
   * @param <E> is the type of the aggregate events
   * @return a new envelope with type and version tags taken from the event
   */
  public static <E extends DomainEvent<?>> EventEnvelope<E> of(
      final String aggregateType,
      final String aggregateId,
      final long sequence,
      final Instant recordedAt,
      final E event) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    return new EventEnvelope<>(
        aggregateType,
        aggregateId,
        sequence,
        event.eventType(),
        event.eventVersion(),
        recordedAt,
        event);
  }
}
