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
import io.github.suppierk.eventsourcing.error.AggregateException;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Append-only log of {@link DomainEvent}s, one stream per aggregate identifier.
 *
 * <p>Writes are guarded by optimistic concurrency: the writer states how many events it has seen,
 * and the append is refused if the stream has moved on since. This is how the single-writer
 * discipline per aggregate is enforced across processes.
 *
 * @param <E> is the type of the aggregate events
 */
public interface EventJournal<E extends DomainEvent<?>> {
  /**
   * @return namespace of the aggregates this journal stores events for
   */
  String aggregateType();

  /**
   * Appends events to the end of the aggregate stream, all or nothing.
   *
   * @param aggregateId identifier of the aggregate
   * @param expectedSequence the sequence of the last event the writer has seen, {@code 0} for a new
   *     aggregate
   * @param events to append, in order; an empty list appends nothing and is never a conflict
   * @return stored envelopes, completed exceptionally with {@link
   *     AggregateException.AggregateConflict} if the stream does not end at {@code
   *     expectedSequence} or with {@link AggregateException.DatabaseConnection} if the store is
   *     unreachable
   * @throws IllegalArgumentException if the identifier is null or blank or the events are null
   */
  CompletableFuture<List<EventEnvelope<E>>> append(
      final String aggregateId, final long expectedSequence, final List<? extends E> events);

  /**
   * @param aggregateId identifier of the aggregate
   * @return the full stream ordered by sequence, empty if the aggregate is unknown
   * @throws IllegalArgumentException if the identifier is null or blank
   */
  CompletableFuture<List<EventEnvelope<E>>> load(final String aggregateId);
}
