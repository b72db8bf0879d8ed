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
import io.github.suppierk.eventsourcing.core.Suspicious;
import io.github.suppierk.eventsourcing.error.AggregateException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventJournal} keeping streams in memory.
 *
 * <p>Appends to the same stream are atomic with respect to each other, appends to different
 * streams do not contend.
 *
 * @param <E> is the type of the aggregate events
 */
public final class InMemoryEventJournal<E extends DomainEvent<?>> extends Suspicious
    implements EventJournal<E> {
  private static final Logger log = LoggerFactory.getLogger(InMemoryEventJournal.class);

  private final String aggregateType;
  private final Executor executor;
  private final Clock clock;
  private final ConcurrentMap<String, List<EventEnvelope<E>>> streams;

  /**
   * @param aggregateType namespace of the aggregates
   * @param executor to run storage operations on
   * @param clock to stamp envelopes with
   * @throws IllegalArgumentException if any of the arguments is null or blank
   */
  public InMemoryEventJournal(
      final String aggregateType, final Executor executor, final Clock clock) {
    this.aggregateType = throwIllegalArgumentIfBlank(aggregateType, "Aggregate type");
    this.executor = throwIllegalArgumentIfNull(executor, "Executor");
    this.clock = throwIllegalArgumentIfNull(clock, "Clock");
    this.streams = new ConcurrentHashMap<>();
  }

  /**
   * @param aggregateType namespace of the aggregates
   * @throws IllegalArgumentException if the type is null or blank
   */
  public InMemoryEventJournal(final String aggregateType) {
    this(aggregateType, ForkJoinPool.commonPool(), Clock.systemUTC());
  }

  /** {@inheritDoc} */
  @Override
  public String aggregateType() {
    return aggregateType;
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<List<EventEnvelope<E>>> append(
      final String aggregateId, final long expectedSequence, final List<? extends E> events) {
    final String nonNullAggregateId =
        throwIllegalArgumentIfBlank(aggregateId, "Aggregate identifier");
    final List<E> nonNullEvents = List.copyOf(throwIllegalArgumentIfNull(events, "Events"));

    if (nonNullEvents.isEmpty()) {
      return CompletableFuture.completedFuture(List.of());
    }

    return CompletableFuture.supplyAsync(
        () -> {
          final List<EventEnvelope<E>> appended = new ArrayList<>(nonNullEvents.size());

          streams.compute(
              nonNullAggregateId,
              (id, stream) -> {
                final List<EventEnvelope<E>> current = stream == null ? List.of() : stream;
                if (current.size() != expectedSequence) {
                  log.warn(
                      "{} '{}' expected at sequence {}, but it is at {}",
                      aggregateType,
                      id,
                      expectedSequence,
                      current.size());
                  throw new AggregateException.AggregateConflict(
                      aggregateType,
                      id,
                      "Expected sequence %d, actual %d"
                          .formatted(expectedSequence, current.size()));
                }

                final Instant recordedAt = clock.instant().truncatedTo(ChronoUnit.MICROS);
                long sequence = expectedSequence;
                for (E event : nonNullEvents) {
                  appended.add(
                      EventEnvelope.of(aggregateType, id, ++sequence, recordedAt, event));
                }

                final List<EventEnvelope<E>> updated = new ArrayList<>(current);
                updated.addAll(appended);
                return List.copyOf(updated);
              });

          log.debug(
              "Appended {} event(s) to {} '{}'",
              appended.size(),
              aggregateType,
              nonNullAggregateId);
          return List.copyOf(appended);
        },
        executor);
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<List<EventEnvelope<E>>> load(final String aggregateId) {
    final String nonNullAggregateId =
        throwIllegalArgumentIfBlank(aggregateId, "Aggregate identifier");

    return CompletableFuture.supplyAsync(
        () -> streams.getOrDefault(nonNullAggregateId, List.of()), executor);
  }
}
