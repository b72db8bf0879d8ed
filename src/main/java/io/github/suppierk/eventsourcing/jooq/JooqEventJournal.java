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

package io.github.suppierk.eventsourcing.jooq;

import static io.github.suppierk.eventsourcing.jooq.StorageTables.AGGREGATE_ID;
import static io.github.suppierk.eventsourcing.jooq.StorageTables.AGGREGATE_TYPE;
import static io.github.suppierk.eventsourcing.jooq.StorageTables.EVENT_TYPE;
import static io.github.suppierk.eventsourcing.jooq.StorageTables.EVENT_VERSION;
import static io.github.suppierk.eventsourcing.jooq.StorageTables.PAYLOAD;
import static io.github.suppierk.eventsourcing.jooq.StorageTables.RECORDED_AT;
import static io.github.suppierk.eventsourcing.jooq.StorageTables.SEQUENCE_NUMBER;

import io.github.suppierk.eventsourcing.core.AggregateHandler;
import io.github.suppierk.eventsourcing.core.DomainEvent;
import io.github.suppierk.eventsourcing.core.Suspicious;
import io.github.suppierk.eventsourcing.error.AggregateException;
import io.github.suppierk.eventsourcing.json.JsonCodec;
import io.github.suppierk.eventsourcing.repository.EventEnvelope;
import io.github.suppierk.eventsourcing.repository.EventJournal;
import io.vavr.CheckedFunction0;
import io.vavr.control.Try;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import org.jooq.Condition;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.IntegrityConstraintViolationException;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventJournal} keeping event streams in a relational table, one row per event.
 *
 * <p>The expected sequence is verified within the same transaction that inserts the events. The
 * primary key over aggregate type, identifier and sequence number catches writers racing past that
 * check, which is reported as {@link AggregateException.AggregateConflict} as well.
 *
 * @param <E> is the type of the aggregate events
 */
public final class JooqEventJournal<E extends DomainEvent<?>> extends Suspicious
    implements EventJournal<E> {
  private static final Logger log = LoggerFactory.getLogger(JooqEventJournal.class);

  private final String aggregateType;
  private final Class<E> eventClass;
  private final DslContextProvider dslContextProvider;
  private final StorageTables tables;
  private final JsonCodec jsonCodec;
  private final Executor executor;
  private final Clock clock;

  /**
   * @param aggregateType namespace of the aggregates
   * @param eventClass to deserialize records into
   * @param dslContextProvider to select the database with
   * @param tables physical layout
   * @param jsonCodec to (de)serialize events with
   * @param executor to run database operations on
   * @param clock to stamp events with
   * @throws IllegalArgumentException if any of the arguments is null or blank
   */
  public JooqEventJournal(
      final String aggregateType,
      final Class<E> eventClass,
      final DslContextProvider dslContextProvider,
      final StorageTables tables,
      final JsonCodec jsonCodec,
      final Executor executor,
      final Clock clock) {
    this.aggregateType = throwIllegalArgumentIfBlank(aggregateType, "Aggregate type");
    this.eventClass = throwIllegalArgumentIfNull(eventClass, "Event class");
    this.dslContextProvider =
        throwIllegalArgumentIfNull(dslContextProvider, "DSLContext provider");
    this.tables = throwIllegalArgumentIfNull(tables, "Storage tables");
    this.jsonCodec = throwIllegalArgumentIfNull(jsonCodec, "JSON codec");
    this.executor = throwIllegalArgumentIfNull(executor, "Executor");
    this.clock = throwIllegalArgumentIfNull(clock, "Clock");
  }

  /**
   * @param handler to take the aggregate type and event class from
   * @param dslContextProvider to select the database with
   * @param <E> is the type of the aggregate events
   * @return a new journal with default tables and codec, running on {@link
   *     ForkJoinPool#commonPool()}
   */
  public static <E extends DomainEvent<?>> JooqEventJournal<E> forHandler(
      final AggregateHandler<?, ?, E, ?> handler, final DslContextProvider dslContextProvider) {
    if (handler == null) {
      throw new IllegalArgumentException("Aggregate handler cannot be null");
    }

    return new JooqEventJournal<>(
        handler.aggregateType(),
        handler.getEventClass(),
        dslContextProvider,
        StorageTables.defaults(),
        JsonCodec.defaultCodec(),
        ForkJoinPool.commonPool(),
        Clock.systemUTC());
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
          final Instant recordedAt = clock.instant().truncatedTo(ChronoUnit.MICROS);
          final List<EventEnvelope<E>> envelopes = new ArrayList<>(nonNullEvents.size());
          long sequence = expectedSequence;
          for (E event : nonNullEvents) {
            envelopes.add(
                EventEnvelope.of(aggregateType, nonNullAggregateId, ++sequence, recordedAt, event));
          }

          Try.run(() -> insert(nonNullAggregateId, expectedSequence, envelopes))
              .getOrElseThrow(cause -> translate(nonNullAggregateId, cause));

          log.debug(
              "Appended {} event(s) to {} '{}'",
              envelopes.size(),
              aggregateType,
              nonNullAggregateId);
          return List.copyOf(envelopes);
        },
        executor);
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<List<EventEnvelope<E>>> load(final String aggregateId) {
    final String nonNullAggregateId =
        throwIllegalArgumentIfBlank(aggregateId, "Aggregate identifier");

    return CompletableFuture.supplyAsync(
        () ->
            withDatabase(
                    nonNullAggregateId,
                    () ->
                        dsl()
                            .select(
                                SEQUENCE_NUMBER, EVENT_TYPE, EVENT_VERSION, PAYLOAD, RECORDED_AT)
                            .from(tables.events())
                            .where(byIdentifier(nonNullAggregateId))
                            .orderBy(SEQUENCE_NUMBER.asc())
                            .fetch())
                .stream()
                .map(dbRecord -> toEnvelope(nonNullAggregateId, dbRecord))
                .toList(),
        executor);
  }

  private void insert(
      final String aggregateId,
      final long expectedSequence,
      final List<EventEnvelope<E>> envelopes) {
    dsl()
        .transaction(
            (final Configuration trx) -> {
              final Long lastSequence =
                  trx.dsl()
                      .select(DSL.max(SEQUENCE_NUMBER))
                      .from(tables.events())
                      .where(byIdentifier(aggregateId))
                      .fetchOne(0, Long.class);
              final long actualSequence = lastSequence == null ? 0L : lastSequence;

              if (actualSequence != expectedSequence) {
                throw new AggregateException.AggregateConflict(
                    aggregateType,
                    aggregateId,
                    "Expected sequence %d, actual %d".formatted(expectedSequence, actualSequence));
              }

              for (EventEnvelope<E> envelope : envelopes) {
                trx.dsl()
                    .insertInto(tables.events())
                    .set(AGGREGATE_TYPE, aggregateType)
                    .set(AGGREGATE_ID, aggregateId)
                    .set(SEQUENCE_NUMBER, envelope.sequence())
                    .set(EVENT_TYPE, envelope.eventType())
                    .set(EVENT_VERSION, envelope.eventVersion())
                    .set(PAYLOAD, jsonCodec.write(aggregateType, envelope.event()))
                    .set(RECORDED_AT, envelope.recordedAt().atOffset(ZoneOffset.UTC))
                    .execute();
              }
            });
  }

  private EventEnvelope<E> toEnvelope(final String aggregateId, final Record dbRecord) {
    return new EventEnvelope<>(
        aggregateType,
        aggregateId,
        dbRecord.get(SEQUENCE_NUMBER),
        dbRecord.get(EVENT_TYPE),
        dbRecord.get(EVENT_VERSION),
        dbRecord.get(RECORDED_AT).toInstant(),
        jsonCodec.read(aggregateType, aggregateId, dbRecord.get(PAYLOAD), eventClass));
  }

  private DSLContext dsl() {
    return throwIllegalStateIfNull(
        dslContextProvider.apply(aggregateType), "DSLContext for '%s'".formatted(aggregateType));
  }

  private Condition byIdentifier(final String aggregateId) {
    return AGGREGATE_TYPE.eq(aggregateType).and(AGGREGATE_ID.eq(aggregateId));
  }

  private <T> T withDatabase(final String aggregateId, final CheckedFunction0<T> operation) {
    return Try.of(operation).getOrElseThrow(cause -> translate(aggregateId, cause));
  }

  private AggregateException translate(final String aggregateId, final Throwable cause) {
    if (cause instanceof AggregateException aggregateException) {
      if (aggregateException instanceof AggregateException.AggregateConflict) {
        log.warn("{} '{}' was appended to concurrently", aggregateType, aggregateId);
      }
      return aggregateException;
    }

    if (cause instanceof IntegrityConstraintViolationException) {
      log.warn("{} '{}' was appended to concurrently", aggregateType, aggregateId);
      return new AggregateException.AggregateConflict(
          aggregateType, aggregateId, "Sequence is already taken", cause);
    }

    if (cause instanceof DataAccessException) {
      return new AggregateException.DatabaseConnection(aggregateType, cause);
    }

    return new AggregateException.Unexpected(aggregateType, aggregateId, cause);
  }
}
