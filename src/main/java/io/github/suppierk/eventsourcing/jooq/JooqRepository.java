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
import static io.github.suppierk.eventsourcing.jooq.StorageTables.CREATED_AT;
import static io.github.suppierk.eventsourcing.jooq.StorageTables.PAYLOAD;

import io.github.suppierk.eventsourcing.core.Aggregate;
import io.github.suppierk.eventsourcing.core.AggregateHandler;
import io.github.suppierk.eventsourcing.core.Suspicious;
import io.github.suppierk.eventsourcing.error.AggregateException;
import io.github.suppierk.eventsourcing.json.JsonCodec;
import io.github.suppierk.eventsourcing.repository.Repository;
import io.vavr.CheckedFunction0;
import io.vavr.control.Try;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import org.jooq.Condition;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.IntegrityConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Repository} keeping aggregate snapshots as JSON documents in a relational table.
 *
 * <p>Records are keyed by the aggregate type and identifier. Insertion runs within a transaction
 * and never overwrites: a record which is already present, including one inserted concurrently by
 * another writer, wins.
 *
 * @param <A> is the type of the stored aggregate
 */
public final class JooqRepository<A extends Aggregate> extends Suspicious
    implements Repository<A> {
  private static final Logger log = LoggerFactory.getLogger(JooqRepository.class);

  private final String aggregateType;
  private final Class<A> aggregateClass;
  private final DslContextProvider dslContextProvider;
  private final StorageTables tables;
  private final JsonCodec jsonCodec;
  private final Executor executor;
  private final Clock clock;

  /**
   * @param aggregateType namespace of the aggregates
   * @param aggregateClass to deserialize records into
   * @param dslContextProvider to select the database with
   * @param tables physical layout
   * @param jsonCodec to (de)serialize aggregates with
   * @param executor to run database operations on
   * @param clock to stamp records with
   * @throws IllegalArgumentException if any of the arguments is null or blank
   */
  public JooqRepository(
      final String aggregateType,
      final Class<A> aggregateClass,
      final DslContextProvider dslContextProvider,
      final StorageTables tables,
      final JsonCodec jsonCodec,
      final Executor executor,
      final Clock clock) {
    this.aggregateType = throwIllegalArgumentIfBlank(aggregateType, "Aggregate type");
    this.aggregateClass = throwIllegalArgumentIfNull(aggregateClass, "Aggregate class");
    this.dslContextProvider =
        throwIllegalArgumentIfNull(dslContextProvider, "DSLContext provider");
    this.tables = throwIllegalArgumentIfNull(tables, "Storage tables");
    this.jsonCodec = throwIllegalArgumentIfNull(jsonCodec, "JSON codec");
    this.executor = throwIllegalArgumentIfNull(executor, "Executor");
    this.clock = throwIllegalArgumentIfNull(clock, "Clock");
  }

  /**
   * @param handler to take the aggregate type and class from
   * @param dslContextProvider to select the database with
   * @param <A> is the type of the stored aggregate
   * @return a new repository with default tables and codec, running on {@link
   *     ForkJoinPool#commonPool()}
   */
  public static <A extends Aggregate> JooqRepository<A> forHandler(
      final AggregateHandler<A, ?, ?, ?> handler, final DslContextProvider dslContextProvider) {
    if (handler == null) {
      throw new IllegalArgumentException("Aggregate handler cannot be null");
    }

    return new JooqRepository<>(
        handler.aggregateType(),
        handler.getAggregateClass(),
        dslContextProvider,
        StorageTables.defaults(),
        JsonCodec.defaultCodec(),
        ForkJoinPool.commonPool(),
        Clock.systemUTC());
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<String> add(final A aggregate) {
    final A nonNullAggregate = throwIllegalArgumentIfNull(aggregate, "Aggregate");
    final String aggregateId =
        throwIllegalStateIfNull(nonNullAggregate.aggregateId(), "Aggregate identifier");

    return CompletableFuture.supplyAsync(
        () -> {
          final String payload = jsonCodec.write(aggregateType, nonNullAggregate);

          final boolean inserted =
              Try.of(() -> insertIfAbsent(aggregateId, payload))
                  .recover(IntegrityConstraintViolationException.class, false)
                  .getOrElseThrow(this::translate);

          if (inserted) {
            log.debug("Added {} '{}'", aggregateType, aggregateId);
          } else {
            log.warn(
                "{} '{}' is already present, keeping the existing one", aggregateType, aggregateId);
          }

          return aggregateId;
        },
        executor);
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<A> get(final String aggregateId) {
    final String nonNullAggregateId =
        throwIllegalArgumentIfNull(aggregateId, "Aggregate identifier");

    return CompletableFuture.supplyAsync(
        () -> {
          final String payload =
              withDatabase(
                  () ->
                      dsl()
                          .select(PAYLOAD)
                          .from(tables.aggregates())
                          .where(byIdentifier(nonNullAggregateId))
                          .fetchOptional(PAYLOAD)
                          .orElseThrow(
                              () ->
                                  new AggregateException.NotFound(
                                      aggregateType, nonNullAggregateId)));

          final A aggregate =
              jsonCodec.read(aggregateType, nonNullAggregateId, payload, aggregateClass);

          if (!nonNullAggregateId.equals(aggregate.aggregateId())) {
            throw new AggregateException.Deserialization(
                aggregateType,
                nonNullAggregateId,
                new IllegalStateException(
                    "Stored record describes '%s'".formatted(aggregate.aggregateId())));
          }

          return aggregate;
        },
        executor);
  }

  private boolean insertIfAbsent(final String aggregateId, final String payload) {
    return dsl()
        .transactionResult(
            (final Configuration trx) -> {
              if (trx.dsl().fetchExists(tables.aggregates(), byIdentifier(aggregateId))) {
                return false;
              }

              trx.dsl()
                  .insertInto(tables.aggregates())
                  .set(AGGREGATE_TYPE, aggregateType)
                  .set(AGGREGATE_ID, aggregateId)
                  .set(PAYLOAD, payload)
                  .set(CREATED_AT, OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC))
                  .execute();

              return true;
            });
  }

  private DSLContext dsl() {
    return throwIllegalStateIfNull(
        dslContextProvider.apply(aggregateType), "DSLContext for '%s'".formatted(aggregateType));
  }

  private Condition byIdentifier(final String aggregateId) {
    return AGGREGATE_TYPE.eq(aggregateType).and(AGGREGATE_ID.eq(aggregateId));
  }

  private <T> T withDatabase(final CheckedFunction0<T> operation) {
    return Try.of(operation).getOrElseThrow(this::translate);
  }

  private AggregateException translate(final Throwable cause) {
    if (cause instanceof AggregateException aggregateException) {
      return aggregateException;
    }

    if (cause instanceof DataAccessException) {
      return new AggregateException.DatabaseConnection(aggregateType, cause);
    }

    return new AggregateException.Unexpected(aggregateType, cause);
  }
}
