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

import io.github.suppierk.eventsourcing.core.Aggregate;
import io.github.suppierk.eventsourcing.core.AggregateHandler;
import io.github.suppierk.eventsourcing.core.Suspicious;
import io.github.suppierk.eventsourcing.error.AggregateException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Repository} keeping aggregate snapshots in memory.
 *
 * <p>Aggregates are immutable values, so the stored references are returned as they are.
 *
 * @param <A> is the type of the stored aggregate
 */
public final class InMemoryRepository<A extends Aggregate> extends Suspicious
    implements Repository<A> {
  private static final Logger log = LoggerFactory.getLogger(InMemoryRepository.class);

  private final String aggregateType;
  private final Executor executor;
  private final ConcurrentMap<String, A> aggregates;

  /**
   * @param aggregateType used for error reporting
   * @param executor to run storage operations on
   * @throws IllegalArgumentException if any of the arguments is null or blank
   */
  public InMemoryRepository(final String aggregateType, final Executor executor) {
    this.aggregateType = throwIllegalArgumentIfBlank(aggregateType, "Aggregate type");
    this.executor = throwIllegalArgumentIfNull(executor, "Executor");
    this.aggregates = new ConcurrentHashMap<>();
  }

  /**
   * @param handler to take the aggregate type from
   * @param <A> is the type of the stored aggregate
   * @return a new repository running on {@link ForkJoinPool#commonPool()}
   */
  public static <A extends Aggregate> InMemoryRepository<A> forHandler(
      final AggregateHandler<A, ?, ?, ?> handler) {
    if (handler == null) {
      throw new IllegalArgumentException("Aggregate handler cannot be null");
    }

    return new InMemoryRepository<>(handler.aggregateType(), ForkJoinPool.commonPool());
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<String> add(final A aggregate) {
    final A nonNullAggregate = throwIllegalArgumentIfNull(aggregate, "Aggregate");
    final String aggregateId =
        throwIllegalStateIfNull(nonNullAggregate.aggregateId(), "Aggregate identifier");

    return CompletableFuture.supplyAsync(
        () -> {
          final A existing = aggregates.putIfAbsent(aggregateId, nonNullAggregate);
          if (existing == null) {
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
          final A aggregate = aggregates.get(nonNullAggregateId);
          if (aggregate == null) {
            throw new AggregateException.NotFound(aggregateType, nonNullAggregateId);
          }
          return aggregate;
        },
        executor);
  }
}
