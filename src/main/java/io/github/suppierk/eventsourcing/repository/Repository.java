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
import io.github.suppierk.eventsourcing.error.AggregateException;
import java.util.concurrent.CompletableFuture;

/**
 * The abstraction over durable storage of aggregates.
 *
 * <p>This interface makes no assumption about whether the backing store keeps events or snapshots:
 * a conforming implementation may persist either, as long as {@link #get(String)} returns a value
 * equal to what folding the full event history would produce.
 *
 * <p>Operations suspend only on storage access. Failures complete the returned future
 * exceptionally with an {@link AggregateException}; nothing is retried internally. Each call is
 * atomic on its own, there are no cross-call transactions.
 *
 * @param <A> is the type of the stored aggregate
 */
public interface Repository<A extends Aggregate> {
  /**
   * Inserts the aggregate under its identifier if, and only if, no record occupies that identifier
   * yet. An existing record is left untouched and its identifier is still returned, which makes
   * this method safe to retry.
   *
   * @param aggregate to insert
   * @return the identifier of the aggregate, completed exceptionally with {@link
   *     AggregateException.DatabaseConnection} if the store is unreachable
   */
  CompletableFuture<String> add(final A aggregate);

  /**
   * Loads the current state of an aggregate.
   *
   * @param aggregateId of the aggregate to load
   * @return the aggregate, completed exceptionally with {@link AggregateException.NotFound} if no
   *     record exists or with {@link AggregateException.Deserialization} if the record cannot be
   *     reconstructed
   */
  CompletableFuture<A> get(final String aggregateId);
}
