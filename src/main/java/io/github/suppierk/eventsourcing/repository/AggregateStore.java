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
import io.github.suppierk.eventsourcing.core.DomainCommand;
import io.github.suppierk.eventsourcing.core.DomainEvent;
import io.github.suppierk.eventsourcing.core.Execution;
import io.github.suppierk.eventsourcing.core.Suspicious;
import io.github.suppierk.eventsourcing.error.AggregateException;
import io.vavr.control.Try;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs commands against aggregates persisted as event streams:
 *
 * <ul>
 *   <li>Load the aggregate stream from the {@link EventJournal}.
 *   <li>Replay it through the {@link AggregateHandler} to get the current state.
 *   <li>Execute the command and append the produced events, expecting the stream not to have moved
 *       in the meantime.
 * </ul>
 *
 * <p>A concurrent writer of the same aggregate makes the later append fail with {@link
 * AggregateException.AggregateConflict}. The store does not retry, the caller decides whether to
 * execute the command again against the fresh state.
 *
 * @param <A> the type of the aggregate
 * @param <C> the type of the commands the aggregate accepts
 * @param <E> the type of the events the aggregate is folded from
 * @param <S> the type of the services bundle consulted during execution
 */
// @formatter:off
public final class AggregateStore<
  A extends Aggregate,
  C extends DomainCommand,
  E extends DomainEvent<A>,
  S
> extends Suspicious {
// @formatter:on
  private static final Logger log = LoggerFactory.getLogger(AggregateStore.class);

  private final AggregateHandler<A, C, E, S> handler;
  private final EventJournal<E> journal;

  /**
   * @param handler to translate commands and fold events with
   * @param journal to keep aggregate streams in
   * @throws IllegalArgumentException if any of the arguments is null or if they disagree on the
   *     aggregate type
   */
  public AggregateStore(
      final AggregateHandler<A, C, E, S> handler, final EventJournal<E> journal) {
    this.handler = throwIllegalArgumentIfNull(handler, "Aggregate handler");
    this.journal = throwIllegalArgumentIfNull(journal, "Event journal");

    if (!handler.aggregateType().equals(journal.aggregateType())) {
      throw new IllegalArgumentException(
          "Handler of '%s' cannot use journal of '%s'"
              .formatted(handler.aggregateType(), journal.aggregateType()));
    }
  }

  /**
   * Creates a new aggregate and starts its stream.
   *
   * @param command creation-capable command
   * @return the created aggregate with its first events, completed exceptionally with {@link
   *     AggregateException.CommandNotConvertible} if the command cannot create the aggregate or
   *     with {@link AggregateException.AggregateConflict} if the identifier is already taken
   */
  public CompletableFuture<Execution<A, E>> create(final C command) {
    final C nonNullCommand = throwIllegalArgumentIfNull(command, "Command");

    return Try.of(() -> handler.createOrThrow(nonNullCommand))
        .fold(
            cause -> CompletableFuture.<Execution<A, E>>failedFuture(cause),
            execution ->
                journal
                    .append(execution.aggregate().aggregateId(), 0L, execution.events())
                    .thenApply(
                        envelopes -> {
                          log.debug(
                              "Created {} '{}'",
                              handler.aggregateType(),
                              execution.aggregate().aggregateId());
                          return execution;
                        }));
  }

  /**
   * Executes a command against the current state of an aggregate and appends the produced events.
   *
   * @param aggregateId identifier of the aggregate
   * @param command to execute
   * @param services supplied by the caller
   * @return the new aggregate with the appended events, completed exceptionally with {@link
   *     AggregateException.NotFound} for an unknown aggregate, with {@link
   *     AggregateException.AggregateConflict} if another writer appended first, or with any failure
   *     of {@link AggregateHandler#execute(Aggregate, DomainCommand, Object)}
   */
  public CompletableFuture<Execution<A, E>> execute(
      final String aggregateId, final C command, final S services) {
    final String nonNullAggregateId =
        throwIllegalArgumentIfNull(aggregateId, "Aggregate identifier");
    final C nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final S nonNullServices = throwIllegalArgumentIfNull(services, "Services");

    return journal
        .load(nonNullAggregateId)
        .thenCompose(
            envelopes -> {
              final A current = replay(nonNullAggregateId, envelopes);
              final Execution<A, E> execution =
                  handler.execute(current, nonNullCommand, nonNullServices);

              return journal
                  .append(nonNullAggregateId, envelopes.size(), execution.events())
                  .thenApply(appended -> execution);
            });
  }

  /**
   * @param aggregateId identifier of the aggregate
   * @return the current state of the aggregate, completed exceptionally with {@link
   *     AggregateException.NotFound} for an unknown aggregate
   */
  public CompletableFuture<A> load(final String aggregateId) {
    final String nonNullAggregateId =
        throwIllegalArgumentIfNull(aggregateId, "Aggregate identifier");

    return journal
        .load(nonNullAggregateId)
        .thenApply(envelopes -> replay(nonNullAggregateId, envelopes));
  }

  private A replay(final String aggregateId, final List<EventEnvelope<E>> envelopes) {
    return handler
        .replay(envelopes.stream().map(EventEnvelope::event).toList())
        .orElseThrow(() -> new AggregateException.NotFound(handler.aggregateType(), aggregateId));
  }
}
