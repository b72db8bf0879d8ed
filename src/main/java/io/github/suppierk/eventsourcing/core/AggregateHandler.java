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

import io.github.suppierk.eventsourcing.error.AggregateException;
import io.vavr.control.Try;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Class to accept {@link DomainCommand}s for a specific kind of {@link Aggregate}:
 *
 * <ul>
 *   <li>Translate a {@link DomainCommand} into {@link DomainEvent}s.
 *   <li>Fold the events into the aggregate state.
 *   <li>Hand the resulting state together with the produced events back to the caller.
 * </ul>
 *
 * <p>Handlers are stateless and may be shared between threads. They provide no locking: commands
 * against the same aggregate identifier must be serialized by the caller, typically by appending
 * the produced events with an expected sequence.
 *
 * <p><b>Design note</b>: whichever parameters can be controlled must be covered with null checks
 * and {@code final} (if possible), whichever values are expected to be provided by consumer must be
 * checked with the help of {@link Suspicious} methods.
 *
 * @param <A> the type of the aggregate
 * @param <C> the type of the commands the aggregate accepts
 * @param <E> the type of the events the aggregate is folded from
 * @param <S> the type of the services bundle consulted during execution, see {@link NoServices}
 */
// @formatter:off
public abstract class AggregateHandler<
  A extends Aggregate,
  C extends DomainCommand,
  E extends DomainEvent<A>,
  S
> extends Suspicious {
// @formatter:on
  private static final Logger log = LoggerFactory.getLogger(AggregateHandler.class);

  private static final String CONVERTED_EVENT = "Converted event";

  private final Class<A> aggregateClass;
  private final Class<E> eventClass;

  /**
   * Constructs a new {@link AggregateHandler} for a specific {@link Aggregate} class.
   *
   * @param aggregateClass the class of the {@link Aggregate} to handle
   * @param eventClass the common type of the aggregate {@link DomainEvent}s
   * @throws IllegalArgumentException if any of the classes is null
   */
  protected AggregateHandler(final Class<A> aggregateClass, final Class<E> eventClass) {
    this.aggregateClass = throwIllegalArgumentIfNull(aggregateClass, "Aggregate class");
    this.eventClass = throwIllegalArgumentIfNull(eventClass, "Event class");
  }

  /**
   * Used by storage adapters as a namespace key, so it must stay stable once data was persisted.
   *
   * @return the name of the aggregate kind, the simple name of the aggregate class by default
   */
  public String aggregateType() {
    return aggregateClass.getSimpleName();
  }

  /**
   * @return the class type of the aggregate being handled
   */
  public final Class<A> getAggregateClass() {
    return aggregateClass;
  }

  /**
   * @return the common class type of the events of the aggregate being handled
   */
  public final Class<E> getEventClass() {
    return eventClass;
  }

  /**
   * @param aggregate to get the identity token of
   * @return the identity token callers use to correlate subsequent commands
   * @throws IllegalArgumentException if the aggregate is null
   */
  public final String aggregateVersion(final A aggregate) {
    return throwIllegalArgumentIfNull(aggregate, "Aggregate").aggregateVersion();
  }

  /**
   * Pure translation of an already validated command into its event.
   *
   * <p>Any identifier of a newly created aggregate must be generated here, never inside the fold.
   *
   * @param command to translate
   * @return the corresponding event
   */
  public abstract E convertCommand(final C command);

  /**
   * Business logic deciding which events the command produces against the current state.
   *
   * <p>This is the place to consult services or to reject the command with {@link
   * AggregateException.CommandNotConvertible}. Any other unchecked exception is reported as {@link
   * AggregateException.Unexpected}.
   *
   * @param aggregate current state
   * @param command being executed
   * @param services supplied by the caller
   * @return events to fold into the aggregate, in order
   */
  protected List<E> decide(final A aggregate, final C command, final S services) {
    return List.of(throwIllegalStateIfNull(convertCommand(command), CONVERTED_EVENT));
  }

  /**
   * The only entry point producing an aggregate from nothing.
   *
   * @param command to create the aggregate from
   * @return the new aggregate, or empty if the command or its event is not creation-capable
   * @throws IllegalArgumentException if the command is null
   */
  public final Optional<A> create(final C command) {
    return tryCreate(throwIllegalArgumentIfNull(command, "Command")).map(Execution::aggregate);
  }

  /**
   * Same as {@link #create(DomainCommand)}, reporting rejection as a recoverable error.
   *
   * @param command to create the aggregate from
   * @return the new aggregate with the event it was folded from
   * @throws IllegalArgumentException if the command is null
   * @throws AggregateException.CommandNotConvertible if the command is not creation-capable
   */
  public final Execution<A, E> createOrThrow(final C command) {
    final C nonNullCommand = throwIllegalArgumentIfNull(command, "Command");

    return tryCreate(nonNullCommand)
        .orElseThrow(
            () ->
                new AggregateException.CommandNotConvertible(
                    aggregateType(),
                    null,
                    "Command '%s' cannot create '%s'"
                        .formatted(nonNullCommand.getClass().getSimpleName(), aggregateType())));
  }

  /**
   * Translates the command into events and folds them into the given aggregate.
   *
   * @param aggregate current state
   * @param command to execute
   * @param services supplied by the caller, use {@link NoServices} when there are none
   * @return the new aggregate value with the events it was folded from
   * @throws IllegalArgumentException if any of the arguments is null
   * @throws IllegalStateException if user code returned null events or the fold lost the aggregate
   * @throws AggregateException.CommandNotConvertible if the command has no translation for the
   *     current state
   * @throws AggregateException.Unexpected if deciding failed for any other reason
   */
  public final Execution<A, E> execute(final A aggregate, final C command, final S services) {
    final A nonNullAggregate = throwIllegalArgumentIfNull(aggregate, "Aggregate");
    final C nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final S nonNullServices = throwIllegalArgumentIfNull(services, "Services");
    final String aggregateId = nonNullAggregate.aggregateId();

    if (nonNullCommand instanceof DomainCommand.Create) {
      throw new AggregateException.CommandNotConvertible(
          aggregateType(),
          aggregateId,
          "Creation command '%s' cannot be executed against an existing aggregate"
              .formatted(nonNullCommand.getClass().getSimpleName()));
    }

    if (nonNullCommand instanceof DomainCommand.Mutate mutate
        && !aggregateId.equals(mutate.aggregateId())) {
      throw new AggregateException.CommandNotConvertible(
          aggregateType(),
          aggregateId,
          "Command '%s' is aimed at aggregate '%s'"
              .formatted(nonNullCommand.getClass().getSimpleName(), mutate.aggregateId()));
    }

    final List<E> events =
        Try.of(() -> decide(nonNullAggregate, nonNullCommand, nonNullServices))
            .getOrElseThrow(cause -> asAggregateException(aggregateId, cause));

    Optional<A> state = Optional.of(nonNullAggregate);
    for (E event : throwIllegalStateIfNull(events, "Decided events")) {
      state = fold(state, throwIllegalStateIfNull(event, "Decided event"));
    }

    final A result =
        throwIllegalStateIfNull(state.orElse(null), "Aggregate '%s'".formatted(aggregateId));

    log.debug(
        "Executed '{}' against {} '{}', {} event(s) produced",
        nonNullCommand.getClass().getSimpleName(),
        aggregateType(),
        aggregateId,
        events.size());

    return new Execution<>(result, events);
  }

  /**
   * Folds an ordered event history starting from absent state.
   *
   * @param events to fold, in order
   * @return the aggregate described by the history, or empty if no event created it
   * @throws IllegalArgumentException if the history or any of its events is null
   * @throws IllegalStateException if an event folded into a null aggregate
   */
  public final Optional<A> replay(final Iterable<? extends E> events) {
    Optional<A> state = Optional.empty();

    for (E event : throwIllegalArgumentIfNull(events, "Events")) {
      state = fold(state, throwIllegalArgumentIfNull(event, "Event"));
    }

    return state;
  }

  private Optional<Execution<A, E>> tryCreate(final C command) {
    if (!(command instanceof DomainCommand.Create)) {
      log.debug(
          "Rejected '{}' as {} creation command",
          command.getClass().getSimpleName(),
          aggregateType());
      return Optional.empty();
    }

    final E event = throwIllegalStateIfNull(convertCommand(command), CONVERTED_EVENT);
    if (!(event instanceof DomainEvent.Creation)) {
      log.debug("Rejected '{}' as {} creation event", event.eventType(), aggregateType());
      return Optional.empty();
    }

    return fold(Optional.empty(), event)
        .map(aggregate -> new Execution<A, E>(aggregate, List.of(event)));
  }

  @SuppressWarnings("squid:S3553")
  private Optional<A> fold(final Optional<A> state, final E event) {
    return throwIllegalStateIfNull(
        event.mutate(state), "Result of '%s' fold".formatted(event.eventType()));
  }

  private AggregateException asAggregateException(final String aggregateId, final Throwable cause) {
    if (cause instanceof AggregateException aggregateException) {
      return aggregateException;
    }

    return new AggregateException.Unexpected(aggregateType(), aggregateId, cause);
  }
}
