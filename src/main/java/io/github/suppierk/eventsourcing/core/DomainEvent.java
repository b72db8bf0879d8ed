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

import java.io.Serializable;
import java.util.Optional;

/**
 * Represents an immutable fact describing a state change of an {@link Aggregate}.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s and to group all
 * events of a single aggregate under one {@code sealed} interface. Records typically implement one
 * of the {@link Creation} or {@link Mutation} markers, only events which need full control over the
 * fold implement {@link #apply(Optional)} on their own. Only {@link Creation} events are accepted
 * when an aggregate is being created.
 *
 * <p>Each event knows how to fold itself into an aggregate state via {@link #apply(Optional)}. The
 * fold must be deterministic: applying the same event to the same prior state always yields an
 * equal result, which is what makes replay safe. For that reason an event must carry every value
 * the fold needs, including the identifier of a newly created aggregate - nothing may be generated
 * during the fold itself.
 *
 * <p>Event / state combinations which do not match (a {@link Mutation} against absent state, a
 * {@link Creation} against an existing aggregate, or a change which does not concern any part of
 * the current state) are no-ops rather than failures.
 *
 * @param <A> is the type of the aggregate this event belongs to
 */
public interface DomainEvent<A extends Aggregate> extends Serializable {
  /** Schema version of every event unless overridden, reserved for upcasting. */
  String DEFAULT_EVENT_VERSION = "1.0.0";

  /**
   * Used for logging and indexing by storage adapters, never for dispatch.
   *
   * @return stable name of this event variant
   */
  default String eventType() {
    return getClass().getSimpleName();
  }

  /**
   * @return schema version of this event variant
   */
  default String eventVersion() {
    return DEFAULT_EVENT_VERSION;
  }

  /**
   * The fold step.
   *
   * @param existing aggregate state before this event, empty when there is no aggregate yet
   * @return aggregate state after this event
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3553/">Suppressed Sonar rule, absent
   *     state is a legitimate input of the fold</a>
   */
  @SuppressWarnings("squid:S3553")
  Optional<A> apply(final Optional<A> existing);

  /**
   * Extension point for version-aware upcasting, which currently delegates to {@link
   * #apply(Optional)}.
   *
   * @param existing aggregate state before this event, empty when there is no aggregate yet
   * @return aggregate state after this event
   */
  @SuppressWarnings("squid:S3553")
  default Optional<A> mutate(final Optional<A> existing) {
    return apply(existing);
  }

  /**
   * Marker interface, denoting that the event can produce an aggregate from nothing.
   *
   * @param <A> is the type of the aggregate this event creates
   */
  interface Creation<A extends Aggregate> extends DomainEvent<A> {
    /**
     * @return brand-new aggregate state described by this event, never {@code null}
     */
    A create();

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException if {@link #create()} returned {@code null}
     */
    @Override
    @SuppressWarnings("squid:S3553")
    default Optional<A> apply(final Optional<A> existing) {
      if (existing.isPresent()) {
        return existing;
      }

      final A created = create();
      if (created == null) {
        throw new IllegalStateException(
            "Result of '%s' fold cannot be null".formatted(eventType()));
      }

      return Optional.of(created);
    }
  }

  /**
   * Marker interface, denoting that the event changes an existing aggregate.
   *
   * @param <A> is the type of the aggregate this event changes
   */
  interface Mutation<A extends Aggregate> extends DomainEvent<A> {
    /**
     * @param existing aggregate state before this event
     * @return a fresh aggregate value reflecting this event, or {@code existing} if the event does
     *     not concern it, never {@code null}
     */
    A applyTo(final A existing);

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException if {@link #applyTo(Aggregate)} returned {@code null}
     */
    @Override
    @SuppressWarnings("squid:S3553")
    default Optional<A> apply(final Optional<A> existing) {
      return existing.map(
          aggregate -> {
            final A changed = applyTo(aggregate);
            if (changed == null) {
              throw new IllegalStateException(
                  "Result of '%s' fold cannot be null".formatted(eventType()));
            }

            return changed;
          });
    }
  }
}
