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

/**
 * Represents an intent submitted by a caller, which an {@link AggregateHandler} validates and
 * translates into zero or more {@link DomainEvent}s.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s.
 *
 * <p>Commands are never applied to the aggregate state directly and are never stored - only the
 * events they produce are. Commands still implement {@link Serializable} so that they can be placed
 * in a queue before they are processed.
 *
 * <p>Commands must be task-oriented, not data-centric - e.g. 'Request Cancellation' instead of 'Set
 * Item status to CANCELLED'.
 *
 * <p>The creation capability is explicit: only {@link Create} commands can produce an aggregate
 * from nothing, every other command should be a {@link Mutate} command aimed at an existing
 * aggregate. Commands of a single aggregate are best grouped under one {@code sealed} interface
 * extending this one, with records implementing one of the markers.
 */
public interface DomainCommand extends Serializable {

  /**
   * Marker interface, denoting that the command is supposed to represent an intent to create a new
   * aggregate in the system.
   */
  interface Create extends DomainCommand {}

  /**
   * Marker interface, denoting that the command is supposed to represent an intent to change an
   * existing aggregate in the system.
   */
  interface Mutate extends DomainCommand {
    /**
     * @return identifier of the aggregate this command is aimed at
     */
    String aggregateId();
  }
}
