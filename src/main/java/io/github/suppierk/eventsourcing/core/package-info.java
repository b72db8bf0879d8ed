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


/**
 * Defines general contract rules used by the codebase.
 *
 * <p>Here is an example to help explain how different domain objects are related to each other -
 * let's assume that we are a customer buying things in a shop:
 *
 * <ul>
 *   <li>The purchase itself is an {@link io.github.suppierk.eventsourcing.core.Aggregate} - a
 *       transaction owning its line items by value.
 *   <li>We, as a customer, express intents via {@link
 *       io.github.suppierk.eventsourcing.core.DomainCommand}s:
 *       <ul>
 *         <li>{@code Make Purchase} is a {@link
 *             io.github.suppierk.eventsourcing.core.DomainCommand.Create} command, it is the only
 *             way for a transaction to appear.
 *         <li>{@code Request Cancellation} of a single item is a {@link
 *             io.github.suppierk.eventsourcing.core.DomainCommand.Mutate} command aimed at an
 *             existing transaction.
 *       </ul>
 *   <li>The shop checks our intent, possibly asking other services (is the item shipped already?),
 *       and records what happened as {@link io.github.suppierk.eventsourcing.core.DomainEvent}s -
 *       {@code Purchase Made}, {@code Cancellation Requested}. This is the job of an {@link
 *       io.github.suppierk.eventsourcing.core.AggregateHandler}.
 *   <li>The receipt we hold at any time is nothing more than all recorded events folded one after
 *       another, which is why replaying the same events always prints the same receipt.
 * </ul>
 */
package io.github.suppierk.eventsourcing.core;
