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

package io.github.suppierk.eventsourcing.error;

import java.io.Serial;
import java.util.Optional;

/**
 * The closed set of failures shared by aggregate execution and persistence.
 *
 * <p>Java {@code sealed} feature guarantees that no other failure kinds can appear, so consumers
 * can reliably branch on {@link #kind()} or on the concrete nested type.
 *
 * <p>Storage-related variants ({@link DatabaseConnection}, {@link Deserialization}) and {@link
 * Unexpected} always wrap the underlying cause for diagnostics, the remaining variants carry a
 * message only.
 *
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-110/">Suppressed Sonar rule about
 *     inheritance depth, which is dictated by {@link RuntimeException}</a>
 */
@SuppressWarnings("squid:S110")
public abstract sealed class AggregateException extends RuntimeException
    permits AggregateException.AggregateConflict,
        AggregateException.DatabaseConnection,
        AggregateException.Deserialization,
        AggregateException.Unexpected,
        AggregateException.CommandNotConvertible,
        AggregateException.NotFound {
  @Serial private static final long serialVersionUID = 4629715238110847126L;

  /** Discriminator of the failure, one per nested exception type. */
  public enum Kind {
    AGGREGATE_CONFLICT(409),
    DATABASE_CONNECTION_ERROR(503),
    DESERIALIZATION_ERROR(500),
    UNEXPECTED_ERROR(500),
    COMMAND_NOT_CONVERTIBLE(422),
    NOT_FOUND(404);

    private final int statusCode;

    Kind(final int statusCode) {
      this.statusCode = statusCode;
    }

    /**
     * @return the most appropriate HTTP status code for this kind of failure
     */
    public int statusCode() {
      return statusCode;
    }
  }

  private final transient String aggregateType;
  private final transient String aggregateId;

  private AggregateException(
      final String message,
      final Throwable cause,
      final String aggregateType,
      final String aggregateId) {
    super(message, cause);
    this.aggregateType = aggregateType;
    this.aggregateId = aggregateId;
  }

  /**
   * @return the kind of this failure
   */
  public abstract Kind kind();

  /**
   * @return the type of the aggregate this failure concerns, if known
   */
  public final Optional<String> aggregateType() {
    return Optional.ofNullable(aggregateType);
  }

  /**
   * @return the identifier of the aggregate this failure concerns, if known
   */
  public final Optional<String> aggregateId() {
    return Optional.ofNullable(aggregateId);
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status">HTTP response status
   *     codes</a>
   */
  public final int getStatusCode() {
    return kind().statusCode();
  }

  /**
   * Identity collision: a write expected a different aggregate history than the one stored.
   *
   * <p>{@code Repository.add} never raises it, insert-if-absent is not a conflict.
   */
  public static final class AggregateConflict extends AggregateException {
    @Serial private static final long serialVersionUID = -3021542370744655913L;

    public AggregateConflict(
        final String aggregateType, final String aggregateId, final String message) {
      super(message, null, aggregateType, aggregateId);
    }

    public AggregateConflict(
        final String aggregateType,
        final String aggregateId,
        final String message,
        final Throwable cause) {
      super(message, cause, aggregateType, aggregateId);
    }

    /** {@inheritDoc} */
    @Override
    public Kind kind() {
      return Kind.AGGREGATE_CONFLICT;
    }
  }

  /** The backing store could not be reached or refused the operation. */
  public static final class DatabaseConnection extends AggregateException {
    @Serial private static final long serialVersionUID = 5528140962213857095L;

    public DatabaseConnection(final String aggregateType, final Throwable cause) {
      super(describe(cause), cause, aggregateType, null);
    }

    /** {@inheritDoc} */
    @Override
    public Kind kind() {
      return Kind.DATABASE_CONNECTION_ERROR;
    }
  }

  /** A stored record could not be reconstructed into the expected shape. */
  public static final class Deserialization extends AggregateException {
    @Serial private static final long serialVersionUID = -8915062386532209371L;

    public Deserialization(
        final String aggregateType, final String aggregateId, final Throwable cause) {
      super(describe(cause), cause, aggregateType, aggregateId);
    }

    /** {@inheritDoc} */
    @Override
    public Kind kind() {
      return Kind.DESERIALIZATION_ERROR;
    }
  }

  /** Anything else, including failures of the services consulted during execution. */
  public static final class Unexpected extends AggregateException {
    @Serial private static final long serialVersionUID = 1873305468529107614L;

    public Unexpected(final String aggregateType, final Throwable cause) {
      super(describe(cause), cause, aggregateType, null);
    }

    public Unexpected(
        final String aggregateType, final String aggregateId, final Throwable cause) {
      super(describe(cause), cause, aggregateType, aggregateId);
    }

    /** {@inheritDoc} */
    @Override
    public Kind kind() {
      return Kind.UNEXPECTED_ERROR;
    }
  }

  /** A command has no valid translation for the current aggregate state. */
  public static final class CommandNotConvertible extends AggregateException {
    @Serial private static final long serialVersionUID = 7402263117945083550L;

    public CommandNotConvertible(
        final String aggregateType, final String aggregateId, final String message) {
      super(message, null, aggregateType, aggregateId);
    }

    /** {@inheritDoc} */
    @Override
    public Kind kind() {
      return Kind.COMMAND_NOT_CONVERTIBLE;
    }
  }

  /** Lookup miss. */
  public static final class NotFound extends AggregateException {
    @Serial private static final long serialVersionUID = -6674513898701420238L;

    public NotFound(final String aggregateType, final String aggregateId) {
      super(
          "Aggregate '%s' with id '%s' was not found".formatted(aggregateType, aggregateId),
          null,
          aggregateType,
          aggregateId);
    }

    /** {@inheritDoc} */
    @Override
    public Kind kind() {
      return Kind.NOT_FOUND;
    }
  }

  private static String describe(final Throwable cause) {
    return cause == null ? null : cause.toString();
  }
}
