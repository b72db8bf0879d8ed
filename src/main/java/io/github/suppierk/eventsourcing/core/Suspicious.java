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

/**
 * Defines internal utility for verifying user inputs.
 *
 * <p>Unfortunately, annotations are not a saving grace when it comes to {@code null}s - this class
 * is used by handlers, stores and storage adapters to ensure that user inputs are always blocked
 * when they attempt to use {@code null}.
 *
 * <p>The class is public only because storage adapters live in their own packages, it is not meant
 * to be extended by library consumers.
 */
public abstract class Suspicious {
  protected Suspicious() {
    // For subclasses only
  }

  /**
   * This method must be used whenever we deal with values produced by user code, such as events
   * returned from {@code convertCommand}.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the parameter name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalStateException when the value is {@code null}
   */
  protected final <T> T throwIllegalStateIfNull(T value, String whatMustNotBeNull)
      throws IllegalStateException {
    if (value == null) {
      throw new IllegalStateException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * This method must be used whenever we deal with method arguments only. When we need to check
   * values produced by user code use {@link #throwIllegalStateIfNull(Object, String)} instead.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the parameter name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalArgumentException when the value is {@code null}
   */
  protected final <T> T throwIllegalArgumentIfNull(T value, String whatMustNotBeNull)
      throws IllegalArgumentException {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * Same as {@link #throwIllegalArgumentIfNull(Object, String)}, additionally rejecting blank
   * strings - identifiers and type names are used as storage keys.
   *
   * @param value which must not be {@code null} or blank
   * @param whatMustNotBeBlank is the parameter name
   * @return value if it was not {@code null} or blank
   * @throws IllegalArgumentException when the value is {@code null} or blank
   */
  protected final String throwIllegalArgumentIfBlank(String value, String whatMustNotBeBlank)
      throws IllegalArgumentException {
    if (throwIllegalArgumentIfNull(value, whatMustNotBeBlank).isBlank()) {
      throw new IllegalArgumentException("%s cannot be blank".formatted(whatMustNotBeBlank));
    }

    return value;
  }
}
