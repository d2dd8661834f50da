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

package io.github.suppierk.modeling.validation;

import java.util.Optional;

/**
 * Outcome of a {@code validate} callback supplied by a concrete domain type.
 *
 * <p>Gives a modeler a lightweight way to signal either success or failure without throwing:
 *
 * <ul>
 *   <li>{@link #valid()} - the input is acceptable.
 *   <li>{@link #invalid()} - the input is not acceptable, no further details.
 *   <li>{@link #invalid(String)} - the input is not acceptable for the given reason.
 *   <li>{@link #rejected(Throwable)} - the input is not acceptable, reason is the given error.
 * </ul>
 *
 * <p>The only interpreter of this type is {@link ValidationPipeline}.
 */
public sealed interface ValidationResult
    permits ValidationResult.Valid, ValidationResult.Invalid, ValidationResult.Rejected {

  /**
   * @return a successful result
   */
  static ValidationResult valid() {
    return Valid.INSTANCE;
  }

  /**
   * @return a failed result which will be reported with the default message
   */
  static ValidationResult invalid() {
    return new Invalid(null);
  }

  /**
   * @param message describing why the input is not acceptable
   * @return a failed result which will be reported with the given message
   */
  static ValidationResult invalid(final String message) {
    return new Invalid(message);
  }

  /**
   * @param error describing why the input is not acceptable
   * @return a failed result carrying the error
   * @throws IllegalArgumentException if error is {@code null}
   */
  static ValidationResult rejected(final Throwable error) {
    return new Rejected(error);
  }

  /**
   * Similar to returning a {@code boolean} from a predicate.
   *
   * @param isValid outcome of the check
   * @return {@link #valid()} for {@code true}, {@link #invalid()} otherwise
   */
  static ValidationResult of(final boolean isValid) {
    return isValid ? valid() : invalid();
  }

  /**
   * @return {@code true} if this result does not describe a failure
   */
  default boolean isValid() {
    return this instanceof Valid;
  }

  /** Successful outcome. */
  enum Valid implements ValidationResult {
    INSTANCE
  }

  /**
   * Failed outcome with an optional human-readable reason.
   *
   * @param message describing the failure, can be {@code null}
   */
  record Invalid(String message) implements ValidationResult {
    /**
     * @return the reason if it was given
     */
    public Optional<String> reason() {
      return Optional.ofNullable(message);
    }
  }

  /**
   * Failed outcome represented by an error.
   *
   * @param error describing the failure
   */
  record Rejected(Throwable error) implements ValidationResult {
    public Rejected {
      if (error == null) {
        throw new IllegalArgumentException("Rejection error cannot be null");
      }
    }
  }
}
