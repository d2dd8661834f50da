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

import io.github.suppierk.modeling.error.ArgumentInvalidException;
import io.github.suppierk.modeling.error.DddException;
import io.vavr.control.Try;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single choke point through which the outcome of every {@code validate} callback is funneled.
 *
 * <p>Callers of this library observe a uniform error taxonomy regardless of what a particular
 * {@code validate} implementation returns or throws:
 *
 * <ul>
 *   <li>{@code null} or {@link ValidationResult#valid()} - nothing happens.
 *   <li>{@link ValidationResult.Rejected} holding a {@link DddException} - that exception is
 *       rethrown as is, keeping its own code.
 *   <li>{@link ValidationResult.Rejected} holding any other error - only its message survives in
 *       a new {@link ArgumentInvalidException}.
 *   <li>{@link ValidationResult.Invalid} - {@link ArgumentInvalidException} with the given message
 *       or with {@link ArgumentInvalidException#DEFAULT_MESSAGE}.
 * </ul>
 */
public final class ValidationPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(ValidationPipeline.class);

  private ValidationPipeline() {
    // No instance
  }

  /**
   * Interprets validation outcome.
   *
   * @param result to interpret, {@code null} is treated as success
   * @throws DddException if the result describes a failure
   */
  public static void handleValidationResult(final ValidationResult result) {
    if (result == null || result.isValid()) {
      return;
    }

    if (result instanceof ValidationResult.Rejected rejected) {
      final Throwable error = rejected.error();

      if (error instanceof DddException dddException) {
        throw dddException;
      }

      LOG.debug("Narrowing validation error to {}", ArgumentInvalidException.class, error);
      throw error.getMessage() == null
          ? new ArgumentInvalidException()
          : new ArgumentInvalidException(error.getMessage());
    }

    final var invalid = (ValidationResult.Invalid) result;
    throw invalid
        .reason()
        .map(ArgumentInvalidException::new)
        .orElseGet(ArgumentInvalidException::new);
  }

  /**
   * Runs a validator and interprets its outcome.
   *
   * <p>The usage of {@link Try} captures an exception thrown by the validator - it is then treated
   * exactly as if the validator returned {@link ValidationResult#rejected(Throwable)}.
   *
   * @param validator to invoke
   * @throws IllegalArgumentException if validator is {@code null}
   * @throws DddException if validation failed
   */
  public static void validate(final Supplier<ValidationResult> validator) {
    if (validator == null) {
      throw new IllegalArgumentException("Validator cannot be null");
    }

    handleValidationResult(Try.of(validator::get).getOrElseGet(ValidationResult::rejected));
  }
}
