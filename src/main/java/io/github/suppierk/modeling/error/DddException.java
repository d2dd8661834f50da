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

package io.github.suppierk.modeling.error;

import java.io.Serial;

/**
 * Common parent of every exception thrown by this library.
 *
 * <p>Each exception carries a stable {@link #code()} which can be used by consumers for error
 * reporting without relying on the exception class name or on the message text.
 */
public abstract class DddException extends RuntimeException {
  @Serial private static final long serialVersionUID = -4418046521716283903L;

  private final DddErrorCode errorCode;

  /**
   * Constructs a new exception with the specified error code and detail message.
   *
   * @param errorCode describing the category of the failure
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   */
  protected DddException(final DddErrorCode errorCode, final String message) {
    super(message);
    this.errorCode = errorCode;
  }

  /**
   * Constructs a new exception with the specified error code, detail message and cause.
   *
   * @param errorCode describing the category of the failure
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   * @param cause the cause (which is saved for later retrieval by the {@link #getCause()} method).
   */
  protected DddException(
      final DddErrorCode errorCode, final String message, final Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  /**
   * @return error code table entry of this exception
   */
  public final DddErrorCode getErrorCode() {
    return errorCode;
  }

  /**
   * @return stable string code, e.g. {@code ddd/argument-invalid}
   */
  public final String code() {
    return errorCode.code();
  }

  @Override
  public String toString() {
    return "%s (%s): %s".formatted(getClass().getSimpleName(), code(), getMessage());
  }
}
