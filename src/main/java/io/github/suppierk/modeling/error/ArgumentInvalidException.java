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
 * A specific {@link DddException} to be thrown when a domain object cannot be constructed from
 * the given input.
 *
 * <p>Covers every construction and validation failure of value objects, entities and domain
 * events.
 */
public class ArgumentInvalidException extends DddException {
  @Serial private static final long serialVersionUID = 2303766126367924484L;

  public static final String DEFAULT_MESSAGE = "Argument is invalid";

  /** Constructs a new exception with {@link #DEFAULT_MESSAGE}. */
  public ArgumentInvalidException() {
    this(DEFAULT_MESSAGE);
  }

  /**
   * Constructs a new exception with the specified detail message.
   *
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   */
  public ArgumentInvalidException(String message) {
    super(DddErrorCode.ARGUMENT_INVALID, message);
  }
}
