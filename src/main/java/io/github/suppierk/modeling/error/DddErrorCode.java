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

/**
 * Table of stable error codes produced by this library.
 *
 * <p>Every code is prefixed with the module name, e.g. {@code ddd/argument-invalid}, so that codes
 * stay unique when they are mixed with error codes of other modules.
 */
public enum DddErrorCode {
  ARGUMENT_INVALID("argument-invalid"),
  INVALID_INPUT("invalid-input");

  static final String MODULE_NAME = "ddd";
  static final String DELIMITER = "/";

  private final String source;

  DddErrorCode(final String source) {
    this.source = source;
  }

  /**
   * @return error source without module prefix
   */
  public String source() {
    return source;
  }

  /**
   * @return fully qualified error code
   */
  public String code() {
    return MODULE_NAME + DELIMITER + source;
  }
}
