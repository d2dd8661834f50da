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
 * Validation outcomes and their interpretation.
 *
 * <p>Domain objects never throw from their validation hooks directly - they describe the outcome
 * with {@link io.github.suppierk.modeling.validation.ValidationResult} and let {@link
 * io.github.suppierk.modeling.validation.ValidationPipeline} turn it into an exception.
 */
package io.github.suppierk.modeling.validation;
