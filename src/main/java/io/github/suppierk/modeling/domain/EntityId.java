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

package io.github.suppierk.modeling.domain;

/**
 * {@link ValueObject} describing the identity of an {@link Entity}.
 *
 * <p>The value can be a single domain primitive or a composite mapping, {@link #rawId()} defines
 * how the identity is rendered as a single string.
 *
 * @param <SELF> is the concrete identifier type
 * @param <T> is the type of the identifier value
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public abstract class EntityId<SELF extends EntityId<SELF, T>, T> extends ValueObject<SELF, T> {
  protected EntityId(final T value) {
    super(value);
  }

  /**
   * @return string form of the identity
   */
  public abstract String rawId();
}
