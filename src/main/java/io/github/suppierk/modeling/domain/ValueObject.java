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

import com.fasterxml.jackson.databind.JsonNode;
import io.github.suppierk.modeling.common.DomainPrimitives;
import io.github.suppierk.modeling.error.ArgumentInvalidException;
import io.github.suppierk.modeling.json.DeepJson;
import io.github.suppierk.modeling.validation.ValidationPipeline;
import io.github.suppierk.modeling.validation.ValidationResult;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Immutable object defined only by its value.
 *
 * <p>The value is either a single domain primitive (see {@link DomainPrimitives}) or a structured
 * mapping of field names to values. In the latter case {@code T} must be declared as {@code
 * Map<String, Object>} - the value is stored and exposed as read-only {@link Props}.
 *
 * <p>Two value objects are equal when they are of the same class and their values are deeply
 * equal.
 *
 * <p>Construction contract:
 *
 * <ol>
 *   <li>An empty {@link Optional} is rejected.
 *   <li>{@link #validate(Object)} is funneled through {@link ValidationPipeline}.
 *   <li>A structured value must be a mapping with at least one field.
 * </ol>
 *
 * <p>Concrete classes implement {@link #newInstance(Object)} so that every evolve operation
 * returns an instance of the same concrete class, validated again.
 *
 * @param <SELF> is the concrete value object type
 * @param <T> is the type of the value
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public abstract non-sealed class ValueObject<SELF extends ValueObject<SELF, T>, T>
    extends DomainObject {
  private final boolean domainPrimitive;
  private final Object value;

  /**
   * @param value to wrap
   * @throws ArgumentInvalidException if the value did not pass validation
   */
  protected ValueObject(final T value) {
    if (value instanceof Optional<?> optional && optional.isEmpty()) {
      throw new ArgumentInvalidException("The value must not be undefined");
    }

    ValidationPipeline.validate(() -> validate(value));

    this.domainPrimitive = DomainPrimitives.isDomainPrimitive(value);
    this.value = domainPrimitive ? value : toStructuredValue(value);
  }

  /**
   * Checks the value before it gets wrapped.
   *
   * <p>Invoked during construction: implementations must not rely on instance fields of the
   * concrete class.
   *
   * @param value to check
   * @return validation outcome, {@code null} is treated as {@link ValidationResult#valid()}
   */
  protected abstract ValidationResult validate(final T value);

  /**
   * Late-bound constructor of the concrete class.
   *
   * <p>Every concrete subclass must return an instance of itself, otherwise changes fail with
   * {@link IllegalStateException}.
   *
   * @param value for the new instance
   * @return new instance of the concrete class
   */
  protected abstract SELF newInstance(final T value);

  /**
   * @return {@code true} if this value object wraps a single domain primitive
   */
  public final boolean isDomainPrimitive() {
    return domainPrimitive;
  }

  /**
   * @return wrapped value, structured values are exposed as read-only {@link Props}
   */
  @SuppressWarnings("unchecked")
  public final T value() {
    return (T) value;
  }

  /**
   * Replaces the whole value.
   *
   * @param newValue to wrap
   * @return new instance of the concrete class
   * @throws ArgumentInvalidException if the new value did not pass validation
   */
  public final SELF evolve(final T newValue) {
    return sameClassAs(newInstance(newValue));
  }

  /**
   * Applies a recipe to a mutable draft of the current structured value.
   *
   * @param recipe mutating the draft
   * @return new instance of the concrete class
   * @throws IllegalArgumentException if recipe is {@code null}
   * @throws UnsupportedOperationException if this value object wraps a domain primitive
   * @throws ArgumentInvalidException if the changed value did not pass validation
   */
  @SuppressWarnings("unchecked")
  public final SELF evolve(final Consumer<Map<String, Object>> recipe) {
    throwIllegalArgumentIfNull(recipe, "Recipe");

    final Map<String, Object> draft = Drafts.draftOf(structuredValue());
    recipe.accept(draft);
    return sameClassAs(newInstance((T) draft));
  }

  /**
   * Merges a partial mapping into the current structured value, see {@link Props#merge(Map)}.
   *
   * @param partial to merge
   * @return new instance of the concrete class
   * @throws IllegalArgumentException if partial is {@code null}
   * @throws UnsupportedOperationException if this value object wraps a domain primitive
   * @throws ArgumentInvalidException if the changed value did not pass validation
   */
  @SuppressWarnings("unchecked")
  public final SELF withMutations(final Map<String, ?> partial) {
    throwIllegalArgumentIfNull(partial, "Partial value");

    return sameClassAs(newInstance((T) structuredValue().merge(partial)));
  }

  /** {@inheritDoc} */
  @Override
  public JsonNode toJson() {
    return DeepJson.toJson(value);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    final ValueObject<?, ?> that = (ValueObject<?, ?>) o;
    return Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(value);
  }

  @Override
  public String toString() {
    return "%s(%s)".formatted(getClass().getSimpleName(), value);
  }

  private Props structuredValue() {
    if (domainPrimitive) {
      throw new UnsupportedOperationException(
          "%s wraps a domain primitive, use evolve(value) instead"
              .formatted(getClass().getSimpleName()));
    }

    return (Props) value;
  }

  private static Props toStructuredValue(final Object value) {
    if (!(value instanceof Map<?, ?> map) || !DomainObject.hasOnlyStringKeys(map)) {
      throw new ArgumentInvalidException(
          "The value must be a domain primitive or a mapping of fields");
    }

    if (map.isEmpty()) {
      throw new ArgumentInvalidException("The value must not be empty object");
    }

    return (Props) DomainObject.toReadonly(map);
  }
}
