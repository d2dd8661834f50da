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
import io.github.suppierk.modeling.error.ArgumentInvalidException;
import io.github.suppierk.modeling.json.DeepJson;
import io.github.suppierk.modeling.validation.ValidationPipeline;
import io.github.suppierk.modeling.validation.ValidationResult;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Identity-bearing object backed by a props bag.
 *
 * <p>Two entities are equal when they are of the same class and their {@link #id()}s are equal,
 * the rest of the props does not matter.
 *
 * <p>Construction contract:
 *
 * <ol>
 *   <li>{@code null} props are rejected.
 *   <li>{@link #validate(Map)} is funneled through {@link ValidationPipeline}.
 *   <li>Props must have at least one field.
 * </ol>
 *
 * <p>Exposed {@link #props()} are read-only, but nested value objects and entities are kept by
 * reference.
 *
 * <p>Every change produces a new instance via {@link #newInstance(Props)}, the original instance
 * stays untouched even if the change fails validation.
 *
 * @param <SELF> is the concrete entity type
 * @param <ID> is the type of the entity identifier
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public abstract non-sealed class Entity<SELF extends Entity<SELF, ID>, ID extends EntityId<?, ?>>
    extends DomainObject {
  private final Props props;

  /**
   * @param props of the entity
   * @throws ArgumentInvalidException if props did not pass validation
   */
  protected Entity(final Map<String, ?> props) {
    if (props == null) {
      throw new ArgumentInvalidException("The props must not be undefined");
    }

    final Map<String, Object> view =
        props instanceof Props readonly ? readonly : Collections.unmodifiableMap(props);
    ValidationPipeline.validate(() -> validate(view));

    if (props.isEmpty()) {
      throw new ArgumentInvalidException("The props must not be empty object");
    }

    this.props = Props.copyOf(props);
  }

  /**
   * Identity can be a dedicated field or be composed from several fields.
   *
   * @return identity of this entity
   */
  public abstract ID id();

  /**
   * Checks props before they get wrapped.
   *
   * <p>Invoked during construction: implementations must not rely on instance fields of the
   * concrete class.
   *
   * @param props to check
   * @return validation outcome, {@code null} is treated as {@link ValidationResult#valid()}
   */
  protected abstract ValidationResult validate(final Map<String, Object> props);

  /**
   * Late-bound constructor of the concrete class.
   *
   * <p>Every concrete subclass must return an instance of itself, otherwise changes fail with
   * {@link IllegalStateException}.
   *
   * @param props for the new instance
   * @return new instance of the concrete class
   */
  protected abstract SELF newInstance(final Props props);

  /**
   * @return read-only props of this entity
   */
  public final Props props() {
    return props;
  }

  /**
   * Applies a recipe to a mutable draft of the current props.
   *
   * @param recipe mutating the draft
   * @return new instance of the concrete class
   * @throws IllegalArgumentException if recipe is {@code null}
   * @throws ArgumentInvalidException if changed props did not pass validation
   */
  public final SELF evolve(final Consumer<Map<String, Object>> recipe) {
    throwIllegalArgumentIfNull(recipe, "Recipe");

    final Map<String, Object> draft = Drafts.draftOf(props);
    recipe.accept(draft);
    return evolveTo(Props.copyOf(draft));
  }

  /**
   * Merges a partial mapping into the current props, see {@link Props#merge(Map)}.
   *
   * @param partial to merge
   * @return new instance of the concrete class
   * @throws IllegalArgumentException if partial is {@code null}
   * @throws ArgumentInvalidException if changed props did not pass validation
   */
  public final SELF withMutations(final Map<String, ?> partial) {
    throwIllegalArgumentIfNull(partial, "Partial props");

    return evolveTo(props.merge(partial));
  }

  /**
   * Same as {@link #withMutations(Map)} where partial mapping is computed from this entity.
   *
   * @param updater producing partial mapping
   * @return new instance of the concrete class
   * @throws IllegalArgumentException if updater is {@code null}
   * @throws IllegalStateException if updater returned {@code null}
   * @throws ArgumentInvalidException if changed props did not pass validation
   */
  public final SELF withMutations(final Function<SELF, ? extends Map<String, ?>> updater) {
    throwIllegalArgumentIfNull(updater, "Updater");

    return evolveTo(props.merge(throwIllegalStateIfNull(updater.apply(self()), "Updater result")));
  }

  /**
   * Same as {@link #withMutations(Map)} for a single field.
   *
   * @param key of the field
   * @param value of the field, an empty {@link java.util.Optional} removes the field
   * @return new instance of the concrete class
   * @throws IllegalArgumentException if key is {@code null}
   * @throws ArgumentInvalidException if changed props did not pass validation
   */
  public final SELF withMutations(final String key, final Object value) {
    throwIllegalArgumentIfNull(key, "Key");

    return evolveTo(props.merge(key, value));
  }

  /**
   * Same as {@link #withMutations(String, Object)} where the value of the field is computed from
   * this entity.
   *
   * @param key of the field
   * @param propUpdater producing the value of the field, an empty {@link java.util.Optional}
   *     removes the field
   * @return new instance of the concrete class
   * @throws IllegalArgumentException if key or propUpdater is {@code null}
   * @throws ArgumentInvalidException if changed props did not pass validation
   */
  public final SELF withMutations(final String key, final Function<SELF, ?> propUpdater) {
    throwIllegalArgumentIfNull(key, "Key");
    throwIllegalArgumentIfNull(propUpdater, "Prop updater");

    return evolveTo(props.merge(key, propUpdater.apply(self())));
  }

  /** {@inheritDoc} */
  @Override
  public JsonNode toJson() {
    return DeepJson.toJson(props);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    final Entity<?, ?> that = (Entity<?, ?>) o;
    return Objects.equals(id(), that.id());
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id());
  }

  @Override
  public String toString() {
    return "%s%s".formatted(getClass().getSimpleName(), props);
  }

  /**
   * Single exit point of every change - aggregates use it to carry their state over.
   *
   * @param newProps for the new instance
   * @return new instance of the concrete class
   */
  SELF evolveTo(final Props newProps) {
    return sameClassAs(newInstance(newProps));
  }

  @SuppressWarnings("unchecked")
  final SELF self() {
    return (SELF) this;
  }
}
