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

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.suppierk.modeling.common.DomainPrimitives;
import io.github.suppierk.modeling.json.Jsonifiable;
import java.lang.reflect.Array;
import java.util.List;
import java.util.Map;

/**
 * Common parent of every domain-model kind defined by this library.
 *
 * <p>Domain objects manage their own immutability, which is why {@link #toReadonly(Object)} never
 * copies them - nested domain objects keep their reference identity inside read-only views.
 *
 * <p>Every domain object can describe itself as JSON: {@link #toJson()} is also used by Jackson
 * when a domain object is handed to an {@link com.fasterxml.jackson.databind.ObjectMapper}.
 */
public abstract sealed class DomainObject extends Suspicious implements Jsonifiable
    permits ValueObject, Entity, DomainEvent {

  /** {@inheritDoc} */
  @JsonValue
  @Override
  public abstract JsonNode toJson();

  /**
   * Recursively produces an immutable view of the given value:
   *
   * <ul>
   *   <li>Scalars, dates and domain objects are returned as they are.
   *   <li>{@link Props} and {@link PropsList} are already immutable and are returned as they are.
   *   <li>{@link List}s and Java arrays become a {@link PropsList} of converted elements.
   *   <li>{@link Map}s with {@link String} keys become {@link Props} of converted values, keeping
   *       the key order.
   *   <li>Anything else is returned as it is.
   * </ul>
   *
   * @param value to convert
   * @return immutable view of the value
   */
  public static Object toReadonly(final Object value) {
    if (value instanceof DomainObject
        || value instanceof Props
        || value instanceof PropsList
        || DomainPrimitives.isPrimitive(value)
        || DomainPrimitives.isDateLike(value)) {
      return value;
    }

    if (value instanceof List<?> list) {
      final Object[] elements = new Object[list.size()];
      int i = 0;
      for (Object element : list) {
        elements[i++] = toReadonly(element);
      }
      return new PropsList(elements);
    }

    if (value.getClass().isArray()) {
      final Object[] elements = new Object[Array.getLength(value)];
      for (int i = 0; i < elements.length; i++) {
        elements[i] = toReadonly(Array.get(value, i));
      }
      return new PropsList(elements);
    }

    if (value instanceof Map<?, ?> map && hasOnlyStringKeys(map)) {
      @SuppressWarnings("unchecked")
      final Map<String, ?> fields = (Map<String, ?>) map;
      return Props.copyOf(fields);
    }

    return value;
  }

  /**
   * Guards late-bound construction: every subclass in the hierarchy must produce instances of
   * itself.
   *
   * @param result produced by a {@code newInstance} implementation
   * @param <T> is the type of the result
   * @return result if it is of the same class as this object
   * @throws IllegalStateException if result is {@code null} or of another class
   */
  final <T extends DomainObject> T sameClassAs(final T result) {
    throwIllegalStateIfNull(result, "%s.newInstance result".formatted(getClass().getSimpleName()));

    if (result.getClass() != getClass()) {
      throw new IllegalStateException(
          "%s must override newInstance".formatted(getClass().getName()));
    }

    return result;
  }

  /**
   * @param map to check
   * @return {@code true} if every key of the map is a {@link String}
   */
  static boolean hasOnlyStringKeys(final Map<?, ?> map) {
    for (Object key : map.keySet()) {
      if (!(key instanceof String)) {
        return false;
      }
    }

    return true;
  }
}
