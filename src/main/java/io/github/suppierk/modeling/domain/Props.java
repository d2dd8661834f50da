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

import io.vavr.Tuple2;
import io.vavr.collection.LinkedHashMap;
import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, insertion-ordered mapping from field name to value backing entities and structured
 * value objects.
 *
 * <p>Every stored value is already converted by {@link DomainObject#toReadonly(Object)}, so the
 * whole structure is immutable except for nested domain objects, which manage their own
 * immutability.
 *
 * <p>Updates via {@link #with(String, Object)}, {@link #without(String)} and {@link #merge(Map)}
 * produce new instances sharing structure with the original, which stays untouched.
 *
 * <p>Mutating methods of the {@link Map} interface throw {@link UnsupportedOperationException}.
 */
public final class Props extends AbstractMap<String, Object> {
  private static final Props EMPTY = new Props(LinkedHashMap.empty());

  private final LinkedHashMap<String, Object> fields;
  private Set<Entry<String, Object>> entries;

  private Props(final LinkedHashMap<String, Object> fields) {
    this.fields = fields;
  }

  /**
   * @return props without fields
   */
  public static Props empty() {
    return EMPTY;
  }

  /**
   * Converts every value of the given mapping into its read-only form.
   *
   * @param source to copy
   * @return read-only copy of the source, or the source itself if it already was {@link Props}
   * @throws IllegalArgumentException if source is {@code null}
   */
  public static Props copyOf(final Map<String, ?> source) {
    if (source == null) {
      throw new IllegalArgumentException("Props source cannot be null");
    }

    if (source instanceof Props props) {
      return props;
    }

    LinkedHashMap<String, Object> fields = LinkedHashMap.empty();
    for (Entry<String, ?> entry : source.entrySet()) {
      fields = fields.put(entry.getKey(), DomainObject.toReadonly(entry.getValue()));
    }
    return new Props(fields);
  }

  /**
   * @param key of the field
   * @param value of the field, converted by {@link DomainObject#toReadonly(Object)}
   * @return new props with the field added or replaced, keeping the position of existing fields
   */
  public Props with(final String key, final Object value) {
    return new Props(fields.put(key, DomainObject.toReadonly(value)));
  }

  /**
   * @param key of the field
   * @return new props without the field, or this instance if there was no such field
   */
  public Props without(final String key) {
    return fields.containsKey(key) ? new Props(fields.remove(key)) : this;
  }

  /**
   * Merges a partial mapping field by field:
   *
   * <ul>
   *   <li>an empty {@link Optional} removes the field,
   *   <li>a present {@link Optional} sets the field to its content,
   *   <li>any other value sets the field to that value.
   * </ul>
   *
   * <p>Nested mappings are replaced as a whole, they are not merged.
   *
   * @param partial to merge
   * @return new props reflecting the partial mapping
   * @throws IllegalArgumentException if partial is {@code null}
   */
  public Props merge(final Map<String, ?> partial) {
    if (partial == null) {
      throw new IllegalArgumentException("Partial props cannot be null");
    }

    Props result = this;
    for (Entry<String, ?> entry : partial.entrySet()) {
      result = result.merge(entry.getKey(), entry.getValue());
    }
    return result;
  }

  /**
   * Same as {@link #merge(Map)} for a single field.
   *
   * @param key of the field
   * @param value of the field
   * @return new props reflecting the change
   */
  public Props merge(final String key, final Object value) {
    if (value instanceof Optional<?> optional) {
      return optional.isPresent() ? with(key, optional.get()) : without(key);
    }

    return with(key, value);
  }

  /**
   * Typed shortcut for {@link #get(Object)}.
   *
   * @param key of the field
   * @param type expected type of the value
   * @param <T> expected type of the value
   * @return value of the field or {@code null} if there is no such field
   * @throws ClassCastException if the value is not of the expected type
   */
  public <T> T get(final String key, final Class<T> type) {
    return type.cast(get(key));
  }

  @Override
  public Object get(final Object key) {
    return key instanceof String name ? fields.get(name).getOrNull() : null;
  }

  @Override
  public boolean containsKey(final Object key) {
    return key instanceof String name && fields.containsKey(name);
  }

  @Override
  public int size() {
    return fields.size();
  }

  @Override
  public boolean isEmpty() {
    return fields.isEmpty();
  }

  @Override
  public Set<Entry<String, Object>> entrySet() {
    if (entries == null) {
      entries = new EntryView();
    }

    return entries;
  }

  /** Read-only {@link Set} over the persistent fields. */
  private final class EntryView extends AbstractSet<Entry<String, Object>> {
    @Override
    public Iterator<Entry<String, Object>> iterator() {
      final Iterator<Tuple2<String, Object>> delegate = fields.iterator();

      return new Iterator<>() {
        @Override
        public boolean hasNext() {
          return delegate.hasNext();
        }

        @Override
        public Entry<String, Object> next() {
          final Tuple2<String, Object> field = delegate.next();
          return new SimpleImmutableEntry<>(field._1, field._2);
        }
      };
    }

    @Override
    public int size() {
      return fields.size();
    }
  }
}
