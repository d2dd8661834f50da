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

import java.util.AbstractList;
import java.util.RandomAccess;

/**
 * Immutable sequence produced by {@link DomainObject#toReadonly(Object)}.
 *
 * <p>Mutating methods of the {@link java.util.List} interface throw {@link
 * UnsupportedOperationException}.
 */
public final class PropsList extends AbstractList<Object> implements RandomAccess {
  private final Object[] elements;

  /**
   * @param elements already converted by {@link DomainObject#toReadonly(Object)}, owned by this
   *     instance from now on
   */
  PropsList(final Object[] elements) {
    this.elements = elements;
  }

  @Override
  public Object get(final int index) {
    return elements[index];
  }

  @Override
  public int size() {
    return elements.length;
  }
}
