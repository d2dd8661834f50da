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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Produces mutable drafts handed over to evolve recipes.
 *
 * <p>A draft is a deep mutable copy of read-only structures, nested domain objects are handed over
 * by reference.
 */
final class Drafts {
  private Drafts() {
    // No instance
  }

  /**
   * @param props to copy
   * @return mutable copy of the props preserving key order
   */
  static Map<String, Object> draftOf(final Props props) {
    final Map<String, Object> draft = new LinkedHashMap<>(props.size());
    for (Map.Entry<String, Object> entry : props.entrySet()) {
      draft.put(entry.getKey(), thaw(entry.getValue()));
    }
    return draft;
  }

  private static Object thaw(final Object value) {
    if (value instanceof Props props) {
      return draftOf(props);
    }

    if (value instanceof PropsList list) {
      final List<Object> draft = new ArrayList<>(list.size());
      for (Object element : list) {
        draft.add(thaw(element));
      }
      return draft;
    }

    return value;
  }
}
