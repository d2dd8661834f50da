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

package io.github.suppierk.modeling.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.suppierk.modeling.common.DomainPrimitives;
import io.github.suppierk.modeling.error.InvalidInputException;
import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.SignStyle;
import java.time.temporal.ChronoField;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recursively converts an arbitrary value graph into JSON-safe data represented by Jackson {@link
 * JsonNode}s.
 *
 * <p>Conversion rules:
 *
 * <ul>
 *   <li>{@code null}, {@link String}, {@link Boolean} and numbers are kept as they are, a {@link
 *       Character} becomes a string.
 *   <li>Dates become ISO-8601 strings in UTC with millisecond precision, e.g. {@code
 *       2023-01-01T00:00:00.000Z}, years beyond four digits use the expanded form {@code
 *       +010000-01-01T00:00:00.000Z}.
 *   <li>{@link List}s and Java arrays are converted element by element.
 *   <li>{@link Jsonifiable} objects are asked for their own representation, which is used verbatim.
 *   <li>{@link Map}s with {@link String} keys and {@link Record}s are converted key by key, keeping
 *       the key order.
 *   <li>Other collections and maps with non-string keys become an empty object.
 *   <li>An empty {@link Optional} and a {@link BigInteger} depend on the {@link Mode}.
 *   <li>Anything else, including lambdas, cannot be converted.
 * </ul>
 */
public final class DeepJson {
  private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);
  private static final DateTimeFormatter ISO_DATE_TIME =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  /** Years outside of {@code 0000-9999} are written as a signed 6-digit number. */
  private static final DateTimeFormatter EXTENDED_ISO_DATE_TIME =
      new DateTimeFormatterBuilder()
          .appendValue(ChronoField.YEAR, 6, 6, SignStyle.ALWAYS)
          .appendPattern("-MM-dd'T'HH:mm:ss.SSS'Z'")
          .toFormatter()
          .withZone(ZoneOffset.UTC);

  private static final int MAX_FOUR_DIGIT_YEAR = 9999;

  private DeepJson() {
    // No instance
  }

  /** Describes how values without a JSON counterpart are treated. */
  public enum Mode {
    /**
     * An empty {@link Optional} and a {@link BigInteger} fail with {@link InvalidInputException}.
     * Used when domain objects are exported.
     */
    STRICT,

    /**
     * An empty {@link Optional} becomes {@link MissingNode} (dropped from objects, {@code null} in
     * arrays) and a {@link BigInteger} becomes an empty object. Used for arbitrary object graphs.
     */
    LENIENT
  }

  /**
   * Same as {@link #toJson(Object, Mode)} with {@link Mode#STRICT}.
   *
   * @param value to convert
   * @return JSON representation of the value
   * @throws InvalidInputException if the value or any nested value cannot be converted
   */
  public static JsonNode toJson(final Object value) {
    return toJson(value, Mode.STRICT);
  }

  /**
   * Same as {@link #toJson(Object, Mode)} with {@link Mode#LENIENT}.
   *
   * @param value to convert
   * @return JSON representation of the value
   * @throws InvalidInputException if the value or any nested value cannot be converted
   */
  public static JsonNode deepJsonify(final Object value) {
    return toJson(value, Mode.LENIENT);
  }

  /**
   * @param value to convert
   * @param mode deciding how values without a JSON counterpart are treated
   * @return JSON representation of the value
   * @throws IllegalArgumentException if mode is {@code null}
   * @throws InvalidInputException if the value or any nested value cannot be converted
   */
  public static JsonNode toJson(final Object value, final Mode mode) {
    if (mode == null) {
      throw new IllegalArgumentException("Mode cannot be null");
    }

    return convert(value, mode);
  }

  /**
   * @param dateLike value for which {@link DomainPrimitives#isDateLike(Object)} returns {@code
   *     true}
   * @return ISO-8601 representation of the date
   */
  public static String formatDate(final Object dateLike) {
    final Instant instant = DomainPrimitives.toInstant(dateLike);
    final int year = instant.atOffset(ZoneOffset.UTC).getYear();
    return year < 0 || year > MAX_FOUR_DIGIT_YEAR
        ? EXTENDED_ISO_DATE_TIME.format(instant)
        : ISO_DATE_TIME.format(instant);
  }

  private static JsonNode convert(final Object value, final Mode mode) {
    if (value instanceof Optional<?> optional) {
      return convertOptional(optional, mode);
    }

    if (value instanceof BigInteger) {
      if (mode == Mode.STRICT) {
        throw new InvalidInputException("Cannot convert a BigInteger value to JSON");
      }

      return NODES.objectNode();
    }

    if (value == null) {
      return NODES.nullNode();
    } else if (value instanceof JsonNode node) {
      return node;
    } else if (value instanceof String string) {
      return NODES.textNode(string);
    } else if (value instanceof Character character) {
      return NODES.textNode(character.toString());
    } else if (value instanceof Boolean bool) {
      return NODES.booleanNode(bool);
    } else if (DomainPrimitives.isNumber(value)) {
      return convertNumber((Number) value);
    } else if (DomainPrimitives.isDateLike(value)) {
      return NODES.textNode(formatDate(value));
    } else if (value instanceof Jsonifiable jsonifiable) {
      final JsonNode own = jsonifiable.toJson();
      return own == null ? NODES.nullNode() : own;
    } else if (value instanceof List<?> list) {
      final ArrayNode result = NODES.arrayNode(list.size());
      for (Object element : list) {
        addElement(result, convert(element, mode));
      }
      return result;
    } else if (value.getClass().isArray()) {
      final int length = Array.getLength(value);
      final ArrayNode result = NODES.arrayNode(length);
      for (int i = 0; i < length; i++) {
        addElement(result, convert(Array.get(value, i), mode));
      }
      return result;
    } else if (value instanceof Map<?, ?> map) {
      return convertMap(map, mode);
    } else if (value instanceof Collection<?>) {
      // Sets, queues and alike are not a part of the serializable vocabulary
      return NODES.objectNode();
    } else if (value instanceof Record record) {
      return convertRecord(record, mode);
    }

    throw new InvalidInputException("Cannot convert %s to JSON".formatted(value));
  }

  private static JsonNode convertOptional(final Optional<?> optional, final Mode mode) {
    if (optional.isPresent()) {
      return convert(optional.get(), mode);
    }

    if (mode == Mode.STRICT) {
      throw new InvalidInputException("Cannot convert an empty Optional to JSON");
    }

    return MissingNode.getInstance();
  }

  private static JsonNode convertNumber(final Number number) {
    if (number instanceof Byte b) {
      return NODES.numberNode(b);
    } else if (number instanceof Short s) {
      return NODES.numberNode(s);
    } else if (number instanceof Integer i) {
      return NODES.numberNode(i);
    } else if (number instanceof Long l) {
      return NODES.numberNode(l);
    } else if (number instanceof Float f) {
      return NODES.numberNode(f);
    } else if (number instanceof Double d) {
      return NODES.numberNode(d);
    }

    return NODES.numberNode((BigDecimal) number);
  }

  private static JsonNode convertMap(final Map<?, ?> map, final Mode mode) {
    final ObjectNode result = NODES.objectNode();

    for (Object key : map.keySet()) {
      if (!(key instanceof String)) {
        // Keyed collections are not a part of the serializable vocabulary
        return NODES.objectNode();
      }
    }

    for (Map.Entry<?, ?> entry : map.entrySet()) {
      putField(result, (String) entry.getKey(), convert(entry.getValue(), mode));
    }

    return result;
  }

  private static JsonNode convertRecord(final Record record, final Mode mode) {
    final ObjectNode result = NODES.objectNode();

    for (RecordComponent component : record.getClass().getRecordComponents()) {
      final Method accessor = component.getAccessor();
      accessor.trySetAccessible();

      final Object componentValue;
      try {
        componentValue = accessor.invoke(record);
      } catch (IllegalAccessException | InvocationTargetException e) {
        throw new InvalidInputException(
            "Cannot read '%s' of %s".formatted(component.getName(), record.getClass().getName()),
            e);
      }

      putField(result, component.getName(), convert(componentValue, mode));
    }

    return result;
  }

  private static void addElement(final ArrayNode target, final JsonNode element) {
    target.add(element.isMissingNode() ? NODES.nullNode() : element);
  }

  private static void putField(final ObjectNode target, final String key, final JsonNode field) {
    if (!field.isMissingNode()) {
      target.set(key, field);
    }
  }
}
