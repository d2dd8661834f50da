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

package io.github.suppierk.modeling.common;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Set;

/**
 * Classifies values into opaque domain primitives and structured values.
 *
 * <p>A domain primitive is one of:
 *
 * <ul>
 *   <li>{@code null}
 *   <li>{@link String}
 *   <li>{@link Boolean}
 *   <li>a number - {@link Byte}, {@link Short}, {@link Integer}, {@link Long}, {@link Float},
 *       {@link Double} or {@link BigDecimal}
 *   <li>a date with a time value - {@link Date}, {@link Instant}, {@link OffsetDateTime} or {@link
 *       ZonedDateTime}
 * </ul>
 *
 * <p>An empty {@link java.util.Optional} stands for an absent value and is never a domain
 * primitive.
 */
public final class DomainPrimitives {
  private static final Set<Class<?>> NUMBER_TYPES =
      Set.of(
          Byte.class,
          Short.class,
          Integer.class,
          Long.class,
          Float.class,
          Double.class,
          BigDecimal.class);

  private DomainPrimitives() {
    // No instance
  }

  /**
   * @param value to check
   * @return {@code true} if the value is a domain primitive
   */
  public static boolean isDomainPrimitive(final Object value) {
    return value == null
        || value instanceof String
        || value instanceof Boolean
        || isNumber(value)
        || isDateLike(value);
  }

  /**
   * Wider check than {@link #isDomainPrimitive(Object)}: also accepts values which are immutable
   * by nature but not part of the domain vocabulary, such as {@link BigInteger} or {@link
   * Character}.
   *
   * @param value to check
   * @return {@code true} if the value is a plain old immutable scalar
   */
  public static boolean isPrimitive(final Object value) {
    return value == null
        || value instanceof String
        || value instanceof Boolean
        || value instanceof Character
        || value instanceof Number;
  }

  /**
   * @param value to check
   * @return {@code true} if the value is one of the supported number types
   */
  public static boolean isNumber(final Object value) {
    return value != null && NUMBER_TYPES.contains(value.getClass());
  }

  /**
   * @param value to check
   * @return {@code true} if the value is a date with a time value
   */
  public static boolean isDateLike(final Object value) {
    return value instanceof Date
        || value instanceof Instant
        || value instanceof OffsetDateTime
        || value instanceof ZonedDateTime;
  }

  /**
   * @param dateLike value for which {@link #isDateLike(Object)} returns {@code true}
   * @return point on the time-line represented by the value
   * @throws IllegalArgumentException if the value is not a date
   */
  public static Instant toInstant(final Object dateLike) {
    if (dateLike instanceof Instant instant) {
      return instant;
    } else if (dateLike instanceof Date date) {
      return date.toInstant();
    } else if (dateLike instanceof OffsetDateTime offsetDateTime) {
      return offsetDateTime.toInstant();
    } else if (dateLike instanceof ZonedDateTime zonedDateTime) {
      return zonedDateTime.toInstant();
    }

    throw new IllegalArgumentException("%s is not a date".formatted(dateLike));
  }
}
