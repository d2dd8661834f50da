package io.github.suppierk.modeling.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DomainPrimitivesTest {
  @Nested
  class IsDomainPrimitive {
    @Test
    void scalars_must_be_domain_primitives() {
      assertTrue(DomainPrimitives.isDomainPrimitive(null));
      assertTrue(DomainPrimitives.isDomainPrimitive("text"));
      assertTrue(DomainPrimitives.isDomainPrimitive(""));
      assertTrue(DomainPrimitives.isDomainPrimitive(true));
      assertTrue(DomainPrimitives.isDomainPrimitive(42));
      assertTrue(DomainPrimitives.isDomainPrimitive(42L));
      assertTrue(DomainPrimitives.isDomainPrimitive(4.2d));
      assertTrue(DomainPrimitives.isDomainPrimitive(Double.NaN));
      assertTrue(DomainPrimitives.isDomainPrimitive(new BigDecimal("10.50")));
    }

    @Test
    void dates_must_be_domain_primitives() {
      assertTrue(DomainPrimitives.isDomainPrimitive(new Date()));
      assertTrue(DomainPrimitives.isDomainPrimitive(Instant.now()));
      assertTrue(DomainPrimitives.isDomainPrimitive(OffsetDateTime.now()));
      assertTrue(DomainPrimitives.isDomainPrimitive(ZonedDateTime.now()));
    }

    @Test
    void big_integers_must_not_be_domain_primitives() {
      assertFalse(DomainPrimitives.isDomainPrimitive(BigInteger.ONE));
    }

    @Test
    void structures_must_not_be_domain_primitives() {
      final Supplier<String> lambda = () -> "value";

      assertFalse(DomainPrimitives.isDomainPrimitive(Map.of("a", 1)));
      assertFalse(DomainPrimitives.isDomainPrimitive(List.of(1)));
      assertFalse(DomainPrimitives.isDomainPrimitive(Set.of(1)));
      assertFalse(DomainPrimitives.isDomainPrimitive(Optional.empty()));
      assertFalse(DomainPrimitives.isDomainPrimitive(lambda));
      assertFalse(DomainPrimitives.isDomainPrimitive('c'));
    }
  }

  @Nested
  class IsPrimitive {
    @Test
    void scalars_must_be_primitives() {
      assertTrue(DomainPrimitives.isPrimitive(null));
      assertTrue(DomainPrimitives.isPrimitive("text"));
      assertTrue(DomainPrimitives.isPrimitive(false));
      assertTrue(DomainPrimitives.isPrimitive('c'));
      assertTrue(DomainPrimitives.isPrimitive(1));
      assertTrue(DomainPrimitives.isPrimitive(BigInteger.TEN));
    }

    @Test
    void dates_and_structures_must_not_be_primitives() {
      assertFalse(DomainPrimitives.isPrimitive(new Date()));
      assertFalse(DomainPrimitives.isPrimitive(Map.of()));
      assertFalse(DomainPrimitives.isPrimitive(new int[0]));
    }
  }

  @Test
  void every_date_kind_must_be_converted_to_instant() {
    final var instant = Instant.parse("2023-01-01T00:00:00Z");

    assertEquals(instant, DomainPrimitives.toInstant(instant));
    assertEquals(instant, DomainPrimitives.toInstant(Date.from(instant)));
    assertEquals(instant, DomainPrimitives.toInstant(instant.atOffset(ZoneOffset.ofHours(2))));
    assertEquals(
        instant, DomainPrimitives.toInstant(instant.atZone(ZoneId.of("America/New_York"))));
  }

  @Test
  void when_value_is_not_a_date_illegal_argument_exception_is_thrown() {
    assertThrows(IllegalArgumentException.class, () -> DomainPrimitives.toInstant("2023-01-01"));
  }
}
