package io.github.suppierk.modeling.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.suppierk.test.Customer;
import io.github.suppierk.test.Email;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class DomainObjectTest {
  @Test
  void scalars_and_dates_must_be_returned_as_they_are() {
    final var date = new Date();
    final var instant = Instant.now();

    assertEquals("text", DomainObject.toReadonly("text"));
    assertEquals(42, DomainObject.toReadonly(42));
    assertSame(BigInteger.TEN, DomainObject.toReadonly(BigInteger.TEN));
    assertSame(date, DomainObject.toReadonly(date));
    assertSame(instant, DomainObject.toReadonly(instant));
    assertNull(DomainObject.toReadonly(null));
  }

  @Test
  void lists_and_arrays_must_become_read_only_lists() {
    final var source = new ArrayList<Object>(List.of(1, 2));
    final var list = assertInstanceOf(PropsList.class, DomainObject.toReadonly(source));
    final var array = assertInstanceOf(PropsList.class, DomainObject.toReadonly(new int[] {3, 4}));

    source.add(3);

    assertEquals(List.of(1, 2), list);
    assertEquals(List.of(3, 4), array);
    assertThrows(UnsupportedOperationException.class, () -> list.add(5));
    assertThrows(UnsupportedOperationException.class, () -> list.set(0, 5));
  }

  @Test
  void nested_structures_must_be_frozen_recursively() {
    final var frozen =
        assertInstanceOf(
            Props.class,
            DomainObject.toReadonly(Map.of("lines", List.of(Map.of("sku", "A-1")))));

    final var lines = assertInstanceOf(PropsList.class, frozen.get("lines"));
    assertInstanceOf(Props.class, lines.get(0));
  }

  @Test
  void domain_objects_must_keep_their_identity() {
    final var email = new Email("alice@example.com");
    final var frozen =
        assertInstanceOf(Props.class, DomainObject.toReadonly(Map.of("email", email)));

    assertSame(email, DomainObject.toReadonly(email));
    assertSame(email, frozen.get("email"));
  }

  @Test
  void already_read_only_values_must_not_be_copied() {
    final var props = Props.copyOf(Map.of("a", 1));
    final var list = DomainObject.toReadonly(List.of(1));

    assertSame(props, DomainObject.toReadonly(props));
    assertSame(list, DomainObject.toReadonly(list));
  }

  @Test
  void unsupported_structures_must_be_returned_as_they_are() {
    final var set = Set.of(1);
    final Map<Object, Object> nonStringKeys = new HashMap<>();
    nonStringKeys.put(1, "one");

    assertSame(set, DomainObject.toReadonly(set));
    assertSame(nonStringKeys, DomainObject.toReadonly(nonStringKeys));
  }

  @Test
  void jackson_must_serialize_domain_objects_via_their_json_representation() throws Exception {
    final var mapper = new ObjectMapper();
    final var customer = Customer.of(1, "Alice", "alice@example.com");

    assertEquals(
        "{\"id\":1,\"name\":\"Alice\",\"email\":\"alice@example.com\"}",
        mapper.writeValueAsString(customer));
    assertEquals("\"alice@example.com\"", mapper.writeValueAsString(customer.email()));
  }
}
