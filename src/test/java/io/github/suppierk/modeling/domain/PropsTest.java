package io.github.suppierk.modeling.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PropsTest {
  static Map<String, Object> source() {
    final Map<String, Object> source = new LinkedHashMap<>();
    source.put("name", "Alice");
    source.put("age", 30);
    source.put("tags", new ArrayList<>(List.of("a", "b")));
    return source;
  }

  @Nested
  class CopyOf {
    @Test
    void when_source_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> Props.copyOf(null));
    }

    @Test
    void key_order_must_be_preserved() {
      final var props = Props.copyOf(source());

      assertEquals(List.of("name", "age", "tags"), new ArrayList<>(props.keySet()));
    }

    @Test
    @SuppressWarnings("unchecked")
    void nested_values_must_be_frozen_and_detached_from_source() {
      final var source = source();
      final var props = Props.copyOf(source);

      source.put("name", "Bob");
      ((List<Object>) source.get("tags")).add("c");

      assertEquals("Alice", props.get("name"));
      assertInstanceOf(PropsList.class, props.get("tags"));
      assertEquals(List.of("a", "b"), props.get("tags"));
    }

    @Test
    void already_frozen_props_must_be_reused() {
      final var props = Props.copyOf(source());

      assertSame(props, Props.copyOf(props));
    }

    @Test
    void null_values_must_be_kept() {
      final Map<String, Object> source = new LinkedHashMap<>();
      source.put("nothing", null);

      final var props = Props.copyOf(source);

      assertTrue(props.containsKey("nothing"));
      assertNull(props.get("nothing"));
    }
  }

  @Test
  @SuppressWarnings("unchecked")
  void mutators_must_be_rejected() {
    final var props = Props.copyOf(source());

    assertThrows(UnsupportedOperationException.class, () -> props.put("name", "Bob"));
    assertThrows(UnsupportedOperationException.class, () -> props.remove("name"));
    assertThrows(UnsupportedOperationException.class, props::clear);
    assertThrows(
        UnsupportedOperationException.class,
        () -> props.entrySet().iterator().next().setValue("Bob"));
    assertThrows(
        UnsupportedOperationException.class, () -> props.get("tags", List.class).add("c"));
  }

  @Test
  void with_and_without_must_leave_original_untouched() {
    final var props = Props.copyOf(source());

    final var changed = props.with("name", "Bob").with("city", "Berlin");
    final var removed = props.without("age");

    assertEquals("Alice", props.get("name"));
    assertEquals("Bob", changed.get("name"));
    assertEquals(List.of("name", "age", "tags", "city"), new ArrayList<>(changed.keySet()));
    assertFalse(removed.containsKey("age"));
    assertTrue(props.containsKey("age"));
    assertSame(props, props.without("missing"));
  }

  @Test
  void merge_must_interpret_optionals() {
    final var props = Props.copyOf(source());

    final Map<String, Object> partial = new LinkedHashMap<>();
    partial.put("name", Optional.of("Bob"));
    partial.put("age", Optional.empty());
    partial.put("city", "Berlin");

    final var merged = props.merge(partial);

    assertEquals("Bob", merged.get("name"));
    assertFalse(merged.containsKey("age"));
    assertEquals("Berlin", merged.get("city"));
    assertEquals(30, props.get("age"));
  }

  @Test
  void when_partial_is_null_illegal_argument_exception_is_thrown() {
    assertThrows(IllegalArgumentException.class, () -> Props.empty().merge(null));
  }

  @Test
  void typed_get_must_cast_or_fail() {
    final var props = Props.copyOf(source());

    assertEquals("Alice", props.get("name", String.class));
    assertNull(props.get("missing", String.class));
    assertThrows(ClassCastException.class, () -> props.get("age", String.class));
  }

  @Test
  void equality_must_follow_map_contract() {
    final var source = source();
    final var props = Props.copyOf(source);

    assertEquals(source, props);
    assertEquals(props, source);
    assertEquals(source.hashCode(), props.hashCode());
    assertTrue(Props.empty().isEmpty());
    assertEquals(Map.of(), Props.empty());
  }
}
