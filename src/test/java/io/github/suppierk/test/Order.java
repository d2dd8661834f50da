package io.github.suppierk.test;

import io.github.suppierk.modeling.domain.Aggregate;
import io.github.suppierk.modeling.domain.DomainEvent;
import io.github.suppierk.modeling.domain.Props;
import io.github.suppierk.modeling.validation.ValidationResult;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Order extends Aggregate<Order, OrderId> {
  public Order(Map<String, ?> props) {
    super(props);
  }

  public Order(Map<String, ?> props, Iterable<DomainEvent<?>> events) {
    super(props, events);
  }

  public static Order draft(String id) {
    final Map<String, Object> props = new LinkedHashMap<>();
    props.put("id", new OrderId(id));
    props.put("status", "DRAFT");
    props.put("lines", List.of());
    return new Order(props);
  }

  @Override
  public OrderId id() {
    return props().get("id", OrderId.class);
  }

  public String status() {
    return props().get("status", String.class);
  }

  @SuppressWarnings("unchecked")
  public List<Object> lines() {
    return props().get("lines", List.class);
  }

  public Order addLine(String sku, Money price) {
    return evolve(
            draft -> {
              @SuppressWarnings("unchecked")
              final List<Object> lines = (List<Object>) draft.get("lines");
              lines.add(Map.of("sku", sku, "price", price));
            })
        .addEvent(new OrderLineAdded(id().rawId(), sku));
  }

  public Order place() {
    return withMutations("status", "PLACED")
        .addEvent(new OrderPlaced(id().rawId(), new OrderPlaced.Details(lines().size())));
  }

  @Override
  protected ValidationResult validate(Map<String, Object> props) {
    if (!(props.get("id") instanceof OrderId)) {
      return ValidationResult.invalid("Order must have an id");
    }

    return ValidationResult.of(props.get("status") instanceof String);
  }

  @Override
  protected Order newInstance(Props props, Iterable<DomainEvent<?>> events) {
    return new Order(props, events);
  }
}
