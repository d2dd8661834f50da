package io.github.suppierk.test;

import io.github.suppierk.modeling.domain.DomainEvent;
import io.github.suppierk.modeling.domain.DomainEventProps;
import io.github.suppierk.modeling.validation.ValidationResult;

/** Event without payload. */
public final class OrderCancelled extends DomainEvent<Void> {
  public OrderCancelled(String aggregateId) {
    super(aggregateId);
  }

  public OrderCancelled(DomainEventProps<Void> props) {
    super(props);
  }

  @Override
  protected ValidationResult validatePayload(Void payload) {
    return null;
  }
}
