package io.github.suppierk.test;

import io.github.suppierk.modeling.domain.EntityId;
import io.github.suppierk.modeling.validation.ValidationResult;

public final class OrderId extends EntityId<OrderId, String> {
  public OrderId(String value) {
    super(value);
  }

  @Override
  public String rawId() {
    return value();
  }

  @Override
  protected ValidationResult validate(String value) {
    return ValidationResult.of(value != null && !value.isBlank());
  }

  @Override
  protected OrderId newInstance(String value) {
    return new OrderId(value);
  }
}
