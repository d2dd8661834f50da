package io.github.suppierk.test;

import io.github.suppierk.modeling.domain.EntityId;
import io.github.suppierk.modeling.validation.ValidationResult;

public final class CustomerId extends EntityId<CustomerId, Long> {
  public CustomerId(Long value) {
    super(value);
  }

  @Override
  public String rawId() {
    return String.valueOf(value());
  }

  @Override
  protected ValidationResult validate(Long value) {
    return ValidationResult.of(value != null && value > 0);
  }

  @Override
  protected CustomerId newInstance(Long value) {
    return new CustomerId(value);
  }
}
