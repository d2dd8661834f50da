package io.github.suppierk.test;

import io.github.suppierk.modeling.domain.ValueObject;
import io.github.suppierk.modeling.validation.ValidationResult;

public final class Email extends ValueObject<Email, String> {
  public Email(String value) {
    super(value);
  }

  @Override
  protected ValidationResult validate(String value) {
    if (value == null || !value.contains("@")) {
      return ValidationResult.invalid("Email must contain @");
    }

    return ValidationResult.valid();
  }

  @Override
  protected Email newInstance(String value) {
    return new Email(value);
  }
}
